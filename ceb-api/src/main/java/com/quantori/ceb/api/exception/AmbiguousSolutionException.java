package com.quantori.ceb.api.exception;

import lombok.Getter;

/**
 * Thrown when the null space of the equation system has more than one basis vector. Such an equation is a
 * combination of independent reactions and has no single minimal set of coefficients.
 */
@Getter
public class AmbiguousSolutionException extends BalancingException {
  private final int basisSize;

  public AmbiguousSolutionException(int basisSize) {
    super(String.format("Equation has %d independent balancing solutions, expected exactly one", basisSize));
    this.basisSize = basisSize;
  }
}
