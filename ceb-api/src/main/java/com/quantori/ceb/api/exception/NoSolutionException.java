package com.quantori.ceb.api.exception;

/**
 * Thrown when the equation cannot be balanced with positive coefficients: the null space of its system is trivial,
 * or the only balancing direction needs zero or negative coefficients.
 */
public class NoSolutionException extends BalancingException {
  public NoSolutionException(String message) {
    super(message);
  }
}
