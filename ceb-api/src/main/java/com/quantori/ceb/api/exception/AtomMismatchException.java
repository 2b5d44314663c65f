package com.quantori.ceb.api.exception;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.Getter;

/**
 * Thrown when reactants and products reference different sets of atoms, so no assignment of coefficients can
 * conserve every element.
 */
@Getter
public class AtomMismatchException extends BalancingException {
  /**
   * Atoms present among the products but absent from the reactants, sorted.
   */
  private final List<String> missingFromLeft;
  /**
   * Atoms present among the reactants but absent from the products, sorted.
   */
  private final List<String> missingFromRight;

  public AtomMismatchException(Set<String> missingFromLeft, Set<String> missingFromRight) {
    super(String.format("Reactants and products contain different atoms, missing from reactants: %s, "
        + "missing from products: %s", new TreeSet<>(missingFromLeft), new TreeSet<>(missingFromRight)));
    this.missingFromLeft = List.copyOf(new TreeSet<>(missingFromLeft));
    this.missingFromRight = List.copyOf(new TreeSet<>(missingFromRight));
  }
}
