package com.quantori.ceb.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Stoichiometric coefficients of a balanced equation, in the order the reactants and products were given.
 */
public record BalancedEquation(List<Integer> inputCoefficients, List<Integer> outputCoefficients) {

  public BalancedEquation {
    Objects.requireNonNull(inputCoefficients);
    Objects.requireNonNull(outputCoefficients);
    inputCoefficients = List.copyOf(inputCoefficients);
    outputCoefficients = List.copyOf(outputCoefficients);
  }
}
