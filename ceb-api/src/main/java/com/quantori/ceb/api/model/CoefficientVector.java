package com.quantori.ceb.api.model;

import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * Minimal positive integer solution of an equation system, one coefficient per matrix column.
 */
public record CoefficientVector(List<Integer> coefficients) {

  public CoefficientVector {
    Objects.requireNonNull(coefficients);
    coefficients = List.copyOf(coefficients);
    for (Integer coefficient : coefficients) {
      Validate.isTrue(coefficient > 0, "Coefficients must be positive: %s", coefficients);
    }
  }

  public int size() {
    return coefficients.size();
  }

  /**
   * Splits the vector into reactant and product coefficients.
   *
   * @param inputCount number of reactants, i.e. leading coefficients
   * @return balanced equation coefficients
   */
  public BalancedEquation split(int inputCount) {
    Validate.inclusiveBetween(0, coefficients.size(), inputCount);
    return new BalancedEquation(coefficients.subList(0, inputCount),
        coefficients.subList(inputCount, coefficients.size()));
  }
}
