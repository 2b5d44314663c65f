package com.quantori.ceb.api.service;

import com.quantori.ceb.api.exception.BalancingException;
import com.quantori.ceb.api.model.BalancedEquation;
import java.util.List;

/**
 * Balances chemical equations given as lists of reactant and product formulas.
 * Implementations are stateless and may be shared between threads.
 */
public interface EquationBalancer {

  /**
   * Computes the minimal positive integer coefficients conserving every element.
   *
   * @param inputFormulas  reactant formulas, not empty
   * @param outputFormulas product formulas, not empty
   * @return coefficients in the order of the given formulas
   * @throws BalancingException subclass describing the failing stage, never wrapped
   */
  BalancedEquation balance(List<String> inputFormulas, List<String> outputFormulas);
}
