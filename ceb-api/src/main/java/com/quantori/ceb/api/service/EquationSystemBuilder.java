package com.quantori.ceb.api.service;

import com.quantori.ceb.api.exception.AtomMismatchException;
import com.quantori.ceb.api.model.AtomCount;
import com.quantori.ceb.api.model.EquationSystem;
import java.util.List;

/**
 * Builds the homogeneous linear system of an equation from the atom counts of its molecules.
 */
public interface EquationSystemBuilder {

  /**
   * Builds the system: one row per element in sorted order, reactant columns first, then negated product columns.
   *
   * @param inputCounts  atom counts of the reactants
   * @param outputCounts atom counts of the products
   * @return equation system
   * @throws AtomMismatchException if reactants and products contain different elements
   */
  EquationSystem buildSystem(List<AtomCount> inputCounts, List<AtomCount> outputCounts);
}
