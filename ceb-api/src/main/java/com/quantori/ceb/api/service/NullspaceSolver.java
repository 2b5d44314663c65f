package com.quantori.ceb.api.service;

import com.quantori.ceb.api.exception.AmbiguousSolutionException;
import com.quantori.ceb.api.exception.NoSolutionException;
import com.quantori.ceb.api.exception.NonIntegerResultException;
import com.quantori.ceb.api.model.CoefficientVector;
import com.quantori.ceb.api.model.EquationMatrix;

/**
 * Finds the minimal positive integer vector spanning the null space of a matrix.
 */
public interface NullspaceSolver {

  /**
   * Solves {@code matrix * x = 0}.
   *
   * @param matrix equation matrix
   * @return the unique positive integer solution with no common divisor greater than one
   * @throws NoSolutionException        if the null space is trivial or has no positive vector
   * @throws AmbiguousSolutionException if the null space has more than one dimension
   * @throws NonIntegerResultException  if the rescaled solution is not an {@code int} vector
   */
  CoefficientVector solve(EquationMatrix matrix);
}
