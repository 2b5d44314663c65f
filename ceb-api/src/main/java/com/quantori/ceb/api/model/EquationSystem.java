package com.quantori.ceb.api.model;

import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * Homogeneous linear system of an equation: the atom basis naming its rows and the matrix whose first
 * {@code inputCount} columns are reactant vectors and remaining columns are negated product vectors.
 */
public record EquationSystem(AtomBasis basis, EquationMatrix matrix, int inputCount) {

  public EquationSystem {
    Objects.requireNonNull(basis);
    Objects.requireNonNull(matrix);
    Validate.isTrue(basis.size() == matrix.getRows(), "Basis size %d does not match %d matrix rows",
        basis.size(), matrix.getRows());
    Validate.inclusiveBetween(0, matrix.getColumns(), inputCount);
  }

  public int outputCount() {
    return matrix.getColumns() - inputCount;
  }
}
