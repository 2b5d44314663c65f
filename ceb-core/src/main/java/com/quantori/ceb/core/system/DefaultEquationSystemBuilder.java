package com.quantori.ceb.core.system;

import com.quantori.ceb.api.exception.AtomMismatchException;
import com.quantori.ceb.api.model.AtomBasis;
import com.quantori.ceb.api.model.AtomCount;
import com.quantori.ceb.api.model.EquationMatrix;
import com.quantori.ceb.api.model.EquationSystem;
import com.quantori.ceb.api.service.EquationSystemBuilder;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Builds the element conservation system of an equation. Row {@code i} states that the reactants and the products
 * hold the same number of atoms of the {@code i}-th element in sorted order, so reactant columns are taken as is
 * and product columns are negated.
 */
@Slf4j
public class DefaultEquationSystemBuilder implements EquationSystemBuilder {

  @Override
  public EquationSystem buildSystem(List<AtomCount> inputCounts, List<AtomCount> outputCounts) {
    Objects.requireNonNull(inputCounts, "inputCounts");
    Objects.requireNonNull(outputCounts, "outputCounts");
    Validate.notEmpty(inputCounts, "At least one reactant is required");
    Validate.notEmpty(outputCounts, "At least one product is required");

    Set<String> inputAtoms = atoms(inputCounts);
    Set<String> outputAtoms = atoms(outputCounts);
    if (!inputAtoms.equals(outputAtoms)) {
      var missingFromLeft = new TreeSet<>(outputAtoms);
      missingFromLeft.removeAll(inputAtoms);
      var missingFromRight = new TreeSet<>(inputAtoms);
      missingFromRight.removeAll(outputAtoms);
      throw new AtomMismatchException(missingFromLeft, missingFromRight);
    }

    var basis = AtomBasis.of(inputAtoms);
    int inputs = inputCounts.size();
    var values = new BigFraction[basis.size()][inputs + outputCounts.size()];
    for (int column = 0; column < inputs; column++) {
      setColumn(values, column, basis.vectorize(inputCounts.get(column)), false);
    }
    for (int column = 0; column < outputCounts.size(); column++) {
      setColumn(values, inputs + column, basis.vectorize(outputCounts.get(column)), true);
    }
    var matrix = EquationMatrix.of(values);
    log.debug("Built {}x{} system over atoms {}: {}", matrix.getRows(), matrix.getColumns(), basis.atoms(), matrix);
    return new EquationSystem(basis, matrix, inputs);
  }

  private static Set<String> atoms(List<AtomCount> counts) {
    Set<String> atoms = new TreeSet<>();
    for (AtomCount count : counts) {
      atoms.addAll(Objects.requireNonNull(count, "atom count").atoms());
    }
    return atoms;
  }

  private static void setColumn(BigFraction[][] values, int column, BigInteger[] vector, boolean negate) {
    for (int row = 0; row < vector.length; row++) {
      values[row][column] = new BigFraction(negate ? vector[row].negate() : vector[row]);
    }
  }
}
