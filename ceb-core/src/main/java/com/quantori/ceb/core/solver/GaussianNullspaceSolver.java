package com.quantori.ceb.core.solver;

import com.quantori.ceb.api.exception.AmbiguousSolutionException;
import com.quantori.ceb.api.exception.NoSolutionException;
import com.quantori.ceb.api.exception.NonIntegerResultException;
import com.quantori.ceb.api.model.CoefficientVector;
import com.quantori.ceb.api.model.EquationMatrix;
import com.quantori.ceb.api.service.NullspaceSolver;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Computes balancing coefficients from the null space of an equation matrix using exact rational elimination.
 * <p>
 * The single null space basis vector is scaled by the least common multiple of its denominators, its sign is
 * normalized so the first non zero entry is positive, and it is divided by the greatest common divisor of its
 * entries. Scaling by the smallest entry instead would be wrong: {@code [2/3, 3/4]} must become {@code [8, 9]}.
 */
@Slf4j
public class GaussianNullspaceSolver implements NullspaceSolver {

  @Override
  public CoefficientVector solve(EquationMatrix matrix) {
    Objects.requireNonNull(matrix, "matrix");
    var echelon = RowEchelonForm.reduce(matrix.toArray(), matrix.getColumns());
    List<Integer> freeColumns = echelon.freeColumns();
    log.debug("Matrix {}x{} has rank {} and null space dimension {}", matrix.getRows(), matrix.getColumns(),
        echelon.rank(), freeColumns.size());

    if (freeColumns.isEmpty()) {
      throw new NoSolutionException("Equation has only the trivial solution, it cannot be balanced");
    }
    if (freeColumns.size() > 1) {
      throw new AmbiguousSolutionException(freeColumns.size());
    }

    BigInteger[] integers = toIntegers(echelon.nullspaceVector(freeColumns.get(0)));
    normalizeSign(integers);
    divideByGcd(integers);
    if (Arrays.stream(integers).anyMatch(value -> value.signum() <= 0)) {
      throw new NoSolutionException("Equation has no solution with all coefficients positive: "
          + Arrays.toString(integers));
    }
    return new CoefficientVector(toInts(integers));
  }

  private static BigInteger[] toIntegers(BigFraction[] vector) {
    BigInteger lcm = BigInteger.ONE;
    for (BigFraction value : vector) {
      BigInteger denominator = value.getDenominator();
      lcm = lcm.divide(lcm.gcd(denominator)).multiply(denominator);
    }
    var integers = new BigInteger[vector.length];
    for (int i = 0; i < vector.length; i++) {
      BigFraction scaled = vector[i].multiply(lcm);
      if (!scaled.getDenominator().equals(BigInteger.ONE)) {
        throw new NonIntegerResultException("Coefficient " + scaled + " is not an integer after scaling by " + lcm);
      }
      integers[i] = scaled.getNumerator();
    }
    return integers;
  }

  private static void normalizeSign(BigInteger[] values) {
    for (BigInteger value : values) {
      if (value.signum() != 0) {
        if (value.signum() < 0) {
          for (int i = 0; i < values.length; i++) {
            values[i] = values[i].negate();
          }
        }
        return;
      }
    }
  }

  private static void divideByGcd(BigInteger[] values) {
    BigInteger gcd = BigInteger.ZERO;
    for (BigInteger value : values) {
      gcd = gcd.gcd(value);
    }
    if (gcd.signum() == 0 || gcd.equals(BigInteger.ONE)) {
      return;
    }
    for (int i = 0; i < values.length; i++) {
      values[i] = values[i].divide(gcd);
    }
  }

  private static List<Integer> toInts(BigInteger[] values) {
    List<Integer> ints = new ArrayList<>(values.length);
    for (BigInteger value : values) {
      try {
        ints.add(value.intValueExact());
      } catch (ArithmeticException e) {
        throw new NonIntegerResultException("Coefficient " + value + " does not fit into an int", e);
      }
    }
    return ints;
  }
}
