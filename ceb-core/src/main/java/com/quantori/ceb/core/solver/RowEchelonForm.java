package com.quantori.ceb.core.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Reduced row echelon form of a rational matrix computed by Gauss-Jordan elimination. All arithmetic is exact.
 */
final class RowEchelonForm {

  private final BigFraction[][] rows;
  private final int columns;
  private final List<Integer> pivotColumns;

  private RowEchelonForm(BigFraction[][] rows, int columns, List<Integer> pivotColumns) {
    this.rows = rows;
    this.columns = columns;
    this.pivotColumns = Collections.unmodifiableList(pivotColumns);
  }

  /**
   * Reduces the given matrix in place.
   *
   * @param values  row major matrix, modified by the call
   * @param columns number of columns, needed when there are no rows
   * @return reduced form
   */
  static RowEchelonForm reduce(BigFraction[][] values, int columns) {
    List<Integer> pivots = new ArrayList<>();
    int pivotRow = 0;
    for (int column = 0; column < columns && pivotRow < values.length; column++) {
      int source = findPivot(values, pivotRow, column);
      if (source < 0) {
        continue;
      }
      swap(values, pivotRow, source);
      normalize(values[pivotRow], column);
      for (int row = 0; row < values.length; row++) {
        if (row != pivotRow && !isZero(values[row][column])) {
          eliminate(values[row], values[pivotRow], column);
        }
      }
      pivots.add(column);
      pivotRow++;
    }
    return new RowEchelonForm(values, columns, pivots);
  }

  int rank() {
    return pivotColumns.size();
  }

  List<Integer> freeColumns() {
    var pivot = new boolean[columns];
    for (int column : pivotColumns) {
      pivot[column] = true;
    }
    List<Integer> free = new ArrayList<>();
    for (int column = 0; column < columns; column++) {
      if (!pivot[column]) {
        free.add(column);
      }
    }
    return free;
  }

  /**
   * Null space basis vector obtained by setting the given free variable to one and the other free variables to zero.
   *
   * @param freeColumn one of {@link #freeColumns()}
   * @return vector {@code x} with {@code A * x = 0}
   */
  BigFraction[] nullspaceVector(int freeColumn) {
    var vector = new BigFraction[columns];
    for (int i = 0; i < columns; i++) {
      vector[i] = BigFraction.ZERO;
    }
    vector[freeColumn] = BigFraction.ONE;
    for (int i = 0; i < pivotColumns.size(); i++) {
      vector[pivotColumns.get(i)] = rows[i][freeColumn].negate();
    }
    return vector;
  }

  private static int findPivot(BigFraction[][] values, int fromRow, int column) {
    for (int row = fromRow; row < values.length; row++) {
      if (!isZero(values[row][column])) {
        return row;
      }
    }
    return -1;
  }

  private static boolean isZero(BigFraction value) {
    return value.getNumerator().signum() == 0;
  }

  private static void swap(BigFraction[][] values, int a, int b) {
    if (a != b) {
      BigFraction[] tmp = values[a];
      values[a] = values[b];
      values[b] = tmp;
    }
  }

  private static void normalize(BigFraction[] row, int pivotColumn) {
    BigFraction pivot = row[pivotColumn];
    for (int column = 0; column < row.length; column++) {
      row[column] = row[column].divide(pivot);
    }
  }

  // row := row - factor * pivotRow, where pivotRow has 1 in pivotColumn
  private static void eliminate(BigFraction[] row, BigFraction[] pivotRow, int pivotColumn) {
    BigFraction factor = row[pivotColumn];
    for (int column = 0; column < row.length; column++) {
      row[column] = row[column].subtract(factor.multiply(pivotRow[column]));
    }
  }
}
