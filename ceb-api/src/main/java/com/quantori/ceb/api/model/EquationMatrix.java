package com.quantori.ceb.api.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * A dense matrix of exact rational values. Immutable: every accessor returns copies or immutable values.
 */
public final class EquationMatrix {

  private final BigFraction[][] data;
  private final int rows;
  private final int columns;

  private EquationMatrix(BigFraction[][] data, int rows, int columns) {
    this.data = data;
    this.rows = rows;
    this.columns = columns;
  }

  /**
   * Creates a matrix from a row major array, the array is copied.
   *
   * @param values rows of equal length
   * @return matrix
   */
  public static EquationMatrix of(BigFraction[][] values) {
    Objects.requireNonNull(values);
    int columns = values.length == 0 ? 0 : values[0].length;
    var copy = new BigFraction[values.length][];
    for (int r = 0; r < values.length; r++) {
      Validate.isTrue(values[r].length == columns, "Row %d has %d columns, expected %d", r, values[r].length,
          columns);
      copy[r] = new BigFraction[columns];
      for (int c = 0; c < columns; c++) {
        copy[r][c] = Objects.requireNonNull(values[r][c]);
      }
    }
    return new EquationMatrix(copy, values.length, columns);
  }

  public int getRows() {
    return rows;
  }

  public int getColumns() {
    return columns;
  }

  public BigFraction get(int row, int column) {
    return data[row][column];
  }

  /**
   * Copy of the matrix content, suitable for in-place elimination.
   *
   * @return row major copy
   */
  public BigFraction[][] toArray() {
    var copy = new BigFraction[rows][];
    for (int r = 0; r < rows; r++) {
      copy[r] = Arrays.copyOf(data[r], columns);
    }
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EquationMatrix other)) {
      return false;
    }
    return rows == other.rows && columns == other.columns && Arrays.deepEquals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rows + columns) + Arrays.deepHashCode(data);
  }

  @Override
  public String toString() {
    return Arrays.stream(data)
        .map(row -> Arrays.stream(row).map(EquationMatrix::format).collect(Collectors.joining(" ", "[", "]")))
        .collect(Collectors.joining(", ", "[", "]"));
  }

  private static String format(BigFraction value) {
    return value.getDenominatorAsLong() == 1 ? value.getNumerator().toString() : value.toString();
  }
}
