package com.quantori.ceb.api.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.Validate;

/**
 * Number of atoms of each element in a molecule or a group. Immutable, all methods are safe.
 * <p>
 * Only positive counts are stored: an element absent from the molecule is absent from the map, and
 * {@link #get(String)} returns zero for it. Counts are arbitrary precision, so summing and scaling never overflow.
 */
@EqualsAndHashCode
public final class AtomCount {

  private static final AtomCount EMPTY = new AtomCount(new TreeMap<>());

  private final SortedMap<String, BigInteger> counts;

  private AtomCount(SortedMap<String, BigInteger> counts) {
    this.counts = Collections.unmodifiableSortedMap(counts);
  }

  /**
   * Count without any atoms, the neutral element of {@link #plus(AtomCount)}.
   *
   * @return empty count
   */
  public static AtomCount empty() {
    return EMPTY;
  }

  public static AtomCount of(String symbol, long count) {
    return of(symbol, BigInteger.valueOf(count));
  }

  /**
   * Count of a single element.
   *
   * @param symbol element symbol
   * @param count  number of atoms, must be positive
   * @return atom count
   */
  public static AtomCount of(String symbol, BigInteger count) {
    Objects.requireNonNull(symbol);
    Validate.isTrue(count.signum() > 0, "Atom count must be positive: %s", count);
    var map = new TreeMap<String, BigInteger>();
    map.put(symbol, count);
    return new AtomCount(map);
  }

  /**
   * Count built from a map of element symbols to positive counts.
   *
   * @param counts element counts, zero entries are dropped
   * @return atom count
   */
  public static AtomCount of(Map<String, Long> counts) {
    Objects.requireNonNull(counts);
    var map = new TreeMap<String, BigInteger>();
    counts.forEach((symbol, count) -> {
      Objects.requireNonNull(symbol);
      Validate.isTrue(count >= 0, "Atom count must not be negative: %s=%d", symbol, count);
      if (count > 0) {
        map.put(symbol, BigInteger.valueOf(count));
      }
    });
    return map.isEmpty() ? EMPTY : new AtomCount(map);
  }

  /**
   * Adds two counts.
   *
   * @param other count to add
   * @return new count containing the union of elements with summed counts
   */
  public AtomCount plus(AtomCount other) {
    Objects.requireNonNull(other);
    if (other.counts.isEmpty()) {
      return this;
    }
    var map = new TreeMap<>(counts);
    other.counts.forEach((symbol, count) -> map.merge(symbol, count, BigInteger::add));
    return new AtomCount(map);
  }

  public AtomCount times(long factor) {
    return times(BigInteger.valueOf(factor));
  }

  /**
   * Multiplies every count by the given factor.
   *
   * @param factor multiplier, must be positive
   * @return new scaled count
   */
  public AtomCount times(BigInteger factor) {
    Validate.isTrue(factor.signum() > 0, "Multiplier must be positive: %s", factor);
    if (BigInteger.ONE.equals(factor)) {
      return this;
    }
    var map = new TreeMap<String, BigInteger>();
    counts.forEach((symbol, count) -> map.put(symbol, count.multiply(factor)));
    return new AtomCount(map);
  }

  public BigInteger get(String symbol) {
    return counts.getOrDefault(symbol, BigInteger.ZERO);
  }

  public Set<String> atoms() {
    return counts.keySet();
  }

  public Map<String, BigInteger> asMap() {
    return counts;
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  @Override
  public String toString() {
    return counts.toString();
  }
}
