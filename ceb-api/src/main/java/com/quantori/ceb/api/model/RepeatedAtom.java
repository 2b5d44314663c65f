package com.quantori.ceb.api.model;

import java.math.BigInteger;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * An atom symbol followed by its count, e.g. {@code H2} in {@code H2O}.
 */
public record RepeatedAtom(String symbol, BigInteger count) implements ParseNode {

  public RepeatedAtom {
    Objects.requireNonNull(symbol);
    Objects.requireNonNull(count);
    Validate.isTrue(count.signum() > 0, "Atom count must be positive: %s", count);
  }

  public RepeatedAtom(String symbol, long count) {
    this(symbol, BigInteger.valueOf(count));
  }
}
