package com.quantori.ceb.api.model;

import java.util.Objects;

/**
 * An atom symbol without a count, e.g. {@code O} in {@code H2O}.
 */
public record SingleAtom(String symbol) implements ParseNode {

  public SingleAtom {
    Objects.requireNonNull(symbol);
  }
}
