package com.quantori.ceb.api.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * A parenthesised group with its mandatory multiplier, e.g. {@code (OH)2} in {@code Mg(OH)2}.
 */
public record Group(List<ParseNode> children, BigInteger multiplier) implements ParseNode {

  public Group {
    Objects.requireNonNull(children);
    Objects.requireNonNull(multiplier);
    Validate.notEmpty(children, "Group must have at least one member");
    Validate.isTrue(multiplier.signum() > 0, "Group multiplier must be positive: %s", multiplier);
    children = List.copyOf(children);
  }

  public Group(List<ParseNode> children, long multiplier) {
    this(children, BigInteger.valueOf(multiplier));
  }
}
