package com.quantori.ceb.api.model;

import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * Root node of a parsed formula holding its top level atoms and groups in order of appearance.
 */
public record Molecule(List<ParseNode> children) implements ParseNode {

  public Molecule {
    Objects.requireNonNull(children);
    Validate.notEmpty(children, "Molecule must have at least one member");
    children = List.copyOf(children);
  }
}
