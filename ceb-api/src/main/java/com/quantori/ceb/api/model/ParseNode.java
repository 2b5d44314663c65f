package com.quantori.ceb.api.model;

/**
 * A node of a parsed chemical formula. A formula always parses to a single root {@link Molecule}, whose children
 * are {@link SingleAtom}, {@link RepeatedAtom} and {@link Group} nodes; groups nest to any depth.
 */
public interface ParseNode {
}
