package com.quantori.ceb.api.service;

import com.quantori.ceb.api.exception.FormulaParseException;
import com.quantori.ceb.api.model.Molecule;

/**
 * Parses chemical formula strings such as {@code Co3(Fe(CN)6)2} into a tree of atoms and groups.
 * <p>
 * The grammar is case sensitive, whitespace between tokens is ignored:
 * <pre>
 * molecule    := (atom | group)+
 * group       := "(" (atom | group)+ ")" INTEGER
 * atom        := ATOM_SYMBOL [INTEGER]
 * ATOM_SYMBOL := UPPER [lower]
 * INTEGER     := digit+
 * </pre>
 */
public interface FormulaParser {

  /**
   * Parses a formula.
   *
   * @param formula chemical formula
   * @return root node of the parse tree
   * @throws FormulaParseException if the formula does not match the grammar
   */
  Molecule parse(String formula);
}
