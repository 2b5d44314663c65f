package com.quantori.ceb.core.parser;

/**
 * Lexical token of a chemical formula.
 *
 * @param type     token kind
 * @param text     matched characters
 * @param position zero based offset of the first character in the formula
 */
record FormulaToken(Type type, String text, int position) {

  enum Type {
    SYMBOL,
    INTEGER,
    OPEN,
    CLOSE
  }

  boolean is(Type expected) {
    return type == expected;
  }
}
