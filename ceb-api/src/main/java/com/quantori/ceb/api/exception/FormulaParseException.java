package com.quantori.ceb.api.exception;

import lombok.Getter;

/**
 * Thrown when a chemical formula does not match the formula grammar: an unexpected character, an unmatched
 * parenthesis, a group without its multiplier, a zero count or unconsumed trailing input.
 */
@Getter
public class FormulaParseException extends BalancingException {
  private final String formula;
  private final int position;

  /**
   * Constructs a {@code FormulaParseException}.
   *
   * @param formula  the formula being parsed
   * @param position zero based offset in {@code formula} where the problem was detected
   * @param message  what was expected or found at {@code position}
   */
  public FormulaParseException(String formula, int position, String message) {
    super(String.format("Cannot parse formula '%s' at position %d: %s", formula, position, message));
    this.formula = formula;
    this.position = position;
  }

  public FormulaParseException(String formula, int position, String message, Throwable cause) {
    super(String.format("Cannot parse formula '%s' at position %d: %s", formula, position, message), cause);
    this.formula = formula;
    this.position = position;
  }
}
