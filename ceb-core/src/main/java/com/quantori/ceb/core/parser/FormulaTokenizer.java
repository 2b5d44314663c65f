package com.quantori.ceb.core.parser;

import com.quantori.ceb.api.exception.FormulaParseException;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Splits a formula into symbols, integers and parentheses, skipping whitespace between them.
 */
@UtilityClass
class FormulaTokenizer {

  static List<FormulaToken> tokenize(String formula) {
    List<FormulaToken> tokens = new ArrayList<>();
    int length = formula.length();
    int i = 0;
    while (i < length) {
      char c = formula.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (isUpper(c)) {
        int end = i + 1 < length && isLower(formula.charAt(i + 1)) ? i + 2 : i + 1;
        tokens.add(new FormulaToken(FormulaToken.Type.SYMBOL, formula.substring(i, end), i));
        i = end;
      } else if (isDigit(c)) {
        int end = i + 1;
        while (end < length && isDigit(formula.charAt(end))) {
          end++;
        }
        tokens.add(new FormulaToken(FormulaToken.Type.INTEGER, formula.substring(i, end), i));
        i = end;
      } else if (c == '(') {
        tokens.add(new FormulaToken(FormulaToken.Type.OPEN, "(", i));
        i++;
      } else if (c == ')') {
        tokens.add(new FormulaToken(FormulaToken.Type.CLOSE, ")", i));
        i++;
      } else {
        throw new FormulaParseException(formula, i, "unexpected character '" + c + "'");
      }
    }
    return tokens;
  }

  // ASCII only, symbols like "Na" never contain other letters
  private static boolean isUpper(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isLower(char c) {
    return c >= 'a' && c <= 'z';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
