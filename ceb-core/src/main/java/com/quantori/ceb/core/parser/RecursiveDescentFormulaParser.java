package com.quantori.ceb.core.parser;

import com.quantori.ceb.api.exception.FormulaParseException;
import com.quantori.ceb.api.model.Group;
import com.quantori.ceb.api.model.Molecule;
import com.quantori.ceb.api.model.ParseNode;
import com.quantori.ceb.api.model.RepeatedAtom;
import com.quantori.ceb.api.model.SingleAtom;
import com.quantori.ceb.api.service.FormulaParser;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * A hand written LL(1) parser of chemical formulas. An atom symbol or an opening parenthesis selects the branch,
 * so every valid formula has exactly one parse tree.
 * <p>
 * The parser keeps no state between calls and is safe to share between threads.
 */
@Slf4j
public class RecursiveDescentFormulaParser implements FormulaParser {

  public static final int UNLIMITED = 0;

  private final int maxFormulaLength;
  private final int maxGroupDepth;

  public RecursiveDescentFormulaParser() {
    this(UNLIMITED, UNLIMITED);
  }

  /**
   * Creates a parser with input limits. A formula within the limits is accepted exactly when it matches the grammar.
   *
   * @param maxFormulaLength longest accepted formula in characters, {@link #UNLIMITED} for no limit
   * @param maxGroupDepth    deepest accepted nesting of parenthesised groups, {@link #UNLIMITED} for no limit
   */
  public RecursiveDescentFormulaParser(int maxFormulaLength, int maxGroupDepth) {
    Validate.isTrue(maxFormulaLength >= 0, "maxFormulaLength must not be negative: %d", maxFormulaLength);
    Validate.isTrue(maxGroupDepth >= 0, "maxGroupDepth must not be negative: %d", maxGroupDepth);
    this.maxFormulaLength = maxFormulaLength;
    this.maxGroupDepth = maxGroupDepth;
  }

  @Override
  public Molecule parse(String formula) {
    Objects.requireNonNull(formula, "formula");
    if (maxFormulaLength != UNLIMITED && formula.length() > maxFormulaLength) {
      throw new FormulaParseException(formula, maxFormulaLength,
          "formula is longer than " + maxFormulaLength + " characters");
    }
    var cursor = new Cursor(formula, FormulaTokenizer.tokenize(formula));
    List<ParseNode> members = parseMembers(cursor);
    if (members.isEmpty()) {
      throw cursor.error("expected an atom or '('");
    }
    if (!cursor.atEnd()) {
      FormulaToken token = cursor.peek();
      String message = token.is(FormulaToken.Type.CLOSE) ? "unmatched ')'" : "unexpected '" + token.text() + "'";
      throw new FormulaParseException(formula, token.position(), message);
    }
    var molecule = new Molecule(members);
    log.debug("Parsed formula {} into {}", formula, molecule);
    return molecule;
  }

  private List<ParseNode> parseMembers(Cursor cursor) {
    List<ParseNode> members = new ArrayList<>();
    while (!cursor.atEnd()) {
      FormulaToken token = cursor.peek();
      if (token.is(FormulaToken.Type.SYMBOL)) {
        members.add(parseAtom(cursor));
      } else if (token.is(FormulaToken.Type.OPEN)) {
        members.add(parseGroup(cursor));
      } else {
        break;
      }
    }
    return members;
  }

  private ParseNode parseAtom(Cursor cursor) {
    FormulaToken symbol = cursor.next();
    if (cursor.check(FormulaToken.Type.INTEGER)) {
      return new RepeatedAtom(symbol.text(), parseInteger(cursor, cursor.next()));
    }
    return new SingleAtom(symbol.text());
  }

  private ParseNode parseGroup(Cursor cursor) {
    FormulaToken open = cursor.next();
    if (++cursor.depth > maxGroupDepth && maxGroupDepth != UNLIMITED) {
      throw new FormulaParseException(cursor.formula, open.position(),
          "groups are nested deeper than " + maxGroupDepth + " levels");
    }
    List<ParseNode> members = parseMembers(cursor);
    if (members.isEmpty() && cursor.check(FormulaToken.Type.CLOSE)) {
      throw cursor.error("empty group");
    }
    if (!cursor.check(FormulaToken.Type.CLOSE)) {
      if (cursor.atEnd()) {
        throw new FormulaParseException(cursor.formula, open.position(), "unmatched '('");
      }
      throw cursor.error("expected an atom, '(' or ')'");
    }
    cursor.next();
    if (!cursor.check(FormulaToken.Type.INTEGER)) {
      throw cursor.error("missing group multiplier after ')'");
    }
    BigInteger multiplier = parseInteger(cursor, cursor.next());
    cursor.depth--;
    return new Group(members, multiplier);
  }

  private BigInteger parseInteger(Cursor cursor, FormulaToken token) {
    var value = new BigInteger(token.text());
    if (value.signum() == 0) {
      throw new FormulaParseException(cursor.formula, token.position(), "count must be at least 1");
    }
    return value;
  }

  /**
   * Position in the token list of a single parse call.
   */
  private static final class Cursor {
    private final String formula;
    private final List<FormulaToken> tokens;
    private int index;
    private int depth;

    private Cursor(String formula, List<FormulaToken> tokens) {
      this.formula = formula;
      this.tokens = tokens;
    }

    boolean atEnd() {
      return index >= tokens.size();
    }

    FormulaToken peek() {
      return tokens.get(index);
    }

    FormulaToken next() {
      return tokens.get(index++);
    }

    boolean check(FormulaToken.Type type) {
      return !atEnd() && peek().is(type);
    }

    FormulaParseException error(String message) {
      int position = atEnd() ? formula.length() : peek().position();
      return new FormulaParseException(formula, position, message);
    }
  }
}
