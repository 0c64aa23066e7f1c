/*-
 * #%L
 * Genome Damage and Stability Centre Ablation Trace Tools
 *
 * Software for laser ablation time-series analysis
 * %%
 * Copyright (C) 2011 - 2025 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.trace.filter.expression;

import java.util.function.Predicate;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Parse a filter expression using the grammar:
 *
 * <pre>
 * expr   := term ('|' term)*
 * term   := factor ('&amp;' factor)*
 * factor := '!' factor | '(' expr ')' | NAME
 * </pre>
 *
 * <p>A name is a maximal run of characters other than whitespace and the operator characters
 * {@code & | ! ( )}.
 */
public final class ExpressionParser {
  private final String text;
  private final Predicate<String> isKnown;

  /** The current position. */
  private int pos;

  private ExpressionParser(String text, Predicate<String> isKnown) {
    this.text = text;
    this.isKnown = isKnown;
  }

  /**
   * Parse the expression. The text must not be blank.
   *
   * @param text the text
   * @param isKnown test if a name is a known filter
   * @return the expression
   * @throws InvalidExpressionException if the syntax is invalid or a name is unknown
   */
  public static Expression parse(String text, Predicate<String> isKnown) {
    ValidationUtils.checkNotNull(text, "text");
    ValidationUtils.checkNotNull(isKnown, "isKnown");
    final ExpressionParser parser = new ExpressionParser(text, isKnown);
    final Expression e = parser.parseExpression();
    parser.skipWhitespace();
    if (parser.pos < text.length()) {
      throw parser.unexpected();
    }
    return e;
  }

  /**
   * Check if the character is part of a name.
   *
   * @param ch the character
   * @return true if a name character
   */
  public static boolean isNameCharacter(char ch) {
    return !Character.isWhitespace(ch) && ch != '&' && ch != '|' && ch != '!' && ch != '('
        && ch != ')';
  }

  /**
   * Check if the text is a valid name.
   *
   * @param name the name
   * @return true if valid
   */
  public static boolean isValidName(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      if (!isNameCharacter(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private Expression parseExpression() {
    Expression e = parseTerm();
    while (accept('|')) {
      e = new Expression.Or(e, parseTerm());
    }
    return e;
  }

  private Expression parseTerm() {
    Expression e = parseFactor();
    while (accept('&')) {
      e = new Expression.And(e, parseFactor());
    }
    return e;
  }

  private Expression parseFactor() {
    skipWhitespace();
    if (pos == text.length()) {
      throw new InvalidExpressionException("Unexpected end of expression: '" + text + "'", "",
          pos);
    }
    if (accept('!')) {
      return new Expression.Not(parseFactor());
    }
    if (text.charAt(pos) == '(') {
      final int open = pos;
      pos++;
      final Expression e = parseExpression();
      if (!accept(')')) {
        skipWhitespace();
        if (pos == text.length()) {
          throw new InvalidExpressionException("Unclosed parenthesis: '" + text + "'", "(", open);
        }
        throw unexpected();
      }
      return e;
    }
    final int start = pos;
    while (pos < text.length() && isNameCharacter(text.charAt(pos))) {
      pos++;
    }
    if (start == pos) {
      throw unexpected();
    }
    final String name = text.substring(start, pos);
    if (!isKnown.test(name)) {
      throw new InvalidExpressionException("Unknown filter '" + name + "'", name, start);
    }
    return new Expression.Name(name);
  }

  private boolean accept(char ch) {
    skipWhitespace();
    if (pos < text.length() && text.charAt(pos) == ch) {
      pos++;
      return true;
    }
    return false;
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private InvalidExpressionException unexpected() {
    final String token = String.valueOf(text.charAt(pos));
    return new InvalidExpressionException("Unexpected '" + token + "' in '" + text + "'", token,
        pos);
  }
}
