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

/**
 * Exception thrown when a filter expression cannot be parsed or refers to an unknown filter.
 */
public class InvalidExpressionException extends IllegalArgumentException {
  private static final long serialVersionUID = 20250101L;

  /** The offending token. */
  private final String token;

  /** The position of the token in the expression (or -1). */
  private final int position;

  /**
   * Create an instance.
   *
   * @param message the message
   * @param token the offending token
   * @param position the position of the token in the expression (or -1)
   */
  public InvalidExpressionException(String message, String token, int position) {
    super(position < 0 ? message : message + " at position " + position);
    this.token = token;
    this.position = position;
  }

  /**
   * Gets the offending token.
   *
   * @return the token
   */
  public String getToken() {
    return token;
  }

  /**
   * Gets the position of the token in the expression.
   *
   * @return the position (or -1)
   */
  public int getPosition() {
    return position;
  }
}
