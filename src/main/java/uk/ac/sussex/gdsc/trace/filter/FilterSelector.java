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

package uk.ac.sussex.gdsc.trace.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Selects the mask to use for an analyte from a {@link FilterRegistry}.
 *
 * @see FilterRegistry#grab(FilterSelector, String)
 */
public final class FilterSelector {
  private static final FilterSelector NONE = new FilterSelector(Kind.NONE, null, null);
  private static final FilterSelector SWITCHES = new FilterSelector(Kind.SWITCHES, null, null);

  /**
   * The kind of selection.
   */
  public enum Kind {
    /** All samples are selected. */
    NONE,
    /** A single expression is used for all analytes. */
    EXPRESSION,
    /** An expression is provided for each analyte. */
    PER_ANALYTE,
    /** The current filter switches of the analyte are used. */
    SWITCHES;
  }

  private final Kind kind;
  private final String expression;
  private final Map<String, String> expressions;

  private FilterSelector(Kind kind, String expression, Map<String, String> expressions) {
    this.kind = kind;
    this.expression = expression;
    this.expressions = expressions;
  }

  /**
   * Select all samples.
   *
   * @return the selector
   */
  public static FilterSelector none() {
    return NONE;
  }

  /**
   * Select samples using a logical expression of filter names.
   *
   * @param expression the expression
   * @return the selector
   */
  public static FilterSelector expression(String expression) {
    ValidationUtils.checkNotNull(expression, "expression");
    return new FilterSelector(Kind.EXPRESSION, expression, null);
  }

  /**
   * Select samples using a logical expression for each analyte.
   *
   * @param expressions the expression for each analyte
   * @return the selector
   */
  public static FilterSelector perAnalyte(Map<String, String> expressions) {
    return new FilterSelector(Kind.PER_ANALYTE, null,
        Collections.unmodifiableMap(new LinkedHashMap<>(expressions)));
  }

  /**
   * Select samples using the filters currently switched on for the analyte.
   *
   * @return the selector
   */
  public static FilterSelector switches() {
    return SWITCHES;
  }

  /**
   * Gets the kind.
   *
   * @return the kind
   */
  public Kind getKind() {
    return kind;
  }

  /**
   * Gets the expression. Only valid for {@link Kind#EXPRESSION}.
   *
   * @return the expression (or null)
   */
  public String getExpression() {
    return expression;
  }

  /**
   * Gets the expressions for each analyte. Only valid for {@link Kind#PER_ANALYTE}.
   *
   * @return the expressions (or null)
   */
  public Map<String, String> getExpressions() {
    return expressions;
  }

  @Override
  public String toString() {
    switch (kind) {
      case EXPRESSION:
        return "expression[" + expression + "]";
      case PER_ANALYTE:
        return "perAnalyte" + expressions;
      case SWITCHES:
        return "switches";
      default:
        return "none";
    }
  }
}
