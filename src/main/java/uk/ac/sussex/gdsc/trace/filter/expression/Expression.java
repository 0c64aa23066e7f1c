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

import java.util.Set;
import java.util.function.Function;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A logical expression over named boolean masks.
 */
public abstract class Expression {

  /** Package-private construction. */
  Expression() {}

  /**
   * Evaluate the expression. The lookup must return a new mask for each name that may be modified.
   *
   * @param lookup the lookup from filter name to mask
   * @return the mask
   */
  public abstract boolean[] evaluate(Function<String, boolean[]> lookup);

  /**
   * Add the filter names used in the expression to the set.
   *
   * @param names the names
   */
  public abstract void collectNames(Set<String> names);

  /**
   * A reference to a named mask.
   */
  public static final class Name extends Expression {
    private final String name;

    /**
     * Create an instance.
     *
     * @param name the name
     */
    public Name(String name) {
      this.name = ValidationUtils.checkNotNull(name, "name");
    }

    /**
     * Gets the name.
     *
     * @return the name
     */
    public String getName() {
      return name;
    }

    @Override
    public boolean[] evaluate(Function<String, boolean[]> lookup) {
      return lookup.apply(name);
    }

    @Override
    public void collectNames(Set<String> names) {
      names.add(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Logical negation.
   */
  public static final class Not extends Expression {
    private final Expression operand;

    /**
     * Create an instance.
     *
     * @param operand the operand
     */
    public Not(Expression operand) {
      this.operand = ValidationUtils.checkNotNull(operand, "operand");
    }

    @Override
    public boolean[] evaluate(Function<String, boolean[]> lookup) {
      final boolean[] mask = operand.evaluate(lookup);
      for (int i = 0; i < mask.length; i++) {
        mask[i] = !mask[i];
      }
      return mask;
    }

    @Override
    public void collectNames(Set<String> names) {
      operand.collectNames(names);
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }

  /**
   * A binary operation.
   */
  abstract static class Binary extends Expression {
    final Expression left;
    final Expression right;

    Binary(Expression left, Expression right) {
      this.left = ValidationUtils.checkNotNull(left, "left");
      this.right = ValidationUtils.checkNotNull(right, "right");
    }

    @Override
    public void collectNames(Set<String> names) {
      left.collectNames(names);
      right.collectNames(names);
    }

    /**
     * Gets the operator symbol.
     *
     * @return the symbol
     */
    abstract String symbol();

    @Override
    public String toString() {
      return "(" + left + " " + symbol() + " " + right + ")";
    }
  }

  /**
   * Logical conjunction.
   */
  public static final class And extends Binary {
    /**
     * Create an instance.
     *
     * @param left the left operand
     * @param right the right operand
     */
    public And(Expression left, Expression right) {
      super(left, right);
    }

    @Override
    public boolean[] evaluate(Function<String, boolean[]> lookup) {
      final boolean[] a = left.evaluate(lookup);
      final boolean[] b = right.evaluate(lookup);
      for (int i = 0; i < a.length; i++) {
        a[i] &= b[i];
      }
      return a;
    }

    @Override
    String symbol() {
      return "&";
    }
  }

  /**
   * Logical disjunction.
   */
  public static final class Or extends Binary {
    /**
     * Create an instance.
     *
     * @param left the left operand
     * @param right the right operand
     */
    public Or(Expression left, Expression right) {
      super(left, right);
    }

    @Override
    public boolean[] evaluate(Function<String, boolean[]> lookup) {
      final boolean[] a = left.evaluate(lookup);
      final boolean[] b = right.evaluate(lookup);
      for (int i = 0; i < a.length; i++) {
        a[i] |= b[i];
      }
      return a;
    }

    @Override
    String symbol() {
      return "|";
    }
  }
}
