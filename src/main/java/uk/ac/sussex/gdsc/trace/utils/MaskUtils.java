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

package uk.ac.sussex.gdsc.trace.utils;

import java.util.Arrays;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Logical operations on boolean masks.
 */
public final class MaskUtils {

  /** No public construction. */
  private MaskUtils() {}

  /**
   * Create a mask of the given length with all values set to the given value.
   *
   * @param length the length
   * @param value the value
   * @return the mask
   */
  public static boolean[] filled(int length, boolean value) {
    final boolean[] mask = new boolean[length];
    if (value) {
      Arrays.fill(mask, true);
    }
    return mask;
  }

  /**
   * Compute {@code a & b} in place on {@code a}.
   *
   * @param a the first mask (modified)
   * @param b the second mask
   * @return a
   */
  public static boolean[] andInPlace(boolean[] a, boolean[] b) {
    checkLength(a, b);
    for (int i = 0; i < a.length; i++) {
      a[i] &= b[i];
    }
    return a;
  }

  /**
   * Compute {@code a | b} in place on {@code a}.
   *
   * @param a the first mask (modified)
   * @param b the second mask
   * @return a
   */
  public static boolean[] orInPlace(boolean[] a, boolean[] b) {
    checkLength(a, b);
    for (int i = 0; i < a.length; i++) {
      a[i] |= b[i];
    }
    return a;
  }

  /**
   * Compute {@code !a} in place.
   *
   * @param a the mask (modified)
   * @return a
   */
  public static boolean[] notInPlace(boolean[] a) {
    for (int i = 0; i < a.length; i++) {
      a[i] = !a[i];
    }
    return a;
  }

  /**
   * Compute {@code !a & !b} as a new mask.
   *
   * @param a the first mask
   * @param b the second mask
   * @return the mask
   */
  public static boolean[] neither(boolean[] a, boolean[] b) {
    checkLength(a, b);
    final boolean[] result = new boolean[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = !a[i] && !b[i];
    }
    return result;
  }

  /**
   * Count the true values.
   *
   * @param mask the mask
   * @return the count
   */
  public static int count(boolean[] mask) {
    int count = 0;
    for (final boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /**
   * Get the indices of the true values.
   *
   * @param mask the mask
   * @return the indices
   */
  public static int[] indices(boolean[] mask) {
    final int[] indices = new int[count(mask)];
    int count = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        indices[count++] = i;
      }
    }
    return indices;
  }

  /**
   * Create a mask of samples that are finite in every one of the value arrays.
   *
   * @param length the length
   * @param values the values
   * @return the mask
   */
  public static boolean[] finite(int length, double[]... values) {
    final boolean[] mask = filled(length, true);
    for (final double[] v : values) {
      ValidationUtils.checkArgument(v.length == length, "Length mismatch: %d != %d", v.length,
          length);
      for (int i = 0; i < length; i++) {
        mask[i] &= Double.isFinite(v[i]);
      }
    }
    return mask;
  }

  private static void checkLength(boolean[] a, boolean[] b) {
    ValidationUtils.checkArgument(a.length == b.length, "Mask length mismatch: %d != %d", a.length,
        b.length);
  }
}
