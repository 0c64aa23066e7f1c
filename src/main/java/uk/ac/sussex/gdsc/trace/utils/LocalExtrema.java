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
 * Find strict local extrema in a sampled curve. The end points are never extrema.
 */
public final class LocalExtrema {

  /** No public construction. */
  private LocalExtrema() {}

  /**
   * Find the indices of the strict local minima {@code y[i-1] > y[i] < y[i+1]}.
   *
   * @param y the y values
   * @return the indices
   */
  public static int[] findMinimaIndices(double[] y) {
    final int[] indices = new int[Math.max(0, y.length - 2)];
    int count = 0;
    for (int i = 1; i < y.length - 1; i++) {
      if (y[i - 1] > y[i] && y[i] < y[i + 1]) {
        indices[count++] = i;
      }
    }
    return Arrays.copyOf(indices, count);
  }

  /**
   * Find the indices of the strict local maxima {@code y[i-1] < y[i] > y[i+1]}.
   *
   * @param y the y values
   * @return the indices
   */
  public static int[] findMaximaIndices(double[] y) {
    final int[] indices = new int[Math.max(0, y.length - 2)];
    int count = 0;
    for (int i = 1; i < y.length - 1; i++) {
      if (y[i - 1] < y[i] && y[i] > y[i + 1]) {
        indices[count++] = i;
      }
    }
    return Arrays.copyOf(indices, count);
  }

  /**
   * Find the x positions of the strict local minima of y.
   *
   * @param x the x values
   * @param y the y values
   * @return the x positions
   */
  public static double[] findMinima(double[] x, double[] y) {
    return select(x, y, findMinimaIndices(y));
  }

  /**
   * Find the x positions of the strict local maxima of y.
   *
   * @param x the x values
   * @param y the y values
   * @return the x positions
   */
  public static double[] findMaxima(double[] x, double[] y) {
    return select(x, y, findMaximaIndices(y));
  }

  private static double[] select(double[] x, double[] y, int[] indices) {
    ValidationUtils.checkArgument(x.length == y.length, "Length mismatch: x=%d, y=%d", x.length,
        y.length);
    final double[] result = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      result[i] = x[indices[i]];
    }
    return result;
  }
}
