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
import org.apache.commons.math3.stat.regression.SimpleRegression;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Compute statistics over a window centred on each position of an array.
 *
 * <p>Windows must have an odd width so that each window has a centre. Even widths are reduced by
 * one. The {@code width / 2} positions at each end of the array where the window would extend
 * beyond the data receive a pad value.
 *
 * <p>Non-finite values are treated as missing data and ignored by the statistics.
 */
public final class RollingWindow {

  /**
   * Define a function computed over a window of data.
   */
  @FunctionalInterface
  public interface WindowFunction {
    /**
     * Compute the statistic over the window {@code [from, to)}.
     *
     * @param data the data
     * @param from the from index (inclusive)
     * @param to the to index (exclusive)
     * @return the statistic
     */
    double apply(double[] data, int from, int to);
  }

  /** No public construction. */
  private RollingWindow() {}

  /**
   * Get the odd window width. Even widths are reduced by one.
   *
   * @param width the width
   * @param length the length of the data
   * @return the odd width
   * @throws IllegalArgumentException if the width is not within {@code [1, length]}
   */
  public static int oddWidth(int width, int length) {
    ValidationUtils.checkArgument(width >= 1 && width <= length, "Window width %d not in [1, %d]",
        width, length);
    return (width & 1) == 0 ? width - 1 : width;
  }

  /**
   * Apply the function to the window centred on each position.
   *
   * @param values the values
   * @param width the window width
   * @param fn the function
   * @param pad the pad value for the positions without a complete window
   * @return the result
   */
  public static double[] rolling(double[] values, int width, WindowFunction fn, double pad) {
    final int w = oddWidth(width, values.length);
    final int half = w / 2;
    final double[] result = new double[values.length];
    Arrays.fill(result, 0, half, pad);
    Arrays.fill(result, values.length - half, values.length, pad);
    for (int i = half; i < values.length - half; i++) {
      result[i] = fn.apply(values, i - half, i + half + 1);
    }
    return result;
  }

  /**
   * Compute the rolling mean of the finite values.
   *
   * @param values the values
   * @param width the window width
   * @param pad the pad value
   * @return the rolling mean
   */
  public static double[] rollingMean(double[] values, int width, double pad) {
    return rolling(values, width, TraceMath::nanMean, pad);
  }

  /**
   * Compute the rolling population standard deviation of the finite values.
   *
   * @param values the values
   * @param width the window width
   * @param pad the pad value
   * @return the rolling standard deviation
   */
  public static double[] rollingStd(double[] values, int width, double pad) {
    return rolling(values, width, TraceMath::nanStd, pad);
  }

  /**
   * Compute the rolling gradient. This is the slope of a least squares straight line fit to each
   * window using an integer x scale. Ends are padded with zero.
   *
   * @param values the values
   * @param width the window width
   * @return the rolling gradient
   */
  public static double[] rollingSlope(double[] values, int width) {
    final SimpleRegression regression = new SimpleRegression();
    return rolling(values, width, (data, from, to) -> {
      regression.clear();
      for (int i = from; i < to; i++) {
        if (Double.isFinite(data[i])) {
          regression.addData(i - from, data[i]);
        }
      }
      // NaN if fewer than 2 points
      return regression.getSlope();
    }, 0);
  }

  /**
   * Compute the mean and population standard deviation of a window of any width. The window for
   * centre {@code c} starts at {@code c - width / 2} and spans {@code width} samples. Incomplete
   * windows are NaN.
   *
   * <p>The values are assumed to be finite.
   *
   * @param values the values
   * @param width the window width
   * @return {mean, std}
   */
  public static double[][] windowMeanStd(double[] values, int width) {
    final int n = values.length;
    ValidationUtils.checkArgument(width >= 1, "Window width must be positive: %d", width);
    final double[] mean = new double[n];
    final double[] std = new double[n];
    Arrays.fill(mean, Double.NaN);
    Arrays.fill(std, Double.NaN);
    if (width > n) {
      return new double[][] {mean, std};
    }
    // Cumulative sums of data shifted by the mean to limit cancellation
    final double shift = TraceMath.nanMean(values);
    final double[] s1 = new double[n + 1];
    final double[] s2 = new double[n + 1];
    for (int i = 0; i < n; i++) {
      final double d = values[i] - shift;
      s1[i + 1] = s1[i] + d;
      s2[i + 1] = s2[i] + d * d;
    }
    final int half = width / 2;
    for (int c = half; c - half + width <= n; c++) {
      final int start = c - half;
      final int end = start + width;
      final double m = (s1[end] - s1[start]) / width;
      final double v = (s2[end] - s2[start]) / width - m * m;
      mean[c] = m + shift;
      std[c] = Math.sqrt(Math.max(0, v));
    }
    return new double[][] {mean, std};
  }
}
