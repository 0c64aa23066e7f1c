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
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Simple statistics on arrays of doubles that treat non-finite values as missing.
 */
public final class TraceMath {

  /** No public construction. */
  private TraceMath() {}

  /**
   * Compute the mean of the finite values.
   *
   * @param values the values
   * @return the mean (NaN if there are no finite values)
   */
  public static double nanMean(double[] values) {
    return nanMean(values, 0, values.length);
  }

  /**
   * Compute the mean of the finite values in the range {@code [from, to)}.
   *
   * @param values the values
   * @param from the from index (inclusive)
   * @param to the to index (exclusive)
   * @return the mean (NaN if there are no finite values)
   */
  public static double nanMean(double[] values, int from, int to) {
    double sum = 0;
    int count = 0;
    for (int i = from; i < to; i++) {
      if (Double.isFinite(values[i])) {
        sum += values[i];
        count++;
      }
    }
    return count == 0 ? Double.NaN : sum / count;
  }

  /**
   * Compute the population standard deviation of the finite values.
   *
   * @param values the values
   * @return the standard deviation (NaN if there are no finite values)
   */
  public static double nanStd(double[] values) {
    return nanStd(values, 0, values.length);
  }

  /**
   * Compute the population standard deviation of the finite values in the range
   * {@code [from, to)}.
   *
   * @param values the values
   * @param from the from index (inclusive)
   * @param to the to index (exclusive)
   * @return the standard deviation (NaN if there are no finite values)
   */
  public static double nanStd(double[] values, int from, int to) {
    final double mean = nanMean(values, from, to);
    if (Double.isNaN(mean)) {
      return Double.NaN;
    }
    double ss = 0;
    int count = 0;
    for (int i = from; i < to; i++) {
      if (Double.isFinite(values[i])) {
        final double d = values[i] - mean;
        ss += d * d;
        count++;
      }
    }
    return Math.sqrt(ss / count);
  }

  /**
   * Count the finite values.
   *
   * @param values the values
   * @return the count
   */
  public static int countFinite(double[] values) {
    int count = 0;
    for (final double v : values) {
      if (Double.isFinite(v)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Extract the finite values.
   *
   * @param values the values
   * @return the finite values
   */
  public static double[] finite(double[] values) {
    return Arrays.stream(values).filter(Double::isFinite).toArray();
  }

  /**
   * Compute the percentile of the finite values using linear interpolation between the closest
   * ranks.
   *
   * @param values the values
   * @param p the percentile in {@code (0, 100]}
   * @return the percentile (NaN if there are no finite values)
   */
  public static double percentile(double[] values, double p) {
    final double[] data = finite(values);
    if (data.length == 0) {
      return Double.NaN;
    }
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(data, p);
  }

  /**
   * Compute the median of the finite values.
   *
   * @param values the values
   * @return the median (NaN if there are no finite values)
   */
  public static double nanMedian(double[] values) {
    return percentile(values, 50);
  }

  /**
   * Create {@code n} evenly spaced values over the closed interval {@code [min, max]}.
   *
   * @param min the min
   * @param max the max
   * @param n the number of values
   * @return the values
   */
  public static double[] linspace(double min, double max, int n) {
    ValidationUtils.checkArgument(n > 0, "Number of points must be positive: %d", n);
    if (n == 1) {
      return new double[] {min};
    }
    final double[] x = SimpleArrayUtils.newArray(n, min, (max - min) / (n - 1));
    // Avoid round-off at the end
    x[n - 1] = max;
    return x;
  }

  /**
   * Find the index of the maximum value. NaN values are ignored.
   *
   * @param values the values
   * @param from the from index (inclusive)
   * @param to the to index (exclusive)
   * @return the index (-1 if no values are comparable)
   */
  public static int argMax(double[] values, int from, int to) {
    int index = -1;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = from; i < to; i++) {
      if (values[i] > max || (index == -1 && values[i] == max)) {
        max = values[i];
        index = i;
      }
    }
    return index;
  }
}
