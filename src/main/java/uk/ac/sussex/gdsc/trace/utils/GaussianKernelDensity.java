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
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * One dimensional gaussian kernel density estimate.
 *
 * <p>The kernel bandwidth is the sample standard deviation (bias corrected) multiplied by a factor
 * from a {@link BandwidthMethod} or an explicit factor. Non-finite values are ignored.
 */
public class GaussianKernelDensity {
  /** The kernel is truncated at this many bandwidths from the evaluation point. */
  private static final double KERNEL_RANGE = 9;

  /** 1 / sqrt(2 pi). */
  private static final double INV_ROOT_2_PI = 1 / Math.sqrt(2 * Math.PI);

  /** The sorted finite data. */
  private final double[] data;

  /** The bandwidth. */
  private final double bandwidth;

  /**
   * Create an instance using Scott's rule for the bandwidth.
   *
   * @param values the values
   * @throws IllegalArgumentException if there are fewer than 2 finite values or zero variance
   */
  public GaussianKernelDensity(double[] values) {
    this(values, BandwidthMethod.SCOTT);
  }

  /**
   * Create an instance.
   *
   * @param values the values
   * @param method the bandwidth method
   * @throws IllegalArgumentException if there are fewer than 2 finite values or zero variance
   */
  public GaussianKernelDensity(double[] values, BandwidthMethod method) {
    this(values, ValidationUtils.checkNotNull(method, "method"), Double.NaN);
  }

  /**
   * Create an instance with an explicit bandwidth factor.
   *
   * @param values the values
   * @param factor the factor applied to the standard deviation
   * @throws IllegalArgumentException if there are fewer than 2 finite values or zero variance
   */
  public GaussianKernelDensity(double[] values, double factor) {
    this(values, null, factor);
  }

  private GaussianKernelDensity(double[] values, BandwidthMethod method, double factor) {
    data = TraceMath.finite(values);
    ValidationUtils.checkArgument(data.length >= 2,
        "Kernel density requires at least 2 finite values: %d", data.length);
    final double sd = new StandardDeviation(true).evaluate(data);
    ValidationUtils.checkArgument(sd > 0, "Kernel density requires non-zero variance");
    final double f = method == null ? factor : method.getFactor(data.length);
    ValidationUtils.checkArgument(f > 0 && Double.isFinite(f),
        "Bandwidth factor must be positive: %s", f);
    bandwidth = sd * f;
    Arrays.sort(data);
  }

  /**
   * Gets the kernel bandwidth.
   *
   * @return the bandwidth
   */
  public double getBandwidth() {
    return bandwidth;
  }

  /**
   * Gets the number of finite data points.
   *
   * @return the size
   */
  public int getSize() {
    return data.length;
  }

  /**
   * Gets the minimum of the data.
   *
   * @return the min
   */
  public double getMin() {
    return data[0];
  }

  /**
   * Gets the maximum of the data.
   *
   * @return the max
   */
  public double getMax() {
    return data[data.length - 1];
  }

  /**
   * Evaluate the density at the point.
   *
   * @param x the point
   * @return the density
   */
  public double pdf(double x) {
    final double range = KERNEL_RANGE * bandwidth;
    int from = Arrays.binarySearch(data, x - range);
    if (from < 0) {
      from = -from - 1;
    }
    double sum = 0;
    for (int i = from; i < data.length; i++) {
      final double u = (x - data[i]) / bandwidth;
      if (u < -KERNEL_RANGE) {
        break;
      }
      sum += Math.exp(-0.5 * u * u);
    }
    return sum * INV_ROOT_2_PI / (data.length * bandwidth);
  }

  /**
   * Evaluate the density at the points.
   *
   * @param x the points
   * @return the density
   */
  public double[] pdf(double[] x) {
    final double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = pdf(x[i]);
    }
    return y;
  }
}
