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

package uk.ac.sussex.gdsc.trace.optimiser;

import java.util.stream.Stream;
import org.apache.commons.lang3.ArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.utils.GaussianKernelDensity;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * The method used to derive a threshold from the values of a statistic surface.
 */
public enum ThresholdMode {
  /** The mean. */
  MEAN("Mean") {
    @Override
    public double threshold(double[] values) {
      return TraceMath.nanMean(values);
    }
  },
  /** The median. */
  MEDIAN("Median") {
    @Override
    public double threshold(double[] values) {
      return TraceMath.nanMedian(values);
    }
  },
  /** The global maximum of a kernel density estimate. */
  KDE_MAX("KDE max") {
    @Override
    public double threshold(double[] values) {
      final double[][] density = density(values);
      if (density == null) {
        return Double.NaN;
      }
      final double[] x = density[0];
      return x[TraceMath.argMax(density[1], 0, x.length)];
    }
  },
  /**
   * The first local maximum of a kernel density estimate above 25% of the global maximum. Uses
   * the global maximum if there is no local maximum. This targets the first dominant mode of the
   * values rather than the largest.
   */
  KDE_FIRST_MAX("KDE first max") {
    @Override
    public double threshold(double[] values) {
      final double[][] density = density(values);
      if (density == null) {
        return Double.NaN;
      }
      final double[] x = density[0];
      final double[] y = density[1];
      final int max = TraceMath.argMax(y, 0, y.length);
      final double limit = 0.25 * y[max];
      for (int i = 1; i < y.length - 1; i++) {
        if (y[i] > y[i - 1] && y[i] > y[i + 1] && y[i] > limit) {
          return x[i];
        }
      }
      return x[max];
    }
  },
  /** The Bayesian posterior mean of the mean. */
  BAYES_MVS("Bayes MVS") {
    @Override
    public double threshold(double[] values) {
      return ScaleMethod.BAYESIAN.estimate(values)[0];
    }
  };

  /** The number of points for the kernel density estimate. */
  private static final int DENSITY_POINTS = 100;

  /** The message when the default value for an enum is null. */
  private static final String MSG_DEFAULT_IS_NULL = "Default value is null";

  /** The Constant values. */
  private static final ThresholdMode[] values = values();

  /** The description. */
  private final String description;

  ThresholdMode(String description) {
    this.description = description;
  }

  /**
   * Compute the threshold from the finite values.
   *
   * @param values the values
   * @return the threshold (NaN if it cannot be computed)
   */
  public abstract double threshold(double[] values);

  /**
   * Compute the kernel density estimate over the range of the 1st to the 99th percentile.
   *
   * @param values the values
   * @return {x, density} (or null if the density cannot be estimated)
   */
  static double[][] density(double[] values) {
    final double[] data = TraceMath.finite(values);
    if (data.length < 2) {
      return null;
    }
    final GaussianKernelDensity kde;
    try {
      kde = new GaussianKernelDensity(data);
    } catch (final IllegalArgumentException ex) {
      // Constant values
      return null;
    }
    final double[] x = TraceMath.linspace(TraceMath.percentile(data, 1),
        TraceMath.percentile(data, 99), DENSITY_POINTS);
    return new double[][] {x, kde.pdf(x)};
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Gets the descriptions for all of the values.
   *
   * @return the descriptions
   */
  public static String[] getDescriptions() {
    return Stream.of(values).map(ThresholdMode::getDescription).toArray(String[]::new);
  }

  /**
   * Get the enum value for the description.
   *
   * @param description the description
   * @return the value (or null)
   */
  public static ThresholdMode fromDescription(String description) {
    for (final ThresholdMode value : values) {
      if (value.description.equals(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Get the enum value for the ordinal. If the ordinal is invalid then return the default value.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value
   * @return the value
   * @throws NullPointerException if the default value is null
   */
  public static ThresholdMode fromOrdinal(int ordinal, ThresholdMode defaultValue) {
    return ArrayUtils.get(values, ordinal,
        ValidationUtils.checkNotNull(defaultValue, MSG_DEFAULT_IS_NULL));
  }
}
