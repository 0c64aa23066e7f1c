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

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.special.Gamma;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * The method used to estimate the location and scale of a statistic surface.
 */
public enum ScaleMethod {
  /** The mean and the population standard deviation of the values. */
  STANDARD("Standard") {
    @Override
    public double[] estimate(double[] values) {
      return new double[] {TraceMath.nanMean(values), TraceMath.nanStd(values)};
    }
  },
  /**
   * The posterior means of the mean and the standard deviation of the values using the Jeffreys
   * prior.
   */
  BAYESIAN("Bayesian") {
    @Override
    public double[] estimate(double[] values) {
      final double[] data = TraceMath.finite(values);
      final int n = data.length;
      if (n < 3) {
        return new double[] {Double.NaN, Double.NaN};
      }
      final double mean = TraceMath.nanMean(data);
      final double sd = TraceMath.nanStd(data);
      // E[sigma] = sqrt(n C / 2) Gamma((n - 2) / 2) / Gamma((n - 1) / 2), C the sample variance
      final double s = Math.sqrt(n * sd * sd / 2)
          * Math.exp(Gamma.logGamma((n - 2) / 2.0) - Gamma.logGamma((n - 1) / 2.0));
      return new double[] {mean, s};
    }
  };

  /** The message when the default value for an enum is null. */
  private static final String MSG_DEFAULT_IS_NULL = "Default value is null";

  /** The Constant values. */
  private static final ScaleMethod[] values = values();

  /** The description. */
  private final String description;

  ScaleMethod(String description) {
    this.description = description;
  }

  /**
   * Estimate the location and scale of the finite values.
   *
   * @param values the values
   * @return {location, scale} (NaN if there are not enough values)
   */
  public abstract double[] estimate(double[] values);

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
   * Get the enum value for the ordinal.
   *
   * @param ordinal the ordinal
   * @return the value
   * @throws IndexOutOfBoundsException if the ordinal is invalid
   */
  public static ScaleMethod fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Get the enum value for the ordinal. If the ordinal is invalid then return the default value.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value
   * @return the value
   * @throws NullPointerException if the default value is null
   */
  public static ScaleMethod fromOrdinal(int ordinal, ScaleMethod defaultValue) {
    return ArrayUtils.get(values, ordinal,
        ValidationUtils.checkNotNull(defaultValue, MSG_DEFAULT_IS_NULL));
  }
}
