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

import org.apache.commons.lang3.ArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The rule used to choose the bandwidth of a gaussian kernel density estimate. The bandwidth is
 * the sample standard deviation multiplied by a factor dependent on the number of samples.
 */
public enum BandwidthMethod {
  /** Scott's rule: {@code n^(-1/5)}. */
  SCOTT("Scott") {
    @Override
    public double getFactor(int n) {
      return Math.pow(n, -0.2);
    }
  },
  /** Silverman's rule: {@code (n * 3 / 4)^(-1/5)}. */
  SILVERMAN("Silverman") {
    @Override
    public double getFactor(int n) {
      return Math.pow(n * 0.75, -0.2);
    }
  };

  /** The message when the default value for an enum is null. */
  private static final String MSG_DEFAULT_IS_NULL = "Default value is null";

  /** The Constant values. */
  private static final BandwidthMethod[] values;

  /** The Constant descriptions. */
  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  /** The description. */
  private final String description;

  BandwidthMethod(String description) {
    this.description = description;
  }

  /**
   * Gets the factor applied to the standard deviation for the given number of samples.
   *
   * @param n the number of samples
   * @return the factor
   */
  public abstract double getFactor(int n);

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
    return descriptions.clone();
  }

  /**
   * Create from the description.
   *
   * @param description the description
   * @return the bandwidth method (or null)
   */
  public static BandwidthMethod fromDescription(String description) {
    for (final BandwidthMethod value : values) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @return the bandwidth method
   * @throws IndexOutOfBoundsException if the index is invalid
   */
  public static BandwidthMethod fromOrdinal(int ordinal) {
    return values[ValidationUtils.checkIndex(ordinal, values)];
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value (must not be null)
   * @return the bandwidth method
   * @throws NullPointerException if the default value is null
   */
  public static BandwidthMethod fromOrdinal(int ordinal, BandwidthMethod defaultValue) {
    return ArrayUtils.get(values, ordinal,
        ValidationUtils.checkNotNull(defaultValue, MSG_DEFAULT_IS_NULL));
  }
}
