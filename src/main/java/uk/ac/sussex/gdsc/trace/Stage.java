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

package uk.ac.sussex.gdsc.trace;

/**
 * The processing stages of a trace. Each stage holds a complete set of analyte values.
 */
public enum Stage {
  /** The measured data. */
  RAW("rawdata"),
  /** The data after spike and decay filtering. */
  DESPIKED("despiked"),
  /** The signal regions of the data; all other samples are NaN. */
  SIGNAL("signal"),
  /** The background regions of the data; all other samples are NaN. */
  BACKGROUND("background"),
  /** The signal with the mean background subtracted. */
  BACKGROUND_SUBTRACTED("bkgsub"),
  /** The background subtracted signal divided by a denominator analyte. */
  RATIOS("ratios");

  /** The Constant values. */
  private static final Stage[] values = values();

  /** The description. */
  private final String description;

  Stage(String description) {
    this.description = description;
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
   * Create from the description.
   *
   * @param description the description
   * @return the stage (or null)
   */
  public static Stage fromDescription(String description) {
    for (final Stage value : values) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }
}
