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

import java.util.Collections;
import java.util.List;

/**
 * The result of the {@link SignalOptimiser}.
 *
 * <p>The statistic surfaces are indexed by {@code [width - minPoints][centre]} in the space of
 * the considered samples.
 */
public final class OptimiserResult {
  private final List<String> analytes;
  private final boolean[] mask;
  private final double meanThreshold;
  private final double stdThreshold;
  private final double[][] means;
  private final double[][] stds;
  private final int[] limits;
  private final int centre;
  private final int width;
  private final int minPoints;

  /**
   * Create an instance.
   *
   * @param analytes the analytes
   * @param mask the selected samples
   * @param meanThreshold the mean threshold
   * @param stdThreshold the std threshold
   * @param means the scaled mean surface
   * @param stds the scaled std surface
   * @param limits the trace index limits {start, end} (end exclusive); null if empty
   * @param centre the centre of the selected window in the considered samples (-1 if empty)
   * @param width the width of the selected window (0 if empty)
   * @param minPoints the min points
   */
  OptimiserResult(List<String> analytes, boolean[] mask, double meanThreshold,
      double stdThreshold, double[][] means, double[][] stds, int[] limits, int centre,
      int width, int minPoints) {
    this.analytes = Collections.unmodifiableList(analytes);
    this.mask = mask;
    this.meanThreshold = meanThreshold;
    this.stdThreshold = stdThreshold;
    this.means = means;
    this.stds = stds;
    this.limits = limits;
    this.centre = centre;
    this.width = width;
    this.minPoints = minPoints;
  }

  /**
   * Create an empty result.
   *
   * @param analytes the analytes
   * @param size the trace size
   * @param minPoints the min points
   * @return the result
   */
  static OptimiserResult empty(List<String> analytes, int size, int minPoints) {
    return new OptimiserResult(analytes, new boolean[size], Double.NaN, Double.NaN,
        new double[0][0], new double[0][0], null, -1, 0, minPoints);
  }

  /**
   * Checks if no window was selected.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return width == 0;
  }

  /**
   * Gets the analytes.
   *
   * @return the analytes
   */
  public List<String> getAnalytes() {
    return analytes;
  }

  /**
   * Gets a copy of the mask of the selected samples.
   *
   * @return the mask
   */
  public boolean[] getMask() {
    return mask.clone();
  }

  /**
   * Gets the threshold for the scaled mean.
   *
   * @return the mean threshold
   */
  public double getMeanThreshold() {
    return meanThreshold;
  }

  /**
   * Gets the threshold for the scaled standard deviation.
   *
   * @return the std threshold
   */
  public double getStdThreshold() {
    return stdThreshold;
  }

  /**
   * Gets the scaled mean surface averaged over the analytes.
   *
   * @return the means
   */
  public double[][] getMeans() {
    return copy(means);
  }

  /**
   * Gets the scaled std surface averaged over the analytes.
   *
   * @return the stds
   */
  public double[][] getStds() {
    return copy(stds);
  }

  /**
   * Gets the trace index limits of the selection {start, end}. The end is exclusive.
   *
   * @return the limits (null if empty)
   */
  public int[] getLimits() {
    return limits == null ? null : limits.clone();
  }

  /**
   * Gets the centre of the selected window in the considered samples.
   *
   * @return the centre (-1 if empty)
   */
  public int getCentre() {
    return centre;
  }

  /**
   * Gets the width of the selected window.
   *
   * @return the width (0 if empty)
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the minimum number of points in a window.
   *
   * @return the min points
   */
  public int getMinPoints() {
    return minPoints;
  }

  private static double[][] copy(double[][] data) {
    final double[][] result = new double[data.length][];
    for (int i = 0; i < data.length; i++) {
      result[i] = data[i].clone();
    }
    return result;
  }
}
