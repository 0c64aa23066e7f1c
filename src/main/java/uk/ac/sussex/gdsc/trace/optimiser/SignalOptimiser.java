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

import java.util.ArrayList;
import java.util.List;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;
import uk.ac.sussex.gdsc.trace.utils.RollingWindow;

/**
 * Find the longest contiguous window of the signal where the mean and standard deviation of the
 * analytes are both low.
 *
 * <p>For each window width from the minimum points to the number of samples, and each window
 * centre, the mean and standard deviation are computed for each analyte. The surfaces of each
 * statistic are scaled to a common location and scale, weighted and averaged over the analytes.
 * Thresholds are derived from the averaged surfaces. The widest window under both thresholds is
 * selected; ties are resolved to the earliest window.
 */
public class SignalOptimiser {
  /** The margin below the thresholds for a window to qualify. */
  private static final double THRESHOLD_MARGIN = 0.01;

  private final OptimiserOptions options;

  /**
   * Create an instance.
   *
   * @param options the options
   */
  public SignalOptimiser(OptimiserOptions options) {
    this.options = options.copy();
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public OptimiserOptions getOptions() {
    return options.copy();
  }

  /**
   * Optimise the signal region of the working stage of the trace.
   *
   * @param trace the trace
   * @return the result
   */
  public OptimiserResult optimise(Trace trace) {
    return optimise(trace, trace.getSignal());
  }

  /**
   * Optimise the considered samples of the working stage of the trace. Samples that are not
   * finite in all the analytes are ignored.
   *
   * @param trace the trace
   * @param considered the samples to consider
   * @return the result
   * @throws IllegalArgumentException if the mask has the wrong length, an analyte is unknown or
   *         the weights do not match the analytes
   */
  public OptimiserResult optimise(Trace trace, boolean[] considered) {
    ValidationUtils.checkArgument(considered.length == trace.size(),
        "Mask length %d != trace length %d", considered.length, trace.size());
    final List<String> analytes =
        options.getAnalytes().isEmpty() ? trace.getAnalytes() : options.getAnalytes();
    final double[] weights = options.getWeights();
    ValidationUtils.checkArgument(weights == null || weights.length == analytes.size(),
        "Weights length %d != number of analytes %d", weights == null ? 0 : weights.length,
        analytes.size());

    final double[][] values = new double[analytes.size()][];
    for (int i = 0; i < values.length; i++) {
      values[i] = trace.getValues(analytes.get(i));
    }
    final boolean[] use = MaskUtils.finite(trace.size(), values);
    MaskUtils.andInPlace(use, considered);
    final int[] indices = MaskUtils.indices(use);
    final int n = indices.length;
    final int minPoints = options.getMinPoints();
    if (n < minPoints + 1) {
      trace.getDiagnostics().warning(SignalOptimiser.class, String.format(
          "Not enough samples to optimise: %d < %d", n, minPoints + 1));
      return OptimiserResult.empty(new ArrayList<>(analytes), trace.size(), minPoints);
    }

    // Statistic surfaces averaged over the analytes
    final int rows = n - minPoints;
    final double[][] means = new double[rows][n];
    final double[][] stds = new double[rows][n];
    for (int a = 0; a < values.length; a++) {
      final double[] data = new double[n];
      for (int i = 0; i < n; i++) {
        data[i] = values[a][indices[i]];
      }
      final double[][] m = new double[rows][];
      final double[][] s = new double[rows][];
      for (int r = 0; r < rows; r++) {
        final double[][] ms = RollingWindow.windowMeanStd(data, r + minPoints);
        m[r] = ms[0];
        s[r] = ms[1];
      }
      final double w = weights == null ? 1 : weights[a];
      accumulate(means, scale(m), w / values.length);
      accumulate(stds, scale(s), w / values.length);
    }

    final double meanThreshold;
    final double stdThreshold;
    if (options.hasThresholds()) {
      meanThreshold = options.getMeanThreshold();
      stdThreshold = options.getStdThreshold();
    } else {
      meanThreshold = options.getThresholdMode().threshold(flatten(means));
      stdThreshold = options.getThresholdMode().threshold(flatten(stds));
    }

    // Widest qualifying window
    final double mt = meanThreshold - THRESHOLD_MARGIN;
    final double st = stdThreshold - THRESHOLD_MARGIN;
    int best = -1;
    for (int r = rows - 1; r >= 0 && best < 0; r--) {
      for (int c = 0; c < n; c++) {
        if (means[r][c] < mt && stds[r][c] < st) {
          best = r;
          break;
        }
      }
    }
    if (best < 0) {
      trace.getDiagnostics().warning(SignalOptimiser.class, String.format(
          "No window below the thresholds: mean %s, std %s", meanThreshold, stdThreshold));
      return new OptimiserResult(new ArrayList<>(analytes), new boolean[trace.size()],
          meanThreshold, stdThreshold, means, stds, null, -1, 0, minPoints);
    }

    // Earliest centre within one width of the best; prefer the larger width
    int centre = n;
    int row = best;
    for (int r = Math.max(0, best - 1); r <= best; r++) {
      for (int c = 0; c < n; c++) {
        if (means[r][c] < mt && stds[r][c] < st && c <= centre) {
          if (c < centre || r > row) {
            centre = c;
            row = r;
          }
          break;
        }
      }
    }
    final int width = row + minPoints;
    final int start = centre - width / 2;
    final boolean[] mask = new boolean[trace.size()];
    for (int i = start; i < start + width; i++) {
      mask[indices[i]] = true;
    }
    final int[] limits = {indices[start], indices[start + width - 1] + 1};
    trace.getDiagnostics().fine(SignalOptimiser.class,
        String.format("Optimised window [%d, %d): %d points", limits[0], limits[1], width));
    return new OptimiserResult(new ArrayList<>(analytes), mask, meanThreshold, stdThreshold,
        means, stds, limits, centre, width, minPoints);
  }

  /**
   * Scale the surface to zero location and unit scale.
   *
   * @param surface the surface (modified)
   * @return the surface
   */
  private double[][] scale(double[][] surface) {
    final double[] estimate = options.getScaleMethod().estimate(flatten(surface));
    for (final double[] row : surface) {
      for (int i = 0; i < row.length; i++) {
        row[i] = (row[i] - estimate[0]) / estimate[1];
      }
    }
    return surface;
  }

  private static void accumulate(double[][] total, double[][] surface, double weight) {
    for (int r = 0; r < total.length; r++) {
      for (int c = 0; c < total[r].length; c++) {
        total[r][c] += weight * surface[r][c];
      }
    }
  }

  private static double[] flatten(double[][] surface) {
    int size = 0;
    for (final double[] row : surface) {
      size += row.length;
    }
    final double[] data = new double[size];
    int i = 0;
    for (final double[] row : surface) {
      System.arraycopy(row, 0, data, i, row.length);
      i += row.length;
    }
    return data;
  }
}
