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

package uk.ac.sussex.gdsc.trace.autorange;

import java.util.List;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.trace.RangeUtils;
import uk.ac.sussex.gdsc.trace.TimeRange;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.GaussianKernelDensity;
import uk.ac.sussex.gdsc.trace.utils.LocalExtrema;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;
import uk.ac.sussex.gdsc.trace.utils.RollingWindow;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * Separate a trace into signal, background and transition regions using a target analyte.
 *
 * <p>Step 1: Thresholding. A gaussian kernel density estimate of the log of the target values
 * is computed. The lowest minimum in the density separates the background distribution from the
 * signal.
 *
 * <p>Step 2: Transition removal. At each change between background and signal a gaussian is
 * fitted to the peak of the absolute gradient of the target. The region where the gaussian is
 * above a fraction of its peak height is removed from both background and signal.
 *
 * <p>Step 3: Safety pass. Background boundaries that lie within a fraction of the mean transition
 * width of a signal boundary indicate a transition that was not removed. Half a transition width
 * either side of such boundaries is removed.
 *
 * <p>Finally the contiguous signal regions are numbered.
 */
public class Autorange {
  private final AutorangeOptions options;

  /**
   * Create an instance.
   *
   * @param options the options
   */
  public Autorange(AutorangeOptions options) {
    this.options = options.copy();
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public AutorangeOptions getOptions() {
    return options.copy();
  }

  /**
   * Compute the regions of the trace using the working stage. The regions are applied to the
   * trace.
   *
   * @param trace the trace
   * @return the result
   * @throws IllegalArgumentException if the analyte is unknown or the trace is shorter than the
   *         gradient window
   */
  public AutorangeResult run(Trace trace) {
    final String analyte = options.getAnalyte() == null ? trace.getAnalytes().get(0)
        : trace.checkAnalyte(options.getAnalyte());
    final double[] values = trace.getValues(analyte);
    final double[] time = trace.getTime();
    final int n = values.length;

    final Map<String, Object> parameters = options.toParameters();
    parameters.put("analyte", analyte);
    parameters.put("stage", trace.getWorkingStage().getDescription());
    trace.setAutorangeParameters(parameters);

    final double threshold = findThreshold(trace, values);
    if (Double.isNaN(threshold)) {
      trace.setRegions(MaskUtils.finite(n, values), new boolean[n]);
      return new AutorangeResult(trace, analyte, threshold, new LocalList<>(), 0, 0);
    }

    final boolean[] bkg = new boolean[n];
    final boolean[] sig = new boolean[n];
    for (int i = 0; i < n; i++) {
      bkg[i] = values[i] < threshold;
      sig[i] = values[i] >= threshold;
    }

    // Fit each transition
    final double[] gradient = RollingWindow.rollingSlope(values, options.getGradientWindow());
    for (int i = 0; i < n; i++) {
      gradient[i] = Math.abs(gradient[i]);
    }
    final TransitionFitter fitter = new TransitionFitter(time, gradient, options);
    final List<Transition> transitions = new LocalList<>();
    Transition previous = null;
    int failed = 0;
    // Missing values are neither background nor signal; compare with the last valid sample
    int last = -1;
    for (int i = 0; i < n; i++) {
      if (!bkg[i] && !sig[i]) {
        continue;
      }
      final int before = last;
      last = i;
      if (before < 0 || bkg[i] == bkg[before]) {
        continue;
      }
      final double[] bounds = fitter.findBounds(before);
      Transition t = null;
      if (bounds != null) {
        t = fitter.fit(bounds[1], bounds[2], false);
        if (t == null && previous != null) {
          final double half = 0.5 * (previous.getFitUpper() - previous.getFitLower());
          t = fitter.fit(bounds[0] - half, bounds[0] + half, true);
        }
      }
      if (t == null) {
        failed++;
        trace.getDiagnostics().warning(Autorange.class,
            String.format("Failed to fit the transition at time %s; not removed",
                bounds == null ? time[i] : bounds[0]));
      } else {
        transitions.add(t);
        previous = t;
      }
    }

    for (final Transition t : transitions) {
      RangeUtils.exclude(time, bkg, t.getStart(), t.getEnd());
      RangeUtils.exclude(time, sig, t.getStart(), t.getEnd());
    }
    RangeUtils.clearEdges(bkg);
    RangeUtils.clearEdges(sig);

    final int corrections = safetyPass(time, values, bkg, sig, options.getSafetyMargin());
    if (corrections != 0) {
      trace.getDiagnostics().fine(Autorange.class,
          "Removed " + corrections + " unresolved transition boundaries");
    }

    trace.setRegions(bkg, sig);
    trace.getDiagnostics().fine(Autorange.class,
        String.format("%s threshold %s: %d segments, %d transitions, %d failed", analyte,
            threshold, trace.getSegmentCount(), transitions.size(), failed));
    return new AutorangeResult(trace, analyte, threshold, transitions, failed, corrections);
  }

  /**
   * Find the background threshold from the lowest minimum of the density of the log values.
   *
   * @param trace the trace
   * @param values the values
   * @return the threshold (NaN if not found)
   */
  private double findThreshold(Trace trace, double[] values) {
    final double[] logValues = new double[values.length];
    int count = 0;
    for (final double v : values) {
      if (v > 1 && v < Double.POSITIVE_INFINITY) {
        logValues[count++] = Math.log10(v);
      }
    }
    final double[] data = new double[count];
    System.arraycopy(logValues, 0, data, 0, count);
    if (count < 2) {
      trace.getDiagnostics().warning(Autorange.class,
          "Not enough values above 1 to separate background: " + count
              + "; all data is background");
      return Double.NaN;
    }
    final GaussianKernelDensity kde;
    try {
      kde = new GaussianKernelDensity(data);
    } catch (final IllegalArgumentException ex) {
      trace.getDiagnostics().warning(Autorange.class,
          "Cannot estimate the data density: " + ex.getMessage() + "; all data is background");
      return Double.NaN;
    }
    final double[] x = TraceMath.linspace(kde.getMin(), kde.getMax(), options.getBins());
    final double[] mins = LocalExtrema.findMinima(x, kde.pdf(x));
    if (mins.length == 0) {
      trace.getDiagnostics().warning(Autorange.class,
          "Data is a single distribution; all data is background");
      return Double.NaN;
    }
    return options.getBackgroundFactor() * Math.pow(10, mins[0]);
  }

  /**
   * Remove background boundaries close to a signal boundary.
   *
   * @param time the time
   * @param values the values
   * @param bkg the background (modified)
   * @param sig the signal (modified)
   * @param safetyMargin the fraction of the mean transition width
   * @return the number of corrected boundaries
   */
  static int safetyPass(double[] time, double[] values, boolean[] bkg, boolean[] sig,
      double safetyMargin) {
    final boolean[] gaps = MaskUtils.neither(bkg, sig);
    MaskUtils.andInPlace(gaps, MaskUtils.finite(values.length, values));
    final List<TimeRange> transitions = RangeUtils.maskToRanges(time, gaps);
    if (transitions.isEmpty()) {
      return 0;
    }
    double sum = 0;
    for (final TimeRange r : transitions) {
      sum += r.getWidth();
    }
    final double width = sum / transitions.size();
    final double margin = safetyMargin * width;
    final List<TimeRange> bkgRanges = RangeUtils.maskToRanges(time, bkg);
    final List<TimeRange> sigRanges = RangeUtils.maskToRanges(time, sig);
    final List<Double> boundaries = new LocalList<>(2 * bkgRanges.size());
    for (final TimeRange r : bkgRanges) {
      boundaries.add(r.getStart());
      boundaries.add(r.getEnd());
    }
    int corrections = 0;
    for (final double b : boundaries) {
      boolean close = false;
      for (final TimeRange r : sigRanges) {
        if (Math.abs(r.getStart() - b) < margin || Math.abs(r.getEnd() - b) < margin) {
          close = true;
          break;
        }
      }
      if (close) {
        corrections++;
        final double lo = b - width / 2;
        final double hi = b + width / 2;
        for (int i = 0; i < time.length; i++) {
          if (time[i] >= lo && time[i] <= hi) {
            bkg[i] = false;
            sig[i] = false;
          }
        }
      }
    }
    return corrections;
  }
}
