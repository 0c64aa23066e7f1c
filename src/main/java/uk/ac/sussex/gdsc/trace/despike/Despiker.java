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

package uk.ac.sussex.gdsc.trace.despike;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Stage;
import uk.ac.sussex.gdsc.trace.StageData;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;
import uk.ac.sussex.gdsc.trace.utils.RollingWindow;

/**
 * Remove instrumental spikes and implausibly fast decays from a trace.
 *
 * <p>The spike filter flags values far above a rolling mean assuming counting statistics. The
 * exponential decay filter flags a value when the following value falls faster than the signal
 * can wash out. Flagged values are replaced by the mean of their neighbours.
 *
 * <p>Analytes with "time" in the name are not filtered.
 */
public class Despiker {
  private static final Logger logger = Logger.getLogger(Despiker.class.getName());

  private final DespikeOptions options;

  /**
   * Create an instance.
   *
   * @param options the options
   */
  public Despiker(DespikeOptions options) {
    this.options = options.copy();
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public DespikeOptions getOptions() {
    return options.copy();
  }

  /**
   * Despike the working stage of the trace. The result is stored in {@link Stage#DESPIKED}.
   *
   * @param trace the trace
   */
  public void despike(Trace trace) {
    despike(trace, trace.getWorkingStage());
  }

  /**
   * Despike the source stage of the trace. The result is stored in {@link Stage#DESPIKED}.
   *
   * @param trace the trace
   * @param source the source stage
   */
  public void despike(Trace trace, Stage source) {
    final StageData data = trace.getStageData(source);
    final StageData result = new StageData(trace.size());
    final boolean decay = options.isDecayFilter() && !Double.isNaN(options.getExponent());
    if (options.isDecayFilter() && !decay) {
      trace.getDiagnostics().warning(Despiker.class,
          "No exponential decay coefficient; decay filter not applied");
    }
    final double timeStep =
        Double.isNaN(options.getTimeStep()) ? trace.getTimeStep() : options.getTimeStep();
    for (final String analyte : data.getAnalytes()) {
      final double[] values = data.get(analyte);
      if (!isFiltered(analyte)) {
        result.put(analyte, values);
        continue;
      }
      if (options.isSpikeFilter() && values.length >= options.getWindow()) {
        final int count =
            MaskUtils.count(spikeFilter(values, options.getWindow(), options.getNSigma()));
        trace.getDiagnostics().fine(Despiker.class, analyte + " spikes: " + count);
      }
      if (decay && values.length > 1) {
        final int count =
            MaskUtils.count(expDecayFilter(values, options.getExponent(), timeStep));
        trace.getDiagnostics().fine(Despiker.class, analyte + " decay outliers: " + count);
      }
      result.put(analyte, values);
    }
    trace.setStageData(Stage.DESPIKED, result);
    final Map<String, Object> parameters = options.toParameters();
    parameters.put("stage", source.getDescription());
    trace.setDespikeParameters(parameters);
  }

  /**
   * Despike all the traces. If the decay filter is enabled without a known coefficient it is
   * estimated from the trailing transitions of the standards (which must have been
   * autoranged). If the estimate fails a warning is recorded on each trace and the decay filter is
   * not applied.
   *
   * @param traces the traces
   * @param standards the reference standards
   * @param analyte the analyte used to estimate the decay coefficient
   * @return the decay coefficient used (NaN if none)
   */
  public double despike(List<Trace> traces, List<Trace> standards, String analyte) {
    final DespikeOptions opt = options.copy();
    if (opt.isDecayFilter() && Double.isNaN(opt.getExponent())) {
      final DecayCoefficientEstimator estimator = new DecayCoefficientEstimator();
      for (final Trace standard : standards) {
        estimator.addTrailingTransitions(standard, analyte);
      }
      try {
        final DecayCoefficient coefficient = estimator.estimate();
        logger.info(() -> "Exponential decay coefficient: " + coefficient);
        opt.setExponent(coefficient.getWorkingCoefficient());
      } catch (final DecayFitException ex) {
        opt.setDecayFilter(false);
        for (final Trace trace : traces) {
          trace.getDiagnostics().warning(Despiker.class,
              "Decay filter not applied: " + ex.getMessage());
        }
      }
    }
    final Despiker despiker = new Despiker(opt);
    for (final Trace trace : traces) {
      despiker.despike(trace);
    }
    return opt.isDecayFilter() ? opt.getExponent() : Double.NaN;
  }

  /**
   * Check if the analyte is filtered. Analytes containing "time" (case insensitive) are not.
   *
   * @param analyte the analyte
   * @return true if filtered
   */
  public static boolean isFiltered(String analyte) {
    return !analyte.toLowerCase(Locale.ROOT).contains("time");
  }

  /**
   * Flag values above the rolling mean {@code m} (NaN padded) by more than {@code nSigma *
   * sqrt(m)} and replace them with the mean of their neighbours. The values are modified in place.
   *
   * @param values the values
   * @param window the rolling window
   * @param nSigma the number of standard deviations
   * @return the flagged samples
   */
  public static boolean[] spikeFilter(double[] values, int window, double nSigma) {
    ValidationUtils.checkNotNull(values, "values");
    final double[] mean = RollingWindow.rollingMean(values, window, Double.NaN);
    final boolean[] over = new boolean[values.length];
    for (int i = 0; i < values.length; i++) {
      over[i] = values[i] > mean[i] + nSigma * Math.sqrt(mean[i]);
    }
    replaceWithNeighbourMean(values, over);
    return over;
  }

  /**
   * Flag values that the following value falls below by more than exponential decay allows, i.e.
   * {@code v[i+1] < v[i] * exp(exponent * timeStep)}, and replace them with the mean of their
   * neighbours. The values are modified in place.
   *
   * @param values the values
   * @param exponent the decay exponent (negative)
   * @param timeStep the time step
   * @return the flagged samples
   */
  public static boolean[] expDecayFilter(double[] values, double exponent, double timeStep) {
    ValidationUtils.checkArgument(exponent < 0, "Exponent must be negative: %s", exponent);
    final double factor = Math.exp(exponent * timeStep);
    final boolean[] over = new boolean[values.length];
    for (int i = 0; i < values.length - 1; i++) {
      over[i] = values[i + 1] < values[i] * factor;
    }
    replaceWithNeighbourMean(values, over);
    return over;
  }

  /**
   * Replace flagged values with the mean of the finite values of their immediate neighbours taken
   * before any replacement. A value without a finite neighbour is unchanged.
   *
   * @param values the values (modified)
   * @param flags the flags
   */
  static void replaceWithNeighbourMean(double[] values, boolean[] flags) {
    final double[] original = values.clone();
    for (int i = 0; i < values.length; i++) {
      if (flags[i]) {
        double sum = 0;
        int count = 0;
        if (i > 0 && Double.isFinite(original[i - 1])) {
          sum += original[i - 1];
          count++;
        }
        if (i + 1 < values.length && Double.isFinite(original[i + 1])) {
          sum += original[i + 1];
          count++;
        }
        if (count != 0) {
          values[i] = sum / count;
        }
      }
    }
  }
}
