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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.TimeRange;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.FitUtils;
import uk.ac.sussex.gdsc.trace.utils.RollingWindow;

/**
 * Estimate the exponential decay coefficient of the signal washout from the tails of reference
 * standard ablations.
 *
 * <p>Each tail is normalised to [0, 1] and the plateau before the decay is trimmed. The pooled
 * samples of all tails are binned by time and the minimum of each bin forms a lower envelope.
 * {@code exp(k t)} is fitted to the envelope.
 */
public class DecayCoefficientEstimator {
  private static final Logger logger = Logger.getLogger(DecayCoefficientEstimator.class.getName());

  /** The default number of standard errors subtracted from the coefficient. */
  public static final double DEFAULT_N_SIGMA = 12;

  /** The tails: {values, timeStep}. */
  private final List<Pair<double[], Double>> tails = new ArrayList<>();

  private double nSigma = DEFAULT_N_SIGMA;
  private double trimLimit = Double.NaN;

  /**
   * Gets the number of standard errors subtracted from the coefficient.
   *
   * @return the n sigma
   */
  public double getNSigma() {
    return nSigma;
  }

  /**
   * Sets the number of standard errors subtracted from the coefficient.
   *
   * @param nSigma the new n sigma
   * @return this
   */
  public DecayCoefficientEstimator setNSigma(double nSigma) {
    ValidationUtils.checkArgument(nSigma >= 0, "Sigma must not be negative: %s", nSigma);
    this.nSigma = nSigma;
    return this;
  }

  /**
   * Gets the trim limit. The decay starts where the drop between successive smoothed samples falls
   * below the limit.
   *
   * @return the trim limit (NaN for half the largest drop)
   */
  public double getTrimLimit() {
    return trimLimit;
  }

  /**
   * Sets the trim limit.
   *
   * @param trimLimit the new trim limit (NaN for half the largest drop)
   * @return this
   */
  public DecayCoefficientEstimator setTrimLimit(double trimLimit) {
    this.trimLimit = trimLimit;
    return this;
  }

  /**
   * Add a washout tail.
   *
   * @param values the values
   * @param timeStep the time step between samples
   * @return this
   */
  public DecayCoefficientEstimator addTail(double[] values, double timeStep) {
    ValidationUtils.checkArgument(timeStep > 0, "Time step must be positive: %s", timeStep);
    tails.add(new Pair<>(values.clone(), timeStep));
    return this;
  }

  /**
   * Add the trailing transitions of each signal segment of the trace. These are the second and
   * every alternate transition range. The values are taken from the working stage.
   *
   * @param trace the trace
   * @param analyte the analyte
   * @return this
   */
  public DecayCoefficientEstimator addTrailingTransitions(Trace trace, String analyte) {
    final double[] time = trace.getTime();
    final double[] values = trace.getValues(analyte);
    final List<TimeRange> ranges = trace.getTransitionRanges();
    for (int i = 1; i < ranges.size(); i += 2) {
      final TimeRange range = ranges.get(i);
      final double[] tail = new double[values.length];
      int count = 0;
      for (int j = 0; j < time.length; j++) {
        if (range.contains(time[j])) {
          tail[count++] = values[j];
        }
      }
      final double[] data = new double[count];
      System.arraycopy(tail, 0, data, 0, count);
      addTail(data, trace.getTimeStep());
    }
    return this;
  }

  /**
   * Gets the number of tails.
   *
   * @return the number of tails
   */
  public int getTailCount() {
    return tails.size();
  }

  /**
   * Estimate the decay coefficient.
   *
   * @return the coefficient
   * @throws DecayFitException if there is not enough data or the fit fails
   */
  public DecayCoefficient estimate() throws DecayFitException {
    final List<double[]> times = new LocalList<>();
    final List<double[]> trans = new LocalList<>();
    for (final Pair<double[], Double> tail : tails) {
      final double[] decay = trim(tail.getFirst());
      if (decay.length < 2) {
        logger.fine(() -> "Ignoring washout tail of length " + tail.getFirst().length);
        continue;
      }
      final double[] t = new double[decay.length];
      for (int i = 0; i < t.length; i++) {
        t[i] = i * tail.getSecond();
      }
      times.add(t);
      trans.add(decay);
    }

    // Lower envelope: the minimum at each unique time
    final TreeMap<Double, Double> envelope = new TreeMap<>();
    int size = 0;
    for (int i = 0; i < times.size(); i++) {
      final double[] t = times.get(i);
      final double[] v = trans.get(i);
      for (int j = 0; j < t.length; j++) {
        if (Double.isFinite(v[j])) {
          envelope.merge(t[j], v[j], Math::min);
          size++;
        }
      }
    }
    if (envelope.size() < 2) {
      throw new DecayFitException(
          "Not enough washout data to fit the decay: " + envelope.size() + " time points");
    }

    final double[] x = new double[envelope.size()];
    final double[] y = new double[x.length];
    int count = 0;
    for (final Map.Entry<Double, Double> e : envelope.entrySet()) {
      x[count] = e.getKey();
      y[count++] = e.getValue();
    }

    final LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer();
    final LeastSquaresProblem problem =
        FitUtils.createProblem(new ExponentialFunction(x), y, new double[] {-1}, null);
    final double k;
    final double se;
    try {
      final Optimum optimum = optimizer.optimize(problem);
      k = optimum.getPoint().getEntry(0);
      // Scale the covariance by the residual variance
      final double cost = optimum.getCost();
      final double variance = x.length > 1 ? cost * cost / (x.length - 1) : Double.NaN;
      se = Math.sqrt(optimum.getCovariances(1e-14).getEntry(0, 0) * variance);
    } catch (TooManyIterationsException | ConvergenceException ex) {
      throw new DecayFitException("Failed to fit the decay: " + ex.getMessage(), ex);
    } catch (MathIllegalArgumentException | MathIllegalStateException ex) {
      throw new DecayFitException("Invalid decay fit: " + ex.getMessage(), ex);
    }
    if (!Double.isFinite(k)) {
      throw new DecayFitException("Decay fit is not finite: " + k);
    }

    // R^2 against all pooled samples
    double sum = 0;
    for (final double[] v : trans) {
      for (final double d : v) {
        if (Double.isFinite(d)) {
          sum += d;
        }
      }
    }
    final double mean = sum / size;
    double ssTot = 0;
    double ssFit = 0;
    for (int i = 0; i < times.size(); i++) {
      final double[] t = times.get(i);
      final double[] v = trans.get(i);
      for (int j = 0; j < t.length; j++) {
        if (Double.isFinite(v[j])) {
          final double d = v[j] - mean;
          final double r = v[j] - Math.exp(k * t[j]);
          ssTot += d * d;
          ssFit += r * r;
        }
      }
    }
    final DecayCoefficient result =
        new DecayCoefficient(k, se, 1 - ssFit / ssTot, nSigma, size);
    logger.fine(result::toString);
    return result;
  }

  /**
   * Normalise the tail, trim the plateau before the decay and normalise again.
   *
   * @param values the values
   * @return the decay
   */
  private double[] trim(double[] values) {
    if (values.length < 3) {
      return new double[0];
    }
    final double[] tr = normalise(values);
    final double[] sm = RollingWindow.rollingMean(tr, 3, 0);
    sm[0] = sm[1];
    final int n = sm.length;
    final double[] drop = new double[n];
    double maxDrop = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      drop[i] = sm[i] - (i + 1 < n ? sm[i + 1] : 0);
      if (drop[i] > maxDrop) {
        maxDrop = drop[i];
      }
    }
    final double limit = Double.isNaN(trimLimit) ? 0.5 * maxDrop : trimLimit;
    // First position where the drop indicator changes state
    int trim = 0;
    for (int i = 0; i < n; i++) {
      if ((drop[i] >= limit) != (drop[(i + 1) % n] >= limit)) {
        trim = i;
        break;
      }
    }
    trim += 2;
    if (trim >= n) {
      return new double[0];
    }
    final double[] decay = new double[n - trim];
    System.arraycopy(tr, trim, decay, 0, decay.length);
    return normalise(decay);
  }

  private static double[] normalise(double[] values) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (final double v : values) {
      if (Double.isFinite(v)) {
        min = Math.min(min, v);
        max = Math.max(max, v);
      }
    }
    final double range = max - min;
    final double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = (values[i] - min) / range;
    }
    return result;
  }

  /**
   * Exponential decay function {@code f(t) = exp(k * t)}.
   */
  static final class ExponentialFunction implements MultivariateJacobianFunction {
    private final double[] time;

    /**
     * @param time the time
     */
    ExponentialFunction(double[] time) {
      this.time = time;
    }

    /**
     * {@inheritDoc}
     *
     * @param point {k}
     */
    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      final double k = point.getEntry(0);
      final double[] value = new double[time.length];
      final double[][] jacobian = new double[time.length][1];
      // f(t) = exp(k t)
      // df_dk = t exp(k t)
      for (int i = 0; i < time.length; i++) {
        final double e = Math.exp(k * time[i]);
        value[i] = e;
        jacobian[i][0] = time[i] * e;
      }
      return new Pair<>(new ArrayRealVector(value, false),
          new Array2DRowRealMatrix(jacobian, false));
    }
  }
}
