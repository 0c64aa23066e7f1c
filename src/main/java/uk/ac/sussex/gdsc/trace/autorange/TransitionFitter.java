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

import java.util.Arrays;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import uk.ac.sussex.gdsc.trace.utils.FitUtils;
import uk.ac.sussex.gdsc.trace.utils.RollingWindow;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * Fit a gaussian to the peak of the absolute gradient at a transition.
 */
class TransitionFitter {
  private static final Logger logger = Logger.getLogger(TransitionFitter.class.getName());

  private final double[] time;
  private final double[] gradient;
  private final AutorangeOptions options;
  private final double halfWidthFactor;

  /**
   * Create an instance.
   *
   * @param time the time
   * @param gradient the absolute gradient of the target analyte
   * @param options the options
   */
  TransitionFitter(double[] time, double[] gradient, AutorangeOptions options) {
    this.time = time;
    this.gradient = gradient;
    this.options = options;
    // Half width of a gaussian at the given fraction of the peak height, in units of sigma
    halfWidthFactor = Math.sqrt(2) * Math.sqrt(Math.log(1 / options.getConfidence()));
  }

  /**
   * Locate the gradient peak of the transition near the index and the limits of the data to fit.
   *
   * <p>The centre is the time of the maximum gradient within the window {@code [z - win, z +
   * win)}. The limits are found from the inflection points of the peak either side of the centre
   * using the gradient of the gradient. The limits are twice the distance from the centre to each
   * inflection. If no inflection is found the window edge is used.
   *
   * @param z the index before the background changes state
   * @return {centre, lower, upper} (or null)
   */
  double[] findBounds(int z) {
    final int from = Math.max(0, z - options.getWindow());
    final int to = Math.min(time.length, z + options.getWindow());
    final int ci = TraceMath.argMax(gradient, from, to);
    if (ci < 0) {
      return null;
    }
    final double c = time[ci];
    double lower = time[from];
    double upper = time[to - 1];
    final int length = to - from;
    if (length >= 3) {
      final int w = RollingWindow.oddWidth(Math.min(options.getSmoothWindow(), length), length);
      final double[] yd =
          RollingWindow.rollingSlope(Arrays.copyOfRange(gradient, from, to), w);
      final int half = w / 2;
      // Search only where the gradient is not padded
      final int min = half + 1;
      final int max = length - half - 2;
      final int local = ci - from;
      for (int j = Math.min(local - 1, max); j >= min; j--) {
        if (yd[j - 1] < yd[j] && yd[j] > yd[j + 1]) {
          lower = c - 2 * (c - time[from + j]);
          break;
        }
      }
      for (int j = Math.max(local + 1, min); j <= max; j++) {
        if (yd[j - 1] > yd[j] && yd[j] < yd[j + 1]) {
          upper = c + 2 * (time[from + j] - c);
          break;
        }
      }
    }
    return new double[] {c, lower, upper};
  }

  /**
   * Fit a gaussian to the gradient within the limits (inclusive).
   *
   * @param lower the lower limit
   * @param upper the upper limit
   * @param retry set to true if these are limits from a previous transition
   * @return the transition (or null if the fit failed)
   */
  Transition fit(double lower, double upper, boolean retry) {
    final double[] xs = new double[time.length];
    final double[] ys = new double[time.length];
    int count = 0;
    for (int i = 0; i < time.length; i++) {
      if (time[i] >= lower && time[i] <= upper && Double.isFinite(gradient[i])) {
        xs[count] = time[i];
        ys[count++] = gradient[i];
      }
    }
    final double span = upper - lower;
    if (count < 3 || !(span > 0)) {
      logger.fine(() -> String.format("Not enough data to fit transition in [%g, %g]", lower,
          upper));
      return null;
    }
    final double[] x = Arrays.copyOf(xs, count);
    final double[] y = Arrays.copyOf(ys, count);
    final int im = TraceMath.argMax(y, 0, count);

    final LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer();
    final ParameterValidator validator = point -> {
      // Sigma is symmetric; keep it away from zero
      final double s = Math.abs(point.getEntry(2));
      point.setEntry(2, Math.max(s, Double.MIN_NORMAL));
      return point;
    };
    final LeastSquaresProblem problem = FitUtils.createProblem(new GaussianFunction(x), y,
        new double[] {y[im], x[im], span / 2}, validator);
    final double[] p;
    try {
      final Optimum optimum = optimizer.optimize(problem);
      p = optimum.getPoint().toArray();
    } catch (TooManyIterationsException | ConvergenceException ex) {
      logger.fine(() -> "Failed to fit transition: " + ex.getMessage());
      return null;
    } catch (MathIllegalStateException ex) {
      logger.fine(() -> "Invalid transition fit: " + ex.getMessage());
      return null;
    }
    final double amplitude = p[0];
    final double mu = p[1];
    final double sigma = Math.abs(p[2]);
    if (!Double.isFinite(amplitude) || !Double.isFinite(mu) || !Double.isFinite(sigma)
        || sigma > span || mu < lower || mu > upper) {
      logger.fine(() -> String.format("Rejected transition fit A=%g, mu=%g, sigma=%g in [%g, %g]",
          amplitude, mu, sigma, lower, upper));
      return null;
    }
    final double h = halfWidthFactor * sigma;
    return new Transition(amplitude, mu, sigma, lower, upper,
        mu - h - options.getLowerMultiple() * sigma, mu + h + options.getUpperMultiple() * sigma,
        retry);
  }

  /**
   * Gaussian function {@code f(x) = A exp(-0.5 ((x - mu) / sigma)^2)}.
   */
  static final class GaussianFunction implements MultivariateJacobianFunction {
    private final double[] x;

    /**
     * @param x the x values
     */
    GaussianFunction(double[] x) {
      this.x = x;
    }

    /**
     * {@inheritDoc}
     *
     * @param point {A, mu, sigma}
     */
    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      final double a = point.getEntry(0);
      final double mu = point.getEntry(1);
      final double sigma = point.getEntry(2);
      final double s2 = sigma * sigma;
      final double[] value = new double[x.length];
      final double[][] jacobian = new double[x.length][3];
      // df_da = e
      // df_dmu = A e (x - mu) / sigma^2
      // df_dsigma = A e (x - mu)^2 / sigma^3
      for (int i = 0; i < x.length; i++) {
        final double dx = x[i] - mu;
        final double e = Math.exp(-0.5 * dx * dx / s2);
        value[i] = a * e;
        jacobian[i][0] = e;
        jacobian[i][1] = a * e * dx / s2;
        jacobian[i][2] = a * e * dx * dx / (s2 * sigma);
      }
      return new Pair<>(new ArrayRealVector(value, false),
          new Array2DRowRealMatrix(jacobian, false));
    }
  }
}
