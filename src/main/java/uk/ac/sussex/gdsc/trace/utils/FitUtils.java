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

import java.util.Arrays;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem.Evaluation;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;

/**
 * Helpers for least squares fitting with the Levenberg-Marquardt optimiser.
 */
public final class FitUtils {
  /** The maximum number of iterations. */
  public static final int MAX_ITERATIONS = 3000;

  /** The relative change in the cost for convergence. */
  private static final double RELATIVE_COST = 1e-6;

  /** No public construction. */
  private FitUtils() {}

  /**
   * Create an unweighted least squares problem.
   *
   * @param model the model
   * @param observed the observed values
   * @param start the start point
   * @param validator the parameter validator (can be null)
   * @return the problem
   */
  public static LeastSquaresProblem createProblem(MultivariateJacobianFunction model,
      double[] observed, double[] start, ParameterValidator validator) {
    final RealVector target = new ArrayRealVector(observed, false);
    final RealVector startPoint = new ArrayRealVector(start, false);
    final double[] weights = new double[observed.length];
    Arrays.fill(weights, 1.0);
    final RealMatrix weightMatrix = new DiagonalMatrix(weights, false);
    final ConvergenceChecker<Evaluation> checker = (iteration, previous,
        current) -> relativeError(previous.getCost(), current.getCost()) < RELATIVE_COST;
    final int maxEvaluations = Integer.MAX_VALUE;
    final boolean lazyEvaluation = false;
    return LeastSquaresFactory.create(model, target, startPoint, weightMatrix, checker,
        maxEvaluations, MAX_ITERATIONS, lazyEvaluation, validator);
  }

  /**
   * Compute the relative error between two values.
   *
   * @param a the first value
   * @param b the second value
   * @return the relative error
   */
  public static double relativeError(double a, double b) {
    final double max = Math.max(Math.abs(a), Math.abs(b));
    return max == 0 ? 0 : Math.abs(a - b) / max;
  }
}
