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

/**
 * A transition between background and signal located by fitting a gaussian to the absolute
 * gradient of the target analyte.
 */
public final class Transition {
  private final double amplitude;
  private final double centre;
  private final double sigma;
  private final double fitLower;
  private final double fitUpper;
  private final double start;
  private final double end;
  private final boolean retry;

  Transition(double amplitude, double centre, double sigma, double fitLower, double fitUpper,
      double start, double end, boolean retry) {
    this.amplitude = amplitude;
    this.centre = centre;
    this.sigma = sigma;
    this.fitLower = fitLower;
    this.fitUpper = fitUpper;
    this.start = start;
    this.end = end;
    this.retry = retry;
  }

  /**
   * Gets the fitted amplitude of the gradient peak.
   *
   * @return the amplitude
   */
  public double getAmplitude() {
    return amplitude;
  }

  /**
   * Gets the fitted centre time.
   *
   * @return the centre
   */
  public double getCentre() {
    return centre;
  }

  /**
   * Gets the fitted width.
   *
   * @return the sigma
   */
  public double getSigma() {
    return sigma;
  }

  /**
   * Gets the lower time limit of the data used for the fit.
   *
   * @return the fit lower
   */
  public double getFitLower() {
    return fitLower;
  }

  /**
   * Gets the upper time limit of the data used for the fit.
   *
   * @return the fit upper
   */
  public double getFitUpper() {
    return fitUpper;
  }

  /**
   * Gets the start of the excluded transition interval.
   *
   * @return the start
   */
  public double getStart() {
    return start;
  }

  /**
   * Gets the end of the excluded transition interval.
   *
   * @return the end
   */
  public double getEnd() {
    return end;
  }

  /**
   * Checks if the fit used the limits of the previous transition.
   *
   * @return true if a retry
   */
  public boolean isRetry() {
    return retry;
  }

  @Override
  public String toString() {
    return String.format("Transition[centre=%g, sigma=%g, interval=(%g, %g)%s]", centre, sigma,
        start, end, retry ? ", retry" : "");
  }
}
