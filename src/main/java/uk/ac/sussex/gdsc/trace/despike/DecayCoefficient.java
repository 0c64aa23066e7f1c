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

/**
 * The exponential decay coefficient {@code k} of the washout {@code exp(k t)} following an
 * ablation.
 */
public final class DecayCoefficient {
  private final double coefficient;
  private final double standardError;
  private final double rSquared;
  private final double nSigma;
  private final int size;

  DecayCoefficient(double coefficient, double standardError, double rSquared, double nSigma,
      int size) {
    this.coefficient = coefficient;
    this.standardError = standardError;
    this.rSquared = rSquared;
    this.nSigma = nSigma;
    this.size = size;
  }

  /**
   * Gets the fitted coefficient.
   *
   * @return the coefficient
   */
  public double getCoefficient() {
    return coefficient;
  }

  /**
   * Gets the standard error of the fitted coefficient.
   *
   * @return the standard error
   */
  public double getStandardError() {
    return standardError;
  }

  /**
   * Gets the coefficient of determination of the fit against all the pooled samples.
   *
   * @return the R^2
   */
  public double getRSquared() {
    return rSquared;
  }

  /**
   * Gets the number of standard errors subtracted from the coefficient to give the working
   * coefficient.
   *
   * @return the n sigma
   */
  public double getNSigma() {
    return nSigma;
  }

  /**
   * Gets the number of pooled samples.
   *
   * @return the size
   */
  public int getSize() {
    return size;
  }

  /**
   * Gets the coefficient used by the decay filter: {@code k - nSigma * se}.
   *
   * @return the working coefficient
   */
  public double getWorkingCoefficient() {
    return coefficient - nSigma * standardError;
  }

  @Override
  public String toString() {
    return String.format("y = exp(%.2f ± %.2f * x); R^2 = %.2f; Coefficient = %.2f",
        coefficient, standardError, rSquared, getWorkingCoefficient());
  }
}
