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
 * Exception thrown when the exponential decay coefficient cannot be estimated.
 */
public class DecayFitException extends Exception {
  private static final long serialVersionUID = 20250101L;

  /**
   * Create an instance.
   *
   * @param message the message
   */
  public DecayFitException(String message) {
    super(message);
  }

  /**
   * Create an instance.
   *
   * @param message the message
   * @param cause the cause
   */
  public DecayFitException(String message, Throwable cause) {
    super(message, cause);
  }
}
