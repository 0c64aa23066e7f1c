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

import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Provides the options for the {@link Despiker}.
 */
public class DespikeOptions {
  /** The default rolling window for the spike filter. */
  public static final int DEFAULT_WINDOW = 3;
  /** The default number of standard deviations above the rolling mean for a spike. */
  public static final double DEFAULT_N_SIGMA = 12;

  /** Set to true to apply the spike filter. */
  private boolean spikeFilter;

  /** The rolling window for the spike filter. */
  private int window;

  /** The number of standard deviations above the rolling mean for a spike. */
  private double nSigma;

  /** Set to true to apply the exponential decay filter. */
  private boolean decayFilter;

  /** The exponential decay coefficient (negative). NaN if not known. */
  private double exponent;

  /** The time step for the decay filter. NaN to use the first time step of the trace. */
  private double timeStep;

  /**
   * Create an instance with the defaults.
   */
  public DespikeOptions() {
    spikeFilter = true;
    window = DEFAULT_WINDOW;
    nSigma = DEFAULT_N_SIGMA;
    decayFilter = true;
    exponent = Double.NaN;
    timeStep = Double.NaN;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected DespikeOptions(DespikeOptions source) {
    spikeFilter = source.spikeFilter;
    window = source.window;
    nSigma = source.nSigma;
    decayFilter = source.decayFilter;
    exponent = source.exponent;
    timeStep = source.timeStep;
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public DespikeOptions copy() {
    return new DespikeOptions(this);
  }

  /**
   * Checks if the spike filter is applied.
   *
   * @return true if the spike filter is applied
   */
  public boolean isSpikeFilter() {
    return spikeFilter;
  }

  /**
   * Sets if the spike filter is applied.
   *
   * @param spikeFilter the new spike filter flag
   * @return this
   */
  public DespikeOptions setSpikeFilter(boolean spikeFilter) {
    this.spikeFilter = spikeFilter;
    return this;
  }

  /**
   * Gets the rolling window for the spike filter.
   *
   * @return the window
   */
  public int getWindow() {
    return window;
  }

  /**
   * Sets the rolling window for the spike filter.
   *
   * @param window the new window
   * @return this
   */
  public DespikeOptions setWindow(int window) {
    ValidationUtils.checkArgument(window >= 1, "Window must be positive: %d", window);
    this.window = window;
    return this;
  }

  /**
   * Gets the number of standard deviations above the rolling mean for a spike.
   *
   * @return the n sigma
   */
  public double getNSigma() {
    return nSigma;
  }

  /**
   * Sets the number of standard deviations above the rolling mean for a spike.
   *
   * @param nSigma the new n sigma
   * @return this
   */
  public DespikeOptions setNSigma(double nSigma) {
    ValidationUtils.checkArgument(nSigma > 0, "Sigma limit must be positive: %s", nSigma);
    this.nSigma = nSigma;
    return this;
  }

  /**
   * Checks if the exponential decay filter is applied.
   *
   * @return true if the decay filter is applied
   */
  public boolean isDecayFilter() {
    return decayFilter;
  }

  /**
   * Sets if the exponential decay filter is applied.
   *
   * @param decayFilter the new decay filter flag
   * @return this
   */
  public DespikeOptions setDecayFilter(boolean decayFilter) {
    this.decayFilter = decayFilter;
    return this;
  }

  /**
   * Gets the exponential decay coefficient.
   *
   * @return the exponent (NaN if not known)
   */
  public double getExponent() {
    return exponent;
  }

  /**
   * Sets the exponential decay coefficient. This should be negative.
   *
   * @param exponent the new exponent
   * @return this
   */
  public DespikeOptions setExponent(double exponent) {
    ValidationUtils.checkArgument(Double.isNaN(exponent) || exponent < 0,
        "Exponent must be negative: %s", exponent);
    this.exponent = exponent;
    return this;
  }

  /**
   * Gets the time step for the decay filter.
   *
   * @return the time step (NaN to use the first time step of the trace)
   */
  public double getTimeStep() {
    return timeStep;
  }

  /**
   * Sets the time step for the decay filter.
   *
   * @param timeStep the new time step
   * @return this
   */
  public DespikeOptions setTimeStep(double timeStep) {
    this.timeStep = timeStep;
    return this;
  }

  /**
   * Gets the options as named parameters.
   *
   * @return the parameters
   */
  public Map<String, Object> toParameters() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("spike_filter", spikeFilter);
    map.put("win", window);
    map.put("nlim", nSigma);
    map.put("expdecay_filter", decayFilter);
    map.put("exponent", exponent);
    map.put("tstep", timeStep);
    return map;
  }
}
