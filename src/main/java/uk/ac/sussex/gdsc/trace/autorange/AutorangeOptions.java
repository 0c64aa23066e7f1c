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

import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Provides the options for the {@link Autorange}.
 */
public class AutorangeOptions {
  /** The target analyte. Null to use the first analyte of the trace. */
  private String analyte;

  /** The rolling window for the gradient of the target analyte. */
  private int gradientWindow;

  /** The half width of the data window around each transition. */
  private int window;

  /** The rolling window for the gradient of the transition peak. */
  private int smoothWindow;

  /** The height of the fitted gaussian, relative to the peak, that limits the transition. */
  private double confidence;

  /** Multiples of sigma added to the lower and upper transition limits. */
  private double lowerMultiple;
  private double upperMultiple;

  /** The factor applied to the lowest density minimum to give the background threshold. */
  private double backgroundFactor;

  /** The fraction of the mean transition width used to find unresolved transitions. */
  private double safetyMargin;

  /** The number of points for the kernel density estimate. */
  private int bins;

  /**
   * Create an instance with the defaults.
   */
  public AutorangeOptions() {
    gradientWindow = 11;
    window = 40;
    smoothWindow = 5;
    confidence = 0.01;
    backgroundFactor = 1.2;
    safetyMargin = 0.3;
    bins = 50;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected AutorangeOptions(AutorangeOptions source) {
    analyte = source.analyte;
    gradientWindow = source.gradientWindow;
    window = source.window;
    smoothWindow = source.smoothWindow;
    confidence = source.confidence;
    lowerMultiple = source.lowerMultiple;
    upperMultiple = source.upperMultiple;
    backgroundFactor = source.backgroundFactor;
    safetyMargin = source.safetyMargin;
    bins = source.bins;
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public AutorangeOptions copy() {
    return new AutorangeOptions(this);
  }

  /**
   * Gets the target analyte.
   *
   * @return the analyte (null for the first analyte)
   */
  public String getAnalyte() {
    return analyte;
  }

  /**
   * Sets the target analyte. An ideal target is abundant and homogeneous in the sample.
   *
   * @param analyte the new analyte (null for the first analyte)
   * @return this
   */
  public AutorangeOptions setAnalyte(String analyte) {
    this.analyte = analyte;
    return this;
  }

  /**
   * Gets the rolling window for the gradient of the target analyte.
   *
   * @return the gradient window
   */
  public int getGradientWindow() {
    return gradientWindow;
  }

  /**
   * Sets the rolling window for the gradient of the target analyte.
   *
   * @param gradientWindow the new gradient window
   * @return this
   */
  public AutorangeOptions setGradientWindow(int gradientWindow) {
    ValidationUtils.checkArgument(gradientWindow >= 2, "Gradient window must be at least 2: %d",
        gradientWindow);
    this.gradientWindow = gradientWindow;
    return this;
  }

  /**
   * Gets the half width of the data window around each transition.
   *
   * @return the window
   */
  public int getWindow() {
    return window;
  }

  /**
   * Sets the half width of the data window around each transition.
   *
   * @param window the new window
   * @return this
   */
  public AutorangeOptions setWindow(int window) {
    ValidationUtils.checkArgument(window >= 1, "Window must be positive: %d", window);
    this.window = window;
    return this;
  }

  /**
   * Gets the rolling window for the gradient of the transition peak.
   *
   * @return the smooth window
   */
  public int getSmoothWindow() {
    return smoothWindow;
  }

  /**
   * Sets the rolling window for the gradient of the transition peak.
   *
   * @param smoothWindow the new smooth window
   * @return this
   */
  public AutorangeOptions setSmoothWindow(int smoothWindow) {
    ValidationUtils.checkArgument(smoothWindow >= 2, "Smooth window must be at least 2: %d",
        smoothWindow);
    this.smoothWindow = smoothWindow;
    return this;
  }

  /**
   * Gets the height of the fitted gaussian, relative to the peak, that limits the transition.
   * Lower values exclude wider transitions.
   *
   * @return the confidence
   */
  public double getConfidence() {
    return confidence;
  }

  /**
   * Sets the height of the fitted gaussian, relative to the peak, that limits the transition.
   *
   * @param confidence the new confidence in (0, 1)
   * @return this
   */
  public AutorangeOptions setConfidence(double confidence) {
    ValidationUtils.checkArgument(confidence > 0 && confidence < 1,
        "Confidence must be in (0, 1): %s", confidence);
    this.confidence = confidence;
    return this;
  }

  /**
   * Gets the multiple of sigma subtracted from the lower transition limit.
   *
   * @return the lower multiple
   */
  public double getLowerMultiple() {
    return lowerMultiple;
  }

  /**
   * Gets the multiple of sigma added to the upper transition limit.
   *
   * @return the upper multiple
   */
  public double getUpperMultiple() {
    return upperMultiple;
  }

  /**
   * Sets the multiples of sigma that widen the transition limits.
   *
   * @param lowerMultiple the multiple subtracted from the lower limit
   * @param upperMultiple the multiple added to the upper limit
   * @return this
   */
  public AutorangeOptions setTransitionMultiples(double lowerMultiple, double upperMultiple) {
    this.lowerMultiple = lowerMultiple;
    this.upperMultiple = upperMultiple;
    return this;
  }

  /**
   * Gets the factor applied to the lowest density minimum to give the background threshold.
   *
   * @return the background factor
   */
  public double getBackgroundFactor() {
    return backgroundFactor;
  }

  /**
   * Sets the factor applied to the lowest density minimum to give the background threshold.
   *
   * @param backgroundFactor the new background factor
   * @return this
   */
  public AutorangeOptions setBackgroundFactor(double backgroundFactor) {
    ValidationUtils.checkArgument(backgroundFactor > 0, "Background factor must be positive: %s",
        backgroundFactor);
    this.backgroundFactor = backgroundFactor;
    return this;
  }

  /**
   * Gets the fraction of the mean transition width used to find unresolved transitions.
   *
   * @return the safety margin
   */
  public double getSafetyMargin() {
    return safetyMargin;
  }

  /**
   * Sets the fraction of the mean transition width used to find unresolved transitions. A
   * background boundary closer than this to a signal boundary is removed.
   *
   * @param safetyMargin the new safety margin
   * @return this
   */
  public AutorangeOptions setSafetyMargin(double safetyMargin) {
    ValidationUtils.checkArgument(safetyMargin >= 0, "Safety margin must not be negative: %s",
        safetyMargin);
    this.safetyMargin = safetyMargin;
    return this;
  }

  /**
   * Gets the number of points for the kernel density estimate.
   *
   * @return the bins
   */
  public int getBins() {
    return bins;
  }

  /**
   * Sets the number of points for the kernel density estimate.
   *
   * @param bins the new bins
   * @return this
   */
  public AutorangeOptions setBins(int bins) {
    ValidationUtils.checkArgument(bins >= 3, "Bins must be at least 3: %d", bins);
    this.bins = bins;
    return this;
  }

  /**
   * Gets the options as named parameters.
   *
   * @return the parameters
   */
  public Map<String, Object> toParameters() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("analyte", analyte);
    map.put("gwin", gradientWindow);
    map.put("win", window);
    map.put("smwin", smoothWindow);
    map.put("conf", confidence);
    map.put("trans_mult", new double[] {lowerMultiple, upperMultiple});
    map.put("bkg_factor", backgroundFactor);
    map.put("safety_margin", safetyMargin);
    map.put("bins", bins);
    return map;
  }
}
