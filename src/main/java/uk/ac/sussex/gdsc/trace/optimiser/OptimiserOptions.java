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

package uk.ac.sussex.gdsc.trace.optimiser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Provides the options for the {@link SignalOptimiser}.
 */
public class OptimiserOptions {
  /** The default minimum number of points in a window. */
  public static final int DEFAULT_MIN_POINTS = 5;

  /** The analytes. Empty to use all analytes of the trace. */
  private List<String> analytes;

  /** The minimum number of points in a window. */
  private int minPoints;

  /** The method used to derive the thresholds. */
  private ThresholdMode thresholdMode;

  /** Explicit thresholds. NaN to use the threshold mode. */
  private double meanThreshold;
  private double stdThreshold;

  /** The weight of each analyte. Null for equal weights. */
  private double[] weights;

  /** The method used to scale the statistic surfaces. */
  private ScaleMethod scaleMethod;

  /**
   * Create an instance with the defaults.
   */
  public OptimiserOptions() {
    analytes = Collections.emptyList();
    minPoints = DEFAULT_MIN_POINTS;
    thresholdMode = ThresholdMode.KDE_FIRST_MAX;
    meanThreshold = Double.NaN;
    stdThreshold = Double.NaN;
    scaleMethod = ScaleMethod.BAYESIAN;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected OptimiserOptions(OptimiserOptions source) {
    analytes = source.analytes;
    minPoints = source.minPoints;
    thresholdMode = source.thresholdMode;
    meanThreshold = source.meanThreshold;
    stdThreshold = source.stdThreshold;
    weights = source.weights;
    scaleMethod = source.scaleMethod;
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public OptimiserOptions copy() {
    return new OptimiserOptions(this);
  }

  /**
   * Gets the analytes.
   *
   * @return the analytes (empty for all analytes)
   */
  public List<String> getAnalytes() {
    return analytes;
  }

  /**
   * Sets the analytes.
   *
   * @param analytes the new analytes (none for all analytes)
   * @return this
   */
  public OptimiserOptions setAnalytes(String... analytes) {
    this.analytes = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(analytes)));
    return this;
  }

  /**
   * Gets the minimum number of points in a window.
   *
   * @return the min points
   */
  public int getMinPoints() {
    return minPoints;
  }

  /**
   * Sets the minimum number of points in a window.
   *
   * @param minPoints the new min points
   * @return this
   */
  public OptimiserOptions setMinPoints(int minPoints) {
    ValidationUtils.checkArgument(minPoints >= 2, "Min points must be at least 2: %d", minPoints);
    this.minPoints = minPoints;
    return this;
  }

  /**
   * Gets the threshold mode.
   *
   * @return the threshold mode
   */
  public ThresholdMode getThresholdMode() {
    return thresholdMode;
  }

  /**
   * Sets the threshold mode. This is ignored if explicit thresholds are set.
   *
   * @param thresholdMode the new threshold mode
   * @return this
   */
  public OptimiserOptions setThresholdMode(ThresholdMode thresholdMode) {
    this.thresholdMode = ValidationUtils.checkNotNull(thresholdMode, "thresholdMode");
    return this;
  }

  /**
   * Gets the explicit mean threshold.
   *
   * @return the mean threshold (NaN if not set)
   */
  public double getMeanThreshold() {
    return meanThreshold;
  }

  /**
   * Gets the explicit standard deviation threshold.
   *
   * @return the std threshold (NaN if not set)
   */
  public double getStdThreshold() {
    return stdThreshold;
  }

  /**
   * Sets explicit thresholds for the scaled mean and standard deviation. Set to NaN to use the
   * threshold mode.
   *
   * @param meanThreshold the mean threshold
   * @param stdThreshold the std threshold
   * @return this
   */
  public OptimiserOptions setThresholds(double meanThreshold, double stdThreshold) {
    ValidationUtils.checkArgument(Double.isNaN(meanThreshold) == Double.isNaN(stdThreshold),
        "Both thresholds must be set or unset: %s, %s", meanThreshold, stdThreshold);
    this.meanThreshold = meanThreshold;
    this.stdThreshold = stdThreshold;
    return this;
  }

  /**
   * Checks for explicit thresholds.
   *
   * @return true if explicit thresholds are set
   */
  public boolean hasThresholds() {
    return !Double.isNaN(meanThreshold);
  }

  /**
   * Gets a copy of the weights.
   *
   * @return the weights (null for equal weights)
   */
  public double[] getWeights() {
    return weights == null ? null : weights.clone();
  }

  /**
   * Sets the weight of each analyte.
   *
   * @param weights the new weights (null for equal weights)
   * @return this
   */
  public OptimiserOptions setWeights(double... weights) {
    this.weights = weights == null ? null : weights.clone();
    return this;
  }

  /**
   * Gets the scale method.
   *
   * @return the scale method
   */
  public ScaleMethod getScaleMethod() {
    return scaleMethod;
  }

  /**
   * Sets the scale method.
   *
   * @param scaleMethod the new scale method
   * @return this
   */
  public OptimiserOptions setScaleMethod(ScaleMethod scaleMethod) {
    this.scaleMethod = ValidationUtils.checkNotNull(scaleMethod, "scaleMethod");
    return this;
  }

  /**
   * Gets the options as named parameters.
   *
   * @return the parameters
   */
  public Map<String, Object> toParameters() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("analytes", analytes);
    map.put("min_points", minPoints);
    map.put("threshold_mode", hasThresholds() ? new double[] {meanThreshold, stdThreshold}
        : thresholdMode.getDescription());
    map.put("weights", getWeights());
    map.put("scale", scaleMethod.getDescription());
    return map;
  }
}
