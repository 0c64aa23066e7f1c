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

package uk.ac.sussex.gdsc.trace.filter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.BandwidthMethod;
import uk.ac.sussex.gdsc.trace.utils.GaussianKernelDensity;
import uk.ac.sussex.gdsc.trace.utils.LocalExtrema;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * Create filters that separate the distinct distributions of an analyte.
 *
 * <p>A gaussian kernel density estimate is computed for the selected values. The local minima
 * of the density divide the values into bins. A filter is created for each bin.
 */
public class DistributionFilter implements FilterGenerator {
  private static final Logger logger = Logger.getLogger(DistributionFilter.class.getName());

  private final String analyte;
  private BandwidthMethod bandwidthMethod = BandwidthMethod.SCOTT;
  private boolean logTransform;
  private FilterSelector selector = FilterSelector.switches();

  /**
   * Create an instance.
   *
   * @param analyte the analyte
   */
  public DistributionFilter(String analyte) {
    this.analyte = ValidationUtils.checkNotNull(analyte, "analyte");
  }

  /**
   * Sets the bandwidth method of the kernel density estimate.
   *
   * @param bandwidthMethod the new bandwidth method
   * @return this
   */
  public DistributionFilter setBandwidthMethod(BandwidthMethod bandwidthMethod) {
    this.bandwidthMethod = ValidationUtils.checkNotNull(bandwidthMethod, "bandwidthMethod");
    return this;
  }

  /**
   * Set to true to compute the density of the log10 of the values. Values that are not positive
   * are excluded.
   *
   * @param logTransform the new log transform
   * @return this
   */
  public DistributionFilter setLogTransform(boolean logTransform) {
    this.logTransform = logTransform;
    return this;
  }

  /**
   * Sets the selector for the samples to consider. Samples outside the selection are excluded.
   * The default uses the current filter switches.
   *
   * @param selector the new selector
   * @return this
   */
  public DistributionFilter setSelector(FilterSelector selector) {
    this.selector = ValidationUtils.checkNotNull(selector, "selector");
    return this;
  }

  @Override
  public List<String> apply(Trace trace) {
    trace.checkAnalyte(analyte);
    final boolean[] subset =
        FilterSubsets.subset(trace, selector, Collections.singletonList(analyte));
    final double[] values = trace.getValues(analyte);
    if (logTransform) {
      for (int i = 0; i < subset.length; i++) {
        subset[i] = subset[i] && values[i] > 0;
      }
    }

    final Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("analyte", analyte);
    parameters.put("binwidth", bandwidthMethod.getDescription());
    parameters.put("transform", logTransform ? "log" : null);
    parameters.put("filt", selector.toString());

    final double[] limits = findLimits(values, subset);
    final FilterRegistry filters = trace.getFilters();
    if (limits.length < 2) {
      final String name = analyte + "_distribution_failed";
      filters.add(name, subset,
          analyte + " is within a single distribution. No data removed.", parameters);
      return Collections.singletonList(name);
    }

    final List<String> names = new LocalList<>(limits.length);
    final int last = limits.length - 1;
    for (int bin = 0; bin < limits.length; bin++) {
      final double lower = bin == 0 ? Double.NEGATIVE_INFINITY : limits[bin - 1];
      final double upper = bin == last ? Double.POSITIVE_INFINITY : limits[bin];
      final boolean[] mask = new boolean[subset.length];
      for (int i = 0; i < mask.length; i++) {
        mask[i] = subset[i] && values[i] >= lower && values[i] < upper;
      }
      final String info = bin == 0
          ? String.format("%s distribution filter, 0 <i> %.2e", analyte, limits[bin])
          : String.format("%s distribution filter, %.2e <i> %.2e", analyte, lower, limits[bin]);
      final String name = analyte + "_distribution_" + bin;
      filters.add(name, mask, info, parameters);
      names.add(name);
    }
    return names;
  }

  /**
   * Find the bin limits. These are the minima of the density and the maximum value.
   *
   * @param values the values
   * @param subset the subset of values to use
   * @return the limits (length 1 if the values are a single distribution)
   */
  private double[] findLimits(double[] values, boolean[] subset) {
    final double[] data = new double[values.length];
    int count = 0;
    for (int i = 0; i < values.length; i++) {
      if (subset[i]) {
        data[count++] = logTransform ? Math.log10(values[i]) : values[i];
      }
    }
    final GaussianKernelDensity kde;
    try {
      kde = new GaussianKernelDensity(Arrays.copyOf(data, count), bandwidthMethod);
    } catch (final IllegalArgumentException ex) {
      logger.fine(() -> "No density for " + analyte + ": " + ex.getMessage());
      return new double[1];
    }
    final double[] x =
        TraceMath.linspace(kde.getMin(), kde.getMax(), Math.max(3, kde.getSize() / 3));
    final double[] minima = LocalExtrema.findMinima(x, kde.pdf(x));
    final double[] limits = Arrays.copyOf(minima, minima.length + 1);
    limits[minima.length] = x[x.length - 1];
    if (logTransform) {
      for (int i = 0; i < limits.length; i++) {
        limits[i] = Math.pow(10, limits[i]);
      }
    }
    return limits;
  }
}
