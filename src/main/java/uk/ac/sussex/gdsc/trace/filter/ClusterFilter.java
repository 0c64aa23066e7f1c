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
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.cluster.ClusterResult;
import uk.ac.sussex.gdsc.trace.cluster.Clusterer;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * Create filters from the clusters of the values of one or more analytes.
 */
public class ClusterFilter implements FilterGenerator {
  private final List<String> analytes;
  private final Clusterer clusterer;
  private boolean normalise = true;
  private boolean includeTime;
  private FilterSelector selector = FilterSelector.switches();

  /**
   * Create an instance.
   *
   * @param clusterer the clusterer
   * @param analytes the analytes
   */
  public ClusterFilter(Clusterer clusterer, String... analytes) {
    this.clusterer = ValidationUtils.checkNotNull(clusterer, "clusterer");
    ValidationUtils.checkArgument(analytes.length > 0, "No analytes to cluster");
    this.analytes = Collections.unmodifiableList(Arrays.asList(analytes.clone()));
  }

  /**
   * Set to true to scale each feature to zero mean and unit variance. Features are always scaled
   * when there is more than one analyte.
   *
   * @param normalise the new normalise
   * @return this
   */
  public ClusterFilter setNormalise(boolean normalise) {
    this.normalise = normalise;
    return this;
  }

  /**
   * Set to true to include the time as a feature.
   *
   * @param includeTime the new include time
   * @return this
   */
  public ClusterFilter setIncludeTime(boolean includeTime) {
    this.includeTime = includeTime;
    return this;
  }

  /**
   * Sets the selector for the samples to consider. Samples outside the selection are excluded.
   * The default uses the current filter switches.
   *
   * @param selector the new selector
   * @return this
   */
  public ClusterFilter setSelector(FilterSelector selector) {
    this.selector = ValidationUtils.checkNotNull(selector, "selector");
    return this;
  }

  @Override
  public List<String> apply(Trace trace) {
    analytes.forEach(trace::checkAnalyte);
    final boolean[] subset = FilterSubsets.subset(trace, selector, analytes);
    final int[] sampled = MaskUtils.indices(subset);
    ValidationUtils.checkArgument(sampled.length > 0, "No samples to cluster for %s",
        trace.getSample());

    final List<double[]> columns = new LocalList<>();
    for (final String analyte : analytes) {
      columns.add(select(trace.getValues(analyte), sampled));
    }
    if (includeTime) {
      columns.add(select(trace.getTime(), sampled));
    } else if (analytes.size() == 1) {
      columns.add(new double[sampled.length]);
    }
    if (normalise || analytes.size() > 1) {
      columns.forEach(ClusterFilter::scale);
    }
    final double[][] data = new double[sampled.length][columns.size()];
    for (int j = 0; j < columns.size(); j++) {
      final double[] column = columns.get(j);
      for (int i = 0; i < sampled.length; i++) {
        data[i][j] = column[i];
      }
    }

    final ClusterResult result = clusterer.cluster(data);
    result.getWarnings().forEach(w -> trace.getDiagnostics().warning(ClusterFilter.class, w));

    final Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("analytes", analytes);
    parameters.put("method", clusterer.getName());
    parameters.put("normalise", normalise);
    parameters.put("include_time", includeTime);
    parameters.put("filt", selector.toString());

    final String label = FilterSubsets.label(analytes);
    final String base = label + "_cluster-" + clusterer.getName();
    final String info = label + " cluster filter.";
    final FilterRegistry filters = trace.getFilters();
    final List<String> names = new LocalList<>();
    for (final int cluster : result.getUniqueLabels()) {
      final String name =
          base + (cluster == ClusterResult.NOISE ? "_noise" : "_" + cluster);
      filters.add(name, resize(result.getMask(cluster), sampled, trace.size()), info, parameters);
      names.add(name);
    }
    if (result.hasCore()) {
      final String name = base + "_core";
      filters.add(name, resize(result.getCore(), sampled, trace.size()), info, parameters);
      names.add(name);
    }
    return names;
  }

  private static double[] select(double[] values, int[] indices) {
    final double[] selected = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      selected[i] = values[indices[i]];
    }
    return selected;
  }

  /**
   * Scale to zero mean and unit variance. A constant feature is centred only.
   *
   * @param values the values (modified)
   */
  static void scale(double[] values) {
    final double mean = TraceMath.nanMean(values);
    final double std = TraceMath.nanStd(values);
    final double s = std > 0 ? std : 1;
    for (int i = 0; i < values.length; i++) {
      values[i] = (values[i] - mean) / s;
    }
  }

  private static boolean[] resize(boolean[] mask, int[] sampled, int size) {
    final boolean[] full = new boolean[size];
    for (int i = 0; i < sampled.length; i++) {
      full[sampled[i]] = mask[i];
    }
    return full;
  }
}
