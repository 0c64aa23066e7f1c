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

package uk.ac.sussex.gdsc.trace.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Cluster using mean shift with a flat kernel.
 *
 * <p>Each seed is shifted to the mean of the samples within the bandwidth until it converges on a
 * mode of the density. Modes within one bandwidth of a mode with more samples are merged. Samples
 * are assigned to the nearest mode. Labels are ordered by descending cluster size.
 */
public class MeanShiftClusterer implements Clusterer {
  private static final Logger logger = Logger.getLogger(MeanShiftClusterer.class.getName());

  /** The quantile of the nearest neighbours used to estimate the bandwidth. */
  private static final double QUANTILE = 0.3;

  /** Convergence threshold relative to the bandwidth. */
  private static final double STOP_THRESHOLD = 1e-3;

  private double bandwidth;
  private boolean binSeeding;
  private int maxIterations = 300;

  private final EuclideanDistance distance = new EuclideanDistance();

  /**
   * Sets the bandwidth. Set to zero to estimate from the data.
   *
   * @param bandwidth the new bandwidth
   * @return this
   */
  public MeanShiftClusterer setBandwidth(double bandwidth) {
    ValidationUtils.checkArgument(bandwidth >= 0, "Bandwidth must not be negative: %s", bandwidth);
    this.bandwidth = bandwidth;
    return this;
  }

  /**
   * Set to true to seed using the occupied cells of a grid with the bandwidth spacing. The default
   * uses all samples as seeds.
   *
   * @param binSeeding the new bin seeding
   * @return this
   */
  public MeanShiftClusterer setBinSeeding(boolean binSeeding) {
    this.binSeeding = binSeeding;
    return this;
  }

  /**
   * Sets the maximum iterations for each seed.
   *
   * @param maxIterations the new max iterations
   * @return this
   */
  public MeanShiftClusterer setMaxIterations(int maxIterations) {
    ValidationUtils.checkArgument(maxIterations >= 1, "Max iterations must be positive: %d",
        maxIterations);
    this.maxIterations = maxIterations;
    return this;
  }

  @Override
  public String getName() {
    return "meanshift";
  }

  @Override
  public ClusterResult cluster(double[][] data) {
    ValidationUtils.checkArgument(data.length > 0, "No data to cluster");
    final double bw = bandwidth > 0 ? bandwidth : estimateBandwidth(data);
    if (!(bw > 0)) {
      // All samples are identical
      return new ClusterResult(new int[data.length]);
    }

    // Shift each seed to its mode
    final List<double[]> modes = new LocalList<>();
    final List<Integer> counts = new LocalList<>();
    for (final double[] seed : createSeeds(data, bw)) {
      double[] mean = seed;
      int count = 0;
      for (int iteration = 0; iteration < maxIterations; iteration++) {
        final double[] next = new double[mean.length];
        count = 0;
        for (final double[] p : data) {
          if (distance.compute(p, mean) <= bw) {
            for (int k = 0; k < next.length; k++) {
              next[k] += p[k];
            }
            count++;
          }
        }
        if (count == 0) {
          break;
        }
        for (int k = 0; k < next.length; k++) {
          next[k] /= count;
        }
        final boolean converged = distance.compute(next, mean) < STOP_THRESHOLD * bw;
        mean = next;
        if (converged) {
          break;
        }
      }
      if (count != 0) {
        modes.add(mean);
        counts.add(count);
      }
    }

    final List<double[]> centres = mergeModes(modes, counts, bw);
    final int[] labels = assign(data, centres);
    logger.fine(() -> String.format("Mean shift bandwidth %s: %d clusters", bw, centres.size()));
    return new ClusterResult(relabelBySize(labels, centres.size()));
  }

  /**
   * Estimate the bandwidth as the mean distance to the neighbour at the 30th percentile of the
   * samples (the sample itself is the first neighbour).
   *
   * @param data the data
   * @return the bandwidth
   */
  double estimateBandwidth(double[][] data) {
    final int k = Math.max(1, (int) (QUANTILE * data.length));
    final double[] d = new double[data.length];
    double sum = 0;
    for (final double[] p : data) {
      for (int j = 0; j < data.length; j++) {
        d[j] = distance.compute(p, data[j]);
      }
      Arrays.sort(d);
      sum += d[k - 1];
    }
    return sum / data.length;
  }

  private List<double[]> createSeeds(double[][] data, double bw) {
    if (!binSeeding) {
      return Arrays.asList(data);
    }
    final Map<List<Long>, double[]> bins = new LinkedHashMap<>();
    for (final double[] p : data) {
      final List<Long> key = new ArrayList<>(p.length);
      for (final double v : p) {
        key.add(Math.round(v / bw));
      }
      bins.computeIfAbsent(key, k -> k.stream().mapToDouble(b -> b * bw).toArray());
    }
    return new ArrayList<>(bins.values());
  }

  /**
   * Merge modes within the bandwidth. Modes with more samples are kept first.
   */
  private List<double[]> mergeModes(List<double[]> modes, List<Integer> counts, double bw) {
    final Integer[] order = new Integer[modes.size()];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingInt((Integer i) -> counts.get(i)).reversed());
    final List<double[]> centres = new LocalList<>();
    for (final int i : order) {
      final double[] mode = modes.get(i);
      if (centres.stream().noneMatch(c -> distance.compute(c, mode) <= bw)) {
        centres.add(mode);
      }
    }
    return centres;
  }

  private int[] assign(double[][] data, List<double[]> centres) {
    final int[] labels = new int[data.length];
    for (int i = 0; i < data.length; i++) {
      double min = Double.POSITIVE_INFINITY;
      for (int j = 0; j < centres.size(); j++) {
        final double d = distance.compute(data[i], centres.get(j));
        if (d < min) {
          min = d;
          labels[i] = j;
        }
      }
    }
    return labels;
  }

  private static int[] relabelBySize(int[] labels, int n) {
    final int[] size = new int[n];
    for (final int label : labels) {
      size[label]++;
    }
    final Integer[] order = new Integer[n];
    for (int i = 0; i < n; i++) {
      order[i] = i;
    }
    // Stable sort keeps the mode order for equal sizes
    Arrays.sort(order, (a, b) -> Integer.compare(size[b], size[a]));
    final int[] map = new int[n];
    for (int i = 0; i < n; i++) {
      map[order[i]] = i;
    }
    final int[] result = new int[labels.length];
    for (int i = 0; i < labels.length; i++) {
      result[i] = map[labels[i]];
    }
    return result;
  }
}
