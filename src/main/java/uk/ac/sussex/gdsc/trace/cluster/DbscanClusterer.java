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
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Cluster using density-based spatial clustering of applications with noise (DBSCAN).
 *
 * <p>A core sample has at least {@code minSamples} samples, including itself, within distance
 * {@code eps}. Clusters are the samples reachable from core samples. Samples that are not
 * reachable are noise.
 *
 * <p>If a target number of clusters is set the distance {@code eps} is tuned: starting from 1 it
 * is reduced by a factor of 0.95 until the target is reached.
 */
public class DbscanClusterer implements Clusterer {
  private static final Logger logger = Logger.getLogger(DbscanClusterer.class.getName());

  /** The factor used to reduce eps during tuning. */
  private static final double EPS_FACTOR = 0.95;

  private double eps = 0.3;
  private int minSamples;
  private int targetClusters;
  private int maxIterations = 200;

  /**
   * Sets the maximum distance between two samples in the same neighbourhood.
   *
   * @param eps the new eps
   * @return this
   */
  public DbscanClusterer setEps(double eps) {
    ValidationUtils.checkArgument(eps > 0, "Eps must be positive: %s", eps);
    this.eps = eps;
    return this;
  }

  /**
   * Gets the eps.
   *
   * @return the eps
   */
  public double getEps() {
    return eps;
  }

  /**
   * Sets the number of samples in a neighbourhood for a core sample (including itself). Set to
   * zero to use 1/20 of the data size (minimum 2).
   *
   * @param minSamples the new min samples
   * @return this
   */
  public DbscanClusterer setMinSamples(int minSamples) {
    ValidationUtils.checkArgument(minSamples >= 0, "Min samples must not be negative: %d",
        minSamples);
    this.minSamples = minSamples;
    return this;
  }

  /**
   * Sets the target number of clusters. Set to zero to use the configured eps.
   *
   * @param targetClusters the new target clusters
   * @return this
   */
  public DbscanClusterer setTargetClusters(int targetClusters) {
    ValidationUtils.checkArgument(targetClusters >= 0, "Target clusters must not be negative: %d",
        targetClusters);
    this.targetClusters = targetClusters;
    return this;
  }

  /**
   * Sets the maximum iterations when tuning eps.
   *
   * @param maxIterations the new max iterations
   * @return this
   */
  public DbscanClusterer setMaxIterations(int maxIterations) {
    ValidationUtils.checkArgument(maxIterations >= 1, "Max iterations must be positive: %d",
        maxIterations);
    this.maxIterations = maxIterations;
    return this;
  }

  @Override
  public String getName() {
    return "DBSCAN";
  }

  @Override
  public ClusterResult cluster(double[][] data) {
    final int min = minSamples == 0 ? Math.max(2, data.length / 20) : minSamples;
    final List<IndexedPoint> points = Arrays.asList(IndexedPoint.of(data));
    if (targetClusters == 0) {
      return new ClusterResult(fit(points, eps, min), core(data, eps, min), new ArrayList<>());
    }

    final List<String> warnings = new LocalList<>();
    double e = 1 / EPS_FACTOR;
    int[] labels = null;
    int count = 0;
    for (int iteration = 1;; iteration++) {
      final int last = count;
      e *= EPS_FACTOR;
      labels = fit(points, e, min);
      count = countClusters(labels);
      if (count >= targetClusters) {
        break;
      }
      if (count < last) {
        e /= EPS_FACTOR;
        labels = fit(points, e, min);
        count = countClusters(labels);
        warnings.add(String.format("Unable to find %d clusters. Found %d with eps %.2e",
            targetClusters, count, e));
        break;
      }
      if (iteration == maxIterations) {
        warnings.add(String.format(
            "Maximum iterations (%d) reached, %d clusters not found. Found %d with eps %.2e",
            maxIterations, targetClusters, count, e));
        break;
      }
    }
    final double tuned = e;
    logger.fine(() -> "DBSCAN eps = " + tuned);
    return new ClusterResult(labels, core(data, e, min), warnings);
  }

  /**
   * Run DBSCAN.
   *
   * @param points the points
   * @param eps the eps
   * @param min the min samples including the sample itself
   * @return the labels
   */
  private static int[] fit(List<IndexedPoint> points, double eps, int min) {
    // The neighbour count of DBSCANClusterer excludes the point itself
    final DBSCANClusterer<IndexedPoint> clusterer =
        new DBSCANClusterer<>(eps, min - 1, new EuclideanDistance());
    final List<Cluster<IndexedPoint>> clusters = clusterer.cluster(points);
    final int[] labels = new int[points.size()];
    Arrays.fill(labels, ClusterResult.NOISE);
    for (int label = 0; label < clusters.size(); label++) {
      for (final IndexedPoint p : clusters.get(label).getPoints()) {
        labels[p.getIndex()] = label;
      }
    }
    return labels;
  }

  /**
   * Identify the core samples.
   *
   * @param data the data
   * @param eps the eps
   * @param min the min samples including the sample itself
   * @return the core flags
   */
  private static boolean[] core(double[][] data, double eps, int min) {
    final EuclideanDistance distance = new EuclideanDistance();
    final boolean[] core = new boolean[data.length];
    for (int i = 0; i < data.length; i++) {
      int count = 0;
      for (int j = 0; j < data.length && count < min; j++) {
        if (distance.compute(data[i], data[j]) <= eps) {
          count++;
        }
      }
      core[i] = count >= min;
    }
    return core;
  }

  private static int countClusters(int[] labels) {
    int max = -1;
    for (final int label : labels) {
      max = Math.max(max, label);
    }
    return max + 1;
  }
}
