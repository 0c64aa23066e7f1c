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

import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Cluster using k-means with k-means++ initialisation.
 */
public class KMeansClusterer implements Clusterer {
  /** The default seed for the initialisation. */
  public static final long DEFAULT_SEED = 42;

  private final int clusters;
  private int maxIterations = 300;
  private long seed = DEFAULT_SEED;

  /**
   * Create an instance.
   *
   * @param clusters the number of clusters
   */
  public KMeansClusterer(int clusters) {
    ValidationUtils.checkArgument(clusters >= 1, "Number of clusters must be positive: %d",
        clusters);
    this.clusters = clusters;
  }

  /**
   * Gets the number of clusters.
   *
   * @return the clusters
   */
  public int getClusters() {
    return clusters;
  }

  /**
   * Sets the maximum iterations.
   *
   * @param maxIterations the new max iterations
   * @return this
   */
  public KMeansClusterer setMaxIterations(int maxIterations) {
    ValidationUtils.checkArgument(maxIterations >= 1, "Max iterations must be positive: %d",
        maxIterations);
    this.maxIterations = maxIterations;
    return this;
  }

  /**
   * Sets the seed for the random initialisation.
   *
   * @param seed the new seed
   * @return this
   */
  public KMeansClusterer setSeed(long seed) {
    this.seed = seed;
    return this;
  }

  @Override
  public String getName() {
    return "kmeans";
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if there are fewer samples than clusters
   */
  @Override
  public ClusterResult cluster(double[][] data) {
    final KMeansPlusPlusClusterer<IndexedPoint> clusterer = new KMeansPlusPlusClusterer<>(
        clusters, maxIterations, new EuclideanDistance(), new Well19937c(seed));
    final List<CentroidCluster<IndexedPoint>> result =
        clusterer.cluster(Arrays.asList(IndexedPoint.of(data)));
    final int[] labels = new int[data.length];
    for (int label = 0; label < result.size(); label++) {
      for (final IndexedPoint p : result.get(label).getPoints()) {
        labels[p.getIndex()] = label;
      }
    }
    return new ClusterResult(labels);
  }
}
