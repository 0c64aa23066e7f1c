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

import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * A point with the index of the sample.
 */
final class IndexedPoint implements Clusterable {
  private final int index;
  private final double[] point;

  IndexedPoint(int index, double[] point) {
    this.index = index;
    this.point = point;
  }

  /**
   * Gets the sample index.
   *
   * @return the index
   */
  int getIndex() {
    return index;
  }

  @Override
  public double[] getPoint() {
    return point;
  }

  /**
   * Create the points.
   *
   * @param data the data
   * @return the points
   */
  static IndexedPoint[] of(double[][] data) {
    final IndexedPoint[] points = new IndexedPoint[data.length];
    for (int i = 0; i < data.length; i++) {
      points[i] = new IndexedPoint(i, data[i]);
    }
    return points;
  }
}
