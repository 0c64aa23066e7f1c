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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class KMeansClustererTest {
  @Test
  void canClusterSeparatedGroups() {
    final int[] sizes = {5, 4, 3};
    final double[][] data =
        ClusterSamples.grids(sizes, new double[][] {{0, 0}, {5, 5}, {10, 0}});
    final ClusterResult result = new KMeansClusterer(3).cluster(data);
    Assertions.assertEquals(data.length, result.size());
    Assertions.assertEquals(3, result.getClusterCount());
    Assertions.assertFalse(result.hasCore());
    final int[] labels = result.getLabels();
    // Each grid has a single distinct label
    final int[] first = {labels[0], labels[25], labels[41]};
    Assertions.assertNotEquals(first[0], first[1]);
    Assertions.assertNotEquals(first[0], first[2]);
    Assertions.assertNotEquals(first[1], first[2]);
    for (int i = 0; i < labels.length; i++) {
      final int grid = i < 25 ? 0 : i < 41 ? 1 : 2;
      Assertions.assertEquals(first[grid], labels[i]);
    }
  }

  @Test
  void sameSeedIsRepeatable() {
    final double[][] data =
        ClusterSamples.grids(new int[] {6, 6}, new double[][] {{0, 0}, {0.2, 0.2}});
    final int[] l1 = new KMeansClusterer(2).setSeed(7).cluster(data).getLabels();
    final int[] l2 = new KMeansClusterer(2).setSeed(7).cluster(data).getLabels();
    Assertions.assertArrayEquals(l1, l2);
  }

  @Test
  void optionsAreValidated() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new KMeansClusterer(0));
    final KMeansClusterer clusterer = new KMeansClusterer(2);
    Assertions.assertThrows(IllegalArgumentException.class, () -> clusterer.setMaxIterations(0));
    Assertions.assertEquals("kmeans", clusterer.getName());
    Assertions.assertEquals(2, clusterer.getClusters());
  }
}
