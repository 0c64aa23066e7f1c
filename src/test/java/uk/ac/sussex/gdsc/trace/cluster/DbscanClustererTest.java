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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class DbscanClustererTest {
  @Test
  void canFindClustersAndNoise() {
    final double[][] grids =
        ClusterSamples.grids(new int[] {5, 5, 5}, new double[][] {{0, 0}, {5, 5}, {10, 0}});
    final double[][] data = Arrays.copyOf(grids, grids.length + 1);
    data[grids.length] = new double[] {20, 20};
    final ClusterResult result = new DbscanClusterer().setMinSamples(5).cluster(data);
    Assertions.assertEquals(3, result.getClusterCount());
    Assertions.assertArrayEquals(new int[] {ClusterResult.NOISE, 0, 1, 2},
        result.getUniqueLabels());
    final int[] labels = result.getLabels();
    Assertions.assertEquals(ClusterResult.NOISE, labels[grids.length]);
    Assertions.assertTrue(result.hasCore());
    final boolean[] core = result.getCore();
    for (int i = 0; i < grids.length; i++) {
      Assertions.assertTrue(core[i]);
      Assertions.assertEquals(labels[(i / 25) * 25], labels[i]);
    }
    Assertions.assertFalse(core[grids.length]);
    Assertions.assertTrue(result.getWarnings().isEmpty());
  }

  @Test
  void canTuneEpsToTargetClusters() {
    // Groups separated by 0.75; points spaced by 0.125
    final double[][] data = ClusterSamples.lines(new double[] {0, 2}, 11);
    final ClusterResult initial = new DbscanClusterer().setEps(1).cluster(data);
    Assertions.assertEquals(1, initial.getClusterCount());

    final ClusterResult result = new DbscanClusterer().setTargetClusters(2).cluster(data);
    Assertions.assertEquals(2, result.getClusterCount());
    Assertions.assertTrue(result.getWarnings().isEmpty());
    final int[] labels = result.getLabels();
    for (int i = 0; i < labels.length; i++) {
      Assertions.assertEquals(labels[i < 11 ? 0 : 11], labels[i]);
    }
  }

  @Test
  void unreachableTargetReturnsClosestCount() {
    final double[][] data = ClusterSamples.lines(new double[] {0, 2}, 11);
    final ClusterResult result = new DbscanClusterer().setTargetClusters(3).cluster(data);
    Assertions.assertEquals(2, result.getClusterCount());
    Assertions.assertEquals(1, result.getWarnings().size());
    Assertions.assertTrue(result.getWarnings().get(0).startsWith("Unable to find 3 clusters"));
  }

  @Test
  void tuningStopsAtMaxIterations() {
    final double[][] data = ClusterSamples.lines(new double[] {0, 2}, 11);
    final ClusterResult result =
        new DbscanClusterer().setTargetClusters(3).setMaxIterations(3).cluster(data);
    Assertions.assertEquals(1, result.getClusterCount());
    Assertions.assertTrue(result.getWarnings().get(0).startsWith("Maximum iterations (3)"));
  }

  @Test
  void optionsAreValidated() {
    final DbscanClusterer clusterer = new DbscanClusterer();
    Assertions.assertThrows(IllegalArgumentException.class, () -> clusterer.setEps(0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> clusterer.setMinSamples(-1));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> clusterer.setTargetClusters(-1));
    Assertions.assertEquals("DBSCAN", clusterer.getName());
  }
}
