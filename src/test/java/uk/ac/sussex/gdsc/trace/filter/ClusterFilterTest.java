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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.TraceSamples;
import uk.ac.sussex.gdsc.trace.cluster.DbscanClusterer;
import uk.ac.sussex.gdsc.trace.cluster.KMeansClusterer;

@SuppressWarnings({"javadoc"})
class ClusterFilterTest {
  private static Trace createOutlierTrace() {
    final double[] values = new double[50];
    for (int i = 0; i < values.length; i++) {
      values[i] = 10 + 0.01 * (i % 5);
    }
    values[20] = 100;
    return TraceSamples.of("X", values);
  }

  @Test
  void canClusterTwoAnalytes() {
    final double[] a = new double[40];
    final double[] b = new double[40];
    for (int i = 0; i < a.length; i++) {
      final double level = i % 2 == 0 ? 10 : 20;
      a[i] = level + 0.1 * (i % 5);
      b[i] = 3 * level - 0.1 * (i % 3);
    }
    b[5] = Double.NaN;
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", a);
    data.put("B", b);
    final Trace trace = TraceSamples.of(data);

    final List<String> names = new ClusterFilter(new KMeansClusterer(2), "A", "B").apply(trace);
    Assertions.assertEquals(
        Arrays.asList("A-B_cluster-kmeans_0", "A-B_cluster-kmeans_1"), names);
    final boolean[] m0 = trace.getFilters().getMask(names.get(0));
    final boolean[] m1 = trace.getFilters().getMask(names.get(1));
    Assertions.assertFalse(m0[5] || m1[5], "Missing sample");
    // Each level is a single cluster
    final boolean evenInFirst = m0[0];
    for (int i = 0; i < a.length; i++) {
      if (i != 5) {
        Assertions.assertNotEquals(m0[i], m1[i]);
        Assertions.assertEquals(evenInFirst == (i % 2 == 0), m0[i]);
      }
    }
    Assertions.assertEquals("A-B cluster filter.",
        trace.getFilters().getFilter(names.get(0)).getDescription());
    Assertions.assertEquals("kmeans",
        trace.getFilters().getFilter(names.get(0)).getParameters().get("method"));
  }

  @Test
  void canFindNoiseAndCore() {
    final Trace trace = createOutlierTrace();
    final List<String> names =
        new ClusterFilter(new DbscanClusterer().setMinSamples(3), "X").apply(trace);
    Assertions.assertEquals(Arrays.asList("X_cluster-DBSCAN_noise", "X_cluster-DBSCAN_0",
        "X_cluster-DBSCAN_core"), names);
    final boolean[] noise = trace.getFilters().getMask(names.get(0));
    final boolean[] cluster = trace.getFilters().getMask(names.get(1));
    final boolean[] core = trace.getFilters().getMask(names.get(2));
    for (int i = 0; i < noise.length; i++) {
      Assertions.assertEquals(i == 20, noise[i]);
      Assertions.assertEquals(i != 20, cluster[i]);
      Assertions.assertEquals(i != 20, core[i]);
    }
  }

  @Test
  void clustererWarningsAreLogged() {
    final Trace trace = createOutlierTrace();
    final Logger clustererLogger = Logger.getLogger(DbscanClusterer.class.getName());
    final Logger filterLogger = Logger.getLogger(ClusterFilter.class.getName());
    final List<LogRecord> clustererRecords = new ArrayList<>();
    final List<LogRecord> filterRecords = new ArrayList<>();
    final Handler clustererHandler = new CollectingHandler(clustererRecords);
    final Handler filterHandler = new CollectingHandler(filterRecords);
    clustererLogger.addHandler(clustererHandler);
    filterLogger.addHandler(filterHandler);
    try {
      new ClusterFilter(new DbscanClusterer().setTargetClusters(10).setMaxIterations(20), "X")
          .apply(trace);
    } finally {
      clustererLogger.removeHandler(clustererHandler);
      filterLogger.removeHandler(filterHandler);
    }
    final List<String> warnings = trace.getDiagnostics().getWarnings();
    Assertions.assertEquals(1, warnings.size());
    Assertions.assertTrue(warnings.get(0).contains("10 clusters"));
    // Reported once through the trace diagnostics
    Assertions.assertEquals(0, countWarnings(clustererRecords), "Clusterer warnings");
    Assertions.assertEquals(1, countWarnings(filterRecords), "Filter warnings");
  }

  private static long countWarnings(List<LogRecord> records) {
    return records.stream().filter(r -> r.getLevel() == Level.WARNING).count();
  }

  /**
   * Collect the published log records.
   */
  private static class CollectingHandler extends Handler {
    private final List<LogRecord> records;

    CollectingHandler(List<LogRecord> records) {
      this.records = records;
    }

    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {
      // Nothing to flush
    }

    @Override
    public void close() {
      // Nothing to release
    }
  }

  @Test
  void canScale() {
    final double[] values = {1, 2, 3, Double.NaN};
    ClusterFilter.scale(values);
    final double s = Math.sqrt(2.0 / 3);
    Assertions.assertArrayEquals(new double[] {-1 / s, 0, 1 / s}, Arrays.copyOf(values, 3), 1e-10);
    Assertions.assertTrue(Double.isNaN(values[3]));

    final double[] constant = {2, 2, 2};
    ClusterFilter.scale(constant);
    Assertions.assertArrayEquals(new double[3], constant);
  }

  @Test
  void applyThrowsWithNoSamples() {
    final double[] values = new double[5];
    Arrays.fill(values, Double.NaN);
    final Trace trace = TraceSamples.of("X", values);
    final ClusterFilter filter = new ClusterFilter(new KMeansClusterer(2), "X");
    Assertions.assertThrows(IllegalArgumentException.class, () -> filter.apply(trace));
  }
}
