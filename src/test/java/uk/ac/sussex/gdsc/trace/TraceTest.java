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

package uk.ac.sussex.gdsc.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class TraceTest {
  private static Trace createTrace() {
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", new double[] {1, 2, 10, 12, 14, 3, 2, 1});
    data.put("B", new double[] {2, 2, 4, 6, 8, 2, 2, 2});
    return TraceSamples.of(data);
  }

  private static boolean[] mask(int size, int from, int to) {
    final boolean[] mask = new boolean[size];
    for (int i = from; i < to; i++) {
      mask[i] = true;
    }
    return mask;
  }

  @Test
  void constructorValidatesData() {
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", new double[3]);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Trace("s", new double[0], data), "Empty time");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Trace("s", new double[2], data), "Length mismatch");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Trace("s", new double[3], Collections.emptyMap()), "No analytes");
  }

  @Test
  void newTraceIsAllTransition() {
    final Trace trace = createTrace();
    Assertions.assertEquals(Stage.RAW, trace.getWorkingStage());
    Assertions.assertEquals(8, trace.size());
    Assertions.assertEquals(1.0, trace.getTimeStep());
    Assertions.assertArrayEquals(mask(8, 0, 8), trace.getTransition());
    Assertions.assertEquals(0, trace.getSegmentCount());
    Assertions.assertThrows(IllegalArgumentException.class, () -> trace.getValues("C"));
    Assertions.assertThrows(IllegalStateException.class,
        () -> trace.getValues(Stage.SIGNAL, "A"));
  }

  @Test
  void setRegionsRejectsOverlap() {
    final Trace trace = createTrace();
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> trace.setRegions(mask(8, 0, 3), mask(8, 2, 5)));
  }

  @Test
  void regionsPartitionTheTrace() {
    final Trace trace = createTrace();
    trace.setRegions(mask(8, 0, 2), mask(8, 2, 5));
    final boolean[] bkg = trace.getBackground();
    final boolean[] sig = trace.getSignal();
    final boolean[] trn = trace.getTransition();
    Assertions.assertFalse(bkg[0], "First sample is cleared");
    for (int i = 0; i < 8; i++) {
      Assertions.assertFalse(bkg[i] && sig[i], "Overlap");
      Assertions.assertTrue(bkg[i] || sig[i] || trn[i], "Not covered");
    }
    Assertions.assertEquals(1, trace.getSegmentCount());
    Assertions.assertArrayEquals(new int[] {0, 0, 1, 1, 1, 0, 0, 0}, trace.getSegmentNumbers());
  }

  @Test
  void canSeparateAndCorrectBackground() {
    final Trace trace = createTrace();
    final boolean[] bkg = mask(8, 0, 2);
    bkg[6] = true;
    trace.setRegions(bkg, mask(8, 2, 5));
    trace.backgroundCorrect();
    Assertions.assertEquals(Stage.BACKGROUND_SUBTRACTED, trace.getWorkingStage());
    // Background of A is samples 1 and 6 (the edges are cleared): mean 2
    final double[] a = trace.getValues("A");
    Assertions.assertTrue(Double.isNaN(a[0]));
    Assertions.assertArrayEquals(new double[] {8, 10, 12}, new double[] {a[2], a[3], a[4]});
    final double[] b = trace.getValues(Stage.BACKGROUND, "B");
    Assertions.assertEquals(2, b[1]);
    Assertions.assertTrue(Double.isNaN(b[3]));

    trace.ratio("B");
    Assertions.assertEquals(Stage.RATIOS, trace.getWorkingStage());
    final double[] r = trace.getValues("A");
    // B corrected is {2, 4, 6}
    Assertions.assertArrayEquals(new double[] {4, 2.5, 2}, new double[] {r[2], r[3], r[4]});
  }

  @Test
  void backgroundCorrectWarnsWithNoBackground() {
    final Trace trace = createTrace();
    trace.setRegions(new boolean[8], mask(8, 2, 5));
    trace.backgroundCorrect();
    Assertions.assertTrue(trace.getDiagnostics().hasWarnings());
    Assertions.assertTrue(Double.isNaN(trace.getValues("A")[3]));
  }

  @Test
  void separateUsesTheDespikedData() {
    final Trace trace = createTrace();
    final StageData despiked = trace.getStageData(Stage.RAW);
    despiked.put("A", new double[] {0, 0, 5, 5, 5, 0, 0, 0});
    trace.setStageData(Stage.DESPIKED, despiked);
    trace.setRegions(mask(8, 0, 2), mask(8, 2, 5));
    trace.separate();
    Assertions.assertEquals(Stage.SIGNAL, trace.getWorkingStage());
    Assertions.assertEquals(5, trace.getValues("A")[3]);
    Assertions.assertThrows(IllegalArgumentException.class, () -> trace.separate(Stage.RATIOS));
  }

  @Test
  void canApplyManualRanges() {
    final Trace trace = createTrace();
    trace.addSignalRange(1.5, 4.5);
    Assertions.assertArrayEquals(mask(8, 2, 5), trace.getSignal());
    trace.addBackgroundRange(3.5, 6.5);
    Assertions.assertArrayEquals(mask(8, 2, 4), trace.getSignal(), "Background replaces signal");
    Assertions.assertArrayEquals(mask(8, 4, 7), trace.getBackground());
    Assertions.assertEquals(1, trace.getSignalRanges().size());
    Assertions.assertEquals(new TimeRange(1.5, 3.5), trace.getSignalRanges().get(0));
  }

  @Test
  void parametersIncludeTheProcessingRecords() {
    final Trace trace = createTrace();
    trace.getFilters().add("f", new boolean[8], "test", Collections.singletonMap("x", 1));
    final Map<String, Object> parameters = trace.getParameters();
    Assertions.assertEquals("test", parameters.get("sample"));
    Assertions.assertEquals(Collections.singletonList("f"), parameters.get("filter_sequence"));
    Assertions.assertTrue(parameters.containsKey("despike"));
    Assertions.assertTrue(parameters.containsKey("autorange"));
    Assertions.assertTrue(parameters.containsKey("filter_params"));
    @SuppressWarnings("unchecked")
    final Map<String, String> keys = (Map<String, String>) parameters.get("filter_keys");
    Assertions.assertEquals("f", keys.get("A"));
  }
}
