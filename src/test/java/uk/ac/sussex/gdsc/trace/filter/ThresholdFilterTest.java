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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.TraceSamples;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;

@SuppressWarnings({"javadoc"})
class ThresholdFilterTest {
  private static Trace createTrace() {
    final double[] a = new double[10];
    final double[] b = new double[10];
    for (int i = 0; i < a.length; i++) {
      a[i] = i;
      b[i] = 1;
    }
    b[7] = Double.NaN;
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", a);
    data.put("B", b);
    return TraceSamples.of(data);
  }

  @Test
  void canKeepAboveThreshold() {
    final Trace trace = createTrace();
    final ThresholdFilter filter = new ThresholdFilter("A", 5, ThresholdFilter.Mode.ABOVE);
    Assertions.assertEquals(Collections.singletonList("A_thresh_above"), filter.apply(trace));
    final boolean[] mask = trace.getFilters().getMask("A_thresh_above");
    for (int i = 0; i < mask.length; i++) {
      // Missing in any analyte is excluded
      Assertions.assertEquals(i >= 5 && i != 7, mask[i]);
    }
    final Filter f = trace.getFilters().getFilter("A_thresh_above");
    Assertions.assertEquals("Keep above 5.000e+00 A", f.getDescription());
    Assertions.assertEquals("above", f.getParameters().get("mode"));
    Assertions.assertEquals(5.0, f.getParameters().get("threshold"));
  }

  @Test
  void canKeepBelowThreshold() {
    final Trace trace = createTrace();
    new ThresholdFilter("A", 5, ThresholdFilter.Mode.BELOW).apply(trace);
    final boolean[] mask = trace.getFilters().getMask("A_thresh_below");
    for (int i = 0; i < mask.length; i++) {
      Assertions.assertEquals(i <= 5, mask[i]);
    }
  }

  @Test
  void canRestrictToSelection() {
    final Trace trace = createTrace();
    new ThresholdFilter("A", 5, ThresholdFilter.Mode.BELOW).apply(trace);
    new ThresholdFilter("A", 3, ThresholdFilter.Mode.ABOVE)
        .setSelector(FilterSelector.expression("A_thresh_below")).apply(trace);
    final boolean[] mask = trace.getFilters().getMask("A_thresh_above");
    for (int i = 0; i < mask.length; i++) {
      Assertions.assertEquals(i >= 3 && i <= 5, mask[i]);
    }
  }

  @Test
  void defaultSelectionRefinesEarlierFilters() {
    final Trace trace = createTrace();
    new ThresholdFilter("A", 5, ThresholdFilter.Mode.BELOW).apply(trace);
    new ThresholdFilter("A", 3, ThresholdFilter.Mode.ABOVE).apply(trace);
    final boolean[] mask = trace.getFilters().getMask("A_thresh_above");
    for (int i = 0; i < mask.length; i++) {
      Assertions.assertEquals(i >= 3 && i <= 5, mask[i]);
    }
    Assertions.assertEquals("switches",
        trace.getFilters().getFilter("A_thresh_above").getParameters().get("filt"));
  }

  @Test
  void selectionIgnoresFiltersSwitchedOnForOtherAnalytes() {
    final double[] a = new double[20];
    final double[] b = new double[20];
    for (int i = 0; i < a.length; i++) {
      a[i] = i;
      b[i] = 2 * i;
    }
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", a);
    data.put("B", b);
    final Trace trace = TraceSamples.of(data);
    final boolean[] late = new boolean[20];
    for (int i = 10; i < late.length; i++) {
      late[i] = true;
    }
    final FilterRegistry filters = trace.getFilters();
    filters.add("late", late, "Second half", null);
    filters.off("late", "A");

    new ThresholdFilter("A", -1, ThresholdFilter.Mode.ABOVE).apply(trace);
    Assertions.assertEquals(20, MaskUtils.count(filters.getMask("A_thresh_above")));
    new ThresholdFilter("B", -1, ThresholdFilter.Mode.ABOVE).apply(trace);
    Assertions.assertArrayEquals(late, filters.getMask("B_thresh_above"));
  }

  @Test
  void applyThrowsWithUnknownAnalyte() {
    final Trace trace = createTrace();
    final ThresholdFilter filter = new ThresholdFilter("C", 5, ThresholdFilter.Mode.BELOW);
    Assertions.assertThrows(IllegalArgumentException.class, () -> filter.apply(trace));
    Assertions.assertEquals(0, trace.getFilters().getFilterCount());
  }

  @Test
  void applyTwiceThrows() {
    final Trace trace = createTrace();
    final ThresholdFilter filter = new ThresholdFilter("A", 5, ThresholdFilter.Mode.BELOW);
    filter.apply(trace);
    Assertions.assertThrows(DuplicateFilterException.class, () -> filter.apply(trace));
  }

  @Test
  void canGetModeDescriptions() {
    Assertions.assertArrayEquals(new String[] {"above", "below"},
        ThresholdFilter.Mode.getDescriptions());
  }
}
