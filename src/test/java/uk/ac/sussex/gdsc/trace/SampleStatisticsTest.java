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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.trace.filter.FilterSelector;

@SuppressWarnings({"javadoc"})
class SampleStatisticsTest {
  @Test
  void canComputePerSegmentStatistics() {
    final double[] values = {0, 1, 2, 3, 0, 10, 20, 0};
    final Trace trace = TraceSamples.of("A", values);
    final boolean[] sig = {false, true, true, true, false, true, true, false};
    trace.setRegions(new boolean[values.length], sig);
    trace.separate();

    final SampleStatistics all = SampleStatistics.compute(trace, FilterSelector.none(), false);
    Assertions.assertEquals(1, all.getGroupCount());
    Assertions.assertEquals(5, all.getCount("A", 0));
    Assertions.assertEquals(7.2, all.getMean("A", 0), 1e-12);

    final SampleStatistics seg = SampleStatistics.compute(trace, FilterSelector.none(), true);
    Assertions.assertEquals(2, seg.getGroupCount());
    Assertions.assertTrue(seg.isPerSegment());
    Assertions.assertEquals(3, seg.getCount("A", 0));
    Assertions.assertEquals(2, seg.getMean("A", 0), 1e-12);
    Assertions.assertEquals(Math.sqrt(2.0 / 3), seg.getStd("A", 0), 1e-12);
    Assertions.assertEquals(15, seg.getMean("A", 1), 1e-12);
    Assertions.assertEquals(5, seg.getStd("A", 1), 1e-12);
  }

  @Test
  void statisticsUseTheFilterSelection() {
    final double[] values = {0, 1, 2, 3, 4, 0};
    final Trace trace = TraceSamples.of("A", values);
    trace.getFilters().add("low", new boolean[] {true, true, true, false, false, true}, "low",
        Collections.emptyMap());
    final SampleStatistics stats =
        SampleStatistics.compute(trace, FilterSelector.expression("!low"), false);
    Assertions.assertEquals(2, stats.getCount("A", 0));
    Assertions.assertEquals(3.5, stats.getMean("A", 0), 1e-12);
    final SampleStatistics switched =
        SampleStatistics.compute(trace, FilterSelector.switches(), false);
    Assertions.assertEquals(0.75, switched.getMean("A", 0), 1e-12);
  }
}
