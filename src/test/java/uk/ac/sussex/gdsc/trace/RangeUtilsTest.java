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

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class RangeUtilsTest {
  private static final double[] TIME = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

  @Test
  void canFindRuns() {
    final boolean[] mask = {true, true, false, true, false, false, true, true, true, false};
    final List<int[]> runs = RangeUtils.runs(mask);
    Assertions.assertEquals(3, runs.size());
    Assertions.assertArrayEquals(new int[] {0, 1}, runs.get(0));
    Assertions.assertArrayEquals(new int[] {3, 3}, runs.get(1));
    Assertions.assertArrayEquals(new int[] {6, 8}, runs.get(2));
  }

  @Test
  void canEnumerateRuns() {
    final boolean[] mask = {false, true, true, false, true, false};
    Assertions.assertArrayEquals(new int[] {0, 1, 1, 0, 2, 0}, RangeUtils.enumerate(mask, 0));
  }

  @Test
  void rangesUseMidpointsAndIgnoreEdges() {
    final boolean[] mask = {true, true, false, true, true, true, false, false, true, true};
    final List<TimeRange> ranges = RangeUtils.maskToRanges(TIME, mask);
    Assertions.assertEquals(Arrays.asList(new TimeRange(0.5, 1.5), new TimeRange(2.5, 5.5),
        new TimeRange(7.5, 8.5)), ranges);
  }

  @Test
  void rangeRoundTripReproducesMaskExceptEdges() {
    final boolean[] mask = {true, false, true, true, false, true, false, true, true, true};
    final boolean[] actual = RangeUtils.rangesToMask(TIME, RangeUtils.maskToRanges(TIME, mask));
    final boolean[] expected = mask.clone();
    RangeUtils.clearEdges(expected);
    Assertions.assertArrayEquals(expected, actual);
  }

  @Test
  void excludeIsExclusiveOfLimits() {
    final boolean[] mask = new boolean[TIME.length];
    Arrays.fill(mask, true);
    RangeUtils.exclude(TIME, mask, 2, 5);
    Assertions.assertArrayEquals(
        new boolean[] {true, true, true, false, false, true, true, true, true, true}, mask);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> RangeUtils.exclude(TIME, new boolean[3], 0, 1));
  }

  @Test
  void timeRangeRejectsReversedLimits() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new TimeRange(2, 1));
    final TimeRange range = new TimeRange(1, 3);
    Assertions.assertEquals(2, range.getWidth());
    Assertions.assertFalse(range.contains(1));
    Assertions.assertTrue(range.contains(2));
    Assertions.assertEquals("[1.0, 3.0]", range.toString());
  }
}
