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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class RangeListFormatTest {
  @Test
  void canFormatRanges() {
    final List<TimeRange> ranges = Arrays.asList(new TimeRange(1.5, 2.5), new TimeRange(4, 8.25));
    Assertions.assertEquals("Sample-1:[[1.5, 2.5], [4.0, 8.25]]",
        RangeListFormat.format("Sample-1", ranges));
    Assertions.assertEquals("s:[]", RangeListFormat.format("s", Collections.emptyList()));
  }

  @Test
  void canParseFormattedRanges() {
    final Map<String, List<TimeRange>> map = new LinkedHashMap<>();
    map.put("A:1", Arrays.asList(new TimeRange(0.5, 10.5), new TimeRange(20, 30)));
    map.put("B", Collections.emptyList());
    map.put("C", Collections.singletonList(new TimeRange(-1, 1e-3)));
    final String text = RangeListFormat.format(map);
    Assertions.assertEquals(map, RangeListFormat.parse(text));
  }

  @Test
  void parseReportsTheBadLine() {
    final IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
        () -> RangeListFormat.parse("A:[[1, 2]]\nB:[[1, x]]"));
    Assertions.assertTrue(ex.getMessage().startsWith("Line 2"), ex::getMessage);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> RangeListFormat.parse("no ranges"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> RangeListFormat.parseRanges("[[1, 2, 3]]"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> RangeListFormat.parseRanges("[[3, 2]]"));
  }

  @Test
  void parsedRangesReproduceTheMask() {
    final Trace trace = TraceSamples.plateaus(99);
    final boolean[] mask = new boolean[trace.size()];
    for (int i = 120; i < 180; i++) {
      mask[i] = true;
    }
    final List<TimeRange> ranges = RangeUtils.maskToRanges(trace.getTime(), mask);
    final List<TimeRange> parsed =
        RangeListFormat.parse(RangeListFormat.format(trace.getSample(), ranges))
            .get(trace.getSample());
    Assertions.assertArrayEquals(mask, RangeUtils.rangesToMask(trace.getTime(), parsed));
  }
}
