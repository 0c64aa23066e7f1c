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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import uk.ac.sussex.gdsc.core.utils.LocalList;

/**
 * Text format for the time ranges of samples. Each sample is written on one line:
 *
 * <pre>
 * sample:[[t0, t1], [t2, t3]]
 * </pre>
 *
 * <p>Times are written using the shortest decimal that parses to the same double so a round trip
 * is exact.
 */
public final class RangeListFormat {
  private static final String SEPARATOR = ":[";

  /** No public construction. */
  private RangeListFormat() {}

  /**
   * Format the ranges of a sample.
   *
   * @param sample the sample
   * @param ranges the ranges
   * @return the line
   */
  public static String format(String sample, List<TimeRange> ranges) {
    return sample + ':' + formatRanges(ranges);
  }

  /**
   * Format the ranges of each sample, one sample per line.
   *
   * @param ranges the ranges of each sample
   * @return the text
   */
  public static String format(Map<String, List<TimeRange>> ranges) {
    final StringBuilder sb = new StringBuilder();
    ranges.forEach((sample, list) -> sb.append(format(sample, list)).append('\n'));
    return sb.toString();
  }

  /**
   * Format the ranges as {@code [[t0, t1], [t2, t3]]}.
   *
   * @param ranges the ranges
   * @return the text
   */
  public static String formatRanges(List<TimeRange> ranges) {
    final StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < ranges.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(ranges.get(i));
    }
    return sb.append(']').toString();
  }

  /**
   * Parse the ranges of each sample. Blank lines are ignored.
   *
   * @param text the text
   * @return the ranges of each sample
   * @throws IllegalArgumentException if a line is malformed
   */
  public static Map<String, List<TimeRange>> parse(String text) {
    final Map<String, List<TimeRange>> map = new LinkedHashMap<>();
    final String[] lines = text.split("\\r?\\n");
    for (int i = 0; i < lines.length; i++) {
      final String line = lines[i].trim();
      if (line.isEmpty()) {
        continue;
      }
      final int index = line.lastIndexOf(SEPARATOR);
      if (index <= 0) {
        throw new IllegalArgumentException(
            "Line " + (i + 1) + ": expected 'sample:[[start, end], ...]' but was: " + line);
      }
      try {
        map.put(line.substring(0, index), parseRanges(line.substring(index + 1)));
      } catch (final IllegalArgumentException ex) {
        throw new IllegalArgumentException("Line " + (i + 1) + ": " + ex.getMessage(), ex);
      }
    }
    return map;
  }

  /**
   * Parse ranges from {@code [[t0, t1], [t2, t3]]}.
   *
   * @param text the text
   * @return the ranges
   * @throws IllegalArgumentException if the text is malformed
   */
  public static List<TimeRange> parseRanges(String text) {
    final String s = text.trim();
    if (!s.startsWith("[") || !s.endsWith("]")) {
      throw new IllegalArgumentException("Ranges must be enclosed in []: " + text);
    }
    final List<TimeRange> ranges = new LocalList<>();
    final String inner = s.substring(1, s.length() - 1).trim();
    if (inner.isEmpty()) {
      return ranges;
    }
    final String[] pairs = StringUtils.substringsBetween(inner, "[", "]");
    if (pairs == null) {
      throw new IllegalArgumentException("No ranges found: " + text);
    }
    for (final String pair : pairs) {
      final String[] values = StringUtils.split(pair, ',');
      if (values.length != 2) {
        throw new IllegalArgumentException("Range must have 2 values: [" + pair + "]");
      }
      try {
        final double start = Double.parseDouble(values[0].trim());
        final double end = Double.parseDouble(values[1].trim());
        ranges.add(new TimeRange(start, end));
      } catch (final NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number in range: [" + pair + "]", ex);
      }
    }
    return ranges;
  }
}
