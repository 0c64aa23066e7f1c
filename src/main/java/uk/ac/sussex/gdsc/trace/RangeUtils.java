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

import java.util.List;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Conversions between boolean masks, contiguous runs and time ranges.
 */
public final class RangeUtils {

  /** No public construction. */
  private RangeUtils() {}

  /**
   * Find the contiguous runs of true values.
   *
   * @param mask the mask
   * @return the runs as {start, end} pairs (both inclusive)
   */
  public static List<int[]> runs(boolean[] mask) {
    final List<int[]> runs = new LocalList<>();
    int i = 0;
    while (i < mask.length) {
      if (mask[i]) {
        final int start = i;
        while (i + 1 < mask.length && mask[i + 1]) {
          i++;
        }
        runs.add(new int[] {start, i});
      }
      i++;
    }
    return runs;
  }

  /**
   * Number the contiguous runs of true values. False samples are labelled {@code start}; the runs
   * are labelled {@code start + 1}, {@code start + 2}, etc.
   *
   * @param mask the mask
   * @param start the start label
   * @return the labels
   */
  public static int[] enumerate(boolean[] mask, int start) {
    final int[] labels = new int[mask.length];
    int label = start;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        if (i == 0 || !mask[i - 1]) {
          label++;
        }
        labels[i] = label;
      } else {
        labels[i] = start;
      }
    }
    return labels;
  }

  /**
   * Convert the mask to time ranges. The first and last samples are treated as false. Each range
   * boundary is the mid-point between the edge sample of the run and its neighbour outside the run.
   *
   * @param time the time
   * @param mask the mask
   * @return the ranges
   */
  public static List<TimeRange> maskToRanges(double[] time, boolean[] mask) {
    checkLength(time, mask);
    final boolean[] m = mask.clone();
    clearEdges(m);
    final List<TimeRange> ranges = new LocalList<>();
    for (final int[] run : runs(m)) {
      ranges.add(new TimeRange(0.5 * (time[run[0] - 1] + time[run[0]]),
          0.5 * (time[run[1]] + time[run[1] + 1])));
    }
    return ranges;
  }

  /**
   * Convert the time ranges to a mask. Samples strictly inside any range are true.
   *
   * @param time the time
   * @param ranges the ranges
   * @return the mask
   */
  public static boolean[] rangesToMask(double[] time, List<TimeRange> ranges) {
    final boolean[] mask = new boolean[time.length];
    for (final TimeRange range : ranges) {
      for (int i = 0; i < time.length; i++) {
        if (range.contains(time[i])) {
          mask[i] = true;
        }
      }
    }
    return mask;
  }

  /**
   * Set false all samples with time strictly inside {@code (start, end)}.
   *
   * @param time the time
   * @param mask the mask (modified)
   * @param start the start
   * @param end the end
   */
  public static void exclude(double[] time, boolean[] mask, double start, double end) {
    checkLength(time, mask);
    for (int i = 0; i < time.length; i++) {
      if (time[i] > start && time[i] < end) {
        mask[i] = false;
      }
    }
  }

  /**
   * Set the first and last samples to false.
   *
   * @param mask the mask (modified)
   */
  public static void clearEdges(boolean[] mask) {
    if (mask.length != 0) {
      mask[0] = false;
      mask[mask.length - 1] = false;
    }
  }

  private static void checkLength(double[] time, boolean[] mask) {
    ValidationUtils.checkArgument(time.length == mask.length, "Mask length %d != time length %d",
        mask.length, time.length);
  }
}
