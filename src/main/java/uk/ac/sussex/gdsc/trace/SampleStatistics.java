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
import uk.ac.sussex.gdsc.trace.filter.FilterSelector;

/**
 * Summary statistics of the selected samples of each analyte at the working stage of a trace.
 *
 * <p>Statistics are computed either over the whole trace or for each signal segment. The mean and
 * population standard deviation ignore non-finite values.
 */
public final class SampleStatistics {
  private final String sample;
  private final List<String> analytes;
  private final int segmentCount;
  private final boolean perSegment;
  /** For each analyte the {count, mean, std} for each segment. */
  private final Map<String, double[][]> stats;

  private SampleStatistics(String sample, List<String> analytes, int segmentCount,
      boolean perSegment, Map<String, double[][]> stats) {
    this.sample = sample;
    this.analytes = analytes;
    this.segmentCount = segmentCount;
    this.perSegment = perSegment;
    this.stats = stats;
  }

  /**
   * Compute the statistics.
   *
   * @param trace the trace
   * @param selector the selector used to choose the samples of each analyte
   * @param perSegment set to true to compute statistics for each signal segment
   * @return the statistics
   */
  public static SampleStatistics compute(Trace trace, FilterSelector selector,
      boolean perSegment) {
    final int[] segments = trace.getSegmentNumbers();
    final int count = perSegment ? trace.getSegmentCount() : 1;
    final Map<String, double[][]> stats = new LinkedHashMap<>();
    for (final String analyte : trace.getAnalytes()) {
      final double[] values = trace.getValues(analyte);
      final boolean[] mask = trace.getFilters().grab(selector, analyte);
      final double[] n = new double[count];
      final double[] s1 = new double[count];
      final double[] s2 = new double[count];
      for (int i = 0; i < values.length; i++) {
        if (mask[i] && Double.isFinite(values[i])) {
          final int index;
          if (perSegment) {
            if (segments[i] == 0) {
              continue;
            }
            index = segments[i] - 1;
          } else {
            index = 0;
          }
          n[index]++;
          s1[index] += values[i];
        }
      }
      final double[] mean = new double[count];
      for (int j = 0; j < count; j++) {
        mean[j] = n[j] == 0 ? Double.NaN : s1[j] / n[j];
      }
      // Second pass for the deviations from the mean
      for (int i = 0; i < values.length; i++) {
        if (mask[i] && Double.isFinite(values[i]) && (!perSegment || segments[i] != 0)) {
          final int index = perSegment ? segments[i] - 1 : 0;
          final double d = values[i] - mean[index];
          s2[index] += d * d;
        }
      }
      final double[] std = new double[count];
      for (int j = 0; j < count; j++) {
        std[j] = n[j] == 0 ? Double.NaN : Math.sqrt(s2[j] / n[j]);
      }
      stats.put(analyte, new double[][] {n, mean, std});
    }
    return new SampleStatistics(trace.getSample(), trace.getAnalytes(), count, perSegment, stats);
  }

  /**
   * Gets the sample name.
   *
   * @return the sample
   */
  public String getSample() {
    return sample;
  }

  /**
   * Gets the analytes.
   *
   * @return the analytes
   */
  public List<String> getAnalytes() {
    return analytes;
  }

  /**
   * Checks if the statistics are per segment.
   *
   * @return true if per segment
   */
  public boolean isPerSegment() {
    return perSegment;
  }

  /**
   * Gets the number of groups. This is the segment count if per segment; otherwise 1.
   *
   * @return the group count
   */
  public int getGroupCount() {
    return segmentCount;
  }

  /**
   * Gets the number of samples used for the analyte in the group.
   *
   * @param analyte the analyte
   * @param group the group (segment number - 1 if per segment; otherwise 0)
   * @return the count
   */
  public int getCount(String analyte, int group) {
    return (int) get(analyte)[0][group];
  }

  /**
   * Gets the mean of the analyte in the group.
   *
   * @param analyte the analyte
   * @param group the group (segment number - 1 if per segment; otherwise 0)
   * @return the mean
   */
  public double getMean(String analyte, int group) {
    return get(analyte)[1][group];
  }

  /**
   * Gets the standard deviation of the analyte in the group.
   *
   * @param analyte the analyte
   * @param group the group (segment number - 1 if per segment; otherwise 0)
   * @return the standard deviation
   */
  public double getStd(String analyte, int group) {
    return get(analyte)[2][group];
  }

  private double[][] get(String analyte) {
    final double[][] s = stats.get(analyte);
    if (s == null) {
      throw new IllegalArgumentException("Unknown analyte: " + analyte);
    }
    return s;
  }
}
