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

import java.util.List;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;

/**
 * Utilities for selecting the samples used to create a filter.
 */
final class FilterSubsets {
  /** No public construction. */
  private FilterSubsets() {}

  /**
   * Get the samples selected for each of the given analytes that are finite in every analyte of
   * the trace at the working stage.
   *
   * <p>Filter switches are per analyte so only the selection of the given analytes is used.
   *
   * @param trace the trace
   * @param selector the selector
   * @param analytes the analytes the filter is created from
   * @return the subset
   */
  static boolean[] subset(Trace trace, FilterSelector selector, List<String> analytes) {
    final FilterRegistry filters = trace.getFilters();
    final boolean[] subset = MaskUtils.filled(trace.size(), true);
    for (final String analyte : analytes) {
      MaskUtils.andInPlace(subset, filters.grab(selector, analyte));
    }
    final List<String> all = trace.getAnalytes();
    final double[][] values = new double[all.size()][];
    for (int i = 0; i < values.length; i++) {
      values[i] = trace.getValues(all.get(i));
    }
    return MaskUtils.andInPlace(subset, MaskUtils.finite(trace.size(), values));
  }

  /**
   * Join the analyte names with a dash.
   *
   * @param analytes the analytes
   * @return the label
   */
  static String label(List<String> analytes) {
    return String.join("-", analytes);
  }
}
