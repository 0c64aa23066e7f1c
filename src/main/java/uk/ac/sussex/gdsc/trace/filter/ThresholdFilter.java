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
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Trace;

/**
 * Create a filter that keeps samples above or below a threshold value of an analyte.
 */
public class ThresholdFilter implements FilterGenerator {

  /**
   * The side of the threshold to keep.
   */
  public enum Mode {
    /** Keep values greater than or equal to the threshold. */
    ABOVE("above") {
      @Override
      boolean keep(double value, double threshold) {
        return value >= threshold;
      }
    },
    /** Keep values less than or equal to the threshold. */
    BELOW("below") {
      @Override
      boolean keep(double value, double threshold) {
        return value <= threshold;
      }
    };

    private final String description;

    Mode(String description) {
      this.description = description;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    /**
     * Test if the value is kept.
     *
     * @param value the value
     * @param threshold the threshold
     * @return true if kept
     */
    abstract boolean keep(double value, double threshold);

    @Override
    public String toString() {
      return description;
    }

    /**
     * Gets the descriptions.
     *
     * @return the descriptions
     */
    public static String[] getDescriptions() {
      return Stream.of(values()).map(Mode::getDescription).toArray(String[]::new);
    }
  }

  private final String analyte;
  private final double threshold;
  private final Mode mode;
  private FilterSelector selector = FilterSelector.switches();

  /**
   * Create an instance.
   *
   * @param analyte the analyte
   * @param threshold the threshold
   * @param mode the mode
   */
  public ThresholdFilter(String analyte, double threshold, Mode mode) {
    this.analyte = ValidationUtils.checkNotNull(analyte, "analyte");
    this.threshold = threshold;
    this.mode = ValidationUtils.checkNotNull(mode, "mode");
  }

  /**
   * Sets the selector for the samples to consider. Samples outside the selection are excluded.
   * The default uses the current filter switches.
   *
   * @param selector the new selector
   * @return this
   */
  public ThresholdFilter setSelector(FilterSelector selector) {
    this.selector = ValidationUtils.checkNotNull(selector, "selector");
    return this;
  }

  /**
   * Gets the filter name.
   *
   * @return the name
   */
  public String getName() {
    return analyte + "_thresh_" + mode.getDescription();
  }

  @Override
  public List<String> apply(Trace trace) {
    trace.checkAnalyte(analyte);
    final boolean[] mask =
        FilterSubsets.subset(trace, selector, Collections.singletonList(analyte));
    final double[] values = trace.getValues(analyte);
    for (int i = 0; i < mask.length; i++) {
      mask[i] = mask[i] && mode.keep(values[i], threshold);
    }
    final Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("analyte", analyte);
    parameters.put("threshold", threshold);
    parameters.put("mode", mode.getDescription());
    parameters.put("filt", selector.toString());
    final String name = getName();
    trace.getFilters().add(name, mask,
        String.format("Keep %s %.3e %s", mode.getDescription(), threshold, analyte), parameters);
    return Collections.singletonList(name);
  }
}
