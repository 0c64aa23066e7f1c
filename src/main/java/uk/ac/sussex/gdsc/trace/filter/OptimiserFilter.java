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
import java.util.List;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.optimiser.OptimiserOptions;
import uk.ac.sussex.gdsc.trace.optimiser.OptimiserResult;
import uk.ac.sussex.gdsc.trace.optimiser.SignalOptimiser;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;

/**
 * Create a filter that keeps the window of the signal selected by the {@link SignalOptimiser}.
 */
public class OptimiserFilter implements FilterGenerator {
  private final OptimiserOptions options;
  private FilterSelector selector = FilterSelector.switches();
  private OptimiserResult result;

  /**
   * Create an instance.
   *
   * @param options the optimiser options
   */
  public OptimiserFilter(OptimiserOptions options) {
    this.options = options.copy();
  }

  /**
   * Sets the selector for the samples to consider. The selection is combined with the signal
   * region of the trace. The default uses the current filter switches.
   *
   * @param selector the new selector
   * @return this
   */
  public OptimiserFilter setSelector(FilterSelector selector) {
    this.selector = ValidationUtils.checkNotNull(selector, "selector");
    return this;
  }

  /**
   * Gets the result of the last call to {@link #apply(Trace)}.
   *
   * @return the result (or null)
   */
  public OptimiserResult getResult() {
    return result;
  }

  @Override
  public List<String> apply(Trace trace) {
    final List<String> analytes =
        options.getAnalytes().isEmpty() ? trace.getAnalytes() : options.getAnalytes();
    final boolean[] considered = trace.getSignal();
    for (final String analyte : analytes) {
      MaskUtils.andInPlace(considered, trace.getFilters().grab(selector, analyte));
    }
    result = new SignalOptimiser(options).optimise(trace, considered);

    final Map<String, Object> parameters = options.toParameters();
    parameters.put("filt", selector.toString());
    parameters.put("mean_threshold", result.getMeanThreshold());
    parameters.put("std_threshold", result.getStdThreshold());
    parameters.put("lims", result.getLimits());
    final String name = "optimise_" + FilterSubsets.label(analytes);
    trace.getFilters().add(name, result.getMask(),
        "Optimised selection of " + FilterSubsets.label(analytes) + ".", parameters);
    return Collections.singletonList(name);
  }
}
