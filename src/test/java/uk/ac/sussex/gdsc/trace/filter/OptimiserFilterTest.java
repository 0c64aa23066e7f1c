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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.TraceSamples;
import uk.ac.sussex.gdsc.trace.optimiser.OptimiserOptions;
import uk.ac.sussex.gdsc.trace.optimiser.OptimiserResult;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;

@SuppressWarnings({"javadoc"})
class OptimiserFilterTest {
  private static Trace createTrace(long seed) {
    final Trace trace = TraceSamples.of("A", TraceSamples.quietPlateau(seed));
    trace.setRegions(new boolean[trace.size()], MaskUtils.filled(trace.size(), true));
    return trace;
  }

  @Test
  void canSelectQuietPlateau() {
    final Trace trace = createTrace(123);
    final OptimiserFilter filter = new OptimiserFilter(new OptimiserOptions());
    Assertions.assertEquals(Collections.singletonList("optimise_A"), filter.apply(trace));
    final OptimiserResult result = filter.getResult();
    Assertions.assertFalse(result.isEmpty());
    final int[] lims = result.getLimits();
    Assertions.assertTrue(lims[0] >= 40 && lims[1] <= 90, () -> lims[0] + "-" + lims[1]);
    Assertions.assertTrue(result.getWidth() >= 40);

    final boolean[] mask = trace.getFilters().getMask("optimise_A");
    Assertions.assertEquals(result.getWidth(), MaskUtils.count(mask));
    for (int i = 0; i < mask.length; i++) {
      Assertions.assertEquals(i >= lims[0] && i < lims[1], mask[i]);
    }
    final Filter f = trace.getFilters().getFilter("optimise_A");
    Assertions.assertEquals("Optimised selection of A.", f.getDescription());
    Assertions.assertArrayEquals(lims, (int[]) f.getParameters().get("lims"));
  }

  @Test
  void onlySignalIsConsidered() {
    final Trace trace = createTrace(99);
    final boolean[] sig = new boolean[trace.size()];
    for (int i = 50; i < 120; i++) {
      sig[i] = true;
    }
    trace.setRegions(new boolean[trace.size()], sig);
    final OptimiserFilter filter = new OptimiserFilter(new OptimiserOptions());
    filter.apply(trace);
    final boolean[] mask = trace.getFilters().getMask("optimise_A");
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        Assertions.assertTrue(i >= 50 && i < 90, "Selected outside the signal plateau");
      }
    }
  }

  @Test
  void noSignalGivesEmptySelection() {
    final Trace trace = TraceSamples.of("A", TraceSamples.quietPlateau(1));
    final OptimiserFilter filter = new OptimiserFilter(new OptimiserOptions());
    filter.apply(trace);
    Assertions.assertTrue(filter.getResult().isEmpty());
    Assertions.assertEquals(0, MaskUtils.count(trace.getFilters().getMask("optimise_A")));
    Assertions.assertTrue(trace.getDiagnostics().hasWarnings());
  }
}
