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

package uk.ac.sussex.gdsc.trace.optimiser;

import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.TraceSamples;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;

@SuppressWarnings({"javadoc"})
class SignalOptimiserTest {
  private static Trace createTrace(Map<String, double[]> data) {
    final Trace trace = TraceSamples.of(data);
    trace.setRegions(new boolean[trace.size()], MaskUtils.filled(trace.size(), true));
    return trace;
  }

  private static Trace createTrace(long seed) {
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", TraceSamples.quietPlateau(seed));
    return createTrace(data);
  }

  @SeededTest
  void canFindQuietPlateau(RandomSeed seed) {
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", TraceSamples.quietPlateau(RngFactory.create(seed.get())));
    final Trace trace = createTrace(data);
    final OptimiserResult result = new SignalOptimiser(new OptimiserOptions()).optimise(trace);
    Assertions.assertFalse(result.isEmpty());
    final int[] lims = result.getLimits();
    Assertions.assertTrue(lims[0] >= 40 && lims[1] <= 90, () -> lims[0] + "-" + lims[1]);
    Assertions.assertTrue(result.getWidth() >= 40, () -> "Width " + result.getWidth());
    Assertions.assertEquals(lims[1] - lims[0], result.getWidth());
    Assertions.assertEquals(result.getWidth(), MaskUtils.count(result.getMask()));
    // Edge samples are not signal
    final int n = trace.size() - 2;
    Assertions.assertEquals(n - 5, result.getMeans().length);
    Assertions.assertEquals(n, result.getStds()[0].length);
    Assertions.assertFalse(trace.getDiagnostics().hasWarnings());
  }

  @Test
  void zeroWeightIgnoresAnalyte() {
    final UniformRandomProvider rng = TraceSamples.createRng(42);
    final double[] noise = new double[130];
    for (int i = 0; i < noise.length; i++) {
      noise[i] = rng.nextDouble() * 1000;
    }
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", TraceSamples.quietPlateau(5));
    data.put("B", noise);
    final Trace trace = createTrace(data);
    final OptimiserResult result =
        new SignalOptimiser(new OptimiserOptions().setWeights(1, 0)).optimise(trace);
    final int[] lims = result.getLimits();
    Assertions.assertTrue(lims[0] >= 40 && lims[1] <= 90, () -> lims[0] + "-" + lims[1]);
    Assertions.assertEquals(2, result.getAnalytes().size());
  }

  @Test
  void canOptimiseSelectedAnalytes() {
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", TraceSamples.quietPlateau(6));
    data.put("B", new double[130]);
    final Trace trace = createTrace(data);
    final OptimiserResult result =
        new SignalOptimiser(new OptimiserOptions().setAnalytes("A")).optimise(trace);
    Assertions.assertEquals(1, result.getAnalytes().size());
    Assertions.assertFalse(result.isEmpty());
  }

  @Test
  void tooFewSamplesIsEmpty() {
    final Map<String, double[]> data = new LinkedHashMap<>();
    data.put("A", new double[] {1, 2, 3, 4, 5, 6, 7});
    final Trace trace = createTrace(data);
    final OptimiserResult result = new SignalOptimiser(new OptimiserOptions()).optimise(trace);
    Assertions.assertTrue(result.isEmpty());
    Assertions.assertNull(result.getLimits());
    Assertions.assertEquals(0, MaskUtils.count(result.getMask()));
    Assertions.assertTrue(trace.getDiagnostics().getWarnings().get(0)
        .startsWith("Not enough samples to optimise"));
  }

  @Test
  void noQualifyingWindowIsEmpty() {
    final Trace trace = createTrace(7);
    final OptimiserResult result =
        new SignalOptimiser(new OptimiserOptions().setThresholds(-100, -100)).optimise(trace);
    Assertions.assertTrue(result.isEmpty());
    Assertions.assertEquals(-100, result.getMeanThreshold());
    Assertions.assertEquals(0, MaskUtils.count(result.getMask()));
    Assertions.assertTrue(result.getMeans().length > 0, "Surfaces are kept");
    Assertions.assertTrue(trace.getDiagnostics().hasWarnings());
  }

  @Test
  void invalidArgumentsThrow() {
    final Trace trace = createTrace(8);
    final SignalOptimiser optimiser = new SignalOptimiser(new OptimiserOptions());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> optimiser.optimise(trace, new boolean[3]));
    final SignalOptimiser weighted =
        new SignalOptimiser(new OptimiserOptions().setWeights(1, 2));
    Assertions.assertThrows(IllegalArgumentException.class, () -> weighted.optimise(trace));
    final SignalOptimiser unknown =
        new SignalOptimiser(new OptimiserOptions().setAnalytes("Xx"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> unknown.optimise(trace));
  }
}
