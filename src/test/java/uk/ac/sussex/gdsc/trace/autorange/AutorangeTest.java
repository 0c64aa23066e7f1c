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

package uk.ac.sussex.gdsc.trace.autorange;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.ac.sussex.gdsc.trace.TimeRange;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.TraceSamples;

@SuppressWarnings({"javadoc"})
class AutorangeTest {
  @ParameterizedTest
  @ValueSource(longs = {1, 42, 789})
  void canFindThreeAblations(long seed) {
    final Trace trace = TraceSamples.plateaus(seed);
    final AutorangeResult result = new Autorange(new AutorangeOptions()).run(trace);

    Assertions.assertEquals(TraceSamples.TARGET, result.getAnalyte());
    Assertions.assertEquals(3, result.getSegmentCount(), "Segments");
    Assertions.assertEquals(3, trace.getSegmentCount(), "Trace segments");
    Assertions.assertEquals(6, result.getTransitions().size(), "Transitions");
    Assertions.assertEquals(0, result.getFailedFits(), "Failed fits");
    Assertions.assertTrue(result.getThreshold() > 100 && result.getThreshold() < 10000,
        () -> "Threshold " + result.getThreshold());

    final boolean[] bkg = result.getBackground();
    final boolean[] sig = result.getSignal();
    final boolean[] trn = result.getTransition();
    for (int i = 0; i < bkg.length; i++) {
      Assertions.assertFalse(bkg[i] && sig[i], "Background and signal overlap");
      Assertions.assertTrue(bkg[i] ^ sig[i] ^ trn[i], "Regions are not exclusive");
    }
    Assertions.assertTrue(trn[0] && trn[bkg.length - 1], "Edges are transition");

    // Each ablation is signal at the centre and background lies between them
    final int[] segments = result.getSegmentNumbers();
    for (int k = 0; k < 3; k++) {
      final double[] p = TraceSamples.PLATEAUS[k];
      final int centre = (int) ((p[0] + p[1]) / 2);
      Assertions.assertTrue(sig[centre], "Plateau centre");
      Assertions.assertEquals(k + 1, segments[centre], "Segment number");
      // The ramps are removed
      Assertions.assertFalse(sig[(int) p[0]] || bkg[(int) p[0]], "Ramp up");
      Assertions.assertFalse(sig[(int) p[1]] || bkg[(int) p[1]], "Ramp down");
    }
    Assertions.assertTrue(bkg[50] && bkg[250] && bkg[450] && bkg[650], "Background");

    for (final TimeRange range : result.getSignalRanges()) {
      Assertions.assertTrue(range.getWidth() > 50, () -> "Signal range " + range);
    }
    Assertions.assertEquals(TraceSamples.TARGET, trace.getAutorangeParameters().get("analyte"));
  }

  @Test
  void singleDistributionIsAllBackground() {
    final double[] values = new double[100];
    Arrays.fill(values, 500);
    values[10] = Double.NaN;
    final Trace trace = TraceSamples.of("A", values);
    final AutorangeResult result = new Autorange(new AutorangeOptions()).run(trace);
    Assertions.assertTrue(Double.isNaN(result.getThreshold()));
    Assertions.assertEquals(0, result.getSegmentCount());
    final boolean[] bkg = result.getBackground();
    Assertions.assertFalse(bkg[10], "Missing sample");
    Assertions.assertTrue(bkg[50]);
    Assertions.assertTrue(trace.getDiagnostics().hasWarnings());
  }

  @Test
  void runThrowsWithUnknownAnalyte() {
    final Trace trace = TraceSamples.plateaus(1);
    final Autorange autorange = new Autorange(new AutorangeOptions().setAnalyte("Xx"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> autorange.run(trace));
  }

  @Test
  void optionsAreValidated() {
    final AutorangeOptions options = new AutorangeOptions();
    Assertions.assertThrows(IllegalArgumentException.class, () -> options.setConfidence(0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> options.setConfidence(1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> options.setGradientWindow(1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> options.setBins(2));
    Assertions.assertThrows(IllegalArgumentException.class, () -> options.setSafetyMargin(-1));
    final AutorangeOptions copy = options.setTransitionMultiples(1, 2).copy();
    Assertions.assertEquals(1, copy.getLowerMultiple());
    Assertions.assertEquals(2, copy.getUpperMultiple());
  }

  @Test
  void transitionMultiplesWidenTheTransition() {
    final Trace trace1 = TraceSamples.plateaus(7);
    final Trace trace2 = TraceSamples.plateaus(7);
    final AutorangeResult r1 = new Autorange(new AutorangeOptions()).run(trace1);
    final AutorangeResult r2 =
        new Autorange(new AutorangeOptions().setTransitionMultiples(2, 2)).run(trace2);
    final Transition t1 = r1.getTransitions().get(0);
    final Transition t2 = r2.getTransitions().get(0);
    Assertions.assertEquals(t1.getCentre(), t2.getCentre(), 1e-10);
    Assertions.assertEquals(t1.getStart() - 2 * t1.getSigma(), t2.getStart(), 1e-8);
    Assertions.assertEquals(t1.getEnd() + 2 * t1.getSigma(), t2.getEnd(), 1e-8);
  }

  @Test
  void missingValuesDoNotCreateTransitions() {
    final Trace clean = TraceSamples.plateaus(1);
    final Map<String, double[]> data = new LinkedHashMap<>();
    for (final String analyte : clean.getAnalytes()) {
      final double[] values = clean.getValues(analyte);
      values[50] = Double.NaN;
      values[250] = Double.NaN;
      data.put(analyte, values);
    }
    final Trace trace = new Trace("missing", clean.getTime(), data);
    final AutorangeResult expected = new Autorange(new AutorangeOptions()).run(clean);
    final AutorangeResult result = new Autorange(new AutorangeOptions()).run(trace);

    Assertions.assertEquals(0, result.getFailedFits(), "Failed fits");
    Assertions.assertEquals(expected.getCorrections(), result.getCorrections(), "Corrections");
    Assertions.assertEquals(3, result.getSegmentCount(), "Segments");
    Assertions.assertEquals(expected.getTransitions().size(), result.getTransitions().size());
    for (int i = 0; i < expected.getTransitions().size(); i++) {
      Assertions.assertEquals(expected.getTransitions().get(i).getCentre(),
          result.getTransitions().get(i).getCentre(), 0.5, "Transition centre");
    }
    for (final String warning : trace.getDiagnostics().getWarnings()) {
      Assertions.assertFalse(warning.contains("Failed to fit"), warning);
    }
    final boolean[] bkg = result.getBackground();
    Assertions.assertFalse(bkg[50] || bkg[250], "Missing samples");
    Assertions.assertTrue(bkg[49] && bkg[51] && bkg[249] && bkg[251], "Background");
  }

  @Test
  void failedFitsAreCountedAndLeaveTheTransition() {
    final Trace trace = TraceSamples.plateaus(1);
    // A data window too small to fit any peak
    final AutorangeResult result =
        new Autorange(new AutorangeOptions().setWindow(1)).run(trace);

    Assertions.assertEquals(6, result.getFailedFits(), "Failed fits");
    Assertions.assertTrue(result.getTransitions().isEmpty(), "Transitions");
    Assertions.assertEquals(0, result.getCorrections(), "Corrections");
    Assertions.assertEquals(3, result.getSegmentCount(), "Segments");
    final List<String> warnings = trace.getDiagnostics().getWarnings();
    Assertions.assertEquals(6, warnings.size(), "Warnings");
    for (final String warning : warnings) {
      Assertions.assertTrue(warning.startsWith("Failed to fit the transition"), warning);
    }
    // Nothing is removed between the edges
    final boolean[] bkg = result.getBackground();
    final boolean[] sig = result.getSignal();
    for (int i = 1; i < bkg.length - 1; i++) {
      Assertions.assertTrue(bkg[i] ^ sig[i], "Sample is background or signal");
    }
  }

  @Test
  void safetyPassRemovesBackgroundNextToSignal() {
    final int n = 30;
    final double[] time = new double[n];
    final double[] values = new double[n];
    final boolean[] bkg = new boolean[n];
    final boolean[] sig = new boolean[n];
    for (int i = 0; i < n; i++) {
      time[i] = i;
      values[i] = i;
      bkg[i] = (i >= 1 && i <= 9) || (i >= 20 && i <= 28);
      sig[i] = i >= 13 && i <= 19;
    }
    // The only transition is 10-12 with width 3. The background at 20 touches the signal.
    Assertions.assertEquals(1, Autorange.safetyPass(time, values, bkg, sig, 0.3));
    for (int i = 0; i < n; i++) {
      final boolean eb = (i >= 1 && i <= 9) || (i >= 22 && i <= 28);
      final boolean es = i >= 13 && i <= 17;
      Assertions.assertEquals(eb, bkg[i], "Background");
      Assertions.assertEquals(es, sig[i], "Signal");
    }
  }

  @Test
  void safetyPassIgnoresMissingValues() {
    final int n = 30;
    final double[] time = new double[n];
    final double[] values = new double[n];
    final boolean[] bkg = new boolean[n];
    final boolean[] sig = new boolean[n];
    for (int i = 0; i < n; i++) {
      time[i] = i;
      values[i] = i;
      bkg[i] = i >= 1 && i <= 14;
      sig[i] = i >= 16 && i <= 28;
    }
    // A missing sample between background and signal is not a transition
    values[15] = Double.NaN;
    Assertions.assertEquals(0, Autorange.safetyPass(time, values, bkg, sig, 0.3));
    Assertions.assertTrue(bkg[14] && sig[16]);
  }
}
