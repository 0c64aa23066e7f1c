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

import java.util.Collections;
import java.util.List;
import uk.ac.sussex.gdsc.trace.TimeRange;
import uk.ac.sussex.gdsc.trace.Trace;

/**
 * The result of the {@link Autorange}.
 */
public final class AutorangeResult {
  private final String analyte;
  private final double threshold;
  private final boolean[] background;
  private final boolean[] signal;
  private final boolean[] transition;
  private final List<TimeRange> backgroundRanges;
  private final List<TimeRange> signalRanges;
  private final List<TimeRange> transitionRanges;
  private final int[] segmentNumbers;
  private final int segmentCount;
  private final List<Transition> transitions;
  private final int failedFits;
  private final int corrections;

  /**
   * Create an instance from the regions of the trace.
   *
   * @param trace the trace
   * @param analyte the target analyte
   * @param threshold the background threshold
   * @param transitions the fitted transitions
   * @param failedFits the number of transitions that could not be fitted
   * @param corrections the number of background boundaries removed by the safety pass
   */
  AutorangeResult(Trace trace, String analyte, double threshold, List<Transition> transitions,
      int failedFits, int corrections) {
    this.analyte = analyte;
    this.threshold = threshold;
    background = trace.getBackground();
    signal = trace.getSignal();
    transition = trace.getTransition();
    backgroundRanges = Collections.unmodifiableList(trace.getBackgroundRanges());
    signalRanges = Collections.unmodifiableList(trace.getSignalRanges());
    transitionRanges = Collections.unmodifiableList(trace.getTransitionRanges());
    segmentNumbers = trace.getSegmentNumbers();
    segmentCount = trace.getSegmentCount();
    this.transitions = Collections.unmodifiableList(transitions);
    this.failedFits = failedFits;
    this.corrections = corrections;
  }

  /**
   * Gets the target analyte.
   *
   * @return the analyte
   */
  public String getAnalyte() {
    return analyte;
  }

  /**
   * Gets the background threshold.
   *
   * @return the threshold (NaN if the data has a single distribution)
   */
  public double getThreshold() {
    return threshold;
  }

  /**
   * Gets a copy of the background mask.
   *
   * @return the background
   */
  public boolean[] getBackground() {
    return background.clone();
  }

  /**
   * Gets a copy of the signal mask.
   *
   * @return the signal
   */
  public boolean[] getSignal() {
    return signal.clone();
  }

  /**
   * Gets a copy of the transition mask.
   *
   * @return the transition
   */
  public boolean[] getTransition() {
    return transition.clone();
  }

  /**
   * Gets the background ranges.
   *
   * @return the background ranges
   */
  public List<TimeRange> getBackgroundRanges() {
    return backgroundRanges;
  }

  /**
   * Gets the signal ranges.
   *
   * @return the signal ranges
   */
  public List<TimeRange> getSignalRanges() {
    return signalRanges;
  }

  /**
   * Gets the transition ranges.
   *
   * @return the transition ranges
   */
  public List<TimeRange> getTransitionRanges() {
    return transitionRanges;
  }

  /**
   * Gets a copy of the segment numbers.
   *
   * @return the segment numbers
   */
  public int[] getSegmentNumbers() {
    return segmentNumbers.clone();
  }

  /**
   * Gets the number of signal segments.
   *
   * @return the segment count
   */
  public int getSegmentCount() {
    return segmentCount;
  }

  /**
   * Gets the fitted transitions.
   *
   * @return the transitions
   */
  public List<Transition> getTransitions() {
    return transitions;
  }

  /**
   * Gets the number of transitions that could not be fitted.
   *
   * @return the failed fits
   */
  public int getFailedFits() {
    return failedFits;
  }

  /**
   * Gets the number of background boundaries removed by the safety pass.
   *
   * @return the corrections
   */
  public int getCorrections() {
    return corrections;
  }
}
