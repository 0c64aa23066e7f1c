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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.filter.FilterRegistry;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;
import uk.ac.sussex.gdsc.trace.utils.TraceMath;

/**
 * The time-resolved measurements of a set of analytes for one sample.
 *
 * <p>All analytes share the same time axis. The values of each processing {@link Stage} are held
 * separately. Processing reads a stage and writes a new stage which becomes the working stage.
 *
 * <p>Each sample is labelled as background, signal or transition. The labels are mutually
 * exclusive and jointly exhaustive. Contiguous runs of signal are numbered as segments from 1.
 */
public class Trace {
  private final String sample;
  private final double[] time;
  private final List<String> analytes;
  private final Map<Stage, StageData> stages = new EnumMap<>(Stage.class);
  private Stage workingStage;

  private boolean[] background;
  private boolean[] signal;
  private boolean[] transition;
  private int[] segments;
  private int segmentCount;

  private final FilterRegistry filters;
  private final DiagnosticLog diagnostics;
  private final Map<String, Object> despikeParameters = new LinkedHashMap<>();
  private final Map<String, Object> autorangeParameters = new LinkedHashMap<>();

  /**
   * Create an instance. The data is copied.
   *
   * @param sample the sample name
   * @param time the time of each sample
   * @param data the values of each analyte
   * @throws IllegalArgumentException if the time is empty, there are no analytes or an analyte
   *         has the wrong length
   */
  public Trace(String sample, double[] time, Map<String, double[]> data) {
    this.sample = ValidationUtils.checkNotNull(sample, "sample");
    ValidationUtils.checkArgument(time.length > 0, "Empty time axis for sample %s", sample);
    ValidationUtils.checkArgument(!data.isEmpty(), "No analytes for sample %s", sample);
    this.time = time.clone();
    final StageData raw = new StageData(time.length);
    data.forEach((analyte, values) -> {
      ValidationUtils.checkArgument(analyte != null, "Null analyte name for sample %s", sample);
      raw.put(analyte, values);
    });
    analytes = raw.getAnalytes();
    stages.put(Stage.RAW, raw);
    workingStage = Stage.RAW;

    background = new boolean[time.length];
    signal = new boolean[time.length];
    transition = MaskUtils.filled(time.length, true);
    segments = new int[time.length];

    filters = new FilterRegistry(time.length, analytes);
    diagnostics = new DiagnosticLog(sample);
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
   * Gets a copy of the time axis.
   *
   * @return the time
   */
  public double[] getTime() {
    return time.clone();
  }

  /**
   * Gets the time step between the first two samples.
   *
   * @return the time step (NaN if there is only one sample)
   */
  public double getTimeStep() {
    return time.length < 2 ? Double.NaN : time[1] - time[0];
  }

  /**
   * Gets the number of samples.
   *
   * @return the size
   */
  public int size() {
    return time.length;
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
   * Check the analyte is present.
   *
   * @param analyte the analyte
   * @return the analyte
   * @throws IllegalArgumentException if the analyte is unknown
   */
  public String checkAnalyte(String analyte) {
    ValidationUtils.checkArgument(analytes.contains(analyte), "Unknown analyte %s in sample %s",
        analyte, sample);
    return analyte;
  }

  /**
   * Check if the stage has been populated.
   *
   * @param stage the stage
   * @return true if populated
   */
  public boolean hasStage(Stage stage) {
    return stages.containsKey(stage);
  }

  /**
   * Gets a copy of the stage data.
   *
   * @param stage the stage
   * @return the data
   * @throws IllegalStateException if the stage has not been populated
   */
  public StageData getStageData(Stage stage) {
    return stage(stage).copy();
  }

  private StageData stage(Stage stage) {
    final StageData data = stages.get(stage);
    if (data == null) {
      throw new IllegalStateException("Stage " + stage + " has not been populated for " + sample);
    }
    return data;
  }

  /**
   * Set the stage data. The stage becomes the working stage.
   *
   * @param stage the stage
   * @param data the data
   * @throws IllegalArgumentException if the data does not hold the analytes of the trace
   */
  public void setStageData(Stage stage, StageData data) {
    ValidationUtils.checkNotNull(stage, "stage");
    ValidationUtils.checkArgument(data.getLength() == time.length,
        "Stage length %d != time length %d", data.getLength(), time.length);
    ValidationUtils.checkArgument(data.getAnalytes().equals(analytes), "Stage analytes %s != %s",
        data.getAnalytes(), analytes);
    stages.put(stage, data.copy());
    workingStage = stage;
  }

  /**
   * Gets the working stage.
   *
   * @return the working stage
   */
  public Stage getWorkingStage() {
    return workingStage;
  }

  /**
   * Sets the working stage.
   *
   * @param stage the new working stage
   * @throws IllegalStateException if the stage has not been populated
   */
  public void setWorkingStage(Stage stage) {
    stage(stage);
    workingStage = stage;
  }

  /**
   * Gets a copy of the values of the analyte at the working stage.
   *
   * @param analyte the analyte
   * @return the values
   */
  public double[] getValues(String analyte) {
    return getValues(workingStage, analyte);
  }

  /**
   * Gets a copy of the values of the analyte at the stage.
   *
   * @param stage the stage
   * @param analyte the analyte
   * @return the values
   * @throws IllegalStateException if the stage has not been populated
   * @throws IllegalArgumentException if the analyte is unknown
   */
  public double[] getValues(Stage stage, String analyte) {
    return stage(stage).get(checkAnalyte(analyte));
  }

  // Regions

  /**
   * Sets the background and signal regions. The first and last samples are cleared from both
   * masks. All other samples are transition. The signal segments are renumbered.
   *
   * @param background the background mask
   * @param signal the signal mask
   * @throws IllegalArgumentException if the masks have the wrong length or overlap
   */
  public void setRegions(boolean[] background, boolean[] signal) {
    ValidationUtils.checkArgument(background.length == time.length,
        "Background length %d != time length %d", background.length, time.length);
    ValidationUtils.checkArgument(signal.length == time.length,
        "Signal length %d != time length %d", signal.length, time.length);
    for (int i = 0; i < time.length; i++) {
      ValidationUtils.checkArgument(!(background[i] && signal[i]),
          "Sample %d is both background and signal", i);
    }
    this.background = background.clone();
    this.signal = signal.clone();
    RangeUtils.clearEdges(this.background);
    RangeUtils.clearEdges(this.signal);
    transition = MaskUtils.neither(this.background, this.signal);
    segments = RangeUtils.enumerate(this.signal, 0);
    segmentCount = RangeUtils.runs(this.signal).size();
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
    return RangeUtils.maskToRanges(time, background);
  }

  /**
   * Gets the signal ranges.
   *
   * @return the signal ranges
   */
  public List<TimeRange> getSignalRanges() {
    return RangeUtils.maskToRanges(time, signal);
  }

  /**
   * Gets the transition ranges.
   *
   * @return the transition ranges
   */
  public List<TimeRange> getTransitionRanges() {
    return RangeUtils.maskToRanges(time, transition);
  }

  /**
   * Gets a copy of the segment number of each sample. Non-signal samples are 0.
   *
   * @return the segment numbers
   */
  public int[] getSegmentNumbers() {
    return segments.clone();
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
   * Mark the samples strictly inside the time range as background. They are removed from the
   * signal.
   *
   * @param start the start
   * @param end the end
   */
  public void addBackgroundRange(double start, double end) {
    final boolean[] add = RangeUtils.rangesToMask(time,
        Collections.singletonList(new TimeRange(start, end)));
    final boolean[] bkg = MaskUtils.orInPlace(background.clone(), add);
    final boolean[] sig = MaskUtils.andInPlace(signal.clone(), MaskUtils.notInPlace(add));
    setRegions(bkg, sig);
  }

  /**
   * Mark the samples strictly inside the time range as signal. They are removed from the
   * background.
   *
   * @param start the start
   * @param end the end
   */
  public void addSignalRange(double start, double end) {
    final boolean[] add = RangeUtils.rangesToMask(time,
        Collections.singletonList(new TimeRange(start, end)));
    final boolean[] sig = MaskUtils.orInPlace(signal.clone(), add);
    final boolean[] bkg = MaskUtils.andInPlace(background.clone(), MaskUtils.notInPlace(add));
    setRegions(bkg, sig);
  }

  /**
   * Rebuild the regions from range lists. Samples in both lists are signal.
   *
   * @param backgroundRanges the background ranges
   * @param signalRanges the signal ranges
   */
  public void applyRanges(List<TimeRange> backgroundRanges, List<TimeRange> signalRanges) {
    final boolean[] sig = RangeUtils.rangesToMask(time, signalRanges);
    final boolean[] bkg = MaskUtils.andInPlace(RangeUtils.rangesToMask(time, backgroundRanges),
        MaskUtils.notInPlace(sig.clone()));
    setRegions(bkg, sig);
  }

  // Derived stages

  /**
   * Gets the stage of measured data: {@link Stage#DESPIKED} if populated, otherwise
   * {@link Stage#RAW}.
   *
   * @return the stage
   */
  public Stage getMeasuredStage() {
    return hasStage(Stage.DESPIKED) ? Stage.DESPIKED : Stage.RAW;
  }

  /**
   * Separate the measured data into the {@link Stage#SIGNAL} and {@link Stage#BACKGROUND} stages.
   * Samples outside each region are NaN. The signal becomes the working stage.
   */
  public void separate() {
    separate(getMeasuredStage());
  }

  /**
   * Separate the source stage into the {@link Stage#SIGNAL} and {@link Stage#BACKGROUND} stages.
   * Samples outside each region are NaN. The signal becomes the working stage.
   *
   * @param source the source stage
   * @throws IllegalArgumentException if the source is not a measured stage
   */
  public void separate(Stage source) {
    ValidationUtils.checkArgument(source == Stage.RAW || source == Stage.DESPIKED,
        "Cannot separate stage %s", source);
    final StageData data = stage(source);
    final StageData sig = new StageData(time.length);
    final StageData bkg = new StageData(time.length);
    for (final String analyte : analytes) {
      final double[] values = data.getRef(analyte);
      sig.put(analyte, masked(values, signal));
      bkg.put(analyte, masked(values, background));
    }
    stages.put(Stage.BACKGROUND, bkg);
    stages.put(Stage.SIGNAL, sig);
    workingStage = Stage.SIGNAL;
  }

  private static double[] masked(double[] values, boolean[] mask) {
    final double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = mask[i] ? values[i] : Double.NaN;
    }
    return result;
  }

  /**
   * Subtract a constant background from the signal. The measured data is separated into signal
   * and background and the mean of the background of each analyte is subtracted from the signal.
   * The result is stored in {@link Stage#BACKGROUND_SUBTRACTED} which becomes the working stage.
   */
  public void backgroundCorrect() {
    separate();
    final StageData sig = stage(Stage.SIGNAL);
    final StageData bkg = stage(Stage.BACKGROUND);
    final StageData result = new StageData(time.length);
    for (final String analyte : analytes) {
      final double mean = TraceMath.nanMean(bkg.getRef(analyte));
      if (Double.isNaN(mean)) {
        diagnostics.warning(Trace.class, "No background for " + analyte);
      }
      final double[] values = sig.get(analyte);
      for (int i = 0; i < values.length; i++) {
        values[i] -= mean;
      }
      result.put(analyte, values);
    }
    stages.put(Stage.BACKGROUND_SUBTRACTED, result);
    workingStage = Stage.BACKGROUND_SUBTRACTED;
  }

  /**
   * Divide all analytes of the background subtracted data by the denominator analyte. The result
   * is stored in {@link Stage#RATIOS} which becomes the working stage.
   *
   * @param denominator the denominator analyte
   * @throws IllegalStateException if the background has not been subtracted
   */
  public void ratio(String denominator) {
    ratio(denominator, Stage.BACKGROUND_SUBTRACTED);
  }

  /**
   * Divide all analytes of the source stage by the denominator analyte. The result is stored in
   * {@link Stage#RATIOS} which becomes the working stage.
   *
   * @param denominator the denominator analyte
   * @param source the source stage
   * @throws IllegalStateException if the source stage has not been populated
   */
  public void ratio(String denominator, Stage source) {
    checkAnalyte(denominator);
    final StageData data = stage(source);
    final double[] d = data.getRef(denominator);
    final StageData result = new StageData(time.length);
    for (final String analyte : analytes) {
      final double[] values = data.get(analyte);
      for (int i = 0; i < values.length; i++) {
        values[i] /= d[i];
      }
      result.put(analyte, values);
    }
    stages.put(Stage.RATIOS, result);
    workingStage = Stage.RATIOS;
  }

  // Processing records

  /**
   * Gets the filter registry.
   *
   * @return the filters
   */
  public FilterRegistry getFilters() {
    return filters;
  }

  /**
   * Gets the diagnostic log.
   *
   * @return the diagnostics
   */
  public DiagnosticLog getDiagnostics() {
    return diagnostics;
  }

  /**
   * Gets the parameters of the last despike.
   *
   * @return the despike parameters
   */
  public Map<String, Object> getDespikeParameters() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(despikeParameters));
  }

  /**
   * Sets the parameters of the last despike.
   *
   * @param parameters the parameters
   */
  public void setDespikeParameters(Map<String, ?> parameters) {
    despikeParameters.clear();
    despikeParameters.putAll(parameters);
  }

  /**
   * Gets the parameters of the last autorange.
   *
   * @return the autorange parameters
   */
  public Map<String, Object> getAutorangeParameters() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(autorangeParameters));
  }

  /**
   * Sets the parameters of the last autorange.
   *
   * @param parameters the parameters
   */
  public void setAutorangeParameters(Map<String, ?> parameters) {
    autorangeParameters.clear();
    autorangeParameters.putAll(parameters);
  }

  /**
   * Gets all the processing parameters of the trace: the sample name, the despike and autorange
   * parameters, the parameters of each filter, the filter sequence and the filter expression of
   * each analyte.
   *
   * @return the parameters
   */
  public Map<String, Object> getParameters() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("sample", sample);
    map.put("despike", getDespikeParameters());
    map.put("autorange", getAutorangeParameters());
    map.put("filter_params", filters.getParameters());
    map.put("filter_sequence", new ArrayList<>(filters.getNames()));
    map.put("filter_keys", filters.makeKeyMap());
    return map;
  }

  @Override
  public String toString() {
    return sample + " " + analytes + " (" + time.length + " samples, " + segmentCount
        + " segments)";
  }
}
