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

package uk.ac.sussex.gdsc.trace.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The cluster label of each sample.
 */
public final class ClusterResult {
  /** The label of a sample that is not in any cluster. */
  public static final int NOISE = -1;

  private final int[] labels;
  private final boolean[] core;
  private final List<String> warnings;

  /**
   * Create an instance.
   *
   * @param labels the label of each sample ({@link #NOISE} for no cluster)
   * @param core the core sample flags (can be null)
   * @param warnings the warnings produced during clustering
   */
  public ClusterResult(int[] labels, boolean[] core, List<String> warnings) {
    ValidationUtils.checkArgument(core == null || core.length == labels.length,
        "Core length %d != labels length %d", core == null ? 0 : core.length, labels.length);
    this.labels = labels.clone();
    this.core = core == null ? null : core.clone();
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  /**
   * Create an instance with no core samples and no warnings.
   *
   * @param labels the labels
   */
  public ClusterResult(int[] labels) {
    this(labels, null, Collections.emptyList());
  }

  /**
   * Gets the number of samples.
   *
   * @return the size
   */
  public int size() {
    return labels.length;
  }

  /**
   * Gets a copy of the labels.
   *
   * @return the labels
   */
  public int[] getLabels() {
    return labels.clone();
  }

  /**
   * Gets the distinct labels in ascending order. This includes {@link #NOISE} if present.
   *
   * @return the labels
   */
  public int[] getUniqueLabels() {
    final TreeSet<Integer> set = new TreeSet<>();
    for (final int label : labels) {
      set.add(label);
    }
    return set.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Gets the number of clusters. Noise is not a cluster.
   *
   * @return the cluster count
   */
  public int getClusterCount() {
    final int[] unique = getUniqueLabels();
    return unique.length != 0 && unique[0] == NOISE ? unique.length - 1 : unique.length;
  }

  /**
   * Gets the mask of the samples with the label.
   *
   * @param label the label
   * @return the mask
   */
  public boolean[] getMask(int label) {
    final boolean[] mask = new boolean[labels.length];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = labels[i] == label;
    }
    return mask;
  }

  /**
   * Checks for core sample flags.
   *
   * @return true if core flags are available
   */
  public boolean hasCore() {
    return core != null;
  }

  /**
   * Gets a copy of the core sample flags.
   *
   * @return the core flags (or null)
   */
  public boolean[] getCore() {
    return core == null ? null : core.clone();
  }

  /**
   * Gets the warnings produced during clustering.
   *
   * @return the warnings
   */
  public List<String> getWarnings() {
    return warnings;
  }
}
