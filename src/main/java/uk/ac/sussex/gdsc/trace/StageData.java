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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The values of all analytes at one processing stage. Analytes are held in insertion order.
 *
 * <p>Arrays are copied on the way in and on the way out.
 */
public class StageData {
  private final int length;
  private final Map<String, double[]> data;

  /**
   * Create an empty instance.
   *
   * @param length the length of each analyte array
   */
  public StageData(int length) {
    ValidationUtils.checkArgument(length > 0, "Length must be positive: %d", length);
    this.length = length;
    data = new LinkedHashMap<>();
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  private StageData(StageData source) {
    length = source.length;
    data = new LinkedHashMap<>();
    source.data.forEach((k, v) -> data.put(k, v.clone()));
  }

  /**
   * Copy the data.
   *
   * @return the copy
   */
  public StageData copy() {
    return new StageData(this);
  }

  /**
   * Gets the length of each analyte array.
   *
   * @return the length
   */
  public int getLength() {
    return length;
  }

  /**
   * Put the values for the analyte.
   *
   * @param analyte the analyte
   * @param values the values
   * @throws IllegalArgumentException if the values have the wrong length
   */
  public void put(String analyte, double[] values) {
    ValidationUtils.checkNotNull(analyte, "analyte");
    if (values.length != length) {
      throw new IllegalArgumentException(String.format("Analyte %s length %d != time length %d",
          analyte, values.length, length));
    }
    data.put(analyte, values.clone());
  }

  /**
   * Get a copy of the values for the analyte.
   *
   * @param analyte the analyte
   * @return the values
   * @throws IllegalArgumentException if the analyte is unknown
   */
  public double[] get(String analyte) {
    return getRef(analyte).clone();
  }

  /**
   * Get the values for the analyte without a copy.
   *
   * @param analyte the analyte
   * @return the values
   */
  double[] getRef(String analyte) {
    final double[] values = data.get(analyte);
    ValidationUtils.checkArgument(values != null, "Unknown analyte: %s", analyte);
    return values;
  }

  /**
   * Check if the analyte is present.
   *
   * @param analyte the analyte
   * @return true if present
   */
  public boolean contains(String analyte) {
    return data.containsKey(analyte);
  }

  /**
   * Gets the analytes in insertion order.
   *
   * @return the analytes
   */
  public List<String> getAnalytes() {
    return Collections.unmodifiableList(new ArrayList<>(data.keySet()));
  }
}
