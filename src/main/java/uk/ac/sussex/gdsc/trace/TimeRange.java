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

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;


/**
 * An open interval of time {@code (start, end)}.
 */
public final class TimeRange {
  private final double start;
  private final double end;

  /**
   * Create an instance.
   *
   * @param start the start
   * @param end the end
   * @throws IllegalArgumentException if the end is below the start or either bound is NaN
   */
  public TimeRange(double start, double end) {
    ValidationUtils.checkArgument(start <= end, "Invalid time range: (%s, %s)", start, end);
    this.start = start;
    this.end = end;
  }

  /**
   * Gets the start.
   *
   * @return the start
   */
  public double getStart() {
    return start;
  }

  /**
   * Gets the end.
   *
   * @return the end
   */
  public double getEnd() {
    return end;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public double getWidth() {
    return end - start;
  }

  /**
   * Check if the time is strictly inside the range.
   *
   * @param time the time
   * @return true if inside
   */
  public boolean contains(double time) {
    return time > start && time < end;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TimeRange)) {
      return false;
    }
    final TimeRange other = (TimeRange) obj;
    return Double.compare(start, other.start) == 0 && Double.compare(end, other.end) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(start) + Double.hashCode(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}
