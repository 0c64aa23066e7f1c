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
import java.util.Map;

/**
 * Immutable metadata of a named filter held in a {@link FilterRegistry}.
 */
public final class Filter {
  private final String name;
  private final String description;
  private final Map<String, Object> parameters;
  private final int index;

  /**
   * Create an instance.
   *
   * @param name the name
   * @param description the description
   * @param parameters the parameters used to create the filter
   * @param index the insertion index
   */
  Filter(String name, String description, Map<String, ?> parameters, int index) {
    this.name = name;
    this.description = description == null ? "" : description;
    this.parameters = parameters == null ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.index = index;
  }

  /**
   * Gets the name.
   *
   * @return the name
   */
  public String getName() {
    return name;
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
   * Gets the parameters used to create the filter.
   *
   * @return the parameters
   */
  public Map<String, Object> getParameters() {
    return parameters;
  }

  /**
   * Gets the insertion index. This increases with each filter added to the registry and is not
   * reused after removal.
   *
   * @return the index
   */
  public int getIndex() {
    return index;
  }

  @Override
  public String toString() {
    return name + ": " + description;
  }
}
