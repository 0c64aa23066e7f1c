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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.lang3.StringUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.filter.expression.Expression;
import uk.ac.sussex.gdsc.trace.filter.expression.ExpressionParser;
import uk.ac.sussex.gdsc.trace.filter.expression.InvalidExpressionException;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;

/**
 * Stores named boolean masks over the samples of a trace and combines them per analyte.
 *
 * <p>Each filter can be switched on or off for each analyte. The filters switched on for an
 * analyte are combined with a logical AND by {@link #make(String)}. Arbitrary combinations can be
 * created using a logical expression of filter names with {@link #makeFromKey(String)}.
 *
 * <p>Masks are copied on the way in and on the way out.
 */
public class FilterRegistry {
  /** The join used for the expression of all switched on filters. */
  private static final String AND = " & ";

  private final int size;
  private final List<String> analytes;
  private final Map<String, Integer> analyteIndex;

  /** The filter names in insertion order. */
  private final List<String> names = new ArrayList<>();
  private final Map<String, Filter> filters = new HashMap<>();
  private final Map<String, boolean[]> masks = new HashMap<>();
  /** The switches for each filter (rows, insertion order) and analyte (columns). */
  private final List<boolean[]> switches = new ArrayList<>();
  /** The last expression made for each analyte. */
  private final Map<String, String> keys = new HashMap<>();
  private int count;

  /**
   * Create an instance.
   *
   * @param size the number of samples in each mask
   * @param analytes the analytes
   */
  public FilterRegistry(int size, List<String> analytes) {
    ValidationUtils.checkArgument(size > 0, "Size must be positive: %d", size);
    this.size = size;
    this.analytes = Collections.unmodifiableList(new ArrayList<>(analytes));
    analyteIndex = new HashMap<>();
    for (int i = 0; i < this.analytes.size(); i++) {
      ValidationUtils.checkArgument(analyteIndex.put(this.analytes.get(i), i) == null,
          "Duplicate analyte: %s", this.analytes.get(i));
    }
  }

  /**
   * Gets the number of samples in each mask.
   *
   * @return the size
   */
  public int getSize() {
    return size;
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
   * Add a filter. The filter is switched on for all analytes.
   *
   * @param name the name
   * @param mask the mask
   * @param description the description
   * @param parameters the parameters used to create the mask
   * @return the filter
   * @throws DuplicateFilterException if the name is already present
   * @throws IllegalArgumentException if the name is not valid in an expression or the mask has the
   *         wrong length
   */
  public Filter add(String name, boolean[] mask, String description,
      Map<String, ?> parameters) {
    ValidationUtils.checkArgument(ExpressionParser.isValidName(name), "Invalid filter name: '%s'",
        name);
    if (mask.length != size) {
      throw new IllegalArgumentException(
          String.format("Filter %s mask length %d != %d", name, mask.length, size));
    }
    if (filters.containsKey(name)) {
      throw new DuplicateFilterException(name);
    }
    final Filter filter = new Filter(name, description, parameters, count++);
    names.add(name);
    filters.put(name, filter);
    masks.put(name, mask.clone());
    switches.add(MaskUtils.filled(analytes.size(), true));
    return filter;
  }

  /**
   * Remove the filter. The mask, metadata and switches are removed.
   *
   * @param name the name
   * @throws FilterNotFoundException if the name is not present
   */
  public void remove(String name) {
    final int index = names.indexOf(name);
    if (index < 0) {
      throw new FilterNotFoundException(name);
    }
    names.remove(index);
    switches.remove(index);
    filters.remove(name);
    masks.remove(name);
    // Drop cached expressions that refer to the filter
    keys.values().removeIf(key -> splitKey(key).contains(name));
  }

  /**
   * Remove all filters.
   */
  public void clear() {
    names.clear();
    switches.clear();
    filters.clear();
    masks.clear();
    keys.clear();
    count = 0;
  }

  /**
   * Remove all filters that are switched off for every analyte.
   */
  public void clean() {
    for (final String name : new ArrayList<>(names)) {
      final boolean[] row = switches.get(names.indexOf(name));
      if (MaskUtils.count(row) == 0) {
        remove(name);
      }
    }
  }

  /**
   * Switch on all filters whose name contains the text for the given analytes.
   *
   * @param text the text (null for all filters)
   * @param analytes the analytes (none for all analytes)
   * @throws IllegalArgumentException if an analyte is unknown
   */
  public void on(String text, String... analytes) {
    setSwitches(text, true, analytes);
  }

  /**
   * Switch off all filters whose name contains the text for the given analytes.
   *
   * @param text the text (null for all filters)
   * @param analytes the analytes (none for all analytes)
   * @throws IllegalArgumentException if an analyte is unknown
   */
  public void off(String text, String... analytes) {
    setSwitches(text, false, analytes);
  }

  private void setSwitches(String text, boolean value, String... analytes) {
    final int[] columns = analyteColumns(analytes);
    for (int i = 0; i < names.size(); i++) {
      if (text == null || names.get(i).contains(text)) {
        final boolean[] row = switches.get(i);
        for (final int j : columns) {
          row[j] = value;
        }
      }
    }
  }

  private int[] analyteColumns(String... analytes) {
    if (analytes == null || analytes.length == 0) {
      final int[] all = new int[this.analytes.size()];
      for (int i = 0; i < all.length; i++) {
        all[i] = i;
      }
      return all;
    }
    final int[] columns = new int[analytes.length];
    for (int i = 0; i < analytes.length; i++) {
      columns[i] = analyteIndex(analytes[i]);
    }
    return columns;
  }

  private int analyteIndex(String analyte) {
    final Integer index = analyteIndex.get(analyte);
    ValidationUtils.checkArgument(index != null, "Unknown analyte: %s", analyte);
    return index;
  }

  /**
   * Check if the filter is switched on for the analyte.
   *
   * @param name the name
   * @param analyte the analyte
   * @return true if on
   * @throws FilterNotFoundException if the name is not present
   */
  public boolean isOn(String name, String analyte) {
    final int index = names.indexOf(name);
    if (index < 0) {
      throw new FilterNotFoundException(name);
    }
    return switches.get(index)[analyteIndex(analyte)];
  }

  /**
   * Create the expression combining all filters switched on for the analyte. The filter names are
   * sorted and joined using {@code " & "}. If no filters are on the expression is empty.
   *
   * @param analyte the analyte
   * @return the expression
   */
  public String makeKey(String analyte) {
    final int column = analyteIndex(analyte);
    final TreeSet<String> on = new TreeSet<>();
    for (int i = 0; i < names.size(); i++) {
      if (switches.get(i)[column]) {
        on.add(names.get(i));
      }
    }
    return String.join(AND, on);
  }

  /**
   * Create the expression for each analyte from the filter switches.
   *
   * @param analytes the analytes (none for all analytes)
   * @return the expression for each analyte
   */
  public Map<String, String> makeKeyMap(String... analytes) {
    final Map<String, String> map = new LinkedHashMap<>();
    for (final int column : analyteColumns(analytes)) {
      final String analyte = this.analytes.get(column);
      map.put(analyte, makeKey(analyte));
    }
    return map;
  }

  /**
   * Make the mask for the analyte from the logical AND of all filters switched on for the
   * analyte. The expression used is cached for the analyte.
   *
   * @param analyte the analyte
   * @return the mask
   * @see #getKey(String)
   */
  public boolean[] make(String analyte) {
    final String key = makeKey(analyte);
    keys.put(analyte, key);
    return makeFromKey(key);
  }

  /**
   * Gets the expression last used by {@link #make(String)} for the analyte.
   *
   * @param analyte the analyte
   * @return the key (or null)
   */
  public String getKey(String analyte) {
    analyteIndex(analyte);
    return keys.get(analyte);
  }

  /**
   * Make the mask from a logical expression of filter names, e.g.
   * {@code (Filter_1 | Filter_2) & Filter_3}. A blank expression selects all samples.
   *
   * @param key the expression
   * @return the mask
   * @throws InvalidExpressionException if the expression is invalid
   */
  public boolean[] makeFromKey(String key) {
    if (StringUtils.isBlank(key)) {
      return MaskUtils.filled(size, true);
    }
    final Expression expression = ExpressionParser.parse(key, masks::containsKey);
    return expression.evaluate(name -> masks.get(name).clone());
  }

  /**
   * Get the mask for the analyte using the selector.
   *
   * @param selector the selector
   * @param analyte the analyte
   * @return the mask
   * @throws InvalidExpressionException if the expression is invalid or there is no expression for
   *         the analyte
   */
  public boolean[] grab(FilterSelector selector, String analyte) {
    ValidationUtils.checkNotNull(selector, "selector");
    switch (selector.getKind()) {
      case EXPRESSION:
        return makeFromKey(selector.getExpression());
      case PER_ANALYTE:
        final String key = selector.getExpressions().get(analyte);
        if (key == null) {
          throw new InvalidExpressionException("No filter expression for analyte " + analyte,
              analyte, -1);
        }
        return makeFromKey(key);
      case SWITCHES:
        return make(analyte);
      case NONE:
      default:
        return MaskUtils.filled(size, true);
    }
  }

  /**
   * Get the masks of the filters whose name contains the text.
   *
   * @param text the text
   * @param analyte the analyte (null for any); if specified only filters switched on for the
   *        analyte are returned
   * @return the masks in insertion order
   */
  public Map<String, boolean[]> getComponents(String text, String analyte) {
    final int column = analyte == null ? -1 : analyteIndex(analyte);
    final Map<String, boolean[]> map = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      final String name = names.get(i);
      if (name.contains(text) && (column < 0 || switches.get(i)[column])) {
        map.put(name, masks.get(name).clone());
      }
    }
    return map;
  }

  /**
   * Get a copy of the mask.
   *
   * @param name the name
   * @return the mask
   * @throws FilterNotFoundException if the name is not present
   */
  public boolean[] getMask(String name) {
    final boolean[] mask = masks.get(name);
    if (mask == null) {
      throw new FilterNotFoundException(name);
    }
    return mask.clone();
  }

  /**
   * Gets the filter metadata.
   *
   * @param name the name
   * @return the filter
   * @throws FilterNotFoundException if the name is not present
   */
  public Filter getFilter(String name) {
    final Filter filter = filters.get(name);
    if (filter == null) {
      throw new FilterNotFoundException(name);
    }
    return filter;
  }

  /**
   * Check if the filter is present.
   *
   * @param name the name
   * @return true if present
   */
  public boolean contains(String name) {
    return filters.containsKey(name);
  }

  /**
   * Gets the filter names in insertion order.
   *
   * @return the names
   */
  public List<String> getNames() {
    return Collections.unmodifiableList(new ArrayList<>(names));
  }

  /**
   * Gets the number of filters.
   *
   * @return the number of filters
   */
  public int getFilterCount() {
    return names.size();
  }

  /**
   * Gets the parameters of each filter in insertion order.
   *
   * @return the parameters
   */
  public Map<String, Map<String, Object>> getParameters() {
    final Map<String, Map<String, Object>> map = new LinkedHashMap<>();
    for (final String name : names) {
      map.put(name, filters.get(name).getParameters());
    }
    return map;
  }

  /**
   * Gets the description of all filters as {@code name: description} lines sorted by name.
   *
   * @return the info
   */
  public String getInfo() {
    final StringBuilder sb = new StringBuilder();
    for (final String name : new TreeSet<>(names)) {
      sb.append(filters.get(name)).append('\n');
    }
    return sb.toString();
  }

  /**
   * Gets the table of filter switches. Rows are filters sorted by name; columns are analytes.
   */
  @Override
  public String toString() {
    int pad = 11;
    for (final String name : names) {
      pad = Math.max(pad, name.length());
    }
    pad += 2;
    final int[] widths = new int[analytes.size()];
    final StringBuilder sb = new StringBuilder(StringUtils.rightPad("Filter Name", pad));
    for (int j = 0; j < widths.length; j++) {
      widths[j] = Math.max(7, analytes.get(j).length() + 1);
      sb.append(StringUtils.rightPad(analytes.get(j), widths[j]));
    }
    sb.append('\n');
    for (final String name : new TreeSet<>(names)) {
      final boolean[] row = switches.get(names.indexOf(name));
      sb.append(StringUtils.rightPad(name, pad));
      for (int j = 0; j < widths.length; j++) {
        sb.append(StringUtils.rightPad(row[j] ? "True" : "False", widths[j]));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static Set<String> splitKey(String key) {
    final Set<String> set = new TreeSet<>();
    for (final String name : StringUtils.splitByWholeSeparator(key, AND)) {
      set.add(name.trim());
    }
    return set;
  }
}
