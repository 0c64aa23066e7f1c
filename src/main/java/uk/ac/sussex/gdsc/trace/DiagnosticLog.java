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
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Accumulates the diagnostic messages of processing a trace. Each message is also passed to the
 * {@link Logger} of the class that raised it.
 */
public class DiagnosticLog {
  private final String name;
  private final List<Entry> entries = new ArrayList<>();

  /**
   * A diagnostic message.
   */
  public static final class Entry {
    private final Level level;
    private final String source;
    private final String message;

    Entry(Level level, String source, String message) {
      this.level = level;
      this.source = source;
      this.message = message;
    }

    /**
     * Gets the level.
     *
     * @return the level
     */
    public Level getLevel() {
      return level;
    }

    /**
     * Gets the name of the class that raised the message.
     *
     * @return the source
     */
    public String getSource() {
      return source;
    }

    /**
     * Gets the message.
     *
     * @return the message
     */
    public String getMessage() {
      return message;
    }

    @Override
    public String toString() {
      return level + ": " + message;
    }
  }

  /**
   * Create an instance.
   *
   * @param name the name prefixed to logged messages (e.g. the sample name)
   */
  public DiagnosticLog(String name) {
    this.name = name;
  }

  /**
   * Record the message.
   *
   * @param source the class raising the message
   * @param level the level
   * @param message the message
   */
  public void log(Class<?> source, Level level, String message) {
    synchronized (entries) {
      entries.add(new Entry(level, source.getName(), message));
    }
    Logger.getLogger(source.getName()).log(level, () -> name + ": " + message);
  }

  /**
   * Record a warning.
   *
   * @param source the class raising the message
   * @param message the message
   */
  public void warning(Class<?> source, String message) {
    log(source, Level.WARNING, message);
  }

  /**
   * Record a fine detail message.
   *
   * @param source the class raising the message
   * @param message the message
   */
  public void fine(Class<?> source, String message) {
    log(source, Level.FINE, message);
  }

  /**
   * Gets the entries.
   *
   * @return the entries
   */
  public List<Entry> getEntries() {
    synchronized (entries) {
      return Collections.unmodifiableList(new ArrayList<>(entries));
    }
  }

  /**
   * Gets the warning messages.
   *
   * @return the warnings
   */
  public List<String> getWarnings() {
    return getEntries().stream().filter(e -> e.getLevel() == Level.WARNING)
        .map(Entry::getMessage).collect(Collectors.toList());
  }

  /**
   * Check for warnings.
   *
   * @return true if a warning has been recorded
   */
  public boolean hasWarnings() {
    return !getWarnings().isEmpty();
  }

  /**
   * Remove all entries.
   */
  public void clear() {
    synchronized (entries) {
      entries.clear();
    }
  }
}
