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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.trace.Trace;
import uk.ac.sussex.gdsc.trace.utils.MaskUtils;
import uk.ac.sussex.gdsc.trace.utils.RollingWindow;

/**
 * Create a filter that removes samples where two analytes are locally correlated.
 *
 * <p>The Pearson correlation is computed in a rolling window. A window is correlated when the
 * absolute correlation is above the r threshold and the two-sided p-value is below the p
 * threshold. The filter keeps the samples that are not correlated. It is switched on for the y
 * analyte only.
 */
public class CorrelationFilter implements FilterGenerator {
  private final String xanalyte;
  private final String yanalyte;
  private final int window;
  private double rthreshold = 0.9;
  private double pthreshold = 0.05;
  private FilterSelector selector = FilterSelector.switches();

  /**
   * Create an instance.
   *
   * @param xanalyte the x analyte
   * @param yanalyte the y analyte
   * @param window the window (an even window is increased by 1)
   * @throws IllegalArgumentException if the window is less than 2
   */
  public CorrelationFilter(String xanalyte, String yanalyte, int window) {
    this.xanalyte = ValidationUtils.checkNotNull(xanalyte, "xanalyte");
    this.yanalyte = ValidationUtils.checkNotNull(yanalyte, "yanalyte");
    ValidationUtils.checkArgument(window >= 2, "Correlation window must be at least 2: %d", window);
    this.window = (window & 1) == 0 ? window + 1 : window;
  }

  /**
   * Gets the window. This is odd.
   *
   * @return the window
   */
  public int getWindow() {
    return window;
  }

  /**
   * Sets the threshold for the absolute correlation coefficient.
   *
   * @param rthreshold the new r threshold
   * @return this
   */
  public CorrelationFilter setRThreshold(double rthreshold) {
    ValidationUtils.checkArgument(rthreshold >= 0 && rthreshold <= 1,
        "R threshold not in [0, 1]: %s", rthreshold);
    this.rthreshold = rthreshold;
    return this;
  }

  /**
   * Sets the threshold for the p-value of the correlation.
   *
   * @param pthreshold the new p threshold
   * @return this
   */
  public CorrelationFilter setPThreshold(double pthreshold) {
    ValidationUtils.checkArgument(pthreshold >= 0 && pthreshold <= 1,
        "P threshold not in [0, 1]: %s", pthreshold);
    this.pthreshold = pthreshold;
    return this;
  }

  /**
   * Sets the selector for the samples to consider. Samples outside the selection are treated as
   * missing. The default uses the current filter switches.
   *
   * @param selector the new selector
   * @return this
   */
  public CorrelationFilter setSelector(FilterSelector selector) {
    this.selector = ValidationUtils.checkNotNull(selector, "selector");
    return this;
  }

  /**
   * Gets the filter name.
   *
   * @return the name
   */
  public String getName() {
    return xanalyte + "-" + yanalyte + "_corr";
  }

  @Override
  public List<String> apply(Trace trace) {
    trace.checkAnalyte(xanalyte);
    trace.checkAnalyte(yanalyte);
    final FilterRegistry filters = trace.getFilters();
    final boolean[] ind = filters.grab(selector, xanalyte);
    MaskUtils.andInPlace(ind, filters.grab(selector, yanalyte));
    final double[] x = trace.getValues(xanalyte);
    final double[] y = trace.getValues(yanalyte);
    for (int i = 0; i < ind.length; i++) {
      if (!ind[i]) {
        x[i] = Double.NaN;
        y[i] = Double.NaN;
      }
    }

    final double[][] rp = correlation(x, y, window);
    final double[] r = rp[0];
    final double[] p = rp[1];
    final boolean[] mask = new boolean[x.length];
    for (int i = 0; i < mask.length; i++) {
      // NaN comparisons are false: missing windows are not correlated
      mask[i] = !(Math.abs(r[i]) > rthreshold && p[i] < pthreshold);
    }

    final Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("x_analyte", xanalyte);
    parameters.put("y_analyte", yanalyte);
    parameters.put("window", window);
    parameters.put("r_threshold", rthreshold);
    parameters.put("p_threshold", pthreshold);
    parameters.put("filt", selector.toString());
    final String name = getName();
    filters.add(name, mask, xanalyte + " vs. " + yanalyte + " correlation filter.", parameters);
    filters.off(name);
    filters.on(name, yanalyte);
    return Collections.singletonList(name);
  }

  /**
   * Compute the rolling Pearson correlation and its two-sided p-value. Windows containing a
   * non-finite value and incomplete windows at the ends are NaN.
   *
   * @param x the x values
   * @param y the y values
   * @param window the window (odd)
   * @return {r, p}
   * @throws IllegalArgumentException if the window is larger than the data
   */
  public static double[][] correlation(double[] x, double[] y, int window) {
    ValidationUtils.checkArgument(x.length == y.length, "Length mismatch: %d != %d", x.length,
        y.length);
    final int w = RollingWindow.oddWidth(window, x.length);
    ValidationUtils.checkArgument(w >= 3, "Correlation window must be at least 3: %d", w);
    final int half = w / 2;
    final double[] r = new double[x.length];
    final double[] p = new double[x.length];
    Arrays.fill(r, Double.NaN);
    Arrays.fill(p, Double.NaN);
    final PearsonsCorrelation pearson = new PearsonsCorrelation();
    final TDistribution t = new TDistribution(null, w - 2.0);
    for (int i = half; i < x.length - half; i++) {
      final double[] xw = Arrays.copyOfRange(x, i - half, i + half + 1);
      final double[] yw = Arrays.copyOfRange(y, i - half, i + half + 1);
      if (!allFinite(xw) || !allFinite(yw)) {
        continue;
      }
      final double ri = pearson.correlation(xw, yw);
      r[i] = ri;
      if (Math.abs(ri) >= 1) {
        p[i] = 0;
      } else if (!Double.isNaN(ri)) {
        final double ti = Math.abs(ri) * Math.sqrt((w - 2) / (1 - ri * ri));
        p[i] = 2 * (1 - t.cumulativeProbability(ti));
      }
    }
    return new double[][] {r, p};
  }

  private static boolean allFinite(double[] values) {
    for (final double v : values) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }
}
