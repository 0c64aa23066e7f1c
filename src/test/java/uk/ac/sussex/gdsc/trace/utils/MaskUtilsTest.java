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

package uk.ac.sussex.gdsc.trace.utils;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class MaskUtilsTest {
  @Test
  void canCombineMasks() {
    final boolean[] a = {true, true, false, false};
    final boolean[] b = {true, false, true, false};
    Assertions.assertArrayEquals(new boolean[] {true, false, false, false},
        MaskUtils.andInPlace(a.clone(), b), "and");
    Assertions.assertArrayEquals(new boolean[] {true, true, true, false},
        MaskUtils.orInPlace(a.clone(), b), "or");
    Assertions.assertArrayEquals(new boolean[] {false, false, true, true},
        MaskUtils.notInPlace(a.clone()), "not");
    Assertions.assertArrayEquals(new boolean[] {false, false, false, true},
        MaskUtils.neither(a, b), "neither");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> MaskUtils.andInPlace(a, new boolean[3]));
  }

  @Test
  void canCountAndIndex() {
    final boolean[] mask = {false, true, true, false, true};
    Assertions.assertEquals(3, MaskUtils.count(mask));
    Assertions.assertArrayEquals(new int[] {1, 2, 4}, MaskUtils.indices(mask));
  }

  @Test
  void finiteRequiresAllValues() {
    final double[] a = {1, Double.NaN, 3, 4};
    final double[] b = {1, 2, Double.NEGATIVE_INFINITY, 4};
    Assertions.assertArrayEquals(new boolean[] {true, false, false, true},
        MaskUtils.finite(4, a, b));
    Assertions.assertArrayEquals(new boolean[] {true, true}, MaskUtils.finite(2));
  }
}
