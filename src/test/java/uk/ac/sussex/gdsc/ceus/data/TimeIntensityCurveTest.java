/*-
 * #%L
 * Genome Damage and Stability Centre CEUS Perfusion Analysis
 *
 * Software for contrast-enhanced ultrasound perfusion analysis
 * %%
 * Copyright (C) 2020 Alex Herbert
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

package uk.ac.sussex.gdsc.ceus.data;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.ceus.InputShapeException;

@SuppressWarnings({"javadoc"})
class TimeIntensityCurveTest {
  @Test
  void testFromFrames() {
    final TimeIntensityCurve curve =
        TimeIntensityCurve.fromFrames("a", new double[] {1, 2, 3, 4}, 2);
    Assertions.assertArrayEquals(new double[] {0, 0.5, 1, 1.5}, curve.getTime());
    Assertions.assertEquals("a", curve.getLabel());
    Assertions.assertEquals(4, curve.size());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> TimeIntensityCurve.fromFrames("a", new double[2], 0));
  }

  @Test
  void testConstructorChecksShape() {
    Assertions.assertThrows(InputShapeException.class,
        () -> new TimeIntensityCurve("a", new double[3], new double[2]));
    Assertions.assertThrows(InputShapeException.class,
        () -> new TimeIntensityCurve("a", new double[] {0, 2, 1}, new double[3]));
  }

  @Test
  void testValuesAreRelativeToFirstIncludedFrame() {
    final TimeIntensityCurve curve =
        TimeIntensityCurve.fromFrames("a", new double[] {10, 12, 15, 11}, 1);
    Assertions.assertArrayEquals(new double[] {0, 2, 5, 1}, curve.getValues());
    curve.setIncluded(0, false);
    Assertions.assertEquals(1, curve.getFirstIncluded());
    Assertions.assertArrayEquals(new double[] {-2, 0, 3, -1}, curve.getValues());
    Assertions.assertArrayEquals(new double[] {1, 2, 3}, curve.getIncludedTime());
    Assertions.assertArrayEquals(new double[] {0, 3, -1}, curve.getIncludedValues());
    Assertions.assertEquals(3, curve.getIncludedCount());
  }

  @Test
  void testToggleTwiceRestoresValues() {
    final TimeIntensityCurve curve =
        TimeIntensityCurve.fromFrames("a", new double[] {3, 4, 8, 6, 5}, 10);
    final double[] expected = curve.getValues();
    for (int i = 0; i < curve.size(); i++) {
      Assertions.assertFalse(curve.toggleIncluded(i));
      Assertions.assertFalse(curve.isIncluded(i));
      Assertions.assertTrue(curve.toggleIncluded(i));
      Assertions.assertArrayEquals(expected, curve.getValues());
    }
  }

  @Test
  void testNoIncludedFrames() {
    final TimeIntensityCurve curve = TimeIntensityCurve.fromFrames("a", new double[] {1, 2}, 1);
    curve.setIncluded(0, false);
    curve.setIncluded(1, false);
    Assertions.assertEquals(-1, curve.getFirstIncluded());
    Assertions.assertEquals(0, curve.getIncludedCount());
    for (final double v : curve.getValues()) {
      Assertions.assertTrue(Double.isNaN(v));
    }
    Assertions.assertEquals(0, curve.getIncludedValues().length);
    curve.includeAll();
    Assertions.assertArrayEquals(new boolean[] {true, true}, curve.getIncludedMask());
  }
}
