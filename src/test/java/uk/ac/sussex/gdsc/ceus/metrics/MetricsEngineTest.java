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

package uk.ac.sussex.gdsc.ceus.metrics;

import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class MetricsEngineTest {
  private static double[] createTime(int size, double step) {
    final double[] t = new double[size];
    for (int i = 0; i < size; i++) {
      t[i] = i * step;
    }
    return t;
  }

  @Test
  void testTriangularPulse() {
    final double peak = 8;
    final double duration = 10;
    final double[] t = createTime(101, 0.1);
    final double[] y = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      y[i] = peak * (1 - Math.abs(t[i] - 5) / 5);
    }
    final MetricSet m = MetricsEngine.compute(t, y);
    Assertions.assertEquals(0.5 * peak * duration, m.getAuc(), 1e-9);
    Assertions.assertEquals(5, m.getMtt(), 1e-2);
    Assertions.assertEquals(peak, m.getPeak(), 1e-9);
    Assertions.assertEquals(5, m.getTtp(), 1e-9);
    // Symmetric rise and fall
    Assertions.assertEquals(0, m.getSlope1090(), 1e-9);
    Assertions.assertEquals(1.6, m.getMaxAbsDerivative(), 1e-9);
    Assertions.assertTrue(Double.isNaN(m.getRSquared()));
  }

  @Test
  void testRamp() {
    final double[] t = createTime(101, 0.1);
    final double[] y = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      y[i] = 2 * t[i];
    }
    final MetricSet m = MetricsEngine.compute(t, y, y);
    Assertions.assertEquals(100, m.getAuc(), 1e-9);
    Assertions.assertEquals(20, m.getPeak(), 1e-9);
    Assertions.assertEquals(10, m.getTtp(), 1e-9);
    Assertions.assertEquals(2, m.getSlope1090(), 1e-9);
    Assertions.assertEquals(2, m.getMaxAbsDerivative(), 1e-9);
    Assertions.assertEquals(10, m.getMean(), 1e-9);
    Assertions.assertEquals(1, m.getRSquared(), 1e-12);
  }

  @Test
  void testNegativeValuesAreExcludedFromArea() {
    final double[] t = {0, 1, 2, 3};
    final double[] y = {0, -4, 0, 2};
    final MetricSet m = MetricsEngine.compute(t, y);
    Assertions.assertEquals(1, m.getAuc(), 1e-12);
    // Largest magnitude
    Assertions.assertEquals(-4, m.getPeak());
    Assertions.assertEquals(1, m.getTtp());
  }

  @Test
  void testDegenerateInput() {
    Assertions.assertSame(MetricSet.NAN, MetricsEngine.compute(new double[0], new double[0]));
    Assertions.assertSame(MetricSet.NAN, MetricsEngine.compute(new double[2], new double[3]));
    Assertions.assertSame(MetricSet.NAN,
        MetricsEngine.compute(new double[] {0, 1}, new double[] {0, Double.NaN}));
    for (final double v : MetricSet.NAN.toMap().values()) {
      Assertions.assertTrue(Double.isNaN(v));
    }

    final MetricSet zero = MetricsEngine.compute(new double[] {0, 1, 2}, new double[3]);
    Assertions.assertEquals(0, zero.getAuc());
    Assertions.assertTrue(Double.isNaN(zero.getMtt()));
    Assertions.assertTrue(Double.isNaN(zero.getSlope1090()));

    final MetricSet single = MetricsEngine.compute(new double[] {1}, new double[] {3});
    Assertions.assertEquals(0, single.getAuc());
    Assertions.assertTrue(Double.isNaN(single.getMaxAbsDerivative()));
  }

  @Test
  void testRepeatedTimesAreFinite() {
    final MetricSet m =
        MetricsEngine.compute(new double[] {0, 0, 1}, new double[] {0, 1, 1});
    Assertions.assertTrue(Double.isFinite(m.getMaxAbsDerivative()));
  }

  @Test
  void testRSquared() {
    final double[] ref = {1, 2, 3, 4};
    Assertions.assertEquals(1, MetricsEngine.rsquared(ref, ref));
    Assertions.assertEquals(1 - 4.0 / 5, MetricsEngine.rsquared(new double[] {2, 3, 4, 5}, ref),
        1e-12);
    Assertions.assertTrue(Double.isNaN(MetricsEngine.rsquared(ref, null)));
    Assertions.assertTrue(Double.isNaN(MetricsEngine.rsquared(ref, new double[] {2, 2, 2, 2})));
  }

  @Test
  void testMapKeys() {
    final Map<String, Double> map = MetricsEngine.compute(new double[] {0, 1},
        new double[] {0, 1}).toMap();
    Assertions.assertArrayEquals(new String[] {"AUC", "MTT", "Peak", "TTP", "Slope10-90",
        "MaxAbsDerivative", "Mean", "R2"}, map.keySet().toArray());
  }
}
