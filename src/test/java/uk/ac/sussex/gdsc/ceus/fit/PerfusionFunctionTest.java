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

package uk.ac.sussex.gdsc.ceus.fit;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class PerfusionFunctionTest {
  private static double[] createTime(int size, double step) {
    final double[] t = new double[size];
    for (int i = 0; i < size; i++) {
      t[i] = i * step;
    }
    return t;
  }

  /**
   * Check the Jacobian against a central finite difference of the values.
   */
  private static void assertJacobian(PerfusionFunction f, double[] point, double relativeError) {
    final Pair<RealVector, RealMatrix> p = f.value(new ArrayRealVector(point));
    final RealMatrix jacobian = p.getSecond();
    Assertions.assertArrayEquals(f.values(point), p.getFirst().toArray(), 1e-10);
    for (int j = 0; j < point.length; j++) {
      final int column = j;
      final double delta = 1e-6 * Math.max(1, Math.abs(point[j]));
      final double[] upper = point.clone();
      final double[] lower = point.clone();
      upper[j] += delta;
      lower[j] -= delta;
      final double[] v1 = f.values(lower);
      final double[] v2 = f.values(upper);
      for (int i = 0; i < v1.length; i++) {
        final double expected = (v2[i] - v1[i]) / (2 * delta);
        final double actual = jacobian.getEntry(i, j);
        final double tolerance = relativeError * Math.max(1, Math.abs(expected));
        Assertions.assertEquals(expected, actual, tolerance,
            () -> "Jacobian column " + column);
      }
    }
  }

  @Test
  void testWashInFunction() {
    final WashInFunction f = new WashInFunction(createTime(20, 0.25));
    Assertions.assertEquals(2, f.getNumberOfParameters());
    for (final double a : new double[] {10, 50}) {
      for (final double b : new double[] {0.1, 0.5, 2}) {
        final double[] p = {a, b};
        Assertions.assertEquals(0, f.value(0, p));
        Assertions.assertEquals(a * (1 - Math.exp(-b * 2)), f.value(2, p), 1e-10);
        Assertions.assertArrayEquals(new double[] {a * b}, f.derived(p), 1e-10);
        assertJacobian(f, p, 1e-5);
      }
    }
  }

  @Test
  void testBolusFunctionsHaveUnitArea() {
    // A fine grid to integrate the density numerically
    final double[] time = createTime(40001, 0.005);
    final double[][] shapes = {{1.5, 0.4}, {3, 1.2}, {4, 2}, {4, 2}};
    final KineticModel[] models = {KineticModel.LOGNORMAL, KineticModel.GAMMA_VARIATE,
        KineticModel.LDRW, KineticModel.FPT};
    for (int m = 0; m < models.length; m++) {
      final PerfusionFunction f = models[m].createFunction(time);
      final double[] p = {100, shapes[m][0], shapes[m][1], 2, 5};
      final double[] values = f.values(p);
      double sum = 0;
      for (int i = 1; i < time.length; i++) {
        sum += 0.5 * (time[i] - time[i - 1]) * (values[i] + values[i - 1] - 2 * p[4]);
      }
      Assertions.assertEquals(100, sum, 1, models[m]::toString);
      // Baseline before the onset
      Assertions.assertEquals(5, f.value(1, p), models[m]::toString);
    }
  }

  @Test
  void testBolusJacobian() {
    final double[] time = createTime(40, 0.5);
    for (final KineticModel model : new KineticModel[] {KineticModel.LOGNORMAL,
        KineticModel.GAMMA_VARIATE, KineticModel.LDRW, KineticModel.FPT}) {
      final PerfusionFunction f = model.createFunction(time);
      Assertions.assertEquals(5, f.getNumberOfParameters());
      final double[] p = model == KineticModel.LOGNORMAL ? new double[] {50, 1.5, 0.5, 2.2, 3}
          : new double[] {50, 3, 1.5, 2.2, 3};
      assertJacobian(f, p, 1e-3);
    }
  }

  @Test
  void testLognormalDerived() {
    final KineticFunction f = new LognormalFunction(new double[1]);
    final double mu = 1.2;
    final double sigma = 0.5;
    final double[] derived = f.derived(new double[] {10, mu, sigma, 3, 0});
    Assertions.assertEquals(Math.exp(mu + sigma * sigma / 2), derived[0], 1e-10);
    Assertions.assertEquals(3 + Math.exp(mu - sigma * sigma), derived[1], 1e-10);
  }
}
