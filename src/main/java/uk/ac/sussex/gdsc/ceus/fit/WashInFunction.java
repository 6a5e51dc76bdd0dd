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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Wash-in (exponential saturation) model.
 *
 * <pre>
 * f(t) = A(1 - exp(-B t))
 *
 * A = plateau intensity
 * B = wash-in rate
 * </pre>
 *
 * <p>The derived parameter {@code A * B} is the initial wash-in slope.
 */
final class WashInFunction extends PerfusionFunction {

  /**
   * Create an instance.
   *
   * @param time the times
   */
  WashInFunction(double[] time) {
    super(time);
  }

  @Override
  int getNumberOfParameters() {
    return 2;
  }

  @Override
  double value(double t, double[] p) {
    return p[0] * (1 - Math.exp(-p[1] * t));
  }

  @Override
  double[] derived(double[] p) {
    return new double[] {p[0] * p[1]};
  }

  /**
   * {@inheritDoc}
   *
   * @param point {A, B}
   */
  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    final double a = point.getEntry(0);
    final double b = point.getEntry(1);
    final double[] value = new double[time.length];
    final double[][] jacobian = new double[time.length][2];
    // df_da = 1 - exp(-b t)
    // df_db = a t exp(-b t)
    for (int i = 0; i < time.length; i++) {
      final double t = time[i];
      final double x = Math.exp(-b * t);
      value[i] = a * (1 - x);
      jacobian[i][0] = 1 - x;
      jacobian[i][1] = a * t * x;
    }
    return new Pair<>(new ArrayRealVector(value, false),
        new Array2DRowRealMatrix(jacobian, false));
  }
}
