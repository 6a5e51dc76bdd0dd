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
 * Base class for an indicator-dilution bolus model.
 *
 * <pre>
 * f(t) = C                      t &lt;= t0
 * f(t) = C + AUC g(t - t0)      t &gt; t0
 * </pre>
 *
 * <p>where g is a unit-area density. Parameters are {AUC, shape1, shape2, t0, C}. The Jacobian
 * is computed by central finite differences.
 */
abstract class KineticFunction extends PerfusionFunction {
  /** Index of the area under the curve. */
  static final int AUC = 0;
  /** Index of the first shape parameter. */
  static final int SHAPE1 = 1;
  /** Index of the second shape parameter. */
  static final int SHAPE2 = 2;
  /** Index of the onset time. */
  static final int T0 = 3;
  /** Index of the baseline. */
  static final int C = 4;
  /** The minimum elapsed time after onset. */
  static final double MIN_TAU = 1e-9;
  /** The relative step for the finite difference Jacobian. */
  private static final double RELATIVE_STEP = 1e-6;

  /**
   * Create an instance.
   *
   * @param time the times
   */
  KineticFunction(double[] time) {
    super(time);
  }

  @Override
  int getNumberOfParameters() {
    return 5;
  }

  @Override
  double value(double t, double[] p) {
    if (t <= p[T0]) {
      return p[C];
    }
    final double tau = Math.max(t - p[T0], MIN_TAU);
    return p[C] + p[AUC] * density(tau, p[SHAPE1], p[SHAPE2]);
  }

  /**
   * Compute the unit-area density at the elapsed time.
   *
   * @param tau the time after onset (strictly positive)
   * @param s1 the first shape parameter
   * @param s2 the second shape parameter
   * @return the density
   */
  abstract double density(double tau, double s1, double s2);

  /**
   * Gets the mean transit time measured from the onset.
   *
   * @param s1 the first shape parameter
   * @param s2 the second shape parameter
   * @return the mean transit time
   */
  abstract double meanTransitTime(double s1, double s2);

  /**
   * Gets the time to peak measured from the onset.
   *
   * @param s1 the first shape parameter
   * @param s2 the second shape parameter
   * @return the time to peak
   */
  abstract double peakTime(double s1, double s2);

  /**
   * {@inheritDoc}
   *
   * @return {MTT, TTP} where TTP is an absolute time
   */
  @Override
  double[] derived(double[] p) {
    return new double[] {meanTransitTime(p[SHAPE1], p[SHAPE2]),
        p[T0] + peakTime(p[SHAPE1], p[SHAPE2])};
  }

  /**
   * {@inheritDoc}
   *
   * @param point {AUC, shape1, shape2, t0, C}
   */
  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    final double[] p = point.toArray();
    final double[] value = values(p);
    final double[][] jacobian = new double[time.length][p.length];
    for (int j = 0; j < p.length; j++) {
      final double original = p[j];
      final double h = RELATIVE_STEP * Math.max(Math.abs(original), 1);
      p[j] = original + h;
      final double[] upper = values(p);
      p[j] = original - h;
      final double[] lower = values(p);
      p[j] = original;
      for (int i = 0; i < time.length; i++) {
        jacobian[i][j] = (upper[i] - lower[i]) / (2 * h);
      }
    }
    return new Pair<>(new ArrayRealVector(value, false),
        new Array2DRowRealMatrix(jacobian, false));
  }
}
