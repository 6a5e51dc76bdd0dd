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

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.RealVector;

/**
 * Base class for a perfusion model evaluated at a fixed set of times.
 */
abstract class PerfusionFunction implements MultivariateJacobianFunction {
  /** The times (seconds). */
  protected final double[] time;

  /**
   * Create an instance.
   *
   * @param time the times
   */
  PerfusionFunction(double[] time) {
    this.time = time;
  }

  /**
   * Gets the number of parameters.
   *
   * @return the number of parameters
   */
  abstract int getNumberOfParameters();

  /**
   * Compute the value of the function at time t.
   *
   * @param t the time
   * @param p the parameters
   * @return the value
   */
  abstract double value(double t, double[] p);

  /**
   * Compute the derived parameters.
   *
   * @param p the parameters
   * @return the derived parameters
   */
  abstract double[] derived(double[] p);

  /**
   * Compute the values of the function at each time.
   *
   * @param point the point
   * @return the values
   */
  double[] values(RealVector point) {
    return values(point.toArray());
  }

  /**
   * Compute the values of the function at each time.
   *
   * @param p the parameters
   * @return the values
   */
  double[] values(double[] p) {
    final double[] value = new double[time.length];
    for (int i = 0; i < value.length; i++) {
      value[i] = value(time[i], p);
    }
    return value;
  }
}
