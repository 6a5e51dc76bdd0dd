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

import org.apache.commons.math3.special.Gamma;

/**
 * Gamma variate bolus model.
 *
 * <pre>
 * g(tau) = tau^alpha exp(-tau / beta) / (beta^(alpha + 1) Gamma(alpha + 1))
 * MTT = (alpha + 1) beta
 * TTP = t0 + alpha beta
 * </pre>
 */
final class GammaVariateFunction extends KineticFunction {

  /**
   * Create an instance.
   *
   * @param time the times
   */
  GammaVariateFunction(double[] time) {
    super(time);
  }

  @Override
  double density(double tau, double alpha, double beta) {
    // Log space avoids overflow of the power and gamma terms
    return Math.exp(alpha * Math.log(tau) - tau / beta - (alpha + 1) * Math.log(beta)
        - Gamma.logGamma(alpha + 1));
  }

  @Override
  double meanTransitTime(double alpha, double beta) {
    return (alpha + 1) * beta;
  }

  @Override
  double peakTime(double alpha, double beta) {
    return alpha * beta;
  }
}
