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

/**
 * First passage time bolus model.
 *
 * <pre>
 * g(tau) = (e^lambda / mu) sqrt(lambda / (2 pi)) (mu / tau)^1.5
 *          exp(-lambda / 2 (mu / tau + tau / mu))
 * MTT = mu
 * TTP = t0 + mu (sqrt(9 + 4 lambda^2) - 3) / (2 lambda)
 * </pre>
 */
final class FptFunction extends KineticFunction {

  /**
   * Create an instance.
   *
   * @param time the times
   */
  FptFunction(double[] time) {
    super(time);
  }

  @Override
  double density(double tau, double mu, double lambda) {
    final double d = Math.sqrt(mu / tau) - Math.sqrt(tau / mu);
    final double ratio = mu / tau;
    return Math.sqrt(lambda / (2 * Math.PI)) * ratio * Math.sqrt(ratio) / mu
        * Math.exp(-0.5 * lambda * d * d);
  }

  @Override
  double meanTransitTime(double mu, double lambda) {
    return mu;
  }

  @Override
  double peakTime(double mu, double lambda) {
    return mu * (Math.sqrt(9 + 4 * lambda * lambda) - 3) / (2 * lambda);
  }
}
