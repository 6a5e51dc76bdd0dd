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
 * Local density random walk bolus model.
 *
 * <pre>
 * g(tau) = (e^lambda / mu) sqrt(mu lambda / (2 pi tau)) exp(-lambda / 2 (mu / tau + tau / mu))
 * MTT = mu (1 + 1 / lambda)
 * TTP = t0 + mu (sqrt(1 + 4 lambda^2) - 1) / (2 lambda)
 * </pre>
 */
final class LdrwFunction extends KineticFunction {

  /**
   * Create an instance.
   *
   * @param time the times
   */
  LdrwFunction(double[] time) {
    super(time);
  }

  @Override
  double density(double tau, double mu, double lambda) {
    // lambda - lambda/2 (mu/tau + tau/mu) = -lambda/2 (sqrt(mu/tau) - sqrt(tau/mu))^2
    final double d = Math.sqrt(mu / tau) - Math.sqrt(tau / mu);
    return Math.sqrt(mu * lambda / (2 * Math.PI * tau)) / mu * Math.exp(-0.5 * lambda * d * d);
  }

  @Override
  double meanTransitTime(double mu, double lambda) {
    return mu * (1 + 1 / lambda);
  }

  @Override
  double peakTime(double mu, double lambda) {
    return mu * (Math.sqrt(1 + 4 * lambda * lambda) - 1) / (2 * lambda);
  }
}
