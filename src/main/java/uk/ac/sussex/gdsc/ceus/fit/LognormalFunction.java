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
 * Lognormal bolus model.
 *
 * <pre>
 * g(tau) = exp(-(ln(tau) - mu)^2 / (2 sigma^2)) / (sqrt(2 pi) sigma tau)
 * MTT = exp(mu + sigma^2 / 2)
 * TTP = t0 + exp(mu - sigma^2)
 * </pre>
 */
final class LognormalFunction extends KineticFunction {
  private static final double SQRT_2PI = Math.sqrt(2 * Math.PI);

  /**
   * Create an instance.
   *
   * @param time the times
   */
  LognormalFunction(double[] time) {
    super(time);
  }

  @Override
  double density(double tau, double mu, double sigma) {
    final double z = (Math.log(tau) - mu) / sigma;
    return Math.exp(-0.5 * z * z) / (SQRT_2PI * sigma * tau);
  }

  @Override
  double meanTransitTime(double mu, double sigma) {
    return Math.exp(mu + sigma * sigma / 2);
  }

  @Override
  double peakTime(double mu, double sigma) {
    return Math.exp(mu - sigma * sigma);
  }
}
