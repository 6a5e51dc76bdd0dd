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

import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Provides the options for the {@link ModelFitter}.
 */
public class FitOptions {
  /** The default number of restarts. */
  public static final int DEFAULT_RESTARTS = 50;
  /** The default maximum time for the wash-in fit (seconds). */
  public static final double DEFAULT_WASH_IN_MAX_TIME = 5;

  private int restarts;
  private Long seed;
  private double washInMaxTime;
  private Double onsetHint;
  private Double baselineHint;
  private final Map<KineticModel, double[][]> bounds;
  private int threads;

  /**
   * Create an instance with the default options.
   */
  public FitOptions() {
    restarts = DEFAULT_RESTARTS;
    washInMaxTime = DEFAULT_WASH_IN_MAX_TIME;
    bounds = new EnumMap<>(KineticModel.class);
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  public FitOptions(FitOptions source) {
    restarts = source.restarts;
    seed = source.seed;
    washInMaxTime = source.washInMaxTime;
    onsetHint = source.onsetHint;
    baselineHint = source.baselineHint;
    bounds = new EnumMap<>(KineticModel.class);
    source.bounds.forEach((k, v) -> bounds.put(k, copy(v)));
    threads = source.threads;
  }

  private static double[][] copy(double[][] b) {
    return new double[][] {b[0].clone(), b[1].clone()};
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public FitOptions copy() {
    return new FitOptions(this);
  }

  /**
   * Gets the number of restarts (starting points) for each model.
   *
   * @return the restarts
   */
  public int getRestarts() {
    return restarts;
  }

  /**
   * Sets the number of restarts (starting points) for each model. The minimum is 1.
   *
   * @param restarts the new restarts
   */
  public void setRestarts(int restarts) {
    this.restarts = Math.max(1, restarts);
  }

  /**
   * Gets the seed for the restart jitter. A null seed uses a random seed.
   *
   * @return the seed (can be null)
   */
  public Long getSeed() {
    return seed;
  }

  /**
   * Sets the seed for the restart jitter. A null seed uses a random seed.
   *
   * @param seed the new seed
   */
  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Gets the maximum time used for the wash-in fit.
   *
   * @return the wash-in max time
   */
  public double getWashInMaxTime() {
    return washInMaxTime;
  }

  /**
   * Sets the maximum time used for the wash-in fit.
   *
   * @param washInMaxTime the new wash-in max time
   */
  public void setWashInMaxTime(double washInMaxTime) {
    Validate.isTrue(washInMaxTime > 0, "Wash-in max time must be positive: %s", washInMaxTime);
    this.washInMaxTime = washInMaxTime;
  }

  /**
   * Gets the onset time hint. A null hint uses the first time.
   *
   * @return the onset hint (can be null)
   */
  public Double getOnsetHint() {
    return onsetHint;
  }

  /**
   * Sets the onset time hint. A null hint uses the first time.
   *
   * @param onsetHint the new onset hint
   */
  public void setOnsetHint(Double onsetHint) {
    this.onsetHint = onsetHint;
  }

  /**
   * Gets the baseline hint. A null hint uses the 10th percentile of the values.
   *
   * @return the baseline hint (can be null)
   */
  public Double getBaselineHint() {
    return baselineHint;
  }

  /**
   * Sets the baseline hint. A null hint uses the 10th percentile of the values.
   *
   * @param baselineHint the new baseline hint
   */
  public void setBaselineHint(Double baselineHint) {
    this.baselineHint = baselineHint;
  }

  /**
   * Gets the bounds for the model, or null to use the defaults.
   *
   * @param model the model
   * @return the bounds {lower, upper} (can be null)
   */
  public double[][] getBounds(KineticModel model) {
    final double[][] b = bounds.get(model);
    return b == null ? null : copy(b);
  }

  /**
   * Sets the bounds for the model. Use null to restore the defaults.
   *
   * @param model the model
   * @param lower the lower bounds
   * @param upper the upper bounds
   */
  public void setBounds(KineticModel model, double[] lower, double[] upper) {
    if (lower == null || upper == null) {
      bounds.remove(model);
      return;
    }
    final int n = model.getNumberOfParameters();
    Validate.isTrue(lower.length == n && upper.length == n,
        "%s requires %d bounds", model, n);
    for (int i = 0; i < n; i++) {
      Validate.isTrue(lower[i] <= upper[i], "%s lower bound above upper bound for %s", model,
          model.getParameterName(i));
    }
    bounds.put(model, new double[][] {lower.clone(), upper.clone()});
  }

  /**
   * Gets the number of threads. Non-positive values use the ImageJ preference.
   *
   * @return the threads
   */
  public int getThreads() {
    return threads;
  }

  /**
   * Sets the number of threads. Non-positive values use the ImageJ preference.
   *
   * @param threads the new threads
   */
  public void setThreads(int threads) {
    this.threads = threads;
  }
}
