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

import java.util.function.Function;

/**
 * The perfusion models that can be fit to a time-intensity curve.
 */
public enum KineticModel {
  /** Lognormal bolus. */
  LOGNORMAL("Lognormal", new String[] {"AUC", "mu", "sigma", "t0", "C"}, LognormalFunction::new),
  /** Gamma variate bolus. */
  GAMMA_VARIATE("Gamma variate", new String[] {"AUC", "alpha", "beta", "t0", "C"},
      GammaVariateFunction::new),
  /** Local density random walk bolus. */
  LDRW("LDRW", new String[] {"AUC", "mu", "lambda", "t0", "C"}, LdrwFunction::new),
  /** First passage time bolus. */
  FPT("FPT", new String[] {"AUC", "mu", "lambda", "t0", "C"}, FptFunction::new),
  /** Exponential wash-in. */
  WASH_IN("Wash-in", new String[] {"A", "B"}, WashInFunction::new);

  private static final String[] KINETIC_DERIVED = {"MTT", "TTP"};
  private static final String[] WASH_IN_DERIVED = {"A*B"};

  private final String description;
  private final String[] parameterNames;
  private final Function<double[], PerfusionFunction> factory;

  KineticModel(String description, String[] parameterNames,
      Function<double[], PerfusionFunction> factory) {
    this.description = description;
    this.parameterNames = parameterNames;
    this.factory = factory;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  /**
   * Checks if this is a bolus model with parameters {AUC, shape1, shape2, t0, C}.
   *
   * @return true if a bolus model
   */
  public boolean isBolus() {
    return this != WASH_IN;
  }

  /**
   * Gets the number of parameters.
   *
   * @return the number of parameters
   */
  public int getNumberOfParameters() {
    return parameterNames.length;
  }

  /**
   * Gets the parameter name.
   *
   * @param index the index
   * @return the parameter name
   */
  public String getParameterName(int index) {
    return parameterNames[index];
  }

  /**
   * Gets the parameter names.
   *
   * @return the parameter names
   */
  public String[] getParameterNames() {
    return parameterNames.clone();
  }

  /**
   * Gets the names of the derived parameters.
   *
   * @return the derived parameter names
   */
  public String[] getDerivedNames() {
    return isBolus() ? KINETIC_DERIVED.clone() : WASH_IN_DERIVED.clone();
  }

  /**
   * Gets the minimum number of points required to fit the model.
   *
   * @return the minimum points
   */
  public int getMinimumPoints() {
    return isBolus() ? 5 : 3;
  }

  /**
   * Create the function evaluated at the times.
   *
   * @param time the times
   * @return the function
   */
  PerfusionFunction createFunction(double[] time) {
    return factory.apply(time);
  }

  @Override
  public String toString() {
    return getDescription();
  }
}
