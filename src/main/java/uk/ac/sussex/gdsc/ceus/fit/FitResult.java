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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * The best fit of a model to a curve.
 *
 * <p>Curves are anchored: the model value at the first fitted time is subtracted and the result
 * clamped to be non-negative.
 */
public final class FitResult {
  private final KineticModel model;
  private final PerfusionFunction function;
  private final double[] parameters;
  private final double[] derived;
  private final double[] time;
  private final double residualSumOfSquares;
  private final double rsquared;
  private final int startIndex;

  /**
   * Create an instance.
   *
   * @param model the model
   * @param function the function (evaluated at the fitted times)
   * @param parameters the parameters
   * @param residualSumOfSquares the residual sum of squares
   * @param rsquared the coefficient of determination
   * @param startIndex the index of the start point that produced the fit
   */
  FitResult(KineticModel model, PerfusionFunction function, double[] parameters,
      double residualSumOfSquares, double rsquared, int startIndex) {
    this.model = model;
    this.function = function;
    this.parameters = parameters;
    this.derived = function.derived(parameters);
    this.time = function.time;
    this.residualSumOfSquares = residualSumOfSquares;
    this.rsquared = rsquared;
    this.startIndex = startIndex;
  }

  /**
   * Gets the model.
   *
   * @return the model
   */
  public KineticModel getModel() {
    return model;
  }

  /**
   * Gets a copy of the parameters.
   *
   * @return the parameters
   */
  public double[] getParameters() {
    return parameters.clone();
  }

  /**
   * Gets the parameter.
   *
   * @param name the parameter name
   * @return the parameter (NaN if not a parameter of the model)
   */
  public double getParameter(String name) {
    final Double value = getNamedParameters().get(name);
    return value == null ? Double.NaN : value;
  }

  /**
   * Gets the parameters by name.
   *
   * @return the named parameters
   */
  public Map<String, Double> getNamedParameters() {
    final Map<String, Double> map = new LinkedHashMap<>();
    for (int i = 0; i < parameters.length; i++) {
      map.put(model.getParameterName(i), parameters[i]);
    }
    return Collections.unmodifiableMap(map);
  }

  /**
   * Gets the derived parameters by name: MTT and TTP for bolus models; A*B for the wash-in
   * model.
   *
   * @return the derived parameters
   */
  public Map<String, Double> getDerivedParameters() {
    final Map<String, Double> map = new LinkedHashMap<>();
    final String[] names = model.getDerivedNames();
    for (int i = 0; i < names.length; i++) {
      map.put(names[i], derived[i]);
    }
    return Collections.unmodifiableMap(map);
  }

  /**
   * Gets the residual sum of squares.
   *
   * @return the residual sum of squares
   */
  public double getResidualSumOfSquares() {
    return residualSumOfSquares;
  }

  /**
   * Gets the coefficient of determination against the fitted data.
   *
   * @return the R^2
   */
  public double getRSquared() {
    return rsquared;
  }

  /**
   * Gets the index of the start point that produced the fit. Index 0 is the seed.
   *
   * @return the start index
   */
  public int getStartIndex() {
    return startIndex;
  }

  /**
   * Gets the times used for the fit.
   *
   * @return the time
   */
  public double[] getTime() {
    return time.clone();
  }

  /**
   * Gets the anchored fitted curve at the fitted times.
   *
   * @return the curve
   */
  public double[] getCurve() {
    return MathUtils.anchor(function.values(parameters));
  }

  /**
   * Gets the anchored model curve at the given times. The anchor is the model value at the first
   * fitted time.
   *
   * @param t the times
   * @return the curve
   */
  public double[] predict(double[] t) {
    final double anchor = time.length == 0 ? 0 : function.value(time[0], parameters);
    final double[] values = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      values[i] = Math.max(0, function.value(t[i], parameters) - anchor);
    }
    return values;
  }

  @Override
  public String toString() {
    return String.format("%s %s RSS=%.6g R2=%.4f start=%d", model, getNamedParameters(),
        residualSumOfSquares, rsquared, startIndex);
  }
}
