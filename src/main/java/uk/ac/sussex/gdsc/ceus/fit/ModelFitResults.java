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
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The fit results of each requested model. A model that could not be fit has no result and a
 * failure description.
 */
public final class ModelFitResults {
  private final Map<KineticModel, FitResult> results = new EnumMap<>(KineticModel.class);
  private final Map<KineticModel, String> failures = new EnumMap<>(KineticModel.class);

  /**
   * Add a result.
   *
   * @param result the result
   */
  void add(FitResult result) {
    results.put(result.getModel(), result);
  }

  /**
   * Add a failure.
   *
   * @param model the model
   * @param message the failure description
   */
  void addFailure(KineticModel model, String message) {
    failures.put(model, message);
  }

  /**
   * Gets the result for the model.
   *
   * @param model the model
   * @return the result (empty if missing)
   */
  public Optional<FitResult> get(KineticModel model) {
    return Optional.ofNullable(results.get(model));
  }

  /**
   * Gets the results.
   *
   * @return the results
   */
  public Map<KineticModel, FitResult> getResults() {
    return Collections.unmodifiableMap(results);
  }

  /**
   * Gets the failure descriptions of the models that could not be fit.
   *
   * @return the failures
   */
  public Map<KineticModel, String> getFailures() {
    return Collections.unmodifiableMap(failures);
  }

  /**
   * Gets the bolus model result with the lowest residual sum of squares.
   *
   * @return the best bolus result (empty if none)
   */
  public Optional<FitResult> getBestBolus() {
    FitResult best = null;
    for (final FitResult r : results.values()) {
      if (r.getModel().isBolus()
          && (best == null || r.getResidualSumOfSquares() < best.getResidualSumOfSquares())) {
        best = r;
      }
    }
    return Optional.ofNullable(best);
  }
}
