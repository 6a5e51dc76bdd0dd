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

package uk.ac.sussex.gdsc.ceus.tic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;

/**
 * The curves extracted for each ROI of a session and the failures of any ROI that could not be
 * extracted.
 */
public final class TicExtraction {
  private final Map<String, TimeIntensityCurve> curves = new LinkedHashMap<>();
  private final Map<String, String> failures = new LinkedHashMap<>();

  /**
   * Add a curve.
   *
   * @param curve the curve
   */
  void addCurve(TimeIntensityCurve curve) {
    curves.put(curve.getLabel(), curve);
  }

  /**
   * Add a failure.
   *
   * @param label the ROI label
   * @param message the failure description
   */
  void addFailure(String label, String message) {
    failures.put(label, message);
  }

  /**
   * Gets the curves by ROI label in session order.
   *
   * @return the curves
   */
  public Map<String, TimeIntensityCurve> getCurves() {
    return Collections.unmodifiableMap(curves);
  }

  /**
   * Gets the failure descriptions by ROI label.
   *
   * @return the failures
   */
  public Map<String, String> getFailures() {
    return Collections.unmodifiableMap(failures);
  }
}
