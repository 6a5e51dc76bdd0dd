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

package uk.ac.sussex.gdsc.ceus.export;

/**
 * A tidy row of a curve export: one ROI at one time.
 */
public final class CurveRow {
  private final String roi;
  private final double time;
  private final double rawValue;
  private final double smoothedValue;
  private final double predictedValue;

  /**
   * Create an instance.
   *
   * @param roi the ROI label
   * @param time the time
   * @param rawValue the raw value
   * @param smoothedValue the smoothed value
   * @param predictedValue the predicted value
   */
  public CurveRow(String roi, double time, double rawValue, double smoothedValue,
      double predictedValue) {
    this.roi = roi;
    this.time = time;
    this.rawValue = rawValue;
    this.smoothedValue = smoothedValue;
    this.predictedValue = predictedValue;
  }

  public String getRoi() {
    return roi;
  }

  public double getTime() {
    return time;
  }

  public double getRawValue() {
    return rawValue;
  }

  public double getSmoothedValue() {
    return smoothedValue;
  }

  public double getPredictedValue() {
    return predictedValue;
  }

  @Override
  public String toString() {
    return roi + "," + time + "," + rawValue + "," + smoothedValue + "," + predictedValue;
  }
}
