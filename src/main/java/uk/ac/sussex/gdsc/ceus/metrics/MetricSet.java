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

package uk.ac.sussex.gdsc.ceus.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary metrics of a time-intensity curve. Metrics that cannot be computed are NaN.
 */
public final class MetricSet {
  /** A metric set with all values NaN. */
  public static final MetricSet NAN = new MetricSet(Double.NaN, Double.NaN, Double.NaN,
      Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);

  private final double auc;
  private final double mtt;
  private final double peak;
  private final double ttp;
  private final double slope;
  private final double maxAbsDerivative;
  private final double mean;
  private final double rsquared;

  /**
   * Create an instance.
   *
   * @param auc the area under the curve
   * @param mtt the mean transit time
   * @param peak the peak
   * @param ttp the time to peak
   * @param slope the 10-90% rise slope
   * @param maxAbsDerivative the max absolute derivative
   * @param mean the mean value
   * @param rsquared the R^2 against a reference
   */
  MetricSet(double auc, double mtt, double peak, double ttp, double slope,
      double maxAbsDerivative, double mean, double rsquared) {
    this.auc = auc;
    this.mtt = mtt;
    this.peak = peak;
    this.ttp = ttp;
    this.slope = slope;
    this.maxAbsDerivative = maxAbsDerivative;
    this.mean = mean;
    this.rsquared = rsquared;
  }

  /**
   * Gets the area under the positive part of the curve.
   *
   * @return the AUC
   */
  public double getAuc() {
    return auc;
  }

  /**
   * Gets the mean transit time: the first moment of the positive part of the curve.
   *
   * @return the MTT
   */
  public double getMtt() {
    return mtt;
  }

  /**
   * Gets the peak: the signed value with the largest magnitude.
   *
   * @return the peak
   */
  public double getPeak() {
    return peak;
  }

  /**
   * Gets the time of the peak.
   *
   * @return the TTP
   */
  public double getTtp() {
    return ttp;
  }

  /**
   * Gets the least-squares slope of the points between 10% and 90% of the peak.
   *
   * @return the slope
   */
  public double getSlope1090() {
    return slope;
  }

  /**
   * Gets the maximum absolute derivative.
   *
   * @return the max absolute derivative
   */
  public double getMaxAbsDerivative() {
    return maxAbsDerivative;
  }

  /**
   * Gets the mean value.
   *
   * @return the mean
   */
  public double getMean() {
    return mean;
  }

  /**
   * Gets the coefficient of determination against the reference curve.
   *
   * @return the R^2
   */
  public double getRSquared() {
    return rsquared;
  }

  /**
   * Gets the metrics by name.
   *
   * @return the metrics
   */
  public Map<String, Double> toMap() {
    final Map<String, Double> map = new LinkedHashMap<>();
    map.put("AUC", auc);
    map.put("MTT", mtt);
    map.put("Peak", peak);
    map.put("TTP", ttp);
    map.put("Slope10-90", slope);
    map.put("MaxAbsDerivative", maxAbsDerivative);
    map.put("Mean", mean);
    map.put("R2", rsquared);
    return map;
  }

  @Override
  public String toString() {
    return "MetricSet" + toMap();
  }
}
