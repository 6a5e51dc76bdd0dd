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

import org.apache.commons.math3.stat.regression.SimpleRegression;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * Computes summary metrics of a curve. Degenerate input (empty, mismatched lengths or non-finite
 * values) produces NaN metrics.
 */
public final class MetricsEngine {
  /** The time difference used in place of zero for the derivative. */
  static final double MIN_DT = 1e-9;

  /** No public construction. */
  private MetricsEngine() {}

  /**
   * Compute the metrics of the curve.
   *
   * @param t the time
   * @param y the values
   * @return the metrics
   */
  public static MetricSet compute(double[] t, double[] y) {
    return compute(t, y, null);
  }

  /**
   * Compute the metrics of the curve. The R^2 is computed if the reference is supplied.
   *
   * @param t the time
   * @param y the values
   * @param reference the reference values the curve is compared to (can be null)
   * @return the metrics
   */
  public static MetricSet compute(double[] t, double[] y, double[] reference) {
    if (t == null || y == null || t.length == 0 || t.length != y.length
        || !MathUtils.isFinite(t) || !MathUtils.isFinite(y)) {
      return MetricSet.NAN;
    }
    final int n = t.length;
    final double[] positive = new double[n];
    final double[] moment = new double[n];
    double sum = 0;
    int peakIndex = 0;
    for (int i = 0; i < n; i++) {
      positive[i] = Math.max(y[i], 0);
      moment[i] = t[i] * positive[i];
      sum += y[i];
      if (Math.abs(y[i]) > Math.abs(y[peakIndex])) {
        peakIndex = i;
      }
    }
    final double auc = MathUtils.trapz(t, positive);
    final double mtt = auc > 0 ? MathUtils.trapz(t, moment) / auc : Double.NaN;
    final double peak = y[peakIndex];
    return new MetricSet(auc, mtt, peak, t[peakIndex], slope1090(t, y, peak),
        maxAbsDerivative(t, y), sum / n, rsquared(y, reference));
  }

  private static double slope1090(double[] t, double[] y, double peak) {
    if (peak == 0) {
      return Double.NaN;
    }
    final double lo = Math.min(0.1 * peak, 0.9 * peak);
    final double hi = Math.max(0.1 * peak, 0.9 * peak);
    final SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < t.length; i++) {
      if (y[i] >= lo && y[i] <= hi) {
        regression.addData(t[i], y[i]);
      }
    }
    return regression.getN() < 2 ? Double.NaN : regression.getSlope();
  }

  private static double maxAbsDerivative(double[] t, double[] y) {
    if (t.length < 2) {
      return Double.NaN;
    }
    double max = 0;
    for (int i = 1; i < t.length; i++) {
      double dt = t[i] - t[i - 1];
      if (dt == 0) {
        dt = MIN_DT;
      }
      max = Math.max(max, Math.abs((y[i] - y[i - 1]) / dt));
    }
    return max;
  }

  /**
   * Compute the coefficient of determination of the curve against the reference.
   *
   * @param y the curve
   * @param reference the reference (can be null)
   * @return the R^2 (NaN if not computable)
   */
  static double rsquared(double[] y, double[] reference) {
    if (reference == null || reference.length != y.length || !MathUtils.isFinite(reference)) {
      return Double.NaN;
    }
    double sum = 0;
    for (final double v : reference) {
      sum += v;
    }
    final double mean = sum / reference.length;
    double ssres = 0;
    double sstot = 0;
    for (int i = 0; i < y.length; i++) {
      ssres += (reference[i] - y[i]) * (reference[i] - y[i]);
      sstot += (reference[i] - mean) * (reference[i] - mean);
    }
    return sstot > 0 ? 1 - ssres / sstot : Double.NaN;
  }
}
