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

package uk.ac.sussex.gdsc.ceus.utils;

import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Numerical helpers shared by the analysis components.
 */
public final class MathUtils {

  /** No public construction. */
  private MathUtils() {}

  /**
   * Compute the percentile using linear interpolation between the closest ranks (the R-7
   * estimator).
   *
   * @param values the values
   * @param p the percentile in [0, 100]
   * @return the percentile (NaN for empty input)
   */
  public static double percentile(double[] values, double p) {
    if (values.length == 0) {
      return Double.NaN;
    }
    if (p <= 0) {
      return min(values);
    }
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
  }

  /**
   * Compute the median. The input is not modified.
   *
   * @param values the values
   * @return the median (NaN for empty input)
   */
  public static double median(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    final double[] sorted = values.clone();
    Arrays.sort(sorted);
    return medianOfSorted(sorted, sorted.length);
  }

  /**
   * Compute the median of the first {@code length} values. The values are sorted in place.
   *
   * @param values the values
   * @param length the length
   * @return the median
   */
  public static float medianInPlace(float[] values, int length) {
    Arrays.sort(values, 0, length);
    final int mid = length >> 1;
    if ((length & 1) == 1) {
      return values[mid];
    }
    return (float) (((double) values[mid - 1] + values[mid]) * 0.5);
  }

  private static double medianOfSorted(double[] sorted, int length) {
    final int mid = length >> 1;
    if ((length & 1) == 1) {
      return sorted[mid];
    }
    return (sorted[mid - 1] + sorted[mid]) * 0.5;
  }

  /**
   * Compute the minimum.
   *
   * @param values the values
   * @return the minimum
   */
  public static double min(double[] values) {
    double min = Double.POSITIVE_INFINITY;
    for (final double v : values) {
      min = Math.min(min, v);
    }
    return min;
  }

  /**
   * Compute the maximum.
   *
   * @param values the values
   * @return the maximum
   */
  public static double max(double[] values) {
    double max = Double.NEGATIVE_INFINITY;
    for (final double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }

  /**
   * Compute the population standard deviation.
   *
   * @param values the values
   * @return the standard deviation (NaN for empty input)
   */
  public static double populationStandardDeviation(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    double sum = 0;
    for (final double v : values) {
      sum += v;
    }
    final double mean = sum / values.length;
    double ss = 0;
    for (final double v : values) {
      final double d = v - mean;
      ss += d * d;
    }
    return Math.sqrt(ss / values.length);
  }

  /**
   * Integrate y over x using the trapezoid rule.
   *
   * @param x the x values
   * @param y the y values
   * @return the integral (0 for fewer than 2 points)
   */
  public static double trapz(double[] x, double[] y) {
    double sum = 0;
    for (int i = 1; i < x.length; i++) {
      sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]);
    }
    return sum * 0.5;
  }

  /**
   * Check all the values are finite.
   *
   * @param values the values
   * @return true if finite
   */
  public static boolean isFinite(double[] values) {
    for (final double v : values) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Subtract the first value and clamp the result to be non-negative.
   *
   * @param values the values
   * @return the anchored values
   */
  public static double[] anchor(double[] values) {
    final double[] result = new double[values.length];
    if (values.length == 0) {
      return result;
    }
    final double first = values[0];
    for (int i = 0; i < values.length; i++) {
      result[i] = Math.max(0, values[i] - first);
    }
    return result;
  }

  /**
   * Linearly interpolate the function (xp, fp) at x. Values outside the range of xp take the end
   * values. The xp must be strictly increasing.
   *
   * @param xp the x points
   * @param fp the function values
   * @param x the x value
   * @return the interpolated value
   */
  public static double interpolate(double[] xp, double[] fp, double x) {
    final int n = xp.length;
    if (x <= xp[0]) {
      return fp[0];
    }
    if (x >= xp[n - 1]) {
      return fp[n - 1];
    }
    int i = Arrays.binarySearch(xp, x);
    if (i >= 0) {
      return fp[i];
    }
    // insertion point is the upper index
    i = -(i + 1);
    final double f = (x - xp[i - 1]) / (xp[i] - xp[i - 1]);
    return fp[i - 1] + f * (fp[i] - fp[i - 1]);
  }
}
