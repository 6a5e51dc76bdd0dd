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

import java.util.Arrays;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import uk.ac.sussex.gdsc.ceus.InputShapeException;
import uk.ac.sussex.gdsc.ceus.InsufficientDataException;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * Local polynomial regression (LOESS) smoother.
 *
 * <p>Each point is estimated by a weighted least-squares polynomial fit to its nearest neighbours
 * using tri-cube weights. Repeated time values are collapsed to the first occurrence before
 * fitting and the result is interpolated back to every input time.
 */
public class LoessSmoother {
  /** The default span. */
  public static final double DEFAULT_SPAN = 0.8;
  /** The default polynomial degree. */
  public static final int DEFAULT_DEGREE = 2;
  /** The minimum number of points. */
  public static final int MIN_POINTS = 3;

  private final double span;
  private final int degree;

  /**
   * Create an instance with the default span and degree.
   */
  public LoessSmoother() {
    this(DEFAULT_SPAN, DEFAULT_DEGREE);
  }

  /**
   * Create an instance.
   *
   * @param span the fraction of points in each local fit, in (0, 1]
   * @param degree the polynomial degree (1 or 2)
   */
  public LoessSmoother(double span, int degree) {
    if (!(span > 0 && span <= 1)) {
      throw new IllegalArgumentException("Span must be in (0, 1]: " + span);
    }
    if (degree != 1 && degree != 2) {
      throw new IllegalArgumentException("Degree must be 1 or 2: " + degree);
    }
    this.span = span;
    this.degree = degree;
  }

  /**
   * Smooth the data.
   *
   * @param t the time
   * @param y the values
   * @return the smoothed values at each time
   * @throws InsufficientDataException if there are fewer than 3 points
   */
  public double[] smooth(double[] t, double[] y) {
    if (t.length != y.length) {
      throw new InputShapeException(
          "Time and value lengths differ: " + t.length + " != " + y.length);
    }
    if (t.length < MIN_POINTS) {
      throw InsufficientDataException.of("LOESS smoothing", MIN_POINTS, t.length);
    }

    // Sort by time; the stable sort keeps the first occurrence of duplicates first
    final Integer[] order = new Integer[t.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (i1, i2) -> Double.compare(t[i1], t[i2]));
    double[] xs = new double[t.length];
    double[] ys = new double[t.length];
    int n = 0;
    for (final int i : order) {
      if (n == 0 || t[i] != xs[n - 1]) {
        xs[n] = t[i];
        ys[n] = y[i];
        n++;
      }
    }
    xs = Arrays.copyOf(xs, n);
    ys = Arrays.copyOf(ys, n);

    final double[] fitted = new double[n];
    if (n < MIN_POINTS) {
      // All time values are repeated: no local structure to fit
      System.arraycopy(ys, 0, fitted, 0, n);
    } else {
      for (int i = 0; i < n; i++) {
        fitted[i] = fitPoint(xs, ys, i);
      }
    }

    final double[] result = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      result[i] = n == 1 ? fitted[0] : MathUtils.interpolate(xs, fitted, t[i]);
    }
    return result;
  }

  /**
   * Gets the number of neighbours used for each local fit.
   *
   * @param n the number of points
   * @return the neighbours
   */
  int getNeighbours(int n) {
    final int k = Math.max(degree + 2, (int) Math.floor(span * n));
    return Math.max(2, Math.min(n - 1, k));
  }

  private double fitPoint(double[] xs, double[] ys, int index) {
    final int n = xs.length;
    final double x0 = xs[index];
    final double[] distance = new double[n];
    for (int j = 0; j < n; j++) {
      distance[j] = Math.abs(xs[j] - x0);
    }
    final double bandwidth = getBandwidth(distance, getNeighbours(n));

    // Collect the rows with non-zero weight scaled by sqrt(w)
    final int cols = degree + 1;
    final double[][] a = new double[n][cols];
    final double[] b = new double[n];
    int rows = 0;
    for (int j = 0; j < n; j++) {
      final double u = distance[j] / bandwidth;
      if (u >= 1) {
        continue;
      }
      final double v = 1 - u * u * u;
      final double w = Math.sqrt(v * v * v);
      final double z = (xs[j] - x0) / bandwidth;
      double p = w;
      for (int c = 0; c < cols; c++) {
        a[rows][c] = p;
        p *= z;
      }
      b[rows] = w * ys[j];
      rows++;
    }
    if (rows == 0) {
      return ys[index];
    }
    final Array2DRowRealMatrix matrix =
        new Array2DRowRealMatrix(Arrays.copyOf(a, rows), false);
    // The pseudo-inverse gives the minimum-norm solution for rank deficient systems
    final RealVector solution = new SingularValueDecomposition(matrix).getSolver()
        .solve(new ArrayRealVector(Arrays.copyOf(b, rows), false));
    return solution.getEntry(0);
  }

  /**
   * Gets the k-th smallest non-zero distance. Falls back to the largest distance, or 1 if all
   * distances are zero.
   */
  private static double getBandwidth(double[] distance, int k) {
    final double[] sorted = distance.clone();
    Arrays.sort(sorted);
    int count = 0;
    for (final double d : sorted) {
      if (d > 0 && ++count == k) {
        return d;
      }
    }
    final double max = sorted[sorted.length - 1];
    return max > 0 ? max : 1;
  }

  /**
   * Subtract the first value and clamp the result to be non-negative. This anchors a smoothed
   * curve to zero at the first time point for display of the intensity change.
   *
   * @param values the values
   * @return the anchored values
   */
  public static double[] anchor(double[] values) {
    return MathUtils.anchor(values);
  }
}
