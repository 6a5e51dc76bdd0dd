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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import uk.ac.sussex.gdsc.ceus.InputShapeException;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.fit.FitResult;
import uk.ac.sussex.gdsc.ceus.fit.KineticModel;
import uk.ac.sussex.gdsc.ceus.fit.ModelFitResults;
import uk.ac.sussex.gdsc.ceus.metrics.MetricSet;

/**
 * Builds tidy (one observation per row) tables of the analysis results for serialisation by the
 * caller.
 */
public final class TidyExport {
  /** The end of the wash-in prediction grid (seconds). */
  public static final double GRID_END = 8;
  /** The step of the wash-in prediction grid (seconds). */
  public static final double GRID_STEP = 0.1;

  /** No public construction. */
  private TidyExport() {}

  /**
   * Create the curve rows for the included points of the curve.
   *
   * @param curve the curve
   * @param smoothed the smoothed values of the included points (can be null)
   * @param washIn the wash-in fit (can be null)
   * @return the rows
   * @throws InputShapeException if the smoothed values do not match the included points
   */
  public static List<CurveRow> curveRows(TimeIntensityCurve curve, double[] smoothed,
      FitResult washIn) {
    final double[] time = curve.getIncludedTime();
    final double[] values = curve.getIncludedValues();
    if (smoothed != null && smoothed.length != time.length) {
      throw new InputShapeException(String.format(
          "Smoothed values length %d does not match %d included points", smoothed.length,
          time.length));
    }
    final double[] predicted = washIn == null ? null : washIn.predict(time);
    final List<CurveRow> rows = new ArrayList<>(time.length);
    for (int i = 0; i < time.length; i++) {
      rows.add(new CurveRow(curve.getLabel(), time[i], values[i],
          smoothed == null ? Double.NaN : smoothed[i],
          predicted == null ? Double.NaN : predicted[i]));
    }
    return rows;
  }

  /**
   * Create the parameter rows: the wash-in parameters (A, B, A*B, R2), the parameters, derived
   * parameters and RSS of every fitted model, and the metric sets. Missing values are NaN.
   *
   * @param roi the ROI label
   * @param fits the fit results
   * @param metrics the metric sets keyed by curve name (e.g. raw, smoothed, predicted)
   * @return the rows
   */
  public static List<ParameterRow> parameterRows(String roi, ModelFitResults fits,
      Map<String, MetricSet> metrics) {
    final List<ParameterRow> rows = new ArrayList<>();
    final Optional<FitResult> washIn = fits.get(KineticModel.WASH_IN);
    rows.add(new ParameterRow(roi, "A", washIn.map(r -> r.getParameter("A")).orElse(Double.NaN)));
    rows.add(new ParameterRow(roi, "B", washIn.map(r -> r.getParameter("B")).orElse(Double.NaN)));
    rows.add(new ParameterRow(roi, "A*B",
        washIn.map(r -> r.getDerivedParameters().get("A*B")).orElse(Double.NaN)));
    rows.add(new ParameterRow(roi, "R2", washIn.map(FitResult::getRSquared).orElse(Double.NaN)));

    for (final FitResult result : fits.getResults().values()) {
      if (!result.getModel().isBolus()) {
        continue;
      }
      final String prefix = result.getModel().name() + ".";
      result.getNamedParameters()
          .forEach((name, value) -> rows.add(new ParameterRow(roi, prefix + name, value)));
      result.getDerivedParameters()
          .forEach((name, value) -> rows.add(new ParameterRow(roi, prefix + name, value)));
      rows.add(new ParameterRow(roi, prefix + "RSS", result.getResidualSumOfSquares()));
      rows.add(new ParameterRow(roi, prefix + "R2", result.getRSquared()));
    }

    metrics.forEach((curve, set) -> set.toMap()
        .forEach((name, value) -> rows.add(new ParameterRow(roi, curve + "." + name, value))));
    return rows;
  }

  /**
   * Gets the regular time grid used for the predicted wash-in curve: 0 to 8 seconds in steps of
   * 0.1.
   *
   * @return the grid
   */
  public static double[] getPredictionGrid() {
    final int n = (int) Math.round(GRID_END / GRID_STEP) + 1;
    final double[] grid = new double[n];
    for (int i = 0; i < n; i++) {
      grid[i] = i * GRID_STEP;
    }
    return grid;
  }

  /**
   * Create the predicted wash-in curve rows on the regular grid. The raw and smoothed values are
   * NaN.
   *
   * @param roi the ROI label
   * @param washIn the wash-in fit
   * @return the rows
   */
  public static List<CurveRow> predictedRows(String roi, FitResult washIn) {
    final double[] grid = getPredictionGrid();
    final double[] predicted = washIn.predict(grid);
    final List<CurveRow> rows = new ArrayList<>(grid.length);
    for (int i = 0; i < grid.length; i++) {
      rows.add(new CurveRow(roi, grid[i], Double.NaN, Double.NaN, predicted[i]));
    }
    return rows;
  }
}
