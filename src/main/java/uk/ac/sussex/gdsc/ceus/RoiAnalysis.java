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

package uk.ac.sussex.gdsc.ceus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.export.CurveRow;
import uk.ac.sussex.gdsc.ceus.export.ParameterRow;
import uk.ac.sussex.gdsc.ceus.export.TidyExport;
import uk.ac.sussex.gdsc.ceus.fit.FitResult;
import uk.ac.sussex.gdsc.ceus.fit.KineticModel;
import uk.ac.sussex.gdsc.ceus.fit.ModelFitResults;
import uk.ac.sussex.gdsc.ceus.metrics.MetricSet;

/**
 * The analysis of the time-intensity curve of one ROI.
 */
public final class RoiAnalysis {
  /** The metric set name for the raw curve. */
  public static final String RAW = "raw";
  /** The metric set name for the smoothed curve. */
  public static final String SMOOTHED = "smoothed";
  /** The metric set name for the predicted wash-in curve. */
  public static final String PREDICTED = "predicted";

  private final TimeIntensityCurve curve;
  private final double[] smoothed;
  private final ModelFitResults fits;
  private final Map<String, MetricSet> metrics;
  private final List<String> failures;

  /**
   * Create an instance.
   *
   * @param curve the curve
   * @param smoothed the smoothed values of the included points (can be null)
   * @param fits the fits
   * @param metrics the metric sets by curve name
   * @param failures the failure descriptions
   */
  RoiAnalysis(TimeIntensityCurve curve, double[] smoothed, ModelFitResults fits,
      Map<String, MetricSet> metrics, List<String> failures) {
    this.curve = curve;
    this.smoothed = smoothed;
    this.fits = fits;
    this.metrics = new LinkedHashMap<>(metrics);
    this.failures = new ArrayList<>(failures);
  }

  /**
   * Gets the curve.
   *
   * @return the curve
   */
  public TimeIntensityCurve getCurve() {
    return curve;
  }

  /**
   * Gets the smoothed values of the included points.
   *
   * @return the smoothed values (empty if smoothing failed)
   */
  public Optional<double[]> getSmoothed() {
    return Optional.ofNullable(smoothed).map(double[]::clone);
  }

  /**
   * Gets the model fits.
   *
   * @return the fits
   */
  public ModelFitResults getFits() {
    return fits;
  }

  /**
   * Gets the metric sets keyed by curve name ({@value #RAW}, {@value #SMOOTHED},
   * {@value #PREDICTED}).
   *
   * @return the metrics
   */
  public Map<String, MetricSet> getMetrics() {
    return Collections.unmodifiableMap(metrics);
  }

  /**
   * Gets the failure descriptions of the stages that could not be computed.
   *
   * @return the failures
   */
  public List<String> getFailures() {
    return Collections.unmodifiableList(failures);
  }

  /**
   * Create the tidy curve rows of the included points.
   *
   * @return the rows
   */
  public List<CurveRow> getCurveRows() {
    return TidyExport.curveRows(curve, smoothed, fits.get(KineticModel.WASH_IN).orElse(null));
  }

  /**
   * Create the tidy parameter rows.
   *
   * @return the rows
   */
  public List<ParameterRow> getParameterRows() {
    return TidyExport.parameterRows(curve.getLabel(), fits, metrics);
  }

  /**
   * Create the predicted wash-in curve rows on the regular export grid.
   *
   * @return the rows (empty if there is no wash-in fit)
   */
  public List<CurveRow> getPredictedRows() {
    final Optional<FitResult> washIn = fits.get(KineticModel.WASH_IN);
    return washIn.isPresent() ? TidyExport.predictedRows(curve.getLabel(), washIn.get())
        : Collections.emptyList();
  }
}
