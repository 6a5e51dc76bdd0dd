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

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.ceus.InputShapeException;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.fit.FitOptions;
import uk.ac.sussex.gdsc.ceus.fit.FitResult;
import uk.ac.sussex.gdsc.ceus.fit.KineticModel;
import uk.ac.sussex.gdsc.ceus.fit.ModelFitResults;
import uk.ac.sussex.gdsc.ceus.fit.ModelFitter;
import uk.ac.sussex.gdsc.ceus.metrics.MetricSet;
import uk.ac.sussex.gdsc.ceus.metrics.MetricsEngine;

@SuppressWarnings({"javadoc"})
class TidyExportTest {
  private static TimeIntensityCurve createCurve() {
    final double[] raw = new double[80];
    for (int i = 0; i < raw.length; i++) {
      raw[i] = 5 + 20 * (1 - Math.exp(-0.4 * i / 10.0));
    }
    return TimeIntensityCurve.fromFrames("liver", raw, 10);
  }

  private static ModelFitResults fit(TimeIntensityCurve curve) {
    final FitOptions options = new FitOptions();
    options.setRestarts(10);
    options.setSeed(1L);
    options.setThreads(1);
    return new ModelFitter(options).fit(curve,
        EnumSet.of(KineticModel.WASH_IN, KineticModel.GAMMA_VARIATE));
  }

  @Test
  void testPredictionGrid() {
    final double[] grid = TidyExport.getPredictionGrid();
    Assertions.assertEquals(81, grid.length);
    Assertions.assertEquals(0, grid[0]);
    Assertions.assertEquals(8, grid[80], 1e-10);
    Assertions.assertEquals(0.1, grid[1], 1e-12);
  }

  @Test
  void testCurveRows() {
    final TimeIntensityCurve curve = createCurve();
    curve.setIncluded(3, false);
    final FitResult washIn = fit(curve).get(KineticModel.WASH_IN).get();
    final double[] smoothed = new double[curve.getIncludedCount()];
    final List<CurveRow> rows = TidyExport.curveRows(curve, smoothed, washIn);
    Assertions.assertEquals(79, rows.size());
    Assertions.assertEquals("liver", rows.get(0).getRoi());
    Assertions.assertEquals(0.4, rows.get(3).getTime(), 1e-10);
    Assertions.assertEquals(0, rows.get(0).getRawValue());
    Assertions.assertEquals(0, rows.get(0).getPredictedValue(), 1e-6);
    Assertions.assertEquals(rows.get(50).getRawValue(), rows.get(50).getPredictedValue(), 0.1);

    final List<CurveRow> noFit = TidyExport.curveRows(curve, null, null);
    Assertions.assertTrue(Double.isNaN(noFit.get(1).getSmoothedValue()));
    Assertions.assertTrue(Double.isNaN(noFit.get(1).getPredictedValue()));
    Assertions.assertThrows(InputShapeException.class,
        () -> TidyExport.curveRows(curve, new double[3], null));
  }

  @Test
  void testPredictedRows() {
    final TimeIntensityCurve curve = createCurve();
    final FitResult washIn = fit(curve).get(KineticModel.WASH_IN).get();
    final List<CurveRow> rows = TidyExport.predictedRows("liver", washIn);
    Assertions.assertEquals(81, rows.size());
    Assertions.assertTrue(Double.isNaN(rows.get(10).getRawValue()));
    Assertions.assertEquals(20 * (1 - Math.exp(-0.4 * 8)), rows.get(80).getPredictedValue(),
        0.5);
  }

  @Test
  void testParameterRows() {
    final TimeIntensityCurve curve = createCurve();
    final ModelFitResults fits = fit(curve);
    final Map<String, MetricSet> metrics = new LinkedHashMap<>();
    metrics.put("raw", MetricsEngine.compute(curve.getIncludedTime(),
        curve.getIncludedValues()));
    final List<ParameterRow> rows = TidyExport.parameterRows("liver", fits, metrics);
    final Map<String, Double> byName = rows.stream()
        .collect(Collectors.toMap(ParameterRow::getName, ParameterRow::getValue));
    Assertions.assertEquals("A", rows.get(0).getName());
    final double a = byName.get("A");
    final double b = byName.get("B");
    final double ab = byName.get("A*B");
    Assertions.assertEquals(20, a, 1);
    Assertions.assertEquals(0.4, b, 0.02);
    Assertions.assertEquals(a * b, ab, 1e-10);
    Assertions.assertTrue(byName.containsKey("R2"));
    Assertions.assertTrue(byName.containsKey("GAMMA_VARIATE.alpha"));
    Assertions.assertTrue(byName.containsKey("GAMMA_VARIATE.MTT"));
    Assertions.assertTrue(byName.containsKey("GAMMA_VARIATE.RSS"));
    Assertions.assertTrue(byName.containsKey("raw.AUC"));
    Assertions.assertTrue(byName.containsKey("raw.Slope10-90"));
    for (final ParameterRow row : rows) {
      Assertions.assertEquals("liver", row.getRoi());
    }
  }

  @Test
  void testParameterRowsWithoutFits() {
    final List<ParameterRow> rows = TidyExport.parameterRows("a",
        new ModelFitter(new FitOptions()).fit(new double[0], new double[0],
            Collections.singleton(KineticModel.WASH_IN)),
        Collections.<String, MetricSet>emptyMap());
    Assertions.assertEquals(4, rows.size());
    for (final ParameterRow row : rows) {
      Assertions.assertTrue(Double.isNaN(row.getValue()));
    }
  }
}
