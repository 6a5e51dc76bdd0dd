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

import java.awt.Color;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.ceus.data.PerfusionRoi;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.RecordingMetadata;
import uk.ac.sussex.gdsc.ceus.data.RegionDescriptor;
import uk.ac.sussex.gdsc.ceus.data.RoiSession;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.SpatialFilter;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.TemporalFilter;
import uk.ac.sussex.gdsc.ceus.fit.FitResult;
import uk.ac.sussex.gdsc.ceus.fit.KineticModel;
import uk.ac.sussex.gdsc.ceus.metrics.MetricSet;
import uk.ac.sussex.gdsc.ceus.region.ClassificationCase;

@SuppressWarnings({"javadoc"})
class PerfusionAnalysisTest {
  private static final int SIZE = 64;
  private static final double FPS = 10;

  /**
   * Create a uniform wash-in recording: {@code 50 + 150 (1 - exp(-0.4 t))}.
   */
  private static PixelVolume createWashIn(int frames) {
    return createWashIn(frames, 0.4);
  }

  /**
   * Create a uniform wash-in recording: {@code 50 + 150 (1 - exp(-rate t))}.
   */
  private static PixelVolume createWashIn(int frames, double rate) {
    final float[][] data = new float[frames][SIZE * SIZE];
    for (int i = 0; i < frames; i++) {
      final double t = i / FPS;
      Arrays.fill(data[i], (float) (50 + 150 * (1 - Math.exp(-rate * t))));
    }
    return PixelVolume.ofFloat(SIZE, SIZE, data);
  }

  /**
   * Settings with every optional preprocessing step disabled.
   */
  private static CeusSettings createSettings() {
    final CeusSettings settings = new CeusSettings();
    settings.setNormalise(false);
    settings.setLogCompression(false);
    settings.setSpatialFilter(SpatialFilter.NONE);
    settings.setTemporalFilter(TemporalFilter.NONE);
    settings.setBaselineFrames(0);
    settings.setRestarts(10);
    settings.setSeed(7L);
    settings.setThreads(1);
    return settings;
  }

  @Test
  void testRunWashIn() {
    final RoiSession session = new RoiSession();
    session.add(PerfusionRoi.rectangle("full", 0, 0, SIZE - 1, SIZE - 1, Color.RED));
    final RecordingMetadata metadata = new RecordingMetadata(null, null, 100.0, null, null);
    final AnalysisResult result = new PerfusionAnalysis(createSettings()).run(createWashIn(60),
        Collections.<RegionDescriptor>emptyList(), metadata, session);

    Assertions.assertEquals(ClassificationCase.NO_REGION,
        result.getClassified().getClassificationCase());
    Assertions.assertEquals(FPS, result.getFps());
    Assertions.assertNotNull(result.getEvent());
    Assertions.assertEquals(0, result.getRegistration().getShifts().getRmsd(), 1e-10);
    Assertions.assertTrue(result.getFailures().isEmpty());

    final RoiAnalysis roi = result.getRois().get("full");
    Assertions.assertNotNull(roi);
    final double[] values = roi.getCurve().getValues();
    Assertions.assertEquals(0, values[0]);
    for (int i = 1; i < values.length; i++) {
      Assertions.assertTrue(values[i] >= values[i - 1], "Curve is not non-decreasing");
    }

    final FitResult washIn = roi.getFits().get(KineticModel.WASH_IN).get();
    Assertions.assertEquals(150, washIn.getParameter("A"), 150 * 0.05);
    Assertions.assertEquals(0.4, washIn.getParameter("B"), 0.4 * 0.05);

    final MetricSet raw = roi.getMetrics().get(RoiAnalysis.RAW);
    Assertions.assertTrue(raw.getAuc() > 0);
    Assertions.assertTrue(raw.getMtt() > 0 && Double.isFinite(raw.getMtt()));
    Assertions.assertTrue(roi.getSmoothed().isPresent());
    Assertions.assertTrue(roi.getMetrics().get(RoiAnalysis.PREDICTED).getRSquared() > 0.999);

    Assertions.assertEquals(60, roi.getCurveRows().size());
    Assertions.assertEquals(81, roi.getPredictedRows().size());
    Assertions.assertFalse(roi.getParameterRows().isEmpty());
  }

  @Test
  void testRunSlowWashInFullFrame() {
    final RoiSession session = new RoiSession();
    session.add(PerfusionRoi.rectangle("full", 0, 0, SIZE - 1, SIZE - 1, Color.RED));
    final RecordingMetadata metadata = new RecordingMetadata(null, null, 100.0, null, null);
    final AnalysisResult result = new PerfusionAnalysis(createSettings(),
        EnumSet.of(KineticModel.WASH_IN)).run(createWashIn(50, 0.1),
            Collections.<RegionDescriptor>emptyList(), metadata, session);
    Assertions.assertEquals(FPS, result.getFps());

    final RoiAnalysis roi = result.getRois().get("full");
    Assertions.assertNotNull(roi);
    final double[] values = roi.getCurve().getValues();
    Assertions.assertEquals(50, values.length);
    for (int i = 1; i < values.length; i++) {
      Assertions.assertTrue(values[i] >= values[i - 1], "Curve is not non-decreasing");
    }

    final FitResult washIn = roi.getFits().get(KineticModel.WASH_IN).get();
    final double a = washIn.getParameter("A");
    final double b = washIn.getParameter("B");
    Assertions.assertEquals(150, a, 150 * 0.1);
    Assertions.assertEquals(0.1, b, 0.1 * 0.1);

    final MetricSet raw = roi.getMetrics().get(RoiAnalysis.RAW);
    Assertions.assertTrue(raw.getAuc() > 0 && Double.isFinite(raw.getAuc()));
    Assertions.assertTrue(raw.getMtt() > 0 && Double.isFinite(raw.getMtt()));
  }

  @Test
  void testRunIsolatesInvalidRoi() {
    final RoiSession session = new RoiSession();
    session.add(PerfusionRoi.rectangle("good", 10, 10, 30, 30, Color.RED));
    session.add(PerfusionRoi.rectangle("tiny", 0, 0, 1, 1, Color.BLUE));
    final AnalysisResult result =
        new PerfusionAnalysis(createSettings(), EnumSet.of(KineticModel.WASH_IN)).run(
            createWashIn(30), Collections.<RegionDescriptor>emptyList(),
            RecordingMetadata.EMPTY, session);
    Assertions.assertEquals(FPS, result.getFps());
    Assertions.assertTrue(result.getRois().containsKey("good"));
    Assertions.assertFalse(result.getRois().containsKey("tiny"));
    Assertions.assertTrue(result.getFailures().containsKey("tiny"));
  }

  @Test
  void testAnalyseRecordsFailures() {
    final TimeIntensityCurve curve =
        TimeIntensityCurve.fromFrames("short", new double[] {1, 2}, 1);
    final RoiAnalysis analysis =
        new PerfusionAnalysis(createSettings()).analyse(curve, null);
    Assertions.assertFalse(analysis.getSmoothed().isPresent());
    Assertions.assertFalse(analysis.getFailures().isEmpty());
    Assertions.assertTrue(analysis.getFits().getResults().isEmpty());
    Assertions.assertEquals(KineticModel.values().length,
        analysis.getFits().getFailures().size());
  }

  @Test
  void testExcludedPointsAreIgnored() {
    final double[] raw = new double[50];
    for (int i = 0; i < raw.length; i++) {
      raw[i] = 10 + 30 * (1 - Math.exp(-0.5 * i / FPS));
    }
    raw[0] = 500;
    final TimeIntensityCurve curve = TimeIntensityCurve.fromFrames("a", raw, FPS);
    curve.setIncluded(0, false);
    final RoiAnalysis analysis = new PerfusionAnalysis(createSettings(),
        EnumSet.of(KineticModel.WASH_IN)).analyse(curve, null);
    Assertions.assertEquals(49, analysis.getCurveRows().size());
    final FitResult washIn = analysis.getFits().get(KineticModel.WASH_IN).get();
    Assertions.assertEquals(49, washIn.getTime().length);
  }
}
