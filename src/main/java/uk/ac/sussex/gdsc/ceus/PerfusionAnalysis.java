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
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.RecordingMetadata;
import uk.ac.sussex.gdsc.ceus.data.RegionDescriptor;
import uk.ac.sussex.gdsc.ceus.data.RoiSession;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.event.FlashEvent;
import uk.ac.sussex.gdsc.ceus.filter.Preprocessor;
import uk.ac.sussex.gdsc.ceus.fit.FitOptions;
import uk.ac.sussex.gdsc.ceus.fit.FitResult;
import uk.ac.sussex.gdsc.ceus.fit.KineticModel;
import uk.ac.sussex.gdsc.ceus.fit.ModelFitResults;
import uk.ac.sussex.gdsc.ceus.fit.ModelFitter;
import uk.ac.sussex.gdsc.ceus.metrics.MetricSet;
import uk.ac.sussex.gdsc.ceus.metrics.MetricsEngine;
import uk.ac.sussex.gdsc.ceus.region.ClassifiedStacks;
import uk.ac.sussex.gdsc.ceus.registration.RegistrationResult;
import uk.ac.sussex.gdsc.ceus.tic.TicExtraction;
import uk.ac.sussex.gdsc.ceus.tic.TicExtractor;

/**
 * Runs the perfusion analysis of a contrast-enhanced ultrasound recording.
 *
 * <p>The stages are: classify the regions; detect the flash; register the contrast video (using
 * the B-mode video to estimate the motion when available); preprocess; extract the curve of each
 * ROI; smooth, fit and summarise each curve. Each stage can be called independently.
 *
 * <p>Failures of a single ROI or model are recorded with the partial results. Only failures that
 * prevent any analysis (no frames) are thrown.
 */
public class PerfusionAnalysis {
  private static final Logger logger = Logger.getLogger(PerfusionAnalysis.class.getName());

  private final CeusSettings settings;
  private final Set<KineticModel> models;

  /**
   * Create an instance fitting all the models.
   *
   * @param settings the settings
   */
  public PerfusionAnalysis(CeusSettings settings) {
    this(settings, EnumSet.allOf(KineticModel.class));
  }

  /**
   * Create an instance.
   *
   * @param settings the settings
   * @param models the models to fit to each curve
   */
  public PerfusionAnalysis(CeusSettings settings, Collection<KineticModel> models) {
    this.settings = settings.copy();
    this.models = models.isEmpty() ? EnumSet.noneOf(KineticModel.class) : EnumSet.copyOf(models);
  }

  /**
   * Classify the regions of the recording.
   *
   * @param volume the volume
   * @param regions the region descriptors
   * @param metadata the metadata
   * @return the classified stacks
   */
  public ClassifiedStacks classify(PixelVolume volume, List<RegionDescriptor> regions,
      RecordingMetadata metadata) {
    return settings.createRegionClassifier().classify(volume, regions, metadata);
  }

  /**
   * Detect the flash in the contrast volume.
   *
   * @param ceus the contrast volume
   * @return the event
   */
  public FlashEvent detectEvents(PixelVolume ceus) {
    return settings.createEventDetector().detect(ceus);
  }

  /**
   * Register the contrast volume, estimating the motion on the B-mode volume when it is present
   * and has the same frame size.
   *
   * @param classified the classified stacks
   * @return the registration result
   */
  public RegistrationResult register(ClassifiedStacks classified) {
    return settings.createRegistrar().register(classified.getCeus(),
        classified.getBmode().orElse(null));
  }

  /**
   * Preprocess the contrast volume.
   *
   * @param ceus the contrast volume
   * @return the processed volume
   */
  public PixelVolume preprocess(PixelVolume ceus) {
    return new Preprocessor(settings.createPreprocessorOptions(), settings.getThreads())
        .process(ceus);
  }

  /**
   * Extract the curve of each ROI of the session.
   *
   * @param volume the volume
   * @param session the session
   * @param fps the frame rate
   * @return the extraction
   */
  public TicExtraction extract(PixelVolume volume, RoiSession session, double fps) {
    return new TicExtractor(fps, settings.getThreads()).extractAll(volume, session);
  }

  /**
   * Smooth, fit and summarise the included points of the curve.
   *
   * @param curve the curve
   * @param onsetHint the onset time hint for the bolus models (can be null)
   * @return the analysis
   */
  public RoiAnalysis analyse(TimeIntensityCurve curve, Double onsetHint) {
    final double[] t = curve.getIncludedTime();
    final double[] y = curve.getIncludedValues();
    final List<String> failures = new ArrayList<>();
    final Map<String, MetricSet> metrics = new LinkedHashMap<>();
    metrics.put(RoiAnalysis.RAW, MetricsEngine.compute(t, y));

    double[] smoothed = null;
    try {
      smoothed = settings.createSmoother().smooth(t, y);
      metrics.put(RoiAnalysis.SMOOTHED, MetricsEngine.compute(t, smoothed, y));
    } catch (final InsufficientDataException ex) {
      logger.warning(() -> curve.getLabel() + ": smoothing failed: " + ex.getMessage());
      failures.add("Smoothing: " + ex.getMessage());
      metrics.put(RoiAnalysis.SMOOTHED, MetricSet.NAN);
    }

    final FitOptions fitOptions = settings.createFitOptions();
    if (onsetHint != null && t.length != 0 && onsetHint >= t[0] && onsetHint <= t[t.length - 1]) {
      fitOptions.setOnsetHint(onsetHint);
    }
    final ModelFitResults fits = new ModelFitter(fitOptions).fit(t, y, models);
    fits.getFailures().forEach((model, message) -> failures.add(model + ": " + message));

    final Optional<FitResult> washIn = fits.get(KineticModel.WASH_IN);
    metrics.put(RoiAnalysis.PREDICTED, washIn.isPresent()
        ? MetricsEngine.compute(t, washIn.get().predict(t), y)
        : MetricSet.NAN);
    return new RoiAnalysis(curve, smoothed, fits, metrics, failures);
  }

  /**
   * Run the full analysis.
   *
   * @param volume the volume
   * @param regions the region descriptors
   * @param metadata the metadata
   * @param session the ROI session
   * @return the result
   */
  public AnalysisResult run(PixelVolume volume, List<RegionDescriptor> regions,
      RecordingMetadata metadata, RoiSession session) {
    final ClassifiedStacks classified = classify(volume, regions, metadata);
    logger.fine(() -> "Classification: " + classified);
    final double fps = metadata.getFrameRate(settings.getDefaultFps());

    FlashEvent event = null;
    try {
      event = detectEvents(classified.getCeus());
    } catch (final InsufficientDataException ex) {
      logger.warning(() -> "Event detection failed: " + ex.getMessage());
    }

    final RegistrationResult registration = register(classified);
    final PixelVolume processed = preprocess(registration.getCorrected());
    final TicExtraction extraction = extract(processed, session, fps);

    final Double onsetHint = event == null ? null : event.getFlashTime(fps);
    final Map<String, RoiAnalysis> rois = new LinkedHashMap<>();
    extraction.getCurves().forEach((label, curve) -> rois.put(label, analyse(curve, onsetHint)));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("Analysed %d ROIs (%d failed) at %.3f fps: %s", rois.size(),
          extraction.getFailures().size(), fps, Arrays.toString(rois.keySet().toArray())));
    }
    return new AnalysisResult(classified, event, registration, processed, fps, rois,
        extraction.getFailures());
  }
}
