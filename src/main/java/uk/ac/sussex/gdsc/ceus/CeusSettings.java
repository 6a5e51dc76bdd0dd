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

import ij.Prefs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import uk.ac.sussex.gdsc.ceus.data.FrameRate;
import uk.ac.sussex.gdsc.ceus.event.EventDetector;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.SpatialFilter;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.TemporalFilter;
import uk.ac.sussex.gdsc.ceus.fit.FitOptions;
import uk.ac.sussex.gdsc.ceus.fit.LoessSmoother;
import uk.ac.sussex.gdsc.ceus.region.RegionClassifier;
import uk.ac.sussex.gdsc.ceus.registration.Registrar;

/**
 * The settings for the perfusion analysis.
 *
 * <p>Settings are persisted to the ImageJ preferences using keys with the prefix
 * {@value #PREFIX}. The components of the analysis are created from a copy of the settings so they
 * never read global state during computation.
 */
public class CeusSettings {
  /** The preferences key prefix. */
  public static final String PREFIX = "gdsc.ceus.";

  private static final String KEY_EXCLUDED_FRAMES = PREFIX + "excludedFrames";
  private static final String KEY_WASHOUT_WINDOW = PREFIX + "washoutWindow";
  private static final String KEY_REGISTRATION_SKIP = PREFIX + "registrationSkip";
  private static final String KEY_REGISTRATION_WINDOW = PREFIX + "registrationWindow";
  private static final String KEY_UPSAMPLE = PREFIX + "upsample";
  private static final String KEY_NORMALISE = PREFIX + "normalise";
  private static final String KEY_LOWER_PERCENTILE = PREFIX + "lowerPercentile";
  private static final String KEY_UPPER_PERCENTILE = PREFIX + "upperPercentile";
  private static final String KEY_LOG_COMPRESSION = PREFIX + "logCompression";
  private static final String KEY_SPATIAL_FILTER = PREFIX + "spatialFilter";
  private static final String KEY_TEMPORAL_FILTER = PREFIX + "temporalFilter";
  private static final String KEY_TEMPORAL_WINDOW = PREFIX + "temporalWindow";
  private static final String KEY_BASELINE_FRAMES = PREFIX + "baselineFrames";
  private static final String KEY_LOESS_SPAN = PREFIX + "loessSpan";
  private static final String KEY_LOESS_DEGREE = PREFIX + "loessDegree";
  private static final String KEY_RESTARTS = PREFIX + "restarts";
  private static final String KEY_WASH_IN_MAX_TIME = PREFIX + "washInMaxTime";
  private static final String KEY_DEFAULT_FPS = PREFIX + "defaultFps";
  private static final String KEY_VENDORS = PREFIX + "splitScreenVendors";
  private static final String KEY_THREADS = PREFIX + "threads";

  /** The last settings used. This should be updated after the analysis. */
  private static final AtomicReference<CeusSettings> lastSettings =
      new AtomicReference<>(fromPreferences());

  int excludedFrames;
  int washoutWindow;
  int registrationSkip;
  int registrationWindow;
  int upsample;
  boolean normalise;
  double lowerPercentile;
  double upperPercentile;
  boolean logCompression;
  SpatialFilter spatialFilter;
  TemporalFilter temporalFilter;
  int temporalWindow;
  int baselineFrames;
  double loessSpan;
  int loessDegree;
  int restarts;
  Long seed;
  double washInMaxTime;
  double defaultFps;
  List<String> splitScreenVendors;
  int threads;

  /**
   * Default constructor.
   */
  public CeusSettings() {
    excludedFrames = EventDetector.DEFAULT_EXCLUDED_FRAMES;
    washoutWindow = EventDetector.DEFAULT_WINDOW;
    registrationSkip = Registrar.DEFAULT_SKIP;
    registrationWindow = Registrar.DEFAULT_WINDOW;
    upsample = Registrar.DEFAULT_UPSAMPLE;
    normalise = true;
    lowerPercentile = 1;
    upperPercentile = 99;
    logCompression = true;
    spatialFilter = SpatialFilter.MEDIAN;
    temporalFilter = TemporalFilter.GAUSSIAN;
    temporalWindow = 3;
    baselineFrames = 5;
    loessSpan = LoessSmoother.DEFAULT_SPAN;
    loessDegree = LoessSmoother.DEFAULT_DEGREE;
    restarts = FitOptions.DEFAULT_RESTARTS;
    washInMaxTime = FitOptions.DEFAULT_WASH_IN_MAX_TIME;
    defaultFps = FrameRate.DEFAULT_FPS;
    splitScreenVendors = new ArrayList<>(RegionClassifier.DEFAULT_SPLIT_SCREEN_VENDORS);
    threads = Prefs.getThreads();
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  public CeusSettings(CeusSettings source) {
    excludedFrames = source.excludedFrames;
    washoutWindow = source.washoutWindow;
    registrationSkip = source.registrationSkip;
    registrationWindow = source.registrationWindow;
    upsample = source.upsample;
    normalise = source.normalise;
    lowerPercentile = source.lowerPercentile;
    upperPercentile = source.upperPercentile;
    logCompression = source.logCompression;
    spatialFilter = source.spatialFilter;
    temporalFilter = source.temporalFilter;
    temporalWindow = source.temporalWindow;
    baselineFrames = source.baselineFrames;
    loessSpan = source.loessSpan;
    loessDegree = source.loessDegree;
    restarts = source.restarts;
    seed = source.seed;
    washInMaxTime = source.washInMaxTime;
    defaultFps = source.defaultFps;
    splitScreenVendors = new ArrayList<>(source.splitScreenVendors);
    threads = source.threads;
  }

  /**
   * Copy the settings.
   *
   * @return the settings
   */
  public CeusSettings copy() {
    return new CeusSettings(this);
  }

  /**
   * Load a copy of the last settings. On first use these are read from the ImageJ preferences.
   *
   * @return the settings
   */
  public static CeusSettings load() {
    return lastSettings.get().copy();
  }

  /**
   * Save the settings as the last settings and write them to the ImageJ preferences.
   */
  public void save() {
    lastSettings.set(copy());
    Prefs.set(KEY_EXCLUDED_FRAMES, excludedFrames);
    Prefs.set(KEY_WASHOUT_WINDOW, washoutWindow);
    Prefs.set(KEY_REGISTRATION_SKIP, registrationSkip);
    Prefs.set(KEY_REGISTRATION_WINDOW, registrationWindow);
    Prefs.set(KEY_UPSAMPLE, upsample);
    Prefs.set(KEY_NORMALISE, normalise);
    Prefs.set(KEY_LOWER_PERCENTILE, lowerPercentile);
    Prefs.set(KEY_UPPER_PERCENTILE, upperPercentile);
    Prefs.set(KEY_LOG_COMPRESSION, logCompression);
    Prefs.set(KEY_SPATIAL_FILTER, spatialFilter.ordinal());
    Prefs.set(KEY_TEMPORAL_FILTER, temporalFilter.ordinal());
    Prefs.set(KEY_TEMPORAL_WINDOW, temporalWindow);
    Prefs.set(KEY_BASELINE_FRAMES, baselineFrames);
    Prefs.set(KEY_LOESS_SPAN, loessSpan);
    Prefs.set(KEY_LOESS_DEGREE, loessDegree);
    Prefs.set(KEY_RESTARTS, restarts);
    Prefs.set(KEY_WASH_IN_MAX_TIME, washInMaxTime);
    Prefs.set(KEY_DEFAULT_FPS, defaultFps);
    Prefs.set(KEY_VENDORS, String.join(",", splitScreenVendors));
    Prefs.set(KEY_THREADS, threads);
  }

  /**
   * Read the settings from the ImageJ preferences. Missing keys take the default value.
   *
   * @return the settings
   */
  public static CeusSettings fromPreferences() {
    final CeusSettings s = new CeusSettings();
    s.excludedFrames = (int) Prefs.get(KEY_EXCLUDED_FRAMES, s.excludedFrames);
    s.washoutWindow = (int) Prefs.get(KEY_WASHOUT_WINDOW, s.washoutWindow);
    s.registrationSkip = (int) Prefs.get(KEY_REGISTRATION_SKIP, s.registrationSkip);
    s.registrationWindow = (int) Prefs.get(KEY_REGISTRATION_WINDOW, s.registrationWindow);
    s.upsample = (int) Prefs.get(KEY_UPSAMPLE, s.upsample);
    s.normalise = Prefs.get(KEY_NORMALISE, s.normalise);
    s.lowerPercentile = Prefs.get(KEY_LOWER_PERCENTILE, s.lowerPercentile);
    s.upperPercentile = Prefs.get(KEY_UPPER_PERCENTILE, s.upperPercentile);
    s.logCompression = Prefs.get(KEY_LOG_COMPRESSION, s.logCompression);
    s.spatialFilter = SpatialFilter.fromOrdinal(
        (int) Prefs.get(KEY_SPATIAL_FILTER, s.spatialFilter.ordinal()), s.spatialFilter);
    s.temporalFilter = TemporalFilter.fromOrdinal(
        (int) Prefs.get(KEY_TEMPORAL_FILTER, s.temporalFilter.ordinal()), s.temporalFilter);
    s.temporalWindow = (int) Prefs.get(KEY_TEMPORAL_WINDOW, s.temporalWindow);
    s.baselineFrames = (int) Prefs.get(KEY_BASELINE_FRAMES, s.baselineFrames);
    s.loessSpan = Prefs.get(KEY_LOESS_SPAN, s.loessSpan);
    s.loessDegree = (int) Prefs.get(KEY_LOESS_DEGREE, s.loessDegree);
    s.restarts = (int) Prefs.get(KEY_RESTARTS, s.restarts);
    s.washInMaxTime = Prefs.get(KEY_WASH_IN_MAX_TIME, s.washInMaxTime);
    s.defaultFps = Prefs.get(KEY_DEFAULT_FPS, s.defaultFps);
    s.splitScreenVendors =
        parseVendors(Prefs.get(KEY_VENDORS, String.join(",", s.splitScreenVendors)));
    s.threads = (int) Prefs.get(KEY_THREADS, s.threads);
    return s;
  }

  /**
   * Parse a comma separated list of vendor names. Blank entries are ignored.
   *
   * @param text the text
   * @return the vendors
   */
  static List<String> parseVendors(String text) {
    final List<String> list = new ArrayList<>();
    for (final String vendor : text.split(",")) {
      if (!vendor.trim().isEmpty()) {
        list.add(vendor.trim());
      }
    }
    return list;
  }

  /**
   * Create the region classifier.
   *
   * @return the region classifier
   */
  public RegionClassifier createRegionClassifier() {
    return new RegionClassifier(splitScreenVendors);
  }

  /**
   * Create the event detector.
   *
   * @return the event detector
   */
  public EventDetector createEventDetector() {
    return new EventDetector(excludedFrames, washoutWindow, threads);
  }

  /**
   * Create the registrar.
   *
   * @return the registrar
   */
  public Registrar createRegistrar() {
    return new Registrar(registrationSkip, registrationWindow, upsample, threads);
  }

  /**
   * Create the preprocessor options.
   *
   * @return the preprocessor options
   */
  public PreprocessorOptions createPreprocessorOptions() {
    final PreprocessorOptions options = new PreprocessorOptions();
    options.setNormalise(normalise);
    options.setPercentiles(lowerPercentile, upperPercentile);
    options.setLogCompression(logCompression);
    options.setSpatialFilter(spatialFilter);
    options.setTemporalFilter(temporalFilter);
    options.setTemporalWindow(temporalWindow);
    options.setBaselineFrames(baselineFrames);
    return options;
  }

  /**
   * Create the LOESS smoother.
   *
   * @return the smoother
   */
  public LoessSmoother createSmoother() {
    return new LoessSmoother(loessSpan, loessDegree);
  }

  /**
   * Create the fit options.
   *
   * @return the fit options
   */
  public FitOptions createFitOptions() {
    final FitOptions options = new FitOptions();
    options.setRestarts(restarts);
    options.setSeed(seed);
    options.setWashInMaxTime(washInMaxTime);
    options.setThreads(threads);
    return options;
  }

  /**
   * Gets the number of excluded leading frames for flash detection.
   *
   * @return the excluded frames
   */
  public int getExcludedFrames() {
    return excludedFrames;
  }

  /**
   * Sets the number of excluded leading frames for flash detection.
   *
   * @param excludedFrames the new excluded frames
   */
  public void setExcludedFrames(int excludedFrames) {
    this.excludedFrames = excludedFrames;
  }

  /**
   * Gets the washout search window (frames).
   *
   * @return the washout window
   */
  public int getWashoutWindow() {
    return washoutWindow;
  }

  /**
   * Sets the washout search window (frames).
   *
   * @param washoutWindow the new washout window
   */
  public void setWashoutWindow(int washoutWindow) {
    this.washoutWindow = washoutWindow;
  }

  /**
   * Gets the number of frames skipped before the registration reference window.
   *
   * @return the registration skip
   */
  public int getRegistrationSkip() {
    return registrationSkip;
  }

  /**
   * Sets the number of frames skipped before the registration reference window.
   *
   * @param registrationSkip the new registration skip
   */
  public void setRegistrationSkip(int registrationSkip) {
    this.registrationSkip = registrationSkip;
  }

  /**
   * Gets the number of frames in the registration reference window.
   *
   * @return the registration window
   */
  public int getRegistrationWindow() {
    return registrationWindow;
  }

  /**
   * Sets the number of frames in the registration reference window.
   *
   * @param registrationWindow the new registration window
   */
  public void setRegistrationWindow(int registrationWindow) {
    this.registrationWindow = registrationWindow;
  }

  /**
   * Gets the registration upsampling factor.
   *
   * @return the upsample
   */
  public int getUpsample() {
    return upsample;
  }

  /**
   * Sets the registration upsampling factor.
   *
   * @param upsample the new upsample
   */
  public void setUpsample(int upsample) {
    this.upsample = upsample;
  }

  /**
   * Checks if percentile normalisation is enabled.
   *
   * @return true if enabled
   */
  public boolean isNormalise() {
    return normalise;
  }

  /**
   * Sets the percentile normalisation flag.
   *
   * @param normalise the new normalise flag
   */
  public void setNormalise(boolean normalise) {
    this.normalise = normalise;
  }

  /**
   * Sets the percentiles for normalisation.
   *
   * @param lower the lower percentile
   * @param upper the upper percentile
   */
  public void setPercentiles(double lower, double upper) {
    this.lowerPercentile = lower;
    this.upperPercentile = upper;
  }

  public double getLowerPercentile() {
    return lowerPercentile;
  }

  public double getUpperPercentile() {
    return upperPercentile;
  }

  public boolean isLogCompression() {
    return logCompression;
  }

  public void setLogCompression(boolean logCompression) {
    this.logCompression = logCompression;
  }

  public SpatialFilter getSpatialFilter() {
    return spatialFilter;
  }

  public void setSpatialFilter(SpatialFilter spatialFilter) {
    this.spatialFilter = spatialFilter;
  }

  public TemporalFilter getTemporalFilter() {
    return temporalFilter;
  }

  public void setTemporalFilter(TemporalFilter temporalFilter) {
    this.temporalFilter = temporalFilter;
  }

  public int getTemporalWindow() {
    return temporalWindow;
  }

  public void setTemporalWindow(int temporalWindow) {
    this.temporalWindow = temporalWindow;
  }

  public int getBaselineFrames() {
    return baselineFrames;
  }

  public void setBaselineFrames(int baselineFrames) {
    this.baselineFrames = baselineFrames;
  }

  public double getLoessSpan() {
    return loessSpan;
  }

  public void setLoessSpan(double loessSpan) {
    this.loessSpan = loessSpan;
  }

  public int getLoessDegree() {
    return loessDegree;
  }

  public void setLoessDegree(int loessDegree) {
    this.loessDegree = loessDegree;
  }

  public int getRestarts() {
    return restarts;
  }

  public void setRestarts(int restarts) {
    this.restarts = restarts;
  }

  /**
   * Gets the seed for the fit restarts. Null uses a random seed.
   *
   * @return the seed
   */
  public Long getSeed() {
    return seed;
  }

  /**
   * Sets the seed for the fit restarts. This is not persisted.
   *
   * @param seed the new seed
   */
  public void setSeed(Long seed) {
    this.seed = seed;
  }

  public double getWashInMaxTime() {
    return washInMaxTime;
  }

  public void setWashInMaxTime(double washInMaxTime) {
    this.washInMaxTime = washInMaxTime;
  }

  /**
   * Gets the frame rate used when the recording has no timing metadata.
   *
   * @return the default fps
   */
  public double getDefaultFps() {
    return defaultFps;
  }

  /**
   * Sets the frame rate used when the recording has no timing metadata.
   *
   * @param defaultFps the new default fps
   */
  public void setDefaultFps(double defaultFps) {
    this.defaultFps = defaultFps;
  }

  /**
   * Gets the vendors with a fixed split-screen layout.
   *
   * @return the split screen vendors
   */
  public List<String> getSplitScreenVendors() {
    return Collections.unmodifiableList(splitScreenVendors);
  }

  /**
   * Sets the vendors with a fixed split-screen layout.
   *
   * @param splitScreenVendors the new split screen vendors
   */
  public void setSplitScreenVendors(List<String> splitScreenVendors) {
    this.splitScreenVendors = new ArrayList<>(splitScreenVendors);
  }

  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    this.threads = threads;
  }
}
