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

package uk.ac.sussex.gdsc.ceus.filter;

import org.apache.commons.lang3.Validate;

/**
 * Provides the options for the {@link Preprocessor}.
 */
public class PreprocessorOptions {

  /**
   * The spatial filter applied to each frame.
   */
  public enum SpatialFilter {
    /** No filter. */
    NONE("None"),
    /** A 3x3 median filter. */
    MEDIAN("Median 3x3"),
    /** A Gaussian filter with standard deviation 0.6 pixels. */
    GAUSSIAN("Gaussian");

    private static final SpatialFilter[] values = values();

    private final String description;

    SpatialFilter(String description) {
      this.description = description;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return getDescription();
    }

    /**
     * Create from the enum {@link #ordinal()}.
     *
     * @param ordinal the ordinal
     * @param defaultValue the default value
     * @return the spatial filter
     */
    public static SpatialFilter fromOrdinal(int ordinal, SpatialFilter defaultValue) {
      return ordinal >= 0 && ordinal < values.length ? values[ordinal] : defaultValue;
    }
  }

  /**
   * The temporal filter applied along the time axis of each pixel.
   */
  public enum TemporalFilter {
    /** No filter. */
    NONE("None"),
    /** A Gaussian filter. */
    GAUSSIAN("Gaussian"),
    /** A centred moving mean. */
    MEAN("Mean");

    private static final TemporalFilter[] values = values();

    private final String description;

    TemporalFilter(String description) {
      this.description = description;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return getDescription();
    }

    /**
     * Create from the enum {@link #ordinal()}.
     *
     * @param ordinal the ordinal
     * @param defaultValue the default value
     * @return the temporal filter
     */
    public static TemporalFilter fromOrdinal(int ordinal, TemporalFilter defaultValue) {
      return ordinal >= 0 && ordinal < values.length ? values[ordinal] : defaultValue;
    }
  }

  private boolean normalise;
  private double lowerPercentile;
  private double upperPercentile;
  private boolean logCompression;
  private SpatialFilter spatialFilter;
  private int baselineFrames;
  private TemporalFilter temporalFilter;
  private int temporalWindow;

  /**
   * Create an instance with the default options.
   */
  public PreprocessorOptions() {
    normalise = true;
    lowerPercentile = 1;
    upperPercentile = 99;
    logCompression = true;
    spatialFilter = SpatialFilter.MEDIAN;
    baselineFrames = 5;
    temporalFilter = TemporalFilter.GAUSSIAN;
    temporalWindow = 3;
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  public PreprocessorOptions(PreprocessorOptions source) {
    normalise = source.normalise;
    lowerPercentile = source.lowerPercentile;
    upperPercentile = source.upperPercentile;
    logCompression = source.logCompression;
    spatialFilter = source.spatialFilter;
    baselineFrames = source.baselineFrames;
    temporalFilter = source.temporalFilter;
    temporalWindow = source.temporalWindow;
  }

  /**
   * Create options with every optional step disabled. Only the reduction to luminance is
   * performed.
   *
   * @return the options
   */
  public static PreprocessorOptions none() {
    final PreprocessorOptions options = new PreprocessorOptions();
    options.normalise = false;
    options.logCompression = false;
    options.spatialFilter = SpatialFilter.NONE;
    options.baselineFrames = 0;
    options.temporalFilter = TemporalFilter.NONE;
    return options;
  }

  /**
   * Copy the options.
   *
   * @return the copy
   */
  public PreprocessorOptions copy() {
    return new PreprocessorOptions(this);
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
   * Gets the lower percentile for normalisation.
   *
   * @return the lower percentile
   */
  public double getLowerPercentile() {
    return lowerPercentile;
  }

  /**
   * Gets the upper percentile for normalisation.
   *
   * @return the upper percentile
   */
  public double getUpperPercentile() {
    return upperPercentile;
  }

  /**
   * Sets the percentiles for normalisation.
   *
   * @param lower the lower percentile in [0, 100]
   * @param upper the upper percentile in [0, 100]
   */
  public void setPercentiles(double lower, double upper) {
    Validate.inclusiveBetween(0.0, 100.0, lower, "Lower percentile out of range: %s", lower);
    Validate.inclusiveBetween(0.0, 100.0, upper, "Upper percentile out of range: %s", upper);
    Validate.isTrue(lower <= upper, "Lower percentile above upper percentile");
    this.lowerPercentile = lower;
    this.upperPercentile = upper;
  }

  /**
   * Checks if log compression is enabled.
   *
   * @return true if enabled
   */
  public boolean isLogCompression() {
    return logCompression;
  }

  /**
   * Sets the log compression flag.
   *
   * @param logCompression the new log compression flag
   */
  public void setLogCompression(boolean logCompression) {
    this.logCompression = logCompression;
  }

  /**
   * Gets the spatial filter.
   *
   * @return the spatial filter
   */
  public SpatialFilter getSpatialFilter() {
    return spatialFilter;
  }

  /**
   * Sets the spatial filter.
   *
   * @param spatialFilter the new spatial filter
   */
  public void setSpatialFilter(SpatialFilter spatialFilter) {
    this.spatialFilter = Validate.notNull(spatialFilter, "Spatial filter");
  }

  /**
   * Gets the number of leading frames used for the baseline. Zero disables baseline subtraction.
   *
   * @return the baseline frames
   */
  public int getBaselineFrames() {
    return baselineFrames;
  }

  /**
   * Sets the number of leading frames used for the baseline. Zero disables baseline subtraction.
   *
   * @param baselineFrames the new baseline frames
   */
  public void setBaselineFrames(int baselineFrames) {
    this.baselineFrames = Math.max(0, baselineFrames);
  }

  /**
   * Gets the temporal filter.
   *
   * @return the temporal filter
   */
  public TemporalFilter getTemporalFilter() {
    return temporalFilter;
  }

  /**
   * Sets the temporal filter.
   *
   * @param temporalFilter the new temporal filter
   */
  public void setTemporalFilter(TemporalFilter temporalFilter) {
    this.temporalFilter = Validate.notNull(temporalFilter, "Temporal filter");
  }

  /**
   * Gets the temporal window (frames).
   *
   * @return the temporal window
   */
  public int getTemporalWindow() {
    return temporalWindow;
  }

  /**
   * Sets the temporal window (frames).
   *
   * @param temporalWindow the new temporal window
   */
  public void setTemporalWindow(int temporalWindow) {
    this.temporalWindow = Math.max(1, temporalWindow);
  }
}
