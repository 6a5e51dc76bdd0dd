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

package uk.ac.sussex.gdsc.ceus.data;

import java.util.Arrays;
import uk.ac.sussex.gdsc.ceus.InputShapeException;

/**
 * A time-intensity curve (TIC) for a region of interest.
 *
 * <p>Stores the raw mean intensity of each frame and a caller-controlled flag for each frame
 * marking it as included in the analysis. The curve values are the change in intensity from the
 * first included frame; these are recomputed from the raw trace on each request so the inclusion
 * flags can be toggled without loss.
 */
public class TimeIntensityCurve {
  private final String label;
  private final double[] time;
  private final double[] raw;
  private final boolean[] included;

  /**
   * Create an instance with all frames included.
   *
   * @param label the label
   * @param time the time of each frame (seconds, non-decreasing)
   * @param raw the raw intensity of each frame
   */
  public TimeIntensityCurve(String label, double[] time, double[] raw) {
    if (time.length != raw.length) {
      throw new InputShapeException(
          "Time and intensity lengths differ: " + time.length + " != " + raw.length);
    }
    for (int i = 1; i < time.length; i++) {
      if (time[i] < time[i - 1]) {
        throw new InputShapeException("Time must be non-decreasing at index " + i);
      }
    }
    this.label = label;
    this.time = time.clone();
    this.raw = raw.clone();
    this.included = new boolean[time.length];
    Arrays.fill(included, true);
  }

  /**
   * Create an instance using frame times {@code i / fps}.
   *
   * @param label the label
   * @param raw the raw intensity of each frame
   * @param fps the frames per second
   * @return the curve
   */
  public static TimeIntensityCurve fromFrames(String label, double[] raw, double fps) {
    if (!(fps > 0)) {
      throw new IllegalArgumentException("Frame rate must be positive: " + fps);
    }
    final double[] time = new double[raw.length];
    for (int i = 0; i < time.length; i++) {
      time[i] = i / fps;
    }
    return new TimeIntensityCurve(label, time, raw);
  }

  /**
   * Gets the label.
   *
   * @return the label
   */
  public String getLabel() {
    return label;
  }

  /**
   * Gets the number of frames.
   *
   * @return the size
   */
  public int size() {
    return time.length;
  }

  /**
   * Gets the time of each frame.
   *
   * @return the time
   */
  public double[] getTime() {
    return time.clone();
  }

  /**
   * Gets the raw intensity of each frame.
   *
   * @return the raw intensity
   */
  public double[] getRaw() {
    return raw.clone();
  }

  /**
   * Gets the change in intensity of each frame from the first included frame. If no frames are
   * included all values are NaN.
   *
   * @return the values
   */
  public double[] getValues() {
    final int first = getFirstIncluded();
    final double[] values = new double[raw.length];
    if (first < 0) {
      Arrays.fill(values, Double.NaN);
      return values;
    }
    final double baseline = raw[first];
    for (int i = 0; i < values.length; i++) {
      values[i] = raw[i] - baseline;
    }
    return values;
  }

  /**
   * Gets the index of the first included frame.
   *
   * @return the index (or -1)
   */
  public int getFirstIncluded() {
    for (int i = 0; i < included.length; i++) {
      if (included[i]) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Checks if the frame is included.
   *
   * @param index the index
   * @return true if included
   */
  public boolean isIncluded(int index) {
    return included[index];
  }

  /**
   * Sets the included flag of the frame.
   *
   * @param index the index
   * @param include the include flag
   */
  public void setIncluded(int index, boolean include) {
    included[index] = include;
  }

  /**
   * Toggle the included flag of the frame.
   *
   * @param index the index
   * @return the new flag
   */
  public boolean toggleIncluded(int index) {
    included[index] = !included[index];
    return included[index];
  }

  /**
   * Include all frames.
   */
  public void includeAll() {
    Arrays.fill(included, true);
  }

  /**
   * Gets a copy of the included flags.
   *
   * @return the included mask
   */
  public boolean[] getIncludedMask() {
    return included.clone();
  }

  /**
   * Gets the number of included frames.
   *
   * @return the count
   */
  public int getIncludedCount() {
    int count = 0;
    for (final boolean b : included) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /**
   * Gets the time of the included frames.
   *
   * @return the included times
   */
  public double[] getIncludedTime() {
    return select(time);
  }

  /**
   * Gets the values of the included frames.
   *
   * @return the included values
   * @see #getValues()
   */
  public double[] getIncludedValues() {
    return select(getValues());
  }

  private double[] select(double[] data) {
    final double[] out = new double[getIncludedCount()];
    int count = 0;
    for (int i = 0; i < data.length; i++) {
      if (included[i]) {
        out[count++] = data[i];
      }
    }
    return out;
  }
}
