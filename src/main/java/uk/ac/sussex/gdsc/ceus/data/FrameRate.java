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

/**
 * Resolves the video frame rate from container metadata.
 */
public final class FrameRate {
  /** The frame rate used when the container does not provide one. */
  public static final double DEFAULT_FPS = 10.0;

  /** No public construction. */
  private FrameRate() {}

  /**
   * Resolve the frame rate. The first valid value is used in order: the frame time (in
   * milliseconds, converted to 1000 / time), the cine rate, and the recommended display frame
   * rate. Null, non-finite or non-positive values are ignored. If no value is valid then
   * {@link #DEFAULT_FPS} is returned.
   *
   * @param frameTimeMs the frame time in milliseconds (can be null)
   * @param cineRate the cine rate (can be null)
   * @param recommendedRate the recommended display frame rate (can be null)
   * @return the frames per second
   */
  public static double resolve(Double frameTimeMs, Double cineRate, Double recommendedRate) {
    return resolve(frameTimeMs, cineRate, recommendedRate, DEFAULT_FPS);
  }

  /**
   * Resolve the frame rate using the given fallback when the metadata has no valid value.
   *
   * @param frameTimeMs the frame time in milliseconds (can be null)
   * @param cineRate the cine rate (can be null)
   * @param recommendedRate the recommended display frame rate (can be null)
   * @param fallback the fallback frame rate
   * @return the frames per second
   * @see #resolve(Double, Double, Double)
   */
  public static double resolve(Double frameTimeMs, Double cineRate, Double recommendedRate,
      double fallback) {
    if (isValid(frameTimeMs)) {
      return 1000.0 / frameTimeMs;
    }
    if (isValid(cineRate)) {
      return cineRate;
    }
    if (isValid(recommendedRate)) {
      return recommendedRate;
    }
    return fallback;
  }

  private static boolean isValid(Double value) {
    return value != null && value > 0 && !value.isInfinite();
  }
}
