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

import java.util.Locale;

/**
 * Metadata of the recording supplied by the container layer.
 */
public final class RecordingMetadata {
  /** Metadata with no values. */
  public static final RecordingMetadata EMPTY = new RecordingMetadata(null, null, null, null, null);

  private final String manufacturer;
  private final String photometricInterpretation;
  private final Double frameTimeMs;
  private final Double cineRate;
  private final Double recommendedFrameRate;

  /**
   * Create an instance.
   *
   * @param manufacturer the scanner manufacturer (can be null)
   * @param photometricInterpretation the photometric interpretation (can be null)
   * @param frameTimeMs the frame time in milliseconds (can be null)
   * @param cineRate the cine rate (can be null)
   * @param recommendedFrameRate the recommended display frame rate (can be null)
   */
  public RecordingMetadata(String manufacturer, String photometricInterpretation,
      Double frameTimeMs, Double cineRate, Double recommendedFrameRate) {
    this.manufacturer = manufacturer;
    this.photometricInterpretation = photometricInterpretation;
    this.frameTimeMs = frameTimeMs;
    this.cineRate = cineRate;
    this.recommendedFrameRate = recommendedFrameRate;
  }

  /**
   * Gets the manufacturer.
   *
   * @return the manufacturer (or empty string)
   */
  public String getManufacturer() {
    return manufacturer == null ? "" : manufacturer;
  }

  /**
   * Gets the photometric interpretation.
   *
   * @return the photometric interpretation (or empty string)
   */
  public String getPhotometricInterpretation() {
    return photometricInterpretation == null ? "" : photometricInterpretation;
  }

  /**
   * Checks if the pixel data is luma/chroma (YBR) encoded.
   *
   * @return true if YBR
   */
  public boolean isYbr() {
    return getPhotometricInterpretation().toUpperCase(Locale.ROOT).contains("YBR");
  }

  /**
   * Gets the frame rate resolved from the metadata.
   *
   * @return the frame rate
   * @see FrameRate#resolve(Double, Double, Double)
   */
  public double getFrameRate() {
    return FrameRate.resolve(frameTimeMs, cineRate, recommendedFrameRate);
  }

  /**
   * Gets the frame rate resolved from the metadata, or the fallback if there is no valid value.
   *
   * @param fallback the fallback frame rate
   * @return the frame rate
   */
  public double getFrameRate(double fallback) {
    return FrameRate.resolve(frameTimeMs, cineRate, recommendedFrameRate, fallback);
  }
}
