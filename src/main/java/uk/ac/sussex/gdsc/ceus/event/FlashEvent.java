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

package uk.ac.sussex.gdsc.ceus.event;

/**
 * The microbubble destruction flash and the subsequent washout minimum.
 */
public final class FlashEvent {
  private final int flashIndex;
  private final int washoutIndex;
  private final double[] intensityTrace;

  /**
   * Create an instance.
   *
   * @param flashIndex the flash frame index
   * @param washoutIndex the washout frame index
   * @param intensityTrace the per-frame mean intensity
   */
  FlashEvent(int flashIndex, int washoutIndex, double[] intensityTrace) {
    this.flashIndex = flashIndex;
    this.washoutIndex = washoutIndex;
    this.intensityTrace = intensityTrace;
  }

  /**
   * Gets the flash frame index.
   *
   * @return the flash index
   */
  public int getFlashIndex() {
    return flashIndex;
  }

  /**
   * Gets the washout frame index (the minimum intensity after the flash).
   *
   * @return the washout index
   */
  public int getWashoutIndex() {
    return washoutIndex;
  }

  /**
   * Gets a copy of the per-frame mean intensity.
   *
   * @return the intensity trace
   */
  public double[] getIntensityTrace() {
    return intensityTrace.clone();
  }

  /**
   * Gets the flash time in seconds.
   *
   * @param fps the frame rate
   * @return the flash time
   */
  public double getFlashTime(double fps) {
    return flashIndex / fps;
  }

  @Override
  public String toString() {
    return "FlashEvent[flash=" + flashIndex + ", washout=" + washoutIndex + "]";
  }
}
