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

package uk.ac.sussex.gdsc.ceus.registration;

import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.ShiftTable;

/**
 * The motion corrected volume and the shifts used to correct it.
 */
public final class RegistrationResult {
  /** The source label when shifts are estimated on the B-mode volume. */
  public static final String SOURCE_BMODE = "B-mode";
  /** The source label when shifts are estimated on the contrast volume. */
  public static final String SOURCE_CEUS = "CEUS";

  private final PixelVolume corrected;
  private final ShiftTable shifts;
  private final String source;

  /**
   * Create an instance.
   *
   * @param corrected the corrected volume
   * @param shifts the shifts
   * @param source the source label of the estimation volume
   */
  RegistrationResult(PixelVolume corrected, ShiftTable shifts, String source) {
    this.corrected = corrected;
    this.shifts = shifts;
    this.source = source;
  }

  /**
   * Gets the corrected volume.
   *
   * @return the corrected volume
   */
  public PixelVolume getCorrected() {
    return corrected;
  }

  /**
   * Gets the shifts.
   *
   * @return the shifts
   */
  public ShiftTable getShifts() {
    return shifts;
  }

  /**
   * Gets the source label of the volume used to estimate the shifts.
   *
   * @return the source
   */
  public String getSource() {
    return source;
  }
}
