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

package uk.ac.sussex.gdsc.ceus.region;

/**
 * The rule used to assign the B-mode and contrast regions of a recording.
 */
public enum ClassificationCase {
  /** A region is explicitly tagged as contrast data. */
  EXPLICIT_CONTRAST("Explicit contrast region"),
  /** Side-by-side display from a vendor with a fixed layout: B-mode left, contrast right. */
  SPLIT_SCREEN_KNOWN_VENDOR("Split screen (vendor layout)"),
  /** Side-by-side display classified by colour variance. */
  SPLIT_SCREEN_GENERIC("Split screen (colour variance)"),
  /** A single usable region. */
  SINGLE_REGION("Single region"),
  /** No usable region; the whole frame is used. */
  NO_REGION("Whole frame");

  private final String description;

  ClassificationCase(String description) {
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
}
