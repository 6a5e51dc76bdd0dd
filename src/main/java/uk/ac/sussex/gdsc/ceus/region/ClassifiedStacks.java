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

import java.util.Optional;
import org.apache.commons.lang3.Validate;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;

/**
 * The B-mode and contrast volumes extracted from a recording.
 *
 * <p>The contrast volume is always present.
 */
public final class ClassifiedStacks {
  /** The region index used when the volume is not taken from a region. */
  public static final int NO_INDEX = -1;

  private final PixelVolume bmode;
  private final PixelVolume ceus;
  private final ClassificationCase classificationCase;
  private final int bmodeIndex;
  private final int ceusIndex;

  /**
   * Create an instance.
   *
   * @param bmode the B-mode volume (can be null)
   * @param ceus the contrast volume
   * @param classificationCase the classification case
   * @param bmodeIndex the B-mode region index
   * @param ceusIndex the contrast region index
   */
  ClassifiedStacks(PixelVolume bmode, PixelVolume ceus, ClassificationCase classificationCase,
      int bmodeIndex, int ceusIndex) {
    this.bmode = bmode;
    this.ceus = Validate.notNull(ceus, "Contrast volume");
    this.classificationCase = classificationCase;
    this.bmodeIndex = bmode == null ? NO_INDEX : bmodeIndex;
    this.ceusIndex = ceusIndex;
  }

  /**
   * Gets the B-mode volume.
   *
   * @return the B-mode volume
   */
  public Optional<PixelVolume> getBmode() {
    return Optional.ofNullable(bmode);
  }

  /**
   * Gets the contrast volume.
   *
   * @return the contrast volume
   */
  public PixelVolume getCeus() {
    return ceus;
  }

  /**
   * Gets the classification case.
   *
   * @return the classification case
   */
  public ClassificationCase getClassificationCase() {
    return classificationCase;
  }

  /**
   * Gets the index of the B-mode region descriptor, or {@link #NO_INDEX}.
   *
   * @return the B-mode index
   */
  public int getBmodeIndex() {
    return bmodeIndex;
  }

  /**
   * Gets the index of the contrast region descriptor, or {@link #NO_INDEX}.
   *
   * @return the contrast index
   */
  public int getCeusIndex() {
    return ceusIndex;
  }

  @Override
  public String toString() {
    return String.format("ClassifiedStacks[%s, bmode=%d, ceus=%d]", classificationCase,
        bmodeIndex, ceusIndex);
  }
}
