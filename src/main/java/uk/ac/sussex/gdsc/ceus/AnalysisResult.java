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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.event.FlashEvent;
import uk.ac.sussex.gdsc.ceus.region.ClassifiedStacks;
import uk.ac.sussex.gdsc.ceus.registration.RegistrationResult;

/**
 * The result of a full perfusion analysis of a recording.
 */
public final class AnalysisResult {
  private final ClassifiedStacks classified;
  private final FlashEvent event;
  private final RegistrationResult registration;
  private final PixelVolume processed;
  private final double fps;
  private final Map<String, RoiAnalysis> rois;
  private final Map<String, String> failures;

  /**
   * Create an instance.
   *
   * @param classified the classified stacks
   * @param event the flash event (can be null)
   * @param registration the registration result
   * @param processed the processed contrast volume
   * @param fps the frame rate
   * @param rois the ROI analyses by label
   * @param failures the ROI failures by label
   */
  AnalysisResult(ClassifiedStacks classified, FlashEvent event, RegistrationResult registration,
      PixelVolume processed, double fps, Map<String, RoiAnalysis> rois,
      Map<String, String> failures) {
    this.classified = classified;
    this.event = event;
    this.registration = registration;
    this.processed = processed;
    this.fps = fps;
    this.rois = new LinkedHashMap<>(rois);
    this.failures = new LinkedHashMap<>(failures);
  }

  /**
   * Gets the classified stacks.
   *
   * @return the classified stacks
   */
  public ClassifiedStacks getClassified() {
    return classified;
  }

  /**
   * Gets the flash event. This is null if the contrast volume has too few frames.
   *
   * @return the event
   */
  public FlashEvent getEvent() {
    return event;
  }

  /**
   * Gets the registration result.
   *
   * @return the registration
   */
  public RegistrationResult getRegistration() {
    return registration;
  }

  /**
   * Gets the processed contrast volume.
   *
   * @return the processed volume
   */
  public PixelVolume getProcessed() {
    return processed;
  }

  /**
   * Gets the frame rate.
   *
   * @return the fps
   */
  public double getFps() {
    return fps;
  }

  /**
   * Gets the ROI analyses by label.
   *
   * @return the ROI analyses
   */
  public Map<String, RoiAnalysis> getRois() {
    return Collections.unmodifiableMap(rois);
  }

  /**
   * Gets the failure descriptions of ROIs that could not be extracted.
   *
   * @return the failures
   */
  public Map<String, String> getFailures() {
    return Collections.unmodifiableMap(failures);
  }
}
