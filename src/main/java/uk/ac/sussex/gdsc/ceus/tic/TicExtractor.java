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

package uk.ac.sussex.gdsc.ceus.tic;

import java.util.logging.Logger;
import uk.ac.sussex.gdsc.ceus.CeusException;
import uk.ac.sussex.gdsc.ceus.InvalidRoiException;
import uk.ac.sussex.gdsc.ceus.data.PerfusionRoi;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.RoiSession;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.utils.ConcurrencyUtils;

/**
 * Extracts the time-intensity curve of a region of interest: the mean luminance inside the ROI
 * of each frame.
 */
public class TicExtractor {
  private static final Logger logger = Logger.getLogger(TicExtractor.class.getName());

  private final double fps;
  private final int threads;

  /**
   * Create an instance using a single thread.
   *
   * @param fps the frame rate used for the time axis
   */
  public TicExtractor(double fps) {
    this(fps, 1);
  }

  /**
   * Create an instance.
   *
   * @param fps the frame rate used for the time axis
   * @param threads the number of threads (non-positive to use the ImageJ preference)
   */
  public TicExtractor(double fps, int threads) {
    if (!(fps > 0) || Double.isInfinite(fps)) {
      throw new IllegalArgumentException("Frame rate must be positive: " + fps);
    }
    this.fps = fps;
    this.threads = threads;
  }

  /**
   * Gets the frame rate.
   *
   * @return the frame rate
   */
  public double getFps() {
    return fps;
  }

  /**
   * Compute the raw mean intensity inside the mask for each frame. Frames are processed in
   * parallel.
   *
   * @param volume the volume
   * @param mask the mask
   * @param threads the number of threads (non-positive to use the ImageJ preference)
   * @return the trace
   */
  public static double[] trace(PixelVolume volume, RoiMask mask, int threads) {
    final double[] trace = new double[volume.getFrames()];
    ConcurrencyUtils.forEach(threads, trace.length,
        t -> trace[t] = mask.mean(volume.getLuminance(t)));
    return trace;
  }

  /**
   * Extract the curve for the ROI.
   *
   * @param volume the volume
   * @param roi the roi
   * @return the curve
   * @throws InvalidRoiException if the ROI is degenerate
   */
  public TimeIntensityCurve extract(PixelVolume volume, PerfusionRoi roi) {
    final RoiMask mask = RoiMask.create(roi, volume.getWidth(), volume.getHeight());
    return TimeIntensityCurve.fromFrames(roi.getLabel(), trace(volume, mask, threads), fps);
  }

  /**
   * Extract the curves for every ROI of the session. A failure of one ROI is recorded and does
   * not prevent extraction of the others.
   *
   * @param volume the volume
   * @param session the session
   * @return the extraction
   */
  public TicExtraction extractAll(PixelVolume volume, RoiSession session) {
    final TicExtraction result = new TicExtraction();
    for (final PerfusionRoi roi : session) {
      try {
        result.addCurve(extract(volume, roi));
      } catch (final CeusException ex) {
        logger.warning(() -> "TIC extraction failed for " + roi.getLabel() + ": "
            + ex.getMessage());
        result.addFailure(roi.getLabel(), ex.getMessage());
      }
    }
    return result;
  }
}
