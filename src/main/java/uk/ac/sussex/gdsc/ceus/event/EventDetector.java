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

import java.util.logging.Logger;
import uk.ac.sussex.gdsc.ceus.InsufficientDataException;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.utils.ConcurrencyUtils;

/**
 * Detects the flash (the largest drop in mean intensity between consecutive frames) and the
 * washout (the lowest mean intensity shortly after the flash).
 *
 * <p>The leading frames can be excluded from the flash search to avoid transients at the start
 * of the recording.
 */
public class EventDetector {
  private static final Logger logger = Logger.getLogger(EventDetector.class.getName());

  /** The default number of excluded leading frames. */
  public static final int DEFAULT_EXCLUDED_FRAMES = 5;
  /** The default washout search window (frames). */
  public static final int DEFAULT_WINDOW = 20;

  private final int excludedFrames;
  private final int window;
  private final int threads;

  /**
   * Create an instance with the default settings using a single thread.
   */
  public EventDetector() {
    this(DEFAULT_EXCLUDED_FRAMES, DEFAULT_WINDOW);
  }

  /**
   * Create an instance.
   *
   * @param excludedFrames the number of excluded leading frames
   * @param window the washout search window (frames)
   */
  public EventDetector(int excludedFrames, int window) {
    this(excludedFrames, window, 1);
  }

  /**
   * Create an instance.
   *
   * @param excludedFrames the number of excluded leading frames
   * @param window the washout search window (frames)
   * @param threads the number of threads used to compute the trace (non-positive to use the
   *        ImageJ preference)
   */
  public EventDetector(int excludedFrames, int window, int threads) {
    this.excludedFrames = Math.max(0, excludedFrames);
    this.window = Math.max(1, window);
    this.threads = threads;
  }

  /**
   * Detect the flash and washout in the volume.
   *
   * @param volume the contrast volume
   * @return the flash event
   * @throws InsufficientDataException if there are fewer than 2 frames
   */
  public FlashEvent detect(PixelVolume volume) {
    return detect(computeTrace(volume, threads));
  }

  /**
   * Detect the flash and washout in the per-frame intensity trace.
   *
   * @param trace the intensity trace
   * @return the flash event
   * @throws InsufficientDataException if there are fewer than 2 frames
   */
  public FlashEvent detect(double[] trace) {
    final int size = trace.length;
    if (size < 2) {
      throw InsufficientDataException.of("Flash detection", 2, size);
    }
    final int start = Math.min(excludedFrames, size / 10);
    int flash = start;
    double minDiff = Double.POSITIVE_INFINITY;
    for (int i = start; i < size - 1; i++) {
      final double d = trace[i + 1] - trace[i];
      if (d < minDiff) {
        minDiff = d;
        flash = i;
      }
    }
    final FlashEvent event = new FlashEvent(flash, findWashout(trace, flash), trace.clone());
    logger.fine(() -> "Detected " + event);
    return event;
  }

  /**
   * Create the event using a flash index chosen by the caller. The washout is derived by the
   * same rule as automatic detection.
   *
   * @param volume the contrast volume
   * @param flashIndex the flash index
   * @return the flash event
   */
  public FlashEvent override(PixelVolume volume, int flashIndex) {
    return override(computeTrace(volume, threads), flashIndex);
  }

  /**
   * Create the event using a flash index chosen by the caller. The washout is derived by the
   * same rule as automatic detection.
   *
   * @param trace the intensity trace
   * @param flashIndex the flash index
   * @return the flash event
   */
  public FlashEvent override(double[] trace, int flashIndex) {
    if (trace.length < 2) {
      throw InsufficientDataException.of("Flash detection", 2, trace.length);
    }
    if (flashIndex < 0 || flashIndex >= trace.length) {
      throw new IndexOutOfBoundsException("Flash " + flashIndex + " of " + trace.length);
    }
    return new FlashEvent(flashIndex, findWashout(trace, flashIndex), trace.clone());
  }

  private int findWashout(double[] trace, int flash) {
    final int end = Math.min(trace.length, flash + window);
    int washout = flash;
    for (int i = flash + 1; i < end; i++) {
      if (trace[i] < trace[washout]) {
        washout = i;
      }
    }
    return washout;
  }

  /**
   * Compute the per-frame mean intensity over all pixels and channels.
   *
   * @param volume the volume
   * @return the trace
   */
  public static double[] computeTrace(PixelVolume volume) {
    return computeTrace(volume, 1);
  }

  /**
   * Compute the per-frame mean intensity over all pixels and channels. Frames are processed in
   * parallel.
   *
   * @param volume the volume
   * @param threads the number of threads (non-positive to use the ImageJ preference)
   * @return the trace
   */
  public static double[] computeTrace(PixelVolume volume, int threads) {
    final double[] trace = new double[volume.getFrames()];
    ConcurrencyUtils.forEach(threads, trace.length, i -> trace[i] = volume.getMeanIntensity(i));
    return trace;
  }
}
