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

import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.ceus.InputShapeException;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.ShiftTable;
import uk.ac.sussex.gdsc.ceus.utils.ConcurrencyUtils;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * Corrects translational motion in a video.
 *
 * <p>A reference image is built as the per-pixel median luminance of a window of frames after
 * the start of the recording. The translation of each frame relative to the reference is found
 * by phase correlation and removed by bilinear interpolation. The motion may be estimated on a
 * second volume of the same frame size (e.g. the B-mode image, which has more structure than
 * the contrast image) and applied to the target.
 */
public class Registrar {
  private static final Logger logger = Logger.getLogger(Registrar.class.getName());

  /** The default number of frames skipped before the reference window. */
  public static final int DEFAULT_SKIP = 3;
  /** The default number of frames in the reference window. */
  public static final int DEFAULT_WINDOW = 10;
  /** The default upsampling factor for sub-pixel estimation. */
  public static final int DEFAULT_UPSAMPLE = 20;

  private final int skip;
  private final int window;
  private final int upsample;
  private final int threads;

  /**
   * Create an instance with the default settings.
   *
   * @param threads the number of threads (non-positive to use the ImageJ preference)
   */
  public Registrar(int threads) {
    this(DEFAULT_SKIP, DEFAULT_WINDOW, DEFAULT_UPSAMPLE, threads);
  }

  /**
   * Create an instance.
   *
   * @param skip the number of frames skipped before the reference window
   * @param window the number of frames in the reference window
   * @param upsample the upsampling factor for sub-pixel estimation
   * @param threads the number of threads (non-positive to use the ImageJ preference)
   */
  public Registrar(int skip, int window, int upsample, int threads) {
    this.skip = skip;
    this.window = Math.max(1, window);
    this.upsample = Math.max(1, upsample);
    this.threads = threads;
  }

  /**
   * Estimate the motion on the target and correct it.
   *
   * @param target the target volume
   * @return the registration result
   */
  public RegistrationResult register(PixelVolume target) {
    return register(target, null);
  }

  /**
   * Estimate the motion and correct the target. The estimation volume is used if it has the same
   * frame size as the target, otherwise the target is used. When the estimation volume is used
   * both volumes are truncated to the common number of frames.
   *
   * @param target the target volume
   * @param estimation the volume used to estimate the motion (can be null)
   * @return the registration result
   */
  public RegistrationResult register(PixelVolume target, PixelVolume estimation) {
    PixelVolume moving = target;
    PixelVolume source = target;
    String label = RegistrationResult.SOURCE_CEUS;
    if (estimation != null && estimation.hasSameShape(target)) {
      final int frames = Math.min(target.getFrames(), estimation.getFrames());
      moving = target.truncate(frames);
      source = estimation.truncate(frames);
      label = RegistrationResult.SOURCE_BMODE;
    } else if (estimation != null) {
      logger.fine(() -> String.format("Estimation volume %dx%d does not match target %dx%d",
          estimation.getWidth(), estimation.getHeight(), target.getWidth(), target.getHeight()));
    }
    final ShiftTable shifts = estimateShifts(source);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("Estimated %d shifts on %s: rmsd=%.3f px", shifts.size(), label,
          shifts.getRmsd()));
    }
    return new RegistrationResult(applyShifts(moving, shifts), shifts, label);
  }

  /**
   * Compute the reference image: the per-pixel median luminance over frames
   * {@code [skip, skip + window)}. The start is clamped to the available frames and at least one
   * frame is used.
   *
   * @param volume the volume
   * @return the reference
   */
  public float[] computeReference(PixelVolume volume) {
    final int frames = volume.getFrames();
    final int start = Math.min(Math.max(0, skip), Math.max(0, frames - 1));
    final int end = Math.min(frames, start + window);
    final int n = end - start;
    final float[][] data = new float[n][];
    for (int i = 0; i < n; i++) {
      data[i] = volume.getLuminance(start + i);
    }
    final int size = data[0].length;
    final float[] reference = new float[size];
    final float[] work = new float[n];
    for (int j = 0; j < size; j++) {
      for (int i = 0; i < n; i++) {
        work[i] = data[i][j];
      }
      reference[j] = MathUtils.medianInPlace(work, n);
    }
    return reference;
  }

  /**
   * Estimate the shift of each frame relative to the reference of the volume.
   *
   * @param volume the volume
   * @return the shifts
   */
  public ShiftTable estimateShifts(PixelVolume volume) {
    final PhaseCorrelator correlator = new PhaseCorrelator(computeReference(volume),
        volume.getWidth(), volume.getHeight(), upsample);
    final int frames = volume.getFrames();
    final double[] dy = new double[frames];
    final double[] dx = new double[frames];
    ConcurrencyUtils.forEach(threads, frames, t -> {
      final double[] shift = correlator.estimate(volume.getLuminance(t));
      dy[t] = shift[0];
      dx[t] = shift[1];
    });
    return new ShiftTable(dy, dx);
  }

  /**
   * Apply the shifts to the volume. Single channel frames are returned as 32-bit; RGB frames
   * shift each channel by the same offset.
   *
   * @param volume the volume
   * @param shifts the shifts
   * @return the shifted volume
   * @throws InputShapeException if the shift table does not match the number of frames
   */
  public PixelVolume applyShifts(PixelVolume volume, ShiftTable shifts) {
    if (shifts.size() != volume.getFrames()) {
      throw new InputShapeException(String.format("Shift table size %d does not match %d frames",
          shifts.size(), volume.getFrames()));
    }
    final int frames = volume.getFrames();
    final ImageProcessor[] out = new ImageProcessor[frames];
    ConcurrencyUtils.forEach(threads, frames,
        t -> out[t] = shift(volume.getProcessor(t), shifts.getDy(t), shifts.getDx(t)));
    final ImageStack stack = new ImageStack(volume.getWidth(), volume.getHeight());
    for (final ImageProcessor ip : out) {
      stack.addSlice(null, ip);
    }
    return PixelVolume.wrap(stack);
  }

  /**
   * Shift the image so that {@code out(y, x) = in(y - dy, x - dx)} using bilinear interpolation.
   * Samples outside the image take the value of the nearest edge pixel.
   *
   * @param ip the image
   * @param dy the y shift
   * @param dx the x shift
   * @return the shifted image
   */
  static ImageProcessor shift(ImageProcessor ip, double dy, double dx) {
    final int width = ip.getWidth();
    final int height = ip.getHeight();
    if (ip instanceof ColorProcessor) {
      final int[] pixels = (int[]) ip.getPixels();
      final int[] result = new int[pixels.length];
      for (int c = 0; c < 3; c++) {
        final int bits = 16 - 8 * c;
        final float[] channel = new float[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
          channel[i] = (pixels[i] >> bits) & 0xff;
        }
        final float[] shifted = shift(channel, width, height, dy, dx);
        for (int i = 0; i < pixels.length; i++) {
          final int v = (int) Math.round(shifted[i]);
          result[i] |= (v < 0 ? 0 : v > 255 ? 255 : v) << bits;
        }
      }
      return new ColorProcessor(width, height, result);
    }
    final float[] data = new float[width * height];
    for (int i = 0; i < data.length; i++) {
      data[i] = ip.getf(i);
    }
    return new FloatProcessor(width, height, shift(data, width, height, dy, dx));
  }

  private static float[] shift(float[] data, int width, int height, double dy, double dx) {
    final float[] out = new float[data.length];
    final int maxx = width - 1;
    final int maxy = height - 1;
    for (int y = 0, i = 0; y < height; y++) {
      final double sy = clamp(y - dy, maxy);
      final int y0 = (int) sy;
      final int y1 = Math.min(y0 + 1, maxy);
      final double fy = sy - y0;
      for (int x = 0; x < width; x++, i++) {
        final double sx = clamp(x - dx, maxx);
        final int x0 = (int) sx;
        final int x1 = Math.min(x0 + 1, maxx);
        final double fx = sx - x0;
        final double top = data[y0 * width + x0] * (1 - fx) + data[y0 * width + x1] * fx;
        final double bottom = data[y1 * width + x0] * (1 - fx) + data[y1 * width + x1] * fx;
        out[i] = (float) (top * (1 - fy) + bottom * fy);
      }
    }
    return out;
  }

  private static double clamp(double value, int max) {
    return value < 0 ? 0 : value > max ? max : value;
  }
}
