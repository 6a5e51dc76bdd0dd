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

package uk.ac.sussex.gdsc.ceus.filter;

import ij.ImageStack;
import ij.plugin.filter.GaussianBlur;
import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.SpatialFilter;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.TemporalFilter;
import uk.ac.sussex.gdsc.ceus.utils.ConcurrencyUtils;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * Conditions the contrast video for analysis.
 *
 * <p>The steps are applied in a fixed order:
 *
 * <ol>
 * <li>Conversion to luminance;
 * <li>Global percentile normalisation to [0, 1];
 * <li>Log compression;
 * <li>Spatial filter of each frame;
 * <li>Baseline subtraction using the median of the leading frames;
 * <li>Temporal filter of each pixel.
 * </ol>
 *
 * <p>The output is a 32-bit volume of the same size.
 */
public class Preprocessor {
  private static final Logger logger = Logger.getLogger(Preprocessor.class.getName());

  /** The gain used for log compression. */
  static final double LOG_GAIN = 20;
  /** The Gaussian spatial filter standard deviation. */
  static final double SPATIAL_SIGMA = 0.6;
  /** The offset applied to the upper percentile when it is not above the lower percentile. */
  static final double PERCENTILE_EPSILON = 1e-3;

  private final PreprocessorOptions options;
  private final int threads;

  /**
   * Create an instance.
   *
   * @param options the options
   * @param threads the number of threads (non-positive to use the ImageJ preference)
   */
  public Preprocessor(PreprocessorOptions options, int threads) {
    this.options = options.copy();
    this.threads = threads;
  }

  /**
   * Process the volume.
   *
   * @param volume the volume
   * @return the processed volume
   */
  public PixelVolume process(PixelVolume volume) {
    final int frames = volume.getFrames();
    final int width = volume.getWidth();
    final int height = volume.getHeight();
    final float[][] data = new float[frames][];
    for (int t = 0; t < frames; t++) {
      data[t] = volume.getLuminance(t);
    }

    if (options.isNormalise()) {
      normalise(data, options.getLowerPercentile(), options.getUpperPercentile());
    }
    if (options.isLogCompression()) {
      logCompress(data);
    }
    if (options.getSpatialFilter() != SpatialFilter.NONE) {
      final SpatialFilter filter = options.getSpatialFilter();
      ConcurrencyUtils.forEach(threads, frames,
          t -> spatialFilter(new FloatProcessor(width, height, data[t]), filter));
    }
    final int baselineFrames = getBaselineFrames(options.getBaselineFrames(), frames);
    if (baselineFrames > 0) {
      subtractBaseline(data, baselineFrames);
    }
    if (options.getTemporalFilter() != TemporalFilter.NONE) {
      temporalFilter(data, options.getTemporalFilter(), options.getTemporalWindow());
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("Preprocessed %d frames: normalise=%b, log=%b, spatial=%s, "
          + "baseline=%d, temporal=%s(%d)", frames, options.isNormalise(),
          options.isLogCompression(), options.getSpatialFilter(), baselineFrames,
          options.getTemporalFilter(), options.getTemporalWindow()));
    }

    final ImageStack stack = new ImageStack(width, height);
    for (final float[] frame : data) {
      stack.addSlice(null, new FloatProcessor(width, height, frame));
    }
    return PixelVolume.wrap(stack);
  }

  /**
   * Gets the number of frames used for the baseline: {@code min(requested, max(1, T/10))}, or zero
   * if disabled.
   *
   * @param requested the requested frames
   * @param frames the total frames
   * @return the baseline frames
   */
  static int getBaselineFrames(int requested, int frames) {
    if (requested <= 0) {
      return 0;
    }
    return Math.min(requested, Math.max(1, frames / 10));
  }

  /**
   * Map the data linearly so the lower and upper percentiles of all the values map to 0 and 1.
   * The result is clipped to [0, 1].
   *
   * @param data the data
   * @param lower the lower percentile
   * @param upper the upper percentile
   */
  static void normalise(float[][] data, double lower, double upper) {
    int size = 0;
    for (final float[] frame : data) {
      size += frame.length;
    }
    final double[] all = new double[size];
    int i = 0;
    for (final float[] frame : data) {
      for (final float v : frame) {
        all[i++] = v;
      }
    }
    final double lo = MathUtils.percentile(all, lower);
    double hi = MathUtils.percentile(all, upper);
    if (hi <= lo) {
      hi = lo + PERCENTILE_EPSILON;
    }
    final double range = hi - lo;
    for (final float[] frame : data) {
      for (int j = 0; j < frame.length; j++) {
        final double v = (frame[j] - lo) / range;
        frame[j] = (float) (v < 0 ? 0 : v > 1 ? 1 : v);
      }
    }
  }

  /**
   * Apply {@code y = log1p(20x) / log1p(20)}.
   *
   * @param data the data
   */
  static void logCompress(float[][] data) {
    final double norm = Math.log1p(LOG_GAIN);
    for (final float[] frame : data) {
      for (int j = 0; j < frame.length; j++) {
        frame[j] = (float) (Math.log1p(LOG_GAIN * frame[j]) / norm);
      }
    }
  }

  /**
   * Filter the processor in place.
   *
   * @param ip the image
   * @param filter the filter
   */
  static void spatialFilter(FloatProcessor ip, SpatialFilter filter) {
    if (filter == SpatialFilter.MEDIAN) {
      // A radius of 1 is the 3x3 square kernel
      new RankFilters().rank(ip, 1, RankFilters.MEDIAN);
    } else if (filter == SpatialFilter.GAUSSIAN) {
      new GaussianBlur().blurGaussian(ip, SPATIAL_SIGMA);
    }
  }

  /**
   * Subtract the per-pixel median of the first n frames. The result is clamped to be
   * non-negative.
   *
   * @param data the data
   * @param n the number of baseline frames
   */
  static void subtractBaseline(float[][] data, int n) {
    final int size = data[0].length;
    final float[] work = new float[n];
    final float[] baseline = new float[size];
    for (int j = 0; j < size; j++) {
      for (int t = 0; t < n; t++) {
        work[t] = data[t][j];
      }
      baseline[j] = MathUtils.medianInPlace(work, n);
    }
    for (final float[] frame : data) {
      for (int j = 0; j < size; j++) {
        final float v = frame[j] - baseline[j];
        frame[j] = v < 0 ? 0 : v;
      }
    }
  }

  /**
   * Filter each pixel along the time axis.
   *
   * @param data the data
   * @param filter the filter
   * @param window the window (frames)
   */
  void temporalFilter(float[][] data, TemporalFilter filter, int window) {
    final double[] kernel = filter == TemporalFilter.GAUSSIAN ? gaussianKernel(window)
        : meanKernel(window);
    final int frames = data.length;
    final int size = data[0].length;
    // Split the pixels into blocks, each task owns a disjoint set of pixels
    final int blocks = Math.max(1, Math.min(size, ConcurrencyUtils.getThreads(threads) * 4));
    final int blockSize = (size + blocks - 1) / blocks;
    ConcurrencyUtils.forEach(threads, blocks, b -> {
      final double[] series = new double[frames];
      final int from = b * blockSize;
      final int to = Math.min(size, from + blockSize);
      for (int j = from; j < to; j++) {
        for (int t = 0; t < frames; t++) {
          series[t] = data[t][j];
        }
        for (int t = 0; t < frames; t++) {
          data[t][j] = (float) convolve(series, t, kernel);
        }
      }
    });
  }

  /**
   * Create a normalised Gaussian kernel with standard deviation {@code max(0.5, (window-1)/2)}
   * truncated at 4 standard deviations.
   *
   * @param window the window
   * @return the kernel
   */
  static double[] gaussianKernel(int window) {
    final double sigma = Math.max(0.5, (window - 1) / 2.0);
    final int radius = (int) (4 * sigma + 0.5);
    final double[] kernel = new double[2 * radius + 1];
    double sum = 0;
    for (int i = -radius; i <= radius; i++) {
      final double v = Math.exp(-0.5 * i * i / (sigma * sigma));
      kernel[i + radius] = v;
      sum += v;
    }
    for (int i = 0; i < kernel.length; i++) {
      kernel[i] /= sum;
    }
    return kernel;
  }

  /**
   * Create a mean kernel. Even windows are increased to the next odd size.
   *
   * @param window the window
   * @return the kernel
   */
  static double[] meanKernel(int window) {
    final int width = Math.max(1, window | 1);
    final double[] kernel = new double[width];
    Arrays.fill(kernel, 1.0 / width);
    return kernel;
  }

  /**
   * Convolve the data at the index with the centred kernel using nearest-edge padding.
   *
   * @param data the data
   * @param index the index
   * @param kernel the kernel (odd length)
   * @return the value
   */
  private static double convolve(double[] data, int index, double[] kernel) {
    final int radius = kernel.length / 2;
    final int last = data.length - 1;
    double sum = 0;
    for (int k = -radius; k <= radius; k++) {
      int i = index + k;
      i = i < 0 ? 0 : i > last ? last : i;
      sum += kernel[k + radius] * data[i];
    }
    return sum;
  }
}
