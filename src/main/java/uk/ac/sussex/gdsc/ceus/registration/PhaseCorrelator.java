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

import java.util.Arrays;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Estimates the translation between an image and a reference using phase correlation.
 *
 * <p>Both images are mean subtracted, multiplied by a Tukey window and zero-padded to a power of
 * 2. The integer peak of the normalised cross-power spectrum is refined to {@code 1/upsample}
 * pixels using a matrix-multiply DFT evaluated on a small neighbourhood of the peak.
 *
 * <p>The returned shift {@code (dy, dx)} registers the image onto the reference: an image that
 * is the reference translated by {@code +k} pixels returns {@code -k}.
 *
 * <p>Instances hold the transformed reference and can be shared between threads.
 */
public class PhaseCorrelator {
  /** The fraction of the Tukey window that is tapered. */
  static final double TUKEY_ALPHA = 0.25;
  /** Magnitudes below this are treated as zero in the phase normalisation. */
  private static final double EPSILON = 1e-12;

  private final int width;
  private final int height;
  private final int upsample;
  /** Padded size in x. */
  private final int nx;
  /** Padded size in y. */
  private final int ny;
  private final double[] windowX;
  private final double[] windowY;
  private final double[][] refRe;
  private final double[][] refIm;

  /**
   * Create an instance.
   *
   * @param reference the reference image (row-major, width * height)
   * @param width the width
   * @param height the height
   * @param upsample the upsampling factor (1 for integer precision)
   */
  public PhaseCorrelator(float[] reference, int width, int height, int upsample) {
    this.width = width;
    this.height = height;
    this.upsample = Math.max(1, upsample);
    nx = nextPow2(width);
    ny = nextPow2(height);
    windowX = tukey(width, TUKEY_ALPHA);
    windowY = tukey(height, TUKEY_ALPHA);
    refRe = new double[ny][nx];
    refIm = new double[ny][nx];
    pad(reference, refRe);
    fft2(refRe, refIm, TransformType.FORWARD);
  }

  private static int nextPow2(int size) {
    return ArithmeticUtils.isPowerOfTwo(size) ? size : Integer.highestOneBit(size) << 1;
  }

  /**
   * Create a Tukey (tapered cosine) window.
   *
   * @param size the size
   * @param alpha the tapered fraction in [0, 1]
   * @return the window
   */
  static double[] tukey(int size, double alpha) {
    final double[] w = new double[size];
    if (size == 1 || alpha <= 0) {
      Arrays.fill(w, 1);
      return w;
    }
    final double m = size - 1;
    final double edge = alpha * m / 2;
    for (int i = 0; i < size; i++) {
      final double x = Math.min(i, m - i);
      w[i] = x < edge ? 0.5 * (1 + Math.cos(Math.PI * (x / edge - 1))) : 1;
    }
    return w;
  }

  /**
   * Mean subtract, window and copy the image into the centre of the padded array.
   */
  private void pad(float[] image, double[][] out) {
    double sum = 0;
    for (final float v : image) {
      sum += v;
    }
    final double mean = sum / image.length;
    final int ox = (nx - width) / 2;
    final int oy = (ny - height) / 2;
    for (int y = 0, i = 0; y < height; y++) {
      final double[] row = out[y + oy];
      for (int x = 0; x < width; x++, i++) {
        row[x + ox] = (image[i] - mean) * windowY[y] * windowX[x];
      }
    }
  }

  /**
   * In-place 2D FFT using row then column 1D transforms.
   */
  private static void fft2(double[][] re, double[][] im, TransformType type) {
    final int rows = re.length;
    final int cols = re[0].length;
    for (int y = 0; y < rows; y++) {
      FastFourierTransformer.transformInPlace(new double[][] {re[y], im[y]},
          DftNormalization.STANDARD, type);
    }
    final double[] colRe = new double[rows];
    final double[] colIm = new double[rows];
    final double[][] col = {colRe, colIm};
    for (int x = 0; x < cols; x++) {
      for (int y = 0; y < rows; y++) {
        colRe[y] = re[y][x];
        colIm[y] = im[y][x];
      }
      FastFourierTransformer.transformInPlace(col, DftNormalization.STANDARD, type);
      for (int y = 0; y < rows; y++) {
        re[y][x] = colRe[y];
        im[y][x] = colIm[y];
      }
    }
  }

  /**
   * Estimate the shift that registers the image onto the reference.
   *
   * @param image the image (row-major, width * height)
   * @return the shift {dy, dx}
   */
  public double[] estimate(float[] image) {
    final double[][] re = new double[ny][nx];
    final double[][] im = new double[ny][nx];
    pad(image, re);
    fft2(re, im, TransformType.FORWARD);

    // Normalised cross-power spectrum: R = F_ref * conj(F_image) / |.|
    boolean flat = true;
    for (int y = 0; y < ny; y++) {
      for (int x = 0; x < nx; x++) {
        final double ar = refRe[y][x];
        final double ai = refIm[y][x];
        final double br = re[y][x];
        final double bi = -im[y][x];
        final double pr = ar * br - ai * bi;
        final double pi = ar * bi + ai * br;
        final double mag = Math.sqrt(pr * pr + pi * pi);
        if (mag > EPSILON) {
          re[y][x] = pr / mag;
          im[y][x] = pi / mag;
          flat = false;
        } else {
          re[y][x] = 0;
          im[y][x] = 0;
        }
      }
    }
    if (flat) {
      return new double[2];
    }

    final double[][] spectrumRe = copy(re);
    final double[][] spectrumIm = copy(im);
    fft2(re, im, TransformType.INVERSE);

    int py = 0;
    int px = 0;
    double max = Double.NEGATIVE_INFINITY;
    for (int y = 0; y < ny; y++) {
      for (int x = 0; x < nx; x++) {
        if (re[y][x] > max) {
          max = re[y][x];
          py = y;
          px = x;
        }
      }
    }
    double dy = py > ny / 2 ? py - ny : py;
    double dx = px > nx / 2 ? px - nx : px;

    if (upsample > 1) {
      final double[] refined = refine(spectrumRe, spectrumIm, dy, dx);
      dy = refined[0];
      dx = refined[1];
    }
    return new double[] {dy, dx};
  }

  private static double[][] copy(double[][] data) {
    final double[][] out = new double[data.length][];
    for (int i = 0; i < data.length; i++) {
      out[i] = data[i].clone();
    }
    return out;
  }

  /**
   * Refine the shift by evaluating the inverse DFT of the spectrum on an upsampled grid of
   * {@code ceil(1.5 * upsample)} points per axis centred on the current estimate.
   */
  private double[] refine(double[][] spectrumRe, double[][] spectrumIm, double dy, double dx) {
    final int region = (int) Math.ceil(upsample * 1.5);
    final int centre = region / 2;
    final double sy = Math.round(dy * upsample) / (double) upsample;
    final double sx = Math.round(dx * upsample) / (double) upsample;

    // Location of each upsampled sample in pixels
    final double[] uy = new double[region];
    final double[] ux = new double[region];
    for (int r = 0; r < region; r++) {
      uy[r] = sy + (r - centre) / (double) upsample;
      ux[r] = sx + (r - centre) / (double) upsample;
    }
    final double[][] kxRe = new double[region][nx];
    final double[][] kxIm = new double[region][nx];
    kernel(ux, nx, kxRe, kxIm);
    final double[][] kyRe = new double[region][ny];
    final double[][] kyIm = new double[region][ny];
    kernel(uy, ny, kyRe, kyIm);

    // Sum over x: a[ky][rx]
    final double[][] aRe = new double[ny][region];
    final double[][] aIm = new double[ny][region];
    for (int y = 0; y < ny; y++) {
      final double[] pr = spectrumRe[y];
      final double[] pi = spectrumIm[y];
      for (int r = 0; r < region; r++) {
        final double[] er = kxRe[r];
        final double[] ei = kxIm[r];
        double sr = 0;
        double si = 0;
        for (int x = 0; x < nx; x++) {
          sr += pr[x] * er[x] - pi[x] * ei[x];
          si += pr[x] * ei[x] + pi[x] * er[x];
        }
        aRe[y][r] = sr;
        aIm[y][r] = si;
      }
    }

    // Sum over y: only the real part of the correlation is required
    int bestY = centre;
    int bestX = centre;
    double max = Double.NEGATIVE_INFINITY;
    for (int ry = 0; ry < region; ry++) {
      final double[] er = kyRe[ry];
      final double[] ei = kyIm[ry];
      for (int rx = 0; rx < region; rx++) {
        double sr = 0;
        for (int y = 0; y < ny; y++) {
          sr += aRe[y][rx] * er[y] - aIm[y][rx] * ei[y];
        }
        if (sr > max) {
          max = sr;
          bestY = ry;
          bestX = rx;
        }
      }
    }
    return new double[] {sy + (bestY - centre) / (double) upsample,
        sx + (bestX - centre) / (double) upsample};
  }

  /**
   * Compute exp(2 pi i u f / n) for each location u and each FFT frequency index f.
   */
  private static void kernel(double[] u, int n, double[][] re, double[][] im) {
    for (int r = 0; r < u.length; r++) {
      for (int k = 0; k < n; k++) {
        final int f = k < (n + 1) / 2 ? k : k - n;
        final double angle = 2 * Math.PI * u[r] * f / n;
        re[r][k] = Math.cos(angle);
        im[r][k] = Math.sin(angle);
      }
    }
  }
}
