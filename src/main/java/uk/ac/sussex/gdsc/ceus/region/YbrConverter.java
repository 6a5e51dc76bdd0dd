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

import ij.ImageStack;
import ij.process.ColorProcessor;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;

/**
 * Converts YCbCr frames to RGB using the ITU-R BT.601 full range transform.
 */
public final class YbrConverter {

  /** No public construction. */
  private YbrConverter() {}

  /**
   * Convert a packed YCbCr pixel (Y in the red byte, Cb in green, Cr in blue) to packed RGB.
   *
   * @param ybr the YCbCr pixel
   * @return the RGB pixel
   */
  public static int toRgb(int ybr) {
    final double y = (ybr >> 16) & 0xff;
    final double cb = ((ybr >> 8) & 0xff) - 128.0;
    final double cr = (ybr & 0xff) - 128.0;
    final int r = clip(y + 1.402 * cr);
    final int g = clip(y - 0.344136 * cb - 0.714136 * cr);
    final int b = clip(y + 1.772 * cb);
    return (r << 16) | (g << 8) | b;
  }

  private static int clip(double value) {
    // Truncation of the clipped value, as for a cast to an unsigned byte
    return value <= 0 ? 0 : value >= 255 ? 255 : (int) value;
  }

  /**
   * Convert each frame of the RGB volume. Single channel volumes are returned unchanged.
   *
   * @param volume the volume
   * @return the converted volume
   */
  public static PixelVolume convert(PixelVolume volume) {
    if (!volume.isRgb()) {
      return volume;
    }
    final ImageStack stack = new ImageStack(volume.getWidth(), volume.getHeight());
    for (int t = 0; t < volume.getFrames(); t++) {
      final ColorProcessor cp = (ColorProcessor) volume.getProcessor(t);
      final int[] pixels = (int[]) cp.getPixels();
      for (int i = 0; i < pixels.length; i++) {
        pixels[i] = toRgb(pixels[i]);
      }
      stack.addSlice(null, cp);
    }
    return PixelVolume.wrap(stack);
  }
}
