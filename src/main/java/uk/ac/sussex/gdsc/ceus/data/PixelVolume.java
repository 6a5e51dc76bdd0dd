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

package uk.ac.sussex.gdsc.ceus.data;

import ij.ImageStack;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import uk.ac.sussex.gdsc.ceus.EmptyVideoException;
import uk.ac.sussex.gdsc.ceus.InputShapeException;

/**
 * An ordered sequence of video frames of the same size.
 *
 * <p>Frames are single channel (8-bit, 16-bit or 32-bit) or 3 channel (RGB) images. The volume is
 * immutable: all accessors return copies of the underlying frame data.
 *
 * <p>Frame indices are zero-based.
 */
public final class PixelVolume {
  /** The red weight for luminance. */
  public static final double LUMA_R = 0.299;
  /** The green weight for luminance. */
  public static final double LUMA_G = 0.587;
  /** The blue weight for luminance. */
  public static final double LUMA_B = 0.114;

  private final ImageStack stack;
  private final int channels;

  private PixelVolume(ImageStack stack) {
    this.stack = stack;
    this.channels = stack.getProcessor(1) instanceof ColorProcessor ? 3 : 1;
  }

  /**
   * Create a volume from a copy of the stack.
   *
   * @param stack the stack
   * @return the pixel volume
   * @throws EmptyVideoException if the stack has no frames
   */
  public static PixelVolume of(ImageStack stack) {
    if (stack == null || stack.getSize() == 0) {
      throw new EmptyVideoException("No frames in the video");
    }
    return new PixelVolume(stack.duplicate());
  }

  /**
   * Create a volume from single channel float frames.
   *
   * @param width the width
   * @param height the height
   * @param frames the frames (each of length width * height)
   * @return the pixel volume
   */
  public static PixelVolume ofFloat(int width, int height, float[][] frames) {
    final ImageStack stack = new ImageStack(width, height);
    for (final float[] frame : frames) {
      checkLength(width, height, frame.length);
      stack.addSlice(null, new FloatProcessor(width, height, frame.clone()));
    }
    return wrap(stack);
  }

  /**
   * Create a volume from packed RGB frames (0xRRGGBB).
   *
   * @param width the width
   * @param height the height
   * @param frames the frames (each of length width * height)
   * @return the pixel volume
   */
  public static PixelVolume ofRgb(int width, int height, int[][] frames) {
    final ImageStack stack = new ImageStack(width, height);
    for (final int[] frame : frames) {
      checkLength(width, height, frame.length);
      stack.addSlice(null, new ColorProcessor(width, height, frame.clone()));
    }
    return wrap(stack);
  }

  /**
   * Wrap the stack without a copy. The caller must not modify the stack after this call.
   *
   * @param stack the stack
   * @return the pixel volume
   * @throws EmptyVideoException if the stack has no frames
   */
  public static PixelVolume wrap(ImageStack stack) {
    if (stack.getSize() == 0) {
      throw new EmptyVideoException("No frames in the video");
    }
    return new PixelVolume(stack);
  }

  private static void checkLength(int width, int height, int length) {
    if (length != width * height) {
      throw new InputShapeException(
          String.format("Frame length %d does not match %dx%d", length, width, height));
    }
  }

  /**
   * Gets the number of frames (T).
   *
   * @return the frames
   */
  public int getFrames() {
    return stack.getSize();
  }

  /**
   * Gets the width (W).
   *
   * @return the width
   */
  public int getWidth() {
    return stack.getWidth();
  }

  /**
   * Gets the height (H).
   *
   * @return the height
   */
  public int getHeight() {
    return stack.getHeight();
  }

  /**
   * Gets the number of channels (1 or 3).
   *
   * @return the channels
   */
  public int getChannels() {
    return channels;
  }

  /**
   * Gets the bit depth of the samples (8, 16, 24 for RGB, or 32).
   *
   * @return the bit depth
   */
  public int getBitDepth() {
    return stack.getBitDepth();
  }

  /**
   * Checks if the volume has 3 channels.
   *
   * @return true if RGB
   */
  public boolean isRgb() {
    return channels == 3;
  }

  /**
   * Gets a copy of the frame.
   *
   * @param index the frame index
   * @return the processor
   */
  public ImageProcessor getProcessor(int index) {
    return stack.getProcessor(checkIndex(index) + 1).duplicate();
  }

  /**
   * Gets a copy of the entire stack.
   *
   * @return the image stack
   */
  public ImageStack toImageStack() {
    return stack.duplicate();
  }

  /**
   * Gets the luminance of the frame. For RGB frames this is {@code 0.299R + 0.587G + 0.114B};
   * single channel frames return the sample value.
   *
   * @param index the frame index
   * @return the luminance
   */
  public float[] getLuminance(int index) {
    final ImageProcessor ip = stack.getProcessor(checkIndex(index) + 1);
    final int size = ip.getPixelCount();
    final float[] luminance = new float[size];
    if (channels == 3) {
      final int[] pixels = (int[]) ip.getPixels();
      for (int i = 0; i < size; i++) {
        final int c = pixels[i];
        luminance[i] = (float) (LUMA_R * ((c >> 16) & 0xff) + LUMA_G * ((c >> 8) & 0xff)
            + LUMA_B * (c & 0xff));
      }
    } else {
      for (int i = 0; i < size; i++) {
        luminance[i] = ip.getf(i);
      }
    }
    return luminance;
  }

  /**
   * Gets a channel of the frame. Single channel frames only support channel 0.
   *
   * @param index the frame index
   * @param channel the channel (0=red, 1=green, 2=blue)
   * @return the channel values
   */
  public float[] getChannel(int index, int channel) {
    if (channel < 0 || channel >= channels) {
      throw new InputShapeException("Invalid channel " + channel + " for " + channels
          + " channel data");
    }
    final ImageProcessor ip = stack.getProcessor(checkIndex(index) + 1);
    if (channels == 1) {
      final float[] values = new float[ip.getPixelCount()];
      for (int i = 0; i < values.length; i++) {
        values[i] = ip.getf(i);
      }
      return values;
    }
    final int[] pixels = (int[]) ip.getPixels();
    final int shift = 16 - 8 * channel;
    final float[] values = new float[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      values[i] = (pixels[i] >> shift) & 0xff;
    }
    return values;
  }

  /**
   * Gets the mean intensity of the frame over all pixels and channels.
   *
   * @param index the frame index
   * @return the mean intensity
   */
  public double getMeanIntensity(int index) {
    final ImageProcessor ip = stack.getProcessor(checkIndex(index) + 1);
    final int size = ip.getPixelCount();
    double sum = 0;
    if (channels == 3) {
      final int[] pixels = (int[]) ip.getPixels();
      for (int i = 0; i < size; i++) {
        final int c = pixels[i];
        sum += ((c >> 16) & 0xff) + ((c >> 8) & 0xff) + (c & 0xff);
      }
      return sum / (3.0 * size);
    }
    for (int i = 0; i < size; i++) {
      sum += ip.getf(i);
    }
    return sum / size;
  }

  /**
   * Crop the volume to the inclusive pixel bounds.
   *
   * @param x0 the min x
   * @param y0 the min y
   * @param x1 the max x (inclusive)
   * @param y1 the max y (inclusive)
   * @return the cropped volume
   */
  public PixelVolume crop(int x0, int y0, int x1, int y1) {
    if (x0 < 0 || y0 < 0 || x1 >= getWidth() || y1 >= getHeight() || x0 > x1 || y0 > y1) {
      throw new InputShapeException(String.format("Invalid crop [%d,%d]-[%d,%d] for %dx%d", x0,
          y0, x1, y1, getWidth(), getHeight()));
    }
    return new PixelVolume(
        stack.crop(x0, y0, 0, x1 - x0 + 1, y1 - y0 + 1, stack.getSize()).duplicate());
  }

  /**
   * Return a volume with only the first {@code frames} frames.
   *
   * @param frames the number of frames
   * @return the volume (this instance if no truncation is required)
   */
  public PixelVolume truncate(int frames) {
    if (frames >= getFrames()) {
      return this;
    }
    if (frames <= 0) {
      throw new EmptyVideoException("No frames in the truncated video");
    }
    final ImageStack out = new ImageStack(getWidth(), getHeight());
    for (int i = 1; i <= frames; i++) {
      out.addSlice(stack.getSliceLabel(i), stack.getProcessor(i).duplicate());
    }
    return new PixelVolume(out);
  }

  /**
   * Checks if the other volume has the same width and height.
   *
   * @param other the other volume
   * @return true if the same frame shape
   */
  public boolean hasSameShape(PixelVolume other) {
    return getWidth() == other.getWidth() && getHeight() == other.getHeight();
  }

  private int checkIndex(int index) {
    if (index < 0 || index >= stack.getSize()) {
      throw new IndexOutOfBoundsException("Frame " + index + " of " + stack.getSize());
    }
    return index;
  }

  @Override
  public String toString() {
    return String.format("PixelVolume[T=%d, H=%d, W=%d, channels=%d, bitDepth=%d]", getFrames(),
        getHeight(), getWidth(), channels, getBitDepth());
  }
}
