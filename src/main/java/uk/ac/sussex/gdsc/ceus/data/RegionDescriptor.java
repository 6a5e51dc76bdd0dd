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

/**
 * Describes an ultrasound region within the video frame. Coordinates are inclusive pixel bounds.
 */
public final class RegionDescriptor {
  /** Data type tag for a region of unknown mode (typically tissue). */
  public static final int DATA_TYPE_AMBIGUOUS = 1;
  /** Data type tag for a region explicitly marked as contrast mode. */
  public static final int DATA_TYPE_CONTRAST = 2;

  private final int x0;
  private final int y0;
  private final int x1;
  private final int y1;
  private final int dataType;
  private final int flags;

  /**
   * Create an instance.
   *
   * @param x0 the min x
   * @param y0 the min y
   * @param x1 the max x (inclusive)
   * @param y1 the max y (inclusive)
   * @param dataType the data type tag
   * @param flags the vendor flags
   */
  public RegionDescriptor(int x0, int y0, int x1, int y1, int dataType, int flags) {
    this.x0 = x0;
    this.y0 = y0;
    this.x1 = x1;
    this.y1 = y1;
    this.dataType = dataType;
    this.flags = flags;
  }

  /**
   * Create an instance with no vendor flags.
   *
   * @param x0 the min x
   * @param y0 the min y
   * @param x1 the max x (inclusive)
   * @param y1 the max y (inclusive)
   * @param dataType the data type tag
   */
  public RegionDescriptor(int x0, int y0, int x1, int y1, int dataType) {
    this(x0, y0, x1, y1, dataType, 0);
  }

  /**
   * Clip the region to the frame. Returns null if the clipped region is empty in either
   * dimension.
   *
   * @param width the frame width
   * @param height the frame height
   * @return the clipped region (or null)
   */
  public RegionDescriptor clip(int width, int height) {
    final int cx0 = clampCoordinate(x0, width);
    final int cy0 = clampCoordinate(y0, height);
    final int cx1 = clampCoordinate(x1, width);
    final int cy1 = clampCoordinate(y1, height);
    if (cx0 >= cx1 || cy0 >= cy1) {
      return null;
    }
    if (cx0 == x0 && cy0 == y0 && cx1 == x1 && cy1 == y1) {
      return this;
    }
    return new RegionDescriptor(cx0, cy0, cx1, cy1, dataType, flags);
  }

  private static int clampCoordinate(int value, int size) {
    return Math.max(0, Math.min(value, size - 1));
  }

  /**
   * Gets the min x.
   *
   * @return the min x
   */
  public int getX0() {
    return x0;
  }

  /**
   * Gets the min y.
   *
   * @return the min y
   */
  public int getY0() {
    return y0;
  }

  /**
   * Gets the max x (inclusive).
   *
   * @return the max x
   */
  public int getX1() {
    return x1;
  }

  /**
   * Gets the max y (inclusive).
   *
   * @return the max y
   */
  public int getY1() {
    return y1;
  }

  /**
   * Gets the data type tag.
   *
   * @return the data type
   */
  public int getDataType() {
    return dataType;
  }

  /**
   * Gets the vendor flags.
   *
   * @return the flags
   */
  public int getFlags() {
    return flags;
  }

  /**
   * Checks if the region is explicitly tagged as contrast mode.
   *
   * @return true if contrast
   */
  public boolean isContrast() {
    return dataType == DATA_TYPE_CONTRAST;
  }

  /**
   * Checks if the region mode is ambiguous.
   *
   * @return true if ambiguous
   */
  public boolean isAmbiguous() {
    return dataType == DATA_TYPE_AMBIGUOUS;
  }

  @Override
  public String toString() {
    return String.format("Region[%d,%d]-[%d,%d] type=%d flags=%d", x0, y0, x1, y1, dataType,
        flags);
  }
}
