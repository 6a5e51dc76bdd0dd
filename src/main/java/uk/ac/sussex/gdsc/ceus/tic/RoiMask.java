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

import ij.process.FloatPolygon;
import java.awt.geom.Line2D;
import java.awt.geom.Point2D;
import java.util.Arrays;
import java.util.List;
import uk.ac.sussex.gdsc.ceus.InvalidRoiException;
import uk.ac.sussex.gdsc.ceus.data.PerfusionRoi;

/**
 * The pixels of a frame inside a region of interest.
 *
 * <p>Vertices are pixel coordinates where integer values are pixel centres. A pixel is inside a
 * polygon if its centre is inside or on the outline. Axis-aligned rectangles include both the first and last pixel
 * in each dimension.
 */
public final class RoiMask {
  /** The minimum size of the clipped bounding box in each dimension. */
  public static final int MIN_SIZE = 5;

  /** The squared distance within which a pixel centre is on the outline. */
  private static final double EDGE_TOLERANCE = 1e-12;

  private final int width;
  private final int height;
  private final int[] indices;

  private RoiMask(int width, int height, int[] indices) {
    this.width = width;
    this.height = height;
    this.indices = indices;
  }

  /**
   * Create the mask of the ROI for a frame.
   *
   * @param roi the roi
   * @param width the frame width
   * @param height the frame height
   * @return the mask
   * @throws InvalidRoiException if the ROI is degenerate
   */
  public static RoiMask create(PerfusionRoi roi, int width, int height) {
    final List<Point2D.Double> polygon = roi.getPolygon();
    if (polygon.size() < 3) {
      throw new InvalidRoiException(
          roi.getLabel() + ": polygon has " + polygon.size() + " vertices (minimum 3)");
    }
    if (roi.getArea() == 0) {
      throw new InvalidRoiException(roi.getLabel() + ": polygon has zero area");
    }
    double minx = Double.POSITIVE_INFINITY;
    double miny = Double.POSITIVE_INFINITY;
    double maxx = Double.NEGATIVE_INFINITY;
    double maxy = Double.NEGATIVE_INFINITY;
    for (final Point2D.Double p : polygon) {
      minx = Math.min(minx, p.x);
      miny = Math.min(miny, p.y);
      maxx = Math.max(maxx, p.x);
      maxy = Math.max(maxy, p.y);
    }
    final int x0 = Math.max(0, (int) Math.floor(minx));
    final int y0 = Math.max(0, (int) Math.floor(miny));
    final int x1 = Math.min(width - 1, (int) Math.ceil(maxx));
    final int y1 = Math.min(height - 1, (int) Math.ceil(maxy));
    if (x1 - x0 + 1 < MIN_SIZE || y1 - y0 + 1 < MIN_SIZE) {
      throw new InvalidRoiException(String.format(
          "%s: clipped bounds [%d,%d]-[%d,%d] smaller than %dx%d", roi.getLabel(), x0, y0, x1, y1,
          MIN_SIZE, MIN_SIZE));
    }

    final int[] indices = isRectangle(polygon) ? rectangle(x0, y0, x1, y1, width)
        : polygon(polygon, x0, y0, x1, y1, width);
    if (indices.length == 0) {
      throw new InvalidRoiException(roi.getLabel() + ": mask is empty");
    }
    return new RoiMask(width, height, indices);
  }

  private static boolean isRectangle(List<Point2D.Double> polygon) {
    if (polygon.size() != 4) {
      return false;
    }
    // Each edge must be horizontal or vertical, alternating
    boolean horizontal = polygon.get(0).y == polygon.get(1).y;
    for (int i = 0; i < 4; i++) {
      final Point2D.Double p1 = polygon.get(i);
      final Point2D.Double p2 = polygon.get((i + 1) % 4);
      if (horizontal ? p1.y != p2.y : p1.x != p2.x) {
        return false;
      }
      horizontal = !horizontal;
    }
    return true;
  }

  private static int[] rectangle(int x0, int y0, int x1, int y1, int width) {
    final int[] indices = new int[(x1 - x0 + 1) * (y1 - y0 + 1)];
    int k = 0;
    for (int y = y0; y <= y1; y++) {
      for (int x = x0; x <= x1; x++) {
        indices[k++] = y * width + x;
      }
    }
    return indices;
  }

  private static int[] polygon(List<Point2D.Double> polygon, int x0, int y0, int x1, int y1,
      int width) {
    final int n = polygon.size();
    final float[] xp = new float[n];
    final float[] yp = new float[n];
    for (int i = 0; i < n; i++) {
      xp[i] = (float) polygon.get(i).x;
      yp[i] = (float) polygon.get(i).y;
    }
    final FloatPolygon fp = new FloatPolygon(xp, yp, n);
    final int[] indices = new int[(x1 - x0 + 1) * (y1 - y0 + 1)];
    int k = 0;
    for (int y = y0; y <= y1; y++) {
      for (int x = x0; x <= x1; x++) {
        if (onEdge(polygon, x, y) || fp.contains((float) x, (float) y)) {
          indices[k++] = y * width + x;
        }
      }
    }
    return Arrays.copyOf(indices, k);
  }

  /**
   * Checks if the point lies on the polygon outline. Points on the outline are inside the mask
   * for every edge orientation.
   */
  private static boolean onEdge(List<Point2D.Double> polygon, double x, double y) {
    final int n = polygon.size();
    for (int i = 0; i < n; i++) {
      final Point2D.Double p1 = polygon.get(i);
      final Point2D.Double p2 = polygon.get((i + 1) % n);
      if (Line2D.ptSegDistSq(p1.x, p1.y, p2.x, p2.y, x, y) <= EDGE_TOLERANCE) {
        return true;
      }
    }
    return false;
  }

  /**
   * Gets the frame width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the frame height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the number of pixels in the mask.
   *
   * @return the count
   */
  public int getCount() {
    return indices.length;
  }

  /**
   * Checks if the pixel is inside the mask.
   *
   * @param x the x
   * @param y the y
   * @return true if inside
   */
  public boolean contains(int x, int y) {
    if (x < 0 || y < 0 || x >= width || y >= height) {
      return false;
    }
    return Arrays.binarySearch(indices, y * width + x) >= 0;
  }

  /**
   * Compute the mean of the frame values inside the mask.
   *
   * @param frame the frame (row-major, width * height)
   * @return the mean
   */
  public double mean(float[] frame) {
    double sum = 0;
    for (final int i : indices) {
      sum += frame[i];
    }
    return sum / indices.length;
  }
}
