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

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * A labelled polygon region of interest. Vertices are in pixel coordinates (x, y).
 */
public final class PerfusionRoi {
  private final String label;
  private final List<Point2D.Double> polygon;
  private final Color color;

  /**
   * Create an instance.
   *
   * @param label the label
   * @param polygon the polygon vertices
   * @param color the display colour
   */
  public PerfusionRoi(String label, List<? extends Point2D> polygon, Color color) {
    this.label = Validate.notBlank(label, "ROI label must not be blank");
    Validate.notNull(polygon, "ROI polygon must not be null");
    final List<Point2D.Double> list = new ArrayList<>(polygon.size());
    polygon.forEach(p -> list.add(new Point2D.Double(p.getX(), p.getY())));
    this.polygon = Collections.unmodifiableList(list);
    this.color = Validate.notNull(color, "ROI colour must not be null");
  }

  /**
   * Create a rectangle ROI from inclusive pixel bounds.
   *
   * @param label the label
   * @param x0 the min x
   * @param y0 the min y
   * @param x1 the max x (inclusive)
   * @param y1 the max y (inclusive)
   * @param color the display colour
   * @return the roi
   */
  public static PerfusionRoi rectangle(String label, int x0, int y0, int x1, int y1,
      Color color) {
    final List<Point2D.Double> list = new ArrayList<>(4);
    list.add(new Point2D.Double(x0, y0));
    list.add(new Point2D.Double(x1, y0));
    list.add(new Point2D.Double(x1, y1));
    list.add(new Point2D.Double(x0, y1));
    return new PerfusionRoi(label, list, color);
  }

  /**
   * Gets the label.
   *
   * @return the label
   */
  public String getLabel() {
    return label;
  }

  /**
   * Gets the polygon vertices.
   *
   * @return the polygon (unmodifiable)
   */
  public List<Point2D.Double> getPolygon() {
    return polygon;
  }

  /**
   * Gets the display colour.
   *
   * @return the colour
   */
  public Color getColor() {
    return color;
  }

  /**
   * Gets the number of vertices.
   *
   * @return the number of points
   */
  public int getNumberOfPoints() {
    return polygon.size();
  }

  /**
   * Gets the polygon area using the shoelace formula.
   *
   * @return the area
   */
  public double getArea() {
    final int n = polygon.size();
    double sum = 0;
    for (int i = 0; i < n; i++) {
      final Point2D.Double p1 = polygon.get(i);
      final Point2D.Double p2 = polygon.get((i + 1) % n);
      sum += p1.x * p2.y - p2.x * p1.y;
    }
    return 0.5 * Math.abs(sum);
  }

  /**
   * Gets the centre of the vertices.
   *
   * @return the centre
   */
  public Point2D.Double getCentre() {
    double sx = 0;
    double sy = 0;
    for (final Point2D.Double p : polygon) {
      sx += p.x;
      sy += p.y;
    }
    final int n = Math.max(1, polygon.size());
    return new Point2D.Double(sx / n, sy / n);
  }

  /**
   * Create a copy with a new label.
   *
   * @param newLabel the new label
   * @return the roi
   */
  PerfusionRoi withLabel(String newLabel) {
    return new PerfusionRoi(newLabel, polygon, color);
  }

  @Override
  public String toString() {
    return label + " (" + polygon.size() + " points)";
  }
}
