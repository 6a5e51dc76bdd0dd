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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A caller-owned collection of labelled regions of interest. Labels are unique.
 *
 * <p>This class is not thread-safe.
 */
public class RoiSession implements Iterable<PerfusionRoi> {
  private static final Color[] PALETTE = {Color.RED, Color.GREEN, Color.BLUE, Color.YELLOW,
      Color.MAGENTA, Color.CYAN, new Color(255, 128, 0), new Color(128, 0, 255)};

  private final List<PerfusionRoi> rois = new ArrayList<>();
  private int nextId = 1;

  /**
   * Adds the polygon with an automatic label ({@code ROI_n}) and palette colour.
   *
   * @param polygon the polygon
   * @return the roi
   */
  public PerfusionRoi add(List<? extends Point2D> polygon) {
    String label;
    do {
      label = "ROI_" + nextId++;
    } while (contains(label));
    return add(label, polygon, null);
  }

  /**
   * Adds the polygon.
   *
   * @param label the label
   * @param polygon the polygon
   * @param color the colour (if null a palette colour is used)
   * @return the roi
   * @throws IllegalArgumentException if the label is already used
   */
  public PerfusionRoi add(String label, List<? extends Point2D> polygon, Color color) {
    if (contains(label)) {
      throw new IllegalArgumentException("Duplicate ROI label: " + label);
    }
    final Color c = color == null ? PALETTE[rois.size() % PALETTE.length] : color;
    final PerfusionRoi roi = new PerfusionRoi(label, polygon, c);
    rois.add(roi);
    return roi;
  }

  /**
   * Adds the roi.
   *
   * @param roi the roi
   * @throws IllegalArgumentException if the label is already used
   */
  public void add(PerfusionRoi roi) {
    if (contains(roi.getLabel())) {
      throw new IllegalArgumentException("Duplicate ROI label: " + roi.getLabel());
    }
    rois.add(roi);
  }

  /**
   * Removes the ROI with the label.
   *
   * @param label the label
   * @return true if removed
   */
  public boolean remove(String label) {
    return rois.removeIf(roi -> roi.getLabel().equals(label));
  }

  /**
   * Renames the ROI. Fails if the old label is missing or the new label is already used.
   *
   * @param oldLabel the old label
   * @param newLabel the new label
   * @return true if renamed
   */
  public boolean rename(String oldLabel, String newLabel) {
    if (contains(newLabel)) {
      return false;
    }
    for (int i = 0; i < rois.size(); i++) {
      if (rois.get(i).getLabel().equals(oldLabel)) {
        rois.set(i, rois.get(i).withLabel(newLabel));
        return true;
      }
    }
    return false;
  }

  /**
   * Gets the ROI with the label.
   *
   * @param label the label
   * @return the roi (or null)
   */
  public PerfusionRoi get(String label) {
    for (final PerfusionRoi roi : rois) {
      if (roi.getLabel().equals(label)) {
        return roi;
      }
    }
    return null;
  }

  /**
   * Checks if the label is used.
   *
   * @param label the label
   * @return true if present
   */
  public boolean contains(String label) {
    return get(label) != null;
  }

  /**
   * Gets the ROIs in insertion order.
   *
   * @return the rois (unmodifiable)
   */
  public List<PerfusionRoi> getRois() {
    return Collections.unmodifiableList(rois);
  }

  /**
   * Gets the number of ROIs.
   *
   * @return the size
   */
  public int size() {
    return rois.size();
  }

  /**
   * Remove all ROIs and reset the automatic label counter.
   */
  public void clear() {
    rois.clear();
    nextId = 1;
  }

  /**
   * Check that all the vertices of each ROI are inside the frame.
   *
   * @param width the frame width
   * @param height the frame height
   * @return map of label to valid flag
   */
  public Map<String, Boolean> validate(int width, int height) {
    final Map<String, Boolean> results = new LinkedHashMap<>();
    for (final PerfusionRoi roi : rois) {
      boolean valid = true;
      for (final Point2D.Double p : roi.getPolygon()) {
        if (p.x < 0 || p.x >= width || p.y < 0 || p.y >= height) {
          valid = false;
          break;
        }
      }
      results.put(roi.getLabel(), valid);
    }
    return results;
  }

  @Override
  public Iterator<PerfusionRoi> iterator() {
    return getRois().iterator();
  }
}
