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

import uk.ac.sussex.gdsc.ceus.InputShapeException;

/**
 * Per-frame translational offsets (dy, dx) relative to a single reference image. Applying the
 * offset to the frame registers it onto the reference.
 */
public final class ShiftTable {
  private final double[] dy;
  private final double[] dx;

  /**
   * Create an instance.
   *
   * @param dy the y offsets
   * @param dx the x offsets
   */
  public ShiftTable(double[] dy, double[] dx) {
    if (dy.length != dx.length) {
      throw new InputShapeException("Shift arrays have different lengths: " + dy.length + " != "
          + dx.length);
    }
    this.dy = dy.clone();
    this.dx = dx.clone();
  }

  /**
   * Gets the number of frames.
   *
   * @return the size
   */
  public int size() {
    return dy.length;
  }

  /**
   * Gets the y offset of the frame.
   *
   * @param frame the frame
   * @return the y offset
   */
  public double getDy(int frame) {
    return dy[frame];
  }

  /**
   * Gets the x offset of the frame.
   *
   * @param frame the frame
   * @return the x offset
   */
  public double getDx(int frame) {
    return dx[frame];
  }

  /**
   * Gets the table as a T x 2 array of {dy, dx}.
   *
   * @return the table
   */
  public double[][] toArray() {
    final double[][] table = new double[dy.length][];
    for (int i = 0; i < dy.length; i++) {
      table[i] = new double[] {dy[i], dx[i]};
    }
    return table;
  }

  /**
   * Gets the root mean square displacement of all frames.
   *
   * @return the RMSD
   */
  public double getRmsd() {
    if (dy.length == 0) {
      return 0;
    }
    double ss = 0;
    for (int i = 0; i < dy.length; i++) {
      ss += dy[i] * dy[i] + dx[i] * dx[i];
    }
    return Math.sqrt(ss / dy.length);
  }
}
