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

package uk.ac.sussex.gdsc.ceus.export;

/**
 * A tidy row of a parameter export: one named value of one ROI.
 */
public final class ParameterRow {
  private final String roi;
  private final String name;
  private final double value;

  /**
   * Create an instance.
   *
   * @param roi the ROI label
   * @param name the parameter name
   * @param value the value
   */
  public ParameterRow(String roi, String name, double value) {
    this.roi = roi;
    this.name = name;
    this.value = value;
  }

  public String getRoi() {
    return roi;
  }

  public String getName() {
    return name;
  }

  public double getValue() {
    return value;
  }

  @Override
  public String toString() {
    return roi + "," + name + "," + value;
  }
}
