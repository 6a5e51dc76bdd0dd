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

package uk.ac.sussex.gdsc.ceus;

/**
 * Thrown when there are too few data points for an operation.
 */
public class InsufficientDataException extends CeusException {
  private static final long serialVersionUID = 20200101L;

  /**
   * Create an instance.
   *
   * @param message the message
   */
  public InsufficientDataException(String message) {
    super(message);
  }

  /**
   * Create an exception describing the required and actual number of points.
   *
   * @param operation the operation
   * @param required the required number of points
   * @param actual the actual number of points
   * @return the exception
   */
  public static InsufficientDataException of(String operation, int required, int actual) {
    return new InsufficientDataException(
        String.format("%s requires at least %d points, found %d", operation, required, actual));
  }
}
