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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class RegionDescriptorTest {
  @Test
  void testClipInsideFrameIsUnchanged() {
    final RegionDescriptor region = new RegionDescriptor(2, 3, 30, 40, 2, 7);
    Assertions.assertSame(region, region.clip(64, 48));
  }

  @Test
  void testClipToFrame() {
    final RegionDescriptor region = new RegionDescriptor(-5, 10, 100, 80, 1, 3);
    final RegionDescriptor clipped = region.clip(64, 48);
    Assertions.assertEquals(0, clipped.getX0());
    Assertions.assertEquals(10, clipped.getY0());
    Assertions.assertEquals(63, clipped.getX1());
    Assertions.assertEquals(47, clipped.getY1());
    Assertions.assertEquals(1, clipped.getDataType());
    Assertions.assertEquals(3, clipped.getFlags());
    Assertions.assertTrue(clipped.isAmbiguous());
  }

  @Test
  void testClipEmptyRegion() {
    // Entirely right of the frame
    Assertions.assertNull(new RegionDescriptor(70, 0, 90, 20, 2).clip(64, 48));
    // Zero width
    Assertions.assertNull(new RegionDescriptor(10, 0, 10, 20, 2).clip(64, 48));
    // Inverted
    Assertions.assertNull(new RegionDescriptor(20, 30, 10, 40, 2).clip(64, 48));
  }
}
