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

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.ceus.InvalidRoiException;
import uk.ac.sussex.gdsc.ceus.data.PerfusionRoi;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.RoiSession;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;

@SuppressWarnings({"javadoc"})
class TicExtractorTest {
  private static final int WIDTH = 20;
  private static final int HEIGHT = 16;

  /**
   * Create frames where the pixel value is {@code t * 100 + x}.
   */
  private static PixelVolume createVolume(int frames) {
    final float[][] data = new float[frames][WIDTH * HEIGHT];
    for (int t = 0; t < frames; t++) {
      for (int y = 0, i = 0; y < HEIGHT; y++) {
        for (int x = 0; x < WIDTH; x++, i++) {
          data[t][i] = t * 100 + x;
        }
      }
    }
    return PixelVolume.ofFloat(WIDTH, HEIGHT, data);
  }

  @Test
  void testRectangleMaskIsInclusive() {
    final RoiMask mask =
        RoiMask.create(PerfusionRoi.rectangle("r", 2, 3, 6, 9, Color.RED), WIDTH, HEIGHT);
    Assertions.assertEquals(5 * 7, mask.getCount());
    Assertions.assertTrue(mask.contains(2, 3));
    Assertions.assertTrue(mask.contains(6, 9));
    Assertions.assertFalse(mask.contains(7, 9));
    Assertions.assertFalse(mask.contains(-1, 0));
  }

  @Test
  void testRectangleIsClipped() {
    final RoiMask mask =
        RoiMask.create(PerfusionRoi.rectangle("r", 15, 10, 30, 30, Color.RED), WIDTH, HEIGHT);
    Assertions.assertEquals(5 * 6, mask.getCount());
  }

  @Test
  void testPolygonMask() {
    final PerfusionRoi triangle = new PerfusionRoi("t",
        Arrays.asList(new Point2D.Double(0, 0), new Point2D.Double(12, 0),
            new Point2D.Double(0, 12)),
        Color.RED);
    final RoiMask mask = RoiMask.create(triangle, WIDTH, HEIGHT);
    Assertions.assertTrue(mask.contains(1, 1));
    Assertions.assertFalse(mask.contains(11, 11));
    // Pixel centres on or inside the polygon: x + y <= 12
    Assertions.assertEquals(91, mask.getCount());
    for (int i = 0; i <= 12; i++) {
      Assertions.assertTrue(mask.contains(i, 0), "top edge");
      Assertions.assertTrue(mask.contains(0, i), "left edge");
      Assertions.assertTrue(mask.contains(i, 12 - i), "diagonal edge");
    }
  }

  @Test
  void testPolygonOutlineMatchesRectangle() {
    final RoiMask rectangle =
        RoiMask.create(PerfusionRoi.rectangle("r", 5, 5, 15, 15, Color.RED), WIDTH, HEIGHT);
    // Same region with an extra vertex on the left edge
    final PerfusionRoi pentagon = new PerfusionRoi("p",
        Arrays.asList(new Point2D.Double(5, 5), new Point2D.Double(15, 5),
            new Point2D.Double(15, 15), new Point2D.Double(5, 15), new Point2D.Double(5, 10)),
        Color.RED);
    final RoiMask mask = RoiMask.create(pentagon, WIDTH, HEIGHT);
    Assertions.assertEquals(121, rectangle.getCount());
    Assertions.assertEquals(rectangle.getCount(), mask.getCount());
    for (int i = 5; i <= 15; i++) {
      Assertions.assertTrue(mask.contains(i, 5));
      Assertions.assertTrue(mask.contains(i, 15));
      Assertions.assertTrue(mask.contains(5, i));
      Assertions.assertTrue(mask.contains(15, i));
    }
    Assertions.assertFalse(mask.contains(4, 10));
    Assertions.assertFalse(mask.contains(16, 10));
  }

  @Test
  void testInvalidRois() {
    final PerfusionRoi line = new PerfusionRoi("line",
        Arrays.asList(new Point2D.Double(0, 0), new Point2D.Double(10, 10)), Color.RED);
    Assertions.assertThrows(InvalidRoiException.class, () -> RoiMask.create(line, WIDTH, HEIGHT));
    final PerfusionRoi flat = new PerfusionRoi("flat", Arrays.asList(new Point2D.Double(0, 0),
        new Point2D.Double(5, 5), new Point2D.Double(10, 10)), Color.RED);
    Assertions.assertThrows(InvalidRoiException.class, () -> RoiMask.create(flat, WIDTH, HEIGHT));
    final PerfusionRoi small = PerfusionRoi.rectangle("small", 2, 2, 4, 10, Color.RED);
    Assertions.assertThrows(InvalidRoiException.class,
        () -> RoiMask.create(small, WIDTH, HEIGHT));
    final PerfusionRoi outside = PerfusionRoi.rectangle("outside", 50, 50, 60, 60, Color.RED);
    Assertions.assertThrows(InvalidRoiException.class,
        () -> RoiMask.create(outside, WIDTH, HEIGHT));
  }

  @Test
  void testExtract() {
    final PixelVolume volume = createVolume(4);
    final TicExtractor extractor = new TicExtractor(2);
    final TimeIntensityCurve curve =
        extractor.extract(volume, PerfusionRoi.rectangle("r", 2, 0, 6, 4, Color.RED));
    Assertions.assertEquals("r", curve.getLabel());
    Assertions.assertArrayEquals(new double[] {0, 0.5, 1, 1.5}, curve.getTime());
    Assertions.assertArrayEquals(new double[] {4, 104, 204, 304}, curve.getRaw(), 1e-6);
    Assertions.assertArrayEquals(new double[] {0, 100, 200, 300}, curve.getValues(), 1e-6);
  }

  @Test
  void testTraceMultiThreaded() {
    final PixelVolume volume = createVolume(9);
    final RoiMask mask =
        RoiMask.create(PerfusionRoi.rectangle("r", 1, 2, 12, 9, Color.RED), WIDTH, HEIGHT);
    final double[] expected = TicExtractor.trace(volume, mask, 1);
    Assertions.assertArrayEquals(expected, TicExtractor.trace(volume, mask, 4));
    final TimeIntensityCurve curve = new TicExtractor(10, 3).extract(volume,
        PerfusionRoi.rectangle("r", 1, 2, 12, 9, Color.RED));
    Assertions.assertArrayEquals(expected, curve.getRaw());
  }

  @Test
  void testExtractAllIsolatesFailures() {
    final RoiSession session = new RoiSession();
    session.add(PerfusionRoi.rectangle("good", 0, 0, 9, 9, Color.RED));
    session.add(PerfusionRoi.rectangle("bad", 0, 0, 2, 2, Color.RED));
    session.add(PerfusionRoi.rectangle("good2", 10, 5, 19, 15, Color.RED));
    final TicExtraction result = new TicExtractor(10).extractAll(createVolume(3), session);
    Assertions.assertEquals(2, result.getCurves().size());
    Assertions.assertTrue(result.getCurves().containsKey("good"));
    Assertions.assertTrue(result.getCurves().containsKey("good2"));
    Assertions.assertEquals(1, result.getFailures().size());
    Assertions.assertTrue(result.getFailures().containsKey("bad"));
  }
}
