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

import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions;
import uk.ac.sussex.gdsc.ceus.filter.PreprocessorOptions.SpatialFilter;
import uk.ac.sussex.gdsc.ceus.fit.FitOptions;

@SuppressWarnings({"javadoc"})
class CeusSettingsTest {
  @Test
  void testCopyIsIndependent() {
    final CeusSettings settings = new CeusSettings();
    settings.setExcludedFrames(7);
    settings.setSplitScreenVendors(Arrays.asList("GE", "Acme"));
    final CeusSettings copy = settings.copy();
    Assertions.assertEquals(7, copy.getExcludedFrames());
    Assertions.assertEquals(Arrays.asList("GE", "Acme"), copy.getSplitScreenVendors());
    copy.setExcludedFrames(2);
    Assertions.assertEquals(7, settings.getExcludedFrames());
  }

  @Test
  void testCreatedComponentsUseSettings() {
    final CeusSettings settings = new CeusSettings();
    settings.setNormalise(false);
    settings.setPercentiles(5, 95);
    settings.setSpatialFilter(SpatialFilter.GAUSSIAN);
    settings.setRestarts(12);
    settings.setSeed(3L);
    settings.setWashInMaxTime(4);
    settings.setSplitScreenVendors(Arrays.asList("Acme"));

    final PreprocessorOptions options = settings.createPreprocessorOptions();
    Assertions.assertFalse(options.isNormalise());
    Assertions.assertEquals(5, options.getLowerPercentile());
    Assertions.assertEquals(95, options.getUpperPercentile());
    Assertions.assertEquals(SpatialFilter.GAUSSIAN, options.getSpatialFilter());

    final FitOptions fitOptions = settings.createFitOptions();
    Assertions.assertEquals(12, fitOptions.getRestarts());
    Assertions.assertEquals(Long.valueOf(3), fitOptions.getSeed());
    Assertions.assertEquals(4, fitOptions.getWashInMaxTime());

    Assertions.assertTrue(settings.createRegionClassifier().isSplitScreenVendor("ACME Corp"));
    Assertions.assertFalse(settings.createRegionClassifier().isSplitScreenVendor("GE"));
  }

  @Test
  void testParseVendors() {
    Assertions.assertEquals(Arrays.asList("GE", "Acme"), CeusSettings.parseVendors(" GE, ,Acme,"));
    Assertions.assertTrue(CeusSettings.parseVendors("").isEmpty());
  }

  @Test
  void testLoadReturnsCopy() {
    final CeusSettings s1 = CeusSettings.load();
    final CeusSettings s2 = CeusSettings.load();
    Assertions.assertNotSame(s1, s2);
  }
}
