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

package uk.ac.sussex.gdsc.ceus.region;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import uk.ac.sussex.gdsc.ceus.EmptyVideoException;
import uk.ac.sussex.gdsc.ceus.data.PixelVolume;
import uk.ac.sussex.gdsc.ceus.data.RecordingMetadata;
import uk.ac.sussex.gdsc.ceus.data.RegionDescriptor;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * Identifies the B-mode and contrast regions of an ultrasound recording.
 *
 * <p>Scanners may show the contrast image alone or side-by-side with the B-mode image. The
 * regions are described by the container. The contrast region is chosen using, in order:
 *
 * <ol>
 * <li>an explicit contrast tag;
 * <li>the fixed layout of a known split-screen vendor (B-mode left, contrast right);
 * <li>the colour variance of the regions (the contrast overlay is coloured);
 * <li>the single usable region;
 * <li>the whole frame.
 * </ol>
 */
public class RegionClassifier {
  private static final Logger logger = Logger.getLogger(RegionClassifier.class.getName());

  /** The default vendors with a fixed split-screen layout. */
  public static final Set<String> DEFAULT_SPLIT_SCREEN_VENDORS =
      Collections.unmodifiableSet(new LinkedHashSet<>(Collections.singletonList("GE")));

  private final List<Pattern> vendors;

  /**
   * A usable region of the recording.
   */
  private static class Candidate {
    final int index;
    final RegionDescriptor region;
    double score;

    Candidate(int index, RegionDescriptor region) {
      this.index = index;
      this.region = region;
    }
  }

  /**
   * Create an instance with the default split-screen vendors.
   */
  public RegionClassifier() {
    this(DEFAULT_SPLIT_SCREEN_VENDORS);
  }

  /**
   * Create an instance.
   *
   * @param splitScreenVendors the vendors with a fixed split-screen layout
   */
  public RegionClassifier(Collection<String> splitScreenVendors) {
    vendors = new ArrayList<>(splitScreenVendors.size());
    for (final String vendor : splitScreenVendors) {
      vendors.add(Pattern.compile("\\b" + Pattern.quote(vendor.trim()) + "\\b",
          Pattern.CASE_INSENSITIVE));
    }
  }

  /**
   * Checks if the manufacturer is a known split-screen vendor. The vendor name must match a whole
   * word of the manufacturer, ignoring case.
   *
   * @param manufacturer the manufacturer
   * @return true if a known vendor
   */
  public boolean isSplitScreenVendor(String manufacturer) {
    if (manufacturer == null) {
      return false;
    }
    for (final Pattern p : vendors) {
      if (p.matcher(manufacturer).find()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Classify the regions of the volume.
   *
   * @param volume the volume
   * @param regions the region descriptors
   * @param metadata the recording metadata
   * @return the classified stacks
   * @throws EmptyVideoException if the volume has no frames
   */
  public ClassifiedStacks classify(PixelVolume volume, List<RegionDescriptor> regions,
      RecordingMetadata metadata) {
    if (volume == null || volume.getFrames() == 0) {
      throw new EmptyVideoException("No frames in the video");
    }

    final List<Candidate> usable = new ArrayList<>();
    for (int i = 0; i < regions.size(); i++) {
      final RegionDescriptor clipped = regions.get(i).clip(volume.getWidth(), volume.getHeight());
      if (clipped != null) {
        usable.add(new Candidate(i, clipped));
      }
    }
    final List<Candidate> contrast = new ArrayList<>();
    final List<Candidate> ambiguous = new ArrayList<>();
    for (final Candidate c : usable) {
      if (c.region.isContrast()) {
        contrast.add(c);
      } else if (c.region.isAmbiguous()) {
        ambiguous.add(c);
      }
    }

    final ClassifiedStacks result;
    if (!contrast.isEmpty()) {
      final Candidate ceus = contrast.get(0);
      final Candidate bmode = ambiguous.size() == 1 ? ambiguous.get(0) : null;
      result = create(volume, metadata, ClassificationCase.EXPLICIT_CONTRAST, bmode, ceus);
    } else if (ambiguous.size() >= 2) {
      if (isSplitScreenVendor(metadata.getManufacturer())) {
        // Stable sort: equal x0 keeps the descriptor order
        ambiguous.sort(Comparator.comparingInt(c -> c.region.getX0()));
        result = create(volume, metadata, ClassificationCase.SPLIT_SCREEN_KNOWN_VENDOR,
            ambiguous.get(0), ambiguous.get(1));
      } else {
        for (final Candidate c : ambiguous) {
          c.score = colourVariance(volume, c.region);
        }
        // Highest score first; ties to the larger x0 then the higher index
        ambiguous.sort((c1, c2) -> {
          int cmp = Double.compare(c2.score, c1.score);
          if (cmp == 0) {
            cmp = Integer.compare(c2.region.getX0(), c1.region.getX0());
            if (cmp == 0) {
              cmp = Integer.compare(c2.index, c1.index);
            }
          }
          return cmp;
        });
        result = create(volume, metadata, ClassificationCase.SPLIT_SCREEN_GENERIC,
            ambiguous.get(1), ambiguous.get(0));
      }
    } else if (!usable.isEmpty()) {
      final Candidate ceus = ambiguous.isEmpty() ? usable.get(0) : ambiguous.get(0);
      result = create(volume, metadata, ClassificationCase.SINGLE_REGION, null, ceus);
    } else {
      result = create(volume, metadata, ClassificationCase.NO_REGION, null, null);
    }
    logger.fine(() -> "Classified " + usable.size() + " usable regions: " + result);
    return result;
  }

  private static ClassifiedStacks create(PixelVolume volume, RecordingMetadata metadata,
      ClassificationCase classificationCase, Candidate bmode, Candidate ceus) {
    final boolean ybr = metadata.isYbr() && volume.isRgb();
    final PixelVolume ceusVolume = extract(volume, ceus, ybr);
    final PixelVolume bmodeVolume = bmode == null ? null : extract(volume, bmode, ybr);
    return new ClassifiedStacks(bmodeVolume, ceusVolume, classificationCase,
        bmode == null ? ClassifiedStacks.NO_INDEX : bmode.index,
        ceus == null ? ClassifiedStacks.NO_INDEX : ceus.index);
  }

  private static PixelVolume extract(PixelVolume volume, Candidate candidate, boolean ybr) {
    PixelVolume result;
    if (candidate == null) {
      result = PixelVolume.of(volume.toImageStack());
    } else {
      final RegionDescriptor r = candidate.region;
      result = volume.crop(r.getX0(), r.getY0(), r.getX1(), r.getY1());
    }
    return ybr ? YbrConverter.convert(result) : result;
  }

  /**
   * Compute the colour variance of the region on the middle frame. This is the sum of the
   * population standard deviations of the channel differences R-G, G-B and R-B. Single channel
   * data has no colour variance.
   *
   * @param volume the volume
   * @param region the region
   * @return the colour variance
   */
  static double colourVariance(PixelVolume volume, RegionDescriptor region) {
    if (!volume.isRgb()) {
      return 0;
    }
    final int frame = Math.min(volume.getFrames() / 2, volume.getFrames() - 1);
    final float[] red = volume.getChannel(frame, 0);
    final float[] green = volume.getChannel(frame, 1);
    final float[] blue = volume.getChannel(frame, 2);
    final int width = volume.getWidth();
    final int size = (region.getX1() - region.getX0() + 1) * (region.getY1() - region.getY0() + 1);
    final double[] rg = new double[size];
    final double[] gb = new double[size];
    final double[] rb = new double[size];
    int k = 0;
    for (int y = region.getY0(); y <= region.getY1(); y++) {
      for (int x = region.getX0(), i = y * width + x; x <= region.getX1(); x++, i++) {
        rg[k] = red[i] - green[i];
        gb[k] = green[i] - blue[i];
        rb[k] = red[i] - blue[i];
        k++;
      }
    }
    return MathUtils.populationStandardDeviation(rg)
        + MathUtils.populationStandardDeviation(gb) + MathUtils.populationStandardDeviation(rb);
  }
}
