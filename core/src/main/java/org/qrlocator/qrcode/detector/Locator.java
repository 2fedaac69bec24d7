/*
 * Copyright 2026 QR Locator authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.qrlocator.qrcode.detector;

import com.google.zxing.ResultPoint;
import com.google.zxing.common.BitMatrix;
import org.qrlocator.InsufficientPatternsException;
import org.qrlocator.common.PatternsLocation;

import java.util.List;

/**
 * <p>Locates the three finder patterns and the bottom right alignment pattern of a
 * QR-like symbol in a binarized image.</p>
 *
 * <p>A Locator keeps no state between calls and may be shared between threads, as long
 * as its pattern sources can.</p>
 *
 * @author QR Locator authors
 */
public final class Locator {

  private static final boolean DO_LOG = Boolean.getBoolean("qrlocator.debug");

  private final FinderPatternSource finderSource;
  private final AlignmentEstimator alignmentEstimator;

  public Locator() {
    this(new FinderLocator(), new AlignmentLocator());
  }

  public Locator(FinderPatternSource finderSource, AlignmentPatternSource alignmentSource) {
    this.finderSource = finderSource;
    this.alignmentEstimator = new AlignmentEstimator(alignmentSource);
  }

  /**
   * <p>Locates the reference patterns of a symbol.</p>
   *
   * @param image binarized image, true meaning black
   * @return {@link PatternsLocation} of the finder and alignment patterns
   * @throws InsufficientPatternsException if three distinct finder patterns of
   *         compatible sizes can't be found
   */
  public PatternsLocation locate(BitMatrix image) throws InsufficientPatternsException {
    List<LocationError> finders = finderSource.locate(image);
    log("%d finder candidates", finders.size());

    List<LocationError> selected = FinderSelector.select(finders);
    log("selected finders %s", selected);

    FinderAssigner.Corners corners = FinderAssigner.assign(selected.get(0).getLocation(),
                                                           selected.get(1).getLocation(),
                                                           selected.get(2).getLocation());
    log("assigned tl/tr/bl %s", corners);

    float finderAverageSize = (selected.get(0).getSize() +
                               selected.get(1).getSize() +
                               selected.get(2).getSize()) / 3;

    ResultPoint bottomRight = alignmentEstimator.locateBottomRight(image, corners);

    return new PatternsLocation(corners.getTopLeft(),
                                corners.getTopRight(),
                                corners.getBottomLeft(),
                                bottomRight,
                                finderAverageSize,
                                AlignmentEstimator.alignmentSize(finderAverageSize));
  }

  private static void log(String format, Object... args) {
    if (DO_LOG) {
      System.out.println(String.format(format, args));
    }
  }

}
