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

import com.google.zxing.common.BitMatrix;

import java.util.List;

/**
 * <p>Scans an image for finder patterns: a 3x3 black square inside a white ring inside a
 * black ring, 7 modules across. Every black run of every scanned row is tried as the
 * middle of such a pattern and cross-checked along its column.</p>
 *
 * @author QR Locator authors
 */
public final class FinderLocator implements FinderPatternSource {

  private static final int[] FINDER_RATIOS = {1, 1, 3, 1, 1};
  private static final int ROW_STEP = Math.max(1, Integer.getInteger("qrlocator.finder.rowStep", 1));

  @Override
  public List<LocationError> locate(BitMatrix image) {
    int width = image.getWidth();
    int height = image.getHeight();
    PatternCandidates candidates = new PatternCandidates(PatternRuns.sum(FINDER_RATIOS));

    for (int y = 0; y < height; y += ROW_STEP) {
      int x = 0;
      while (x < width) {
        if (!image.get(x, y)) {
          x++;
          continue;
        }
        int runStart = x;
        while (x < width && image.get(x, y)) {
          x++;
        }
        LocationError hit = PatternRuns.crossCheck(image, (runStart + x - 1) / 2, y, FINDER_RATIOS);
        if (hit != null) {
          candidates.add(hit);
        }
      }
    }
    return candidates.toList();
  }

}
