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

import java.util.List;

/**
 * <p>Scans a window of an image for alignment patterns: a black module inside a white
 * ring inside a black ring, 5 modules across. Runs may extend past the window but the
 * center of every pattern returned lies inside it.</p>
 *
 * @author QR Locator authors
 */
public final class AlignmentLocator implements AlignmentPatternSource {

  private static final int[] ALIGNMENT_RATIOS = {1, 1, 1, 1, 1};
  private static final int ROW_STEP = Math.max(1, Integer.getInteger("qrlocator.alignment.rowStep", 1));

  @Override
  public List<LocationError> locate(BitMatrix image, ResultPoint start, ResultPoint end) {
    int left = Math.max(0, (int) start.getX());
    int top = Math.max(0, (int) start.getY());
    int right = Math.min(image.getWidth(), (int) end.getX());
    int bottom = Math.min(image.getHeight(), (int) end.getY());
    PatternCandidates candidates = new PatternCandidates(PatternRuns.sum(ALIGNMENT_RATIOS));

    for (int y = top; y < bottom; y += ROW_STEP) {
      int x = left;
      while (x < right) {
        if (!image.get(x, y)) {
          x++;
          continue;
        }
        int runStart = x;
        while (x < right && image.get(x, y)) {
          x++;
        }
        LocationError hit = PatternRuns.crossCheck(image, (runStart + x - 1) / 2, y, ALIGNMENT_RATIOS);
        if (hit != null && isInside(hit.getLocation(), left, top, right, bottom)) {
          candidates.add(hit);
        }
      }
    }
    return candidates.toList();
  }

  private static boolean isInside(ResultPoint point, int left, int top, int right, int bottom) {
    return point.getX() >= left && point.getX() < right && point.getY() >= top && point.getY() < bottom;
  }

}
