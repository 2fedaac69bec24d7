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

import org.qrlocator.InsufficientPatternsException;
import org.qrlocator.common.detector.Geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>Picks the three finder patterns to work with out of a noisy list of candidates.</p>
 *
 * <p>Candidates are taken by increasing error. One is skipped if it sits on top of a
 * pattern already picked, or if its size is more than {@link #MAX_SIZE_RATIO} times
 * off the size of the first (most trusted) pattern picked.</p>
 *
 * @author QR Locator authors
 */
final class FinderSelector {

  /**
   * Minimum distance, in pixels, between two distinct finder patterns.
   */
  static final float MIN_PATTERN_DIST = 50.0f;

  private static final float MAX_SIZE_RATIO = 5.0f;

  private FinderSelector() {
  }

  /**
   * @param finders candidates in any order; not modified
   * @return the three selected candidates, lowest error first
   * @throws InsufficientPatternsException if fewer than three could be selected
   */
  static List<LocationError> select(List<LocationError> finders) throws InsufficientPatternsException {
    List<LocationError> sorted = new ArrayList<>(finders);
    Collections.sort(sorted, new LocationError.ErrorComparator());

    List<LocationError> selected = new ArrayList<>(3);
    for (LocationError candidate : sorted) {
      if (selected.size() == 3) {
        break;
      }
      if (isNearSelected(selected, candidate)) {
        continue;
      }
      // Always measured against the first pattern, never the last one accepted
      if (!selected.isEmpty() && !isSizeCompatible(selected.get(0).getSize(), candidate.getSize())) {
        continue;
      }
      selected.add(candidate);
    }

    if (selected.size() < 3) {
      throw new InsufficientPatternsException(selected.size());
    }
    return selected;
  }

  private static boolean isNearSelected(List<LocationError> selected, LocationError candidate) {
    for (LocationError pattern : selected) {
      if (Geometry.nearlySame(pattern.getLocation(), candidate.getLocation(), MIN_PATTERN_DIST)) {
        return true;
      }
    }
    return false;
  }

  static boolean isSizeCompatible(float referenceSize, float size) {
    float min = Math.min(referenceSize, size);
    float max = Math.max(referenceSize, size);
    return max <= MAX_SIZE_RATIO * min;
  }

}
