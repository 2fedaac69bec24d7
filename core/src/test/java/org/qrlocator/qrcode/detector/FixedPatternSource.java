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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Returns the same candidates whatever the image, and remembers the last window it
 * was asked to search.
 */
final class FixedPatternSource implements FinderPatternSource, AlignmentPatternSource {

  private final List<LocationError> candidates;
  private ResultPoint lastStart;
  private ResultPoint lastEnd;

  FixedPatternSource(LocationError... candidates) {
    this.candidates = new ArrayList<>(Arrays.asList(candidates));
  }

  @Override
  public List<LocationError> locate(BitMatrix image) {
    return candidates;
  }

  @Override
  public List<LocationError> locate(BitMatrix image, ResultPoint start, ResultPoint end) {
    lastStart = start;
    lastEnd = end;
    return candidates;
  }

  ResultPoint getLastStart() {
    return lastStart;
  }

  ResultPoint getLastEnd() {
    return lastEnd;
  }

  static LocationError candidate(float x, float y, float size, float error) {
    return new LocationError(new ResultPoint(x, y), size, error);
  }

}
