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

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the hits of a scan. A hit less than one module away from an earlier one is
 * the same pattern seen from another row and is folded into it.
 *
 * @author QR Locator authors
 */
final class PatternCandidates {

  private final int modules;
  private final List<Estimate> estimates = new ArrayList<>();

  /**
   * @param modules width of the pattern, in modules
   */
  PatternCandidates(int modules) {
    this.modules = modules;
  }

  void add(LocationError hit) {
    for (Estimate estimate : estimates) {
      if (estimate.aboutEquals(hit, modules)) {
        estimate.combine(hit);
        return;
      }
    }
    estimates.add(new Estimate(hit));
  }

  List<LocationError> toList() {
    List<LocationError> result = new ArrayList<>(estimates.size());
    for (Estimate estimate : estimates) {
      result.add(estimate.toLocationError());
    }
    return result;
  }

  private static final class Estimate {

    private float x;
    private float y;
    private float size;
    private float error;
    private int count;

    Estimate(LocationError hit) {
      x = hit.getLocation().getX();
      y = hit.getLocation().getY();
      size = hit.getSize();
      error = hit.getError();
      count = 1;
    }

    boolean aboutEquals(LocationError hit, int modules) {
      float moduleSize = size / modules;
      return Math.abs(hit.getLocation().getX() - x) <= moduleSize &&
          Math.abs(hit.getLocation().getY() - y) <= moduleSize;
    }

    void combine(LocationError hit) {
      int combinedCount = count + 1;
      x = (count * x + hit.getLocation().getX()) / combinedCount;
      y = (count * y + hit.getLocation().getY()) / combinedCount;
      size = (count * size + hit.getSize()) / combinedCount;
      error = Math.min(error, hit.getError());
      count = combinedCount;
    }

    LocationError toLocationError() {
      return new LocationError(new ResultPoint(x, y), size, error);
    }
  }

}
