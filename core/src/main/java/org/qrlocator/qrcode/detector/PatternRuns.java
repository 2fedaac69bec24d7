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

/**
 * <p>The five black/white/black/white/black runs crossing a pattern along one row or
 * one column, centered on a black pixel.</p>
 *
 * <p>Finder and alignment patterns are both concentric squares, so a line through
 * their center crosses runs in a fixed ratio: 1:1:3:1:1 for a finder pattern and
 * 1:1:1:1:1 for an alignment pattern.</p>
 *
 * @author QR Locator authors
 */
final class PatternRuns {

  private final int[] counts;
  private final float center;

  private PatternRuns(int[] counts, float center) {
    this.counts = counts;
    this.center = center;
  }

  /**
   * <p>Reads the runs around a black pixel. The middle run is the one containing the
   * pixel; two more runs are read on each side.</p>
   *
   * @param vertical true to read along column {@code x}, false along row {@code y}
   * @return the runs, or null if the pixel is white or an outer run is empty
   */
  static PatternRuns read(BitMatrix image, int x, int y, boolean vertical) {
    if (!image.get(x, y)) {
      return null;
    }
    int limit = vertical ? image.getHeight() : image.getWidth();
    int position = vertical ? y : x;
    int[] counts = new int[5];

    int i = position;
    while (i >= 0 && isBlack(image, x, y, i, vertical)) {
      counts[2]++;
      i--;
    }
    int middleStart = i + 1;
    while (i >= 0 && !isBlack(image, x, y, i, vertical)) {
      counts[1]++;
      i--;
    }
    while (i >= 0 && isBlack(image, x, y, i, vertical)) {
      counts[0]++;
      i--;
    }

    i = position + 1;
    while (i < limit && isBlack(image, x, y, i, vertical)) {
      counts[2]++;
      i++;
    }
    int middleEnd = i;
    while (i < limit && !isBlack(image, x, y, i, vertical)) {
      counts[3]++;
      i++;
    }
    while (i < limit && isBlack(image, x, y, i, vertical)) {
      counts[4]++;
      i++;
    }

    for (int count : counts) {
      if (count == 0) {
        return null;
      }
    }
    return new PatternRuns(counts, (middleStart + middleEnd) / 2.0f);
  }

  /**
   * <p>Reads the runs along the row through {@code (x, y)}, then along the column through
   * the center found, then again along the row through the center found.</p>
   *
   * @return a candidate at the center of the pattern, or null if the runs don't fit
   *         {@code ratios} in either direction
   */
  static LocationError crossCheck(BitMatrix image, int x, int y, int[] ratios) {
    PatternRuns horizontal = read(image, x, y, false);
    if (horizontal == null || !horizontal.matches(ratios)) {
      return null;
    }
    int centerX = (int) horizontal.getCenter();

    PatternRuns vertical = read(image, centerX, y, true);
    if (vertical == null || !vertical.matches(ratios)) {
      return null;
    }
    int centerY = (int) vertical.getCenter();

    // Row y may not have gone through the middle of the pattern
    PatternRuns recheck = read(image, centerX, centerY, false);
    if (recheck == null || !recheck.matches(ratios)) {
      return null;
    }

    float width = recheck.getTotal();
    float height = vertical.getTotal();
    float size = (width + height) / 2;
    float error = (recheck.error(ratios) + vertical.error(ratios)) / 2 + Math.abs(width - height) / size;
    return new LocationError(new ResultPoint(recheck.getCenter(), vertical.getCenter()), size, error);
  }

  int getTotal() {
    int total = 0;
    for (int count : counts) {
      total += count;
    }
    return total;
  }

  /**
   * @return coordinate, along the line read, of the middle of the middle run
   */
  float getCenter() {
    return center;
  }

  /**
   * Each run may be off by at most half of what it should be.
   */
  boolean matches(int[] ratios) {
    int total = getTotal();
    int units = sum(ratios);
    if (total < units) {
      return false;
    }
    float moduleSize = total / (float) units;
    for (int i = 0; i < counts.length; i++) {
      float expected = ratios[i] * moduleSize;
      if (Math.abs(counts[i] - expected) >= expected / 2) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return mean squared relative deviation of the runs from {@code ratios}; 0 is a
   *         perfect match
   */
  float error(int[] ratios) {
    float moduleSize = getTotal() / (float) sum(ratios);
    float error = 0.0f;
    for (int i = 0; i < counts.length; i++) {
      float expected = ratios[i] * moduleSize;
      float deviation = (counts[i] - expected) / expected;
      error += deviation * deviation;
    }
    return error / counts.length;
  }

  static int sum(int[] ratios) {
    int sum = 0;
    for (int ratio : ratios) {
      sum += ratio;
    }
    return sum;
  }

  private static boolean isBlack(BitMatrix image, int x, int y, int position, boolean vertical) {
    return vertical ? image.get(x, position) : image.get(position, y);
  }

}
