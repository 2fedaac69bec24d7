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
import java.util.Collections;
import java.util.List;

/**
 * <p>Finds the fourth reference point of a symbol, bottom right, from its three
 * finder patterns.</p>
 *
 * <p>The point is first predicted by completing the parallelogram, then looked for
 * with an {@link AlignmentPatternSource} in a window around the prediction about one
 * finder-to-finder spacing wide. The prediction stands if nothing is found there.</p>
 *
 * @author QR Locator authors
 */
final class AlignmentEstimator {

  /**
   * An alignment pattern is 5 modules wide, a finder pattern 7.
   */
  static final float ALIGNMENT_TO_FINDER_RATIO = 5.0f / 7.0f;

  private static final boolean DO_LOG = Boolean.getBoolean("qrlocator.debug");

  private final AlignmentPatternSource alignmentSource;

  AlignmentEstimator(AlignmentPatternSource alignmentSource) {
    this.alignmentSource = alignmentSource;
  }

  /**
   * @return the detected alignment pattern center closest to ideal, or the predicted
   *         bottom right corner if none was detected
   */
  ResultPoint locateBottomRight(BitMatrix image, FinderAssigner.Corners corners) {
    ResultPoint predicted = predictBottomRight(corners.getTopLeft(), corners.getTopRight(), corners.getBottomLeft());
    ResultPoint[] window = searchWindow(image, corners, predicted);
    log("alignment window %s - %s around %s", window[0], window[1], predicted);

    List<LocationError> alignments = new ArrayList<>(alignmentSource.locate(image, window[0], window[1]));
    if (alignments.isEmpty()) {
      log("no alignment pattern, keeping %s", predicted);
      return predicted;
    }
    Collections.sort(alignments, new LocationError.ErrorComparator());
    LocationError best = alignments.get(0);
    log("alignment pattern %s out of %d", best, alignments.size());
    return best.getLocation();
  }

  static ResultPoint predictBottomRight(ResultPoint topLeft, ResultPoint topRight, ResultPoint bottomLeft) {
    return new ResultPoint(topRight.getX() - topLeft.getX() + bottomLeft.getX(),
                           topRight.getY() - topLeft.getY() + bottomLeft.getY());
  }

  static float alignmentSize(float finderAverageSize) {
    return finderAverageSize * ALIGNMENT_TO_FINDER_RATIO;
  }

  /**
   * Window centered on the predicted bottom right corner, clamped to the image.
   *
   * @return start (inclusive) and end (exclusive) corners
   */
  static ResultPoint[] searchWindow(BitMatrix image, FinderAssigner.Corners corners, ResultPoint bottomRight) {
    ResultPoint topLeft = corners.getTopLeft();
    ResultPoint topRight = corners.getTopRight();
    ResultPoint bottomLeft = corners.getBottomLeft();

    float averageXDistance = (float) Math.floor(
        (Math.abs(bottomRight.getX() - bottomLeft.getX()) + Math.abs(topRight.getX() - topLeft.getX())) / 2);
    float averageYDistance = (float) Math.floor(
        (Math.abs(topRight.getY() - bottomRight.getY()) + Math.abs(topLeft.getY() - bottomLeft.getY())) / 2);

    ResultPoint start = new ResultPoint(
        Math.max(0.0f, (float) Math.floor(bottomRight.getX() - averageXDistance / 2)),
        Math.max(0.0f, (float) Math.floor(bottomRight.getY() - averageYDistance / 2)));
    ResultPoint end = new ResultPoint(
        Math.min(image.getWidth(), (float) Math.floor(bottomRight.getX() + averageXDistance / 2)),
        Math.min(image.getHeight(), (float) Math.floor(bottomRight.getY() + averageYDistance / 2)));
    return new ResultPoint[] {start, end};
  }

  private static void log(String format, Object... args) {
    if (DO_LOG) {
      System.out.println(String.format(format, args));
    }
  }

}
