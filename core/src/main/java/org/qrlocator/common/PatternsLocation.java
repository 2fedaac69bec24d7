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

package org.qrlocator.common;

import com.google.zxing.ResultPoint;

/**
 * <p>Encapsulates the result of locating the reference patterns of a symbol: the
 * three finder pattern centers, the bottom right alignment point and the sizes
 * a sampler needs to build its grid.</p>
 *
 * @author QR Locator authors
 */
public final class PatternsLocation {

  private final ResultPoint topLeft;
  private final ResultPoint topRight;
  private final ResultPoint bottomLeft;
  private final ResultPoint bottomRight;
  private final float finderAverageSize;
  private final float alignmentSize;

  public PatternsLocation(ResultPoint topLeft,
                          ResultPoint topRight,
                          ResultPoint bottomLeft,
                          ResultPoint bottomRight,
                          float finderAverageSize,
                          float alignmentSize) {
    this.topLeft = topLeft;
    this.topRight = topRight;
    this.bottomLeft = bottomLeft;
    this.bottomRight = bottomRight;
    this.finderAverageSize = finderAverageSize;
    this.alignmentSize = alignmentSize;
  }

  public ResultPoint getTopLeft() {
    return topLeft;
  }

  public ResultPoint getTopRight() {
    return topRight;
  }

  public ResultPoint getBottomLeft() {
    return bottomLeft;
  }

  /**
   * @return center of the detected alignment pattern, or the position predicted
   *         from the three finder patterns when none was detected
   */
  public ResultPoint getBottomRight() {
    return bottomRight;
  }

  public float getFinderAverageSize() {
    return finderAverageSize;
  }

  public float getAlignmentSize() {
    return alignmentSize;
  }

  @Override
  public String toString() {
    return "topLeft=" + topLeft +
        " topRight=" + topRight +
        " bottomLeft=" + bottomLeft +
        " bottomRight=" + bottomRight +
        " finderSize=" + finderAverageSize +
        " alignmentSize=" + alignmentSize;
  }

}
