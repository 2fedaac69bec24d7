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
import org.qrlocator.common.detector.Geometry;

/**
 * <p>Tells which of three finder pattern centers is the top left, the top right and
 * the bottom left one.</p>
 *
 * <p>Top right and bottom left are the two farthest apart. The top left one must then
 * be on the left of the vector going from bottom left to top right, which the sign of
 * a cross product settles.</p>
 *
 * @author QR Locator authors
 */
final class FinderAssigner {

  private FinderAssigner() {
  }

  /**
   * @return the three points labelled; the same labels whatever order they come in
   */
  static Corners assign(ResultPoint a, ResultPoint b, ResultPoint c) {
    float distAB = Geometry.squaredDistance(a, b);
    float distAC = Geometry.squaredDistance(a, c);
    float distBC = Geometry.squaredDistance(b, c);

    // Longest side goes to a-b
    ResultPoint temp;
    if (distAC > distAB && distAC > distBC) {
      temp = b;
      b = c;
      c = temp;
    } else if (distBC > distAB) {
      temp = a;
      a = c;
      c = temp;
    }

    // c is now the top left; it has to lie on the left of a->b
    if (Geometry.cross(Geometry.vector(a, b), Geometry.vector(a, c)) > 0) {
      temp = a;
      a = b;
      b = temp;
    }

    return new Corners(c, b, a);
  }

  /**
   * The three finder pattern centers, labelled.
   */
  static final class Corners {

    private final ResultPoint topLeft;
    private final ResultPoint topRight;
    private final ResultPoint bottomLeft;

    Corners(ResultPoint topLeft, ResultPoint topRight, ResultPoint bottomLeft) {
      this.topLeft = topLeft;
      this.topRight = topRight;
      this.bottomLeft = bottomLeft;
    }

    ResultPoint getTopLeft() {
      return topLeft;
    }

    ResultPoint getTopRight() {
      return topRight;
    }

    ResultPoint getBottomLeft() {
      return bottomLeft;
    }

    @Override
    public String toString() {
      return topLeft + "/" + topRight + '/' + bottomLeft;
    }
  }

}
