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

package org.qrlocator.common.detector;

import com.google.zxing.ResultPoint;

/**
 * Vector helpers over {@link ResultPoint}s. A point returned by {@link #vector}
 * is a displacement, not a location.
 *
 * @author QR Locator authors
 */
public final class Geometry {

  private Geometry() {
  }

  public static float squaredDistance(ResultPoint a, ResultPoint b) {
    float xDiff = a.getX() - b.getX();
    float yDiff = a.getY() - b.getY();
    return xDiff * xDiff + yDiff * yDiff;
  }

  /**
   * @return displacement from {@code from} to {@code to}
   */
  public static ResultPoint vector(ResultPoint from, ResultPoint to) {
    return new ResultPoint(to.getX() - from.getX(), to.getY() - from.getY());
  }

  /**
   * @return z component of the cross product of two displacements. With y growing
   *         downwards a positive value means {@code v} turns clockwise from {@code u}
   */
  public static float cross(ResultPoint u, ResultPoint v) {
    return u.getX() * v.getY() - u.getY() * v.getX();
  }

  /**
   * @return true if {@code a} and {@code b} are closer than {@code threshold}
   */
  public static boolean nearlySame(ResultPoint a, ResultPoint b, float threshold) {
    return squaredDistance(a, b) < threshold * threshold;
  }

}
