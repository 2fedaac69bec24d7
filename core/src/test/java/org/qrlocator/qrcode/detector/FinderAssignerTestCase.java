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
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests {@link FinderAssigner}.
 */
public final class FinderAssignerTestCase extends Assert {

  @Test
  public void testUprightSymbolAnyOrder() {
    assertAllOrders(new ResultPoint(100, 100), new ResultPoint(300, 100), new ResultPoint(100, 300));
  }

  @Test
  public void testRotatedSymbolAnyOrder() {
    // Quarter turn clockwise
    assertAllOrders(new ResultPoint(300, 100), new ResultPoint(300, 300), new ResultPoint(100, 100));
    // Half turn
    assertAllOrders(new ResultPoint(300, 300), new ResultPoint(100, 300), new ResultPoint(300, 100));
  }

  @Test
  public void testSkewedSymbolAnyOrder() {
    assertAllOrders(new ResultPoint(120, 80), new ResultPoint(310, 130), new ResultPoint(70, 290));
  }

  @Test
  public void testSwapsDiagonalWhenTopLeftIsOnTheRight() {
    ResultPoint topLeft = new ResultPoint(100, 100);
    ResultPoint topRight = new ResultPoint(300, 100);
    ResultPoint bottomLeft = new ResultPoint(100, 300);

    // a->b runs from top right to bottom left, leaving c on its right
    FinderAssigner.Corners corners = FinderAssigner.assign(topRight, bottomLeft, topLeft);

    assertEquals(topLeft, corners.getTopLeft());
    assertEquals(topRight, corners.getTopRight());
    assertEquals(bottomLeft, corners.getBottomLeft());
  }

  @Test
  public void testTieBetweenACAndBCTakesBCAsDiagonal() {
    ResultPoint a = new ResultPoint(0, 0);
    ResultPoint b = new ResultPoint(100, 0);
    ResultPoint c = new ResultPoint(50, 200);

    // |AC| == |BC| > |AB|: a and c trade places
    FinderAssigner.Corners corners = FinderAssigner.assign(a, b, c);

    assertEquals(a, corners.getTopLeft());
    assertEquals(b, corners.getTopRight());
    assertEquals(c, corners.getBottomLeft());
  }

  @Test
  public void testTieBetweenABAndACKeepsOrder() {
    ResultPoint a = new ResultPoint(0, 0);
    ResultPoint b = new ResultPoint(200, 50);
    ResultPoint c = new ResultPoint(200, -50);

    // |AB| == |AC| > |BC|: a-b stays the diagonal
    FinderAssigner.Corners corners = FinderAssigner.assign(a, b, c);

    assertEquals(c, corners.getTopLeft());
    assertEquals(b, corners.getTopRight());
    assertEquals(a, corners.getBottomLeft());
  }

  private static void assertAllOrders(ResultPoint topLeft, ResultPoint topRight, ResultPoint bottomLeft) {
    ResultPoint[][] orders = {
        {topLeft, topRight, bottomLeft},
        {topLeft, bottomLeft, topRight},
        {topRight, topLeft, bottomLeft},
        {topRight, bottomLeft, topLeft},
        {bottomLeft, topLeft, topRight},
        {bottomLeft, topRight, topLeft},
    };
    for (ResultPoint[] order : orders) {
      FinderAssigner.Corners corners = FinderAssigner.assign(order[0], order[1], order[2]);
      assertEquals(topLeft, corners.getTopLeft());
      assertEquals(topRight, corners.getTopRight());
      assertEquals(bottomLeft, corners.getBottomLeft());
    }
  }

}
