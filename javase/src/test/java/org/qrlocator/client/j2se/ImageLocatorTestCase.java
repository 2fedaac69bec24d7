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

package org.qrlocator.client.j2se;

import com.google.zxing.NotFoundException;
import com.google.zxing.ResultPoint;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.qrlocator.InsufficientPatternsException;
import org.qrlocator.common.PatternsLocation;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * Tests {@link ImageLocator}.
 */
public final class ImageLocatorTestCase extends Assert {

  private static final int MODULE = 6;
  private static final int QUIET_ZONE = 4;

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testLocateImage() throws NotFoundException, InsufficientPatternsException {
    PatternsLocation location = ImageLocator.locate(drawSymbol());

    assertEquals(new ResultPoint(45, 45), location.getTopLeft());
    assertEquals(new ResultPoint(153, 45), location.getTopRight());
    assertEquals(new ResultPoint(45, 153), location.getBottomLeft());
    assertEquals(new ResultPoint(135, 135), location.getBottomRight());
  }

  @Test
  public void testLocateFile() throws IOException {
    File file = folder.newFile("symbol.png");
    ImageIO.write(drawSymbol(), "png", file);

    String text = ImageLocator.getLocateText(file.toPath());

    assertTrue(text, text.startsWith("topLeft=(45.0,45.0) topRight=(153.0,45.0) bottomLeft=(45.0,153.0)"));
    assertTrue(text, text.contains("bottomRight=(135.0,135.0)"));
  }

  @Test
  public void testBlankFile() throws IOException {
    File file = folder.newFile("blank.png");
    ImageIO.write(blankImage(), "png", file);

    String text = ImageLocator.getLocateText(file.toPath());

    assertTrue(text, text.startsWith(InsufficientPatternsException.class.getName()));
  }

  @Test
  public void testMissingFile() {
    String text = ImageLocator.getLocateText(new File(folder.getRoot(), "missing.png").toPath());
    assertTrue(text, text.contains("IOException"));
  }

  private static BufferedImage blankImage() {
    int side = (25 + 2 * QUIET_ZONE) * MODULE;
    BufferedImage image = new BufferedImage(side, side, BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, side, side);
    } finally {
      g.dispose();
    }
    return image;
  }

  /**
   * 25x25 module symbol: three finder patterns and the alignment pattern on module (18, 18).
   */
  private static BufferedImage drawSymbol() {
    BufferedImage image = blankImage();
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(Color.BLACK);
      drawSquares(g, QUIET_ZONE, QUIET_ZONE, 7);
      drawSquares(g, QUIET_ZONE + 18, QUIET_ZONE, 7);
      drawSquares(g, QUIET_ZONE, QUIET_ZONE + 18, 7);
      drawSquares(g, QUIET_ZONE + 16, QUIET_ZONE + 16, 5);
    } finally {
      g.dispose();
    }
    return image;
  }

  private static void drawSquares(Graphics2D g, int moduleX, int moduleY, int modules) {
    int left = moduleX * MODULE;
    int top = moduleY * MODULE;
    int side = modules * MODULE;
    g.setColor(Color.BLACK);
    g.fillRect(left, top, side, side);
    g.setColor(Color.WHITE);
    g.fillRect(left + MODULE, top + MODULE, side - 2 * MODULE, side - 2 * MODULE);
    g.setColor(Color.BLACK);
    int inner = modules == 7 ? 3 : 1;
    int offset = (modules - inner) / 2 * MODULE;
    g.fillRect(left + offset, top + offset, inner * MODULE, inner * MODULE);
  }

}
