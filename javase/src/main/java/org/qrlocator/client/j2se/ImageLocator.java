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

import com.google.zxing.BinaryBitmap;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.client.j2se.ImageReader;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.common.HybridBinarizer;
import org.qrlocator.InsufficientPatternsException;
import org.qrlocator.common.PatternsLocation;
import org.qrlocator.qrcode.detector.Locator;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the {@link Locator} on image files.
 *
 * @author QR Locator authors
 */
public final class ImageLocator {

  private ImageLocator() {
  }

  /**
   * @return the located patterns, or a description of what went wrong
   */
  public static String getLocateText(Path file) {
    BufferedImage image;
    try {
      image = ImageReader.readImage(file.toUri());
    } catch (IOException ioe) {
      return ioe.toString();
    }
    try {
      return locate(image).toString();
    } catch (NotFoundException | InsufficientPatternsException e) {
      return e.toString();
    }
  }

  /**
   * Binarizes an image and locates its patterns.
   *
   * @throws NotFoundException if the image can't be binarized
   * @throws InsufficientPatternsException if the finder patterns can't be found
   */
  public static PatternsLocation locate(BufferedImage image)
      throws NotFoundException, InsufficientPatternsException {
    LuminanceSource source = new BufferedImageLuminanceSource(image);
    BitMatrix matrix = new BinaryBitmap(new HybridBinarizer(source)).getBlackMatrix();
    return new Locator().locate(matrix);
  }

}
