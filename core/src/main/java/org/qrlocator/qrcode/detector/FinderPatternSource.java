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

import com.google.zxing.common.BitMatrix;

import java.util.List;

/**
 * Proposes finder pattern candidates found anywhere in a binarized image.
 *
 * @author QR Locator authors
 */
public interface FinderPatternSource {

  /**
   * @param image binarized image, true meaning black
   * @return candidates in no particular order, possibly empty
   */
  List<LocationError> locate(BitMatrix image);

}
