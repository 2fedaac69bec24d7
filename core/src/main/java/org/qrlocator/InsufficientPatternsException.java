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

package org.qrlocator;

/**
 * Thrown when three distinct, size-consistent finder patterns could not be picked
 * from the candidates found in an image.
 *
 * @author QR Locator authors
 */
public final class InsufficientPatternsException extends Exception {

  private static final long serialVersionUID = 1L;

  private final int accepted;

  public InsufficientPatternsException(int accepted) {
    super("Couldn't locate finder patterns: only " + accepted + " of 3 accepted");
    this.accepted = accepted;
  }

  /**
   * @return number of finder patterns that passed selection before it gave up
   */
  public int getAccepted() {
    return accepted;
  }

}
