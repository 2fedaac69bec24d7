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

import java.io.Serializable;
import java.util.Comparator;

/**
 * <p>A pattern candidate proposed by a {@link FinderPatternSource} or an
 * {@link AlignmentPatternSource}: where it is, how wide it looks and how far its
 * black/white runs are from the ideal ones. A lower error is a better candidate.</p>
 *
 * @author QR Locator authors
 */
public final class LocationError {

  private final ResultPoint location;
  private final float size;
  private final float error;

  public LocationError(ResultPoint location, float size, float error) {
    this.location = location;
    this.size = size;
    this.error = error;
  }

  public ResultPoint getLocation() {
    return location;
  }

  /**
   * @return estimated width of the whole pattern, in pixels
   */
  public float getSize() {
    return size;
  }

  public float getError() {
    return error;
  }

  @Override
  public String toString() {
    return location + "/" + size + '/' + error;
  }

  /**
   * Orders candidates by error, ascending.
   */
  static final class ErrorComparator implements Comparator<LocationError>, Serializable {
    @Override
    public int compare(LocationError o1, LocationError o2) {
      return Float.compare(o1.getError(), o2.getError());
    }
  }

}
