/*
 * Copyright 2015 Twitter, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.twitter.custom64;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

final class Custom64Util {

  static final Charset UTF_8 = StandardCharsets.UTF_8;

  static final int DEFAULT_BIT_WIDTH = 6;

  // Wide enough for any practical alphabet; keeps the bit accumulators within a long.
  static final int MAX_BIT_WIDTH = 16;

  // The reference table leaves 64 unused and pads with 65.
  static final int DEFAULT_PAD_INDEX = 65;

  static void checkBitWidth(int bitWidth) {
    if (bitWidth < 1 || bitWidth > MAX_BIT_WIDTH) {
      throw new IllegalArgumentException("Illegal bit width: " + bitWidth);
    }
  }

  /**
   * Number of bits needed to write {@code value} in binary, at least one.
   */
  static int bitLength(int value) {
    return Math.max(1, 32 - Integer.numberOfLeadingZeros(value));
  }

  /**
   * Returns the number of distinct data values a chunk of the given width can hold.
   */
  static int dataRange(int bitWidth) {
    return 1 << bitWidth;
  }

  static <T> T requireNonNull(T obj) {
    if (obj == null) {
      throw new NullPointerException();
    }
    return obj;
  }

  private Custom64Util() {
    // utility class
  }
}
