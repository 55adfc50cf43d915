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

import static com.twitter.custom64.Custom64Util.UTF_8;
import static com.twitter.custom64.Custom64Util.checkBitWidth;
import static com.twitter.custom64.Custom64Util.requireNonNull;

final class Encoder {

  private final SymbolTable table;

  Encoder(SymbolTable table) {
    this.table = requireNonNull(table);
  }

  /**
   * Packs the UTF-8 bytes of {@code text} into chunks of {@code bitWidth} bits and
   * writes the token of each chunk. The last chunk is filled up with zero bits.
   * A chunk of value zero is always written as the pad token.
   */
  String encode(String text, int bitWidth) throws Custom64Exception {
    checkBitWidth(bitWidth);
    byte[] data = requireNonNull(text).getBytes(UTF_8);
    StringBuilder out = new StringBuilder(getEncodedLength(data, bitWidth) * 2);

    int mask = (1 << bitWidth) - 1;
    long current = 0;
    int n = 0;
    int chunk = 0;

    for (int i = 0; i < data.length; i++) {
      current = (current << 8) | (data[i] & 0xFF);
      n += 8;

      while (n >= bitWidth) {
        n -= bitWidth;
        writeChunk(out, (int) (current >>> n) & mask, chunk++);
      }
      current &= (1L << n) - 1;
    }

    if (n > 0) {
      writeChunk(out, (int) (current << (bitWidth - n)) & mask, chunk);
    }
    return out.toString();
  }

  /**
   * Returns the number of tokens {@code data} encodes to.
   */
  static int getEncodedLength(byte[] data, int bitWidth) {
    long bits = (long) data.length * 8;
    return (int) ((bits + bitWidth - 1) / bitWidth);
  }

  private void writeChunk(StringBuilder out, int value, int chunk) throws Custom64Exception {
    int index = value == 0 ? table.padIndex() : value;
    String token = table.getToken(index);
    if (token == null) {
      throw Custom64Exception.undefinedSymbol(index, chunk);
    }
    out.append(token);
  }
}
