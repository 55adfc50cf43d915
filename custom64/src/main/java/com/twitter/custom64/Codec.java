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

import static com.twitter.custom64.Custom64Util.requireNonNull;

/**
 * Maps text to a string of tokens from a {@link SymbolTable} and back.
 *
 * <p>Encoding packs the UTF-8 bytes of the text into chunks of {@code bitWidth} bits
 * and writes one token per chunk. Decoding splits the token string greedily, longest
 * token first, and unpacks the bits again.
 *
 * <p>Two lossy rules are part of the format:
 * <ul>
 *   <li>a chunk of value zero is written as the pad token, so the token of index 0 is
 *       never produced;</li>
 *   <li>an all-zero byte is dropped while decoding, so U+0000 does not survive a round
 *       trip.</li>
 * </ul>
 *
 * <p>A codec is immutable and may be shared between threads.
 */
public final class Codec {

  private final SymbolTable table;
  private final Encoder encoder;
  private final Decoder decoder;

  public Codec(SymbolTable table) {
    this.table = requireNonNull(table);
    this.encoder = new Encoder(table);
    this.decoder = new Decoder(table);
  }

  public SymbolTable getSymbolTable() {
    return table;
  }

  /**
   * Encodes the text with the bit width of the symbol table.
   */
  public String encode(String text) throws Custom64Exception {
    return encoder.encode(text, table.bitWidth());
  }

  public String encode(String text, int bitWidth) throws Custom64Exception {
    return encoder.encode(text, bitWidth);
  }

  /**
   * Decodes the token string with the bit width of the symbol table.
   */
  public String decode(String encoded) throws Custom64Exception {
    return decoder.decode(encoded, table.bitWidth());
  }

  public String decode(String encoded, int bitWidth) throws Custom64Exception {
    return decoder.decode(encoded, bitWidth);
  }
}
