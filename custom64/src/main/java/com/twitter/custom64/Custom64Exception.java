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

import java.io.IOException;

/**
 * Signals that a text could not be encoded or a token string could not be decoded.
 * The {@link Kind} tells the caller which step failed; the remaining accessors carry
 * whatever diagnostic data that step has.
 */
public final class Custom64Exception extends IOException {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** Encode computed an index that has no token in the table. */
    UNDEFINED_SYMBOL,
    /** Decode found no token matching at some position of the input. */
    SEGMENTATION_FAILURE,
    /** Decode matched a token that has no index in the table. */
    UNKNOWN_SYMBOL,
    /** The decoded bytes are not valid UTF-8. */
    INVALID_ENCODING
  }

  private final Kind kind;
  private final int position;
  private final int index;
  private final String symbol;

  private Custom64Exception(Kind kind, String message, int position, int index, String symbol, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.position = position;
    this.index = index;
    this.symbol = symbol;
  }

  static Custom64Exception undefinedSymbol(int index, int chunk) {
    return new Custom64Exception(Kind.UNDEFINED_SYMBOL,
        "undefined symbol for index " + index + " at chunk " + chunk, chunk, index, null, null);
  }

  static Custom64Exception segmentationFailure(int position) {
    return new Custom64Exception(Kind.SEGMENTATION_FAILURE,
        "unrecognized token at position " + position, position, -1, null, null);
  }

  static Custom64Exception unknownSymbol(String symbol, int position) {
    return new Custom64Exception(Kind.UNKNOWN_SYMBOL,
        "unknown symbol '" + symbol + "' at position " + position, position, -1, symbol, null);
  }

  static Custom64Exception invalidEncoding(Throwable cause) {
    return new Custom64Exception(Kind.INVALID_ENCODING,
        "decoded bytes are not valid UTF-8", -1, -1, null, cause);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the failing position, or -1 if the failure has none.
   * For {@link Kind#UNDEFINED_SYMBOL} this is the chunk number; for the decode
   * failures it is the {@code char} offset into the token string.
   */
  public int getPosition() {
    return position;
  }

  /**
   * Returns the index that had no token, or -1.
   */
  public int getIndex() {
    return index;
  }

  /**
   * Returns the token that had no index, or null.
   */
  public String getSymbol() {
    return symbol;
  }
}
