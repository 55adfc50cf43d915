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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import static com.twitter.custom64.Custom64Util.DEFAULT_BIT_WIDTH;
import static com.twitter.custom64.Custom64Util.checkBitWidth;
import static com.twitter.custom64.Custom64Util.dataRange;
import static com.twitter.custom64.Custom64Util.requireNonNull;

/**
 * An immutable, bidirectional mapping between indices and tokens, plus the
 * reserved pad index. Instances are created through {@link Builder} and may be
 * shared freely between threads.
 */
public final class SymbolTable {

  private static final Logger logger = Logger.getLogger(SymbolTable.class.getName());

  private final int bitWidth;
  private final int padIndex;
  private final String padToken;

  // index -> token, the pad index included; indices may be sparse and arbitrarily large
  private final Map<Integer, String> tokenByIndex;
  // token -> index, the exact inverse of tokens
  private final Map<String, Integer> indexByToken;
  private final boolean complete;

  private SymbolTable(Builder builder) {
    this.bitWidth = builder.bitWidth;
    this.padIndex = builder.padIndex;
    this.padToken = builder.padToken;

    HashMap<Integer, String> tokens = new HashMap<Integer, String>(builder.symbols.size() * 2);
    HashMap<String, Integer> inverse = new HashMap<String, Integer>(builder.symbols.size() * 2);
    for (Map.Entry<Integer, String> entry : builder.symbols.entrySet()) {
      tokens.put(entry.getKey(), entry.getValue());
      inverse.put(entry.getValue(), entry.getKey());
    }
    tokens.put(padIndex, padToken);
    inverse.put(padToken, padIndex);
    this.tokenByIndex = Collections.unmodifiableMap(tokens);
    this.indexByToken = Collections.unmodifiableMap(inverse);

    boolean complete = true;
    for (int index = 0; index < dataRange(bitWidth); index++) {
      if (!tokens.containsKey(index)) {
        complete = false;
        break;
      }
    }
    this.complete = complete;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int bitWidth() {
    return bitWidth;
  }

  public int padIndex() {
    return padIndex;
  }

  public String padToken() {
    return padToken;
  }

  /**
   * The number of tokens in the table, the pad token included.
   */
  public int size() {
    return indexByToken.size();
  }

  /**
   * Returns the token for the given index, or null if the table has none.
   */
  public String getToken(int index) {
    return tokenByIndex.get(index);
  }

  /**
   * Returns the index of the given token, or -1 if the token is not in the table.
   */
  public int getIndex(String token) {
    Integer index = indexByToken.get(token);
    if (index == null) {
      return -1;
    }
    return index;
  }

  /**
   * Returns true if every data index of the configured bit width has a token.
   */
  public boolean isComplete() {
    return complete;
  }

  /**
   * Returns all tokens keyed by index, the pad token included.
   */
  public Map<Integer, String> tokens() {
    return Collections.unmodifiableMap(new TreeMap<Integer, String>(tokenByIndex));
  }

  @Override
  public String toString() {
    return "SymbolTable(bitWidth=" + bitWidth + ", size=" + size()
        + ", padIndex=" + padIndex + ", padToken=" + padToken + ")";
  }

  /**
   * Collects and validates the configuration of a {@link SymbolTable}.
   */
  public static final class Builder {

    private final TreeMap<Integer, String> symbols = new TreeMap<Integer, String>();
    private int bitWidth = DEFAULT_BIT_WIDTH;
    private int padIndex = -1;
    private String padToken;

    private Builder() {}

    public Builder bitWidth(int bitWidth) {
      checkBitWidth(bitWidth);
      this.bitWidth = bitWidth;
      return this;
    }

    public Builder symbol(int index, String token) {
      if (index < 0) {
        throw new IllegalArgumentException("Illegal index: " + index);
      }
      checkToken(token);
      if (symbols.containsKey(index)) {
        throw new IllegalArgumentException("duplicate index: " + index);
      }
      symbols.put(index, token);
      return this;
    }

    /**
     * Adds a symbol whose index is given as a string of decimal digits. Signs,
     * whitespace and other characters are rejected; leading zeros are allowed.
     */
    public Builder symbol(String index, String token) {
      requireNonNull(index);
      if (index.isEmpty()) {
        throw new IllegalArgumentException("index is not a decimal number: ''");
      }
      for (int i = 0; i < index.length(); i++) {
        char c = index.charAt(i);
        if (c < '0' || c > '9') {
          throw new IllegalArgumentException("index is not a decimal number: '" + index + "'");
        }
      }
      int value;
      try {
        value = Integer.parseInt(index);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("index out of range: '" + index + "'", e);
      }
      return symbol(value, token);
    }

    public Builder symbols(Map<String, String> mapping) {
      for (Map.Entry<String, String> entry : requireNonNull(mapping).entrySet()) {
        symbol(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder padding(int index, String token) {
      if (index < 0) {
        throw new IllegalArgumentException("Illegal pad index: " + index);
      }
      checkToken(token);
      this.padIndex = index;
      this.padToken = token;
      return this;
    }

    public SymbolTable build() {
      if (padToken == null) {
        throw new IllegalStateException("pad index and token are required");
      }
      if (padIndex < dataRange(bitWidth)) {
        throw new IllegalStateException(
            "pad index " + padIndex + " lies inside the data range of " + bitWidth + " bits");
      }
      if (symbols.containsKey(padIndex)) {
        throw new IllegalStateException("duplicate index: " + padIndex + " is the pad index");
      }

      HashMap<String, Integer> seen = new HashMap<String, Integer>(symbols.size() * 2);
      seen.put(padToken, padIndex);
      for (Map.Entry<Integer, String> entry : symbols.entrySet()) {
        Integer previous = seen.put(entry.getValue(), entry.getKey());
        if (previous != null) {
          throw new IllegalStateException("duplicate token '" + entry.getValue()
              + "' at indices " + previous + " and " + entry.getKey());
        }
      }

      SymbolTable table = new SymbolTable(this);
      if (!table.isComplete()) {
        logger.warning("symbol table does not cover all " + dataRange(bitWidth)
            + " indices of a " + bitWidth + "-bit chunk; encoding may fail");
      }
      return table;
    }

    private static void checkToken(String token) {
      if (requireNonNull(token).isEmpty()) {
        throw new IllegalArgumentException("token must not be empty");
      }
    }
  }
}
