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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.logging.Logger;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import static com.twitter.custom64.Custom64Util.DEFAULT_BIT_WIDTH;
import static com.twitter.custom64.Custom64Util.DEFAULT_PAD_INDEX;
import static com.twitter.custom64.Custom64Util.UTF_8;
import static com.twitter.custom64.Custom64Util.requireNonNull;

/**
 * Reads symbol tables from JSON.
 *
 * <pre>
 * {
 *   "bit_width": 6,
 *   "pad_index": 65,
 *   "pad_token": "的",
 *   "symbols": { "0": "香香", "1": "软软", ... }
 * }
 * </pre>
 */
public final class SymbolTables {

  private static final Logger logger = Logger.getLogger(SymbolTables.class.getName());

  static final String DEFAULT_TABLE = "default-symbols.json";

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .create();

  /**
   * Returns the bundled table of 64 food words, padded with "的" at index 65.
   */
  public static SymbolTable defaultTable() throws IOException {
    InputStream is = SymbolTables.class.getResourceAsStream(DEFAULT_TABLE);
    if (is == null) {
      throw new IOException("missing resource: " + DEFAULT_TABLE);
    }
    try {
      return load(is);
    } finally {
      is.close();
    }
  }

  public static SymbolTable load(InputStream is) throws IOException {
    return load(new InputStreamReader(requireNonNull(is), UTF_8));
  }

  public static SymbolTable load(Reader reader) throws IOException {
    TableConfig config;
    try {
      config = GSON.fromJson(requireNonNull(reader), TableConfig.class);
    } catch (JsonParseException e) {
      throw new IOException("malformed symbol table", e);
    }
    if (config == null) {
      throw new IOException("empty symbol table document");
    }
    if (config.symbols == null) {
      throw new IOException("symbol table has no 'symbols'");
    }
    if (config.padToken == null) {
      throw new IOException("symbol table has no 'pad_token'");
    }

    SymbolTable table;
    try {
      table = SymbolTable.builder()
          .bitWidth(config.bitWidth)
          .symbols(config.symbols)
          .padding(config.padIndex, config.padToken)
          .build();
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid symbol table: " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      throw new IOException("invalid symbol table: " + e.getMessage(), e);
    }
    logger.fine("loaded " + table);
    return table;
  }

  static final class TableConfig {
    int bitWidth = DEFAULT_BIT_WIDTH;
    int padIndex = DEFAULT_PAD_INDEX;
    String padToken;
    LinkedHashMap<String, String> symbols;
  }

  private SymbolTables() {
    // utility class
  }
}
