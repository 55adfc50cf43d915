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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.twitter.custom64.Custom64Util.UTF_8;
import static com.twitter.custom64.Custom64Util.bitLength;
import static com.twitter.custom64.Custom64Util.checkBitWidth;
import static com.twitter.custom64.Custom64Util.requireNonNull;

final class Decoder {

  private final SymbolTable table;
  private final Node root = new Node();

  Decoder(SymbolTable table) {
    this.table = requireNonNull(table);
    buildTree(table.tokens());
  }

  private void buildTree(Map<Integer, String> tokens) {
    for (String token : tokens.values()) {
      addToken(token);
    }
  }

  private void addToken(String token) {
    Node current = root;
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      Node child = current.children.get(c);
      if (child == null) {
        child = new Node();
        current.children.put(c, child);
      }
      current = child;
    }
    current.terminal = true;
  }

  /**
   * Decodes the given token string back into text.
   * Zero-valued bytes never survive decoding: an all-zero byte is dropped, as is a
   * trailing group of fewer than eight bits.
   */
  String decode(String encoded, int bitWidth) throws Custom64Exception {
    checkBitWidth(bitWidth);
    List<String> symbols = segment(requireNonNull(encoded));

    ByteArrayOutputStream baos = new ByteArrayOutputStream(symbols.size() * bitWidth / 8 + 1);
    int padIndex = table.padIndex();
    long current = 0;
    int n = 0;
    int position = 0;

    for (String symbol : symbols) {
      int index = table.getIndex(symbol);
      if (index == -1) {
        throw Custom64Exception.unknownSymbol(symbol, position);
      }
      position += symbol.length();

      int nbits;
      int value;
      if (index == padIndex) {
        nbits = bitWidth;
        value = 0;
      } else {
        // an index wider than the chunk keeps all of its bits
        nbits = Math.max(bitWidth, bitLength(index));
        value = index;
      }

      current = (current << nbits) | value;
      n += nbits;

      while (n >= 8) {
        n -= 8;
        int b = (int) (current >>> n) & 0xFF;
        if (b != 0) {
          baos.write(b);
        }
      }
      current &= (1L << n) - 1;
    }

    return toText(baos.toByteArray());
  }

  /**
   * Splits the input into tokens, always taking the longest token that matches at
   * the current position.
   */
  List<String> segment(String encoded) throws Custom64Exception {
    List<String> symbols = new ArrayList<String>();
    int length = encoded.length();
    int i = 0;
    while (i < length) {
      int matched = longestMatch(encoded, i);
      if (matched == 0) {
        throw Custom64Exception.segmentationFailure(i);
      }
      symbols.add(encoded.substring(i, i + matched));
      i += matched;
    }
    return symbols;
  }

  private int longestMatch(String encoded, int start) {
    Node node = root;
    int matched = 0;
    for (int i = start; i < encoded.length(); i++) {
      node = node.children.get(encoded.charAt(i));
      if (node == null) {
        break;
      }
      if (node.terminal) {
        matched = i - start + 1;
      }
    }
    return matched;
  }

  private static String toText(byte[] bytes) throws Custom64Exception {
    try {
      return UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw Custom64Exception.invalidEncoding(e);
    }
  }

  private static final class Node {

    private final Map<Character, Node> children = new HashMap<Character, Node>();

    // true if the path to this node spells a whole token
    private boolean terminal;
  }
}
