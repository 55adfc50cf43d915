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
import java.util.Random;

import org.junit.BeforeClass;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CodecTest {

  private static SymbolTable table;
  private static Codec codec;

  @BeforeClass
  public static void setUp() throws IOException {
    table = SymbolTables.defaultTable();
    codec = new Codec(table);
  }

  @Test
  public void testSingleCharacter() throws IOException {
    // 0x41 = 010000|01 -> 010000|010000
    assertEquals(table.getToken(16) + table.getToken(16), codec.encode("A"));
    assertEquals("香蕉香蕉", codec.encode("A"));
    assertEquals("A", codec.decode("香蕉香蕉"));
  }

  @Test
  public void testZeroChunkUsesPadToken() throws IOException {
    // 0x40 = 010000|00 -> 010000|000000, the second chunk is real data
    String encoded = codec.encode("@");
    assertEquals(table.getToken(16) + table.padToken(), encoded);
    assertEquals("@", codec.decode(encoded));
  }

  @Test
  public void testIndexZeroTokenIsNeverWritten() throws IOException {
    Random random = new Random(123456789L);
    String zeroToken = table.getToken(0);
    for (int i = 0; i < 100; i++) {
      String encoded = codec.encode(randomText(random, 64));
      assertFalse(encoded, encoded.contains(zeroToken));
    }
  }

  @Test
  public void testPadAndZeroTokensDecodeAlike() throws IOException {
    String zero = table.getToken(0);
    String pad = table.padToken();
    // 010000|000000 and 010000|010000 framed by either zero token
    assertEquals(codec.decode(table.getToken(16) + pad), codec.decode(table.getToken(16) + zero));
    assertEquals(codec.decode(pad + table.getToken(16) + table.getToken(16)),
        codec.decode(zero + table.getToken(16) + table.getToken(16)));
  }

  @Test
  public void testZeroByteIsDropped() throws IOException {
    assertEquals(table.padToken() + table.padToken(), codec.encode("\u0000"));
    assertEquals("", codec.decode(codec.encode("\u0000")));
    assertEquals("ab", codec.decode(codec.encode("a\u0000b")));
    assertEquals("xy", codec.decode(codec.encode("\u0000x\u0000\u0000y\u0000")));
  }

  @Test
  public void testEmptyText() throws IOException {
    assertEquals("", codec.encode(""));
    assertEquals("", codec.decode(""));
  }

  @Test
  public void testRoundTrip() throws IOException {
    String s = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    for (int i = 0; i < s.length(); i++) {
      roundTrip(s.substring(0, i));
    }

    Random random = new Random(123456789L);
    for (int i = 0; i < 200; i++) {
      roundTrip(randomText(random, random.nextInt(40)));
    }
  }

  @Test
  public void testRoundTripOtherBitWidths() throws IOException {
    Random random = new Random(987654321L);
    for (int bitWidth = 1; bitWidth <= 6; bitWidth++) {
      for (int i = 0; i < 20; i++) {
        String text = randomText(random, 20);
        assertEquals(text, codec.decode(codec.encode(text, bitWidth), bitWidth));
      }
    }
  }

  @Test
  public void testTokenCount() throws IOException {
    // 3 bytes = 24 bits = 4 chunks, 4 bytes = 32 bits = 6 chunks
    assertEquals(4, Encoder.getEncodedLength(new byte[3], 6));
    assertEquals(6, Encoder.getEncodedLength(new byte[4], 6));
    assertEquals(0, Encoder.getEncodedLength(new byte[0], 6));
  }

  @Test
  public void testUndefinedSymbol() throws IOException {
    // seven-bit chunks reach past the 64 data tokens: 0x7F = 0111111|1 -> 63, then 64
    try {
      codec.encode("\u007f", 7);
      fail();
    } catch (Custom64Exception e) {
      assertEquals(Custom64Exception.Kind.UNDEFINED_SYMBOL, e.getKind());
      assertEquals(64, e.getIndex());
      assertEquals(1, e.getPosition());
    }
  }

  @Test
  public void testSegmentationFailure() throws IOException {
    try {
      codec.decode("香香香蕉?香香");
      fail();
    } catch (Custom64Exception e) {
      assertEquals(Custom64Exception.Kind.SEGMENTATION_FAILURE, e.getKind());
      assertEquals(4, e.getPosition());
      assertTrue(e.getMessage(), e.getMessage().contains("4"));
    }
  }

  @Test
  public void testInvalidEncoding() throws IOException {
    // 111111|110000 -> 0xFF, which never starts a UTF-8 sequence
    try {
      codec.decode(table.getToken(63) + table.getToken(48));
      fail();
    } catch (Custom64Exception e) {
      assertEquals(Custom64Exception.Kind.INVALID_ENCODING, e.getKind());
      assertEquals(-1, e.getPosition());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIllegalBitWidth() throws IOException {
    codec.encode("A", 0);
  }

  @Test(expected = NullPointerException.class)
  public void testNullText() throws IOException {
    codec.encode(null);
  }

  @Test
  public void testSharedBetweenThreads() throws Exception {
    final String text = "啊宝宝编码 Custom64";
    final String expected = codec.encode(text);
    final Throwable[] failure = new Throwable[1];
    Thread[] threads = new Thread[4];
    for (int i = 0; i < threads.length; i++) {
      threads[i] = new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            for (int j = 0; j < 1000; j++) {
              assertEquals(expected, codec.encode(text));
              assertEquals(text, codec.decode(expected));
            }
          } catch (Throwable t) {
            synchronized (failure) {
              failure[0] = t;
            }
          }
        }
      });
      threads[i].start();
    }
    for (Thread thread : threads) {
      thread.join();
    }
    synchronized (failure) {
      if (failure[0] != null) {
        throw new AssertionError(failure[0]);
      }
    }
  }

  private void roundTrip(String s) throws IOException {
    String encoded = codec.encode(s);
    assertEquals(s, codec.decode(encoded));
  }

  // random mix of ASCII, CJK and astral characters, never U+0000
  private static String randomText(Random random, int length) {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      switch (random.nextInt(3)) {
      case 0:
        sb.append((char) (1 + random.nextInt(0x7F)));
        break;
      case 1:
        sb.append((char) (0x4E00 + random.nextInt(0x5000)));
        break;
      default:
        sb.appendCodePoint(0x1F300 + random.nextInt(0x300));
        break;
      }
    }
    return sb.toString();
  }
}
