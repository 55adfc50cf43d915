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
package com.twitter.custom64.microbench;

import java.util.Random;

/**
 * Helper class holding a random text of a given length. Used by the benchmarks.
 */
class Text {
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789-_ ";

    // CJK Unified Ideographs
    private static final int CJK_FIRST = 0x4E00;
    private static final int CJK_COUNT = 0x9FA5 - CJK_FIRST;

    final String value;

    Text(final String value) {
        this.value = value;
    }

    /**
     * Creates a random text of {@code length} characters. Characters are drawn from a
     * small ASCII alphabet or, when not limited to ASCII, mixed with CJK ideographs.
     * U+0000 is never produced, so every text survives a round trip.
     */
    static Text createText(final int length, final boolean limitToAscii) {
        final Random r = new Random();
        final StringBuilder sb = new StringBuilder(length);
        for (int index = 0; index < length; ++index) {
            if (limitToAscii || r.nextBoolean()) {
                sb.append(ALPHABET.charAt(r.nextInt(ALPHABET.length())));
            } else {
                sb.append((char) (CJK_FIRST + r.nextInt(CJK_COUNT)));
            }
        }
        return new Text(sb.toString());
    }
}
