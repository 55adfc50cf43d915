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

/**
 * Enum that indicates the size of the texts to be encoded and decoded.
 */
public enum TextSize {
    SMALL(16),
    MEDIUM(256),
    LARGE(4096);

    private final int length;

    TextSize(final int length) {
        this.length = length;
    }

    Text newText(final boolean limitToAscii) {
        return Text.createText(length, limitToAscii);
    }
}
