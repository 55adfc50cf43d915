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
 * A fixed prefix and suffix placed around encoded text for display.
 */
public final class Envelope {

  public static final Envelope DEFAULT = new Envelope("啊啊啊啊啊啊宝宝你是一个", "的小蛋糕");

  private final String prefix;
  private final String suffix;

  public Envelope(String prefix, String suffix) {
    this.prefix = requireNonNull(prefix);
    this.suffix = requireNonNull(suffix);
  }

  public String wrap(String encoded) {
    return prefix + requireNonNull(encoded) + suffix;
  }

  /**
   * Removes the prefix and suffix if the text carries both; otherwise returns it as is.
   */
  public String unwrap(String text) {
    requireNonNull(text);
    if (text.length() >= prefix.length() + suffix.length()
        && text.startsWith(prefix) && text.endsWith(suffix)) {
      return text.substring(prefix.length(), text.length() - suffix.length());
    }
    return text;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getSuffix() {
    return suffix;
  }
}
