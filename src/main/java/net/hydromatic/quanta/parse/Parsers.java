/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.quanta.parse;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given quoted string {@code "abc"} returns {@code abc}; {@code "a\tb"}
   * returns a string with a tab character.
   *
   * <p>The supported escapes are {@code \n}, {@code \t}, {@code \"} and
   * {@code \\}.
   *
   * @throws IllegalArgumentException if the string contains another escape
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != '\\') {
        b.append(c);
        continue;
      }
      if (++i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      final char c2 = s.charAt(i);
      switch (c2) {
        case 'n':
          b.append('\n');
          break;
        case 't':
          b.append('\t');
          break;
        case '"':
        case '\\':
          b.append(c2);
          break;
        default:
          throw new IllegalArgumentException("illegal escape '\\" + c2 + "'");
      }
    }
    return b.toString();
  }

  /** Converts a string to a quoted string literal; inverse of
   * {@link #unquoteString(String)}. */
  public static String quoteString(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        case '"':
          b.append("\\\"");
          break;
        case '\\':
          b.append("\\\\");
          break;
        default:
          b.append(c);
      }
    }
    return b.append('"').toString();
  }
}

// End Parsers.java
