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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.quanta.compile.CompileException;

/** Exception caused by a parse error. */
public class ParseException extends CompileException {
  /** The token that was not expected. */
  public final Token token;
  /** Descriptions of the tokens that would have been valid, such as
   * "')'" and "identifier". */
  public final List<String> expected;

  ParseException(Token token, List<String> expected, String file) {
    super(message(token, expected), Kind.PARSE, token.pos(file));
    this.token = requireNonNull(token);
    this.expected = ImmutableList.copyOf(expected);
  }

  private static String message(Token token, List<String> expected) {
    final StringBuilder b =
        new StringBuilder("unexpected ").append(token.describe());
    if (expected.size() == 1) {
      b.append("; expected ").append(expected.get(0));
    } else if (!expected.isEmpty()) {
      b.append("; expected one of ").append(String.join(", ", expected));
    }
    return b.toString();
  }
}

// End ParseException.java
