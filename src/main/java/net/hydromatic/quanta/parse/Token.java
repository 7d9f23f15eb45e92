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

import net.hydromatic.quanta.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Token produced by the {@link Lexer}. */
public class Token {
  public final TokenKind kind;
  /** Source text of the token; empty for {@link TokenKind#EOF}. */
  public final String text;
  /** Value of a literal: {@link Integer}, {@link Double} or
   * {@link String}; null for other kinds of token. */
  public final @Nullable Object value;
  /** Line number, starting at 1. */
  public final int line;
  /** Column number, starting at 1. */
  public final int column;

  public Token(TokenKind kind, String text, @Nullable Object value, int line,
      int column) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.value = value;
    this.line = line;
    this.column = column;
  }

  /** Returns the position of this token within a given file. */
  public Pos pos(String file) {
    return Pos.of(file, line, column, text.length());
  }

  /** Describes this token for an error message, e.g. "'+'",
   * "identifier 'foo'" or "end of input". */
  public String describe() {
    switch (kind.group) {
      case IDENTIFIER:
      case LITERAL:
        return kind.describe() + " '" + text + "'";
      default:
        return kind.describe();
    }
  }

  @Override
  public String toString() {
    return kind + (kind.text == null && !text.isEmpty() ? "(" + text + ")" : "")
        + "@" + line + ":" + column;
  }
}

// End Token.java
