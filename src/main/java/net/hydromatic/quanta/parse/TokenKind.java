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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of {@link Token}. */
public enum TokenKind {
  // keywords
  VAR("var", Group.KEYWORD),
  CONST("const", Group.KEYWORD),
  DEF("def", Group.KEYWORD),
  GATE("gate", Group.KEYWORD),
  CLASS("class", Group.KEYWORD),
  FOR("for", Group.KEYWORD),
  IN("in", Group.KEYWORD),
  IF("if", Group.KEYWORD),
  ELIF("elif", Group.KEYWORD),
  ELSE("else", Group.KEYWORD),
  RETURN("return", Group.KEYWORD),
  TRUE("true", Group.KEYWORD),
  FALSE("false", Group.KEYWORD),
  AND("and", Group.KEYWORD),
  OR("or", Group.KEYWORD),
  NOT("not", Group.KEYWORD),
  CTRL("ctrl", Group.KEYWORD),
  INV("inv", Group.KEYWORD),
  QUBIT("qubit", Group.KEYWORD),
  BIT("bit", Group.KEYWORD),
  INT("int", Group.KEYWORD),
  FLOAT("float", Group.KEYWORD),
  BOOL("bool", Group.KEYWORD),
  STR("str", Group.KEYWORD),

  IDENTIFIER(null, Group.IDENTIFIER),

  // literals
  INT_LITERAL(null, Group.LITERAL),
  FLOAT_LITERAL(null, Group.LITERAL),
  STRING_LITERAL(null, Group.LITERAL),

  // operators
  PLUS("+", Group.OPERATOR),
  MINUS("-", Group.OPERATOR),
  STAR("*", Group.OPERATOR),
  SLASH("/", Group.OPERATOR),
  SLASH_SLASH("//", Group.OPERATOR),
  PERCENT("%", Group.OPERATOR),
  STAR_STAR("**", Group.OPERATOR),
  EQ_EQ("==", Group.OPERATOR),
  NE("!=", Group.OPERATOR),
  LT("<", Group.OPERATOR),
  LE("<=", Group.OPERATOR),
  GT(">", Group.OPERATOR),
  GE(">=", Group.OPERATOR),
  ASSIGN("=", Group.OPERATOR),
  PLUS_ASSIGN("+=", Group.OPERATOR),
  MINUS_ASSIGN("-=", Group.OPERATOR),
  STAR_ASSIGN("*=", Group.OPERATOR),
  ARROW("->", Group.OPERATOR),
  /** Postfix dagger, U+2020, which inverts a gate. */
  DAGGER("†", Group.OPERATOR),

  // punctuation
  COLON(":", Group.PUNCTUATION),
  COMMA(",", Group.PUNCTUATION),
  DOT(".", Group.PUNCTUATION),
  LPAREN("(", Group.PUNCTUATION),
  RPAREN(")", Group.PUNCTUATION),
  LBRACKET("[", Group.PUNCTUATION),
  RBRACKET("]", Group.PUNCTUATION),
  LBRACE("{", Group.PUNCTUATION),
  RBRACE("}", Group.PUNCTUATION),

  // separators
  SEMICOLON(";", Group.SEPARATOR),
  NEWLINE(null, Group.SEPARATOR),

  EOF(null, Group.EOF);

  /** Fixed text of the token, or null if the text varies. */
  public final @Nullable String text;
  public final Group group;

  private static final ImmutableMap<String, TokenKind> KEYWORDS;

  static {
    final ImmutableMap.Builder<String, TokenKind> b = ImmutableMap.builder();
    for (TokenKind kind : values()) {
      if (kind.group == Group.KEYWORD) {
        b.put(kind.text, kind);
      }
    }
    KEYWORDS = b.build();
  }

  TokenKind(@Nullable String text, Group group) {
    this.text = text;
    this.group = group;
  }

  /** Returns the keyword with a given spelling, or null. */
  static @Nullable TokenKind keyword(String s) {
    return KEYWORDS.get(s);
  }

  /** Description for use in error messages, e.g. "')'" or "identifier". */
  public String describe() {
    if (text != null) {
      return "'" + text + "'";
    }
    switch (this) {
      case IDENTIFIER:
        return "identifier";
      case INT_LITERAL:
        return "integer literal";
      case FLOAT_LITERAL:
        return "float literal";
      case STRING_LITERAL:
        return "string literal";
      case NEWLINE:
        return "newline";
      case EOF:
        return "end of input";
      default:
        throw new AssertionError(this);
    }
  }

  /** Group of token kinds. */
  public enum Group {
    KEYWORD,
    IDENTIFIER,
    LITERAL,
    OPERATOR,
    PUNCTUATION,
    SEPARATOR,
    EOF
  }
}

// End TokenKind.java
