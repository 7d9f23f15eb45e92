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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts source text into a list of {@link Token}s.
 *
 * <p>A line break produces a {@link TokenKind#NEWLINE} token, except inside
 * parentheses or brackets, where lines join implicitly. A comment runs from
 * {@code #} to the end of the line. The last token is always
 * {@link TokenKind#EOF}.
 */
public class Lexer {
  private final String file;
  private final String source;
  private final List<Token> tokens = new ArrayList<>();

  /** Offset of the first character of the current token. */
  private int start = 0;
  /** Offset of the next character. */
  private int current = 0;
  private int line = 1;
  private int column = 1;
  private int startLine = 1;
  private int startColumn = 1;
  /** Number of open parentheses and brackets. */
  private int depth = 0;

  /** Creates a Lexer. */
  public Lexer(String file, String source) {
    this.file = requireNonNull(file);
    this.source = requireNonNull(source);
  }

  /** Tokenizes a string. */
  public static List<Token> tokenize(String file, String source) {
    return new Lexer(file, source).scanTokens();
  }

  /** Scans the entire source and returns the list of tokens. */
  public List<Token> scanTokens() {
    while (!isAtEnd()) {
      start = current;
      startLine = line;
      startColumn = column;
      scanToken();
    }
    tokens.add(new Token(TokenKind.EOF, "", null, line, column));
    return ImmutableList.copyOf(tokens);
  }

  private void scanToken() {
    final char c = advance();
    switch (c) {
      case ' ':
      case '\t':
      case '\r':
        break;
      case '\n':
        if (depth == 0 && !tokens.isEmpty()
            && last().kind != TokenKind.NEWLINE) {
          addToken(TokenKind.NEWLINE, "\\n", null);
        }
        break;
      case '#':
        while (peek() != '\n' && !isAtEnd()) {
          advance();
        }
        break;
      case '(':
        ++depth;
        addToken(TokenKind.LPAREN);
        break;
      case ')':
        depth = Math.max(depth - 1, 0);
        addToken(TokenKind.RPAREN);
        break;
      case '[':
        ++depth;
        addToken(TokenKind.LBRACKET);
        break;
      case ']':
        depth = Math.max(depth - 1, 0);
        addToken(TokenKind.RBRACKET);
        break;
      case '{':
        addToken(TokenKind.LBRACE);
        break;
      case '}':
        addToken(TokenKind.RBRACE);
        break;
      case ',':
        addToken(TokenKind.COMMA);
        break;
      case '.':
        addToken(TokenKind.DOT);
        break;
      case ':':
        addToken(TokenKind.COLON);
        break;
      case ';':
        addToken(TokenKind.SEMICOLON);
        break;
      case '%':
        addToken(TokenKind.PERCENT);
        break;
      case '†':
        addToken(TokenKind.DAGGER);
        break;
      case '+':
        addToken(match('=') ? TokenKind.PLUS_ASSIGN : TokenKind.PLUS);
        break;
      case '-':
        addToken(match('>') ? TokenKind.ARROW
            : match('=') ? TokenKind.MINUS_ASSIGN
            : TokenKind.MINUS);
        break;
      case '*':
        addToken(match('*') ? TokenKind.STAR_STAR
            : match('=') ? TokenKind.STAR_ASSIGN
            : TokenKind.STAR);
        break;
      case '/':
        addToken(match('/') ? TokenKind.SLASH_SLASH : TokenKind.SLASH);
        break;
      case '=':
        addToken(match('=') ? TokenKind.EQ_EQ : TokenKind.ASSIGN);
        break;
      case '<':
        addToken(match('=') ? TokenKind.LE : TokenKind.LT);
        break;
      case '>':
        addToken(match('=') ? TokenKind.GE : TokenKind.GT);
        break;
      case '!':
        if (match('=')) {
          addToken(TokenKind.NE);
          break;
        }
        throw error("unexpected character '!'");
      case '"':
        string();
        break;
      default:
        if (isDigit(c)) {
          number();
        } else if (isIdentifierStart(c)) {
          identifier();
        } else {
          throw error("unexpected character '" + c + "'");
        }
    }
  }

  private void identifier() {
    while (isIdentifierPart(peek())) {
      advance();
    }
    final String text = text();
    final TokenKind keyword = TokenKind.keyword(text);
    addToken(keyword != null ? keyword : TokenKind.IDENTIFIER, text, null);
  }

  private void number() {
    while (isDigit(peek())) {
      advance();
    }
    boolean isFloat = false;
    if (peek() == '.' && !isIdentifierStart(peekNext())) {
      isFloat = true;
      advance();
      while (isDigit(peek())) {
        advance();
      }
    }
    if (peek() == 'e' || peek() == 'E') {
      final int signOffset =
          peekNext() == '+' || peekNext() == '-' ? 1 : 0;
      if (isDigit(peekAt(current + 1 + signOffset))) {
        isFloat = true;
        advance();
        if (signOffset == 1) {
          advance();
        }
        while (isDigit(peek())) {
          advance();
        }
      }
    }
    final String text = text();
    if (isFloat) {
      final double d = Double.parseDouble(text);
      if (Double.isInfinite(d)) {
        throw error("float literal out of range: " + text);
      }
      addToken(TokenKind.FLOAT_LITERAL, text, d);
    } else {
      try {
        addToken(TokenKind.INT_LITERAL, text, Integer.parseInt(text));
      } catch (NumberFormatException e) {
        throw error("integer literal out of range: " + text);
      }
    }
  }

  private void string() {
    while (peek() != '"') {
      if (isAtEnd() || peek() == '\n') {
        throw error("unterminated string");
      }
      if (advance() == '\\' && !isAtEnd() && peek() != '\n') {
        advance();
      }
    }
    advance(); // the closing quote
    final String text = text();
    try {
      addToken(TokenKind.STRING_LITERAL, text, Parsers.unquoteString(text));
    } catch (IllegalArgumentException e) {
      throw error(e.getMessage());
    }
  }

  private LexException error(String message) {
    return new LexException(message,
        Pos.of(file, startLine, startColumn, current - start));
  }

  private Token last() {
    return tokens.get(tokens.size() - 1);
  }

  private String text() {
    return source.substring(start, current);
  }

  private void addToken(TokenKind kind) {
    addToken(kind, text(), null);
  }

  private void addToken(TokenKind kind, String text, @Nullable Object value) {
    tokens.add(new Token(kind, text, value, startLine, startColumn));
  }

  private boolean isAtEnd() {
    return current >= source.length();
  }

  private char advance() {
    final char c = source.charAt(current++);
    if (c == '\n') {
      ++line;
      column = 1;
    } else {
      ++column;
    }
    return c;
  }

  private boolean match(char expected) {
    if (peek() != expected) {
      return false;
    }
    advance();
    return true;
  }

  private char peek() {
    return peekAt(current);
  }

  private char peekNext() {
    return peekAt(current + 1);
  }

  private char peekAt(int i) {
    return i < source.length() ? source.charAt(i) : '\0';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}

// End Lexer.java
