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

import static net.hydromatic.quanta.Matchers.isAt;
import static net.hydromatic.quanta.Matchers.throwsKind;
import static net.hydromatic.quanta.Qs.assertError;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.quanta.compile.CompileException;
import org.junit.jupiter.api.Test;

/** Tests {@link Lexer}. */
public class LexerTest {
  /** Returns the kinds of the tokens in a string, separated by spaces. */
  private static String kinds(String source) {
    return Lexer.tokenize("stdIn", source).stream()
        .map(t -> t.kind.name())
        .collect(Collectors.joining(" "));
  }

  @Test void testCall() {
    assertThat(kinds("H(q[0])"),
        is("IDENTIFIER LPAREN IDENTIFIER LBRACKET INT_LITERAL RBRACKET "
            + "RPAREN EOF"));
  }

  @Test void testEmpty() {
    assertThat(kinds(""), is("EOF"));
    assertThat(kinds("\n\n  # just a comment\n"), is("EOF"));
  }

  @Test void testNewlines() {
    // Consecutive line breaks yield one separator
    assertThat(kinds("a\n\n\nb"), is("IDENTIFIER NEWLINE IDENTIFIER EOF"));
    // Line breaks inside parentheses and brackets are ignored
    assertThat(kinds("f(a,\n  b)\n[1,\n2]"),
        is("IDENTIFIER LPAREN IDENTIFIER COMMA IDENTIFIER RPAREN NEWLINE "
            + "LBRACKET INT_LITERAL COMMA INT_LITERAL RBRACKET EOF"));
    assertThat(kinds("{\nx\n}"),
        is("LBRACE NEWLINE IDENTIFIER NEWLINE RBRACE EOF"));
  }

  @Test void testComment() {
    assertThat(kinds("H(q) # apply Hadamard\nX(q)"),
        is("IDENTIFIER LPAREN IDENTIFIER RPAREN NEWLINE "
            + "IDENTIFIER LPAREN IDENTIFIER RPAREN EOF"));
  }

  @Test void testKeywords() {
    assertThat(kinds("var const def gate class for in if elif else return"),
        is("VAR CONST DEF GATE CLASS FOR IN IF ELIF ELSE RETURN EOF"));
    assertThat(kinds("true false and or not ctrl inv"),
        is("TRUE FALSE AND OR NOT CTRL INV EOF"));
    assertThat(kinds("qubit bit int float bool str"),
        is("QUBIT BIT INT FLOAT BOOL STR EOF"));
    // Keywords are case-sensitive
    assertThat(kinds("Var CTRL ctrl_1"),
        is("IDENTIFIER IDENTIFIER IDENTIFIER EOF"));
  }

  @Test void testOperators() {
    assertThat(kinds("+ - * / // % ** == != < <= > >="),
        is("PLUS MINUS STAR SLASH SLASH_SLASH PERCENT STAR_STAR EQ_EQ NE "
            + "LT LE GT GE EOF"));
    assertThat(kinds("= += -= *= -> : , . ; †"),
        is("ASSIGN PLUS_ASSIGN MINUS_ASSIGN STAR_ASSIGN ARROW COLON COMMA "
            + "DOT SEMICOLON DAGGER EOF"));
    assertThat(kinds("x-=1"), is("IDENTIFIER MINUS_ASSIGN INT_LITERAL EOF"));
  }

  @Test void testNumbers() {
    final List<Token> tokens = Lexer.tokenize("stdIn", "42 1.5 3. 1e3 2.5E-2");
    assertThat(tokens.get(0).kind, is(TokenKind.INT_LITERAL));
    assertThat(tokens.get(0).value, is(42));
    assertThat(tokens.get(1).kind, is(TokenKind.FLOAT_LITERAL));
    assertThat(tokens.get(1).value, is(1.5D));
    assertThat(tokens.get(2).value, is(3D));
    assertThat(tokens.get(3).kind, is(TokenKind.FLOAT_LITERAL));
    assertThat(tokens.get(3).value, is(1000D));
    assertThat(tokens.get(4).value, is(0.025D));

    // "1.x" is an int followed by a member access, not a float
    assertThat(kinds("1.x"), is("INT_LITERAL DOT IDENTIFIER EOF"));
    // "2e" is an int followed by an identifier
    assertThat(kinds("2e"), is("INT_LITERAL IDENTIFIER EOF"));
  }

  @Test void testString() {
    final List<Token> tokens =
        Lexer.tokenize("stdIn", "\"a\\tb\" \"say \\\"hi\\\"\"");
    assertThat(tokens.get(0).kind, is(TokenKind.STRING_LITERAL));
    assertThat(tokens.get(0).value, is("a\tb"));
    assertThat(tokens.get(1).value, is("say \"hi\""));
  }

  @Test void testPosition() {
    final List<Token> tokens = Lexer.tokenize("stdIn", "H(q)\n  CNot(a, b)");
    final Token cnot = tokens.get(5);
    assertThat(cnot.text, is("CNot"));
    assertThat(cnot.line, is(2));
    assertThat(cnot.column, is(3));
    assertThat(cnot.pos("f.qs").toString(), is("f.qs:2.3-2.7"));
  }

  @Test void testErrors() {
    assertError(() -> Lexer.tokenize("stdIn", "H(q) @ X(q)"),
        throwsKind(CompileException.Kind.LEX, "unexpected character '@'"));
    assertError(() -> Lexer.tokenize("stdIn", "H(q) @ X(q)"), isAt("1.6"));
    assertError(() -> Lexer.tokenize("stdIn", "x = 1 ! 2"),
        throwsKind(CompileException.Kind.LEX, "unexpected character '!'"));
    assertError(() -> Lexer.tokenize("stdIn", "var s = \"abc"),
        throwsKind(CompileException.Kind.LEX, "unterminated string"));
    assertError(() -> Lexer.tokenize("stdIn", "var s = \"abc\nd\""),
        throwsKind(CompileException.Kind.LEX, "unterminated string"));
    assertError(() -> Lexer.tokenize("stdIn", "var s = \"a\\qb\""),
        throwsKind(CompileException.Kind.LEX, "illegal escape '\\q'"));
    assertError(() -> Lexer.tokenize("stdIn", "var n = 12345678901"),
        throwsKind(CompileException.Kind.LEX,
            "integer literal out of range: 12345678901"));
  }
}

// End LexerTest.java
