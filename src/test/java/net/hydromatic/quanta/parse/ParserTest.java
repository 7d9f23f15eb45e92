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
import static net.hydromatic.quanta.Qs.qs;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.compile.CompileException;
import org.junit.jupiter.api.Test;

/** Tests {@link QuantaParser}. */
public class ParserTest {
  private static Ast.Exp exp(String s) {
    return new QuantaParser("stdIn", s).expressionEof();
  }

  /** Checks that an expression parses and unparses to the same text. */
  private static void assertRoundTrip(String s) {
    assertThat(exp(s).toString(), is(s));
  }

  @Test void testProgram() {
    final String bell = "qubit[2] q\n"
        + "bit[2] c\n"
        + "H(q[0])\n"
        + "CNot(q[0], q[1])\n"
        + "measure_all(q, c)";
    qs(bell).assertParse(bell);
    qs("\n\n# leading comment\n" + bell + "\n\n").assertParse(bell);
    qs("").assertParse("");
  }

  @Test void testSemicolons() {
    qs("H(q[0]); X(q[1]);;\nZ(q[2])")
        .assertParse("H(q[0])\nX(q[1])\nZ(q[2])");
  }

  @Test void testPrecedence() {
    assertRoundTrip("1 + 2 * 3");
    assertRoundTrip("(1 + 2) * 3");
    assertRoundTrip("x - (y - z)");
    assertRoundTrip("x - y - z");
    assertRoundTrip("2 ** 3 ** 2");
    assertRoundTrip("(2 ** 3) ** 2");
    assertRoundTrip("-2 ** 2");
    assertRoundTrip("not a and b or c");
    assertRoundTrip("not (a and b)");
    assertRoundTrip("a < b and b <= c");
    assertRoundTrip("x // 2 % 3 / 4");
    assertThat(exp("((1))").toString(), is("1"));
    assertThat(exp("+x").toString(), is("x"));
    assertThat(exp("1.0 + 2.50").toString(), is("1.0 + 2.5"));
  }

  @Test void testPower() {
    final Ast.Exp e = exp("-2 ** 2");
    assertThat(e, instanceOf(Ast.PrefixCall.class));
    final Ast.Exp e2 = exp("2 ** -1");
    assertThat(e2, instanceOf(Ast.InfixCall.class));
    assertThat(e2.toString(), is("2 ** (-1)"));
  }

  @Test void testConversionCalls() {
    final Ast.Exp e = exp("int(2.5) + float(n)");
    assertThat(e.toString(), is("int(2.5) + float(n)"));
    final Ast.Exp e2 = ((Ast.InfixCall) e).a0;
    assertThat(e2, instanceOf(Ast.Call.class));
    assertThat(((Ast.Call) e2).name, is("int"));
    qs("var x: int = int(y)").assertParse("var x: int = int(y)");
    qs("var x = int + 1").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected 'int'; expected expression"));
  }

  @Test void testLists() {
    assertRoundTrip("[]");
    assertRoundTrip("[1, 2, 3]");
    assertRoundTrip("[0:4]");
    assertRoundTrip("[10:-2:0]");
    assertRoundTrip("[0:n][i]");
    assertRoundTrip("Ops.angles[2]");
  }

  @Test void testModifiers() {
    assertRoundTrip("ctrl inv RX(c, 0.5, t)");
    assertRoundTrip("ctrl[2] X(a, b, t)");
    assertThat(exp("X(q)†").toString(), is("inv X(q)"));
    assertThat(exp("ctrl X(c, t)†").toString(), is("ctrl inv X(c, t)"));
    assertThat(exp("X(q)††").toString(), is("inv inv X(q)"));

    final Ast.Call call = (Ast.Call) exp("ctrl[3] ctrl inv Z(a, b, c, d, t)");
    assertThat(call.modifiers.size(), is(3));
    assertThat(call.modifiers.get(0), is(Modifier.ctrl(3)));
    assertThat(call.modifiers.get(1), is(Modifier.CTRL));
    assertThat(call.modifiers.get(2), is(Modifier.INV));
    assertThat(call.controlCount(), is(4));
  }

  @Test void testDeclarations() {
    qs("qubit q\nbit[1 + 1] c").assertParse("qubit q\nbit[1 + 1] c");
    qs("var x = 1\nconst N: int = 3\nvar e: float[] = []")
        .assertParse("var x = 1\nconst N: int = 3\nvar e: float[] = []");
    qs("def double(n: int) -> int {\n  return n * 2\n}")
        .assertParse("def double(n: int) -> int { return n * 2 }");
    qs("def noop() {\n}").assertParse("def noop() {}");
    qs("def apply(r: qubit[2], theta: float) {\n  RX(theta, r[0])\n}")
        .assertParse("def apply(r: qubit[2], theta: float) "
            + "{ RX(theta, r[0]) }");
    qs("gate Bell(a, b) { H(a); CNot(a, b) }")
        .assertParse("gate Bell(a, b) { H(a); CNot(a, b) }");
    qs("class Ops {\n  const N = 2\n\n  gate Flip(q) {\n    X(q)\n  }\n}")
        .assertParse("class Ops { const N = 2; gate Flip(q) { X(q) } }");
  }

  @Test void testStatements() {
    qs("for i in [0:3] {\n  H(q[i])\n}")
        .assertParse("for i in [0:3] { H(q[i]) }");
    qs("for (i in [0:2:10]) { H(q[i]) }")
        .assertParse("for i in [0:2:10] { H(q[i]) }");
    qs("if x < 1 {\n  H(q)\n} elif x < 2 {\n  X(q)\n}\nelse {\n  Z(q)\n}")
        .assertParse("if x < 1 { H(q) } "
            + "else { if x < 2 { X(q) } else { Z(q) } }");
    qs("if b { H(q) }\nX(q)").assertParse("if b { H(q) }\nX(q)");
    qs("x = 1\nx += 2\nx -= 3\nx *= 4")
        .assertParse("x = 1\nx += 2\nx -= 3\nx *= 4");
    qs("def f() {\n  return\n}").assertParse("def f() { return }");
    qs("var s = \"a\\\"b\"").assertParse("var s = \"a\\\"b\"");
  }

  @Test void testErrors() {
    qs("H(q[0]").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected end of input; expected ')'"));
    qs("qubit[2]").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected end of input; expected identifier"));
    qs("H(q) X(q)").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected identifier 'X'; expected one of newline, ';', "
                + "end of input"));
    qs("ctrl 3").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected integer literal '3'; expected call"));
    qs("ctrl[0] X(a, b)").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected integer literal '0'; expected positive integer"));
    qs("1 = 2").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected '='; expected one of newline, ';'"));
    qs("var x: qreg = 1").assertParseThrows(
        throwsKind(CompileException.Kind.PARSE,
            "unexpected identifier 'qreg'; expected type"));
    qs("H(q)\nX(q").assertParseThrows(isAt("2.4"));
    qs("H(q) @").assertParseThrows(
        throwsKind(CompileException.Kind.LEX, "unexpected character '@'"));
  }
}

// End ParserTest.java
