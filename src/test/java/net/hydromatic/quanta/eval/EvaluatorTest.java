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
package net.hydromatic.quanta.eval;

import static net.hydromatic.quanta.Matchers.throwsKind;
import static net.hydromatic.quanta.Qs.assertError;
import static net.hydromatic.quanta.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Pos;
import net.hydromatic.quanta.compile.Analyzer;
import net.hydromatic.quanta.compile.CompileException;
import net.hydromatic.quanta.compile.SymbolTable;
import net.hydromatic.quanta.parse.QuantaParser;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests {@link Evaluator}. */
public class EvaluatorTest {
  /** Analyzes a program whose last declaration is constant "x", and
   * evaluates "x". */
  private static Object evalProgram(String source, int maxListSize) {
    final Analyzer.Analysis analysis =
        Analyzer.analyze(QuantaParser.parse("stdIn", source),
            ImmutableMap.of());
    return new Evaluator(analysis.symbolTable, maxListSize)
        .constant("x", analysis.program);
  }

  private static Object eval(String exp) {
    return evalProgram("const x = " + exp, 1_000);
  }

  private static void check(String exp, Object expected) {
    assertValue(eval(exp), expected);
  }

  private static void assertValue(@Nullable Object actual, Object expected) {
    assertThat(actual, is(expected));
  }

  private static void checkThrows(String exp, String message) {
    assertError(() -> eval(exp),
        throwsKind(CompileException.Kind.SEMANTIC, message));
  }

  @Test void testArithmetic() {
    check("1 + 2 * 3", 7);
    check("1 + 2.5", 3.5);
    check("7 / 2", 3.5);
    check("4 / 2", 2.0);
    check("7 // 2", 3);
    check("-7 // 2", -4);
    check("-7.5 // 2", -4.0);
    check("-7 % 3", 2);
    check("7 % -3", -2);
    check("2 ** 10", 1024);
    check("2 ** 0", 1);
    check("2.0 ** 3", 8.0);
    check("4 ** 0.5", 2.0);
    check("-(3)", -3);
    check("2147483647 - 1", 2147483646);
  }

  @Test void testArithmeticErrors() {
    checkThrows("1 // 0", "division by zero");
    checkThrows("1 % 0", "division by zero");
    checkThrows("1.0 / 0", "division by zero");
    checkThrows("2147483647 + 1", "integer overflow");
    checkThrows("65536 * 65536", "integer overflow");
    checkThrows("2 ** 31", "integer overflow");
    checkThrows("2 ** -1", "negative exponent -1 in integer power");
    checkThrows("10.0 ** 400", "float overflow");
    checkThrows("sqrt(-1.0)", "sqrt of negative number -1.0");
    checkThrows("int(1e10)", "integer overflow");
  }

  @Test void testComparison() {
    check("1 < 2", true);
    check("2 <= 1", false);
    check("1 == 1.0", true);
    check("1 != 2", true);
    check("\"a\" < \"b\"", true);
    check("not (1 > 2)", true);
    // "and" and "or" do not evaluate their right operand if not needed
    check("false and 1 // 0 == 0", false);
    check("true or 1 // 0 == 0", true);
  }

  @Test void testBuiltIns() {
    check("pi", Math.PI);
    check("tau / 2", Math.PI);
    check("abs(-3)", 3);
    check("abs(-2.5)", 2.5);
    check("min(2, 3)", 2);
    check("min(2, 3.5)", 2.0);
    check("max(2, 3)", 3);
    check("sqrt(16)", 4.0);
    check("sin(0)", 0.0);
    check("cos(0)", 1.0);
    check("int(2.9)", 2);
    check("int(-2.9)", -2);
    check("float(2)", 2.0);
    check("len([1, 2, 3])", 3);
  }

  @Test void testStrings() {
    check("\"ab\" + \"c\"", "abc");
    check("\"ab\" == \"ab\"", true);
  }

  @Test void testLists() {
    check("[1, 2] + [3]", ImmutableList.of(1, 2, 3));
    check("[1, 2, 3][1]", 2);
    check("[0:4]", ImmutableList.of(0, 1, 2, 3));
    check("[0:3:10]", ImmutableList.of(0, 3, 6, 9));
    check("[0:10:3]", ImmutableList.of(0));
    check("[5:-2:0]", ImmutableList.of(5, 3, 1));
    check("[3:1]", ImmutableList.of());
    check("len([0:3:10])", 4);
    checkThrows("[1, 2, 3][5]", "index 5 out of range for list of size 3");
    checkThrows("[1, 2, 3][-1]", "index -1 out of range for list of size 3");
  }

  @Test void testRangeLimit() {
    assertValue(evalProgram("const x = [0:10]", 10),
        Arrays.asList(0, 1, 2, 3, 4, 5, 6, 7, 8, 9));
    assertError(() -> evalProgram("const x = [0:100]", 10),
        throwsKind(CompileException.Kind.SEMANTIC,
            "range has 100 elements; limit is 10"));
    assertError(() -> evalProgram("const s = 0\nconst x = [0:s:3]", 10),
        throwsKind(CompileException.Kind.SEMANTIC,
            "range step must not be zero"));
  }

  @Test void testConstants() {
    assertValue(evalProgram("const a = 2\nconst x = a * 3", 10), 6);
    assertValue(evalProgram("const x: float = 2", 10), 2.0);
    assertValue(
        evalProgram("class K { const A = 4 }\nconst x = K.A + 1", 10), 5);
  }

  @Test void testFunctions() {
    final String fact = "def fact(n: int) -> int {\n"
        + "  var r = 1\n"
        + "  for i in [1:n + 1] {\n"
        + "    r *= i\n"
        + "  }\n"
        + "  return r\n"
        + "}\n"
        + "const x = fact(5)";
    assertValue(evalProgram(fact, 100), 120);

    final String half = "def half(v: float) -> float {\n"
        + "  return v / 2\n"
        + "}\n"
        + "const x = half(3)";
    assertValue(evalProgram(half, 100), 1.5);

    final String sign = "def sign(n: int) -> int {\n"
        + "  if n > 0 {\n"
        + "    return 1\n"
        + "  } elif n < 0 {\n"
        + "    return -1\n"
        + "  }\n"
        + "  return 0\n"
        + "}\n"
        + "const x = [sign(-5), sign(0), sign(7)]";
    assertValue(evalProgram(sign, 100), ImmutableList.of(-1, 0, 1));

    // A float variable stays float when assigned an int
    final String acc = "def total(n: int) -> float {\n"
        + "  var t = 0.0\n"
        + "  t = n\n"
        + "  return t\n"
        + "}\n"
        + "const x = total(3)";
    assertValue(evalProgram(acc, 100), 3.0);

    final String partial = "def f(n: int) -> int {\n"
        + "  if n > 0 {\n"
        + "    return 1\n"
        + "  }\n"
        + "}\n"
        + "const x = f(0)";
    assertError(() -> evalProgram(partial, 100),
        throwsKind(CompileException.Kind.SEMANTIC,
            "function 'f' did not return a value"));
  }

  @Test void testBinary() {
    final Evaluator evaluator = new Evaluator(SymbolTable.empty(), 10);
    final Ast.Literal node = ast.intLiteral(Pos.ZERO, 0);
    assertValue(evaluator.binary(Op.FLOOR_DIVIDE, -7, 2, node), -4);
    assertValue(evaluator.binary(Op.MOD, 7.5, 2, node), 1.5);
    assertValue(evaluator.binary(Op.PLUS, "a", "b", node), "ab");
    assertValue(evaluator.binary(Op.EQ, 2, 2.0, node), true);
    assertError(() -> evaluator.binary(Op.MINUS, "a", 1, node),
        throwsKind(CompileException.Kind.SEMANTIC,
            "cannot apply '-' to str and int 1"));
  }

  @Test void testEnv() {
    final EvalEnv root = EvalEnv.root();
    root.declare("a", 1);
    final EvalEnv sub = root.sub();
    sub.declare("b", 2);
    assertValue(sub.getOpt("a"), 1);
    assertThat(sub.assign("a", 3), is(true));
    assertValue(root.getOpt("a"), 3);
    assertThat(root.getOpt("b") == null, is(true));
    assertThat(sub.assign("c", 4), is(false));
  }
}

// End EvaluatorTest.java
