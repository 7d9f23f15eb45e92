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
package net.hydromatic.quanta.compile;

import static net.hydromatic.quanta.Matchers.isAt;
import static net.hydromatic.quanta.Matchers.throwsKind;
import static net.hydromatic.quanta.Qs.qs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.quanta.compile.CompileException.Kind;
import net.hydromatic.quanta.parse.QuantaParser;
import net.hydromatic.quanta.type.RegisterType;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests {@link Analyzer}. */
public class AnalyzerTest {
  private static Analyzer.Analysis analyze(String source) {
    return Analyzer.analyze(QuantaParser.parse("stdIn", source),
        ImmutableMap.of());
  }

  private static Matcher<Throwable> semantic(String message) {
    return throwsKind(Kind.SEMANTIC, message);
  }

  @Test void testBell() {
    final String bell = "qubit[2] q\n"
        + "bit[2] c\n"
        + "gate Bell(a, b) { H(a); CNot(a, b) }\n"
        + "Bell(q[0], q[1])\n"
        + "measure_all(q, c)";
    qs(bell).assertAnalyze(bell);

    final Analyzer.Analysis analysis = analyze(bell);
    assertThat(analysis.symbolTable.registers.keySet().toString(),
        is("[q, c]"));
    assertThat(analysis.symbolTable.register("q"),
        is(RegisterType.of(RegisterType.Kind.QUBIT, 2)));
    assertThat(analysis.symbolTable.gates.keySet().toString(), is("[Bell]"));
    assertThat(analysis.callGraph.nodes().toString(), is("[Bell]"));
  }

  @Test void testRegisterSizeIsFolded() {
    qs("const N = 3\nqubit[N + 1] q\nbit c")
        .assertAnalyze("const N = 3\nqubit[4] q\nbit c");
  }

  @Test void testClassMembersAreQualified() {
    final String source = "qubit q\n"
        + "class Ops {\n"
        + "  const theta = pi / 2\n"
        + "  gate Rot(x) { RX(theta, x) }\n"
        + "}\n"
        + "Ops.Rot(q)\n"
        + "RZ(Ops.theta, q)";
    qs(source).assertAnalyze("qubit q\n"
        + "class Ops { const Ops.theta = pi / 2; "
        + "gate Ops.Rot(x) { RX(Ops.theta, x) } }\n"
        + "Ops.Rot(q)\n"
        + "RZ(Ops.theta, q)");
  }

  @Test void testQuantumFunctionsAreInlined() {
    final Analyzer.Analysis analysis = analyze("qubit[2] q\n"
        + "def prep(r: qubit[2]) {\n"
        + "  for i in [0:2] { H(r[i]) }\n"
        + "}\n"
        + "def square(n: int) -> int {\n"
        + "  return n * n\n"
        + "}\n"
        + "def twice() {\n"
        + "  prep(q)\n"
        + "  prep(q)\n"
        + "}\n"
        + "twice()\n"
        + "RX(square(2), q[0])");
    assertThat(analysis.symbolTable.functions.keySet().toString(),
        is("[prep, square, twice]"));
    // "twice" has no quantum parameter, but calls a quantum function
    assertThat(analysis.symbolTable.inlineFunctions.toString(),
        is("[prep, twice]"));
  }

  @Test void testUndeclared() {
    qs("qubit q\nH(r)").assertAnalyzeThrows(
        semantic("undeclared identifier 'r'"));
    qs("qubit q\nH(r)").assertAnalyzeThrows(isAt("2.3"));
    qs("var x = y + 1").assertAnalyzeThrows(
        semantic("undeclared identifier 'y'"));
    qs("qubit q\nFoo(q)").assertAnalyzeThrows(
        semantic("unknown gate or function 'Foo'"));
    qs("qubit q\nRX(Ops.theta, q)").assertAnalyzeThrows(
        semantic("unknown class 'Ops'"));
    qs("class Ops { const A = 1 }\nvar x = Ops.B").assertAnalyzeThrows(
        semantic("class 'Ops' has no member 'B'"));
    qs("class C {\n  const A = C.B\n  const B = 1\n}").assertAnalyzeThrows(
        semantic("class member 'C.B' is used before its declaration"));
  }

  @Test void testDuplicates() {
    qs("qubit q\nqubit q").assertAnalyzeThrows(
        semantic("duplicate declaration of 'q'"));
    qs("var x = 1\ngate x(a) { H(a) }").assertAnalyzeThrows(
        semantic("duplicate declaration of 'x'"));
    qs("gate G(a, a) { H(a) }").assertAnalyzeThrows(
        semantic("duplicate declaration of 'a'"));
    qs("class C {\n  const A = 1\n  def A() {}\n}").assertAnalyzeThrows(
        semantic("duplicate declaration of 'A' in class 'C'"));
    qs("gate H(q) { X(q) }").assertAnalyzeThrows(
        semantic("cannot redefine built-in 'H'"));
    qs("def len(x: int) -> int { return x }").assertAnalyzeThrows(
        semantic("cannot redefine built-in 'len'"));
    qs("var pi = 3").assertAnalyzeThrows(
        semantic("cannot redefine built-in 'pi'"));
  }

  @Test void testRegisters() {
    qs("qubit[0] q").assertAnalyzeThrows(
        semantic("size of register 'q' must be at least 1, was 0"));
    qs("var n = 2\nqubit[n] q").assertAnalyzeThrows(
        semantic("size of register 'q' must be a constant expression"));
    qs("qubit[1.5] q").assertAnalyzeThrows(
        semantic("type mismatch: register size must be int, got float"));
    qs("def f() {\n  qubit q\n}").assertAnalyzeThrows(
        semantic("register 'q' must be declared at top level"));
    qs("for i in [0:2] { qubit q }").assertAnalyzeThrows(
        semantic("register 'q' must be declared at top level"));
    qs("qubit[2] q\nH(q[2])").assertAnalyzeThrows(
        semantic("index 2 out of range for register q of size 2"));
    qs("qubit[2] q\nH(q[-1])").assertAnalyzeThrows(
        semantic("index -1 out of range for register q of size 2"));
    qs("qubit[2] a\nqubit[3] b\nCNot(a, b)").assertAnalyzeThrows(
        semantic("registers in call to 'CNot' must have the same size"));
  }

  @Test void testQuantumValues() {
    qs("bit c\nvar x = c").assertAnalyzeThrows(
        semantic("cannot read bit 'c'; measurement results are not "
            + "classical values"));
    qs("qubit q\nvar x = q").assertAnalyzeThrows(
        semantic("qubit 'q' cannot be used as a value"));
    qs("var x = H").assertAnalyzeThrows(
        semantic("'H' cannot be used as a value"));
    qs("var x: qubit = 1").assertAnalyzeThrows(
        semantic("variable 'x' cannot have a quantum type"));
  }

  @Test void testOperands() {
    qs("qubit q\nH(1)").assertAnalyzeThrows(
        semantic("illegal quantum operand '1'"));
    qs("var x = 1\nH(x)").assertAnalyzeThrows(
        semantic("illegal quantum operand 'x'"));
    qs("qubit q\nbit c\nMeasure(c, q)").assertAnalyzeThrows(
        semantic("expected qubit operand, got bit 'c'"));
    qs("qubit[2] q\nCNot(q[0])").assertAnalyzeThrows(
        semantic("'CNot' expects 2 arguments, got 1"));
    qs("qubit[3] q\nctrl X(q[0])").assertAnalyzeThrows(
        semantic("'X' expects 2 arguments, got 1"));
    qs("qubit q\nRX(true, q)").assertAnalyzeThrows(
        semantic("angle must be int or float, got bool"));
    qs("Barrier()").assertAnalyzeThrows(
        semantic("'Barrier' requires at least one qubit"));
    qs("qubit[2] q\nbit[2] c\nmeasure_all(q[0], c)").assertAnalyzeThrows(
        semantic("arguments of 'measure_all' must be registers"));
    qs("qubit q\nvar x = 1 + H(q)").assertAnalyzeThrows(
        semantic("gate 'H' cannot be used in an expression"));
  }

  @Test void testRegisterArguments() {
    // A register may be passed to a qubit parameter; it is broadcast later
    qs("qubit q\ngate G(x) { H(x) }\nG(q)")
        .assertAnalyze("qubit q\ngate G(x) { H(x) }\nG(q)");
    qs("qubit[2] q\nbit[2] c\n"
        + "gate M(x, b: bit) { Measure(x, b) }\nM(q, c)")
        .assertAnalyze("qubit[2] q\nbit[2] c\n"
            + "gate M(x, b: bit) { Measure(x, b) }\nM(q, c)");
    // Only single-qubit positions must agree in size
    qs("qubit[2] a\nqubit[3] r\n"
        + "gate F(x, s: qubit[3]) { CNot(x, s[0]) }\nF(a, r)")
        .assertAnalyze(inlines("[]"));
    qs("qubit[2] a\nqubit[3] r\ngate G(x, y) { CNot(x, y) }\nG(a, r)")
        .assertAnalyzeThrows(
            semantic("registers in call to 'G' must have the same size"));
    qs("qubit[3] q\ngate F(s: qubit[2]) { H(s[0]) }\nF(q)")
        .assertAnalyzeThrows(semantic("expected qubit[2], got qubit[3]"));
    qs("qubit q\nbit c\ngate G(x) { H(x) }\nG(c)")
        .assertAnalyzeThrows(
            semantic("expected qubit operand, got bit 'c'"));
  }

  @Test void testModifiers() {
    qs("qubit[2] q\nbit[2] c\nctrl Measure(q[0], q[1], c[0])")
        .assertAnalyzeThrows(
            semantic("modifier 'ctrl' cannot be applied to non-unitary "
                + "operation 'Measure'"));
    qs("qubit q\ninv Reset(q)").assertAnalyzeThrows(
        semantic("modifier 'inv' cannot be applied to non-unitary "
            + "operation 'Reset'"));
    qs("qubit q\ndef f(x: qubit) { H(x) }\ninv f(q)").assertAnalyzeThrows(
        semantic("modifier 'inv' cannot be applied to function 'f'"));
    qs("qubit q\nbit c\n"
        + "gate M(x, b: bit) { H(x); Measure(x, b) }\n"
        + "gate N(x, b: bit) { M(x, b) }\n"
        + "inv N(q, c)").assertAnalyzeThrows(
            semantic("modifier 'inv' cannot be applied to gate 'N', which "
                + "contains a non-unitary operation"));
  }

  @Test void testStaticness() {
    qs("qubit[4] q\nvar n = 3\nfor i in [0:n] { H(q[i]) }")
        .assertAnalyzeThrows(
            semantic("range of a loop that contains quantum operations must "
                + "be known at compile time"));
    qs("qubit q\nvar b = true\nif b { X(q) }").assertAnalyzeThrows(
        semantic("condition that guards quantum operations must be known at "
            + "compile time"));
    qs("qubit q\ngate Rot(t: float, x) { RX(t, x) }\n"
        + "var a = 0.5\nRot(a, q)").assertAnalyzeThrows(
            semantic("argument 't' of gate 'Rot' must be known at compile "
                + "time"));
    qs("qubit q\ndef rot(t: float) { RX(t, q) }\n"
        + "var a = 0.5\nrot(a)").assertAnalyzeThrows(
            semantic("argument 't' of quantum function 'rot' must be known "
                + "at compile time"));

    // A loop with a dynamic bound is fine if it contains no quantum code
    qs("var n = 3\nvar s = 0\nfor i in [0:n] { s += i }")
        .assertAnalyze("var n = 3\nvar s = 0\nfor i in [0:n] { s += i }");
    // A loop with a constant bound may guard quantum code
    qs("qubit[3] q\nconst n = 3\nfor i in [0:n] { H(q[i]) }")
        .assertAnalyze("qubit[3] q\nconst n = 3\n"
            + "for i in [0:n] { H(q[i]) }");
  }

  @Test void testRecursion() {
    qs("qubit q\ngate A(x) { B(x) }\ngate B(x) { A(x) }\nA(q)")
        .assertAnalyzeThrows(
            semantic("recursive definition: A -> B -> A"));
    qs("qubit q\ngate R(x) { R(x) }").assertAnalyzeThrows(
        semantic("recursive definition: R -> R"));
    qs("def f(n: int) -> int {\n  return f(n - 1)\n}").assertAnalyzeThrows(
        semantic("recursive definition: f -> f"));
    qs("class C {\n  def f() -> int { return C.g() }\n"
        + "  def g() -> int { return f() }\n}").assertAnalyzeThrows(
            semantic("recursive definition: C.f -> C.g -> C.f"));
  }

  @Test void testFunctions() {
    qs("var x = 1\ndef f() -> int { return x }").assertAnalyzeThrows(
        semantic("function 'f' cannot refer to variable 'x' of an "
            + "enclosing scope"));
    qs("def f(x) {}").assertAnalyzeThrows(
        semantic("parameter 'x' of function 'f' must have a type"));
    qs("return 1").assertAnalyzeThrows(
        semantic("return outside of function"));
    qs("def f() -> int { return }").assertAnalyzeThrows(
        semantic("function 'f' must return a value of type int"));
    qs("def f() { return 1 }").assertAnalyzeThrows(
        semantic("function 'f' has no return type, so cannot return a "
            + "value"));
    qs("def f() -> int { return 1.5 }").assertAnalyzeThrows(
        semantic("type mismatch: return value must be int, got float"));
    qs("gate G(q) { return }").assertAnalyzeThrows(
        semantic("return is not allowed in gate 'G'"));
    qs("qubit q\ndef f(x: qubit) -> int {\n  H(x)\n  return 1\n}")
        .assertAnalyzeThrows(
            semantic("quantum function 'f' cannot have a return type"));
    qs("qubit q\ndef f() {\n  H(q)\n  return\n}").assertAnalyzeThrows(
        semantic("quantum function 'f' cannot contain 'return'"));
    qs("def f(x: int) -> int { return x }\nvar y = f(1, 2)")
        .assertAnalyzeThrows(semantic("'f' expects 1 argument, got 2"));
    qs("def f() { }\nvar y = f()").assertAnalyzeThrows(
        semantic("'f()' does not return a value"));
  }

  @Test void testStatements() {
    qs("1 + 2").assertAnalyzeThrows(
        semantic("expression statement must be a call"));
    qs("const N = 1\nN = 2").assertAnalyzeThrows(
        semantic("cannot assign to constant 'N'"));
    qs("qubit q\nq = 2").assertAnalyzeThrows(
        semantic("cannot assign to register 'q'"));
    qs("for i in [0:2] { i = 1 }").assertAnalyzeThrows(
        semantic("cannot assign to loop iterator 'i'"));
    qs("var x = 1\nx = \"a\"").assertAnalyzeThrows(
        semantic("type mismatch: cannot assign str to variable 'x' of "
            + "type int"));
    qs("var x = 1\nx += 0.5").assertAnalyzeThrows(
        semantic("type mismatch: cannot assign float to variable 'x' of "
            + "type int"));
    qs("var f = 1.0\nf = 2\nf += 1")
        .assertAnalyze("var f = 1.0\nf = 2\nf += 1");
    qs("if 1 { }").assertAnalyzeThrows(
        semantic("type mismatch: condition must be bool, got int"));
    qs("for i in 3 { }").assertAnalyzeThrows(
        semantic("cannot iterate over value of type int"));
    qs("var e = []").assertAnalyzeThrows(
        semantic("cannot infer the type of 'e'; add a type annotation"));
    qs("var xs = [1, true]").assertAnalyzeThrows(
        semantic("list elements must have the same type; int and bool"));
    qs("var x = \"a\" - 1").assertAnalyzeThrows(
        semantic("operator '-' cannot be applied to str and int"));
    qs("var r = [0:0:5]").assertAnalyzeThrows(
        semantic("range step must not be zero"));
    qs("def f() {\n  def g() {}\n}").assertAnalyzeThrows(
        semantic("functions and gates must be declared at top level or in "
            + "a class"));
    qs("class C { var x = 1 }").assertAnalyzeThrows(
        semantic("class member must be a constant, function or gate"));
  }

  @Test void testCallGraph() {
    final Analyzer.Analysis analysis = analyze("qubit q\n"
        + "class K { const A = 2 }\n"
        + "const B = K.A * 2\n"
        + "gate G(x) { H(x) }\n"
        + "gate F(x) { G(x); RX(B, x) }\n"
        + "F(q)");
    final CallGraph callGraph = analysis.callGraph;
    assertThat(callGraph.successors("F").toString(), is("[G, B]"));
    assertThat(callGraph.successors("B").toString(), is("[K.A]"));
    assertThat(callGraph.reaches("F", "K.A"::equals), is(true));
    assertThat(callGraph.reaches("G", "K.A"::equals), is(false));
  }

  /** Matches an analysis whose symbol table has a given set of inline
   * functions. */
  static Matcher<Analyzer.Analysis> inlines(String expected) {
    return new CustomTypeSafeMatcher<Analyzer.Analysis>("inlines "
        + expected) {
      @Override protected boolean matchesSafely(Analyzer.Analysis item) {
        return item.symbolTable.inlineFunctions.toString().equals(expected);
      }
    };
  }

  @Test void testClassicalFunctionIsNotInlined() {
    qs("def square(n: int) -> int { return n * n }\n"
        + "const nine = square(3)")
        .assertAnalyze(inlines("[]"));
  }
}

// End AnalyzerTest.java
