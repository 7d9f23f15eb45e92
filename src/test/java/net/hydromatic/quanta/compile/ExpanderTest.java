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

import static net.hydromatic.quanta.Matchers.throwsKind;
import static net.hydromatic.quanta.Qs.qs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.compile.CompileException.Kind;
import net.hydromatic.quanta.parse.QuantaParser;
import org.junit.jupiter.api.Test;

/** Tests {@link Expander} and its passes. */
public class ExpanderTest {
  @Test void testInlineGateMacro() {
    qs("qubit[2] q\n"
        + "bit[2] c\n"
        + "gate Bell(a, b) { H(a); CNot(a, b) }\n"
        + "Bell(q[0], q[1])\n"
        + "measure_all(q, c)")
        .assertExpand("qubit[2] q\n"
            + "bit[2] c\n"
            + "H(q[0])\n"
            + "CNot(q[0], q[1])\n"
            + "measure_all(q, c)");
  }

  @Test void testInlineNested() {
    // Calls are inlined depth-first, left to right
    qs("qubit[2] q\n"
        + "gate A(x) { H(x) }\n"
        + "gate B(x, y) { A(x); X(y); A(y) }\n"
        + "B(q[1], q[0])\n"
        + "A(q[0])")
        .assertExpand("qubit[2] q\n"
            + "H(q[1])\n"
            + "X(q[0])\n"
            + "H(q[0])\n"
            + "H(q[0])");
  }

  @Test void testInlineBroadcast() {
    // A register passed to a qubit parameter expands once per element
    qs("qubit[2] q\n"
        + "qubit[2] r\n"
        + "gate G(a, b) { H(a); CNot(a, b) }\n"
        + "G(q, r)")
        .assertExpand("qubit[2] q\n"
            + "qubit[2] r\n"
            + "H(q[0])\n"
            + "CNot(q[0], r[0])\n"
            + "H(q[1])\n"
            + "CNot(q[1], r[1])");

    // A register parameter receives the whole register in each copy
    qs("qubit[2] t\n"
        + "qubit[3] q\n"
        + "gate F(a, r: qubit[3]) { CNot(a, r[2]) }\n"
        + "F(t, q)")
        .assertExpand("qubit[2] t\n"
            + "qubit[3] q\n"
            + "CNot(t[0], q[2])\n"
            + "CNot(t[1], q[2])");

    // Controls broadcast too, and each copy keeps its modifiers
    qs("qubit[2] c\n"
        + "qubit[2] q\n"
        + "gate G(a) { T(a); S(a) }\n"
        + "ctrl inv G(c, q)")
        .assertExpand("qubit[2] c\n"
            + "qubit[2] q\n"
            + "ctrl inv S(c[0], q[0])\n"
            + "ctrl inv T(c[0], q[0])\n"
            + "ctrl inv S(c[1], q[1])\n"
            + "ctrl inv T(c[1], q[1])");

    // An unsized qubit is a register of one element
    qs("qubit q\n"
        + "def flip(x: qubit) { X(x) }\n"
        + "flip(q)")
        .assertExpand("qubit q\nX(q[0])");

    qs("qubit[2] q\n"
        + "qubit[3] r\n"
        + "gate G(a, b) { CNot(a, b) }\n"
        + "G(q, r)")
        .assertExpandThrows(
            throwsKind(Kind.SEMANTIC,
                "registers in call to 'G' must have the same size"));
  }

  @Test void testInlineQuantumFunction() {
    qs("qubit[2] q\n"
        + "def rot(k: int) {\n"
        + "  var t = k * 0.5\n"
        + "  RX(t, q[k])\n"
        + "}\n"
        + "rot(0)\n"
        + "rot(1)")
        .assertExpand("qubit[2] q\n"
            + "var t$1 = 0 * 0.5\n"
            + "RX(0.0, q[0])\n"
            + "var t$2 = 1 * 0.5\n"
            + "RX(0.5, q[1])");
  }

  @Test void testAnglesAreFolded() {
    qs("qubit q\n"
        + "class Ops { const theta = pi / 2 }\n"
        + "RX(Ops.theta, q)\n"
        + "RY(1, q)\n"
        + "U(0, pi, 2 * pi, q)")
        .assertExpand("qubit q\n"
            + "RX(1.5707963267948966, q)\n"
            + "RY(1.0, q)\n"
            + "U(0.0, 3.141592653589793, 6.283185307179586, q)");
  }

  @Test void testUnrollLoop() {
    qs("qubit[3] q\nfor i in [0:3] { H(q[i]) }")
        .assertExpand("qubit[3] q\nH(q[0])\nH(q[1])\nH(q[2])");
    qs("qubit[3] q\nfor i in [2:-1:-1] { H(q[i]) }")
        .assertExpand("qubit[3] q\nH(q[2])\nH(q[1])\nH(q[0])");
    qs("qubit q\nfor t in [0.5, 1.5] { RZ(t, q) }")
        .assertExpand("qubit q\nRZ(0.5, q)\nRZ(1.5, q)");
    qs("qubit q\nfor i in [0:0] { H(q) }")
        .assertExpand("qubit q");
  }

  @Test void testUnrollNestedLoops() {
    qs("qubit[2] q\n"
        + "for i in [0:2] {\n"
        + "  for j in [0:2] {\n"
        + "    RX(i * 2 + j, q[i])\n"
        + "  }\n"
        + "}")
        .assertExpand("qubit[2] q\n"
            + "RX(0.0, q[0])\n"
            + "RX(1.0, q[0])\n"
            + "RX(2.0, q[1])\n"
            + "RX(3.0, q[1])");
  }

  @Test void testClassicalStatementsRunInOrder() {
    qs("qubit q\n"
        + "var s = 0\n"
        + "for i in [0:3] { s += i }\n"
        + "RX(s, q)")
        .assertExpand("qubit q\n"
            + "var s = 0\n"
            + "s += 0\n"
            + "s += 1\n"
            + "s += 2\n"
            + "RX(3.0, q)");
  }

  @Test void testConditional() {
    qs("qubit q\n"
        + "const flip = true\n"
        + "if flip { X(q) } else { Z(q) }")
        .assertExpand("qubit q\nconst flip = true\nX(q)");
    qs("qubit q\n"
        + "const n = 2\n"
        + "if n == 1 {\n"
        + "  X(q)\n"
        + "} elif n == 2 {\n"
        + "  Y(q)\n"
        + "} else {\n"
        + "  Z(q)\n"
        + "}")
        .assertExpand("qubit q\nconst n = 2\nY(q)");
  }

  @Test void testCtrl() {
    qs("qubit[2] q\n"
        + "gate G(a) { X(a) }\n"
        + "ctrl G(q[0], q[1])")
        .assertExpand("qubit[2] q\nctrl X(q[0], q[1])");

    // Modifiers of the block come before those of the call; controls of the
    // block come before the call's arguments
    qs("qubit[4] q\n"
        + "gate CG(a, b) { ctrl S(a, b) }\n"
        + "ctrl[2] CG(q[0], q[1], q[2], q[3])")
        .assertExpand("qubit[4] q\n"
            + "ctrl[2] ctrl S(q[0], q[1], q[2], q[3])");
  }

  @Test void testInvReversesBody() {
    qs("qubit[2] q\n"
        + "gate G(a, b) { H(a); CNot(a, b); S(b) }\n"
        + "inv G(q[0], q[1])")
        .assertExpand("qubit[2] q\n"
            + "inv S(q[1])\n"
            + "inv CNot(q[0], q[1])\n"
            + "inv H(q[0])");
  }

  @Test void testInvParity() {
    // Two inv modifiers cancel out, and the body keeps its order
    qs("qubit[2] q\n"
        + "gate G(a, b) { H(a); CNot(a, b) }\n"
        + "inv inv G(q[0], q[1])")
        .assertExpand("qubit[2] q\nH(q[0])\nCNot(q[0], q[1])");

    // The inv of a nested call is moved after all ctrl modifiers
    qs("qubit[3] q\n"
        + "gate CG(a, b) { ctrl S(a, b) }\n"
        + "inv ctrl CG(q[0], q[1], q[2])")
        .assertExpand("qubit[3] q\n"
            + "ctrl ctrl inv S(q[0], q[1], q[2])");

    // Inside a reversed block, a block with its own inv is reversed again
    qs("qubit q\n"
        + "gate A(a) { T(a); S(a) }\n"
        + "gate B(a) { H(a); inv A(a) }\n"
        + "inv B(q)")
        .assertExpand("qubit q\n"
            + "T(q[0])\n"
            + "S(q[0])\n"
            + "inv H(q[0])");
  }

  @Test void testClassicalCodeInModifiedBlockIsDropped() {
    qs("qubit q\n"
        + "gate G(a) {\n"
        + "  var t = 0.25\n"
        + "  RX(t, a)\n"
        + "  H(a)\n"
        + "}\n"
        + "inv G(q)")
        .assertExpand("qubit q\ninv H(q[0])\ninv RX(0.25, q[0])");
  }

  @Test void testExpandIsIdempotent() {
    final String source = "qubit[3] q\n"
        + "bit[3] c\n"
        + "var k = 1\n"
        + "gate G(a, b) { H(a); CNot(a, b) }\n"
        + "for i in [0:2] { inv G(q[i], q[i + 1]) }\n"
        + "ctrl RZ(q[0], k * pi, q[k])\n"
        + "measure_all(q, c)";
    final Analyzer.Analysis analysis =
        Analyzer.analyze(QuantaParser.parse("stdIn", source),
            ImmutableMap.of());
    final Ast.Program expanded =
        Expander.expand(analysis, ImmutableMap.of(), Tracers.empty());
    final Ast.Program expanded2 =
        Expander.expand(analysis.symbolTable, expanded, ImmutableMap.of(),
            Tracers.empty());
    assertThat(expanded2.toString(), is(expanded.toString()));
    assertThat(expanded.toString(),
        is("qubit[3] q\n"
            + "bit[3] c\n"
            + "var k = 1\n"
            + "inv CNot(q[0], q[1])\n"
            + "inv H(q[0])\n"
            + "inv CNot(q[1], q[2])\n"
            + "inv H(q[1])\n"
            + "ctrl RZ(q[0], 3.141592653589793, q[1])\n"
            + "measure_all(q, c)"));
  }

  @Test void testTracerSeesEachPass() {
    final List<String> passes = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    for (int pass = 1; pass <= 3; pass++) {
      final int p = pass;
      tracer = Tracers.withOnExpand(tracer, pass, program ->
          passes.add(p + ": " + program.toString().replace("\n", "; ")));
    }
    qs("qubit[2] q\n"
        + "gate G(a) { S(a) }\n"
        + "for i in [0:2] { inv G(q[i]) }")
        .withTracer(tracer)
        .assertExpand("qubit[2] q\ninv S(q[0])\ninv S(q[1])");
    assertThat(passes.size(), is(3));
    assertThat(passes.get(0),
        is("1: qubit[2] q; for i$1 in [0:2] { inv () { S(q[i$1]) } }"));
    assertThat(passes.get(2), is("3: qubit[2] q; inv S(q[0]); inv S(q[1])"));
  }

  @Test void testLimits() {
    qs("qubit q\nfor i in [0:10] { H(q) }")
        .withProp(Prop.MAX_UNROLL_COUNT, 5)
        .assertExpandThrows(
            throwsKind(Kind.SEMANTIC, "range has 10 elements; limit is 5"));
    qs("qubit q\nconst xs = [1, 2, 3]\nfor x in xs { RX(x, q) }")
        .withProp(Prop.MAX_UNROLL_COUNT, 2)
        .assertExpandThrows(
            throwsKind(Kind.SEMANTIC, "loop has 3 iterations; limit is 2"));
    qs("qubit q\nfor i in [0:5] { H(q) }")
        .withProp(Prop.MAX_UNROLL_COUNT, 5)
        .assertExpand("qubit q\nH(q)\nH(q)\nH(q)\nH(q)\nH(q)");

    final String chain = "qubit q\n"
        + "gate A(x) { H(x) }\n"
        + "gate B(x) { A(x) }\n"
        + "gate C(x) { B(x) }\n"
        + "C(q)";
    qs(chain).withProp(Prop.MAX_INLINE_DEPTH, 2)
        .assertExpandThrows(
            throwsKind(Kind.EXPANSION,
                "inlining 'A' exceeds maximum depth 2"));
    qs(chain).withProp(Prop.MAX_INLINE_DEPTH, 3)
        .assertExpand("qubit q\nH(q[0])");
  }

  @Test void testEvaluationErrors() {
    // A dynamic index is folded; lowering checks its range
    qs("qubit[2] q\nvar k = 2\nH(q[k])")
        .assertExpand("qubit[2] q\nvar k = 2\nH(q[2])");
    qs("qubit q\nvar z = 0\nRX(1 / z, q)")
        .assertExpandThrows(throwsKind(Kind.SEMANTIC, "division by zero"));
  }
}

// End ExpanderTest.java
