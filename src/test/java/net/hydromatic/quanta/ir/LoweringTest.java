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
package net.hydromatic.quanta.ir;

import static net.hydromatic.quanta.Matchers.throwsKind;
import static net.hydromatic.quanta.Qs.qs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.compile.CompileException.Kind;
import net.hydromatic.quanta.compile.Gate;
import net.hydromatic.quanta.compile.Prop;
import net.hydromatic.quanta.type.RegisterType;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests {@link Lowering} and {@link Circuit}. */
public class LoweringTest {
  /** Matches a circuit with a given number of operations. */
  private static Matcher<Circuit> hasOperationCount(int count) {
    return new CustomTypeSafeMatcher<Circuit>("circuit with " + count
        + " operations") {
      @Override protected boolean matchesSafely(Circuit circuit) {
        return circuit.operations.size() == count;
      }
    };
  }

  @Test void testBell() {
    qs("qubit[2] q\n"
        + "bit[2] c\n"
        + "gate Bell(a, b) { H(a); CNot(a, b) }\n"
        + "Bell(q[0], q[1])\n"
        + "measure_all(q, c)")
        .assertCircuit("qubit[2] q\n"
            + "bit[2] c\n"
            + "H [q[0]]\n"
            + "CNot [q[0], q[1]]\n"
            + "Measure [q[0], c[0]]\n"
            + "Measure [q[1], c[1]]\n");
  }

  @Test void testEmpty() {
    qs("").assertCircuit("");
    qs("qubit q\nbit c").assertCircuit("qubit[1] q\nbit[1] c\n");
    qs("var x = 1\nx += 2").assertCircuit(hasOperationCount(0));
  }

  @Test void testBroadcast() {
    qs("qubit[3] q\nH(q)")
        .assertCircuit("qubit[3] q\nH [q[0]]\nH [q[1]]\nH [q[2]]\n");
    qs("qubit[2] a\nqubit[2] b\nCNot(a, b)")
        .assertCircuit("qubit[2] a\n"
            + "qubit[2] b\n"
            + "CNot [a[0], b[0]]\n"
            + "CNot [a[1], b[1]]\n");
    // A single qubit is repeated for each element of a register
    qs("qubit[2] a\nqubit[2] t\nctrl RX(t[0], 0.5, a)")
        .assertCircuit("qubit[2] a\n"
            + "qubit[2] t\n"
            + "ctrl RX[0.5] [t[0], a[0]]\n"
            + "ctrl RX[0.5] [t[0], a[1]]\n");
    qs("qubit[2] q\nReset(q)")
        .assertCircuit("qubit[2] q\nReset [q[0]]\nReset [q[1]]\n");
    qs("qubit[2] q\nbit[2] c\nMeasure(q, c)")
        .assertCircuit("qubit[2] q\n"
            + "bit[2] c\n"
            + "Measure [q[0], c[0]]\n"
            + "Measure [q[1], c[1]]\n");
  }

  @Test void testBarrier() {
    // A barrier is one operation, however many registers it spans
    qs("qubit[2] q\nqubit r\nBarrier(q, r)")
        .assertCircuit("qubit[2] q\nqubit[1] r\nBarrier [q[0], q[1], r[0]]\n");
  }

  @Test void testModifiers() {
    qs("qubit[3] q\n"
        + "gate G(a, b) { ctrl S(a, b) }\n"
        + "inv ctrl G(q[0], q[1], q[2])\n"
        + "inv T(q[0])")
        .assertCircuit("qubit[3] q\n"
            + "ctrl ctrl inv S [q[0], q[1], q[2]]\n"
            + "inv T [q[0]]\n");
  }

  @Test void testClassicalStatementsAreDropped() {
    qs("qubit q\nvar k = 3\nk -= 1\nRX(k, q)")
        .assertCircuit("qubit[1] q\nRX[2.0] [q[0]]\n");
  }

  @Test void testDuplicateQubit() {
    qs("qubit[2] q\nCNot(q[0], q[0])")
        .assertCompileThrows(
            throwsKind(Kind.SEMANTIC,
                "qubit q[0] is used more than once in call to 'CNot'"));
    qs("qubit[2] q\nCNot(q[1], q)")
        .assertCompileThrows(
            throwsKind(Kind.SEMANTIC,
                "qubit q[1] is used more than once in call to 'CNot'"));
    // Two operands may name the same bit
    qs("qubit[2] q\nbit c\nMeasure(q[0], c[0])\nMeasure(q[1], c[0])")
        .assertCircuit(hasOperationCount(2));
  }

  @Test void testIndexOutOfRange() {
    qs("qubit[2] q\nvar k = 2\nH(q[k])")
        .assertCompileThrows(
            throwsKind(Kind.SEMANTIC,
                "index 2 out of range for register q of size 2"));
    qs("qubit[2] q\nvar k = 0\nk -= 1\nH(q[k])")
        .assertCompileThrows(
            throwsKind(Kind.SEMANTIC,
                "index -1 out of range for register q of size 2"));
  }

  @Test void testMaxOperations() {
    qs("qubit[3] q\nH(q)")
        .withProp(Prop.MAX_OPERATIONS, 2)
        .assertCompileThrows(
            throwsKind(Kind.SEMANTIC, "circuit has more than 2 operations"));
    qs("qubit[3] q\nH(q)")
        .withProp(Prop.MAX_OPERATIONS, 3)
        .assertCircuit(hasOperationCount(3));
  }

  @Test void testOperation() {
    final Operation operation =
        Operation.of(Gate.CRX, ImmutableList.of(0.25),
            ImmutableList.of(Operand.of("q", 0), Operand.of("q", 1)),
            ImmutableList.of(Modifier.INV));
    assertThat(operation.toString(), is("inv CRX[0.25] [q[0], q[1]]"));
    assertThat(operation.controlCount(), is(0));
    assertThat(operation,
        is(Operation.of(Gate.CRX, ImmutableList.of(0.25),
            ImmutableList.of(Operand.of("q", 0), Operand.of("q", 1)),
            ImmutableList.of(Modifier.INV))));
    assertThat(RegisterFact.of("c", RegisterType.Kind.BIT, 4).toString(),
        is("bit[4] c"));
  }
}

// End LoweringTest.java
