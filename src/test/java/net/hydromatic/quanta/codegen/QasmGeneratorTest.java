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
package net.hydromatic.quanta.codegen;

import static net.hydromatic.quanta.Matchers.throwsA;
import static net.hydromatic.quanta.Matchers.throwsKind;
import static net.hydromatic.quanta.Qs.assertError;
import static net.hydromatic.quanta.Qs.qs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.compile.CompileException;
import net.hydromatic.quanta.compile.Gate;
import net.hydromatic.quanta.compile.Prop;
import net.hydromatic.quanta.ir.Circuit;
import net.hydromatic.quanta.ir.Operand;
import net.hydromatic.quanta.ir.Operation;
import net.hydromatic.quanta.ir.RegisterFact;
import net.hydromatic.quanta.type.RegisterType;
import org.junit.jupiter.api.Test;

/** Tests {@link QasmGenerator} and {@link GateTable}. */
public class QasmGeneratorTest {
  private static final List<RegisterFact> Q2 =
      ImmutableList.of(RegisterFact.of("q", RegisterType.Kind.QUBIT, 2));

  private static String generate(List<RegisterFact> registers,
      Operation... operations) {
    return new QasmGenerator(GateTable.OPENQASM3, ImmutableMap.of())
        .generate(Circuit.of(registers, ImmutableList.copyOf(operations)));
  }

  private static Operation op(Gate gate, List<Double> params,
      List<Modifier> modifiers, Operand... operands) {
    return Operation.of(gate, params, ImmutableList.copyOf(operands),
        modifiers);
  }

  private static Operand q(int i) {
    return Operand.of("q", i);
  }

  @Test void testEmptyCircuit() {
    assertThat(generate(ImmutableList.of()),
        is("OPENQASM 3;\ninclude \"stdgates.inc\";\n"));
    assertThat(generate(Q2),
        is("OPENQASM 3;\ninclude \"stdgates.inc\";\n\nqubit[2] q;\n"));
  }

  @Test void testModifiers() {
    final String qasm =
        generate(
            ImmutableList.of(
                RegisterFact.of("q", RegisterType.Kind.QUBIT, 4)),
            op(Gate.X, ImmutableList.of(), ImmutableList.of(Modifier.CTRL),
                q(0), q(1)),
            op(Gate.X, ImmutableList.of(),
                ImmutableList.of(Modifier.ctrl(2)), q(0), q(1), q(2)),
            op(Gate.S, ImmutableList.of(), ImmutableList.of(Modifier.INV),
                q(3)),
            op(Gate.RZ, ImmutableList.of(0.5),
                ImmutableList.of(Modifier.ctrl(2), Modifier.CTRL,
                    Modifier.INV),
                q(0), q(1), q(2), q(3)));
    assertThat(qasm,
        is("OPENQASM 3;\n"
            + "include \"stdgates.inc\";\n"
            + "\n"
            + "qubit[4] q;\n"
            + "\n"
            + "ctrl @ x q[0], q[1];\n"
            + "ctrl(2) @ x q[0], q[1], q[2];\n"
            + "inv @ s q[3];\n"
            + "ctrl(2) @ ctrl @ inv @ rz(0.5) q[0], q[1], q[2], q[3];\n"));
  }

  @Test void testAngles() {
    assertThat(QasmGenerator.angle(0.5), is("0.5"));
    assertThat(QasmGenerator.angle(0), is("0.0"));
    assertThat(QasmGenerator.angle(-2), is("-2.0"));
    assertThat(QasmGenerator.angle(1e-7), is("0.0000001"));
    assertThat(QasmGenerator.angle(Math.PI), is("3.141592653589793"));
    assertThat(QasmGenerator.angle(1e20), is("100000000000000000000"));

    final String qasm =
        generate(Q2,
            op(Gate.U, ImmutableList.of(0.0, Math.PI / 2, -0.25),
                ImmutableList.of(), q(1)));
    assertThat(qasm.endsWith("\nU(0.0, 1.5707963267948966, -0.25) q[1];\n"),
        is(true));
  }

  @Test void testSeparateMeasurements() {
    final List<RegisterFact> registers =
        ImmutableList.of(RegisterFact.of("q", RegisterType.Kind.QUBIT, 2),
            RegisterFact.of("c", RegisterType.Kind.BIT, 2));
    final Operation[] operations = {
        op(Gate.H, ImmutableList.of(), ImmutableList.of(), q(0)),
        op(Gate.MEASURE, ImmutableList.of(), ImmutableList.of(), q(0),
            Operand.of("c", 0)),
        op(Gate.MEASURE, ImmutableList.of(), ImmutableList.of(), q(1),
            Operand.of("c", 1)),
        op(Gate.RESET, ImmutableList.of(), ImmutableList.of(), q(0)),
    };
    final Circuit circuit = Circuit.of(registers,
        ImmutableList.copyOf(operations));
    final String header = "OPENQASM 3;\n"
        + "include \"stdgates.inc\";\n"
        + "\n"
        + "qubit[2] q;\n"
        + "bit[2] c;\n"
        + "\n";
    assertThat(
        new QasmGenerator(GateTable.OPENQASM3, ImmutableMap.of())
            .generate(circuit),
        is(header
            + "h q[0];\n"
            + "\n"
            + "measure q[0] -> c[0];\n"
            + "measure q[1] -> c[1];\n"
            + "\n"
            + "reset q[0];\n"));

    final Map<Prop, Object> props = new HashMap<>();
    Prop.SEPARATE_MEASUREMENTS.set(props, false);
    Prop.INCLUDE_FILE.set(props, "qelib1.inc");
    assertThat(new QasmGenerator(GateTable.OPENQASM3, props).generate(circuit),
        is(header.replace("stdgates.inc", "qelib1.inc")
            + "h q[0];\n"
            + "measure q[0] -> c[0];\n"
            + "measure q[1] -> c[1];\n"
            + "reset q[0];\n"));
  }

  @Test void testBarrier() {
    assertThat(
        generate(Q2,
            op(Gate.BARRIER, ImmutableList.of(), ImmutableList.of(), q(0),
                q(1))).endsWith("\nbarrier q[0], q[1];\n"),
        is(true));
  }

  @Test void testMismatch() {
    // Missing angle
    assertError(() ->
            generate(Q2,
                op(Gate.RX, ImmutableList.of(), ImmutableList.of(), q(0))),
        throwsKind(CompileException.Kind.INTERNAL,
            "operation 'RX [q[0]]' does not match instruction rx/1/1"));
    // Missing control qubit
    assertError(() ->
            generate(Q2,
                op(Gate.X, ImmutableList.of(), ImmutableList.of(Modifier.CTRL),
                    q(0))),
        throwsKind(CompileException.Kind.INTERNAL,
            "operation 'ctrl X [q[0]]' does not match instruction x/1/0"));
  }

  @Test void testGateTable() {
    final GateTable table = GateTable.builder()
        .add(Gate.H, "hadamard")
        .add(Gate.CX, "cnot", 2, 0)
        .build();
    assertThat(table.contains(Gate.H), is(true));
    assertThat(table.contains(Gate.X), is(false));
    assertThat(table.get(Gate.CX).toString(), is("cnot/2/0"));
    assertError(() -> table.get(Gate.X),
        throwsA("no instruction for gate X"));

    // Every operation that can reach the generator has an instruction
    for (Gate gate : Gate.values()) {
      assertThat(gate.toString(), GateTable.OPENQASM3.contains(gate),
          is(gate != Gate.MEASURE_ALL));
    }
    assertThat(GateTable.OPENQASM3.get(Gate.BARRIER).toString(),
        is("barrier/-1/0"));
  }

  @Test void testBell() {
    qs("qubit[2] q\n"
        + "bit[2] c\n"
        + "gate Bell(a, b) { H(a); CNot(a, b) }\n"
        + "Bell(q[0], q[1])\n"
        + "measure_all(q, c)")
        .assertQasm("OPENQASM 3;\n"
            + "include \"stdgates.inc\";\n"
            + "\n"
            + "qubit[2] q;\n"
            + "bit[2] c;\n"
            + "\n"
            + "h q[0];\n"
            + "cx q[0], q[1];\n"
            + "\n"
            + "measure q[0] -> c[0];\n"
            + "measure q[1] -> c[1];\n");
  }
}

// End QasmGeneratorTest.java
