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

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.ast.Pos;
import net.hydromatic.quanta.compile.CompileException;
import net.hydromatic.quanta.compile.Gate;
import net.hydromatic.quanta.compile.Prop;
import net.hydromatic.quanta.ir.Circuit;
import net.hydromatic.quanta.ir.Operand;
import net.hydromatic.quanta.ir.Operation;
import net.hydromatic.quanta.ir.RegisterFact;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates OpenQASM 3 text from a {@link Circuit}.
 *
 * <p>The output has a header, one declaration per register, and one
 * statement per operation, with a blank line between sections. If
 * {@link Prop#SEPARATE_MEASUREMENTS} is set, each run of consecutive
 * {@code measure} statements is separated from its neighbors by a blank
 * line.
 *
 * <p>Identical input gives identical output.
 */
public class QasmGenerator {
  private final GateTable gateTable;
  private final Map<Prop, Object> props;

  public QasmGenerator(GateTable gateTable, Map<Prop, Object> props) {
    this.gateTable = requireNonNull(gateTable);
    this.props = requireNonNull(props);
  }

  /** Generates the text of a program. */
  public String generate(Circuit circuit) {
    final StringBuilder b = new StringBuilder();
    b.append("OPENQASM 3;\n")
        .append("include \"")
        .append(Prop.INCLUDE_FILE.stringValue(props))
        .append("\";\n");
    if (!circuit.registers.isEmpty()) {
      b.append('\n');
      for (RegisterFact register : circuit.registers) {
        b.append(register.kind.moniker)
            .append('[').append(register.size).append("] ")
            .append(register.name).append(";\n");
      }
    }
    if (!circuit.operations.isEmpty()) {
      b.append('\n');
      final boolean separate =
          Prop.SEPARATE_MEASUREMENTS.booleanValue(props);
      @Nullable Operation previous = null;
      for (Operation operation : circuit.operations) {
        if (separate
            && previous != null
            && isMeasure(previous) != isMeasure(operation)) {
          b.append('\n');
        }
        operation(b, operation);
        b.append(";\n");
        previous = operation;
      }
    }
    return b.toString();
  }

  private static boolean isMeasure(Operation operation) {
    return operation.gate == Gate.MEASURE;
  }

  /** Writes an operation, without the trailing semicolon. */
  private void operation(StringBuilder b, Operation operation) {
    final GateTable.Entry entry = gateTable.get(operation.gate);
    final int controlCount = operation.controlCount();
    if (operation.params.size() != entry.paramCount
        || entry.operandCount >= 0
            && operation.operands.size()
                != controlCount + entry.operandCount) {
      throw new CompileException("operation '" + operation + "' does not "
          + "match instruction " + entry, Pos.ZERO);
    }
    for (Modifier modifier : operation.modifiers) {
      switch (modifier.kind) {
        case CTRL:
          b.append("ctrl");
          if (modifier.count > 1) {
            b.append('(').append(modifier.count).append(')');
          }
          b.append(" @ ");
          break;
        case INV:
          b.append("inv @ ");
          break;
        default:
          throw new AssertionError(modifier);
      }
    }
    b.append(entry.mnemonic);
    if (!operation.params.isEmpty()) {
      b.append('(');
      for (int i = 0; i < operation.params.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(angle(operation.params.get(i)));
      }
      b.append(')');
    }
    b.append(' ');
    if (operation.gate == Gate.MEASURE) {
      b.append(operation.operands.get(0))
          .append(" -> ")
          .append(operation.operands.get(1));
    } else {
      operands(b, operation.operands);
    }
  }

  private static void operands(StringBuilder b, List<Operand> operands) {
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(operands.get(i));
    }
  }

  /** Formats an angle; for example, 0.5 becomes "0.5" and 1E-7 becomes
   * "0.0000001". */
  static String angle(double d) {
    BigDecimal b = BigDecimal.valueOf(d);
    if (b.scale() > 1) {
      b = b.stripTrailingZeros();
    }
    return b.toPlainString();
  }
}

// End QasmGenerator.java
