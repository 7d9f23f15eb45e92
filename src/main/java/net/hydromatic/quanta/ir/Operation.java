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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.compile.Gate;

/**
 * One operation in a circuit.
 *
 * <p>Operands are ordered as in OpenQASM: control qubits (one per
 * {@code ctrl} count, outermost modifier first), then target qubits, then
 * bits. Modifiers are normalized (see {@link Modifier#normalize(List)}).
 */
public final class Operation {
  public final Gate gate;
  public final ImmutableList<Double> params;
  public final ImmutableList<Operand> operands;
  public final ImmutableList<Modifier> modifiers;

  private Operation(Gate gate, ImmutableList<Double> params,
      ImmutableList<Operand> operands, ImmutableList<Modifier> modifiers) {
    this.gate = requireNonNull(gate);
    this.params = requireNonNull(params);
    this.operands = requireNonNull(operands);
    this.modifiers = requireNonNull(modifiers);
  }

  public static Operation of(Gate gate, List<Double> params,
      List<Operand> operands, List<Modifier> modifiers) {
    return new Operation(gate, ImmutableList.copyOf(params),
        ImmutableList.copyOf(operands), ImmutableList.copyOf(modifiers));
  }

  /** Number of leading operands that are control qubits. */
  public int controlCount() {
    return Modifier.controlCount(modifiers);
  }

  @Override
  public int hashCode() {
    return Objects.hash(gate, params, operands, modifiers);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Operation
            && gate == ((Operation) o).gate
            && params.equals(((Operation) o).params)
            && operands.equals(((Operation) o).operands)
            && modifiers.equals(((Operation) o).modifiers);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Modifier modifier : modifiers) {
      b.append(modifier).append(' ');
    }
    b.append(gate.sourceName());
    if (!params.isEmpty()) {
      b.append(params);
    }
    return b.append(' ').append(operands).toString();
  }
}

// End Operation.java
