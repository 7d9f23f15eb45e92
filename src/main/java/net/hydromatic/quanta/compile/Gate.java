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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in gate or quantum operation.
 *
 * <p>Arguments of a call are, in order: control qubits (one per control of
 * the call's {@code ctrl} modifiers), angle parameters, then target qubits
 * and bits.
 */
public enum Gate {
  H(1, 0, "H"),
  X(1, 0, "X"),
  Y(1, 0, "Y"),
  Z(1, 0, "Z"),
  S(1, 0, "S"),
  SDG(1, 0, "Sdg"),
  T(1, 0, "T"),
  TDG(1, 0, "Tdg"),
  SX(1, 0, "SX"),
  ID(1, 0, "Id"),
  RX(1, 1, "RX"),
  RY(1, 1, "RY"),
  RZ(1, 1, "RZ"),
  P(1, 1, "P"),
  U(1, 3, "U"),
  CX(2, 0, "CNot", "CX"),
  CY(2, 0, "CY"),
  CZ(2, 0, "CZ"),
  CH(2, 0, "CH"),
  CP(2, 1, "CP"),
  CRX(2, 1, "CRX"),
  CRY(2, 1, "CRY"),
  CRZ(2, 1, "CRZ"),
  SWAP(2, 0, "Swap"),
  CCX(3, 0, "CCX", "Toffoli"),
  CSWAP(3, 0, "CSwap", "Fredkin"),

  /** Measures a qubit into a bit. Arguments are (qubit, bit). */
  MEASURE(1, 1, 0, false, "Measure"),
  /** Resets a qubit to |0&gt;. */
  RESET(1, 0, 0, false, "Reset"),
  /** Barrier across one or more qubits. */
  BARRIER(-1, 0, 0, false, "Barrier"),
  /** Measures every qubit of a register into the bit of the same index of
   * another register. Arguments are two whole registers. Lowering replaces
   * it with one {@link #MEASURE} per index. */
  MEASURE_ALL(1, 1, 0, false, "measure_all");

  /** Number of target qubits; -1 if variadic. */
  public final int qubitCount;
  /** Number of target bits. */
  public final int bitCount;
  /** Number of angle parameters. */
  public final int paramCount;
  /** Whether the operation is unitary, and therefore may have modifiers. */
  public final boolean unitary;
  /** Names by which the gate is called in source code. */
  public final List<String> sourceNames;

  private static final ImmutableMap<String, Gate> BY_SOURCE_NAME;

  static {
    final ImmutableMap.Builder<String, Gate> b = ImmutableMap.builder();
    for (Gate gate : values()) {
      for (String name : gate.sourceNames) {
        b.put(name, gate);
      }
    }
    BY_SOURCE_NAME = b.build();
  }

  Gate(int qubitCount, int paramCount, String... sourceNames) {
    this(qubitCount, 0, paramCount, true, sourceNames);
  }

  Gate(int qubitCount, int bitCount, int paramCount, boolean unitary,
      String... sourceNames) {
    this.qubitCount = qubitCount;
    this.bitCount = bitCount;
    this.paramCount = paramCount;
    this.unitary = unitary;
    this.sourceNames = ImmutableList.copyOf(sourceNames);
  }

  /** Looks up a gate by the name used in source code, e.g. "CNot";
   * returns null if there is no such gate. */
  public static @Nullable Gate lookup(String sourceName) {
    return BY_SOURCE_NAME.get(sourceName);
  }

  /** Returns the name used in source code, e.g. "CNot". */
  public String sourceName() {
    return sourceNames.get(0);
  }

  /** Whether the gate accepts any number of qubits. */
  public boolean isVariadic() {
    return qubitCount < 0;
  }
}

// End Gate.java
