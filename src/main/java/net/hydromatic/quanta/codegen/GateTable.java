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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.quanta.compile.Gate;

/**
 * Maps each {@link Gate} to the mnemonic and arity of the corresponding
 * instruction in the target language.
 *
 * <p>Immutable; {@link #OPENQASM3} is the table for OpenQASM 3 with the
 * standard gate library.
 */
public final class GateTable {
  /** Table for OpenQASM 3 and "stdgates.inc". */
  public static final GateTable OPENQASM3 =
      builder()
          .add(Gate.H, "h")
          .add(Gate.X, "x")
          .add(Gate.Y, "y")
          .add(Gate.Z, "z")
          .add(Gate.S, "s")
          .add(Gate.SDG, "sdg")
          .add(Gate.T, "t")
          .add(Gate.TDG, "tdg")
          .add(Gate.SX, "sx")
          .add(Gate.ID, "id")
          .add(Gate.RX, "rx")
          .add(Gate.RY, "ry")
          .add(Gate.RZ, "rz")
          .add(Gate.P, "p")
          .add(Gate.U, "U")
          .add(Gate.CX, "cx")
          .add(Gate.CY, "cy")
          .add(Gate.CZ, "cz")
          .add(Gate.CH, "ch")
          .add(Gate.CP, "cp")
          .add(Gate.CRX, "crx")
          .add(Gate.CRY, "cry")
          .add(Gate.CRZ, "crz")
          .add(Gate.SWAP, "swap")
          .add(Gate.CCX, "ccx")
          .add(Gate.CSWAP, "cswap")
          .add(Gate.MEASURE, "measure")
          .add(Gate.RESET, "reset")
          .add(Gate.BARRIER, "barrier")
          .build();

  private final ImmutableMap<Gate, Entry> entries;

  private GateTable(Map<Gate, Entry> entries) {
    this.entries = ImmutableMap.copyOf(entries);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the entry for a gate. Throws if the gate has no entry. */
  public Entry get(Gate gate) {
    final Entry entry = entries.get(gate);
    if (entry == null) {
      throw new IllegalArgumentException("no instruction for gate " + gate);
    }
    return entry;
  }

  /** Whether this table has an entry for a gate. */
  public boolean contains(Gate gate) {
    return entries.containsKey(gate);
  }

  /** Target instruction for a gate. */
  public static final class Entry {
    public final String mnemonic;
    /** Number of operands, not including control qubits added by
     * {@code ctrl} modifiers; -1 if the instruction takes any number. */
    public final int operandCount;
    public final int paramCount;

    Entry(String mnemonic, int operandCount, int paramCount) {
      this.mnemonic = requireNonNull(mnemonic);
      this.operandCount = operandCount;
      this.paramCount = paramCount;
    }

    @Override
    public String toString() {
      return mnemonic + "/" + operandCount + "/" + paramCount;
    }
  }

  /** Builder for {@link GateTable}. */
  public static final class Builder {
    private final Map<Gate, Entry> entries = new EnumMap<>(Gate.class);

    /** Adds a gate, with the arity of its source-language definition. */
    @CanIgnoreReturnValue
    public Builder add(Gate gate, String mnemonic) {
      return add(gate, mnemonic,
          gate.isVariadic() ? -1 : gate.qubitCount + gate.bitCount,
          gate.paramCount);
    }

    @CanIgnoreReturnValue
    public Builder add(Gate gate, String mnemonic, int operandCount,
        int paramCount) {
      entries.put(gate, new Entry(mnemonic, operandCount, paramCount));
      return this;
    }

    public GateTable build() {
      return new GateTable(entries);
    }
  }
}

// End GateTable.java
