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
package net.hydromatic.quanta.type;

import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;

/** Type of a register of qubits or bits, such as {@code qubit[3]}.
 *
 * <p>The type of a register parameter may be unsized, written
 * {@code qubit[]}; it accepts registers of any size. */
public class RegisterType implements Type {
  /** Size of an unsized register type. */
  public static final int UNSIZED = -1;

  public final Kind kind;
  public final int size;

  public RegisterType(Kind kind, int size) {
    this.kind = requireNonNull(kind);
    this.size = size;
  }

  public static RegisterType of(Kind kind, int size) {
    return new RegisterType(kind, size);
  }

  /** Returns the type of an element, {@code qubit} or {@code bit}. */
  public PrimitiveType elementType() {
    return kind.elementType;
  }

  public boolean isSized() {
    return size != UNSIZED;
  }

  @Override
  public String moniker() {
    return kind.moniker + "[" + (isSized() ? Integer.toString(size) : "")
        + "]";
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public boolean isQuantum() {
    return true;
  }

  @Override
  public boolean accepts(Type from) {
    return from instanceof RegisterType
        && ((RegisterType) from).kind == kind
        && (size == UNSIZED || size == ((RegisterType) from).size);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, size);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RegisterType
            && kind == ((RegisterType) o).kind
            && size == ((RegisterType) o).size;
  }

  /** Kind of register. */
  public enum Kind {
    QUBIT(PrimitiveType.QUBIT),
    BIT(PrimitiveType.BIT);

    /** The name in the language, e.g. {@code qubit}. */
    public final String moniker = name().toLowerCase(Locale.ROOT);
    public final PrimitiveType elementType;

    Kind(PrimitiveType elementType) {
      this.elementType = elementType;
    }
  }
}

// End RegisterType.java
