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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Reference to one qubit or bit: a register name and an index. */
public final class Operand {
  public final String register;
  public final int index;

  private Operand(String register, int index) {
    this.register = requireNonNull(register);
    this.index = index;
    checkArgument(index >= 0, "negative index %s", index);
  }

  public static Operand of(String register, int index) {
    return new Operand(register, index);
  }

  @Override
  public int hashCode() {
    return Objects.hash(register, index);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Operand
            && register.equals(((Operand) o).register)
            && index == ((Operand) o).index;
  }

  /** Returns the operand as it appears in OpenQASM, e.g. "q[0]". */
  @Override
  public String toString() {
    return register + "[" + index + "]";
  }
}

// End Operand.java
