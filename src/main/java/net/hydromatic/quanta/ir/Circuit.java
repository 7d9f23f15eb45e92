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

/** Lowered program: registers in declaration order, and a linear sequence
 * of operations on them. */
public final class Circuit {
  public final ImmutableList<RegisterFact> registers;
  public final ImmutableList<Operation> operations;

  private Circuit(ImmutableList<RegisterFact> registers,
      ImmutableList<Operation> operations) {
    this.registers = requireNonNull(registers);
    this.operations = requireNonNull(operations);
  }

  public static Circuit of(List<RegisterFact> registers,
      List<Operation> operations) {
    return new Circuit(ImmutableList.copyOf(registers),
        ImmutableList.copyOf(operations));
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    registers.forEach(r -> b.append(r).append('\n'));
    operations.forEach(o -> b.append(o).append('\n'));
    return b.toString();
  }
}

// End Circuit.java
