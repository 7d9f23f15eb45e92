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
package net.hydromatic.quanta.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Modifier of a gate invocation: {@code ctrl(n)} (controlled by {@code n}
 * qubits) or {@code inv} (inverse).
 *
 * <p>A call holds its modifiers as an ordered list, outermost first. The
 * control qubits of a call are its leading arguments, in the same order as
 * its {@code ctrl} modifiers.
 */
public final class Modifier {
  public static final Modifier INV = new Modifier(Kind.INV, 0);
  public static final Modifier CTRL = new Modifier(Kind.CTRL, 1);

  public final Kind kind;
  /** Number of control qubits; 0 for {@link Kind#INV}. */
  public final int count;

  private Modifier(Kind kind, int count) {
    this.kind = kind;
    this.count = count;
  }

  /** Creates a {@code ctrl(n)} modifier. */
  public static Modifier ctrl(int count) {
    checkArgument(count >= 1, "control count must be positive: %s", count);
    return count == 1 ? CTRL : new Modifier(Kind.CTRL, count);
  }

  /** Returns the total number of control qubits in a list of modifiers. */
  public static int controlCount(List<Modifier> modifiers) {
    int n = 0;
    for (Modifier modifier : modifiers) {
      n += modifier.count;
    }
    return n;
  }

  /**
   * Normalizes a list of modifiers.
   *
   * <p>Every {@code ctrl} keeps its position relative to the other
   * {@code ctrl} modifiers. An even number of {@code inv} modifiers cancels
   * out; an odd number leaves exactly one {@code inv}, after the last
   * {@code ctrl}.
   */
  public static ImmutableList<Modifier> normalize(List<Modifier> modifiers) {
    final ImmutableList.Builder<Modifier> b = ImmutableList.builder();
    int invCount = 0;
    for (Modifier modifier : modifiers) {
      if (modifier.kind == Kind.INV) {
        ++invCount;
      } else {
        b.add(modifier);
      }
    }
    if (invCount % 2 == 1) {
      b.add(INV);
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, count);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Modifier
            && kind == ((Modifier) o).kind
            && count == ((Modifier) o).count;
  }

  /** Returns how the modifier is written in source, e.g. "ctrl[2]". */
  @Override
  public String toString() {
    switch (kind) {
      case INV:
        return "inv";
      default:
        return count == 1 ? "ctrl" : "ctrl[" + count + "]";
    }
  }

  /** Kind of modifier. */
  public enum Kind {
    CTRL,
    INV
  }
}

// End Modifier.java
