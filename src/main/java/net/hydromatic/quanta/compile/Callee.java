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

import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a call refers to.
 *
 * <p>The parser creates every call with callee {@link #UNRESOLVED}; semantic
 * analysis resolves it exactly once. A callee never references a declaration
 * directly; a gate-macro or function is identified by its key in the
 * {@link SymbolTable}.
 */
public final class Callee {
  public static final Callee UNRESOLVED =
      new Callee(Kind.UNRESOLVED, null, null, null);

  public final Kind kind;
  public final @Nullable Gate gate;
  public final @Nullable BuiltIn builtIn;
  /** Key of a gate-macro or function in the symbol table. */
  public final @Nullable String key;

  private Callee(Kind kind, @Nullable Gate gate, @Nullable BuiltIn builtIn,
      @Nullable String key) {
    this.kind = requireNonNull(kind);
    this.gate = gate;
    this.builtIn = builtIn;
    this.key = key;
  }

  public static Callee gate(Gate gate) {
    return new Callee(Kind.GATE, requireNonNull(gate), null, null);
  }

  public static Callee gateMacro(String key) {
    return new Callee(Kind.GATE_MACRO, null, null, requireNonNull(key));
  }

  public static Callee function(String key) {
    return new Callee(Kind.FUNCTION, null, null, requireNonNull(key));
  }

  public static Callee builtIn(BuiltIn builtIn) {
    return new Callee(Kind.BUILT_IN, null, requireNonNull(builtIn), null);
  }

  /** Returns the gate; throws if this is not a gate. */
  public Gate gate() {
    if (gate == null) {
      throw new IllegalStateException("not a gate: " + this);
    }
    return gate;
  }

  /** Returns the key; throws if this is not a gate-macro or function. */
  public String key() {
    if (key == null) {
      throw new IllegalStateException("not a gate-macro or function: "
          + this);
    }
    return key;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, gate, builtIn, key);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Callee
            && kind == ((Callee) o).kind
            && gate == ((Callee) o).gate
            && builtIn == ((Callee) o).builtIn
            && Objects.equals(key, ((Callee) o).key);
  }

  @Override
  public String toString() {
    switch (kind) {
      case GATE:
        return "gate " + gate;
      case BUILT_IN:
        return "built-in " + builtIn;
      case UNRESOLVED:
        return "unresolved";
      default:
        return kind.name().toLowerCase(Locale.ROOT) + " " + key;
    }
  }

  /** Kind of callee. */
  public enum Kind {
    UNRESOLVED,
    GATE,
    GATE_MACRO,
    FUNCTION,
    BUILT_IN
  }
}

// End Callee.java
