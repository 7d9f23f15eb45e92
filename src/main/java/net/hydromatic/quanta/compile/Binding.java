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

import net.hydromatic.quanta.type.PrimitiveType;
import net.hydromatic.quanta.type.Type;

/**
 * Binding of a name to a kind of entity and a type.
 *
 * <p>Used in {@link Environment}.
 */
public class Binding {
  /** Name as written in source. */
  public final String name;
  public final Kind kind;
  /** Type of a value; {@link PrimitiveType#UNIT} for functions, gate-macros
   * and classes. */
  public final Type type;
  /** Key in the symbol table and in the rewritten program; for example,
   * "Ops.N" for member "N" of class "Ops". */
  public final String key;
  public final Staticness staticness;
  /** Nesting depth of function and gate-macro bodies at the point of
   * declaration; 0 if declared in the global or a class scope. */
  public final int functionDepth;

  private Binding(String name, Kind kind, Type type, String key,
      Staticness staticness, int functionDepth) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.type = requireNonNull(type);
    this.key = requireNonNull(key);
    this.staticness = requireNonNull(staticness);
    this.functionDepth = functionDepth;
  }

  public static Binding of(String name, Kind kind, Type type, String key,
      Staticness staticness, int functionDepth) {
    return new Binding(name, kind, type, key, staticness, functionDepth);
  }

  /** Creates a binding for a function, gate-macro or class. */
  public static Binding declaration(String name, Kind kind, String key) {
    return new Binding(name, kind, PrimitiveType.UNIT, key,
        Staticness.CONSTANT, 0);
  }

  /** Whether the binding is to a value that a program can read. */
  public boolean isValue() {
    switch (kind) {
      case FUNCTION:
      case GATE_MACRO:
      case CLASS:
        return false;
      default:
        return true;
    }
  }

  @Override
  public String toString() {
    return kind.description + " " + name + ": " + type.moniker();
  }

  /** Kind of binding. */
  public enum Kind {
    REGISTER("register"),
    VARIABLE("variable"),
    CONSTANT("constant"),
    PARAMETER("parameter"),
    ITERATOR("loop iterator"),
    FUNCTION("function"),
    GATE_MACRO("gate"),
    CLASS("class");

    /** Description for error messages, e.g. "loop iterator". */
    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End Binding.java
