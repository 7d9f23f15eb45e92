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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in classical function or constant. */
public enum BuiltIn {
  /** Function "len(x)" returns the number of elements of a list or the
   * size of a register. */
  LEN("len", 1),
  ABS("abs", 1),
  MIN("min", 2),
  MAX("max", 2),
  SQRT("sqrt", 1),
  SIN("sin", 1),
  COS("cos", 1),
  /** Function "int(x)" converts a number to an integer, truncating toward
   * zero. */
  INT("int", 1),
  FLOAT("float", 1),

  /** Constant "pi", the ratio of a circle's circumference to its
   * diameter. */
  PI("pi", -1),
  /** Constant "tau", 2&pi;. */
  TAU("tau", -1);

  /** Name in the language. */
  public final String sourceName;
  /** Number of arguments; -1 for a constant. */
  public final int arity;

  private static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.sourceName, builtIn);
    }
    BY_NAME = b.build();
  }

  BuiltIn(String sourceName, int arity) {
    this.sourceName = sourceName;
    this.arity = arity;
  }

  /** Looks up a built-in by name; returns null if not found. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }

  public boolean isConstant() {
    return arity < 0;
  }

  /** Returns the value of a constant. */
  public double constantValue() {
    switch (this) {
      case PI:
        return Math.PI;
      case TAU:
        return 2 * Math.PI;
      default:
        throw new IllegalStateException("not a constant: " + this);
    }
  }
}

// End BuiltIn.java
