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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL,
  INT,
  FLOAT {
    @Override
    public boolean accepts(Type from) {
      return from == FLOAT || from == INT;
    }
  },
  STR,
  QUBIT,
  BIT,
  /** Type of a call that returns no value. */
  UNIT;

  /** The name in the language, e.g. {@code bool}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  private static final ImmutableMap<String, PrimitiveType> BY_MONIKER;

  static {
    final ImmutableMap.Builder<String, PrimitiveType> b =
        ImmutableMap.builder();
    for (PrimitiveType type : values()) {
      if (type != UNIT) {
        b.put(type.moniker, type);
      }
    }
    BY_MONIKER = b.build();
  }

  /** Looks up a type by the name used in type annotations, e.g. "int";
   * returns null if not found. */
  public static @Nullable PrimitiveType lookup(String moniker) {
    return BY_MONIKER.get(moniker);
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public boolean isQuantum() {
    return this == QUBIT || this == BIT;
  }

  @Override
  public boolean isNumeric() {
    return this == INT || this == FLOAT;
  }
}

// End PrimitiveType.java
