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
package net.hydromatic.quanta.eval;

import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Values of variables during compile-time evaluation.
 *
 * <p>Unlike {@link net.hydromatic.quanta.compile.Environment}, an evaluation
 * environment is mutable, because {@code var} variables may be assigned.
 * Each block creates a {@link #sub() child}; a variable declared in a child
 * is not visible to its parent.
 */
public class EvalEnv {
  private final @Nullable EvalEnv parent;
  private final Map<String, Object> values = new HashMap<>();

  private EvalEnv(@Nullable EvalEnv parent) {
    this.parent = parent;
  }

  /** Creates an empty root environment. */
  public static EvalEnv root() {
    return new EvalEnv(null);
  }

  /** Creates a child environment. */
  public EvalEnv sub() {
    return new EvalEnv(this);
  }

  /** Returns the value of a variable, or null if it is not defined. */
  public @Nullable Object getOpt(String name) {
    for (EvalEnv e = this; e != null; e = e.parent) {
      final Object value = e.values.get(name);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Defines a variable in this environment. */
  public void declare(String name, Object value) {
    values.put(name, value);
  }

  /** Assigns a new value to an existing variable, in whichever environment
   * defines it. Returns false if the variable is not defined. */
  public boolean assign(String name, Object value) {
    for (EvalEnv e = this; e != null; e = e.parent) {
      if (e.values.containsKey(name)) {
        e.values.put(name, value);
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return parent == null ? values.toString() : values + ", " + parent;
  }
}

// End EvalEnv.java
