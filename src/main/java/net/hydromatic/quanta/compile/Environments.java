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

import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** An environment with no bindings. */
  private static final Environment EMPTY = new EmptyEnvironment();

  /** Returns an empty environment.
   *
   * <p>Built-in gates, functions and constants are not bound in any
   * environment; a name that has no binding is looked up among them. */
  public static Environment empty() {
    return EMPTY;
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    for (Binding binding : bindings) {
      env = env.bind(binding);
    }
    return env;
  }

  /** Environment that contains no bindings. */
  private static class EmptyEnvironment extends Environment {
    @Override
    void visit(Consumer<Binding> consumer) {}

    @Override
    public @Nullable Binding getOpt(String name) {
      return null;
    }
  }

  /** Environment that consists of a binding and a parent environment. */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override
    public String toString() {
      return binding.name + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      if (name.equals(binding.name)) {
        return binding;
      }
      return parent.getOpt(name);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }
  }
}

// End Environments.java
