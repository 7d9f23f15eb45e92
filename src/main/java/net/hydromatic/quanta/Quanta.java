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
package net.hydromatic.quanta;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.quanta.codegen.GateTable;
import net.hydromatic.quanta.compile.CompileException;
import net.hydromatic.quanta.compile.Compiles;
import net.hydromatic.quanta.compile.Prop;
import net.hydromatic.quanta.compile.Tracer;
import net.hydromatic.quanta.compile.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry point to the Quanta compiler.
 *
 * <p>Compiles a program in the Quanta language to OpenQASM 3 text.
 * Compilation is synchronous and has no side effects; concurrent calls share
 * no mutable state.
 */
public class Quanta {
  private Quanta() {}

  /** Compiles a program with default properties.
   *
   * @throws CompileException if the program is invalid */
  public static String compile(String source) {
    final String qasm =
        compile("stdIn", source, ImmutableMap.of(), Tracers.empty());
    return requireNonNull(qasm);
  }

  /**
   * Compiles a program.
   *
   * <p>If compilation fails and the tracer handles the exception, returns
   * null; otherwise the exception propagates.
   *
   * @param file   Name of the source file, used in error positions
   * @param source Program text
   * @param props  Compiler properties; see {@link Prop}
   * @param tracer Receives each intermediate result
   */
  public static @Nullable String compile(String file, String source,
      Map<Prop, Object> props, Tracer tracer) {
    try {
      return Compiles.compile(file, source, props, GateTable.OPENQASM3,
          tracer);
    } catch (CompileException e) {
      if (tracer.handleCompileException(e)) {
        return null;
      }
      throw e;
    }
  }

  /** Compiles a program and runs it on a backend, returning the backend's
   * histogram of measurement results. */
  public static Map<String, Integer> run(String source, int shots,
      Backend backend) {
    checkArgument(shots > 0, "shots must be positive: %s", shots);
    requireNonNull(backend, "backend");
    final String qasm = compile(source);
    return backend.execute(qasm, shots);
  }
}

// End Quanta.java
