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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.type.RegisterType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declarations of a program, produced by semantic analysis.
 *
 * <p>Immutable. Gate-macros, functions and constants are keyed by their
 * qualified name; for example, function "f" of class "Ops" has key "Ops.f".
 * Declarations have already been resolved; calls in their bodies have
 * {@link Callee callees}, and references to class members have
 * qualified names.
 */
public class SymbolTable {
  /** Registers, in declaration order. */
  public final ImmutableMap<String, RegisterType> registers;
  public final ImmutableMap<String, Ast.FunDecl> functions;
  public final ImmutableMap<String, Ast.GateDecl> gates;
  /** Global and class constants; not constants declared inside function or
   * gate-macro bodies. */
  public final ImmutableMap<String, Ast.VarDecl> constants;
  /** Keys of functions that have quantum effects and must therefore be
   * inlined. */
  public final ImmutableSet<String> inlineFunctions;

  private SymbolTable(Map<String, RegisterType> registers,
      Map<String, Ast.FunDecl> functions, Map<String, Ast.GateDecl> gates,
      Map<String, Ast.VarDecl> constants, Set<String> inlineFunctions) {
    this.registers = ImmutableMap.copyOf(registers);
    this.functions = ImmutableMap.copyOf(functions);
    this.gates = ImmutableMap.copyOf(gates);
    this.constants = ImmutableMap.copyOf(constants);
    this.inlineFunctions = ImmutableSet.copyOf(inlineFunctions);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a symbol table with no declarations. */
  public static SymbolTable empty() {
    return builder().build();
  }

  /** Returns the type of a register, or null if there is no such
   * register. */
  public @Nullable RegisterType register(String name) {
    return registers.get(name);
  }

  /** Returns the declaration of a function. Throws if not found. */
  public Ast.FunDecl function(String key) {
    final Ast.FunDecl funDecl = functions.get(key);
    if (funDecl == null) {
      throw new IllegalArgumentException("unknown function " + key);
    }
    return funDecl;
  }

  /** Returns the declaration of a gate-macro. Throws if not found. */
  public Ast.GateDecl gate(String key) {
    final Ast.GateDecl gateDecl = gates.get(key);
    if (gateDecl == null) {
      throw new IllegalArgumentException("unknown gate " + key);
    }
    return gateDecl;
  }

  /** Whether a call to a given callee must be replaced by its body. */
  public boolean isInline(Callee callee) {
    switch (callee.kind) {
      case GATE_MACRO:
        return true;
      case FUNCTION:
        return inlineFunctions.contains(callee.key());
      default:
        return false;
    }
  }

  /** Builder for {@link SymbolTable}. */
  public static class Builder {
    final Map<String, RegisterType> registers = new LinkedHashMap<>();
    final Map<String, Ast.FunDecl> functions = new LinkedHashMap<>();
    final Map<String, Ast.GateDecl> gates = new LinkedHashMap<>();
    final Map<String, Ast.VarDecl> constants = new LinkedHashMap<>();
    final Set<String> inlineFunctions = new LinkedHashSet<>();

    @CanIgnoreReturnValue
    public Builder register(String name, RegisterType type) {
      registers.put(name, type);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder function(String key, Ast.FunDecl funDecl) {
      functions.put(key, funDecl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder gate(String key, Ast.GateDecl gateDecl) {
      gates.put(key, gateDecl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder constant(String key, Ast.VarDecl varDecl) {
      constants.put(key, varDecl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder inline(String key) {
      inlineFunctions.add(key);
      return this;
    }

    public SymbolTable build() {
      return new SymbolTable(registers, functions, gates, constants,
          inlineFunctions);
    }
  }
}

// End SymbolTable.java
