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

import static net.hydromatic.quanta.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replaces identifiers with expressions, and gives local variables fresh
 * names.
 *
 * <p>Respects scope: a declaration in a block hides a substitution for the
 * same name until the end of the block. Declarations of functions,
 * gate-macros and classes are not entered.
 */
class Substituter extends Shuttle {
  private final @Nullable NameGenerator nameGenerator;
  private final boolean renameTopLevel;
  private final Deque<Map<String, Ast.Exp>> scopes = new ArrayDeque<>();

  private Substituter(@Nullable NameGenerator nameGenerator,
      boolean renameTopLevel, Map<String, ? extends Ast.Exp> substitution) {
    this.nameGenerator = nameGenerator;
    this.renameTopLevel = renameTopLevel;
    scopes.push(new HashMap<>(substitution));
  }

  /** Gives a fresh name to every local variable and loop iterator in a
   * program. Variables declared at top level keep their names. */
  static Ast.Program uniquify(NameGenerator nameGenerator,
      Ast.Program program) {
    return program.accept(
        new Substituter(nameGenerator, false, ImmutableMap.of()));
  }

  /** Creates a copy of a block, replacing identifiers according to a
   * substitution and giving every variable declared in the block a fresh
   * name. */
  static Ast.Block freshen(NameGenerator nameGenerator,
      Map<String, ? extends Ast.Exp> substitution, Ast.Block block) {
    return block.accept(new Substituter(nameGenerator, true, substitution));
  }

  private Ast.@Nullable Exp lookup(String name) {
    for (Map<String, Ast.Exp> scope : scopes) {
      final Ast.Exp exp = scope.get(name);
      if (exp != null) {
        return exp;
      }
    }
    return null;
  }

  /** Declares a variable in the current scope, and returns its new name. */
  private String bind(Ast.Id id, boolean rename) {
    final String name = nameGenerator != null && rename
        ? nameGenerator.fresh(id.name)
        : id.name;
    scopes.element().put(id.name, ast.id(id.pos, name));
    return name;
  }

  private boolean isTopLevel() {
    return scopes.size() == 1;
  }

  @Override
  protected Ast.Exp visit(Ast.Id id) {
    final Ast.Exp exp = lookup(id.name);
    return exp != null ? exp : id;
  }

  @Override
  protected Ast.Id visitTarget(Ast.Id id) {
    final Ast.Exp exp = lookup(id.name);
    return exp instanceof Ast.Id ? (Ast.Id) exp : id;
  }

  @Override
  protected Ast.Block visit(Ast.Block block) {
    scopes.push(new HashMap<>());
    try {
      return super.visit(block);
    } finally {
      scopes.pop();
    }
  }

  @Override
  protected Ast.Stmt visit(Ast.ModifiedBlock modifiedBlock) {
    scopes.push(new HashMap<>());
    try {
      return super.visit(modifiedBlock);
    } finally {
      scopes.pop();
    }
  }

  @Override
  protected Ast.Stmt visit(Ast.VarDecl varDecl) {
    final Ast.Exp exp = varDecl.exp.accept(this);
    final String name =
        bind(ast.id(varDecl.pos, varDecl.name),
            renameTopLevel || !isTopLevel());
    return varDecl.copy(name, exp);
  }

  @Override
  protected Ast.Stmt visit(Ast.For forLoop) {
    final Ast.Exp iterable = forLoop.iterable.accept(this);
    scopes.push(new HashMap<>());
    try {
      final String iterator =
          bind(ast.id(forLoop.pos, forLoop.iterator), true);
      return forLoop.copy(iterator, iterable, forLoop.body.accept(this));
    } finally {
      scopes.pop();
    }
  }

  @Override
  protected Ast.Stmt visit(Ast.FunDecl funDecl) {
    return funDecl;
  }

  @Override
  protected Ast.Stmt visit(Ast.GateDecl gateDecl) {
    return gateDecl;
  }

  @Override
  protected Ast.Stmt visit(Ast.ClassDecl classDecl) {
    return classDecl;
  }
}

// End Substituter.java
