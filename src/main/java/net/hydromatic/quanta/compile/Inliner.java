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
import static net.hydromatic.quanta.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.type.RegisterType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replaces each call to a gate-macro or quantum function with a fresh copy
 * of its body.
 *
 * <p>Arguments are substituted for parameters positionally, by value.
 * Nested calls are inlined depth-first, left to right. A call that has
 * modifiers becomes an {@link Ast.ModifiedBlock} that holds the modifiers,
 * the control arguments, and the inlined body. A register passed to a
 * {@code qubit} or {@code bit} parameter, or as a control, is broadcast:
 * the call is inlined once per element. Declarations of functions,
 * gate-macros and classes are removed.
 */
class Inliner {
  private final SymbolTable symbolTable;
  private final NameGenerator nameGenerator;
  private final int maxDepth;

  Inliner(SymbolTable symbolTable, NameGenerator nameGenerator,
      int maxDepth) {
    this.symbolTable = requireNonNull(symbolTable);
    this.nameGenerator = requireNonNull(nameGenerator);
    this.maxDepth = maxDepth;
  }

  Ast.Program inline(Ast.Program program) {
    return program.copy(inline(program.statements, 0));
  }

  private List<Ast.Stmt> inline(List<Ast.Stmt> statements, int depth) {
    final List<Ast.Stmt> list = new ArrayList<>();
    for (Ast.Stmt statement : statements) {
      switch (statement.op) {
        case FUN_DECL:
        case GATE_DECL:
        case CLASS_DECL:
          break;

        case EXP_STMT:
          final Ast.Exp exp = ((Ast.ExpStmt) statement).exp;
          if (exp instanceof Ast.Call
              && symbolTable.isInline(((Ast.Call) exp).callee)) {
            inlineCall((Ast.Call) exp, depth, list);
          } else {
            list.add(statement);
          }
          break;

        case BLOCK:
          list.add(inline((Ast.Block) statement, depth));
          break;

        case FOR:
          final Ast.For forLoop = (Ast.For) statement;
          list.add(
              forLoop.copy(forLoop.iterator, forLoop.iterable,
                  inline(forLoop.body, depth)));
          break;

        case IF:
          final Ast.If ifThenElse = (Ast.If) statement;
          list.add(
              ifThenElse.copy(ifThenElse.condition,
                  inline(ifThenElse.ifTrue, depth),
                  ifThenElse.ifFalse == null
                      ? null
                      : inline(ifThenElse.ifFalse, depth)));
          break;

        case MODIFIED_BLOCK:
          final Ast.ModifiedBlock modifiedBlock =
              (Ast.ModifiedBlock) statement;
          list.add(
              modifiedBlock.copy(modifiedBlock.controls,
                  inline(modifiedBlock.statements, depth)));
          break;

        default:
          list.add(statement);
      }
    }
    return list;
  }

  private Ast.Block inline(Ast.Block block, int depth) {
    return block.copy(inline(block.statements, depth));
  }

  private void inlineCall(Ast.Call call, int depth, List<Ast.Stmt> list) {
    if (depth >= maxDepth) {
      throw new ExpansionException("inlining '" + call.name
          + "' exceeds maximum depth " + maxDepth, call.pos);
    }
    final List<Ast.Param> params;
    final Ast.Block body;
    if (call.callee.kind == Callee.Kind.GATE_MACRO) {
      final Ast.GateDecl gateDecl = symbolTable.gate(call.callee.key());
      params = gateDecl.params;
      body = gateDecl.body;
    } else {
      final Ast.FunDecl funDecl = symbolTable.function(call.callee.key());
      params = funDecl.params;
      body = funDecl.body;
    }
    final int size = broadcastSize(call, params);
    if (size >= 0) {
      for (int k = 0; k < size; k++) {
        inlineCall(element(call, params, k), depth, list);
      }
      return;
    }
    final int controlCount = call.controlCount();
    final List<Ast.Exp> controls = call.args.subList(0, controlCount);
    final Map<String, Ast.Exp> substitution = new HashMap<>();
    for (int i = 0; i < params.size(); i++) {
      substitution.put(params.get(i).name, call.args.get(controlCount + i));
    }
    final Ast.Block body2 =
        Substituter.freshen(nameGenerator, substitution, body);
    final List<Ast.Stmt> statements = inline(body2.statements, depth + 1);
    if (call.modifiers.isEmpty()) {
      list.addAll(statements);
    } else {
      list.add(
          ast.modifiedBlock(call.pos, call.modifiers, controls, statements));
    }
  }

  /** Returns the size of the registers passed to single-qubit or
   * single-bit positions of a call, or -1 if there are none. */
  private int broadcastSize(Ast.Call call, List<Ast.Param> params) {
    final int controlCount = call.controlCount();
    for (int i = 0; i < call.args.size(); i++) {
      if (isScalar(params, controlCount, i)) {
        final RegisterType type = registerType(call.args.get(i));
        if (type != null) {
          return type.size;
        }
      }
    }
    return -1;
  }

  /** Returns a copy of a broadcast call in which each register in a
   * single-qubit or single-bit position is replaced by its {@code k}th
   * element. */
  private Ast.Call element(Ast.Call call, List<Ast.Param> params, int k) {
    final int controlCount = call.controlCount();
    final List<Ast.Exp> args = new ArrayList<>();
    for (int i = 0; i < call.args.size(); i++) {
      final Ast.Exp arg = call.args.get(i);
      if (isScalar(params, controlCount, i) && registerType(arg) != null) {
        args.add(ast.index(arg.pos, arg, ast.intLiteral(arg.pos, k)));
      } else {
        args.add(arg);
      }
    }
    return call.copy(call.name, call.modifiers, args, call.callee);
  }

  /** Whether argument {@code i} of a call is a control or is passed to a
   * parameter of type {@code qubit} or {@code bit}. */
  private static boolean isScalar(List<Ast.Param> params, int controlCount,
      int i) {
    if (i < controlCount) {
      return true;
    }
    final Ast.Param param = params.get(i - controlCount);
    return param.type == null
        || !param.type.array
            && (param.type.name.equals("qubit")
                || param.type.name.equals("bit"));
  }

  private @Nullable RegisterType registerType(Ast.Exp arg) {
    return arg instanceof Ast.Id
        ? symbolTable.register(((Ast.Id) arg).name)
        : null;
  }
}

// End Inliner.java
