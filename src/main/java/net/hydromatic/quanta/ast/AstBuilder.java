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
package net.hydromatic.quanta.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.quanta.compile.Callee;
import net.hydromatic.quanta.type.RegisterType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // literals

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos p, boolean b) {
    return new Ast.Literal(p, Op.BOOL_LITERAL, b);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, int value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a floating-point literal. */
  public Ast.Literal floatLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a literal from a value produced by the evaluator: an
   * {@link Integer}, {@link Double}, {@link Boolean} or {@link String}. */
  public Ast.Literal literal(Pos pos, Object value) {
    if (value instanceof Integer) {
      return intLiteral(pos, (Integer) value);
    }
    if (value instanceof Double) {
      return floatLiteral(pos, (Double) value);
    }
    if (value instanceof Boolean) {
      return boolLiteral(pos, (Boolean) value);
    }
    if (value instanceof String) {
      return stringLiteral(pos, (String) value);
    }
    throw new IllegalArgumentException("not a literal value: " + value);
  }

  // expressions

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.Index index(Pos pos, Ast.Exp exp, Ast.Exp index) {
    return new Ast.Index(pos, exp, index);
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.Call call(Pos pos, String name, List<Modifier> modifiers,
      List<? extends Ast.Exp> args, Callee callee) {
    return new Ast.Call(pos, name, ImmutableList.copyOf(modifiers),
        ImmutableList.copyOf(args), callee);
  }

  /** Creates a call whose callee has not yet been resolved. */
  public Ast.Call call(Pos pos, String name, List<Modifier> modifiers,
      List<? extends Ast.Exp> args) {
    return call(pos, name, modifiers, args, Callee.UNRESOLVED);
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args));
  }

  public Ast.Range range(Pos pos, Ast.Exp start, Ast.@Nullable Exp step,
      Ast.Exp end) {
    return new Ast.Range(pos, start, step, end);
  }

  // types and parameters

  public Ast.TypeExp typeExp(Pos pos, String name, boolean array,
      @Nullable Integer size) {
    return new Ast.TypeExp(pos, name, array, size);
  }

  public Ast.Param param(Pos pos, String name, Ast.@Nullable TypeExp type) {
    return new Ast.Param(pos, name, type);
  }

  // declarations

  public Ast.Program program(Pos pos, List<? extends Ast.Stmt> statements) {
    return new Ast.Program(pos, ImmutableList.copyOf(statements));
  }

  public Ast.QuantumDecl quantumDecl(Pos pos, RegisterType.Kind kind,
      Ast.@Nullable Exp size, String name) {
    return new Ast.QuantumDecl(pos, kind, size, name);
  }

  public Ast.VarDecl varDecl(Pos pos, Op op, String name,
      Ast.@Nullable TypeExp type, Ast.Exp exp) {
    return new Ast.VarDecl(pos, op, name, type, exp);
  }

  public Ast.FunDecl funDecl(Pos pos, String name,
      List<Ast.Param> params, Ast.@Nullable TypeExp returnType,
      Ast.Block body) {
    return new Ast.FunDecl(pos, name, ImmutableList.copyOf(params),
        returnType, body);
  }

  public Ast.GateDecl gateDecl(Pos pos, String name, List<Ast.Param> params,
      Ast.Block body) {
    return new Ast.GateDecl(pos, name, ImmutableList.copyOf(params), body);
  }

  public Ast.ClassDecl classDecl(Pos pos, String name,
      List<? extends Ast.Stmt> members) {
    return new Ast.ClassDecl(pos, name, ImmutableList.copyOf(members));
  }

  // statements

  public Ast.Block block(Pos pos, List<? extends Ast.Stmt> statements) {
    return new Ast.Block(pos, ImmutableList.copyOf(statements));
  }

  public Ast.For forLoop(Pos pos, String iterator, Ast.Exp iterable,
      Ast.Block body) {
    return new Ast.For(pos, iterator, iterable, body);
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Block ifTrue,
      Ast.@Nullable Block ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Return returnStmt(Pos pos, Ast.@Nullable Exp exp) {
    return new Ast.Return(pos, exp);
  }

  public Ast.Assign assign(Pos pos, Op op, Ast.Id target, Ast.Exp exp) {
    return new Ast.Assign(pos, op, target, exp);
  }

  public Ast.ExpStmt expStmt(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStmt(pos, exp);
  }

  public Ast.ModifiedBlock modifiedBlock(Pos pos, List<Modifier> modifiers,
      List<? extends Ast.Exp> controls, List<? extends Ast.Stmt> statements) {
    return new Ast.ModifiedBlock(pos, ImmutableList.copyOf(modifiers),
        ImmutableList.copyOf(controls), ImmutableList.copyOf(statements));
  }
}

// End AstBuilder.java
