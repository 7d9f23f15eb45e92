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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms syntax trees.
 *
 * <p>Each method returns the node unchanged if none of its children
 * changed. */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // expressions

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.Id id) {
    return id; // leaf
  }

  /** Visits the target of an assignment. */
  protected Ast.Id visitTarget(Ast.Id id) {
    return id;
  }

  protected Ast.Exp visit(Ast.Index index) {
    return index.copy(index.exp.accept(this), index.index.accept(this));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this),
        infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(prefixCall.a.accept(this));
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(call.name, call.modifiers, visitList(call.args),
        call.callee);
  }

  protected Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args));
  }

  protected Ast.Exp visit(Ast.Range range) {
    return range.copy(range.start.accept(this),
        range.step == null ? null : range.step.accept(this),
        range.end.accept(this));
  }

  // types and parameters

  protected Ast.TypeExp visit(Ast.TypeExp typeExp) {
    return typeExp; // leaf
  }

  protected Ast.Param visit(Ast.Param param) {
    return param; // leaf
  }

  // declarations

  protected Ast.Program visit(Ast.Program program) {
    return program.copy(visitList(program.statements));
  }

  protected Ast.Stmt visit(Ast.QuantumDecl quantumDecl) {
    return quantumDecl;
  }

  protected Ast.Stmt visit(Ast.VarDecl varDecl) {
    return varDecl.copy(varDecl.name, varDecl.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.FunDecl funDecl) {
    return funDecl.copy(funDecl.name, funDecl.body.accept(this));
  }

  protected Ast.Stmt visit(Ast.GateDecl gateDecl) {
    return gateDecl.copy(gateDecl.name, gateDecl.body.accept(this));
  }

  protected Ast.Stmt visit(Ast.ClassDecl classDecl) {
    return classDecl.copy(visitList(classDecl.members));
  }

  // statements

  protected Ast.Block visit(Ast.Block block) {
    return block.copy(visitList(block.statements));
  }

  protected Ast.Stmt visit(Ast.For forLoop) {
    return forLoop.copy(forLoop.iterator, forLoop.iterable.accept(this),
        forLoop.body.accept(this));
  }

  protected Ast.Stmt visit(Ast.If ifThenElse) {
    return ifThenElse.copy(ifThenElse.condition.accept(this),
        ifThenElse.ifTrue.accept(this),
        ifThenElse.ifFalse == null ? null : ifThenElse.ifFalse.accept(this));
  }

  protected Ast.Stmt visit(Ast.Return returnStmt) {
    return returnStmt.copy(
        returnStmt.exp == null ? null : returnStmt.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.Assign assign) {
    return assign.copy(visitTarget(assign.target), assign.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.ExpStmt expStmt) {
    return expStmt.copy(expStmt.exp.accept(this));
  }

  protected Ast.Stmt visit(Ast.ModifiedBlock modifiedBlock) {
    return modifiedBlock.copy(visitList(modifiedBlock.controls),
        visitList(modifiedBlock.statements));
  }
}

// End Shuttle.java
