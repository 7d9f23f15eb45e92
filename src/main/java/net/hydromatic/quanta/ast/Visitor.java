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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Index index) {
    index.exp.accept(this);
    index.index.accept(this);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.Range range) {
    range.start.accept(this);
    if (range.step != null) {
      range.step.accept(this);
    }
    range.end.accept(this);
  }

  // types and parameters

  protected void visit(Ast.TypeExp typeExp) {}

  protected void visit(Ast.Param param) {
    if (param.type != null) {
      param.type.accept(this);
    }
  }

  // declarations

  protected void visit(Ast.Program program) {
    program.statements.forEach(this::accept);
  }

  protected void visit(Ast.QuantumDecl quantumDecl) {
    if (quantumDecl.size != null) {
      quantumDecl.size.accept(this);
    }
  }

  protected void visit(Ast.VarDecl varDecl) {
    varDecl.exp.accept(this);
  }

  protected void visit(Ast.FunDecl funDecl) {
    funDecl.params.forEach(this::accept);
    funDecl.body.accept(this);
  }

  protected void visit(Ast.GateDecl gateDecl) {
    gateDecl.params.forEach(this::accept);
    gateDecl.body.accept(this);
  }

  protected void visit(Ast.ClassDecl classDecl) {
    classDecl.members.forEach(this::accept);
  }

  // statements

  protected void visit(Ast.Block block) {
    block.statements.forEach(this::accept);
  }

  protected void visit(Ast.For forLoop) {
    forLoop.iterable.accept(this);
    forLoop.body.accept(this);
  }

  protected void visit(Ast.If ifThenElse) {
    ifThenElse.condition.accept(this);
    ifThenElse.ifTrue.accept(this);
    if (ifThenElse.ifFalse != null) {
      ifThenElse.ifFalse.accept(this);
    }
  }

  protected void visit(Ast.Return returnStmt) {
    if (returnStmt.exp != null) {
      returnStmt.exp.accept(this);
    }
  }

  protected void visit(Ast.Assign assign) {
    assign.target.accept(this);
    assign.exp.accept(this);
  }

  protected void visit(Ast.ExpStmt expStmt) {
    expStmt.exp.accept(this);
  }

  protected void visit(Ast.ModifiedBlock modifiedBlock) {
    modifiedBlock.controls.forEach(this::accept);
    modifiedBlock.statements.forEach(this::accept);
  }
}

// End Visitor.java
