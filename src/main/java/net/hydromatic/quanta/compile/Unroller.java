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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Pos;
import net.hydromatic.quanta.eval.EvalEnv;
import net.hydromatic.quanta.eval.Evaluator;

/**
 * Replaces loops and conditionals with the statements they execute.
 *
 * <p>Walks statements in order, evaluating constants and variables as it
 * goes. Each {@code for} is replaced by one copy of its body per value of its
 * iterable, in iteration order, with the iterator replaced by a literal.
 * Each {@code if} is replaced by the branch that its condition selects.
 *
 * <p>Arguments of gate calls are folded: angles and register indexes
 * become literals. Classical statements inside a modified block are executed
 * and then removed; classical statements elsewhere are kept.
 */
class Unroller {
  private final Evaluator evaluator;
  private final NameGenerator nameGenerator;
  private final int maxUnrollCount;

  Unroller(Evaluator evaluator, NameGenerator nameGenerator,
      int maxUnrollCount) {
    this.evaluator = requireNonNull(evaluator);
    this.nameGenerator = requireNonNull(nameGenerator);
    this.maxUnrollCount = maxUnrollCount;
  }

  Ast.Program unroll(Ast.Program program) {
    final List<Ast.Stmt> list = new ArrayList<>();
    unroll(program.statements, EvalEnv.root(), true, list);
    return program.copy(list);
  }

  private void unroll(List<Ast.Stmt> statements, EvalEnv env,
      boolean keepClassical, List<Ast.Stmt> list) {
    for (Ast.Stmt statement : statements) {
      switch (statement.op) {
        case QUANTUM_DECL:
          list.add(statement);
          break;

        case VAR_DECL:
        case CONST_DECL:
        case ASSIGN:
        case PLUS_ASSIGN:
        case MINUS_ASSIGN:
        case TIMES_ASSIGN:
          evaluator.exec(statement, env);
          if (keepClassical) {
            list.add(statement);
          }
          break;

        case EXP_STMT:
          final Ast.ExpStmt expStmt = (Ast.ExpStmt) statement;
          final Ast.Call call = (Ast.Call) expStmt.exp;
          switch (call.callee.kind) {
            case GATE:
              list.add(expStmt.copy(fold(call, env)));
              break;
            case FUNCTION:
            case BUILT_IN:
              evaluator.exec(statement, env);
              if (keepClassical) {
                list.add(statement);
              }
              break;
            default:
              throw new ExpansionException("call to '" + call.name
                  + "' was not inlined", call.pos);
          }
          break;

        case BLOCK:
          unroll(((Ast.Block) statement).statements, env, keepClassical,
              list);
          break;

        case FOR:
          unrollFor((Ast.For) statement, env, keepClassical, list);
          break;

        case IF:
          final Ast.If ifThenElse = (Ast.If) statement;
          if (evaluator.evalBoolean(ifThenElse.condition, env)) {
            unroll(ifThenElse.ifTrue.statements, env, keepClassical, list);
          } else if (ifThenElse.ifFalse != null) {
            unroll(ifThenElse.ifFalse.statements, env, keepClassical, list);
          }
          break;

        case MODIFIED_BLOCK:
          final Ast.ModifiedBlock modifiedBlock =
              (Ast.ModifiedBlock) statement;
          final List<Ast.Exp> controls = new ArrayList<>();
          for (Ast.Exp control : modifiedBlock.controls) {
            controls.add(foldOperand(control, env));
          }
          final List<Ast.Stmt> statements2 = new ArrayList<>();
          unroll(modifiedBlock.statements, env, false, statements2);
          list.add(modifiedBlock.copy(controls, statements2));
          break;

        default:
          throw new ExpansionException("unexpected " + statement.op.lowerName()
              + " during unrolling", statement.pos);
      }
    }
  }

  private void unrollFor(Ast.For forLoop, EvalEnv env,
      boolean keepClassical, List<Ast.Stmt> list) {
    final List<Object> values = evaluator.evalList(forLoop.iterable, env);
    if (values.size() > maxUnrollCount) {
      throw new SemanticException("loop has " + values.size()
          + " iterations; limit is " + maxUnrollCount, forLoop.iterable.pos);
    }
    for (Object value : values) {
      final Ast.Block body =
          Substituter.freshen(nameGenerator,
              ImmutableMap.of(forLoop.iterator,
                  toExp(forLoop.iterable.pos, value)),
              forLoop.body);
      unroll(body.statements, env, keepClassical, list);
    }
  }

  /** Folds the arguments of a gate call: evaluates angles, and the indexes
   * of register elements. */
  private Ast.Call fold(Ast.Call call, EvalEnv env) {
    final Gate gate = call.callee.gate();
    final int controlCount = call.controlCount();
    final List<Ast.Exp> args = new ArrayList<>();
    for (int i = 0; i < call.args.size(); i++) {
      final Ast.Exp arg = call.args.get(i);
      if (i >= controlCount && i < controlCount + gate.paramCount) {
        args.add(ast.literal(arg.pos, evaluator.evalDouble(arg, env)));
      } else {
        args.add(foldOperand(arg, env));
      }
    }
    return call.copy(call.name, call.modifiers, args, call.callee);
  }

  private Ast.Exp foldOperand(Ast.Exp operand, EvalEnv env) {
    if (operand instanceof Ast.Index) {
      final Ast.Index index = (Ast.Index) operand;
      return index.copy(index.exp,
          ast.intLiteral(index.index.pos,
              evaluator.evalInt(index.index, env)));
    }
    return operand;
  }

  /** Converts a value to an expression. */
  private static Ast.Exp toExp(Pos pos, Object value) {
    if (value instanceof List) {
      final List<Ast.Exp> list = new ArrayList<>();
      for (Object o : (List<?>) value) {
        list.add(toExp(pos, o));
      }
      return ast.list(pos, list);
    }
    return ast.literal(pos, value);
  }
}

// End Unroller.java
