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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Modifier;

/**
 * Removes modified blocks, giving their modifiers and control arguments to
 * the gate calls inside them.
 *
 * <p>Modifiers form an ordered list, outermost first. A block with
 * modifiers {@code M} and controls {@code C} that contains a call with
 * modifiers {@code m} and arguments {@code a} yields a call with modifiers
 * {@code M ++ m} and arguments {@code C ++ a}. The resulting list is then
 * {@link Modifier#normalize(List) normalized}.
 *
 * <p>If a block's own modifiers contain an odd number of {@code inv}, the
 * order of the statements in the block is reversed, because the inverse of
 * a sequence of gates is the sequence of their inverses in reverse order.
 */
class ModifierPropagator {
  Ast.Program propagate(Ast.Program program) {
    return program.copy(
        propagate(program.statements, ImmutableList.of(),
            ImmutableList.of()));
  }

  private List<Ast.Stmt> propagate(List<Ast.Stmt> statements,
      List<Modifier> modifiers, List<Ast.Exp> controls) {
    final List<Ast.Stmt> list = new ArrayList<>();
    for (Ast.Stmt statement : statements) {
      switch (statement.op) {
        case MODIFIED_BLOCK:
          final Ast.ModifiedBlock block = (Ast.ModifiedBlock) statement;
          final List<Ast.Stmt> inner =
              propagate(block.statements,
                  concat(modifiers, block.modifiers),
                  concat(controls, block.controls));
          list.addAll(isInverted(block.modifiers)
              ? Lists.reverse(inner)
              : inner);
          break;

        case EXP_STMT:
          final Ast.ExpStmt expStmt = (Ast.ExpStmt) statement;
          final Ast.Call call = (Ast.Call) expStmt.exp;
          switch (call.callee.kind) {
            case GATE:
              list.add(expStmt.copy(modify(call, modifiers, controls)));
              break;
            case FUNCTION:
            case BUILT_IN:
              checkUnmodified(statement, modifiers);
              list.add(statement);
              break;
            default:
              throw new ExpansionException("call to '" + call.name
                  + "' was not inlined", call.pos);
          }
          break;

        default:
          checkUnmodified(statement, modifiers);
          list.add(statement);
      }
    }
    return list;
  }

  private static Ast.Call modify(Ast.Call call, List<Modifier> modifiers,
      List<Ast.Exp> controls) {
    final List<Modifier> modifiers2 = concat(modifiers, call.modifiers);
    if (!call.callee.gate().unitary && !modifiers2.isEmpty()) {
      throw new ExpansionException("modifier '" + modifiers2.get(0)
          + "' reached non-unitary operation '" + call.name + "'", call.pos);
    }
    return call.copy(call.name, Modifier.normalize(modifiers2),
        concat(controls, call.args), call.callee);
  }

  private static void checkUnmodified(Ast.Stmt statement,
      List<Modifier> modifiers) {
    if (!modifiers.isEmpty()) {
      throw new ExpansionException("unexpected " + statement.op.lowerName()
          + " in modified block", statement.pos);
    }
  }

  private static boolean isInverted(List<Modifier> modifiers) {
    int count = 0;
    for (Modifier modifier : modifiers) {
      if (modifier.kind == Modifier.Kind.INV) {
        ++count;
      }
    }
    return count % 2 == 1;
  }

  private static <E> List<E> concat(List<E> list0, List<E> list1) {
    if (list0.isEmpty()) {
      return list1;
    }
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }
}

// End ModifierPropagator.java
