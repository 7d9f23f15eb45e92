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
package net.hydromatic.quanta.ir;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.compile.CompileException;
import net.hydromatic.quanta.compile.Gate;
import net.hydromatic.quanta.compile.Prop;
import net.hydromatic.quanta.compile.SemanticException;
import net.hydromatic.quanta.compile.SymbolTable;
import net.hydromatic.quanta.eval.EvalEnv;
import net.hydromatic.quanta.eval.Evaluator;
import net.hydromatic.quanta.type.RegisterType;

/**
 * Converts an expanded program into a {@link Circuit}.
 *
 * <p>Classical statements are evaluated and dropped. Each gate call becomes
 * one operation, or one operation per index if it broadcasts over whole
 * registers. {@code measure_all} becomes one {@code measure} per index.
 */
public class Lowering {
  private final SymbolTable symbolTable;
  private final Evaluator evaluator;
  private final int maxOperations;
  private final EvalEnv env = EvalEnv.root();
  private final List<Operation> operations = new ArrayList<>();

  private Lowering(SymbolTable symbolTable, Map<Prop, Object> props) {
    this.symbolTable = requireNonNull(symbolTable);
    this.evaluator =
        new Evaluator(symbolTable, Prop.MAX_UNROLL_COUNT.intValue(props));
    this.maxOperations = Prop.MAX_OPERATIONS.intValue(props);
  }

  /** Lowers an expanded program. */
  public static Circuit lower(SymbolTable symbolTable, Ast.Program program,
      Map<Prop, Object> props) {
    return new Lowering(symbolTable, props).lower(program);
  }

  private Circuit lower(Ast.Program program) {
    for (Ast.Stmt statement : program.statements) {
      switch (statement.op) {
        case QUANTUM_DECL:
          break;

        case EXP_STMT:
          final Ast.Call call = (Ast.Call) ((Ast.ExpStmt) statement).exp;
          if (call.callee.gate != null) {
            lowerGate(call);
          } else {
            evaluator.exec(statement, env);
          }
          break;

        case VAR_DECL:
        case CONST_DECL:
        case ASSIGN:
        case PLUS_ASSIGN:
        case MINUS_ASSIGN:
        case TIMES_ASSIGN:
          evaluator.exec(statement, env);
          break;

        default:
          throw new CompileException("cannot lower " + statement.op,
              statement.pos);
      }
    }
    final List<RegisterFact> registers = new ArrayList<>();
    symbolTable.registers.forEach((name, type) ->
        registers.add(RegisterFact.of(name, type.kind, type.size)));
    return Circuit.of(registers, operations);
  }

  private void lowerGate(Ast.Call call) {
    final Gate gate = call.callee.gate();
    final int controlCount = call.controlCount();
    switch (gate) {
      case BARRIER:
        final List<Operand> operands = new ArrayList<>();
        for (Ast.Exp arg : call.args) {
          operands.addAll(operand(arg).operands);
        }
        add(call, Operation.of(gate, ImmutableList.of(), operands,
            ImmutableList.of()));
        return;

      case MEASURE_ALL:
        final Slot q = operand(call.args.get(0));
        final Slot c = operand(call.args.get(1));
        if (q.operands.size() != c.operands.size()) {
          throw new SemanticException("registers in call to '" + call.name
              + "' must have the same size", call.pos);
        }
        for (int i = 0; i < q.operands.size(); i++) {
          add(call,
              Operation.of(Gate.MEASURE, ImmutableList.of(),
                  ImmutableList.of(q.operands.get(i), c.operands.get(i)),
                  ImmutableList.of()));
        }
        return;

      default:
        break;
    }

    final List<Double> params = new ArrayList<>();
    final List<Slot> slots = new ArrayList<>();
    for (int i = 0; i < call.args.size(); i++) {
      final Ast.Exp arg = call.args.get(i);
      if (i >= controlCount && i < controlCount + gate.paramCount) {
        params.add(evaluator.evalDouble(arg, env));
      } else {
        slots.add(operand(arg));
      }
    }

    // Broadcast over whole registers, which must all have the same size.
    int size = -1;
    for (Slot slot : slots) {
      if (slot.register) {
        if (size >= 0 && slot.operands.size() != size) {
          throw new SemanticException("registers in call to '" + call.name
              + "' must have the same size", call.pos);
        }
        size = slot.operands.size();
      }
    }
    final List<Modifier> modifiers = Modifier.normalize(call.modifiers);
    for (int i = 0; i < Math.max(size, 1); i++) {
      final List<Operand> operands = new ArrayList<>();
      for (Slot slot : slots) {
        operands.add(slot.operands.get(slot.register ? i : 0));
      }
      add(call, Operation.of(gate, params, operands, modifiers));
    }
  }

  private void add(Ast.Call call, Operation operation) {
    final Set<Operand> qubits = new HashSet<>();
    for (Operand operand : operation.operands) {
      final RegisterType type =
          requireNonNull(symbolTable.register(operand.register));
      if (type.kind == RegisterType.Kind.QUBIT && !qubits.add(operand)) {
        throw new SemanticException("qubit " + operand + " is used more "
            + "than once in call to '" + call.name + "'", call.pos);
      }
    }
    if (operations.size() >= maxOperations) {
      throw new SemanticException("circuit has more than " + maxOperations
          + " operations", call.pos);
    }
    operations.add(operation);
  }

  /** Resolves an operand to one qubit or bit, or to all of the elements of
   * a register. */
  private Slot operand(Ast.Exp arg) {
    if (arg instanceof Ast.Id) {
      final String name = ((Ast.Id) arg).name;
      final RegisterType type = register(name, arg);
      final ImmutableList.Builder<Operand> b = ImmutableList.builder();
      for (int i = 0; i < type.size; i++) {
        b.add(Operand.of(name, i));
      }
      return new Slot(true, b.build());
    }
    if (arg instanceof Ast.Index && ((Ast.Index) arg).exp instanceof Ast.Id) {
      final Ast.Index index = (Ast.Index) arg;
      final String name = ((Ast.Id) index.exp).name;
      final RegisterType type = register(name, arg);
      final int i = evaluator.evalInt(index.index, env);
      if (i < 0 || i >= type.size) {
        throw new SemanticException("index " + i + " out of range for "
            + "register " + name + " of size " + type.size, index.index.pos);
      }
      return new Slot(false, ImmutableList.of(Operand.of(name, i)));
    }
    throw new CompileException("cannot lower operand " + arg, arg.pos);
  }

  private RegisterType register(String name, Ast.Exp arg) {
    final RegisterType type = symbolTable.register(name);
    if (type == null) {
      throw new CompileException("unknown register " + name, arg.pos);
    }
    return type;
  }

  /** Operands supplied by one argument of a gate call. */
  private static class Slot {
    /** Whether the argument is a whole register. */
    final boolean register;
    final List<Operand> operands;

    Slot(boolean register, List<Operand> operands) {
      this.register = register;
      this.operands = operands;
    }
  }
}

// End Lowering.java
