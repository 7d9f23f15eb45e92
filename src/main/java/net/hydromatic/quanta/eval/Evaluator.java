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
package net.hydromatic.quanta.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.AstNode;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.compile.BuiltIn;
import net.hydromatic.quanta.compile.Callee;
import net.hydromatic.quanta.compile.CompileException;
import net.hydromatic.quanta.compile.SemanticException;
import net.hydromatic.quanta.compile.SymbolTable;
import net.hydromatic.quanta.type.RegisterType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates classical expressions and statements at compile time.
 *
 * <p>Values are {@link Integer}, {@link Double}, {@link Boolean},
 * {@link String}, and immutable lists of values. Arithmetic follows Python:
 * {@code /} always yields a float, {@code //} and {@code %} round toward
 * negative infinity, and integer arithmetic that overflows is an error.
 *
 * <p>The program must have been validated by
 * {@link net.hydromatic.quanta.compile.Analyzer}; the evaluator does not
 * check types except where a value determines the result type.
 *
 * <p>An evaluator memoizes the values of global and class constants, so
 * should not be shared between compilations.
 */
public class Evaluator {
  private final SymbolTable symbolTable;
  private final int maxListSize;
  private final Map<String, Object> constantValues = new HashMap<>();

  /** Creates an Evaluator.
   *
   * @param symbolTable Declarations of functions, constants and registers
   * @param maxListSize Largest number of elements in a range
   */
  public Evaluator(SymbolTable symbolTable, int maxListSize) {
    this.symbolTable = requireNonNull(symbolTable);
    this.maxListSize = maxListSize;
  }

  /** Evaluates an expression. */
  public Object eval(Ast.Exp exp, EvalEnv env) {
    switch (exp.op) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case STRING_LITERAL:
        return ((Ast.Literal) exp).value;

      case ID:
        return lookup((Ast.Id) exp, env);

      case INDEX:
        final Ast.Index index = (Ast.Index) exp;
        final List<Object> list = evalList(index.exp, env);
        final int i = evalInt(index.index, env);
        if (i < 0 || i >= list.size()) {
          throw error("index " + i + " out of range for list of size "
              + list.size(), index.index);
        }
        return list.get(i);

      case LIST:
        final ImmutableList.Builder<Object> b = ImmutableList.builder();
        for (Ast.Exp arg : ((Ast.ListExp) exp).args) {
          b.add(eval(arg, env));
        }
        return b.build();

      case RANGE:
        return range((Ast.Range) exp, env);

      case CALL:
        final Ast.Call call = (Ast.Call) exp;
        final Object result = call(call, env);
        if (result == null) {
          throw error("function '" + call.name + "' did not return a value",
              call);
        }
        return result;

      case NEGATE:
        final Object o = eval(((Ast.PrefixCall) exp).a, env);
        if (o instanceof Integer) {
          try {
            return Math.negateExact((Integer) o);
          } catch (ArithmeticException e) {
            throw error("integer overflow", exp);
          }
        }
        return -(Double) o;

      case NOT:
        return !evalBoolean(((Ast.PrefixCall) exp).a, env);

      case AND:
        final Ast.InfixCall and = (Ast.InfixCall) exp;
        return evalBoolean(and.a0, env) && evalBoolean(and.a1, env);

      case OR:
        final Ast.InfixCall or = (Ast.InfixCall) exp;
        return evalBoolean(or.a0, env) || evalBoolean(or.a1, env);

      default:
        if (exp instanceof Ast.InfixCall) {
          final Ast.InfixCall infix = (Ast.InfixCall) exp;
          return binary(infix.op, eval(infix.a0, env), eval(infix.a1, env),
              infix);
        }
        throw new CompileException("cannot evaluate " + exp.op, exp.pos);
    }
  }

  /** Evaluates an expression whose type is {@code int}. */
  public int evalInt(Ast.Exp exp, EvalEnv env) {
    final Object o = eval(exp, env);
    if (!(o instanceof Integer)) {
      throw error("expected int, got " + describe(o), exp);
    }
    return (Integer) o;
  }

  /** Evaluates an expression whose type is {@code int} or {@code float}.
   * Throws if the result is not finite. */
  public double evalDouble(Ast.Exp exp, EvalEnv env) {
    final Object o = eval(exp, env);
    if (!(o instanceof Number)) {
      throw error("expected float, got " + describe(o), exp);
    }
    final double d = ((Number) o).doubleValue();
    if (!Double.isFinite(d)) {
      throw error("value is not finite: " + d, exp);
    }
    return d;
  }

  /** Evaluates an expression whose type is {@code bool}. */
  public boolean evalBoolean(Ast.Exp exp, EvalEnv env) {
    final Object o = eval(exp, env);
    if (!(o instanceof Boolean)) {
      throw error("expected bool, got " + describe(o), exp);
    }
    return (Boolean) o;
  }

  /** Evaluates an expression whose type is a list. */
  @SuppressWarnings("unchecked")
  public List<Object> evalList(Ast.Exp exp, EvalEnv env) {
    final Object o = eval(exp, env);
    if (!(o instanceof List)) {
      throw error("expected list, got " + describe(o), exp);
    }
    return (List<Object>) o;
  }

  /** Returns the value of a global or class constant. */
  public Object constant(String key, AstNode node) {
    final Object value = constantValues.get(key);
    if (value != null) {
      return value;
    }
    final Ast.VarDecl varDecl = symbolTable.constants.get(key);
    if (varDecl == null) {
      throw new CompileException("unknown name '" + key + "'", node.pos);
    }
    final Object v = coerce(varDecl.type, eval(varDecl.exp, EvalEnv.root()));
    constantValues.put(key, v);
    return v;
  }

  private Object lookup(Ast.Id id, EvalEnv env) {
    final Object value = env.getOpt(id.name);
    if (value != null) {
      return value;
    }
    if (symbolTable.constants.containsKey(id.name)) {
      return constant(id.name, id);
    }
    final BuiltIn builtIn = BuiltIn.lookup(id.name);
    if (builtIn != null && builtIn.isConstant()) {
      return builtIn.constantValue();
    }
    if (symbolTable.register(id.name) != null) {
      throw error("register '" + id.name + "' is not a classical value", id);
    }
    throw new CompileException("unknown name '" + id.name + "'", id.pos);
  }

  private List<Object> range(Ast.Range range, EvalEnv env) {
    final int start = evalInt(range.start, env);
    final int step = range.step == null ? 1 : evalInt(range.step, env);
    final int end = evalInt(range.end, env);
    if (step == 0) {
      throw error("range step must not be zero",
          requireNonNull(range.step));
    }
    final long count = step > 0
        ? Math.max(0L, ((long) end - start + step - 1) / step)
        : Math.max(0L, ((long) start - end - step - 1) / -step);
    if (count > maxListSize) {
      throw error("range has " + count + " elements; limit is "
          + maxListSize, range);
    }
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (long i = 0; i < count; i++) {
      b.add((int) (start + i * step));
    }
    return b.build();
  }

  /** Applies a binary operator to two values. */
  Object binary(Op op, Object v0, Object v1, AstNode node) {
    switch (op) {
      case EQ:
        return valueEquals(v0, v1);
      case NE:
        return !valueEquals(v0, v1);
      case LT:
        return compare(v0, v1, node) < 0;
      case LE:
        return compare(v0, v1, node) <= 0;
      case GT:
        return compare(v0, v1, node) > 0;
      case GE:
        return compare(v0, v1, node) >= 0;
      default:
        break;
    }
    if (op == Op.PLUS && v0 instanceof String && v1 instanceof String) {
      return (String) v0 + v1;
    }
    if (op == Op.PLUS && v0 instanceof List && v1 instanceof List) {
      return ImmutableList.builder().addAll((List<?>) v0)
          .addAll((List<?>) v1).build();
    }
    if (v0 instanceof Integer && v1 instanceof Integer) {
      return intBinary(op, (Integer) v0, (Integer) v1, node);
    }
    if (v0 instanceof Number && v1 instanceof Number) {
      return floatBinary(op, ((Number) v0).doubleValue(),
          ((Number) v1).doubleValue(), node);
    }
    throw error("cannot apply '" + op.padded.trim() + "' to "
        + describe(v0) + " and " + describe(v1), node);
  }

  private Object intBinary(Op op, int a, int b, AstNode node) {
    try {
      switch (op) {
        case PLUS:
          return Math.addExact(a, b);
        case MINUS:
          return Math.subtractExact(a, b);
        case TIMES:
          return Math.multiplyExact(a, b);
        case DIVIDE:
          checkDivisor(b, node);
          return (double) a / b;
        case FLOOR_DIVIDE:
          checkDivisor(b, node);
          if (a == Integer.MIN_VALUE && b == -1) {
            throw new ArithmeticException("integer overflow");
          }
          return Math.floorDiv(a, b);
        case MOD:
          checkDivisor(b, node);
          return Math.floorMod(a, b);
        case POWER:
          if (b < 0) {
            throw error("negative exponent " + b + " in integer power",
                node);
          }
          int result = 1;
          for (int i = 0; i < b; i++) {
            result = Math.multiplyExact(result, a);
          }
          return result;
        default:
          throw new CompileException("unknown operator " + op, node.pos);
      }
    } catch (ArithmeticException e) {
      throw error("integer overflow", node);
    }
  }

  private Object floatBinary(Op op, double a, double b, AstNode node) {
    final double d;
    switch (op) {
      case PLUS:
        d = a + b;
        break;
      case MINUS:
        d = a - b;
        break;
      case TIMES:
        d = a * b;
        break;
      case DIVIDE:
        checkDivisor(b, node);
        d = a / b;
        break;
      case FLOOR_DIVIDE:
        checkDivisor(b, node);
        d = Math.floor(a / b);
        break;
      case MOD:
        checkDivisor(b, node);
        d = a - b * Math.floor(a / b);
        break;
      case POWER:
        d = Math.pow(a, b);
        break;
      default:
        throw new CompileException("unknown operator " + op, node.pos);
    }
    if (Double.isNaN(d)) {
      throw error("result of '" + op.padded.trim() + "' is not a number",
          node);
    }
    if (Double.isInfinite(d)) {
      throw error("float overflow", node);
    }
    return d;
  }

  private void checkDivisor(double b, AstNode node) {
    if (b == 0) {
      throw error("division by zero", node);
    }
  }

  private static boolean valueEquals(Object v0, Object v1) {
    if (v0 instanceof Number && v1 instanceof Number
        && (v0 instanceof Double || v1 instanceof Double)) {
      return ((Number) v0).doubleValue() == ((Number) v1).doubleValue();
    }
    return v0.equals(v1);
  }

  private int compare(Object v0, Object v1, AstNode node) {
    if (v0 instanceof Integer && v1 instanceof Integer) {
      return Integer.compare((Integer) v0, (Integer) v1);
    }
    if (v0 instanceof Number && v1 instanceof Number) {
      return Double.compare(((Number) v0).doubleValue(),
          ((Number) v1).doubleValue());
    }
    if (v0 instanceof String && v1 instanceof String) {
      return ((String) v0).compareTo((String) v1);
    }
    throw error("cannot compare " + describe(v0) + " and " + describe(v1),
        node);
  }

  /** Evaluates a call to a built-in or a classical function.
   * Returns null if the function completes without returning a value. */
  public @Nullable Object call(Ast.Call call, EvalEnv env) {
    switch (call.callee.kind) {
      case BUILT_IN:
        return builtIn(requireNonNull(call.callee.builtIn), call, env);
      case FUNCTION:
        final Ast.FunDecl funDecl = symbolTable.function(call.callee.key());
        final EvalEnv env2 = EvalEnv.root();
        for (int i = 0; i < funDecl.params.size(); i++) {
          final Ast.Param param = funDecl.params.get(i);
          env2.declare(param.name,
              coerce(param.type, eval(call.args.get(i), env)));
        }
        final Returned returned = exec(funDecl.body, env2);
        if (returned == null || returned.value == null) {
          return null;
        }
        return coerce(funDecl.returnType, returned.value);
      default:
        throw new CompileException("cannot evaluate call to "
            + call.callee, call.pos);
    }
  }

  private Object builtIn(BuiltIn builtIn, Ast.Call call, EvalEnv env) {
    final List<Ast.Exp> args = call.args;
    switch (builtIn) {
      case LEN:
        final Ast.Exp arg = args.get(0);
        if (arg instanceof Ast.Id && env.getOpt(((Ast.Id) arg).name) == null) {
          final RegisterType registerType =
              symbolTable.register(((Ast.Id) arg).name);
          if (registerType != null) {
            return registerType.size;
          }
        }
        return evalList(arg, env).size();

      case ABS:
        final Object a = eval(args.get(0), env);
        if (a instanceof Integer) {
          if ((Integer) a == Integer.MIN_VALUE) {
            throw error("integer overflow", call);
          }
          return Math.abs((Integer) a);
        }
        return Math.abs((Double) a);

      case MIN:
      case MAX:
        final Object a0 = eval(args.get(0), env);
        final Object a1 = eval(args.get(1), env);
        final boolean first = builtIn == BuiltIn.MIN
            ? compare(a0, a1, call) <= 0
            : compare(a0, a1, call) >= 0;
        if (a0 instanceof Integer && a1 instanceof Integer) {
          return first ? a0 : a1;
        }
        return ((Number) (first ? a0 : a1)).doubleValue();

      case SQRT:
        final double x = evalDouble(args.get(0), env);
        if (x < 0) {
          throw error("sqrt of negative number " + x, call);
        }
        return Math.sqrt(x);

      case SIN:
        return Math.sin(evalDouble(args.get(0), env));

      case COS:
        return Math.cos(evalDouble(args.get(0), env));

      case INT:
        final Object n = eval(args.get(0), env);
        if (n instanceof Integer) {
          return n;
        }
        final double d = ((Number) n).doubleValue();
        if (d >= Integer.MAX_VALUE + 1D || d <= Integer.MIN_VALUE - 1D) {
          throw error("integer overflow", call);
        }
        return (int) d;

      case FLOAT:
        return evalDouble(args.get(0), env);

      default:
        throw new CompileException("cannot call constant " + builtIn,
            call.pos);
    }
  }

  /** Executes a classical statement.
   *
   * <p>Returns the result of a {@code return} statement, or null if the
   * statement completed normally. */
  public @Nullable Returned exec(Ast.Stmt stmt, EvalEnv env) {
    switch (stmt.op) {
      case VAR_DECL:
      case CONST_DECL:
        final Ast.VarDecl varDecl = (Ast.VarDecl) stmt;
        env.declare(varDecl.name,
            coerce(varDecl.type, eval(varDecl.exp, env)));
        return null;

      case ASSIGN:
      case PLUS_ASSIGN:
      case MINUS_ASSIGN:
      case TIMES_ASSIGN:
        assign((Ast.Assign) stmt, env);
        return null;

      case EXP_STMT:
        final Ast.Exp exp = ((Ast.ExpStmt) stmt).exp;
        if (exp instanceof Ast.Call
            && ((Ast.Call) exp).callee.kind == Callee.Kind.FUNCTION) {
          call((Ast.Call) exp, env);
        } else {
          eval(exp, env);
        }
        return null;

      case BLOCK:
        final EvalEnv env2 = env.sub();
        for (Ast.Stmt s : ((Ast.Block) stmt).statements) {
          final Returned returned = exec(s, env2);
          if (returned != null) {
            return returned;
          }
        }
        return null;

      case IF:
        final Ast.If ifThenElse = (Ast.If) stmt;
        if (evalBoolean(ifThenElse.condition, env)) {
          return exec(ifThenElse.ifTrue, env);
        } else if (ifThenElse.ifFalse != null) {
          return exec(ifThenElse.ifFalse, env);
        }
        return null;

      case FOR:
        final Ast.For forLoop = (Ast.For) stmt;
        for (Object value : evalList(forLoop.iterable, env)) {
          final EvalEnv env3 = env.sub();
          env3.declare(forLoop.iterator, value);
          final Returned returned = exec(forLoop.body, env3);
          if (returned != null) {
            return returned;
          }
        }
        return null;

      case RETURN:
        final Ast.Return returnStmt = (Ast.Return) stmt;
        return new Returned(returnStmt.exp == null
            ? null
            : eval(returnStmt.exp, env));

      default:
        throw new CompileException("cannot evaluate " + stmt.op, stmt.pos);
    }
  }

  private void assign(Ast.Assign assign, EvalEnv env) {
    final String name = assign.target.name;
    final Object previous = env.getOpt(name);
    if (previous == null) {
      throw new CompileException("unknown variable '" + name + "'",
          assign.target.pos);
    }
    final Op op = assign.op.arithmeticOp();
    Object value = eval(assign.exp, env);
    if (op != null) {
      value = binary(op, previous, value, assign);
    }
    if (previous instanceof Double && value instanceof Integer) {
      value = ((Integer) value).doubleValue();
    }
    env.assign(name, value);
  }

  /** Converts a value to a declared type; an {@code int} (or list of
   * {@code int}) becomes a {@code float} (or list of {@code float}). */
  private static Object coerce(Ast.@Nullable TypeExp type, Object value) {
    if (type == null || !type.name.equals("float")) {
      return value;
    }
    if (type.array && value instanceof List) {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (Object o : (List<?>) value) {
        b.add(o instanceof Integer ? ((Integer) o).doubleValue() : o);
      }
      return b.build();
    }
    if (value instanceof Integer) {
      return ((Integer) value).doubleValue();
    }
    return value;
  }

  private static String describe(Object o) {
    if (o instanceof Integer) {
      return "int " + o;
    } else if (o instanceof Double) {
      return "float " + o;
    } else if (o instanceof Boolean) {
      return "bool " + o;
    } else if (o instanceof String) {
      return "str";
    } else if (o instanceof List) {
      return "list";
    } else {
      return o.getClass().getSimpleName();
    }
  }

  private static SemanticException error(String message, AstNode node) {
    return new SemanticException(message, node.pos);
  }

  /** Result of a {@code return} statement. */
  public static class Returned {
    /** Returned value, or null if the statement has no expression. */
    public final @Nullable Object value;

    Returned(@Nullable Object value) {
      this.value = value;
    }
  }
}

// End Evaluator.java
