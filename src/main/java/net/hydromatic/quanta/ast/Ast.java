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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.quanta.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import net.hydromatic.quanta.compile.Callee;
import net.hydromatic.quanta.parse.Parsers;
import net.hydromatic.quanta.type.RegisterType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);
  }

  /** Base class for a statement, including declarations. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Literal, such as {@code 1}, {@code 2.5}, {@code true} or
   * {@code "abc"}.
   *
   * <p>The value is an {@link Integer}, {@link Double}, {@link Boolean} or
   * {@link String}. */
  public static class Literal extends Exp {
    public final Object value;

    Literal(Pos pos, Op op, Object value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.BOOL_LITERAL && value instanceof Boolean
          || op == Op.INT_LITERAL && value instanceof Integer
          || op == Op.FLOAT_LITERAL && value instanceof Double
          || op == Op.STRING_LITERAL && value instanceof String,
          "bad literal %s %s", op, value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal) o).op
              && value.equals(((Literal) o).value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case FLOAT_LITERAL:
          return w.append(BigDecimal.valueOf((Double) value).toPlainString());
        case STRING_LITERAL:
          return w.append(Parsers.quoteString((String) value));
        default:
          return w.append(value.toString());
      }
    }
  }

  /** Reference to a variable, register, constant or function.
   *
   * <p>After semantic analysis, a reference to a class member has a
   * qualified name such as "Ops.N". */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Indexed access, such as {@code q[0]}. */
  public static class Index extends Exp {
    public final Exp exp;
    public final Exp index;

    Index(Pos pos, Exp exp, Exp index) {
      super(pos, Op.INDEX);
      this.exp = requireNonNull(exp);
      this.index = requireNonNull(index);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, index);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Index
              && exp.equals(((Index) o).exp)
              && index.equals(((Index) o).index);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append("[").append(index, 0, 0)
          .append("]");
    }

    /** Creates a copy of this {@code Index} with given contents,
     * or {@code this} if the contents are the same. */
    public Index copy(Exp exp, Exp index) {
      return this.exp.equals(exp) && this.index.equals(index)
          ? this
          : ast.index(pos, exp, index);
    }
  }

  /** Call to an infix operator, such as {@code a + b}. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
              && op == ((InfixCall) o).op
              && a0.equals(((InfixCall) o).a0)
              && a1.equals(((InfixCall) o).a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /** Creates a copy of this {@code InfixCall} with given contents
     * and same operator,
     * or {@code this} if the contents are the same. */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : ast.infixCall(pos, op, a0, a1);
    }
  }

  /** Call to a prefix operator, such as {@code -x} or {@code not b}. */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PrefixCall
              && op == ((PrefixCall) o).op
              && a.equals(((PrefixCall) o).a);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    /** Creates a copy of this {@code PrefixCall} with given contents,
     * or {@code this} if the contents are the same. */
    public PrefixCall copy(Exp a) {
      return this.a.equals(a) ? this : ast.prefixCall(pos, op, a);
    }
  }

  /** Call to a gate, gate-macro, function or built-in, such as
   * {@code ctrl inv RX(q[0], 0.5, q[1])}.
   *
   * <p>Modifiers are ordered outermost first. The parser creates every call
   * with an {@link Callee#UNRESOLVED unresolved} callee; semantic analysis
   * replaces it with the resolved callee. */
  public static class Call extends Exp {
    public final String name;
    public final List<Modifier> modifiers;
    public final List<Exp> args;
    public final Callee callee;

    Call(Pos pos, String name, ImmutableList<Modifier> modifiers,
        ImmutableList<Exp> args, Callee callee) {
      super(pos, Op.CALL);
      this.name = requireNonNull(name);
      this.modifiers = requireNonNull(modifiers);
      this.args = requireNonNull(args);
      this.callee = requireNonNull(callee);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, modifiers, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && name.equals(((Call) o).name)
              && modifiers.equals(((Call) o).modifiers)
              && args.equals(((Call) o).args)
              && callee.equals(((Call) o).callee);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Modifier modifier : modifiers) {
        w.append(modifier.toString()).append(" ");
      }
      return w.append(name).append("(").appendAll(args, ", ").append(")");
    }

    /** Number of leading arguments that are control qubits. */
    public int controlCount() {
      return Modifier.controlCount(modifiers);
    }

    /** Creates a copy of this {@code Call} with given contents,
     * or {@code this} if the contents are the same. */
    public Call copy(String name, List<Modifier> modifiers, List<Exp> args,
        Callee callee) {
      return this.name.equals(name)
          && this.modifiers.equals(modifiers)
          && this.args.equals(args)
          && this.callee.equals(callee)
          ? this
          : ast.call(pos, name, modifiers, args, callee);
    }
  }

  /** List literal, such as {@code [1, 3, 5]}. */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.LIST);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp && args.equals(((ListExp) o).args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args, ", ").append("]");
    }

    /** Creates a copy of this {@code ListExp} with given contents,
     * or {@code this} if the contents are the same. */
    public ListExp copy(List<Exp> args) {
      return this.args.equals(args) ? this : ast.list(pos, args);
    }
  }

  /** Range literal: {@code [start:end]} or {@code [start:step:end]}.
   *
   * <p>The range includes {@code start} and excludes {@code end}. */
  public static class Range extends Exp {
    public final Exp start;
    public final @Nullable Exp step;
    public final Exp end;

    Range(Pos pos, Exp start, @Nullable Exp step, Exp end) {
      super(pos, Op.RANGE);
      this.start = requireNonNull(start);
      this.step = step;
      this.end = requireNonNull(end);
    }

    @Override
    public int hashCode() {
      return Objects.hash(start, step, end);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Range
              && start.equals(((Range) o).start)
              && Objects.equals(step, ((Range) o).step)
              && end.equals(((Range) o).end);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[").append(start, 0, 0).append(":");
      if (step != null) {
        w.append(step, 0, 0).append(":");
      }
      return w.append(end, 0, 0).append("]");
    }

    /** Creates a copy of this {@code Range} with given contents,
     * or {@code this} if the contents are the same. */
    public Range copy(Exp start, @Nullable Exp step, Exp end) {
      return this.start.equals(start)
          && Objects.equals(this.step, step)
          && this.end.equals(end)
          ? this
          : ast.range(pos, start, step, end);
    }
  }

  /** Type annotation, such as {@code int}, {@code qubit[3]} or
   * {@code qubit[]}. */
  public static class TypeExp extends AstNode {
    public final String name;
    /** Whether the type has brackets. */
    public final boolean array;
    /** Size between the brackets, or null. */
    public final @Nullable Integer size;

    TypeExp(Pos pos, String name, boolean array, @Nullable Integer size) {
      super(pos, Op.TYPE);
      this.name = requireNonNull(name);
      this.array = array;
      this.size = size;
      checkArgument(array || size == null);
    }

    @Override
    public TypeExp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name);
      if (array) {
        w.append("[").append(size == null ? "" : size.toString()).append("]");
      }
      return w;
    }
  }

  /** Parameter of a function or gate-macro, such as {@code theta: float}. */
  public static class Param extends AstNode {
    public final String name;
    public final @Nullable TypeExp type;

    Param(Pos pos, String name, @Nullable TypeExp type) {
      super(pos, Op.PARAM);
      this.name = requireNonNull(name);
      this.type = type;
    }

    @Override
    public Param accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name);
      if (type != null) {
        w.append(": ").append(type, 0, 0);
      }
      return w;
    }
  }

  /** Compilation unit: a list of top-level statements. */
  public static class Program extends AstNode {
    public final List<Stmt> statements;

    Program(Pos pos, ImmutableList<Stmt> statements) {
      super(pos, Op.PROGRAM);
      this.statements = requireNonNull(statements);
    }

    @Override
    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(statements, "\n");
    }

    /** Creates a copy of this {@code Program} with given contents,
     * or {@code this} if the contents are the same. */
    public Program copy(List<Stmt> statements) {
      return this.statements.equals(statements)
          ? this
          : ast.program(pos, statements);
    }
  }

  /** Declaration of a quantum or classical register, such as
   * {@code qubit[2] q} or {@code bit c}. */
  public static class QuantumDecl extends Stmt {
    public final RegisterType.Kind kind;
    /** Size expression, or null if the declaration has no brackets (in which
     * case the size is 1). */
    public final @Nullable Exp size;
    public final String name;

    QuantumDecl(Pos pos, RegisterType.Kind kind, @Nullable Exp size,
        String name) {
      super(pos, Op.QUANTUM_DECL);
      this.kind = requireNonNull(kind);
      this.size = size;
      this.name = requireNonNull(name);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(kind.moniker);
      if (size != null) {
        w.append("[").append(size, 0, 0).append("]");
      }
      return w.append(" ").append(name);
    }
  }

  /** Declaration of a variable ({@code var x = 1}) or constant
   * ({@code const N: int = 3}). */
  public static class VarDecl extends Stmt {
    public final String name;
    public final @Nullable TypeExp type;
    public final Exp exp;

    VarDecl(Pos pos, Op op, String name, @Nullable TypeExp type, Exp exp) {
      super(pos, op);
      this.name = requireNonNull(name);
      this.type = type;
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.VAR_DECL || op == Op.CONST_DECL);
    }

    /** Whether the declared name may be assigned to. */
    public boolean isMutable() {
      return op == Op.VAR_DECL;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(isMutable() ? "var " : "const ").append(name);
      if (type != null) {
        w.append(": ").append(type, 0, 0);
      }
      return w.append(" = ").append(exp, 0, 0);
    }

    /** Creates a copy of this {@code VarDecl} with given contents,
     * or {@code this} if the contents are the same. */
    public VarDecl copy(String name, Exp exp) {
      return this.name.equals(name) && this.exp.equals(exp)
          ? this
          : ast.varDecl(pos, op, name, type, exp);
    }
  }

  /** Function declaration, such as
   * {@code def half(x: float) -> float { return x / 2 }}. */
  public static class FunDecl extends Stmt {
    public final String name;
    public final List<Param> params;
    public final @Nullable TypeExp returnType;
    public final Block body;

    FunDecl(Pos pos, String name, ImmutableList<Param> params,
        @Nullable TypeExp returnType, Block body) {
      super(pos, Op.FUN_DECL);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.returnType = returnType;
      this.body = requireNonNull(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("def ").append(name).append("(").appendAll(params, ", ")
          .append(")");
      if (returnType != null) {
        w.append(" -> ").append(returnType, 0, 0);
      }
      return w.append(" ").append(body, 0, 0);
    }

    /** Creates a copy of this {@code FunDecl} with a given name and body,
     * or {@code this} if the contents are the same. */
    public FunDecl copy(String name, Block body) {
      return this.name.equals(name) && this.body.equals(body)
          ? this
          : ast.funDecl(pos, name, params, returnType, body);
    }
  }

  /** Gate-macro declaration, such as
   * {@code gate Bell(a, b) { H(a); CNot(a, b) }}.
   *
   * <p>A parameter without a type annotation is a qubit. */
  public static class GateDecl extends Stmt {
    public final String name;
    public final List<Param> params;
    public final Block body;

    GateDecl(Pos pos, String name, ImmutableList<Param> params, Block body) {
      super(pos, Op.GATE_DECL);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("gate ").append(name).append("(")
          .appendAll(params, ", ").append(") ").append(body, 0, 0);
    }

    /** Creates a copy of this {@code GateDecl} with a given name and body,
     * or {@code this} if the contents are the same. */
    public GateDecl copy(String name, Block body) {
      return this.name.equals(name) && this.body.equals(body)
          ? this
          : ast.gateDecl(pos, name, params, body);
    }
  }

  /** Class declaration; a namespace of constants, functions and
   * gate-macros. */
  public static class ClassDecl extends Stmt {
    public final String name;
    public final List<Stmt> members;

    ClassDecl(Pos pos, String name, ImmutableList<Stmt> members) {
      super(pos, Op.CLASS_DECL);
      this.name = requireNonNull(name);
      this.members = requireNonNull(members);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("class ").append(name).append(" ").block(members);
    }

    /** Creates a copy of this {@code ClassDecl} with given members,
     * or {@code this} if the contents are the same. */
    public ClassDecl copy(List<Stmt> members) {
      return this.members.equals(members)
          ? this
          : ast.classDecl(pos, name, members);
    }
  }

  /** Block of statements, with its own scope. */
  public static class Block extends Stmt {
    public final List<Stmt> statements;

    Block(Pos pos, ImmutableList<Stmt> statements) {
      super(pos, Op.BLOCK);
      this.statements = requireNonNull(statements);
    }

    @Override
    public int hashCode() {
      return statements.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Block
              && statements.equals(((Block) o).statements);
    }

    @Override
    public Block accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.block(statements);
    }

    /** Creates a copy of this {@code Block} with given contents,
     * or {@code this} if the contents are the same. */
    public Block copy(List<Stmt> statements) {
      return this.statements.equals(statements)
          ? this
          : ast.block(pos, statements);
    }
  }

  /** Loop, such as {@code for i in [0:3] { H(q[i]) }}. */
  public static class For extends Stmt {
    public final String iterator;
    public final Exp iterable;
    public final Block body;

    For(Pos pos, String iterator, Exp iterable, Block body) {
      super(pos, Op.FOR);
      this.iterator = requireNonNull(iterator);
      this.iterable = requireNonNull(iterable);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(iterator, iterable, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof For
              && iterator.equals(((For) o).iterator)
              && iterable.equals(((For) o).iterable)
              && body.equals(((For) o).body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for ").append(iterator).append(" in ")
          .append(iterable, 0, 0).append(" ").append(body, 0, 0);
    }

    /** Creates a copy of this {@code For} with given contents,
     * or {@code this} if the contents are the same. */
    public For copy(String iterator, Exp iterable, Block body) {
      return this.iterator.equals(iterator)
          && this.iterable.equals(iterable)
          && this.body.equals(body)
          ? this
          : ast.forLoop(pos, iterator, iterable, body);
    }
  }

  /** Conditional, such as {@code if N > 2 { X(q[0]) } else { Z(q[0]) }}.
   *
   * <p>An {@code elif} clause is an {@code If} that is the only statement in
   * the {@link #ifFalse} block. */
  public static class If extends Stmt {
    public final Exp condition;
    public final Block ifTrue;
    public final @Nullable Block ifFalse;

    If(Pos pos, Exp condition, Block ifTrue, @Nullable Block ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && condition.equals(((If) o).condition)
              && ifTrue.equals(((If) o).ifTrue)
              && Objects.equals(ifFalse, ((If) o).ifFalse);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ").append(condition, 0, 0).append(" ")
          .append(ifTrue, 0, 0);
      if (ifFalse != null) {
        w.append(" else ").append(ifFalse, 0, 0);
      }
      return w;
    }

    /** Creates a copy of this {@code If} with given contents,
     * or {@code this} if the contents are the same. */
    public If copy(Exp condition, Block ifTrue, @Nullable Block ifFalse) {
      return this.condition.equals(condition)
          && this.ifTrue.equals(ifTrue)
          && Objects.equals(this.ifFalse, ifFalse)
          ? this
          : ast.ifThenElse(pos, condition, ifTrue, ifFalse);
    }
  }

  /** Return statement, with or without a value. */
  public static class Return extends Stmt {
    public final @Nullable Exp exp;

    Return(Pos pos, @Nullable Exp exp) {
      super(pos, Op.RETURN);
      this.exp = exp;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Return && Objects.equals(exp, ((Return) o).exp);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("return");
      if (exp != null) {
        w.append(" ").append(exp, 0, 0);
      }
      return w;
    }

    /** Creates a copy of this {@code Return} with given contents,
     * or {@code this} if the contents are the same. */
    public Return copy(@Nullable Exp exp) {
      return Objects.equals(this.exp, exp) ? this : ast.returnStmt(pos, exp);
    }
  }

  /** Assignment to a variable, such as {@code x = 1} or {@code x += 1}. */
  public static class Assign extends Stmt {
    public final Id target;
    public final Exp exp;

    Assign(Pos pos, Op op, Id target, Exp exp) {
      super(pos, op);
      this.target = requireNonNull(target);
      this.exp = requireNonNull(exp);
      checkArgument(Op.ASSIGN_BY_TOKEN.containsValue(op));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, target, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
              && op == ((Assign) o).op
              && target.equals(((Assign) o).target)
              && exp.equals(((Assign) o).exp);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(target, 0, 0).append(op.padded).append(exp, 0, 0);
    }

    /** Creates a copy of this {@code Assign} with given contents,
     * or {@code this} if the contents are the same. */
    public Assign copy(Id target, Exp exp) {
      return this.target.equals(target) && this.exp.equals(exp)
          ? this
          : ast.assign(pos, op, target, exp);
    }
  }

  /** Statement that consists of an expression, usually a call. */
  public static class ExpStmt extends Stmt {
    public final Exp exp;

    ExpStmt(Pos pos, Exp exp) {
      super(pos, Op.EXP_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return exp.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ExpStmt && exp.equals(((ExpStmt) o).exp);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, right);
    }

    /** Creates a copy of this {@code ExpStmt} with given contents,
     * or {@code this} if the contents are the same. */
    public ExpStmt copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.expStmt(pos, exp);
    }
  }

  /** Inlined body of a modified gate-macro call.
   *
   * <p>Created by inlining, and removed by modifier propagation, which gives
   * each gate inside the block the block's modifiers and control qubits. */
  public static class ModifiedBlock extends Stmt {
    public final List<Modifier> modifiers;
    public final List<Exp> controls;
    public final List<Stmt> statements;

    ModifiedBlock(Pos pos, ImmutableList<Modifier> modifiers,
        ImmutableList<Exp> controls, ImmutableList<Stmt> statements) {
      super(pos, Op.MODIFIED_BLOCK);
      this.modifiers = requireNonNull(modifiers);
      this.controls = requireNonNull(controls);
      this.statements = requireNonNull(statements);
      checkArgument(Modifier.controlCount(modifiers) == controls.size());
    }

    @Override
    public int hashCode() {
      return Objects.hash(modifiers, controls, statements);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ModifiedBlock
              && modifiers.equals(((ModifiedBlock) o).modifiers)
              && controls.equals(((ModifiedBlock) o).controls)
              && statements.equals(((ModifiedBlock) o).statements);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Modifier modifier : modifiers) {
        w.append(modifier.toString()).append(" ");
      }
      return w.append("(").appendAll(controls, ", ").append(") ")
          .block(statements);
    }

    /** Creates a copy of this {@code ModifiedBlock} with given contents,
     * or {@code this} if the contents are the same. */
    public ModifiedBlock copy(List<Exp> controls, List<Stmt> statements) {
      return this.controls.equals(controls)
          && this.statements.equals(statements)
          ? this
          : ast.modifiedBlock(pos, modifiers, controls, statements);
    }
  }
}

// End Ast.java
