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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Pos;
import net.hydromatic.quanta.ast.Visitor;
import net.hydromatic.quanta.eval.EvalEnv;
import net.hydromatic.quanta.eval.Evaluator;
import net.hydromatic.quanta.type.ListType;
import net.hydromatic.quanta.type.PrimitiveType;
import net.hydromatic.quanta.type.RegisterType;
import net.hydromatic.quanta.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Validates a program and resolves its names.
 *
 * <p>Analysis runs in passes:
 *
 * <ol>
 *   <li>Declare: hoist functions, gate-macros and classes into the global
 *   scope, and class functions and gate-macros into their class.
 *   <li>Resolve: walk top-level statements in order, then the bodies of
 *   functions and gate-macros. Every identifier is resolved to a
 *   {@link Binding}, every call to a {@link Callee}, and every expression
 *   is given a type and a {@link Staticness}.
 *   <li>Check that the {@link CallGraph} is acyclic.
 *   <li>Classify functions as quantum or classical, and run checks that
 *   depend on the classification.
 * </ol>
 *
 * <p>The first violation throws {@link SemanticException}.
 */
public class Analyzer {
  private final Map<Prop, Object> props;
  private final SymbolTable.Builder symbols = SymbolTable.builder();
  private final CallGraph callGraph = new CallGraph();

  /** Original declarations, by key. */
  private final Map<String, Ast.FunDecl> funDecls = new LinkedHashMap<>();
  private final Map<String, Ast.GateDecl> gateDecls = new LinkedHashMap<>();
  /** Resolved declarations, by key. */
  private final Map<String, Ast.Stmt> resolvedDecls = new HashMap<>();

  /** Members of each class, by member name; constants are added as they are
   * resolved. */
  private final Map<String, Map<String, Binding>> classMembers =
      new HashMap<>();
  /** Names of all members of each class. */
  private final Map<String, Set<String>> classMemberNames = new HashMap<>();

  private final Map<String, Body> bodies = new LinkedHashMap<>();
  private final List<PendingBody> pendingBodies = new ArrayList<>();
  private final List<Runnable> pendingChecks = new ArrayList<>();
  private final Deque<Usage> usages = new ArrayDeque<>();

  /** Keys of functions and gate-macros that have quantum effects. */
  private final Set<String> quantumKeys = new HashSet<>();
  /** Keys of functions and gate-macros that reach a non-unitary
   * operation. */
  private final Set<String> nonUnitaryKeys = new HashSet<>();

  /** Key of the function, gate-macro or constant whose definition is being
   * resolved, or null at top level. */
  private @Nullable String owner;

  private Analyzer(Map<Prop, Object> props) {
    this.props = requireNonNull(props);
  }

  /** Analyzes a program. */
  public static Analysis analyze(Ast.Program program,
      Map<Prop, Object> props) {
    return new Analyzer(props).analyze(program);
  }

  private Analysis analyze(Ast.Program program) {
    final Scope global =
        new Scope(Environments.empty(), null, null, true);
    for (Ast.Stmt statement : program.statements) {
      declare(statement, global);
    }

    final Usage programUsage = new Usage();
    usages.push(programUsage);
    final List<Ast.Stmt> statements = new ArrayList<>();
    for (Ast.Stmt statement : program.statements) {
      statements.add(resolve(statement, global));
    }
    usages.pop();

    for (PendingBody pendingBody : pendingBodies) {
      resolveBody(pendingBody, global.env);
    }

    callGraph.checkAcyclic();
    classify();
    pendingChecks.forEach(Runnable::run);

    final List<Ast.Stmt> statements2 = new ArrayList<>();
    for (Ast.Stmt statement : statements) {
      statements2.add(replaceDecls(statement));
    }
    final SymbolTable symbolTable = symbols.build();
    return new Analysis(program.copy(statements2), symbolTable, callGraph);
  }

  // Pass 1. Declare

  private void declare(Ast.Stmt statement, Scope global) {
    switch (statement.op) {
      case FUN_DECL:
        final Ast.FunDecl funDecl = (Ast.FunDecl) statement;
        declareFunction(funDecl, funDecl.name, global, null);
        break;

      case GATE_DECL:
        final Ast.GateDecl gateDecl = (Ast.GateDecl) statement;
        declareGate(gateDecl, gateDecl.name, global, null);
        break;

      case CLASS_DECL:
        final Ast.ClassDecl classDecl = (Ast.ClassDecl) statement;
        global.declare(
            Binding.declaration(classDecl.name, Binding.Kind.CLASS,
                classDecl.name),
            classDecl.pos);
        final Map<String, Binding> members = new LinkedHashMap<>();
        final Set<String> names = new LinkedHashSet<>();
        classMembers.put(classDecl.name, members);
        classMemberNames.put(classDecl.name, names);
        for (Ast.Stmt member : classDecl.members) {
          final String name = memberName(member);
          if (!names.add(name)) {
            throw error("duplicate declaration of '" + name + "' in class '"
                + classDecl.name + "'", member.pos);
          }
          final String key = classDecl.name + "." + name;
          if (member instanceof Ast.FunDecl) {
            members.put(name,
                declareFunction((Ast.FunDecl) member, key, null,
                    classDecl.name));
          } else if (member instanceof Ast.GateDecl) {
            members.put(name,
                declareGate((Ast.GateDecl) member, key, null,
                    classDecl.name));
          }
        }
        break;

      default:
        break;
    }
  }

  private String memberName(Ast.Stmt member) {
    if (member instanceof Ast.FunDecl) {
      return ((Ast.FunDecl) member).name;
    } else if (member instanceof Ast.GateDecl) {
      return ((Ast.GateDecl) member).name;
    } else if (member instanceof Ast.VarDecl
        && !((Ast.VarDecl) member).isMutable()) {
      return ((Ast.VarDecl) member).name;
    } else {
      throw error("class member must be a constant, function or gate",
          member.pos);
    }
  }

  private Binding declareFunction(Ast.FunDecl funDecl, String key,
      @Nullable Scope scope, @Nullable String className) {
    checkNotBuiltIn(funDecl.name, funDecl.pos);
    final Binding binding =
        Binding.declaration(funDecl.name, Binding.Kind.FUNCTION, key);
    if (scope != null) {
      scope.declare(binding, funDecl.pos);
    }
    funDecls.put(key, funDecl);
    callGraph.addNode(key);
    pendingBodies.add(new PendingBody(funDecl, key, className));
    return binding;
  }

  private Binding declareGate(Ast.GateDecl gateDecl, String key,
      @Nullable Scope scope, @Nullable String className) {
    checkNotBuiltIn(gateDecl.name, gateDecl.pos);
    final Binding binding =
        Binding.declaration(gateDecl.name, Binding.Kind.GATE_MACRO, key);
    if (scope != null) {
      scope.declare(binding, gateDecl.pos);
    }
    gateDecls.put(key, gateDecl);
    callGraph.addNode(key);
    pendingBodies.add(new PendingBody(gateDecl, key, className));
    return binding;
  }

  private static void checkNotBuiltIn(String name, Pos pos) {
    if (Gate.lookup(name) != null || BuiltIn.lookup(name) != null) {
      throw error("cannot redefine built-in '" + name + "'", pos);
    }
  }

  // Pass 2. Resolve statements

  private List<Ast.Stmt> resolveAll(List<Ast.Stmt> statements,
      Scope scope) {
    final List<Ast.Stmt> list = new ArrayList<>();
    for (Ast.Stmt statement : statements) {
      list.add(resolve(statement, scope));
    }
    return list;
  }

  private Ast.Block resolveBlock(Ast.Block block, Scope scope) {
    return block.copy(resolveAll(block.statements, scope.child()));
  }

  private Ast.Stmt resolve(Ast.Stmt statement, Scope scope) {
    switch (statement.op) {
      case QUANTUM_DECL:
        return resolveRegister((Ast.QuantumDecl) statement, scope);

      case VAR_DECL:
      case CONST_DECL:
        return resolveVarDecl((Ast.VarDecl) statement, scope, null);

      case FUN_DECL:
      case GATE_DECL:
        if (!scope.global) {
          throw error("functions and gates must be declared at top level or"
              + " in a class", statement.pos);
        }
        return statement; // body is resolved later

      case CLASS_DECL:
        if (!scope.global) {
          throw error("classes must be declared at top level",
              statement.pos);
        }
        return resolveClass((Ast.ClassDecl) statement, scope);

      case BLOCK:
        return resolveBlock((Ast.Block) statement, scope);

      case FOR:
        return resolveFor((Ast.For) statement, scope);

      case IF:
        return resolveIf((Ast.If) statement, scope);

      case RETURN:
        return resolveReturn((Ast.Return) statement, scope);

      case ASSIGN:
      case PLUS_ASSIGN:
      case MINUS_ASSIGN:
      case TIMES_ASSIGN:
        return resolveAssign((Ast.Assign) statement, scope);

      case EXP_STMT:
        final Ast.ExpStmt expStmt = (Ast.ExpStmt) statement;
        if (!(expStmt.exp instanceof Ast.Call)) {
          throw error("expression statement must be a call", expStmt.pos);
        }
        final Resolved r = resolveCall((Ast.Call) expStmt.exp, scope, true);
        return expStmt.copy(r.exp);

      default:
        throw new CompileException("unexpected statement " + statement.op,
            statement.pos);
    }
  }

  private Ast.Stmt resolveRegister(Ast.QuantumDecl decl, Scope scope) {
    if (!scope.global) {
      throw error("register '" + decl.name + "' must be declared at top level",
          decl.pos);
    }
    int size = 1;
    Ast.Exp sizeExp = null;
    if (decl.size != null) {
      final Resolved r = resolveValue(decl.size, scope);
      checkType(PrimitiveType.INT, r, "register size");
      final Object value = constantValue(r);
      if (value == null) {
        throw error("size of register '" + decl.name
            + "' must be a constant expression", decl.size.pos);
      }
      size = (Integer) value;
      if (size < 1) {
        throw error("size of register '" + decl.name
            + "' must be at least 1, was " + size, decl.size.pos);
      }
      sizeExp = ast.intLiteral(decl.size.pos, size);
    }
    final RegisterType type = RegisterType.of(decl.kind, size);
    scope.declare(
        Binding.of(decl.name, Binding.Kind.REGISTER, type, decl.name,
            Staticness.CONSTANT, 0),
        decl.pos);
    symbols.register(decl.name, type);
    return ast.quantumDecl(decl.pos, decl.kind, sizeExp, decl.name);
  }

  /** Resolves a variable or constant declaration. If {@code className} is
   * not null, the declaration is a class constant. */
  private Ast.VarDecl resolveVarDecl(Ast.VarDecl decl, Scope scope,
      @Nullable String className) {
    final boolean global =
        !decl.isMutable() && (scope.global || className != null);
    final String key =
        className != null ? className + "." + decl.name : decl.name;
    final String previousOwner = owner;
    if (global) {
      owner = key;
      callGraph.addNode(key);
    }
    final Resolved r;
    try {
      r = resolveValue(decl.exp, scope);
    } finally {
      owner = previousOwner;
    }
    final Type type;
    if (decl.type != null) {
      type = typeOf(decl.type);
      if (type.isQuantum()) {
        throw error("variable '" + decl.name
            + "' cannot have a quantum type", decl.type.pos);
      }
      checkType(type, r, "value of '" + decl.name + "'");
    } else if (r.type instanceof ListType
        && ((ListType) r.type).elementType == PrimitiveType.UNIT) {
      throw error("cannot infer the type of '" + decl.name
          + "'; add a type annotation", decl.pos);
    } else {
      type = r.type;
    }

    final Binding binding;
    if (decl.isMutable()) {
      binding = Binding.of(decl.name, Binding.Kind.VARIABLE, type, key,
          Staticness.DYNAMIC, scope.functionDepth());
    } else if (global) {
      if (r.staticness != Staticness.CONSTANT) {
        throw error("value of constant '" + decl.name
            + "' must be known at compile time", decl.exp.pos);
      }
      binding = Binding.of(decl.name, Binding.Kind.CONSTANT, type, key,
          Staticness.CONSTANT, 0);
    } else {
      binding = Binding.of(decl.name, Binding.Kind.CONSTANT, type, key,
          r.staticness.max(Staticness.STATIC), scope.functionDepth());
    }
    scope.declare(binding, decl.pos);

    final Ast.VarDecl decl2 =
        ast.varDecl(decl.pos, decl.op, key, decl.type, r.exp);
    if (global) {
      symbols.constant(key, decl2);
    }
    if (className != null) {
      classMembers.get(className).put(decl.name, binding);
    }
    return decl2;
  }

  private Ast.Stmt resolveClass(Ast.ClassDecl classDecl, Scope scope) {
    final Scope classScope = scope.child();
    classMembers.get(classDecl.name).values()
        .forEach(b -> classScope.env = classScope.env.bind(b));
    final List<Ast.Stmt> members = new ArrayList<>();
    for (Ast.Stmt member : classDecl.members) {
      if (member instanceof Ast.VarDecl) {
        members.add(
            resolveVarDecl((Ast.VarDecl) member, classScope, classDecl.name));
      } else {
        members.add(member); // body is resolved later
      }
    }
    return classDecl.copy(members);
  }

  private Ast.Stmt resolveFor(Ast.For forLoop, Scope scope) {
    final Resolved iterable = resolveValue(forLoop.iterable, scope);
    if (!(iterable.type instanceof ListType)) {
      throw error("cannot iterate over value of type "
          + iterable.type.moniker(), forLoop.iterable.pos);
    }
    final Type elementType = ((ListType) iterable.type).elementType;
    final Scope loopScope = scope.child();
    loopScope.declare(
        Binding.of(forLoop.iterator, Binding.Kind.ITERATOR, elementType,
            forLoop.iterator, Staticness.STATIC, scope.functionDepth()),
        forLoop.pos);
    final Usage usage = new Usage();
    usages.push(usage);
    final Ast.Block body = resolveBlock(forLoop.body, loopScope);
    usages.pop();
    if (iterable.staticness == Staticness.DYNAMIC) {
      pendingChecks.add(() -> {
        if (isQuantum(usage)) {
          throw error("range of a loop that contains quantum operations "
              + "must be known at compile time", forLoop.iterable.pos);
        }
      });
    }
    return forLoop.copy(forLoop.iterator, iterable.exp, body);
  }

  private Ast.Stmt resolveIf(Ast.If ifThenElse, Scope scope) {
    final Resolved condition = resolveValue(ifThenElse.condition, scope);
    checkType(PrimitiveType.BOOL, condition, "condition");
    final Usage usage = new Usage();
    usages.push(usage);
    final Ast.Block ifTrue = resolveBlock(ifThenElse.ifTrue, scope);
    final Ast.Block ifFalse = ifThenElse.ifFalse == null
        ? null
        : resolveBlock(ifThenElse.ifFalse, scope);
    usages.pop();
    if (condition.staticness == Staticness.DYNAMIC) {
      pendingChecks.add(() -> {
        if (isQuantum(usage)) {
          throw error("condition that guards quantum operations must be "
              + "known at compile time", ifThenElse.condition.pos);
        }
      });
    }
    return ifThenElse.copy(condition.exp, ifTrue, ifFalse);
  }

  private Ast.Stmt resolveReturn(Ast.Return returnStmt, Scope scope) {
    final Body body = scope.body;
    if (body == null) {
      throw error("return outside of function", returnStmt.pos);
    }
    if (body.gate) {
      throw error("return is not allowed in gate '" + body.name + "'",
          returnStmt.pos);
    }
    if (body.returnPos == null) {
      body.returnPos = returnStmt.pos;
    }
    if (returnStmt.exp == null) {
      if (body.resultType != PrimitiveType.UNIT) {
        throw error("function '" + body.name + "' must return a value of "
            + "type " + body.resultType.moniker(), returnStmt.pos);
      }
      return returnStmt;
    }
    if (body.resultType == PrimitiveType.UNIT) {
      throw error("function '" + body.name + "' has no return type, so "
          + "cannot return a value", returnStmt.pos);
    }
    final Resolved r = resolveValue(returnStmt.exp, scope);
    checkType(body.resultType, r, "return value");
    return returnStmt.copy(r.exp);
  }

  private Ast.Stmt resolveAssign(Ast.Assign assign, Scope scope) {
    final Binding binding = lookup(assign.target, scope);
    if (binding.kind != Binding.Kind.VARIABLE) {
      throw error("cannot assign to " + binding.kind.description + " '"
          + assign.target.name + "'", assign.target.pos);
    }
    final Resolved r = resolveValue(assign.exp, scope);
    final Op op = assign.op.arithmeticOp();
    final Type type = op == null
        ? r.type
        : binaryType(op, binding.type, r.type, assign.pos);
    if (!binding.type.accepts(type)) {
      throw error("type mismatch: cannot assign " + type.moniker()
          + " to variable '" + assign.target.name + "' of type "
          + binding.type.moniker(), assign.exp.pos);
    }
    return assign.copy(ast.id(assign.target.pos, binding.key), r.exp);
  }

  // Bodies of functions and gate-macros

  private void resolveBody(PendingBody pending, Environment globalEnv) {
    Environment env = globalEnv;
    if (pending.className != null) {
      for (Binding b : classMembers.get(pending.className).values()) {
        env = env.bind(b);
      }
    }
    final boolean gate = pending.decl instanceof Ast.GateDecl;
    final String name = gate
        ? ((Ast.GateDecl) pending.decl).name
        : ((Ast.FunDecl) pending.decl).name;
    final List<Ast.Param> params = gate
        ? ((Ast.GateDecl) pending.decl).params
        : ((Ast.FunDecl) pending.decl).params;
    final Ast.TypeExp returnType = gate
        ? null
        : ((Ast.FunDecl) pending.decl).returnType;
    final Ast.Block block = gate
        ? ((Ast.GateDecl) pending.decl).body
        : ((Ast.FunDecl) pending.decl).body;

    final Type resultType =
        returnType == null ? PrimitiveType.UNIT : typeOf(returnType);
    if (resultType.isQuantum()) {
      throw error("function '" + name + "' cannot return a quantum value",
          requireNonNull(returnType).pos);
    }
    final Body body =
        new Body(pending.key, name, gate, returnType, resultType);
    bodies.put(pending.key, body);
    final Scope scope = new Scope(env, body, pending.className, false);
    for (Ast.Param param : params) {
      final Type type = paramType(param, gate, name);
      if (type.isQuantum()) {
        body.quantumParam = true;
      }
      scope.declare(
          Binding.of(param.name, Binding.Kind.PARAMETER, type, param.name,
              Staticness.STATIC, 1),
          param.pos);
    }

    final String previousOwner = owner;
    owner = pending.key;
    usages.push(body.usage);
    final Ast.Block block2;
    try {
      block2 = block.copy(resolveAll(block.statements, scope));
    } finally {
      usages.pop();
      owner = previousOwner;
    }
    if (gate) {
      final Ast.GateDecl gateDecl =
          ((Ast.GateDecl) pending.decl).copy(pending.key, block2);
      symbols.gate(pending.key, gateDecl);
      resolvedDecls.put(pending.key, gateDecl);
    } else {
      final Ast.FunDecl funDecl =
          ((Ast.FunDecl) pending.decl).copy(pending.key, block2);
      symbols.function(pending.key, funDecl);
      resolvedDecls.put(pending.key, funDecl);
    }
  }

  private Type paramType(Ast.Param param, boolean gate, String name) {
    if (param.type == null) {
      if (gate) {
        return PrimitiveType.QUBIT;
      }
      throw error("parameter '" + param.name + "' of function '" + name
          + "' must have a type", param.pos);
    }
    return typeOf(param.type);
  }

  /** Replaces a top-level declaration with its resolved version. */
  private Ast.Stmt replaceDecls(Ast.Stmt statement) {
    switch (statement.op) {
      case FUN_DECL:
        return requireNonNull(
            resolvedDecls.get(((Ast.FunDecl) statement).name));
      case GATE_DECL:
        return requireNonNull(
            resolvedDecls.get(((Ast.GateDecl) statement).name));
      case CLASS_DECL:
        final Ast.ClassDecl classDecl = (Ast.ClassDecl) statement;
        final List<Ast.Stmt> members = new ArrayList<>();
        for (Ast.Stmt member : classDecl.members) {
          if (member instanceof Ast.FunDecl) {
            members.add(
                requireNonNull(resolvedDecls.get(classDecl.name + "."
                    + ((Ast.FunDecl) member).name)));
          } else if (member instanceof Ast.GateDecl) {
            members.add(
                requireNonNull(resolvedDecls.get(classDecl.name + "."
                    + ((Ast.GateDecl) member).name)));
          } else {
            members.add(member);
          }
        }
        return classDecl.copy(members);
      default:
        return statement;
    }
  }

  // Expressions

  /** Resolves an expression whose value is used. */
  private Resolved resolveValue(Ast.Exp exp, Scope scope) {
    final Resolved r = resolveExp(exp, scope);
    if (r.type == PrimitiveType.UNIT) {
      throw error("'" + exp + "' does not return a value", exp.pos);
    }
    return r;
  }

  private Resolved resolveExp(Ast.Exp exp, Scope scope) {
    switch (exp.op) {
      case BOOL_LITERAL:
        return new Resolved(exp, PrimitiveType.BOOL, Staticness.CONSTANT);
      case INT_LITERAL:
        return new Resolved(exp, PrimitiveType.INT, Staticness.CONSTANT);
      case FLOAT_LITERAL:
        return new Resolved(exp, PrimitiveType.FLOAT, Staticness.CONSTANT);
      case STRING_LITERAL:
        return new Resolved(exp, PrimitiveType.STR, Staticness.CONSTANT);

      case ID:
        return resolveId((Ast.Id) exp, scope);

      case INDEX:
        final Ast.Index index = (Ast.Index) exp;
        final Resolved list = resolveValue(index.exp, scope);
        if (!(list.type instanceof ListType)) {
          throw error("cannot index value of type " + list.type.moniker(),
              index.exp.pos);
        }
        final Resolved i = resolveValue(index.index, scope);
        checkType(PrimitiveType.INT, i, "index");
        return new Resolved(index.copy(list.exp, i.exp),
            ((ListType) list.type).elementType,
            list.staticness.max(i.staticness));

      case NEGATE:
        final Ast.PrefixCall negate = (Ast.PrefixCall) exp;
        final Resolved a = resolveValue(negate.a, scope);
        if (!a.type.isNumeric()) {
          throw error("operator '-' cannot be applied to "
              + a.type.moniker(), exp.pos);
        }
        return new Resolved(negate.copy(a.exp), a.type, a.staticness);

      case NOT:
        final Ast.PrefixCall not = (Ast.PrefixCall) exp;
        final Resolved b = resolveValue(not.a, scope);
        checkType(PrimitiveType.BOOL, b, "operand of 'not'");
        return new Resolved(not.copy(b.exp), PrimitiveType.BOOL,
            b.staticness);

      case CALL:
        return resolveCall((Ast.Call) exp, scope, false);

      case LIST:
        return resolveList((Ast.ListExp) exp, scope);

      case RANGE:
        final Ast.Range range = (Ast.Range) exp;
        final Resolved start = resolveValue(range.start, scope);
        checkType(PrimitiveType.INT, start, "range start");
        Staticness staticness = start.staticness;
        Ast.Exp step = null;
        if (range.step != null) {
          final Resolved s = resolveValue(range.step, scope);
          checkType(PrimitiveType.INT, s, "range step");
          if (s.exp instanceof Ast.Literal
              && ((Ast.Literal) s.exp).value.equals(0)) {
            throw error("range step must not be zero", range.step.pos);
          }
          staticness = staticness.max(s.staticness);
          step = s.exp;
        }
        final Resolved end = resolveValue(range.end, scope);
        checkType(PrimitiveType.INT, end, "range end");
        return new Resolved(range.copy(start.exp, step, end.exp),
            ListType.of(PrimitiveType.INT), staticness.max(end.staticness));

      default:
        final Ast.InfixCall infix = (Ast.InfixCall) exp;
        final Resolved a0 = resolveValue(infix.a0, scope);
        final Resolved a1 = resolveValue(infix.a1, scope);
        return new Resolved(infix.copy(a0.exp, a1.exp),
            binaryType(infix.op, a0.type, a1.type, infix.pos),
            a0.staticness.max(a1.staticness));
    }
  }

  private Resolved resolveId(Ast.Id id, Scope scope) {
    final Binding binding = lookupOpt(id, scope);
    if (binding == null) {
      final BuiltIn builtIn = BuiltIn.lookup(id.name);
      if (builtIn != null && builtIn.isConstant()) {
        return new Resolved(id, PrimitiveType.FLOAT, Staticness.CONSTANT);
      }
      if (builtIn != null || Gate.lookup(id.name) != null) {
        throw error("'" + id.name + "' cannot be used as a value", id.pos);
      }
      throw undeclared(id);
    }
    if (!binding.isValue()) {
      throw error(binding.kind.description + " '" + id.name
          + "' cannot be used as a value", id.pos);
    }
    if (binding.type.isQuantum()) {
      if (binding.type == PrimitiveType.BIT
          || binding.type instanceof RegisterType
              && ((RegisterType) binding.type).kind == RegisterType.Kind.BIT) {
        throw error("cannot read bit '" + id.name + "'; measurement "
            + "results are not classical values", id.pos);
      }
      throw error("qubit '" + id.name + "' cannot be used as a value",
          id.pos);
    }
    return new Resolved(ast.id(id.pos, binding.key), binding.type,
        binding.staticness);
  }

  private Binding lookup(Ast.Id id, Scope scope) {
    final Binding binding = lookupOpt(id, scope);
    if (binding == null) {
      throw undeclared(id);
    }
    return binding;
  }

  /** Looks up an identifier, which may be qualified ("Ops.N").
   * Records a reference to a constant in the call graph, and checks that a
   * function body does not refer to a global variable. */
  private @Nullable Binding lookupOpt(Ast.Id id, Scope scope) {
    final Binding binding;
    final int dot = id.name.indexOf('.');
    if (dot >= 0) {
      binding = classMember(id.name.substring(0, dot),
          id.name.substring(dot + 1), id.pos);
    } else {
      binding = scope.env.getOpt(id.name);
    }
    if (binding == null) {
      return null;
    }
    if (binding.kind == Binding.Kind.VARIABLE
        && binding.functionDepth < scope.functionDepth()) {
      throw error(scope.describeBody() + " cannot refer to variable '"
          + id.name + "' of an enclosing scope", id.pos);
    }
    if (binding.kind == Binding.Kind.CONSTANT
        && binding.functionDepth == 0
        && symbolsHaveConstant(binding.key)
        && owner != null) {
      callGraph.addEdge(owner, binding.key, id.pos);
    }
    return binding;
  }

  private boolean symbolsHaveConstant(String key) {
    return symbols.constants.containsKey(key);
  }

  private Binding classMember(String className, String memberName,
      Pos pos) {
    final Map<String, Binding> members = classMembers.get(className);
    if (members == null) {
      throw error("unknown class '" + className + "'", pos);
    }
    final Binding binding = members.get(memberName);
    if (binding == null) {
      if (classMemberNames.get(className).contains(memberName)) {
        throw error("class member '" + className + "." + memberName
            + "' is used before its declaration", pos);
      }
      throw error("class '" + className + "' has no member '" + memberName
          + "'", pos);
    }
    return binding;
  }

  private Resolved resolveList(Ast.ListExp list, Scope scope) {
    if (list.args.isEmpty()) {
      return new Resolved(list, ListType.of(PrimitiveType.UNIT),
          Staticness.CONSTANT);
    }
    final List<Ast.Exp> args = new ArrayList<>();
    Type elementType = null;
    Staticness staticness = Staticness.CONSTANT;
    for (Ast.Exp arg : list.args) {
      final Resolved r = resolveValue(arg, scope);
      args.add(r.exp);
      staticness = staticness.max(r.staticness);
      if (elementType == null || r.type.accepts(elementType)) {
        elementType = r.type;
      } else if (!elementType.accepts(r.type)) {
        throw error("list elements must have the same type; "
            + elementType.moniker() + " and " + r.type.moniker(), arg.pos);
      }
    }
    return new Resolved(list.copy(args),
        ListType.of(requireNonNull(elementType)), staticness);
  }

  /** Returns the type of a binary operator applied to operands of given
   * types. */
  private static Type binaryType(Op op, Type t0, Type t1, Pos pos) {
    switch (op) {
      case AND:
      case OR:
        if (t0 == PrimitiveType.BOOL && t1 == PrimitiveType.BOOL) {
          return PrimitiveType.BOOL;
        }
        break;

      case EQ:
      case NE:
        if (t0.isNumeric() && t1.isNumeric()
            || t0.accepts(t1) || t1.accepts(t0)) {
          return PrimitiveType.BOOL;
        }
        break;

      case LT:
      case LE:
      case GT:
      case GE:
        if (t0.isNumeric() && t1.isNumeric()
            || t0 == PrimitiveType.STR && t1 == PrimitiveType.STR) {
          return PrimitiveType.BOOL;
        }
        break;

      case PLUS:
        if (t0 == PrimitiveType.STR && t1 == PrimitiveType.STR) {
          return PrimitiveType.STR;
        }
        if (t0 instanceof ListType && t1 instanceof ListType) {
          if (t0.accepts(t1)) {
            return t0;
          }
          if (t1.accepts(t0)) {
            return t1;
          }
        }
        // fall through
      case MINUS:
      case TIMES:
      case FLOOR_DIVIDE:
      case MOD:
      case POWER:
        if (t0.isNumeric() && t1.isNumeric()) {
          return t0 == PrimitiveType.INT && t1 == PrimitiveType.INT
              ? PrimitiveType.INT
              : PrimitiveType.FLOAT;
        }
        break;

      case DIVIDE:
        if (t0.isNumeric() && t1.isNumeric()) {
          return PrimitiveType.FLOAT;
        }
        break;

      default:
        break;
    }
    throw error("operator '" + op.padded.trim() + "' cannot be applied to "
        + t0.moniker() + " and " + t1.moniker(), pos);
  }

  // Calls

  private Resolved resolveCall(Ast.Call call, Scope scope,
      boolean statement) {
    final Callee callee = lookupCallee(call, scope);
    switch (callee.kind) {
      case GATE:
        return resolveGateCall(call, callee, scope, statement);
      case GATE_MACRO:
        return resolveMacroCall(call, callee, scope, statement);
      case FUNCTION:
        return resolveFunctionCall(call, callee, scope, statement);
      default:
        return resolveBuiltInCall(call, callee, scope);
    }
  }

  private Callee lookupCallee(Ast.Call call, Scope scope) {
    final Binding binding = lookupOpt(ast.id(call.pos, call.name), scope);
    if (binding != null) {
      switch (binding.kind) {
        case FUNCTION:
          return Callee.function(binding.key);
        case GATE_MACRO:
          return Callee.gateMacro(binding.key);
        default:
          throw error(binding.kind.description + " '" + call.name
              + "' is not callable", call.pos);
      }
    }
    final Gate gate = Gate.lookup(call.name);
    if (gate != null) {
      return Callee.gate(gate);
    }
    final BuiltIn builtIn = BuiltIn.lookup(call.name);
    if (builtIn != null) {
      if (builtIn.isConstant()) {
        throw error("'" + call.name + "' is not callable", call.pos);
      }
      return Callee.builtIn(builtIn);
    }
    throw error("unknown gate or function '" + call.name + "'", call.pos);
  }

  private Resolved resolveGateCall(Ast.Call call, Callee callee,
      Scope scope, boolean statement) {
    final Gate gate = callee.gate();
    if (!statement) {
      throw error("gate '" + call.name + "' cannot be used in an "
          + "expression", call.pos);
    }
    if (!gate.unitary && !call.modifiers.isEmpty()) {
      throw error("modifier '" + call.modifiers.get(0) + "' cannot be "
          + "applied to non-unitary operation '" + call.name + "'",
          call.pos);
    }
    final int controlCount = call.controlCount();
    final List<Ast.Exp> args = new ArrayList<>();
    final List<Operand> operands = new ArrayList<>();
    switch (gate) {
      case BARRIER:
        if (call.args.isEmpty()) {
          throw error("'" + call.name + "' requires at least one qubit",
              call.pos);
        }
        for (Ast.Exp arg : call.args) {
          final Operand operand =
              resolveOperand(arg, RegisterType.Kind.QUBIT, scope);
          args.add(operand.exp);
        }
        break;

      case MEASURE_ALL:
        checkArgCount(call, 2);
        final Operand q =
            resolveOperand(call.args.get(0), RegisterType.Kind.QUBIT, scope);
        final Operand c =
            resolveOperand(call.args.get(1), RegisterType.Kind.BIT, scope);
        if (!(q.type instanceof RegisterType)
            || !(c.type instanceof RegisterType)) {
          throw error("arguments of '" + call.name + "' must be registers",
              call.pos);
        }
        operands.add(q);
        operands.add(c);
        args.add(q.exp);
        args.add(c.exp);
        break;

      default:
        checkArgCount(call,
            controlCount + gate.paramCount + gate.qubitCount
                + gate.bitCount);
        int i = 0;
        for (; i < controlCount; i++) {
          operands.add(
              resolveOperand(call.args.get(i), RegisterType.Kind.QUBIT,
                  scope));
        }
        for (; i < controlCount + gate.paramCount; i++) {
          final Resolved r = resolveValue(call.args.get(i), scope);
          if (!r.type.isNumeric()) {
            throw error("angle must be int or float, got "
                + r.type.moniker(), call.args.get(i).pos);
          }
          args.add(r.exp);
        }
        for (; i < controlCount + gate.paramCount + gate.qubitCount; i++) {
          operands.add(
              resolveOperand(call.args.get(i), RegisterType.Kind.QUBIT,
                  scope));
        }
        for (; i < call.args.size(); i++) {
          operands.add(
              resolveOperand(call.args.get(i), RegisterType.Kind.BIT,
                  scope));
        }
        // Rebuild in argument order: controls, angles, qubits, bits.
        final List<Ast.Exp> ordered = new ArrayList<>();
        for (int j = 0; j < controlCount; j++) {
          ordered.add(operands.get(j).exp);
        }
        ordered.addAll(args);
        for (int j = controlCount; j < operands.size(); j++) {
          ordered.add(operands.get(j).exp);
        }
        args.clear();
        args.addAll(ordered);
    }
    checkBroadcast(call, operands);
    for (Usage usage : usages) {
      usage.quantum = true;
      if (!gate.unitary) {
        usage.nonUnitary = true;
      }
    }
    return new Resolved(call.copy(call.name, call.modifiers, args, callee),
        PrimitiveType.UNIT, Staticness.CONSTANT);
  }

  /** Checks that registers used in one call have the same size. */
  private static void checkBroadcast(Ast.Call call, List<Operand> operands) {
    int size = -1;
    for (Operand operand : operands) {
      if (operand.type instanceof RegisterType
          && ((RegisterType) operand.type).isSized()) {
        final int size2 = ((RegisterType) operand.type).size;
        if (size >= 0 && size2 != size) {
          throw error("registers in call to '" + call.name
              + "' must have the same size", operand.exp.pos);
        }
        size = size2;
      }
    }
  }

  private Resolved resolveMacroCall(Ast.Call call, Callee callee,
      Scope scope, boolean statement) {
    final String key = callee.key();
    final Ast.GateDecl gateDecl = requireNonNull(gateDecls.get(key));
    if (!statement) {
      throw error("gate '" + call.name + "' cannot be used in an "
          + "expression", call.pos);
    }
    final int controlCount = call.controlCount();
    checkArgCount(call, controlCount + gateDecl.params.size());
    final List<Ast.Exp> args = new ArrayList<>();
    final List<Operand> operands = new ArrayList<>();
    for (int i = 0; i < controlCount; i++) {
      final Operand operand =
          resolveOperand(call.args.get(i), RegisterType.Kind.QUBIT, scope);
      operands.add(operand);
      args.add(operand.exp);
    }
    for (int i = 0; i < gateDecl.params.size(); i++) {
      final Ast.Param param = gateDecl.params.get(i);
      final Ast.Exp arg = call.args.get(controlCount + i);
      final Type type = paramType(param, true, gateDecl.name);
      if (type.isQuantum()) {
        final Operand operand = resolveArgOperand(arg, type, scope);
        if (!(type instanceof RegisterType)) {
          operands.add(operand);
        }
        args.add(operand.exp);
      } else {
        final Resolved r = resolveValue(arg, scope);
        checkType(type, r, "argument '" + param.name + "'");
        if (r.staticness == Staticness.DYNAMIC) {
          throw error("argument '" + param.name + "' of gate '" + call.name
              + "' must be known at compile time", arg.pos);
        }
        args.add(r.exp);
      }
    }
    checkBroadcast(call, operands);
    recordCall(key, call.pos);
    if (!call.modifiers.isEmpty()) {
      pendingChecks.add(() -> {
        if (nonUnitaryKeys.contains(key)) {
          throw error("modifier '" + call.modifiers.get(0) + "' cannot be "
              + "applied to gate '" + call.name + "', which contains a "
              + "non-unitary operation", call.pos);
        }
      });
    }
    return new Resolved(call.copy(key, call.modifiers, args, callee),
        PrimitiveType.UNIT, Staticness.CONSTANT);
  }

  private Resolved resolveFunctionCall(Ast.Call call, Callee callee,
      Scope scope, boolean statement) {
    final String key = callee.key();
    final Ast.FunDecl funDecl = requireNonNull(funDecls.get(key));
    if (!call.modifiers.isEmpty()) {
      throw error("modifier '" + call.modifiers.get(0) + "' cannot be "
          + "applied to function '" + call.name + "'", call.pos);
    }
    checkArgCount(call, funDecl.params.size());
    final List<Ast.Exp> args = new ArrayList<>();
    final List<Operand> operands = new ArrayList<>();
    Staticness staticness = Staticness.CONSTANT;
    for (int i = 0; i < funDecl.params.size(); i++) {
      final Ast.Param param = funDecl.params.get(i);
      final Ast.Exp arg = call.args.get(i);
      final Type type = paramType(param, false, funDecl.name);
      if (type.isQuantum()) {
        final Operand operand = resolveArgOperand(arg, type, scope);
        if (!(type instanceof RegisterType)) {
          operands.add(operand);
        }
        args.add(operand.exp);
      } else {
        final Resolved r = resolveValue(arg, scope);
        checkType(type, r, "argument '" + param.name + "'");
        if (r.staticness == Staticness.DYNAMIC) {
          pendingChecks.add(() -> {
            if (quantumKeys.contains(key)) {
              throw error("argument '" + param.name + "' of quantum "
                  + "function '" + call.name + "' must be known at compile "
                  + "time", arg.pos);
            }
          });
        }
        staticness = staticness.max(r.staticness);
        args.add(r.exp);
      }
    }
    checkBroadcast(call, operands);
    recordCall(key, call.pos);
    if (!statement) {
      pendingChecks.add(() -> {
        if (quantumKeys.contains(key)) {
          throw error("quantum function '" + call.name + "' cannot be used "
              + "in an expression", call.pos);
        }
      });
    }
    final Type type = funDecl.returnType == null
        ? PrimitiveType.UNIT
        : typeOf(funDecl.returnType);
    return new Resolved(call.copy(key, call.modifiers, args, callee), type,
        staticness);
  }

  private Resolved resolveBuiltInCall(Ast.Call call, Callee callee,
      Scope scope) {
    final BuiltIn builtIn = requireNonNull(callee.builtIn);
    if (!call.modifiers.isEmpty()) {
      throw error("modifier '" + call.modifiers.get(0) + "' cannot be "
          + "applied to function '" + call.name + "'", call.pos);
    }
    checkArgCount(call, builtIn.arity);
    if (builtIn == BuiltIn.LEN && call.args.get(0) instanceof Ast.Id) {
      final Ast.Id id = (Ast.Id) call.args.get(0);
      final Binding binding = lookupOpt(id, scope);
      if (binding != null && binding.type instanceof RegisterType) {
        return new Resolved(
            call.copy(call.name, call.modifiers,
                ImmutableList.of(ast.id(id.pos, binding.key)), callee),
            PrimitiveType.INT, binding.staticness);
      }
    }
    final List<Ast.Exp> args = new ArrayList<>();
    final List<Type> types = new ArrayList<>();
    Staticness staticness = Staticness.CONSTANT;
    for (Ast.Exp arg : call.args) {
      final Resolved r = resolveValue(arg, scope);
      args.add(r.exp);
      types.add(r.type);
      staticness = staticness.max(r.staticness);
      if (builtIn == BuiltIn.LEN) {
        if (!(r.type instanceof ListType)) {
          throw error("argument of 'len' must be a list or register, got "
              + r.type.moniker(), arg.pos);
        }
      } else if (!r.type.isNumeric()) {
        throw error("argument of '" + call.name + "' must be int or float, "
            + "got " + r.type.moniker(), arg.pos);
      }
    }
    final Type type;
    switch (builtIn) {
      case LEN:
      case INT:
        type = PrimitiveType.INT;
        break;
      case ABS:
        type = types.get(0);
        break;
      case MIN:
      case MAX:
        type = types.get(0) == PrimitiveType.INT
            && types.get(1) == PrimitiveType.INT
            ? PrimitiveType.INT
            : PrimitiveType.FLOAT;
        break;
      default:
        type = PrimitiveType.FLOAT;
        break;
    }
    return new Resolved(call.copy(call.name, call.modifiers, args, callee),
        type, staticness);
  }

  private void recordCall(String key, Pos pos) {
    for (Usage usage : usages) {
      usage.callees.add(key);
    }
    if (owner != null) {
      callGraph.addEdge(owner, key, pos);
    }
  }

  private static void checkArgCount(Ast.Call call, int expected) {
    if (call.args.size() != expected) {
      throw error("'" + call.name + "' expects " + expected + " argument"
          + (expected == 1 ? "" : "s") + ", got " + call.args.size(),
          call.pos);
    }
  }

  // Quantum operands

  /** Resolves an argument passed to a quantum parameter of a gate-macro
   * or function.
   *
   * <p>A register passed to a {@code qubit} or {@code bit} parameter is
   * broadcast: the inliner expands the call once per element. */
  private Operand resolveArgOperand(Ast.Exp arg, Type paramType,
      Scope scope) {
    final RegisterType.Kind kind =
        paramType == PrimitiveType.BIT
            || paramType instanceof RegisterType
                && ((RegisterType) paramType).kind == RegisterType.Kind.BIT
            ? RegisterType.Kind.BIT
            : RegisterType.Kind.QUBIT;
    final Operand operand = resolveOperand(arg, kind, scope);
    if (paramType instanceof RegisterType
        && !paramType.accepts(operand.type)) {
      throw error("expected " + paramType.moniker() + ", got "
          + operand.type.moniker(), arg.pos);
    }
    return operand;
  }

  /** Resolves a quantum operand: a register, an element of a register,
   * or a qubit or bit parameter. */
  private Operand resolveOperand(Ast.Exp arg, RegisterType.Kind kind,
      Scope scope) {
    if (arg instanceof Ast.Id) {
      final Ast.Id id = (Ast.Id) arg;
      final Binding binding = lookup(id, scope);
      final Type type = binding.type;
      if (type instanceof RegisterType) {
        checkKind(kind, ((RegisterType) type).kind, arg);
      } else if (type instanceof PrimitiveType && type.isQuantum()) {
        checkKind(kind,
            type == PrimitiveType.QUBIT
                ? RegisterType.Kind.QUBIT
                : RegisterType.Kind.BIT,
            arg);
      } else {
        throw illegalOperand(arg);
      }
      return new Operand(ast.id(id.pos, binding.key), type);
    }
    if (arg instanceof Ast.Index
        && ((Ast.Index) arg).exp instanceof Ast.Id) {
      final Ast.Index index = (Ast.Index) arg;
      final Ast.Id id = (Ast.Id) index.exp;
      final Binding binding = lookup(id, scope);
      if (!(binding.type instanceof RegisterType)) {
        throw illegalOperand(arg);
      }
      final RegisterType registerType = (RegisterType) binding.type;
      checkKind(kind, registerType.kind, arg);
      final Resolved i = resolveValue(index.index, scope);
      checkType(PrimitiveType.INT, i, "register index");
      final Object value = constantValue(i);
      if (value != null && registerType.isSized()
          && ((Integer) value < 0 || (Integer) value >= registerType.size)) {
        throw error("index " + value + " out of range for register "
            + id.name + " of size " + registerType.size, index.index.pos);
      }
      return new Operand(index.copy(ast.id(id.pos, binding.key), i.exp),
          registerType.kind.elementType);
    }
    throw illegalOperand(arg);
  }

  private static void checkKind(RegisterType.Kind expected,
      RegisterType.Kind actual, Ast.Exp arg) {
    if (expected != actual) {
      throw error("expected " + expected.moniker + " operand, got "
          + actual.moniker + " '" + arg + "'", arg.pos);
    }
  }

  private static SemanticException illegalOperand(Ast.Exp arg) {
    return error("illegal quantum operand '" + arg + "'", arg.pos);
  }

  // Pass 4. Classify

  private void classify() {
    for (String key : callGraph.nodes()) {
      if (callGraph.reaches(key, this::isDirectlyQuantum)) {
        quantumKeys.add(key);
      }
      if (callGraph.reaches(key, k -> bodies.containsKey(k)
          && bodies.get(k).usage.nonUnitary)) {
        nonUnitaryKeys.add(key);
      }
    }
    for (Body body : bodies.values()) {
      if (body.gate || !quantumKeys.contains(body.key)) {
        continue;
      }
      symbols.inline(body.key);
      if (body.returnType != null) {
        throw error("quantum function '" + body.name + "' cannot have a "
            + "return type", body.returnType.pos);
      }
      if (body.returnPos != null) {
        throw error("quantum function '" + body.name + "' cannot contain "
            + "'return'", body.returnPos);
      }
    }
  }

  private boolean isDirectlyQuantum(String key) {
    final Body body = bodies.get(key);
    return body != null
        && (body.gate || body.quantumParam || body.usage.quantum);
  }

  private boolean isQuantum(Usage usage) {
    if (usage.quantum) {
      return true;
    }
    for (String callee : usage.callees) {
      if (quantumKeys.contains(callee)) {
        return true;
      }
    }
    return false;
  }

  // Utilities

  /** Returns the value of an expression if it can be computed now, that is,
   * if it depends only on literals and global constants; otherwise null. */
  private @Nullable Object constantValue(Resolved r) {
    if (r.staticness != Staticness.CONSTANT) {
      return null;
    }
    final boolean[] hasCall = {false};
    r.exp.accept(new Visitor() {
      @Override
      protected void visit(Ast.Call call) {
        if (call.callee.kind == Callee.Kind.FUNCTION) {
          hasCall[0] = true;
        }
        super.visit(call);
      }
    });
    if (hasCall[0]) {
      return null;
    }
    return new Evaluator(symbols.build(),
        Prop.MAX_UNROLL_COUNT.intValue(props))
        .eval(r.exp, EvalEnv.root());
  }

  /** Converts a type annotation to a type. */
  private static Type typeOf(Ast.TypeExp typeExp) {
    final PrimitiveType primitiveType = PrimitiveType.lookup(typeExp.name);
    if (primitiveType == null) {
      throw error("unknown type '" + typeExp.name + "'", typeExp.pos);
    }
    if (!typeExp.array) {
      return primitiveType;
    }
    switch (primitiveType) {
      case QUBIT:
        return RegisterType.of(RegisterType.Kind.QUBIT,
            typeExp.size == null ? RegisterType.UNSIZED : typeExp.size);
      case BIT:
        return RegisterType.of(RegisterType.Kind.BIT,
            typeExp.size == null ? RegisterType.UNSIZED : typeExp.size);
      default:
        if (typeExp.size != null) {
          throw error("list type '" + typeExp + "' cannot have a size",
              typeExp.pos);
        }
        return ListType.of(primitiveType);
    }
  }

  private static void checkType(Type expected, Resolved r, String what) {
    if (!expected.accepts(r.type)) {
      throw error("type mismatch: " + what + " must be "
          + expected.moniker() + ", got " + r.type.moniker(), r.exp.pos);
    }
  }

  private static SemanticException undeclared(Ast.Id id) {
    return error("undeclared identifier '" + id.name + "'", id.pos);
  }

  private static SemanticException error(String message, Pos pos) {
    return new SemanticException(message, pos);
  }

  /** Result of semantic analysis. */
  public static class Analysis {
    /** Program with names resolved to keys and calls to callees. */
    public final Ast.Program program;
    public final SymbolTable symbolTable;
    public final CallGraph callGraph;

    Analysis(Ast.Program program, SymbolTable symbolTable,
        CallGraph callGraph) {
      this.program = requireNonNull(program);
      this.symbolTable = requireNonNull(symbolTable);
      this.callGraph = requireNonNull(callGraph);
    }
  }

  /** Resolved expression, with its type and staticness. */
  private static class Resolved {
    final Ast.Exp exp;
    final Type type;
    final Staticness staticness;

    Resolved(Ast.Exp exp, Type type, Staticness staticness) {
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
      this.staticness = requireNonNull(staticness);
    }
  }

  /** Resolved quantum operand. The type is a {@link RegisterType} if the
   * operand is a whole register, otherwise qubit or bit. */
  private static class Operand {
    final Ast.Exp exp;
    final Type type;

    Operand(Ast.Exp exp, Type type) {
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }
  }

  /** Lexical scope. */
  private static class Scope {
    Environment env;
    final Set<String> names = new HashSet<>();
    final @Nullable Body body;
    final @Nullable String className;
    /** Whether this is the global scope, where registers, functions and
     * classes may be declared. */
    final boolean global;

    Scope(Environment env, @Nullable Body body, @Nullable String className,
        boolean global) {
      this.env = requireNonNull(env);
      this.body = body;
      this.className = className;
      this.global = global;
    }

    Scope child() {
      return new Scope(env, body, className, false);
    }

    int functionDepth() {
      return body == null ? 0 : 1;
    }

    String describeBody() {
      final Body b = requireNonNull(body);
      return (b.gate ? "gate '" : "function '") + b.name + "'";
    }

    void declare(Binding binding, Pos pos) {
      checkNotBuiltIn(binding.name, pos);
      if (!names.add(binding.name)) {
        throw error("duplicate declaration of '" + binding.name + "'", pos);
      }
      env = env.bind(binding);
    }
  }

  /** Function or gate-macro whose body is being, or has been, resolved. */
  private static class Body {
    final String key;
    final String name;
    final boolean gate;
    final Ast.@Nullable TypeExp returnType;
    final Type resultType;
    final Usage usage = new Usage();
    boolean quantumParam;
    @Nullable Pos returnPos;

    Body(String key, String name, boolean gate,
        Ast.@Nullable TypeExp returnType, Type resultType) {
      this.key = key;
      this.name = name;
      this.gate = gate;
      this.returnType = returnType;
      this.resultType = resultType;
    }
  }

  /** Function or gate-macro declaration whose body has not yet been
   * resolved. */
  private static class PendingBody {
    final Ast.Stmt decl;
    final String key;
    final @Nullable String className;

    PendingBody(Ast.Stmt decl, String key, @Nullable String className) {
      this.decl = decl;
      this.key = key;
      this.className = className;
    }
  }

  /** What a region of code does: whether it applies quantum operations
   * directly, and which functions and gate-macros it calls. */
  private static class Usage {
    boolean quantum;
    boolean nonUnitary;
    final Set<String> callees = new LinkedHashSet<>();
  }
}

// End Analyzer.java
