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

import java.util.Map;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.eval.Evaluator;

/**
 * Expands a validated program into a flat list of statements.
 *
 * <p>The result contains no calls to gate-macros or quantum functions, no
 * loops, no conditionals, and no modified blocks. Every gate call has
 * literal angles and register indexes, and normalized modifiers.
 *
 * <p>Expansion runs three passes, in order: {@link Inliner inlining},
 * {@link Unroller unrolling}, and {@link ModifierPropagator modifier
 * propagation}. Before the first pass, every local variable is given a
 * unique name, so that inlined code never captures or hides a name.
 *
 * <p>Expanding an expanded program returns an equal program.
 */
public class Expander {
  private final SymbolTable symbolTable;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final NameGenerator nameGenerator = new NameGenerator();

  private Expander(SymbolTable symbolTable, Map<Prop, Object> props,
      Tracer tracer) {
    this.symbolTable = requireNonNull(symbolTable);
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Expands the program produced by semantic analysis. */
  public static Ast.Program expand(Analyzer.Analysis analysis,
      Map<Prop, Object> props, Tracer tracer) {
    return expand(analysis.symbolTable, analysis.program, props, tracer);
  }

  /** Expands a program whose names have been resolved against a given
   * symbol table. */
  public static Ast.Program expand(SymbolTable symbolTable,
      Ast.Program program, Map<Prop, Object> props, Tracer tracer) {
    return new Expander(symbolTable, props, tracer).expand(program);
  }

  private Ast.Program expand(Ast.Program program) {
    final int maxUnrollCount = Prop.MAX_UNROLL_COUNT.intValue(props);
    final Ast.Program program0 =
        Substituter.uniquify(nameGenerator, program);

    final Inliner inliner =
        new Inliner(symbolTable, nameGenerator,
            Prop.MAX_INLINE_DEPTH.intValue(props));
    final Ast.Program program1 = inliner.inline(program0);
    tracer.onExpand(1, program1);

    final Unroller unroller =
        new Unroller(new Evaluator(symbolTable, maxUnrollCount),
            nameGenerator, maxUnrollCount);
    final Ast.Program program2 = unroller.unroll(program1);
    tracer.onExpand(2, program2);

    final Ast.Program program3 =
        new ModifierPropagator().propagate(program2);
    tracer.onExpand(3, program3);
    return program3;
  }
}

// End Expander.java
