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

import java.util.Map;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.codegen.GateTable;
import net.hydromatic.quanta.codegen.QasmGenerator;
import net.hydromatic.quanta.ir.Circuit;
import net.hydromatic.quanta.ir.Lowering;
import net.hydromatic.quanta.parse.QuantaParser;

/** Helpers that run the stages of compilation in sequence. */
public abstract class Compiles {
  /**
   * Parses, analyzes, expands, lowers and generates a program.
   *
   * <p>Calls the tracer after each stage. Throws the first
   * {@link CompileException}; never returns partial output.
   */
  public static String compile(String file, String source,
      Map<Prop, Object> props, GateTable gateTable, Tracer tracer) {
    final Ast.Program program = QuantaParser.parse(file, source);
    tracer.onParse(program);
    final Circuit circuit = toCircuit(program, props, tracer);
    final String qasm =
        new QasmGenerator(gateTable, props).generate(circuit);
    tracer.onOutput(qasm);
    return qasm;
  }

  /** Analyzes, expands and lowers a parsed program. */
  public static Circuit toCircuit(Ast.Program program,
      Map<Prop, Object> props, Tracer tracer) {
    final Analyzer.Analysis analysis = Analyzer.analyze(program, props);
    tracer.onAnalysis(analysis);
    final Ast.Program expanded = Expander.expand(analysis, props, tracer);
    final Circuit circuit =
        Lowering.lower(analysis.symbolTable, expanded, props);
    tracer.onCircuit(circuit);
    return circuit;
  }
}

// End Compiles.java
