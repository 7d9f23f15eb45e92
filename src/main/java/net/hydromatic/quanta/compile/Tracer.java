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

import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ir.Circuit;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when the source has been parsed. */
  void onParse(Ast.Program program);

  /** Called when semantic analysis has succeeded. */
  void onAnalysis(Analyzer.Analysis analysis);

  /** Called after each expansion pass: 1 (inlining), 2 (unrolling) and
   * 3 (modifier propagation). */
  void onExpand(int pass, Ast.Program program);

  /** Called when the program has been lowered to a circuit. */
  void onCircuit(Circuit circuit);

  /** Called with the generated OpenQASM text. */
  void onOutput(String qasm);

  /**
   * Called with the exception thrown during compilation. Returns whether a
   * handler was found; if not, the exception propagates to the caller.
   */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
