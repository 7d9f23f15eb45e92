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

import java.util.function.Consumer;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ir.Circuit;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a parsed program,
   * then calls the underlying tracer. */
  public static Tracer withOnParse(Tracer tracer,
      Consumer<Ast.Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onParse(Ast.Program program) {
        consumer.accept(program);
        super.onParse(program);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of
   * semantic analysis, then calls the underlying tracer. */
  public static Tracer withOnAnalysis(Tracer tracer,
      Consumer<Analyzer.Analysis> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onAnalysis(Analyzer.Analysis analysis) {
        consumer.accept(analysis);
        super.onAnalysis(analysis);
      }
    };
  }

  /** Returns a tracer that performs the given action on the program after a
   * given expansion pass, then calls the underlying tracer. */
  public static Tracer withOnExpand(Tracer tracer, int pass,
      Consumer<Ast.Program> consumer) {
    final int expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override
      public void onExpand(int pass, Ast.Program program) {
        if (pass == expectedPass) {
          consumer.accept(program);
        }
        super.onExpand(pass, program);
      }
    };
  }

  /** Returns a tracer that performs the given action on a circuit,
   * then calls the underlying tracer. */
  public static Tracer withOnCircuit(Tracer tracer,
      Consumer<Circuit> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCircuit(Circuit circuit) {
        consumer.accept(circuit);
        super.onCircuit(circuit);
      }
    };
  }

  /** Returns a tracer that performs the given action on the generated text,
   * then calls the underlying tracer. */
  public static Tracer withOnOutput(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onOutput(String qasm) {
        consumer.accept(qasm);
        super.onOutput(qasm);
      }
    };
  }

  /** Returns a tracer that handles compile exceptions by passing them to the
   * given action. */
  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onParse(Ast.Program program) {}

    @Override
    public void onAnalysis(Analyzer.Analysis analysis) {}

    @Override
    public void onExpand(int pass, Ast.Program program) {}

    @Override
    public void onCircuit(Circuit circuit) {}

    @Override
    public void onOutput(String qasm) {}

    @Override
    public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onParse(Ast.Program program) {
      tracer.onParse(program);
    }

    @Override
    public void onAnalysis(Analyzer.Analysis analysis) {
      tracer.onAnalysis(analysis);
    }

    @Override
    public void onExpand(int pass, Ast.Program program) {
      tracer.onExpand(pass, program);
    }

    @Override
    public void onCircuit(Circuit circuit) {
      tracer.onCircuit(circuit);
    }

    @Override
    public void onOutput(String qasm) {
      tracer.onOutput(qasm);
    }

    @Override
    public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
