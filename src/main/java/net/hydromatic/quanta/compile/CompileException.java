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

import net.hydromatic.quanta.ast.Pos;
import net.hydromatic.quanta.util.QuantaException;

/** An error occurred during compilation.
 *
 * <p>Each stage of the compiler throws its own sub-class; an instance of
 * this class itself means that the compiler has an internal fault. Use
 * {@link #kind} to tell them apart. */
public class CompileException extends RuntimeException
    implements QuantaException {
  public final Kind kind;
  private final Pos pos;

  /** Creates a CompileException of kind {@link Kind#INTERNAL}. */
  public CompileException(String message, Pos pos) {
    this(message, Kind.INTERNAL, pos);
  }

  protected CompileException(String message, Kind kind, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }

  /** Stage of compilation that detected the error. */
  public enum Kind {
    /** Invalid character, unterminated string, malformed literal. */
    LEX,
    /** Unexpected token. */
    PARSE,
    /** The program is well-formed but not valid; for example, an undeclared
     * name, a type mismatch, recursion, or an index out of range. */
    SEMANTIC,
    /** A program that passed analysis could not be expanded. */
    EXPANSION,
    /** The compiler has a bug. */
    INTERNAL
  }
}

// End CompileException.java
