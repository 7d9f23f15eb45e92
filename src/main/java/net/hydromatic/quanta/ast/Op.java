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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),

  // value constructors
  LIST(true),
  RANGE(true),

  // postfix
  INDEX(true),
  CALL(true),

  // infix and prefix operators
  POWER(" ** ", 9, false),
  NEGATE("-", 8),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  FLOOR_DIVIDE(" // ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  NOT("not ", 3),
  AND(" and ", 2),
  OR(" or ", 1),

  // assignments
  ASSIGN(" = "),
  PLUS_ASSIGN(" += "),
  MINUS_ASSIGN(" -= "),
  TIMES_ASSIGN(" *= "),

  // declarations
  PROGRAM,
  QUANTUM_DECL,
  VAR_DECL,
  CONST_DECL,
  FUN_DECL,
  GATE_DECL,
  CLASS_DECL,
  PARAM,
  TYPE,

  // statements
  BLOCK,
  EXP_STMT,
  FOR,
  IF,
  RETURN,
  /** Block of statements that share modifiers; occurs only during
   * expansion. */
  MODIFIED_BLOCK;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Map from the token text of an assignment operator to its op. */
  public static final ImmutableMap<String, Op> ASSIGN_BY_TOKEN =
      ImmutableMap.of("=", ASSIGN, "+=", PLUS_ASSIGN, "-=", MINUS_ASSIGN,
          "*=", TIMES_ASSIGN);

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the name in lower case, e.g. "quantum_decl". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** For a compound assignment such as {@code +=}, returns the arithmetic
   * operator, e.g. {@link #PLUS}; returns null for plain assignment. */
  public @Nullable Op arithmeticOp() {
    switch (this) {
      case PLUS_ASSIGN:
        return PLUS;
      case MINUS_ASSIGN:
        return MINUS;
      case TIMES_ASSIGN:
        return TIMES;
      case ASSIGN:
        return null;
      default:
        throw new AssertionError("not an assignment: " + this);
    }
  }
}

// End Op.java
