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

/**
 * When the value of an expression becomes known.
 *
 * <p>Values are ordered; combining two expressions gives the later of their
 * staticness values.
 */
public enum Staticness {
  /** Known during analysis; for example, a literal or a global constant. */
  CONSTANT,
  /** Known after expansion; for example, a loop iterator or a parameter of
   * an inlined gate-macro. */
  STATIC,
  /** Depends on a mutable variable. */
  DYNAMIC;

  /** Returns the later of two staticness values. */
  public Staticness max(Staticness other) {
    return compareTo(other) >= 0 ? this : other;
  }
}

// End Staticness.java
