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
package net.hydromatic.quanta.type;

/** Type of a value, variable or expression. */
public interface Type {
  /** Name of the type as written in source, e.g. "{@code qubit[3]}". */
  String moniker();

  /** Whether values of this type are qubits or bits. */
  default boolean isQuantum() {
    return false;
  }

  /** Whether this type is {@code int} or {@code float}. */
  default boolean isNumeric() {
    return false;
  }

  /**
   * Returns whether a value of type {@code from} may be used where a value of
   * this type is expected.
   *
   * <p>The default implementation requires the types to be equal.
   * {@link PrimitiveType#FLOAT} also accepts {@link PrimitiveType#INT}.
   */
  default boolean accepts(Type from) {
    return equals(from);
  }
}

// End Type.java
