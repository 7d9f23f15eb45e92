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

import static java.util.Objects.requireNonNull;

/** Type of a list or range of classical values, such as {@code list[int]}.
 *
 * <p>The empty list {@code []} has element type {@link PrimitiveType#UNIT},
 * and is accepted by every list type. */
public class ListType implements Type {
  public final Type elementType;

  public ListType(Type elementType) {
    this.elementType = requireNonNull(elementType);
  }

  public static ListType of(Type elementType) {
    return new ListType(elementType);
  }

  @Override
  public String moniker() {
    return "list[" + elementType.moniker() + "]";
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public boolean accepts(Type from) {
    return from instanceof ListType
        && (((ListType) from).elementType == PrimitiveType.UNIT
            || elementType.accepts(((ListType) from).elementType));
  }

  @Override
  public int hashCode() {
    return elementType.hashCode() * 31 + 7;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ListType
            && elementType.equals(((ListType) o).elementType);
  }
}

// End ListType.java
