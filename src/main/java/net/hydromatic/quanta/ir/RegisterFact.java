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
package net.hydromatic.quanta.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.quanta.type.RegisterType;

/** Declared register: its name, kind and size. */
public final class RegisterFact {
  public final String name;
  public final RegisterType.Kind kind;
  public final int size;

  private RegisterFact(String name, RegisterType.Kind kind, int size) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.size = size;
    checkArgument(size > 0, "register %s has size %s", name, size);
  }

  public static RegisterFact of(String name, RegisterType.Kind kind,
      int size) {
    return new RegisterFact(name, kind, size);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, size);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RegisterFact
            && name.equals(((RegisterFact) o).name)
            && kind == ((RegisterFact) o).kind
            && size == ((RegisterFact) o).size;
  }

  @Override
  public String toString() {
    return kind.moniker + "[" + size + "] " + name;
  }
}

// End RegisterFact.java
