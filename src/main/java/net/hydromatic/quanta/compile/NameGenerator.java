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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique names.
 *
 * <p>Keeps track of how many times each given name has been used in this
 * compilation, so that a new occurrence of a name can be given a fresh
 * ordinal. Generated names contain '$', which cannot occur in a source
 * identifier, and therefore never clash with a name declared in source.
 */
public class NameGenerator {
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  /** Returns the number of times that "name" has been used for a
   * variable, starting at 1. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(1))
        .getAndIncrement();
  }

  /** Generates a fresh name based on a given name; for example "x$1", then
   * "x$2". If the name has already been renamed, the part before the '$' is
   * used; so "x$1" might become "x$3". */
  public String fresh(String name) {
    final int i = name.indexOf('$');
    final String base = i < 0 ? name : name.substring(0, i);
    return base + "$" + inc(base);
  }
}

// End NameGenerator.java
