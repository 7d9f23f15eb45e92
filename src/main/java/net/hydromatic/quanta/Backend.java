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
package net.hydromatic.quanta;

import java.util.Map;

/**
 * Executes a compiled program on a simulator or device.
 *
 * <p>This project contains no implementation; callers supply one to
 * {@link Quanta#run(String, int, Backend)}.
 */
public interface Backend {
  /**
   * Executes an OpenQASM 3 program a given number of times, and returns a
   * histogram of results.
   *
   * <p>Each key is the string of measured bits; each value is the number of
   * shots that produced it.
   *
   * @param qasm  Program text
   * @param shots Number of shots; positive
   */
  Map<String, Integer> execute(String qasm, int shots);
}

// End Backend.java
