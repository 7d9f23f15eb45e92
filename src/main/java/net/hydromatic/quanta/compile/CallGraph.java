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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.quanta.ast.Pos;

/**
 * Graph of references between functions, gate-macros and constants.
 *
 * <p>There is an edge from A to B if the body of A calls B, or if the
 * initializer of constant A refers to constant B. Nodes are held in
 * declaration order, so that the cycle check is deterministic.
 */
public class CallGraph {
  private final Map<String, List<Edge>> edges = new LinkedHashMap<>();

  /** Adds a node, if not already present. */
  void addNode(String key) {
    edges.computeIfAbsent(key, k -> new ArrayList<>());
  }

  /** Adds an edge that arises from a call or reference at a given
   * position. */
  void addEdge(String from, String to, Pos pos) {
    addNode(to);
    edges.computeIfAbsent(from, k -> new ArrayList<>())
        .add(new Edge(from, to, pos));
  }

  /** Returns the keys of all nodes, in declaration order. */
  public List<String> nodes() {
    return ImmutableList.copyOf(edges.keySet());
  }

  /** Returns the keys that a given node references directly. */
  public List<String> successors(String key) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Edge edge : edges.getOrDefault(key, ImmutableList.of())) {
      b.add(edge.to);
    }
    return b.build();
  }

  /**
   * Throws if the graph contains a cycle.
   *
   * <p>Visits nodes depth-first, in declaration order, keeping the stack of
   * nodes being visited. An edge to a node on the stack closes a cycle; the
   * error is reported at the call or reference that created that edge.
   *
   * @throws SemanticException if there is a cycle
   */
  public void checkAcyclic() {
    final Map<String, State> states = new HashMap<>();
    final Deque<String> stack = new ArrayDeque<>();
    for (String key : edges.keySet()) {
      visit(key, states, stack);
    }
  }

  private void visit(String key, Map<String, State> states,
      Deque<String> stack) {
    final State state = states.get(key);
    if (state == State.DONE) {
      return;
    }
    states.put(key, State.IN_PROGRESS);
    stack.addLast(key);
    for (Edge edge : edges.getOrDefault(key, ImmutableList.of())) {
      if (states.get(edge.to) == State.IN_PROGRESS) {
        final List<String> path = new ArrayList<>();
        boolean found = false;
        for (String k : stack) {
          found |= k.equals(edge.to);
          if (found) {
            path.add(k);
          }
        }
        path.add(edge.to);
        throw new SemanticException(
            "recursive definition: " + String.join(" -> ", path), edge.pos);
      }
      visit(edge.to, states, stack);
    }
    stack.removeLast();
    states.put(key, State.DONE);
  }

  /**
   * Returns whether a node, or any node reachable from it, satisfies a
   * predicate. The graph must be acyclic.
   */
  public boolean reaches(String key, Predicate<String> predicate) {
    return reaches(key, predicate, new HashSet<>());
  }

  private boolean reaches(String key, Predicate<String> predicate,
      Set<String> visited) {
    if (!visited.add(key)) {
      return false;
    }
    if (predicate.test(key)) {
      return true;
    }
    for (Edge edge : edges.getOrDefault(key, ImmutableList.of())) {
      if (reaches(edge.to, predicate, visited)) {
        return true;
      }
    }
    return false;
  }

  /** State of a node during the cycle check. */
  private enum State {
    IN_PROGRESS,
    DONE
  }

  /** Reference from one node to another. */
  private static class Edge {
    final String from;
    final String to;
    final Pos pos;

    Edge(String from, String to, Pos pos) {
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
      this.pos = requireNonNull(pos);
    }

    @Override
    public String toString() {
      return from + " -> " + to;
    }
  }
}

// End CallGraph.java
