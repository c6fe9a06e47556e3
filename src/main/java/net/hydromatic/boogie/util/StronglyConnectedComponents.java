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
package net.hydromatic.boogie.util;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Computes the strongly connected components of a directed graph.
 *
 * <p>Uses Kosaraju's algorithm: a depth-first search along successor edges
 * orders the nodes by finishing time, then a search along predecessor
 * edges, taking nodes in reverse finishing order, collects one component
 * per tree.
 *
 * @param <N> Node type
 */
public class StronglyConnectedComponents<N> implements Iterable<List<N>> {
  private final ImmutableList<N> nodes;
  private final Function<N, ? extends Iterable<N>> successors;
  private final Function<N, ? extends Iterable<N>> predecessors;
  private final List<List<N>> components = new ArrayList<>();
  private boolean computed;

  public StronglyConnectedComponents(Iterable<N> nodes,
      Function<N, ? extends Iterable<N>> successors,
      Function<N, ? extends Iterable<N>> predecessors) {
    this.nodes = ImmutableList.copyOf(nodes);
    this.successors = requireNonNull(successors);
    this.predecessors = requireNonNull(predecessors);
  }

  /** Computes the components. May be called only once. */
  public void compute() {
    checkState(!computed, "already computed");
    final Set<N> visited = new HashSet<>();
    final List<N> finished = new ArrayList<>();
    for (N node : nodes) {
      search(node, visited, successors, n -> { }, finished::add);
    }

    final Set<N> assigned = new HashSet<>();
    for (int i = finished.size() - 1; i >= 0; i--) {
      final N node = finished.get(i);
      if (!assigned.contains(node)) {
        final List<N> component = new ArrayList<>();
        search(node, assigned, predecessors, component::add, n -> { });
        components.add(ImmutableList.copyOf(component));
      }
    }
    computed = true;
  }

  /** Depth-first search from {@code root}, calling {@code onEnter} as each
   * unseen node is reached and {@code onExit} after all of its neighbors
   * have been searched. Uses an explicit stack, so that long paths do not
   * overflow the call stack. */
  private static <N> void search(N root, Set<N> seen,
      Function<N, ? extends Iterable<N>> neighbors, Consumer<N> onEnter,
      Consumer<N> onExit) {
    if (!seen.add(root)) {
      return;
    }
    onEnter.accept(root);
    final Deque<Frame<N>> stack = new ArrayDeque<>();
    stack.push(new Frame<>(root, neighbors.apply(root).iterator()));
    while (!stack.isEmpty()) {
      final Frame<N> frame = stack.peek();
      if (frame.remaining.hasNext()) {
        final N next = frame.remaining.next();
        if (seen.add(next)) {
          onEnter.accept(next);
          stack.push(new Frame<>(next, neighbors.apply(next).iterator()));
        }
      } else {
        stack.pop();
        onExit.accept(frame.node);
      }
    }
  }

  /** Returns the components, in topological order: if there is an edge
   * from a node in one component to a node in another, the first
   * component comes earlier. */
  public List<List<N>> components() {
    checkState(computed, "not computed");
    return components;
  }

  @Override
  public Iterator<List<N>> iterator() {
    return components().iterator();
  }

  @Override
  public String toString() {
    return computed ? components.toString() : "<not computed>";
  }

  /** Node on the search stack, with the neighbors not yet searched. */
  private static class Frame<N> {
    final N node;
    final Iterator<N> remaining;

    Frame(N node, Iterator<N> remaining) {
      this.node = node;
      this.remaining = remaining;
    }
  }
}

// End StronglyConnectedComponents.java
