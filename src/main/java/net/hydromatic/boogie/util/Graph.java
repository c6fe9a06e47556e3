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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Table;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Directed graph with one or more source nodes.
 *
 * <p>After edges have been added, {@link #computeLoops()} computes
 * dominators, back edges and natural loops. A back edge is an edge whose
 * target dominates its source; the target is a loop header. The graph is
 * reducible if removing all back edges leaves it acyclic.
 *
 * <p>Nodes are compared by {@link Object#equals}; results are returned in
 * the order in which nodes were first added.
 *
 * @param <N> Node type
 */
public class Graph<N> {
  private final Set<N> nodes = new LinkedHashSet<>();
  private final List<N> sources = new ArrayList<>();
  private final SetMultimap<N, N> successors = LinkedHashMultimap.create();
  private final SetMultimap<N, N> predecessors = LinkedHashMultimap.create();

  // Populated by computeLoops
  private boolean loopsComputed;
  private final Map<N, Set<N>> dominators = new HashMap<>();
  private final SetMultimap<N, N> backEdgeNodes = LinkedHashMultimap.create();
  private final Table<N, N, ImmutableList<N>> naturalLoops =
      HashBasedTable.create();
  private boolean reducible;

  /** Adds a source node; that is, an entry point of the graph. */
  public void addSource(N node) {
    nodes.add(node);
    if (!sources.contains(node)) {
      sources.add(node);
    }
    loopsComputed = false;
  }

  /** Adds an edge, and its endpoints if they are not already present. */
  public void addEdge(N from, N to) {
    nodes.add(from);
    nodes.add(to);
    successors.put(from, to);
    predecessors.put(to, from);
    loopsComputed = false;
  }

  public Set<N> nodes() {
    return Collections.unmodifiableSet(nodes);
  }

  public List<N> sources() {
    return Collections.unmodifiableList(sources);
  }

  public Set<N> successors(N node) {
    return Collections.unmodifiableSet(successors.get(node));
  }

  public Set<N> predecessors(N node) {
    return Collections.unmodifiableSet(predecessors.get(node));
  }

  /** Computes dominators, back edges, loop headers and natural loops. */
  public void computeLoops() {
    checkState(!sources.isEmpty(), "graph has no source");
    dominators.clear();
    backEdgeNodes.clear();
    naturalLoops.clear();

    final List<N> order = reversePostOrder();
    computeDominators(order);

    final SetMultimap<N, N> backEdges = LinkedHashMultimap.create();
    for (N node : order) {
      for (N successor : successors.get(node)) {
        if (dominates(successor, node)) {
          backEdges.put(successor, node);
        }
      }
    }
    for (N node : nodes) {
      if (!backEdges.containsKey(node)) {
        continue;
      }
      for (N source : nodes) {
        if (backEdges.containsEntry(node, source)) {
          backEdgeNodes.put(node, source);
          naturalLoops.put(node, source, naturalLoop(node, source));
        }
      }
    }
    reducible = isAcyclicWithout(order, backEdges);
    loopsComputed = true;
  }

  /** Returns the nodes reachable from the sources, in reverse post-order
   * of a depth-first search. */
  private List<N> reversePostOrder() {
    final Set<N> visited = new HashSet<>();
    final List<N> postOrder = new ArrayList<>();
    for (N source : sources) {
      postOrder(source, visited, postOrder);
    }
    Collections.reverse(postOrder);
    return postOrder;
  }

  /** Appends the unvisited nodes reachable from {@code root} in post-order.
   * The search keeps its own stack; a path may be as long as the graph. */
  private void postOrder(N root, Set<N> visited, List<N> postOrder) {
    if (!visited.add(root)) {
      return;
    }
    final Deque<N> path = new ArrayDeque<>();
    final Deque<Iterator<N>> pending = new ArrayDeque<>();
    path.push(root);
    pending.push(successors.get(root).iterator());
    while (!path.isEmpty()) {
      final Iterator<N> iterator = pending.peek();
      if (iterator.hasNext()) {
        final N successor = iterator.next();
        if (visited.add(successor)) {
          path.push(successor);
          pending.push(successors.get(successor).iterator());
        }
      } else {
        pending.pop();
        postOrder.add(path.pop());
      }
    }
  }

  /** Computes the dominators of each reachable node by iterating to a
   * fixed point. */
  private void computeDominators(List<N> order) {
    final Set<N> all = ImmutableSet.copyOf(order);
    for (N node : order) {
      dominators.put(node,
          sources.contains(node) ? ImmutableSet.of(node) : all);
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (N node : order) {
        if (sources.contains(node)) {
          continue;
        }
        Set<N> meet = null;
        for (N predecessor : predecessors.get(node)) {
          final Set<N> d = dominators.get(predecessor);
          if (d == null) {
            continue; // unreachable predecessor
          }
          if (meet == null) {
            meet = new LinkedHashSet<>(d);
          } else {
            meet.retainAll(d);
          }
        }
        final Set<N> newDominators = new LinkedHashSet<>();
        if (meet != null) {
          newDominators.addAll(meet);
        }
        newDominators.add(node);
        if (!newDominators.equals(dominators.get(node))) {
          dominators.put(node, ImmutableSet.copyOf(newDominators));
          changed = true;
        }
      }
    }
  }

  /** Returns the nodes of the natural loop of a back edge: the header, and
   * each node that reaches the source of the back edge without passing
   * through the header. */
  private ImmutableList<N> naturalLoop(N header, N source) {
    final Set<N> loop = new HashSet<>();
    loop.add(header);
    final Deque<N> stack = new ArrayDeque<>();
    stack.push(source);
    while (!stack.isEmpty()) {
      final N node = stack.pop();
      if (loop.add(node)) {
        predecessors.get(node).forEach(stack::push);
      }
    }
    final ImmutableList.Builder<N> b = ImmutableList.builder();
    for (N node : nodes) {
      if (loop.contains(node)) {
        b.add(node);
      }
    }
    return b.build();
  }

  /** Returns whether the reachable part of the graph is acyclic after
   * removing the back edges. */
  private boolean isAcyclicWithout(List<N> order,
      SetMultimap<N, N> backEdges) {
    final Set<N> visited = new HashSet<>();
    final Set<N> onStack = new HashSet<>();
    for (N node : order) {
      if (hasCycle(node, backEdges, visited, onStack)) {
        return false;
      }
    }
    return true;
  }

  private boolean hasCycle(N node, SetMultimap<N, N> backEdges,
      Set<N> visited, Set<N> onStack) {
    if (onStack.contains(node)) {
      return true;
    }
    if (!visited.add(node)) {
      return false;
    }
    onStack.add(node);
    for (N successor : successors.get(node)) {
      if (backEdges.containsEntry(successor, node)) {
        continue;
      }
      if (hasCycle(successor, backEdges, visited, onStack)) {
        return true;
      }
    }
    onStack.remove(node);
    return false;
  }

  private void checkComputed() {
    checkState(loopsComputed, "computeLoops has not been called");
  }

  /** Returns whether {@code a} dominates {@code b}; that is, every path
   * from a source to {@code b} passes through {@code a}. */
  public boolean dominates(N a, N b) {
    final Set<N> d = dominators.get(b);
    return d != null && d.contains(a);
  }

  /** Returns the immediate dominator of a node, or null if the node is a
   * source or is unreachable. */
  public @Nullable N immediateDominator(N node) {
    checkComputed();
    final Set<N> d = dominators.get(node);
    if (d == null || sources.contains(node)) {
      return null;
    }
    for (N candidate : d) {
      if (!candidate.equals(node)
          && dominators.get(candidate).size() == d.size() - 1) {
        return candidate;
      }
    }
    return null;
  }

  /** Returns whether the graph is reducible. */
  public boolean isReducible() {
    checkComputed();
    return reducible;
  }

  /** Returns the loop headers; that is, the targets of back edges. */
  public Set<N> headers() {
    checkComputed();
    return Collections.unmodifiableSet(backEdgeNodes.keySet());
  }

  /** Returns the sources of the back edges into a loop header. */
  public Set<N> backEdgeNodes(N header) {
    checkComputed();
    return Collections.unmodifiableSet(backEdgeNodes.get(header));
  }

  /** Returns the nodes of the natural loop of the back edge from
   * {@code source} to {@code header}. */
  public List<N> naturalLoops(N header, N source) {
    checkComputed();
    final ImmutableList<N> loop = naturalLoops.get(header, source);
    checkArgument(loop != null, "not a back edge: %s -> %s", source, header);
    return loop;
  }
}

// End Graph.java
