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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link StronglyConnectedComponents}. */
public class StronglyConnectedComponentsTest {
  private static StronglyConnectedComponents<String> scc(List<String> nodes,
      String... edges) {
    final ImmutableListMultimap.Builder<String, String> b =
        ImmutableListMultimap.builder();
    for (String edge : edges) {
      final String[] fromTo = edge.split("-");
      b.put(fromTo[0], fromTo[1]);
    }
    final ListMultimap<String, String> successors = b.build();
    final ListMultimap<String, String> predecessors =
        ImmutableListMultimap.copyOf(successors).inverse();
    final StronglyConnectedComponents<String> scc =
        new StronglyConnectedComponents<>(nodes, successors::get,
            predecessors::get);
    scc.compute();
    return scc;
  }

  @Test
  void testComponents() {
    final StronglyConnectedComponents<String> scc =
        scc(ImmutableList.of("a", "b", "c", "d"),
            "a-b", "b-a", "b-c", "c-d");
    assertThat(scc.components(),
        is(ImmutableList.of(ImmutableList.of("a", "b"),
            ImmutableList.of("c"), ImmutableList.of("d"))));
    assertThat(scc.toString(), is("[[a, b], [c], [d]]"));
  }

  /** Components come out in topological order even if the nodes are given
   * in reverse. Within a component, nodes are in search order. */
  @Test
  void testTopologicalOrder() {
    final StronglyConnectedComponents<String> scc =
        scc(ImmutableList.of("d", "c", "b", "a"),
            "a-b", "b-c", "c-b", "c-d");
    assertThat(scc.components(),
        is(ImmutableList.of(ImmutableList.of("a"),
            ImmutableList.of("c", "b"), ImmutableList.of("d"))));
  }

  /** A long chain, such as a straight-line control-flow graph with many
   * blocks, does not exhaust the call stack. */
  @Test
  void testLongChain() {
    final int n = 100_000;
    final List<Integer> nodes = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      nodes.add(i);
    }
    final StronglyConnectedComponents<Integer> scc =
        new StronglyConnectedComponents<>(nodes,
            i -> i + 1 < n ? ImmutableList.of(i + 1) : ImmutableList.of(),
            i -> i > 0 ? ImmutableList.of(i - 1) : ImmutableList.of());
    scc.compute();
    assertThat(scc.components().size(), is(n));
    assertThat(scc.components().get(0), is(ImmutableList.of(0)));
    assertThat(scc.components().get(n - 1), is(ImmutableList.of(n - 1)));
  }

  @Test
  void testIsolated() {
    final StronglyConnectedComponents<String> scc =
        scc(ImmutableList.of("x", "y"));
    int n = 0;
    for (List<String> component : scc) {
      assertThat(component.size(), is(1));
      ++n;
    }
    assertThat(n, is(2));
  }

  @Test
  void testNotComputed() {
    final StronglyConnectedComponents<String> scc =
        new StronglyConnectedComponents<>(ImmutableList.of("x"),
            x -> ImmutableList.of(), x -> ImmutableList.of());
    assertThat(scc.toString(), is("<not computed>"));
    assertThrows(IllegalStateException.class, scc::components);
    scc.compute();
    assertThrows(IllegalStateException.class, scc::compute);
  }
}

// End StronglyConnectedComponentsTest.java
