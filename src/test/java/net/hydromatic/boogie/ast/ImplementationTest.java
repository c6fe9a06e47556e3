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
package net.hydromatic.boogie.ast;

import static net.hydromatic.boogie.Boogie.boogie;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.boogie.compile.Prop;
import org.junit.jupiter.api.Test;

/** Tests for {@link Implementation}: control-flow graph utilities. */
public class ImplementationTest {
  private static List<String> labels(List<Ast.Block> blocks) {
    return blocks.stream().map(b -> b.label).collect(Collectors.toList());
  }

  private static Ast.Block block(Implementation impl, String label) {
    for (Ast.Block b : impl.blocks) {
      if (b.label.equals(label)) {
        return b;
      }
    }
    throw new AssertionError("no block " + label);
  }

  @Test
  void testPredecessors() {
    final String s = "procedure P() {\n"
        + "  goto L;\n"
        + "L:\n"
        + "  goto L, M;\n"
        + "M:\n"
        + "}";
    boogie(s).withChecked(checked -> {
      final Implementation impl = checked.program.implementations().get(0);
      assertThat(labels(impl.blocks),
          is(ImmutableList.of("anon0", "L", "M")));
      impl.computePredecessors();
      assertThat(labels(block(impl, "L").predecessors),
          is(ImmutableList.of("anon0", "L")));
      assertThat(labels(block(impl, "M").predecessors),
          is(ImmutableList.of("L")));
      assertThat(block(impl, "anon0").predecessors.isEmpty(), is(true));

      // Recomputing does not add duplicates.
      impl.computePredecessors();
      assertThat(block(impl, "L").predecessors.size(), is(2));
    });
  }

  @Test
  void testConnectedComponents() {
    final String s = "procedure P() {\n"
        + "A:\n"
        + "  goto B;\n"
        + "B:\n"
        + "  goto A, C;\n"
        + "C:\n"
        + "}";
    boogie(s).withChecked(checked -> {
      final Implementation impl = checked.program.implementations().get(0);
      assertThat(labels(impl.getConnectedComponents(block(impl, "B"))),
          is(ImmutableList.of("A", "B")));
      assertThat(labels(impl.getConnectedComponents(block(impl, "C"))),
          is(ImmutableList.of("C")));

      // Predecessors are cleared after computing components.
      assertThat(block(impl, "A").predecessors.isEmpty(), is(true));
    });
  }

  @Test
  void testPruneUnreachableBlocks() {
    final String s = "procedure P() {\n"
        + "  goto A;\n"
        + "A:\n"
        + "  return;\n"
        + "B:\n"
        + "  goto A;\n"
        + "}";
    boogie(s).withChecked(checked -> {
      final Implementation impl = checked.program.implementations().get(0);
      assertThat(labels(impl.blocks), is(ImmutableList.of("anon0", "A", "B")));
      impl.pruneUnreachableBlocks();
      assertThat(labels(impl.blocks), is(ImmutableList.of("anon0", "A")));
    });

    // The same, when checking
    boogie(s)
        .with(Prop.PRUNE_UNREACHABLE_BLOCKS, true)
        .withChecked(checked -> {
          final Implementation impl =
              checked.program.implementations().get(0);
          assertThat(labels(impl.blocks),
              is(ImmutableList.of("anon0", "A")));
        });
  }

  /** A block that assumes false does not reach its successors. */
  @Test
  void testPruneAfterAssumeFalse() {
    final String s = "procedure P() {\n"
        + "  assume false;\n"
        + "  goto A;\n"
        + "A:\n"
        + "  return;\n"
        + "}";
    final String expected = "procedure P();\n"
        + "\n"
        + "implementation P()\n"
        + "{\n"
        + "  anon0:\n"
        + "    assume false;\n"
        + "    return;\n"
        + "}\n";
    boogie(s)
        .with(Prop.PRUNE_UNREACHABLE_BLOCKS, true)
        .assertChecked(expected);
  }

  @Test
  void testImplFormalMap() {
    final String s = "procedure P(n: int) returns (r: int);\n"
        + "implementation P(m: int) returns (q: int) { q := m; }";
    boogie(s).withChecked(checked -> {
      final Procedure proc = checked.program.procedures().get(0);
      final Implementation impl = checked.program.implementations().get(0);
      assertThat(impl.proc(), sameInstance(proc));
      final Map<Variable, Ast.Id> map = impl.getImplFormalMap();
      assertThat(map.size(), is(2));
      assertThat(map.get(proc.inParams.get(0)).name, is("m"));
      assertThat(map.get(proc.inParams.get(0)).decl(),
          sameInstance(impl.inParams.get(0)));
      assertThat(map.get(proc.outParams.get(0)).name, is("q"));
      assertThat(impl.getImplFormalMap(), sameInstance(map));
    });
  }

  @Test
  void testSkipVerification() {
    final String s = "procedure {:verify false} P() { }\n"
        + "procedure Q() { }\n"
        + "procedure R();\n"
        + "implementation {:verify false} R() { }";
    boogie(s).withChecked(checked -> {
      final List<Implementation> impls =
          checked.program.implementations();
      assertThat(impls.get(0).skipVerification(), is(true));
      assertThat(impls.get(1).skipVerification(), is(false));
      assertThat(impls.get(2).skipVerification(), is(true));
    });
  }
}

// End ImplementationTest.java
