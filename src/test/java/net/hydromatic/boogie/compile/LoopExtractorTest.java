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
package net.hydromatic.boogie.compile;

import static net.hydromatic.boogie.Boogie.boogie;
import static net.hydromatic.boogie.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link LoopExtractor}. */
public class LoopExtractorTest {
  @Test
  void testSimpleLoop() {
    final String s = "procedure P(n: int) returns (r: int) {\n"
        + "  var i: int;\n"
        + "  i := 0;\n"
        + "  goto L;\n"
        + "L:\n"
        + "  i := i + 1;\n"
        + "  goto L, M;\n"
        + "M:\n"
        + "  r := i;\n"
        + "}";
    final String expected = "procedure P(n: int) returns (r: int);\n"
        + "\n"
        + "implementation P(n: int) returns (r: int)\n"
        + "{\n"
        + "  var i: int;\n"
        + "\n"
        + "  anon0:\n"
        + "    i := 0;\n"
        + "    goto L;\n"
        + "\n"
        + "  L:\n"
        + "    call r, i := loop_L(n, r, i);\n"
        + "    i := i + 1;\n"
        + "    goto M, L_dummy;\n"
        + "\n"
        + "  M:\n"
        + "    r := i;\n"
        + "    return;\n"
        + "\n"
        + "  L_dummy:\n"
        + "    assume false;\n"
        + "    return;\n"
        + "}\n"
        + "\n"
        + "procedure loop_L(in_n: int, in_r: int, in_i: int)"
        + " returns (out_r: int, out_i: int);\n"
        + "\n"
        + "implementation loop_L(in_n: int, in_r: int, in_i: int)"
        + " returns (out_r: int, out_i: int)\n"
        + "{\n"
        + "  entry:\n"
        + "    out_r, out_i := in_r, in_i;\n"
        + "    goto L, exit;\n"
        + "\n"
        + "  L:\n"
        + "    out_i := out_i + 1;\n"
        + "    goto L_dummy;\n"
        + "\n"
        + "  L_dummy:\n"
        + "    call out_r, out_i := loop_L(in_n, out_r, out_i);\n"
        + "    return;\n"
        + "\n"
        + "  exit:\n"
        + "    return;\n"
        + "}\n";
    boogie(s).assertExtractLoops(expected);
  }

  /** A global variable assigned in the loop goes into the modifies clause
   * of the loop's procedure. A loop procedure without outputs has no
   * initial assignment. */
  @Test
  void testGlobalInLoop() {
    final String s = "var g: int;\n"
        + "procedure P() modifies g; {\n"
        + "L:\n"
        + "  g := g + 1;\n"
        + "  goto L;\n"
        + "}";
    final String expected = "var g: int;\n"
        + "\n"
        + "procedure P();\n"
        + "  modifies g;\n"
        + "\n"
        + "implementation P()\n"
        + "{\n"
        + "  L:\n"
        + "    call loop_L();\n"
        + "    g := g + 1;\n"
        + "    goto L_dummy;\n"
        + "\n"
        + "  L_dummy:\n"
        + "    assume false;\n"
        + "    return;\n"
        + "}\n"
        + "\n"
        + "procedure loop_L();\n"
        + "  modifies g;\n"
        + "\n"
        + "implementation loop_L()\n"
        + "{\n"
        + "  entry:\n"
        + "    goto L, exit;\n"
        + "\n"
        + "  L:\n"
        + "    g := g + 1;\n"
        + "    goto L_dummy;\n"
        + "\n"
        + "  L_dummy:\n"
        + "    call loop_L();\n"
        + "    return;\n"
        + "\n"
        + "  exit:\n"
        + "    return;\n"
        + "}\n";
    boogie(s).assertExtractLoops(expected);
  }

  @Test
  void testInlineLoops() {
    final String s = "var g: int;\n"
        + "procedure P() modifies g; {\n"
        + "L:\n"
        + "  g := g + 1;\n"
        + "  goto L;\n"
        + "}";
    boogie(s).withChecked(checked -> {
      Compiles.extractLoops(checked.program,
          ImmutableMap.of(Prop.INLINE_LOOPS, true), Tracers.empty());
      assertThat(checked.program.toString(),
          containsString("procedure {:inline 1} loop_L();\n"));
    });
  }

  /** A program without loops is unchanged. */
  @Test
  void testNoLoops() {
    final String s = "procedure P(x: int) returns (y: int)\n"
        + "{\n"
        + "  anon0:\n"
        + "    y := x;\n"
        + "    return;\n"
        + "}\n";
    final String expected = "procedure P(x: int) returns (y: int);\n"
        + "\n"
        + "implementation P(x: int) returns (y: int)\n"
        + "{\n"
        + "  anon0:\n"
        + "    y := x;\n"
        + "    return;\n"
        + "}\n";
    boogie(s).assertExtractLoops(expected);
  }

  @Test
  void testIrreducible() {
    final String s = "procedure P() {\n"
        + "  goto A, B;\n"
        + "A:\n"
        + "  goto B;\n"
        + "B:\n"
        + "  goto A;\n"
        + "}";
    boogie(s).withChecked(checked -> {
      final IllegalStateException e =
          assertThrows(IllegalStateException.class, () ->
              Compiles.extractLoops(checked.program, ImmutableMap.of(),
                  Tracers.empty()));
      assertThat(e,
          throwsA("Irreducible flow graphs are unsupported."));
    });
  }
}

// End LoopExtractorTest.java
