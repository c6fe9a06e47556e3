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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.boogie.ast.Program;
import net.hydromatic.boogie.parse.BoogieParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Tracers}. */
public class TracersTest {
  private static Tracer recordPhases(Tracer tracer, List<String> phases) {
    for (Tracer.Phase phase : Tracer.Phase.values()) {
      tracer = Tracers.withOnPhase(tracer, phase,
          program -> phases.add(phase.name()));
    }
    return tracer;
  }

  @Test
  void testPhases() {
    final Program program =
        BoogieParser.parse("procedure P() { L: goto L; }");
    final List<String> phases = new ArrayList<>();
    final Tracer tracer = recordPhases(Tracers.empty(), phases);
    final Compiles.Result result =
        Compiles.check(program, ImmutableMap.of(), tracer);
    assertThat(result.ok(), is(true));
    assertThat(result.toString(),
        is("resolution errors: 0, typecheck errors: 0"));
    Compiles.extractLoops(program, ImmutableMap.of(), tracer);
    assertThat(phases,
        is(ImmutableList.of("REGISTER", "RESOLVE", "TYPECHECK",
            "EXTRACT_LOOPS")));
  }

  /** After resolution errors, there is no typecheck phase. */
  @Test
  void testPhasesAfterError() {
    final Program program = BoogieParser.parse("var x: T;");
    final List<String> phases = new ArrayList<>();
    final List<String> errors = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(
            recordPhases(Tracers.empty(), phases),
            e -> errors.add(e.getMessage()));
    final Compiles.Result result =
        Compiles.check(program, ImmutableMap.of(), tracer);
    assertThat(result.resolutionErrorCount, is(1));
    assertThat(phases, is(ImmutableList.of("REGISTER", "RESOLVE")));
    assertThat(errors, is(ImmutableList.of("undeclared type: T")));
  }
}

// End TracersTest.java
