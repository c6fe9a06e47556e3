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
package net.hydromatic.boogie;

import static net.hydromatic.boogie.Matchers.hasMessages;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.boogie.ast.Program;
import net.hydromatic.boogie.compile.CompileException;
import net.hydromatic.boogie.compile.Compiles;
import net.hydromatic.boogie.compile.Prop;
import net.hydromatic.boogie.compile.Tracer;
import net.hydromatic.boogie.compile.Tracers;
import net.hydromatic.boogie.parse.BoogieParser;
import net.hydromatic.boogie.parse.ParseException;
import org.hamcrest.Matcher;

/** Fluent test helper. */
public class Boogie {
  private final String text;
  private final ImmutableMap<Prop, Object> propMap;

  private Boogie(String text, Map<Prop, Object> propMap) {
    this.text = text;
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Creates a {@code Boogie}. */
  public static Boogie boogie(String text) {
    return new Boogie(text, ImmutableMap.of());
  }

  /** Returns a copy of this fixture with a property set. */
  public Boogie with(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Boogie(text, map);
  }

  /** Parses the program and performs an action on it. */
  @CanIgnoreReturnValue
  public Boogie withProgram(Consumer<Program> action) {
    action.accept(BoogieParser.parse(text));
    return this;
  }

  /** Checks that the program parses and unparses to the given string. */
  @CanIgnoreReturnValue
  public Boogie assertParse(String expected) {
    return withProgram(program ->
        assertThat(program.toString(), is(expected)));
  }

  /** Checks that the program parses and unparses to its original text. */
  @CanIgnoreReturnValue
  public Boogie assertParseSame() {
    return assertParse(text.endsWith("\n") ? text : text + "\n");
  }

  /** Checks that parsing throws an error whose message matches. */
  @CanIgnoreReturnValue
  public Boogie assertParseThrows(Matcher<Throwable> matcher) {
    try {
      final Program program = BoogieParser.parse(text);
      fail("expected error, got " + program);
    } catch (ParseException e) {
      assertThat(e, matcher);
    }
    return this;
  }

  /** Parses and checks the program, and performs an action on the
   * outcome. */
  @CanIgnoreReturnValue
  public Boogie withChecked(Consumer<Checked> action) {
    final Program program = BoogieParser.parse(text);
    final List<CompileException> errors = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnCompileException(tracer, errors::add);
    tracer = Tracers.withOnWarning(tracer, (pos, message) ->
        warnings.add(message));
    final Compiles.Result result = Compiles.check(program, propMap, tracer);
    action.accept(new Checked(program, result, errors, warnings, tracer));
    return this;
  }

  /** Checks that the program has no resolution or type errors. */
  @CanIgnoreReturnValue
  public Boogie assertValid() {
    return withChecked(checked -> {
      assertThat(checked.errorStrings(), is(ImmutableList.of()));
      assertThat(checked.result.ok(), is(true));
    });
  }

  /** Checks that checking the program reports errors whose messages
   * contain the given strings, in order. */
  @CanIgnoreReturnValue
  public Boogie assertErrors(String... messages) {
    return withChecked(checked ->
        assertThat(checked.errors, hasMessages(messages)));
  }

  /** Checks the numbers of resolution and typecheck errors. */
  @CanIgnoreReturnValue
  public Boogie assertErrorCount(int resolutionErrorCount,
      int typecheckErrorCount) {
    return withChecked(checked -> {
      assertThat(checked.result.resolutionErrorCount,
          is(resolutionErrorCount));
      assertThat(checked.result.typecheckErrorCount,
          is(typecheckErrorCount));
    });
  }

  /** Checks the warnings emitted while checking the program. */
  @CanIgnoreReturnValue
  public Boogie assertWarnings(String... warnings) {
    return withChecked(checked ->
        assertThat(checked.warnings, is(ImmutableList.copyOf(warnings))));
  }

  /** Checks that the program is valid, then that the checked program
   * unparses to the given string. */
  @CanIgnoreReturnValue
  public Boogie assertChecked(String expected) {
    return withChecked(checked -> {
      assertThat(checked.errorStrings(), is(ImmutableList.of()));
      assertThat(checked.program.toString(), is(expected));
    });
  }

  /** Checks that the program is valid, extracts its loops, and checks
   * that the resulting program unparses to the given string. */
  @CanIgnoreReturnValue
  public Boogie assertExtractLoops(String expected) {
    return withChecked(checked -> {
      assertThat(checked.errorStrings(), is(ImmutableList.of()));
      Compiles.extractLoops(checked.program, propMap, checked.tracer);
      assertThat(checked.program.toString(), is(expected));
    });
  }

  /** Outcome of checking a program. */
  public static class Checked {
    public final Program program;
    public final Compiles.Result result;
    public final List<CompileException> errors;
    public final List<String> warnings;
    final Tracer tracer;

    Checked(Program program, Compiles.Result result,
        List<CompileException> errors, List<String> warnings,
        Tracer tracer) {
      this.program = program;
      this.result = result;
      this.errors = errors;
      this.warnings = warnings;
      this.tracer = tracer;
    }

    /** Returns each error as "position Error: message". */
    public List<String> errorStrings() {
      final ImmutableList.Builder<String> b = ImmutableList.builder();
      errors.forEach(e -> b.add(e.describeTo(new StringBuilder()).toString()));
      return b.build();
    }
  }
}

// End Boogie.java
