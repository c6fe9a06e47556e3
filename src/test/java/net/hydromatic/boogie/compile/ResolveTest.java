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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.boogie.ast.Constant;
import net.hydromatic.boogie.ast.Program;
import net.hydromatic.boogie.ast.TypeSynonymDecl;
import net.hydromatic.boogie.parse.BoogieParser;
import net.hydromatic.boogie.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for name resolution; see {@link ResolutionContext}. */
public class ResolveTest {
  @Test
  void testUndeclared() {
    boogie("procedure P() { x := 1; }")
        .assertErrors("undeclared identifier: x");
    boogie("procedure P() { call Q(); }")
        .assertErrors("undeclared procedure: Q");
    boogie("procedure P() { goto L; }")
        .assertErrors("undeclared label: L");
    boogie("axiom f(1) == 1;")
        .assertErrors("undeclared function: f");
    boogie("var x: T;")
        .assertErrors("undeclared type: T");
    boogie("implementation Q() { }")
        .assertErrors("implementation given for undeclared procedure: Q");
  }

  @Test
  void testErrorPosition() {
    final String s = "procedure P() {\n"
        + "  x := 1;\n"
        + "}\n";
    boogie(s).withChecked(checked -> {
      assertThat(checked.errorStrings(),
          is(ImmutableList.of("2.3 Error: undeclared identifier: x")));
      assertThat(checked.result.resolutionErrorCount, is(1));
      assertThat(checked.result.typecheckErrorCount, is(0));
      assertThat(checked.result.ok(), is(false));
    });
  }

  @Test
  void testDuplicates() {
    boogie("var x: int; var x: bool;")
        .assertErrors("more than one declaration of variable name: x");
    boogie("type T; type T;")
        .assertErrors("more than one declaration of type name: T");
    boogie("type T; type T = int;")
        .assertErrors("more than one declaration of type name: T");
    boogie("procedure P(); procedure P();")
        .assertErrors("more than one declaration of function/procedure "
            + "name: P");
    boogie("function f(x: int) returns (int); procedure f();")
        .assertErrors("more than one declaration of function/procedure "
            + "name: f");
    boogie("procedure P() { L: return; L: return; }")
        .assertErrors("more than one declaration of label: L");
  }

  /** A formal and a local of the same implementation are in the same
   * scope; a local may shadow a global. */
  @Test
  void testScopes() {
    boogie("procedure P(x: int) { var x: int; }")
        .assertErrors("more than one declaration of variable name: x");
    boogie("var x: int;\n"
        + "procedure P() { var x: bool; x := true; }")
        .assertValid();
    boogie("procedure P(x: int) returns (x: int);")
        .assertErrors("more than one declaration of variable name: x");
  }

  @Test
  void testTypeSynonymCycle() {
    final String cycle = "type A = B; type B = A; var x: A;";
    boogie(cycle)
        .assertErrors("type synonym could not be resolved because of "
                + "cycles: A (replacing body with \"bool\" to continue "
                + "resolving)",
            "type synonym could not be resolved because of cycles: B")
        .withChecked(checked -> {
          for (int i = 0; i < 2; i++) {
            final TypeSynonymDecl synonym =
                (TypeSynonymDecl) checked.program.decls.get(i);
            assertThat(synonym.body, is(Type.BOOL));
          }
        });
    boogie("type A = B; type B = [int]C; type C = int; var x: A;")
        .assertValid();
  }

  @Test
  void testConstants() {
    boogie("const unique c: int;")
        .assertValid()
        .withChecked(checked -> {
          final Constant c = (Constant) checked.program.decls.get(0);
          assertThat(c.unique, is(true));
          assertThat(c.parents, nullValue());
          assertThat(c.childrenComplete, is(false));
        });
    boogie("const unique p: int;\n"
        + "const c: int extends unique p complete;")
        .assertValid();
    boogie("var v: int; const c: int extends v;")
        .assertErrors("the parent of a constant has to be a constant");
    boogie("const c: int extends c;")
        .assertErrors("constant cannot be its own parent");
    boogie("const p: int; const c: int extends p, p;")
        .assertErrors("p occurs more than once as parent");
  }

  @Test
  void testImplementationOfFunction() {
    boogie("function f(x: int) returns (int);\n"
        + "implementation f(x: int) { }")
        .assertErrors("implementations given for function, not procedure: f");
  }

  /** An exception thrown while resolving an implementation body leaves no
   * scope behind. */
  @Test
  void testScopesRestoredOnException() {
    final Program program =
        BoogieParser.parse("procedure P<T>(x: T) { var y: int; z := 1; }");
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), e -> {
          throw e;
        });
    final ResolutionContext rc = new ResolutionContext(tracer);
    program.register(rc);
    final CompileException e =
        assertThrows(CompileException.class, () -> program.resolve(rc));
    assertThat(e.getMessage(), is("undeclared identifier: z"));
    assertThat(rc.stateMode(), is(ResolutionContext.StateMode.SINGLE));
    assertThat(rc.lookupVariable("x"), nullValue());
    assertThat(rc.lookupVariable("y"), nullValue());
    assertThat(rc.lookupTypeBinder("T"), nullValue());
    assertThrows(IllegalStateException.class, () -> rc.lookupBlock("anon0"));
    assertThrows(IllegalStateException.class, rc::popVarContext);
  }

  @Test
  void testStateModes() {
    boogie("var g: int;\n"
        + "procedure P();\n"
        + "  requires old(g) == 0;")
        .assertErrors("old expressions allowed only in two-state contexts");
    boogie("var g: int;\n"
        + "procedure P();\n"
        + "  modifies g;\n"
        + "  ensures g == old(g) + 1;")
        .assertValid();
    boogie("var g: int;\n"
        + "function f(x: int) returns (int) { x + g }")
        .assertErrors("global variables not allowed in this context: g");
    boogie("var g: int; axiom g == 0;")
        .assertErrors("global variables not allowed in this context: g");
    boogie("const c: int; axiom c == 0;")
        .assertValid();
  }

  @Test
  void testImmutable() {
    boogie("procedure P(x: int) { x := 1; }")
        .assertErrors("command assigns to an immutable variable: x");
    boogie("const c: int; procedure P() { c := 1; }")
        .assertErrors("command assigns to an immutable variable: c");
    boogie("procedure P() returns (r: int) { r := 1; }")
        .assertValid();
    boogie("procedure P() { var x: int; havoc x; }")
        .assertValid();
  }

  @Test
  void testTypeParameterOccurrences() {
    boogie("procedure P<T>(x: int);")
        .assertErrors("type variable must occur in procedure arguments: T");
    boogie("function f<T>(x: int) returns (int);")
        .assertErrors("type variable must occur in function arguments: T");
    boogie("function f<T>(x: int) returns (T);")
        .assertValid();
  }

  /** With "overlookTypeErrors", an implementation with resolution errors
   * is dropped, with a warning, and its errors do not count. */
  @Test
  void testOverlookTypeErrors() {
    final String s = "procedure P();\n"
        + "implementation P() { x := 1; }\n"
        + "procedure Q() { }";
    boogie(s)
        .assertErrorCount(1, 0);
    boogie(s)
        .with(Prop.OVERLOOK_TYPE_ERRORS, true)
        .assertErrorCount(0, 0)
        .assertWarnings("Ignoring implementation P because of translation "
            + "resolution errors")
        .withChecked(checked -> {
          assertThat(checked.errors.size(), is(1));
          assertThat(checked.program.implementations().size(), is(1));
          assertThat(checked.program.implementations().get(0).name,
              is("Q"));
        });
  }
}

// End ResolveTest.java
