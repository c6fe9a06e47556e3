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
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.boogie.ast.Axiom;
import org.junit.jupiter.api.Test;

/** Tests for type checking; see {@link TypecheckingContext}. */
public class TypecheckTest {
  @Test
  void testValid() {
    final String s = "var g: int;\n"
        + "procedure Inc(n: int) returns (r: int);\n"
        + "  modifies g;\n"
        + "  ensures g == old(g) + n;\n"
        + "  ensures r == g;\n"
        + "implementation Inc(n: int) returns (r: int) {\n"
        + "  g := g + n;\n"
        + "  r := g;\n"
        + "}\n"
        + "procedure Main() modifies g; {\n"
        + "  var x: int;\n"
        + "  call x := Inc(3);\n"
        + "  assert x == g;\n"
        + "}";
    boogie(s).assertValid();
  }

  @Test
  void testMaps() {
    final String s = "var m: [int]bool;\n"
        + "procedure P(i: int) modifies m; {\n"
        + "  m[i] := true;\n"
        + "  assert m[i];\n"
        + "  assert m[i := false][i] == false;\n"
        + "}";
    boogie(s).assertValid();
    boogie("var m: [int]bool; axiom m[true];")
        .assertErrors("global variables not allowed in this context: m");
    boogie("const m: [int]bool; axiom m[true];")
        .assertErrors("invalid type for argument 0 in map select: bool "
            + "(expected: int)");
  }

  @Test
  void testAssignment() {
    boogie("procedure P() { var x: int; x := true; }")
        .assertErrors("mismatched types in assignment command (cannot "
            + "assign bool to int)");
    boogie("var g: int; procedure P() { g := 1; }")
        .assertErrors("command assigns to a global variable that is not in "
            + "the modifies clause of the enclosing procedure: g");
    boogie("var g: int; procedure P() modifies g; { g := 1; }")
        .assertValid();
  }

  @Test
  void testCall() {
    boogie("var g: int;\n"
        + "procedure Q(); modifies g;\n"
        + "procedure P() { call Q(); }")
        .assertErrors("call to Q modifies g, which is not in the modifies "
            + "clause of the caller");
    boogie("procedure Q(x: int); procedure P() { call Q(true); }")
        .assertErrors("invalid type for argument 0 in call to Q: bool "
            + "(expected: int)");
    boogie("procedure Q(x: int); procedure P() { call Q(1, 2); }")
        .assertErrors("wrong number of arguments in call to Q: 2");
  }

  @Test
  void testFunctions() {
    boogie("function f(x: int) returns (bool); axiom f(true);")
        .assertErrors("invalid type for argument 0 in application of f: "
            + "bool (expected: int)");
    boogie("function f(x: int) returns (bool); axiom f(1, 2);")
        .assertErrors("wrong number of arguments in application of f: 2");
    boogie("function f(x: int) returns (int) { x == 1 }")
        .assertErrors("function body with invalid type: bool "
            + "(expected: int)");
    boogie("function f(x: int) returns (int) { x + 1 }")
        .assertValid();
  }

  /** Each use of a polymorphic function gets its own instantiation. */
  @Test
  void testPolymorphism() {
    final String s = "function id<T>(x: T) returns (T);\n"
        + "axiom id(1) == 1;\n"
        + "axiom id(true);";
    boogie(s).assertValid();
    boogie(s).withChecked(checked -> {
      final Axiom axiom = (Axiom) checked.program.decls.get(2);
      assertThat(axiom.expr.type().isBool(), is(true));
    });
    boogie("function id<T>(x: T) returns (T); axiom id(1) == true;")
        .assertErrors("invalid argument types (int and bool) to binary "
            + "operator ==");
  }

  @Test
  void testAmbiguity() {
    boogie("function f<T>(x: int) returns (T);\n"
        + "procedure P() { assert f(1) == f(2); }")
        .assertErrors("type of f(1) could not be inferred",
            "type of f(2) could not be inferred");
    boogie("function f<T>(x: int) returns (T);\n"
        + "procedure P() { assert f(1) == 3; }")
        .assertValid();
  }

  @Test
  void testOperators() {
    boogie("axiom 1 + true == 2;")
        .assertErrors("invalid argument types (int and bool) to binary "
            + "operator +");
    boogie("procedure P() { assert 1; }")
        .assertErrors("assert/assume expressions must be of type bool");
    boogie("const c: int; procedure P(); modifies c;")
        .assertErrors("modifies list contains constant: c");
    boogie("axiom 1bv8 ++ 2bv4 == 3bv12;")
        .assertValid();
  }

  @Test
  void testGenericFunctionBody() {
    boogie("function f<T>(x: T) returns (T) { x }")
        .assertErrorCount(0, 0)
        .assertValid();
  }

  @Test
  void testImplementationFormals() {
    boogie("procedure P() returns (r: int);\n"
        + "implementation P() returns (r: bool) { }")
        .assertErrorCount(0, 1)
        .assertErrors("mismatched type of out-parameter in implementation "
            + "P: r");
    boogie("procedure P(x: int);\n"
        + "implementation P(y: bool) { }")
        .assertErrors("mismatched type of in-parameter in implementation "
            + "P: x (named y in implementation)");
    boogie("procedure P(x: int);\n"
        + "implementation P() { }")
        .assertErrors("mismatched number of in-parameters in procedure "
            + "implementation: P");
    boogie("procedure P<T>(x: T);\n"
        + "implementation P(x: int) { }")
        .assertErrors("mismatched number of type parameters in procedure "
            + "implementation: P");
    boogie("procedure P<T>(x: T);\n"
        + "implementation P<U>(y: U) { }")
        .assertValid();
  }

  @Test
  void testConditionsMustBeBool() {
    boogie("axiom 1;")
        .assertErrors("axioms must be of type bool");
    boogie("var x: int where 1;")
        .assertErrors("where clauses must be of type bool");
    boogie("procedure P(x: int);\n"
        + "  requires x;")
        .assertErrors("preconditions must be of type bool");
    boogie("procedure P() returns (r: int);\n"
        + "  ensures r;")
        .assertErrors("postconditions must be of type bool");
  }

  @Test
  void testConstantParentType() {
    boogie("const p: bool; const c: int extends p;")
        .assertErrors("parent of constant has incompatible type (bool "
            + "instead of int)");
  }

  @Test
  void testBvExtract() {
    boogie("const b: bv8; axiom b[4:0] == 0bv4;")
        .assertValid();
    boogie("const b: bv8; axiom b[9:1] == 0bv8;")
        .assertErrors("bit-vector extraction [9:1] is out of range");
    boogie("const i: int; axiom i[4:0] == 0bv4;")
        .assertErrors("type of bit-vector extraction must be a bit-vector: "
            + "int");
  }

  /** A resolved and typechecked program writes the same text that it was
   * read from. */
  @Test
  void testCheckedProgramRoundTrip() {
    final String s = "const unique p: int;\n"
        + "\n"
        + "const unique q: int;\n"
        + "\n"
        + "const unique c: int extends unique p, q complete;\n"
        + "\n"
        + "const m: <a>[a]int;\n"
        + "\n"
        + "const b: bv8;\n"
        + "\n"
        + "axiom m[b] == 0 && b[4:0] == 0bv4;\n";
    boogie(s).assertChecked(s);
  }

  /** Typechecking is skipped after resolution errors. */
  @Test
  void testResolutionErrorsSkipTypecheck() {
    boogie("procedure P() { var x: int; x := true; call Q(); }")
        .assertErrorCount(1, 0);
  }
}

// End TypecheckTest.java
