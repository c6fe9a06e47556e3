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
package net.hydromatic.boogie.parse;

import static net.hydromatic.boogie.Boogie.boogie;
import static net.hydromatic.boogie.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Implementation;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link BoogieParser}. */
public class BoogieParserTest {
  private static String unparseExpr(String s) {
    return new BoogieParser("", s).expressionEof().toString();
  }

  private static void assertExpr(String s, String expected) {
    assertThat(unparseExpr(s), is(expected));
  }

  private static void assertExprSame(String s) {
    assertExpr(s, s);
  }

  @Test
  void testExpressions() {
    assertExprSame("1");
    assertExprSame("true");
    assertExprSame("x");
    assertExprSame("a + b * c");
    assertExprSame("(a + b) * c");
    assertExprSame("a - b - c");
    assertExprSame("a - (b - c)");
    assertExprSame("a div b mod c");
    assertExprSame("a <==> b <==> c");
    assertExprSame("a && b || c");
    assertExprSame("a && (b || c)");
    assertExprSame("!(a && b)");
    assertExprSame("-x + 1");
    assertExprSame("old(x) + f(1, y)");
    assertExprSame("f()");
    assertExprSame("m[i, j]");
    assertExprSame("m[i := v][j]");
    assertExprSame("if c then 1 else 2");
    assertExprSame("(if c then 1 else 2) + 3");
    assertExprSame("x[8:0] ++ 5bv8");
    assertExprSame("(forall x: int :: x + 0 == x)");
    assertExprSame("(exists<T> x: T, y: int :: {:weight 2} f(x) == y)");
    assertExprSame("x <: y");
  }

  @Test
  void testRedundantParentheses() {
    assertExpr("((a))", "a");
    assertExpr("(a + b) + c", "a + b + c");
    assertExpr("a * (b * c)", "a * (b * c)");
    assertExpr("(-x)", "-x");
    assertExpr("(a == b) == c", "(a == b) == c");
  }

  /** Implication is right-associative; its parentheses are written only
   * where the left operand is itself an implication. */
  @Test
  void testImplies() {
    assertExprSame("a ==> b ==> c");
    assertExpr("a ==> (b ==> c)", "a ==> b ==> c");
    assertExprSame("(a ==> b) ==> c");
    assertExprSame("a || b ==> c && d");
  }

  @Test
  void testExpressionStructure() {
    final Ast.Expr e = new BoogieParser("", "a ==> b ==> c").expressionEof();
    assertThat(e, instanceOf(Ast.Binary.class));
    final Ast.Binary binary = (Ast.Binary) e;
    assertThat(binary.a0.toString(), is("a"));
    assertThat(binary.a1.toString(), is("b ==> c"));

    final Ast.Expr e2 = new BoogieParser("", "a - b - c").expressionEof();
    assertThat(((Ast.Binary) e2).a0.toString(), is("a - b"));
  }

  /** Comparisons do not associate. */
  @Test
  void testComparisonIsNotAssociative() {
    final ParseException e =
        assertThrows(ParseException.class, () -> unparseExpr("a < b < c"));
    assertThat(e.getMessage(), is("expected end of input, found '<'"));
  }

  @Test
  void testTypes() {
    assertType("int", "int");
    assertType("bool", "bool");
    assertType("bv32", "bv32");
    assertType("[int]bool", "[int]bool");
    assertType("[int, bool]int", "[int, bool]int");
    assertType("<a>[a]a", "<a>[a]a");
    assertType("<a,b>[a]b", "<a,b>[a]b");
    assertType("[int][int]int", "[int][int]int");
    assertType("C int [int]bool", "C int [int]bool");
    assertType("C (D int) bool", "C (D int) bool");
    assertType("(int)", "int");
  }

  private static void assertType(String s, String expected) {
    final Type type = new BoogieParser("", s).typeEof();
    assertThat(type.toString(), is(expected));
  }

  @Test
  void testDeclarations() {
    boogie("type T _ _;").assertParseSame();
    boogie("type {:builtin \"Seq\"} Seq _;").assertParseSame();
    boogie("type S a = [a]int;").assertParseSame();
    boogie("const c: int;").assertParseSame();
    boogie("const unique c: int extends unique p, q complete;")
        .assertParseSame();
    boogie("const c: int extends;").assertParseSame();
    boogie("var x: int;").assertParseSame();
    boogie("var x: int where x > 0;").assertParseSame();
    boogie("var {:a} m: [int]bool;").assertParseSame();
    boogie("axiom (forall x: int :: x + 0 == x);").assertParseSame();
    boogie("axiom {:id 1} true;").assertParseSame();
    boogie("function f<T>(x: T) returns (T) { x }").assertParseSame();
    boogie("function {:inline} g(int, bool) returns (r: int);")
        .assertParseSame();
  }

  @Test
  void testFunctionResultAbbreviation() {
    boogie("function f(x: int): int;")
        .assertParse("function f(x: int) returns (int);\n");
    boogie("function f(x: int): bool { x > 0 }")
        .assertParse("function f(x: int) returns (bool) { x > 0 }\n");
  }

  @Test
  void testProcedure() {
    final String s = "procedure P(x: int) returns (r: int);\n"
        + "  requires x > 0;\n"
        + "  free requires {:note \"n\"} x < 10;\n"
        + "  modifies g, h;\n"
        + "  ensures r == old(g);\n";
    boogie(s).assertParseSame();
  }

  /** A procedure with a body is also an implementation. The
   * implementation's formals do not have where clauses. */
  @Test
  void testProcedureWithBody() {
    final String s = "procedure {:verify false} Q<T>(x: T where true)"
        + " returns (r: T)\n"
        + "  ensures r == x;\n"
        + "{\n"
        + "  r := x;\n"
        + "}\n";
    final String expected = "procedure {:verify false} Q<T>(x: T where true)"
        + " returns (r: T);\n"
        + "  ensures r == x;\n"
        + "\n"
        + "implementation Q<T>(x: T) returns (r: T)\n"
        + "{\n"
        + "  anon0:\n"
        + "    r := x;\n"
        + "    return;\n"
        + "}\n";
    boogie(s).assertParse(expected);
  }

  @Test
  void testImplementation() {
    final String s = "procedure P(n: int) returns (r: int);\n"
        + "\n"
        + "implementation P(n: int) returns (r: int)\n"
        + "{\n"
        + "  var i: int;\n"
        + "  var m: [int]int;\n"
        + "\n"
        + "  start:\n"
        + "    i, m[i] := 0, 1;\n"
        + "    havoc i, m;\n"
        + "    assume i >= 0;\n"
        + "    call r := P(i);\n"
        + "    call P(i);\n"
        + "    assert r == m[i];\n"
        + "    goto L, M;\n"
        + "\n"
        + "  L:\n"
        + "    return;\n"
        + "\n"
        + "  M:\n"
        + "    return;\n"
        + "}\n";
    boogie(s).assertParseSame();
  }

  /** Unlabeled blocks get generated labels; a label that follows an open
   * block ends that block with a goto. */
  @Test
  void testBlockStructure() {
    final String s = "procedure P()\n"
        + "{\n"
        + "  assert true;\n"
        + "  L:\n"
        + "  assume false;\n"
        + "  goto L;\n"
        + "  assert false;\n"
        + "}\n";
    final String expected = "procedure P();\n"
        + "\n"
        + "implementation P()\n"
        + "{\n"
        + "  anon0:\n"
        + "    assert true;\n"
        + "    goto L;\n"
        + "\n"
        + "  L:\n"
        + "    assume false;\n"
        + "    goto L;\n"
        + "\n"
        + "  anon1:\n"
        + "    assert false;\n"
        + "    return;\n"
        + "}\n";
    boogie(s).assertParse(expected);
  }

  @Test
  void testEmptyBody() {
    boogie("procedure P() {}").withProgram(program -> {
      final List<Implementation> impls = program.implementations();
      assertThat(impls.size(), is(1));
      final Implementation impl = impls.get(0);
      assertThat(impl.blocks.size(), is(1));
      assertThat(impl.blocks.get(0).label, is("anon0"));
      assertThat(impl.blocks.get(0).transfer,
          instanceOf(Ast.Return.class));
    });
  }

  @Test
  void testComments() {
    final String s = "// a comment\n"
        + "var x: int; /* another\n"
        + "comment */ var y: bool;\n";
    boogie(s).assertParse("var x: int;\n\nvar y: bool;\n");
  }

  @Test
  void testPositions() {
    final String s = "var x: int;\n"
        + "axiom x\n"
        + "  > 0;\n";
    boogie(s).withProgram(program -> {
      assertThat(program.decls.get(0).pos.toString(), is("1.1-1.12"));
      assertThat(program.decls.get(1).pos,
          is(new Pos("", 2, 1, 3, 7)));
    });
  }

  @Test
  void testErrors() {
    boogie("var x: int")
        .assertParseThrows(
            throwsA(ParseException.class,
                is("expected ';', found end of input")));
    boogie("procedure P(;")
        .assertParseThrows(
            throwsA(ParseException.class,
                is("expected identifier, found ';'")));
    boogie("axiom x +;")
        .assertParseThrows(
            throwsA(ParseException.class,
                is("expected expression, found ';'")));
    boogie("foo;")
        .assertParseThrows(
            throwsA(ParseException.class,
                is("expected declaration, found 'foo'")));
    boogie("procedure P(); free modifies x;")
        .assertParseThrows(
            throwsA(ParseException.class,
                is("expected 'requires' or 'ensures', found 'modifies'")));
    boogie("var x: int; /* unfinished")
        .assertParseThrows(throwsA("unterminated comment"));
    boogie("var x: int @")
        .assertParseThrows(throwsA("unexpected character '@'"));
  }

  @Test
  void testKeywords() {
    assertThat(Lexer.KEYWORDS, hasItem("implementation"));
    final List<Lexer.Token> tokens =
        new Lexer("", "x := 12bv8 ==> \"s\" div").scan();
    assertThat(tokens.toString(),
        is("['x', ':=', '12bv8', '==>', 's', 'div', end of input]"));
    assertThat(tokens.get(2).kind, is(Lexer.TokenKind.BV));
    assertThat(tokens.get(4).kind, is(Lexer.TokenKind.STRING));
    assertThat(tokens.get(5).kind, is(Lexer.TokenKind.KEYWORD));
  }
}

// End BoogieParserTest.java
