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
package net.hydromatic.boogie.type;

import static net.hydromatic.boogie.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Attributes;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.TypeCtorDecl;
import org.junit.jupiter.api.Test;

/** Tests for {@link Type} and its sub-classes: equality, unification,
 * substitution and printing. */
public class TypeTest {
  private static TypeVariable var(String name) {
    return new TypeVariable(Pos.ZERO, name);
  }

  private static MapType map(List<TypeVariable> typeParameters,
      List<Type> arguments, Type result) {
    return new MapType(Pos.ZERO, typeParameters, arguments, result);
  }

  @Test
  void testUnifyBasic() {
    assertThat(Type.INT.unify(Type.INT), is(true));
    assertThat(Type.INT.unify(Type.BOOL), is(false));
    assertThat(Type.BOOL.unify(Types.bvType(1)), is(false));
    assertThat(Types.bvType(8).unify(Types.bvType(8)), is(true));
    assertThat(Types.bvType(8).unify(Types.bvType(16)), is(false));
  }

  /** The result type of a polymorphic application is the formal result
   * type with the inferred type parameters substituted. */
  @Test
  void testInferValueType() {
    final TypeVariable t = var("T");
    final TypeVariable u = var("U");
    final Type result =
        Types.inferValueType(ImmutableList.of(t, u),
            ImmutableList.of(t, map(ImmutableList.of(), ImmutableList.of(t),
                u)),
            map(ImmutableList.of(), ImmutableList.of(Type.INT), u),
            ImmutableList.of(Type.INT,
                map(ImmutableList.of(), ImmutableList.of(Type.INT),
                    Type.BOOL)));
    assertThat(result.toString(), is("[int]bool"));
    assertThat(result.equals(
            map(ImmutableList.of(), ImmutableList.of(Type.INT), Type.BOOL)),
        is(true));
    assertThat(result.freeVariables().isEmpty(), is(true));
  }

  @Test
  void testDescribe() {
    assertThat(Type.INT.toString(), is("int"));
    assertThat(Types.bvType(32).toString(), is("bv32"));
    final TypeVariable a = var("a");
    final TypeVariable b = var("b");
    final MapType m =
        map(ImmutableList.of(a, b), ImmutableList.of(a, b), Type.INT);
    assertThat(m.toString(), is("<a,b>[a, b]int"));
    final MapType nested =
        map(ImmutableList.of(), ImmutableList.of(Type.INT),
            map(ImmutableList.of(), ImmutableList.of(Type.BOOL), Type.INT));
    assertThat(nested.toString(), is("[int][bool]int"));

    final TypeCtorDecl c =
        ast.typeCtorDecl(Pos.ZERO, new Attributes(), "C", 2);
    final TypeCtorDecl d =
        ast.typeCtorDecl(Pos.ZERO, new Attributes(), "D", 1);
    final Type t0 =
        new CtorType(Pos.ZERO, c,
            ImmutableList.of(Type.INT,
                map(ImmutableList.of(), ImmutableList.of(Type.INT),
                    Type.BOOL)));
    assertThat(t0.toString(), is("C int [int]bool"));
    final Type t1 =
        new CtorType(Pos.ZERO, c,
            ImmutableList.of(
                new CtorType(Pos.ZERO, d, ImmutableList.of(Type.INT)),
                Type.BOOL));
    assertThat(t1.toString(), is("C (D int) bool"));
  }

  @Test
  void testProxy() {
    final TypeProxy p = new TypeProxy(Pos.ZERO, "x");
    assertThat(p.toString().startsWith("x$proxy#"), is(true));
    assertThat(p.proxyFor(), nullValue());
    assertThat(p.freeProxies(), is(ImmutableList.of(p)));

    assertThat(p.unify(Type.INT), is(true));
    assertThat(p.proxyFor(), sameInstance(Type.INT));
    assertThat(p.toString(), is("int"));
    assertThat(p.isInt(), is(true));
    assertThat(p.freeProxies().isEmpty(), is(true));

    // Once defined, a proxy behaves like its definition.
    assertThat(p.unify(Type.BOOL), is(false));
    assertThat(Type.INT.equals(p), is(true));
    assertThat(p.equals(Type.INT), is(true));
  }

  @Test
  void testProxyChain() {
    final TypeProxy p = new TypeProxy(Pos.ZERO, "p");
    final TypeProxy q = new TypeProxy(Pos.ZERO, "q");
    assertThat(p.unify(q), is(true));
    assertThat(q.unify(Type.BOOL), is(true));
    assertThat(p.isBool(), is(true));
    assertThat(TypeProxy.followProxy(p), sameInstance(Type.BOOL));
  }

  @Test
  void testOccursCheck() {
    final TypeProxy p = new TypeProxy(Pos.ZERO, "p");
    final MapType m =
        map(ImmutableList.of(), ImmutableList.of(Type.INT), p);
    assertThat(p.unify(m), is(false));
    assertThat(p.proxyFor(), nullValue());

    // A proxy unifies with itself without being defined.
    assertThat(p.unify(p), is(true));
    assertThat(p.proxyFor(), nullValue());
  }

  @Test
  void testAlphaEquivalence() {
    final TypeVariable a = var("a");
    final TypeVariable b = var("b");
    final MapType m1 = map(ImmutableList.of(a), ImmutableList.of(a), a);
    final MapType m2 = map(ImmutableList.of(b), ImmutableList.of(b), b);
    assertThat(m1.equals(m2), is(true));
    assertThat(m1.hashCode(), is(m2.hashCode()));

    // Free variables are only equal to themselves.
    final MapType m3 = map(ImmutableList.of(), ImmutableList.of(a), a);
    final MapType m4 = map(ImmutableList.of(), ImmutableList.of(b), b);
    assertThat(m3.equals(m4), is(false));
    assertThat(m3.equals(map(ImmutableList.of(), ImmutableList.of(a), a)),
        is(true));
    assertThat(var("a").equals(a), is(false));

    // Bound variables must appear in the same positions.
    final TypeVariable c = var("c");
    final TypeVariable d = var("d");
    final MapType m5 =
        map(ImmutableList.of(a, b), ImmutableList.of(a, b), Type.INT);
    final MapType m6 =
        map(ImmutableList.of(c, d), ImmutableList.of(d, c), Type.INT);
    assertThat(m5.equals(m6), is(false));
  }

  @Test
  void testUnifyMapTypes() {
    final TypeVariable a = var("a");
    final TypeVariable b = var("b");
    final MapType m1 = map(ImmutableList.of(a), ImmutableList.of(a), a);
    final MapType m2 = map(ImmutableList.of(b), ImmutableList.of(b), b);
    assertThat(m1.unify(m2), is(true));

    final MapType m3 = map(ImmutableList.of(b), ImmutableList.of(b), Type.INT);
    assertThat(m1.unify(m3), is(false));

    final TypeProxy p = new TypeProxy(Pos.ZERO, "p");
    final MapType m4 =
        map(ImmutableList.of(), ImmutableList.of(Type.INT), p);
    final MapType m5 =
        map(ImmutableList.of(), ImmutableList.of(Type.INT), Type.BOOL);
    assertThat(m4.unify(m5), is(true));
    assertThat(m4.toString(), is("[int]bool"));
  }

  @Test
  void testUnifyVariables() {
    final TypeVariable a = var("a");
    final Map<TypeVariable, Type> unifier = new HashMap<>();

    // A variable that is not unifiable only unifies with itself.
    assertThat(a.unify(Type.INT), is(false));
    assertThat(a.unify(a), is(true));

    assertThat(a.unify(Type.INT, ImmutableList.of(a), unifier), is(true));
    assertThat(unifier.get(a), sameInstance(Type.INT));
    assertThat(a.unify(Type.BOOL, ImmutableList.of(a), unifier), is(false));
  }

  @Test
  void testUnifierStaysIdempotent() {
    final TypeVariable c = var("c");
    final TypeVariable d = var("d");
    final List<TypeVariable> vars = ImmutableList.of(c, d);
    final Map<TypeVariable, Type> unifier = new HashMap<>();
    final MapType m = map(ImmutableList.of(), ImmutableList.of(Type.INT), d);
    assertThat(c.unify(m, vars, unifier), is(true));
    assertThat(unifier.get(c).toString(), is("[int]d"));

    assertThat(d.unify(Type.BOOL, vars, unifier), is(true));
    assertThat(unifier.get(c).toString(), is("[int]bool"));
    assertThat(unifier.get(d), sameInstance(Type.BOOL));
    assertThat(Type.isIdempotent(unifier), is(true));

    // A variable cannot be bound to a type that contains it.
    final TypeVariable e = var("e");
    final Map<TypeVariable, Type> unifier2 = new HashMap<>();
    final MapType m2 = map(ImmutableList.of(), ImmutableList.of(e), Type.INT);
    assertThat(e.unify(m2, ImmutableList.of(e), unifier2), is(false));
  }

  @Test
  void testIsIdempotent() {
    final TypeVariable a = var("a");
    final TypeVariable b = var("b");
    assertThat(Type.isIdempotent(ImmutableMap.of(a, Type.INT, b, a)),
        is(false));
    assertThat(Type.isIdempotent(ImmutableMap.of(a, Type.INT, b, Type.INT)),
        is(true));
  }

  @Test
  void testSubstitute() {
    final TypeVariable a = var("a");
    final TypeVariable b = var("b");
    final MapType m = map(ImmutableList.of(), ImmutableList.of(a), b);
    assertThat(m.substitute(ImmutableMap.of(a, Type.INT)).toString(),
        is("[int]b"));
    assertThat(m.freeVariables(), is(ImmutableList.of(a, b)));

    // Bound variables are not substituted.
    final MapType m2 = map(ImmutableList.of(a), ImmutableList.of(a), b);
    assertThat(m2.freeVariables(), is(ImmutableList.of(b)));
    assertThat(m2.substitute(ImmutableMap.of(a, Type.INT)).toString(),
        is("<a>[a]b"));

    // Substituting "a" for "b" in "<a>[a]b" must not capture "a".
    final TypeVariable c = var("c");
    final Type m3 = m2.substitute(ImmutableMap.of(b, a));
    assertThat(m3.equals(map(ImmutableList.of(c), ImmutableList.of(c), a)),
        is(true));
    assertThat(m3.equals(map(ImmutableList.of(c), ImmutableList.of(c), c)),
        is(false));
  }

  @Test
  void testBvTypeProxy() {
    final BvTypeProxy p = new BvTypeProxy(Pos.ZERO, "x", 4);
    assertThat(p.isBv(), is(true));
    assertThat(p.bvBits(), is(4));
    assertThat(p.unify(Types.bvType(8)), is(true));
    assertThat(p.bvBits(), is(8));

    // Too narrow
    final BvTypeProxy q = new BvTypeProxy(Pos.ZERO, "y", 16);
    assertThat(q.unify(Types.bvType(8)), is(false));
    assertThat(q.unify(Type.INT), is(false));
    assertThat(q.proxyFor(), nullValue());
  }

  @Test
  void testBvConcatProxy() {
    final BvTypeProxy lo = new BvTypeProxy(Pos.ZERO, "lo", 0);
    final BvTypeProxy concat =
        new BvTypeProxy(Pos.ZERO, "concat", Types.bvType(8), lo);
    assertThat(concat.minBits, is(8));
    assertThat(concat.unify(Types.bvType(12)), is(true));
    assertThat(concat.bvBits(), is(12));
    assertThat(lo.bvBits(), is(4));
  }

  @Test
  void testMapTypeProxy() {
    final MapTypeProxy p = new MapTypeProxy(Pos.ZERO, "m", 1);
    assertThat(p.toString(), is("[?]?"));
    assertThat(p.isMap(), is(true));
    assertThat(p.mapArity(), is(1));
    assertThat(new MapTypeProxy(Pos.ZERO, "m", 2).toString(),
        is("[?, ?]?"));
  }

  @Test
  void testBvTypeCache() {
    assertThat(Types.bvType(8), sameInstance(Types.bvType(8)));
    assertThat(Types.bvType(200), not(sameInstance(Types.bvType(200))));
    assertThat(Types.bvType(200), is(Types.bvType(200)));
  }
}

// End TypeTest.java
