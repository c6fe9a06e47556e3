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

import static net.hydromatic.boogie.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Tests for {@link Attributes}. */
public class AttributesTest {
  private static List<String> keys(Attributes attributes) {
    return attributes.entries().stream()
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  private static String unparse(Attributes attributes) {
    return attributes.unparse(new AstWriter()).toString();
  }

  @Test
  void testOrder() {
    final Attributes attributes = new Attributes();
    assertThat(attributes.isEmpty(), is(true));
    attributes.add("b", ImmutableList.of(ast.intLiteral(Pos.ZERO, 1)));
    attributes.add("a", ImmutableList.of("s"));
    assertThat(keys(attributes), is(ImmutableList.of("b", "a")));
    assertThat(unparse(attributes), is("{:b 1} {:a \"s\"} "));

    // A new key goes first; an existing key gets another parameter.
    attributes.addAttribute("c", ast.intLiteral(Pos.ZERO, 3));
    attributes.addAttribute("b", ast.intLiteral(Pos.ZERO, 2));
    assertThat(keys(attributes), is(ImmutableList.of("c", "b", "a")));
    assertThat(unparse(attributes), is("{:c 3} {:b 1, 2} {:a \"s\"} "));

    // A key may occur more than once.
    attributes.add("a", ImmutableList.of());
    assertThat(keys(attributes), is(ImmutableList.of("c", "b", "a", "a")));
    assertThat(unparse(attributes),
        is("{:c 3} {:b 1, 2} {:a \"s\"} {:a} "));
  }

  @Test
  void testFind() {
    final Attributes attributes = new Attributes()
        .add("msg", ImmutableList.of("oops"))
        .add("two", ImmutableList.of("x", "y"))
        .add("e", ImmutableList.of(ast.boolLiteral(Pos.ZERO, true)));
    assertThat(attributes.findStringAttribute("msg"), is("oops"));
    assertThat(attributes.findExprAttribute("msg"), nullValue());
    assertThat(attributes.findStringAttribute("two"), nullValue());
    assertThat(attributes.findStringAttribute("missing"), nullValue());
    assertThat(attributes.findExprAttribute("e").toString(), is("true"));
  }

  @Test
  void testCheck() {
    final Attributes attributes = new Attributes()
        .add("verify", ImmutableList.of(ast.boolLiteral(Pos.ZERO, false)))
        .add("inline", ImmutableList.of(ast.intLiteral(Pos.ZERO, 2)))
        .add("huge",
            ImmutableList.of(
                ast.intLiteral(Pos.ZERO, BigInteger.ONE.shiftLeft(40))))
        .add("str", ImmutableList.of("true"));
    assertThat(attributes.checkBooleanAttribute("verify", true), is(false));
    assertThat(attributes.checkBooleanAttribute("other", true), is(true));
    assertThat(attributes.checkBooleanAttribute("str", false), is(false));
    assertThat(attributes.checkBooleanAttribute("inline", true), is(true));
    assertThat(attributes.checkIntAttribute("inline", 0), is(2));
    assertThat(attributes.checkIntAttribute("huge", -1), is(-1));
    assertThat(attributes.checkIntAttribute("verify", 7), is(7));
  }

  @Test
  void testInvalidParameter() {
    final Attributes attributes = new Attributes();
    assertThrows(IllegalArgumentException.class,
        () -> attributes.add("x", ImmutableList.of(1)));
    assertThrows(IllegalArgumentException.class,
        () -> attributes.addAttribute("x", 1.5));
    assertThat(attributes.isEmpty(), is(true));
  }
}

// End AttributesTest.java
