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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.INDENT_SIZE.intValue(map), is(2));
    assertThat(Prop.INLINE_LOOPS.booleanValue(map), is(false));
    assertThat(Prop.OVERLOOK_TYPE_ERRORS.booleanValue(map), is(false));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("inlineLoops"), is(Prop.INLINE_LOOPS));
    assertThat(Prop.lookup("INLINE_LOOPS"), is(Prop.INLINE_LOOPS));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.lookup("noSuchProp"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.INDENT_SIZE));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INDENT_SIZE.setLenient(map, " 4 ");
    assertThat(Prop.INDENT_SIZE.intValue(map), is(4));
    Prop.PRUNE_UNREACHABLE_BLOCKS.setLenient(map, "TRUE");
    assertThat(Prop.PRUNE_UNREACHABLE_BLOCKS.booleanValue(map), is(true));
    Prop.INLINE_LOOPS.set(map, true);
    assertThat(Prop.INLINE_LOOPS.booleanValue(map), is(true));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT_SIZE.setLenient(map, "four"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INLINE_LOOPS.set(map, 1));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INLINE_LOOPS.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INLINE_LOOPS.intValue(map));

    assertThat(Prop.INLINE_LOOPS.remove(map), is(true));
    assertThat(Prop.INLINE_LOOPS.booleanValue(map), is(false));
  }
}

// End PropTest.java
