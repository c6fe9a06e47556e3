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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.boogie.compile.Prop;
import net.hydromatic.boogie.parse.BoogieParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link AstWriter}. */
public class AstWriterTest {
  @Test
  void testIndentSize() {
    final Program program =
        BoogieParser.parse("procedure P() { assert true; }");
    final Map<Prop, Object> props = new HashMap<>();
    Prop.INDENT_SIZE.set(props, 4);
    final String expected = "procedure P();\n"
        + "\n"
        + "implementation P()\n"
        + "{\n"
        + "    anon0:\n"
        + "        assert true;\n"
        + "        return;\n"
        + "}\n";
    assertThat(program.unparse(new AstWriter(props)), is(expected));
  }

  @Test
  void testUniqueIds() {
    final Program program = BoogieParser.parse("var x: int;");
    final GlobalVariable x = program.globalVariables().get(0);
    final Map<Prop, Object> props = new HashMap<>();
    Prop.PRINT_WITH_UNIQUE_IDS.set(props, true);
    assertThat(program.unparse(new AstWriter(props)),
        is("var x#" + x.id + ": int;\n"));
  }
}

// End AstWriterTest.java
