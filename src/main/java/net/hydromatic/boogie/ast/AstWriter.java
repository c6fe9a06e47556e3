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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.compile.Prop;

/** Context for writing an AST out as program text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private final boolean withUniqueIds;
  private final int indentSize;
  private int level;

  /** Creates an AstWriter with default properties. */
  public AstWriter() {
    this(ImmutableMap.of());
  }

  /** Creates an AstWriter whose layout is controlled by properties. */
  public AstWriter(Map<Prop, Object> props) {
    requireNonNull(props);
    this.withUniqueIds = Prop.PRINT_WITH_UNIQUE_IDS.booleanValue(props);
    this.indentSize = Prop.INDENT_SIZE.intValue(props);
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a list of nodes separated by a string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      nodes.get(i).unparse(this, 0, 0);
    }
    return this;
  }

  /** Appends an identifier. If unique ids are enabled, appends the id of
   * the node that the identifier refers to. */
  public AstWriter id(String name, AstNode node) {
    b.append(name);
    if (withUniqueIds) {
      b.append('#').append(node.id);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    // An operand that is a comparison needs parentheses on either side.
    a0.unparse(this, left, op.isComparison() ? op.right + 1 : op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Starts a new line at the current indentation. */
  public AstWriter newline() {
    b.append('\n');
    b.append(Strings.repeat(" ", level * indentSize));
    return this;
  }

  /** Writes an empty line, then starts a new line at the current
   * indentation. */
  public AstWriter blankLine() {
    b.append('\n');
    return newline();
  }

  /** Increases the indentation of subsequent lines. */
  public AstWriter indent() {
    ++level;
    return this;
  }

  /** Decreases the indentation of subsequent lines. */
  public AstWriter outdent() {
    --level;
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
