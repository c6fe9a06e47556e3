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

import java.util.concurrent.atomic.AtomicInteger;

/** Abstract syntax tree node. */
public abstract class AstNode {
  private static final AtomicInteger ID_COUNTER = new AtomicInteger();

  public final Pos pos;
  public final Op op;
  /** Unique ordinal of this node. Each node, including a copy of another
   * node, gets a new id. */
  public final int id;

  protected AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
    this.id = ID_COUNTER.incrementAndGet();
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging. If you want to generate
   * program text with particular settings, use {@link #unparse(AstWriter)}.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter());
  }

  /** Converts this node into a string, with a given writer. */
  public final String unparse(AstWriter w) {
    return unparse(w, 0, 0).toString();
  }

  abstract AstWriter unparse(AstWriter w, int left, int right);

  /**
   * Accepts a visitor, calling the {@link
   * net.hydromatic.boogie.ast.Visitor#visit} method appropriate to the type
   * of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
