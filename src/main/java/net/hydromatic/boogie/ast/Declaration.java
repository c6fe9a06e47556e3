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

import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;

/**
 * Top-level declaration, or a variable.
 *
 * <p>A program is checked in three passes over its declarations:
 * {@link #register}, which adds names to the global scope;
 * {@link #resolve}, which binds the names used in the declaration; and
 * {@link #typecheck}.
 */
public abstract class Declaration extends AstNode {
  public final Attributes attributes;

  protected Declaration(Pos pos, Op op, Attributes attributes) {
    super(pos, op);
    this.attributes = requireNonNull(attributes);
  }

  /** Adds this declaration to the appropriate namespace. Most declarations
   * that have no name do nothing. */
  public void register(ResolutionContext rc) {}

  public abstract void resolve(ResolutionContext rc);

  public abstract void typecheck(TypecheckingContext tc);
}

// End Declaration.java
