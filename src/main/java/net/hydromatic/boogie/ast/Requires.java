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
import net.hydromatic.boogie.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Precondition of a procedure. A free precondition is assumed by the
 * procedure's implementations but not checked at call sites. */
public class Requires extends AstNode {
  public final boolean free;
  public final Ast.Expr condition;
  public final Attributes attributes;

  Requires(Pos pos, boolean free, Ast.Expr condition,
      Attributes attributes) {
    super(pos, Op.REQUIRES);
    this.free = free;
    this.condition = requireNonNull(condition);
    this.attributes = requireNonNull(attributes);
  }

  /** Returns the message to report if this condition does not hold, from
   * the <code>{:msg "..."}</code> attribute; or null. */
  public @Nullable String errorMessage() {
    return attributes.findStringAttribute("msg");
  }

  public void resolve(ResolutionContext rc) {
    attributes.resolve(rc);
    condition.resolve(rc);
  }

  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
    condition.typecheck(tc);
    if (!condition.type().unify(Type.BOOL)) {
      tc.error(condition.pos, "preconditions must be of type bool");
    }
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append(free ? "free requires " : "requires ");
    attributes.unparse(w);
    return w.append(condition, 0, 0).append(";");
  }
}

// End Requires.java
