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

/** Axiom, such as {@code axiom (forall x: int :: f(x) > 0);}. An axiom
 * may refer to constants and functions but not to global variables. */
public class Axiom extends Declaration {
  public final Ast.Expr expr;

  Axiom(Pos pos, Attributes attributes, Ast.Expr expr) {
    super(pos, Op.AXIOM_DECL, attributes);
    this.expr = requireNonNull(expr);
  }

  @Override
  public void resolve(ResolutionContext rc) {
    attributes.resolve(rc);
    final ResolutionContext.StateMode previousMode =
        rc.setStateMode(ResolutionContext.StateMode.STATELESS);
    expr.resolve(rc);
    rc.setStateMode(previousMode);
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
    expr.typecheck(tc);
    if (!expr.type().unify(Type.BOOL)) {
      tc.error(expr.pos, "axioms must be of type bool");
    }
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("axiom ");
    attributes.unparse(w);
    return w.append(expr, 0, 0).append(";");
  }
}

// End Axiom.java
