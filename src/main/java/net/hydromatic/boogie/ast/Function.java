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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Function declaration, such as
 * {@code function f<T>(x: T) returns (T) { x }}.
 *
 * <p>A function has exactly one out-parameter. If it has a body, it may be
 * expanded at each application.
 */
public class Function extends DeclWithFormals {
  public final Ast.@Nullable Expr body;

  Function(Pos pos, Attributes attributes, String name,
      List<TypeVariable> typeParameters, List<Formal> inParams,
      Formal outParam, Ast.@Nullable Expr body) {
    super(pos, Op.FUNCTION_DECL, attributes, name, typeParameters, inParams,
        ImmutableList.of(outParam));
    checkArgument(!outParam.incoming, "result must be an out-parameter");
    this.body = body;
  }

  /** Returns the result parameter. */
  public Formal outParam() {
    return outParams.get(0);
  }

  /** Returns whether this function must never be used as a trigger in a
   * quantifier; set by the <code>{:never_pattern true}</code>
   * attribute. */
  public boolean neverTrigger() {
    return attributes.checkBooleanAttribute("never_pattern", false);
  }

  @Override
  public void resolve(ResolutionContext rc) {
    final int previousState = rc.typeBinderState();
    try {
      typeParameters.forEach(rc::addTypeBinder);
      rc.pushVarContext();
      registerFormals(inParams, rc);
      registerFormals(outParams, rc);
      attributes.resolve(rc);
      if (body != null) {
        final ResolutionContext.StateMode previousMode =
            rc.setStateMode(ResolutionContext.StateMode.STATELESS);
        body.resolve(rc);
        rc.setStateMode(previousMode);
      }
      rc.popVarContext();
      Types.checkBoundVariableOccurrences(typeParameters,
          Variable.typesOf(inParams), Variable.typesOf(outParams), pos,
          "function arguments", rc);
    } finally {
      rc.setTypeBinderState(previousState);
    }
    sortTypeParams();
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
    typecheckFormals(tc);
    if (body != null) {
      body.typecheck(tc);
      final Type expected = outParam().type;
      if (!body.type().unify(expected)) {
        tc.error(body.pos,
            "function body with invalid type: {0} (expected: {1})",
            body.type, expected);
      }
    }
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("function ");
    unparseSignature(w);
    if (body == null) {
      return w.append(";");
    }
    return w.append(" { ").append(body, 0, 0).append(" }");
  }
}

// End Function.java
