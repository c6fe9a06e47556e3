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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.Types;

/**
 * Procedure declaration: a signature and a contract.
 *
 * <p>The contract consists of preconditions, the global variables that the
 * procedure may modify, and postconditions. Postconditions are two-state:
 * they may use {@code old} to refer to the values of variables on entry.
 */
public class Procedure extends DeclWithFormals {
  public final ImmutableList<Requires> requires;
  public final ImmutableList<Ast.Id> modifies;
  public final ImmutableList<Ensures> ensures;

  Procedure(Pos pos, Attributes attributes, String name,
      List<TypeVariable> typeParameters, List<Formal> inParams,
      List<Formal> outParams, List<Requires> requires,
      List<Ast.Id> modifies, List<Ensures> ensures) {
    super(pos, Op.PROCEDURE_DECL, attributes, name, typeParameters, inParams,
        outParams);
    this.requires = ImmutableList.copyOf(requires);
    this.modifies = ImmutableList.copyOf(modifies);
    this.ensures = ImmutableList.copyOf(ensures);
  }

  @Override
  public void resolve(ResolutionContext rc) {
    rc.pushVarContext();
    modifies.forEach(id -> id.resolve(rc));

    final int previousState = rc.typeBinderState();
    try {
      typeParameters.forEach(rc::addTypeBinder);
      registerFormals(inParams, rc);
      resolveWhere(inParams, rc);
      requires.forEach(r -> r.resolve(rc));

      registerFormals(outParams, rc);
      resolveWhere(outParams, rc);
      final ResolutionContext.StateMode previousMode =
          rc.setStateMode(ResolutionContext.StateMode.TWO);
      try {
        ensures.forEach(e -> e.resolve(rc));
      } finally {
        rc.setStateMode(previousMode);
      }
      attributes.resolve(rc);

      Types.checkBoundVariableOccurrences(typeParameters,
          Variable.typesOf(inParams), Variable.typesOf(outParams), pos,
          "procedure arguments", rc);
    } finally {
      rc.setTypeBinderState(previousState);
      rc.popVarContext();
    }
    sortTypeParams();
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
    typecheckFormals(tc);
    for (Ast.Id id : modifies) {
      if (id.decl == null) {
        continue;
      }
      id.typecheck(tc);
      if (!id.decl.isMutable()) {
        tc.error(id.pos, "modifies list contains constant: {0}", id.name);
      }
    }
    requires.forEach(r -> r.typecheck(tc));
    ensures.forEach(e -> e.typecheck(tc));
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("procedure ");
    unparseSignature(w);
    w.append(";").indent();
    for (Requires r : requires) {
      w.newline().append(r, 0, 0);
    }
    if (!modifies.isEmpty()) {
      w.newline().append("modifies ").appendAll(modifies, ", ").append(";");
    }
    for (Ensures e : ensures) {
      w.newline().append(e, 0, 0);
    }
    return w.outdent();
  }
}

// End Procedure.java
