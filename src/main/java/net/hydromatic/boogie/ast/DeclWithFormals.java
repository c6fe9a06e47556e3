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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.Types;

/** Declaration that has type parameters, in-parameters and
 * out-parameters: a function, procedure or implementation. */
public abstract class DeclWithFormals extends NamedDeclaration {
  /** Type parameters; sorted into order of occurrence by resolve. */
  public List<TypeVariable> typeParameters;
  public final ImmutableList<Formal> inParams;
  public final ImmutableList<Formal> outParams;

  protected DeclWithFormals(Pos pos, Op op, Attributes attributes,
      String name, List<TypeVariable> typeParameters,
      List<Formal> inParams, List<Formal> outParams) {
    super(pos, op, attributes, name);
    this.typeParameters = ImmutableList.copyOf(typeParameters);
    this.inParams = ImmutableList.copyOf(inParams);
    this.outParams = ImmutableList.copyOf(outParams);
  }

  @Override
  public void register(ResolutionContext rc) {
    rc.addProcedure(this);
  }

  /** Adds formal parameters to the innermost scope and resolves their
   * types. Unnamed formals are not added. */
  static void registerFormals(List<? extends Variable> formals,
      ResolutionContext rc) {
    for (Variable v : formals) {
      if (!v.name.isEmpty()) {
        rc.addVariable(v, false);
      }
      v.resolve(rc);
    }
  }

  static void resolveWhere(List<? extends Variable> variables,
      ResolutionContext rc) {
    variables.forEach(v -> v.resolveWhere(rc));
  }

  /** Sorts the type parameters into the order in which they occur in the
   * types of the in-parameters and out-parameters. */
  void sortTypeParams() {
    final List<Type> types = new ArrayList<>(Variable.typesOf(inParams));
    types.addAll(Variable.typesOf(outParams));
    typeParameters = Types.sortTypeParams(typeParameters, types, null);
  }

  /** Typechecks the formal parameters, including their where clauses. */
  void typecheckFormals(TypecheckingContext tc) {
    inParams.forEach(v -> v.typecheck(tc));
    outParams.forEach(v -> v.typecheck(tc));
  }

  /** Writes type parameters, such as {@code <a, b>}; writes nothing if
   * there are none. */
  static void unparseTypeParams(AstWriter w, List<TypeVariable> params) {
    if (params.isEmpty()) {
      return;
    }
    w.append("<");
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.append(params.get(i).name);
    }
    w.append(">");
  }

  /** Writes the name, type parameters and formal parameters. */
  void unparseSignature(AstWriter w) {
    attributes.unparse(w);
    w.id(name, this);
    unparseTypeParams(w, typeParameters);
    w.append("(").appendAll(inParams, ", ").append(")");
    if (!outParams.isEmpty()) {
      w.append(" returns (").appendAll(outParams, ", ").append(")");
    }
  }
}

// End DeclWithFormals.java
