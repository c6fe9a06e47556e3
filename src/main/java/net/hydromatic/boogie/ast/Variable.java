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
import static net.hydromatic.boogie.util.Static.transformEager;

import java.util.List;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Variable: a global variable, constant, formal parameter, local variable
 * or bound variable.
 *
 * <p>The {@link #where} clause is resolved separately from the rest of the
 * variable, by {@link #resolveWhere}, because it may refer to variables
 * declared later in the same scope.
 */
public abstract class Variable extends NamedDeclaration {
  /** Type; unresolved until {@link #resolve} is called. */
  public Type type;
  public final Ast.@Nullable Expr where;

  protected Variable(Pos pos, Op op, Attributes attributes, String name,
      Type type, Ast.@Nullable Expr where) {
    super(pos, op, attributes, name);
    this.type = requireNonNull(type);
    this.where = where;
  }

  /** Returns whether a command may assign to this variable. */
  public abstract boolean isMutable();

  /** Returns whether this variable belongs to the global scope. */
  public boolean isGlobal() {
    return false;
  }

  @Override
  public void register(ResolutionContext rc) {
    rc.addVariable(this, isGlobal());
  }

  @Override
  public void resolve(ResolutionContext rc) {
    type = type.resolveType(rc);
    attributes.resolve(rc);
  }

  /** Resolves the where clause, if any. */
  public void resolveWhere(ResolutionContext rc) {
    if (where != null) {
      where.resolve(rc);
    }
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
    if (where != null) {
      where.typecheck(tc);
      if (!where.type().unify(Type.BOOL)) {
        tc.error(where.pos, "where clauses must be of type bool");
      }
    }
  }

  /** Returns the types of a list of variables. */
  public static List<Type> typesOf(List<? extends Variable> variables) {
    return transformEager(variables, v -> v.type);
  }

  /** Writes "name: type", followed by the where clause if present. An
   * unnamed variable, such as the result of a function, writes only its
   * type. */
  void unparseTypedIdent(AstWriter w) {
    if (!name.isEmpty()) {
      w.id(name, this).append(": ");
    }
    w.append(type.toString());
    if (where != null) {
      w.append(" where ").append(where, 0, 0);
    }
  }
}

// End Variable.java
