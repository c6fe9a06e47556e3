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
package net.hydromatic.boogie.type;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.boogie.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.TypeCtorDecl;
import net.hydromatic.boogie.ast.TypeSynonymDecl;
import net.hydromatic.boogie.compile.ResolutionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type as written by the user, before resolution; a name applied to
 * arguments.
 *
 * <p>Resolution turns it into a bit-vector type, a type variable, a
 * constructed type or a type synonym annotation.
 */
public class UnresolvedTypeIdentifier extends Type {
  public final String name;
  public final ImmutableList<Type> arguments;

  public UnresolvedTypeIdentifier(Pos pos, String name,
      List<Type> arguments) {
    super(pos);
    this.name = requireNonNull(name);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public UnresolvedTypeIdentifier(Pos pos, String name) {
    this(pos, name, ImmutableList.of());
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    return new UnresolvedTypeIdentifier(pos, name,
        transformEager(arguments, t -> t.clone(varMap)));
  }

  @Override
  public Type cloneUnresolved() {
    return new UnresolvedTypeIdentifier(pos, name,
        transformEager(arguments, Type::cloneUnresolved));
  }

  /** Compares syntactically. Unresolved types only occur before resolution,
   * so there are no bound variables to consider. */
  @Override
  public boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables) {
    if (!(that instanceof UnresolvedTypeIdentifier)) {
      return false;
    }
    final UnresolvedTypeIdentifier u = (UnresolvedTypeIdentifier) that;
    if (!name.equals(u.name) || arguments.size() != u.arguments.size()) {
      return false;
    }
    for (int i = 0; i < arguments.size(); i++) {
      if (!arguments.get(i).equals(u.arguments.get(i), thisBoundVariables,
          thatBoundVariables)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier) {
    throw new IllegalStateException("cannot unify unresolved type " + this);
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    throw new IllegalStateException(
        "cannot substitute into unresolved type " + this);
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    int res = name.hashCode();
    for (Type t : arguments) {
      res = res * 31 + t.hashCode(boundVariables);
    }
    return res;
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    final @Nullable Integer bits = bvBits(name);
    if (bits != null) {
      if (!arguments.isEmpty()) {
        rc.error(pos,
            "bitvector types must not be applied to arguments: {0}", name);
      }
      return new BvType(pos, bits);
    }

    final TypeVariable var = rc.lookupTypeBinder(name);
    if (var != null) {
      if (!arguments.isEmpty()) {
        rc.error(pos, "type variables must not be applied to arguments: {0}",
            var);
      }
      return var;
    }

    final TypeCtorDecl ctorDecl = rc.lookupType(name);
    if (ctorDecl != null) {
      if (arguments.size() != ctorDecl.arity) {
        rc.error(pos,
            "type constructor received wrong number of arguments: {0}",
            ctorDecl.name);
        return this;
      }
      return new CtorType(pos, ctorDecl, resolveArguments(rc));
    }

    final TypeSynonymDecl synDecl = rc.lookupTypeSynonym(name);
    if (synDecl != null) {
      if (arguments.size() != synDecl.typeParameters.size()) {
        rc.error(pos, "type synonym received wrong number of arguments: {0}",
            synDecl.name);
        return this;
      }
      return new TypeSynonymAnnotation(pos, synDecl, resolveArguments(rc));
    }

    rc.error(pos, "undeclared type: {0}", name);
    return this;
  }

  /** Returns the width if a name has the form "bv" followed by digits,
   * otherwise null. */
  static @Nullable Integer bvBits(String name) {
    if (!name.startsWith("bv") || name.length() <= 2) {
      return null;
    }
    for (int i = 2; i < name.length(); ++i) {
      if (!Character.isDigit(name.charAt(i))) {
        return null;
      }
    }
    return Integer.parseInt(name.substring(2));
  }

  private List<Type> resolveArguments(ResolutionContext rc) {
    return transformEager(arguments, t -> t.resolveType(rc));
  }

  @Override
  public List<TypeVariable> freeVariables() {
    return ImmutableList.of();
  }

  @Override
  public List<TypeProxy> freeProxies() {
    return ImmutableList.of();
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    CtorType.describeCtor(b, name, arguments, contextBindingStrength);
  }

  @Override
  public boolean isUnresolved() {
    return true;
  }

  @Override
  public UnresolvedTypeIdentifier asUnresolved() {
    return this;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End UnresolvedTypeIdentifier.java
