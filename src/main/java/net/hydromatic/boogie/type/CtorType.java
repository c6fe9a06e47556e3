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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.boogie.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.TypeCtorDecl;
import net.hydromatic.boogie.compile.ResolutionContext;

/** Application of a type constructor to arguments, such as {@code ref} or
 * {@code Set int}. */
public class CtorType extends Type {
  public final TypeCtorDecl decl;
  public final ImmutableList<Type> arguments;

  public CtorType(Pos pos, TypeCtorDecl decl, List<Type> arguments) {
    super(pos);
    this.decl = requireNonNull(decl);
    this.arguments = ImmutableList.copyOf(arguments);
    checkArgument(decl.arity == arguments.size(),
        "constructor %s expects %s arguments", decl.name, decl.arity);
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    return new CtorType(pos, decl, transformEager(arguments,
        t -> t.clone(varMap)));
  }

  @Override
  public Type cloneUnresolved() {
    return new CtorType(pos, decl,
        transformEager(arguments, Type::cloneUnresolved));
  }

  @Override
  public boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables) {
    that = TypeProxy.followProxy(that.expanded());
    if (!(that instanceof CtorType) || decl != ((CtorType) that).decl) {
      return false;
    }
    final CtorType thatCtorType = (CtorType) that;
    for (int i = 0; i < arguments.size(); ++i) {
      if (!arguments.get(i)
          .equals(thatCtorType.arguments.get(i), thisBoundVariables,
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
    that = that.expanded();
    if (that instanceof TypeProxy || that instanceof TypeVariable) {
      return that.unify(this, unifiableVariables, unifier);
    }
    if (!(that instanceof CtorType) || decl != ((CtorType) that).decl) {
      return false;
    }
    final CtorType thatCtorType = (CtorType) that;
    boolean good = true;
    for (int i = 0; i < arguments.size(); ++i) {
      good &=
          arguments.get(i)
              .unify(thatCtorType.arguments.get(i), unifiableVariables,
                  unifier);
    }
    return good;
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    if (subst.isEmpty()) {
      return this;
    }
    return new CtorType(pos, decl,
        transformEager(arguments, t -> t.substitute(subst)));
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    int res = 1637643879 * decl.hashCode();
    for (Type t : arguments) {
      res = res * 3 + t.hashCode(boundVariables);
    }
    return res;
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    describeCtor(b, decl.name, arguments, contextBindingStrength);
  }

  /** Writes a constructor application. The last argument is written with a
   * lower binding strength, so that a map type need not be parenthesized. */
  static void describeCtor(StringBuilder b, String name,
      List<? extends Type> args, int contextBindingStrength) {
    final int opBindingStrength = args.isEmpty() ? 2 : 0;
    final boolean paren = opBindingStrength < contextBindingStrength;
    if (paren) {
      b.append('(');
    }
    b.append(name);
    int i = args.size();
    for (Type t : args) {
      b.append(' ');
      t.describe(b, i == 1 ? 1 : 2);
      --i;
    }
    if (paren) {
      b.append(')');
    }
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    return new CtorType(pos, decl,
        transformEager(arguments, t -> t.resolveType(rc)));
  }

  @Override
  public List<TypeVariable> freeVariables() {
    return Types.freeVariablesIn(arguments);
  }

  @Override
  public List<TypeProxy> freeProxies() {
    return Types.freeProxiesIn(arguments);
  }

  @Override
  public boolean isCtor() {
    return true;
  }

  @Override
  public CtorType asCtor() {
    return this;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End CtorType.java
