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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.boogie.util.Static.appendWithoutDups;
import static net.hydromatic.boogie.util.Static.containsIdentical;
import static net.hydromatic.boogie.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;

/**
 * Polymorphic map type, such as {@code [int]bool} or {@code <a>[ref, Field
 * a]a}.
 *
 * <p>Each type parameter must occur free in at least one of the argument
 * types or the result type; resolution reports an error otherwise.
 */
public class MapType extends Type {
  public final ImmutableList<TypeVariable> typeParameters;
  public final ImmutableList<Type> arguments;
  public final Type result;

  public MapType(Pos pos, List<TypeVariable> typeParameters,
      List<Type> arguments, Type result) {
    super(pos);
    this.typeParameters = ImmutableList.copyOf(typeParameters);
    this.arguments = ImmutableList.copyOf(arguments);
    this.result = requireNonNull(result);
  }

  //-----------  Cloning  ----------------------------------

  // Bound type variables must be created afresh; it is not enough to clone
  // recursively.
  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    final Map<TypeVariable, TypeVariable> newVarMap = new HashMap<>();
    varMap.forEach((k, v) -> {
      if (!containsIdentical(typeParameters, k)) {
        newVarMap.put(k, v);
      }
    });
    final List<TypeVariable> newTypeParams = new ArrayList<>();
    for (TypeVariable var : typeParameters) {
      final TypeVariable newVar = new TypeVariable(var.pos, var.name);
      newVarMap.put(var, newVar);
      newTypeParams.add(newVar);
    }
    return new MapType(pos, newTypeParams,
        transformEager(arguments, t -> t.clone(newVarMap)),
        result.clone(newVarMap));
  }

  @Override
  public Type cloneUnresolved() {
    final List<TypeVariable> newTypeParams = new ArrayList<>();
    for (TypeVariable var : typeParameters) {
      newTypeParams.add(new TypeVariable(var.pos, var.name));
    }
    return new MapType(pos, newTypeParams,
        transformEager(arguments, Type::cloneUnresolved),
        result.cloneUnresolved());
  }

  //-----------  Equality  ----------------------------------

  @Override
  public boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables) {
    that = TypeProxy.followProxy(that.expanded());
    if (!(that instanceof MapType)) {
      return false;
    }
    final MapType thatMapType = (MapType) that;
    if (typeParameters.size() != thatMapType.typeParameters.size()
        || arguments.size() != thatMapType.arguments.size()) {
      return false;
    }

    thisBoundVariables.addAll(typeParameters);
    thatBoundVariables.addAll(thatMapType.typeParameters);
    try {
      for (int i = 0; i < arguments.size(); ++i) {
        if (!arguments.get(i)
            .equals(thatMapType.arguments.get(i), thisBoundVariables,
                thatBoundVariables)) {
          return false;
        }
      }
      return result.equals(thatMapType.result, thisBoundVariables,
          thatBoundVariables);
    } finally {
      for (int i = 0; i < typeParameters.size(); ++i) {
        thisBoundVariables.remove(thisBoundVariables.size() - 1);
        thatBoundVariables.remove(thatBoundVariables.size() - 1);
      }
    }
  }

  //-----------  Unification  ----------------------------------

  @Override
  public boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier) {
    that = that.expanded();
    if (that instanceof TypeProxy || that instanceof TypeVariable) {
      return that.unify(this, unifiableVariables, unifier);
    }
    if (!(that instanceof MapType)) {
      return false;
    }
    final MapType thatMapType = (MapType) that;
    if (typeParameters.size() != thatMapType.typeParameters.size()
        || arguments.size() != thatMapType.arguments.size()) {
      return false;
    }

    // Treat the bound variables of both types as the same fresh variables,
    // then unify the argument and result types.
    final Map<TypeVariable, Type> subst0 = new HashMap<>();
    final Map<TypeVariable, Type> subst1 = new HashMap<>();
    final List<TypeVariable> freshies = new ArrayList<>();
    for (int i = 0; i < typeParameters.size(); i++) {
      final TypeVariable tp0 = typeParameters.get(i);
      final TypeVariable tp1 = thatMapType.typeParameters.get(i);
      final TypeVariable freshVar = new TypeVariable(tp0.pos, tp0.name);
      freshies.add(freshVar);
      subst0.put(tp0, freshVar);
      subst1.put(tp1, freshVar);
    }
    boolean good = true;
    for (int i = 0; i < arguments.size(); i++) {
      final Type t0 = arguments.get(i).substitute(subst0);
      final Type t1 = thatMapType.arguments.get(i).substitute(subst1);
      good &= t0.unify(t1, unifiableVariables, unifier);
    }
    final Type r0 = result.substitute(subst0);
    final Type r1 = thatMapType.result.substitute(subst1);
    good &= r0.unify(r1, unifiableVariables, unifier);

    // Check that none of the fresh variables has escaped.
    if (good && !freshies.isEmpty()) {
      if (anyOccursIn(freshies, this.freeVariables())
          || anyOccursIn(freshies, thatMapType.freeVariables())) {
        return false;
      }
      for (Type t : unifier.values()) {
        if (anyOccursIn(freshies, t.freeVariables())) {
          return false;
        }
      }
    }
    return good;
  }

  private static boolean anyOccursIn(List<TypeVariable> vars,
      List<TypeVariable> freeVars) {
    for (TypeVariable var : vars) {
      if (containsIdentical(freeVars, var)) {
        return true;
      }
    }
    return false;
  }

  //-----------  Substitution  ----------------------------------

  /** Returns whether substituting might capture a bound variable, or
   * substitute a variable that is shadowed by a bound variable. */
  private boolean collisionsPossible(Map<TypeVariable, Type> subst) {
    for (TypeVariable var : typeParameters) {
      if (subst.containsKey(var)) {
        return true;
      }
      for (Type t : subst.values()) {
        if (containsIdentical(t.freeVariables(), var)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    if (subst.isEmpty()) {
      return this;
    }
    if (collisionsPossible(subst)) {
      final MapType newType = (MapType) copy();
      checkState(!newType.collisionsPossible(subst));
      return newType.substitute(subst);
    }
    return new MapType(pos, typeParameters,
        transformEager(arguments, t -> t.substitute(subst)),
        result.substitute(subst));
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    int res = 7643761 * typeParameters.size() + 65121 * arguments.size();
    boundVariables.addAll(typeParameters);
    for (Type t : arguments) {
      res = res * 5 + t.hashCode(boundVariables);
    }
    res = res * 7 + result.hashCode(boundVariables);
    for (int i = 0; i < typeParameters.size(); ++i) {
      boundVariables.remove(boundVariables.size() - 1);
    }
    return res;
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    final int opBindingStrength = 1;
    final boolean paren = opBindingStrength < contextBindingStrength;
    if (paren) {
      b.append('(');
    }
    Types.describeTypeParams(b, typeParameters);
    b.append('[');
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      arguments.get(i).describe(b, 0);
    }
    b.append(']');
    result.describe(b, 0);
    if (paren) {
      b.append(')');
    }
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    final int previousState = rc.typeBinderState();
    try {
      typeParameters.forEach(rc::addTypeBinder);
      final List<Type> resolvedArgs =
          transformEager(arguments, t -> t.resolveType(rc));
      final Type resolvedResult = result.resolveType(rc);
      Types.checkBoundVariableOccurrences(typeParameters, resolvedArgs,
          ImmutableList.of(resolvedResult), pos, "map arguments", rc);
      // Sort the type parameters in order of occurrence.
      final List<TypeVariable> sortedTypeParams =
          Types.sortTypeParams(typeParameters, resolvedArgs, resolvedResult);
      return new MapType(pos, sortedTypeParams, resolvedArgs,
          resolvedResult);
    } finally {
      rc.setTypeBinderState(previousState);
    }
  }

  @Override
  public List<TypeVariable> freeVariables() {
    final List<TypeVariable> res =
        new ArrayList<>(Types.freeVariablesIn(arguments));
    appendWithoutDups(res, result.freeVariables());
    res.removeIf(v -> containsIdentical(typeParameters, v));
    return ImmutableList.copyOf(res);
  }

  @Override
  public List<TypeProxy> freeProxies() {
    final List<TypeProxy> res =
        new ArrayList<>(Types.freeProxiesIn(arguments));
    appendWithoutDups(res, result.freeProxies());
    return ImmutableList.copyOf(res);
  }

  @Override
  public boolean isMap() {
    return true;
  }

  @Override
  public MapType asMap() {
    return this;
  }

  @Override
  public int mapArity() {
    return arguments.size();
  }

  /**
   * Matches the formal argument types of this map against actual arguments,
   * and returns the result type.
   *
   * <p>The result type is null if so many errors occurred that the situation
   * is hopeless.
   */
  public Types.ArgumentMatch checkArgumentTypes(
      Pos pos,
      List<? extends Ast.Expr> actualArgs,
      String opName,
      TypecheckingContext tc) {
    final List<Type> actualTypeParams = new ArrayList<>();
    final List<Type> actualResult =
        Types.checkArgumentTypes(typeParameters, actualTypeParams, arguments,
            actualArgs, ImmutableList.of(result), null, pos, opName, tc);
    if (actualResult == null) {
      return new Types.ArgumentMatch(null, TypeParamInstantiation.EMPTY);
    }
    checkState(actualResult.size() == 1);
    return new Types.ArgumentMatch(actualResult.get(0),
        TypeParamInstantiation.from(typeParameters, actualTypeParams));
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End MapType.java
