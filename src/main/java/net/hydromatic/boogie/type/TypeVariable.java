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
import static net.hydromatic.boogie.util.Static.containsIdentical;
import static net.hydromatic.boogie.util.Static.lastIndexOfIdentical;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.ResolutionContext;

/**
 * Type variable.
 *
 * <p>Two free type variables are equal only if they are the same object. Two
 * bound type variables are equal if they occur at the same position in the
 * parallel lists of bound variables during a structural comparison.
 */
public class TypeVariable extends Type {
  public final String name;

  public TypeVariable(Pos pos, String name) {
    super(pos);
    this.name = requireNonNull(name);
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    final TypeVariable v = varMap.get(this);
    return v == null ? this : v;
  }

  @Override
  public Type cloneUnresolved() {
    return this;
  }

  @Override
  public boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables) {
    that = TypeProxy.followProxy(that.expanded());
    if (!(that instanceof TypeVariable)) {
      return false;
    }
    final int thisIndex = lastIndexOfIdentical(thisBoundVariables, this);
    final int thatIndex = lastIndexOfIdentical(thatBoundVariables, that);
    return thisIndex >= 0 && thisIndex == thatIndex
        || thisIndex == -1 && thatIndex == -1 && this == that;
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof Type
            && equals((Type) o, ImmutableList.of(), ImmutableList.of());
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }

  @Override
  public boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier) {
    that = that.expanded();
    if (that instanceof TypeProxy && !(that instanceof ConstrainedProxy)) {
      return that.unify(this, unifiableVariables, unifier);
    }
    if (this.equals(that)) {
      return true;
    }
    if (containsIdentical(unifiableVariables, this)) {
      final Type previous = unifier.get(this);
      if (previous == null) {
        return addSubstitution(unifier, that);
      } else {
        return previous.unify(that, unifiableVariables, unifier);
      }
    }
    return that instanceof TypeVariable
        && containsIdentical(unifiableVariables, (TypeVariable) that)
        && that.unify(this, unifiableVariables, unifier);
  }

  /** Binds this variable in an idempotent unifier, first applying the
   * unifier to the new value and then the new binding to the old values. */
  private boolean addSubstitution(
      Map<TypeVariable, Type> oldSolution, Type newSubst) {
    checkState(!oldSolution.containsKey(this));
    final Type substSubst = newSubst.substitute(oldSolution);
    if (containsIdentical(substSubst.freeVariables(), this)) {
      return false;
    }
    final Map<TypeVariable, Type> newMapping = new HashMap<>();
    newMapping.put(this, substSubst);
    for (TypeVariable var : new ArrayList<>(oldSolution.keySet())) {
      oldSolution.put(var, oldSolution.get(var).substitute(newMapping));
    }
    oldSolution.put(this, substSubst);
    assert isIdempotent(oldSolution);
    return true;
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    final Type t = subst.get(this);
    return t == null ? this : t;
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    final int index = lastIndexOfIdentical(boundVariables, this);
    if (index == -1) {
      return System.identityHashCode(this);
    }
    return index * 27473671;
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    b.append(name);
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    return this;
  }

  @Override
  public List<TypeVariable> freeVariables() {
    return ImmutableList.of(this);
  }

  @Override
  public List<TypeProxy> freeProxies() {
    return ImmutableList.of();
  }

  @Override
  public boolean isVariable() {
    return true;
  }

  @Override
  public TypeVariable asVariable() {
    return this;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End TypeVariable.java
