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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.ResolutionContext;

/**
 * Type.
 *
 * <p>Types are immutable once resolved, with the exception of {@link
 * TypeProxy}, which is a placeholder that is defined at most once during
 * unification.
 *
 * <p>{@link #equals(Object)} is structural, and treats two types that differ
 * only in the names of their bound type variables as equal.
 */
public abstract class Type {
  public static final BasicType INT =
      new BasicType(Pos.ZERO, BasicType.Kind.INT);
  public static final BasicType BOOL =
      new BasicType(Pos.ZERO, BasicType.Kind.BOOL);

  public final Pos pos;

  protected Type(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  //-----------  Equality  ----------------------------------

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Type
            && equals((Type) o, new ArrayList<>(), new ArrayList<>());
  }

  @Override
  public int hashCode() {
    return hashCode(new ArrayList<>());
  }

  /**
   * Compares two types structurally, treating variables at the same position
   * in the two lists of bound variables as equal.
   *
   * <p>The lists are modified during the walk but restored before returning.
   */
  public abstract boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables);

  /** Computes a hash code consistent with {@link #equals(Type, List, List)}. */
  public abstract int hashCode(List<TypeVariable> boundVariables);

  //-----------  Unification  ----------------------------------

  /**
   * Unifies this type with another, where no type variables can be
   * substituted. Type proxies may be defined as a side effect.
   */
  public boolean unify(Type that) {
    return unify(that, ImmutableList.of(), new HashMap<>());
  }

  /**
   * Unifies this type with another.
   *
   * <p>{@code unifier} must be idempotent on entry. On success, it has been
   * extended (binding only variables in {@code unifiableVariables}) so that
   * both types are equal after substitution, and is still idempotent. On
   * failure, the unifier may have been partially extended.
   */
  public abstract boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier);

  /** Returns whether a substitution is idempotent; that is, no variable that
   * it binds occurs free in any of its values. */
  public static boolean isIdempotent(Map<TypeVariable, Type> unifier) {
    for (Type t : unifier.values()) {
      for (TypeVariable v : t.freeVariables()) {
        if (unifier.containsKey(v)) {
          return false;
        }
      }
    }
    return true;
  }

  //-----------  Substitution  ----------------------------------

  /**
   * Substitutes free type variables. Bound variables of map types are renamed
   * if they would otherwise capture or shadow the substitution.
   */
  public abstract Type substitute(Map<TypeVariable, Type> subst);

  //-----------  Cloning  ----------------------------------

  /** Creates a copy in which every bound type variable is fresh. */
  public Type copy() {
    return clone(new HashMap<>());
  }

  /** Creates a copy, replacing type variables that occur in {@code varMap}
   * and creating fresh bound variables. */
  public abstract Type clone(Map<TypeVariable, TypeVariable> varMap);

  /** Creates a copy of this type suitable for an AST that will be resolved
   * again. Proxies are replaced with fresh proxies. */
  public abstract Type cloneUnresolved();

  //-----------  Resolution  ----------------------------------

  /** Resolves type identifiers, returning the resolved type. Errors are
   * reported to the context. */
  public abstract Type resolveType(ResolutionContext rc);

  /** Returns the type this type stands for, looking through type synonym
   * annotations. */
  public Type expanded() {
    return this;
  }

  /** Returns the free type variables, in order of first occurrence and
   * without duplicates. */
  public abstract List<TypeVariable> freeVariables();

  /** Returns the unresolved proxies that occur in this type. */
  public abstract List<TypeProxy> freeProxies();

  /** Returns whether this type has no free type variables. */
  public boolean isClosed() {
    return freeVariables().isEmpty();
  }

  //-----------  Getters/Issers  ----------------------------------

  public boolean isBasic() {
    return false;
  }

  public boolean isInt() {
    return false;
  }

  public boolean isBool() {
    return false;
  }

  public boolean isVariable() {
    return false;
  }

  public TypeVariable asVariable() {
    throw new IllegalStateException("not a type variable: " + this);
  }

  public boolean isCtor() {
    return false;
  }

  public CtorType asCtor() {
    throw new IllegalStateException("not a constructed type: " + this);
  }

  public boolean isMap() {
    return false;
  }

  public MapType asMap() {
    throw new IllegalStateException("not a map type: " + this);
  }

  public int mapArity() {
    throw new IllegalStateException("not a map type: " + this);
  }

  public boolean isUnresolved() {
    return false;
  }

  public UnresolvedTypeIdentifier asUnresolved() {
    throw new IllegalStateException("not an unresolved type: " + this);
  }

  public boolean isBv() {
    return false;
  }

  public int bvBits() {
    throw new IllegalStateException("not a bit-vector type: " + this);
  }

  //-----------  Linearisation  ----------------------------------

  @Override
  public final String toString() {
    final StringBuilder b = new StringBuilder();
    describe(b, 0);
    return b.toString();
  }

  /**
   * Writes this type in the textual syntax.
   *
   * @param b Builder
   * @param contextBindingStrength Binding strength of the surrounding
   *     context; 0 is weakest, 2 is strongest
   */
  public abstract void describe(StringBuilder b, int contextBindingStrength);

  public abstract <R> R accept(TypeVisitor<R> typeVisitor);
}

// End Type.java
