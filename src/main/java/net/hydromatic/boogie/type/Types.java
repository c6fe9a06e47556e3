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
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Type} and its sub-classes. */
public class Types {
  private Types() {}

  private static final BvType[] BV_TYPES = new BvType[128];

  static {
    for (int i = 0; i < BV_TYPES.length; i++) {
      BV_TYPES[i] = new BvType(Pos.ZERO, i);
    }
  }

  /** Returns the bit-vector type of a given width. Narrow types are
   * shared. */
  public static BvType bvType(int bits) {
    checkArgument(bits >= 0, "negative width %s", bits);
    if (bits < BV_TYPES.length) {
      return BV_TYPES[bits];
    }
    return new BvType(Pos.ZERO, bits);
  }

  /** Returns the types of a list of typechecked expressions. */
  public static List<Type> typesOf(List<? extends Ast.Expr> exprs) {
    return transformEager(exprs, Types::typeOf);
  }

  private static Type typeOf(Ast.Expr e) {
    if (e.type == null) {
      throw new IllegalStateException("expression has not been typechecked: "
          + e);
    }
    return e.type;
  }

  /** Returns the free type variables of a list of types, in order of first
   * occurrence and without duplicates. */
  public static List<TypeVariable> freeVariablesIn(
      List<? extends Type> types) {
    final List<TypeVariable> list = new ArrayList<>();
    for (Type type : types) {
      appendWithoutDups(list, type.freeVariables());
    }
    return ImmutableList.copyOf(list);
  }

  /** Returns the unresolved proxies of a list of types, in order of first
   * occurrence and without duplicates. */
  public static List<TypeProxy> freeProxiesIn(List<? extends Type> types) {
    final List<TypeProxy> list = new ArrayList<>();
    for (Type type : types) {
      appendWithoutDups(list, type.freeProxies());
    }
    return ImmutableList.copyOf(list);
  }

  /** Writes a list of type parameters in angle brackets; writes nothing if
   * the list is empty. */
  public static void describeTypeParams(StringBuilder b,
      List<TypeVariable> typeParams) {
    if (typeParams.isEmpty()) {
      return;
    }
    b.append('<');
    for (int i = 0; i < typeParams.size(); i++) {
      if (i > 0) {
        b.append(',');
      }
      b.append(typeParams.get(i).name);
    }
    b.append('>');
  }

  /**
   * Sorts type parameters in the order they occur in argument types, then
   * the result type. Parameters that occur in neither go at the end.
   */
  public static List<TypeVariable> sortTypeParams(
      List<TypeVariable> typeParams,
      List<? extends Type> argumentTypes,
      @Nullable Type resultType) {
    if (typeParams.isEmpty()) {
      return typeParams;
    }
    final List<TypeVariable> inUse =
        new ArrayList<>(freeVariablesIn(argumentTypes));
    if (resultType != null) {
      appendWithoutDups(inUse, resultType.freeVariables());
    }
    final List<TypeVariable> sorted = new ArrayList<>();
    for (TypeVariable v : inUse) {
      if (containsIdentical(typeParams, v)) {
        sorted.add(v);
      }
    }
    appendWithoutDups(sorted, typeParams);
    return ImmutableList.copyOf(sorted);
  }

  /**
   * Checks that each type parameter occurs in at least one argument type.
   *
   * <p>Reports an error for each parameter that occurs in neither
   * {@code argumentTypes} nor {@code moreArgumentTypes}. Returns whether some
   * parameters occur only in {@code moreArgumentTypes}.
   */
  public static boolean checkBoundVariableOccurrences(
      List<TypeVariable> typeParams,
      List<? extends Type> argumentTypes,
      @Nullable List<? extends Type> moreArgumentTypes,
      Pos pos,
      String subjectName,
      ResolutionContext rc) {
    final List<TypeVariable> inArgs = freeVariablesIn(argumentTypes);
    final List<TypeVariable> inMore =
        moreArgumentTypes == null ? null : freeVariablesIn(moreArgumentTypes);
    boolean onlyAmongMore = false;
    for (TypeVariable v : typeParams) {
      // A variable bound twice has already been reported.
      if (rc.lookupTypeBinder(v.name) != v) {
        continue;
      }
      if (containsIdentical(inArgs, v)) {
        continue;
      }
      if (inMore != null && containsIdentical(inMore, v)) {
        onlyAmongMore = true;
      } else {
        rc.error(pos, "type variable must occur in {0}: {1}", subjectName,
            v.name);
      }
    }
    return onlyAmongMore;
  }

  /** Creates a substitution that maps each type parameter to a fresh
   * proxy. */
  private static Map<TypeVariable, Type> freshProxies(
      List<TypeVariable> typeParams) {
    final Map<TypeVariable, Type> subst = new HashMap<>();
    for (TypeVariable v : typeParams) {
      subst.put(v, new TypeProxy(Pos.ZERO, v.name));
    }
    return subst;
  }

  /**
   * Matches formal argument types against the types of actual arguments, and
   * returns the substitution of the type parameters.
   *
   * <p>Each type parameter is replaced by a fresh proxy that unification
   * refines. Each mismatch is reported at the position of the offending
   * actual.
   */
  public static Map<TypeVariable, Type> matchArgumentTypes(
      List<TypeVariable> typeParams,
      List<? extends Type> formalArgs,
      List<? extends Ast.Expr> actualArgs,
      @Nullable List<? extends Type> formalOuts,
      @Nullable List<? extends Ast.Expr> actualOuts,
      String opName,
      TypecheckingContext tc) {
    checkArgument(formalArgs.size() == actualArgs.size());
    checkArgument((formalOuts == null) == (actualOuts == null));
    final Map<TypeVariable, Type> subst = freshProxies(typeParams);
    for (int i = 0; i < formalArgs.size(); i++) {
      final Type formal = formalArgs.get(i).substitute(subst);
      final Ast.Expr actualArg = actualArgs.get(i);
      final Type actual = typeOf(actualArg);
      if (!formal.unify(actual)) {
        tc.error(actualArg.pos,
            "invalid type for argument {0} in {1}: {2} (expected: {3})",
            i, opName, actual, formalArgs.get(i));
      }
    }
    if (formalOuts != null && actualOuts != null) {
      checkArgument(formalOuts.size() == actualOuts.size());
      for (int i = 0; i < formalOuts.size(); i++) {
        final Type formal = formalOuts.get(i).substitute(subst);
        final Ast.Expr actualOut = actualOuts.get(i);
        final Type actual = typeOf(actualOut);
        if (!formal.unify(actual)) {
          tc.error(actualOut.pos,
              "invalid type for out-parameter {0} in {1}: {2} (expected: {3})",
              i, opName, actual, formal);
        }
      }
    }
    return subst;
  }

  /**
   * Matches the formal parameters of a function, procedure or map against
   * actual arguments, and returns the instantiated result types.
   *
   * <p>Adds the instantiation of each type parameter to
   * {@code actualTypeParams}. Returns null if the result types cannot be
   * determined because of errors.
   */
  public static @Nullable List<Type> checkArgumentTypes(
      List<TypeVariable> typeParams,
      List<Type> actualTypeParams,
      List<? extends Type> formalIns,
      List<? extends Ast.Expr> actualIns,
      List<? extends Type> formalOuts,
      @Nullable List<? extends Ast.Expr> actualOuts,
      Pos pos,
      String opName,
      TypecheckingContext tc) {
    if (formalIns.size() != actualIns.size()) {
      tc.error(pos, "wrong number of arguments in {0}: {1}", opName,
          actualIns.size());
      // Without type parameters, the result types are still known.
      return typeParams.isEmpty() ? ImmutableList.copyOf(formalOuts) : null;
    }
    if (actualOuts != null && formalOuts.size() != actualOuts.size()) {
      tc.error(pos, "wrong number of result variables in {0}: {1}", opName,
          actualOuts.size());
      return typeParams.isEmpty() ? ImmutableList.copyOf(formalOuts) : null;
    }

    final int previousErrorCount = tc.errorCount();
    final Map<TypeVariable, Type> subst =
        matchArgumentTypes(typeParams, formalIns, actualIns,
            actualOuts != null ? formalOuts : null, actualOuts, opName, tc);
    for (TypeVariable v : typeParams) {
      actualTypeParams.add(subst.get(v));
    }
    final List<Type> actualResults =
        transformEager(formalOuts, t -> t.substitute(subst));
    if (previousErrorCount != tc.errorCount()) {
      final List<TypeVariable> resultFreeVars = freeVariablesIn(actualResults);
      for (TypeVariable v : typeParams) {
        if (containsIdentical(resultFreeVars, v)) {
          return null;
        }
      }
    }
    return actualResults;
  }

  /**
   * Infers the instantiation of type parameters from the types of actual
   * arguments. Assumes that the arguments are known to match.
   */
  public static Map<TypeVariable, Type> inferTypeParameters(
      List<TypeVariable> typeParams,
      List<? extends Type> formalArgs,
      List<? extends Type> actualArgs) {
    checkArgument(formalArgs.size() == actualArgs.size());
    final Map<TypeVariable, Type> subst = freshProxies(typeParams);
    for (int i = 0; i < formalArgs.size(); i++) {
      final Type formal = formalArgs.get(i).substitute(subst);
      final Type actual = actualArgs.get(i);
      if (!formal.unify(actual)) {
        throw new IllegalStateException("type unification failed: " + formal
            + " vs " + actual);
      }
    }
    return subst;
  }

  /** Infers the result type of an application whose argument types are
   * known to match. */
  public static Type inferValueType(
      List<TypeVariable> typeParams,
      List<? extends Type> formalArgs,
      Type formalResult,
      List<? extends Type> actualArgs) {
    final Map<TypeVariable, Type> subst =
        inferTypeParameters(typeParams, formalArgs, actualArgs);
    return formalResult.substitute(subst);
  }

  /** Result of matching the arguments of a map access against the map's
   * type. */
  public static class ArgumentMatch {
    /** Result type, or null if there were too many errors to determine
     * it. */
    public final @Nullable Type result;
    public final TypeParamInstantiation instantiation;

    public ArgumentMatch(@Nullable Type result,
        TypeParamInstantiation instantiation) {
      this.result = result;
      this.instantiation = instantiation;
    }
  }
}

// End Types.java
