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
import static com.google.common.base.Preconditions.checkState;
import static net.hydromatic.boogie.util.Static.containsIdentical;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.TypecheckingContext;

/**
 * Proxy for a map type of known arity.
 *
 * <p>Each use of the map in a select or store records a constraint: the
 * argument and result types at that use must be an instance of the map's
 * argument and result types. Because map types may be polymorphic, any
 * combination of constraints can be satisfied.
 */
public class MapTypeProxy extends ConstrainedProxy {
  public final int arity;
  private final List<Constraint> constraints = new ArrayList<>();

  public MapTypeProxy(Pos pos, String name, int arity) {
    super(pos, name, "mapproxy");
    checkArgument(arity >= 0);
    this.arity = arity;
  }

  private void addConstraint(Constraint c) {
    checkArgument(c.arguments.size() == arity);
    final Type f = proxyFor();
    if (f instanceof MapType) {
      final boolean success =
          c.unify((MapType) f, ImmutableList.of(), new HashMap<>());
      checkState(success, "constraint %s does not match %s", c, f);
      return;
    }
    if (f instanceof MapTypeProxy) {
      ((MapTypeProxy) f).addConstraint(c);
      return;
    }
    checkState(f == null, "map proxy defined to %s", f);
    constraints.add(c);
  }

  /**
   * Records a use of this map with the given argument types, and returns the
   * result type of that use. If the proxy has already been defined, checks
   * the arguments against the definition.
   *
   * @param pos Position of the use
   * @param actualArgs Arguments, already type-checked
   * @param opName Name of the operation, for error messages
   * @param tc Context for reporting errors
   * @return Result type and instantiation of the map's type parameters
   */
  public Types.ArgumentMatch checkArgumentTypes(
      Pos pos,
      List<? extends Ast.Expr> actualArgs,
      String opName,
      TypecheckingContext tc) {
    final Type f = proxyFor();
    if (f instanceof MapType) {
      return ((MapType) f).checkArgumentTypes(pos, actualArgs, opName, tc);
    }
    if (f instanceof MapTypeProxy) {
      return ((MapTypeProxy) f)
          .checkArgumentTypes(pos, actualArgs, opName, tc);
    }
    checkState(f == null, "map proxy defined to %s", f);

    // Record the constraint given by this use of the map.
    final List<Type> argTypes = Types.typesOf(actualArgs);
    final Type result = new TypeProxy(pos, "result");
    addConstraint(new Constraint(argTypes, result));
    final List<Type> argumentsResult =
        ImmutableList.<Type>builder().addAll(argTypes).add(result).build();
    return new Types.ArgumentMatch(result,
        new TypeParamInstantiation.MapProxyInstantiation(this,
            argumentsResult));
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    final Type p = proxyFor();
    if (p != null) {
      return p.clone(varMap);
    }
    final MapTypeProxy p2 = new MapTypeProxy(pos, name, arity);
    for (Constraint c : constraints) {
      p2.addConstraint(c.clone(varMap));
    }
    return p2;
  }

  @Override
  public Type cloneUnresolved() {
    return clone(new HashMap<>());
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    final Type p = proxyFor();
    if (p != null) {
      p.describe(b, contextBindingStrength);
      return;
    }
    b.append('[');
    for (int i = 0; i < arity; ++i) {
      if (i > 0) {
        b.append(", ");
      }
      b.append('?');
    }
    b.append("]?");
  }

  @Override
  public boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier) {
    final Type p = proxyFor();
    if (p != null) {
      return p.unify(that, unifiableVariables, unifier);
    }

    that = followProxy(that.expanded());
    if (reallyOccursIn(that)) {
      return false;
    }
    if (that instanceof TypeVariable
        && containsIdentical(
            unifiableVariables, (TypeVariable) that)) {
      return that.unify(this, unifiableVariables, unifier);
    }

    if (this == that) {
      return true;
    } else if (that instanceof MapType) {
      final MapType mapType = (MapType) that;
      if (mapType.arguments.size() == arity) {
        boolean good = true;
        for (Constraint c : constraints) {
          good &= c.unify(mapType, unifiableVariables, unifier);
        }
        if (good) {
          defineProxy(mapType);
          return true;
        }
      }
    } else if (that instanceof MapTypeProxy) {
      final MapTypeProxy mt = (MapTypeProxy) that;
      if (mt.arity == arity) {
        // Propagate the constraints to the surviving proxy.
        for (Constraint c : constraints) {
          mt.addConstraint(c);
        }
        defineProxy(mt);
        return true;
      }
    } else if (that instanceof ConstrainedProxy) {
      return false;
    } else if (that instanceof TypeProxy) {
      return that.unify(this, unifiableVariables, unifier);
    }
    return false;
  }

  @Override
  public boolean isMap() {
    return true;
  }

  @Override
  public int mapArity() {
    return arity;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /** Argument and result types of one use of the map. */
  private static class Constraint {
    final ImmutableList<Type> arguments;
    final Type result;

    Constraint(List<Type> arguments, Type result) {
      this.arguments = ImmutableList.copyOf(arguments);
      this.result = result;
    }

    @Override
    public String toString() {
      return arguments + " -> " + result;
    }

    Constraint clone(Map<TypeVariable, TypeVariable> varMap) {
      final ImmutableList.Builder<Type> args = ImmutableList.builder();
      for (Type t : arguments) {
        args.add(t.clone(varMap));
      }
      return new Constraint(args.build(), result.clone(varMap));
    }

    /** Unifies this use with a map type, instantiating the map's type
     * parameters with fresh proxies. */
    boolean unify(
        MapType that,
        List<TypeVariable> unifiableVariables,
        Map<TypeVariable, Type> unifier) {
      checkArgument(arguments.size() == that.arguments.size());
      final Map<TypeVariable, Type> subst = new HashMap<>();
      for (TypeVariable tv : that.typeParameters) {
        subst.put(tv, new TypeProxy(Pos.ZERO, tv.name));
      }
      boolean good = true;
      for (int i = 0; i < arguments.size(); i++) {
        final Type t0 = that.arguments.get(i).substitute(subst);
        good &= t0.unify(arguments.get(i), unifiableVariables, unifier);
      }
      good &=
          that.result.substitute(subst)
              .unify(result, unifiableVariables, unifier);
      return good;
    }
  }
}

// End MapTypeProxy.java
