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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instantiation of the type parameters of a polymorphic function or map at
 * one use.
 *
 * <p>This is not simply a map, because if the map's type is only known via a
 * {@link MapTypeProxy}, the type parameters and their values are only
 * determined once the proxy is defined.
 */
public interface TypeParamInstantiation {
  /** Returns the formal type parameters. */
  List<TypeVariable> formalTypeParams();

  /** Returns the actual type of a formal type parameter. */
  Type get(TypeVariable var);

  /** Instantiation with no type parameters. */
  TypeParamInstantiation EMPTY = new Simple(ImmutableMap.of());

  /** Creates an instantiation from parallel lists of formal type parameters
   * and actual types. */
  static TypeParamInstantiation from(
      List<TypeVariable> typeParams, List<Type> actualTypeParams) {
    checkArgument(typeParams.size() == actualTypeParams.size());
    if (typeParams.isEmpty()) {
      return EMPTY;
    }
    final ImmutableMap.Builder<TypeVariable, Type> b = ImmutableMap.builder();
    for (int i = 0; i < typeParams.size(); i++) {
      b.put(typeParams.get(i), actualTypeParams.get(i));
    }
    return new Simple(b.build());
  }

  /** Instantiation whose values are known. */
  class Simple implements TypeParamInstantiation {
    private final ImmutableMap<TypeVariable, Type> instantiations;

    Simple(ImmutableMap<TypeVariable, Type> instantiations) {
      this.instantiations = requireNonNull(instantiations);
    }

    @Override
    public List<TypeVariable> formalTypeParams() {
      return instantiations.keySet().asList();
    }

    @Override
    public Type get(TypeVariable var) {
      return requireNonNull(instantiations.get(var), var.name);
    }
  }

  /** Instantiation that reads the current definition of a map proxy. Its
   * values can change while the proxy receives further unifications. */
  class MapProxyInstantiation implements TypeParamInstantiation {
    private final MapTypeProxy proxy;

    /** Argument and result types of this use of the map. */
    private final ImmutableList<Type> argumentsResult;

    /** Computed on first request, once the proxy is defined. */
    private @Nullable Map<TypeVariable, Type> instantiations;

    MapProxyInstantiation(MapTypeProxy proxy, List<Type> argumentsResult) {
      this.proxy = requireNonNull(proxy);
      this.argumentsResult = ImmutableList.copyOf(argumentsResult);
    }

    @Override
    public List<TypeVariable> formalTypeParams() {
      final Type realType = proxy.proxyFor();
      if (realType instanceof MapType) {
        return ((MapType) realType).typeParameters;
      }
      // No definition is known, so the map is assumed to be monomorphic.
      return ImmutableList.of();
    }

    @Override
    public Type get(TypeVariable var) {
      if (instantiations == null) {
        final Type realType = proxy.proxyFor();
        checkState(realType instanceof MapType,
            "map proxy %s has no definition", proxy.name);
        final MapType mapType = (MapType) realType;
        final List<Type> formalArgs = new ArrayList<>(mapType.arguments);
        formalArgs.add(mapType.result);
        instantiations =
            Types.inferTypeParameters(mapType.typeParameters, formalArgs,
                argumentsResult);
      }
      return requireNonNull(instantiations.get(var), var.name);
    }
  }
}

// End TypeParamInstantiation.java
