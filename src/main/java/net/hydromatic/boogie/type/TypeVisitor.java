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

/** Visitor over {@link Type} objects.
 *
 * <p>The default methods visit component types and return null.
 *
 * @param <R> return type from {@code visit} methods
 *
 * @see Type#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  /** Visits a {@link BasicType}. */
  public R visit(BasicType basicType) {
    return null;
  }

  /** Visits a {@link BvType}. */
  public R visit(BvType bvType) {
    return null;
  }

  /** Visits a {@link TypeVariable}. */
  public R visit(TypeVariable typeVariable) {
    return null;
  }

  /** Visits a {@link CtorType}. */
  public R visit(CtorType ctorType) {
    R r = null;
    for (Type type : ctorType.arguments) {
      r = type.accept(this);
    }
    return r;
  }

  /** Visits a {@link MapType}. */
  public R visit(MapType mapType) {
    for (Type type : mapType.arguments) {
      type.accept(this);
    }
    return mapType.result.accept(this);
  }

  /** Visits a {@link TypeSynonymAnnotation}. */
  public R visit(TypeSynonymAnnotation annotation) {
    R r = null;
    for (Type type : annotation.arguments) {
      r = type.accept(this);
    }
    return r;
  }

  /** Visits an {@link UnresolvedTypeIdentifier}. */
  public R visit(UnresolvedTypeIdentifier unresolved) {
    R r = null;
    for (Type type : unresolved.arguments) {
      r = type.accept(this);
    }
    return r;
  }

  /** Visits a {@link TypeProxy}; if it is defined, visits its definition. */
  public R visit(TypeProxy typeProxy) {
    final Type p = typeProxy.proxyFor();
    return p == null ? null : p.accept(this);
  }

  /** Visits a {@link BvTypeProxy}. */
  public R visit(BvTypeProxy bvTypeProxy) {
    return visit((TypeProxy) bvTypeProxy);
  }

  /** Visits a {@link MapTypeProxy}. */
  public R visit(MapTypeProxy mapTypeProxy) {
    return visit((TypeProxy) mapTypeProxy);
  }
}

// End TypeVisitor.java
