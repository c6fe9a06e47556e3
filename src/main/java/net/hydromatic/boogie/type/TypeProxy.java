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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.ResolutionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Placeholder for a type that is not known yet.
 *
 * <p>A proxy is defined at most once, by unification. Once defined, it behaves
 * exactly like the type it stands for. Chains of proxies are shortened each
 * time they are followed.
 */
public class TypeProxy extends Type {
  private static final AtomicInteger PROXY_COUNT = new AtomicInteger();

  public final String name;
  private @Nullable Type proxyFor;

  public TypeProxy(Pos pos, String givenName) {
    this(pos, givenName, "proxy");
  }

  protected TypeProxy(Pos pos, String givenName, String kind) {
    super(pos);
    this.name =
        requireNonNull(givenName) + "$" + kind + "#"
            + PROXY_COUNT.getAndIncrement();
  }

  /** Returns the type this proxy has been defined to, or null. Shortens the
   * chain of proxies as a side effect. */
  public @Nullable Type proxyFor() {
    if (proxyFor instanceof TypeProxy) {
      final TypeProxy another = (TypeProxy) proxyFor;
      if (another.proxyFor != null) {
        proxyFor = another.proxyFor();
        assert proxyFor != null;
      }
    }
    return proxyFor;
  }

  /** Follows a chain of proxies to the first type that is not a defined
   * proxy. */
  public static Type followProxy(Type t) {
    if (t instanceof TypeProxy) {
      final Type p = ((TypeProxy) t).proxyFor();
      if (p != null) {
        return p;
      }
    }
    return t;
  }

  protected void defineProxy(Type ty) {
    checkState(proxyFor() == null, "proxy %s is already defined", name);
    ty = followProxy(ty);
    if (this != ty) {
      proxyFor = ty;
    }
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    final Type p = proxyFor();
    return p != null ? p.clone(varMap) : new TypeProxy(pos, name);
  }

  @Override
  public Type cloneUnresolved() {
    return new TypeProxy(pos, name);
  }

  //-----------  Equality  ----------------------------------

  @Override
  public boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables) {
    if (this == that) {
      return true;
    }
    final Type p = proxyFor();
    if (p != null) {
      return p.equals(that, thisBoundVariables, thatBoundVariables);
    }
    // An unresolved proxy could be made equal to anything.
    return false;
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    final Type p = proxyFor();
    return p != null
        ? p.hashCode(boundVariables)
        : System.identityHashCode(this);
  }

  //-----------  Unification  ----------------------------------

  /** Occurs check: whether this proxy occurs strictly inside {@code that}. */
  protected boolean reallyOccursIn(Type that) {
    that = followProxy(that.expanded());
    return containsThis(that.freeProxies())
        && (that.isCtor()
            || that.isMap() && this != that && this.proxyFor() != that);
  }

  private boolean containsThis(List<TypeProxy> proxies) {
    for (TypeProxy proxy : proxies) {
      if (proxy == this) {
        return true;
      }
    }
    return false;
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
    if (reallyOccursIn(that)) {
      return false;
    }
    defineProxy(that.expanded());
    return true;
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    final Type p = proxyFor();
    return p != null ? p.substitute(subst) : this;
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    final Type p = proxyFor();
    if (p != null) {
      p.describe(b, contextBindingStrength);
    } else {
      b.append(name);
    }
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    final Type p = proxyFor();
    return p != null ? p.resolveType(rc) : this;
  }

  @Override
  public List<TypeVariable> freeVariables() {
    final Type p = proxyFor();
    return p != null ? p.freeVariables() : ImmutableList.of();
  }

  @Override
  public List<TypeProxy> freeProxies() {
    final Type p = proxyFor();
    return p != null ? p.freeProxies() : ImmutableList.of(this);
  }

  //-----------  Getters/Issers  ----------------------------------

  /** Returns the target, or throws if this proxy is not yet defined. */
  private Type target() {
    final Type p = proxyFor();
    checkState(p != null, "proxy %s is not defined", name);
    return p;
  }

  @Override
  public boolean isBasic() {
    final Type p = proxyFor();
    return p != null && p.isBasic();
  }

  @Override
  public boolean isInt() {
    final Type p = proxyFor();
    return p != null && p.isInt();
  }

  @Override
  public boolean isBool() {
    final Type p = proxyFor();
    return p != null && p.isBool();
  }

  @Override
  public boolean isVariable() {
    final Type p = proxyFor();
    return p != null && p.isVariable();
  }

  @Override
  public TypeVariable asVariable() {
    return target().asVariable();
  }

  @Override
  public boolean isCtor() {
    final Type p = proxyFor();
    return p != null && p.isCtor();
  }

  @Override
  public CtorType asCtor() {
    return target().asCtor();
  }

  @Override
  public boolean isMap() {
    final Type p = proxyFor();
    return p != null && p.isMap();
  }

  @Override
  public MapType asMap() {
    return target().asMap();
  }

  @Override
  public int mapArity() {
    return target().mapArity();
  }

  @Override
  public boolean isUnresolved() {
    final Type p = proxyFor();
    return p != null && p.isUnresolved();
  }

  @Override
  public UnresolvedTypeIdentifier asUnresolved() {
    return target().asUnresolved();
  }

  @Override
  public boolean isBv() {
    final Type p = proxyFor();
    return p != null && p.isBv();
  }

  @Override
  public int bvBits() {
    return target().bvBits();
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End TypeProxy.java
