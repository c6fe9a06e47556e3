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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.ResolutionContext;

/** Built-in type, {@code int} or {@code bool}. */
public class BasicType extends Type {
  public final Kind kind;

  BasicType(Pos pos, Kind kind) {
    super(pos);
    this.kind = requireNonNull(kind);
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    return this;
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
    return that instanceof BasicType && kind == ((BasicType) that).kind;
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
    return this.equals(that);
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    return this;
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    return kind.hashCode();
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    b.append(kind.id);
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    return this;
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
  public boolean isBasic() {
    return true;
  }

  @Override
  public boolean isInt() {
    return kind == Kind.INT;
  }

  @Override
  public boolean isBool() {
    return kind == Kind.BOOL;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /** Which basic type. */
  public enum Kind {
    INT,
    BOOL;

    public final String id = name().toLowerCase(Locale.ROOT);
  }
}

// End BasicType.java
