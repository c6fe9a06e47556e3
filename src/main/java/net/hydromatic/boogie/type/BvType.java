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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.compile.ResolutionContext;

/** Bit-vector type of fixed width, such as {@code bv32}.
 *
 * @see Types#bvType(int) */
public class BvType extends Type {
  public final int bits;

  public BvType(Pos pos, int bits) {
    super(pos);
    checkArgument(bits >= 0, "negative width %s", bits);
    this.bits = bits;
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
    return that instanceof BvType && bits == ((BvType) that).bits;
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
    return Integer.hashCode(bits);
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    b.append("bv").append(bits);
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
  public boolean isBv() {
    return true;
  }

  @Override
  public int bvBits() {
    return bits;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End BvType.java
