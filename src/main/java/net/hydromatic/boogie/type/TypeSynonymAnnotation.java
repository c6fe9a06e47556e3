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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.boogie.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.TypeSynonymDecl;
import net.hydromatic.boogie.compile.ResolutionContext;

/**
 * Use of a type synonym.
 *
 * <p>Behaves exactly like its expansion; the annotation only remembers the
 * synonym so that the type can be written the way the user wrote it.
 */
public class TypeSynonymAnnotation extends Type {
  public final TypeSynonymDecl decl;
  public final ImmutableList<Type> arguments;
  private final Type expandedType;

  public TypeSynonymAnnotation(Pos pos, TypeSynonymDecl decl,
      List<Type> arguments) {
    super(pos);
    this.decl = requireNonNull(decl);
    this.arguments = ImmutableList.copyOf(arguments);
    checkArgument(decl.typeParameters.size() == arguments.size(),
        "synonym %s expects %s arguments", decl.name,
        decl.typeParameters.size());
    final Map<TypeVariable, Type> subst = new HashMap<>();
    for (int i = 0; i < arguments.size(); i++) {
      subst.put(decl.typeParameters.get(i), arguments.get(i));
    }
    this.expandedType = decl.body.substitute(subst);
  }

  private TypeSynonymAnnotation(Pos pos, TypeSynonymDecl decl,
      List<Type> arguments, Type expandedType) {
    super(pos);
    this.decl = decl;
    this.arguments = ImmutableList.copyOf(arguments);
    this.expandedType = expandedType;
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    return new TypeSynonymAnnotation(pos, decl,
        transformEager(arguments, t -> t.clone(varMap)),
        expandedType.clone(varMap));
  }

  @Override
  public Type cloneUnresolved() {
    return new TypeSynonymAnnotation(pos, decl,
        transformEager(arguments, Type::cloneUnresolved));
  }

  @Override
  public boolean equals(
      Type that,
      List<TypeVariable> thisBoundVariables,
      List<TypeVariable> thatBoundVariables) {
    return expandedType.equals(that, thisBoundVariables, thatBoundVariables);
  }

  @Override
  public boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier) {
    return expandedType.unify(that, unifiableVariables, unifier);
  }

  @Override
  public Type substitute(Map<TypeVariable, Type> subst) {
    if (subst.isEmpty()) {
      return this;
    }
    return new TypeSynonymAnnotation(pos, decl,
        transformEager(arguments, t -> t.substitute(subst)),
        expandedType.substitute(subst));
  }

  @Override
  public int hashCode(List<TypeVariable> boundVariables) {
    return expandedType.hashCode(boundVariables);
  }

  @Override
  public void describe(StringBuilder b, int contextBindingStrength) {
    CtorType.describeCtor(b, decl.name, arguments, contextBindingStrength);
  }

  @Override
  public Type resolveType(ResolutionContext rc) {
    // Types may be resolved more than once.
    return new TypeSynonymAnnotation(pos, decl,
        transformEager(arguments, t -> t.resolveType(rc)));
  }

  @Override
  public Type expanded() {
    return expandedType.expanded();
  }

  @Override
  public List<TypeVariable> freeVariables() {
    return expandedType.freeVariables();
  }

  @Override
  public List<TypeProxy> freeProxies() {
    return expandedType.freeProxies();
  }

  @Override
  public boolean isBasic() {
    return expandedType.isBasic();
  }

  @Override
  public boolean isInt() {
    return expandedType.isInt();
  }

  @Override
  public boolean isBool() {
    return expandedType.isBool();
  }

  @Override
  public boolean isVariable() {
    return expandedType.isVariable();
  }

  @Override
  public TypeVariable asVariable() {
    return expandedType.asVariable();
  }

  @Override
  public boolean isCtor() {
    return expandedType.isCtor();
  }

  @Override
  public CtorType asCtor() {
    return expandedType.asCtor();
  }

  @Override
  public boolean isMap() {
    return expandedType.isMap();
  }

  @Override
  public MapType asMap() {
    return expandedType.asMap();
  }

  @Override
  public int mapArity() {
    return expandedType.mapArity();
  }

  @Override
  public boolean isUnresolved() {
    return expandedType.isUnresolved();
  }

  @Override
  public UnresolvedTypeIdentifier asUnresolved() {
    return expandedType.asUnresolved();
  }

  @Override
  public boolean isBv() {
    return expandedType.isBv();
  }

  @Override
  public int bvBits() {
    return expandedType.bvBits();
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End TypeSynonymAnnotation.java
