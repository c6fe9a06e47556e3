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
package net.hydromatic.boogie.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.MapType;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.TypeVisitor;
import net.hydromatic.boogie.type.UnresolvedTypeIdentifier;

/** Declaration of a type synonym, such as {@code type Set a = [a]bool;}. */
public class TypeSynonymDecl extends NamedDeclaration {
  public final ImmutableList<TypeVariable> typeParameters;
  /** Definition; unresolved until {@link #resolve} is called. */
  public Type body;

  TypeSynonymDecl(Pos pos, Attributes attributes, String name,
      List<TypeVariable> typeParameters, Type body) {
    super(pos, Op.TYPE_SYNONYM_DECL, attributes, name);
    this.typeParameters = ImmutableList.copyOf(typeParameters);
    this.body = requireNonNull(body);
  }

  @Override
  public void register(ResolutionContext rc) {
    rc.addType(this);
  }

  @Override
  public void resolve(ResolutionContext rc) {
    attributes.resolve(rc);
    final int previousState = rc.typeBinderState();
    try {
      typeParameters.forEach(rc::addTypeBinder);
      body = body.resolveType(rc);
    } finally {
      rc.setTypeBinderState(previousState);
    }
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
  }

  /**
   * Resolves a list of type synonyms.
   *
   * <p>A synonym is resolved only after the synonyms that its body refers
   * to. Synonyms that are part of a cycle cannot be resolved; each is
   * reported, and its body is replaced by {@code bool}.
   */
  public static void resolveTypeSynonyms(List<TypeSynonymDecl> synonyms,
      ResolutionContext rc) {
    final Map<TypeSynonymDecl, Set<TypeSynonymDecl>> dependencies =
        new LinkedHashMap<>();
    for (TypeSynonymDecl synonym : synonyms) {
      final Set<TypeSynonymDecl> deps = new LinkedHashSet<>();
      synonym.body.accept(new DependencyFinder(synonym, deps, rc));
      dependencies.put(synonym, deps);
    }

    final Set<TypeSynonymDecl> resolved = new LinkedHashSet<>();
    final List<TypeSynonymDecl> unresolved = new ArrayList<>(synonyms);
    while (!unresolved.isEmpty()) {
      final List<TypeSynonymDecl> ready = new ArrayList<>();
      for (TypeSynonymDecl synonym : unresolved) {
        if (resolved.containsAll(dependencies.get(synonym))) {
          ready.add(synonym);
        }
      }
      if (ready.isEmpty()) {
        // The remaining synonyms refer to each other.
        for (TypeSynonymDecl synonym : unresolved) {
          rc.error(synonym.pos, "type synonym could not be resolved because "
              + "of cycles: {0} (replacing body with \"bool\" to continue "
              + "resolving)", synonym.name);
          synonym.body = Type.BOOL;
          synonym.resolve(rc);
        }
        return;
      }
      for (TypeSynonymDecl synonym : ready) {
        synonym.resolve(rc);
        resolved.add(synonym);
        unresolved.remove(synonym);
      }
    }
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("type ");
    attributes.unparse(w);
    w.id(name, this);
    for (TypeVariable v : typeParameters) {
      w.append(" ").append(v.name);
    }
    return w.append(" = ").append(body.toString()).append(";");
  }

  /** Finds the type synonyms that an unresolved type refers to. Names
   * shadowed by the synonym's own parameters, or by the binders of a map
   * type, are not synonyms. */
  private static class DependencyFinder extends TypeVisitor<Void> {
    private final Set<TypeSynonymDecl> dependencies;
    private final ResolutionContext rc;
    private final List<String> boundNames = new ArrayList<>();

    DependencyFinder(TypeSynonymDecl synonym,
        Set<TypeSynonymDecl> dependencies, ResolutionContext rc) {
      this.dependencies = dependencies;
      this.rc = rc;
      synonym.typeParameters.forEach(v -> boundNames.add(v.name));
    }

    @Override
    public Void visit(MapType mapType) {
      final int size = boundNames.size();
      mapType.typeParameters.forEach(v -> boundNames.add(v.name));
      super.visit(mapType);
      boundNames.subList(size, boundNames.size()).clear();
      return null;
    }

    @Override
    public Void visit(UnresolvedTypeIdentifier unresolved) {
      if (!boundNames.contains(unresolved.name)) {
        final TypeSynonymDecl decl = rc.lookupTypeSynonym(unresolved.name);
        if (decl != null) {
          dependencies.add(decl);
        }
      }
      return super.visit(unresolved);
    }
  }
}

// End TypeSynonymDecl.java
