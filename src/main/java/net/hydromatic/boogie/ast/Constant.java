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
import java.util.List;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Constant, such as {@code const unique c: int extends unique p, q;}.
 *
 * <p>The parents of a constant, together with the {@code unique} flags on
 * constants and parent edges, describe a partial order among constants.
 */
public class Constant extends Variable {
  /** Whether this constant is distinct from all other unique constants. */
  public final boolean unique;
  /** Parents; null if there is no {@code extends} clause. */
  public final @Nullable ImmutableList<Parent> parents;
  /** Whether the children of this constant are exactly those constants
   * that list it as a parent. */
  public final boolean childrenComplete;

  Constant(Pos pos, Attributes attributes, String name, Type type,
      boolean unique, @Nullable List<Parent> parents,
      boolean childrenComplete) {
    super(pos, Op.CONST_DECL, attributes, name, type, null);
    this.unique = unique;
    this.parents = parents == null ? null : ImmutableList.copyOf(parents);
    this.childrenComplete = childrenComplete;
  }

  @Override
  public boolean isMutable() {
    return false;
  }

  @Override
  public boolean isGlobal() {
    return true;
  }

  @Override
  public void resolve(ResolutionContext rc) {
    super.resolve(rc);
    if (parents == null) {
      return;
    }
    final List<Variable> seen = new ArrayList<>();
    for (Parent parent : parents) {
      parent.id.resolve(rc);
      final Variable decl = parent.id.decl;
      if (decl == null) {
        continue;
      }
      if (!(decl instanceof Constant)) {
        rc.error(parent.id.pos,
            "the parent of a constant has to be a constant");
      } else if (decl == this) {
        rc.error(parent.id.pos, "constant cannot be its own parent");
      }
      if (seen.contains(decl)) {
        rc.error(parent.id.pos, "{0} occurs more than once as parent",
            parent.id.name);
      } else {
        seen.add(decl);
      }
    }
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    super.typecheck(tc);
    if (parents == null) {
      return;
    }
    for (Parent parent : parents) {
      parent.id.typecheck(tc);
      if (!type.unify(parent.id.type())) {
        tc.error(parent.id.pos,
            "parent of constant has incompatible type ({0} instead of {1})",
            parent.id.type, type);
      }
    }
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("const ");
    attributes.unparse(w);
    if (unique) {
      w.append("unique ");
    }
    unparseTypedIdent(w);
    if (parents != null || childrenComplete) {
      w.append(" extends");
      if (parents != null) {
        for (int i = 0; i < parents.size(); i++) {
          final Parent parent = parents.get(i);
          w.append(i == 0 ? " " : ", ");
          if (parent.unique) {
            w.append("unique ");
          }
          w.append(parent.id, 0, 0);
        }
      }
      if (childrenComplete) {
        w.append(" complete");
      }
    }
    return w.append(";");
  }

  /** Edge from a constant to one of its parents. */
  public static class Parent {
    /** Whether this edge is distinct from the edges of other children of
     * the same parent. */
    public final boolean unique;
    public final Ast.Id id;

    public Parent(boolean unique, Ast.Id id) {
      this.unique = unique;
      this.id = requireNonNull(id);
    }
  }
}

// End Constant.java
