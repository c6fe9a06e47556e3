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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.compile.LoopExtractor;
import net.hydromatic.boogie.compile.Prop;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypeAmbiguitySeeker;
import net.hydromatic.boogie.compile.TypecheckingContext;

/**
 * Program: a list of top-level declarations.
 *
 * <p>To check a program, call {@link #register}, then {@link #resolve}, and
 * if there were no errors, {@link #typecheck}. Transformations such as
 * {@link #extractLoops} modify the list of declarations.
 */
public class Program {
  public final List<Declaration> decls;

  Program(List<Declaration> decls) {
    this.decls = new ArrayList<>(decls);
  }

  /** Returns the declarations of a given class, in order. */
  public <D extends Declaration> List<D> declarations(Class<D> clazz) {
    final ImmutableList.Builder<D> b = ImmutableList.builder();
    for (Declaration decl : decls) {
      if (clazz.isInstance(decl)) {
        b.add(clazz.cast(decl));
      }
    }
    return b.build();
  }

  public List<GlobalVariable> globalVariables() {
    return declarations(GlobalVariable.class);
  }

  public List<Procedure> procedures() {
    return declarations(Procedure.class);
  }

  public List<Implementation> implementations() {
    return declarations(Implementation.class);
  }

  /** Adds each declaration to the global namespaces. */
  public void register(ResolutionContext rc) {
    decls.forEach(d -> d.register(rc));
  }

  /** Resolves the declarations, which must have been registered. */
  public void resolve(ResolutionContext rc) {
    resolve(rc, false);
  }

  /**
   * Resolves the declarations, which must have been registered.
   *
   * <p>Type constructors are resolved first, then type synonyms, then the
   * other declarations, and finally the where clauses of global variables.
   *
   * <p>If {@code overlookTypeErrors}, an implementation that has resolution
   * errors is removed from the program, and its errors are not counted.
   */
  public void resolve(ResolutionContext rc, boolean overlookTypeErrors) {
    declarations(TypeCtorDecl.class).forEach(d -> d.resolve(rc));
    TypeSynonymDecl.resolveTypeSynonyms(declarations(TypeSynonymDecl.class),
        rc);

    final List<Declaration> removed = new ArrayList<>();
    for (Declaration decl : decls) {
      if (decl instanceof TypeCtorDecl || decl instanceof TypeSynonymDecl) {
        continue;
      }
      final int previousErrorCount = rc.errorCount();
      decl.resolve(rc);
      if (overlookTypeErrors
          && decl instanceof Implementation
          && rc.errorCount() != previousErrorCount) {
        rc.warning(decl.pos, "Ignoring implementation {0} because of "
            + "translation resolution errors", ((Implementation) decl).name);
        rc.setErrorCount(previousErrorCount);
        removed.add(decl);
      }
    }
    decls.removeAll(removed);

    globalVariables().forEach(v -> v.resolveWhere(rc));
  }

  /** Typechecks the declarations, which must have been resolved without
   * errors. If there are no type errors, checks that every type has been
   * inferred. */
  public void typecheck(TypecheckingContext tc) {
    final int previousErrorCount = tc.errorCount();
    decls.forEach(d -> d.typecheck(tc));
    if (tc.errorCount() == previousErrorCount) {
      new TypeAmbiguitySeeker(tc).check(this);
    }
  }

  /** Converts each loop in each implementation into a call to a new
   * recursive procedure. The program must have been resolved. */
  public void extractLoops(Map<Prop, Object> props) {
    new LoopExtractor(props).extract(this);
  }

  @Override
  public String toString() {
    return unparse(new AstWriter());
  }

  /** Converts this program into text, one declaration per paragraph. */
  public String unparse(AstWriter w) {
    for (int i = 0; i < decls.size(); i++) {
      if (i > 0) {
        w.blankLine();
      }
      w.append(decls.get(i), 0, 0);
    }
    return w.append("\n").toString();
  }
}

// End Program.java
