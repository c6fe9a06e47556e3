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

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;

/** Declaration of a type constructor, such as {@code type List _;}. */
public class TypeCtorDecl extends NamedDeclaration {
  /** Number of type arguments. */
  public final int arity;

  TypeCtorDecl(Pos pos, Attributes attributes, String name, int arity) {
    super(pos, Op.TYPE_DECL, attributes, name);
    checkArgument(arity >= 0);
    this.arity = arity;
  }

  @Override
  public void register(ResolutionContext rc) {
    rc.addType(this);
  }

  @Override
  public void resolve(ResolutionContext rc) {
    attributes.resolve(rc);
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
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
    for (int i = 0; i < arity; i++) {
      w.append(" _");
    }
    return w.append(";");
  }
}

// End TypeCtorDecl.java
