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

import net.hydromatic.boogie.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Formal parameter of a function, procedure or implementation. An
 * in-parameter is immutable; an out-parameter may be assigned. */
public class Formal extends Variable {
  public final boolean incoming;

  Formal(Pos pos, Attributes attributes, String name, Type type,
      Ast.@Nullable Expr where, boolean incoming) {
    super(pos, Op.FORMAL, attributes, name, type, where);
    this.incoming = incoming;
  }

  @Override
  public boolean isMutable() {
    return !incoming;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    attributes.unparse(w);
    unparseTypedIdent(w);
    return w;
  }
}

// End Formal.java
