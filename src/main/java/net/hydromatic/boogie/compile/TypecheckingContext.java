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
package net.hydromatic.boogie.compile;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context used while typechecking a program. */
public class TypecheckingContext extends CheckingContext {
  /** Modifies clause of the procedure whose implementation is being checked;
   * null outside an implementation. */
  private @Nullable List<Ast.Id> frame;

  public TypecheckingContext(Tracer tracer) {
    super(tracer);
  }

  public @Nullable List<Ast.Id> frame() {
    return frame;
  }

  /** Sets the frame, and returns the previous frame. */
  public @Nullable List<Ast.Id> setFrame(@Nullable List<Ast.Id> frame) {
    final List<Ast.Id> previous = this.frame;
    this.frame = frame == null ? null : ImmutableList.copyOf(frame);
    return previous;
  }

  /** Returns whether a variable may be modified in the current frame.
   * Every variable may be modified if there is no frame. */
  public boolean inFrame(Variable v) {
    if (frame == null) {
      return true;
    }
    for (Ast.Id id : frame) {
      if (id.decl == v) {
        return true;
      }
    }
    return false;
  }
}

// End TypecheckingContext.java
