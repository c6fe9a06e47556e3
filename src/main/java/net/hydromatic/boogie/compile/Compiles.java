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

import java.util.Map;
import net.hydromatic.boogie.ast.Implementation;
import net.hydromatic.boogie.ast.Program;

/** Helpers for checking programs. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Resolves and typechecks a program.
   *
   * <p>Errors are reported to the tracer, and counted in the result.
   * Typechecking is skipped if resolution found errors. If
   * {@link Prop#PRUNE_UNREACHABLE_BLOCKS} is set and the program is valid,
   * removes the unreachable blocks of each implementation.
   */
  public static Result check(Program program, Map<Prop, Object> props,
      Tracer tracer) {
    final ResolutionContext rc = new ResolutionContext(tracer);
    program.register(rc);
    tracer.onPhase(Tracer.Phase.REGISTER, program);
    program.resolve(rc, Prop.OVERLOOK_TYPE_ERRORS.booleanValue(props));
    tracer.onPhase(Tracer.Phase.RESOLVE, program);
    if (rc.errorCount() > 0) {
      return new Result(rc.errorCount(), 0);
    }

    final TypecheckingContext tc = new TypecheckingContext(tracer);
    program.typecheck(tc);
    tracer.onPhase(Tracer.Phase.TYPECHECK, program);
    if (tc.errorCount() == 0
        && Prop.PRUNE_UNREACHABLE_BLOCKS.booleanValue(props)) {
      for (Implementation impl : program.implementations()) {
        if (!impl.blocks.isEmpty()) {
          impl.pruneUnreachableBlocks();
        }
      }
    }
    return new Result(0, tc.errorCount());
  }

  /** Extracts loops from a program that has been checked. */
  public static void extractLoops(Program program, Map<Prop, Object> props,
      Tracer tracer) {
    program.extractLoops(props);
    tracer.onPhase(Tracer.Phase.EXTRACT_LOOPS, program);
  }

  /** Numbers of errors found by {@link #check}. */
  public static class Result {
    public final int resolutionErrorCount;
    public final int typecheckErrorCount;

    Result(int resolutionErrorCount, int typecheckErrorCount) {
      this.resolutionErrorCount = resolutionErrorCount;
      this.typecheckErrorCount = typecheckErrorCount;
    }

    /** Returns whether the program is valid. */
    public boolean ok() {
      return resolutionErrorCount == 0 && typecheckErrorCount == 0;
    }

    @Override
    public String toString() {
      return "resolution errors: " + resolutionErrorCount
          + ", typecheck errors: " + typecheckErrorCount;
    }
  }
}

// End Compiles.java
