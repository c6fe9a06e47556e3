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

import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.Program;

/** Called on various events during checking. */
public interface Tracer {
  /** Called when a phase has completed. */
  void onPhase(Phase phase, Program program);

  /** Called with a warning. */
  void onWarning(Pos pos, String message);

  /**
   * Called with an error found during resolution or type checking. Returns
   * whether a handler was found.
   */
  boolean handleCompileException(CompileException e);

  /** Phase of checking. */
  enum Phase {
    REGISTER,
    RESOLVE,
    TYPECHECK,
    EXTRACT_LOOPS
  }
}

// End Tracer.java
