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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.Program;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a program after a
   * given phase, then calls the underlying tracer. */
  public static Tracer withOnPhase(Tracer tracer, Tracer.Phase phase,
      Consumer<Program> consumer) {
    final Tracer.Phase expectedPhase = phase;
    return new DelegatingTracer(tracer) {
      @Override
      public void onPhase(Tracer.Phase phase, Program program) {
        if (phase == expectedPhase) {
          consumer.accept(program);
        }
        super.onPhase(phase, program);
      }
    };
  }

  /** Returns a tracer that performs the given action on a warning, then
   * calls the underlying tracer. */
  public static Tracer withOnWarning(Tracer tracer,
      BiConsumer<Pos, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarning(Pos pos, String message) {
        consumer.accept(pos, message);
        super.onWarning(pos, message);
      }
    };
  }

  /** Returns a tracer that performs the given action on an error, then
   * calls the underlying tracer. */
  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onPhase(Tracer.Phase phase, Program program) {}

    @Override
    public void onWarning(Pos pos, String message) {}

    @Override
    public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onPhase(Tracer.Phase phase, Program program) {
      tracer.onPhase(phase, program);
    }

    @Override
    public void onWarning(Pos pos, String message) {
      tracer.onWarning(pos, message);
    }

    @Override
    public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
