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

import static java.util.Objects.requireNonNull;

import java.text.MessageFormat;
import java.util.Locale;
import net.hydromatic.boogie.ast.Pos;

/**
 * Base class for contexts that report errors while checking a program.
 *
 * <p>Errors do not stop checking. Each error is formatted, counted, and
 * passed to the {@link Tracer}.
 */
public abstract class CheckingContext {
  protected final Tracer tracer;
  private int errorCount;

  protected CheckingContext(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the number of errors reported so far. */
  public int errorCount() {
    return errorCount;
  }

  /** Sets the error count; used to discard the errors of a declaration that
   * has been removed from the program. */
  public void setErrorCount(int errorCount) {
    this.errorCount = errorCount;
  }

  /**
   * Reports an error.
   *
   * @param pos Position of the offending node
   * @param pattern Message in {@link MessageFormat} syntax
   * @param args Arguments to the message
   */
  public void error(Pos pos, String pattern, Object... args) {
    ++errorCount;
    tracer.handleCompileException(
        new CompileException(format(pattern, args), pos));
  }

  /** Reports a warning. Warnings are not counted. */
  public void warning(Pos pos, String pattern, Object... args) {
    tracer.onWarning(pos, format(pattern, args));
  }

  private static String format(String pattern, Object... args) {
    if (args.length == 0) {
      return pattern;
    }
    // Arguments are formatted by toString, so that numbers are not grouped.
    final Object[] strings = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      strings[i] = String.valueOf(args[i]);
    }
    return new MessageFormat(pattern, Locale.ROOT).format(strings);
  }
}

// End CheckingContext.java
