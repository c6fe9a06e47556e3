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
package net.hydromatic.boogie;

import java.util.List;
import net.hydromatic.boogie.compile.CompileException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Boogie tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a throwable whose string contains a given message. */
  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  /** Matches a throwable of a given class whose message matches. */
  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches a list of compile errors whose messages contain the given
   * strings, in order. */
  public static Matcher<List<CompileException>> hasMessages(
      String... messages) {
    return new CustomTypeSafeMatcher<List<CompileException>>(
        "errors with messages " + String.join(", ", messages)) {
      @Override
      protected boolean matchesSafely(List<CompileException> item) {
        if (item.size() != messages.length) {
          return false;
        }
        for (int i = 0; i < messages.length; i++) {
          if (!item.get(i).getMessage().contains(messages[i])) {
            return false;
          }
        }
        return true;
      }
    };
  }
}

// End Matchers.java
