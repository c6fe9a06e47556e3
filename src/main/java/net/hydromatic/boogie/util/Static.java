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
package net.hydromatic.boogie.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function to
   * each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
      case 0:
        return ImmutableList.of();

      case 1:
        return ImmutableList.of(mapper.apply(elements.get(0)));

      default:
        final ImmutableList.Builder<T> b =
            ImmutableList.builderWithExpectedSize(elements.size());
        elements.forEach(e -> b.add(mapper.apply(e)));
        return b.build();
    }
  }

  /** Returns the last index in a list of an element that is identical to a
   * given object, or -1. */
  public static int lastIndexOfIdentical(List<?> list, Object o) {
    for (int i = list.size() - 1; i >= 0; i--) {
      if (list.get(i) == o) {
        return i;
      }
    }
    return -1;
  }

  /** Returns whether a list contains an element identical to a given
   * object. */
  public static boolean containsIdentical(List<?> list, Object o) {
    return lastIndexOfIdentical(list, o) >= 0;
  }

  /** Appends to a list the elements of another that it does not already
   * contain, compared by identity. */
  public static <E> void appendWithoutDups(List<E> list,
      Iterable<? extends E> more) {
    for (E e : more) {
      if (!containsIdentical(list, e)) {
        list.add(e);
      }
    }
  }
}

// End Static.java
