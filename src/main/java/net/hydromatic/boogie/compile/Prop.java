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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how a program is checked, transformed and written.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Boolean property "overlookTypeErrors" controls what happens when an
   * implementation has resolution errors. If true, the implementation is
   * removed from the program, a warning is issued, and its errors do not
   * count. Default is false.
   */
  OVERLOOK_TYPE_ERRORS("overlookTypeErrors", Boolean.class, true, false),

  /**
   * Boolean property "printWithUniqueIds" controls whether identifiers and
   * block labels are written with the unique id of the node, for example
   * "x#12". Default is false.
   */
  PRINT_WITH_UNIQUE_IDS("printWithUniqueIds", Boolean.class, true, false),

  /** Number of spaces per level of indentation when writing a program. */
  INDENT_SIZE("indentSize", Integer.class, true, 2),

  /**
   * Boolean property "inlineLoops" controls whether the procedures generated
   * by loop extraction are marked {@code {:inline 1}}. Default is false.
   */
  INLINE_LOOPS("inlineLoops", Boolean.class, true, false),

  /**
   * Boolean property "pruneUnreachableBlocks" controls whether unreachable
   * blocks are removed from implementations after a successful typecheck.
   * Default is false.
   */
  PRUNE_UNREACHABLE_BLOCKS("pruneUnreachableBlocks", Boolean.class, true,
      false);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /**
   * Sets the value of a property, converting from a string if necessary;
   * for example "true" for a boolean property or "4" for an integer
   * property.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim().toLowerCase(Locale.ROOT);
      if (type == Boolean.class) {
        checkArgument(s.equals("true") || s.equals("false"),
            "value for property %s must be true or false", camelName);
        set(map, Boolean.valueOf(s));
        return;
      }
      if (type == Integer.class) {
        final Integer i = Ints.tryParse(s);
        checkArgument(i != null,
            "value for property %s must be an integer", camelName);
        set(map, i);
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      checkArgument(!required, "property %s is required", camelName);
      map.remove(this);
    } else {
      checkArgument(type.isInstance(value),
          "value for property %s must have type %s", camelName, type);
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
