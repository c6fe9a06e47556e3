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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Attributes of a declaration, quantifier or contract clause; for example
 * <code>{:inline 1} {:msg "x must be positive"}</code>.
 *
 * <p>Each attribute has a key and a list of parameters. A parameter is
 * either an {@link Ast.Expr} or a {@link String}. A key may occur more than
 * once; attributes keep the order in which they were written.
 */
public class Attributes {
  private final ListMultimap<String, ImmutableList<Object>> map =
      LinkedListMultimap.create();

  /** Returns whether there are no attributes. */
  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns the attributes as a list of key-parameters pairs, in order. */
  public List<Map.Entry<String, ImmutableList<Object>>> entries() {
    return ImmutableList.copyOf(map.entries());
  }

  /** Adds an attribute after the existing ones. */
  public Attributes add(String key, List<?> params) {
    for (Object param : params) {
      checkParam(param);
    }
    map.put(key, ImmutableList.copyOf(params));
    return this;
  }

  /**
   * Adds a parameter to an attribute.
   *
   * <p>If an attribute with this key exists, the parameter is appended to
   * the first one; otherwise a new attribute is created before all existing
   * attributes.
   */
  public void addAttribute(String key, Object param) {
    checkParam(param);
    final List<ImmutableList<Object>> values = map.get(key);
    if (!values.isEmpty()) {
      values.set(0,
          ImmutableList.builder().addAll(values.get(0)).add(param).build());
      return;
    }
    final List<Map.Entry<String, ImmutableList<Object>>> entries =
        ImmutableList.copyOf(map.entries());
    map.clear();
    map.put(key, ImmutableList.of(param));
    entries.forEach(e -> map.put(e.getKey(), e.getValue()));
  }

  private static void checkParam(Object param) {
    if (!(param instanceof Ast.Expr) && !(param instanceof String)) {
      throw new IllegalArgumentException("attribute parameter must be an "
          + "expression or a string: " + param);
    }
  }

  /** Returns the parameter of the first attribute with a given key that has
   * a single parameter of a given class, or null. */
  private <T> @Nullable T findSingle(String key, Class<T> clazz) {
    for (List<Object> params : map.get(key)) {
      if (params.size() == 1 && clazz.isInstance(params.get(0))) {
        return clazz.cast(params.get(0));
      }
    }
    return null;
  }

  /** Returns the expression of an attribute with a single expression
   * parameter, such as <code>{:inline 1}</code>; or null. */
  public Ast.@Nullable Expr findExprAttribute(String key) {
    return findSingle(key, Ast.Expr.class);
  }

  /** Returns the string of an attribute with a single string parameter,
   * such as <code>{:msg "oops"}</code>; or null. */
  public @Nullable String findStringAttribute(String key) {
    return findSingle(key, String.class);
  }

  /** Returns the value of a boolean attribute, such as
   * <code>{:verify false}</code>, or a default value if there is no such
   * attribute. */
  public boolean checkBooleanAttribute(String key, boolean defaultValue) {
    final Ast.Expr e = findExprAttribute(key);
    if (e instanceof Ast.Literal && e.op == Op.BOOL_LITERAL) {
      return (Boolean) ((Ast.Literal) e).value;
    }
    return defaultValue;
  }

  /** Returns the value of an integer attribute, such as
   * <code>{:inline 2}</code>, or a default value if there is no such
   * attribute or its value does not fit in an {@code int}. */
  public int checkIntAttribute(String key, int defaultValue) {
    final Ast.Expr e = findExprAttribute(key);
    if (e instanceof Ast.Literal && e.op == Op.INT_LITERAL) {
      final BigInteger i = (BigInteger) ((Ast.Literal) e).value;
      if (i.bitLength() < 32) {
        return i.intValue();
      }
    }
    return defaultValue;
  }

  /** Resolves the expression parameters. */
  public void resolve(ResolutionContext rc) {
    forEachExpr(e -> e.resolve(rc));
  }

  /** Typechecks the expression parameters. */
  public void typecheck(TypecheckingContext tc) {
    forEachExpr(e -> e.typecheck(tc));
  }

  /** Calls an action for each expression parameter. */
  public void forEachExpr(Consumer<Ast.Expr> action) {
    map.values().forEach(params ->
        params.forEach(p -> {
          if (p instanceof Ast.Expr) {
            action.accept((Ast.Expr) p);
          }
        }));
  }

  /** Writes each attribute followed by a space. */
  AstWriter unparse(AstWriter w) {
    map.entries().forEach(e -> {
      w.append("{:").append(e.getKey());
      String sep = " ";
      for (Object param : e.getValue()) {
        w.append(sep);
        sep = ", ";
        if (param instanceof String) {
          w.append("\"").append((String) param).append("\"");
        } else {
          w.append((Ast.Expr) param, 0, 0);
        }
      }
      w.append("} ");
    });
    return w;
  }
}

// End Attributes.java
