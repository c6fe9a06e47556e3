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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  BV_LITERAL(true),

  // atoms that look like calls
  OLD(true),
  APPLY(true),
  FORALL(true),
  EXISTS(true),

  // postfix
  SELECT("[]", 10),
  STORE("[:=]", 10),
  EXTRACT("[:]", 10),

  // prefix
  NOT("!", 9),
  NEGATE("-", 9),

  // infix
  IFF(" <==> ", 1),
  IMPLIES(" ==> ", 2, false),
  OR(" || ", 3),
  AND(" && ", 4),
  EQ(" == ", 5),
  NE(" != ", 5),
  LT(" < ", 5),
  LE(" <= ", 5),
  GT(" > ", 5),
  GE(" >= ", 5),
  SUBTYPE(" <: ", 5),
  CONCAT(" ++ ", 6),
  PLUS(" + ", 7),
  MINUS(" - ", 7),
  TIMES(" * ", 8),
  DIV(" div ", 8),
  MOD(" mod ", 8),

  IF("if", 0),

  // commands
  ASSIGN,
  ASSERT,
  ASSUME,
  HAVOC,
  CALL,
  GOTO,
  RETURN,
  BLOCK,

  // declarations
  TYPE_DECL,
  TYPE_SYNONYM_DECL,
  CONST_DECL,
  VAR_DECL,
  FORMAL,
  LOCAL,
  BOUND,
  FUNCTION_DECL,
  AXIOM_DECL,
  PROCEDURE_DECL,
  IMPLEMENTATION_DECL,
  REQUIRES,
  ENSURES;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator name, e.g. "+"; null if this is not an operator. */
  public final @Nullable String opName;

  /** Infix and prefix operators, keyed by {@link #opName}. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isInfix()) {
        b.put(op.opName, op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.opName = padded.isEmpty() ? null : padded.trim();
  }

  /** Returns whether this is a binary operator written between its
   * operands. */
  public boolean isInfix() {
    return padded.startsWith(" ");
  }

  /** Returns whether this is a comparison. Comparisons do not associate;
   * {@code a == b == c} is not valid. */
  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case SUBTYPE:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
