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

import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Program;
import net.hydromatic.boogie.ast.Visitor;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeParamInstantiation;
import net.hydromatic.boogie.type.TypeVariable;

/**
 * Checks that the type of every expression has been fully inferred.
 *
 * <p>Run after a program has been typechecked without errors. An expression
 * whose type, or the instantiation of whose type parameters, still contains
 * a proxy is under-constrained, and is reported as an error.
 */
public class TypeAmbiguitySeeker extends Visitor {
  private final TypecheckingContext tc;

  public TypeAmbiguitySeeker(TypecheckingContext tc) {
    this.tc = requireNonNull(tc);
  }

  /** Checks every declaration of a program. */
  public void check(Program program) {
    program.decls.forEach(this::accept);
  }

  private void check(Ast.Expr expr) {
    check(expr, TypeParamInstantiation.EMPTY);
  }

  private void check(Ast.Expr expr, TypeParamInstantiation instantiation) {
    if (isAmbiguous(expr.type())) {
      report(expr);
      return;
    }
    for (TypeVariable v : instantiation.formalTypeParams()) {
      if (isAmbiguous(instantiation.get(v))) {
        report(expr);
        return;
      }
    }
  }

  private static boolean isAmbiguous(Type type) {
    return !type.freeProxies().isEmpty();
  }

  private void report(Ast.Expr expr) {
    tc.error(expr.pos, "type of {0} could not be inferred", expr);
  }

  @Override
  protected void visit(Ast.Literal literal) {
    check(literal);
  }

  @Override
  protected void visit(Ast.BvLiteral bvLiteral) {
    check(bvLiteral);
  }

  @Override
  protected void visit(Ast.Id id) {
    check(id);
  }

  @Override
  protected void visit(Ast.Old old) {
    check(old);
    super.visit(old);
  }

  @Override
  protected void visit(Ast.Unary unary) {
    check(unary);
    super.visit(unary);
  }

  @Override
  protected void visit(Ast.Binary binary) {
    check(binary);
    super.visit(binary);
  }

  @Override
  protected void visit(Ast.FunctionCall functionCall) {
    check(functionCall, functionCall.instantiation);
    super.visit(functionCall);
  }

  @Override
  protected void visit(Ast.MapSelect mapSelect) {
    check(mapSelect, mapSelect.instantiation);
    super.visit(mapSelect);
  }

  @Override
  protected void visit(Ast.MapStore mapStore) {
    check(mapStore, mapStore.instantiation);
    super.visit(mapStore);
  }

  @Override
  protected void visit(Ast.IfThenElse ifThenElse) {
    check(ifThenElse);
    super.visit(ifThenElse);
  }

  @Override
  protected void visit(Ast.BvExtract bvExtract) {
    check(bvExtract);
    super.visit(bvExtract);
  }

  @Override
  protected void visit(Ast.Quantifier quantifier) {
    check(quantifier);
    super.visit(quantifier);
  }
}

// End TypeAmbiguitySeeker.java
