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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.BvLiteral bvLiteral) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Old old) {
    old.expr.accept(this);
  }

  protected void visit(Ast.Unary unary) {
    unary.arg.accept(this);
  }

  protected void visit(Ast.Binary binary) {
    binary.a0.accept(this);
    binary.a1.accept(this);
  }

  protected void visit(Ast.FunctionCall functionCall) {
    functionCall.args.forEach(this::accept);
  }

  protected void visit(Ast.MapSelect mapSelect) {
    mapSelect.map.accept(this);
    mapSelect.indexes.forEach(this::accept);
  }

  protected void visit(Ast.MapStore mapStore) {
    mapStore.map.accept(this);
    mapStore.indexes.forEach(this::accept);
    mapStore.value.accept(this);
  }

  protected void visit(Ast.IfThenElse ifThenElse) {
    ifThenElse.condition.accept(this);
    ifThenElse.ifTrue.accept(this);
    ifThenElse.ifFalse.accept(this);
  }

  protected void visit(Ast.BvExtract bvExtract) {
    bvExtract.bitvector.accept(this);
  }

  protected void visit(Ast.Quantifier quantifier) {
    quantifier.dummies.forEach(this::accept);
    quantifier.attributes.forEachExpr(this::accept);
    quantifier.body.accept(this);
  }

  // commands

  protected void visit(Ast.Assign assign) {
    assign.lhss.forEach(this::accept);
    assign.rhss.forEach(this::accept);
  }

  protected void visit(Ast.Assert assertCmd) {
    assertCmd.expr.accept(this);
  }

  protected void visit(Ast.Assume assume) {
    assume.expr.accept(this);
  }

  protected void visit(Ast.Havoc havoc) {
    havoc.vars.forEach(this::accept);
  }

  protected void visit(Ast.Call call) {
    call.ins.forEach(this::accept);
    call.outs.forEach(this::accept);
  }

  protected void visit(Ast.Goto gotoCmd) {}

  protected void visit(Ast.Return returnCmd) {}

  protected void visit(Ast.Block block) {
    block.cmds.forEach(this::accept);
    block.transfer.accept(this);
  }

  // declarations

  protected void visit(TypeCtorDecl typeCtorDecl) {
    typeCtorDecl.attributes.forEachExpr(this::accept);
  }

  protected void visit(TypeSynonymDecl typeSynonymDecl) {
    typeSynonymDecl.attributes.forEachExpr(this::accept);
  }

  /** Visits the parts common to all kinds of variable. */
  protected void visitVariable(Variable variable) {
    variable.attributes.forEachExpr(this::accept);
    if (variable.where != null) {
      variable.where.accept(this);
    }
  }

  protected void visit(GlobalVariable globalVariable) {
    visitVariable(globalVariable);
  }

  protected void visit(Constant constant) {
    visitVariable(constant);
    if (constant.parents != null) {
      constant.parents.forEach(parent -> parent.id.accept(this));
    }
  }

  protected void visit(Formal formal) {
    visitVariable(formal);
  }

  protected void visit(LocalVariable localVariable) {
    visitVariable(localVariable);
  }

  protected void visit(BoundVariable boundVariable) {
    visitVariable(boundVariable);
  }

  protected void visit(Function function) {
    function.attributes.forEachExpr(this::accept);
    function.inParams.forEach(this::accept);
    function.outParams.forEach(this::accept);
    if (function.body != null) {
      function.body.accept(this);
    }
  }

  protected void visit(Axiom axiom) {
    axiom.attributes.forEachExpr(this::accept);
    axiom.expr.accept(this);
  }

  protected void visit(Requires requires) {
    requires.attributes.forEachExpr(this::accept);
    requires.condition.accept(this);
  }

  protected void visit(Ensures ensures) {
    ensures.attributes.forEachExpr(this::accept);
    ensures.condition.accept(this);
  }

  protected void visit(Procedure procedure) {
    procedure.attributes.forEachExpr(this::accept);
    procedure.inParams.forEach(this::accept);
    procedure.outParams.forEach(this::accept);
    procedure.requires.forEach(this::accept);
    procedure.modifies.forEach(this::accept);
    procedure.ensures.forEach(this::accept);
  }

  protected void visit(Implementation implementation) {
    implementation.attributes.forEachExpr(this::accept);
    implementation.inParams.forEach(this::accept);
    implementation.outParams.forEach(this::accept);
    implementation.locals.forEach(this::accept);
    implementation.blocks.forEach(this::accept);
  }
}

// End Visitor.java
