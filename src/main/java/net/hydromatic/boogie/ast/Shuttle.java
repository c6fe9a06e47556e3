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

import static net.hydromatic.boogie.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Visits and transforms expressions and commands.
 *
 * <p>Each {@code visit} method returns a copy of its node whose children
 * have been transformed. Leaves, such as literals and identifiers, are
 * returned unchanged. A copy of a function application or a procedure call
 * refers to the same function or procedure as the original.
 */
public class Shuttle {
  protected <E extends AstNode> ImmutableList<E> visitList(
      List<? extends E> nodes, UnaryOperator<E> fn) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    for (E node : nodes) {
      b.add(fn.apply(node));
    }
    return b.build();
  }

  protected ImmutableList<Ast.Expr> visitExprs(List<Ast.Expr> exprs) {
    return visitList(exprs, e -> e.accept(this));
  }

  protected ImmutableList<Ast.Id> visitIds(List<Ast.Id> ids) {
    return visitList(ids, id -> id.accept(this));
  }

  /** Transforms a list of commands. */
  public ImmutableList<Ast.Cmd> visitCmds(List<Ast.Cmd> cmds) {
    return visitList(cmds, c -> c.accept(this));
  }

  // expressions

  protected Ast.Expr visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Expr visit(Ast.BvLiteral bvLiteral) {
    return bvLiteral; // leaf
  }

  protected Ast.Id visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Expr visit(Ast.Old old) {
    return ast.old(old.pos, old.expr.accept(this));
  }

  protected Ast.Expr visit(Ast.Unary unary) {
    return ast.unary(unary.pos, unary.op, unary.arg.accept(this));
  }

  protected Ast.Expr visit(Ast.Binary binary) {
    return ast.binary(binary.pos, binary.op, binary.a0.accept(this),
        binary.a1.accept(this));
  }

  protected Ast.Expr visit(Ast.FunctionCall functionCall) {
    final Ast.FunctionCall copy =
        ast.functionCall(functionCall.pos, functionCall.name,
            visitExprs(functionCall.args));
    copy.function = functionCall.function;
    return copy;
  }

  protected Ast.Expr visit(Ast.MapSelect mapSelect) {
    return ast.mapSelect(mapSelect.pos, mapSelect.map.accept(this),
        visitExprs(mapSelect.indexes));
  }

  protected Ast.Expr visit(Ast.MapStore mapStore) {
    return ast.mapStore(mapStore.pos, mapStore.map.accept(this),
        visitExprs(mapStore.indexes), mapStore.value.accept(this));
  }

  protected Ast.Expr visit(Ast.IfThenElse ifThenElse) {
    return ast.ifThenElse(ifThenElse.pos,
        ifThenElse.condition.accept(this), ifThenElse.ifTrue.accept(this),
        ifThenElse.ifFalse.accept(this));
  }

  protected Ast.Expr visit(Ast.BvExtract bvExtract) {
    return ast.bvExtract(bvExtract.pos, bvExtract.bitvector.accept(this),
        bvExtract.end, bvExtract.start);
  }

  protected Ast.Expr visit(Ast.Quantifier quantifier) {
    return ast.quantifier(quantifier.pos, quantifier.op,
        quantifier.typeParameters, quantifier.dummies,
        quantifier.attributes, quantifier.body.accept(this));
  }

  // commands

  protected Ast.Cmd visit(Ast.Assign assign) {
    return ast.assign(assign.pos, visitExprs(assign.lhss),
        visitExprs(assign.rhss));
  }

  protected Ast.Cmd visit(Ast.Assert assertCmd) {
    return ast.assertCmd(assertCmd.pos, assertCmd.expr.accept(this));
  }

  protected Ast.Cmd visit(Ast.Assume assume) {
    return ast.assume(assume.pos, assume.expr.accept(this));
  }

  protected Ast.Cmd visit(Ast.Havoc havoc) {
    return ast.havoc(havoc.pos, visitIds(havoc.vars));
  }

  protected Ast.Cmd visit(Ast.Call call) {
    return ast.call(call.pos, call.procName, visitExprs(call.ins),
        visitIds(call.outs), call.proc);
  }
}

// End Shuttle.java
