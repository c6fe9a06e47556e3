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
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // expressions

  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  public Ast.Literal intLiteral(Pos pos, BigInteger value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  public Ast.Literal intLiteral(Pos pos, long value) {
    return intLiteral(pos, BigInteger.valueOf(value));
  }

  public Ast.BvLiteral bvLiteral(Pos pos, BigInteger value, int bits) {
    return new Ast.BvLiteral(pos, value, bits);
  }

  /** Creates an unresolved identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name, null);
  }

  /** Creates an identifier that refers to a variable. */
  public Ast.Id id(Variable v) {
    return new Ast.Id(v.pos, v.name, v);
  }

  public Ast.Old old(Pos pos, Ast.Expr expr) {
    return new Ast.Old(pos, expr);
  }

  public Ast.Unary unary(Pos pos, Op op, Ast.Expr arg) {
    return new Ast.Unary(pos, op, arg);
  }

  public Ast.Unary not(Pos pos, Ast.Expr arg) {
    return unary(pos, Op.NOT, arg);
  }

  public Ast.Binary binary(Pos pos, Op op, Ast.Expr a0, Ast.Expr a1) {
    return new Ast.Binary(pos, op, a0, a1);
  }

  public Ast.Binary and(Ast.Expr a0, Ast.Expr a1) {
    return binary(a0.pos.plus(a1.pos), Op.AND, a0, a1);
  }

  public Ast.Binary equal(Ast.Expr a0, Ast.Expr a1) {
    return binary(a0.pos.plus(a1.pos), Op.EQ, a0, a1);
  }

  public Ast.FunctionCall functionCall(Pos pos, String name,
      List<? extends Ast.Expr> args) {
    return new Ast.FunctionCall(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.MapSelect mapSelect(Pos pos, Ast.Expr map,
      List<? extends Ast.Expr> indexes) {
    return new Ast.MapSelect(pos, map, ImmutableList.copyOf(indexes));
  }

  public Ast.MapStore mapStore(Pos pos, Ast.Expr map,
      List<? extends Ast.Expr> indexes, Ast.Expr value) {
    return new Ast.MapStore(pos, map, ImmutableList.copyOf(indexes), value);
  }

  public Ast.IfThenElse ifThenElse(Pos pos, Ast.Expr condition,
      Ast.Expr ifTrue, Ast.Expr ifFalse) {
    return new Ast.IfThenElse(pos, condition, ifTrue, ifFalse);
  }

  public Ast.BvExtract bvExtract(Pos pos, Ast.Expr bitvector, int end,
      int start) {
    return new Ast.BvExtract(pos, bitvector, end, start);
  }

  public Ast.Quantifier quantifier(Pos pos, Op op,
      List<TypeVariable> typeParameters, List<BoundVariable> dummies,
      Attributes attributes, Ast.Expr body) {
    return new Ast.Quantifier(pos, op, typeParameters,
        ImmutableList.copyOf(dummies), attributes, body);
  }

  public Ast.Quantifier forall(Pos pos, List<TypeVariable> typeParameters,
      List<BoundVariable> dummies, Ast.Expr body) {
    return quantifier(pos, Op.FORALL, typeParameters, dummies,
        new Attributes(), body);
  }

  // commands

  public Ast.Assign assign(Pos pos, List<? extends Ast.Expr> lhss,
      List<? extends Ast.Expr> rhss) {
    return new Ast.Assign(pos, ImmutableList.copyOf(lhss),
        ImmutableList.copyOf(rhss));
  }

  public Ast.Assert assertCmd(Pos pos, Ast.Expr expr) {
    return new Ast.Assert(pos, expr);
  }

  public Ast.Assume assume(Pos pos, Ast.Expr expr) {
    return new Ast.Assume(pos, expr);
  }

  public Ast.Havoc havoc(Pos pos, List<Ast.Id> vars) {
    return new Ast.Havoc(pos, ImmutableList.copyOf(vars));
  }

  public Ast.Call call(Pos pos, String procName,
      List<? extends Ast.Expr> ins, List<Ast.Id> outs) {
    return call(pos, procName, ins, outs, null);
  }

  /** Creates a call to a procedure that is already known. */
  public Ast.Call call(Pos pos, String procName,
      List<? extends Ast.Expr> ins, List<Ast.Id> outs,
      @Nullable Procedure proc) {
    return new Ast.Call(pos, procName, ImmutableList.copyOf(ins),
        ImmutableList.copyOf(outs), proc);
  }

  /** Creates an unresolved goto. */
  public Ast.Goto gotoCmd(Pos pos, List<String> labels) {
    return new Ast.Goto(pos, ImmutableList.copyOf(labels), null);
  }

  /** Creates a goto whose targets are known. */
  public Ast.Goto gotoBlocks(Pos pos, List<Ast.Block> targets) {
    final ImmutableList.Builder<String> labels = ImmutableList.builder();
    targets.forEach(b -> labels.add(b.label));
    return new Ast.Goto(pos, labels.build(), ImmutableList.copyOf(targets));
  }

  public Ast.Return returnCmd(Pos pos) {
    return new Ast.Return(pos);
  }

  public Ast.Block block(Pos pos, String label, List<Ast.Cmd> cmds,
      Ast.Transfer transfer) {
    return new Ast.Block(pos, label, cmds, transfer);
  }

  // declarations

  public TypeCtorDecl typeCtorDecl(Pos pos, Attributes attributes,
      String name, int arity) {
    return new TypeCtorDecl(pos, attributes, name, arity);
  }

  public TypeSynonymDecl typeSynonymDecl(Pos pos, Attributes attributes,
      String name, List<TypeVariable> typeParameters, Type body) {
    return new TypeSynonymDecl(pos, attributes, name, typeParameters, body);
  }

  public GlobalVariable globalVariable(Pos pos, Attributes attributes,
      String name, Type type, Ast.@Nullable Expr where) {
    return new GlobalVariable(pos, attributes, name, type, where);
  }

  public Constant constant(Pos pos, Attributes attributes, String name,
      Type type, boolean unique, @Nullable List<Constant.Parent> parents,
      boolean childrenComplete) {
    return new Constant(pos, attributes, name, type, unique, parents,
        childrenComplete);
  }

  public Formal formal(Pos pos, String name, Type type,
      Ast.@Nullable Expr where, boolean incoming) {
    return new Formal(pos, new Attributes(), name, type, where, incoming);
  }

  public LocalVariable localVariable(Pos pos, Attributes attributes,
      String name, Type type, Ast.@Nullable Expr where) {
    return new LocalVariable(pos, attributes, name, type, where);
  }

  public BoundVariable boundVariable(Pos pos, String name, Type type) {
    return new BoundVariable(pos, new Attributes(), name, type);
  }

  public Function function(Pos pos, Attributes attributes, String name,
      List<TypeVariable> typeParameters, List<Formal> inParams,
      Formal outParam, Ast.@Nullable Expr body) {
    return new Function(pos, attributes, name, typeParameters, inParams,
        outParam, body);
  }

  public Axiom axiom(Pos pos, Attributes attributes, Ast.Expr expr) {
    return new Axiom(pos, attributes, expr);
  }

  public Requires requires(Pos pos, boolean free, Ast.Expr condition,
      Attributes attributes) {
    return new Requires(pos, free, condition, attributes);
  }

  public Ensures ensures(Pos pos, boolean free, Ast.Expr condition,
      Attributes attributes) {
    return new Ensures(pos, free, condition, attributes);
  }

  public Procedure procedure(Pos pos, Attributes attributes, String name,
      List<TypeVariable> typeParameters, List<Formal> inParams,
      List<Formal> outParams, List<Requires> requires,
      List<Ast.Id> modifies, List<Ensures> ensures) {
    return new Procedure(pos, attributes, name, typeParameters, inParams,
        outParams, requires, modifies, ensures);
  }

  public Implementation implementation(Pos pos, Attributes attributes,
      String name, List<TypeVariable> typeParameters,
      List<Formal> inParams, List<Formal> outParams,
      List<LocalVariable> locals, List<Ast.Block> blocks) {
    return new Implementation(pos, attributes, name, typeParameters,
        inParams, outParams, locals, blocks);
  }

  public Program program(List<? extends Declaration> decls) {
    return new Program(ImmutableList.copyOf(decls));
  }
}

// End AstBuilder.java
