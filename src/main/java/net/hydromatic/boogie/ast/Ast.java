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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.BvType;
import net.hydromatic.boogie.type.BvTypeProxy;
import net.hydromatic.boogie.type.ConstrainedProxy;
import net.hydromatic.boogie.type.MapType;
import net.hydromatic.boogie.type.MapTypeProxy;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeParamInstantiation;
import net.hydromatic.boogie.type.TypeProxy;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes: expressions, commands and blocks. */
public class Ast {
  private Ast() {}

  //-----------  Expressions  ---------------------------------

  /** Base class for an expression. */
  public abstract static class Expr extends AstNode {
    /** Type of this expression; null until the expression has been
     * typechecked. */
    public @Nullable Type type;

    Expr(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns the type of this expression; throws if it has not been
     * typechecked. */
    public Type type() {
      checkState(type != null, "expression has not been typechecked: %s",
          this);
      return type;
    }

    /** Binds the names in this expression. */
    public abstract void resolve(ResolutionContext rc);

    /** Computes and checks the type of this expression and its
     * sub-expressions. */
    public abstract void typecheck(TypecheckingContext tc);

    public abstract Expr accept(Shuttle shuttle);
  }

  /** Boolean or integer literal. */
  public static class Literal extends Expr {
    /** Value; a {@link Boolean} or a {@link BigInteger}. */
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.BOOL_LITERAL && value instanceof Boolean
          || op == Op.INT_LITERAL && value instanceof BigInteger);
    }

    /** Returns whether this is the literal {@code false}. */
    public boolean isFalse() {
      return op == Op.BOOL_LITERAL && value.equals(Boolean.FALSE);
    }

    @Override
    public void resolve(ResolutionContext rc) {}

    @Override
    public void typecheck(TypecheckingContext tc) {
      type = op == Op.BOOL_LITERAL ? Type.BOOL : Type.INT;
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(value.toString());
    }
  }

  /** Bit-vector literal, such as {@code 5bv8}. */
  public static class BvLiteral extends Expr {
    public final BigInteger value;
    public final int bits;

    BvLiteral(Pos pos, BigInteger value, int bits) {
      super(pos, Op.BV_LITERAL);
      this.value = requireNonNull(value);
      this.bits = bits;
      checkArgument(value.signum() >= 0 && value.bitLength() <= bits
          || value.signum() == 0, "%s does not fit in %s bits", value, bits);
    }

    @Override
    public void resolve(ResolutionContext rc) {}

    @Override
    public void typecheck(TypecheckingContext tc) {
      type = Types.bvType(bits);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(value + "bv" + bits);
    }
  }

  /** Reference to a variable. */
  public static class Id extends Expr {
    public final String name;
    /** Variable that this identifier refers to; null until resolved. */
    public @Nullable Variable decl;

    Id(Pos pos, String name, @Nullable Variable decl) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
      this.decl = decl;
    }

    /** Returns the variable; throws if this identifier has not been
     * resolved. */
    public Variable decl() {
      checkState(decl != null, "identifier has not been resolved: %s", name);
      return decl;
    }

    @Override
    public void resolve(ResolutionContext rc) {
      if (decl != null) {
        // already resolved
        return;
      }
      decl = rc.lookupVariable(name);
      if (decl == null) {
        rc.error(pos, "undeclared identifier: {0}", name);
      } else if (rc.stateMode() == ResolutionContext.StateMode.STATELESS
          && decl instanceof GlobalVariable) {
        rc.error(pos, "global variables not allowed in this context: {0}",
            name);
      }
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      type = decl().type;
    }

    @Override
    public Id accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name, decl != null ? decl : this);
    }
  }

  /** {@code old(e)}, the value of an expression on entry to a
   * procedure. */
  public static class Old extends Expr {
    public final Expr expr;

    Old(Pos pos, Expr expr) {
      super(pos, Op.OLD);
      this.expr = requireNonNull(expr);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      if (rc.stateMode() != ResolutionContext.StateMode.TWO) {
        rc.error(pos, "old expressions allowed only in two-state contexts");
      }
      expr.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      expr.typecheck(tc);
      type = expr.type();
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("old(").append(expr, 0, 0).append(")");
    }
  }

  /** Call to a prefix operator, {@code !} or {@code -}. */
  public static class Unary extends Expr {
    public final Expr arg;

    Unary(Pos pos, Op op, Expr arg) {
      super(pos, op);
      this.arg = requireNonNull(arg);
      checkArgument(op == Op.NOT || op == Op.NEGATE);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      arg.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      arg.typecheck(tc);
      final Type expected = op == Op.NOT ? Type.BOOL : Type.INT;
      if (!arg.type().unify(expected)) {
        tc.error(pos, "invalid argument type ({0}) to unary operator {1}",
            arg.type, op.opName);
      }
      type = expected;
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, arg, right);
    }
  }

  /** Call to an infix operator. */
  public static class Binary extends Expr {
    public final Expr a0;
    public final Expr a1;

    Binary(Pos pos, Op op, Expr a0, Expr a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isInfix(), "not an infix operator: %s", op);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      a0.resolve(rc);
      a1.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      a0.typecheck(tc);
      a1.typecheck(tc);
      switch (op) {
        case PLUS:
        case MINUS:
        case TIMES:
        case DIV:
        case MOD:
          checkOperands(Type.INT, tc);
          type = Type.INT;
          break;

        case LT:
        case LE:
        case GT:
        case GE:
          checkOperands(Type.INT, tc);
          type = Type.BOOL;
          break;

        case EQ:
        case NE:
        case SUBTYPE:
          if (!a0.type().unify(a1.type())) {
            invalidOperands(tc);
          }
          type = Type.BOOL;
          break;

        case IFF:
        case IMPLIES:
        case OR:
        case AND:
          checkOperands(Type.BOOL, tc);
          type = Type.BOOL;
          break;

        case CONCAT:
          type = concatType(tc);
          break;

        default:
          throw new AssertionError("unknown operator " + op);
      }
    }

    private void checkOperands(Type expected, TypecheckingContext tc) {
      if (!a0.type().unify(expected) || !a1.type().unify(expected)) {
        invalidOperands(tc);
      }
    }

    private void invalidOperands(TypecheckingContext tc) {
      tc.error(pos,
          "invalid argument types ({0} and {1}) to binary operator {2}",
          a0.type, a1.type, op.opName);
    }

    /** Computes the type of a bit-vector concatenation. If the widths of
     * both operands are known, the result width is their sum; otherwise
     * the result is a proxy constrained by the operands. */
    private Type concatType(TypecheckingContext tc) {
      final Type t0 = bvOperand(a0);
      final Type t1 = bvOperand(a1);
      if (!t0.isBv() || !t1.isBv()) {
        tc.error(pos,
            "arguments of bit-vector concatenation must be bit-vectors: "
                + "{0}, {1}",
            a0.type, a1.type);
        return Types.bvType(0);
      }
      final Type f0 = TypeProxy.followProxy(t0.expanded());
      final Type f1 = TypeProxy.followProxy(t1.expanded());
      if (f0 instanceof BvType && f1 instanceof BvType) {
        return Types.bvType(f0.bvBits() + f1.bvBits());
      }
      return new BvTypeProxy(pos, "concat", f0, f1);
    }

    /** Returns the type of an operand of a concatenation; an undetermined
     * type becomes a bit-vector of unknown width. */
    private Type bvOperand(Expr e) {
      final Type t = TypeProxy.followProxy(e.type().expanded());
      if (isUndetermined(t)) {
        final Type p = new BvTypeProxy(e.pos, "bv", 0);
        checkState(t.unify(p));
        return p;
      }
      return t;
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Returns whether a type is a proxy that has no definition and no
   * constraints. */
  static boolean isUndetermined(Type t) {
    return t instanceof TypeProxy
        && !(t instanceof ConstrainedProxy)
        && ((TypeProxy) t).proxyFor() == null;
  }

  /** Application of a function, such as {@code f(x, 1)}. */
  public static class FunctionCall extends Expr {
    public final String name;
    public final ImmutableList<Expr> args;
    /** Function being called; null until resolved. */
    public @Nullable Function function;
    /** Instantiation of the function's type parameters; set by
     * typecheck. */
    public TypeParamInstantiation instantiation = TypeParamInstantiation.EMPTY;

    FunctionCall(Pos pos, String name, ImmutableList<Expr> args) {
      super(pos, Op.APPLY);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      if (function == null) {
        final DeclWithFormals decl = rc.lookupProcedure(name);
        if (decl instanceof Function) {
          function = (Function) decl;
        } else {
          rc.error(pos, "undeclared function: {0}", name);
        }
      }
      args.forEach(arg -> arg.resolve(rc));
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      args.forEach(arg -> arg.typecheck(tc));
      checkState(function != null, "function has not been resolved: %s",
          name);
      final List<Type> actualTypeParams = new ArrayList<>();
      final List<Type> results =
          Types.checkArgumentTypes(function.typeParameters, actualTypeParams,
              Variable.typesOf(function.inParams), args,
              Variable.typesOf(function.outParams), null, pos,
              "application of " + name, tc);
      if (results == null || results.size() != 1) {
        type = new TypeProxy(pos, "error");
        return;
      }
      type = results.get(0);
      if (actualTypeParams.size() == function.typeParameters.size()) {
        instantiation =
            TypeParamInstantiation.from(function.typeParameters,
                actualTypeParams);
      }
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name, function != null ? function : this)
          .append("(").appendAll(args, ", ").append(")");
    }
  }

  /** Matches the indexes of a map select or map store against the type of
   * the map. Returns null, having reported an error, if the map does not
   * have a map type. */
  static Types.@Nullable ArgumentMatch matchMap(Pos pos, Expr map,
      List<Expr> indexes, String opName, TypecheckingContext tc) {
    Type t = TypeProxy.followProxy(map.type().expanded());
    if (isUndetermined(t)) {
      final MapTypeProxy p = new MapTypeProxy(pos, "map", indexes.size());
      checkState(t.unify(p));
      t = p;
    }
    if (t instanceof MapType) {
      return ((MapType) t).checkArgumentTypes(pos, indexes, opName, tc);
    }
    if (t instanceof MapTypeProxy) {
      return ((MapTypeProxy) t).checkArgumentTypes(pos, indexes, opName, tc);
    }
    tc.error(pos, "non-map type ({0}) in " + opName, map.type);
    return null;
  }

  /** Map select, such as {@code m[i, j]}. */
  public static class MapSelect extends Expr {
    public final Expr map;
    public final ImmutableList<Expr> indexes;
    public TypeParamInstantiation instantiation = TypeParamInstantiation.EMPTY;

    MapSelect(Pos pos, Expr map, ImmutableList<Expr> indexes) {
      super(pos, Op.SELECT);
      this.map = requireNonNull(map);
      this.indexes = requireNonNull(indexes);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      map.resolve(rc);
      indexes.forEach(e -> e.resolve(rc));
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      map.typecheck(tc);
      indexes.forEach(e -> e.typecheck(tc));
      final Types.ArgumentMatch match =
          matchMap(pos, map, indexes, "map select", tc);
      if (match == null || match.result == null) {
        type = new TypeProxy(pos, "error");
        return;
      }
      type = match.result;
      instantiation = match.instantiation;
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(map, left, op.left)
          .append("[").appendAll(indexes, ", ").append("]");
    }
  }

  /** Map store, such as {@code m[i := v]}, a map that is the same as
   * {@code m} except at index {@code i}. */
  public static class MapStore extends Expr {
    public final Expr map;
    public final ImmutableList<Expr> indexes;
    public final Expr value;
    public TypeParamInstantiation instantiation = TypeParamInstantiation.EMPTY;

    MapStore(Pos pos, Expr map, ImmutableList<Expr> indexes, Expr value) {
      super(pos, Op.STORE);
      this.map = requireNonNull(map);
      this.indexes = requireNonNull(indexes);
      this.value = requireNonNull(value);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      map.resolve(rc);
      indexes.forEach(e -> e.resolve(rc));
      value.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      map.typecheck(tc);
      indexes.forEach(e -> e.typecheck(tc));
      value.typecheck(tc);
      final Types.ArgumentMatch match =
          matchMap(pos, map, indexes, "map store", tc);
      if (match != null && match.result != null) {
        instantiation = match.instantiation;
        if (!value.type().unify(match.result)) {
          tc.error(value.pos,
              "invalid type of stored value: {0} (expected: {1})",
              value.type, match.result);
        }
      }
      type = map.type();
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(map, left, op.left)
          .append("[").appendAll(indexes, ", ").append(" := ")
          .append(value, 0, 0).append("]");
    }
  }

  /** {@code if c then a else b}. */
  public static class IfThenElse extends Expr {
    public final Expr condition;
    public final Expr ifTrue;
    public final Expr ifFalse;

    IfThenElse(Pos pos, Expr condition, Expr ifTrue, Expr ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      condition.resolve(rc);
      ifTrue.resolve(rc);
      ifFalse.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      condition.typecheck(tc);
      ifTrue.typecheck(tc);
      ifFalse.typecheck(tc);
      if (!condition.type().unify(Type.BOOL)) {
        tc.error(condition.pos,
            "condition of if-then-else must be of type bool: {0}",
            condition.type);
      }
      if (!ifTrue.type().unify(ifFalse.type())) {
        tc.error(pos,
            "branches of if-then-else have incompatible types {0} and {1}",
            ifTrue.type, ifFalse.type);
      }
      type = ifTrue.type();
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, right);
    }
  }

  /** Bit-vector extraction {@code e[end:start]}, bits {@code start}
   * (inclusive) to {@code end} (exclusive). */
  public static class BvExtract extends Expr {
    public final Expr bitvector;
    public final int end;
    public final int start;

    BvExtract(Pos pos, Expr bitvector, int end, int start) {
      super(pos, Op.EXTRACT);
      this.bitvector = requireNonNull(bitvector);
      this.end = end;
      this.start = start;
    }

    @Override
    public void resolve(ResolutionContext rc) {
      bitvector.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      bitvector.typecheck(tc);
      Type t = TypeProxy.followProxy(bitvector.type().expanded());
      if (isUndetermined(t)) {
        final Type p = new BvTypeProxy(pos, "extract", end);
        checkState(t.unify(p));
        t = p;
      }
      if (!t.isBv()) {
        tc.error(pos, "type of bit-vector extraction must be a bit-vector: {0}",
            bitvector.type);
      } else if (start < 0 || start > end
          || !t.unify(new BvTypeProxy(pos, "extract", end))) {
        tc.error(pos, "bit-vector extraction [{0}:{1}] is out of range", end,
            start);
      }
      type = Types.bvType(Math.max(end - start, 0));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(bitvector, left, op.left)
          .append("[" + end + ":" + start + "]");
    }
  }

  /** Universal or existential quantifier, such as
   * {@code (forall<T> x: T :: f(x) == x)}. */
  public static class Quantifier extends Expr {
    /** Type parameters; sorted into order of occurrence by resolve. */
    public List<TypeVariable> typeParameters;
    public final ImmutableList<BoundVariable> dummies;
    public final Attributes attributes;
    public final Expr body;

    Quantifier(Pos pos, Op op, List<TypeVariable> typeParameters,
        ImmutableList<BoundVariable> dummies, Attributes attributes,
        Expr body) {
      super(pos, op);
      checkArgument(op == Op.FORALL || op == Op.EXISTS);
      this.typeParameters = ImmutableList.copyOf(typeParameters);
      this.dummies = requireNonNull(dummies);
      this.attributes = requireNonNull(attributes);
      this.body = requireNonNull(body);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      final int previousState = rc.typeBinderState();
      try {
        typeParameters.forEach(rc::addTypeBinder);
        rc.pushVarContext();
        for (BoundVariable v : dummies) {
          v.register(rc);
          v.resolve(rc);
        }
        attributes.resolve(rc);
        body.resolve(rc);
        rc.popVarContext();
        Types.checkBoundVariableOccurrences(typeParameters,
            Variable.typesOf(dummies), null, pos, "bound variables", rc);
      } finally {
        rc.setTypeBinderState(previousState);
      }
      typeParameters =
          Types.sortTypeParams(typeParameters, Variable.typesOf(dummies),
              null);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      dummies.forEach(v -> v.typecheck(tc));
      attributes.typecheck(tc);
      body.typecheck(tc);
      if (!body.type().unify(Type.BOOL)) {
        tc.error(pos, "body of quantifier must be of type bool");
      }
      type = Type.BOOL;
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op == Op.FORALL ? "(forall" : "(exists");
      DeclWithFormals.unparseTypeParams(w, typeParameters);
      w.append(" ").appendAll(dummies, ", ").append(" :: ");
      attributes.unparse(w);
      return w.append(body, 0, 0).append(")");
    }
  }

  //-----------  Commands  ------------------------------------

  /** Base class for a command. */
  public abstract static class Cmd extends AstNode {
    Cmd(Pos pos, Op op) {
      super(pos, op);
    }

    public abstract void resolve(ResolutionContext rc);

    public abstract void typecheck(TypecheckingContext tc);

    public abstract Cmd accept(Shuttle shuttle);

    /** Adds to a list the variables that this command assigns. */
    public void addAssignedVariables(List<Variable> variables) {}

    /** Reports an error if a variable may not be assigned. */
    static void checkMutable(@Nullable Variable v, Pos pos,
        ResolutionContext rc) {
      if (v != null && !v.isMutable()) {
        rc.error(pos, "command assigns to an immutable variable: {0}",
            v.name);
      }
    }

    /** Reports an error if a global variable is assigned but is not in the
     * modifies clause of the enclosing procedure. */
    static void checkModifies(@Nullable Variable v, Pos pos,
        TypecheckingContext tc) {
      if (v instanceof GlobalVariable && !tc.inFrame(v)) {
        tc.error(pos, "command assigns to a global variable that is not in "
            + "the modifies clause of the enclosing procedure: {0}", v.name);
      }
    }
  }

  /** Parallel assignment, such as {@code x, m[i] := e1, e2}. Each
   * left-hand side is an identifier or a map select whose innermost map is
   * an identifier. */
  public static class Assign extends Cmd {
    public final ImmutableList<Expr> lhss;
    public final ImmutableList<Expr> rhss;

    Assign(Pos pos, ImmutableList<Expr> lhss, ImmutableList<Expr> rhss) {
      super(pos, Op.ASSIGN);
      this.lhss = requireNonNull(lhss);
      this.rhss = requireNonNull(rhss);
      for (Expr lhs : lhss) {
        checkArgument(isLhs(lhs), "not an assignable expression: %s", lhs);
      }
    }

    private static boolean isLhs(Expr e) {
      return e instanceof Id
          || e instanceof MapSelect && isLhs(((MapSelect) e).map);
    }

    /** Returns the identifier assigned by a left-hand side. */
    public static Id assignedId(Expr lhs) {
      return lhs instanceof MapSelect
          ? assignedId(((MapSelect) lhs).map)
          : (Id) lhs;
    }

    @Override
    public void resolve(ResolutionContext rc) {
      if (lhss.size() != rhss.size()) {
        rc.error(pos, "number of left-hand sides does not match number of "
            + "right-hand sides");
      }
      lhss.forEach(e -> e.resolve(rc));
      rhss.forEach(e -> e.resolve(rc));
      for (Expr lhs : lhss) {
        final Id id = assignedId(lhs);
        checkMutable(id.decl, id.pos, rc);
      }
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      lhss.forEach(e -> e.typecheck(tc));
      rhss.forEach(e -> e.typecheck(tc));
      for (Expr lhs : lhss) {
        final Id id = assignedId(lhs);
        checkModifies(id.decl, id.pos, tc);
      }
      for (int i = 0; i < Math.min(lhss.size(), rhss.size()); i++) {
        final Expr lhs = lhss.get(i);
        final Expr rhs = rhss.get(i);
        if (!lhs.type().unify(rhs.type())) {
          tc.error(rhs.pos, "mismatched types in assignment command "
              + "(cannot assign {0} to {1})", rhs.type, lhs.type);
        }
      }
    }

    @Override
    public void addAssignedVariables(List<Variable> variables) {
      for (Expr lhs : lhss) {
        final Id id = assignedId(lhs);
        if (id.decl != null) {
          variables.add(id.decl);
        }
      }
    }

    @Override
    public Cmd accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(lhss, ", ").append(" := ").appendAll(rhss, ", ")
          .append(";");
    }
  }

  /** Command that states a predicate; {@link Assert} or {@link Assume}. */
  public abstract static class PredicateCmd extends Cmd {
    public final Expr expr;

    PredicateCmd(Pos pos, Op op, Expr expr) {
      super(pos, op);
      this.expr = requireNonNull(expr);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      expr.resolve(rc);
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      expr.typecheck(tc);
      if (!expr.type().unify(Type.BOOL)) {
        tc.error(pos, "assert/assume expressions must be of type bool");
      }
    }

    /** Returns whether the predicate is the literal {@code false}, so that
     * execution cannot continue past this command. */
    public boolean isFalse() {
      return expr instanceof Literal && ((Literal) expr).isFalse();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op == Op.ASSERT ? "assert " : "assume ")
          .append(expr, 0, 0).append(";");
    }
  }

  /** {@code assert e}. */
  public static class Assert extends PredicateCmd {
    Assert(Pos pos, Expr expr) {
      super(pos, Op.ASSERT, expr);
    }

    @Override
    public Cmd accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code assume e}. */
  public static class Assume extends PredicateCmd {
    Assume(Pos pos, Expr expr) {
      super(pos, Op.ASSUME, expr);
    }

    @Override
    public Cmd accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code havoc x, y}, which assigns arbitrary values to variables. */
  public static class Havoc extends Cmd {
    public final ImmutableList<Id> vars;

    Havoc(Pos pos, ImmutableList<Id> vars) {
      super(pos, Op.HAVOC);
      this.vars = requireNonNull(vars);
    }

    @Override
    public void resolve(ResolutionContext rc) {
      for (Id id : vars) {
        id.resolve(rc);
        checkMutable(id.decl, id.pos, rc);
      }
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      for (Id id : vars) {
        id.typecheck(tc);
        checkModifies(id.decl, id.pos, tc);
      }
    }

    @Override
    public void addAssignedVariables(List<Variable> variables) {
      for (Id id : vars) {
        if (id.decl != null) {
          variables.add(id.decl);
        }
      }
    }

    @Override
    public Cmd accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("havoc ").appendAll(vars, ", ").append(";");
    }
  }

  /** Procedure call, such as {@code call r := P(x)}. */
  public static class Call extends Cmd {
    public final String procName;
    public final ImmutableList<Expr> ins;
    public final ImmutableList<Id> outs;
    /** Procedure being called; null until resolved. */
    public @Nullable Procedure proc;
    public TypeParamInstantiation instantiation = TypeParamInstantiation.EMPTY;

    Call(Pos pos, String procName, ImmutableList<Expr> ins,
        ImmutableList<Id> outs, @Nullable Procedure proc) {
      super(pos, Op.CALL);
      this.procName = requireNonNull(procName);
      this.ins = requireNonNull(ins);
      this.outs = requireNonNull(outs);
      this.proc = proc;
    }

    @Override
    public void resolve(ResolutionContext rc) {
      if (proc == null) {
        final DeclWithFormals decl = rc.lookupProcedure(procName);
        if (decl instanceof Procedure) {
          proc = (Procedure) decl;
        } else {
          rc.error(pos, "undeclared procedure: {0}", procName);
        }
      }
      ins.forEach(e -> e.resolve(rc));
      for (Id id : outs) {
        id.resolve(rc);
        checkMutable(id.decl, id.pos, rc);
      }
    }

    @Override
    public void typecheck(TypecheckingContext tc) {
      ins.forEach(e -> e.typecheck(tc));
      outs.forEach(e -> e.typecheck(tc));
      checkState(proc != null, "procedure has not been resolved: %s",
          procName);
      final List<Type> actualTypeParams = new ArrayList<>();
      Types.checkArgumentTypes(proc.typeParameters, actualTypeParams,
          Variable.typesOf(proc.inParams), ins,
          Variable.typesOf(proc.outParams), outs, pos, "call to " + procName,
          tc);
      if (actualTypeParams.size() == proc.typeParameters.size()) {
        instantiation =
            TypeParamInstantiation.from(proc.typeParameters,
                actualTypeParams);
      }
      for (Id id : outs) {
        checkModifies(id.decl, id.pos, tc);
      }
      for (Id id : proc.modifies) {
        if (id.decl != null && !tc.inFrame(id.decl)) {
          tc.error(pos, "call to {0} modifies {1}, which is not in the "
              + "modifies clause of the caller", procName, id.name);
        }
      }
    }

    @Override
    public void addAssignedVariables(List<Variable> variables) {
      for (Id id : outs) {
        if (id.decl != null) {
          variables.add(id.decl);
        }
      }
      if (proc != null) {
        for (Id id : proc.modifies) {
          if (id.decl != null) {
            variables.add(id.decl);
          }
        }
      }
    }

    @Override
    public Cmd accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("call ");
      if (!outs.isEmpty()) {
        w.appendAll(outs, ", ").append(" := ");
      }
      return w.id(procName, proc != null ? proc : this)
          .append("(").appendAll(ins, ", ").append(");");
    }
  }

  //-----------  Transfers and blocks  ------------------------

  /** Command that ends a block; {@link Goto} or {@link Return}. */
  public abstract static class Transfer extends AstNode {
    Transfer(Pos pos, Op op) {
      super(pos, op);
    }

    public void resolve(ResolutionContext rc) {}

    /** Returns the blocks that control may pass to. */
    public abstract List<Block> successors();
  }

  /** {@code goto L1, L2}, a non-deterministic jump. */
  public static class Goto extends Transfer {
    public final ImmutableList<String> labels;
    /** Target blocks, parallel to {@link #labels}; null until resolved. */
    public @Nullable ImmutableList<Block> targets;

    Goto(Pos pos, ImmutableList<String> labels,
        @Nullable ImmutableList<Block> targets) {
      super(pos, Op.GOTO);
      this.labels = requireNonNull(labels);
      this.targets = targets;
      checkArgument(!labels.isEmpty(), "goto must have a target");
      checkArgument(targets == null || targets.size() == labels.size());
    }

    @Override
    public void resolve(ResolutionContext rc) {
      if (targets != null) {
        // already resolved
        return;
      }
      final ImmutableList.Builder<Block> b = ImmutableList.builder();
      boolean ok = true;
      for (String label : labels) {
        final Block block = rc.lookupBlock(label);
        if (block == null) {
          rc.error(pos, "undeclared label: {0}", label);
          ok = false;
        } else {
          b.add(block);
        }
      }
      if (ok) {
        targets = b.build();
      }
    }

    @Override
    public List<Block> successors() {
      checkState(targets != null, "goto has not been resolved: %s", labels);
      return targets;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("goto ");
      for (int i = 0; i < labels.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.id(labels.get(i), targets != null ? targets.get(i) : this);
      }
      return w.append(";");
    }
  }

  /** {@code return}. */
  public static class Return extends Transfer {
    Return(Pos pos) {
      super(pos, Op.RETURN);
    }

    @Override
    public List<Block> successors() {
      return ImmutableList.of();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("return;");
    }
  }

  /**
   * Basic block: a label, a sequence of commands and a transfer.
   *
   * <p>The commands and the transfer may be replaced by transformations.
   * Predecessors are derived by
   * {@link Implementation#computePredecessors()}.
   */
  public static class Block extends AstNode {
    public final String label;
    public final List<Cmd> cmds;
    public Transfer transfer;
    public final List<Block> predecessors = new ArrayList<>();

    Block(Pos pos, String label, List<Cmd> cmds, Transfer transfer) {
      super(pos, Op.BLOCK);
      this.label = requireNonNull(label);
      this.cmds = new ArrayList<>(cmds);
      this.transfer = requireNonNull(transfer);
    }

    /** Returns the blocks that control may pass to. */
    public List<Block> successors() {
      return transfer.successors();
    }

    public void register(ResolutionContext rc) {
      rc.addBlock(this);
    }

    public void resolve(ResolutionContext rc) {
      cmds.forEach(c -> c.resolve(rc));
      transfer.resolve(rc);
    }

    public void typecheck(TypecheckingContext tc) {
      cmds.forEach(c -> c.typecheck(tc));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.id(label, this).append(":").indent();
      for (Cmd cmd : cmds) {
        w.newline().append(cmd, 0, 0);
      }
      return w.newline().append(transfer, 0, 0).outdent();
    }
  }
}

// End Ast.java
