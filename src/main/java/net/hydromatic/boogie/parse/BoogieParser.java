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
package net.hydromatic.boogie.parse;

import static net.hydromatic.boogie.ast.AstBuilder.ast;
import static net.hydromatic.boogie.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Attributes;
import net.hydromatic.boogie.ast.Axiom;
import net.hydromatic.boogie.ast.BoundVariable;
import net.hydromatic.boogie.ast.Constant;
import net.hydromatic.boogie.ast.Declaration;
import net.hydromatic.boogie.ast.Ensures;
import net.hydromatic.boogie.ast.Formal;
import net.hydromatic.boogie.ast.Function;
import net.hydromatic.boogie.ast.GlobalVariable;
import net.hydromatic.boogie.ast.LocalVariable;
import net.hydromatic.boogie.ast.Op;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.Procedure;
import net.hydromatic.boogie.ast.Program;
import net.hydromatic.boogie.ast.Requires;
import net.hydromatic.boogie.type.MapType;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.UnresolvedTypeIdentifier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads the text of a program and builds an unresolved abstract syntax
 * tree.
 *
 * <p>Accepts the text that {@link Program#unparse} writes, and a few
 * conveniences: the commands of an implementation need not be labeled, a
 * block that does not end in {@code goto} or {@code return} falls through
 * to the next block, and a procedure may have a body, in which case it is
 * also an implementation.
 */
public class BoogieParser {
  private static final Set<Op> COMPARISON_OPS =
      EnumSet.copyOf(
          Sets.filter(EnumSet.allOf(Op.class), Op::isComparison));

  private final Lexer lexer;
  private final List<Lexer.Token> tokens;
  private int i;

  public BoogieParser(String file, String text) {
    this.lexer = new Lexer(file, text);
    this.tokens = lexer.scan();
  }

  /** Parses a program that is not in a file. */
  public static Program parse(String text) {
    return new BoogieParser("", text).program();
  }

  //-----------  Entry points  --------------------------------

  /** Parses a whole program. */
  public Program program() {
    final List<Declaration> decls = new ArrayList<>();
    while (peek().kind != Lexer.TokenKind.EOF) {
      declaration(decls);
    }
    return ast.program(decls);
  }

  /** Parses an expression, which must be the whole input. */
  public Ast.Expr expressionEof() {
    final Ast.Expr e = expression();
    expectEof();
    return e;
  }

  /** Parses a type, which must be the whole input. */
  public Type typeEof() {
    final Type type = type();
    expectEof();
    return type;
  }

  //-----------  Tokens  --------------------------------------

  private Lexer.Token peek() {
    return tokens.get(i);
  }

  private Lexer.Token peek(int k) {
    return tokens.get(Math.min(i + k, tokens.size() - 1));
  }

  private Lexer.Token next() {
    final Lexer.Token t = tokens.get(i);
    if (t.kind != Lexer.TokenKind.EOF) {
      ++i;
    }
    return t;
  }

  private boolean at(String s) {
    return peek().is(s);
  }

  private boolean accept(String s) {
    if (at(s)) {
      ++i;
      return true;
    }
    return false;
  }

  private void expect(String s) {
    if (!accept(s)) {
      throw error("expected '" + s + "'");
    }
  }

  private void expectEof() {
    if (peek().kind != Lexer.TokenKind.EOF) {
      throw error("expected end of input");
    }
  }

  private boolean atIdentifier() {
    return peek().kind == Lexer.TokenKind.ID;
  }

  private String identifier() {
    if (!atIdentifier()) {
      throw error("expected identifier");
    }
    return next().text;
  }

  /** Returns the position from the start of a token to the end of the
   * most recently consumed token. */
  private Pos pos(Lexer.Token start) {
    final Lexer.Token last = tokens.get(Math.max(i - 1, 0));
    return lexer.pos(start.start, Math.max(start.end, last.end));
  }

  private ParseException error(String message) {
    final Lexer.Token t = peek();
    return new ParseException(message + ", found " + t,
        lexer.pos(t.start, t.end));
  }

  //-----------  Declarations  --------------------------------

  private void declaration(List<Declaration> decls) {
    final Lexer.Token t = peek();
    switch (t.kind == Lexer.TokenKind.KEYWORD ? t.text : "") {
      case "type":
        decls.add(typeDecl());
        break;
      case "const":
        decls.add(constant());
        break;
      case "var":
        decls.add(globalVariable());
        break;
      case "function":
        decls.add(function());
        break;
      case "axiom":
        decls.add(axiom());
        break;
      case "procedure":
        procedure(decls);
        break;
      case "implementation":
        decls.add(implementation());
        break;
      default:
        throw error("expected declaration");
    }
  }

  /** Parses a type constructor, {@code type T _ _;}, or a type synonym,
   * {@code type S a = [a]int;}. */
  private Declaration typeDecl() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final String name = identifier();
    final List<TypeVariable> params = new ArrayList<>();
    while (atIdentifier()) {
      final Lexer.Token t = next();
      params.add(new TypeVariable(pos(t), t.text));
    }
    if (accept("=")) {
      final Type body = type();
      expect(";");
      return ast.typeSynonymDecl(pos(start), attributes, name, params, body);
    }
    expect(";");
    return ast.typeCtorDecl(pos(start), attributes, name, params.size());
  }

  private Constant constant() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final boolean unique = accept("unique");
    final String name = identifier();
    expect(":");
    final Type type = type();
    @Nullable List<Constant.Parent> parents = null;
    boolean complete = false;
    if (accept("extends")) {
      parents = new ArrayList<>();
      if (!at("complete") && !at(";")) {
        do {
          final boolean parentUnique = accept("unique");
          final Lexer.Token t = peek();
          final String parentName = identifier();
          parents.add(
              new Constant.Parent(parentUnique,
                  ast.id(pos(t), parentName)));
        } while (accept(","));
      }
      complete = accept("complete");
    }
    expect(";");
    return ast.constant(pos(start), attributes, name, type, unique, parents,
        complete);
  }

  private GlobalVariable globalVariable() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final String name = identifier();
    expect(":");
    final Type type = type();
    final Ast.@Nullable Expr where = accept("where") ? expression() : null;
    expect(";");
    return ast.globalVariable(pos(start), attributes, name, type, where);
  }

  private LocalVariable localVariable() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final String name = identifier();
    expect(":");
    final Type type = type();
    final Ast.@Nullable Expr where = accept("where") ? expression() : null;
    expect(";");
    return ast.localVariable(pos(start), attributes, name, type, where);
  }

  /** Parses a function, such as
   * {@code function f<T>(x: T, int) returns (T) { x }}. */
  private Function function() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final String name = identifier();
    final List<TypeVariable> typeParameters = typeParameters();
    final List<Formal> inParams = formals(true, true);
    final Formal outParam;
    if (accept("returns")) {
      expect("(");
      outParam = formal(false, true);
      expect(")");
    } else {
      expect(":");
      final Lexer.Token t = peek();
      final Type type = type();
      outParam = ast.formal(pos(t), "", type, null, false);
    }
    Ast.@Nullable Expr body = null;
    if (accept("{")) {
      body = expression();
      expect("}");
    } else {
      expect(";");
    }
    return ast.function(pos(start), attributes, name, typeParameters,
        inParams, outParam, body);
  }

  private Axiom axiom() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final Ast.Expr e = expression();
    expect(";");
    return ast.axiom(pos(start), attributes, e);
  }

  /** Parses a procedure. If it has a body, also creates an
   * implementation. */
  private void procedure(List<Declaration> decls) {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final String name = identifier();
    final List<TypeVariable> typeParameters = typeParameters();
    final List<Formal> inParams = formals(true, false);
    final List<Formal> outParams =
        accept("returns") ? formals(false, false) : ImmutableList.of();
    final boolean hasBody = !accept(";");
    final List<Requires> requires = new ArrayList<>();
    final List<Ast.Id> modifies = new ArrayList<>();
    final List<Ensures> ensures = new ArrayList<>();
    for (;;) {
      final Lexer.Token t = peek();
      final boolean free = accept("free");
      if (accept("requires")) {
        final Attributes specAttributes = attributes();
        final Ast.Expr e = expression();
        expect(";");
        requires.add(ast.requires(pos(t), free, e, specAttributes));
      } else if (accept("ensures")) {
        final Attributes specAttributes = attributes();
        final Ast.Expr e = expression();
        expect(";");
        ensures.add(ast.ensures(pos(t), free, e, specAttributes));
      } else if (!free && accept("modifies")) {
        do {
          modifies.add(id());
        } while (accept(","));
        expect(";");
      } else if (free) {
        throw error("expected 'requires' or 'ensures'");
      } else {
        break;
      }
    }
    final Procedure procedure =
        ast.procedure(pos(start), attributes, name, typeParameters,
            inParams, outParams, requires, modifies, ensures);
    decls.add(procedure);
    if (!hasBody) {
      return;
    }

    // The implementation has its own copies of the type parameters and
    // formals; "where" clauses belong to the procedure only.
    final List<LocalVariable> locals = new ArrayList<>();
    final List<Ast.Block> blocks = new ArrayList<>();
    body(locals, blocks);
    decls.add(
        ast.implementation(procedure.pos, new Attributes(), name,
            transformEager(typeParameters,
                v -> new TypeVariable(v.pos, v.name)),
            transformEager(inParams, BoogieParser::copyFormal),
            transformEager(outParams, BoogieParser::copyFormal),
            locals, blocks));
  }

  private static Formal copyFormal(Formal f) {
    return ast.formal(f.pos, f.name, f.type.cloneUnresolved(), null,
        f.incoming);
  }

  private Declaration implementation() {
    final Lexer.Token start = next();
    final Attributes attributes = attributes();
    final String name = identifier();
    final List<TypeVariable> typeParameters = typeParameters();
    final List<Formal> inParams = formals(true, false);
    final List<Formal> outParams =
        accept("returns") ? formals(false, false) : ImmutableList.of();
    final List<LocalVariable> locals = new ArrayList<>();
    final List<Ast.Block> blocks = new ArrayList<>();
    final Pos pos = pos(start);
    body(locals, blocks);
    return ast.implementation(pos, attributes, name, typeParameters,
        inParams, outParams, locals, blocks);
  }

  /** Parses type parameters, such as {@code <a, b>}; returns an empty list
   * if there are none. */
  private List<TypeVariable> typeParameters() {
    final List<TypeVariable> list = new ArrayList<>();
    if (accept("<")) {
      do {
        final Lexer.Token t = peek();
        final String name = identifier();
        list.add(new TypeVariable(pos(t), name));
      } while (accept(","));
      expect(">");
    }
    return list;
  }

  /** Parses a parenthesized list of formal parameters. */
  private List<Formal> formals(boolean incoming, boolean allowUnnamed) {
    final List<Formal> list = new ArrayList<>();
    expect("(");
    if (!accept(")")) {
      do {
        list.add(formal(incoming, allowUnnamed));
      } while (accept(","));
      expect(")");
    }
    return list;
  }

  /** Parses a formal parameter, {@code x: T where e}; if unnamed formals
   * are allowed, also {@code T}. */
  private Formal formal(boolean incoming, boolean allowUnnamed) {
    final Lexer.Token start = peek();
    if (allowUnnamed && !(atIdentifier() && peek(1).is(":"))) {
      final Type type = type();
      return ast.formal(pos(start), "", type, null, incoming);
    }
    final String name = identifier();
    expect(":");
    final Type type = type();
    final Ast.@Nullable Expr where = accept("where") ? expression() : null;
    return ast.formal(pos(start), name, type, where, incoming);
  }

  /** Parses attributes, such as <code>{:inline 1} {:msg "m"}</code>. */
  private Attributes attributes() {
    final Attributes attributes = new Attributes();
    while (at("{") && peek(1).is(":")) {
      next();
      next();
      final Lexer.Token key = next();
      if (key.kind != Lexer.TokenKind.ID
          && key.kind != Lexer.TokenKind.KEYWORD) {
        throw new ParseException("expected attribute name",
            lexer.pos(key.start, key.end));
      }
      final List<Object> params = new ArrayList<>();
      if (!at("}")) {
        do {
          if (peek().kind == Lexer.TokenKind.STRING) {
            params.add(next().text);
          } else {
            params.add(expression());
          }
        } while (accept(","));
      }
      expect("}");
      attributes.add(key.text, params);
    }
    return attributes;
  }

  //-----------  Bodies and commands  -------------------------

  /** Parses the body of an implementation: local variables, then labeled
   * blocks. */
  private void body(List<LocalVariable> locals, List<Ast.Block> blocks) {
    expect("{");
    while (at("var")) {
      locals.add(localVariable());
    }
    final BlockBuilder b = new BlockBuilder(blocks);
    while (!at("}")) {
      final Lexer.Token t = peek();
      if (atIdentifier() && peek(1).is(":")) {
        next();
        next();
        if (b.isStarted()) {
          b.finish(ast.gotoCmd(pos(t), ImmutableList.of(t.text)));
        }
        b.start(t);
      } else if (accept("goto")) {
        final List<String> labels = new ArrayList<>();
        do {
          labels.add(identifier());
        } while (accept(","));
        expect(";");
        b.finish(ast.gotoCmd(pos(t), labels));
      } else if (accept("return")) {
        expect(";");
        b.finish(ast.returnCmd(pos(t)));
      } else {
        b.add(command());
      }
    }
    final Lexer.Token close = next();
    if (b.isStarted() || blocks.isEmpty()) {
      b.finish(ast.returnCmd(pos(close)));
    }
  }

  private Ast.Cmd command() {
    final Lexer.Token start = peek();
    if (accept("assert")) {
      final Ast.Expr e = expression();
      expect(";");
      return ast.assertCmd(pos(start), e);
    }
    if (accept("assume")) {
      final Ast.Expr e = expression();
      expect(";");
      return ast.assume(pos(start), e);
    }
    if (accept("havoc")) {
      final List<Ast.Id> vars = new ArrayList<>();
      do {
        vars.add(id());
      } while (accept(","));
      expect(";");
      return ast.havoc(pos(start), vars);
    }
    if (accept("call")) {
      final List<Ast.Id> outs = new ArrayList<>();
      if (atIdentifier() && (peek(1).is(",") || peek(1).is(":="))) {
        do {
          outs.add(id());
        } while (accept(","));
        expect(":=");
      }
      final String procName = identifier();
      expect("(");
      final List<Ast.Expr> ins = expressions(")");
      expect(";");
      return ast.call(pos(start), procName, ins, outs);
    }
    return assignment();
  }

  /** Parses an assignment, such as {@code x, m[i] := 1, 2;}. */
  private Ast.Cmd assignment() {
    final Lexer.Token start = peek();
    final List<Ast.Expr> lhss = new ArrayList<>();
    do {
      final Lexer.Token t = peek();
      Ast.Expr lhs = id();
      while (accept("[")) {
        final List<Ast.Expr> indexes = expressions("]");
        lhs = ast.mapSelect(pos(t), lhs, indexes);
      }
      lhss.add(lhs);
    } while (accept(","));
    expect(":=");
    final List<Ast.Expr> rhss = new ArrayList<>();
    do {
      rhss.add(expression());
    } while (accept(","));
    expect(";");
    return ast.assign(pos(start), lhss, rhss);
  }

  private Ast.Id id() {
    final Lexer.Token t = peek();
    final String name = identifier();
    return ast.id(pos(t), name);
  }

  /** Parses a comma-separated list of expressions and a closing
   * symbol. */
  private List<Ast.Expr> expressions(String close) {
    final List<Ast.Expr> list = new ArrayList<>();
    if (accept(close)) {
      return list;
    }
    do {
      list.add(expression());
    } while (accept(","));
    expect(close);
    return list;
  }

  /** Collects the commands of a block until its transfer is known. */
  private class BlockBuilder {
    private final List<Ast.Block> blocks;
    private Lexer.@Nullable Token label;
    private final List<Ast.Cmd> cmds = new ArrayList<>();
    private int anonCount;

    BlockBuilder(List<Ast.Block> blocks) {
      this.blocks = blocks;
    }

    boolean isStarted() {
      return label != null || !cmds.isEmpty();
    }

    void start(Lexer.Token label) {
      this.label = label;
    }

    void add(Ast.Cmd cmd) {
      cmds.add(cmd);
    }

    void finish(Ast.Transfer transfer) {
      final Pos pos;
      final String name;
      if (label != null) {
        pos = lexer.pos(label.start, label.end);
        name = label.text;
      } else {
        pos = cmds.isEmpty() ? transfer.pos : cmds.get(0).pos;
        name = "anon" + anonCount++;
      }
      blocks.add(ast.block(pos, name, cmds, transfer));
      label = null;
      cmds.clear();
    }
  }

  //-----------  Expressions  ---------------------------------

  /** Parses an expression. */
  public Ast.Expr expression() {
    if (at("if")) {
      return ifThenElse();
    }
    return leftAssociative(this::implies, EnumSet.of(Op.IFF));
  }

  private Ast.Expr implies() {
    final Ast.Expr e = leftAssociative(this::and, EnumSet.of(Op.OR));
    if (accept("==>")) {
      final Ast.Expr e2 = implies();
      return ast.binary(e.pos.plus(e2.pos), Op.IMPLIES, e, e2);
    }
    return e;
  }

  private Ast.Expr and() {
    return leftAssociative(this::comparison, EnumSet.of(Op.AND));
  }

  private Ast.Expr comparison() {
    final Ast.Expr e = concat();
    final @Nullable Op op = infixOp(COMPARISON_OPS);
    if (op == null) {
      return e;
    }
    next();
    final Ast.Expr e2 = concat();
    return ast.binary(e.pos.plus(e2.pos), op, e, e2);
  }

  private Ast.Expr concat() {
    return leftAssociative(this::additive, EnumSet.of(Op.CONCAT));
  }

  private Ast.Expr additive() {
    return leftAssociative(this::multiplicative,
        EnumSet.of(Op.PLUS, Op.MINUS));
  }

  private Ast.Expr multiplicative() {
    return leftAssociative(this::unary,
        EnumSet.of(Op.TIMES, Op.DIV, Op.MOD));
  }

  /** Parses operands separated by left-associative operators. */
  private Ast.Expr leftAssociative(Supplier<Ast.Expr> operand, Set<Op> ops) {
    Ast.Expr e = operand.get();
    for (;;) {
      final @Nullable Op op = infixOp(ops);
      if (op == null) {
        return e;
      }
      next();
      final Ast.Expr e2 = operand.get();
      e = ast.binary(e.pos.plus(e2.pos), op, e, e2);
    }
  }

  /** Returns the operator of the current token, if it is one of a given
   * set of infix operators. */
  private @Nullable Op infixOp(Set<Op> ops) {
    final Lexer.Token t = peek();
    if (t.kind != Lexer.TokenKind.SYMBOL
        && t.kind != Lexer.TokenKind.KEYWORD) {
      return null;
    }
    final @Nullable Op op = Op.BY_OP_NAME.get(t.text);
    return op != null && ops.contains(op) ? op : null;
  }

  private Ast.Expr unary() {
    final Lexer.Token start = peek();
    if (accept("!")) {
      final Ast.Expr arg = unary();
      return ast.unary(pos(start), Op.NOT, arg);
    }
    if (accept("-")) {
      final Ast.Expr arg = unary();
      return ast.unary(pos(start), Op.NEGATE, arg);
    }
    return postfix();
  }

  /** Parses a primary expression followed by map selects, map stores and
   * bit-vector extractions. */
  private Ast.Expr postfix() {
    final Lexer.Token start = peek();
    Ast.Expr e = primary();
    while (accept("[")) {
      if (peek().kind == Lexer.TokenKind.INT
          && peek(1).is(":")
          && peek(2).kind == Lexer.TokenKind.INT
          && peek(3).is("]")) {
        final int end = Integer.parseInt(next().text);
        next();
        final int lo = Integer.parseInt(next().text);
        next();
        e = ast.bvExtract(pos(start), e, end, lo);
        continue;
      }
      final List<Ast.Expr> indexes = new ArrayList<>();
      if (!at("]") && !at(":=")) {
        do {
          indexes.add(expression());
        } while (accept(","));
      }
      if (accept(":=")) {
        final Ast.Expr value = expression();
        expect("]");
        e = ast.mapStore(pos(start), e, indexes, value);
      } else {
        expect("]");
        e = ast.mapSelect(pos(start), e, indexes);
      }
    }
    return e;
  }

  private Ast.Expr primary() {
    final Lexer.Token t = peek();
    switch (t.kind) {
      case INT:
        next();
        return ast.intLiteral(pos(t), new BigInteger(t.text));
      case BV:
        next();
        final int k = t.text.indexOf("bv");
        return ast.bvLiteral(pos(t), new BigInteger(t.text.substring(0, k)),
            Integer.parseInt(t.text.substring(k + 2)));
      case ID:
        next();
        if (accept("(")) {
          final List<Ast.Expr> args = expressions(")");
          return ast.functionCall(pos(t), t.text, args);
        }
        return ast.id(pos(t), t.text);
      case KEYWORD:
        switch (t.text) {
          case "true":
          case "false":
            next();
            return ast.boolLiteral(pos(t), t.text.equals("true"));
          case "old":
            next();
            expect("(");
            final Ast.Expr e = expression();
            expect(")");
            return ast.old(pos(t), e);
          case "if":
            return ifThenElse();
          default:
            break;
        }
        break;
      case SYMBOL:
        if (accept("(")) {
          if (at("forall") || at("exists")) {
            return quantifier(t);
          }
          final Ast.Expr e = expression();
          expect(")");
          return e;
        }
        break;
      default:
        break;
    }
    throw error("expected expression");
  }

  private Ast.Expr ifThenElse() {
    final Lexer.Token start = next();
    final Ast.Expr condition = expression();
    expect("then");
    final Ast.Expr ifTrue = expression();
    expect("else");
    final Ast.Expr ifFalse = expression();
    return ast.ifThenElse(pos(start), condition, ifTrue, ifFalse);
  }

  /** Parses the rest of a quantifier, such as
   * {@code (forall<T> x: T, y: int :: {:a} e)}; the opening parenthesis
   * has been consumed. */
  private Ast.Expr quantifier(Lexer.Token start) {
    final Op op = next().text.equals("forall") ? Op.FORALL : Op.EXISTS;
    final List<TypeVariable> typeParameters = typeParameters();
    final List<BoundVariable> dummies = new ArrayList<>();
    do {
      final Lexer.Token t = peek();
      final String name = identifier();
      expect(":");
      final Type type = type();
      dummies.add(ast.boundVariable(pos(t), name, type));
    } while (accept(","));
    expect("::");
    final Attributes attributes = attributes();
    final Ast.Expr body = expression();
    expect(")");
    return ast.quantifier(pos(start), op, typeParameters, dummies,
        attributes, body);
  }

  //-----------  Types  ---------------------------------------

  /** Parses a type. */
  public Type type() {
    final Lexer.Token t = peek();
    if (at("<") || at("[")) {
      return mapType();
    }
    if (accept("(")) {
      final Type type = type();
      expect(")");
      return type;
    }
    final String name = identifier();
    switch (name) {
      case "int":
        return Type.INT;
      case "bool":
        return Type.BOOL;
      default:
        break;
    }
    final List<Type> args = new ArrayList<>();
    for (;;) {
      if (atIdentifier()) {
        args.add(simpleType(next()));
      } else if (accept("(")) {
        args.add(type());
        expect(")");
      } else if (at("<") || at("[")) {
        // A map type extends as far as possible, so it must be the last
        // argument.
        args.add(mapType());
        break;
      } else {
        break;
      }
    }
    return new UnresolvedTypeIdentifier(pos(t), name, args);
  }

  /** Returns a type that is a name without arguments. */
  private Type simpleType(Lexer.Token t) {
    switch (t.text) {
      case "int":
        return Type.INT;
      case "bool":
        return Type.BOOL;
      default:
        return new UnresolvedTypeIdentifier(pos(t), t.text);
    }
  }

  /** Parses a map type, such as {@code <a>[a, int]bool}. */
  private Type mapType() {
    final Lexer.Token start = peek();
    final List<TypeVariable> typeParameters = typeParameters();
    expect("[");
    final List<Type> args = new ArrayList<>();
    if (!accept("]")) {
      do {
        args.add(type());
      } while (accept(","));
      expect("]");
    }
    final Type result = type();
    return new MapType(pos(start), typeParameters, args, result);
  }
}

// End BoogieParser.java
