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
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.DeclWithFormals;
import net.hydromatic.boogie.ast.NamedDeclaration;
import net.hydromatic.boogie.ast.TypeCtorDecl;
import net.hydromatic.boogie.ast.TypeSynonymDecl;
import net.hydromatic.boogie.ast.Variable;
import net.hydromatic.boogie.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbol table used while resolving names.
 *
 * <p>Types and procedures (including functions) live in flat, program-wide
 * namespaces. Variables live in a stack of scopes whose bottom is the global
 * scope. Type binders are a list that is truncated back to a saved
 * {@link #typeBinderState() state}. Block labels are scoped to a procedure.
 *
 * <p>When a name is declared twice in the same scope, an error is reported
 * and the first declaration stays in force.
 */
public class ResolutionContext extends CheckingContext {
  private final Map<String, NamedDeclaration> types = new HashMap<>();
  private final Map<String, DeclWithFormals> procedures = new HashMap<>();
  private final Deque<Map<String, Variable>> varContexts = new ArrayDeque<>();
  private final List<TypeVariable> typeBinders = new ArrayList<>();
  private final Deque<Map<String, Ast.Block>> procedureContexts =
      new ArrayDeque<>();
  private StateMode stateMode = StateMode.SINGLE;

  public ResolutionContext(Tracer tracer) {
    super(tracer);
    varContexts.push(new HashMap<>());
  }

  //-----------  Types  ---------------------------------------

  /** Registers a type constructor or type synonym. */
  public void addType(NamedDeclaration decl) {
    checkArgument(decl instanceof TypeCtorDecl
        || decl instanceof TypeSynonymDecl, "not a type: %s", decl);
    if (types.containsKey(decl.name)) {
      error(decl.pos, "more than one declaration of type name: {0}",
          decl.name);
      return;
    }
    types.put(decl.name, decl);
  }

  /** Looks up a type constructor; returns null if the name is not declared
   * or is a type synonym. */
  public @Nullable TypeCtorDecl lookupType(String name) {
    final NamedDeclaration decl = types.get(name);
    return decl instanceof TypeCtorDecl ? (TypeCtorDecl) decl : null;
  }

  /** Looks up a type synonym; returns null if the name is not declared or is
   * a type constructor. */
  public @Nullable TypeSynonymDecl lookupTypeSynonym(String name) {
    final NamedDeclaration decl = types.get(name);
    return decl instanceof TypeSynonymDecl ? (TypeSynonymDecl) decl : null;
  }

  //-----------  Procedures and functions  --------------------

  public void addProcedure(DeclWithFormals decl) {
    if (procedures.containsKey(decl.name)) {
      error(decl.pos,
          "more than one declaration of function/procedure name: {0}",
          decl.name);
      return;
    }
    procedures.put(decl.name, decl);
  }

  public @Nullable DeclWithFormals lookupProcedure(String name) {
    return procedures.get(name);
  }

  //-----------  Variables  -----------------------------------

  public void pushVarContext() {
    varContexts.push(new HashMap<>());
  }

  public void popVarContext() {
    checkState(varContexts.size() > 1, "cannot pop the global scope");
    varContexts.pop();
  }

  /** Adds a variable to the innermost scope, or to the global scope if
   * {@code global}. */
  public void addVariable(Variable v, boolean global) {
    final Map<String, Variable> scope =
        global ? varContexts.getLast() : varContexts.getFirst();
    if (scope.containsKey(v.name)) {
      error(v.pos, "more than one declaration of variable name: {0}", v.name);
      return;
    }
    scope.put(v.name, v);
  }

  /** Looks up a variable, searching from the innermost scope outwards. */
  public @Nullable Variable lookupVariable(String name) {
    for (Map<String, Variable> scope : varContexts) {
      final Variable v = scope.get(name);
      if (v != null) {
        return v;
      }
    }
    return null;
  }

  //-----------  Type binders  --------------------------------

  /** Returns a token that {@link #setTypeBinderState(int)} uses to remove
   * the binders added since. */
  public int typeBinderState() {
    return typeBinders.size();
  }

  public void setTypeBinderState(int state) {
    checkArgument(state >= 0 && state <= typeBinders.size(),
        "invalid type binder state %s", state);
    typeBinders.subList(state, typeBinders.size()).clear();
  }

  public void addTypeBinder(TypeVariable v) {
    typeBinders.add(v);
  }

  /** Looks up a type variable; the most recently added binder of a given
   * name wins. */
  public @Nullable TypeVariable lookupTypeBinder(String name) {
    for (int i = typeBinders.size() - 1; i >= 0; i--) {
      final TypeVariable v = typeBinders.get(i);
      if (v.name.equals(name)) {
        return v;
      }
    }
    return null;
  }

  //-----------  Blocks  --------------------------------------

  public void pushProcedureContext() {
    procedureContexts.push(new HashMap<>());
  }

  public void popProcedureContext() {
    checkState(!procedureContexts.isEmpty(), "no procedure context");
    procedureContexts.pop();
  }

  public void addBlock(Ast.Block block) {
    checkState(!procedureContexts.isEmpty(), "no procedure context");
    final Map<String, Ast.Block> blocks = procedureContexts.getFirst();
    if (blocks.containsKey(block.label)) {
      error(block.pos, "more than one declaration of label: {0}",
          block.label);
      return;
    }
    blocks.put(block.label, block);
  }

  public Ast.@Nullable Block lookupBlock(String label) {
    checkState(!procedureContexts.isEmpty(), "no procedure context");
    return procedureContexts.getFirst().get(label);
  }

  //-----------  State  ---------------------------------------

  public StateMode stateMode() {
    return stateMode;
  }

  /** Sets the state mode, and returns the previous mode. */
  public StateMode setStateMode(StateMode stateMode) {
    final StateMode previous = this.stateMode;
    this.stateMode = stateMode;
    return previous;
  }

  /** Which program states an expression may refer to. */
  public enum StateMode {
    /** No state; for example axioms and function bodies. Global variables
     * may not be referenced. */
    STATELESS,
    /** A single state; for example preconditions. */
    SINGLE,
    /** The current state and the state on entry; for example postconditions
     * and implementation bodies. {@code old} is allowed. */
    TWO
  }
}

// End ResolutionContext.java
