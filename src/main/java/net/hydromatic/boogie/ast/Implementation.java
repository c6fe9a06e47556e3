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
import static net.hydromatic.boogie.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.boogie.compile.ResolutionContext;
import net.hydromatic.boogie.compile.TypecheckingContext;
import net.hydromatic.boogie.type.Type;
import net.hydromatic.boogie.type.TypeVariable;
import net.hydromatic.boogie.type.Types;
import net.hydromatic.boogie.util.StronglyConnectedComponents;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementation of a procedure: local variables and a body of blocks.
 *
 * <p>An implementation does not register itself. During resolution it
 * finds the procedure of the same name, and during typechecking it checks
 * that its signature matches that procedure's.
 *
 * <p>The first block is the entry point. The blocks form a control-flow
 * graph; predecessors and strongly connected components are derived on
 * demand.
 */
public class Implementation extends DeclWithFormals {
  public final ImmutableList<LocalVariable> locals;
  /** Blocks; the first is the entry point. Transformations may replace
   * the list. */
  public List<Ast.Block> blocks;
  /** Procedure that this implements; null until resolved. */
  public @Nullable Procedure proc;

  private @Nullable Map<Variable, Ast.Id> formalMap;
  private @Nullable StronglyConnectedComponents<Ast.Block> scc;
  private boolean predecessorsComputed;

  Implementation(Pos pos, Attributes attributes, String name,
      List<TypeVariable> typeParameters, List<Formal> inParams,
      List<Formal> outParams, List<LocalVariable> locals,
      List<Ast.Block> blocks) {
    super(pos, Op.IMPLEMENTATION_DECL, attributes, name, typeParameters,
        inParams, outParams);
    this.locals = ImmutableList.copyOf(locals);
    this.blocks = new ArrayList<>(blocks);
  }

  /** Returns the procedure; throws if this implementation has not been
   * resolved. */
  public Procedure proc() {
    checkState(proc != null, "implementation has not been resolved: %s",
        name);
    return proc;
  }

  @Override
  public void register(ResolutionContext rc) {
    // The procedure of the same name is registered instead.
  }

  @Override
  public void resolve(ResolutionContext rc) {
    if (proc != null) {
      // already resolved
      return;
    }
    final DeclWithFormals decl = rc.lookupProcedure(name);
    if (decl == null) {
      rc.error(pos, "implementation given for undeclared procedure: {0}",
          name);
    } else if (!(decl instanceof Procedure)) {
      rc.error(pos, "implementations given for function, not procedure: {0}",
          name);
    } else {
      proc = (Procedure) decl;
    }

    final int previousState = rc.typeBinderState();
    try {
      typeParameters.forEach(rc::addTypeBinder);
      resolveBody(rc);
      Types.checkBoundVariableOccurrences(typeParameters,
          Variable.typesOf(inParams), Variable.typesOf(outParams), pos,
          "implementation arguments", rc);
    } finally {
      rc.setTypeBinderState(previousState);
    }
    sortTypeParams();
  }

  /** Resolves formals, locals and blocks in their own scopes. Every scope
   * pushed here is popped, and the state mode restored, on every exit. */
  private void resolveBody(ResolutionContext rc) {
    rc.pushVarContext();
    try {
      registerFormals(inParams, rc);
      registerFormals(outParams, rc);
      for (LocalVariable v : locals) {
        v.register(rc);
        v.resolve(rc);
      }
      resolveWhere(locals, rc);

      rc.pushProcedureContext();
      final ResolutionContext.StateMode previousMode = rc.stateMode();
      try {
        blocks.forEach(b -> b.register(rc));
        attributes.resolve(rc);
        rc.setStateMode(ResolutionContext.StateMode.TWO);
        blocks.forEach(b -> b.resolve(rc));
      } finally {
        rc.setStateMode(previousMode);
        rc.popProcedureContext();
      }
    } finally {
      rc.popVarContext();
    }
  }

  @Override
  public void typecheck(TypecheckingContext tc) {
    attributes.typecheck(tc);
    typecheckFormals(tc);
    final Procedure procedure = proc();
    if (typeParameters.size() != procedure.typeParameters.size()) {
      tc.error(pos, "mismatched number of type parameters in procedure "
          + "implementation: {0}", name);
    } else {
      matchFormals(inParams, procedure.inParams, "in", tc);
      matchFormals(outParams, procedure.outParams, "out", tc);
    }

    locals.forEach(v -> v.typecheck(tc));
    final List<Ast.Id> previousFrame = tc.setFrame(procedure.modifies);
    blocks.forEach(b -> b.typecheck(tc));
    tc.setFrame(previousFrame);
  }

  /** Checks that the types of the formals of this implementation are the
   * same as those of the procedure, after renaming type parameters. */
  private void matchFormals(List<Formal> implFormals,
      List<Formal> procFormals, String inOut, TypecheckingContext tc) {
    if (implFormals.size() != procFormals.size()) {
      tc.error(pos, "mismatched number of {0}-parameters in procedure "
          + "implementation: {1}", inOut, name);
      return;
    }
    final Procedure procedure = proc();
    final Map<TypeVariable, Type> procSubst = new HashMap<>();
    final Map<TypeVariable, Type> implSubst = new HashMap<>();
    for (int i = 0; i < typeParameters.size(); i++) {
      final TypeVariable v = procedure.typeParameters.get(i);
      final TypeVariable shared = new TypeVariable(Pos.ZERO, v.name);
      procSubst.put(v, shared);
      implSubst.put(typeParameters.get(i), shared);
    }
    for (int i = 0; i < implFormals.size(); i++) {
      final Formal implFormal = implFormals.get(i);
      final Formal procFormal = procFormals.get(i);
      final Type t = implFormal.type.substitute(implSubst);
      final Type u = procFormal.type.substitute(procSubst);
      if (!t.equals(u)) {
        final String description = implFormal.name.equals(procFormal.name)
            ? implFormal.name
            : procFormal.name + " (named " + implFormal.name
                + " in implementation)";
        tc.error(pos, "mismatched type of {0}-parameter in implementation "
            + "{1}: {2}", inOut, name, description);
      }
    }
  }

  /** Returns whether this implementation should not be verified, because
   * it or its procedure has the attribute <code>{:verify false}</code>. */
  public boolean skipVerification() {
    return !proc().attributes.checkBooleanAttribute("verify", true)
        || !attributes.checkBooleanAttribute("verify", true);
  }

  /** Returns a map from each formal parameter of the procedure to an
   * identifier for the corresponding formal of this implementation. The
   * map is computed once; see {@link #resetImplFormalMap()}. */
  public Map<Variable, Ast.Id> getImplFormalMap() {
    if (formalMap == null) {
      final Procedure procedure = proc();
      checkState(inParams.size() == procedure.inParams.size()
          && outParams.size() == procedure.outParams.size());
      final ImmutableMap.Builder<Variable, Ast.Id> b = ImmutableMap.builder();
      for (int i = 0; i < inParams.size(); i++) {
        b.put(procedure.inParams.get(i), ast.id(inParams.get(i)));
      }
      for (int i = 0; i < outParams.size(); i++) {
        b.put(procedure.outParams.get(i), ast.id(outParams.get(i)));
      }
      formalMap = b.build();
    }
    return formalMap;
  }

  public void resetImplFormalMap() {
    formalMap = null;
  }

  /** Populates the predecessors of each block. */
  public void computePredecessors() {
    blocks.forEach(b -> b.predecessors.clear());
    for (Ast.Block b : blocks) {
      for (Ast.Block successor : b.successors()) {
        successor.predecessors.add(b);
      }
    }
    predecessorsComputed = true;
  }

  /** Computes the strongly connected components of the blocks. Clears the
   * predecessors of each block afterwards. */
  public void computeStronglyConnectedComponents() {
    if (!predecessorsComputed) {
      computePredecessors();
    }
    scc = new StronglyConnectedComponents<>(blocks, Ast.Block::successors,
        b -> b.predecessors);
    scc.compute();
    blocks.forEach(b -> b.predecessors.clear());
    predecessorsComputed = false;
  }

  /** Returns the strongly connected component that contains a block. */
  public List<Ast.Block> getConnectedComponents(Ast.Block block) {
    checkArgument(blocks.contains(block), "block %s is not in %s",
        block.label, name);
    if (scc == null) {
      computeStronglyConnectedComponents();
    }
    for (List<Ast.Block> component : scc) {
      if (component.contains(block)) {
        return component;
      }
    }
    throw new AssertionError("block " + block.label + " is in no component");
  }

  /**
   * Removes blocks that cannot be reached from the entry block.
   *
   * <p>A block that contains {@code assert false} or {@code assume false}
   * does not reach its successors; its transfer is replaced by a return.
   */
  public void pruneUnreachableBlocks() {
    checkState(!blocks.isEmpty(), "implementation has no blocks: %s", name);
    final Set<Ast.Block> reachable = new LinkedHashSet<>();
    final Deque<Ast.Block> stack = new ArrayDeque<>();
    stack.push(blocks.get(0));
    while (!stack.isEmpty()) {
      final Ast.Block b = stack.pop();
      if (!reachable.add(b) || !(b.transfer instanceof Ast.Goto)) {
        continue;
      }
      if (b.cmds.stream().anyMatch(Implementation::isFalse)) {
        b.transfer = ast.returnCmd(b.transfer.pos);
        continue;
      }
      b.successors().forEach(stack::push);
    }
    blocks = new ArrayList<>(reachable);
    scc = null;
    predecessorsComputed = false;
  }

  private static boolean isFalse(Ast.Cmd cmd) {
    return cmd instanceof Ast.PredicateCmd
        && ((Ast.PredicateCmd) cmd).isFalse();
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("implementation ");
    unparseSignature(w);
    w.newline().append("{").indent();
    for (LocalVariable v : locals) {
      w.newline().append(v, 0, 0);
    }
    for (int i = 0; i < blocks.size(); i++) {
      if (i > 0 || !locals.isEmpty()) {
        w.blankLine();
      } else {
        w.newline();
      }
      w.append(blocks.get(i), 0, 0);
    }
    return w.outdent().newline().append("}");
  }
}

// End Implementation.java
