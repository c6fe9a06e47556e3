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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.boogie.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Ast;
import net.hydromatic.boogie.ast.Attributes;
import net.hydromatic.boogie.ast.Declaration;
import net.hydromatic.boogie.ast.Formal;
import net.hydromatic.boogie.ast.GlobalVariable;
import net.hydromatic.boogie.ast.Implementation;
import net.hydromatic.boogie.ast.Pos;
import net.hydromatic.boogie.ast.Procedure;
import net.hydromatic.boogie.ast.Program;
import net.hydromatic.boogie.ast.Shuttle;
import net.hydromatic.boogie.ast.Variable;
import net.hydromatic.boogie.util.Graph;

/**
 * Converts loops into recursive procedures.
 *
 * <p>For each loop header {@code h} of an implementation, creates a
 * procedure {@code loop_h} and an implementation of it. The procedure's
 * in-parameters are copies of the in-parameters, out-parameters and locals
 * of the original implementation, named with prefix "in_"; its
 * out-parameters are copies of the out-parameters and locals, named with
 * prefix "out_". Its modifies clause lists the global variables assigned in
 * the loop.
 *
 * <p>The body of the new implementation is a copy of the loop. Each back
 * edge becomes a recursive call, and each edge that leaves the loop becomes
 * a return. In the original implementation, the header starts with a call
 * to the new procedure, and each back edge is replaced by an edge to a block
 * that assumes {@code false}.
 *
 * <p>The control-flow graph of each implementation must be reducible.
 */
public class LoopExtractor {
  private final boolean inlineLoops;

  public LoopExtractor(Map<Prop, Object> props) {
    this.inlineLoops = Prop.INLINE_LOOPS.booleanValue(props);
  }

  /** Extracts the loops of every implementation in a program, and adds
   * the new procedures and implementations to the program. */
  public void extract(Program program) {
    final List<Declaration> newDecls = new ArrayList<>();
    for (Implementation impl : program.implementations()) {
      if (impl.blocks.isEmpty()) {
        continue;
      }
      final Graph<Ast.Block> g = graphFromImpl(impl);
      g.computeLoops();
      if (!g.isReducible()) {
        throw new IllegalStateException(
            "Irreducible flow graphs are unsupported.");
      }
      createProceduresForLoops(impl, g, newDecls);
    }
    program.decls.addAll(newDecls);
  }

  /** Returns the control-flow graph of an implementation, whose source is
   * the first block. */
  public static Graph<Ast.Block> graphFromImpl(Implementation impl) {
    final Graph<Ast.Block> g = new Graph<>();
    g.addSource(impl.blocks.get(0));
    for (Ast.Block b : impl.blocks) {
      for (Ast.Block successor : b.successors()) {
        g.addEdge(b, successor);
      }
    }
    return g;
  }

  private void createProceduresForLoops(Implementation impl,
      Graph<Ast.Block> g, List<Declaration> newDecls) {
    // First, create a procedure for each loop, so that a loop can call the
    // procedures of the loops nested inside it.
    final Map<Ast.Block, Loop> loops = new LinkedHashMap<>();
    for (Ast.Block header : g.headers()) {
      loops.put(header, createLoop(impl, g, header));
    }

    // Next, create the body of each procedure.
    for (Map.Entry<Ast.Block, Loop> entry : loops.entrySet()) {
      final Ast.Block header = entry.getKey();
      final Loop loop = entry.getValue();
      final Implementation loopImpl =
          createLoopImplementation(impl, g, header, loop);
      newDecls.add(loop.proc);
      newDecls.add(loopImpl);

      // Call the loop's procedure on entry to the header.
      header.cmds.add(0, loop.call);
    }
  }

  private Loop createLoop(Implementation impl, Graph<Ast.Block> g,
      Ast.Block header) {
    final String procName = "loop_" + header.label;
    final List<Formal> inputs = new ArrayList<>();
    final List<Formal> outputs = new ArrayList<>();
    final List<Ast.Expr> callInputs = new ArrayList<>();
    final List<Ast.Id> callOutputs = new ArrayList<>();
    final Map<Variable, Formal> substitution = new HashMap<>();

    for (Formal v : impl.inParams) {
      final Formal in = formal("in_", v, true);
      callInputs.add(ast.id(v));
      inputs.add(in);
      substitution.put(v, in);
    }
    final List<Variable> outsAndLocals = new ArrayList<>(impl.outParams);
    outsAndLocals.addAll(impl.locals);
    for (Variable v : outsAndLocals) {
      final Formal out = formal("out_", v, false);
      callInputs.add(ast.id(v));
      inputs.add(formal("in_", v, true));
      callOutputs.add(ast.id(v));
      outputs.add(out);
      substitution.put(v, out);
    }

    final List<Variable> assigned = new ArrayList<>();
    for (Ast.Block source : g.backEdgeNodes(header)) {
      for (Ast.Block block : g.naturalLoops(header, source)) {
        block.cmds.forEach(cmd -> cmd.addAssignedVariables(assigned));
      }
    }
    final List<GlobalVariable> globals = new ArrayList<>();
    for (Variable v : assigned) {
      if (v instanceof GlobalVariable && !globals.contains(v)) {
        globals.add((GlobalVariable) v);
      }
    }
    final List<Ast.Id> modifies = new ArrayList<>();
    globals.forEach(v -> modifies.add(ast.id(v)));

    final Attributes attributes = new Attributes();
    if (inlineLoops) {
      attributes.add("inline",
          ImmutableList.of(ast.intLiteral(Pos.ZERO, 1)));
    }
    final Procedure proc =
        ast.procedure(Pos.ZERO, attributes, procName, ImmutableList.of(),
            inputs, outputs, ImmutableList.of(), modifies,
            ImmutableList.of());
    final Ast.Call call =
        ast.call(Pos.ZERO, procName, callInputs, callOutputs, proc);
    return new Loop(proc, inputs, outputs, substitution, call);
  }

  private static Formal formal(String prefix, Variable v, boolean incoming) {
    return ast.formal(Pos.ZERO, prefix + v.name, v.type, null, incoming);
  }

  private Implementation createLoopImplementation(Implementation impl,
      Graph<Ast.Block> g, Ast.Block header, Loop loop) {
    final Substituter substituter = new Substituter(loop.substitution);
    final Map<Ast.Block, Ast.Block> blockMap = new LinkedHashMap<>();
    for (Ast.Block source : g.backEdgeNodes(header)) {
      for (Ast.Block block : g.naturalLoops(header, source)) {
        if (!blockMap.containsKey(block)) {
          blockMap.put(block,
              ast.block(Pos.ZERO, block.label,
                  substituter.visitCmds(block.cmds),
                  ast.returnCmd(Pos.ZERO)));
        }
      }

      // The back edge becomes a recursive call in the loop's body, and a
      // dead end in the original implementation.
      final List<Ast.Expr> ins = new ArrayList<>();
      final List<Ast.Id> outs = new ArrayList<>();
      for (int i = 0; i < impl.inParams.size(); i++) {
        ins.add(ast.id(loop.inputs.get(i)));
      }
      for (Formal v : loop.outputs) {
        ins.add(ast.id(v));
        outs.add(ast.id(v));
      }
      final Ast.Call recursiveCall =
          ast.call(Pos.ZERO, loop.proc.name, ins, outs, loop.proc);
      final Ast.Block dummy =
          ast.block(Pos.ZERO, source.label + "_dummy",
              ImmutableList.of(assumeFalse()), ast.returnCmd(Pos.ZERO));
      final Ast.Block callBlock =
          ast.block(Pos.ZERO, dummy.label,
              ImmutableList.<Ast.Cmd>of(recursiveCall),
              ast.returnCmd(Pos.ZERO));
      impl.blocks.add(dummy);

      checkState(source.transfer instanceof Ast.Goto,
          "source of back edge must end in goto: %s", source.label);
      final List<Ast.Block> targets = new ArrayList<>();
      for (Ast.Block target : source.successors()) {
        if (target != header) {
          targets.add(target);
        }
      }
      targets.add(dummy);
      source.transfer = ast.gotoBlocks(source.transfer.pos, targets);
      blockMap.put(dummy, callBlock);
    }

    final Ast.Block exit =
        ast.block(Pos.ZERO, "exit", ImmutableList.of(),
            ast.returnCmd(Pos.ZERO));

    // On entry, each out-parameter takes the value of the corresponding
    // in-parameter.
    final int inCount = impl.inParams.size();
    final List<Ast.Cmd> entryCmds = new ArrayList<>();
    if (!loop.outputs.isEmpty()) {
      final List<Ast.Expr> lhss = new ArrayList<>();
      final List<Ast.Expr> rhss = new ArrayList<>();
      for (int i = inCount; i < loop.inputs.size(); i++) {
        lhss.add(ast.id(loop.outputs.get(i - inCount)));
        rhss.add(ast.id(loop.inputs.get(i)));
      }
      entryCmds.add(ast.assign(Pos.ZERO, lhss, rhss));
    }
    final Ast.Block entry =
        ast.block(Pos.ZERO, "entry", entryCmds,
            ast.gotoBlocks(Pos.ZERO,
                ImmutableList.of(requireNonNull(blockMap.get(header)),
                    exit)));

    final List<Ast.Block> blocks = new ArrayList<>();
    blocks.add(entry);
    blockMap.forEach((original, copy) -> {
      if (original.transfer instanceof Ast.Goto) {
        final List<Ast.Block> targets = new ArrayList<>();
        for (Ast.Block target : original.successors()) {
          final Ast.Block targetCopy = blockMap.get(target);
          if (targetCopy != null) {
            targets.add(targetCopy);
          }
        }
        if (targets.isEmpty()) {
          // Every successor is outside the loop.
          copy.cmds.add(assumeFalse());
          copy.transfer = ast.returnCmd(Pos.ZERO);
        } else {
          copy.transfer = ast.gotoBlocks(Pos.ZERO, targets);
        }
      }
      blocks.add(copy);
    });
    blocks.add(exit);

    final Implementation loopImpl =
        ast.implementation(Pos.ZERO, new Attributes(), loop.proc.name,
            ImmutableList.of(), loop.inputs, loop.outputs,
            ImmutableList.of(), blocks);
    loopImpl.proc = loop.proc;
    return loopImpl;
  }

  private static Ast.Cmd assumeFalse() {
    return ast.assume(Pos.ZERO, ast.boolLiteral(Pos.ZERO, false));
  }

  /** Procedure created for a loop, and the information needed to build
   * its body. */
  private static class Loop {
    final Procedure proc;
    final List<Formal> inputs;
    final List<Formal> outputs;
    final Map<Variable, Formal> substitution;
    /** Call to the procedure from the loop header. */
    final Ast.Call call;

    Loop(Procedure proc, List<Formal> inputs, List<Formal> outputs,
        Map<Variable, Formal> substitution, Ast.Call call) {
      this.proc = proc;
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
      this.substitution = substitution;
      this.call = call;
    }
  }

  /** Copies commands, replacing references to the original
   * implementation's variables with references to the loop procedure's
   * formals. */
  private static class Substituter extends Shuttle {
    private final Map<Variable, Formal> substitution;

    Substituter(Map<Variable, Formal> substitution) {
      this.substitution = substitution;
    }

    @Override
    protected Ast.Id visit(Ast.Id id) {
      final Formal formal =
          id.decl == null ? null : substitution.get(id.decl);
      return formal == null ? id : ast.id(formal);
    }
  }
}

// End LoopExtractor.java
