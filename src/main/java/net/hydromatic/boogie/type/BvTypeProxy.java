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
package net.hydromatic.boogie.type;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.boogie.util.Static.containsIdentical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.boogie.ast.Pos;

/**
 * Proxy for a bit-vector type whose width is not known yet.
 *
 * <p>The proxy represents {@code bvN} if {@code minBits <= N} and, for each
 * constraint {@code (t0, t1)}, {@code t0} and {@code t1} are bit-vector types
 * whose widths add up to {@code N}. Constraints arise from concatenation.
 *
 * <p>It is always possible to increase the width of a constraint pair, so
 * unifying with a concrete bit-vector type of at least {@code minBits} bits
 * always succeeds.
 */
public class BvTypeProxy extends ConstrainedProxy {
  public final int minBits;
  private final ImmutableList<Constraint> constraints;

  /** Creates a proxy for a bit-vector of at least {@code minBits} bits. */
  public BvTypeProxy(Pos pos, String name, int minBits) {
    super(pos, name, "bv" + minBits + "proxy");
    checkArgument(minBits >= 0);
    this.minBits = minBits;
    this.constraints = ImmutableList.of();
  }

  /** Creates a proxy for the concatenation of two bit-vectors. Any further
   * constraints on {@code t0} and {@code t1} must go via this proxy. */
  public BvTypeProxy(Pos pos, String name, Type t0, Type t1) {
    super(pos, name, "bvproxy");
    checkArgument(t0.isBv() && t1.isBv());
    t0 = followProxy(t0);
    t1 = followProxy(t1);
    this.minBits = minBitsFor(t0) + minBitsFor(t1);
    this.constraints = ImmutableList.of(new Constraint(t0, t1));
  }

  private BvTypeProxy(
      Pos pos, String name, int minBits, List<Constraint> constraints) {
    super(pos, name, "");
    this.minBits = minBits;
    this.constraints = ImmutableList.copyOf(constraints);
  }

  private static int minBitsFor(Type t) {
    if (t instanceof BvType) {
      return t.bvBits();
    } else {
      return ((BvTypeProxy) t).minBits;
    }
  }

  @Override
  public Type clone(Map<TypeVariable, TypeVariable> varMap) {
    final Type p = proxyFor();
    return p != null
        ? p.clone(varMap)
        : new BvTypeProxy(pos, name, minBits, constraints);
  }

  @Override
  public Type cloneUnresolved() {
    return new BvTypeProxy(pos, name, minBits, constraints);
  }

  @Override
  public boolean unify(
      Type that,
      List<TypeVariable> unifiableVariables,
      Map<TypeVariable, Type> unifier) {
    final Type p = proxyFor();
    if (p != null) {
      return p.unify(that, unifiableVariables, unifier);
    }

    that = followProxy(that.expanded());
    if (reallyOccursIn(that)) {
      return false;
    }
    if (that instanceof TypeVariable
        && containsIdentical(
            unifiableVariables, (TypeVariable) that)) {
      return that.unify(this, unifiableVariables, unifier);
    }

    if (this == that) {
      return true;
    } else if (that instanceof BvType) {
      final int bits = that.bvBits();
      if (minBits > bits) {
        return false;
      }
      for (Constraint c : constraints) {
        final int minT1 = minBitsFor(c.t1);
        int left = increaseBits(c.t0, bits - minT1);
        left = increaseBits(c.t1, minT1 + left);
        checkState(left == 0, "could not widen %s to %s", this, that);
      }
      defineProxy(that);
      return true;
    } else if (that instanceof BvTypeProxy) {
      // Keep the proxy with the higher minBits; if either has constraints,
      // define both to a new proxy that has the constraints of both.
      final BvTypeProxy bt = (BvTypeProxy) that;
      if (!this.constraints.isEmpty() || !bt.constraints.isEmpty()) {
        final BvTypeProxy np =
            new BvTypeProxy(pos, name, Math.max(this.minBits, bt.minBits),
                ImmutableList.<Constraint>builder()
                    .addAll(this.constraints)
                    .addAll(bt.constraints)
                    .build());
        this.defineProxy(np);
        bt.defineProxy(np);
      } else if (this.minBits <= bt.minBits) {
        this.defineProxy(bt);
      } else {
        bt.defineProxy(this);
      }
      return true;
    } else if (that instanceof ConstrainedProxy) {
      return false;
    } else if (that instanceof TypeProxy) {
      return that.unify(this, unifiableVariables, unifier);
    }
    return false;
  }

  /** Widens {@code t} to {@code to} bits if it is a proxy, and returns the
   * number of bits that could not be provided. */
  private static int increaseBits(Type t, int to) {
    t = followProxy(t);
    if (t instanceof BvType) {
      return to - t.bvBits();
    }
    final BvTypeProxy p = (BvTypeProxy) t;
    checkState(p.minBits <= to);
    if (p.minBits < to) {
      p.defineProxy(new BvTypeProxy(p.pos, p.name, to, p.constraints));
    }
    return 0;
  }

  @Override
  public boolean isBv() {
    return true;
  }

  /** Returns the width; before the proxy is defined, this is the lower bound
   * on the width. */
  @Override
  public int bvBits() {
    final Type p = proxyFor();
    return p != null ? p.bvBits() : minBits;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /** Requires that {@code t0} and {@code t1} are bit-vectors whose widths
   * add up to the width of the proxy. */
  private static class Constraint {
    final Type t0;
    final Type t1;

    Constraint(Type t0, Type t1) {
      this.t0 = requireNonNull(t0);
      this.t1 = requireNonNull(t1);
    }
  }
}

// End BvTypeProxy.java
