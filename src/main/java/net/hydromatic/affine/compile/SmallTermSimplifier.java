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
package net.hydromatic.affine.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.affine.util.Static.transformEager;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.ast.Shuttle;
import net.hydromatic.affine.eval.Prop;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.range.Materializer;
import net.hydromatic.affine.range.RangeEngine;

/**
 * Rewrite rule that removes small terms from every floor division (or every
 * modulo) in the index map of an access.
 *
 * <p>Each result expression is rebuilt bottom-up; each division of the kind
 * handled by the rule's {@link TermPruner} is pruned after its numerator has
 * been rewritten. If any term was removed from any result, the access's map
 * is replaced, once, by a map with the same dimensions, symbols and number
 * of results.
 */
public class SmallTermSimplifier {
  private final TermPruner pruner;
  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  /** Creates a SmallTermSimplifier. */
  public SmallTermSimplifier(
      TermPruner pruner, Map<Prop, Object> map, Tracer tracer) {
    this.pruner = requireNonNull(pruner, "pruner");
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a rule that simplifies floor divisions. */
  public static SmallTermSimplifier floorDiv(
      Map<Prop, Object> map, Tracer tracer) {
    return new SmallTermSimplifier(TermPruner.FLOOR_DIV, map, tracer);
  }

  /** Creates a rule that simplifies modulo expressions. */
  public static SmallTermSimplifier mod(Map<Prop, Object> map, Tracer tracer) {
    return new SmallTermSimplifier(TermPruner.MOD, map, tracer);
  }

  /** Returns the pruner. */
  public TermPruner pruner() {
    return pruner;
  }

  /**
   * Simplifies the index map of an access.
   *
   * <p>Returns true if the map was replaced, false if the rule does not
   * apply.
   */
  public boolean rewrite(
      AccessOp op, RangeEngine rangeEngine, Materializer materializer) {
    final IndexMap before = op.map();
    final AccessContext cx =
        new AccessContext(op, rangeEngine, materializer, tracer, map);
    final Shuttle shuttle = new PruningShuttle(cx);
    final List<Affine.Exp> results =
        transformEager(before.results, e -> e.accept(shuttle));
    if (cx.dropCount() == 0) {
      return false;
    }
    final IndexMap after = before.withResults(results);
    op.setMap(after);
    tracer.onRewrite(op, before, after);
    return true;
  }

  @Override
  public String toString() {
    return "SmallTermSimplifier(" + pruner.op + ")";
  }

  /** Shuttle that prunes each division after rewriting its numerator. */
  private class PruningShuttle extends Shuttle {
    private final AccessContext cx;

    PruningShuttle(AccessContext cx) {
      this.cx = cx;
    }

    @Override
    protected Affine.Exp visit(Affine.FloorDiv floorDiv) {
      return prune(super.visit(floorDiv));
    }

    @Override
    protected Affine.Exp visit(Affine.Mod mod) {
      return prune(super.visit(mod));
    }

    private Affine.Exp prune(Affine.Exp e) {
      // Rewriting the numerator may have folded the division to a constant
      if (e.op != pruner.op) {
        return e;
      }
      return pruner.prune((Affine.Division) e, cx);
    }
  }
}

// End SmallTermSimplifier.java
