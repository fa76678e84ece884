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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.affine.ast.AffineBuilder.affine;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.Op;
import net.hydromatic.affine.op.Value;
import net.hydromatic.affine.range.Interval;

/**
 * Removes terms that are too small to affect the result from the numerator
 * of a floor division or modulo.
 *
 * <p>The numerator must be linear. Its terms are sorted by descending
 * coefficient magnitude, and the pruner repeatedly examines the last,
 * smallest, term. Let {@code g} be the gcd of the denominator and the
 * coefficients of the other terms (see {@link GcdLadder#threshold()}). The
 * other terms sum to a multiple of {@code g}; if the range analysis proves
 * that the smallest term lies in {@code [0, g)}, adding it cannot carry the
 * sum across a multiple of the denominator, and therefore:
 *
 * <ul>
 *   <li>{@code (rest + t) floordiv d = rest floordiv d}
 *   <li>{@code (rest + t) mod d = t + rest mod d}
 * </ul>
 *
 * <p>Pruning stops at the first term that cannot be removed.
 *
 * <p>There is one instance for each kind of division: {@link #FLOOR_DIV}
 * and {@link #MOD}.
 */
public abstract class TermPruner {
  /** Pruner for floor division; removed terms are discarded. */
  public static final TermPruner FLOOR_DIV = new FloorDivPruner();

  /** Pruner for modulo; removed terms are added outside the modulo. */
  public static final TermPruner MOD = new ModPruner();

  /** Kind of division that this pruner simplifies. */
  public final Op op;

  private TermPruner(Op op) {
    this.op = op;
  }

  /**
   * Removes small terms from the numerator of a division.
   *
   * <p>Returns {@code division} itself if the numerator is not linear or if
   * no term can be removed.
   *
   * <p>Removals are reported to the tracer only once pruning has finished;
   * if a contract violation leaves the division unchanged, none are
   * reported.
   */
  public Affine.Exp prune(Affine.Division division, AccessContext cx) {
    checkArgument(division.op == op, "expected %s: %s", op, division);
    final List<Term> terms0 = Terms.terms(division.numerator);
    if (terms0 == null) {
      return division; // not linear
    }
    final List<Term> terms = Terms.reorder(terms0);
    GcdLadder ladder = GcdLadder.of(division.denominator, terms);
    Affine.Exp numerator = Terms.accumulate(terms);
    final List<Drop> drops = new ArrayList<>();
    for (int n = terms.size(); n >= 2; n--) {
      final Term smallest = terms.get(n - 1);
      if (numerator.op != Op.ADD
          || ((Affine.Add) numerator).right != smallest.exp
          || ladder.size() != n) {
        return cx.violation(
            division,
            "malformed term tree " + numerator + " for " + n + " terms");
      }
      final Value value =
          cx.materializer.materialize(
              smallest.coefficient, smallest.operand, cx.op);
      if (value == null) {
        return cx.violation(
            division, "materializer returned null for " + smallest);
      }
      cx.rangeEngine.extend(value);
      final Interval interval = cx.rangeEngine.rangeOf(value);
      final long threshold = ladder.threshold();
      if (interval == null
          || interval.hi >= threshold
          || cx.verifyNonNegative && !interval.isNonNegative()) {
        cx.tracer.onKeep(cx.op, smallest, interval, threshold);
        break;
      }
      drops.add(new Drop(smallest, interval, threshold));
      numerator = ((Affine.Add) numerator).left;
      ladder = ladder.dropLast();
    }
    if (drops.isEmpty()) {
      return division;
    }
    final List<Term> dropped = new ArrayList<>();
    for (Drop drop : drops) {
      cx.tracer.onDrop(cx.op, drop.term, drop.interval, drop.threshold);
      dropped.add(drop.term);
    }
    cx.onDropped(dropped.size());
    return rebuild(numerator, division.denominator, dropped);
  }

  /**
   * Creates the simplified expression.
   *
   * @param numerator Sum of the terms that remain
   * @param denominator Denominator
   * @param dropped Terms that were removed, smallest first
   */
  protected abstract Affine.Exp rebuild(
      Affine.Exp numerator, long denominator, List<Term> dropped);

  /** Pruner for {@link Affine.FloorDiv}. */
  private static class FloorDivPruner extends TermPruner {
    FloorDivPruner() {
      super(Op.FLOOR_DIV);
    }

    @Override
    protected Affine.Exp rebuild(
        Affine.Exp numerator, long denominator, List<Term> dropped) {
      return affine.floorDiv(numerator, denominator);
    }
  }

  /** Pruner for {@link Affine.Mod}. */
  private static class ModPruner extends TermPruner {
    ModPruner() {
      super(Op.MOD);
    }

    @Override
    protected Affine.Exp rebuild(
        Affine.Exp numerator, long denominator, List<Term> dropped) {
      Affine.Exp extracted = affine.constant(0);
      for (Term term : dropped) {
        extracted = affine.add(extracted, term.exp);
      }
      return affine.add(extracted, affine.mod(numerator, denominator));
    }
  }

  /** A term that was found to be small, with the evidence. */
  private static class Drop {
    final Term term;
    final Interval interval;
    final long threshold;

    Drop(Term term, Interval interval, long threshold) {
      this.term = term;
      this.interval = interval;
      this.threshold = threshold;
    }
  }
}

// End TermPruner.java
