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
package net.hydromatic.affine.range;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.Range;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.Op;
import net.hydromatic.affine.ast.Variable;
import net.hydromatic.affine.op.ExpandedValue;
import net.hydromatic.affine.op.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementation of {@link RangeEngine} based on interval arithmetic.
 *
 * <p>The caller seeds the analysis with intervals for values defined outside
 * the analyzed code, such as loop induction variables and parameters. The
 * analysis extends itself to each {@link ExpandedValue} by evaluating the
 * value's expression over the intervals of its operands.
 *
 * <p>An interval is computed once per value and kept for the life of the
 * analysis, so the analysis holds one entry for each distinct value it has
 * been asked about. {@link net.hydromatic.affine.op.Expander} returns the
 * same value for a repeated request, which keeps that number bounded.
 *
 * <p>Not thread-safe.
 */
public class IntervalAnalysis implements RangeEngine {
  private final Map<Value, Interval> intervals = new IdentityHashMap<>();

  /** Records a bound on a value. Returns this analysis. */
  @CanIgnoreReturnValue
  public IntervalAnalysis bound(Value value, Interval interval) {
    intervals.put(requireNonNull(value), requireNonNull(interval));
    return this;
  }

  /**
   * Records a bound on a value. Returns this analysis.
   *
   * <p>For example, {@code bound(i, Range.closedOpen(0L, 64L))} says that
   * loop variable {@code i} takes values 0 through 63.
   */
  @CanIgnoreReturnValue
  public IntervalAnalysis bound(Value value, Range<Long> range) {
    return bound(value, Interval.of(range));
  }

  @Override
  public @Nullable Interval rangeOf(Value value) {
    return intervals.get(value);
  }

  @Override
  public void extend(Value value) {
    if (intervals.containsKey(value) || !(value instanceof ExpandedValue)) {
      return;
    }
    final ExpandedValue expandedValue = (ExpandedValue) value;
    final Interval interval;
    try {
      interval = intervalOf(expandedValue, expandedValue.exp);
    } catch (ArithmeticException e) {
      // A bound overflowed 64 bits; the range is unknown
      return;
    }
    if (interval != null) {
      intervals.put(value, interval);
    }
  }

  /** Computes a bound on the values of an expression, or returns null if any
   * of the operands it uses is unbounded. */
  private @Nullable Interval intervalOf(ExpandedValue value, Affine.Exp exp) {
    switch (exp.op) {
      case CONSTANT:
        return Interval.point(((Affine.Constant) exp).value);

      case VAR:
        final Variable variable = ((Affine.Var) exp).variable;
        final List<Value> operands =
            variable.kind == Variable.Kind.DIM
                ? value.dimOperands
                : value.symbolOperands;
        return intervals.get(operands.get(variable.position));

      case ADD:
        final Affine.Add add = (Affine.Add) exp;
        final Interval left = intervalOf(value, add.left);
        final Interval right = intervalOf(value, add.right);
        return left == null || right == null ? null : left.plus(right);

      case MUL:
        final Affine.Mul mul = (Affine.Mul) exp;
        if (mul.left.op == Op.CONSTANT) {
          return times(intervalOf(value, mul.right), mul.left);
        }
        if (mul.right.op == Op.CONSTANT) {
          return times(intervalOf(value, mul.left), mul.right);
        }
        return null; // product of two variables; not affine

      case FLOOR_DIV:
        final Affine.FloorDiv floorDiv = (Affine.FloorDiv) exp;
        final Interval n = intervalOf(value, floorDiv.numerator);
        return n == null ? null : n.floorDiv(floorDiv.denominator);

      case MOD:
        final Affine.Mod mod = (Affine.Mod) exp;
        final Interval n2 = intervalOf(value, mod.numerator);
        return n2 == null ? null : n2.mod(mod.denominator);

      default:
        throw new AssertionError("unexpected " + exp.op);
    }
  }

  private static @Nullable Interval times(
      @Nullable Interval interval, Affine.Exp constant) {
    return interval == null
        ? null
        : interval.times(((Affine.Constant) constant).value);
  }
}

// End IntervalAnalysis.java
