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
package net.hydromatic.affine;

import static com.google.common.base.Preconditions.checkArgument;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.ast.Variable;
import net.hydromatic.affine.compile.SmallTermSimplifier;
import net.hydromatic.affine.compile.TermPruner;
import net.hydromatic.affine.compile.Tracer;
import net.hydromatic.affine.compile.Tracers;
import net.hydromatic.affine.eval.Evaluator;
import net.hydromatic.affine.eval.Prop;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.op.Expander;
import net.hydromatic.affine.op.MemoryAccess;
import net.hydromatic.affine.op.Value;
import net.hydromatic.affine.range.Interval;
import net.hydromatic.affine.range.IntervalAnalysis;
import net.hydromatic.affine.range.Materializer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fluent test helper.
 *
 * <p>Holds an index map, the ranges of its dimensions and symbols, and the
 * configuration with which to simplify it.
 */
class Fixture {
  /** Largest iteration space that {@link #assertEquivalent} enumerates. */
  private static final long MAX_POINTS = 100_000;

  private final IndexMap map;
  private final ImmutableMap<Variable, Range<Long>> ranges;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;
  private final @Nullable Materializer materializer;

  private Fixture(
      IndexMap map,
      Map<Variable, Range<Long>> ranges,
      Map<Prop, Object> propMap,
      Tracer tracer,
      @Nullable Materializer materializer) {
    this.map = map;
    this.ranges = ImmutableMap.copyOf(ranges);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
    this.materializer = materializer;
  }

  /** Creates a {@code Fixture}. */
  static Fixture fixture(IndexMap map) {
    return new Fixture(
        map, ImmutableMap.of(), ImmutableMap.of(), Tracers.empty(), null);
  }

  /** Creates a {@code Fixture} for a map with the given results. */
  static Fixture fixture(int dimCount, int symbolCount, Affine.Exp... results) {
    return fixture(IndexMap.of(dimCount, symbolCount, results));
  }

  IndexMap map() {
    return map;
  }

  /** Returns a fixture where dimension {@code i} lies in {@code [lo, hi)}. */
  Fixture withDimRange(int i, long lo, long hi) {
    return withRange(Variable.dim(i), Range.closedOpen(lo, hi));
  }

  /** Returns a fixture where symbol {@code i} lies in {@code [lo, hi)}. */
  Fixture withSymbolRange(int i, long lo, long hi) {
    return withRange(Variable.symbol(i), Range.closedOpen(lo, hi));
  }

  Fixture withRange(Variable variable, Range<Long> range) {
    final Map<Variable, Range<Long>> ranges = new LinkedHashMap<>(this.ranges);
    ranges.put(variable, range);
    return new Fixture(map, ranges, propMap, tracer, materializer);
  }

  Fixture withProp(Prop prop, Object value) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>(this.propMap);
    prop.set(propMap, value);
    return new Fixture(map, ranges, propMap, tracer, materializer);
  }

  Fixture withTracer(Tracer tracer) {
    return new Fixture(map, ranges, propMap, tracer, materializer);
  }

  Fixture withMaterializer(Materializer materializer) {
    return new Fixture(map, ranges, propMap, tracer, materializer);
  }

  /**
   * Creates a load of the map. Dimension operands are named {@code i0},
   * {@code i1} etc.; symbol operands {@code n0}, {@code n1} etc.
   */
  MemoryAccess load() {
    return MemoryAccess.load("A", map, operands("i", map.dimCount),
        operands("n", map.symbolCount));
  }

  private static List<Value> operands(String prefix, int count) {
    final ImmutableList.Builder<Value> b = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      b.add(Value.of(prefix + i));
    }
    return b.build();
  }

  /** Creates a range engine that knows the bounds of an access's operands. */
  IntervalAnalysis rangeEngine(AccessOp access) {
    final IntervalAnalysis analysis = new IntervalAnalysis();
    ranges.forEach((variable, range) -> {
      final List<Value> operands =
          variable.kind == Variable.Kind.DIM
              ? access.dimOperands()
              : access.symbolOperands();
      analysis.bound(operands.get(variable.position), range);
    });
    return analysis;
  }

  private Materializer materializer() {
    return materializer != null ? materializer : new Expander();
  }

  @CanIgnoreReturnValue
  Fixture assertFloorDiv(String expected) {
    return assertRewrite(TermPruner.FLOOR_DIV, expected);
  }

  @CanIgnoreReturnValue
  Fixture assertMod(String expected) {
    return assertRewrite(TermPruner.MOD, expected);
  }

  @CanIgnoreReturnValue
  Fixture assertUnchanged() {
    assertRewrite(TermPruner.FLOOR_DIV, map.toString());
    return assertRewrite(TermPruner.MOD, map.toString());
  }

  /**
   * Applies a rule to a fresh load of the map, and checks the resulting map.
   *
   * <p>Also checks that the rule is idempotent, and, if every variable has a
   * range, that the new map computes the same indices as the old one.
   */
  @CanIgnoreReturnValue
  Fixture assertRewrite(TermPruner pruner, String expected) {
    final MemoryAccess access = load();
    final IntervalAnalysis rangeEngine = rangeEngine(access);
    final SmallTermSimplifier rule =
        new SmallTermSimplifier(pruner, propMap, tracer);
    final boolean rewritten = rule.rewrite(access, rangeEngine, materializer());
    assertThat(access.map(), hasToString(expected));
    assertThat(rewritten, is(!expected.equals(map.toString())));
    if (rewritten) {
      final IndexMap map2 = access.map();
      assertThat(rule.rewrite(access, rangeEngine, materializer()), is(false));
      assertThat(access.map(), sameInstance(map2));
    } else {
      assertThat(access.map(), sameInstance(map));
    }
    // With the upper bound alone, the rewrite is not always sound
    if (Prop.VERIFY_NON_NEGATIVE.booleanValue(propMap)) {
      assertEquivalent(map, access.map(), ranges);
    }
    return this;
  }

  /**
   * Checks that two maps compute the same indices at every point of the
   * iteration space. Does nothing if a variable has no range or the space is
   * too large.
   */
  static void assertEquivalent(
      IndexMap before, IndexMap after, Map<Variable, Range<Long>> ranges) {
    checkArgument(before.sameArity(after));
    final int dimCount = before.dimCount;
    final Interval[] intervals =
        new Interval[dimCount + before.symbolCount];
    long points = 1;
    for (int i = 0; i < intervals.length; i++) {
      final Variable variable =
          i < dimCount ? Variable.dim(i) : Variable.symbol(i - dimCount);
      final Range<Long> range = ranges.get(variable);
      if (range == null) {
        return;
      }
      intervals[i] = Interval.of(range);
      points *= intervals[i].hi - intervals[i].lo + 1;
      if (points > MAX_POINTS) {
        return;
      }
    }
    final long[] point = new long[intervals.length];
    forEachPoint(intervals, point, 0, before, after);
  }

  private static void forEachPoint(Interval[] intervals, long[] point, int i,
      IndexMap before, IndexMap after) {
    if (i == intervals.length) {
      final long[] dims = Arrays.copyOfRange(point, 0, before.dimCount);
      final long[] symbols =
          Arrays.copyOfRange(point, before.dimCount, point.length);
      assertThat("at " + Arrays.toString(point) + ", " + after
              + " differs from " + before,
          Arrays.equals(Evaluator.eval(before, dims, symbols),
              Evaluator.eval(after, dims, symbols)),
          is(true));
      return;
    }
    for (long v = intervals[i].lo; v <= intervals[i].hi; v++) {
      point[i] = v;
      forEachPoint(intervals, point, i + 1, before, after);
    }
  }
}

// End Fixture.java
