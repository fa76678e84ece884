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

import static net.hydromatic.affine.ast.AffineBuilder.affine;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.op.ExpandedValue;
import net.hydromatic.affine.op.Expander;
import net.hydromatic.affine.op.MemoryAccess;
import net.hydromatic.affine.op.Value;
import net.hydromatic.affine.range.Interval;
import net.hydromatic.affine.range.IntervalAnalysis;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interval} and {@link IntervalAnalysis}. */
class IntervalTest {
  @Test
  void testOfRange() {
    assertThat(Interval.of(Range.closedOpen(0L, 64L)), hasToString("[0, 63]"));
    assertThat(Interval.of(Range.closed(-3L, 3L)), hasToString("[-3, 3]"));
    assertThat(Interval.of(Range.open(0L, 2L)), hasToString("[1, 1]"));
    assertThat(Interval.of(Range.closed(0L, Long.MAX_VALUE)).hi,
        is(Long.MAX_VALUE));
    assertThat(Interval.of(Range.singleton(Long.MIN_VALUE)),
        is(Interval.point(Long.MIN_VALUE)));
    assertThat(Interval.of(0, 63).toRange(), is(Range.closed(0L, 63L)));

    assertThrows(IllegalArgumentException.class,
        () -> Interval.of(Range.atLeast(0L)));
    assertThrows(IllegalArgumentException.class,
        () -> Interval.of(Range.closedOpen(5L, 5L)));
    assertThrows(IllegalArgumentException.class, () -> Interval.of(3, 1));
  }

  @Test
  void testArithmetic() {
    final Interval i = Interval.of(0, 3);
    assertThat(i.plus(Interval.of(10, 20)), hasToString("[10, 23]"));
    assertThat(i.times(-2), hasToString("[-6, 0]"));
    assertThat(i.times(0), hasToString("[0, 0]"));
    assertThat(Interval.of(-5, 7).floorDiv(4), hasToString("[-2, 1]"));
    assertThat(Interval.of(5, 7).mod(4), hasToString("[1, 3]"));
    assertThat(Interval.of(3, 5).mod(4), hasToString("[0, 3]"));
    assertThat(Interval.of(-1, -1).mod(4), hasToString("[3, 3]"));
    assertThat(i.contains(3), is(true));
    assertThat(i.contains(4), is(false));
    assertThat(i.isNonNegative(), is(true));
    assertThat(Interval.of(-1, 3).isNonNegative(), is(false));

    assertThrows(ArithmeticException.class,
        () -> Interval.of(0, Long.MAX_VALUE).times(2));
    assertThrows(ArithmeticException.class,
        () -> Interval.point(Long.MAX_VALUE).plus(Interval.point(1)));
    assertThrows(IllegalArgumentException.class, () -> i.floorDiv(0));
  }

  @Test
  void testAnalysis() {
    final Value i = Value.of("i");
    final Value j = Value.of("j");
    final MemoryAccess load =
        MemoryAccess.load("A",
            IndexMap.of(2, 0, affine.dim(0), affine.dim(1)),
            ImmutableList.of(i, j), ImmutableList.of());
    final IntervalAnalysis analysis =
        new IntervalAnalysis()
            .bound(i, Range.closedOpen(0L, 4L))
            .bound(j, Range.closed(-2L, 5L));
    assertThat(analysis.rangeOf(i), hasToString("[0, 3]"));

    final Expander expander = new Expander();
    final ExpandedValue v0 = expander.materialize(128, affine.dim(0), load);
    assertThat(analysis.rangeOf(v0), nullValue());
    analysis.extend(v0);
    assertThat(analysis.rangeOf(v0), hasToString("[0, 384]"));

    final ExpandedValue v1 = expander.materialize(-3, affine.dim(1), load);
    analysis.extend(v1);
    assertThat(analysis.rangeOf(v1), hasToString("[-15, 6]"));

    final ExpandedValue v2 =
        expander.materialize(1, affine.constant(42), load);
    analysis.extend(v2);
    assertThat(analysis.rangeOf(v2), hasToString("[42, 42]"));

    // Extending a value that is not derived from an access does nothing
    final Value k = Value.of("k");
    analysis.extend(k);
    assertThat(analysis.rangeOf(k), nullValue());

    // Extending a bound value leaves its bound alone
    analysis.bound(v0, Interval.of(1, 2));
    analysis.extend(v0);
    assertThat(analysis.rangeOf(v0), hasToString("[1, 2]"));
  }

  @Test
  void testAnalysisUnknown() {
    final Value i = Value.of("i");
    final Value j = Value.of("j");
    final MemoryAccess load =
        MemoryAccess.load("A",
            IndexMap.of(2, 0, affine.dim(0), affine.dim(1)),
            ImmutableList.of(i, j), ImmutableList.of());
    final IntervalAnalysis analysis =
        new IntervalAnalysis().bound(i, Range.closed(0L, Long.MAX_VALUE));
    final Expander expander = new Expander();

    // j has no bound
    final ExpandedValue v0 = expander.materialize(2, affine.dim(1), load);
    analysis.extend(v0);
    assertThat(analysis.rangeOf(v0), nullValue());

    // 2 * i overflows
    final ExpandedValue v1 = expander.materialize(2, affine.dim(0), load);
    analysis.extend(v1);
    assertThat(analysis.rangeOf(v1), nullValue());

    final ExpandedValue v2 = expander.materialize(1, affine.dim(0), load);
    analysis.extend(v2);
    assertThat(analysis.rangeOf(v2).hi, is(Long.MAX_VALUE));
  }
}

// End IntervalTest.java
