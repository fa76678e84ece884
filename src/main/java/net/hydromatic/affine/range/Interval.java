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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.BoundType;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.math.LongMath;
import java.util.Objects;

/**
 * Closed range {@code [lo, hi]} of 64-bit integers, with {@code lo <= hi}.
 *
 * <p>An interval is a sound, possibly loose, bound on every value that a
 * quantity can take at runtime.
 *
 * <p>Arithmetic methods throw {@link ArithmeticException} if a bound
 * overflows.
 */
public final class Interval {
  public final long lo;
  public final long hi;

  private Interval(long lo, long hi) {
    checkArgument(lo <= hi, "empty interval [%s, %s]", lo, hi);
    this.lo = lo;
    this.hi = hi;
  }

  /** Creates an interval {@code [lo, hi]}. */
  public static Interval of(long lo, long hi) {
    return new Interval(lo, hi);
  }

  /** Creates an interval that contains a single value. */
  public static Interval point(long value) {
    return new Interval(value, value);
  }

  /**
   * Converts a bounded, non-empty Guava range to an interval.
   *
   * <p>For example, {@code Range.closedOpen(0L, 64L)} becomes {@code [0,
   * 63]}.
   *
   * @throws IllegalArgumentException if the range is unbounded or empty
   */
  public static Interval of(Range<Long> range) {
    checkArgument(
        range.hasLowerBound() && range.hasUpperBound(),
        "unbounded range %s",
        range);
    final Range<Long> closed =
        range.canonical(DiscreteDomain.longs()); // [lo, hi + 1)
    checkArgument(!closed.isEmpty(), "empty range %s", range);
    assert closed.lowerBoundType() == BoundType.CLOSED;
    // Canonical form of "[a, Long.MAX_VALUE]" has no upper bound
    final long hi =
        closed.hasUpperBound() ? closed.upperEndpoint() - 1 : Long.MAX_VALUE;
    return new Interval(closed.lowerEndpoint(), hi);
  }

  /** Converts this interval to a closed Guava range. */
  public Range<Long> toRange() {
    return Range.closed(lo, hi);
  }

  /** Returns whether this interval contains a given value. */
  public boolean contains(long value) {
    return lo <= value && value <= hi;
  }

  /** Returns whether every value in this interval is zero or greater. */
  public boolean isNonNegative() {
    return lo >= 0;
  }

  /** Returns the interval of {@code x + y} for x in this, y in {@code o}. */
  public Interval plus(Interval o) {
    return new Interval(
        LongMath.checkedAdd(lo, o.lo), LongMath.checkedAdd(hi, o.hi));
  }

  /** Returns the interval of {@code c * x} for x in this. */
  public Interval times(long c) {
    final long a = LongMath.checkedMultiply(lo, c);
    final long b = LongMath.checkedMultiply(hi, c);
    return new Interval(Math.min(a, b), Math.max(a, b));
  }

  /** Returns the interval of {@code x floordiv d} for x in this. */
  public Interval floorDiv(long d) {
    checkArgument(d > 0, "denominator must be positive: %s", d);
    return new Interval(Math.floorDiv(lo, d), Math.floorDiv(hi, d));
  }

  /** Returns the interval of {@code x mod d} for x in this. */
  public Interval mod(long d) {
    checkArgument(d > 0, "denominator must be positive: %s", d);
    if (Math.floorDiv(lo, d) == Math.floorDiv(hi, d)) {
      // No wrap-around: lo and hi lie in the same period
      return new Interval(Math.floorMod(lo, d), Math.floorMod(hi, d));
    }
    return new Interval(0, d - 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lo, hi);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Interval
            && ((Interval) o).lo == lo
            && ((Interval) o).hi == hi;
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }
}

// End Interval.java
