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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import java.util.List;

/**
 * Successive greatest common divisors of a denominator and the coefficients
 * of a list of terms.
 *
 * <p>For denominator {@code d} and coefficients {@code c1, ..., cn}, sorted
 * by descending magnitude, the ladder is {@code g0 = d} and {@code gk =
 * gcd(g(k-1), ck)}.
 *
 * <p>{@code g(n-1)}, the {@link #threshold()}, is the gcd of {@code d} and
 * every coefficient except the last. Every sum of the first {@code n - 1}
 * terms is a multiple of the threshold, so adding a value in {@code [0,
 * threshold)} to it never crosses a multiple of {@code d}.
 */
public final class GcdLadder {
  /** g0, ..., gn. */
  private final ImmutableList<Long> gcds;

  private GcdLadder(ImmutableList<Long> gcds) {
    this.gcds = gcds;
  }

  /** Creates a ladder for a positive denominator and a list of terms. */
  public static GcdLadder of(long denominator, List<Term> terms) {
    checkArgument(
        denominator > 0, "denominator must be positive: %s", denominator);
    final ImmutableList.Builder<Long> b =
        ImmutableList.builderWithExpectedSize(terms.size() + 1);
    long g = denominator;
    b.add(g);
    for (Term term : terms) {
      g = gcd(g, term.coefficient);
      b.add(g);
    }
    return new GcdLadder(b.build());
  }

  /** Returns the number of terms that this ladder covers. */
  public int size() {
    return gcds.size() - 1;
  }

  /** Returns the {@code k}th entry, {@code gk}. */
  public long get(int k) {
    return gcds.get(k);
  }

  /**
   * Returns {@code g(n-1)}, the gcd of the denominator and the coefficients
   * of all terms but the last.
   */
  public long threshold() {
    checkState(size() > 0, "ladder covers no terms");
    return gcds.get(size() - 1);
  }

  /** Returns the ladder for all terms but the last. */
  public GcdLadder dropLast() {
    checkState(size() > 0, "ladder covers no terms");
    return new GcdLadder(gcds.subList(0, gcds.size() - 1));
  }

  @Override
  public String toString() {
    return gcds.toString();
  }

  /** Returns the gcd of a positive value and the magnitude of another. */
  static long gcd(long positive, long c) {
    // |Long.MIN_VALUE| overflows. A positive long has at most 2^62 as a
    // factor, so gcd(a, 2^63) = gcd(a, 2^62).
    final long magnitude = c == Long.MIN_VALUE ? 1L << 62 : Math.abs(c);
    return LongMath.gcd(positive, magnitude);
  }
}

// End GcdLadder.java
