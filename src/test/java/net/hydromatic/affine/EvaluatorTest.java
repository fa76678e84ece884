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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.eval.Evaluator;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator}. */
class EvaluatorTest {
  private final Affine.Var d0 = affine.dim(0);
  private final Affine.Var s0 = affine.symbol(0);

  @Test
  void testEval() {
    final long[] dims = {-7};
    final long[] symbols = {3};
    assertThat(Evaluator.eval(affine.floorDiv(d0, 2), dims, symbols), is(-4L));
    assertThat(Evaluator.eval(affine.mod(d0, 2), dims, symbols), is(1L));
    assertThat(
        Evaluator.eval(affine.add(affine.mul(4, d0), s0), dims, symbols),
        is(-25L));
    assertThat(
        Evaluator.eval(affine.mul(affine.mod(s0, 2), affine.constant(5)), dims,
            symbols),
        is(5L));
  }

  @Test
  void testEvalMap() {
    final IndexMap map =
        IndexMap.of(1, 1,
            affine.floorDiv(affine.add(affine.mul(128, d0), s0), 128),
            affine.mod(affine.add(affine.mul(128, d0), s0), 128));
    assertThat(Evaluator.eval(map, new long[] {3}, new long[] {70}),
        is(new long[] {3, 70}));
    assertThrows(IllegalArgumentException.class,
        () -> Evaluator.eval(map, new long[] {3, 4}, new long[] {70}));
  }
}

// End EvaluatorTest.java
