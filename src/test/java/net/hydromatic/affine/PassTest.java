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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.compile.AffineSimplificationPass;
import net.hydromatic.affine.compile.Tracers;
import net.hydromatic.affine.eval.Prop;
import net.hydromatic.affine.op.Expander;
import net.hydromatic.affine.op.MemoryAccess;
import net.hydromatic.affine.op.Value;
import net.hydromatic.affine.range.IntervalAnalysis;
import org.junit.jupiter.api.Test;

/** Tests for {@link AffineSimplificationPass}. */
class PassTest {
  private final Affine.Var d0 = affine.dim(0);
  private final Affine.Var d1 = affine.dim(1);

  private final Value i = Value.of("i");
  private final Value j = Value.of("j");

  /** Returns {@code 128 * d0 + d1}. */
  private Affine.Exp tiled() {
    return affine.add(affine.mul(128, d0), d1);
  }

  private IntervalAnalysis rangeEngine() {
    return new IntervalAnalysis()
        .bound(i, Range.closedOpen(0L, 4L))
        .bound(j, Range.closedOpen(0L, 64L));
  }

  private MemoryAccess load(Affine.Exp... results) {
    return MemoryAccess.load("A", IndexMap.of(2, 0, results),
        ImmutableList.of(i, j), ImmutableList.of());
  }

  private MemoryAccess store(Affine.Exp... results) {
    return MemoryAccess.store("B", IndexMap.of(2, 0, results),
        ImmutableList.of(i, j), ImmutableList.of());
  }

  private static Map<Prop, Object> props(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    prop.set(map, value);
    return map;
  }

  @Test
  void testLoadAndStore() {
    final MemoryAccess load = load(affine.floorDiv(tiled(), 128));
    final MemoryAccess store = store(affine.mod(tiled(), 128));
    final AffineSimplificationPass pass =
        AffineSimplificationPass.create(ImmutableMap.of(), Tracers.empty());
    assertThat(pass.rules(),
        hasToString("[SmallTermSimplifier(FLOOR_DIV), "
            + "SmallTermSimplifier(MOD)]"));

    final List<MemoryAccess> ops = ImmutableList.of(load, store);
    assertThat(pass.run(ops, rangeEngine(), new Expander()), is(2));
    assertThat(load, hasToString("load A (d0, d1) -> (128 * d0 floordiv 128) "
        + "[i, j][]"));
    assertThat(store, hasToString("store B (d0, d1) -> "
        + "(d1 + 128 * d0 mod 128) [i, j][]"));

    // A second run finds nothing to do
    assertThat(pass.run(ops, rangeEngine(), new Expander()), is(0));
  }

  /** Both rules may rewrite the same access in one sweep. */
  @Test
  void testBothRulesOneAccess() {
    final MemoryAccess load =
        load(affine.floorDiv(tiled(), 128), affine.mod(tiled(), 128));
    final AffineSimplificationPass pass =
        AffineSimplificationPass.create(ImmutableMap.of(), Tracers.empty());
    assertThat(pass.run(ImmutableList.of(load), rangeEngine(), new Expander()),
        is(2));
    assertThat(load.map(),
        hasToString("(d0, d1) -> (128 * d0 floordiv 128, "
            + "d1 + 128 * d0 mod 128)"));
  }

  /** Sweeping again does not create new values for terms already asked
   * about. */
  @Test
  void testValuesCreatedOnce() {
    final MemoryAccess load =
        load(affine.floorDiv(tiled(), 128),
            affine.floorDiv(affine.add(affine.mul(3, d0), d1), 4));
    final AffineSimplificationPass pass =
        AffineSimplificationPass.create(ImmutableMap.of(), Tracers.empty());
    final IntervalAnalysis rangeEngine = rangeEngine();
    final Expander expander = new Expander();
    final List<MemoryAccess> ops = ImmutableList.of(load);
    assertThat(pass.run(ops, rangeEngine, expander), is(1));
    assertThat(expander.inserted(), hasToString("[%0 = d1 [i, j][]]"));

    // The kept term d1 is examined again, and its value is reused
    assertThat(pass.run(ops, rangeEngine, expander), is(0));
    assertThat(expander.inserted(), hasSize(1));
    assertThat(rangeEngine.rangeOf(expander.inserted().get(0)),
        hasToString("[0, 63]"));
  }

  @Test
  void testDisableRules() {
    final AffineSimplificationPass floorDivOnly =
        AffineSimplificationPass.create(props(Prop.MOD_ENABLED, false),
            Tracers.empty());
    assertThat(floorDivOnly.rules(), hasSize(1));

    final AffineSimplificationPass modOnly =
        AffineSimplificationPass.create(props(Prop.FLOOR_DIV_ENABLED, false),
            Tracers.empty());
    assertThat(modOnly.rules(), hasToString("[SmallTermSimplifier(MOD)]"));

    final MemoryAccess load = load(affine.floorDiv(tiled(), 128));
    final MemoryAccess store = store(affine.mod(tiled(), 128));
    final List<MemoryAccess> ops = ImmutableList.of(load, store);
    final IndexMap loadMap = load.map();
    assertThat(modOnly.run(ops, rangeEngine(), new Expander()), is(1));
    assertThat(load.map(), is(loadMap));
    assertThat(store.map(),
        hasToString("(d0, d1) -> (d1 + 128 * d0 mod 128)"));

    final Map<Prop, Object> neither = props(Prop.MOD_ENABLED, false);
    Prop.FLOOR_DIV_ENABLED.set(neither, false);
    final AffineSimplificationPass none =
        AffineSimplificationPass.create(neither, Tracers.empty());
    assertThat(none.rules(), hasSize(0));
    assertThat(none.run(ops, rangeEngine(), new Expander()), is(0));
  }

  @Test
  void testMaxIterations() {
    final MemoryAccess load = load(affine.floorDiv(tiled(), 128));
    final IndexMap map = load.map();
    final AffineSimplificationPass pass =
        AffineSimplificationPass.create(props(Prop.MAX_ITERATIONS, 0),
            Tracers.empty());
    assertThat(pass.run(ImmutableList.of(load), rangeEngine(), new Expander()),
        is(0));
    assertThat(load.map(), is(map));

    final AffineSimplificationPass pass1 =
        AffineSimplificationPass.create(props(Prop.MAX_ITERATIONS, 1),
            Tracers.empty());
    assertThat(
        pass1.run(ImmutableList.of(load), rangeEngine(), new Expander()),
        is(1));
    assertThat(load.map(), hasToString("(d0, d1) -> (128 * d0 floordiv 128)"));
  }
}

// End PassTest.java
