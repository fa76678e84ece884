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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.affine.eval.Prop;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.range.Materializer;
import net.hydromatic.affine.range.RangeEngine;

/**
 * Applies small-term simplification rules to a list of accesses, loads and
 * stores alike, until no rule applies.
 */
public class AffineSimplificationPass {
  private final ImmutableList<SmallTermSimplifier> rules;
  private final int maxIterations;

  private AffineSimplificationPass(
      ImmutableList<SmallTermSimplifier> rules, int maxIterations) {
    this.rules = rules;
    this.maxIterations = maxIterations;
    checkArgument(maxIterations >= 0, "negative maxIterations");
  }

  /**
   * Creates a pass.
   *
   * <p>The floor-division rule is included if {@link Prop#FLOOR_DIV_ENABLED},
   * the modulo rule if {@link Prop#MOD_ENABLED}.
   */
  public static AffineSimplificationPass create(
      Map<Prop, Object> map, Tracer tracer) {
    final ImmutableList.Builder<SmallTermSimplifier> rules =
        ImmutableList.builder();
    if (Prop.FLOOR_DIV_ENABLED.booleanValue(map)) {
      rules.add(SmallTermSimplifier.floorDiv(map, tracer));
    }
    if (Prop.MOD_ENABLED.booleanValue(map)) {
      rules.add(SmallTermSimplifier.mod(map, tracer));
    }
    return new AffineSimplificationPass(
        rules.build(), Prop.MAX_ITERATIONS.intValue(map));
  }

  /** Returns the rules, in the order they are applied. */
  public List<SmallTermSimplifier> rules() {
    return rules;
  }

  /**
   * Applies each rule to each access, repeating until a sweep makes no change
   * or {@link Prop#MAX_ITERATIONS} sweeps have been made.
   *
   * <p>Returns the number of times a rule replaced a map.
   */
  public int run(
      List<? extends AccessOp> ops,
      RangeEngine rangeEngine,
      Materializer materializer) {
    int rewriteCount = 0;
    for (int i = 0; i < maxIterations; i++) {
      boolean changed = false;
      for (AccessOp op : ops) {
        for (SmallTermSimplifier rule : rules) {
          if (rule.rewrite(op, rangeEngine, materializer)) {
            changed = true;
            ++rewriteCount;
          }
        }
      }
      if (!changed) {
        break;
      }
    }
    return rewriteCount;
  }
}

// End AffineSimplificationPass.java
