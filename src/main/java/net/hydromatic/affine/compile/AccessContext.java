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

import java.util.Map;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.eval.Prop;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.range.Materializer;
import net.hydromatic.affine.range.RangeEngine;

/**
 * What a {@link TermPruner} needs to know about the access whose index map
 * it is simplifying.
 *
 * <p>A context is created for one invocation of {@link
 * SmallTermSimplifier#rewrite} and discarded afterwards.
 */
public class AccessContext {
  final AccessOp op;
  final RangeEngine rangeEngine;
  final Materializer materializer;
  final Tracer tracer;
  final boolean verifyNonNegative;
  final boolean failFast;
  private int dropCount;

  AccessContext(
      AccessOp op,
      RangeEngine rangeEngine,
      Materializer materializer,
      Tracer tracer,
      Map<Prop, Object> map) {
    this.op = requireNonNull(op, "op");
    this.rangeEngine = requireNonNull(rangeEngine, "rangeEngine");
    this.materializer = requireNonNull(materializer, "materializer");
    this.tracer = requireNonNull(tracer, "tracer");
    this.verifyNonNegative = Prop.VERIFY_NON_NEGATIVE.booleanValue(map);
    this.failFast = Prop.FAIL_FAST.booleanValue(map);
  }

  /** Records that terms have been removed. */
  void onDropped(int count) {
    dropCount += count;
  }

  /** Returns the number of terms removed so far. */
  int dropCount() {
    return dropCount;
  }

  /**
   * Handles an internal inconsistency: throws if {@link Prop#FAIL_FAST},
   * otherwise notifies the tracer and returns {@code unchanged}.
   */
  Affine.Exp violation(Affine.Exp unchanged, String message) {
    if (failFast) {
      throw new AffineException(message);
    }
    tracer.onViolation(op, message);
    return unchanged;
  }
}

// End AccessContext.java
