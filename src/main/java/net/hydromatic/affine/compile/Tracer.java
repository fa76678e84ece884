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

import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.range.Interval;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during simplification. */
public interface Tracer {
  /**
   * Called when a term is removed from a numerator because its interval lies
   * below the threshold.
   */
  void onDrop(AccessOp op, Term term, Interval interval, long threshold);

  /**
   * Called when a term is kept, which ends simplification of its division.
   * The interval is null if the range analysis could not bound the term.
   */
  void onKeep(
      AccessOp op, Term term, @Nullable Interval interval, long threshold);

  /** Called when an access's index map is replaced. */
  void onRewrite(AccessOp op, IndexMap before, IndexMap after);

  /** Called when an internal inconsistency causes a division to be left
   * unchanged. */
  void onViolation(AccessOp op, String message);
}

// End Tracer.java
