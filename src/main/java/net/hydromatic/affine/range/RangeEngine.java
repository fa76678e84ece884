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

import net.hydromatic.affine.op.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integer range analysis.
 *
 * <p>Bounds must be sound: every value that a {@link Value} can take at
 * runtime lies within the interval returned for it.
 */
public interface RangeEngine {
  /** Returns a bound on the values of {@code value}, or null if unknown. */
  @Nullable Interval rangeOf(Value value);

  /**
   * Extends the analysis to cover a value that was created after the
   * analysis ran, such as a value created by a {@link Materializer}.
   */
  void extend(Value value);
}

// End RangeEngine.java
