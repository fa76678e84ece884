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

import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.op.AccessOp;
import net.hydromatic.affine.op.Value;

/**
 * Converts a symbolic term into a value that a {@link RangeEngine} can bound.
 */
public interface Materializer {
  /**
   * Creates a value for {@code coefficient * operand} at the program point of
   * an access, with the access's dimension and symbol operands substituted
   * for the variables of {@code operand}. Never returns null.
   */
  Value materialize(long coefficient, Affine.Exp operand, AccessOp at);
}

// End Materializer.java
