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
package net.hydromatic.affine.op;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.affine.ast.Affine;

/**
 * Value computed by an affine expression whose dimensions and symbols are
 * bound to other values.
 *
 * <p>Created by {@link Expander} so that a range analysis can bound a term
 * of an index expression.
 */
public class ExpandedValue extends Value {
  public final Affine.Exp exp;
  public final ImmutableList<Value> dimOperands;
  public final ImmutableList<Value> symbolOperands;
  /** The access at whose program point this value is computed. */
  public final AccessOp at;

  ExpandedValue(
      String name,
      Affine.Exp exp,
      ImmutableList<Value> dimOperands,
      ImmutableList<Value> symbolOperands,
      AccessOp at) {
    super(name);
    this.exp = requireNonNull(exp, "exp");
    this.dimOperands = requireNonNull(dimOperands, "dimOperands");
    this.symbolOperands = requireNonNull(symbolOperands, "symbolOperands");
    this.at = requireNonNull(at, "at");
  }

  @Override
  public String toString() {
    return name + " = " + exp + " " + dimOperands + symbolOperands;
  }
}

// End ExpandedValue.java
