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

import static net.hydromatic.affine.ast.AffineBuilder.affine;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.range.Materializer;

/**
 * Implementation of {@link Materializer} that expands a term into an {@link
 * ExpandedValue} over the operands of the access.
 *
 * <p>Values are named "%0", "%1", ... in order of creation. Each is recorded
 * in {@link #inserted()}, in the order it was created.
 *
 * <p>Asking again for the same product at the same access returns the value
 * created the first time. A pass that sweeps an access several times
 * therefore creates each value once, and a {@link
 * net.hydromatic.affine.range.RangeEngine} computes its range once.
 */
public class Expander implements Materializer {
  private final List<ExpandedValue> inserted = new ArrayList<>();
  private final Table<AccessOp, Affine.Exp, ExpandedValue> values =
      HashBasedTable.create();

  @Override
  public ExpandedValue materialize(
      long coefficient, Affine.Exp operand, AccessOp at) {
    final Affine.Exp exp = affine.mul(coefficient, operand);
    final ExpandedValue existing = values.get(at, exp);
    if (existing != null) {
      return existing;
    }
    final ExpandedValue value =
        new ExpandedValue(
            "%" + inserted.size(),
            exp,
            ImmutableList.copyOf(at.dimOperands()),
            ImmutableList.copyOf(at.symbolOperands()),
            at);
    values.put(at, exp, value);
    inserted.add(value);
    return value;
  }

  /** Returns the values created so far. */
  public List<ExpandedValue> inserted() {
    return ImmutableList.copyOf(inserted);
  }
}

// End Expander.java
