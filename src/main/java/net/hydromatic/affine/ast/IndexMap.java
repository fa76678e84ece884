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
package net.hydromatic.affine.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of affine result expressions over a fixed number of dimensions
 * and symbols.
 *
 * <p>For example, {@code (d0, d1)[s0] -> (d0 floordiv 4, d1 + s0)} has two
 * dimensions, one symbol and two results.
 *
 * <p>An index map is immutable. An operation that owns one replaces it as a
 * whole; see {@link #withResults(List)}.
 */
public final class IndexMap {
  public final int dimCount;
  public final int symbolCount;
  public final ImmutableList<Affine.Exp> results;

  private IndexMap(
      int dimCount, int symbolCount, ImmutableList<Affine.Exp> results) {
    this.dimCount = dimCount;
    this.symbolCount = symbolCount;
    this.results = results;
    checkArgument(dimCount >= 0 && symbolCount >= 0);
    final Visitor checker =
        new Visitor() {
          @Override
          protected void visit(Affine.Var var) {
            final Variable v = var.variable;
            final int count =
                v.kind == Variable.Kind.DIM ? dimCount : symbolCount;
            checkArgument(
                v.position < count,
                "variable %s out of range in map with %s dims, %s symbols",
                v,
                dimCount,
                symbolCount);
          }
        };
    results.forEach(e -> e.accept(checker));
  }

  /** Creates an index map. */
  public static IndexMap of(
      int dimCount, int symbolCount, List<? extends Affine.Exp> results) {
    return new IndexMap(dimCount, symbolCount, ImmutableList.copyOf(results));
  }

  /** Creates an index map. */
  public static IndexMap of(
      int dimCount, int symbolCount, Affine.Exp... results) {
    return of(dimCount, symbolCount, ImmutableList.copyOf(results));
  }

  /**
   * Returns a map with the same dimensions and symbols and a given list of
   * results, or this map if the results are the same.
   *
   * @throws IllegalArgumentException if the number of results differs
   */
  public IndexMap withResults(List<? extends Affine.Exp> results) {
    checkArgument(
        results.size() == this.results.size(),
        "result count must be preserved: %s, was %s",
        results.size(),
        this.results.size());
    if (results.equals(this.results)) {
      return this;
    }
    return of(dimCount, symbolCount, results);
  }

  /** Returns whether another map has the same dimension, symbol and result
   * counts as this. */
  public boolean sameArity(IndexMap map) {
    return map.dimCount == dimCount
        && map.symbolCount == symbolCount
        && map.results.size() == results.size();
  }

  @Override
  public int hashCode() {
    return Objects.hash(dimCount, symbolCount, results);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IndexMap
            && ((IndexMap) o).dimCount == dimCount
            && ((IndexMap) o).symbolCount == symbolCount
            && ((IndexMap) o).results.equals(results);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("(");
    for (int i = 0; i < dimCount; i++) {
      b.append(i > 0 ? ", " : "").append(Variable.dim(i));
    }
    b.append(")");
    if (symbolCount > 0) {
      b.append("[");
      for (int i = 0; i < symbolCount; i++) {
        b.append(i > 0 ? ", " : "").append(Variable.symbol(i));
      }
      b.append("]");
    }
    b.append(" -> (");
    for (int i = 0; i < results.size(); i++) {
      b.append(i > 0 ? ", " : "").append(results.get(i));
    }
    return b.append(")").toString();
  }
}

// End IndexMap.java
