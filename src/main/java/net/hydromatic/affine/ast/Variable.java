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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Ordering;

/**
 * Reference to a dimension or symbol of an {@link IndexMap}.
 *
 * <p>A variable carries identity only: its kind and its position among the
 * map's dimensions or symbols. Its runtime value is bound by the operation
 * that owns the map.
 */
public final class Variable implements Comparable<Variable> {
  /** Ordering that puts dimensions before symbols, then sorts by position. */
  public static final Ordering<Variable> ORDERING =
      Ordering.from(Variable::compare);

  public final Kind kind;
  public final int position;

  private Variable(Kind kind, int position) {
    this.kind = requireNonNull(kind, "kind");
    this.position = position;
    checkArgument(position >= 0, "negative position %s", position);
  }

  /** Creates a dimension variable. */
  public static Variable dim(int position) {
    return new Variable(Kind.DIM, position);
  }

  /** Creates a symbol variable. */
  public static Variable symbol(int position) {
    return new Variable(Kind.SYMBOL, position);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + position;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Variable
            && ((Variable) o).kind == kind
            && ((Variable) o).position == position;
  }

  @Override
  public String toString() {
    return kind.prefix + position;
  }

  @Override
  public int compareTo(Variable o) {
    return compare(this, o);
  }

  /** Helper for {@link #ORDERING}. */
  static int compare(Variable v1, Variable v2) {
    int c = v1.kind.compareTo(v2.kind);
    if (c != 0) {
      return c;
    }
    return Integer.compare(v1.position, v2.position);
  }

  /** Kind of variable. */
  public enum Kind {
    /** Varies per loop iteration; bound to an induction variable. */
    DIM("d"),
    /** Invariant within the analyzed region. */
    SYMBOL("s");

    final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }
  }
}

// End Variable.java
