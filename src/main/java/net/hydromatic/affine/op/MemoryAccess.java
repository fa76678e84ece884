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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.affine.ast.IndexMap;

/** Load from or store to an array, with an affine index map. */
public class MemoryAccess implements AccessOp {
  public final Kind kind;
  public final String array;
  private final ImmutableList<Value> dimOperands;
  private final ImmutableList<Value> symbolOperands;
  private IndexMap map;

  private MemoryAccess(
      Kind kind,
      String array,
      IndexMap map,
      List<Value> dimOperands,
      List<Value> symbolOperands) {
    this.kind = requireNonNull(kind, "kind");
    this.array = requireNonNull(array, "array");
    this.map = requireNonNull(map, "map");
    this.dimOperands = ImmutableList.copyOf(dimOperands);
    this.symbolOperands = ImmutableList.copyOf(symbolOperands);
    checkArgument(
        map.dimCount == dimOperands.size(),
        "map has %s dims but %s dim operands",
        map.dimCount,
        dimOperands.size());
    checkArgument(
        map.symbolCount == symbolOperands.size(),
        "map has %s symbols but %s symbol operands",
        map.symbolCount,
        symbolOperands.size());
  }

  /** Creates a load. */
  public static MemoryAccess load(
      String array,
      IndexMap map,
      List<Value> dimOperands,
      List<Value> symbolOperands) {
    return new MemoryAccess(
        Kind.LOAD, array, map, dimOperands, symbolOperands);
  }

  /** Creates a store. */
  public static MemoryAccess store(
      String array,
      IndexMap map,
      List<Value> dimOperands,
      List<Value> symbolOperands) {
    return new MemoryAccess(
        Kind.STORE, array, map, dimOperands, symbolOperands);
  }

  @Override
  public IndexMap map() {
    return map;
  }

  @Override
  public void setMap(IndexMap map) {
    checkArgument(
        this.map.sameArity(map),
        "map %s does not have the same arity as %s",
        map,
        this.map);
    this.map = map;
  }

  @Override
  public List<Value> dimOperands() {
    return dimOperands;
  }

  @Override
  public List<Value> symbolOperands() {
    return symbolOperands;
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT)
        + " "
        + array
        + " "
        + map
        + " "
        + dimOperands
        + symbolOperands;
  }

  /** Kind of memory access. */
  public enum Kind {
    LOAD,
    STORE
  }
}

// End MemoryAccess.java
