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

import java.util.List;
import net.hydromatic.affine.ast.IndexMap;

/**
 * Operation that accesses memory at an address computed by an {@link
 * IndexMap}.
 *
 * <p>The map's dimensions are bound to {@link #dimOperands()} and its
 * symbols to {@link #symbolOperands()}.
 */
public interface AccessOp {
  /** Returns the current index map. */
  IndexMap map();

  /**
   * Replaces the index map.
   *
   * @throws IllegalArgumentException if the new map does not have the same
   *     number of dimensions, symbols and results as the current map
   */
  void setMap(IndexMap map);

  /** Returns the values bound to the map's dimensions. */
  List<Value> dimOperands();

  /** Returns the values bound to the map's symbols. */
  List<Value> symbolOperands();
}

// End AccessOp.java
