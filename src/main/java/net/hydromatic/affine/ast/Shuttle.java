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

/**
 * Visits and transforms affine expressions.
 *
 * <p>The default implementation rebuilds each node bottom-up, and returns
 * the original node if none of its operands changed.
 */
public class Shuttle {
  protected Affine.Exp visit(Affine.Constant constant) {
    return constant; // leaf
  }

  protected Affine.Exp visit(Affine.Var var) {
    return var; // leaf
  }

  protected Affine.Exp visit(Affine.Add add) {
    return add.copy(add.left.accept(this), add.right.accept(this));
  }

  protected Affine.Exp visit(Affine.Mul mul) {
    return mul.copy(mul.left.accept(this), mul.right.accept(this));
  }

  protected Affine.Exp visit(Affine.FloorDiv floorDiv) {
    return floorDiv.copy(floorDiv.numerator.accept(this));
  }

  protected Affine.Exp visit(Affine.Mod mod) {
    return mod.copy(mod.numerator.accept(this));
  }
}

// End Shuttle.java
