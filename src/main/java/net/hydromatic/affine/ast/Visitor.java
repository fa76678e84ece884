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

/** Visits affine expressions. */
public class Visitor {
  protected void visit(Affine.Constant constant) {}

  protected void visit(Affine.Var var) {}

  protected void visit(Affine.Add add) {
    add.left.accept(this);
    add.right.accept(this);
  }

  protected void visit(Affine.Mul mul) {
    mul.left.accept(this);
    mul.right.accept(this);
  }

  protected void visit(Affine.FloorDiv floorDiv) {
    floorDiv.numerator.accept(this);
  }

  protected void visit(Affine.Mod mod) {
    mod.numerator.accept(this);
  }
}

// End Visitor.java
