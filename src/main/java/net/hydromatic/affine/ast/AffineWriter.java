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
 * Prints affine expressions, inserting parentheses as required by operator
 * precedence.
 */
class AffineWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string to the output. */
  AffineWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression, parenthesized if its operator binds too loosely. */
  AffineWriter append(Affine.Exp e, int left, int right) {
    return e.unparse(this, left, right);
  }

  /** Appends a call to a binary operator. */
  AffineWriter infix(
      int left, Affine.Exp a0, Op op, Affine.Exp a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    return append(a0, left, op.left)
        .append(op.padded)
        .append(a1, op.right, right);
  }
}

// End AffineWriter.java
