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

import com.google.common.math.LongMath;
import java.util.List;

/**
 * Builds affine expressions.
 *
 * <p>Like the builder of an affine IR, it folds constants and identities as
 * it goes ({@code 2 + 3}, {@code x + 0}, {@code x * 1}, {@code x * 0},
 * {@code 7 floordiv 2}, {@code x mod 1}), but performs no other
 * simplification. A fold that would overflow 64 bits is not performed.
 */
public enum AffineBuilder {
  /**
   * The singleton instance of the builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  affine;

  private final Affine.Constant zero = new Affine.Constant(0);
  private final Affine.Constant one = new Affine.Constant(1);

  /** Creates a constant. */
  public Affine.Constant constant(long value) {
    return value == 0 ? zero : value == 1 ? one : new Affine.Constant(value);
  }

  /** Creates a reference to a variable. */
  public Affine.Var var(Variable variable) {
    return new Affine.Var(variable);
  }

  /** Creates a reference to the {@code i}th dimension. */
  public Affine.Var dim(int i) {
    return var(Variable.dim(i));
  }

  /** Creates a reference to the {@code i}th symbol. */
  public Affine.Var symbol(int i) {
    return var(Variable.symbol(i));
  }

  /** Creates an addition, folding constants and zeros. */
  public Affine.Exp add(Affine.Exp left, Affine.Exp right) {
    if (left.isConstant(0)) {
      return right;
    }
    if (right.isConstant(0)) {
      return left;
    }
    if (left.op == Op.CONSTANT && right.op == Op.CONSTANT) {
      final long v0 = ((Affine.Constant) left).value;
      final long v1 = ((Affine.Constant) right).value;
      final long sum = v0 + v1;
      // Overflow iff both operands have the sign opposite to the result
      if (((v0 ^ sum) & (v1 ^ sum)) >= 0) {
        return constant(sum);
      }
    }
    return new Affine.Add(left, right);
  }

  /** Creates a product, folding constants, zeros and ones. */
  public Affine.Exp mul(Affine.Exp left, Affine.Exp right) {
    if (left.isConstant(0) || right.isConstant(1)) {
      return left;
    }
    if (right.isConstant(0) || left.isConstant(1)) {
      return right;
    }
    if (left.op == Op.CONSTANT && right.op == Op.CONSTANT) {
      final long v0 = ((Affine.Constant) left).value;
      final long v1 = ((Affine.Constant) right).value;
      final long product = LongMath.saturatedMultiply(v0, v1);
      if (product != Long.MAX_VALUE && product != Long.MIN_VALUE) {
        return constant(product);
      }
    }
    return new Affine.Mul(left, right);
  }

  /** Creates a product of a constant and an expression. */
  public Affine.Exp mul(long coefficient, Affine.Exp e) {
    return mul(constant(coefficient), e);
  }

  /**
   * Creates a floor division.
   *
   * @throws IllegalArgumentException if denominator is not positive
   */
  public Affine.Exp floorDiv(Affine.Exp numerator, long denominator) {
    if (denominator == 1) {
      return numerator;
    }
    if (numerator.op == Op.CONSTANT && denominator > 0) {
      return constant(
          Math.floorDiv(((Affine.Constant) numerator).value, denominator));
    }
    return new Affine.FloorDiv(numerator, denominator);
  }

  /**
   * Creates a modulo.
   *
   * @throws IllegalArgumentException if denominator is not positive
   */
  public Affine.Exp mod(Affine.Exp numerator, long denominator) {
    if (denominator == 1) {
      return zero;
    }
    if (numerator.op == Op.CONSTANT && denominator > 0) {
      return constant(
          Math.floorMod(((Affine.Constant) numerator).value, denominator));
    }
    return new Affine.Mod(numerator, denominator);
  }

  /**
   * Creates the sum of a non-empty list of expressions, left-folded, without
   * folding.
   *
   * <p>The result for {@code [a, b, c]} is {@code (a + b) + c}; it contains
   * exactly one {@link Affine.Add} fewer than the list has elements.
   */
  public Affine.Exp sum(List<? extends Affine.Exp> exps) {
    Affine.Exp e = exps.get(0);
    for (int i = 1; i < exps.size(); i++) {
      e = new Affine.Add(e, exps.get(i));
    }
    return e;
  }
}

// End AffineBuilder.java
