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
package net.hydromatic.affine.compile;

import static net.hydromatic.affine.ast.AffineBuilder.affine;
import static net.hydromatic.affine.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.math.LongMath;
import java.util.List;
import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for linear expressions: deciding linearity, splitting a linear
 * expression into {@link Term}s, and ordering the terms.
 */
public class Terms {
  private Terms() {}

  /**
   * Orders terms by the magnitude of their coefficient, largest first.
   *
   * <p>Magnitudes are compared as unsigned values, so that the magnitude of
   * {@link Long#MIN_VALUE} is the largest.
   */
  static final Ordering<Term> BY_MAGNITUDE_DESCENDING =
      Ordering.from(
          (Term t1, Term t2) ->
              Long.compareUnsigned(
                  Math.abs(t2.coefficient), Math.abs(t1.coefficient)));

  /**
   * Returns whether an expression is a linear combination of dimensions,
   * symbols and constants.
   *
   * <p>Constants and variables are linear; a sum is linear if both of its
   * operands are linear; a product is linear if one operand is a constant
   * and the other is linear. Floor division and modulo are not linear.
   */
  public static boolean isLinear(Affine.Exp e) {
    switch (e.op) {
      case CONSTANT:
      case VAR:
        return true;

      case ADD:
        final Affine.Add add = (Affine.Add) e;
        return isLinear(add.left) && isLinear(add.right);

      case MUL:
        final Affine.Mul mul = (Affine.Mul) e;
        if (mul.left.op == Op.CONSTANT) {
          return isLinear(mul.right);
        }
        return mul.right.op == Op.CONSTANT && isLinear(mul.left);

      case FLOOR_DIV:
      case MOD:
        return false;

      default:
        throw new AssertionError("unexpected " + e.op);
    }
  }

  /**
   * Returns the summands of a linear expression, in left-to-right order, or
   * null if the expression is not linear.
   *
   * <p>A constant multiple of a sum is distributed, so that no summand
   * contains a sum: {@code d0 + 4 * (d1 + 2)} yields {@code [d0, 4 * d1,
   * 8]}. A summand that needed no distribution is the original node.
   */
  public static @Nullable List<Affine.Exp> flatten(Affine.Exp e) {
    if (!isLinear(e)) {
      return null;
    }
    final ImmutableList.Builder<Affine.Exp> b = ImmutableList.builder();
    flattenInto(e, b);
    return b.build();
  }

  private static void flattenInto(
      Affine.Exp e, ImmutableList.Builder<Affine.Exp> b) {
    switch (e.op) {
      case ADD:
        final Affine.Add add = (Affine.Add) e;
        flattenInto(add.left, b);
        flattenInto(add.right, b);
        return;

      case MUL:
        final Affine.Mul mul = (Affine.Mul) e;
        final boolean constantOnLeft = mul.left.op == Op.CONSTANT;
        final Affine.Exp constant = constantOnLeft ? mul.left : mul.right;
        final Affine.Exp other = constantOnLeft ? mul.right : mul.left;
        final ImmutableList.Builder<Affine.Exp> b2 = ImmutableList.builder();
        flattenInto(other, b2);
        final List<Affine.Exp> summands = b2.build();
        if (summands.size() == 1) {
          b.add(e);
          return;
        }
        for (Affine.Exp summand : summands) {
          b.add(
              constantOnLeft
                  ? affine.mul(constant, summand)
                  : affine.mul(summand, constant));
        }
        return;

      default:
        b.add(e);
    }
  }

  /**
   * Converts a summand into a term.
   *
   * <p>The coefficient is the product of the constant factors of the summand;
   * the operand is what remains, a variable or a constant. A non-zero
   * constant is entirely coefficient, so that it contributes its own value
   * to the gcd of the coefficients; its operand is 1.
   *
   * @throws ArithmeticException if the coefficient overflows
   */
  static Term toTerm(Affine.Exp summand) {
    long coefficient = 1;
    Affine.Exp e = summand;
    while (e.op == Op.MUL) {
      final Affine.Mul mul = (Affine.Mul) e;
      final Affine.Exp constant;
      if (mul.left.op == Op.CONSTANT) {
        constant = mul.left;
        e = mul.right;
      } else {
        constant = mul.right;
        e = mul.left;
      }
      coefficient =
          LongMath.checkedMultiply(
              coefficient, ((Affine.Constant) constant).value);
    }
    if (e.op == Op.CONSTANT && !e.isConstant(0)) {
      coefficient =
          LongMath.checkedMultiply(coefficient, ((Affine.Constant) e).value);
      e = affine.constant(1);
    }
    return new Term(coefficient, e, summand);
  }

  /**
   * Returns the terms of a linear expression, in left-to-right order, or null
   * if the expression is not linear.
   */
  public static @Nullable List<Term> terms(Affine.Exp e) {
    final List<Affine.Exp> summands = flatten(e);
    if (summands == null) {
      return null;
    }
    try {
      return transformEager(summands, Terms::toTerm);
    } catch (ArithmeticException ex) {
      // A coefficient does not fit in 64 bits. Treat as non-linear.
      return null;
    }
  }

  /**
   * Sorts terms by the magnitude of their coefficient, largest first. The
   * sort is stable.
   */
  public static List<Term> reorder(List<Term> terms) {
    return BY_MAGNITUDE_DESCENDING.immutableSortedCopy(terms);
  }

  /**
   * Returns the sum of a non-empty list of terms, left-folded in list order.
   *
   * <p>If the terms are in the order returned by {@link #reorder(List)}, the
   * result is
   *
   * <pre>
   *            +
   *          /   \
   *         +     (smallest coefficient) * operand
   *       /   \
   *      +     (second smallest coefficient) * operand
   *     ...
   * </pre>
   *
   * <p>The right operand of the outermost {@link Affine.Add} is the term
   * with the smallest coefficient; its left operand is the sum of all of the
   * other terms.
   */
  public static Affine.Exp accumulate(List<Term> terms) {
    return affine.sum(transformEager(terms, t -> t.exp));
  }
}

// End Terms.java
