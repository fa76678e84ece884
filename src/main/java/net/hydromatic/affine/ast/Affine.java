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
import static net.hydromatic.affine.ast.AffineBuilder.affine;

import java.util.Objects;

/**
 * Affine expressions.
 *
 * <p>The grammar is closed: an expression is a {@link Constant}, a {@link
 * Var}, an {@link Add}, a {@link Mul}, a {@link FloorDiv} or a {@link Mod}.
 * This class functions as a namespace, so that we can keep the class names
 * short.
 *
 * <p>Nodes are immutable. Create them using {@link AffineBuilder#affine}.
 */
public class Affine {
  private Affine() {}

  /** Base class of affine expressions. */
  public abstract static class Exp {
    public final Op op;

    Exp(Op op) {
      this.op = requireNonNull(op);
    }

    /**
     * Converts this expression to a string.
     *
     * <p>Marked final because you should override {@link #unparse}, not
     * toString.
     */
    @Override
    public final String toString() {
      return unparse(new AffineWriter(), 0, 0).toString();
    }

    abstract AffineWriter unparse(AffineWriter w, int left, int right);

    /**
     * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
     * to the type of this node, and returning the result.
     */
    public abstract Exp accept(Shuttle shuttle);

    /**
     * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
     * to the type of this node.
     */
    public abstract void accept(Visitor visitor);

    /** Returns whether this is a constant with a given value. */
    public boolean isConstant(long value) {
      return false;
    }
  }

  /** Integer constant. */
  public static class Constant extends Exp {
    public final long value;

    Constant(long value) {
      super(Op.CONSTANT);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant && ((Constant) o).value == value;
    }

    @Override
    AffineWriter unparse(AffineWriter w, int left, int right) {
      return w.append(Long.toString(value));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public boolean isConstant(long value) {
      return this.value == value;
    }
  }

  /** Reference to a dimension or symbol. */
  public static class Var extends Exp {
    public final Variable variable;

    Var(Variable variable) {
      super(Op.VAR);
      this.variable = requireNonNull(variable);
    }

    @Override
    public int hashCode() {
      return variable.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var && ((Var) o).variable.equals(variable);
    }

    @Override
    AffineWriter unparse(AffineWriter w, int left, int right) {
      return w.append(variable.toString());
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression with two operands, {@link Add} or {@link Mul}. */
  public abstract static class Binary extends Exp {
    public final Exp left;
    public final Exp right;

    Binary(Op op, Exp left, Exp right) {
      super(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && ((Binary) o).op == op
              && ((Binary) o).left.equals(left)
              && ((Binary) o).right.equals(right);
    }

    @Override
    AffineWriter unparse(AffineWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }
  }

  /** Sum of two expressions. */
  public static class Add extends Binary {
    Add(Exp left, Exp right) {
      super(Op.ADD, left, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Add} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Exp copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : affine.add(left, right);
    }
  }

  /**
   * Product of two expressions.
   *
   * <p>In an affine expression, at least one operand is a {@link Constant};
   * a product of two non-constant operands is well-formed but not linear.
   */
  public static class Mul extends Binary {
    Mul(Exp left, Exp right) {
      super(Op.MUL, left, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Mul} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Exp copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : affine.mul(left, right);
    }
  }

  /**
   * Division of an expression by a positive constant; base class of {@link
   * FloorDiv} and {@link Mod}.
   */
  public abstract static class Division extends Exp {
    public final Exp numerator;
    public final long denominator;

    Division(Op op, Exp numerator, long denominator) {
      super(op);
      this.numerator = requireNonNull(numerator);
      this.denominator = denominator;
      checkArgument(op.isDivision());
      checkArgument(
          denominator > 0, "denominator must be positive: %s", denominator);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, numerator, denominator);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Division
              && ((Division) o).op == op
              && ((Division) o).numerator.equals(numerator)
              && ((Division) o).denominator == denominator;
    }

    @Override
    AffineWriter unparse(AffineWriter w, int left, int right) {
      return w.infix(
          left, numerator, op, affine.constant(denominator), right);
    }

    /**
     * Creates a division of the same kind with a given numerator, or returns
     * {@code this} if the numerator is the same.
     */
    public abstract Exp copy(Exp numerator);
  }

  /** Floor division, rounding toward negative infinity. */
  public static class FloorDiv extends Division {
    FloorDiv(Exp numerator, long denominator) {
      super(Op.FLOOR_DIV, numerator, denominator);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Exp copy(Exp numerator) {
      return numerator == this.numerator
          ? this
          : affine.floorDiv(numerator, denominator);
    }
  }

  /** Modulo; the result has the sign of the (positive) denominator. */
  public static class Mod extends Division {
    Mod(Exp numerator, long denominator) {
      super(Op.MOD, numerator, denominator);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Exp copy(Exp numerator) {
      return numerator == this.numerator
          ? this
          : affine.mod(numerator, denominator);
    }
  }
}

// End Affine.java
