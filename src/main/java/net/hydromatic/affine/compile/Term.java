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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.Op;

/**
 * Summand of a linear expression, split into a constant coefficient and an
 * operand.
 *
 * <p>For example, the summand {@code 4 * (2 * d0)} has coefficient 8 and
 * operand {@code d0}; the summand {@code 5} has coefficient 1 and operand
 * {@code 5}.
 */
public final class Term {
  public final long coefficient;
  /** A {@link Affine.Var} or {@link Affine.Constant}; never a sum. */
  public final Affine.Exp operand;
  /** The summand, whose value is {@code coefficient * operand}. */
  public final Affine.Exp exp;

  Term(long coefficient, Affine.Exp operand, Affine.Exp exp) {
    this.coefficient = coefficient;
    this.operand = requireNonNull(operand, "operand");
    this.exp = requireNonNull(exp, "exp");
    checkArgument(coefficient != 0, "zero coefficient in %s", exp);
    checkArgument(
        operand.op == Op.VAR || operand.op == Op.CONSTANT,
        "operand must be a variable or constant: %s",
        operand);
  }

  @Override
  public String toString() {
    return exp.toString();
  }
}

// End Term.java
