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
package net.hydromatic.affine.eval;

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.affine.ast.Affine;
import net.hydromatic.affine.ast.IndexMap;
import net.hydromatic.affine.ast.Variable;

/**
 * Evaluates affine expressions for given values of their dimensions and
 * symbols.
 *
 * <p>Division rounds toward negative infinity, and the result of {@code mod}
 * is never negative. Arithmetic wraps on overflow, as in the generated code.
 */
public class Evaluator {
  private Evaluator() {}

  /** Evaluates an expression. */
  public static long eval(Affine.Exp exp, long[] dims, long[] symbols) {
    switch (exp.op) {
      case CONSTANT:
        return ((Affine.Constant) exp).value;

      case VAR:
        final Variable v = ((Affine.Var) exp).variable;
        return v.kind == Variable.Kind.DIM
            ? dims[v.position]
            : symbols[v.position];

      case ADD:
        final Affine.Add add = (Affine.Add) exp;
        return eval(add.left, dims, symbols) + eval(add.right, dims, symbols);

      case MUL:
        final Affine.Mul mul = (Affine.Mul) exp;
        return eval(mul.left, dims, symbols) * eval(mul.right, dims, symbols);

      case FLOOR_DIV:
        final Affine.FloorDiv floorDiv = (Affine.FloorDiv) exp;
        return Math.floorDiv(
            eval(floorDiv.numerator, dims, symbols), floorDiv.denominator);

      case MOD:
        final Affine.Mod mod = (Affine.Mod) exp;
        return Math.floorMod(
            eval(mod.numerator, dims, symbols), mod.denominator);

      default:
        throw new AssertionError("unexpected " + exp.op);
    }
  }

  /** Evaluates each result of an index map. */
  public static long[] eval(IndexMap map, long[] dims, long[] symbols) {
    checkArgument(
        dims.length == map.dimCount && symbols.length == map.symbolCount,
        "expected %s dims and %s symbols",
        map.dimCount,
        map.symbolCount);
    final long[] values = new long[map.results.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = eval(map.results.get(i), dims, symbols);
    }
    return values;
  }
}

// End Evaluator.java
