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
package net.hydromatic.algebra.poly;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.ast.Asts;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Normalizer that multiplies out products and powers.
 *
 * <p>Handles numbers, identifiers, {@code +}, {@code -}, {@code *}, division
 * by a non-zero constant, non-negative integer powers and the square root of
 * a rational constant. Anything else (a function call, division by an
 * expression that is not constant, a power with a symbolic exponent) becomes
 * an opaque atom, keyed by its canonical form.
 *
 * <p>A sum is raised to a power only if the exponent is at most
 * {@code maxExpansionPower}; larger powers of sums are opaque.
 */
public class Expander implements Normalizer {
  /** Largest prime used to remove square factors from a radicand. */
  private static final long SQUARE_FREE_LIMIT = 10_000;

  private final int maxExpansionPower;

  public Expander(int maxExpansionPower) {
    checkArgument(maxExpansionPower >= 0, "bad power %s", maxExpansionPower);
    this.maxExpansionPower = maxExpansionPower;
  }

  @Override
  public MultiPolynomial expand(AstNode node) {
    switch (node.op) {
      case NUMBER_LITERAL:
        return MultiPolynomial.constant(((Ast.NumberLiteral) node).rational());

      case IDENTIFIER:
        return MultiPolynomial.atom(
            MultiPolynomial.Atom.variable(((Ast.Identifier) node).name));

      case NEGATE:
        return expand(((Ast.UnaryExpression) node).operand).negate();

      case POSITIVE:
        return expand(((Ast.UnaryExpression) node).operand);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case POWER:
        return expandBinary((Ast.BinaryExpression) node);

      case FRACTION:
        final Ast.Fraction fraction = (Ast.Fraction) node;
        return divide(node, expand(fraction.numerator),
            expand(fraction.denominator));

      case FUNCTION_CALL:
        final Ast.FunctionCall call = (Ast.FunctionCall) node;
        if (call.name.equals("sqrt") && call.args.size() == 1) {
          final @Nullable Rational r =
              expand(call.args.get(0)).rationalValue();
          if (r != null && r.signum() >= 0) {
            return sqrt(r);
          }
        }
        return opaque(node);

      default:
        throw new AssertionError("unknown op " + node.op);
    }
  }

  private MultiPolynomial expandBinary(Ast.BinaryExpression binary) {
    final MultiPolynomial left = expand(binary.left);
    switch (binary.op) {
      case PLUS:
        return left.add(expand(binary.right));
      case MINUS:
        return left.subtract(expand(binary.right));
      case TIMES:
        return left.multiply(expand(binary.right));
      case DIVIDE:
        return divide(binary, left, expand(binary.right));
      default:
        final @Nullable Rational e = expand(binary.right).rationalValue();
        if (e == null || !e.isInteger() || e.signum() < 0
            || e.numerator.bitLength() > 31) {
          return opaque(binary);
        }
        final int n = e.numerator.intValueExact();
        if (n > maxExpansionPower && left.terms.size() > 1) {
          return opaque(binary);
        }
        return left.pow(n);
    }
  }

  private MultiPolynomial divide(AstNode node, MultiPolynomial numerator,
      MultiPolynomial denominator) {
    final @Nullable Rational d = denominator.rationalValue();
    if (d == null || d.isZero()) {
      return opaque(node);
    }
    return numerator.multiply(d.reciprocal());
  }

  /** Returns the square root of a non-negative rational. If {@code r = n/d},
   * then {@code sqrt(r) = sqrt(n * d) / d}, and square factors of
   * {@code n * d} move outside the root. */
  private static MultiPolynomial sqrt(Rational r) {
    final @Nullable Rational root = r.sqrt();
    if (root != null) {
      return MultiPolynomial.constant(root);
    }
    final BigInteger[] split =
        Integers.extractSquare(r.numerator.multiply(r.denominator),
            SQUARE_FREE_LIMIT);
    final Rational outside = Rational.of(split[0], r.denominator);
    return MultiPolynomial.atom(
            MultiPolynomial.Atom.radical(Rational.of(split[1])))
        .multiply(outside);
  }

  private static MultiPolynomial opaque(AstNode node) {
    return MultiPolynomial.atom(
        MultiPolynomial.Atom.opaque(Asts.canonical(node)));
  }
}

// End Expander.java
