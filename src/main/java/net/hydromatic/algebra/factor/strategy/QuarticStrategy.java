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
package net.hydromatic.algebra.factor.strategy;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.integer.BigPolynomial;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.poly.RationalRoots;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors a quartic.
 *
 * <p>First peels rational roots. If there are none, looks for a split into
 * two integer quadratics,
 * {@code (p1 x^2 + q1 x + r1) * (p2 x^2 + q2 x + r2)}, by enumerating
 * {@code p1} among the divisors of the leading coefficient and {@code r1}
 * among the divisors of the constant term; the coefficients of {@code x^3}
 * and {@code x} then determine {@code q1} and {@code q2}.
 *
 * <p>For example, {@code x^4 + 4} becomes
 * {@code (x^2 - 2 * x + 2) * (x^2 + 2 * x + 2)}.
 */
public class QuarticStrategy extends AbstractStrategy {
  public QuarticStrategy() {
    super("quartic", 85, "rational roots or quadratic factors of a quartic");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 4, 4);
    if (p == null) {
      return FactorizationResult.notApplicable(node);
    }
    final Rational content = p.content();
    final Polynomial q = p.primitivePart();
    final long limit = context.intProp(FactorProp.RATIONAL_ROOT_LIMIT);
    final List<Polynomial> factors = RationalRoots.peel(q, limit);
    if (factors.size() > 1) {
      return FactorizationResult.factored(name(),
          product(content, factors, context.variable),
          ImmutableList.of("rational roots of " + q));
    }
    final @Nullable List<Polynomial> split = split(q, limit);
    if (split == null) {
      return FactorizationResult.notApplicable(node);
    }
    return FactorizationResult.factored(name(),
        product(content, split, context.variable),
        ImmutableList.of(q + " = (" + split.get(0) + ") * ("
            + split.get(1) + ")"));
  }

  /**
   * Splits a primitive quartic with positive leading coefficient into two
   * integer quadratics, or returns null.
   *
   * <p>Matching coefficients of
   * {@code a x^4 + b x^3 + c x^2 + d x + e} gives
   * {@code p2 q1 + p1 q2 = b} and {@code r2 q1 + r1 q2 = d}, a linear system
   * in {@code q1} and {@code q2}. If the system is singular, {@code q1} is
   * searched within the coefficient bound.
   */
  static @Nullable List<Polynomial> split(Polynomial q, long limit) {
    final List<BigInteger> coefficients = q.integerCoefficients();
    final BigInteger e = coefficients.get(0);
    final BigInteger d = coefficients.get(1);
    final BigInteger c = coefficients.get(2);
    final BigInteger b = coefficients.get(3);
    final BigInteger a = coefficients.get(4);
    final @Nullable List<BigInteger> ps = Integers.divisors(a, limit);
    final @Nullable List<BigInteger> rs = Integers.divisors(e, limit);
    if (ps == null || rs == null) {
      return null;
    }
    final BigInteger bound =
        BigPolynomial.of(coefficients).factorCoefficientBound()
            .min(BigInteger.valueOf(limit));
    for (BigInteger p1 : ps) {
      final BigInteger p2 = a.divide(p1);
      for (BigInteger r : rs) {
        for (BigInteger r1 : ImmutableList.of(r, r.negate())) {
          final BigInteger r2 = e.divide(r1);
          final BigInteger det = p2.multiply(r1).subtract(p1.multiply(r2));
          if (det.signum() != 0) {
            final BigInteger[] q1 =
                b.multiply(r1).subtract(p1.multiply(d))
                    .divideAndRemainder(det);
            final BigInteger[] q2 =
                p2.multiply(d).subtract(r2.multiply(b))
                    .divideAndRemainder(det);
            if (q1[1].signum() == 0 && q2[1].signum() == 0) {
              final @Nullable List<Polynomial> found =
                  check(q, p1, q1[0], r1, p2, q2[0], r2);
              if (found != null) {
                return found;
              }
            }
            continue;
          }
          for (BigInteger i = BigInteger.ZERO; i.compareTo(bound) <= 0;
               i = i.add(BigInteger.ONE)) {
            for (BigInteger q1 : ImmutableList.of(i, i.negate())) {
              final BigInteger[] q2 =
                  b.subtract(p2.multiply(q1)).divideAndRemainder(p1);
              if (q2[1].signum() != 0) {
                continue;
              }
              final @Nullable List<Polynomial> found =
                  check(q, p1, q1, r1, p2, q2[0], r2);
              if (found != null) {
                return found;
              }
            }
          }
        }
      }
    }
    return null;
  }

  private static @Nullable List<Polynomial> check(Polynomial q,
      BigInteger p1, BigInteger q1, BigInteger r1,
      BigInteger p2, BigInteger q2, BigInteger r2) {
    final Polynomial f1 = quadratic(p1, q1, r1);
    final Polynomial f2 = quadratic(p2, q2, r2);
    if (!f1.multiply(f2).equals(q)) {
      return null;
    }
    return f1.toString().compareTo(f2.toString()) <= 0
        ? ImmutableList.of(f1, f2)
        : ImmutableList.of(f2, f1);
  }

  private static Polynomial quadratic(BigInteger a, BigInteger b,
      BigInteger c) {
    return Polynomial.of(
        ImmutableList.of(Rational.of(c), Rational.of(b), Rational.of(a)));
  }
}

// End QuarticStrategy.java
