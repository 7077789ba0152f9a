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

import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.poly.RationalRoots;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors a quadratic {@code a x^2 + b x + c}.
 *
 * <p>Uses the AC method on the primitive part: finds integers {@code m} and
 * {@code n} with {@code m n = a c} and {@code m + n = b}, then
 * {@code a (a x^2 + b x + c) = (a x + m) (a x + n)}. If {@code |a c|} is too
 * large to enumerate its divisors, falls back to the roots of an exact
 * square discriminant.
 *
 * <p>A quadratic whose discriminant is not a square is irreducible over the
 * rationals. If {@link FactorProp#ALLOW_IRRATIONAL_FACTORS} is set and the
 * discriminant is positive, it is written as a product of factors with
 * square roots.
 */
public class QuadraticStrategy extends AbstractStrategy {
  public QuadraticStrategy() {
    super("quadratic", 80, "a x^2 + b x + c = (p x + q) (r x + s)");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 2, 2);
    if (p == null) {
      return FactorizationResult.notApplicable(node);
    }
    final Rational content = p.content();
    final Polynomial q = p.primitivePart();
    final String variable = context.variable;
    final @Nullable List<Polynomial> ac =
        acMethod(q, context.intProp(FactorProp.RATIONAL_ROOT_LIMIT));
    if (ac != null) {
      return FactorizationResult.factored(name(),
          product(content, ac, variable),
          ImmutableList.of("AC method on " + q));
    }
    final Rational a = q.coefficient(2);
    final Rational b = q.coefficient(1);
    final Rational c = q.coefficient(0);
    final Rational d =
        b.multiply(b).subtract(Rational.of(4).multiply(a).multiply(c));
    final String step = "discriminant " + d;
    final @Nullable Rational root = d.sqrt();
    if (root != null) {
      final Rational twoA = a.multiply(Rational.TWO);
      final Polynomial f1 =
          RationalRoots.linearFactor(b.negate().add(root).divide(twoA));
      final Polynomial f2 =
          RationalRoots.linearFactor(b.negate().subtract(root).divide(twoA));
      return FactorizationResult.factored(name(),
          product(content, ImmutableList.of(f1, f2), variable),
          ImmutableList.of(step));
    }
    if (d.signum() > 0
        && context.booleanProp(FactorProp.ALLOW_IRRATIONAL_FACTORS)) {
      // roots are s +/- r sqrt(f)
      final Surd surd = surd(d);
      final Rational twoA = a.multiply(Rational.TWO);
      final Rational s = b.negate().divide(twoA);
      final Rational r = surd.coefficient.divide(twoA);
      final AstNode x = ast.id(variable);
      final AstNode result =
          ast.times(minusSurd(x, s, r, surd.radicand),
              minusSurd(x, s, r.negate(), surd.radicand));
      return FactorizationResult.factoredFinal(name(),
          ast.scale(content.multiply(a), result), ImmutableList.of(step));
    }
    return FactorizationResult.unchanged(node,
        FactorizationResult.Status.IRREDUCIBLE, ImmutableList.of(step));
  }

  /** Factors a primitive quadratic by the AC method, or returns null. */
  static @Nullable List<Polynomial> acMethod(Polynomial q, long limit) {
    final List<BigInteger> coefficients = q.integerCoefficients();
    final BigInteger c = coefficients.get(0);
    final BigInteger b = coefficients.get(1);
    final BigInteger a = coefficients.get(2);
    final BigInteger ac = a.multiply(c);
    if (ac.signum() == 0) {
      return pair(a, BigInteger.ZERO, b);
    }
    final @Nullable List<BigInteger> divisors =
        Integers.divisors(ac, limit);
    if (divisors == null) {
      return null;
    }
    for (BigInteger divisor : divisors) {
      for (BigInteger m : ImmutableList.of(divisor, divisor.negate())) {
        final BigInteger n = ac.divide(m);
        if (m.add(n).equals(b)) {
          return pair(a, m, n);
        }
      }
    }
    return null;
  }

  /** Returns the primitive parts of {@code a x + m} and {@code a x + n}. */
  private static List<Polynomial> pair(BigInteger a, BigInteger m,
      BigInteger n) {
    final Polynomial f1 =
        Polynomial.linear(Rational.of(a), Rational.of(m)).primitivePart();
    final Polynomial f2 =
        Polynomial.linear(Rational.of(a), Rational.of(n)).primitivePart();
    return ImmutableList.of(f1, f2);
  }
}

// End QuadraticStrategy.java
