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
import com.google.common.math.IntMath;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;

/**
 * Factors {@code x^n - 1} and {@code x^n + 1} into cyclotomic polynomials.
 *
 * <p>{@code x^n - 1} is the product of {@code Φ_d} for every {@code d}
 * dividing {@code n}; {@code x^n + 1} is the product of {@code Φ_d} for
 * every {@code d} that divides {@code 2n} but not {@code n}. Cyclotomic
 * polynomials are irreducible over the rationals, so the result is final.
 *
 * <p>If {@code n} is a power of 2, {@code x^n + 1} is irreducible; but if
 * {@code n} is a multiple of 4 and
 * {@link FactorProp#ALLOW_IRRATIONAL_FACTORS} is set, it is written as
 * {@code (x^(n/2) + sqrt(2) x^(n/4) + 1) (x^(n/2) - sqrt(2) x^(n/4) + 1)}.
 */
public class BinomialPowerStrategy extends AbstractStrategy {
  public BinomialPowerStrategy() {
    super("binomialPower", 40, "x^n +/- 1 as cyclotomic polynomials");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 2, Integer.MAX_VALUE);
    if (p == null || p.termCount() != 2) {
      return FactorizationResult.notApplicable(node);
    }
    final Rational content = p.content();
    final Polynomial q = p.primitivePart();
    final int n = q.degree();
    final Rational c = q.constantTerm();
    if (!q.leadingCoefficient().isOne() || !c.abs().isOne()) {
      return FactorizationResult.notApplicable(node);
    }
    final Map<Integer, Polynomial> cache = new HashMap<>();
    final List<Polynomial> factors = new ArrayList<>();
    if (c.signum() < 0) {
      for (int d : Integers.divisors(n)) {
        factors.add(cyclotomic(d, cache));
      }
    } else if (IntMath.isPowerOfTwo(n)) {
      if (n % 4 == 0
          && context.booleanProp(FactorProp.ALLOW_IRRATIONAL_FACTORS)) {
        final AstNode result =
            ast.times(sqrtTwoFactor(context.variable, n, false),
                sqrtTwoFactor(context.variable, n, true));
        return FactorizationResult.factoredFinal(name(),
            ast.scale(content, result),
            ImmutableList.of("y^4 + 1 with y = x^" + n / 4));
      }
      return FactorizationResult.unchanged(node,
          FactorizationResult.Status.IRREDUCIBLE,
          ImmutableList.of(q + " is cyclotomic"));
    } else {
      for (int d : Integers.divisors(2 * n)) {
        if (n % d != 0) {
          factors.add(cyclotomic(d, cache));
        }
      }
    }
    return FactorizationResult.factoredFinal(name(),
        product(content, factors, context.variable),
        ImmutableList.of(q + " = product of cyclotomic polynomials"));
  }

  /** Returns the {@code n}th cyclotomic polynomial: {@code x^n - 1} divided
   * by {@code Φ_d} for every proper divisor {@code d} of {@code n}. */
  static Polynomial cyclotomic(int n, Map<Integer, Polynomial> cache) {
    final Polynomial cached = cache.get(n);
    if (cached != null) {
      return cached;
    }
    Polynomial p =
        Polynomial.monomial(Rational.ONE, n).subtract(Polynomial.ONE);
    for (int d : Integers.divisors(n)) {
      if (d < n) {
        p = p.divideExact(cyclotomic(d, cache));
      }
    }
    cache.put(n, p);
    return p;
  }

  /** Builds {@code x^(n/2) +/- sqrt(2) x^(n/4) + 1}. */
  private static AstNode sqrtTwoFactor(String variable, int n,
      boolean minus) {
    final AstNode x = ast.id(variable);
    final AstNode middle =
        ast.times(ast.sqrt(ast.number(2)), ast.power(x, n / 4));
    return ast.sum(
        ImmutableList.of(ast.power(x, n / 2),
            minus ? ast.negate(middle) : middle, ast.number(1)));
  }
}

// End BinomialPowerStrategy.java
