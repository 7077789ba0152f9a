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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recognizes a polynomial that is a constant times the {@code k}th power of
 * another polynomial, such as {@code x^2 + 2 * x + 1 = (x + 1)^2} or
 * {@code 8 * x^3 - 12 * x^2 + 6 * x - 1 = (2 * x - 1)^3}.
 *
 * <p>All arithmetic is exact. A quadratic is a square if its discriminant is
 * zero. Otherwise, for each {@code k} dividing the degree, largest first, the
 * candidate root is computed coefficient by coefficient from the top, and
 * accepted only if its {@code k}th power equals the polynomial.
 */
public class PerfectPowerStrategy extends AbstractStrategy {
  public PerfectPowerStrategy() {
    super("perfectPower", 90, "(a + b)^k");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 2,
        context.intProp(FactorProp.MAX_PERFECT_POWER_DEGREE));
    if (p == null) {
      return FactorizationResult.notApplicable(node);
    }
    if (p.degree() == 2) {
      final @Nullable AstNode square = square(p, context.variable);
      return square == null
          ? FactorizationResult.notApplicable(node)
          : FactorizationResult.factored(name(), square,
              ImmutableList.of("discriminant is zero"));
    }
    final Rational content = p.content();
    final Polynomial q = p.primitivePart();
    final List<Integer> divisors = new ArrayList<>(
        Integers.divisors(p.degree()));
    Collections.reverse(divisors);
    for (int k : divisors) {
      if (k < 2) {
        continue;
      }
      final @Nullable Polynomial r = root(q, k);
      if (r != null) {
        final AstNode power = ast.power(r.toAst(context.variable), k);
        final AstNode result = content.isOne()
            ? power
            : ast.times(ast.number(content), power);
        return FactorizationResult.factored(name(), result,
            ImmutableList.of("(" + r + ")^" + k + " = " + q));
      }
    }
    return FactorizationResult.notApplicable(node);
  }

  /** Writes {@code a x^2 + b x + c} with {@code b^2 = 4 a c} as a square,
   * or returns null if the discriminant is not zero. */
  static @Nullable AstNode square(Polynomial p, String variable) {
    final Rational a = p.coefficient(2);
    final Rational b = p.coefficient(1);
    final Rational c = p.coefficient(0);
    if (!b.multiply(b).subtract(Rational.of(4).multiply(a).multiply(c))
        .isZero()) {
      return null;
    }
    final @Nullable Rational u = a.sqrt();
    if (u != null) {
      // (u x + b / 2u)^2
      final Polynomial base =
          Polynomial.linear(u, b.divide(u.multiply(Rational.TWO)));
      return ast.power(base.toAst(variable), 2);
    }
    // a (x + b / 2a)^2
    final Polynomial base =
        Polynomial.linear(Rational.ONE, b.divide(a.multiply(Rational.TWO)));
    return ast.times(ast.number(a), ast.power(base.toAst(variable), 2));
  }

  /**
   * Returns the polynomial {@code r} with positive leading coefficient such
   * that {@code r^k = q}, or null.
   *
   * <p>If {@code r = u x^m + r[m-1] x^(m-1) + ...}, the coefficient of
   * {@code x^(n-j)} in {@code r^k} is {@code k u^(k-1) r[m-j]} plus terms
   * in coefficients already known; so each coefficient follows from one
   * coefficient of {@code q}.
   */
  static @Nullable Polynomial root(Polynomial q, int k) {
    final int n = q.degree();
    if (n % k != 0 || q.leadingCoefficient().signum() <= 0) {
      return null;
    }
    final int m = n / k;
    final @Nullable Rational u = q.leadingCoefficient().root(k);
    if (u == null) {
      return null;
    }
    final Rational[] r = new Rational[m + 1];
    Arrays.fill(r, Rational.ZERO);
    r[m] = u;
    final Rational scale = Rational.of(k).multiply(u.pow(k - 1));
    for (int j = 1; j <= m; j++) {
      final Rational partial =
          Polynomial.of(Arrays.asList(r)).pow(k).coefficient(n - j);
      r[m - j] = q.coefficient(n - j).subtract(partial).divide(scale);
    }
    final Polynomial root = Polynomial.of(Arrays.asList(r));
    return root.pow(k).equals(q) ? root : null;
  }
}

// End PerfectPowerStrategy.java
