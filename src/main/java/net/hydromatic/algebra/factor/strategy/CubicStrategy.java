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
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.poly.RationalRoots;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors a cubic.
 *
 * <p>A sum or difference of cubes {@code u^3 x^3 + v^3} becomes
 * {@code (u x + v) (u^2 x^2 - u v x + v^2)}. Otherwise rational roots are
 * peeled off; a cubic with no rational root is irreducible over the
 * rationals.
 */
public class CubicStrategy extends AbstractStrategy {
  public CubicStrategy() {
    super("cubic", 60, "rational roots of a cubic");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 3, 3);
    if (p == null) {
      return FactorizationResult.notApplicable(node);
    }
    final @Nullable List<Polynomial> cubes = sumOfCubes(p);
    if (cubes != null) {
      return FactorizationResult.factored(name(),
          product(Rational.ONE, cubes, context.variable),
          ImmutableList.of("sum of cubes"));
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
    if (RationalRoots.candidates(q, limit).isEmpty()) {
      // coefficients too large to search
      return FactorizationResult.notApplicable(node);
    }
    return FactorizationResult.unchanged(node,
        FactorizationResult.Status.IRREDUCIBLE,
        ImmutableList.of("no rational root"));
  }

  /** Factors {@code a x^3 + e} where {@code a} and {@code e} are rational
   * cubes, or returns null. */
  static @Nullable List<Polynomial> sumOfCubes(Polynomial p) {
    if (p.termCount() != 2 || p.constantTerm().isZero()) {
      return null;
    }
    final @Nullable Rational u = p.leadingCoefficient().root(3);
    final @Nullable Rational v = p.constantTerm().root(3);
    if (u == null || v == null) {
      return null;
    }
    final Polynomial linear = Polynomial.linear(u, v);
    final Polynomial quadratic =
        Polynomial.of(
            ImmutableList.of(v.multiply(v), u.multiply(v).negate(),
                u.multiply(u)));
    return ImmutableList.of(linear, quadratic);
  }
}

// End CubicStrategy.java
