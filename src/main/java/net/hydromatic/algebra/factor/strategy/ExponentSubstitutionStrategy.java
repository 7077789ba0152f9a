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

import java.util.ArrayList;
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
 * Factors a polynomial in {@code x^k} by factoring it as a polynomial in
 * {@code t = x^k}.
 *
 * <p>For example, {@code x^4 - 5 * x^2 + 4} is {@code t^2 - 5 * t + 4} with
 * {@code t = x^2}, which is {@code (t - 1) * (t - 4)}, giving
 * {@code (x^2 - 1) * (x^2 - 4)}. The polynomial in {@code t} must have
 * degree 2 or 3. If it is a quadratic without rational roots and
 * {@link FactorProp#ALLOW_IRRATIONAL_FACTORS} is set, its roots are written
 * with square roots.
 */
public class ExponentSubstitutionStrategy extends AbstractStrategy {
  public ExponentSubstitutionStrategy() {
    super("exponentSubstitution", 86, "substitute t = x^k");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 4, Integer.MAX_VALUE);
    if (p == null) {
      return FactorizationResult.notApplicable(node);
    }
    final int k = p.exponentGcd();
    if (k < 2 || p.degree() / k < 2 || p.degree() / k > 3) {
      return FactorizationResult.notApplicable(node);
    }
    final Polynomial q = p.deflate(k);
    final Rational content = q.content();
    final Polynomial primitive = q.primitivePart();
    final String t = "t";
    final List<String> steps = new ArrayList<>();
    steps.add("substitute t = " + ast.power(ast.id(context.variable), k)
        + ": " + primitive.toAst(t));
    final List<Polynomial> factors = RationalRoots.peel(primitive,
        context.intProp(FactorProp.RATIONAL_ROOT_LIMIT));
    if (factors.size() > 1) {
      final List<Polynomial> inflated = new ArrayList<>();
      for (Polynomial factor : factors) {
        inflated.add(factor.inflate(k));
      }
      return FactorizationResult.factored(name(),
          product(content, inflated, context.variable), steps);
    }
    if (primitive.degree() == 2
        && context.booleanProp(FactorProp.ALLOW_IRRATIONAL_FACTORS)) {
      final Rational a = primitive.coefficient(2);
      final Rational b = primitive.coefficient(1);
      final Rational c = primitive.coefficient(0);
      final Rational d =
          b.multiply(b).subtract(Rational.of(4).multiply(a).multiply(c));
      final @Nullable Surd surd = d.signum() > 0 ? surd(d) : null;
      if (surd != null && !surd.isRational()) {
        // roots are s +/- r sqrt(f)
        final Rational twoA = a.multiply(Rational.TWO);
        final Rational s = b.negate().divide(twoA);
        final Rational r = surd.coefficient.divide(twoA);
        final AstNode xk = ast.power(ast.id(context.variable), k);
        final AstNode product =
            ast.times(minusSurd(xk, s, r, surd.radicand),
                minusSurd(xk, s, r.negate(), surd.radicand));
        steps.add("roots in t are " + s + " +/- " + r + " * sqrt("
            + surd.radicand + ")");
        return FactorizationResult.factoredFinal(name(),
            ast.scale(content.multiply(a), product), steps);
      }
    }
    return FactorizationResult.notApplicable(node);
  }
}

// End ExponentSubstitutionStrategy.java
