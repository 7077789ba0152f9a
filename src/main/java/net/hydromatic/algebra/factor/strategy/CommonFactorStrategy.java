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
import java.util.List;
import java.util.Map;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.PolynomialAnalyzer;
import net.hydromatic.algebra.poly.PolynomialAnalyzer.Term;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Takes out the greatest common factor of the terms of a sum: the GCD of the
 * coefficients times the lowest power of each variable that every term
 * has. If every term is negative, so is the factor.
 *
 * <p>For example, {@code 6 * x^2 - 9 * x} becomes
 * {@code 3 * x * (2 * x - 3)}.
 */
public class CommonFactorStrategy extends AbstractStrategy {
  public CommonFactorStrategy() {
    super("commonFactor", 100, "ab + ac = a(b + c)");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final List<Term> terms = PolynomialAnalyzer.extractTerms(node);
    if (terms.size() < 2) {
      return FactorizationResult.notApplicable(node);
    }
    final @Nullable Common common = common(terms);
    if (common == null) {
      return FactorizationResult.notApplicable(node);
    }
    final List<AstNode> quotients = new ArrayList<>();
    for (Term term : terms) {
      quotients.add(term.divide(common.coefficient, common.powers).toAst());
    }
    final AstNode factor =
        Term.monomial(1, common.coefficient, common.powers).toAst();
    final AstNode result = ast.times(factor, ast.sum(quotients));
    return FactorizationResult.factored(name(), result,
        ImmutableList.of("common factor " + factor));
  }

  /** Returns the common factor of some terms, or null if it is 1 or if
   * some term is opaque. */
  static @Nullable Common common(List<Term> terms) {
    final List<Rational> coefficients = new ArrayList<>();
    boolean allNegative = true;
    for (Term term : terms) {
      if (term.opaque) {
        return null;
      }
      coefficients.add(term.coefficient);
      allNegative &= term.sign < 0;
    }
    Rational g = PolynomialAnalyzer.gcd(coefficients);
    if (g.isZero()) {
      return null;
    }
    if (allNegative) {
      g = g.negate();
    }
    final Map<String, Integer> powers =
        PolynomialAnalyzer.commonVariablePowers(terms);
    if (g.isOne() && powers.isEmpty()) {
      return null;
    }
    return new Common(g, powers);
  }

  /** Signed coefficient and variable powers of a common factor. */
  static class Common {
    final Rational coefficient;
    final Map<String, Integer> powers;

    Common(Rational coefficient, Map<String, Integer> powers) {
      this.coefficient = coefficient;
      this.powers = powers;
    }
  }
}

// End CommonFactorStrategy.java
