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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.factor.Strategy;
import net.hydromatic.algebra.integer.IntegerFactorizer;
import net.hydromatic.algebra.poly.Expander;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.poly.PolynomialAnalyzer;
import org.junit.jupiter.api.Test;

/** Tests for the built-in strategies, each applied once to a tree. */
public class StrategyTest {
  private static FactorizationContext context(
      Map<FactorProp, Object> props) {
    return new FactorizationContext("x", 0, 10, props,
        new PolynomialAnalyzer(new Expander(32)));
  }

  /** Returns the tree of a polynomial in x, coefficients lowest degree
   * first. */
  private static AstNode poly(long... coefficients) {
    return Polynomial.of(coefficients).toAst("x");
  }

  private static FactorizationResult apply(Strategy strategy, AstNode node) {
    return apply(strategy, node, ImmutableMap.of());
  }

  private static FactorizationResult apply(Strategy strategy, AstNode node,
      Map<FactorProp, Object> props) {
    final FactorizationContext context = context(props);
    assertThat(strategy.canApply(node, context), is(true));
    return strategy.apply(node, context);
  }

  private static void checkFactored(Strategy strategy, AstNode node,
      String expected) {
    final FactorizationResult result = apply(strategy, node);
    assertThat(result.status, is(FactorizationResult.Status.FACTORED));
    assertThat(result.changed, is(true));
    assertThat(result.strategyUsed, is(strategy.name()));
    assertThat(result.ast, hasToString(expected));
  }

  private static void checkStatus(Strategy strategy, AstNode node,
      FactorizationResult.Status status) {
    final FactorizationResult result = apply(strategy, node);
    assertThat(result.status, is(status));
    assertThat(result.changed, is(false));
    assertThat(result.ast, is(node));
  }

  @Test void testCommonFactor() {
    final Strategy strategy = new CommonFactorStrategy();
    checkFactored(strategy, poly(9, 6), "3 * (2 * x + 3)");
    checkFactored(strategy, poly(0, -9, 6), "3 * x * (2 * x - 3)");
    checkFactored(strategy, poly(0, 0, 1, 1), "x^2 * (x + 1)");
    checkStatus(strategy, poly(1, 1, 1),
        FactorizationResult.Status.NOT_APPLICABLE);
  }

  @Test void testDifferenceOfSquares() {
    final Strategy strategy = new DifferenceOfSquaresStrategy();
    checkFactored(strategy, poly(-4, 0, 1), "(x + 2) * (x - 2)");
    checkFactored(strategy, poly(-9, 0, 4), "(2 * x + 3) * (2 * x - 3)");
    checkFactored(strategy, poly(-1, 0, 0, 0, 1),
        "(x^2 + 1) * (x^2 - 1)");
    // (x + 1)^2 - 1
    final AstNode x = ast.id("x");
    checkFactored(strategy,
        ast.minus(ast.power(ast.plus(x, ast.number(1)), 2), ast.number(1)),
        "(x + 1 + 1) * (x + 1 - 1)");
    checkStatus(strategy, poly(-2, 0, 1),
        FactorizationResult.Status.NOT_APPLICABLE);
    // the signs must differ
    assertThat(strategy.canApply(poly(4, 0, 1), context(ImmutableMap.of())),
        is(false));
  }

  @Test void testPerfectPower() {
    final Strategy strategy = new PerfectPowerStrategy();
    checkFactored(strategy, poly(1, 2, 1), "(x + 1)^2");
    checkFactored(strategy, poly(-1, 6, -12, 8), "(2 * x - 1)^3");
    checkStatus(strategy, poly(1, 3, 3, 2),
        FactorizationResult.Status.NOT_APPLICABLE);
    assertThat(PerfectPowerStrategy.root(Polynomial.of(1, 4, 6, 4, 1), 4),
        hasToString("x + 1"));
    assertThat(PerfectPowerStrategy.root(Polynomial.of(1, 0, 1), 2),
        nullValue());
  }

  @Test void testExponentSubstitution() {
    final Strategy strategy = new ExponentSubstitutionStrategy();
    final FactorizationResult result = apply(strategy, poly(4, 0, -5, 0, 1));
    assertThat(result.ast, hasToString("(x^2 - 1) * (x^2 - 4)"));
    assertThat(result.steps.get(0), is("substitute t = x^2: t^2 - 5 * t + 4"));
    checkStatus(strategy, poly(1, 0, 0, 0, 1),
        FactorizationResult.Status.NOT_APPLICABLE);
  }

  @Test void testQuartic() {
    final Strategy strategy = new QuarticStrategy();
    checkFactored(strategy, poly(4, 0, 0, 0, 1),
        "(x^2 + 2 * x + 2) * (x^2 - 2 * x + 2)");
    checkFactored(strategy, poly(-1, 0, 0, 0, 1),
        "(x - 1) * (x + 1) * (x^2 + 1)");
    assertThat(QuarticStrategy.split(Polynomial.of(1, 0, 0, 0, 1), 1000),
        nullValue());
  }

  @Test void testQuadratic() {
    final Strategy strategy = new QuadraticStrategy();
    checkFactored(strategy, poly(6, -5, 1), "(x - 2) * (x - 3)");
    checkFactored(strategy, poly(-2, 1, 6), "(2 * x - 1) * (3 * x + 2)");
    checkFactored(strategy, poly(2, -4, 2), "2 * (x - 1) * (x - 1)");
    final FactorizationResult result = apply(strategy, poly(1, 1, 1));
    assertThat(result.status, is(FactorizationResult.Status.IRREDUCIBLE));
    assertThat(result.steps, is(ImmutableList.of("discriminant -3")));
    checkStatus(strategy, poly(-2, 0, 1),
        FactorizationResult.Status.IRREDUCIBLE);
  }

  @Test void testQuadraticIrrational() {
    final Map<FactorProp, Object> props = new HashMap<>();
    FactorProp.ALLOW_IRRATIONAL_FACTORS.set(props, true);
    final FactorizationResult result =
        apply(new QuadraticStrategy(), poly(-2, 0, 1), props);
    assertThat(result.status, is(FactorizationResult.Status.FACTORED));
    assertThat(result.canContinue, is(false));
    assertThat(result.ast, hasToString("(x - sqrt(2)) * (x + sqrt(2))"));
  }

  @Test void testGrouping() {
    final Strategy strategy = new GroupingStrategy();
    checkFactored(strategy, poly(1, 1, 1, 1), "(x^2 + 1) * (x + 1)");
    checkStatus(strategy, poly(-6, 11, -6, 1),
        FactorizationResult.Status.NOT_APPLICABLE);
    assertThat(GroupingStrategy.groupings(4),
        hasToString("[[[0, 1], [2, 3]], [[0, 2], [1, 3]], [[0, 3], [1, 2]]]"));
    assertThat(GroupingStrategy.groupings(6), hasSize(4));
  }

  @Test void testCubic() {
    final Strategy strategy = new CubicStrategy();
    checkFactored(strategy, poly(-6, 11, -6, 1),
        "(x - 1) * (x - 2) * (x - 3)");
    checkFactored(strategy, poly(-8, 0, 0, 1), "(x - 2) * (x^2 + 2 * x + 4)");
    checkFactored(strategy, poly(1, 0, 0, 1), "(x + 1) * (x^2 - x + 1)");
    checkStatus(strategy, poly(1, 1, 0, 1),
        FactorizationResult.Status.IRREDUCIBLE);
  }

  @Test void testBinomialPower() {
    final Strategy strategy = new BinomialPowerStrategy();
    final FactorizationResult result =
        apply(strategy, poly(-1, 0, 0, 0, 0, 0, 1));
    assertThat(result.ast,
        hasToString("(x - 1) * (x + 1) * (x^2 + x + 1) * (x^2 - x + 1)"));
    assertThat(result.canContinue, is(false));
    checkFactored(strategy, poly(1, 0, 0, 1), "(x + 1) * (x^2 - x + 1)");
    checkStatus(strategy, poly(1, 0, 0, 0, 1),
        FactorizationResult.Status.IRREDUCIBLE);
    checkStatus(strategy, poly(2, 0, 1),
        FactorizationResult.Status.NOT_APPLICABLE);
    assertThat(BinomialPowerStrategy.cyclotomic(12, new HashMap<>()),
        hasToString("x^4 - x^2 + 1"));
  }

  @Test void testIntegerFactor() {
    final Strategy strategy =
        new IntegerFactorStrategy(new IntegerFactorizer(5, true, 8));
    final FactorizationResult result = apply(strategy, poly(1, 0, 1, 0, 1));
    assertThat(result.ast, hasToString("(x^2 - x + 1) * (x^2 + x + 1)"));
    assertThat(result.canContinue, is(false));
    checkStatus(strategy, poly(1, 0, 0, 0, 1),
        FactorizationResult.Status.IRREDUCIBLE);

    final Map<FactorProp, Object> props = new HashMap<>();
    FactorProp.USE_ALGEBRAIC.set(props, false);
    assertThat(strategy.canApply(poly(1, 0, 1, 0, 1), context(props)),
        is(false));
  }
}

// End StrategyTest.java
