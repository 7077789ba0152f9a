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
package net.hydromatic.algebra.factor;

import static net.hydromatic.algebra.ast.AstBuilder.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.poly.Polynomial;
import org.junit.jupiter.api.Test;

/** Tests for {@link Factorizer}. */
public class FactorizerTest {
  /** Returns the tree of a polynomial in x, coefficients lowest degree
   * first. */
  private static AstNode poly(long... coefficients) {
    return Polynomial.of(coefficients).toAst("x");
  }

  /** Factors a tree, checks the result, and checks that the result is sound
   * and cannot be factored further. */
  private static FactorizationResult check(Factorizer factorizer,
      AstNode node, String expected) {
    final FactorizationResult result = factorizer.factor(node, "x");
    assertThat(result.ast, hasToString(expected));
    assertThat(factorizer.normalizer().equivalent(node, result.ast),
        is(true));
    final FactorizationResult again = factorizer.factor(result.ast, "x");
    assertThat(again.changed, is(false));
    assertThat(again.ast, is(result.ast));
    return result;
  }

  private static FactorizationResult check(AstNode node, String expected) {
    return check(Factorizer.create(), node, expected);
  }

  @Test void testCommonFactor() {
    final FactorizationResult result =
        check(poly(9, 6), "3 * (2 * x + 3)");
    assertThat(result.changed, is(true));
    assertThat(result.success, is(true));
    assertThat(result.status, is(FactorizationResult.Status.FACTORED));
    assertThat(result.strategyUsed, is("commonFactor"));
  }

  @Test void testDifferenceOfSquares() {
    check(poly(-4, 0, 1), "(x - 2) * (x + 2)");
    check(poly(-8, 0, 2), "2 * (x - 2) * (x + 2)");
    check(poly(-1, 0, 0, 0, 1), "(x - 1) * (x + 1) * (x^2 + 1)");
  }

  @Test void testPerfectSquare() {
    check(poly(1, 2, 1), "(x + 1)^2");
  }

  @Test void testCubic() {
    check(poly(-6, 11, -6, 1), "(x - 1) * (x - 2) * (x - 3)");
    check(poly(1, 1, 1, 1), "(x + 1) * (x^2 + 1)");
  }

  @Test void testQuartic() {
    check(poly(4, 0, 0, 0, 1), "(x^2 - 2 * x + 2) * (x^2 + 2 * x + 2)");
    check(poly(4, 0, -5, 0, 1), "(x - 1) * (x + 1) * (x - 2) * (x + 2)");
    check(poly(1, 0, 1, 0, 1), "(x^2 - x + 1) * (x^2 + x + 1)");
  }

  @Test void testIntegerFactorization() {
    // (x^2 + x + 1) * (x^3 + x + 1) matches no pattern
    final FactorizationResult result =
        check(poly(1, 2, 2, 2, 1, 1), "(x^2 + x + 1) * (x^3 + x + 1)");
    assertThat(result.strategyUsed, is("integerFactorization"));
  }

  @Test void testNegativeLeadingCoefficient() {
    // -x * (3x - 1) * (x^2 - 1) * (2x^2 + 1); x^2 - 1 is factored too
    check(poly(0, -1, 3, -1, 3, 2, -6),
        "-x * (x - 1) * (x + 1) * (3 * x - 1) * (2 * x^2 + 1)");
    check(poly(-2, 0, 3, 0, -1), "-(x - 1) * (x + 1) * (x^2 - 2)");
  }

  @Test void testNegation() {
    final AstNode x = ast.id("x");
    check(ast.negate(poly(-4, 0, 1)), "-(x - 2) * (x + 2)");
    check(ast.negate(ast.times(x, poly(-1, 0, 1))),
        "-x * (x - 1) * (x + 1)");

    final AstNode node = ast.negate(poly(1, 1, 1));
    final FactorizationResult result = Factorizer.create().factor(node, "x");
    assertThat(result.changed, is(false));
    assertThat(result.status, is(FactorizationResult.Status.IRREDUCIBLE));
  }

  @Test void testConstantDenominator() {
    check(ast.divide(poly(-4, 0, 1), ast.number(3)),
        "1 / 3 * (x - 2) * (x + 2)");
    check(ast.fraction(poly(-8, 0, 2), ast.number(2)), "(x - 2) * (x + 2)");

    final AstNode node = ast.divide(poly(1, 1, 1), ast.number(3));
    final FactorizationResult result = Factorizer.create().factor(node, "x");
    assertThat(result.changed, is(false));
    assertThat(result.ast, is(node));
    assertThat(result.status, is(FactorizationResult.Status.IRREDUCIBLE));

    // a variable denominator is not a polynomial
    final FactorizationResult result2 =
        Factorizer.create().factor(ast.divide(poly(-4, 0, 1), ast.id("x")),
            "x");
    assertThat(result2.changed, is(false));
    assertThat(result2.status,
        is(FactorizationResult.Status.NOT_APPLICABLE));
  }

  @Test void testIrreducible() {
    final AstNode node = poly(1, 1, 1);
    final FactorizationResult result = Factorizer.create().factor(node, "x");
    assertThat(result.changed, is(false));
    assertThat(result.success, is(false));
    assertThat(result.ast, is(node));
    assertThat(result.status, is(FactorizationResult.Status.IRREDUCIBLE));
    assertThat(result.steps, hasItem("discriminant -3"));

    final FactorizationResult result2 =
        Factorizer.create().factor(poly(1, 0, 0, 0, 1), "x");
    assertThat(result2.status, is(FactorizationResult.Status.IRREDUCIBLE));
  }

  @Test void testNotApplicable() {
    final FactorizationResult result =
        Factorizer.create().factor(ast.number(6), "x");
    assertThat(result.changed, is(false));
    assertThat(result.status, is(FactorizationResult.Status.NOT_APPLICABLE));
    final FactorizationResult result2 =
        Factorizer.create().factor(poly(3, 1), "x");
    assertThat(result2.status,
        is(FactorizationResult.Status.NOT_APPLICABLE));
  }

  @Test void testMultivariate() {
    // 2 * x * y + 4 * x
    final AstNode x = ast.id("x");
    final AstNode node =
        ast.plus(ast.times(ast.times(ast.number(2), x), ast.id("y")),
            ast.times(ast.number(4), x));
    final Factorizer factorizer = Factorizer.create();
    final FactorizationResult result = factorizer.factor(node, "x");
    assertThat(result.changed, is(true));
    assertThat(factorizer.normalizer().equivalent(node, result.ast),
        is(true));
  }

  @Test void testIrrational() {
    final Map<FactorProp, Object> props = new HashMap<>();
    FactorProp.ALLOW_IRRATIONAL_FACTORS.set(props, true);
    final Factorizer factorizer = Factorizer.create(props);
    final FactorizationResult result = factorizer.factor(poly(-2, 0, 1), "x");
    assertThat(result.status, is(FactorizationResult.Status.FACTORED));
    assertThat(result.strategyUsed, is("quadratic"));
  }

  @Test void testStrategyThrows() {
    final Factorizer factorizer = Factorizer.create();
    final List<FactorException> errors = new ArrayList<>();
    final Factorizer factorizer2 =
        factorizer
            .withRegistry(
                factorizer.registry().plus(
                    FixedStrategy.throwing("boom", 1_000)))
            .withTracer(Tracers.withOnError(Tracers.empty(), errors::add));
    final FactorizationResult result =
        factorizer2.factor(poly(-4, 0, 1), "x");
    assertThat(result.ast, hasToString("(x - 2) * (x + 2)"));
    assertThat(result.steps,
        hasItem("boom: java.lang.IllegalStateException: boom"));
    // once for x^2 - 4, once for each of its factors
    assertThat(errors, hasSize(3));
    assertThat(errors.get(0).strategyName(), is("boom"));

    // the error is reported if nothing else is
    errors.clear();
    final AstNode node = ast.plus(ast.call("f", ast.id("x")), ast.number(1));
    final FactorizationResult result2 = factorizer2.factor(node, "x");
    assertThat(result2.changed, is(false));
    assertThat(result2.status,
        is(FactorizationResult.Status.INTERNAL_ERROR));
    assertThat(errors, hasSize(1));
  }

  @Test void testVerification() {
    // a strategy that claims every sum equals 7
    final Strategy liar =
        new FixedStrategy("liar", 500,
            node -> FactorizationResult.factored("liar", ast.number(7),
                ImmutableList.of()));
    final Factorizer factorizer = Factorizer.create();
    final Factorizer factorizer2 =
        factorizer.withRegistry(factorizer.registry().plus(liar));
    final FactorizationResult result =
        factorizer2.factor(poly(-4, 0, 1), "x");
    assertThat(result.ast, hasToString("(x - 2) * (x + 2)"));
    assertThat(result.steps,
        hasItem("liar: rejected 7; it does not equal x^2 - 4"));

    final Map<FactorProp, Object> props =
        ImmutableMap.of(FactorProp.VERIFY, false);
    final Factorizer factorizer3 =
        Factorizer.create(props)
            .withRegistry(factorizer.registry().plus(liar));
    assertThat(factorizer3.factor(poly(-4, 0, 1), "x").ast, hasToString("7"));
  }

  @Test void testNoProgress() {
    // a strategy that claims to change a tree but returns it unchanged
    final Strategy idle =
        new FixedStrategy("idle", 500,
            node -> FactorizationResult.factored("idle", node,
                ImmutableList.of()));
    final List<FactorizationResult.Status> statuses = new ArrayList<>();
    final Factorizer factorizer = Factorizer.create();
    final Factorizer factorizer2 =
        factorizer.withRegistry(factorizer.registry().plus(idle))
            .withTracer(
                Tracers.withOnRejected(Tracers.empty(), statuses::add));
    final FactorizationResult result =
        factorizer2.factor(poly(1, 1, 1), "x");
    assertThat(result.changed, is(false));
    assertThat(result.status, is(FactorizationResult.Status.IRREDUCIBLE));
    assertThat(statuses.get(0), is(FactorizationResult.Status.NO_PROGRESS));
    assertThat(statuses, hasItem(FactorizationResult.Status.IRREDUCIBLE));
  }

  @Test void testTracer() {
    final List<String> attempts = new ArrayList<>();
    final List<String> applied = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnApplied(
            Tracers.withOnAttempt(Tracers.empty(),
                (strategy, node) -> attempts.add(strategy.name())),
            (strategy, node) -> applied.add(strategy.name() + ": " + node));
    final Factorizer factorizer = Factorizer.create().withTracer(tracer);
    factorizer.factor(poly(-1, 0, 0, 0, 1), "x");
    assertThat(applied,
        contains("differenceOfSquares: (x^2 + 1) * (x^2 - 1)",
            "differenceOfSquares: (x + 1) * (x - 1)"));
    assertThat(attempts.get(0), is("differenceOfSquares"));
    assertThat(attempts, hasItem("integerFactorization"));
  }

  @Test void testMaxIterations() {
    final Map<FactorProp, Object> props =
        ImmutableMap.of(FactorProp.MAX_ITERATIONS, 0);
    final FactorizationResult result =
        Factorizer.create(props).factor(poly(-4, 0, 1), "x");
    assertThat(result.changed, is(false));
    assertThat(result.status, is(FactorizationResult.Status.NOT_APPLICABLE));

    // the limit applies to each factor separately
    final Map<FactorProp, Object> props2 =
        ImmutableMap.of(FactorProp.MAX_ITERATIONS, 1);
    check(Factorizer.create(props2), poly(-1, 0, 0, 0, 1),
        "(x - 1) * (x + 1) * (x^2 + 1)");
  }

  @Test void testFactorWithSteps() {
    final FactorizationResult result =
        Factorizer.create().factorWithSteps(poly(-1, 0, 0, 0, 1), "x");
    assertThat(result.ast, hasToString("(x - 1) * (x + 1) * (x^2 + 1)"));
    assertThat(result.strategyUsed, is("differenceOfSquares"));
    assertThat(result.steps,
        hasItem("differenceOfSquares: x^4 - 1 = (x^2 + 1) * (x^2 - 1)"));

    final FactorizationResult result2 =
        Factorizer.create().factorWithSteps(poly(1, 1, 1), "x");
    assertThat(result2.changed, is(false));
    assertThat(result2.status, is(FactorizationResult.Status.IRREDUCIBLE));
  }

  @Test void testDeterministic() {
    final AstNode node = poly(-1, 0, 0, 0, 0, 0, 1);
    final FactorizationResult result1 = Factorizer.create().factor(node, "x");
    final FactorizationResult result2 = Factorizer.create().factor(node, "x");
    assertThat(result1.ast, is(result2.ast));
    assertThat(result1.steps, is(result2.steps));
    assertThat(result1.ast,
        hasToString("(x - 1) * (x + 1) * (x^2 - x + 1) * (x^2 + x + 1)"));
  }
}

// End FactorizerTest.java
