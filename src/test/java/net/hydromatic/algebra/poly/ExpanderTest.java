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

import static net.hydromatic.algebra.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests for {@link Expander}. */
public class ExpanderTest {
  private static final AstNode X = ast.id("x");
  private static final AstNode Y = ast.id("y");
  private static final AstNode ONE = ast.number(1);

  private final Expander expander = new Expander(32);

  @Test void testExpand() {
    assertThat(
        expander.normalize(ast.times(ast.plus(X, ONE), ast.minus(X, ONE)),
            "x"),
        hasToString("x^2 - 1"));
    assertThat(expander.normalize(ast.power(ast.plus(X, ONE), 2), "x"),
        hasToString("x^2 + 2 * x + 1"));
    assertThat(
        expander.normalize(ast.minus(ast.times(X, X), ast.power(X, 2)), "x"),
        hasToString("0"));
    assertThat(
        expander.normalize(ast.negate(ast.minus(ast.number(3), X)), "x"),
        hasToString("x - 3"));
  }

  @Test void testMultivariate() {
    final AstNode tree = ast.plus(ast.times(X, Y), ast.times(Y, X));
    assertThat(expander.expand(tree), hasToString("2 * x * y"));
    assertThat(expander.normalize(tree, "x"), hasToString("2 * y * x"));
    assertThat(expander.expand(tree).variables(), hasToString("[x, y]"));
    assertThat(expander.expand(tree).degree("x"), is(1));
  }

  @Test void testDivision() {
    assertThat(expander.expand(ast.divide(X, ast.number(2))),
        hasToString("1 / 2 * x"));
    assertThat(expander.expand(ast.fraction(ast.number(3), ast.number(6))),
        hasToString("1 / 2"));
    // division by a variable, or by zero, is opaque
    final MultiPolynomial reciprocal =
        expander.expand(ast.divide(ONE, X));
    assertThat(reciprocal.hasOtherAtoms("x"), is(true));
    assertThat(expander.expand(ast.divide(X, ast.number(0))).isConstant(),
        is(false));
  }

  @Test void testSquareRoots() {
    final AstNode sqrt2 = ast.sqrt(ast.number(2));
    assertThat(expander.expand(ast.sqrt(ast.number(8))),
        hasToString("2 * sqrt(2)"));
    assertThat(expander.expand(ast.sqrt(ast.number(9))).rationalValue(),
        is(Rational.of(3)));
    assertThat(expander.expand(ast.times(sqrt2, sqrt2)).rationalValue(),
        is(Rational.of(2)));
    assertThat(
        expander.expand(ast.times(ast.plus(ONE, sqrt2), ast.minus(ONE, sqrt2)))
            .rationalValue(),
        is(Rational.MINUS_ONE));
    assertThat(expander.expand(sqrt2).isConstant(), is(true));
    assertThat(expander.expand(sqrt2).rationalValue(), nullValue());
  }

  @Test void testOpaque() {
    final AstNode sinX = ast.call("sin", X);
    assertThat(expander.expand(ast.plus(sinX, sinX)),
        hasToString("2 * sin(x)"));
    assertThat(
        expander.equivalent(ast.call("f", ast.plus(X, Y)),
            ast.call("f", ast.plus(Y, X))),
        is(true));
    assertThat(expander.expand(ast.power(X, ast.number(-1))).degree("x"),
        is(0));
    assertThat(
        expander.expand(ast.power(X, ast.number(Rational.of(1, 2))))
            .hasOtherAtoms("x"),
        is(true));
  }

  @Test void testMaxExpansionPower() {
    final Expander small = new Expander(2);
    final AstNode cube = ast.power(ast.plus(X, ONE), 3);
    assertThat(small.expand(cube).terms.size(), is(1));
    assertThat(small.expand(cube).hasOtherAtoms("x"), is(true));
    assertThat(expander.expand(cube).terms.size(), is(4));
    // a power of a single term is always expanded
    assertThat(small.expand(ast.power(X, 40)), hasToString("x^40"));
  }

  @Test void testEquivalent() {
    assertThat(
        expander.equivalent(ast.power(ast.plus(X, ONE), 2),
            ast.plus(ast.plus(ast.power(X, 2), ast.times(ast.number(2), X)),
                ONE)),
        is(true));
    assertThat(
        expander.equivalent(ast.plus(X, ONE), ast.plus(X, ast.number(2))),
        is(false));
  }
}

// End ExpanderTest.java
