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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.algebra.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests for {@link Polynomial}. */
public class PolynomialTest {
  /** x^3 - 6 x^2 + 11 x - 6, whose roots are 1, 2, 3. */
  private static final Polynomial CUBIC = Polynomial.of(-6, 11, -6, 1);

  @Test void testToString() {
    assertThat(CUBIC, hasToString("x^3 - 6 * x^2 + 11 * x - 6"));
    assertThat(Polynomial.ZERO, hasToString("0"));
    assertThat(Polynomial.of(1, 0, -1), hasToString("-x^2 + 1"));
    assertThat(Polynomial.of(1, 0, -1).toAst("t"), hasToString("-t^2 + 1"));
    assertThat(Polynomial.linear(Rational.of(1, 2), Rational.ONE),
        hasToString("1 / 2 * x + 1"));
    assertThat(Polynomial.of(0, 0, 0), is(Polynomial.ZERO));
  }

  @Test void testAccessors() {
    assertThat(CUBIC.degree(), is(3));
    assertThat(Polynomial.ZERO.degree(), is(-1));
    assertThat(CUBIC.leadingCoefficient(), is(Rational.ONE));
    assertThat(CUBIC.constantTerm(), is(Rational.of(-6)));
    assertThat(CUBIC.coefficient(7), is(Rational.ZERO));
    assertThat(CUBIC.termCount(), is(4));
    assertThat(Polynomial.of(0, 0, 1, 1).lowestDegree(), is(2));
    assertThat(Polynomial.of(4, 0, -5, 0, 1).exponentGcd(), is(2));
    assertThat(Polynomial.of(7).exponentGcd(), is(0));
    assertThat(CUBIC.isIntegral(), is(true));
    assertThat(Polynomial.of(5).isConstant(), is(true));
  }

  @Test void testArithmetic() {
    final Polynomial xMinus1 = Polynomial.of(-1, 1);
    final Polynomial xPlus1 = Polynomial.of(1, 1);
    assertThat(xMinus1.multiply(xPlus1), hasToString("x^2 - 1"));
    assertThat(xMinus1.add(xPlus1), hasToString("2 * x"));
    assertThat(xMinus1.subtract(xMinus1), is(Polynomial.ZERO));
    assertThat(xPlus1.pow(3), hasToString("x^3 + 3 * x^2 + 3 * x + 1"));
    assertThat(xPlus1.pow(0), is(Polynomial.ONE));
    assertThat(CUBIC.derivative(), hasToString("3 * x^2 - 12 * x + 11"));
    assertThat(CUBIC.evaluate(Rational.of(2)), is(Rational.ZERO));
    assertThat(CUBIC.evaluate(Rational.ZERO), is(Rational.of(-6)));
    assertThat(Polynomial.of(2, 4).monic(), hasToString("x + 1 / 2"));
  }

  @Test void testDivision() {
    final Polynomial.DivRem divRem =
        Polynomial.of(1, 0, 1).divRem(Polynomial.of(-1, 1));
    assertThat(divRem.quotient, hasToString("x + 1"));
    assertThat(divRem.remainder, hasToString("2"));
    assertThat(Polynomial.of(-1, 0, 0, 1).divideExact(Polynomial.of(-1, 1)),
        hasToString("x^2 + x + 1"));
    assertThat(CUBIC.isDivisibleBy(Polynomial.of(-3, 1)), is(true));
    assertThat(CUBIC.isDivisibleBy(Polynomial.of(3, 1)), is(false));
    assertThat(CUBIC.syntheticDivide(Rational.ONE),
        hasToString("x^2 - 5 * x + 6"));
    assertThrows(ArithmeticException.class,
        () -> CUBIC.syntheticDivide(Rational.of(4)));
    assertThrows(ArithmeticException.class,
        () -> CUBIC.divideExact(Polynomial.of(1, 1)));
    assertThrows(ArithmeticException.class,
        () -> CUBIC.divRem(Polynomial.ZERO));
  }

  @Test void testGcd() {
    assertThat(Polynomial.gcd(Polynomial.of(-1, 0, 1), Polynomial.of(1, 2, 1)),
        hasToString("x + 1"));
    assertThat(Polynomial.gcd(Polynomial.of(-2, 0, 2), Polynomial.of(3)),
        is(Polynomial.ONE));
    assertThat(Polynomial.gcd(Polynomial.ZERO, Polynomial.ZERO),
        is(Polynomial.ZERO));
    assertThat(Polynomial.gcd(Polynomial.of(4, 2), Polynomial.ZERO),
        hasToString("x + 2"));
  }

  @Test void testContent() {
    final Polynomial p = Polynomial.of(-4, -2);
    assertThat(p.content(), is(Rational.of(-2)));
    assertThat(p.primitivePart(), hasToString("x + 2"));
    final Polynomial q =
        Polynomial.linear(Rational.of(1, 2), Rational.of(1, 3));
    assertThat(q.content(), is(Rational.of(1, 6)));
    assertThat(q.primitivePart(), hasToString("3 * x + 2"));
    assertThat(Polynomial.ZERO.content(), is(Rational.ONE));
  }

  @Test void testSubstitution() {
    final Polynomial p = Polynomial.of(4, 0, -5, 0, 1);
    final Polynomial q = p.deflate(2);
    assertThat(q, hasToString("x^2 - 5 * x + 4"));
    assertThat(q.inflate(2), is(p));
    assertThrows(IllegalArgumentException.class, () -> CUBIC.deflate(2));
  }
}

// End PolynomialTest.java
