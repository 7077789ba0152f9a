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
package net.hydromatic.algebra.integer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests for {@link GfPolynomial}. */
public class GfPolynomialTest {
  @Test void testOf() {
    final GfPolynomial p = GfPolynomial.of(5, 7, -1);
    assertThat(p, hasToString("4 * x + 2 (mod 5)"));
    assertThat(p.degree(), is(1));
    assertThat(p.coefficient(0), is(2L));
    assertThat(GfPolynomial.of(5, 5, 10).isZero(), is(true));
    assertThat(GfPolynomial.of(5, BigPolynomial.of(-1, 6)),
        is(GfPolynomial.of(5, 4, 1)));
    assertThrows(IllegalArgumentException.class,
        () -> GfPolynomial.of(4, 1, 1));
  }

  @Test void testArithmetic() {
    final GfPolynomial xPlus1 = GfPolynomial.of(5, 1, 1);
    final GfPolynomial xPlus4 = GfPolynomial.of(5, 4, 1);
    assertThat(xPlus1.multiply(xPlus4), is(GfPolynomial.of(5, 4, 0, 1)));
    assertThat(xPlus1.add(xPlus4), is(GfPolynomial.of(5, 0, 2)));
    assertThat(xPlus1.subtract(xPlus1).isZero(), is(true));
    assertThat(xPlus1.inverse(2), is(3L));
    assertThat(GfPolynomial.of(5, 2, 4).monic(), is(GfPolynomial.of(5, 3, 1)));
  }

  @Test void testDivRem() {
    final GfPolynomial[] qr =
        GfPolynomial.of(5, 4, 0, 1).divRem(GfPolynomial.of(5, 1, 1));
    assertThat(qr[0], is(GfPolynomial.of(5, 4, 1)));
    assertThat(qr[1].isZero(), is(true));
    assertThat(GfPolynomial.of(5, 1, 0, 1).mod(GfPolynomial.of(5, 4, 1)),
        is(GfPolynomial.constant(5, 2)));
  }

  @Test void testDerivative() {
    assertThat(GfPolynomial.of(5, 1, 1, 1).derivative(),
        is(GfPolynomial.of(5, 1, 2)));
    // d/dx x^5 = 5 x^4 = 0
    assertThat(GfPolynomial.of(5, 0, 0, 0, 0, 0, 1).derivative().isZero(),
        is(true));
  }

  @Test void testGcd() {
    final GfPolynomial a = GfPolynomial.of(5, -1, 0, 1);
    final GfPolynomial b = GfPolynomial.of(5, 1, 2, 1);
    assertThat(GfPolynomial.gcd(a, b), is(GfPolynomial.of(5, 1, 1)));

    final GfPolynomial c = GfPolynomial.of(5, 1, 0, 1);
    final GfPolynomial d = GfPolynomial.of(5, -1, 1);
    final GfPolynomial[] gst = GfPolynomial.extendedGcd(c, d);
    assertThat(gst[0].isOne(), is(true));
    assertThat(gst[1].multiply(c).add(gst[2].multiply(d)), is(gst[0]));
  }

  @Test void testPowMod() {
    // x^2 = -1, so x^5 = x, modulo x^2 + 1
    final GfPolynomial x = GfPolynomial.x(5);
    assertThat(x.powMod(BigInteger.valueOf(5), GfPolynomial.of(5, 1, 0, 1)),
        is(x));
  }

  @Test void testIsSquareFree() {
    assertThat(GfPolynomial.of(5, 1, 2, 1).isSquareFree(), is(false));
    assertThat(GfPolynomial.of(5, 4, 0, 1).isSquareFree(), is(true));
    assertThat(GfPolynomial.constant(5, 3).isSquareFree(), is(true));
  }
}

// End GfPolynomialTest.java
