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
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Berlekamp}. */
public class BerlekampTest {
  @Test void testSplitsIntoLinearFactors() {
    // x^4 - 1 has the four roots 1, 2, 3, 4 modulo 5
    final GfPolynomial f = GfPolynomial.of(5, -1, 0, 0, 0, 1);
    assertThat(Berlekamp.factorCount(f), is(4));
    assertThat(Berlekamp.factor(f),
        containsInAnyOrder(GfPolynomial.of(5, 4, 1), GfPolynomial.of(5, 3, 1),
            GfPolynomial.of(5, 2, 1), GfPolynomial.of(5, 1, 1)));
  }

  @Test void testIrreducible() {
    // 3 is not a square modulo 5
    final GfPolynomial f = GfPolynomial.of(5, 2, 0, 1);
    assertThat(Berlekamp.factorCount(f), is(1));
    assertThat(Berlekamp.factor(f), containsInAnyOrder(f));
  }

  @Test void testProductIsMonic() {
    // 2 x^6 - 2 modulo 7 has six linear factors
    final GfPolynomial f = GfPolynomial.of(7, -2, 0, 0, 0, 0, 0, 2);
    final List<GfPolynomial> factors = Berlekamp.factor(f);
    assertThat(factors, hasSize(6));
    GfPolynomial product = GfPolynomial.constant(7, 1);
    for (GfPolynomial factor : factors) {
      assertThat(factor.leadingCoefficient(), is(1L));
      product = product.multiply(factor);
    }
    assertThat(product, is(f.monic()));
  }

  @Test void testMixedDegrees() {
    // x^4 - 1 = (x - 1) (x + 1) (x^2 + 1) modulo 3
    final GfPolynomial f = GfPolynomial.of(3, -1, 0, 0, 0, 1);
    assertThat(Berlekamp.factor(f),
        containsInAnyOrder(GfPolynomial.of(3, 2, 1), GfPolynomial.of(3, 1, 1),
            GfPolynomial.of(3, 1, 0, 1)));
  }

  @Test void testRejectsRepeatedFactor() {
    assertThrows(IllegalArgumentException.class,
        () -> Berlekamp.factor(GfPolynomial.of(5, 1, 2, 1)));
    assertThrows(IllegalArgumentException.class,
        () -> Berlekamp.factor(GfPolynomial.constant(5, 3)));
  }
}

// End BerlekampTest.java
