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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Hensel}. */
public class HenselTest {
  @Test void testLiftSquareRoot() {
    // x^2 - 2 = (x - 3) (x + 3) modulo 7; 10^2 = 2 modulo 49
    final BigPolynomial f = BigPolynomial.of(-2, 0, 1);
    final List<BigPolynomial> lifted =
        Hensel.lift(f,
            ImmutableList.of(GfPolynomial.of(7, 4, 1),
                GfPolynomial.of(7, 3, 1)),
            2);
    assertThat(lifted,
        contains(BigPolynomial.of(39, 1), BigPolynomial.of(10, 1)));
  }

  @Test void testLiftProduct() {
    // x^4 - 1 modulo 3, lifted to 3^4
    final BigPolynomial f = BigPolynomial.of(-1, 0, 0, 0, 1);
    final BigInteger modulus = BigInteger.valueOf(81);
    final List<BigPolynomial> lifted =
        Hensel.lift(f,
            ImmutableList.of(GfPolynomial.of(3, 2, 1),
                GfPolynomial.of(3, 1, 1), GfPolynomial.of(3, 1, 0, 1)),
            4);
    BigPolynomial product = BigPolynomial.ONE;
    for (BigPolynomial p : lifted) {
      product = product.multiply(p);
    }
    assertThat(product.mod(modulus), is(f.mod(modulus)));
    assertThat(lifted,
        contains(BigPolynomial.of(80, 1), BigPolynomial.of(1, 1),
            BigPolynomial.of(1, 0, 1)));
  }

  @Test void testLiftNonMonic() {
    // 2 x^2 - 2 = 2 (x - 1) (x + 1); lifts are monic
    final BigPolynomial f = BigPolynomial.of(-2, 0, 2);
    final List<BigPolynomial> lifted =
        Hensel.lift(f,
            ImmutableList.of(GfPolynomial.of(5, 4, 1),
                GfPolynomial.of(5, 1, 1)),
            3);
    assertThat(lifted,
        contains(BigPolynomial.of(124, 1), BigPolynomial.of(1, 1)));
  }

  @Test void testRejectsBadArguments() {
    final BigPolynomial f = BigPolynomial.of(-5, 0, 5);
    assertThrows(IllegalArgumentException.class,
        () -> Hensel.lift(f, ImmutableList.of(GfPolynomial.of(5, 1, 1)), 2));
    assertThrows(IllegalArgumentException.class,
        () -> Hensel.lift(f, ImmutableList.of(), 2));
  }
}

// End HenselTest.java
