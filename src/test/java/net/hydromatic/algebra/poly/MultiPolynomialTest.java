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
import static org.hamcrest.core.Is.is;

import net.hydromatic.algebra.poly.MultiPolynomial.Atom;
import net.hydromatic.algebra.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests for {@link MultiPolynomial}. */
public class MultiPolynomialTest {
  private static final MultiPolynomial X =
      MultiPolynomial.atom(Atom.variable("x"));
  private static final MultiPolynomial Y =
      MultiPolynomial.atom(Atom.variable("y"));
  private static final MultiPolynomial SQRT2 =
      MultiPolynomial.atom(Atom.radical(Rational.of(2)));

  @Test void testMultiplyMergesExponents() {
    final MultiPolynomial xy = X.multiply(Y);
    assertThat(xy.multiply(X), is(X.pow(2).multiply(Y)));
    assertThat(xy.multiply(X).degree("x"), is(2));
    assertThat(xy.multiply(X).degree("y"), is(1));
  }

  @Test void testMultiplyRadicals() {
    // (x sqrt(2))^2 = 2 x^2
    final MultiPolynomial a = X.multiply(SQRT2);
    assertThat(a.multiply(a), is(X.pow(2).multiply(Rational.of(2))));
    // sqrt(2)^3 = 2 sqrt(2)
    assertThat(SQRT2.multiply(SQRT2).multiply(SQRT2),
        is(SQRT2.multiply(Rational.of(2))));
    // (1 + sqrt(2)) (1 - sqrt(2)) = -1
    final MultiPolynomial product =
        MultiPolynomial.ONE.add(SQRT2)
            .multiply(MultiPolynomial.ONE.subtract(SQRT2));
    assertThat(product.rationalValue(), is(Rational.MINUS_ONE));
  }
}

// End MultiPolynomialTest.java
