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
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import java.util.List;
import net.hydromatic.algebra.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests for {@link RationalRoots}. */
public class RationalRootsTest {
  private static final long LIMIT = 1_000_000;

  @Test void testCandidates() {
    // 2 x^2 - x - 1 = (x - 1) (2 x + 1)
    final Polynomial p = Polynomial.of(-1, -1, 2);
    assertThat(RationalRoots.candidates(p, LIMIT),
        hasToString("[1/2, -1/2, 1, -1]"));
    assertThat(RationalRoots.findRoot(p, LIMIT), is(Rational.of(-1, 2)));
  }

  @Test void testFindRoot() {
    assertThat(RationalRoots.findRoot(Polynomial.of(-4, 0, 1), LIMIT),
        is(Rational.of(2)));
    assertThat(RationalRoots.findRoot(Polynomial.of(1, 0, 1), LIMIT),
        nullValue());
    assertThat(RationalRoots.findRoot(Polynomial.of(0, 1, 1), LIMIT),
        is(Rational.ZERO));
    assertThat(RationalRoots.findRoot(Polynomial.of(5), LIMIT), nullValue());
  }

  @Test void testLinearFactor() {
    assertThat(RationalRoots.linearFactor(Rational.of(-1, 2)),
        hasToString("2 * x + 1"));
    assertThat(RationalRoots.linearFactor(Rational.of(3)),
        hasToString("x - 3"));
  }

  @Test void testPeel() {
    final List<Polynomial> factors =
        RationalRoots.peel(Polynomial.of(-6, 11, -6, 1), LIMIT);
    assertThat(factors, hasToString("[x - 1, x - 2, x - 3]"));

    // x^3 - 2 has no rational root
    assertThat(RationalRoots.peel(Polynomial.of(-2, 0, 0, 1), LIMIT),
        hasSize(1));

    // (x - 1)^2 (x^2 + 1)
    assertThat(RationalRoots.peel(Polynomial.of(1, -2, 2, -2, 1), LIMIT),
        hasToString("[x - 1, x - 1, x^2 + 1]"));
  }

  /** Tests that the search is skipped when the constant term is too large
   * to enumerate its divisors. */
  @Test void testLimit() {
    final Polynomial p = Polynomial.of(-1_000_003, 0, 1);
    assertThat(RationalRoots.candidates(p, 1000), empty());
    assertThat(RationalRoots.findRoot(p, 1000), nullValue());
    assertThat(RationalRoots.peel(Polynomial.of(-2000, 1), 1000),
        hasSize(1));
  }
}

// End RationalRootsTest.java
