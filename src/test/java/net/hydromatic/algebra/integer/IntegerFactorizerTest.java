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
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link IntegerFactorizer}. */
public class IntegerFactorizerTest {
  private static final IntegerFactorizer SUBSETS =
      new IntegerFactorizer(3, false, 8);
  private static final IntegerFactorizer LATTICE =
      new IntegerFactorizer(3, true, 0);

  private static void checkFactor(IntegerFactorizer factorizer,
      BigPolynomial f, String expected) {
    final IntegerFactorization factorization = factorizer.factor(f);
    assertThat(factorization, hasToString(expected));
    assertThat(factorization.expand(), is(f));
  }

  @Test void testSubsets() {
    checkFactor(SUBSETS, BigPolynomial.of(-1, 0, 0, 0, 1),
        "1 * (x - 1) * (x + 1) * (x^2 + 1)");
    checkFactor(SUBSETS, BigPolynomial.of(-1, 0, 0, 0, 0, 0, 1),
        "1 * (x - 1) * (x + 1) * (x^2 - x + 1) * (x^2 + x + 1)");
    checkFactor(SUBSETS, BigPolynomial.of(-2, 1, 6),
        "1 * (2 * x - 1) * (3 * x + 2)");
    checkFactor(SUBSETS, BigPolynomial.of(1, 0, -1),
        "-1 * (x - 1) * (x + 1)");
  }

  @Test void testLattice() {
    checkFactor(LATTICE, BigPolynomial.of(-1, 0, 0, 0, 1),
        "1 * (x - 1) * (x + 1) * (x^2 + 1)");
    checkFactor(LATTICE, BigPolynomial.of(-1, 0, 0, 0, 0, 0, 1),
        "1 * (x - 1) * (x + 1) * (x^2 - x + 1) * (x^2 + x + 1)");
    assertThat(LATTICE.factor(BigPolynomial.of(1, 0, 0, 0, 1)).isIrreducible(),
        is(true));
  }

  @Test void testLatticeRecombination() {
    // (x^2 - 2) (x^2 - 3) (x^2 - 5) (x^2 + x + 1) has at least 4 factors
    // modulo any prime, so the lattice has to separate them
    final BigPolynomial f = BigPolynomial.of(-2, 0, 1)
        .multiply(BigPolynomial.of(-3, 0, 1))
        .multiply(BigPolynomial.of(-5, 0, 1))
        .multiply(BigPolynomial.of(1, 1, 1));
    final String expected =
        "1 * (x^2 - 2) * (x^2 - 3) * (x^2 - 5) * (x^2 + x + 1)";
    checkFactor(LATTICE, f, expected);
    checkFactor(new IntegerFactorizer(3, true, 2), f, expected);
    checkFactor(SUBSETS, f, expected);
    assertThat(LATTICE.factor(f).steps,
        hasItem(startsWith("reducing lattices for ")));
  }

  @Test void testLatticeIrreducible() {
    // Swinnerton-Dyer polynomials split into factors of degree at most 2
    // modulo every prime, but are irreducible
    final BigPolynomial s2 = BigPolynomial.of(1, 0, -10, 0, 1);
    final BigPolynomial s3 =
        BigPolynomial.of(576, 0, -960, 0, 352, 0, -40, 0, 1);
    assertThat(LATTICE.factor(s2).isIrreducible(), is(true));
    assertThat(LATTICE.factor(s3).isIrreducible(), is(true));
    assertThat(SUBSETS.factor(s3).isIrreducible(), is(true));
  }

  @Test void testCandidateDegrees() {
    final List<GfPolynomial> modular =
        ImmutableList.of(GfPolynomial.of(5, 1, 1),
            GfPolynomial.of(5, 2, 0, 1),
            GfPolynomial.of(5, 3, 0, 1));
    assertThat(
        IntegerFactorizer.candidateDegrees(modular,
            ImmutableList.of(0, 1, 2), 0, 5),
        contains(1, 3));
    assertThat(
        IntegerFactorizer.candidateDegrees(modular,
            ImmutableList.of(0, 1, 2), 1, 5),
        contains(2, 3, 4));
    assertThat(
        IntegerFactorizer.candidateDegrees(modular,
            ImmutableList.of(1, 2), 1, 4),
        contains(2));
    assertThat(IntegerFactorizer.latticeBound(BigPolynomial.of(1, 1), 1),
        is(BigInteger.valueOf(16)));
  }

  @Test void testSteps() {
    final IntegerFactorization factorization =
        SUBSETS.factor(BigPolynomial.of(-1, 0, 0, 0, 1));
    assertThat(factorization.steps,
        hasItem("x^4 - 1 has 3 factor(s) modulo 3"));
  }

  @Test void testIrreducible() {
    // x^4 + 1 splits modulo every prime, but not over the integers
    final IntegerFactorization factorization =
        SUBSETS.factor(BigPolynomial.of(1, 0, 0, 0, 1));
    assertThat(factorization.isIrreducible(), is(true));
    assertThat(factorization, hasToString("1 * (x^4 + 1)"));
    assertThat(SUBSETS.factor(BigPolynomial.of(1, 1, 1)).isIrreducible(),
        is(true));
    assertThat(SUBSETS.factor(BigPolynomial.of(2, 2, 2)).isIrreducible(),
        is(false));
  }

  @Test void testRepeatedFactors() {
    // 2 (x - 1)^2 (x + 1)
    final BigPolynomial f = BigPolynomial.of(2, -2, -2, 2);
    final IntegerFactorization factorization = SUBSETS.factor(f);
    assertThat(factorization.content, is(BigInteger.TWO));
    assertThat(factorization, hasToString("2 * (x - 1)^2 * (x + 1)"));
    assertThat(factorization.expand(), is(f));
    assertThat(factorization.steps,
        hasItem("square-free part of multiplicity 1: x + 1"));
  }

  @Test void testConstant() {
    final IntegerFactorization factorization =
        SUBSETS.factor(BigPolynomial.of(6));
    assertThat(factorization, hasToString("6"));
    assertThat(factorization.factors, hasSize(0));
    assertThrows(IllegalArgumentException.class,
        () -> SUBSETS.factor(BigPolynomial.ZERO));
  }

  @Test void testSquareFree() {
    assertThat(IntegerFactorizer.squareFree(BigPolynomial.of(1, -1, -1, 1)),
        contains(BigPolynomial.of(1, 1), BigPolynomial.of(-1, 1)));
    assertThat(IntegerFactorizer.squareFree(BigPolynomial.of(-1, 0, 1)),
        contains(BigPolynomial.of(-1, 0, 1)));
  }

  @Test void testCombinations() {
    assertThat(IntegerFactorizer.combinations(4, 2), hasSize(6));
    assertThat(IntegerFactorizer.combinations(4, 2).get(0)[1], is(1));
    assertThat(IntegerFactorizer.combinations(4, 2).get(5)[0], is(2));
    assertThat(IntegerFactorizer.combinations(2, 3), hasSize(0));
    assertThat(IntegerFactorizer.exponentAbove(5, BigInteger.valueOf(25)),
        is(3));
  }
}

// End IntegerFactorizerTest.java
