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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rational root search.
 *
 * <p>By the rational root theorem, every rational root {@code p/q} (in lowest
 * terms) of an integer polynomial has {@code p} dividing the constant term
 * and {@code q} dividing the leading coefficient. Candidates are evaluated
 * exactly.
 */
public class RationalRoots {
  private RationalRoots() {}

  /**
   * Returns a rational root of a polynomial, or null if there is none, or if
   * the constant term or leading coefficient of its primitive part exceeds
   * {@code limit} in magnitude.
   *
   * <p>Zero is returned if the constant term is zero. Candidates are tried in
   * order of increasing magnitude, positive before negative.
   */
  public static @Nullable Rational findRoot(Polynomial p, long limit) {
    if (p.degree() < 1) {
      return null;
    }
    if (p.constantTerm().isZero()) {
      return Rational.ZERO;
    }
    for (Rational candidate : candidates(p, limit)) {
      if (p.evaluate(candidate).isZero()) {
        return candidate;
      }
    }
    return null;
  }

  /**
   * Returns the candidate roots of a polynomial, smallest magnitude first, or
   * an empty list if its coefficients are too large to enumerate.
   */
  public static List<Rational> candidates(Polynomial p, long limit) {
    final Polynomial primitive = p.primitivePart();
    final BigInteger constant =
        primitive.constantTerm().bigIntegerValueExact();
    final BigInteger lead =
        primitive.leadingCoefficient().bigIntegerValueExact();
    final List<BigInteger> ps = Integers.divisors(constant, limit);
    final List<BigInteger> qs = Integers.divisors(lead, limit);
    if (ps == null || qs == null) {
      return ImmutableList.of();
    }
    final Set<Rational> set = new LinkedHashSet<>();
    for (BigInteger n : ps) {
      for (BigInteger d : qs) {
        final Rational r = Rational.of(n, d);
        set.add(r);
        set.add(r.negate());
      }
    }
    final List<Rational> list = new ArrayList<>(set);
    list.sort((a, b) -> {
      final int c = a.abs().compareTo(b.abs());
      return c != 0 ? c : Integer.compare(b.signum(), a.signum());
    });
    return list;
  }

  /**
   * Returns the primitive integer linear factor with a given root: for
   * {@code p/q}, {@code q * x - p}.
   */
  public static Polynomial linearFactor(Rational root) {
    return Polynomial.linear(
        Rational.of(root.denominator), Rational.of(root.numerator.negate()));
  }

  /**
   * Peels every rational root from a polynomial.
   *
   * <p>Returns the linear factors found, each primitive with positive leading
   * coefficient, followed by the quotient. The product of the returned list
   * equals the argument exactly.
   */
  public static List<Polynomial> peel(Polynomial p, long limit) {
    final List<Polynomial> factors = new ArrayList<>();
    Polynomial q = p;
    for (;;) {
      if (q.degree() < 2) {
        break;
      }
      final Rational root = findRoot(q, limit);
      if (root == null) {
        break;
      }
      final Polynomial linear = linearFactor(root);
      factors.add(linear);
      q = q.divideExact(linear);
    }
    factors.add(q);
    return factors;
  }
}

// End RationalRoots.java
