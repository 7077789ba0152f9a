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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.math.BigIntegerMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Polynomial with integer coefficients, lowest degree first.
 *
 * <p>Immutable. The coefficient list has no trailing zeros, so the zero
 * polynomial has an empty list and degree -1.
 */
public final class BigPolynomial {
  public static final BigPolynomial ZERO =
      new BigPolynomial(ImmutableList.of());
  public static final BigPolynomial ONE =
      new BigPolynomial(ImmutableList.of(BigInteger.ONE));

  private final ImmutableList<BigInteger> coefficients;

  private BigPolynomial(ImmutableList<BigInteger> coefficients) {
    this.coefficients = coefficients;
  }

  public static BigPolynomial of(List<BigInteger> coefficients) {
    int n = coefficients.size();
    while (n > 0 && coefficients.get(n - 1).signum() == 0) {
      --n;
    }
    return new BigPolynomial(
        ImmutableList.copyOf(coefficients.subList(0, n)));
  }

  /** Creates a polynomial from coefficients, lowest degree first. */
  public static BigPolynomial of(long... coefficients) {
    final List<BigInteger> list = new ArrayList<>();
    for (long c : coefficients) {
      list.add(BigInteger.valueOf(c));
    }
    return of(list);
  }

  /** Converts a rational polynomial whose coefficients are all integers. */
  public static BigPolynomial of(Polynomial p) {
    return of(p.integerCoefficients());
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BigPolynomial
            && coefficients.equals(((BigPolynomial) o).coefficients);
  }

  @Override
  public String toString() {
    return toPolynomial().toString();
  }

  public Polynomial toPolynomial() {
    final List<Rational> list = new ArrayList<>();
    coefficients.forEach(c -> list.add(Rational.of(c)));
    return Polynomial.of(list);
  }

  public int degree() {
    return coefficients.size() - 1;
  }

  public boolean isZero() {
    return coefficients.isEmpty();
  }

  public BigInteger coefficient(int i) {
    return i < coefficients.size() ? coefficients.get(i) : BigInteger.ZERO;
  }

  public List<BigInteger> coefficients() {
    return coefficients;
  }

  public BigInteger leadingCoefficient() {
    return isZero() ? BigInteger.ZERO : coefficients.get(degree());
  }

  public BigPolynomial add(BigPolynomial o) {
    final int n = Math.max(coefficients.size(), o.coefficients.size());
    final List<BigInteger> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(coefficient(i).add(o.coefficient(i)));
    }
    return of(list);
  }

  public BigPolynomial negate() {
    return multiply(BigInteger.ONE.negate());
  }

  public BigPolynomial subtract(BigPolynomial o) {
    return add(o.negate());
  }

  public BigPolynomial multiply(BigInteger c) {
    final List<BigInteger> list = new ArrayList<>(coefficients.size());
    coefficients.forEach(a -> list.add(a.multiply(c)));
    return of(list);
  }

  public BigPolynomial multiply(BigPolynomial o) {
    if (isZero() || o.isZero()) {
      return ZERO;
    }
    final BigInteger[] r = new BigInteger[degree() + o.degree() + 1];
    Arrays.fill(r, BigInteger.ZERO);
    for (int i = 0; i < coefficients.size(); i++) {
      for (int j = 0; j < o.coefficients.size(); j++) {
        r[i + j] =
            r[i + j].add(coefficients.get(i).multiply(o.coefficients.get(j)));
      }
    }
    return of(Arrays.asList(r));
  }

  public BigPolynomial pow(int n) {
    checkArgument(n >= 0);
    BigPolynomial p = ONE;
    for (int i = 0; i < n; i++) {
      p = p.multiply(this);
    }
    return p;
  }

  /**
   * Divides exactly over the integers, or returns null if the quotient does
   * not exist in Z[x].
   */
  public @Nullable BigPolynomial divideExact(BigPolynomial divisor) {
    checkArgument(!divisor.isZero(), "division by zero polynomial");
    if (isZero()) {
      return ZERO;
    }
    final int dq = degree() - divisor.degree();
    if (dq < 0) {
      return null;
    }
    final BigInteger lead = divisor.leadingCoefficient();
    final BigInteger[] r = coefficients.toArray(new BigInteger[0]);
    final BigInteger[] q = new BigInteger[dq + 1];
    for (int k = dq; k >= 0; k--) {
      final BigInteger[] qr = r[k + divisor.degree()].divideAndRemainder(lead);
      if (qr[1].signum() != 0) {
        return null;
      }
      q[k] = qr[0];
      for (int j = 0; j <= divisor.degree(); j++) {
        r[j + k] = r[j + k].subtract(qr[0].multiply(divisor.coefficient(j)));
      }
    }
    for (BigInteger c : r) {
      if (c.signum() != 0) {
        return null;
      }
    }
    return of(Arrays.asList(q));
  }

  /** Returns the GCD of the coefficients, with the sign of the leading
   * coefficient; 1 for the zero polynomial. */
  public BigInteger content() {
    if (isZero()) {
      return BigInteger.ONE;
    }
    BigInteger g = BigInteger.ZERO;
    for (BigInteger c : coefficients) {
      g = g.gcd(c);
    }
    return leadingCoefficient().signum() < 0 ? g.negate() : g;
  }

  /** Returns this polynomial divided by its content; the result has a
   * positive leading coefficient. */
  public BigPolynomial primitivePart() {
    final BigInteger content = content();
    final List<BigInteger> list = new ArrayList<>(coefficients.size());
    coefficients.forEach(c -> list.add(c.divide(content)));
    return of(list);
  }

  public BigPolynomial derivative() {
    final List<BigInteger> list = new ArrayList<>();
    for (int i = 1; i < coefficients.size(); i++) {
      list.add(coefficients.get(i).multiply(BigInteger.valueOf(i)));
    }
    return of(list);
  }

  /** Returns the primitive greatest common divisor, with positive leading
   * coefficient. */
  public static BigPolynomial gcd(BigPolynomial a, BigPolynomial b) {
    final Polynomial g = Polynomial.gcd(a.toPolynomial(), b.toPolynomial());
    if (g.isZero()) {
      return ZERO;
    }
    return of(g.primitivePart());
  }

  /** Reduces coefficients modulo {@code m} into the symmetric range
   * {@code (-m/2, m/2]}. */
  public BigPolynomial symmetricMod(BigInteger m) {
    final BigInteger half = m.shiftRight(1);
    final List<BigInteger> list = new ArrayList<>(coefficients.size());
    for (BigInteger c : coefficients) {
      BigInteger r = c.mod(m);
      if (r.compareTo(half) > 0) {
        r = r.subtract(m);
      }
      list.add(r);
    }
    return of(list);
  }

  /** Reduces coefficients modulo {@code m} into {@code [0, m)}. */
  public BigPolynomial mod(BigInteger m) {
    final List<BigInteger> list = new ArrayList<>(coefficients.size());
    coefficients.forEach(c -> list.add(c.mod(m)));
    return of(list);
  }

  /** Returns the sum of the squares of the coefficients, the square of the
   * Euclidean norm. */
  public BigInteger normSquared() {
    BigInteger s = BigInteger.ZERO;
    for (BigInteger c : coefficients) {
      s = s.add(c.multiply(c));
    }
    return s;
  }

  /** Returns the ceiling of the Euclidean norm. */
  public BigInteger normCeiling() {
    return BigIntegerMath.sqrt(normSquared(), RoundingMode.CEILING);
  }

  /**
   * Returns a bound on the magnitude of the coefficients of any factor of
   * this polynomial in Z[x]: {@code 2^n * ceil(||f||)}, where {@code n} is the
   * degree (Mignotte).
   */
  public BigInteger factorCoefficientBound() {
    return normCeiling().shiftLeft(Math.max(degree(), 0));
  }
}

// End BigPolynomial.java
