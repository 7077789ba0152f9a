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
package net.hydromatic.algebra.util;

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exact rational number.
 *
 * <p>Always held in lowest terms, with a positive denominator. Instances are
 * immutable.
 */
public final class Rational implements Comparable<Rational> {
  public static final Rational ZERO = new Rational(BigInteger.ZERO);
  public static final Rational ONE = new Rational(BigInteger.ONE);
  public static final Rational MINUS_ONE =
      new Rational(BigInteger.ONE.negate());
  public static final Rational TWO = new Rational(BigInteger.TWO);

  public final BigInteger numerator;
  public final BigInteger denominator;

  private Rational(BigInteger numerator) {
    this.numerator = requireNonNull(numerator);
    this.denominator = BigInteger.ONE;
  }

  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /** Creates a rational from an integer. */
  public static Rational of(long n) {
    return of(BigInteger.valueOf(n));
  }

  /** Creates a rational from an integer. */
  public static Rational of(BigInteger n) {
    if (n.signum() == 0) {
      return ZERO;
    }
    if (n.equals(BigInteger.ONE)) {
      return ONE;
    }
    return new Rational(n);
  }

  /** Creates a rational from a numerator and denominator. */
  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  /**
   * Creates a rational from a numerator and denominator, reducing to lowest
   * terms.
   *
   * @throws ArithmeticException if the denominator is zero
   */
  public static Rational of(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) {
      throw new ArithmeticException("zero denominator");
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger g = numerator.gcd(denominator);
    if (!g.equals(BigInteger.ONE) && g.signum() != 0) {
      numerator = numerator.divide(g);
      denominator = denominator.divide(g);
    }
    if (denominator.equals(BigInteger.ONE)) {
      return of(numerator);
    }
    return new Rational(numerator, denominator);
  }

  /** Converts a decimal value exactly. For example, 0.25 becomes 1/4. */
  public static Rational of(BigDecimal value) {
    final BigDecimal stripped = value.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      return of(stripped.toBigIntegerExact());
    }
    return of(
        stripped.unscaledValue(), BigInteger.TEN.pow(stripped.scale()));
  }

  /** Returns this value as a decimal, or null if it has no finite decimal
   * expansion. */
  public @Nullable BigDecimal toBigDecimal() {
    if (isInteger()) {
      return new BigDecimal(numerator);
    }
    try {
      return new BigDecimal(numerator)
          .divide(new BigDecimal(denominator))
          .stripTrailingZeros();
    } catch (ArithmeticException e) {
      // non-terminating expansion
      return null;
    }
  }

  @Override
  public int hashCode() {
    return numerator.hashCode() * 31 + denominator.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Rational
            && numerator.equals(((Rational) o).numerator)
            && denominator.equals(((Rational) o).denominator);
  }

  @Override
  public int compareTo(Rational o) {
    return numerator
        .multiply(o.denominator)
        .compareTo(o.numerator.multiply(denominator));
  }

  @Override
  public String toString() {
    return isInteger()
        ? numerator.toString()
        : numerator + "/" + denominator;
  }

  public int signum() {
    return numerator.signum();
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public boolean isOne() {
    return equals(ONE);
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public Rational negate() {
    return numerator.signum() == 0
        ? this
        : new Rational(numerator.negate(), denominator);
  }

  public Rational abs() {
    return numerator.signum() < 0 ? negate() : this;
  }

  public Rational add(Rational o) {
    if (isZero()) {
      return o;
    }
    if (o.isZero()) {
      return this;
    }
    if (isInteger() && o.isInteger()) {
      return of(numerator.add(o.numerator));
    }
    return of(
        numerator.multiply(o.denominator)
            .add(o.numerator.multiply(denominator)),
        denominator.multiply(o.denominator));
  }

  public Rational subtract(Rational o) {
    return add(o.negate());
  }

  public Rational multiply(Rational o) {
    if (isZero() || o.isZero()) {
      return ZERO;
    }
    if (isInteger() && o.isInteger()) {
      return of(numerator.multiply(o.numerator));
    }
    return of(
        numerator.multiply(o.numerator), denominator.multiply(o.denominator));
  }

  public Rational multiply(BigInteger n) {
    return multiply(of(n));
  }

  /**
   * Divides this value by another.
   *
   * @throws ArithmeticException if {@code o} is zero
   */
  public Rational divide(Rational o) {
    if (o.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    return of(
        numerator.multiply(o.denominator), denominator.multiply(o.numerator));
  }

  public Rational reciprocal() {
    return ONE.divide(this);
  }

  /** Raises to an integer power; negative exponents use the reciprocal. */
  public Rational pow(int exponent) {
    if (exponent < 0) {
      return reciprocal().pow(-exponent);
    }
    return of(numerator.pow(exponent), denominator.pow(exponent));
  }

  /** Returns the exact square root of this value, or null if it is not the
   * square of a rational. */
  public @Nullable Rational sqrt() {
    return root(2);
  }

  /** Returns the exact {@code k}th root of this value, or null if there is
   * none. Negative values have an odd root only. */
  public @Nullable Rational root(int k) {
    if (signum() < 0) {
      if (k % 2 == 0) {
        return null;
      }
      final Rational r = negate().root(k);
      return r == null ? null : r.negate();
    }
    final BigInteger n = Integers.exactRoot(numerator, k);
    final BigInteger d = Integers.exactRoot(denominator, k);
    return n == null || d == null ? null : of(n, d);
  }

  /** Returns the integer value.
   *
   * @throws ArithmeticException if this value is not an integer */
  public BigInteger bigIntegerValueExact() {
    if (!isInteger()) {
      throw new ArithmeticException("not an integer: " + this);
    }
    return numerator;
  }

  /** Returns the greatest common divisor of two rationals: the rational
   * {@code g} such that both values are integer multiples of {@code g}. The
   * result is non-negative. */
  public static Rational gcd(Rational a, Rational b) {
    if (a.isZero()) {
      return b.abs();
    }
    if (b.isZero()) {
      return a.abs();
    }
    final BigInteger n = a.numerator.gcd(b.numerator);
    final BigInteger d = Integers.lcm(a.denominator, b.denominator);
    return of(n, d);
  }

  public static Rational min(Rational a, Rational b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}

// End Rational.java
