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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.algebra.util.Integers;

/**
 * Polynomial over the finite field GF(p), for a prime {@code p} less than
 * 2<sup>31</sup>.
 *
 * <p>Immutable. Coefficients are in {@code [0, p)}, lowest degree first,
 * with no trailing zeros.
 */
public final class GfPolynomial {
  public final long p;
  private final long[] coefficients;

  private GfPolynomial(long p, long[] coefficients) {
    this.p = p;
    this.coefficients = coefficients;
  }

  /** Creates a polynomial, reducing coefficients modulo {@code p}. */
  public static GfPolynomial of(long p, long... coefficients) {
    checkArgument(Integers.isPrime(p) && p < (1L << 31), "bad prime %s", p);
    final long[] c = new long[coefficients.length];
    for (int i = 0; i < c.length; i++) {
      c[i] = Math.floorMod(coefficients[i], p);
    }
    return new GfPolynomial(p, trim(c));
  }

  /** Reduces an integer polynomial modulo {@code p}. */
  public static GfPolynomial of(long p, BigPolynomial f) {
    final BigInteger bp = BigInteger.valueOf(p);
    final long[] c = new long[f.degree() + 1];
    for (int i = 0; i < c.length; i++) {
      c[i] = f.coefficient(i).mod(bp).longValueExact();
    }
    return of(p, c);
  }

  public static GfPolynomial constant(long p, long c) {
    return of(p, c);
  }

  /** Returns the polynomial {@code x}. */
  public static GfPolynomial x(long p) {
    return of(p, 0, 1);
  }

  private static long[] trim(long[] c) {
    int n = c.length;
    while (n > 0 && c[n - 1] == 0) {
      --n;
    }
    return n == c.length ? c : Arrays.copyOf(c, n);
  }

  private GfPolynomial make(long[] c) {
    return new GfPolynomial(p, trim(c));
  }

  @Override
  public int hashCode() {
    return Long.hashCode(p) * 31 + Arrays.hashCode(coefficients);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GfPolynomial
            && p == ((GfPolynomial) o).p
            && Arrays.equals(coefficients, ((GfPolynomial) o).coefficients);
  }

  @Override
  public String toString() {
    return toBigPolynomial() + " (mod " + p + ")";
  }

  public int degree() {
    return coefficients.length - 1;
  }

  public boolean isZero() {
    return coefficients.length == 0;
  }

  public boolean isOne() {
    return coefficients.length == 1 && coefficients[0] == 1;
  }

  public long coefficient(int i) {
    return i < coefficients.length ? coefficients[i] : 0;
  }

  public long leadingCoefficient() {
    return isZero() ? 0 : coefficients[degree()];
  }

  /** Converts to an integer polynomial with coefficients in {@code [0, p)}. */
  public BigPolynomial toBigPolynomial() {
    final List<BigInteger> list = new ArrayList<>();
    for (long c : coefficients) {
      list.add(BigInteger.valueOf(c));
    }
    return BigPolynomial.of(list);
  }

  public GfPolynomial add(GfPolynomial o) {
    final long[] c = new long[Math.max(coefficients.length,
        o.coefficients.length)];
    for (int i = 0; i < c.length; i++) {
      c[i] = (coefficient(i) + o.coefficient(i)) % p;
    }
    return make(c);
  }

  public GfPolynomial negate() {
    final long[] c = new long[coefficients.length];
    for (int i = 0; i < c.length; i++) {
      c[i] = (p - coefficients[i]) % p;
    }
    return make(c);
  }

  public GfPolynomial subtract(GfPolynomial o) {
    return add(o.negate());
  }

  public GfPolynomial multiply(long k) {
    final long m = Math.floorMod(k, p);
    final long[] c = new long[coefficients.length];
    for (int i = 0; i < c.length; i++) {
      c[i] = coefficients[i] * m % p;
    }
    return make(c);
  }

  public GfPolynomial multiply(GfPolynomial o) {
    if (isZero() || o.isZero()) {
      return make(new long[0]);
    }
    final long[] c = new long[degree() + o.degree() + 1];
    for (int i = 0; i < coefficients.length; i++) {
      if (coefficients[i] == 0) {
        continue;
      }
      for (int j = 0; j < o.coefficients.length; j++) {
        c[i + j] = (c[i + j] + coefficients[i] * o.coefficients[j]) % p;
      }
    }
    return make(c);
  }

  /** Returns the multiplicative inverse of a non-zero element. */
  public long inverse(long a) {
    final long m = Math.floorMod(a, p);
    checkArgument(m != 0, "zero has no inverse");
    return BigInteger.valueOf(m).modInverse(BigInteger.valueOf(p))
        .longValueExact();
  }

  /** Returns {@code [quotient, remainder]}. */
  public GfPolynomial[] divRem(GfPolynomial divisor) {
    checkArgument(!divisor.isZero(), "division by zero polynomial");
    if (degree() < divisor.degree()) {
      return new GfPolynomial[] {make(new long[0]), this};
    }
    final long inv = inverse(divisor.leadingCoefficient());
    final long[] r = coefficients.clone();
    final long[] q = new long[degree() - divisor.degree() + 1];
    for (int k = q.length - 1; k >= 0; k--) {
      final long t = r[k + divisor.degree()] * inv % p;
      q[k] = t;
      if (t == 0) {
        continue;
      }
      for (int j = 0; j <= divisor.degree(); j++) {
        r[j + k] = Math.floorMod(r[j + k] - t * divisor.coefficients[j], p);
      }
    }
    return new GfPolynomial[] {
        make(q), make(Arrays.copyOf(r, divisor.degree()))};
  }

  public GfPolynomial mod(GfPolynomial divisor) {
    return divRem(divisor)[1];
  }

  public GfPolynomial monic() {
    return isZero() ? this : multiply(inverse(leadingCoefficient()));
  }

  public GfPolynomial derivative() {
    if (coefficients.length <= 1) {
      return make(new long[0]);
    }
    final long[] c = new long[coefficients.length - 1];
    for (int i = 1; i < coefficients.length; i++) {
      c[i - 1] = coefficients[i] * (i % p) % p;
    }
    return make(c);
  }

  /** Returns the monic greatest common divisor. */
  public static GfPolynomial gcd(GfPolynomial a, GfPolynomial b) {
    GfPolynomial x = a;
    GfPolynomial y = b;
    while (!y.isZero()) {
      final GfPolynomial r = x.mod(y);
      x = y;
      y = r;
    }
    return x.monic();
  }

  /**
   * Extended Euclidean algorithm. Returns {@code [g, s, t]} with
   * {@code s * a + t * b = g}, and {@code g} the monic GCD.
   */
  public static GfPolynomial[] extendedGcd(GfPolynomial a, GfPolynomial b) {
    final GfPolynomial zero = a.make(new long[0]);
    final GfPolynomial one = constant(a.p, 1);
    GfPolynomial r0 = a;
    GfPolynomial r1 = b;
    GfPolynomial s0 = one;
    GfPolynomial s1 = zero;
    GfPolynomial t0 = zero;
    GfPolynomial t1 = one;
    while (!r1.isZero()) {
      final GfPolynomial[] qr = r0.divRem(r1);
      r0 = r1;
      r1 = qr[1];
      GfPolynomial s = s0.subtract(qr[0].multiply(s1));
      s0 = s1;
      s1 = s;
      GfPolynomial t = t0.subtract(qr[0].multiply(t1));
      t0 = t1;
      t1 = t;
    }
    if (r0.isZero()) {
      return new GfPolynomial[] {r0, s0, t0};
    }
    final long inv = a.inverse(r0.leadingCoefficient());
    return new GfPolynomial[] {
        r0.multiply(inv), s0.multiply(inv), t0.multiply(inv)};
  }

  /** Returns {@code this^e mod modulus}, by repeated squaring. */
  public GfPolynomial powMod(BigInteger e, GfPolynomial modulus) {
    GfPolynomial result = constant(p, 1).mod(modulus);
    GfPolynomial base = mod(modulus);
    for (int i = e.bitLength() - 1; i >= 0; i--) {
      result = result.multiply(result).mod(modulus);
      if (e.testBit(i)) {
        result = result.multiply(base).mod(modulus);
      }
    }
    return result;
  }

  /** Whether this polynomial has no repeated factor. */
  public boolean isSquareFree() {
    return degree() < 1 || gcd(this, derivative()).degree() == 0;
  }
}

// End GfPolynomial.java
