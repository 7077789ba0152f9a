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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.math.BigIntegerMath;
import com.google.common.math.LongMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Exact integer arithmetic that {@link BigInteger} does not provide. */
public class Integers {
  private Integers() {}

  /** Returns the floor of the {@code k}th root of a non-negative integer. */
  public static BigInteger floorRoot(BigInteger n, int k) {
    checkArgument(n.signum() >= 0, "negative radicand %s", n);
    checkArgument(k >= 1, "bad root %s", k);
    if (k == 1 || n.signum() == 0 || n.equals(BigInteger.ONE)) {
      return n;
    }
    if (k == 2) {
      return BigIntegerMath.sqrt(n, RoundingMode.FLOOR);
    }
    // Binary search between 2^(b/k) and 2^(b/k + 1)
    final int bits = n.bitLength();
    BigInteger lo = BigInteger.ONE.shiftLeft((bits - 1) / k);
    BigInteger hi = BigInteger.ONE.shiftLeft((bits - 1) / k + 1);
    while (lo.compareTo(hi) < 0) {
      final BigInteger mid = lo.add(hi).add(BigInteger.ONE).shiftRight(1);
      if (mid.pow(k).compareTo(n) <= 0) {
        lo = mid;
      } else {
        hi = mid.subtract(BigInteger.ONE);
      }
    }
    return lo;
  }

  /** Returns the exact {@code k}th root of a non-negative integer, or null if
   * it is not a perfect power. */
  public static @Nullable BigInteger exactRoot(BigInteger n, int k) {
    if (n.signum() < 0) {
      return null;
    }
    final BigInteger r = floorRoot(n, k);
    return r.pow(k).equals(n) ? r : null;
  }

  /** Returns whether a non-negative integer is a perfect square. */
  public static boolean isSquare(BigInteger n) {
    return exactRoot(n, 2) != null;
  }

  public static BigInteger lcm(BigInteger a, BigInteger b) {
    if (a.signum() == 0 || b.signum() == 0) {
      return BigInteger.ZERO;
    }
    return a.divide(a.gcd(b)).multiply(b).abs();
  }

  /**
   * Returns the positive divisors of {@code n} in ascending order, or null if
   * {@code |n|} exceeds {@code limit}.
   *
   * <p>Divisors are found by trial division, so the limit keeps the work
   * proportional to its square root.
   */
  public static @Nullable List<BigInteger> divisors(BigInteger n, long limit) {
    final BigInteger abs = n.abs();
    if (abs.signum() == 0 || abs.compareTo(BigInteger.valueOf(limit)) > 0) {
      return null;
    }
    final long v = abs.longValueExact();
    final List<Long> small = new ArrayList<>();
    final List<Long> large = new ArrayList<>();
    for (long i = 1; i * i <= v; i++) {
      if (v % i == 0) {
        small.add(i);
        if (i != v / i) {
          large.add(0, v / i);
        }
      }
    }
    final ImmutableList.Builder<BigInteger> b = ImmutableList.builder();
    small.forEach(i -> b.add(BigInteger.valueOf(i)));
    large.forEach(i -> b.add(BigInteger.valueOf(i)));
    return b.build();
  }

  /** Returns whether {@code n} is prime. */
  public static boolean isPrime(long n) {
    return n >= 2 && LongMath.isPrime(n);
  }

  /** Returns the smallest prime greater than {@code n}. */
  public static long nextPrime(long n) {
    long p = Math.max(n + 1, 2);
    while (!isPrime(p)) {
      ++p;
    }
    return p;
  }

  /**
   * Splits a positive integer {@code n} into {@code [s, f]} such that
   * {@code n = s^2 * f}, removing square factors of primes up to
   * {@code limit}.
   */
  public static BigInteger[] extractSquare(BigInteger n, long limit) {
    checkArgument(n.signum() > 0, "non-positive %s", n);
    BigInteger s = BigInteger.ONE;
    BigInteger f = n;
    for (long p = 2; p <= limit; p = nextPrime(p)) {
      final BigInteger pp = BigInteger.valueOf(p * p);
      if (pp.compareTo(f) > 0) {
        break;
      }
      while (f.mod(pp).signum() == 0) {
        f = f.divide(pp);
        s = s.multiply(BigInteger.valueOf(p));
      }
    }
    final BigInteger r = exactRoot(f, 2);
    if (r != null) {
      return new BigInteger[] {s.multiply(r), BigInteger.ONE};
    }
    return new BigInteger[] {s, f};
  }

  /** Returns the positive divisors of a small positive integer, ascending. */
  public static List<Integer> divisors(int n) {
    checkArgument(n > 0);
    final List<Integer> list = new ArrayList<>();
    for (int i = 1; i <= n; i++) {
      if (n % i == 0) {
        list.add(i);
      }
    }
    return list;
  }
}

// End Integers.java
