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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Hensel lifting: turns a factorization modulo {@code p} into one modulo
 * {@code p^e}.
 *
 * <p>Several factors are lifted through a binary tree: the list is split in
 * halves, the product of each half is lifted as a pair, and each half is
 * lifted recursively against its lifted product. Pairs are lifted linearly,
 * one power of {@code p} at a time.
 */
public class Hensel {
  private Hensel() {}

  /**
   * Lifts a factorization.
   *
   * @param f Polynomial; its leading coefficient must not be divisible by
   *     {@code p}, and it must be square-free modulo {@code p}
   * @param factors Monic factors modulo {@code p} whose product is
   *     {@code f / lc(f)} modulo {@code p}
   * @param e Target exponent
   * @return Monic polynomials with coefficients in {@code [0, p^e)}, each
   *     congruent to the corresponding factor modulo {@code p}, whose product
   *     is {@code f / lc(f)} modulo {@code p^e}
   */
  public static List<BigPolynomial> lift(BigPolynomial f,
      List<GfPolynomial> factors, int e) {
    checkArgument(!factors.isEmpty(), "no factors");
    checkArgument(e >= 1, "bad exponent %s", e);
    final long p = factors.get(0).p;
    final BigInteger bp = BigInteger.valueOf(p);
    final BigInteger modulus = bp.pow(e);
    final BigInteger lc = f.leadingCoefficient();
    checkArgument(lc.mod(bp).signum() != 0, "p divides leading coefficient");
    final BigPolynomial monic =
        f.multiply(lc.modInverse(modulus)).mod(modulus);
    final List<BigPolynomial> lifted = new ArrayList<>();
    liftTree(monic, factors, bp, e, lifted);
    return ImmutableList.copyOf(lifted);
  }

  private static void liftTree(BigPolynomial target,
      List<GfPolynomial> factors, BigInteger p, int e,
      List<BigPolynomial> lifted) {
    if (factors.size() == 1) {
      lifted.add(target);
      return;
    }
    final int mid = factors.size() / 2;
    final List<GfPolynomial> left = factors.subList(0, mid);
    final List<GfPolynomial> right = factors.subList(mid, factors.size());
    final BigPolynomial[] pair =
        liftPair(target, product(left), product(right), p, e);
    liftTree(pair[0], left, p, e, lifted);
    liftTree(pair[1], right, p, e, lifted);
  }

  private static GfPolynomial product(List<GfPolynomial> factors) {
    GfPolynomial g = GfPolynomial.constant(factors.get(0).p, 1);
    for (GfPolynomial factor : factors) {
      g = g.multiply(factor);
    }
    return g;
  }

  /**
   * Lifts {@code f = a * b (mod p)} to {@code f = A * B (mod p^e)}, where
   * {@code f} is monic modulo {@code p^e} and {@code a} and {@code b} are
   * monic and coprime modulo {@code p}.
   *
   * <p>At step {@code k}, the error {@code (f - A B) / p^k} is split as
   * {@code sigma A + tau B} modulo {@code p} using the Bezout coefficients of
   * {@code a} and {@code b}, and {@code p^k tau}, {@code p^k sigma} are
   * added to {@code A} and {@code B}.
   */
  static BigPolynomial[] liftPair(BigPolynomial f, GfPolynomial a,
      GfPolynomial b, BigInteger p, int e) {
    final long lp = a.p;
    final GfPolynomial[] gst = GfPolynomial.extendedGcd(a, b);
    checkArgument(gst[0].isOne(), "factors not coprime: %s, %s", a, b);
    final GfPolynomial s = gst[1];
    final GfPolynomial t = gst[2];
    BigPolynomial bigA = a.toBigPolynomial();
    BigPolynomial bigB = b.toBigPolynomial();
    BigInteger pk = p;
    for (int k = 1; k < e; k++) {
      final BigInteger pk1 = pk.multiply(p);
      final BigPolynomial error =
          f.subtract(bigA.multiply(bigB)).mod(pk1);
      if (!error.isZero()) {
        final GfPolynomial c = GfPolynomial.of(lp, divide(error, pk));
        final GfPolynomial[] qr = s.multiply(c).divRem(b);
        final GfPolynomial sigma = qr[1];
        final GfPolynomial tau = t.multiply(c).add(qr[0].multiply(a));
        bigA = bigA.add(tau.toBigPolynomial().multiply(pk)).mod(pk1);
        bigB = bigB.add(sigma.toBigPolynomial().multiply(pk)).mod(pk1);
      }
      pk = pk1;
    }
    return new BigPolynomial[] {bigA, bigB};
  }

  /** Divides every coefficient by {@code d}, which must divide them all. */
  private static BigPolynomial divide(BigPolynomial f, BigInteger d) {
    final List<BigInteger> list = new ArrayList<>();
    for (BigInteger c : f.coefficients()) {
      final BigInteger[] qr = c.divideAndRemainder(d);
      if (qr[1].signum() != 0) {
        throw new ArithmeticException("not divisible by " + d + ": " + f);
      }
      list.add(qr[0]);
    }
    return BigPolynomial.of(list);
  }
}

// End Hensel.java
