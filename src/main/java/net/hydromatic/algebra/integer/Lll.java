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

/**
 * Lenstra-Lenstra-Lovász lattice basis reduction, in integer arithmetic.
 *
 * <p>This is the integral variant (Cohen, Algorithm 2.6.7). Instead of the
 * rational Gram-Schmidt coefficients {@code mu[i][j]} and squared lengths
 * {@code B[i]}, it keeps the Gram determinants {@code d[i]} and the integers
 * {@code lambda[i][j] = d[j] mu[i][j]}; every division is exact, and a swap
 * updates only the rows it affects.
 *
 * <p>The basis must be linearly independent. The reduced basis satisfies the
 * size condition and the Lovász condition with {@code delta = 3/4}; its first
 * vector is at most {@code 2^((n-1)/2)} times as long as the shortest
 * non-zero vector of the lattice.
 */
public class Lll {
  private static final BigInteger THREE = BigInteger.valueOf(3);

  // Vectors, d and lambda are indexed from 1; d[0] = 1.
  private final BigInteger[][] b;
  private final int n;
  private final BigInteger[][] lambda;
  private final BigInteger[] d;

  private Lll(BigInteger[][] basis) {
    this.n = basis.length;
    this.b = new BigInteger[n + 1][];
    for (int i = 0; i < n; i++) {
      this.b[i + 1] = basis[i].clone();
    }
    this.lambda = new BigInteger[n + 1][n + 1];
    this.d = new BigInteger[n + 1];
  }

  /** Returns a reduced basis of the lattice spanned by the rows of
   * {@code basis}. The argument is not modified. */
  public static BigInteger[][] reduce(BigInteger[][] basis) {
    checkArgument(basis.length > 0, "empty basis");
    final Lll lll = new Lll(basis);
    lll.run();
    final BigInteger[][] reduced = new BigInteger[lll.n][];
    System.arraycopy(lll.b, 1, reduced, 0, lll.n);
    return reduced;
  }

  private void run() {
    d[0] = BigInteger.ONE;
    d[1] = dot(b[1], b[1]);
    checkArgument(d[1].signum() != 0, "basis is not independent");
    int k = 2;
    int kmax = 1;
    while (k <= n) {
      if (k > kmax) {
        kmax = k;
        gramSchmidt(k);
      }
      for (;;) {
        reduce(k, k - 1);
        // d[k] d[k-2] < 3/4 d[k-1]^2 - lambda[k][k-1]^2
        final BigInteger l = lambda[k][k - 1];
        final BigInteger lhs = d[k].multiply(d[k - 2]).shiftLeft(2);
        final BigInteger rhs = THREE.multiply(d[k - 1].pow(2))
            .subtract(l.multiply(l).shiftLeft(2));
        if (lhs.compareTo(rhs) >= 0) {
          break;
        }
        swap(k, kmax);
        k = Math.max(2, k - 1);
      }
      for (int l = k - 2; l >= 1; l--) {
        reduce(k, l);
      }
      ++k;
    }
  }

  /** Computes row {@code k} of lambda, and {@code d[k]}. */
  private void gramSchmidt(int k) {
    for (int j = 1; j <= k; j++) {
      BigInteger u = dot(b[k], b[j]);
      for (int i = 1; i < j; i++) {
        u = d[i].multiply(u)
            .subtract(lambda[k][i].multiply(lambda[j][i]))
            .divide(d[i - 1]);
      }
      if (j < k) {
        lambda[k][j] = u;
      } else {
        checkArgument(u.signum() != 0, "basis is not independent");
        d[k] = u;
      }
    }
  }

  /** Subtracts the nearest multiple of {@code b[l]} from {@code b[k]}. */
  private void reduce(int k, int l) {
    if (lambda[k][l].abs().shiftLeft(1).compareTo(d[l]) <= 0) {
      return;
    }
    final BigInteger q = round(lambda[k][l], d[l]);
    for (int i = 0; i < b[k].length; i++) {
      b[k][i] = b[k][i].subtract(q.multiply(b[l][i]));
    }
    lambda[k][l] = lambda[k][l].subtract(q.multiply(d[l]));
    for (int i = 1; i < l; i++) {
      lambda[k][i] = lambda[k][i].subtract(q.multiply(lambda[l][i]));
    }
  }

  /** Exchanges {@code b[k]} and {@code b[k-1]}. */
  private void swap(int k, int kmax) {
    final BigInteger[] tmp = b[k];
    b[k] = b[k - 1];
    b[k - 1] = tmp;
    for (int j = 1; j <= k - 2; j++) {
      final BigInteger t = lambda[k][j];
      lambda[k][j] = lambda[k - 1][j];
      lambda[k - 1][j] = t;
    }
    final BigInteger l = lambda[k][k - 1];
    final BigInteger bb =
        d[k - 2].multiply(d[k]).add(l.multiply(l)).divide(d[k - 1]);
    for (int i = k + 1; i <= kmax; i++) {
      final BigInteger t = lambda[i][k];
      lambda[i][k] = d[k].multiply(lambda[i][k - 1])
          .subtract(l.multiply(t))
          .divide(d[k - 1]);
      lambda[i][k - 1] = bb.multiply(t)
          .add(l.multiply(lambda[i][k]))
          .divide(d[k]);
    }
    d[k - 1] = bb;
  }

  private static BigInteger dot(BigInteger[] u, BigInteger[] v) {
    BigInteger s = BigInteger.ZERO;
    for (int i = 0; i < u.length; i++) {
      if (u[i].signum() != 0 && v[i].signum() != 0) {
        s = s.add(u[i].multiply(v[i]));
      }
    }
    return s;
  }

  /** Rounds {@code a / b} to the nearest integer, halves upwards;
   * {@code b} must be positive. */
  static BigInteger round(BigInteger a, BigInteger b) {
    // floor((2a + b) / 2b)
    final BigInteger twoB = b.shiftLeft(1);
    final BigInteger[] qr = a.shiftLeft(1).add(b).divideAndRemainder(twoB);
    return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
  }
}

// End Lll.java
