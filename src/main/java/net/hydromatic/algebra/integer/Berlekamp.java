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
import java.util.List;

/**
 * Berlekamp's algorithm: factors a square-free polynomial over GF(p).
 *
 * <p>The fixed points of the Frobenius map {@code g -> g^p} on
 * {@code GF(p)[x] / f} form a subspace whose dimension is the number of
 * irreducible factors of {@code f}. Each basis vector {@code v} other than
 * the constant splits {@code f} via {@code gcd(f, v - s)} for some
 * {@code s} in GF(p).
 */
public class Berlekamp {
  private Berlekamp() {}

  /**
   * Returns the monic irreducible factors of a square-free polynomial of
   * positive degree. The product of the factors is {@code f.monic()}.
   */
  public static List<GfPolynomial> factor(GfPolynomial f) {
    checkArgument(f.degree() >= 1, "constant %s", f);
    checkArgument(f.isSquareFree(), "not square-free: %s", f);
    final GfPolynomial monic = f.monic();
    final List<long[]> basis = fixedSpace(monic);
    final List<GfPolynomial> factors = new ArrayList<>();
    factors.add(monic);
    final long p = f.p;
    for (int k = 1; k < basis.size() && factors.size() < basis.size(); k++) {
      final GfPolynomial v = GfPolynomial.of(p, basis.get(k));
      for (int i = 0; i < factors.size()
          && factors.size() < basis.size(); i++) {
        final GfPolynomial u = factors.get(i);
        if (u.degree() <= 1) {
          continue;
        }
        for (long s = 0; s < p; s++) {
          final GfPolynomial g =
              GfPolynomial.gcd(v.subtract(GfPolynomial.constant(p, s)), u);
          if (g.degree() >= 1 && g.degree() < u.degree()) {
            factors.set(i, g);
            factors.add(u.divRem(g)[0].monic());
            // re-examine the shrunken factor at position i
            --i;
            break;
          }
        }
      }
    }
    return factors;
  }

  /** Returns the number of irreducible factors of a monic square-free
   * polynomial. */
  public static int factorCount(GfPolynomial f) {
    return fixedSpace(f.monic()).size();
  }

  /**
   * Returns a basis of the space of polynomials {@code v} of degree less than
   * {@code n} such that {@code v^p = v mod f}. The first vector is the
   * constant 1.
   */
  static List<long[]> fixedSpace(GfPolynomial f) {
    final int n = f.degree();
    final long p = f.p;
    // q[i] = x^(i p) mod f, as a row of the Berlekamp matrix
    final long[][] q = new long[n][n];
    final GfPolynomial xp =
        GfPolynomial.x(p).powMod(BigInteger.valueOf(p), f);
    GfPolynomial row = GfPolynomial.constant(p, 1);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        q[i][j] = row.coefficient(j);
      }
      row = row.multiply(xp).mod(f);
    }
    // Solve v (Q - I) = 0, that is, (Q - I)^T v = 0.
    final long[][] a = new long[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        a[j][i] = Math.floorMod(q[i][j] - (i == j ? 1 : 0), p);
      }
    }
    return nullSpace(a, p);
  }

  /** Returns a basis of the null space of a square matrix over GF(p), by
   * reduction to row echelon form. */
  static List<long[]> nullSpace(long[][] a, long p) {
    final int n = a.length;
    final int[] pivotColumn = new int[n];
    final boolean[] isPivot = new boolean[n];
    int rank = 0;
    for (int col = 0; col < n && rank < n; col++) {
      int pivot = -1;
      for (int r = rank; r < n; r++) {
        if (a[r][col] != 0) {
          pivot = r;
          break;
        }
      }
      if (pivot < 0) {
        continue;
      }
      final long[] tmp = a[rank];
      a[rank] = a[pivot];
      a[pivot] = tmp;
      final long inv = BigInteger.valueOf(a[rank][col])
          .modInverse(BigInteger.valueOf(p)).longValueExact();
      for (int j = 0; j < n; j++) {
        a[rank][j] = a[rank][j] * inv % p;
      }
      for (int r = 0; r < n; r++) {
        if (r != rank && a[r][col] != 0) {
          final long factor = a[r][col];
          for (int j = 0; j < n; j++) {
            a[r][j] = Math.floorMod(a[r][j] - factor * a[rank][j], p);
          }
        }
      }
      pivotColumn[rank] = col;
      isPivot[col] = true;
      ++rank;
    }
    final List<long[]> basis = new ArrayList<>();
    for (int free = 0; free < n; free++) {
      if (isPivot[free]) {
        continue;
      }
      final long[] v = new long[n];
      v[free] = 1;
      for (int r = 0; r < rank; r++) {
        v[pivotColumn[r]] = Math.floorMod(-a[r][free], p);
      }
      basis.add(v);
    }
    return basis;
  }
}

// End Berlekamp.java
