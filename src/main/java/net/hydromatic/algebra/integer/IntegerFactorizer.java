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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Integers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors polynomials over the integers.
 *
 * <p>The algorithm removes the content, splits the polynomial into
 * square-free parts (Yun), and factors each part as follows. Several primes
 * are tried, and the one giving the fewest factors over GF(p) (Berlekamp)
 * wins. The true factors are then reconstructed from the modular factors,
 * lifted (Hensel) to some {@code p^e}, in one of two ways. If there are few
 * modular factors, products of subsets of the lifted factors are tried
 * (Zassenhaus); {@code p^e} must exceed twice the leading coefficient times
 * a bound on the coefficients of any factor. If there are many, each factor
 * is found as a short vector (LLL) in the lattice of polynomials that a
 * lifted factor divides modulo {@code p^e}, lifting only as far as that
 * lattice needs. Every candidate is checked by exact division.
 */
public class IntegerFactorizer {
  /** Primes considered when choosing a modulus. */
  private static final int MAX_PRIME_CANDIDATES = 200;

  private static final Comparator<BigPolynomial> ORDERING =
      Comparator.comparingInt(BigPolynomial::degree)
          .thenComparing(IntegerFactorizer::compareCoefficients);

  private final int primeTrials;
  private final boolean useLattice;
  private final int latticeThreshold;

  /**
   * Creates a factorizer.
   *
   * @param primeTrials Number of suitable primes to compare
   * @param useLattice Whether to use lattice reduction when there are many
   *     modular factors
   * @param latticeThreshold Largest number of modular factors for which
   *     subsets are enumerated
   */
  public IntegerFactorizer(int primeTrials, boolean useLattice,
      int latticeThreshold) {
    checkArgument(primeTrials >= 1, "bad primeTrials %s", primeTrials);
    checkArgument(latticeThreshold >= 0, "bad latticeThreshold %s",
        latticeThreshold);
    this.primeTrials = primeTrials;
    this.useLattice = useLattice;
    this.latticeThreshold = latticeThreshold;
  }

  /** Factors a non-zero polynomial. */
  public IntegerFactorization factor(BigPolynomial f) {
    checkArgument(!f.isZero(), "zero polynomial");
    final List<String> steps = new ArrayList<>();
    final BigInteger content = f.content();
    final BigPolynomial g = f.primitivePart();
    final List<IntegerFactorization.Factor> factors = new ArrayList<>();
    if (g.degree() == 0) {
      return new IntegerFactorization(content, factors, steps);
    }
    final List<BigPolynomial> parts = squareFree(g);
    for (int i = 0; i < parts.size(); i++) {
      final BigPolynomial part = parts.get(i);
      if (part.degree() < 1) {
        continue;
      }
      if (parts.size() > 1) {
        steps.add("square-free part of multiplicity " + (i + 1) + ": "
            + part);
      }
      final List<BigPolynomial> irreducibles =
          part.degree() == 1 ? ImmutableList.of(part)
              : factorSquareFree(part, steps);
      for (BigPolynomial irreducible : irreducibles) {
        factors.add(new IntegerFactorization.Factor(irreducible, i + 1));
      }
    }
    factors.sort(Comparator.comparing(factor -> factor.polynomial, ORDERING));
    return new IntegerFactorization(content, factors, steps);
  }

  /**
   * Yun's square-free decomposition of a primitive polynomial with positive
   * leading coefficient. Element {@code i} of the result is the product of
   * the irreducible factors of multiplicity {@code i + 1}, so that
   * {@code f} is the product of {@code a[i]^(i + 1)}. Each element is
   * primitive with positive leading coefficient; some may be 1.
   */
  public static List<BigPolynomial> squareFree(BigPolynomial f) {
    final List<BigPolynomial> parts = new ArrayList<>();
    if (f.degree() < 1) {
      parts.add(f);
      return parts;
    }
    final Polynomial p = f.toPolynomial();
    final Polynomial dp = p.derivative();
    final Polynomial a0 = Polynomial.gcd(p, dp);
    Polynomial b = p.divideExact(a0);
    Polynomial c = dp.divideExact(a0);
    Polynomial d = c.subtract(b.derivative());
    while (b.degree() > 0) {
      final Polynomial a = Polynomial.gcd(b, d);
      parts.add(BigPolynomial.of(a.primitivePart()));
      b = b.divideExact(a);
      c = d.divideExact(a);
      d = c.subtract(b.derivative());
    }
    return parts;
  }

  /** Factors a square-free primitive polynomial of degree at least 2. */
  List<BigPolynomial> factorSquareFree(BigPolynomial f, List<String> steps) {
    final @Nullable GfPolynomial modular = choosePrime(f);
    if (modular == null) {
      steps.add("no suitable prime for " + f);
      return ImmutableList.of(f);
    }
    final long p = modular.p;
    final List<GfPolynomial> factors = Berlekamp.factor(modular);
    steps.add(f + " has " + factors.size() + " factor(s) modulo " + p);
    if (factors.size() == 1) {
      return ImmutableList.of(f);
    }
    final List<BigPolynomial> result;
    if (useLattice && factors.size() > latticeThreshold) {
      result = latticeReconstruct(f, factors, steps);
    } else {
      result = subsetReconstruct(f, factors, steps);
    }
    result.sort(ORDERING);
    return result;
  }

  /**
   * Returns {@code f} modulo the prime that gives the fewest modular factors
   * among the first {@link #primeTrials} primes that do not divide the
   * leading coefficient and keep {@code f} square-free. Returns null if there
   * is no such prime among the first few hundred.
   */
  private @Nullable GfPolynomial choosePrime(BigPolynomial f) {
    final BigInteger lc = f.leadingCoefficient();
    GfPolynomial best = null;
    int bestCount = Integer.MAX_VALUE;
    int trials = 0;
    long p = 2;
    for (int i = 0; i < MAX_PRIME_CANDIDATES && trials < primeTrials;
        i++, p = Integers.nextPrime(p)) {
      if (lc.mod(BigInteger.valueOf(p)).signum() == 0) {
        continue;
      }
      final GfPolynomial fp = GfPolynomial.of(p, f);
      if (!fp.isSquareFree()) {
        continue;
      }
      ++trials;
      final int count = Berlekamp.factorCount(fp);
      if (count < bestCount) {
        best = fp;
        bestCount = count;
      }
      if (count == 1) {
        break;
      }
    }
    return best;
  }

  /** Returns the smallest {@code e} such that {@code p^e > bound}. */
  static int exponentAbove(long p, BigInteger bound) {
    return exponentAbove(BigInteger.valueOf(p), bound);
  }

  private static int exponentAbove(BigInteger base, BigInteger bound) {
    int e = 1;
    for (BigInteger pe = base; pe.compareTo(bound) <= 0;
        pe = pe.multiply(base)) {
      ++e;
    }
    return e;
  }

  /**
   * Reconstructs the factors of {@code f} from modular factors by trying
   * products of subsets, smallest subsets first.
   */
  List<BigPolynomial> subsetReconstruct(BigPolynomial f,
      List<GfPolynomial> modular, List<String> steps) {
    final long p = modular.get(0).p;
    final BigInteger bound = f.leadingCoefficient().abs()
        .multiply(f.factorCoefficientBound()).shiftLeft(1);
    final int e = exponentAbove(p, bound);
    final BigInteger modulus = BigInteger.valueOf(p).pow(e);
    final List<BigPolynomial> lifted =
        new ArrayList<>(Hensel.lift(f, modular, e));
    steps.add("lifted " + lifted.size() + " factors to modulus " + p + "^"
        + e + "; recombining subsets");

    final List<BigPolynomial> result = new ArrayList<>();
    BigPolynomial g = f;
    int s = 1;
    outer:
    while (2 * s <= lifted.size()) {
      for (int[] subset : combinations(lifted.size(), s)) {
        BigPolynomial h = BigPolynomial.of(
            ImmutableList.of(g.leadingCoefficient()));
        for (int i : subset) {
          h = h.multiply(lifted.get(i));
        }
        h = h.symmetricMod(modulus).primitivePart();
        final @Nullable BigPolynomial q = g.divideExact(h);
        if (q != null) {
          result.add(h);
          g = q;
          for (int k = subset.length - 1; k >= 0; k--) {
            lifted.remove(subset[k]);
          }
          continue outer;
        }
      }
      ++s;
    }
    if (g.degree() > 0) {
      result.add(g);
    }
    return result;
  }

  /**
   * Reconstructs the factors of {@code f} by lattice reduction.
   *
   * <p>For a lifted factor {@code u} of degree {@code l} and a degree
   * {@code m >= l}, the polynomials of degree at most {@code m} that
   * {@code u} divides modulo {@code p^e} form a lattice with basis
   * {@code p^e x^i} ({@code i < l}) and {@code u x^j} ({@code j <= m - l}).
   * If the irreducible factor {@code h} of {@code g} that {@code u} divides
   * has degree {@code m}, and {@code p^e} is large enough, the first vector
   * of the reduced basis is a multiple of {@code h}.
   *
   * <p>{@code u} is the remaining factor of largest degree, since the
   * precision needed falls as {@code l} grows. Only degrees that are the
   * degree of {@code u} plus the degrees of some other remaining factors are
   * tried, in ascending order, and the factors are lifted only as far as
   * each degree requires.
   */
  List<BigPolynomial> latticeReconstruct(BigPolynomial f,
      List<GfPolynomial> modular, List<String> steps) {
    final long p = modular.get(0).p;
    steps.add("reducing lattices for " + modular.size()
        + " factors modulo " + p);
    final Lifting lifting = new Lifting(f, modular);
    final List<Integer> remaining = new ArrayList<>();
    for (int i = 0; i < modular.size(); i++) {
      remaining.add(i);
    }
    final List<BigPolynomial> result = new ArrayList<>();
    BigPolynomial g = f;
    while (remaining.size() > 1) {
      final int index = Collections.max(remaining,
          Comparator.comparingInt((Integer i) -> modular.get(i).degree()));
      final int l = modular.get(index).degree();
      @Nullable BigPolynomial h = null;
      for (int m : candidateDegrees(modular, remaining, index, g.degree())) {
        final BigInteger boundSquared = latticeBound(g, m);
        final int e = exponentAbove(BigInteger.valueOf(p).pow(2 * l),
            boundSquared);
        if (lifting.liftTo(e)) {
          steps.add("lifted " + modular.size() + " factors to modulus " + p
              + "^" + e);
        }
        h = shortFactor(g, lifting.lifted.get(index), m, lifting.modulus);
        if (h != null) {
          break;
        }
      }
      if (h == null) {
        // The factor that u divides has the degree of g.
        h = g;
      }
      result.add(h);
      g = requireDivide(g, h);
      final GfPolynomial hp = GfPolynomial.of(p, h);
      remaining.removeIf(i -> hp.mod(modular.get(i)).isZero());
    }
    if (g.degree() > 0) {
      result.add(g);
    }
    return result;
  }

  /**
   * Returns the possible degrees, less than {@code n}, of a factor that
   * contains modular factor {@code index}: its degree plus the degree of
   * any subset of the other remaining factors. In ascending order.
   */
  static List<Integer> candidateDegrees(List<GfPolynomial> modular,
      List<Integer> remaining, int index, int n) {
    final boolean[] reachable = new boolean[n + 1];
    reachable[modular.get(index).degree()] = true;
    for (int i : remaining) {
      if (i == index) {
        continue;
      }
      final int degree = modular.get(i).degree();
      for (int s = n; s >= degree; s--) {
        if (reachable[s - degree]) {
          reachable[s] = true;
        }
      }
    }
    final List<Integer> degrees = new ArrayList<>();
    for (int s = 0; s < n; s++) {
      if (reachable[s]) {
        degrees.add(s);
      }
    }
    return degrees;
  }

  /** Returns a factor of {@code g} of degree at most {@code m} found among
   * the reduced basis vectors of the lattice for {@code u}, or null. */
  private static @Nullable BigPolynomial shortFactor(BigPolynomial g,
      BigPolynomial u, int m, BigInteger modulus) {
    final int l = u.degree();
    final BigInteger[][] basis = new BigInteger[m + 1][m + 1];
    for (BigInteger[] row : basis) {
      Arrays.fill(row, BigInteger.ZERO);
    }
    for (int i = 0; i < l; i++) {
      basis[i][i] = modulus;
    }
    for (int j = 0; j <= m - l; j++) {
      for (int i = 0; i <= l; i++) {
        basis[l + j][i + j] = u.coefficient(i);
      }
    }
    for (BigInteger[] v : Lll.reduce(basis)) {
      final BigPolynomial candidate =
          BigPolynomial.of(ImmutableList.copyOf(v));
      if (candidate.degree() < 1) {
        continue;
      }
      final BigPolynomial h = candidate.primitivePart();
      if (g.divideExact(h) != null) {
        return h;
      }
    }
    return null;
  }

  private static BigPolynomial requireDivide(BigPolynomial g,
      BigPolynomial h) {
    final @Nullable BigPolynomial q = g.divideExact(h);
    if (q == null) {
      throw new ArithmeticException(h + " does not divide " + g);
    }
    return q;
  }

  /**
   * Returns the square of the bound that {@code p^(e l)} must exceed for
   * the lattice of degree {@code m} to yield a factor of {@code g} of
   * degree {@code m}: {@code 2^(n m) C(2m, m)^n ||g||^(2(m + n))}, where
   * {@code n} is the degree of {@code g}.
   */
  static BigInteger latticeBound(BigPolynomial g, int m) {
    final int n = g.degree();
    return BigInteger.ONE.shiftLeft(n * m)
        .multiply(BigIntegerMath.binomial(2 * m, m).pow(n))
        .multiply(g.normSquared().pow(m + n));
  }

  /** Factors lifted from modulo {@code p} to modulo {@code p^e}; lifted
   * again when more precision is needed. */
  private static class Lifting {
    final BigPolynomial f;
    final List<GfPolynomial> modular;
    int e;
    List<BigPolynomial> lifted = ImmutableList.of();
    BigInteger modulus = BigInteger.ONE;

    Lifting(BigPolynomial f, List<GfPolynomial> modular) {
      this.f = f;
      this.modular = modular;
    }

    /** Lifts to at least {@code p^e}; returns whether it lifted. */
    boolean liftTo(int e) {
      if (e <= this.e) {
        return false;
      }
      lifted = Hensel.lift(f, modular, e);
      modulus = BigInteger.valueOf(modular.get(0).p).pow(e);
      this.e = e;
      return true;
    }
  }

  /** Returns the {@code k}-element subsets of {@code {0, ..., n - 1}}, in
   * lexicographic order. */
  static List<int[]> combinations(int n, int k) {
    final List<int[]> list = new ArrayList<>();
    final int[] c = new int[k];
    for (int i = 0; i < k; i++) {
      c[i] = i;
    }
    if (k > n) {
      return list;
    }
    for (;;) {
      list.add(c.clone());
      int i = k - 1;
      while (i >= 0 && c[i] == n - k + i) {
        --i;
      }
      if (i < 0) {
        return list;
      }
      ++c[i];
      for (int j = i + 1; j < k; j++) {
        c[j] = c[j - 1] + 1;
      }
    }
  }

  /** Compares polynomials of equal degree by their coefficients, highest
   * degree first, smaller magnitude first and negative before positive. */
  private static int compareCoefficients(BigPolynomial a, BigPolynomial b) {
    for (int i = a.degree(); i >= 0; i--) {
      final BigInteger x = a.coefficient(i);
      final BigInteger y = b.coefficient(i);
      int c = x.abs().compareTo(y.abs());
      if (c == 0) {
        c = Integer.compare(x.signum(), y.signum());
      }
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }
}

// End IntegerFactorizer.java
