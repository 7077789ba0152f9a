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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.math.IntMath;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.util.Rational;

/**
 * Univariate polynomial with rational coefficients.
 *
 * <p>Coefficients are held densely, lowest degree first, with no trailing
 * zeros; the zero polynomial has no coefficients and degree -1. Instances are
 * immutable.
 */
public final class Polynomial {
  public static final Polynomial ZERO = new Polynomial(ImmutableList.of());
  public static final Polynomial ONE =
      new Polynomial(ImmutableList.of(Rational.ONE));

  /** Coefficients, lowest degree first. */
  private final ImmutableList<Rational> coefficients;

  private Polynomial(ImmutableList<Rational> coefficients) {
    this.coefficients = requireNonNull(coefficients);
  }

  /** Creates a polynomial from coefficients, lowest degree first. */
  public static Polynomial of(List<Rational> coefficients) {
    int n = coefficients.size();
    while (n > 0 && coefficients.get(n - 1).isZero()) {
      --n;
    }
    return new Polynomial(ImmutableList.copyOf(coefficients.subList(0, n)));
  }

  /** Creates a polynomial from integer coefficients, lowest degree first. */
  public static Polynomial of(long... coefficients) {
    final List<Rational> list = new ArrayList<>();
    for (long c : coefficients) {
      list.add(Rational.of(c));
    }
    return of(list);
  }

  /** Creates a polynomial from a map from exponent to coefficient. */
  public static Polynomial of(Map<Integer, Rational> map) {
    if (map.isEmpty()) {
      return ZERO;
    }
    final int degree = map.keySet().stream().max(Integer::compare).get();
    final Rational[] a = new Rational[degree + 1];
    Arrays.fill(a, Rational.ZERO);
    map.forEach((k, v) -> {
      checkArgument(k >= 0, "negative exponent %s", k);
      a[k] = a[k].add(v);
    });
    return of(Arrays.asList(a));
  }

  /** Creates {@code c * x^k}. */
  public static Polynomial monomial(Rational c, int k) {
    final Rational[] a = new Rational[k + 1];
    Arrays.fill(a, Rational.ZERO);
    a[k] = c;
    return of(Arrays.asList(a));
  }

  public static Polynomial constant(Rational c) {
    return of(ImmutableList.of(c));
  }

  /** Creates the linear polynomial {@code a * x + b}. */
  public static Polynomial linear(Rational a, Rational b) {
    return of(ImmutableList.of(b, a));
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Polynomial
            && coefficients.equals(((Polynomial) o).coefficients);
  }

  @Override
  public String toString() {
    return toAst("x").toString();
  }

  /** Returns the degree; -1 for the zero polynomial. */
  public int degree() {
    return coefficients.size() - 1;
  }

  public boolean isZero() {
    return coefficients.isEmpty();
  }

  public boolean isConstant() {
    return coefficients.size() <= 1;
  }

  /** Returns the coefficient of {@code x^i}; zero if {@code i} is beyond the
   * degree. */
  public Rational coefficient(int i) {
    return i < coefficients.size() ? coefficients.get(i) : Rational.ZERO;
  }

  /** Coefficients, lowest degree first. */
  public List<Rational> coefficients() {
    return coefficients;
  }

  /** Returns a sorted map from exponent to each non-zero coefficient. */
  public SortedMap<Integer, Rational> toMap() {
    final ImmutableSortedMap.Builder<Integer, Rational> b =
        ImmutableSortedMap.naturalOrder();
    for (int i = 0; i < coefficients.size(); i++) {
      if (!coefficients.get(i).isZero()) {
        b.put(i, coefficients.get(i));
      }
    }
    return b.build();
  }

  public Rational leadingCoefficient() {
    return isZero() ? Rational.ZERO : coefficients.get(degree());
  }

  public Rational constantTerm() {
    return coefficient(0);
  }

  /** Number of non-zero coefficients. */
  public int termCount() {
    int n = 0;
    for (Rational c : coefficients) {
      if (!c.isZero()) {
        ++n;
      }
    }
    return n;
  }

  /** Returns the smallest exponent with a non-zero coefficient. */
  public int lowestDegree() {
    for (int i = 0; i < coefficients.size(); i++) {
      if (!coefficients.get(i).isZero()) {
        return i;
      }
    }
    return -1;
  }

  /** Returns the GCD of the exponents of the non-zero, non-constant terms;
   * 0 if there are none. */
  public int exponentGcd() {
    int g = 0;
    for (int i = 1; i < coefficients.size(); i++) {
      if (!coefficients.get(i).isZero()) {
        g = IntMath.gcd(g, i);
      }
    }
    return g;
  }

  public Polynomial add(Polynomial o) {
    final int n = Math.max(coefficients.size(), o.coefficients.size());
    final List<Rational> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(coefficient(i).add(o.coefficient(i)));
    }
    return of(list);
  }

  public Polynomial subtract(Polynomial o) {
    return add(o.negate());
  }

  public Polynomial negate() {
    return multiply(Rational.MINUS_ONE);
  }

  public Polynomial multiply(Rational c) {
    if (c.isZero()) {
      return ZERO;
    }
    final List<Rational> list = new ArrayList<>(coefficients.size());
    for (Rational a : coefficients) {
      list.add(a.multiply(c));
    }
    return of(list);
  }

  public Polynomial multiply(Polynomial o) {
    if (isZero() || o.isZero()) {
      return ZERO;
    }
    final Rational[] a = new Rational[degree() + o.degree() + 1];
    Arrays.fill(a, Rational.ZERO);
    for (int i = 0; i < coefficients.size(); i++) {
      final Rational ci = coefficients.get(i);
      if (ci.isZero()) {
        continue;
      }
      for (int j = 0; j < o.coefficients.size(); j++) {
        a[i + j] = a[i + j].add(ci.multiply(o.coefficients.get(j)));
      }
    }
    return of(Arrays.asList(a));
  }

  public Polynomial pow(int n) {
    checkArgument(n >= 0, "negative power %s", n);
    Polynomial result = ONE;
    for (int i = 0; i < n; i++) {
      result = result.multiply(this);
    }
    return result;
  }

  /**
   * Divides by another polynomial, returning quotient and remainder.
   *
   * @throws ArithmeticException if the divisor is zero
   */
  public DivRem divRem(Polynomial divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("division by zero polynomial");
    }
    final Rational lead = divisor.leadingCoefficient();
    final Rational[] r = coefficients.toArray(new Rational[0]);
    final int dq = degree() - divisor.degree();
    if (dq < 0) {
      return new DivRem(ZERO, this);
    }
    final Rational[] q = new Rational[dq + 1];
    for (int k = dq; k >= 0; k--) {
      final Rational t = r[k + divisor.degree()].divide(lead);
      q[k] = t;
      if (t.isZero()) {
        continue;
      }
      for (int j = 0; j <= divisor.degree(); j++) {
        r[j + k] = r[j + k].subtract(t.multiply(divisor.coefficient(j)));
      }
    }
    return new DivRem(
        of(Arrays.asList(q)),
        of(Arrays.asList(r).subList(0, Math.max(0, divisor.degree()))));
  }

  /** Divides exactly.
   *
   * @throws ArithmeticException if the remainder is not zero */
  public Polynomial divideExact(Polynomial divisor) {
    final DivRem divRem = divRem(divisor);
    if (!divRem.remainder.isZero()) {
      throw new ArithmeticException(
          "inexact division of " + this + " by " + divisor);
    }
    return divRem.quotient;
  }

  /** Returns whether {@code divisor} divides this polynomial exactly. */
  public boolean isDivisibleBy(Polynomial divisor) {
    return divRem(divisor).remainder.isZero();
  }

  /** Returns the monic greatest common divisor of two polynomials; zero if
   * both are zero. */
  public static Polynomial gcd(Polynomial a, Polynomial b) {
    Polynomial x = a;
    Polynomial y = b;
    while (!y.isZero()) {
      final Polynomial r = x.divRem(y).remainder;
      x = y;
      y = r;
    }
    return x.isZero() ? ZERO : x.monic();
  }

  /** Evaluates at a point, exactly, using Horner's rule. */
  public Rational evaluate(Rational x) {
    Rational v = Rational.ZERO;
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      v = v.multiply(x).add(coefficients.get(i));
    }
    return v;
  }

  /**
   * Divides by {@code (x - root)} using synthetic division.
   *
   * @throws ArithmeticException if {@code root} is not a root
   */
  public Polynomial syntheticDivide(Rational root) {
    if (degree() < 1) {
      throw new ArithmeticException("cannot divide constant " + this);
    }
    final Rational[] q = new Rational[degree()];
    Rational carry = Rational.ZERO;
    for (int i = degree(); i >= 1; i--) {
      carry = carry.multiply(root).add(coefficients.get(i));
      q[i - 1] = carry;
    }
    final Rational remainder = carry.multiply(root).add(coefficients.get(0));
    if (!remainder.isZero()) {
      throw new ArithmeticException(root + " is not a root of " + this);
    }
    return of(Arrays.asList(q));
  }

  public Polynomial derivative() {
    if (degree() < 1) {
      return ZERO;
    }
    final List<Rational> list = new ArrayList<>();
    for (int i = 1; i < coefficients.size(); i++) {
      list.add(coefficients.get(i).multiply(Rational.of(i)));
    }
    return of(list);
  }

  /** Returns {@code p(x^k)}. */
  public Polynomial inflate(int k) {
    checkArgument(k >= 1);
    final Map<Integer, Rational> map = new HashMap<>();
    toMap().forEach((e, c) -> map.put(e * k, c));
    return of(map);
  }

  /** Returns {@code q} such that {@code q(x^k) = p(x)}.
   *
   * @throws IllegalArgumentException if some exponent is not a multiple of
   * {@code k} */
  public Polynomial deflate(int k) {
    final Map<Integer, Rational> map = new HashMap<>();
    toMap().forEach((e, c) -> {
      checkArgument(e % k == 0, "exponent %s not a multiple of %s", e, k);
      map.put(e / k, c);
    });
    return of(map);
  }

  /** Returns whether all coefficients are integers. */
  public boolean isIntegral() {
    for (Rational c : coefficients) {
      if (!c.isInteger()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the content: the rational {@code c} such that {@code this / c}
   * has integer coefficients with GCD 1 and a positive leading coefficient.
   * The content of the zero polynomial is 1.
   */
  public Rational content() {
    if (isZero()) {
      return Rational.ONE;
    }
    Rational g = Rational.ZERO;
    for (Rational c : coefficients) {
      g = Rational.gcd(g, c);
    }
    return leadingCoefficient().signum() < 0 ? g.negate() : g;
  }

  /** Returns this polynomial divided by its content. */
  public Polynomial primitivePart() {
    return multiply(content().reciprocal());
  }

  /** Returns the integer coefficients, lowest degree first.
   *
   * @throws ArithmeticException if a coefficient is not an integer */
  public List<BigInteger> integerCoefficients() {
    final ImmutableList.Builder<BigInteger> b = ImmutableList.builder();
    for (Rational c : coefficients) {
      b.add(c.bigIntegerValueExact());
    }
    return b.build();
  }

  /** Returns this polynomial divided by its leading coefficient. */
  public Polynomial monic() {
    return multiply(leadingCoefficient().reciprocal());
  }

  /**
   * Converts to a tree in a given variable.
   *
   * <p>Terms appear in descending degree. A negative coefficient after the
   * first term becomes a subtraction, so {@code [-6, 11, -6, 1]} becomes
   * "x^3 - 6 * x^2 + 11 * x - 6".
   */
  public AstNode toAst(String variable) {
    if (isZero()) {
      return ast.number(0);
    }
    final List<AstNode> terms = new ArrayList<>();
    for (int i = degree(); i >= 0; i--) {
      final Rational c = coefficients.get(i);
      if (c.isZero()) {
        continue;
      }
      final Rational abs = c.abs();
      final AstNode t;
      if (i == 0) {
        t = ast.number(abs);
      } else {
        t = ast.scale(abs, ast.power(ast.id(variable), i));
      }
      if (c.signum() < 0) {
        terms.add(ast.negate(t));
      } else {
        terms.add(t);
      }
    }
    return ast.sum(terms);
  }

  /** Quotient and remainder. */
  public static class DivRem {
    public final Polynomial quotient;
    public final Polynomial remainder;

    DivRem(Polynomial quotient, Polynomial remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }
  }
}

// End Polynomial.java
