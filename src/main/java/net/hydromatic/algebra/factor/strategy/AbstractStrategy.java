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
package net.hydromatic.algebra.factor.strategy;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.Strategy;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Integers;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Base class for strategies, with helpers for reading and writing
 * polynomials. */
public abstract class AbstractStrategy implements Strategy {
  /** Largest prime used to simplify a square root. */
  private static final long SURD_PRIME_LIMIT = 10_000;

  private final String name;
  private final int priority;
  private final String description;

  protected AbstractStrategy(String name, int priority, String description) {
    this.name = requireNonNull(name);
    this.priority = priority;
    this.description = requireNonNull(description);
  }

  @Override public String name() {
    return name;
  }

  @Override public int priority() {
    return priority;
  }

  @Override public String description() {
    return description;
  }

  @Override public String toString() {
    return name;
  }

  /** Returns the tree as a univariate polynomial whose degree is between
   * {@code minDegree} and {@code maxDegree}, or null. */
  protected static @Nullable Polynomial polynomial(AstNode node,
      FactorizationContext context, int minDegree, int maxDegree) {
    final Polynomial p = context.polynomial(node);
    if (p == null || p.degree() < minDegree || p.degree() > maxDegree) {
      return null;
    }
    return p;
  }

  /** Builds the product of a constant and some polynomials. */
  protected static AstNode product(Rational constant,
      List<Polynomial> factors, String variable) {
    final List<AstNode> nodes = new ArrayList<>();
    final boolean negate = constant.equals(Rational.MINUS_ONE);
    if (!constant.isOne() && !negate) {
      nodes.add(ast.number(constant));
    }
    for (Polynomial factor : factors) {
      nodes.add(factor.toAst(variable));
    }
    final AstNode product = ast.product(nodes);
    return negate ? ast.negate(product) : product;
  }

  /** Simplifies the square root of a positive rational. */
  protected static Surd surd(Rational d) {
    // sqrt(n/m) = sqrt(n m) / m
    final BigInteger[] split =
        Integers.extractSquare(d.numerator.multiply(d.denominator),
            SURD_PRIME_LIMIT);
    return new Surd(Rational.of(split[0], d.denominator), split[1]);
  }

  /**
   * Builds {@code node - (s + t * sqrt(f))}, written as a sum whose terms
   * are {@code node}, {@code -s} and {@code -t * sqrt(f)}.
   */
  protected static AstNode minusSurd(AstNode node, Rational s, Rational t,
      BigInteger f) {
    final List<AstNode> terms = new ArrayList<>();
    terms.add(node);
    if (!s.isZero()) {
      terms.add(signed(s.negate(), ast.number(s.abs())));
    }
    if (!t.isZero()) {
      final AstNode surd = ast.scale(t.abs(), ast.sqrt(ast.number(f)));
      terms.add(signed(t.negate(), surd));
    }
    return ast.sum(terms);
  }

  private static AstNode signed(Rational sign, AstNode node) {
    return sign.signum() < 0 ? ast.negate(node) : node;
  }

  /** Square root in the form {@code coefficient * sqrt(radicand)}. */
  protected static class Surd {
    final Rational coefficient;
    /** Positive integer; 1 if the root is rational. */
    final BigInteger radicand;

    Surd(Rational coefficient, BigInteger radicand) {
      this.coefficient = coefficient;
      this.radicand = radicand;
    }

    boolean isRational() {
      return radicand.equals(BigInteger.ONE);
    }
  }
}

// End AbstractStrategy.java
