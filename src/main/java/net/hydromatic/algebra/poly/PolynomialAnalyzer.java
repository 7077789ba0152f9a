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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.ast.Asts;
import net.hydromatic.algebra.ast.Op;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads expression trees as polynomials.
 *
 * <p>There are two views. {@link #analyzePolynomial} expands the whole tree
 * and reports the coefficients of each power of one variable;
 * {@link #extractTerms} looks only at the top-level sum and describes each
 * term as it is written.
 */
public class PolynomialAnalyzer {
  private final Normalizer normalizer;

  public PolynomialAnalyzer(Normalizer normalizer) {
    this.normalizer = requireNonNull(normalizer);
  }

  public Normalizer normalizer() {
    return normalizer;
  }

  /**
   * Returns the polynomial view of a tree in a given variable, or null if the
   * tree is not a polynomial in that variable.
   *
   * <p>A tree is not a polynomial if, after expansion, the variable occurs
   * inside an opaque atom: a negative or fractional exponent, a function
   * call, or a division by an expression in the variable.
   *
   * <p>If other symbols occur the result is not univariate, and its
   * coefficients cover only the monomials that have numeric coefficients.
   */
  public @Nullable PolynomialInfo analyzePolynomial(AstNode node,
      String variable) {
    final MultiPolynomial expansion = normalizer.expand(node);
    boolean univariate = true;
    final Map<Integer, Rational> coefficients = new TreeMap<>();
    for (Map.Entry<MultiPolynomial.Monomial, Rational> e
        : expansion.terms.entrySet()) {
      final MultiPolynomial.Monomial monomial = e.getKey();
      boolean numeric = true;
      for (MultiPolynomial.Atom atom : monomial.atoms.keySet()) {
        if (atom.isVariable(variable)) {
          continue;
        }
        if (atom.kind == MultiPolynomial.AtomKind.OPAQUE
            && Asts.contains(atom.node, variable)) {
          return null;
        }
        numeric = false;
      }
      if (numeric) {
        coefficients.merge(monomial.exponent(variable), e.getValue(),
            Rational::add);
      } else {
        univariate = false;
      }
    }
    return new PolynomialInfo(variable, expansion,
        expansion.degree(variable), coefficients, univariate,
        expansion.variables());
  }

  /** Returns the univariate polynomial of a tree, or null if it is not a
   * polynomial in {@code variable} with rational coefficients. */
  public @Nullable Polynomial univariate(AstNode node, String variable) {
    final PolynomialInfo info = analyzePolynomial(node, variable);
    return info == null || !info.isUnivariate ? null : info.polynomial();
  }

  /**
   * Splits a tree into the terms of its top-level sum.
   *
   * <p>Nested {@code +}, {@code -} and unary minus are flattened, and each
   * term's sign is the product of the signs applied to it. For example,
   * {@code 6 * x - (3 * y - 2)} has terms {@code +6 x}, {@code -3 y},
   * {@code +2}.
   */
  public static List<Term> extractTerms(AstNode node) {
    final List<Term> terms = new ArrayList<>();
    flattenSum(node, 1, terms);
    return ImmutableList.copyOf(terms);
  }

  private static void flattenSum(AstNode node, int sign, List<Term> terms) {
    switch (node.op) {
      case PLUS:
        flattenSum(((Ast.BinaryExpression) node).left, sign, terms);
        flattenSum(((Ast.BinaryExpression) node).right, sign, terms);
        break;
      case MINUS:
        flattenSum(((Ast.BinaryExpression) node).left, sign, terms);
        flattenSum(((Ast.BinaryExpression) node).right, -sign, terms);
        break;
      case NEGATE:
        flattenSum(((Ast.UnaryExpression) node).operand, -sign, terms);
        break;
      case POSITIVE:
        flattenSum(((Ast.UnaryExpression) node).operand, sign, terms);
        break;
      default:
        terms.add(Term.of(node, sign));
    }
  }

  /** Returns the greatest common divisor of some rationals; zero if the list
   * is empty. */
  public static Rational gcd(Iterable<Rational> values) {
    Rational g = Rational.ZERO;
    for (Rational value : values) {
      g = Rational.gcd(g, value);
    }
    return g;
  }

  /**
   * Returns the variables that occur in every term, each with its smallest
   * exponent. Returns an empty map if any term is opaque.
   */
  public static ImmutableSortedMap<String, Integer> commonVariablePowers(
      List<Term> terms) {
    if (terms.isEmpty()) {
      return ImmutableSortedMap.of();
    }
    final Map<String, Integer> common = new TreeMap<>();
    for (Term term : terms) {
      if (term.opaque) {
        return ImmutableSortedMap.of();
      }
    }
    common.putAll(terms.get(0).variables);
    for (Term term : terms.subList(1, terms.size())) {
      common.keySet().retainAll(term.variables.keySet());
      common.replaceAll((name, e) ->
          Math.min(e, requireNonNull(term.variables.get(name))));
    }
    return ImmutableSortedMap.copyOf(common);
  }

  /** Polynomial view of a tree in one variable. */
  public static class PolynomialInfo {
    public final String variable;
    /** The expanded tree. */
    public final MultiPolynomial expansion;
    public final int degree;
    /** Coefficient of each power of the variable; zero coefficients are
     * absent. */
    public final ImmutableSortedMap<Integer, Rational> coefficients;
    /** Whether the tree mentions no symbol other than the variable. */
    public final boolean isUnivariate;
    public final ImmutableSortedSet<String> variables;

    PolynomialInfo(String variable, MultiPolynomial expansion, int degree,
        Map<Integer, Rational> coefficients, boolean isUnivariate,
        ImmutableSortedSet<String> variables) {
      this.variable = requireNonNull(variable);
      this.expansion = requireNonNull(expansion);
      this.degree = degree;
      final ImmutableSortedMap.Builder<Integer, Rational> b =
          ImmutableSortedMap.naturalOrder();
      coefficients.forEach((k, c) -> {
        if (!c.isZero()) {
          b.put(k, c);
        }
      });
      this.coefficients = b.build();
      this.isUnivariate = isUnivariate;
      this.variables = requireNonNull(variables);
    }

    public Rational coefficient(int k) {
      return coefficients.getOrDefault(k, Rational.ZERO);
    }

    public Rational leadingCoefficient() {
      return coefficient(degree);
    }

    public Rational constantTerm() {
      return coefficient(0);
    }

    /** Returns the coefficients as a dense polynomial. Meaningful only if
     * {@link #isUnivariate}. */
    public Polynomial polynomial() {
      return Polynomial.of(coefficients);
    }

    @Override
    public String toString() {
      return "{degree=" + degree
          + ", coefficients=" + coefficients
          + ", isUnivariate=" + isUnivariate
          + ", variables=" + variables + "}";
    }
  }

  /**
   * Term of a sum, as written.
   *
   * <p>A term that is a product of a number and powers of identifiers is
   * described by its sign, its non-negative coefficient and its variables;
   * any other term is opaque, with coefficient 1 and no variables.
   */
  public static class Term {
    /** +1 or -1. */
    public final int sign;
    /** Magnitude of the coefficient. */
    public final Rational coefficient;
    public final ImmutableSortedMap<String, Integer> variables;
    /** The term, without its sign. */
    public final AstNode node;
    public final boolean opaque;

    private Term(int sign, Rational coefficient,
        Map<String, Integer> variables, AstNode node, boolean opaque) {
      this.sign = sign;
      this.coefficient = requireNonNull(coefficient);
      this.variables = ImmutableSortedMap.copyOf(variables);
      this.node = requireNonNull(node);
      this.opaque = opaque;
    }

    /** Creates a term from a tree that is not a sum. */
    static Term of(AstNode node, int sign) {
      final Parts parts = new Parts(sign);
      if (parts.accumulate(node)) {
        return monomial(parts.sign, parts.coefficient, parts.variables);
      }
      return new Term(sign, Rational.ONE, ImmutableSortedMap.of(), node,
          true);
    }

    /** Creates a term that is a product of a number and variables. */
    public static Term monomial(int sign, Rational coefficient,
        Map<String, Integer> variables) {
      final int s = coefficient.signum() < 0 ? -sign : sign;
      final Rational c = coefficient.abs();
      final List<AstNode> factors = new ArrayList<>();
      if (!c.isOne()) {
        factors.add(ast.number(c));
      }
      variables.forEach((name, e) -> {
        if (e > 0) {
          factors.add(ast.power(ast.id(name), e));
        }
      });
      final Map<String, Integer> vars = new TreeMap<>(variables);
      vars.values().removeIf(e -> e == 0);
      final AstNode node =
          factors.isEmpty() ? ast.number(c) : ast.product(factors);
      return new Term(s, c, vars, node, false);
    }

    /** Returns the coefficient including its sign. */
    public Rational signedCoefficient() {
      return sign < 0 ? coefficient.negate() : coefficient;
    }

    public Term negate() {
      return new Term(-sign, coefficient, variables, node, opaque);
    }

    /** Returns the degree of this term in a variable. */
    public int exponent(String variable) {
      return variables.getOrDefault(variable, 0);
    }

    /** Divides this non-opaque term by a non-zero rational and a product of
     * variables, all of which must occur in this term. */
    public Term divide(Rational divisor, Map<String, Integer> powers) {
      final Map<String, Integer> vars = new TreeMap<>(variables);
      powers.forEach((name, e) ->
          vars.merge(name, -e, Integer::sum));
      return monomial(sign * divisor.signum(),
          coefficient.divide(divisor.abs()), vars);
    }

    /** Returns the tree of this term with its sign. */
    public AstNode toAst() {
      return sign < 0 ? Asts.negate(node) : node;
    }

    @Override
    public int hashCode() {
      return Objects.hash(sign, coefficient, variables,
          opaque ? Asts.canonical(node) : null);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Term
              && sign == ((Term) o).sign
              && coefficient.equals(((Term) o).coefficient)
              && variables.equals(((Term) o).variables)
              && opaque == ((Term) o).opaque
              && (!opaque || Asts.equivalent(node, ((Term) o).node));
    }

    @Override
    public String toString() {
      return toAst().toString();
    }
  }

  /** Accumulates the factors of a product. */
  private static class Parts {
    int sign;
    Rational coefficient = Rational.ONE;
    final Map<String, Integer> variables = new TreeMap<>();

    Parts(int sign) {
      this.sign = sign;
    }

    /** Absorbs a factor; returns false if it is not a number, identifier or
     * power of an identifier. */
    boolean accumulate(AstNode node) {
      switch (node.op) {
        case NUMBER_LITERAL:
          return absorb(((Ast.NumberLiteral) node).rational());
        case FRACTION:
          final Ast.Fraction fraction = (Ast.Fraction) node;
          return absorbQuotient(fraction.numerator, fraction.denominator);
        case DIVIDE:
          final Ast.BinaryExpression divide = (Ast.BinaryExpression) node;
          return absorbQuotient(divide.left, divide.right);
        case IDENTIFIER:
          variables.merge(((Ast.Identifier) node).name, 1, Integer::sum);
          return true;
        case POWER:
          final Ast.BinaryExpression power = (Ast.BinaryExpression) node;
          final @Nullable Integer e = Asts.intValue(power.right);
          if (power.left.op != Op.IDENTIFIER || e == null || e < 0) {
            return false;
          }
          if (e > 0) {
            variables.merge(((Ast.Identifier) power.left).name, e,
                Integer::sum);
          }
          return true;
        case TIMES:
          final Ast.BinaryExpression times = (Ast.BinaryExpression) node;
          return accumulate(times.left) && accumulate(times.right);
        case NEGATE:
          sign = -sign;
          return accumulate(((Ast.UnaryExpression) node).operand);
        default:
          return false;
      }
    }

    private boolean absorb(Rational r) {
      if (r.signum() < 0) {
        sign = -sign;
      }
      coefficient = coefficient.multiply(r.abs());
      return true;
    }

    private boolean absorbQuotient(AstNode numerator, AstNode denominator) {
      final @Nullable Rational n = numeric(numerator);
      final @Nullable Rational d = numeric(denominator);
      if (n == null || d == null || d.isZero()) {
        return false;
      }
      return absorb(n.divide(d));
    }

    private static @Nullable Rational numeric(AstNode node) {
      if (node instanceof Ast.NumberLiteral) {
        return ((Ast.NumberLiteral) node).rational();
      }
      if (node.op == Op.NEGATE) {
        final Rational r = numeric(((Ast.UnaryExpression) node).operand);
        return r == null ? null : r.negate();
      }
      return null;
    }
  }
}

// End PolynomialAnalyzer.java
