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
package net.hydromatic.algebra.factor;

import static net.hydromatic.algebra.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.ast.Asts;
import net.hydromatic.algebra.ast.Op;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Combines factors into a product in standard form.
 *
 * <p>A factor that is a polynomial in the variable is rewritten as its
 * primitive part, terms in descending degree, and its content joins the
 * constants. Rational constants are multiplied together and placed first; a
 * constant of -1 becomes a negation of the whole product. Equal factors are
 * merged into powers. The remaining factors are sorted by degree in the
 * variable, then by their coefficients from the leading term down, comparing
 * magnitudes and putting negative before positive; so {@code x - 2} comes
 * before {@code x + 2}, which comes before {@code x - 3}.
 */
class Products {
  private final FactorizationContext context;

  Products(FactorizationContext context) {
    this.context = context;
  }

  AstNode combine(List<AstNode> factors) {
    final Map<AstNode, Factor> map = new LinkedHashMap<>();
    final Rational[] constant = {Rational.ONE};
    for (AstNode factor : factors) {
      collect(factor, 1, map, constant);
    }
    if (constant[0].isZero()) {
      return ast.number(0);
    }
    final List<Factor> list = new ArrayList<>(map.values());
    list.sort(
        Comparator.comparingInt((Factor f) -> f.category)
            .thenComparingInt(f -> f.polynomial == null
                ? 0 : f.polynomial.degree())
            .thenComparing(Products::compareCoefficients)
            .thenComparing(f -> f.node.toString())
            .thenComparingInt(f -> f.exponent));
    final List<AstNode> nodes = new ArrayList<>();
    final Rational c = constant[0];
    final boolean negate = c.equals(Rational.MINUS_ONE) && !list.isEmpty();
    if (!c.isOne() && !negate) {
      nodes.add(ast.number(c));
    }
    for (Factor f : list) {
      nodes.add(ast.power(f.node, f.exponent));
    }
    final AstNode product = ast.product(nodes);
    return negate ? ast.negate(product) : product;
  }

  private void collect(AstNode node, int exponent, Map<AstNode, Factor> map,
      Rational[] constant) {
    switch (node.op) {
      case TIMES:
        final Ast.BinaryExpression times = (Ast.BinaryExpression) node;
        collect(times.left, exponent, map, constant);
        collect(times.right, exponent, map, constant);
        return;
      case NEGATE:
        if (exponent % 2 == 1) {
          constant[0] = constant[0].negate();
        }
        collect(((Ast.UnaryExpression) node).operand, exponent, map,
            constant);
        return;
      case POSITIVE:
        collect(((Ast.UnaryExpression) node).operand, exponent, map,
            constant);
        return;
      default:
        break;
    }
    final @Nullable Integer e = Factorizer.integerExponent(node);
    if (e != null) {
      collect(((Ast.BinaryExpression) node).left, exponent * e, map,
          constant);
      return;
    }
    if (Asts.isConstant(node)) {
      final @Nullable Rational r =
          context.normalizer().expand(node).rationalValue();
      if (r != null) {
        constant[0] = constant[0].multiply(r.pow(exponent));
        return;
      }
    }
    AstNode base = node;
    @Nullable Polynomial polynomial = context.polynomial(node);
    if (polynomial != null && polynomial.degree() < 1) {
      constant[0] =
          constant[0].multiply(polynomial.constantTerm().pow(exponent));
      return;
    }
    if (polynomial != null) {
      // Write polynomial factors in standard form: primitive, with positive
      // leading coefficient, terms in descending degree.
      constant[0] = constant[0].multiply(polynomial.content().pow(exponent));
      polynomial = polynomial.primitivePart();
      base = polynomial.toAst(context.variable);
    }
    final AstNode key = Asts.canonical(base);
    final Factor existing = map.get(key);
    map.put(key,
        existing == null
            ? new Factor(base, exponent, category(base), polynomial)
            : new Factor(existing.node, existing.exponent + exponent,
                existing.category, existing.polynomial));
  }

  private static int category(AstNode node) {
    if (Asts.isConstant(node)) {
      return 0;
    }
    return node.op == Op.FUNCTION_CALL ? 2 : 1;
  }

  private static int compareCoefficients(Factor a, Factor b) {
    if (a.polynomial == null || b.polynomial == null) {
      return Boolean.compare(a.polynomial == null, b.polynomial == null);
    }
    for (int i = a.polynomial.degree(); i >= 0; i--) {
      final Rational x = a.polynomial.coefficient(i);
      final Rational y = b.polynomial.coefficient(i);
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

  /** Base of a factor, its exponent, and its polynomial, if any. */
  private static class Factor {
    final AstNode node;
    final int exponent;
    final int category;
    final @Nullable Polynomial polynomial;

    Factor(AstNode node, int exponent, int category,
        @Nullable Polynomial polynomial) {
      this.node = node;
      this.exponent = exponent;
      this.category = category;
      this.polynomial = polynomial;
    }
  }
}

// End Products.java
