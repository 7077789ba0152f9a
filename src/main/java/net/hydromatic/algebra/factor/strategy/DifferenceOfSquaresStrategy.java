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

import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.ast.Asts;
import net.hydromatic.algebra.ast.Op;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.PolynomialAnalyzer;
import net.hydromatic.algebra.poly.PolynomialAnalyzer.Term;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors {@code a^2 - b^2} as {@code (a + b) * (a - b)}.
 *
 * <p>A term is a square if its coefficient is the square of a rational and
 * each of its variables has an even exponent ({@code 4 * x^2},
 * {@code x * x}), or if it is any expression raised to an even power
 * ({@code (x + 1)^2}).
 */
public class DifferenceOfSquaresStrategy extends AbstractStrategy {
  public DifferenceOfSquaresStrategy() {
    super("differenceOfSquares", 140,
        "a^2 - b^2 = (a + b) * (a - b)");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    if (!node.isAdditive()) {
      return false;
    }
    final List<Term> terms = PolynomialAnalyzer.extractTerms(node);
    return terms.size() == 2 && terms.get(0).sign != terms.get(1).sign;
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final List<Term> terms = PolynomialAnalyzer.extractTerms(node);
    final Term positive = terms.get(0).sign > 0 ? terms.get(0) : terms.get(1);
    final Term negative = terms.get(0).sign > 0 ? terms.get(1) : terms.get(0);
    final @Nullable AstNode a = squareRoot(positive);
    final @Nullable AstNode b = squareRoot(negative);
    if (a == null || b == null) {
      return FactorizationResult.notApplicable(node);
    }
    final AstNode result = ast.times(ast.plus(a, b), ast.minus(a, b));
    return FactorizationResult.factored(name(), result,
        ImmutableList.of("difference of squares: (" + a + ")^2 - (" + b
            + ")^2"));
  }

  /** Returns the square root of a term, ignoring its sign, or null if it is
   * not a perfect square. */
  static @Nullable AstNode squareRoot(Term term) {
    if (term.opaque) {
      if (term.node.op == Op.POWER) {
        final Ast.BinaryExpression power = (Ast.BinaryExpression) term.node;
        final @Nullable Integer e = Asts.intValue(power.right);
        if (e != null && e >= 2 && e % 2 == 0) {
          return e == 2 ? power.left : ast.power(power.left, e / 2);
        }
      }
      return null;
    }
    final @Nullable Rational root = term.coefficient.sqrt();
    if (root == null) {
      return null;
    }
    final Map<String, Integer> halves = new TreeMap<>();
    for (Map.Entry<String, Integer> e : term.variables.entrySet()) {
      if (e.getValue() % 2 != 0) {
        return null;
      }
      halves.put(e.getKey(), e.getValue() / 2);
    }
    return Term.monomial(1, root, halves).toAst();
  }
}

// End DifferenceOfSquaresStrategy.java
