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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorProp;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.integer.BigPolynomial;
import net.hydromatic.algebra.integer.IntegerFactorization;
import net.hydromatic.algebra.integer.IntegerFactorizer;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.util.Rational;

/**
 * Complete factorization over the integers, by square-free decomposition,
 * Berlekamp's algorithm modulo a prime, Hensel lifting, and recombination
 * of the lifted factors.
 *
 * <p>Runs last, after the pattern strategies. Its result is final: every
 * factor is irreducible over the rationals.
 */
public class IntegerFactorStrategy extends AbstractStrategy {
  private final IntegerFactorizer factorizer;

  public IntegerFactorStrategy(IntegerFactorizer factorizer) {
    super("integerFactorization", 10,
        "Berlekamp-Zassenhaus factorization over the integers");
    this.factorizer = requireNonNull(factorizer);
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive()
        && context.booleanProp(FactorProp.USE_ALGEBRAIC);
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final Polynomial p = polynomial(node, context, 2,
        context.intProp(FactorProp.MAX_ALGEBRAIC_DEGREE));
    if (p == null) {
      return FactorizationResult.notApplicable(node);
    }
    final Rational content = p.content();
    final IntegerFactorization factorization =
        factorizer.factor(BigPolynomial.of(p.primitivePart()));
    if (factorization.isIrreducible()) {
      return FactorizationResult.unchanged(node,
          FactorizationResult.Status.IRREDUCIBLE, factorization.steps);
    }
    final List<AstNode> nodes = new ArrayList<>();
    for (IntegerFactorization.Factor factor : factorization.factors) {
      final AstNode f =
          factor.polynomial.toPolynomial().toAst(context.variable);
      nodes.add(factor.multiplicity == 1
          ? f
          : ast.power(f, factor.multiplicity));
    }
    final Rational constant =
        content.multiply(Rational.of(factorization.content));
    return FactorizationResult.factoredFinal(name(),
        ast.scale(constant, ast.product(nodes)), factorization.steps);
  }
}

// End IntegerFactorStrategy.java
