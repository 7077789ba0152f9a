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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.factor.FactorizationContext;
import net.hydromatic.algebra.factor.FactorizationResult;
import net.hydromatic.algebra.poly.PolynomialAnalyzer;
import net.hydromatic.algebra.poly.PolynomialAnalyzer.Term;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors by grouping.
 *
 * <p>Splits the terms of a sum into groups, takes the common factor out of
 * each group, and succeeds if every group leaves the same sum. For
 * example, {@code x^3 + x^2 + x + 1} groups as
 * {@code x^2 * (x + 1) + 1 * (x + 1)}, giving
 * {@code (x^2 + 1) * (x + 1)}.
 *
 * <p>The groupings tried are adjacent pairs, the two ways to pair four
 * terms other than adjacently, and splits into two runs of consecutive
 * terms.
 */
public class GroupingStrategy extends AbstractStrategy {
  public GroupingStrategy() {
    super("grouping", 70, "ax + ay + bx + by = (a + b)(x + y)");
  }

  @Override public boolean canApply(AstNode node,
      FactorizationContext context) {
    return node.isAdditive();
  }

  @Override public FactorizationResult apply(AstNode node,
      FactorizationContext context) {
    final List<Term> terms = PolynomialAnalyzer.extractTerms(node);
    if (terms.size() < 4) {
      return FactorizationResult.notApplicable(node);
    }
    for (Term term : terms) {
      if (term.opaque) {
        return FactorizationResult.notApplicable(node);
      }
    }
    for (List<List<Integer>> grouping : groupings(terms.size())) {
      final @Nullable AstNode result = tryGrouping(terms, grouping);
      if (result != null) {
        return FactorizationResult.factored(name(), result,
            ImmutableList.of("grouping " + grouping));
      }
    }
    return FactorizationResult.notApplicable(node);
  }

  /** Returns the candidate groupings of {@code n} terms, each a list of
   * groups of term indexes. */
  static List<List<List<Integer>>> groupings(int n) {
    final Set<List<List<Integer>>> set = new LinkedHashSet<>();
    if (n % 2 == 0) {
      final List<List<Integer>> pairs = new ArrayList<>();
      for (int i = 0; i < n; i += 2) {
        pairs.add(ImmutableList.of(i, i + 1));
      }
      set.add(pairs);
    }
    if (n == 4) {
      set.add(
          ImmutableList.of(ImmutableList.of(0, 2), ImmutableList.of(1, 3)));
      set.add(
          ImmutableList.of(ImmutableList.of(0, 3), ImmutableList.of(1, 2)));
    }
    for (int i = 2; i <= n - 2; i++) {
      set.add(ImmutableList.of(range(0, i), range(i, n)));
    }
    return ImmutableList.copyOf(set);
  }

  private static List<Integer> range(int start, int end) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = start; i < end; i++) {
      b.add(i);
    }
    return b.build();
  }

  /** Returns the factored form for a grouping, or null if the groups do not
   * share a remainder. */
  private static @Nullable AstNode tryGrouping(List<Term> terms,
      List<List<Integer>> grouping) {
    final List<Term> factors = new ArrayList<>();
    @Nullable List<Term> remainder = null;
    @Nullable Multiset<Term> target = null;
    boolean hasVariables = false;
    for (List<Integer> group : grouping) {
      final List<Term> groupTerms = new ArrayList<>();
      group.forEach(i -> groupTerms.add(terms.get(i)));
      Rational g = PolynomialAnalyzer.gcd(termCoefficients(groupTerms));
      if (groupTerms.get(0).sign < 0) {
        g = g.negate();
      }
      final Map<String, Integer> powers =
          PolynomialAnalyzer.commonVariablePowers(groupTerms);
      hasVariables |= !powers.isEmpty();
      final List<Term> quotients = new ArrayList<>();
      for (Term term : groupTerms) {
        quotients.add(term.divide(g, powers));
      }
      Term factor = Term.monomial(1, g, powers);
      if (target == null) {
        remainder = quotients;
        target = HashMultiset.create(quotients);
      } else if (!target.equals(HashMultiset.create(quotients))) {
        final List<Term> negated = new ArrayList<>();
        quotients.forEach(term -> negated.add(term.negate()));
        if (!target.equals(HashMultiset.create(negated))) {
          return null;
        }
        factor = factor.negate();
      }
      factors.add(factor);
    }
    if (!hasVariables || remainder == null) {
      return null;
    }
    final List<AstNode> factorNodes = new ArrayList<>();
    factors.forEach(factor -> factorNodes.add(factor.toAst()));
    final List<AstNode> remainderNodes = new ArrayList<>();
    remainder.forEach(term -> remainderNodes.add(term.toAst()));
    return ast.times(ast.sum(factorNodes), ast.sum(remainderNodes));
  }

  private static List<Rational> termCoefficients(List<Term> terms) {
    final List<Rational> list = new ArrayList<>();
    terms.forEach(term -> list.add(term.coefficient));
    return list;
  }
}

// End GroupingStrategy.java
