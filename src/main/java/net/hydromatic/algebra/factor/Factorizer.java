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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.algebra.ast.Ast;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.ast.Asts;
import net.hydromatic.algebra.ast.Op;
import net.hydromatic.algebra.poly.Expander;
import net.hydromatic.algebra.poly.Normalizer;
import net.hydromatic.algebra.poly.PolynomialAnalyzer;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factors expression trees by applying strategies until none makes
 * progress.
 *
 * <p>For each tree, the strategies are tried in descending priority. The
 * first rewrite that is verified (it expands to the same polynomial) and new
 * (its canonical form has not been seen before) is accepted; then each factor
 * of the rewritten tree is factored in the same way, and the factors are
 * combined into a sorted product. This repeats until no strategy makes
 * progress or the iteration limit is reached.
 *
 * <p>A negation is factored through its operand, and a quotient by a
 * non-zero constant through its numerator.
 *
 * <p>A strategy that throws is reported to the {@link Tracer} and recorded as
 * a step; the remaining strategies are still tried. The factorizer itself
 * does not throw for a well-formed tree.
 *
 * <p>Immutable, and therefore safe to share between threads.
 */
public class Factorizer {
  /** Deepest nesting of factors that is factored. */
  private static final int MAX_DEPTH = 32;

  private final StrategyRegistry registry;
  private final ImmutableMap<FactorProp, Object> props;
  private final PolynomialAnalyzer analyzer;
  private final Tracer tracer;

  public Factorizer(StrategyRegistry registry, Map<FactorProp, Object> props,
      Tracer tracer) {
    this.registry = requireNonNull(registry);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    final Normalizer normalizer =
        new Expander(FactorProp.MAX_EXPANSION_POWER.intValue(props));
    this.analyzer = new PolynomialAnalyzer(normalizer);
  }

  /** Creates a factorizer with the standard strategies and default
   * properties. */
  public static Factorizer create() {
    return create(ImmutableMap.of());
  }

  /** Creates a factorizer with the standard strategies. */
  public static Factorizer create(Map<FactorProp, Object> props) {
    return new Factorizer(StrategyRegistry.standard(props), props,
        Tracers.empty());
  }

  /** Returns a factorizer that is the same as this but with a given
   * tracer. */
  public Factorizer withTracer(Tracer tracer) {
    return tracer == this.tracer
        ? this
        : new Factorizer(registry, props, tracer);
  }

  /** Returns a factorizer that is the same as this but with a given
   * registry. */
  public Factorizer withRegistry(StrategyRegistry registry) {
    return registry == this.registry
        ? this
        : new Factorizer(registry, props, tracer);
  }

  public StrategyRegistry registry() {
    return registry;
  }

  public Normalizer normalizer() {
    return analyzer.normalizer();
  }

  /** Factors a tree, as a polynomial in {@code variable}. */
  public FactorizationResult factor(AstNode tree, String variable) {
    final FactorizationContext context =
        new FactorizationContext(variable, 0,
            FactorProp.MAX_ITERATIONS.intValue(props), props, analyzer);
    final Run run = new Run();
    AstNode result;
    try {
      result = factorNode(tree, context, 0, run);
    } catch (RuntimeException e) {
      // A fault outside any strategy, for example while combining factors.
      final FactorException fe = new FactorException("factorizer", e);
      tracer.onError(fe);
      run.steps.add(fe.getMessage());
      run.seen.add(FactorizationResult.Status.INTERNAL_ERROR);
      result = tree;
    }
    final boolean changed =
        !Asts.canonical(result).equals(Asts.canonical(tree));
    if (!changed) {
      return FactorizationResult.unchanged(tree, run.unchangedStatus(),
          run.steps);
    }
    return new FactorizationResult(true, true, result, run.steps,
        run.strategyUsed, true, FactorizationResult.Status.FACTORED);
  }

  /**
   * Factors a tree repeatedly, until its canonical form stops changing or
   * the iteration limit is reached, and concatenates the steps of each
   * attempt.
   */
  public FactorizationResult factorWithSteps(AstNode tree, String variable) {
    final List<String> steps = new ArrayList<>();
    final int maxIterations = FactorProp.MAX_ITERATIONS.intValue(props);
    AstNode current = tree;
    FactorizationResult last = null;
    @Nullable String strategyUsed = null;
    for (int i = 0; i < Math.max(maxIterations, 1); i++) {
      last = factor(current, variable);
      steps.addAll(last.steps);
      if (!last.changed) {
        break;
      }
      if (last.strategyUsed != null) {
        strategyUsed = last.strategyUsed;
      }
      current = last.ast;
    }
    requireNonNull(last);
    if (current == tree) {
      return FactorizationResult.unchanged(tree, last.status, steps);
    }
    return new FactorizationResult(true, true, current, steps, strategyUsed,
        true, FactorizationResult.Status.FACTORED);
  }

  /** Factors a tree; returns the tree itself if nothing applies. */
  private AstNode factorNode(AstNode node, FactorizationContext context,
      int depth, Run run) {
    if (depth > MAX_DEPTH || Asts.isConstant(node)) {
      return node;
    }
    if (isProduct(node)) {
      return factorOperands(node, context, depth, run);
    }
    final @Nullable AstNode quotient =
        factorQuotient(node, context, depth, run);
    if (quotient != null) {
      return quotient;
    }
    final Set<AstNode> history = new HashSet<>();
    history.add(Asts.canonical(node));
    AstNode current = node;
    FactorizationContext c = context.withIteration(0);
    while (c.currentIteration < c.maxIterations) {
      final @Nullable FactorizationResult result =
          step(current, c, run, history);
      if (result == null) {
        break;
      }
      c = c.withIteration(c.currentIteration + 1);
      if (!result.canContinue) {
        return combine(Asts.factors(result.ast), c);
      }
      current = result.ast;
      if (isProduct(current)) {
        return factorOperands(current, c, depth, run);
      }
    }
    return current;
  }

  /** Tries each strategy once on a tree. Returns the first accepted result,
   * or null. */
  private @Nullable FactorizationResult step(AstNode node,
      FactorizationContext context, Run run, Set<AstNode> history) {
    for (Strategy strategy : registry.strategies()) {
      if (!strategy.canApply(node, context)) {
        continue;
      }
      tracer.onAttempt(strategy, node);
      final FactorizationResult result;
      try {
        result = strategy.apply(node, context);
      } catch (RuntimeException e) {
        final FactorException fe = new FactorException(strategy.name(), e);
        run.steps.add(fe.getMessage());
        run.seen.add(FactorizationResult.Status.INTERNAL_ERROR);
        tracer.onError(fe);
        continue;
      }
      run.steps.addAll(result.steps);
      if (!result.changed) {
        reject(strategy, node, result.status, run);
        continue;
      }
      if (context.booleanProp(FactorProp.VERIFY)
          && !context.normalizer().equivalent(node, result.ast)) {
        run.steps.add(strategy.name() + ": rejected " + result.ast
            + "; it does not equal " + node);
        reject(strategy, node,
            FactorizationResult.Status.VERIFICATION_FAILURE, run);
        continue;
      }
      if (!history.add(Asts.canonical(result.ast))) {
        reject(strategy, node, FactorizationResult.Status.NO_PROGRESS, run);
        continue;
      }
      run.steps.add(strategy.name() + ": " + node + " = " + result.ast);
      run.strategyUsed = strategy.name();
      tracer.onApplied(strategy, node, result.ast);
      return result;
    }
    return null;
  }

  private void reject(Strategy strategy, AstNode node,
      FactorizationResult.Status status, Run run) {
    run.seen.add(status);
    tracer.onRejected(strategy, node, status);
  }

  /** Factors each factor of a product, or the base of a power, and combines
   * the results. */
  private AstNode factorOperands(AstNode node, FactorizationContext context,
      int depth, Run run) {
    final List<AstNode> factors = new ArrayList<>();
    for (AstNode factor : Asts.factors(node)) {
      factors.add(factorFactor(factor, context, depth, run));
    }
    return combine(factors, context);
  }

  /** Factors one factor of a product. A negation or a power keeps its
   * operator, and its operand is factored. */
  private AstNode factorFactor(AstNode factor, FactorizationContext context,
      int depth, Run run) {
    if (factor.op == Op.NEGATE) {
      final AstNode operand = ((Ast.UnaryExpression) factor).operand;
      return ast.negate(factorFactor(operand, context, depth, run));
    }
    final @Nullable Integer exponent = integerExponent(factor);
    if (exponent != null) {
      final AstNode base = ((Ast.BinaryExpression) factor).left;
      return ast.power(factorNode(base, context, depth + 1, run), exponent);
    }
    return factorNode(factor, context, depth + 1, run);
  }

  /**
   * Factors a quotient whose denominator is a non-zero constant.
   *
   * <p>Returns the product of the reciprocal of the denominator and the
   * factors of the numerator; the tree itself if the numerator does not
   * factor; or null if the tree is not such a quotient.
   */
  private @Nullable AstNode factorQuotient(AstNode node,
      FactorizationContext context, int depth, Run run) {
    final AstNode numerator;
    final AstNode denominator;
    switch (node.op) {
      case DIVIDE:
        numerator = ((Ast.BinaryExpression) node).left;
        denominator = ((Ast.BinaryExpression) node).right;
        break;
      case FRACTION:
        numerator = ((Ast.Fraction) node).numerator;
        denominator = ((Ast.Fraction) node).denominator;
        break;
      default:
        return null;
    }
    if (!Asts.isConstant(denominator)) {
      return null;
    }
    final @Nullable Rational d =
        context.normalizer().expand(denominator).rationalValue();
    if (d == null || d.isZero()) {
      return null;
    }
    final AstNode factored = factorNode(numerator, context, depth + 1, run);
    if (Asts.canonical(factored).equals(Asts.canonical(numerator))) {
      return node;
    }
    return combine(ImmutableList.of(ast.number(d.reciprocal()), factored),
        context);
  }

  private AstNode combine(List<AstNode> factors,
      FactorizationContext context) {
    return new Products(context).combine(factors);
  }

  /** Whether a tree is a product, a negation, or a non-constant base raised
   * to an integer power of at least 2. */
  static boolean isProduct(AstNode node) {
    return node.op == Op.TIMES
        || (node.op == Op.NEGATE && !Asts.isConstant(node))
        || integerExponent(node) != null;
  }

  /** Returns the exponent if a tree is a non-constant base raised to an
   * integer power of at least 2, otherwise null. */
  static @Nullable Integer integerExponent(AstNode node) {
    if (node.op != Op.POWER) {
      return null;
    }
    final Ast.BinaryExpression power = (Ast.BinaryExpression) node;
    final @Nullable Integer e = Asts.intValue(power.right);
    return e != null && e >= 2 && !Asts.isConstant(power.left) ? e : null;
  }

  /** Mutable state of one call to {@link #factor}. */
  private static class Run {
    /** Statuses that explain an unchanged tree, most informative first. */
    static final List<FactorizationResult.Status> UNCHANGED_STATUSES =
        ImmutableList.of(FactorizationResult.Status.IRREDUCIBLE,
            FactorizationResult.Status.VERIFICATION_FAILURE,
            FactorizationResult.Status.INTERNAL_ERROR,
            FactorizationResult.Status.NO_PROGRESS);

    final List<String> steps = new ArrayList<>();
    final Set<FactorizationResult.Status> seen =
        EnumSet.noneOf(FactorizationResult.Status.class);
    @Nullable String strategyUsed;

    /** Returns the status to report if the tree did not change. */
    FactorizationResult.Status unchangedStatus() {
      for (FactorizationResult.Status status : UNCHANGED_STATUSES) {
        if (seen.contains(status)) {
          return status;
        }
      }
      return FactorizationResult.Status.NOT_APPLICABLE;
    }
  }
}

// End Factorizer.java
