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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.poly.Normalizer;
import net.hydromatic.algebra.poly.Polynomial;
import net.hydromatic.algebra.poly.PolynomialAnalyzer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Immutable state shared by strategies while factoring a tree. */
public class FactorizationContext {
  /** Variable that polynomials are in; other identifiers are coefficients. */
  public final String variable;
  public final int currentIteration;
  public final int maxIterations;
  public final ImmutableMap<FactorProp, Object> props;
  public final PolynomialAnalyzer analyzer;

  public FactorizationContext(String variable, int currentIteration,
      int maxIterations, Map<FactorProp, Object> props,
      PolynomialAnalyzer analyzer) {
    checkArgument(currentIteration >= 0 && maxIterations >= 0,
        "bad iteration %s of %s", currentIteration, maxIterations);
    this.variable = requireNonNull(variable);
    this.currentIteration = currentIteration;
    this.maxIterations = maxIterations;
    this.props = ImmutableMap.copyOf(props);
    this.analyzer = requireNonNull(analyzer);
  }

  /** Returns a copy with a given iteration, or this context if the
   * iteration is the same. */
  public FactorizationContext withIteration(int currentIteration) {
    return currentIteration == this.currentIteration
        ? this
        : new FactorizationContext(variable, currentIteration, maxIterations,
            props, analyzer);
  }

  public Normalizer normalizer() {
    return analyzer.normalizer();
  }

  public boolean booleanProp(FactorProp prop) {
    return prop.booleanValue(props);
  }

  public int intProp(FactorProp prop) {
    return prop.intValue(props);
  }

  /** Returns the polynomial view of a tree in the context's variable, or
   * null. */
  public PolynomialAnalyzer.@Nullable PolynomialInfo info(AstNode node) {
    return analyzer.analyzePolynomial(node, variable);
  }

  /** Returns the tree as a univariate polynomial with rational coefficients
   * in the context's variable, or null. */
  public @Nullable Polynomial polynomial(AstNode node) {
    return analyzer.univariate(node, variable);
  }
}

// End FactorizationContext.java
