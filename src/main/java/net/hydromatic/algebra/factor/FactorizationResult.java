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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.algebra.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of applying a strategy, or of the whole factorization. */
public class FactorizationResult {
  /** Whether the tree was factored. */
  public final boolean success;
  /** Whether {@link #ast} differs from the input. */
  public final boolean changed;
  public final AstNode ast;
  /** Human-readable description of each step, in order. */
  public final ImmutableList<String> steps;
  /** Name of the last strategy that changed the tree, or null. */
  public final @Nullable String strategyUsed;
  /** Whether the factors of {@link #ast} may be factored further. */
  public final boolean canContinue;
  public final Status status;

  public FactorizationResult(boolean success, boolean changed, AstNode ast,
      List<String> steps, @Nullable String strategyUsed, boolean canContinue,
      Status status) {
    this.success = success;
    this.changed = changed;
    this.ast = requireNonNull(ast);
    this.steps = ImmutableList.copyOf(steps);
    this.strategyUsed = strategyUsed;
    this.canContinue = canContinue;
    this.status = requireNonNull(status);
  }

  /** Creates a result for a strategy that rewrote a tree. */
  public static FactorizationResult factored(String strategy, AstNode ast,
      List<String> steps) {
    return new FactorizationResult(true, true, ast, steps, strategy, true,
        Status.FACTORED);
  }

  /** Creates a result for a strategy that rewrote a tree into factors that
   * should not be factored further. */
  public static FactorizationResult factoredFinal(String strategy,
      AstNode ast, List<String> steps) {
    return new FactorizationResult(true, true, ast, steps, strategy, false,
        Status.FACTORED);
  }

  /** Creates a result that leaves a tree unchanged. */
  public static FactorizationResult unchanged(AstNode ast, Status status,
      List<String> steps) {
    return new FactorizationResult(false, false, ast, steps, null, true,
        status);
  }

  public static FactorizationResult notApplicable(AstNode ast) {
    return unchanged(ast, Status.NOT_APPLICABLE, ImmutableList.of());
  }

  @Override
  public String toString() {
    return "{status=" + status
        + ", ast=" + ast
        + (strategyUsed == null ? "" : ", strategy=" + strategyUsed)
        + ", steps=" + steps.size() + "}";
  }

  /** Why a result is as it is. */
  public enum Status {
    /** The tree was rewritten as a product. */
    FACTORED,
    /** The strategy does not recognize the tree. */
    NOT_APPLICABLE,
    /** The rewrite is the same as the input, or as an earlier tree. */
    NO_PROGRESS,
    /** The rewrite does not expand to the same polynomial as the input. */
    VERIFICATION_FAILURE,
    /** The polynomial is irreducible over the integers. */
    IRREDUCIBLE,
    /** The strategy threw. */
    INTERNAL_ERROR
  }
}

// End FactorizationResult.java
