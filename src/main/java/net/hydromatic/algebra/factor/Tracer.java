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

import net.hydromatic.algebra.ast.AstNode;

/** Called by the factorizer at interesting moments; the engine's only
 * window for observers, such as tests and step-by-step displays. */
public interface Tracer {
  /** Called before a strategy is applied to a tree. */
  void onAttempt(Strategy strategy, AstNode node);

  /** Called when a strategy's rewrite is accepted. */
  void onApplied(Strategy strategy, AstNode before, AstNode after);

  /**
   * Called when a strategy leaves a tree unchanged, or its rewrite is
   * rejected; {@code status} says why.
   */
  void onRejected(Strategy strategy, AstNode node,
      FactorizationResult.Status status);

  /** Called when a strategy throws. The factorizer carries on with the next
   * strategy. */
  void onError(FactorException e);
}

// End Tracer.java
