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

/**
 * Way of factoring a tree.
 *
 * <p>A strategy must not modify its arguments, and any tree it returns as
 * changed must expand to the same polynomial as its input.
 */
public interface Strategy {
  /** Short unique name, such as "quadratic". */
  String name();

  String description();

  /** Strategies of higher priority are tried first. */
  int priority();

  /** Returns whether this strategy might factor the tree. Must be cheap and
   * must not throw. */
  boolean canApply(AstNode node, FactorizationContext context);

  /** Attempts to factor the tree. */
  FactorizationResult apply(AstNode node, FactorizationContext context);
}

// End Strategy.java
