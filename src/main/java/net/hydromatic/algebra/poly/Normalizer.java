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

import net.hydromatic.algebra.ast.AstNode;

/**
 * Brings expression trees to a normal form.
 *
 * <p>Factorization strategies use it to read a tree as a polynomial, and the
 * dispatcher uses it to check that every rewrite preserves the value of the
 * tree.
 */
public interface Normalizer {
  /** Expands a tree into a sum of monomials. Never throws for a well-formed
   * tree; parts it cannot expand become opaque atoms. */
  MultiPolynomial expand(AstNode node);

  /** Expands a tree and converts it back, ordering terms by descending
   * degree in {@code variable}. */
  default AstNode normalize(AstNode node, String variable) {
    return expand(node).toAst(variable);
  }

  /** Returns whether two trees have the same normal form. */
  default boolean equivalent(AstNode a, AstNode b) {
    return expand(a).equals(expand(b));
  }
}

// End Normalizer.java
