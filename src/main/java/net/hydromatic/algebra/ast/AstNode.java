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
package net.hydromatic.algebra.ast;

import static java.util.Objects.requireNonNull;

/** Expression tree node. */
public abstract class AstNode {
  public final Op op;

  AstNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into infix notation.
   *
   * <p>Parentheses are inserted only where operator precedence requires
   * them, so the result can be compared in tests.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter(), 0, 0).toString();
  }

  abstract AstWriter unparse(AstWriter w, int left, int right);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result.
   */
  public abstract AstNode accept(Shuttle shuttle);

  /** Returns whether this node is a binary expression with a given
   * operator. */
  public boolean isBinary(Op op) {
    return this instanceof Ast.BinaryExpression && this.op == op;
  }

  /** Returns whether this node is a sum or difference. */
  public boolean isAdditive() {
    return isBinary(Op.PLUS) || isBinary(Op.MINUS);
  }
}

// End AstNode.java
