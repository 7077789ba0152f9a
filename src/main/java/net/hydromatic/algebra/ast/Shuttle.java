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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms expression trees.
 *
 * <p>Each method returns the node unchanged if none of its children changed,
 * so unchanged subtrees are shared between the input and output trees.
 */
public class Shuttle {
  protected List<AstNode> visitList(List<AstNode> nodes) {
    final List<AstNode> list = new ArrayList<>();
    for (AstNode node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  protected AstNode visit(Ast.NumberLiteral literal) {
    return literal; // leaf
  }

  protected AstNode visit(Ast.Identifier id) {
    return id; // leaf
  }

  protected AstNode visit(Ast.BinaryExpression binary) {
    return binary.copy(binary.left.accept(this), binary.right.accept(this));
  }

  protected AstNode visit(Ast.UnaryExpression unary) {
    return unary.copy(unary.operand.accept(this));
  }

  protected AstNode visit(Ast.FunctionCall call) {
    return call.copy(visitList(call.args));
  }

  protected AstNode visit(Ast.Fraction fraction) {
    return fraction.copy(
        fraction.numerator.accept(this), fraction.denominator.accept(this));
  }
}

// End Shuttle.java
