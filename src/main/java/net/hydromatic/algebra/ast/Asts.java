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

import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for expression trees. */
public abstract class Asts {
  private Asts() {}

  private static final Comparator<AstNode> BY_STRING =
      Comparator.comparing(AstNode::toString);

  /**
   * Returns the canonical form of a tree.
   *
   * <p>Chains of a commutative operator ({@code +} or {@code *}) are
   * flattened, their operands canonicalized and sorted, and the chain rebuilt
   * left-deep. Two trees that differ only in the order of operands of
   * commutative operators have equal canonical forms.
   */
  public static AstNode canonical(AstNode node) {
    return node.accept(CanonicalShuttle.INSTANCE);
  }

  /** Returns whether two trees are equal modulo the order of operands of
   * commutative operators. */
  public static boolean equivalent(AstNode a, AstNode b) {
    return a.equals(b) || canonical(a).equals(canonical(b));
  }

  /** Returns the operands of a chain of multiplications; a node that is not a
   * multiplication is a chain of one. */
  public static List<AstNode> factors(AstNode node) {
    final List<AstNode> list = new ArrayList<>();
    flatten(node, Op.TIMES, list);
    return ImmutableList.copyOf(list);
  }

  /** Returns the operands of a chain of a given binary operator. */
  public static List<AstNode> operands(AstNode node, Op op) {
    final List<AstNode> list = new ArrayList<>();
    flatten(node, op, list);
    return ImmutableList.copyOf(list);
  }

  private static void flatten(AstNode node, Op op, List<AstNode> list) {
    if (node.isBinary(op)) {
      final Ast.BinaryExpression binary = (Ast.BinaryExpression) node;
      flatten(binary.left, op, list);
      flatten(binary.right, op, list);
    } else {
      list.add(node);
    }
  }

  /** Returns whether a tree mentions a given identifier. */
  public static boolean contains(AstNode node, String name) {
    switch (node.op) {
      case IDENTIFIER:
        return ((Ast.Identifier) node).name.equals(name);
      case NUMBER_LITERAL:
        return false;
      case NEGATE:
      case POSITIVE:
        return contains(((Ast.UnaryExpression) node).operand, name);
      case FUNCTION_CALL:
        for (AstNode arg : ((Ast.FunctionCall) node).args) {
          if (contains(arg, name)) {
            return true;
          }
        }
        return false;
      case FRACTION:
        final Ast.Fraction fraction = (Ast.Fraction) node;
        return contains(fraction.numerator, name)
            || contains(fraction.denominator, name);
      default:
        final Ast.BinaryExpression binary = (Ast.BinaryExpression) node;
        return contains(binary.left, name) || contains(binary.right, name);
    }
  }

  /** Returns whether a tree contains no identifiers. */
  public static boolean isConstant(AstNode node) {
    switch (node.op) {
      case IDENTIFIER:
        return false;
      case NUMBER_LITERAL:
        return true;
      case NEGATE:
      case POSITIVE:
        return isConstant(((Ast.UnaryExpression) node).operand);
      case FUNCTION_CALL:
        for (AstNode arg : ((Ast.FunctionCall) node).args) {
          if (!isConstant(arg)) {
            return false;
          }
        }
        return true;
      case FRACTION:
        final Ast.Fraction fraction = (Ast.Fraction) node;
        return isConstant(fraction.numerator)
            && isConstant(fraction.denominator);
      default:
        final Ast.BinaryExpression binary = (Ast.BinaryExpression) node;
        return isConstant(binary.left) && isConstant(binary.right);
    }
  }

  /** Returns the value of a node that is an integer literal, or null. */
  public static @Nullable Integer intValue(AstNode node) {
    if (node instanceof Ast.NumberLiteral
        && ((Ast.NumberLiteral) node).isInteger()) {
      try {
        return ((Ast.NumberLiteral) node).value.intValueExact();
      } catch (ArithmeticException e) {
        // too large
        return null;
      }
    }
    return null;
  }

  /** Replaces every occurrence of an identifier. */
  public static AstNode substitute(
      AstNode node, String name, AstNode replacement) {
    return node.accept(
        new Shuttle() {
          @Override
          protected AstNode visit(Ast.Identifier id) {
            return id.name.equals(name) ? replacement : id;
          }
        });
  }

  /** Negates a tree, removing a double negation or negating a literal
   * directly. */
  public static AstNode negate(AstNode node) {
    if (node.op == Op.NEGATE) {
      return ((Ast.UnaryExpression) node).operand;
    }
    if (node instanceof Ast.NumberLiteral) {
      return ast.number(((Ast.NumberLiteral) node).value.negate());
    }
    return ast.negate(node);
  }

  /** Shuttle that converts a tree to canonical form. */
  private static class CanonicalShuttle extends Shuttle {
    static final CanonicalShuttle INSTANCE = new CanonicalShuttle();

    @Override
    protected AstNode visit(Ast.NumberLiteral literal) {
      return ast.number(literal.value.stripTrailingZeros());
    }

    @Override
    protected AstNode visit(Ast.BinaryExpression binary) {
      if (!binary.op.isCommutative()) {
        return super.visit(binary);
      }
      final List<AstNode> operands = new ArrayList<>();
      for (AstNode operand : operands(binary, binary.op)) {
        operands.add(operand.accept(this));
      }
      operands.sort(BY_STRING);
      AstNode node = operands.get(0);
      for (int i = 1; i < operands.size(); i++) {
        node = ast.binary(binary.op, node, operands.get(i));
      }
      return node;
    }
  }
}

// End Asts.java
