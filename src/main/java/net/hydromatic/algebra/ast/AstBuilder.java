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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.algebra.util.Rational;

/** Builds expression tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  public Ast.NumberLiteral number(long value) {
    return new Ast.NumberLiteral(BigDecimal.valueOf(value));
  }

  public Ast.NumberLiteral number(BigInteger value) {
    return new Ast.NumberLiteral(new BigDecimal(value));
  }

  public Ast.NumberLiteral number(BigDecimal value) {
    return new Ast.NumberLiteral(value);
  }

  /** Creates a literal for an integer, or a fraction of two literals. A
   * negative fraction carries its sign on the numerator. */
  public AstNode number(Rational value) {
    if (value.isInteger()) {
      return number(value.numerator);
    }
    return fraction(number(value.numerator), number(value.denominator));
  }

  public Ast.Identifier id(String name) {
    return new Ast.Identifier(name);
  }

  public Ast.BinaryExpression binary(Op op, AstNode left, AstNode right) {
    return new Ast.BinaryExpression(op, left, right);
  }

  /** Creates a binary expression from an operator symbol such as "+". */
  public Ast.BinaryExpression binary(
      String symbol, AstNode left, AstNode right) {
    return binary(Op.binary(symbol), left, right);
  }

  public Ast.BinaryExpression plus(AstNode left, AstNode right) {
    return binary(Op.PLUS, left, right);
  }

  public Ast.BinaryExpression minus(AstNode left, AstNode right) {
    return binary(Op.MINUS, left, right);
  }

  public Ast.BinaryExpression times(AstNode left, AstNode right) {
    return binary(Op.TIMES, left, right);
  }

  public Ast.BinaryExpression divide(AstNode left, AstNode right) {
    return binary(Op.DIVIDE, left, right);
  }

  public Ast.BinaryExpression power(AstNode base, AstNode exponent) {
    return binary(Op.POWER, base, exponent);
  }

  /** Creates "base ^ exponent"; returns the base if the exponent is 1. */
  public AstNode power(AstNode base, int exponent) {
    checkArgument(exponent >= 1, "bad exponent %s", exponent);
    return exponent == 1 ? base : power(base, number(exponent));
  }

  public Ast.UnaryExpression negate(AstNode operand) {
    return new Ast.UnaryExpression(Op.NEGATE, operand);
  }

  public Ast.UnaryExpression positive(AstNode operand) {
    return new Ast.UnaryExpression(Op.POSITIVE, operand);
  }

  public Ast.Fraction fraction(AstNode numerator, AstNode denominator) {
    return new Ast.Fraction(numerator, denominator);
  }

  public Ast.FunctionCall call(String name, List<? extends AstNode> args) {
    return new Ast.FunctionCall(name, ImmutableList.copyOf(args));
  }

  public Ast.FunctionCall call(String name, AstNode... args) {
    return call(name, ImmutableList.copyOf(args));
  }

  /** Creates "sqrt(radicand)". */
  public Ast.FunctionCall sqrt(AstNode radicand) {
    return call("sqrt", radicand);
  }

  /** Creates a left-deep chain of multiplications. Returns the literal 1 if
   * the list is empty. */
  public AstNode product(List<? extends AstNode> factors) {
    if (factors.isEmpty()) {
      return number(1);
    }
    AstNode node = factors.get(0);
    for (int i = 1; i < factors.size(); i++) {
      node = times(node, factors.get(i));
    }
    return node;
  }

  /**
   * Creates a left-deep chain of additions. A term that is a negation, or a
   * negative number, is subtracted rather than added. Returns the literal 0
   * if the list is empty.
   */
  public AstNode sum(List<? extends AstNode> terms) {
    if (terms.isEmpty()) {
      return number(0);
    }
    AstNode node = terms.get(0);
    for (int i = 1; i < terms.size(); i++) {
      final AstNode term = terms.get(i);
      if (term instanceof Ast.UnaryExpression && term.op == Op.NEGATE) {
        node = minus(node, ((Ast.UnaryExpression) term).operand);
      } else if (term instanceof Ast.NumberLiteral
          && ((Ast.NumberLiteral) term).value.signum() < 0) {
        node = minus(node, number(((Ast.NumberLiteral) term).value.negate()));
      } else {
        node = plus(node, term);
      }
    }
    return node;
  }

  /** Creates {@code coefficient * node}, omitting a coefficient of 1 and
   * negating for a coefficient of -1. */
  public AstNode scale(Rational coefficient, AstNode node) {
    if (coefficient.isOne()) {
      return node;
    }
    if (coefficient.equals(Rational.MINUS_ONE)) {
      return negate(node);
    }
    return times(number(coefficient), node);
  }
}

// End AstBuilder.java
