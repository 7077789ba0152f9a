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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import net.hydromatic.algebra.util.Rational;

/** Various sub-classes of expression tree nodes. */
public class Ast {
  private Ast() {}

  /** Numeric literal.
   *
   * <p>The value is exact; "0.25" is held as the decimal 0.25, and
   * {@link #rational()} converts it to 1/4. */
  public static class NumberLiteral extends AstNode {
    public final BigDecimal value;

    NumberLiteral(BigDecimal value) {
      super(Op.NUMBER_LITERAL);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.stripTrailingZeros().hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NumberLiteral
              && value.compareTo(((NumberLiteral) o).value) == 0;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final String s = value.stripTrailingZeros().toPlainString();
      if (value.signum() < 0
          && (left > Op.NEGATE.left || Op.NEGATE.right < right)) {
        return w.append("(").append(s).append(")");
      }
      return w.append(s);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Returns the value as an exact rational. */
    public Rational rational() {
      return Rational.of(value);
    }

    public boolean isInteger() {
      return value.signum() == 0
          || value.stripTrailingZeros().scale() <= 0;
    }
  }

  /** Named symbol, such as "x". */
  public static class Identifier extends AstNode {
    public final String name;

    Identifier(String name) {
      super(Op.IDENTIFIER);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty identifier");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Identifier && name.equals(((Identifier) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Call to an infix operator: one of {@code + - * / ^}. */
  public static class BinaryExpression extends AstNode {
    public final AstNode left;
    public final AstNode right;

    BinaryExpression(Op op, AstNode left, AstNode right) {
      super(op);
      checkArgument(
          op == Op.PLUS
              || op == Op.MINUS
              || op == Op.TIMES
              || op == Op.DIVIDE
              || op == Op.POWER,
          "not a binary operator: %s",
          op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BinaryExpression
              && op == ((BinaryExpression) o).op
              && left.equals(((BinaryExpression) o).left)
              && right.equals(((BinaryExpression) o).right);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code BinaryExpression} with given operands
     * and same operator, or {@code this} if the operands are the same. */
    public BinaryExpression copy(AstNode left, AstNode right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : new BinaryExpression(op, left, right);
    }
  }

  /** Call to a prefix operator, "-" or "+". */
  public static class UnaryExpression extends AstNode {
    public final AstNode operand;

    UnaryExpression(Op op, AstNode operand) {
      super(op);
      checkArgument(op == Op.NEGATE || op == Op.POSITIVE);
      this.operand = requireNonNull(operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof UnaryExpression
              && op == ((UnaryExpression) o).op
              && operand.equals(((UnaryExpression) o).operand);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, operand, right);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code UnaryExpression} with a given operand,
     * or {@code this} if the operand is the same. */
    public UnaryExpression copy(AstNode operand) {
      return this.operand.equals(operand)
          ? this
          : new UnaryExpression(op, operand);
    }
  }

  /** Call to a named function, such as "sqrt(2)" or "sin(x)". */
  public static class FunctionCall extends AstNode {
    public final String name;
    public final ImmutableList<AstNode> args;

    FunctionCall(String name, ImmutableList<AstNode> args) {
      super(Op.FUNCTION_CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionCall
              && name.equals(((FunctionCall) o).name)
              && args.equals(((FunctionCall) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.call(name, args);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code FunctionCall} with given arguments,
     * or {@code this} if the arguments are the same. */
    public FunctionCall copy(List<AstNode> args) {
      return this.args.equals(args)
          ? this
          : ast.call(name, args);
    }
  }

  /** Fraction, "numerator / denominator". */
  public static class Fraction extends AstNode {
    public final AstNode numerator;
    public final AstNode denominator;

    Fraction(AstNode numerator, AstNode denominator) {
      super(Op.FRACTION);
      this.numerator = requireNonNull(numerator);
      this.denominator = requireNonNull(denominator);
    }

    @Override
    public int hashCode() {
      return Objects.hash(numerator, denominator);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fraction
              && numerator.equals(((Fraction) o).numerator)
              && denominator.equals(((Fraction) o).denominator);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, numerator, op, denominator, right);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Fraction} with given contents,
     * or {@code this} if the contents are the same. */
    public Fraction copy(AstNode numerator, AstNode denominator) {
      return this.numerator.equals(numerator)
          && this.denominator.equals(denominator)
          ? this
          : new Fraction(numerator, denominator);
    }
  }
}

// End Ast.java
