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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // atoms
  NUMBER_LITERAL(true),
  IDENTIFIER(true),
  FUNCTION_CALL(true),

  // infix operators
  PLUS(" + ", 6, "+"),
  MINUS(" - ", 6, "-"),
  TIMES(" * ", 7, "*"),
  DIVIDE(" / ", 7, "/"),
  /** Numerator over denominator; prints like {@link #DIVIDE}. */
  FRACTION(" / ", 7, null),
  POWER("^", 8, false),

  // prefix operators
  NEGATE("-", 14, 14),
  POSITIVE("+", 14, 14);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;
  /** Operator symbol as written in a tree built by the parser, or null. */
  public final @Nullable String symbol;

  /** Binary operators, keyed by symbol. */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    b.put("+", PLUS);
    b.put("-", MINUS);
    b.put("*", TIMES);
    b.put("/", DIVIDE);
    b.put("^", POWER);
    BY_SYMBOL = b.build();
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence, @Nullable String symbol) {
    this(padded, precedence * 2, precedence * 2 + 1, symbol);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0),
        padded.trim());
  }

  Op(String padded, int left, int right) {
    this(padded, left, right, padded.trim());
  }

  Op(String padded, int left, int right, @Nullable String symbol) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.symbol = symbol;
  }

  /** Whether the operator is commutative, so that operand order does not
   * matter when comparing trees. */
  public boolean isCommutative() {
    return this == PLUS || this == TIMES;
  }

  /** Looks up a binary operator by symbol. Throws if not found; never returns
   * null. */
  public static Op binary(String symbol) {
    final Op op = BY_SYMBOL.get(symbol);
    if (op == null) {
      throw new IllegalArgumentException("unknown operator " + symbol);
    }
    return op;
  }
}

// End Op.java
