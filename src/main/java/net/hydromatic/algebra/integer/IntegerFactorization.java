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
package net.hydromatic.algebra.integer;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/** Factorization of an integer polynomial: a content and irreducible
 * factors with multiplicities. */
public class IntegerFactorization {
  /** Signed integer content. */
  public final BigInteger content;
  /** Primitive irreducible factors with positive leading coefficients,
   * ordered by degree. */
  public final ImmutableList<Factor> factors;
  /** How each factor was found, for display. */
  public final ImmutableList<String> steps;

  IntegerFactorization(BigInteger content, List<Factor> factors,
      List<String> steps) {
    this.content = requireNonNull(content);
    this.factors = ImmutableList.copyOf(factors);
    this.steps = ImmutableList.copyOf(steps);
  }

  /** Whether the polynomial is primitive and irreducible: one factor, of
   * multiplicity one, and content one. */
  public boolean isIrreducible() {
    return content.equals(BigInteger.ONE)
        && factors.size() == 1
        && factors.get(0).multiplicity == 1;
  }

  /** Returns the product of content and factors. */
  public BigPolynomial expand() {
    BigPolynomial p = BigPolynomial.of(ImmutableList.of(content));
    for (Factor factor : factors) {
      p = p.multiply(factor.polynomial.pow(factor.multiplicity));
    }
    return p;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(content);
    for (Factor factor : factors) {
      b.append(" * ").append(factor);
    }
    return b.toString();
  }

  /** Irreducible factor and its multiplicity. */
  public static class Factor {
    public final BigPolynomial polynomial;
    public final int multiplicity;

    Factor(BigPolynomial polynomial, int multiplicity) {
      this.polynomial = requireNonNull(polynomial);
      this.multiplicity = multiplicity;
    }

    @Override
    public String toString() {
      return "(" + polynomial + ")"
          + (multiplicity == 1 ? "" : "^" + multiplicity);
    }
  }
}

// End IntegerFactorization.java
