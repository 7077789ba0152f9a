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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration property of the factorization engine.
 *
 * <p>Values live in a {@code Map<FactorProp, Object>}; a property absent from
 * the map has its default value.
 *
 * @see Factorizer#create(Map)
 */
public enum FactorProp {
  /** Integer property "maxIterations" is the number of rewrites the
   * dispatcher applies to a tree before it stops. Default is 10. */
  MAX_ITERATIONS("maxIterations", Integer.class, 10),

  /**
   * Boolean property "verify" controls whether the dispatcher expands each
   * rewritten tree and checks that it equals the original. If a rewrite fails
   * the check it is rejected. Default is true.
   */
  VERIFY("verify", Boolean.class, true),

  /**
   * Boolean property "allowIrrationalFactors" controls whether strategies may
   * produce factors with square roots, such as
   * {@code x^2 - (3 + sqrt(5)) / 2}. Default is false: factors are over the
   * rationals.
   */
  ALLOW_IRRATIONAL_FACTORS("allowIrrationalFactors", Boolean.class, false),

  /** Boolean property "useAlgebraic" controls whether the integer
   * factorization strategy is registered. Default is true. */
  USE_ALGEBRAIC("useAlgebraic", Boolean.class, true),

  /** Boolean property "useLattice" controls whether the integer
   * factorizer may use lattice reduction. Default is true. */
  USE_LATTICE("useLattice", Boolean.class, true),

  /**
   * Integer property "latticeThreshold" is the largest number of modular
   * factors that the integer factorizer recombines by trying subsets; above
   * it, if {@link #USE_LATTICE} is set, it uses lattice reduction. Default
   * is 8.
   */
  LATTICE_THRESHOLD("latticeThreshold", Integer.class, 8),

  /** Integer property "maxAlgebraicDegree" is the largest degree that the
   * integer factorization strategy attempts. Default is 24. */
  MAX_ALGEBRAIC_DEGREE("maxAlgebraicDegree", Integer.class, 24),

  /** Integer property "primeTrials" is the number of primes the integer
   * factorizer compares. Default is 5. */
  PRIME_TRIALS("primeTrials", Integer.class, 5),

  /**
   * Integer property "rationalRootLimit" is the largest magnitude of leading
   * coefficient and constant term for which the rational root search
   * enumerates divisors. Default is 1,000,000.
   */
  RATIONAL_ROOT_LIMIT("rationalRootLimit", Integer.class, 1_000_000),

  /** Integer property "maxPerfectPowerDegree" is the largest degree that the
   * perfect power strategy recognizes. Default is 8. */
  MAX_PERFECT_POWER_DEGREE("maxPerfectPowerDegree", Integer.class, 8),

  /** Integer property "maxExpansionPower" is the largest power of a sum that
   * the normalizer multiplies out. Default is 32. */
  MAX_EXPANSION_POWER("maxExpansionPower", Integer.class, 32);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  FactorProp(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the value of a property. */
  public Object get(Map<FactorProp, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<FactorProp, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<FactorProp, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property, or removes it if the value is null.
   * Checks that its type is valid. */
  public void set(Map<FactorProp, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End FactorProp.java
