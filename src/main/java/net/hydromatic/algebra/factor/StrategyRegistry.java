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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import net.hydromatic.algebra.factor.strategy.BinomialPowerStrategy;
import net.hydromatic.algebra.factor.strategy.CommonFactorStrategy;
import net.hydromatic.algebra.factor.strategy.CubicStrategy;
import net.hydromatic.algebra.factor.strategy.DifferenceOfSquaresStrategy;
import net.hydromatic.algebra.factor.strategy.ExponentSubstitutionStrategy;
import net.hydromatic.algebra.factor.strategy.GroupingStrategy;
import net.hydromatic.algebra.factor.strategy.IntegerFactorStrategy;
import net.hydromatic.algebra.factor.strategy.PerfectPowerStrategy;
import net.hydromatic.algebra.factor.strategy.QuadraticStrategy;
import net.hydromatic.algebra.factor.strategy.QuarticStrategy;
import net.hydromatic.algebra.integer.IntegerFactorizer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered collection of strategies.
 *
 * <p>Strategies are sorted by descending priority; strategies of equal
 * priority stay in the order they were registered. Immutable.
 */
public class StrategyRegistry {
  private static final Comparator<Strategy> BY_PRIORITY =
      Comparator.comparingInt(Strategy::priority).reversed();

  /** Strategies in registration order. */
  private final ImmutableList<Strategy> registered;
  /** Strategies in the order they are tried. */
  private final ImmutableList<Strategy> strategies;

  public StrategyRegistry(List<? extends Strategy> strategies) {
    this.registered = ImmutableList.copyOf(strategies);
    final List<Strategy> list = new ArrayList<>(registered);
    list.sort(BY_PRIORITY); // List.sort is stable
    this.strategies = ImmutableList.copyOf(list);
  }

  /** Creates a registry of the built-in strategies, configured by a map of
   * properties. */
  public static StrategyRegistry standard(Map<FactorProp, Object> props) {
    final List<Strategy> list = new ArrayList<>();
    list.add(new DifferenceOfSquaresStrategy());
    list.add(new CommonFactorStrategy());
    list.add(new PerfectPowerStrategy());
    list.add(new ExponentSubstitutionStrategy());
    list.add(new QuarticStrategy());
    list.add(new QuadraticStrategy());
    list.add(new GroupingStrategy());
    list.add(new CubicStrategy());
    list.add(new BinomialPowerStrategy());
    if (FactorProp.USE_ALGEBRAIC.booleanValue(props)) {
      list.add(
          new IntegerFactorStrategy(
              new IntegerFactorizer(FactorProp.PRIME_TRIALS.intValue(props),
                  FactorProp.USE_LATTICE.booleanValue(props),
                  FactorProp.LATTICE_THRESHOLD.intValue(props))));
    }
    return new StrategyRegistry(list);
  }

  /** Returns the strategies in the order they are tried. */
  public List<Strategy> strategies() {
    return strategies;
  }

  /** Returns a registry with one more strategy. */
  public StrategyRegistry plus(Strategy strategy) {
    return new StrategyRegistry(
        ImmutableList.<Strategy>builder().addAll(registered).add(strategy)
            .build());
  }

  /** Returns a registry without the strategy of a given name. */
  public StrategyRegistry minus(String name) {
    final List<Strategy> list = new ArrayList<>(registered);
    list.removeIf(strategy -> strategy.name().equals(name));
    return new StrategyRegistry(list);
  }

  /** Returns the strategy with a given name, or null. */
  public @Nullable Strategy get(String name) {
    for (Strategy strategy : strategies) {
      if (strategy.name().equals(name)) {
        return strategy;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("[");
    for (Strategy strategy : strategies) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(strategy.name()).append(':').append(strategy.priority());
    }
    return b.append(']').toString();
  }
}

// End StrategyRegistry.java
