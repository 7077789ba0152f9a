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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.algebra.ast.AstNode;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action when a strategy is
   * attempted, then calls the underlying tracer. */
  public static Tracer withOnAttempt(Tracer tracer,
      BiConsumer<Strategy, AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAttempt(Strategy strategy, AstNode node) {
        consumer.accept(strategy, node);
        super.onAttempt(strategy, node);
      }
    };
  }

  /** Returns a tracer that performs the given action on each accepted
   * rewrite, then calls the underlying tracer. */
  public static Tracer withOnApplied(Tracer tracer,
      BiConsumer<Strategy, AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onApplied(Strategy strategy, AstNode before,
          AstNode after) {
        consumer.accept(strategy, after);
        super.onApplied(strategy, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on the status of each
   * rejection, then calls the underlying tracer. */
  public static Tracer withOnRejected(Tracer tracer,
      Consumer<FactorizationResult.Status> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRejected(Strategy strategy, AstNode node,
          FactorizationResult.Status status) {
        consumer.accept(status);
        super.onRejected(strategy, node, status);
      }
    };
  }

  public static Tracer withOnError(Tracer tracer,
      Consumer<FactorException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onError(FactorException e) {
        consumer.accept(e);
        super.onError(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onAttempt(Strategy strategy, AstNode node) {
    }

    @Override public void onApplied(Strategy strategy, AstNode before,
        AstNode after) {
    }

    @Override public void onRejected(Strategy strategy, AstNode node,
        FactorizationResult.Status status) {
    }

    @Override public void onError(FactorException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onAttempt(Strategy strategy, AstNode node) {
      tracer.onAttempt(strategy, node);
    }

    @Override public void onApplied(Strategy strategy, AstNode before,
        AstNode after) {
      tracer.onApplied(strategy, before, after);
    }

    @Override public void onRejected(Strategy strategy, AstNode node,
        FactorizationResult.Status status) {
      tracer.onRejected(strategy, node, status);
    }

    @Override public void onError(FactorException e) {
      tracer.onError(e);
    }
  }
}

// End Tracers.java
