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
package net.hydromatic.focus.synth;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.eval.EvalResult;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on an instantiation,
   * then calls the underlying tracer. */
  public static Tracer withOnInstantiation(Tracer tracer,
      Consumer<RuleInstantiation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInstantiation(RuleInstantiation instantiation) {
        consumer.accept(instantiation);
        super.onInstantiation(instantiation);
      }
    };
  }

  /** Returns a tracer that performs the given action on a classification,
   * then calls the underlying tracer. */
  public static Tracer withOnClassification(Tracer tracer,
      BiConsumer<Core.Exp, Classification> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onClassification(Core.Exp exp,
          Classification classification) {
        consumer.accept(exp, classification);
        super.onClassification(exp, classification);
      }
    };
  }

  /** Returns a tracer that performs the given action on an evaluation
   * failure, then calls the underlying tracer. */
  public static Tracer withOnEvalFailure(Tracer tracer,
      Consumer<EvalResult.Failure> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onEvalFailure(Core.Exp exp, List<Object> ins,
          EvalResult.Failure failure) {
        consumer.accept(failure);
        super.onEvalFailure(exp, ins, failure);
      }
    };
  }

  /** Returns a tracer that performs the given action when a problem is
   * rejected because of its parent node, then calls the underlying
   * tracer. */
  public static Tracer withOnReentryRejected(Tracer tracer,
      Consumer<SearchNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReentryRejected(Problem problem, SearchNode parentNode) {
        consumer.accept(parentNode);
        super.onReentryRejected(problem, parentNode);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onInstantiation(RuleInstantiation instantiation) {}

    @Override
    public void onClassification(Core.Exp exp,
        Classification classification) {}

    @Override
    public void onEvalFailure(Core.Exp exp, List<Object> ins,
        EvalResult.Failure failure) {}

    @Override
    public void onReentryRejected(Problem problem, SearchNode parentNode) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onInstantiation(RuleInstantiation instantiation) {
      tracer.onInstantiation(instantiation);
    }

    @Override
    public void onClassification(Core.Exp exp,
        Classification classification) {
      tracer.onClassification(exp, classification);
    }

    @Override
    public void onEvalFailure(Core.Exp exp, List<Object> ins,
        EvalResult.Failure failure) {
      tracer.onEvalFailure(exp, ins, failure);
    }

    @Override
    public void onReentryRejected(Problem problem, SearchNode parentNode) {
      tracer.onReentryRejected(problem, parentNode);
    }
  }
}

// End Tracers.java
