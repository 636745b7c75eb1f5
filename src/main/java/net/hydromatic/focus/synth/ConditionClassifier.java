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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.eval.EvalEnv;
import net.hydromatic.focus.eval.EvalEnvs;
import net.hydromatic.focus.eval.EvalResult;
import net.hydromatic.focus.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Evaluates boolean expressions against failing examples.
 *
 * <p>Evaluation failures never escape; they make the classification
 * {@link Classification#INDETERMINATE} and are reported to the tracer. */
public class ConditionClassifier {
  private final ImmutableList<Core.IdPat> inputs;
  private final ImmutableList<Example> examples;
  private final Tracer tracer;

  public ConditionClassifier(List<Core.IdPat> inputs, List<Example> examples,
      Tracer tracer) {
    this.inputs = ImmutableList.copyOf(inputs);
    this.examples = ImmutableList.copyOf(examples);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a classifier for the failing examples of a problem. */
  public static ConditionClassifier of(Problem problem, Tracer tracer) {
    return new ConditionClassifier(problem.inputs, problem.examples.invalids,
        tracer);
  }

  /** Classifies an expression: whether it evaluates to {@code true} on every
   * example, to {@code false} on every example, or neither.
   *
   * <p>If there are no examples, the result is
   * {@link Classification#INDETERMINATE}. */
  public Classification classify(Core.Exp exp, Evaluator evaluator) {
    final Classification classification = classify2(exp, evaluator);
    tracer.onClassification(exp, classification);
    return classification;
  }

  private Classification classify2(Core.Exp exp, Evaluator evaluator) {
    @Nullable Boolean soFar = null;
    for (Example example : examples) {
      final Boolean b = eval(exp, evaluator, example.ins);
      if (b == null || soFar != null && !soFar.equals(b)) {
        return Classification.INDETERMINATE;
      }
      soFar = b;
    }
    if (soFar == null) {
      return Classification.INDETERMINATE;
    }
    return soFar ? Classification.ALWAYS_TRUE : Classification.ALWAYS_FALSE;
  }

  /** Returns whether some example evaluates an expression to {@code true},
   * or fails to evaluate it to a boolean. */
  public boolean existsFailing(Core.Exp exp, Evaluator evaluator) {
    for (Example example : examples) {
      final Boolean b = eval(exp, evaluator, example.ins);
      if (b == null || b) {
        return true;
      }
    }
    return false;
  }

  /** Evaluates an expression on one row of inputs; returns null if
   * evaluation fails or the value is not a boolean. */
  private @Nullable Boolean eval(Core.Exp exp, Evaluator evaluator,
      List<Object> ins) {
    final EvalEnv env = EvalEnvs.of(inputs, ins);
    final EvalResult result = evaluator.eval(exp, env);
    if (!result.isSuccess()) {
      tracer.onEvalFailure(exp, ins, (EvalResult.Failure) result);
    }
    return result.booleanValue();
  }
}

// End ConditionClassifier.java
