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

import static net.hydromatic.focus.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Op;
import net.hydromatic.focus.ast.Program;
import net.hydromatic.focus.eval.DefaultEvaluator;
import net.hydromatic.focus.eval.EvalResult;
import net.hydromatic.focus.eval.Evaluator;
import net.hydromatic.focus.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConditionClassifier}. */
public class ConditionClassifierTest {
  private final Core.IdPat xPat = core.idPat(PrimitiveType.INT, "x");
  private final Core.Id x = core.id(xPat);
  private final Evaluator evaluator = new DefaultEvaluator(Program.of());
  private final List<EvalResult.Failure> failures = new ArrayList<>();
  private final List<String> classifications = new ArrayList<>();
  private final Tracer tracer =
      Tracers.withOnClassification(
          Tracers.withOnEvalFailure(Tracers.empty(), failures::add),
          (exp, c) -> classifications.add(exp + ": " + c));

  private ConditionClassifier classifier(int... xs) {
    final ImmutableList.Builder<Example> b = ImmutableList.builder();
    for (int x : xs) {
      b.add(Example.of(ImmutableList.of(x)));
    }
    return new ConditionClassifier(ImmutableList.of(xPat), b.build(), tracer);
  }

  private Core.Exp gt(int i) {
    return core.greaterThan(x, core.intLiteral(i));
  }

  @Test
  void testClassify() {
    final ConditionClassifier classifier = classifier(3, 5);
    assertThat(classifier.classify(gt(0), evaluator),
        is(Classification.ALWAYS_TRUE));
    assertThat(classifier.classify(gt(10), evaluator),
        is(Classification.ALWAYS_FALSE));
    assertThat(classifier.classify(gt(4), evaluator),
        is(Classification.INDETERMINATE));
    assertThat(classifications,
        hasToString("[x > 0: ALWAYS_TRUE, x > 10: ALWAYS_FALSE, "
            + "x > 4: INDETERMINATE]"));
  }

  /** Tests that evaluation failures and non-boolean values make the
   * result indeterminate. */
  @Test
  void testClassifyFailure() {
    final ConditionClassifier classifier = classifier(5, 3);
    // "10 div (x - 3) > 0" is true for 5, fails for 3
    final Core.Exp exp =
        core.greaterThan(
            core.call2(Op.DIV, core.intLiteral(10),
                core.minus(x, core.intLiteral(3))),
            core.intLiteral(0));
    assertThat(classifier.classify(exp, evaluator),
        is(Classification.INDETERMINATE));
    assertThat(failures, hasSize(1));
    assertThat(failures.get(0),
        hasToString("RUNTIME_ERROR(division by zero)"));

    assertThat(
        classifier.classify(core.plus(x, core.intLiteral(1)), evaluator),
        is(Classification.INDETERMINATE));

    // With no examples, nothing can be concluded
    assertThat(classifier().classify(gt(0), evaluator),
        is(Classification.INDETERMINATE));
  }

  @Test
  void testExistsFailing() {
    final ConditionClassifier classifier = classifier(3, 5);
    assertThat(classifier.existsFailing(gt(4), evaluator), is(true));
    assertThat(classifier.existsFailing(gt(10), evaluator), is(false));
    final Core.Exp divByZero =
        core.greaterThan(core.call2(Op.DIV, x, core.intLiteral(0)),
            core.intLiteral(0));
    assertThat(classifier.existsFailing(divByZero, evaluator), is(true));
    assertThat(classifier().existsFailing(gt(0), evaluator), is(false));
  }
}

// End ConditionClassifierTest.java
