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
package net.hydromatic.focus.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Op;
import net.hydromatic.focus.ast.Program;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Evaluator in which one designated sub-expression is non-deterministic.
 *
 * <p>Each time evaluation reaches the designated expression {@code nd} (by
 * identity) it may yield either {@code true} or {@code false}; the evaluator
 * explores choices, {@code true} first. The exception is {@code not nd}, which
 * evaluates {@code nd} deterministically and negates the result.
 *
 * <p>The evaluator is angelic: its result is {@code true} if any sequence of
 * choices yields {@code true}. Otherwise it is the first successful result,
 * and if no sequence of choices succeeds, the first failure. */
public class AngelicEvaluator extends DefaultEvaluator {
  private final Core.Exp nd;

  public AngelicEvaluator(Program program, Core.Exp nd,
      Map<Prop, Object> props) {
    super(program, props);
    this.nd = requireNonNull(nd);
  }

  public AngelicEvaluator(Program program, Core.Exp nd) {
    this(program, nd, ImmutableMap.of());
  }

  @Override
  public EvalResult eval(Core.Exp exp, EvalEnv env) {
    final int choiceLimit = Prop.CHOICE_LIMIT.intValue(props);
    final Deque<ImmutableList<Boolean>> pending = new ArrayDeque<>();
    pending.push(ImmutableList.of());
    @Nullable EvalResult firstSuccess = null;
    @Nullable EvalResult firstFailure = null;
    while (!pending.isEmpty()) {
      final ImmutableList<Boolean> choices = pending.pop();
      final ChoosingInterpreter interpreter =
          new ChoosingInterpreter(choices);
      final EvalResult result;
      try {
        result = EvalResult.success(interpreter.eval(exp, env));
      } catch (NeedChoice e) {
        // This sequence of choices was too short. Try both extensions.
        if (choices.size() >= choiceLimit) {
          if (firstFailure == null) {
            firstFailure =
                EvalResult.failure(EvalException.Kind.EVALUATOR_ERROR,
                    "exceeded " + choiceLimit + " choices");
          }
        } else {
          pending.push(append(choices, false));
          pending.push(append(choices, true));
        }
        continue;
      } catch (EvalException e) {
        if (firstFailure == null) {
          firstFailure = EvalResult.failure(e);
        }
        continue;
      }
      if (Boolean.TRUE.equals(result.booleanValue())) {
        return result;
      }
      if (firstSuccess == null) {
        firstSuccess = result;
      }
    }
    if (firstSuccess != null) {
      return firstSuccess;
    }
    return requireNonNull(firstFailure);
  }

  private static ImmutableList<Boolean> append(List<Boolean> list,
      boolean b) {
    return ImmutableList.<Boolean>builder().addAll(list).add(b).build();
  }

  /** Thrown when evaluation reaches a choice point beyond the end of the
   * current sequence of choices. */
  private static class NeedChoice extends RuntimeException {
    NeedChoice() {
      super(null, null, false, false);
    }
  }

  /** Interpreter that follows a given sequence of choices. */
  private class ChoosingInterpreter extends Interpreter {
    private final List<Boolean> choices;
    private int next;

    ChoosingInterpreter(List<Boolean> choices) {
      super(AngelicEvaluator.this.program,
          Prop.MAX_STEPS.intValue(props),
          Prop.MAX_CALL_DEPTH.intValue(props));
      this.choices = choices;
    }

    @Override
    public Object eval(Core.Exp exp, EvalEnv env) {
      if (exp.op == Op.NOT && ((Core.Not) exp).exp == nd) {
        return !asBoolean(super.eval(nd, env));
      }
      if (exp == nd) {
        if (next >= choices.size()) {
          throw new NeedChoice();
        }
        return choices.get(next++);
      }
      return super.eval(exp, env);
    }
  }
}

// End AngelicEvaluator.java
