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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Program;

/** Deterministic evaluator.
 *
 * <p>Each call to {@link #eval} uses a fresh {@link Interpreter}, so the step
 * limit applies to each evaluation separately. */
public class DefaultEvaluator implements Evaluator {
  final Program program;
  final ImmutableMap<Prop, Object> props;

  public DefaultEvaluator(Program program, Map<Prop, Object> props) {
    this.program = requireNonNull(program);
    this.props = ImmutableMap.copyOf(props);
  }

  public DefaultEvaluator(Program program) {
    this(program, ImmutableMap.of());
  }

  @Override
  public EvalResult eval(Core.Exp exp, EvalEnv env) {
    final Interpreter interpreter =
        new Interpreter(program, Prop.MAX_STEPS.intValue(props),
            Prop.MAX_CALL_DEPTH.intValue(props));
    try {
      return EvalResult.success(interpreter.eval(exp, env));
    } catch (EvalException e) {
      return EvalResult.failure(e);
    }
  }
}

// End DefaultEvaluator.java
