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
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.eval.EvalResult;

/** Called by the focus rule at various points of its work, to allow a test
 * or a user to observe what it is doing.
 *
 * <p>There is no logging framework; implement this interface, or use the
 * decorators in {@link Tracers}. */
public interface Tracer {
  /** Called when a rule has produced an instantiation. */
  void onInstantiation(RuleInstantiation instantiation);

  /** Called when an expression has been classified against the failing
   * examples. */
  void onClassification(Core.Exp exp, Classification classification);

  /** Called when evaluation of an expression on an example failed. */
  void onEvalFailure(Core.Exp exp, List<Object> ins,
      EvalResult.Failure failure);

  /** Called when a rule declines to work on a problem because of the rule
   * that created its parent node. */
  void onReentryRejected(Problem problem, SearchNode parentNode);
}

// End Tracer.java
