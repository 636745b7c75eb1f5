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

import net.hydromatic.focus.ast.Core;

/** Evaluates expressions.
 *
 * <p>An evaluator never throws; errors are reported as
 * {@link EvalResult.Failure}. An evaluator may be expensive, but is
 * synchronous, and safe to use from several threads at once. */
public interface Evaluator {
  /** Evaluates an expression in an environment. */
  EvalResult eval(Core.Exp exp, EvalEnv env);
}

// End Evaluator.java
