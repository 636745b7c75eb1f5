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

/** Error that occurs while evaluating an expression.
 *
 * <p>Never escapes an {@link Evaluator}; evaluators convert it into an
 * {@link EvalResult.Failure}. */
public class EvalException extends RuntimeException {
  public final Kind kind;

  EvalException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind);
  }

  /** Creates an exception for an error in the program being evaluated,
   * such as a match failure. */
  public static EvalException runtime(String message) {
    return new EvalException(Kind.RUNTIME_ERROR, message);
  }

  /** Creates an exception for a limitation of the evaluator, such as an
   * exhausted step budget. */
  public static EvalException evaluator(String message) {
    return new EvalException(Kind.EVALUATOR_ERROR, message);
  }

  /** Kind of evaluation error. */
  public enum Kind {
    /** The program went wrong: match failure, selecting a field of the wrong
     * constructor, division by zero, and so forth. */
    RUNTIME_ERROR,
    /** The evaluator gave up: step or depth budget exhausted, or the
     * expression contains something that cannot be evaluated, such as a
     * hole. */
    EVALUATOR_ERROR
  }
}

// End EvalException.java
