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

/** Result of evaluating a boolean expression against a set of examples. */
public enum Classification {
  /** The expression evaluated to {@code true} on every example. */
  ALWAYS_TRUE,
  /** The expression evaluated to {@code false} on every example. */
  ALWAYS_FALSE,
  /** The examples disagreed, there were no examples, or evaluation failed
   * or returned a value that is not a boolean. */
  INDETERMINATE
}

// End Classification.java
