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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of evaluating an expression: either a value or a failure. */
public abstract class EvalResult {
  private EvalResult() {}

  /** Creates a successful result. */
  public static Success success(Object value) {
    return new Success(value);
  }

  /** Creates a failed result. */
  public static Failure failure(EvalException.Kind kind, String message) {
    return new Failure(kind, message);
  }

  /** Creates a failed result from an exception. */
  public static Failure failure(EvalException e) {
    return new Failure(e.kind, String.valueOf(e.getMessage()));
  }

  /** Returns whether evaluation succeeded. */
  public abstract boolean isSuccess();

  /** Returns the boolean value of a successful evaluation, or null if
   * evaluation failed or the value is not a boolean. */
  public abstract @Nullable Boolean booleanValue();

  /** Successful evaluation. */
  public static class Success extends EvalResult {
    public final Object value;

    Success(Object value) {
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public @Nullable Boolean booleanValue() {
      return value instanceof Boolean ? (Boolean) value : null;
    }

    @Override
    public String toString() {
      return "Success(" + value + ")";
    }
  }

  /** Failed evaluation. */
  public static class Failure extends EvalResult {
    public final EvalException.Kind kind;
    public final String message;

    Failure(EvalException.Kind kind, String message) {
      this.kind = requireNonNull(kind);
      this.message = requireNonNull(message);
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public @Nullable Boolean booleanValue() {
      return null;
    }

    @Override
    public String toString() {
      return kind + "(" + message + ")";
    }
  }
}

// End EvalResult.java
