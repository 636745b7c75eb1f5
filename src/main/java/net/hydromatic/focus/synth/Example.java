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
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A concrete example: a row of input values and, optionally, a row of
 * expected output values.
 *
 * <p>Input values are aligned with the inputs of the {@link Problem} that
 * owns the example. */
public class Example {
  public final ImmutableList<Object> ins;
  public final @Nullable ImmutableList<Object> outs;

  private Example(ImmutableList<Object> ins,
      @Nullable ImmutableList<Object> outs) {
    this.ins = requireNonNull(ins);
    this.outs = outs;
  }

  /** Creates an example with inputs only. */
  public static Example of(List<?> ins) {
    return new Example(ImmutableList.copyOf(ins), null);
  }

  /** Creates an example with inputs and expected outputs. */
  public static Example inOut(List<?> ins, List<?> outs) {
    return new Example(ImmutableList.copyOf(ins), ImmutableList.copyOf(outs));
  }

  /** Returns an example with the same outputs and different inputs. */
  public Example withIns(List<?> ins) {
    return new Example(ImmutableList.copyOf(ins), outs);
  }

  /** Returns an example without outputs. */
  public Example stripOuts() {
    return outs == null ? this : new Example(ins, null);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ins, outs);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Example
        && ins.equals(((Example) o).ins)
        && Objects.equals(outs, ((Example) o).outs);
  }

  @Override
  public String toString() {
    return outs == null ? "ins" + ins : "ins" + ins + " outs" + outs;
  }
}

// End Example.java
