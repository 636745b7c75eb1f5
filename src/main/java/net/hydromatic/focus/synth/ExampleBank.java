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
import java.util.function.Function;
import java.util.function.Predicate;

/** Immutable collection of examples, split into those that the current
 * program passes ("valid") and those that it fails ("invalid").
 *
 * <p>Operations return new banks; rows are never modified in place. */
public class ExampleBank {
  public static final ExampleBank EMPTY =
      new ExampleBank(ImmutableList.of(), ImmutableList.of());

  public final ImmutableList<Example> valids;
  public final ImmutableList<Example> invalids;

  private ExampleBank(ImmutableList<Example> valids,
      ImmutableList<Example> invalids) {
    this.valids = requireNonNull(valids);
    this.invalids = requireNonNull(invalids);
  }

  /** Creates an example bank. */
  public static ExampleBank of(List<Example> valids, List<Example> invalids) {
    if (valids.isEmpty() && invalids.isEmpty()) {
      return EMPTY;
    }
    return new ExampleBank(ImmutableList.copyOf(valids),
        ImmutableList.copyOf(invalids));
  }

  /** Returns whether this bank has no examples. */
  public boolean isEmpty() {
    return valids.isEmpty() && invalids.isEmpty();
  }

  /** Returns the total number of examples. */
  public int size() {
    return valids.size() + invalids.size();
  }

  /** Returns a bank containing the examples whose inputs satisfy a
   * predicate. */
  public ExampleBank filterIns(Predicate<List<Object>> predicate) {
    return of(filter(valids, predicate), filter(invalids, predicate));
  }

  private static List<Example> filter(List<Example> examples,
      Predicate<List<Object>> predicate) {
    final ImmutableList.Builder<Example> b = ImmutableList.builder();
    for (Example example : examples) {
      if (predicate.test(example.ins)) {
        b.add(example);
      }
    }
    return b.build();
  }

  /** Returns a bank in which each example's inputs are replaced by zero or
   * more new rows of inputs. Outputs are kept.
   *
   * <p>Typically {@code f} appends columns to a row, and returns an empty
   * list if a column cannot be computed, thereby dropping the row. */
  public ExampleBank mapIns(Function<List<Object>, List<List<Object>>> f) {
    return of(map(valids, f), map(invalids, f));
  }

  private static List<Example> map(List<Example> examples,
      Function<List<Object>, List<List<Object>>> f) {
    final ImmutableList.Builder<Example> b = ImmutableList.builder();
    for (Example example : examples) {
      for (List<Object> ins : f.apply(example.ins)) {
        b.add(example.withIns(ins));
      }
    }
    return b.build();
  }

  /** Returns a bank whose examples have no outputs. */
  public ExampleBank stripOuts() {
    return of(strip(valids), strip(invalids));
  }

  private static List<Example> strip(List<Example> examples) {
    final ImmutableList.Builder<Example> b = ImmutableList.builder();
    examples.forEach(example -> b.add(example.stripOuts()));
    return b.build();
  }

  @Override
  public String toString() {
    return "ExampleBank{valids: " + valids + ", invalids: " + invalids + "}";
  }
}

// End ExampleBank.java
