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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExampleBank}. */
public class ExampleBankTest {
  private static Example example(int x) {
    return Example.of(ImmutableList.of(x));
  }

  private final ExampleBank bank =
      ExampleBank.of(ImmutableList.of(example(1), example(2)),
          ImmutableList.of(example(-1),
              Example.inOut(ImmutableList.of(3), ImmutableList.of(30))));

  @Test
  void testSize() {
    assertThat(bank.size(), is(4));
    assertThat(bank.isEmpty(), is(false));
    assertThat(ExampleBank.of(ImmutableList.of(), ImmutableList.of()),
        sameInstance(ExampleBank.EMPTY));
    assertThat(ExampleBank.EMPTY.isEmpty(), is(true));
  }

  @Test
  void testFilterIns() {
    final ExampleBank positive =
        bank.filterIns(ins -> (Integer) ins.get(0) > 0);
    assertThat(positive.valids, hasToString("[ins[1], ins[2]]"));
    assertThat(positive.invalids, hasToString("[ins[3] outs[30]]"));
    assertThat(bank.filterIns(ins -> false).isEmpty(), is(true));
  }

  /** Tests that {@link ExampleBank#mapIns} extends rows, drops rows for which
   * the function returns nothing, and keeps outputs. */
  @Test
  void testMapIns() {
    final ExampleBank extended =
        bank.mapIns(ins -> {
          final int x = (Integer) ins.get(0);
          if (x == 2) {
            return ImmutableList.of();
          }
          final List<Object> row = new ArrayList<>(ins);
          row.add(x * 10);
          return ImmutableList.of(row);
        });
    assertThat(extended.valids, hasToString("[ins[1, 10]]"));
    assertThat(extended.invalids,
        hasToString("[ins[-1, -10], ins[3, 30] outs[30]]"));
  }

  @Test
  void testStripOuts() {
    final ExampleBank stripped = bank.stripOuts();
    assertThat(stripped.invalids, hasToString("[ins[-1], ins[3]]"));
    assertThat(stripped.size(), is(bank.size()));
  }
}

// End ExampleBankTest.java
