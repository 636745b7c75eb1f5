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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.MAX_STEPS.intValue(map), is(100_000));
    assertThat(Prop.CHOICE_LIMIT.intValue(map), is(12));
    assertThat(Prop.MAX_CALL_DEPTH.intValue(map), is(400));
    assertThat(Prop.CONDITION_PROBE.booleanValue(map), is(true));
    assertThat(Prop.MISSING_CASE.booleanValue(map), is(true));
  }

  @Test
  void testSetAndLookup() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.lookup("choiceLimit").set(map, 5);
    assertThat(Prop.CHOICE_LIMIT.intValue(map), is(5));
    assertThat(Prop.lookup("MISSING_CASE"), is(Prop.MISSING_CASE));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.lookup("noSuchProperty"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_STEPS.set(map, "many"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_STEPS.booleanValue(map));
  }
}

// End PropTest.java
