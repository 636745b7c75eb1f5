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

import static net.hydromatic.focus.ast.CoreBuilder.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.type.Type;

/**
 * Generates unique names.
 *
 * <p>Keeps track of how many times each given name has been used, so that a
 * new variable can be given a fresh ordinal. Ordinals start at 1; variables
 * written by the user have ordinal 0, so generated variables never clash
 * with them.
 *
 * <p>Is thread-safe; one generator may be shared by several searches.
 */
public class NameGenerator {
  private final Map<String, AtomicInteger> nameCounts =
      new ConcurrentHashMap<>();

  /** Returns the next ordinal for "name". */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .incrementAndGet();
  }

  /** Creates a variable whose name is unique. */
  public Core.IdPat fresh(Type type, String name) {
    return core.idPat(type, name, inc(name));
  }

  /** Creates a hole whose name is unique. */
  public Core.Hole hole(Type type, String name) {
    return core.hole(type, name + "_" + inc(name));
  }
}

// End NameGenerator.java
