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
package net.hydromatic.focus.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A program: a collection of function definitions, keyed by name. */
public class Program {
  public final ImmutableMap<String, Core.FunDef> funDefs;

  private Program(ImmutableMap<String, Core.FunDef> funDefs) {
    this.funDefs = funDefs;
  }

  /** Creates a program. Function names must be unique. */
  public static Program of(Iterable<Core.FunDef> funDefs) {
    final Map<String, Core.FunDef> map = new LinkedHashMap<>();
    for (Core.FunDef funDef : funDefs) {
      checkArgument(map.put(funDef.name, funDef) == null,
          "duplicate function %s", funDef.name);
    }
    return new Program(ImmutableMap.copyOf(map));
  }

  public static Program of(Core.FunDef... funDefs) {
    return of(Arrays.asList(funDefs));
  }

  /** Returns the definition of a function, or null if not found. */
  public Core.@Nullable FunDef lookup(String name) {
    return funDefs.get(name);
  }

  @Override
  public String toString() {
    final AstWriter w = new AstWriter();
    funDefs.values().forEach(funDef -> w.append(funDef, 0, 0).append("\n"));
    return w.toString();
  }
}

// End Program.java
