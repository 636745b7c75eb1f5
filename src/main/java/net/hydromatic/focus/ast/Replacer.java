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

import static java.util.Objects.requireNonNull;

import java.util.IdentityHashMap;
import java.util.Map;

/** Replaces particular occurrences of sub-expressions.
 *
 * <p>Occurrences are matched by identity, not by equality: replacing one
 * occurrence of "x > 0" leaves other, structurally equal, occurrences
 * alone. A replacement expression is not itself visited. */
public class Replacer extends Shuttle {
  private final Map<Core.Exp, Core.Exp> substitution;

  private Replacer(Map<Core.Exp, Core.Exp> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Returns a copy of {@code exp} with {@code target} replaced by
   * {@code replacement}. */
  public static Core.Exp replace(Core.Exp exp, Core.Exp target,
      Core.Exp replacement) {
    final Map<Core.Exp, Core.Exp> substitution = new IdentityHashMap<>();
    substitution.put(target, replacement);
    return new Replacer(substitution).visitExp(exp);
  }

  /** Returns a copy of {@code exp} with occurrences replaced according to an
   * identity map. */
  public static Core.Exp replace(Core.Exp exp,
      IdentityHashMap<Core.Exp, Core.Exp> substitution) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return new Replacer(substitution).visitExp(exp);
  }

  @Override
  public Core.Exp visitExp(Core.Exp exp) {
    final Core.Exp replacement = substitution.get(exp);
    return replacement != null ? replacement : super.visitExp(exp);
  }
}

// End Replacer.java
