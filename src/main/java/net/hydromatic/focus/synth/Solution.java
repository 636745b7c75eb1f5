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
import static net.hydromatic.focus.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableSet;
import net.hydromatic.focus.ast.Core;

/** Solution to a {@link Problem}.
 *
 * <p>{@link #term} computes the problem's outputs, and is correct wherever
 * {@link #pre} holds. {@link #defs} are auxiliary functions that the term
 * may call. */
public class Solution {
  public final Core.Exp pre;
  public final ImmutableSet<Core.FunDef> defs;
  public final Core.Exp term;
  public final boolean trusted;

  public Solution(Core.Exp pre, Iterable<Core.FunDef> defs, Core.Exp term,
      boolean trusted) {
    this.pre = requireNonNull(pre);
    this.defs = ImmutableSet.copyOf(defs);
    this.term = requireNonNull(term);
    this.trusted = trusted;
  }

  /** Creates a trusted solution that is valid everywhere and has no auxiliary
   * functions. */
  public static Solution simple(Core.Exp term) {
    return new Solution(core.boolLiteral(true), ImmutableSet.of(), term, true);
  }

  @Override
  public String toString() {
    return "Solution{pre: " + pre + ", defs: " + defs.size()
        + ", term: " + term + (trusted ? "" : ", untrusted") + "}";
  }
}

// End Solution.java
