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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** One way in which a rule decomposes a problem: a list of sub-problems,
 * all of which must be solved, and a way to combine their solutions. */
public class RuleInstantiation {
  public final Rule rule;
  public final ImmutableList<Problem> children;
  public final Recomposition recomposition;
  public final String label;

  public RuleInstantiation(Rule rule, List<Problem> children,
      Recomposition recomposition, String label) {
    this.rule = requireNonNull(rule);
    this.children = ImmutableList.copyOf(children);
    this.recomposition = requireNonNull(recomposition);
    this.label = requireNonNull(label);
    checkArgument(this.children.size() == recomposition.arity(),
        "%s children, but recomposition expects %s", this.children.size(),
        recomposition.arity());
  }

  /** Combines solutions of {@link #children}, in order, into a solution of
   * the parent problem; returns null if they cannot be combined. */
  public @Nullable Solution recompose(List<Solution> solutions) {
    return recomposition.recompose(solutions);
  }

  @Override
  public String toString() {
    return label;
  }
}

// End RuleInstantiation.java
