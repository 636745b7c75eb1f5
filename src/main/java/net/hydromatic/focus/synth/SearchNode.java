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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Node in the search graph.
 *
 * <p>The graph alternates between {@link OrNode}s, each holding a problem
 * that can be solved in several ways, and {@link AndNode}s, each holding one
 * way of decomposing its parent's problem. Rules read nodes but never
 * modify them. */
public abstract class SearchNode {
  public final @Nullable SearchNode parent;

  SearchNode(@Nullable SearchNode parent) {
    this.parent = parent;
  }

  /** Node created by applying a rule. */
  public static class AndNode extends SearchNode {
    public final RuleInstantiation instantiation;

    public AndNode(@Nullable SearchNode parent,
        RuleInstantiation instantiation) {
      super(parent);
      this.instantiation = requireNonNull(instantiation);
    }

    @Override
    public String toString() {
      return "AndNode(" + instantiation.label + ")";
    }
  }

  /** Node holding a problem. */
  public static class OrNode extends SearchNode {
    public final Problem problem;

    public OrNode(@Nullable SearchNode parent, Problem problem) {
      super(parent);
      this.problem = requireNonNull(problem);
    }

    @Override
    public String toString() {
      return "OrNode(" + problem + ")";
    }
  }
}

// End SearchNode.java
