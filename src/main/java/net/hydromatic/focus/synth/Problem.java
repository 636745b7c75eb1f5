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
import net.hydromatic.focus.ast.Core;

/** Synthesis problem: a hole to be filled.
 *
 * <p>A solution must compute {@link #outputs} from {@link #inputs} such that
 * {@link #spec} holds, assuming {@link #pathCondition}. Problems are
 * immutable. */
public class Problem {
  public final ImmutableList<Core.IdPat> inputs;
  public final Path pathCondition;
  public final ImmutableList<Witnesses.Witness> witnesses;
  public final Core.Exp spec;
  public final ImmutableList<Core.IdPat> outputs;
  public final ExampleBank examples;

  private Problem(ImmutableList<Core.IdPat> inputs, Path pathCondition,
      ImmutableList<Witnesses.Witness> witnesses, Core.Exp spec,
      ImmutableList<Core.IdPat> outputs, ExampleBank examples) {
    this.inputs = requireNonNull(inputs);
    this.pathCondition = requireNonNull(pathCondition);
    this.witnesses = requireNonNull(witnesses);
    this.spec = requireNonNull(spec);
    this.outputs = requireNonNull(outputs);
    this.examples = requireNonNull(examples);
  }

  /** Creates a problem. */
  public static Problem of(List<Core.IdPat> inputs, Path pathCondition,
      List<? extends Witnesses.Witness> witnesses, Core.Exp spec,
      List<Core.IdPat> outputs, ExampleBank examples) {
    return new Problem(ImmutableList.copyOf(inputs), pathCondition,
        ImmutableList.copyOf(witnesses), spec, ImmutableList.copyOf(outputs),
        examples);
  }

  public Problem withPathCondition(Path pathCondition) {
    return of(inputs, pathCondition, witnesses, spec, outputs, examples);
  }

  public Problem withWitnesses(List<? extends Witnesses.Witness> witnesses) {
    return of(inputs, pathCondition, witnesses, spec, outputs, examples);
  }

  public Problem withExamples(ExampleBank examples) {
    return of(inputs, pathCondition, witnesses, spec, outputs, examples);
  }

  @Override
  public String toString() {
    return "Problem{inputs: " + inputs
        + ", path: " + pathCondition
        + ", witnesses: " + witnesses
        + ", spec: " + spec
        + ", outputs: " + outputs
        + ", examples: " + examples.size() + "}";
  }
}

// End Problem.java
