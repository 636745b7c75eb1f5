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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Program;
import net.hydromatic.focus.eval.DefaultEvaluator;
import net.hydromatic.focus.eval.Evaluator;
import net.hydromatic.focus.eval.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context in which a rule is applied to a problem.
 *
 * <p>Holds the program, the function being repaired, the search node whose
 * child is being expanded, configuration properties, the tracer, and the
 * name generator. Immutable, except for the name generator, which is
 * shared. */
public class SearchContext {
  public final Program program;
  public final Core.FunDef functionContext;
  public final @Nullable SearchNode parentNode;
  public final ImmutableMap<Prop, Object> props;
  public final Tracer tracer;
  public final NameGenerator nameGenerator;

  public SearchContext(Program program, Core.FunDef functionContext,
      @Nullable SearchNode parentNode, Map<Prop, Object> props,
      Tracer tracer, NameGenerator nameGenerator) {
    this.program = requireNonNull(program);
    this.functionContext = requireNonNull(functionContext);
    this.parentNode = parentNode;
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.nameGenerator = requireNonNull(nameGenerator);
  }

  /** Creates a context with no parent node, default properties, and an
   * empty tracer. */
  public static SearchContext of(Program program, Core.FunDef functionContext) {
    return new SearchContext(program, functionContext, null,
        ImmutableMap.of(), Tracers.empty(), new NameGenerator());
  }

  public SearchContext withParentNode(@Nullable SearchNode parentNode) {
    return new SearchContext(program, functionContext, parentNode, props,
        tracer, nameGenerator);
  }

  public SearchContext withTracer(Tracer tracer) {
    return new SearchContext(program, functionContext, parentNode, props,
        tracer, nameGenerator);
  }

  /** Returns a context with a property set to a given value. */
  public SearchContext withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(props);
    prop.set(map, value);
    return new SearchContext(program, functionContext, parentNode, map,
        tracer, nameGenerator);
  }

  /** Creates a deterministic evaluator for this context's program. */
  public Evaluator evaluator() {
    return new DefaultEvaluator(program, props);
  }
}

// End SearchContext.java
