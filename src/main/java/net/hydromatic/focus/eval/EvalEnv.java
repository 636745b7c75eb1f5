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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.focus.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>An immutable mapping from variables to values. Binding a variable
 * creates a new environment that shares its parent.
 */
public interface EvalEnv {
  /** Returns the binding of {@code idPat} if bound, null if not. */
  @Nullable Object getOpt(Core.IdPat idPat);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (idPat, value).
   */
  default EvalEnv bind(Core.IdPat idPat, Object value) {
    return new EvalEnvs.SubEvalEnv(this, idPat, value);
  }

  /**
   * Creates an environment that has the same content as this one, plus a
   * binding for each (variable, value) pair.
   */
  default EvalEnv bindAll(List<Core.IdPat> idPats, List<?> values) {
    EvalEnv env = this;
    for (int i = 0; i < idPats.size(); i++) {
      env = env.bind(idPats.get(i), values.get(i));
    }
    return env;
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same
   * variable are visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<Core.IdPat, Object> consumer);

  /** Returns a map of the values and bindings. */
  default Map<Core.IdPat, Object> valueMap() {
    final Map<Core.IdPat, Object> valueMap = new HashMap<>();
    visit(valueMap::putIfAbsent);
    return valueMap;
  }
}

// End EvalEnv.java
