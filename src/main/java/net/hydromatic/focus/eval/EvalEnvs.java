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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.BiConsumer;
import net.hydromatic.focus.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private EvalEnvs() {}

  /** Returns an environment with no bindings. */
  public static EvalEnv empty() {
    return EmptyEvalEnv.INSTANCE;
  }

  /** Creates an environment that binds each of a list of variables to the
   * corresponding value in a row. */
  public static EvalEnv of(List<Core.IdPat> idPats, List<?> values) {
    checkArgument(idPats.size() == values.size(),
        "%s variables but %s values", idPats.size(), values.size());
    return empty().bindAll(idPats, values);
  }

  /** Evaluation environment that has no bindings. */
  private static class EmptyEvalEnv implements EvalEnv {
    static final EvalEnv INSTANCE = new EmptyEvalEnv();

    @Override
    public @Nullable Object getOpt(Core.IdPat idPat) {
      return null;
    }

    @Override
    public void visit(BiConsumer<Core.IdPat, Object> consumer) {
    }

    @Override
    public String toString() {
      return "{}";
    }
  }

  /** Evaluation environment that inherits from a parent environment and adds
   * one binding. */
  static class SubEvalEnv implements EvalEnv {
    private final EvalEnv parentEnv;
    private final Core.IdPat idPat;
    private final Object value;

    SubEvalEnv(EvalEnv parentEnv, Core.IdPat idPat, Object value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.idPat = requireNonNull(idPat);
      this.value = requireNonNull(value);
    }

    @Override
    public void visit(BiConsumer<Core.IdPat, Object> consumer) {
      consumer.accept(idPat, value);
      parentEnv.visit(consumer);
    }

    @Override
    public @Nullable Object getOpt(Core.IdPat idPat) {
      for (SubEvalEnv e = this;;) {
        if (idPat.equals(e.idPat)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(idPat);
        }
      }
    }

    @Override
    public String toString() {
      return valueMap().toString();
    }
  }
}

// End EvalEnvs.java
