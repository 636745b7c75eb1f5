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

import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.focus.ast.Core;

/** Utilities for patterns. */
public abstract class Patterns {
  private Patterns() {}

  /** Returns the condition under which a value {@code scrut} matches a
   * pattern.
   *
   * <p>For example, the condition for {@code Cons(0, t)} is
   * "{@code l is Cons andalso #Cons.1 l = 0}". Variables bound by the pattern
   * do not appear in the condition. */
  public static Path conditionForPattern(Core.Exp scrut, Core.Pat pat) {
    switch (pat.op) {
    case ID_PAT:
    case WILDCARD_PAT:
      return Path.EMPTY;

    case BOOL_LITERAL_PAT:
    case INT_LITERAL_PAT:
    case STRING_LITERAL_PAT:
      final Core.LiteralPat literalPat = (Core.LiteralPat) pat;
      return Path.EMPTY.withCond(core.equal(scrut, literal(literalPat)));

    case CON_PAT:
      final Core.ConPat conPat = (Core.ConPat) pat;
      Path path = Path.EMPTY.withCond(core.conTest(scrut, conPat.tyCon));
      for (int i = 0; i < conPat.args.size(); i++) {
        final Core.Pat arg = conPat.args.get(i);
        path = path.merge(
            conditionForPattern(
                core.conSelect(arg.type, scrut, conPat.tyCon, i), arg));
      }
      return path;

    case TUPLE_PAT:
      final Core.TuplePat tuplePat = (Core.TuplePat) pat;
      Path tuplePath = Path.EMPTY;
      for (int i = 0; i < tuplePat.args.size(); i++) {
        final Core.Pat arg = tuplePat.args.get(i);
        tuplePath = tuplePath.merge(
            conditionForPattern(core.tupleSelect(arg.type, scrut, i), arg));
      }
      return tuplePath;

    default:
      throw new AssertionError("unknown pattern " + pat.op);
    }
  }

  /** Returns the variables bound by a pattern, each mapped to the
   * expression that extracts its value from {@code scrut}, in the order they
   * occur in the pattern. */
  public static Map<Core.IdPat, Core.Exp> mapForPattern(Core.Exp scrut,
      Core.Pat pat) {
    final Map<Core.IdPat, Core.Exp> map = new LinkedHashMap<>();
    populate(scrut, pat, map);
    return map;
  }

  private static void populate(Core.Exp scrut, Core.Pat pat,
      Map<Core.IdPat, Core.Exp> map) {
    switch (pat.op) {
    case ID_PAT:
      map.put((Core.IdPat) pat, scrut);
      break;

    case CON_PAT:
      final Core.ConPat conPat = (Core.ConPat) pat;
      for (int i = 0; i < conPat.args.size(); i++) {
        final Core.Pat arg = conPat.args.get(i);
        populate(core.conSelect(arg.type, scrut, conPat.tyCon, i), arg, map);
      }
      break;

    case TUPLE_PAT:
      final Core.TuplePat tuplePat = (Core.TuplePat) pat;
      for (int i = 0; i < tuplePat.args.size(); i++) {
        final Core.Pat arg = tuplePat.args.get(i);
        populate(core.tupleSelect(arg.type, scrut, i), arg, map);
      }
      break;

    default:
      break;
    }
  }

  /** Converts a literal pattern to the corresponding literal. */
  static Core.Literal literal(Core.LiteralPat literalPat) {
    switch (literalPat.op) {
    case BOOL_LITERAL_PAT:
      return core.boolLiteral((Boolean) literalPat.value);
    case INT_LITERAL_PAT:
      return core.intLiteral((Integer) literalPat.value);
    case STRING_LITERAL_PAT:
      return core.stringLiteral((String) literalPat.value);
    default:
      throw new AssertionError("not a literal pattern: " + literalPat);
    }
  }
}

// End Patterns.java
