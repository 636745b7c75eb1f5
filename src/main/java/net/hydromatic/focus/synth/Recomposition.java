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
import static net.hydromatic.focus.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Replacer;
import net.hydromatic.focus.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rebuilds a solution to a problem from solutions to the sub-problems into
 * which it was decomposed.
 *
 * <p>The set of sub-classes is closed; each carries just the data needed to
 * rebuild the parent term. */
public abstract class Recomposition {
  private Recomposition() {}

  /** Returns the number of solutions that {@link #recompose} expects. */
  public abstract int arity();

  /** Combines solutions to sub-problems, in the order that the sub-problems
   * were created, into a solution of the parent problem.
   *
   * <p>Returns null if the number of solutions is wrong. */
  public final @Nullable Solution recompose(List<Solution> solutions) {
    if (solutions.size() != arity()) {
      return null;
    }
    return apply(solutions);
  }

  abstract Solution apply(List<Solution> solutions);

  /** Creates a recomposition that substitutes the term of the only solution
   * for a hole in a template. */
  public static WrapTermHole wrapTermHole(Core.Exp template, Core.Hole hole,
      Core.Exp pre) {
    return new WrapTermHole(template, hole, pre);
  }

  /** Creates a recomposition that puts the term of the only solution into
   * one branch of a conditional. */
  public static WrapConditionalBranch wrapConditionalBranch(Side side,
      Core.Exp condition, Core.Exp untouched) {
    return new WrapConditionalBranch(side, condition, untouched);
  }

  /** Creates a recomposition that builds a conditional from two
   * solutions. */
  public static WrapConditionalBoth wrapConditionalBoth(Core.Exp condition) {
    return new WrapConditionalBoth(condition);
  }

  /** Creates a recomposition that builds a "case" expression whose solved
   * cases are replaced by solutions, in order. */
  public static WrapMatch wrapMatch(Type type, Core.Exp scrut,
      List<Core.Match> matchList, List<Integer> solvedOrdinals,
      Path parentPath) {
    return new WrapMatch(type, scrut, ImmutableList.copyOf(matchList),
        ImmutableList.copyOf(solvedOrdinals), parentPath);
  }

  /** Creates a recomposition that wraps the term of the only solution in a
   * "let". */
  public static WrapLet wrapLet(Core.IdPat idPat, Core.Exp value) {
    return new WrapLet(idPat, value);
  }

  static ImmutableSet<Core.FunDef> defs(List<Solution> solutions) {
    final ImmutableSet.Builder<Core.FunDef> b = ImmutableSet.builder();
    solutions.forEach(s -> b.addAll(s.defs));
    return b.build();
  }

  static boolean trusted(List<Solution> solutions) {
    return solutions.stream().allMatch(s -> s.trusted);
  }

  /** Branch of a conditional. */
  public enum Side {
    THEN, ELSE
  }

  /** Substitutes the solution for a hole. */
  public static class WrapTermHole extends Recomposition {
    public final Core.Exp template;
    public final Core.Hole hole;
    public final Core.Exp pre;

    WrapTermHole(Core.Exp template, Core.Hole hole, Core.Exp pre) {
      this.template = requireNonNull(template);
      this.hole = requireNonNull(hole);
      this.pre = requireNonNull(pre);
    }

    @Override
    public int arity() {
      return 1;
    }

    @Override
    Solution apply(List<Solution> solutions) {
      final Solution s = solutions.get(0);
      return new Solution(core.andAlso(pre, s.pre), s.defs,
          Replacer.replace(template, hole, s.term), s.trusted);
    }

    @Override
    public String toString() {
      return "WrapTermHole(" + template + ")";
    }
  }

  /** Puts a solution into one branch of a conditional, keeping the other
   * branch. */
  public static class WrapConditionalBranch extends Recomposition {
    public final Side side;
    public final Core.Exp condition;
    public final Core.Exp untouched;

    WrapConditionalBranch(Side side, Core.Exp condition, Core.Exp untouched) {
      this.side = requireNonNull(side);
      this.condition = requireNonNull(condition);
      this.untouched = requireNonNull(untouched);
    }

    @Override
    public int arity() {
      return 1;
    }

    @Override
    Solution apply(List<Solution> solutions) {
      final Solution s = solutions.get(0);
      switch (side) {
      case THEN:
        return new Solution(core.andAlso(condition, s.pre), s.defs,
            core.ifThenElse(condition, s.term, untouched), s.trusted);
      case ELSE:
        return new Solution(core.andAlso(core.not(condition), s.pre), s.defs,
            core.ifThenElse(condition, untouched, s.term), s.trusted);
      default:
        throw new AssertionError(side);
      }
    }

    @Override
    public String toString() {
      return "WrapConditionalBranch(" + side + ", " + condition + ")";
    }
  }

  /** Builds a conditional whose branches are two solutions. */
  public static class WrapConditionalBoth extends Recomposition {
    public final Core.Exp condition;

    WrapConditionalBoth(Core.Exp condition) {
      this.condition = requireNonNull(condition);
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    Solution apply(List<Solution> solutions) {
      final Solution s1 = solutions.get(0);
      final Solution s2 = solutions.get(1);
      return new Solution(core.orElse(s1.pre, s2.pre), defs(solutions),
          core.ifThenElse(condition, s1.term, s2.term), trusted(solutions));
    }

    @Override
    public String toString() {
      return "WrapConditionalBoth(" + condition + ")";
    }
  }

  /** Rebuilds a "case" expression. */
  public static class WrapMatch extends Recomposition {
    public final Type type;
    public final Core.Exp scrut;
    public final ImmutableList<Core.Match> matchList;
    /** Ordinals, in {@link #matchList}, of the cases that have a
     * sub-problem. */
    public final ImmutableList<Integer> solvedOrdinals;
    public final Path parentPath;

    WrapMatch(Type type, Core.Exp scrut, ImmutableList<Core.Match> matchList,
        ImmutableList<Integer> solvedOrdinals, Path parentPath) {
      this.type = requireNonNull(type);
      this.scrut = requireNonNull(scrut);
      this.matchList = requireNonNull(matchList);
      this.solvedOrdinals = requireNonNull(solvedOrdinals);
      this.parentPath = requireNonNull(parentPath);
      for (int ordinal : solvedOrdinals) {
        checkArgument(ordinal >= 0 && ordinal < matchList.size(),
            "bad ordinal %s", ordinal);
      }
    }

    @Override
    public int arity() {
      return solvedOrdinals.size();
    }

    @Override
    Solution apply(List<Solution> solutions) {
      final List<Core.Match> matches = new ArrayList<>(matchList);
      final List<Core.Exp> pres = new ArrayList<>();
      for (int i = 0; i < solvedOrdinals.size(); i++) {
        final int ordinal = solvedOrdinals.get(i);
        final Solution s = solutions.get(i);
        final Core.Match match = matchList.get(ordinal);
        matches.set(ordinal, match.copy(match.pat, s.term));
        pres.add(s.pre.isBoolLiteral(true) ? s.pre : parentPath.and(s.pre));
      }
      return new Solution(core.orElse(pres), defs(solutions),
          core.caseOf(type, scrut, matches), trusted(solutions));
    }

    @Override
    public String toString() {
      return "WrapMatch(" + scrut + ", " + solvedOrdinals + ")";
    }
  }

  /** Wraps a solution in a "let". */
  public static class WrapLet extends Recomposition {
    public final Core.IdPat idPat;
    public final Core.Exp value;

    WrapLet(Core.IdPat idPat, Core.Exp value) {
      this.idPat = requireNonNull(idPat);
      this.value = requireNonNull(value);
    }

    @Override
    public int arity() {
      return 1;
    }

    @Override
    Solution apply(List<Solution> solutions) {
      final Solution s = solutions.get(0);
      return new Solution(s.pre, s.defs, core.let(idPat, value, s.term),
          s.trusted);
    }

    @Override
    public String toString() {
      return "WrapLet(" + idPat + ")";
    }
  }
}

// End Recomposition.java
