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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.type.DataType;
import net.hydromatic.focus.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Recomposition} and {@link RuleInstantiation}. */
public class RecompositionTest {
  /** Tests that a split conditional combines the preconditions of its
   * branches with "orelse". */
  @Test
  void testConditionalBoth() {
    final Fixture f = new Fixture();
    final Recomposition r = Recomposition.wrapConditionalBoth(f.xGt0);
    final Solution s1 =
        new Solution(f.lt(100), ImmutableSet.of(f.aux1), f.x, true);
    final Solution s2 =
        new Solution(f.gt(-100), ImmutableSet.of(f.aux2, f.aux1),
            core.minus(core.intLiteral(0), f.x), false);
    final Solution s = r.recompose(ImmutableList.of(s1, s2));
    assertThat(s, notNullValue());
    assertThat(s.term, hasToString("if x > 0 then x else 0 - x"));
    assertThat(s.pre, hasToString("x < 100 orelse x > ~100"));
    assertThat(s.defs, hasSize(2));
    assertThat(s.trusted, is(false));
  }

  /** Tests that the wrong number of solutions gives null, not an
   * exception. */
  @Test
  void testMismatch() {
    final Fixture f = new Fixture();
    final Recomposition r = Recomposition.wrapConditionalBoth(f.xGt0);
    final Solution s1 = Solution.simple(f.x);
    assertThat(r.recompose(ImmutableList.of(s1)), nullValue());
    assertThat(r.recompose(ImmutableList.of(s1, s1, s1)), nullValue());
    assertThat(Recomposition.wrapLet(f.yPat, f.x)
        .recompose(ImmutableList.of()), nullValue());
  }

  @Test
  void testConditionalBranch() {
    final Fixture f = new Fixture();
    final Solution s1 = new Solution(f.lt(100), ImmutableSet.of(), f.x, true);
    final Solution thenSolution =
        Recomposition.wrapConditionalBranch(Recomposition.Side.THEN, f.xGt0,
            core.intLiteral(0)).recompose(ImmutableList.of(s1));
    assertThat(thenSolution, notNullValue());
    assertThat(thenSolution.term, hasToString("if x > 0 then x else 0"));
    assertThat(thenSolution.pre, hasToString("x > 0 andalso x < 100"));

    final Solution elseSolution =
        Recomposition.wrapConditionalBranch(Recomposition.Side.ELSE, f.xGt0,
            core.intLiteral(0))
            .recompose(ImmutableList.of(Solution.simple(f.x)));
    assertThat(elseSolution, notNullValue());
    assertThat(elseSolution.term, hasToString("if x > 0 then 0 else x"));
    assertThat(elseSolution.pre, hasToString("not (x > 0)"));
  }

  @Test
  void testMatch() {
    final Fixture f = new Fixture();
    final Core.Hole hole = core.hole(PrimitiveType.INT, "case_1");
    final ImmutableList<Core.Match> matchList =
        ImmutableList.of(
            core.match(core.conPat(f.intList, "Nil"), core.intLiteral(0)),
            core.match(core.conPat(f.intList, "Cons", f.hPat, f.tPat),
                core.id(f.hPat)),
            core.match(core.wildcardPat(f.intList), hole));
    final Path parentPath = Path.EMPTY.withCond(f.xGt0);
    final Recomposition r =
        Recomposition.wrapMatch(PrimitiveType.INT, f.l, matchList,
            ImmutableList.of(1, 2), parentPath);
    assertThat(r.arity(), is(2));

    // A case whose precondition is "true" makes the whole precondition
    // "true"
    final Solution s1 =
        r.recompose(
            ImmutableList.of(
                Solution.simple(
                    core.plus(core.id(f.hPat), core.intLiteral(1))),
                new Solution(f.lt(5), ImmutableSet.of(), core.intLiteral(0),
                    true)));
    assertThat(s1, notNullValue());
    assertThat(s1.term,
        hasToString("case l of Nil => 0 | Cons(h, t) => h + 1 | _ => 0"));
    assertThat(s1.pre, hasToString("true"));

    // Other preconditions are qualified by the parent's path
    final Solution s2 =
        r.recompose(
            ImmutableList.of(
                new Solution(f.lt(5), ImmutableSet.of(), core.id(f.hPat),
                    true),
                new Solution(f.gt(10), ImmutableSet.of(), core.intLiteral(0),
                    true)));
    assertThat(s2, notNullValue());
    assertThat(s2.term,
        hasToString("case l of Nil => 0 | Cons(h, t) => h | _ => 0"));
    assertThat(s2.pre,
        hasToString("x > 0 andalso x < 5 orelse x > 0 andalso x > 10"));
  }

  @Test
  void testLetAndTermHole() {
    final Fixture f = new Fixture();
    final Solution s =
        Recomposition.wrapLet(f.yPat, core.plus(f.x, core.intLiteral(1)))
            .recompose(
                ImmutableList.of(
                    new Solution(f.lt(5), ImmutableSet.of(),
                        core.times(core.id(f.yPat), core.intLiteral(2)),
                        true)));
    assertThat(s, notNullValue());
    assertThat(s.term, hasToString("let val y = x + 1 in y * 2 end"));
    assertThat(s.pre, hasToString("x < 5"));

    final Core.Hole hole = core.hole(PrimitiveType.BOOL, "cond_1");
    final Core.Exp template =
        core.ifThenElse(hole, f.x, core.minus(core.intLiteral(0), f.x));
    assertThat(template, hasToString("if ?cond_1 then x else 0 - x"));
    final Solution s2 =
        Recomposition.wrapTermHole(template, hole, core.boolLiteral(true))
            .recompose(
                ImmutableList.of(
                    new Solution(f.lt(10), ImmutableSet.of(), f.xGt0, true)));
    assertThat(s2, notNullValue());
    assertThat(s2.term, hasToString("if x > 0 then x else 0 - x"));
    assertThat(s2.pre, hasToString("x < 10"));
  }

  /** Tests that an instantiation checks that its recomposition expects one
   * solution per child. */
  @Test
  void testInstantiationArity() {
    final Fixture f = new Fixture();
    final Problem problem =
        Problem.of(ImmutableList.of(f.xPat), Path.EMPTY, ImmutableList.of(),
            core.boolLiteral(true), ImmutableList.of(f.yPat),
            ExampleBank.EMPTY);
    assertThrows(IllegalArgumentException.class, () ->
        new RuleInstantiation(FocusRule.INSTANCE, ImmutableList.of(problem),
            Recomposition.wrapConditionalBoth(f.xGt0), "split"));
    final RuleInstantiation ri =
        new RuleInstantiation(FocusRule.INSTANCE,
            ImmutableList.of(problem, problem),
            Recomposition.wrapConditionalBoth(f.xGt0), "split");
    assertThat(ri, hasToString("split"));
    assertThat(ri.recompose(ImmutableList.of(Solution.simple(f.x))),
        nullValue());
  }

  /** Test fixture with common setup. */
  private static class Fixture {
    final DataType intList =
        DataType.builder("intlist").add("Nil", 0).add("Cons", 2).build();
    final Core.IdPat xPat = core.idPat(PrimitiveType.INT, "x");
    final Core.IdPat yPat = core.idPat(PrimitiveType.INT, "y");
    final Core.IdPat lPat = core.idPat(intList, "l");
    final Core.IdPat hPat = core.idPat(PrimitiveType.INT, "h");
    final Core.IdPat tPat = core.idPat(intList, "t");
    final Core.Id x = core.id(xPat);
    final Core.Id l = core.id(lPat);
    final Core.Exp xGt0 = gt(0);
    final Core.FunDef aux1 =
        core.funDef("aux1", ImmutableList.of(xPat), PrimitiveType.INT, x,
            null);
    final Core.FunDef aux2 =
        core.funDef("aux2", ImmutableList.of(xPat), PrimitiveType.INT, x,
            null);

    Core.Exp gt(int i) {
      return core.greaterThan(x, core.intLiteral(i));
    }

    Core.Exp lt(int i) {
      return core.lessThan(x, core.intLiteral(i));
    }
  }
}

// End RecompositionTest.java
