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
package net.hydromatic.focus.ast;

import static net.hydromatic.focus.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableList;
import net.hydromatic.focus.type.DataType;
import net.hydromatic.focus.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Core}, {@link CoreBuilder} and {@link Replacer}. */
public class CoreTest {
  /** Tests that expressions are converted to strings with the minimum of
   * parentheses. */
  @Test
  void testUnparse() {
    final Fixture f = new Fixture();
    final Core.Exp xGt0 = core.greaterThan(f.x, core.intLiteral(0));
    assertThat(xGt0, hasToString("x > 0"));
    assertThat(core.not(xGt0), hasToString("not (x > 0)"));
    assertThat(core.plus(core.times(f.x, f.x), core.intLiteral(-1)),
        hasToString("x * x + ~1"));
    assertThat(core.times(core.plus(f.x, f.x), core.intLiteral(2)),
        hasToString("(x + x) * 2"));
    assertThat(core.minus(f.x, core.minus(f.x, f.x)),
        hasToString("x - (x - x)"));
    assertThat(core.andAlso(xGt0, core.orElse(xGt0, xGt0)),
        hasToString("x > 0 andalso (x > 0 orelse x > 0)"));
    assertThat(
        core.ifThenElse(xGt0, core.plus(f.x, core.intLiteral(1)),
            core.minus(core.intLiteral(0), f.x)),
        hasToString("if x > 0 then x + 1 else 0 - x"));
    assertThat(core.stringLiteral("a\"b"), hasToString("\"a\\\"b\""));
    assertThat(core.let(f.yPat, core.intLiteral(1), core.plus(f.x, f.y)),
        hasToString("let val y = 1 in x + y end"));
    assertThat(core.hole(PrimitiveType.INT, "h"), hasToString("?h"));
    assertThat(core.idPat(PrimitiveType.INT, "x", 2), hasToString("x_2"));
  }

  /** Tests constructors, selectors and "case". */
  @Test
  void testUnparseDataType() {
    final Fixture f = new Fixture();
    final Core.Exp cons =
        core.con(f.intList, "Cons", core.intLiteral(1),
            core.con(f.intList, "Nil"));
    assertThat(cons, hasToString("Cons(1, Nil)"));
    assertThat(core.conTest(f.l, "Nil"), hasToString("l is Nil"));
    assertThat(core.not(core.conTest(f.l, "Nil")),
        hasToString("not (l is Nil)"));
    assertThat(core.conSelect(PrimitiveType.INT, f.l, "Cons", 0),
        hasToString("#Cons.1 l"));
    assertThat(
        core.conSelect(f.intList,
            core.conSelect(f.intList, f.l, "Cons", 1), "Cons", 1),
        hasToString("#Cons.2 (#Cons.2 l)"));

    final Core.Exp caseExp = f.sumCase();
    assertThat(caseExp,
        hasToString("case l of Nil => 0 | Cons(h, t) => h + 1"));

    // A "case" in a non-final arm is parenthesized
    final Core.Exp nested =
        core.caseOf(f.l,
            core.match(core.wildcardPat(f.intList),
                core.ifThenElse(core.boolLiteral(true), f.x, f.x)),
            core.match(core.wildcardPat(f.intList), f.x));
    assertThat(nested,
        hasToString("case l of _ => (if true then x else x) | _ => x"));
  }

  /** Tests the simplifications that {@link CoreBuilder} makes. */
  @Test
  void testSimplify() {
    final Fixture f = new Fixture();
    final Core.Exp xGt0 = core.greaterThan(f.x, core.intLiteral(0));
    final Core.Exp trueLiteral = core.boolLiteral(true);
    final Core.Exp falseLiteral = core.boolLiteral(false);
    assertThat(core.not(trueLiteral), hasToString("false"));
    assertThat(core.not(core.not(xGt0)), sameInstance(xGt0));
    assertThat(core.andAlso(trueLiteral, xGt0), sameInstance(xGt0));
    assertThat(core.andAlso(xGt0, trueLiteral), sameInstance(xGt0));
    assertThat(core.andAlso(xGt0, falseLiteral), hasToString("false"));
    assertThat(core.orElse(falseLiteral, xGt0), sameInstance(xGt0));
    assertThat(core.orElse(xGt0, trueLiteral), hasToString("true"));
    assertThat(core.andAlso(ImmutableList.of()), hasToString("true"));
    assertThat(core.orElse(ImmutableList.of()), hasToString("false"));
    assertThat(core.orElse(ImmutableList.of(xGt0, xGt0)),
        hasToString("x > 0 orelse x > 0"));
  }

  @Test
  void testLetTuple() {
    final Fixture f = new Fixture();
    final Core.Exp value = core.tuple(f.x, f.x);
    assertThat(
        core.letTuple(ImmutableList.of(f.yPat), f.x, f.y),
        hasToString("let val y = x in y end"));
    assertThat(
        core.letTuple(ImmutableList.of(f.yPat, f.zPat), value,
            core.plus(f.y, f.z)),
        hasToString("case (x, x) of (y, z) => y + z"));
  }

  /** Tests that {@link Replacer} replaces by identity, not by equality. */
  @Test
  void testReplaceByIdentity() {
    final Fixture f = new Fixture();
    final Core.Exp c1 = core.greaterThan(f.x, core.intLiteral(0));
    final Core.Exp c2 = core.greaterThan(f.x, core.intLiteral(0));
    final Core.Exp e = core.call2(Op.ANDALSO, c1, c2);
    final Core.Exp e2 = Replacer.replace(e, c2, core.not(c2));
    assertThat(e2, hasToString("x > 0 andalso not (x > 0)"));
    assertThat(((Core.Call2) e2).a0, sameInstance(c1));

    // Nothing to replace; the same tree is returned
    final Core.Exp e3 =
        Replacer.replace(e, core.greaterThan(f.x, core.intLiteral(0)),
            core.boolLiteral(true));
    assertThat(e3, sameInstance(e));

    // Replacing inside a "case"
    final Core.Case caseExp = f.sumCase();
    final Core.Exp body = caseExp.matchList.get(1).exp;
    assertThat(Replacer.replace(caseExp, body, f.x),
        hasToString("case l of Nil => 0 | Cons(h, t) => x"));
  }

  @Test
  void testProgram() {
    final Fixture f = new Fixture();
    final Core.FunDef inc =
        core.funDef("inc", ImmutableList.of(f.xPat), PrimitiveType.INT,
            core.plus(f.x, core.intLiteral(1)),
            core.fn(f.yPat, core.greaterThan(f.y, f.x)));
    final Program program = Program.of(inc);
    assertThat(program.lookup("inc"), sameInstance(inc));
    assertThat(program.lookup("dec") == null, is(true));
    assertThat(program,
        hasToString("fun inc(x) = x + 1 ensuring fn y => y > x\n"));
  }

  /** Test fixture with common setup. */
  private static class Fixture {
    final DataType intList =
        DataType.builder("intlist").add("Nil", 0).add("Cons", 2).build();
    final Core.IdPat xPat = core.idPat(PrimitiveType.INT, "x");
    final Core.IdPat yPat = core.idPat(PrimitiveType.INT, "y");
    final Core.IdPat zPat = core.idPat(PrimitiveType.INT, "z");
    final Core.IdPat lPat = core.idPat(intList, "l");
    final Core.IdPat hPat = core.idPat(PrimitiveType.INT, "h");
    final Core.IdPat tPat = core.idPat(intList, "t");
    final Core.Id x = core.id(xPat);
    final Core.Id y = core.id(yPat);
    final Core.Id z = core.id(zPat);
    final Core.Id l = core.id(lPat);

    Core.Case sumCase() {
      return core.caseOf(l,
          core.match(core.conPat(intList, "Nil"), core.intLiteral(0)),
          core.match(core.conPat(intList, "Cons", hPat, tPat),
              core.plus(core.id(hPat), core.intLiteral(1))));
    }
  }
}

// End CoreTest.java
