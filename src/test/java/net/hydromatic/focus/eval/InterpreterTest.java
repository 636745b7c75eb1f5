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

import static net.hydromatic.focus.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Op;
import net.hydromatic.focus.ast.Program;
import net.hydromatic.focus.type.DataType;
import net.hydromatic.focus.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interpreter} and {@link DefaultEvaluator}. */
public class InterpreterTest {
  @Test
  void testArithmetic() {
    final Fixture f = new Fixture();
    f.assertEval(core.plus(f.x, core.intLiteral(1)), 5, "Success(6)");
    f.assertEval(core.call2(Op.DIV, core.intLiteral(-7), f.x), 2,
        "Success(-4)");
    f.assertEval(core.call2(Op.MOD, core.intLiteral(-7), f.x), 2,
        "Success(1)");
    f.assertEval(core.call2(Op.DIV, core.intLiteral(1), f.x), 0,
        "RUNTIME_ERROR(division by zero)");
    f.assertEval(core.greaterThan(f.x, core.intLiteral(0)), -1,
        "Success(false)");
    f.assertEval(
        core.call2(Op.LT, core.stringLiteral("abc"),
            core.stringLiteral("abd")), 0,
        "Success(true)");
  }

  @Test
  void testBoolean() {
    final Fixture f = new Fixture();
    // "andalso" does not evaluate its right argument if the left is false
    final Core.Exp divByZero =
        core.equal(core.call2(Op.DIV, f.x, core.intLiteral(0)),
            core.intLiteral(1));
    f.assertEval(
        core.andAlso(core.greaterThan(f.x, core.intLiteral(10)), divByZero),
        5, "Success(false)");
    f.assertEval(
        core.orElse(core.greaterThan(f.x, core.intLiteral(0)), divByZero),
        5, "Success(true)");
    f.assertEval(core.not(core.equal(f.x, core.intLiteral(5))), 5,
        "Success(false)");
    f.assertEval(core.ifThenElse(f.x, f.x, f.x), 5,
        "RUNTIME_ERROR(not a bool: 5)");
  }

  @Test
  void testDataType() {
    final Fixture f = new Fixture();
    final Core.Exp list =
        core.con(f.intList, "Cons", f.x, core.con(f.intList, "Nil"));
    f.assertEval(list, 3, "Success([Cons, 3, [Nil]])");
    f.assertEval(core.conTest(list, "Cons"), 3, "Success(true)");
    f.assertEval(core.conSelect(PrimitiveType.INT, list, "Cons", 0), 3,
        "Success(3)");
    f.assertEval(
        core.conSelect(PrimitiveType.INT, core.con(f.intList, "Nil"), "Cons",
            0), 3,
        "RUNTIME_ERROR(value [Nil] was not built by Cons)");
    f.assertEval(core.tupleSelect(PrimitiveType.INT, core.tuple(f.x, list), 0),
        3, "Success(3)");
    assertThat(Values.intList(1, 2),
        is(Values.con("Cons", 1, Values.con("Cons", 2, Values.con("Nil")))));
  }

  /** A data type value with too few fields is a runtime error, not a
   * crash. */
  @Test
  void testMalformedDataType() {
    final Fixture f = new Fixture();
    final Evaluator evaluator = new DefaultEvaluator(Program.of());
    final EvalEnv env =
        EvalEnvs.of(ImmutableList.of(f.lPat),
            ImmutableList.of(Values.con("Cons", 1)));
    assertThat(
        evaluator.eval(core.conSelect(f.intList, f.l, "Cons", 1), env),
        hasToString("RUNTIME_ERROR(no field 2 in [Cons, 1])"));
    final Core.Exp caseExp =
        core.caseOf(f.l,
            core.match(core.conPat(f.intList, "Nil"), core.intLiteral(1)),
            core.match(core.conPat(f.intList, "Cons", f.hPat, f.tPat),
                core.id(f.hPat)));
    assertThat(evaluator.eval(caseExp, env),
        hasToString("RUNTIME_ERROR(value [Cons, 1] has wrong number of "
            + "fields for Cons)"));
  }

  @Test
  void testCaseAndCall() {
    final Fixture f = new Fixture();
    final Program program = Program.of(f.sum);
    final Evaluator evaluator = new DefaultEvaluator(program);
    final EvalEnv env =
        EvalEnvs.of(ImmutableList.of(f.lPat),
            ImmutableList.of(Values.intList(1, 2, 3)));
    assertThat(
        evaluator.eval(core.call(PrimitiveType.INT, "sum", f.l), env),
        hasToString("Success(6)"));
    assertThat(
        evaluator.eval(core.call(PrimitiveType.INT, "product", f.l), env),
        hasToString("RUNTIME_ERROR(unknown function product)"));

    // A "case" with no matching pattern fails
    final Core.Exp onlyNil =
        core.caseOf(f.l,
            core.match(core.conPat(f.intList, "Nil"), core.intLiteral(0)));
    assertThat(evaluator.eval(onlyNil, env),
        hasToString("RUNTIME_ERROR(no match for [Cons, 1, [Cons, 2, "
            + "[Cons, 3, [Nil]]]])"));

    // Literal and tuple patterns
    final Core.Exp tupleCase =
        core.caseOf(core.tuple(core.intLiteral(1), core.intLiteral(2)),
            core.match(
                core.tuplePat(core.literalPat(core.intLiteral(0)),
                    core.wildcardPat(PrimitiveType.INT)),
                core.stringLiteral("zero")),
            core.match(core.tuplePat(core.idPat(PrimitiveType.INT, "a"),
                    f.yPat),
                core.plus(f.y, f.y)));
    assertThat(evaluator.eval(tupleCase, EvalEnvs.empty()),
        hasToString("Success(4)"));
  }

  @Test
  void testLimits() {
    final Fixture f = new Fixture();
    final Core.FunDef loop =
        core.funDef("loop", ImmutableList.of(f.xPat), PrimitiveType.INT,
            core.call(PrimitiveType.INT, "loop", f.x), null);
    final Program program = Program.of(loop);
    final Core.Exp call = core.call(PrimitiveType.INT, "loop", f.x);
    final EvalEnv env = EvalEnvs.of(ImmutableList.of(f.xPat),
        ImmutableList.of(1));
    assertThat(new DefaultEvaluator(program).eval(call, env),
        hasToString("EVALUATOR_ERROR(exceeded call depth 400)"));
    assertThat(
        new DefaultEvaluator(program, ImmutableMap.of(Prop.MAX_STEPS, 10))
            .eval(call, env),
        hasToString("EVALUATOR_ERROR(exceeded 10 steps)"));

    // Holes cannot be evaluated
    assertThat(
        new DefaultEvaluator(program)
            .eval(core.hole(PrimitiveType.INT, "h"), env),
        hasToString("EVALUATOR_ERROR(cannot evaluate hole ?h)"));
    assertThat(
        new DefaultEvaluator(program)
            .eval(core.id(core.idPat(PrimitiveType.INT, "z")), env),
        hasToString("RUNTIME_ERROR(unbound variable z)"));
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
    final Core.Id y = core.id(yPat);
    final Core.Id l = core.id(lPat);

    /** "fun sum(l) = case l of Nil => 0 | Cons(h, t) => h + sum(t)". */
    final Core.FunDef sum =
        core.funDef("sum", ImmutableList.of(lPat), PrimitiveType.INT,
            core.caseOf(l,
                core.match(core.conPat(intList, "Nil"), core.intLiteral(0)),
                core.match(core.conPat(intList, "Cons", hPat, tPat),
                    core.plus(core.id(hPat),
                        core.call(PrimitiveType.INT, "sum",
                            core.id(tPat))))),
            null);

    /** Evaluates an expression with "x" bound to an integer. */
    void assertEval(Core.Exp exp, int xValue, String expected) {
      final Evaluator evaluator = new DefaultEvaluator(Program.of());
      final EvalEnv env =
          EvalEnvs.of(ImmutableList.of(xPat), ImmutableList.of(xValue));
      assertThat(evaluator.eval(exp, env), hasToString(expected));
    }
  }
}

// End InterpreterTest.java
