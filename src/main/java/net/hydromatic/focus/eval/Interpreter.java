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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Program;

/** Evaluates {@link Core} expressions by walking the tree.
 *
 * <p>An interpreter counts the steps it has taken, so should be used for one
 * evaluation only. Errors are thrown as {@link EvalException}.
 *
 * <p>Sub-classes may override {@link #eval} to intercept particular
 * sub-expressions; see {@link AngelicEvaluator}. */
public class Interpreter {
  protected final Program program;
  private final int maxSteps;
  private final int maxCallDepth;
  private int steps;
  private int callDepth;

  public Interpreter(Program program, int maxSteps, int maxCallDepth) {
    this.program = requireNonNull(program);
    this.maxSteps = maxSteps;
    this.maxCallDepth = maxCallDepth;
  }

  /** Evaluates an expression. */
  public Object eval(Core.Exp exp, EvalEnv env) {
    if (++steps > maxSteps) {
      throw EvalException.evaluator("exceeded " + maxSteps + " steps");
    }
    switch (exp.op) {
    case ID:
      final Core.Id id = (Core.Id) exp;
      final Object value = env.getOpt(id.idPat);
      if (value == null) {
        throw EvalException.runtime("unbound variable " + id);
      }
      return value;

    case BOOL_LITERAL:
    case INT_LITERAL:
    case STRING_LITERAL:
      return ((Core.Literal) exp).value;

    case TUPLE:
      return evalList(((Core.Tuple) exp).args, env);

    case CON:
      final Core.Con con = (Core.Con) exp;
      return ImmutableList.builder().add(con.tyCon)
          .addAll(evalList(con.args, env)).build();

    case TUPLE_SELECT:
      final Core.TupleSelect tupleSelect = (Core.TupleSelect) exp;
      final List<?> tuple = asList(eval(tupleSelect.exp, env));
      if (tupleSelect.slot >= tuple.size()) {
        throw EvalException.runtime("no field " + (tupleSelect.slot + 1)
            + " in " + tuple);
      }
      return tuple.get(tupleSelect.slot);

    case CON_SELECT:
      final Core.ConSelect conSelect = (Core.ConSelect) exp;
      final Object conValue = eval(conSelect.exp, env);
      if (!Values.isCon(conValue, conSelect.tyCon)) {
        throw EvalException.runtime("value " + conValue
            + " was not built by " + conSelect.tyCon);
      }
      final List<?> fields = asList(conValue);
      if (conSelect.slot + 1 >= fields.size()) {
        throw EvalException.runtime("no field " + (conSelect.slot + 1)
            + " in " + conValue);
      }
      return fields.get(conSelect.slot + 1);

    case CON_TEST:
      final Core.ConTest conTest = (Core.ConTest) exp;
      final Object testValue = eval(conTest.exp, env);
      if (!(testValue instanceof List) || ((List<?>) testValue).isEmpty()) {
        throw EvalException.runtime("not a data type value: " + testValue);
      }
      return Values.isCon(testValue, conTest.tyCon);

    case NOT:
      return !asBoolean(eval(((Core.Not) exp).exp, env));

    case ANDALSO:
      final Core.Call2 andAlso = (Core.Call2) exp;
      return asBoolean(eval(andAlso.a0, env))
          && asBoolean(eval(andAlso.a1, env));

    case ORELSE:
      final Core.Call2 orElse = (Core.Call2) exp;
      return asBoolean(eval(orElse.a0, env))
          || asBoolean(eval(orElse.a1, env));

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
    case PLUS:
    case MINUS:
    case TIMES:
    case DIV:
    case MOD:
      final Core.Call2 call2 = (Core.Call2) exp;
      return binary(call2, eval(call2.a0, env), eval(call2.a1, env));

    case CALL:
      return call((Core.Call) exp, env);

    case IF:
      final Core.If ifThenElse = (Core.If) exp;
      return asBoolean(eval(ifThenElse.condition, env))
          ? eval(ifThenElse.ifTrue, env)
          : eval(ifThenElse.ifFalse, env);

    case CASE:
      final Core.Case caseOf = (Core.Case) exp;
      final Object scrutinee = eval(caseOf.exp, env);
      for (Core.Match match : caseOf.matchList) {
        final EvalEnv[] envRef = {env};
        if (bindRecurse(match.pat, envRef, scrutinee)) {
          return eval(match.exp, envRef[0]);
        }
      }
      throw EvalException.runtime("no match for " + scrutinee);

    case LET:
      final Core.Let let = (Core.Let) exp;
      return eval(let.exp, env.bind(let.idPat, eval(let.value, env)));

    case HOLE:
      throw EvalException.evaluator("cannot evaluate hole " + exp);

    default:
      throw EvalException.evaluator("cannot evaluate " + exp.op);
    }
  }

  private List<Object> evalList(List<Core.Exp> exps, EvalEnv env) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (Core.Exp exp : exps) {
      b.add(eval(exp, env));
    }
    return b.build();
  }

  private Object call(Core.Call call, EvalEnv env) {
    final Core.FunDef funDef = program.lookup(call.name);
    if (funDef == null) {
      throw EvalException.runtime("unknown function " + call.name);
    }
    if (funDef.params.size() != call.args.size()) {
      throw EvalException.runtime("function " + call.name + " expects "
          + funDef.params.size() + " arguments");
    }
    final List<Object> args = evalList(call.args, env);
    if (++callDepth > maxCallDepth) {
      throw EvalException.evaluator("exceeded call depth " + maxCallDepth);
    }
    try {
      return eval(funDef.body, EvalEnvs.of(funDef.params, args));
    } finally {
      --callDepth;
    }
  }

  private static Object binary(Core.Call2 call2, Object v0, Object v1) {
    switch (call2.op) {
    case EQ:
      return Objects.equals(v0, v1);
    case NE:
      return !Objects.equals(v0, v1);
    case LT:
      return compare(v0, v1) < 0;
    case LE:
      return compare(v0, v1) <= 0;
    case GT:
      return compare(v0, v1) > 0;
    case GE:
      return compare(v0, v1) >= 0;
    case PLUS:
      return asInt(v0) + asInt(v1);
    case MINUS:
      return asInt(v0) - asInt(v1);
    case TIMES:
      return asInt(v0) * asInt(v1);
    case DIV:
      if (asInt(v1) == 0) {
        throw EvalException.runtime("division by zero");
      }
      return Math.floorDiv(asInt(v0), asInt(v1));
    case MOD:
      if (asInt(v1) == 0) {
        throw EvalException.runtime("division by zero");
      }
      return Math.floorMod(asInt(v0), asInt(v1));
    default:
      throw new AssertionError("unknown op " + call2.op);
    }
  }

  private static int compare(Object v0, Object v1) {
    if (v0 instanceof Integer && v1 instanceof Integer) {
      return Integer.compare((Integer) v0, (Integer) v1);
    }
    if (v0 instanceof String && v1 instanceof String) {
      return ((String) v0).compareTo((String) v1);
    }
    throw EvalException.runtime("cannot compare " + v0 + " and " + v1);
  }

  /** Binds the variables of a pattern, if it matches a value.
   * Returns whether the pattern matched. */
  protected boolean bindRecurse(Core.Pat pat, EvalEnv[] envRef,
      Object argValue) {
    final List<?> listValue;
    switch (pat.op) {
    case ID_PAT:
      envRef[0] = envRef[0].bind((Core.IdPat) pat, argValue);
      return true;

    case WILDCARD_PAT:
      return true;

    case BOOL_LITERAL_PAT:
    case INT_LITERAL_PAT:
    case STRING_LITERAL_PAT:
      return ((Core.LiteralPat) pat).value.equals(argValue);

    case TUPLE_PAT:
      final Core.TuplePat tuplePat = (Core.TuplePat) pat;
      listValue = asList(argValue);
      if (listValue.size() != tuplePat.args.size()) {
        return false;
      }
      for (int i = 0; i < tuplePat.args.size(); i++) {
        if (!bindRecurse(tuplePat.args.get(i), envRef, listValue.get(i))) {
          return false;
        }
      }
      return true;

    case CON_PAT:
      final Core.ConPat conPat = (Core.ConPat) pat;
      if (!Values.isCon(argValue, conPat.tyCon)) {
        return false;
      }
      listValue = asList(argValue);
      if (listValue.size() != conPat.args.size() + 1) {
        throw EvalException.runtime("value " + argValue + " has wrong "
            + "number of fields for " + conPat.tyCon);
      }
      for (int i = 0; i < conPat.args.size(); i++) {
        if (!bindRecurse(conPat.args.get(i), envRef, listValue.get(i + 1))) {
          return false;
        }
      }
      return true;

    default:
      throw new AssertionError("cannot match " + pat.op + ": " + pat);
    }
  }

  static boolean asBoolean(Object o) {
    if (!(o instanceof Boolean)) {
      throw EvalException.runtime("not a bool: " + o);
    }
    return (Boolean) o;
  }

  static int asInt(Object o) {
    if (!(o instanceof Integer)) {
      throw EvalException.runtime("not an int: " + o);
    }
    return (Integer) o;
  }

  static List<?> asList(Object o) {
    if (!(o instanceof List)) {
      throw EvalException.runtime("not a tuple or data type value: " + o);
    }
    return (List<?>) o;
  }
}

// End Interpreter.java
