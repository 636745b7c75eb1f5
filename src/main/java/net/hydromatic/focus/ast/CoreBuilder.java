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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.Iterables.getOnlyElement;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.focus.type.DataType;
import net.hydromatic.focus.type.PrimitiveType;
import net.hydromatic.focus.type.TupleType;
import net.hydromatic.focus.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes.
 *
 * <p>Builder methods for boolean connectives perform the obvious
 * simplifications ({@code true andalso e} is {@code e}, {@code not (not e)}
 * is {@code e}, and so forth). */
public enum CoreBuilder {
  /** The singleton instance of the CORE builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  private final Core.Literal trueLiteral =
      new Core.Literal(Op.BOOL_LITERAL, PrimitiveType.BOOL, true);

  private final Core.Literal falseLiteral =
      new Core.Literal(Op.BOOL_LITERAL, PrimitiveType.BOOL, false);

  /** Creates a {@code bool} literal. */
  public Core.Literal boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates an {@code int} literal. */
  public Core.Literal intLiteral(int value) {
    return new Core.Literal(Op.INT_LITERAL, PrimitiveType.INT, value);
  }

  /** Creates a {@code string} literal. */
  public Core.Literal stringLiteral(String value) {
    return new Core.Literal(Op.STRING_LITERAL, PrimitiveType.STRING, value);
  }

  /** Creates a reference to a variable. */
  public Core.Id id(Core.IdPat idPat) {
    return new Core.Id(idPat);
  }

  public Core.IdPat idPat(Type type, String name, int i) {
    return new Core.IdPat(type, name, i);
  }

  public Core.IdPat idPat(Type type, String name) {
    return new Core.IdPat(type, name, 0);
  }

  public Core.WildcardPat wildcardPat(Type type) {
    return new Core.WildcardPat(type);
  }

  /** Creates a pattern that matches the value of a literal. */
  public Core.LiteralPat literalPat(Core.Literal literal) {
    return new Core.LiteralPat(literal.op.toPat(), literal.type,
        literal.value);
  }

  public Core.ConPat conPat(DataType type, String tyCon, Core.Pat... args) {
    return new Core.ConPat(type, tyCon, ImmutableList.copyOf(args));
  }

  public Core.TuplePat tuplePat(List<? extends Core.Pat> args) {
    final List<Type> types = new ArrayList<>();
    args.forEach(arg -> types.add(arg.type));
    return new Core.TuplePat(new TupleType(types), ImmutableList.copyOf(args));
  }

  public Core.TuplePat tuplePat(Core.Pat... args) {
    return tuplePat(ImmutableList.copyOf(args));
  }

  /** Creates a tuple; its type is derived from the types of its arguments. */
  public Core.Tuple tuple(List<? extends Core.Exp> args) {
    final List<Type> types = new ArrayList<>();
    args.forEach(arg -> types.add(arg.type));
    return new Core.Tuple(new TupleType(types), ImmutableList.copyOf(args));
  }

  public Core.Tuple tuple(Core.Exp... args) {
    return tuple(ImmutableList.copyOf(args));
  }

  /** Creates an application of a data type constructor. */
  public Core.Con con(DataType type, String tyCon,
      List<? extends Core.Exp> args) {
    return new Core.Con(type, tyCon, ImmutableList.copyOf(args));
  }

  public Core.Con con(DataType type, String tyCon, Core.Exp... args) {
    return con(type, tyCon, ImmutableList.copyOf(args));
  }

  /** Creates an expression that selects field {@code slot} (zero-based) of a
   * tuple. */
  public Core.TupleSelect tupleSelect(Type type, Core.Exp exp, int slot) {
    return new Core.TupleSelect(type, exp, slot);
  }

  /** Creates an expression that selects argument {@code slot} (zero-based) of
   * a constructor value. */
  public Core.ConSelect conSelect(Type type, Core.Exp exp, String tyCon,
      int slot) {
    return new Core.ConSelect(type, exp, tyCon, slot);
  }

  public Core.ConTest conTest(Core.Exp exp, String tyCon) {
    return new Core.ConTest(exp, tyCon);
  }

  /** Creates a call to a built-in binary operator. */
  public Core.Call2 call2(Op op, Core.Exp a0, Core.Exp a1) {
    switch (op) {
    case TIMES:
    case DIV:
    case MOD:
    case PLUS:
    case MINUS:
      return new Core.Call2(op, PrimitiveType.INT, a0, a1);
    default:
      return new Core.Call2(op, PrimitiveType.BOOL, a0, a1);
    }
  }

  public Core.Exp equal(Core.Exp a0, Core.Exp a1) {
    return call2(Op.EQ, a0, a1);
  }

  public Core.Exp lessThan(Core.Exp a0, Core.Exp a1) {
    return call2(Op.LT, a0, a1);
  }

  public Core.Exp greaterThan(Core.Exp a0, Core.Exp a1) {
    return call2(Op.GT, a0, a1);
  }

  public Core.Exp plus(Core.Exp a0, Core.Exp a1) {
    return call2(Op.PLUS, a0, a1);
  }

  public Core.Exp minus(Core.Exp a0, Core.Exp a1) {
    return call2(Op.MINUS, a0, a1);
  }

  public Core.Exp times(Core.Exp a0, Core.Exp a1) {
    return call2(Op.TIMES, a0, a1);
  }

  /** Creates a negation, simplifying if possible. */
  public Core.Exp not(Core.Exp exp) {
    if (exp.isBoolLiteral(true)) {
      return falseLiteral;
    }
    if (exp.isBoolLiteral(false)) {
      return trueLiteral;
    }
    if (exp.op == Op.NOT) {
      return ((Core.Not) exp).exp;
    }
    return new Core.Not(exp);
  }

  /** Creates a conjunction, simplifying if possible. */
  public Core.Exp andAlso(Core.Exp a0, Core.Exp a1) {
    if (a0.isBoolLiteral(true) || a1.isBoolLiteral(false)) {
      return a1;
    }
    if (a1.isBoolLiteral(true) || a0.isBoolLiteral(false)) {
      return a0;
    }
    return call2(Op.ANDALSO, a0, a1);
  }

  /** Creates a disjunction, simplifying if possible. */
  public Core.Exp orElse(Core.Exp a0, Core.Exp a1) {
    if (a0.isBoolLiteral(false) || a1.isBoolLiteral(true)) {
      return a1;
    }
    if (a1.isBoolLiteral(false) || a0.isBoolLiteral(true)) {
      return a0;
    }
    return call2(Op.ORELSE, a0, a1);
  }

  /** Joins a list of expressions with "andalso"; returns {@code true} if the
   * list is empty. */
  public Core.Exp andAlso(Iterable<? extends Core.Exp> exps) {
    Core.Exp result = trueLiteral;
    for (Core.Exp exp : exps) {
      result = andAlso(result, exp);
    }
    return result;
  }

  /** Joins a list of expressions with "orelse"; returns {@code false} if the
   * list is empty. */
  public Core.Exp orElse(Iterable<? extends Core.Exp> exps) {
    Core.Exp result = falseLiteral;
    for (Core.Exp exp : exps) {
      result = orElse(result, exp);
    }
    return result;
  }

  /** Creates a call to a function defined in the program. */
  public Core.Call call(Type type, String name,
      List<? extends Core.Exp> args) {
    return new Core.Call(type, name, ImmutableList.copyOf(args));
  }

  public Core.Call call(Type type, String name, Core.Exp... args) {
    return call(type, name, ImmutableList.copyOf(args));
  }

  public Core.If ifThenElse(Core.Exp condition, Core.Exp ifTrue,
      Core.Exp ifFalse) {
    return new Core.If(condition, ifTrue, ifFalse);
  }

  public Core.Match match(Core.Pat pat, Core.Exp exp) {
    return new Core.Match(pat, exp);
  }

  public Core.Case caseOf(Type type, Core.Exp exp,
      List<? extends Core.Match> matchList) {
    return new Core.Case(type, exp, ImmutableList.copyOf(matchList));
  }

  public Core.Case caseOf(Core.Exp exp, Core.Match... matches) {
    return caseOf(matches[0].exp.type, exp, ImmutableList.copyOf(matches));
  }

  public Core.Let let(Core.IdPat idPat, Core.Exp value, Core.Exp exp) {
    return new Core.Let(idPat, value, exp);
  }

  /** Binds a list of variables to the components of a value.
   *
   * <p>With one variable, creates "let val x = value in exp end"; otherwise
   * creates "case value of (x, y, ...) => exp". */
  public Core.Exp letTuple(List<Core.IdPat> idPats, Core.Exp value,
      Core.Exp exp) {
    checkArgument(!idPats.isEmpty(), "no variables");
    if (idPats.size() == 1) {
      return let(getOnlyElement(idPats), value, exp);
    }
    return caseOf(exp.type, value,
        ImmutableList.of(match(tuplePat(idPats), exp)));
  }

  public Core.Hole hole(Type type, String name) {
    return new Core.Hole(type, name);
  }

  public Core.Fn fn(Core.IdPat idPat, Core.Exp exp) {
    return new Core.Fn(idPat, exp);
  }

  /** Applies a lambda to an argument, converting it into a "let". */
  public Core.Exp apply(Core.Fn fn, Core.Exp arg) {
    return let(fn.idPat, arg, fn.exp);
  }

  public Core.FunDef funDef(String name, List<Core.IdPat> params,
      Type returnType, Core.Exp body, Core.@Nullable Fn post) {
    return new Core.FunDef(name, ImmutableList.copyOf(params), returnType,
        body, post);
  }
}

// End CoreBuilder.java
