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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms syntax trees.
 *
 * <p>The default implementation of each method rebuilds a node from its
 * transformed children, returning the original node if no child changed.
 * Every sub-expression is transformed via {@link #visitExp}, which
 * sub-classes may override to intercept particular occurrences. */
public class Shuttle {
  /** Transforms an expression. */
  public Core.Exp visitExp(Core.Exp exp) {
    return exp.accept(this);
  }

  protected List<Core.Exp> visitList(List<Core.Exp> exps) {
    final List<Core.Exp> list = new ArrayList<>();
    for (Core.Exp exp : exps) {
      list.add(visitExp(exp));
    }
    return list;
  }

  // patterns

  protected Core.Pat visit(Core.Pat pat) {
    return pat; // leaf
  }

  // expressions

  protected Core.Exp visit(Core.Id id) {
    return id; // leaf
  }

  protected Core.Exp visit(Core.Literal literal) {
    return literal; // leaf
  }

  protected Core.Exp visit(Core.Hole hole) {
    return hole; // leaf
  }

  protected Core.Exp visit(Core.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Core.Exp visit(Core.Con con) {
    return con.copy(visitList(con.args));
  }

  protected Core.Exp visit(Core.TupleSelect tupleSelect) {
    return tupleSelect.copy(visitExp(tupleSelect.exp));
  }

  protected Core.Exp visit(Core.ConSelect conSelect) {
    return conSelect.copy(visitExp(conSelect.exp));
  }

  protected Core.Exp visit(Core.ConTest conTest) {
    return conTest.copy(visitExp(conTest.exp));
  }

  protected Core.Exp visit(Core.Not not) {
    return not.copy(visitExp(not.exp));
  }

  protected Core.Exp visit(Core.Call2 call2) {
    return call2.copy(visitExp(call2.a0), visitExp(call2.a1));
  }

  protected Core.Exp visit(Core.Call call) {
    return call.copy(visitList(call.args));
  }

  protected Core.Exp visit(Core.If ifThenElse) {
    return ifThenElse.copy(visitExp(ifThenElse.condition),
        visitExp(ifThenElse.ifTrue), visitExp(ifThenElse.ifFalse));
  }

  protected Core.Match visit(Core.Match match) {
    return match.copy(match.pat.accept(this), visitExp(match.exp));
  }

  protected Core.Exp visit(Core.Case caseOf) {
    final List<Core.Match> matchList = new ArrayList<>();
    caseOf.matchList.forEach(match -> matchList.add(match.accept(this)));
    return caseOf.copy(visitExp(caseOf.exp), matchList);
  }

  protected Core.Exp visit(Core.Let let) {
    return let.copy(visitExp(let.value), visitExp(let.exp));
  }

  protected Core.Exp visit(Core.Fn fn) {
    return fn.copy(visitExp(fn.exp));
  }

  // declarations

  protected Core.FunDef visit(Core.FunDef funDef) {
    return funDef.copy(visitExp(funDef.body));
  }
}

// End Shuttle.java
