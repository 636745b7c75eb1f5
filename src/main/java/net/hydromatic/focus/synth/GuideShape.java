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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.focus.ast.CoreBuilder.core;

import net.hydromatic.focus.ast.Core;

/** The focus rule's view of a guide expression.
 *
 * <p>The rule only needs to know the guide's top-level shape, and how to
 * rebuild the guide with one of its parts replaced. */
public abstract class GuideShape {
  public final Kind kind;

  private GuideShape(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the shape of an expression. */
  public static GuideShape of(Core.Exp exp) {
    switch (exp.op) {
    case IF:
      return new Conditional((Core.If) exp);
    case CASE:
      return new PatternMatch((Core.Case) exp);
    case LET:
      return new Binding((Core.Let) exp);
    default:
      return new Opaque(exp);
    }
  }

  /** Kind of guide. */
  public enum Kind {
    CONDITIONAL, PATTERN_MATCH, BINDING, OPAQUE
  }

  /** Guide of the form "if condition then ifTrue else ifFalse". */
  public static class Conditional extends GuideShape {
    public final Core.If exp;

    Conditional(Core.If exp) {
      super(Kind.CONDITIONAL);
      this.exp = requireNonNull(exp);
    }

    public Core.Exp condition() {
      return exp.condition;
    }

    public Core.Exp ifTrue() {
      return exp.ifTrue;
    }

    public Core.Exp ifFalse() {
      return exp.ifFalse;
    }

    /** Returns a conditional with the same branches and a different
     * condition. */
    public Core.If withCondition(Core.Exp condition) {
      return core.ifThenElse(condition, exp.ifTrue, exp.ifFalse);
    }
  }

  /** Guide of the form "case scrut of p1 => e1 | ...". */
  public static class PatternMatch extends GuideShape {
    public final Core.Case exp;

    PatternMatch(Core.Case exp) {
      super(Kind.PATTERN_MATCH);
      this.exp = requireNonNull(exp);
    }

    public Core.Exp scrut() {
      return exp.exp;
    }
  }

  /** Guide of the form "let val id = value in body end". */
  public static class Binding extends GuideShape {
    public final Core.Let exp;

    Binding(Core.Let exp) {
      super(Kind.BINDING);
      this.exp = requireNonNull(exp);
    }
  }

  /** Any other guide. The focus rule cannot decompose it. */
  public static class Opaque extends GuideShape {
    public final Core.Exp exp;

    Opaque(Core.Exp exp) {
      super(Kind.OPAQUE);
      this.exp = requireNonNull(exp);
    }
  }
}

// End GuideShape.java
