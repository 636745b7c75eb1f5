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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.focus.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.focus.type.DataType;
import net.hydromatic.focus.type.PrimitiveType;
import net.hydromatic.focus.type.TupleType;
import net.hydromatic.focus.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Core expressions.
 *
 * <p>This is the small, strict functional language in which programs under
 * repair are written. This class functions as a namespace, so that we can
 * keep the class names short.
 *
 * <p>Nodes are immutable. Apart from {@link Literal} and {@link IdPat}, nodes
 * use identity equality, so that a particular occurrence of a sub-expression
 * (for example, the one marked for repair) can be located in a larger tree.
 */
public class Core {
  private Core() {}

  /** Abstract base class of Core nodes. */
  abstract static class BaseNode extends AstNode {
    BaseNode(Op op) {
      super(op);
    }
  }

  /**
   * Base class for a pattern.
   *
   * <p>For example, "x" in "fn x => x + 1" is a {@link IdPat}; the "Cons(h, t)"
   * in "case l of Cons(h, t) => h" is a {@link ConPat}.
   */
  public abstract static class Pat extends BaseNode {
    public final Type type;

    Pat(Op op, Type type) {
      super(op);
      this.type = requireNonNull(type);
    }

    /** Returns the type. */
    public Type type() {
      return type;
    }

    @Override
    public Pat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Named pattern. Also serves as the identity of a variable. */
  public static class IdPat extends Pat {
    public final String name;
    public final int i;

    IdPat(Type type, String name, int i) {
      super(Op.ID_PAT, type);
      this.name = requireNonNull(name, "name");
      this.i = i;
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode() + i;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof IdPat
              && ((IdPat) obj).name.equals(name)
              && ((IdPat) obj).i == i;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name, i);
    }
  }

  /** Wildcard pattern.
   *
   * <p>For example, "{@code _}" in "{@code case x of 0 => 1 | _ => 2}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Type type) {
      super(Op.WILDCARD_PAT, type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Literal pattern, the pattern analog of the {@link Literal} expression.
   *
   * <p>For example, "0" in "case n of 0 => 1 | _ => n". */
  @SuppressWarnings("rawtypes")
  public static class LiteralPat extends Pat {
    public final Comparable value;

    LiteralPat(Op op, Type type, Comparable value) {
      super(op, type);
      this.value = requireNonNull(value);
      checkArgument(op == Op.BOOL_LITERAL_PAT
          || op == Op.INT_LITERAL_PAT
          || op == Op.STRING_LITERAL_PAT);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Data type constructor pattern.
   *
   * <p>For example, in "case l of Nil => 0 | Cons(h, t) => h",
   * "Nil" is a constructor pattern with no arguments and "Cons(h, t)" is a
   * constructor pattern with two. */
  public static class ConPat extends Pat {
    public final String tyCon;
    public final ImmutableList<Pat> args;

    ConPat(DataType type, String tyCon, ImmutableList<Pat> args) {
      super(Op.CON_PAT, type);
      this.tyCon = requireNonNull(tyCon);
      this.args = requireNonNull(args);
      checkArgument(type.arity(tyCon) == args.size(),
          "wrong number of arguments to %s", tyCon);
    }

    @Override
    public DataType type() {
      return (DataType) type;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(tyCon);
      if (!args.isEmpty()) {
        w.append("(").appendAll(args, ", ").append(")");
      }
      return w;
    }
  }

  /** Tuple pattern, the pattern analog of the {@link Tuple} expression.
   *
   * <p>For example, "(x, y)" in "case p of (x, y) => x + y". */
  public static class TuplePat extends Pat {
    public final ImmutableList<Pat> args;

    TuplePat(TupleType type, ImmutableList<Pat> args) {
      super(Op.TUPLE_PAT, type);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(args, ", ").append(")");
    }
  }

  /** Base class of core expressions. */
  public abstract static class Exp extends BaseNode {
    public final Type type;

    Exp(Op op, Type type) {
      super(op);
      this.type = requireNonNull(type);
    }

    /** Returns the type. */
    public Type type() {
      return type;
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /** Returns whether this expression is the boolean literal {@code b}. */
    public boolean isBoolLiteral(boolean b) {
      return false;
    }

    /** Returns whether this expression must be wrapped in parentheses if it
     * is not the last thing in its context, because it would otherwise
     * swallow what follows (e.g. "if", "case", "fn"). */
    boolean isOpenEnded() {
      return false;
    }

    /** Writes this expression, in parentheses if it is open-ended and its
     * context has a precedence. */
    AstWriter unparseOpen(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return unparse(w, 0, 0);
    }
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final IdPat idPat;

    Id(IdPat idPat) {
      super(Op.ID, idPat.type);
      this.idPat = requireNonNull(idPat);
    }

    @Override
    public int hashCode() {
      return idPat.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Id
              && this.idPat.equals(((Id) o).idPat);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(idPat.name, idPat.i);
    }
  }

  /** Code of a literal (constant). */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Op op, PrimitiveType type, Comparable value) {
      super(op, type);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && value.equals(((Literal) o).value);
    }

    @Override
    public boolean isBoolLiteral(boolean b) {
      return op == Op.BOOL_LITERAL && value.equals(b);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Tuple expression. */
  public static class Tuple extends Exp {
    public final ImmutableList<Exp> args;

    Tuple(TupleType type, ImmutableList<Exp> args) {
      super(Op.TUPLE, type);
      this.args = requireNonNull(args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(args, ", ").append(")");
    }

    public Exp copy(List<Exp> args) {
      return args.equals(this.args) ? this : core.tuple(args);
    }
  }

  /** Application of a data type constructor, e.g. "Cons(1, Nil)". */
  public static class Con extends Exp {
    public final String tyCon;
    public final ImmutableList<Exp> args;

    Con(DataType type, String tyCon, ImmutableList<Exp> args) {
      super(Op.CON, type);
      this.tyCon = requireNonNull(tyCon);
      this.args = requireNonNull(args);
      checkArgument(type.arity(tyCon) == args.size(),
          "wrong number of arguments to %s", tyCon);
    }

    @Override
    public DataType type() {
      return (DataType) type;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(tyCon);
      if (!args.isEmpty()) {
        w.append("(").appendAll(args, ", ").append(")");
      }
      return w;
    }

    public Exp copy(List<Exp> args) {
      return args.equals(this.args) ? this
          : core.con(type(), tyCon, args);
    }
  }

  /** Selects a field of a tuple, e.g. "#1 p". Slots are zero-based
   * internally and printed one-based. */
  public static class TupleSelect extends Exp {
    public final Exp exp;
    public final int slot;

    TupleSelect(Type type, Exp exp, int slot) {
      super(Op.TUPLE_SELECT, type);
      this.exp = requireNonNull(exp);
      this.slot = slot;
      checkArgument(slot >= 0, "negative slot");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, "#" + (slot + 1) + " ", op, exp, right);
    }

    public Exp copy(Exp exp) {
      return exp == this.exp ? this : core.tupleSelect(type, exp, slot);
    }
  }

  /** Selects an argument of a constructor value, e.g. "#Cons.2 l" is the tail
   * of a list. Fails at run time if the value was built by a different
   * constructor. */
  public static class ConSelect extends Exp {
    public final Exp exp;
    public final String tyCon;
    public final int slot;

    ConSelect(Type type, Exp exp, String tyCon, int slot) {
      super(Op.CON_SELECT, type);
      this.exp = requireNonNull(exp);
      this.tyCon = requireNonNull(tyCon);
      this.slot = slot;
      checkArgument(slot >= 0, "negative slot");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, "#" + tyCon + "." + (slot + 1) + " ", op, exp,
          right);
    }

    public Exp copy(Exp exp) {
      return exp == this.exp ? this
          : core.conSelect(type, exp, tyCon, slot);
    }
  }

  /** Tests whether a value was built by a given constructor,
   * e.g. "l is Nil". */
  public static class ConTest extends Exp {
    public final Exp exp;
    public final String tyCon;

    ConTest(Exp exp, String tyCon) {
      super(Op.CON_TEST, PrimitiveType.BOOL);
      this.exp = requireNonNull(exp);
      this.tyCon = requireNonNull(tyCon);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return w.append(exp, left, op.left).append(op.padded).append(tyCon);
    }

    public Exp copy(Exp exp) {
      return exp == this.exp ? this : core.conTest(exp, tyCon);
    }
  }

  /** Logical negation, "not e". */
  public static class Not extends Exp {
    public final Exp exp;

    Not(Exp exp) {
      super(Op.NOT, PrimitiveType.BOOL);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op.padded, op, exp, right);
    }

    public Exp copy(Exp exp) {
      return exp == this.exp ? this : core.not(exp);
    }
  }

  /** Call to a built-in binary operator, such as "x + 1" or
   * "a andalso b". */
  public static class Call2 extends Exp {
    public final Exp a0;
    public final Exp a1;

    Call2(Op op, Type type, Exp a0, Exp a1) {
      super(op, type);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    public Exp copy(Exp a0, Exp a1) {
      return a0 == this.a0 && a1 == this.a1 ? this
          : core.call2(op, a0, a1);
    }
  }

  /** Call to a function defined in the {@link Program}. */
  public static class Call extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Call(Type type, String name, ImmutableList<Exp> args) {
      super(Op.CALL, type);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append("(").appendAll(args, ", ").append(")");
    }

    public Exp copy(List<Exp> args) {
      return args.equals(this.args) ? this : core.call(type, name, args);
    }
  }

  /** "If" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF, ifTrue.type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    boolean isOpenEnded() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return unparseOpen(w, left, right);
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, 0);
    }

    public Exp copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : core.ifThenElse(condition, ifTrue, ifFalse);
    }
  }

  /** Match, one arm of a {@link Case}. */
  public static class Match extends BaseNode {
    public final Pat pat;
    public final Exp exp;

    Match(Pat pat, Exp exp) {
      super(Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Match accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(pat, 0, 0).append(" => ");
      return exp.isOpenEnded() && right > 0
          ? exp.unparseOpen(w, 0, right)
          : w.append(exp, 0, 0);
    }

    public Match copy(Pat pat, Exp exp) {
      return pat == this.pat && exp == this.exp ? this
          : core.match(pat, exp);
    }
  }

  /** Case expression. */
  public static class Case extends Exp {
    public final Exp exp;
    public final ImmutableList<Match> matchList;

    Case(Type type, Exp exp, ImmutableList<Match> matchList) {
      super(Op.CASE, type);
      this.exp = requireNonNull(exp);
      this.matchList = requireNonNull(matchList);
      checkArgument(!matchList.isEmpty(), "case with no matches");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    boolean isOpenEnded() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return unparseOpen(w, left, right);
      }
      w.append("case ").append(exp, 0, 0).append(" of ");
      for (int i = 0; i < matchList.size(); i++) {
        final boolean last = i == matchList.size() - 1;
        if (i > 0) {
          w.append(" | ");
        }
        // An open-ended body that is not last would swallow later matches
        matchList.get(i).unparse(w, 0, last ? 0 : 1);
      }
      return w;
    }

    public Exp copy(Exp exp, List<Match> matchList) {
      return exp == this.exp && matchList.equals(this.matchList) ? this
          : core.caseOf(type, exp, matchList);
    }
  }

  /** "Let" expression, "let val x = e1 in e2 end". */
  public static class Let extends Exp {
    public final IdPat idPat;
    public final Exp value;
    public final Exp exp;

    Let(IdPat idPat, Exp value, Exp exp) {
      super(Op.LET, exp.type);
      this.idPat = requireNonNull(idPat);
      this.value = requireNonNull(value);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("let val ").append(idPat, 0, 0)
          .append(" = ").append(value, 0, 0)
          .append(" in ").append(exp, 0, 0)
          .append(" end");
    }

    public Exp copy(Exp value, Exp exp) {
      return value == this.value && exp == this.exp ? this
          : core.let(idPat, value, exp);
    }
  }

  /** Placeholder for an expression that has not been synthesized yet.
   *
   * <p>Cannot be evaluated. */
  public static class Hole extends Exp {
    public final String name;

    Hole(Type type, String name) {
      super(Op.HOLE, type);
      this.name = requireNonNull(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("?").append(name);
    }
  }

  /** Lambda expression with a single parameter. Used for postconditions. */
  public static class Fn extends Exp {
    public final IdPat idPat;
    public final Exp exp;

    Fn(IdPat idPat, Exp exp) {
      super(Op.FN, exp.type);
      this.idPat = requireNonNull(idPat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    boolean isOpenEnded() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return unparseOpen(w, left, right);
      }
      return w.append("fn ").append(idPat, 0, 0).append(" => ")
          .append(exp, 0, 0);
    }

    public Fn copy(Exp exp) {
      return exp == this.exp ? this : core.fn(idPat, exp);
    }
  }

  /** Function definition, with an optional postcondition.
   *
   * <p>The postcondition is a {@link Fn} from the result to {@code bool}, and
   * may also refer to the parameters. */
  public static class FunDef extends BaseNode {
    public final String name;
    public final ImmutableList<IdPat> params;
    public final Type returnType;
    public final Exp body;
    public final @Nullable Fn post;

    FunDef(String name, ImmutableList<IdPat> params, Type returnType,
        Exp body, @Nullable Fn post) {
      super(Op.FUN_DEF);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.returnType = requireNonNull(returnType);
      this.body = requireNonNull(body);
      this.post = post;
    }

    @Override
    public FunDef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("fun ").append(name).append("(").appendAll(params, ", ")
          .append(") = ").append(body, 0, 0);
      if (post != null) {
        w.append(" ensuring ").append(post, 0, 0);
      }
      return w;
    }

    public FunDef copy(Exp body) {
      return body == this.body ? this
          : core.funDef(name, params, returnType, body, post);
    }
  }
}

// End Core.java
