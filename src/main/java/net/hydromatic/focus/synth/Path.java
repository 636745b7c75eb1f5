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

import com.google.common.collect.ImmutableList;
import java.util.Map;
import net.hydromatic.focus.ast.Core;

/** Path condition: an ordered conjunction of variable bindings and boolean
 * conditions that hold on the way to a hole.
 *
 * <p>A binding scopes over every element that follows it. */
public class Path {
  public static final Path EMPTY = new Path(ImmutableList.of());

  public final ImmutableList<Element> elements;

  private Path(ImmutableList<Element> elements) {
    this.elements = requireNonNull(elements);
  }

  /** Creates a path from a list of elements. */
  public static Path of(Iterable<? extends Element> elements) {
    return new Path(ImmutableList.copyOf(elements));
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  private Path plus(Element element) {
    return new Path(
        ImmutableList.<Element>builder().addAll(elements).add(element)
            .build());
  }

  /** Returns this path followed by another. */
  public Path merge(Path that) {
    if (that.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return that;
    }
    return new Path(
        ImmutableList.<Element>builder().addAll(elements)
            .addAll(that.elements).build());
  }

  /** Returns this path with an extra condition. Adding {@code true} returns
   * this path unchanged. */
  public Path withCond(Core.Exp condition) {
    if (condition.isBoolLiteral(true)) {
      return this;
    }
    return plus(new Condition(condition));
  }

  /** Returns this path with an extra binding. */
  public Path withBinding(Core.IdPat idPat, Core.Exp value) {
    return plus(new Binding(idPat, value));
  }

  /** Returns this path with extra bindings, in iteration order. */
  public Path withBindings(Map<Core.IdPat, Core.Exp> bindings) {
    Path path = this;
    for (Map.Entry<Core.IdPat, Core.Exp> entry : bindings.entrySet()) {
      path = path.withBinding(entry.getKey(), entry.getValue());
    }
    return path;
  }

  /** Returns the negation of this path.
   *
   * <p>Leading bindings are kept; the remaining elements are converted to a
   * clause, and replaced by a single condition that negates it. */
  public Path negate() {
    int i = 0;
    while (i < elements.size() && elements.get(i) instanceof Binding) {
      ++i;
    }
    final Path outer = new Path(elements.subList(0, i));
    final Path rest = new Path(elements.subList(i, elements.size()));
    return outer.plus(new Condition(core.not(rest.toClause())));
  }

  /** Converts this path to a boolean expression. */
  public Core.Exp toClause() {
    return and(core.boolLiteral(true));
  }

  /** Returns an expression that is true if this path holds and {@code exp}
   * is true. Bindings in the path are in scope in {@code exp}. */
  public Core.Exp and(Core.Exp exp) {
    Core.Exp e = exp;
    for (Element element : elements.reverse()) {
      e = element.wrap(e);
    }
    return e;
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Path
        && elements.equals(((Path) o).elements);
  }

  @Override
  public String toString() {
    return toClause().toString();
  }

  /** Element of a path. */
  public abstract static class Element {
    /** Returns an expression that applies this element to an expression
     * that follows it. */
    abstract Core.Exp wrap(Core.Exp exp);
  }

  /** Path element that binds a variable to a value. */
  public static class Binding extends Element {
    public final Core.IdPat idPat;
    public final Core.Exp value;

    Binding(Core.IdPat idPat, Core.Exp value) {
      this.idPat = requireNonNull(idPat);
      this.value = requireNonNull(value);
    }

    @Override
    Core.Exp wrap(Core.Exp exp) {
      if (exp.isBoolLiteral(true)) {
        return exp;
      }
      return core.let(idPat, value, exp);
    }

    @Override
    public int hashCode() {
      return idPat.hashCode() * 31 + value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binding
          && idPat.equals(((Binding) o).idPat)
          && value.equals(((Binding) o).value);
    }

    @Override
    public String toString() {
      return idPat + " = " + value;
    }
  }

  /** Path element that is a boolean condition. */
  public static class Condition extends Element {
    public final Core.Exp exp;

    Condition(Core.Exp exp) {
      this.exp = requireNonNull(exp);
    }

    @Override
    Core.Exp wrap(Core.Exp exp) {
      return core.andAlso(this.exp, exp);
    }

    @Override
    public int hashCode() {
      return exp.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Condition
          && exp.equals(((Condition) o).exp);
    }

    @Override
    public String toString() {
      return exp.toString();
    }
  }
}

// End Path.java
