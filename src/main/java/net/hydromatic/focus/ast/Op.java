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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  STRING_LITERAL(true),

  // patterns
  ID_PAT(true),
  WILDCARD_PAT(true),
  CON_PAT(true),
  TUPLE_PAT(true),
  BOOL_LITERAL_PAT(true),
  INT_LITERAL_PAT(true),
  STRING_LITERAL_PAT(true),

  // value constructors
  TUPLE(true),
  CON(true),
  FN(" => ", 0),

  // selectors
  TUPLE_SELECT(" ", 8),
  CON_SELECT(" ", 8),
  CON_TEST(" is ", 4),

  TIMES(" * ", 7),
  DIV(" div ", 7),
  MOD(" mod ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  LE(" <= ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EQ(" = ", 4),
  NE(" <> ", 4),
  ANDALSO(" andalso ", 2),
  ORELSE(" orelse ", 1),
  NOT("not ", 8),

  // structure
  CALL(true),
  IF,
  CASE,
  MATCH,
  LET,
  HOLE(true),

  // declarations
  FUN_DEF;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary operator that {@link CoreBuilder#call2}
   * can create. */
  public boolean isBinary() {
    switch (this) {
    case TIMES:
    case DIV:
    case MOD:
    case PLUS:
    case MINUS:
    case LE:
    case LT:
    case GE:
    case GT:
    case EQ:
    case NE:
    case ANDALSO:
    case ORELSE:
      return true;
    default:
      return false;
    }
  }

  /** Converts the op of a literal expression to the corresponding op
   * of a pattern. */
  public Op toPat() {
    switch (this) {
    case BOOL_LITERAL:
      return BOOL_LITERAL_PAT;
    case INT_LITERAL:
      return INT_LITERAL_PAT;
    case STRING_LITERAL:
      return STRING_LITERAL_PAT;
    default:
      throw new AssertionError("unknown op " + this);
    }
  }
}

// End Op.java
