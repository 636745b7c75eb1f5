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

import net.hydromatic.focus.ast.Core;

/** Side-conditions attached to a {@link Problem}. */
public abstract class Witnesses {
  private Witnesses() {}

  /** Creates a guide. */
  public static Guide guide(Core.Exp exp) {
    return new Guide(exp);
  }

  /** Creates a hint. */
  public static Hint hint(Core.Exp exp) {
    return new Hint(exp);
  }

  /** A side-condition of a problem. */
  public abstract static class Witness {
    public final Core.Exp exp;

    Witness(Core.Exp exp) {
      this.exp = requireNonNull(exp);
    }
  }

  /** Marks the sub-expression of the enclosing function that is suspected
   * to need repair. */
  public static class Guide extends Witness {
    Guide(Core.Exp exp) {
      super(exp);
    }

    @Override
    public String toString() {
      return "Guide(" + exp + ")";
    }
  }

  /** Any side-condition that is not a guide. The focus rule passes hints
   * through to the problems it creates, unchanged. */
  public static class Hint extends Witness {
    Hint(Core.Exp exp) {
      super(exp);
    }

    @Override
    public String toString() {
      return "Hint(" + exp + ")";
    }
  }
}

// End Witnesses.java
