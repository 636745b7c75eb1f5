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
package net.hydromatic.focus.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Algebraic data type.
 *
 * <p>For example, {@code datatype intlist = Nil | Cons of int * intlist} has
 * two constructors, "Nil" with no arguments and "Cons" with two.
 *
 * <p>Argument types are not recorded; a constructor is known only by its
 * name and arity. Constructors are held in declaration order. */
public class DataType implements Type {
  public final String name;
  public final ImmutableMap<String, Integer> arities;

  DataType(String name, ImmutableMap<String, Integer> arities) {
    this.name = requireNonNull(name, "name");
    this.arities = requireNonNull(arities, "arities");
    checkArgument(!arities.isEmpty(), "data type %s has no constructors",
        name);
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String moniker() {
    return name;
  }

  /** Returns the number of arguments of a constructor. */
  public int arity(String tyCon) {
    final Integer arity = arities.get(tyCon);
    checkArgument(arity != null, "%s is not a constructor of %s", tyCon,
        name);
    return arity;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builds a {@link DataType}. */
  public static class Builder {
    private final String name;
    private final Map<String, Integer> arities = new LinkedHashMap<>();

    Builder(String name) {
      this.name = name;
    }

    /** Adds a constructor. */
    public Builder add(String tyCon, int arity) {
      checkArgument(arity >= 0, "negative arity");
      checkArgument(arities.put(tyCon, arity) == null,
          "duplicate constructor %s", tyCon);
      return this;
    }

    public DataType build() {
      return new DataType(name, ImmutableMap.copyOf(arities));
    }
  }
}

// End DataType.java
