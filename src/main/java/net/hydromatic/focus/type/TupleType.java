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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** Tuple type. */
public class TupleType implements Type {
  public final ImmutableList<Type> argTypes;

  public TupleType(List<? extends Type> argTypes) {
    this.argTypes = ImmutableList.copyOf(argTypes);
    checkArgument(this.argTypes.size() != 1, "singleton tuple");
  }

  /** Creates a tuple type. */
  public static TupleType of(Type... argTypes) {
    return new TupleType(ImmutableList.copyOf(argTypes));
  }

  @Override
  public String moniker() {
    return argTypes.isEmpty()
        ? "unit"
        : argTypes.stream().map(Type::moniker)
            .collect(Collectors.joining(" * "));
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType
            && argTypes.equals(((TupleType) o).argTypes);
  }

  @Override
  public int hashCode() {
    return argTypes.hashCode();
  }

  @Override
  public String toString() {
    return moniker();
  }
}

// End TupleType.java
