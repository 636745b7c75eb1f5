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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Utilities for run-time values.
 *
 * <p>Values are represented as follows:
 *
 * <ul>
 *   <li>{@code bool}, {@code int}, {@code string} as {@link Boolean},
 *       {@link Integer}, {@link String};
 *   <li>a tuple as an immutable {@link List} of its components;
 *   <li>a data type value as an immutable {@link List} whose first element is
 *       the constructor name, followed by the constructor's arguments; for
 *       example, {@code Cons(1, Nil)} is {@code ["Cons", 1, ["Nil"]]}.
 * </ul>
 */
public class Values {
  private Values() {}

  /** Creates a data type value. */
  public static List<Object> con(String tyCon, Object... args) {
    return ImmutableList.builder().add(tyCon).add(args).build();
  }

  /** Converts a list of ints into a value of a list data type with
   * constructors "Nil" and "Cons". */
  public static List<Object> intList(int... ints) {
    List<Object> list = con("Nil");
    for (int i = ints.length - 1; i >= 0; i--) {
      list = con("Cons", ints[i], list);
    }
    return list;
  }

  /** Returns whether a value was built by a given constructor. */
  public static boolean isCon(Object value, String tyCon) {
    return value instanceof List
        && !((List<?>) value).isEmpty()
        && tyCon.equals(((List<?>) value).get(0));
  }
}

// End Values.java
