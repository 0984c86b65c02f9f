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
package net.hydromatic.gql.compile;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Variables exposed by one open construct: a path pattern, a parenthesized
 * path pattern expression, a quantified or questioned primary, a union or a
 * union operand.
 *
 * <p>Iteration order is the order in which variables were first exposed.
 */
class ExposureFrame {
  private final Map<String, ExposedVariable> map = new LinkedHashMap<>();

  /** Exposes a variable in this frame, reconciling it with an existing
   * occurrence of the same name.
   *
   * <p>Two occurrences are compatible only if both are unconditional
   * singletons and neither is a strict interior variable. */
  void expose(String name, ExposedVariable variable) {
    final ExposedVariable existing = map.putIfAbsent(name, variable);
    if (existing == null) {
      return;
    }
    if (variable.degree != Degree.UNCONDITIONAL_SINGLETON
        || existing.degree != Degree.UNCONDITIONAL_SINGLETON) {
      throw new GqlException(ErrorCode.INCOMPATIBLE_DEGREE_OF_EXPOSURE,
          variable.pos, name);
    }
    if (variable.strictInterior || existing.strictInterior) {
      throw new GqlException(ErrorCode.STRICT_INTERIOR_VARIABLE_CLASH,
          variable.pos, name);
    }
  }

  /** Sets a variable, replacing any existing occurrence without checks. */
  void put(String name, ExposedVariable variable) {
    map.put(name, variable);
  }

  @Nullable ExposedVariable get(String name) {
    return map.get(name);
  }

  boolean contains(String name) {
    return map.containsKey(name);
  }

  /** Returns a copy of the set of names. */
  Set<String> names() {
    return ImmutableSet.copyOf(map.keySet());
  }

  void forEach(BiConsumer<String, ExposedVariable> consumer) {
    map.forEach(consumer);
  }

  @Override public String toString() {
    return map.toString();
  }
}

// End ExposureFrame.java
