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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.util.TailList;

/** Append-only list of the search conditions of a graph pattern, in the
 * order that they were registered. */
class SearchConditionRegistry {
  private final List<SearchConditionScope> conditions = new ArrayList<>();

  SearchConditionScope add(Ast.WhereClause where, int scope) {
    final SearchConditionScope condition =
        new SearchConditionScope(where, scope);
    conditions.add(condition);
    return condition;
  }

  int size() {
    return conditions.size();
  }

  SearchConditionScope get(int i) {
    return conditions.get(i);
  }

  /** Returns the conditions registered since the registry had a given size.
   * The list is a live view. */
  List<SearchConditionScope> since(int start) {
    return new TailList<>(conditions, start);
  }

  /** Restricts every condition registered since {@code start} to a set of
   * variables. */
  void restrictSince(int start, Set<String> names) {
    for (SearchConditionScope condition : since(start)) {
      condition.restrictTo(names);
    }
  }

  /** Adds declaration counts to the inaccessible counts of the conditions
   * in positions {@code start} (inclusive) to {@code end} (exclusive). */
  void addInaccessible(int start, int end, Multiset<String> declarations) {
    for (SearchConditionScope condition : conditions.subList(start, end)) {
      for (Multiset.Entry<String> e : declarations.entrySet()) {
        condition.addInaccessible(e.getElement(), e.getCount());
      }
    }
  }

  void finalizeAll(Multiset<String> totalDeclarations) {
    conditions.forEach(c -> c.finalizeScope(totalDeclarations));
  }

  List<SearchConditionScope> asList() {
    return ImmutableList.copyOf(conditions);
  }
}

// End SearchConditionRegistry.java
