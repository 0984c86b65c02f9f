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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.gql.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A search condition (WHERE clause) registered during analysis of a graph
 * pattern, and the restrictions on which variables it may reference.
 *
 * <p>Restrictions accumulate while the rest of the pattern is analyzed, and
 * become final when the graph pattern is finalized.
 */
public class SearchConditionScope {
  public final Ast.WhereClause where;
  /** Index of the scope, in the {@link ScopeTree}, that contains the
   * condition. */
  public final int scope;
  private @Nullable ImmutableSet<String> restrictedToVariables;
  private final Multiset<String> inaccessibleCounts = HashMultiset.create();
  private @Nullable ImmutableSet<String> inaccessibleVariables;
  private final Map<String, Variable> referencedVariables =
      new LinkedHashMap<>();

  SearchConditionScope(Ast.WhereClause where, int scope) {
    this.where = requireNonNull(where);
    this.scope = scope;
  }

  @Override public String toString() {
    return "{" + where + ", scope " + scope
        + (restrictedToVariables == null
            ? ""
            : ", restricted to " + restrictedToVariables)
        + ", inaccessible "
        + (inaccessibleVariables == null
            ? inaccessibleCounts
            : inaccessibleVariables)
        + "}";
  }

  /** The condition. */
  public Ast.Exp condition() {
    return where.condition;
  }

  /** If the condition is inside a selective path pattern, the variables
   * declared by that path pattern; otherwise null. */
  public @Nullable Set<String> restrictedToVariables() {
    return restrictedToVariables;
  }

  void restrictTo(Set<String> names) {
    restrictedToVariables = ImmutableSet.copyOf(names);
  }

  /** Records that {@code count} declarations of {@code name} are in a union
   * operand adjacent to the one that contains this condition. */
  void addInaccessible(String name, int count) {
    checkState(inaccessibleVariables == null, "already finalized");
    inaccessibleCounts.add(name, count);
  }

  /** Returns the number of declarations of a variable recorded as being in
   * adjacent union operands. */
  int inaccessibleCount(String name) {
    return inaccessibleCounts.count(name);
  }

  /** Finalizes the inaccessible variables. A variable remains inaccessible
   * only if every one of its declarations is in an adjacent union operand.
   *
   * @param totalDeclarations Number of declarations of each variable in the
   *                          whole graph pattern
   */
  void finalizeScope(Multiset<String> totalDeclarations) {
    checkState(inaccessibleVariables == null, "already finalized");
    final ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (Multiset.Entry<String> e : inaccessibleCounts.entrySet()) {
      if (e.getCount() >= totalDeclarations.count(e.getElement())) {
        b.add(e.getElement());
      }
    }
    inaccessibleVariables = b.build();
  }

  /** Returns the variables that the condition may not reference because
   * they are declared only in adjacent union operands. Empty until the graph
   * pattern is finalized. */
  public Set<String> inaccessibleVariables() {
    return inaccessibleVariables == null
        ? ImmutableSet.of()
        : inaccessibleVariables;
  }

  void addReference(String name, Variable variable) {
    referencedVariables.put(name, variable);
  }

  /** Returns the variables referenced by the condition, as resolved by
   * {@link ReferenceChecker}. */
  public Map<String, Variable> referencedVariables() {
    return ImmutableMap.copyOf(referencedVariables);
  }
}

// End SearchConditionScope.java
