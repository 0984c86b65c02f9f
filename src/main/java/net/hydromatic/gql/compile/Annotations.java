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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.AstNode;

/**
 * Results of semantic analysis of a graph pattern, keyed by the identity of
 * the syntax tree nodes they describe.
 *
 * <p>Read-only. The tree itself is not modified.
 */
public class Annotations {
  private final IdentityHashMap<Ast.GraphPattern, ImmutableMap<String, Variable>>
      variables;
  private final IdentityHashMap<Ast.PathPattern, ImmutableSet<String>>
      joinableVariables;
  private final IdentityHashMap<Ast.WhereClause, SearchConditionScope>
      searchConditions;
  private final IdentityHashMap<AstNode, ImmutableMap<String, Variable>>
      referenceScopes;
  private final ImmutableList<SearchConditionScope> searchConditionList;
  private final ScopeTree scopes;

  private Annotations(Builder b) {
    this.variables = new IdentityHashMap<>(b.variables);
    this.joinableVariables = new IdentityHashMap<>(b.joinableVariables);
    this.searchConditions = new IdentityHashMap<>();
    b.searchConditions.forEach(c -> searchConditions.put(c.where, c));
    this.searchConditionList = ImmutableList.copyOf(b.searchConditions);
    this.referenceScopes = new IdentityHashMap<>();
    b.referenceScopes.forEach((node, map) ->
        referenceScopes.put(node, ImmutableMap.copyOf(map)));
    this.scopes = requireNonNull(b.scopes);
  }

  /** Returns the variables of a graph pattern, in order of first
   * declaration. */
  public Map<String, Variable> variables(Ast.GraphPattern graphPattern) {
    return get(variables, graphPattern);
  }

  /** Returns the variables that a path pattern exposes as unconditional
   * singletons, and which can therefore be used to join it to other path
   * patterns. */
  public Set<String> joinableVariables(Ast.PathPattern pathPattern) {
    return get(joinableVariables, pathPattern);
  }

  /** Returns the scope of a search condition. */
  public SearchConditionScope searchCondition(Ast.WhereClause where) {
    return get(searchConditions, where);
  }

  /** Returns all search conditions, in the order they were registered. */
  public List<SearchConditionScope> searchConditions() {
    return searchConditionList;
  }

  /** Returns the node and edge variables newly declared within a path factor
   * or path pattern expression, with their type and degree. */
  public Map<String, Variable> referenceScope(AstNode node) {
    return get(referenceScopes, node);
  }

  /** Returns whether a node has a reference scope. */
  public boolean hasReferenceScope(AstNode node) {
    return referenceScopes.containsKey(node);
  }

  /** Returns the tree of lexical scopes. */
  public ScopeTree scopes() {
    return scopes;
  }

  private static <K extends AstNode, V> V get(Map<K, V> map, K node) {
    final V v = map.get(node);
    if (v == null) {
      throw new IllegalArgumentException("no annotation for " + node.op
          + " at " + node.pos + ": " + node);
    }
    return v;
  }

  /** Collects annotations during analysis. */
  static class Builder {
    final Map<Ast.GraphPattern, ImmutableMap<String, Variable>> variables =
        new IdentityHashMap<>();
    final Map<Ast.PathPattern, ImmutableSet<String>> joinableVariables =
        new IdentityHashMap<>();
    final Map<AstNode, Map<String, Variable>> referenceScopes =
        new IdentityHashMap<>();
    List<SearchConditionScope> searchConditions = ImmutableList.of();
    ScopeTree scopes;

    Builder variables(Ast.GraphPattern graphPattern,
        Map<String, Variable> map) {
      variables.put(graphPattern, ImmutableMap.copyOf(map));
      return this;
    }

    Builder joinableVariables(Ast.PathPattern pathPattern,
        Set<String> names) {
      joinableVariables.put(pathPattern, ImmutableSet.copyOf(names));
      return this;
    }

    /** Registers the map that will collect a reference scope's
     * variables. */
    Builder referenceScope(AstNode node, Map<String, Variable> map) {
      referenceScopes.put(node, map);
      return this;
    }

    Builder searchConditions(List<SearchConditionScope> conditions) {
      this.searchConditions = ImmutableList.copyOf(conditions);
      return this;
    }

    Builder scopes(ScopeTree scopes) {
      this.scopes = scopes;
      return this;
    }

    Annotations build() {
      return new Annotations(this);
    }
  }
}

// End Annotations.java
