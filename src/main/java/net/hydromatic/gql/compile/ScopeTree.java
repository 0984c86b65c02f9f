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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.gql.util.FrameStack;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tree of lexical scopes of a graph pattern.
 *
 * <p>There is a root scope for the graph pattern, and a scope for each
 * selective path pattern and each parenthesized path pattern expression.
 * Scopes are stored in an arena and refer to their parent by index, so they
 * remain valid after analysis, when search conditions are resolved.
 *
 * <p>When a scope is exited, the variables exposed in it are frozen into
 * {@link Scope#localVariables}.
 */
public class ScopeTree {
  private final List<Scope> scopes = new ArrayList<>();
  private final FrameStack<Integer> open = new FrameStack<>();

  /** Opens a scope, child of the current scope, and returns its index. */
  int enter() {
    final int parent = open.isEmpty() ? -1 : open.top();
    final int index = scopes.size();
    scopes.add(new Scope(index, parent));
    open.push(index);
    return index;
  }

  /** Closes the current scope, freezing its variables. */
  void exit(Map<String, Variable> localVariables) {
    final Scope scope = scopes.get(open.pop());
    scope.freeze(localVariables);
  }

  /** Returns the index of the innermost open scope. */
  int current() {
    checkState(!open.isEmpty(), "no open scope");
    return open.top();
  }

  /** Returns the number of open scopes. */
  int depth() {
    return open.size();
  }

  /** Returns the scope with a given index. */
  public Scope get(int index) {
    return scopes.get(index);
  }

  /** Returns the number of scopes. */
  public int size() {
    return scopes.size();
  }

  /** Returns the nearest scope, starting at {@code index} and moving towards
   * the root, that declares a variable; or null. */
  public @Nullable Scope resolve(int index, String name) {
    for (int i = index; i >= 0; i = scopes.get(i).parent) {
      final Scope scope = scopes.get(i);
      if (scope.localVariables.containsKey(name)) {
        return scope;
      }
    }
    return null;
  }

  /** Returns whether {@code ancestor} is {@code index} or one of its
   * ancestors. */
  public boolean isWithin(int index, int ancestor) {
    for (int i = index; i >= 0; i = scopes.get(i).parent) {
      if (i == ancestor) {
        return true;
      }
    }
    return false;
  }

  /** A lexical scope. */
  public static class Scope {
    public final int index;
    /** Index of the parent scope, or -1 for the root. */
    public final int parent;
    private ImmutableMap<String, Variable> localVariables = ImmutableMap.of();
    private boolean frozen;

    Scope(int index, int parent) {
      this.index = index;
      this.parent = parent;
    }

    void freeze(Map<String, Variable> localVariables) {
      checkState(!frozen, "scope %s is already frozen", index);
      this.localVariables = ImmutableMap.copyOf(localVariables);
      this.frozen = true;
    }

    /** Whether the construct that owns this scope has been exited. */
    public boolean isFrozen() {
      return frozen;
    }

    /** Variables exposed within this scope, including nested scopes, with
     * their degree at the point the scope was exited. */
    public Map<String, Variable> localVariables() {
      return localVariables;
    }

    public @Nullable Variable get(String name) {
      return localVariables.get(requireNonNull(name));
    }

    @Override public String toString() {
      return "scope#" + index + "(parent " + parent + ") " + localVariables;
    }
  }
}

// End ScopeTree.java
