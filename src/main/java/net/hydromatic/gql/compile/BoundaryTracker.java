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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tracks the boundary variables of the current selective path pattern.
 *
 * <p>The left boundary is the first non-temporary node variable declared
 * before anything (an edge, quantifier, optional primary or union) that
 * could separate it from the start of the path. The right boundary is the
 * last node variable declared with nothing after it. Every other variable
 * exposed by a selective path pattern is strict interior.
 */
class BoundaryTracker {
  private boolean insideSelective;
  private boolean expectingLeft;
  private @Nullable String left;
  private @Nullable String possibleRight;

  /** Starts tracking a new path pattern. Boundaries are only recorded if the
   * pattern is selective. */
  void enterPathPattern(boolean selective) {
    insideSelective = selective;
    expectingLeft = selective;
    left = null;
    possibleRight = null;
  }

  boolean isInsideSelective() {
    return insideSelective;
  }

  void nodeDeclared(String name, boolean isTemp) {
    if (expectingLeft && !isTemp) {
      left = name;
      expectingLeft = false;
    }
    possibleRight = name;
  }

  /** No node variable declared after this point can be the left boundary. */
  void closeLeft() {
    expectingLeft = false;
  }

  /** The most recent node variable is no longer at the end of the path. */
  void resetRight() {
    possibleRight = null;
  }

  void edge() {
    closeLeft();
    resetRight();
  }

  /** Returns whether a variable is the left or right boundary. */
  boolean isBoundary(String name) {
    return name.equals(left) || name.equals(possibleRight);
  }

  @Nullable String left() {
    return left;
  }

  @Nullable String right() {
    return possibleRight;
  }
}

// End BoundaryTracker.java
