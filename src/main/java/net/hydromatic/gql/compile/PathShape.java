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

import com.google.common.math.LongMath;
import net.hydromatic.gql.util.FrameStack;

/**
 * Minimum path length and minimum node count of each open construct.
 *
 * <p>Lengths count edges. The node count is only tracked as "greater than
 * zero or not".
 *
 * <p>There are two stacks because path patterns and parenthesized path
 * pattern expressions track node count but contribute their length directly
 * to the enclosing construct.
 */
class PathShape {
  private final FrameStack<Long> lengths = FrameStack.of(0L);
  private final FrameStack<Boolean> nodes = FrameStack.of(false);

  /** Returns the minimum path length of the innermost construct. */
  long minimumLength() {
    return lengths.top();
  }

  /** Returns whether the innermost construct that tracks nodes has a
   * minimum node count greater than zero. */
  boolean hasNode() {
    return nodes.top();
  }

  int lengthDepth() {
    return lengths.size();
  }

  int nodeDepth() {
    return nodes.size();
  }

  /** A node pattern makes the node count of its construct non-zero. */
  void node() {
    nodes.setTop(true);
  }

  /** An edge pattern adds one to the length of its construct. */
  void edge() {
    lengths.setTop(LongMath.saturatedAdd(lengths.top(), 1));
  }

  /** Enters a path pattern or parenthesized path pattern expression. */
  void enterGroup() {
    nodes.push(false);
  }

  /** Exits a parenthesized path pattern expression; its nodes count towards
   * the enclosing construct. */
  void exitParenthesized() {
    final boolean node = nodes.pop();
    nodes.setTop(nodes.top() || node);
  }

  /** Exits a path pattern. */
  void exitPathPattern() {
    nodes.pop();
  }

  /** Enters a quantified or questioned primary. */
  void enterRepetition() {
    lengths.push(0L);
    nodes.push(false);
  }

  /** Exits a quantified primary; the inner length is repeated
   * {@code lowerBound} times, and inner nodes count only if the lower bound
   * is positive. */
  void exitQuantified(int lowerBound) {
    final long length = lengths.pop();
    lengths.setTop(
        LongMath.saturatedAdd(lengths.top(),
            LongMath.saturatedMultiply(length, lowerBound)));
    final boolean node = nodes.pop();
    nodes.setTop(nodes.top() || node && lowerBound > 0);
  }

  /** Exits a questioned primary, which may match nothing, so contributes
   * neither length nor nodes. */
  void exitQuestioned() {
    lengths.pop();
    nodes.pop();
  }

  /** Enters a union. The union's length starts at infinity and its node
   * flag at true, so that each operand can lower them. */
  void enterUnion() {
    lengths.push(Long.MAX_VALUE);
    nodes.push(true);
  }

  void enterOperand() {
    lengths.push(0L);
    nodes.push(false);
  }

  /** Exits a union operand; the union takes the shortest operand, and has a
   * node only if every operand has one. */
  void exitOperand() {
    final long length = lengths.pop();
    lengths.setTop(Math.min(lengths.top(), length));
    final boolean node = nodes.pop();
    nodes.setTop(node && nodes.top());
  }

  /** Exits a union, concatenating it to the enclosing construct. */
  void exitUnion() {
    final long length = lengths.pop();
    lengths.setTop(LongMath.saturatedAdd(lengths.top(), length));
    final boolean node = nodes.pop();
    nodes.setTop(nodes.top() || node);
  }

  @Override public String toString() {
    return "lengths " + lengths + ", nodes " + nodes;
  }
}

// End PathShape.java
