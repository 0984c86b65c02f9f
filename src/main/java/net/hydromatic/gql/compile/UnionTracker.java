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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.gql.util.FrameStack;

/**
 * Counts variable declarations per union operand, and works out which search
 * conditions are in operands adjacent to which declarations.
 *
 * <p>The bottom counter holds the number of declarations of each variable in
 * the whole graph pattern. Each open union operand pushes a counter, which is
 * added to the one beneath it when the operand is exited.
 */
class UnionTracker {
  private final FrameStack<Multiset<String>> declarations =
      FrameStack.of(HashMultiset.create());
  private final FrameStack<Union> unions = new FrameStack<>();

  /** Records a declaration in the current operand. */
  void declared(String name) {
    declarations.top().add(name);
  }

  /** Returns the number of declarations of a variable in the graph pattern
   * so far, including those in open union operands. */
  int totalDeclarations(String name) {
    int count = 0;
    for (Multiset<String> counter : declarations.asList()) {
      count += counter.count(name);
    }
    return count;
  }

  /** Returns the counts of declarations in the whole graph pattern; valid
   * once every union has been exited. */
  Multiset<String> totals() {
    checkState(declarations.size() == 1, "union operand still open");
    return Multisets.unmodifiableMultiset(declarations.top());
  }

  int depth() {
    return unions.size();
  }

  /** Returns whether the operand being merged into the current union is the
   * first. */
  boolean isFirstOperand() {
    return unions.top().operandDeclarations.isEmpty();
  }

  void enterUnion(int registrySize) {
    unions.push(new Union(registrySize));
  }

  void enterOperand() {
    declarations.push(HashMultiset.create());
  }

  /** Exits an operand, recording its declarations and the conditions that
   * it registered. */
  void exitOperand(int registrySize) {
    final Multiset<String> operand = declarations.pop();
    final Union union = unions.top();
    union.boundaries.add(registrySize);
    union.operandDeclarations.add(ImmutableMultiset.copyOf(operand));
    declarations.top().addAll(operand);
  }

  /** Exits a union. Declarations in each operand are recorded as
   * inaccessible to the conditions of every other operand. */
  void exitUnion(SearchConditionRegistry registry) {
    final Union union = unions.pop();
    final int n = union.operandDeclarations.size();
    for (int i = 0; i < n; i++) {
      final Multiset<String> operand = union.operandDeclarations.get(i);
      for (int j = 0; j < n; j++) {
        if (i != j) {
          registry.addInaccessible(union.boundaries.get(j),
              union.boundaries.get(j + 1), operand);
        }
      }
    }
  }

  /** State of an open union. */
  private static class Union {
    /** Registry size when the union was entered and after each operand;
     * operand {@code i} registered conditions {@code boundaries[i]} up to
     * {@code boundaries[i + 1]}. */
    final List<Integer> boundaries = new ArrayList<>();
    final List<Multiset<String>> operandDeclarations = new ArrayList<>();

    Union(int registrySize) {
      boundaries.add(registrySize);
    }
  }
}

// End UnionTracker.java
