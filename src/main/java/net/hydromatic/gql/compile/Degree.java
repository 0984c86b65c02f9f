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

/**
 * Degree of exposure of a graph pattern variable.
 *
 * <p>The constants are declared in order of increasing uncertainty about how
 * many elements the variable binds to. The two group degrees are not
 * comparable to each other in the standard, but when two occurrences are
 * combined, an unbounded group wins over a bounded one, so ordinal order is
 * also the order of dominance.
 *
 * <p>A degree only ever moves up this order as analysis leaves enclosing
 * constructs.
 */
public enum Degree {
  /** Binds to exactly one element in every match. */
  UNCONDITIONAL_SINGLETON,
  /** Binds to at most one element; absent in some matches. */
  CONDITIONAL_SINGLETON,
  /** Binds to a group of elements whose size has an upper bound. */
  EFFECTIVELY_BOUNDED_GROUP,
  /** Binds to a group of elements of any size. */
  EFFECTIVELY_UNBOUNDED_GROUP;

  /** Returns whether this is a singleton degree. */
  public boolean isSingleton() {
    return this == UNCONDITIONAL_SINGLETON || this == CONDITIONAL_SINGLETON;
  }

  /** Returns whether this is a group degree. */
  public boolean isGroup() {
    return !isSingleton();
  }

  /** Returns the degree that dominates both this and another degree; the
   * degree of a variable exposed by two union operands. */
  public Degree dominant(Degree degree) {
    return compareTo(degree) >= 0 ? this : degree;
  }

  /** Returns the degree a variable has after leaving an optional ("?")
   * primary, or a union operand that does not declare it. */
  public Degree conditional() {
    return this == UNCONDITIONAL_SINGLETON ? CONDITIONAL_SINGLETON : this;
  }

  /** Returns the degree a variable has after leaving a quantified primary.
   *
   * @param bounded Whether the quantifier has an upper bound or the primary
   *                is inside a restrictive path mode
   */
  public Degree quantified(boolean bounded) {
    if (this == EFFECTIVELY_UNBOUNDED_GROUP) {
      return this;
    }
    return bounded ? EFFECTIVELY_BOUNDED_GROUP : EFFECTIVELY_UNBOUNDED_GROUP;
  }

  /** Returns the degree a variable has after leaving a parenthesized path
   * pattern expression or a path pattern; an unbounded group becomes
   * bounded. */
  public Degree capped() {
    return this == EFFECTIVELY_UNBOUNDED_GROUP
        ? EFFECTIVELY_BOUNDED_GROUP
        : this;
  }
}

// End Degree.java
