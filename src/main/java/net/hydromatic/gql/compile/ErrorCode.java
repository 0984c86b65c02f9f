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

/**
 * Errors reported by semantic analysis of a graph pattern.
 *
 * <p>Each constant has a stable code, which tools may match on, and a message
 * template in {@link String#format} syntax.
 */
public enum ErrorCode {
  // Redeclaration
  VARIABLE_KIND_CONFLICT("E0001",
      "%s variable \"%s\" was declared before as a %s variable"),
  DUPLICATE_PATH_VARIABLE("E0002",
      "Path variable \"%s\" was declared more than once"),
  DUPLICATE_SUBPATH_VARIABLE("E0003",
      "Subpath variable \"%s\" was declared more than once"),

  // Structure
  NESTED_QUANTIFIED_PATH_PRIMARY("E0004",
      "Nested quantified path primary is not allowed"),
  UNBOUNDED_QUANTIFIER_NOT_ALLOWED("E0005",
      "An unbounded quantified path primary shall be inside a restrictive "
          + "search or a selective path pattern"),
  QUANTIFIED_PRIMARY_ZERO_PATH_LENGTH("E0006",
      "A quantified path primary shall have minimum path length that is "
          + "greater than zero"),
  QUESTIONED_PRIMARY_ZERO_PATH_LENGTH("E0007",
      "A questioned path primary shall have minimum path length that is "
          + "greater than zero"),

  // Degree of exposure
  INCOMPATIBLE_DEGREE_OF_EXPOSURE("E0008",
      "Element variable \"%s\" was declared before and has incompatible "
          + "degree of exposure"),
  STRICT_INTERIOR_VARIABLE_CLASH("E0009",
      "Element variable \"%s\" is a strict interior variable of one "
          + "selective path pattern and can't be exposed by another"),

  INVALID_QUANTIFIER_BOUNDS("E0010",
      "Quantifier upper bound %d is less than lower bound %d"),

  // Accessibility of references in search conditions
  REFERENCE_TO_ADJACENT_UNION_OPERAND("E0051",
      "Cannot reference variable in the adjacent union operand"),
  NON_LOCAL_GROUP_REFERENCE("E0052",
      "Cannot reference non-local variable with group degree of reference"),
  REFERENCE_FROM_SELECTIVE_PATH_PATTERN("E0053",
      "Cannot reference variables in other path patterns from selective "
          + "path pattern"),
  UNKNOWN_VARIABLE("E0054", "Reference to unknown variable \"%s\""),
  EXPECTED_SINGLETON_REFERENCE("E0055",
      "Expected singleton degree of reference"),
  EXPECTED_ELEMENT_REFERENCE("E0056",
      "Expected element variable, but \"%s\" is a %s variable"),

  // Node count and rewrite preconditions
  PATH_PATTERN_ZERO_NODE_COUNT("E0109",
      "Path pattern shall have minimum node count that is greater than zero"),
  SUBPATH_PATTERN_ZERO_NODE_COUNT("E0110",
      "Subpath pattern shall have minimum node count that is greater than "
          + "zero"),
  ELEMENT_PREDICATE_NOT_REWRITTEN("E0111",
      "Element predicate must be rewritten to parenthesized path pattern "
          + "where clause");

  /** Stable code, e.g. "E0001". */
  public final String code;
  private final String template;

  ErrorCode(String code, String template) {
    this.code = requireNonNull(code);
    this.template = requireNonNull(template);
  }

  /** Formats the message, substituting arguments into the template. */
  public String message(Object... args) {
    return String.format(template, args);
  }
}

// End ErrorCode.java
