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
package net.hydromatic.gql.ast;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),
  PROPERTY_REF(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  STRING_LITERAL(true),

  // variable declarations
  ELEMENT_VARIABLE(true),
  PATH_VARIABLE(true),
  SUBPATH_VARIABLE(true),

  // graph patterns
  GRAPH_PATTERN,
  PATH_PATTERN,
  PATH_PATTERN_PREFIX,
  /** Path pattern expression; a union if it has more than one term. */
  PATH_PATTERN_EXPRESSION(" | "),
  PATH_TERM,
  PATH_FACTOR,
  /** Quantifier such as "{1,3}", "*" or "+". */
  QUANTIFIER,
  /** The "?" quantifier of an optional (questioned) path primary. */
  QUESTIONED,
  NODE_PATTERN,
  EDGE_PATTERN,
  PARENTHESIZED_PATH_PATTERN_EXPRESSION,
  ELEMENT_PATTERN_FILLER,
  WHERE(" WHERE "),

  // operators
  EQ(" = ", 4),
  NE(" <> ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  NOT("NOT ", 3),
  AND(" AND ", 2),
  OR(" OR ", 1);

  /** Padded name, e.g. " AND ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Comparison and logical operators, keyed by their trimmed name. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.left > 0 && op.left < 99) {
        b.put(op.padded.trim(), op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the lower-case name, e.g. "path_pattern". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns whether this is a comparison operator such as "=" or "<". */
  public boolean isComparison() {
    switch (this) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
