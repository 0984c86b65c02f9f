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

import java.util.List;

/** Prints ASTs as GQL text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Returns the GQL text. */
  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier. Identifiers that are not simple words are
   * quoted with double-quotes. */
  public AstWriter id(String s) {
    if (isSimple(s)) {
      b.append(s);
    } else {
      b.append('"').append(s.replace("\"", "\"\"")).append('"');
    }
    return this;
  }

  private static boolean isSimple(String s) {
    if (s.isEmpty() || !Character.isLetter(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') {
        return false;
      }
    }
    return true;
  }

  /** Appends a literal. */
  @SuppressWarnings("rawtypes")
  public AstWriter appendLiteral(Comparable value) {
    if (value instanceof String) {
      b.append('\'')
          .append(((String) value).replace("'", "''"))
          .append('\'');
    } else if (value instanceof Boolean) {
      b.append((Boolean) value ? "TRUE" : "FALSE");
    } else {
      b.append(value);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    b.append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    b.append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a node, with given left and right precedence. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a list of nodes separated by a given string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }
}

// End AstWriter.java
