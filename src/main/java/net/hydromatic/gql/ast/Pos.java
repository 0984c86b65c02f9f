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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ComparisonChain;
import java.util.List;
import java.util.Objects;

/**
 * Source span of a syntax-tree node, from a start line and column to an end
 * line and column. Lines and columns are 1-based and the end is exclusive.
 *
 * <p>Spans sort by start, then by end. A correct traversal declares variables
 * in that order.
 */
public class Pos implements Comparable<Pos> {
  /** Placeholder for a node that has no source span. */
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates the span between two character offsets of {@code gql}. */
  public static Pos of(String gql, String file, int startOffset, int endOffset) {
    checkArgument(0 <= startOffset && startOffset <= endOffset
            && endOffset <= gql.length(),
        "offsets %s..%s outside query of length %s", startOffset, endOffset,
        gql.length());
    final int startLine = lineOf(gql, startOffset);
    final int endLine = lineOf(gql, endOffset);
    return new Pos(file, startLine, columnOf(gql, startOffset), endLine,
        columnOf(gql, endOffset));
  }

  private static int lineOf(String s, int offset) {
    return 1 + (int) s.substring(0, offset).chars().filter(c -> c == '\n')
        .count();
  }

  private static int columnOf(String s, int offset) {
    return offset - s.lastIndexOf('\n', offset - 1);
  }

  /** Returns the smallest span that covers every node's span. Nodes
   * without a span do not contribute. */
  public static Pos sum(List<? extends AstNode> nodes) {
    return nodes.stream().map(node -> node.pos).reduce(ZERO, Pos::plus);
  }

  /** Returns the smallest span that covers this span and {@code pos}. */
  public Pos plus(Pos pos) {
    if (!pos.isSet()) {
      return this;
    }
    if (!isSet()) {
      return pos;
    }
    final Pos first = compareStart(this, pos) <= 0 ? this : pos;
    final Pos last = endLine > pos.endLine
        || endLine == pos.endLine && endColumn >= pos.endColumn ? this : pos;
    return new Pos(file, first.startLine, first.startColumn, last.endLine,
        last.endColumn);
  }

  private static int compareStart(Pos p0, Pos p1) {
    return ComparisonChain.start()
        .compare(p0.startLine, p1.startLine)
        .compare(p0.startColumn, p1.startColumn)
        .result();
  }

  public boolean isSet() {
    return !equals(ZERO);
  }

  /** Returns whether this span sorts strictly after {@code pos}. */
  public boolean isAfter(Pos pos) {
    return compareTo(pos) > 0;
  }

  @Override public int compareTo(Pos o) {
    return ComparisonChain.start()
        .compare(startLine, o.startLine)
        .compare(startColumn, o.startColumn)
        .compare(endLine, o.endLine)
        .compare(endColumn, o.endColumn)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (!(o instanceof Pos)) {
      return false;
    }
    final Pos that = (Pos) o;
    return compareTo(that) == 0 && file.equals(that.file);
  }

  @Override public int hashCode() {
    return Objects.hash(file, startLine, startColumn, endLine, endColumn);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Appends this span to a buffer as "file:line.col-line.col". The file
   * prefix is omitted if there is no file, and the end is omitted if the
   * span is one character wide. */
  public StringBuilder describeTo(StringBuilder buf) {
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    buf.append(startLine).append('.').append(startColumn);
    if (endLine != startLine || endColumn != startColumn + 1) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }
}

// End Pos.java
