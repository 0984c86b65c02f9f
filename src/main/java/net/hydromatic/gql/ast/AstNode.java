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

import static java.util.Objects.requireNonNull;

/** Node in the syntax tree of a graph pattern.
 *
 * <p>Nodes are immutable. Analysis results refer to them by identity. */
public abstract class AstNode {
  /** Source span. */
  public final Pos pos;
  public final Op op;

  protected AstNode(Pos pos, Op op) {
    this.op = requireNonNull(op, "op");
    this.pos = requireNonNull(pos, "pos");
  }

  /** Returns GQL text for this node, for use in messages and tests. Override
   * {@link #unparse(AstWriter, int, int)} to change it. */
  @Override public final String toString() {
    return unparse(new AstWriter());
  }

  /** Writes this node as GQL text using {@code w}, and returns the text. */
  public final String unparse(AstWriter w) {
    return unparse(w, 0, 0).toString();
  }

  /** Writes this node to {@code w}. {@code left} and {@code right} are the
   * binding strengths of the operators on either side, used to decide
   * whether to add parentheses. */
  abstract AstWriter unparse(AstWriter w, int left, int right);

  /** Calls the method of {@code visitor} that handles this kind of node. */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
