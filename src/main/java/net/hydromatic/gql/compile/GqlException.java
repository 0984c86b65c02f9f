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

import net.hydromatic.gql.ast.AstNode;
import net.hydromatic.gql.ast.Pos;

/** An error found during semantic analysis of a graph pattern. */
public class GqlException extends RuntimeException {
  private final Pos pos;
  private final ErrorCode code;

  public GqlException(ErrorCode code, Pos pos, Object... args) {
    super(code.message(args));
    this.code = requireNonNull(code);
    this.pos = requireNonNull(pos);
  }

  /** Creates an exception positioned at a node. */
  public static GqlException of(ErrorCode code, AstNode node,
      Object... args) {
    return new GqlException(code, node.pos, args);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  public Pos pos() {
    return pos;
  }

  public ErrorCode code() {
    return code;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: [")
        .append(code.code)
        .append("] ")
        .append(getMessage());
  }
}

// End GqlException.java
