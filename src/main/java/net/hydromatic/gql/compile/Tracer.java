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

import java.util.Set;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.Pos;

/** Called on various events during semantic analysis. */
public interface Tracer {
  /** Called when a variable declaration is recorded. */
  void onDeclare(String name, VariableType type, Pos pos);

  /** Called when a path pattern has been analyzed, with its joinable
   * variables. */
  void onPathPattern(Ast.PathPattern pathPattern, Set<String> joinable);

  /** Called when a graph pattern has been analyzed successfully. */
  void onResult(Ast.GraphPattern graphPattern, Annotations annotations);

  /** Called with the error that stopped analysis of a graph pattern. */
  void onException(Ast.GraphPattern graphPattern, GqlException e);
}

// End Tracer.java
