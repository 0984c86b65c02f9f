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

import java.util.Set;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.Visitor;

/**
 * Validates the variable references in a search condition, making sure that
 * each refers to a variable that the condition can see, and records the
 * variables it references.
 */
public class ReferenceChecker extends Visitor {
  private final ScopeTree scopes;
  private final SearchConditionScope condition;

  private ReferenceChecker(ScopeTree scopes, SearchConditionScope condition) {
    this.scopes = requireNonNull(scopes);
    this.condition = requireNonNull(condition);
  }

  /** Checks a search condition. Throws {@link GqlException} at the first
   * invalid reference. */
  public static void check(ScopeTree scopes, SearchConditionScope condition) {
    condition.condition().accept(new ReferenceChecker(scopes, condition));
  }

  @Override protected void visit(Ast.Id id) {
    reference(id, false);
  }

  @Override protected void visit(Ast.PropertyRef propertyRef) {
    reference(propertyRef.base, true);
  }

  private void reference(Ast.Id id, boolean property) {
    final String name = id.name;
    final Set<String> restricted = condition.restrictedToVariables();
    if (restricted != null && !restricted.contains(name)) {
      throw GqlException.of(ErrorCode.REFERENCE_FROM_SELECTIVE_PATH_PATTERN,
          id);
    }
    if (condition.inaccessibleVariables().contains(name)) {
      throw GqlException.of(ErrorCode.REFERENCE_TO_ADJACENT_UNION_OPERAND,
          id);
    }
    final ScopeTree.Scope scope = scopes.resolve(condition.scope, name);
    if (scope == null) {
      throw GqlException.of(ErrorCode.UNKNOWN_VARIABLE, id, name);
    }
    final Variable variable = requireNonNull(scope.get(name));
    if (variable.degree.isGroup()) {
      throw GqlException.of(scope.index == condition.scope
              ? ErrorCode.EXPECTED_SINGLETON_REFERENCE
              : ErrorCode.NON_LOCAL_GROUP_REFERENCE,
          id);
    }
    if (property && !variable.type.isElement()) {
      throw GqlException.of(ErrorCode.EXPECTED_ELEMENT_REFERENCE, id, name,
          variable.type.description());
    }
    condition.addReference(name, variable);
  }
}

// End ReferenceChecker.java
