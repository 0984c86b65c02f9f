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

import static com.google.common.base.Verify.verify;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.gql.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Variables declared in a graph pattern, in order of first declaration.
 *
 * <p>The type of a variable is fixed by its first declaration. Node and edge
 * variables may be declared again with the same type; path and subpath
 * variables may not.
 */
class VariableTable {
  private final Map<String, Declaration> declarations = new LinkedHashMap<>();
  private final boolean checkOrder;
  private Pos lastPos = Pos.ZERO;

  VariableTable(boolean checkOrder) {
    this.checkOrder = checkOrder;
  }

  /** Records a declaration. Returns whether it is the first declaration of
   * {@code name}; throws if the redeclaration is illegal. */
  boolean declare(String name, VariableType type, Pos pos) {
    if (checkOrder && pos.isSet()) {
      verify(!lastPos.isSet() || pos.isAfter(lastPos),
          "declaration of %s at %s does not follow previous declaration at %s",
          name, pos, lastPos);
      lastPos = pos;
    }

    final Declaration declaration = declarations.get(name);
    if (declaration == null) {
      declarations.put(name,
          new Declaration(type, declarations.size(), pos));
      return true;
    }
    if (declaration.type != type) {
      throw new GqlException(ErrorCode.VARIABLE_KIND_CONFLICT, pos,
          type.description(), name, declaration.type.description());
    }
    switch (type) {
    case PATH:
      throw new GqlException(ErrorCode.DUPLICATE_PATH_VARIABLE, pos, name);
    case SUBPATH:
      throw new GqlException(ErrorCode.DUPLICATE_SUBPATH_VARIABLE, pos, name);
    default:
      return false;
    }
  }

  @Nullable Declaration get(String name) {
    return declarations.get(name);
  }

  /** Returns the names of all declared variables, in order of first
   * declaration. */
  List<String> names() {
    return ImmutableList.copyOf(declarations.keySet());
  }

  int size() {
    return declarations.size();
  }

  /** First declaration of a variable. */
  static class Declaration {
    final VariableType type;
    final int ordinal;
    final Pos firstPos;

    Declaration(VariableType type, int ordinal, Pos firstPos) {
      this.type = requireNonNull(type);
      this.ordinal = ordinal;
      this.firstPos = requireNonNull(firstPos);
    }
  }
}

// End VariableTable.java
