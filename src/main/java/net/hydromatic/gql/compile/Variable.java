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

import java.util.Objects;
import net.hydromatic.gql.ast.Pos;

/** A graph pattern variable, as seen by later phases of compilation. */
public class Variable {
  public final VariableType type;
  /** Position of the declaration; for entries of the variable table, the
   * first declaration. */
  public final Pos pos;
  public final boolean isTemp;
  public final Degree degree;

  public Variable(VariableType type, Pos pos, boolean isTemp, Degree degree) {
    this.type = requireNonNull(type);
    this.pos = requireNonNull(pos);
    this.isTemp = isTemp;
    this.degree = requireNonNull(degree);
  }

  @Override public int hashCode() {
    return Objects.hash(type, pos, isTemp, degree);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Variable
        && type == ((Variable) o).type
        && pos.equals(((Variable) o).pos)
        && isTemp == ((Variable) o).isTemp
        && degree == ((Variable) o).degree;
  }

  @Override public String toString() {
    return "{type " + type + ", degree " + degree
        + (isTemp ? ", temp" : "") + ", pos " + pos + "}";
  }
}

// End Variable.java
