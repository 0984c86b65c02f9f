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

import net.hydromatic.gql.ast.Pos;

/** Occurrence of a variable in an {@link ExposureFrame}.
 *
 * <p>Immutable; the degree changes by replacing the occurrence. */
class ExposedVariable {
  final VariableType type;
  final Pos pos;
  final boolean isTemp;
  final Degree degree;
  /** Whether this is a strict interior variable of a selective path pattern,
   * that is, neither its left nor its right boundary. */
  final boolean strictInterior;

  ExposedVariable(VariableType type, Pos pos, boolean isTemp, Degree degree,
      boolean strictInterior) {
    this.type = requireNonNull(type);
    this.pos = requireNonNull(pos);
    this.isTemp = isTemp;
    this.degree = requireNonNull(degree);
    this.strictInterior = strictInterior;
  }

  /** Creates the occurrence made by a declaration. */
  static ExposedVariable declared(VariableType type, Pos pos, boolean isTemp) {
    return new ExposedVariable(type, pos, isTemp,
        Degree.UNCONDITIONAL_SINGLETON, false);
  }

  ExposedVariable withDegree(Degree degree) {
    return degree == this.degree
        ? this
        : new ExposedVariable(type, pos, isTemp, degree, strictInterior);
  }

  ExposedVariable asStrictInterior() {
    return strictInterior
        ? this
        : new ExposedVariable(type, pos, isTemp, degree, true);
  }

  Variable toVariable() {
    return new Variable(type, pos, isTemp, degree);
  }

  @Override public String toString() {
    return type + " " + degree + (strictInterior ? " interior" : "");
  }
}

// End ExposedVariable.java
