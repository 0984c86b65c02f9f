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

import java.util.Locale;

/** Kind of a graph pattern variable. */
public enum VariableType {
  NODE,
  EDGE,
  PATH,
  SUBPATH;

  /** Returns the name used in error messages, e.g. "node". */
  public String description() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns whether this is a node or edge variable. Only element variables
   * may be declared more than once in a graph pattern. */
  public boolean isElement() {
    return this == NODE || this == EDGE;
  }
}

// End VariableType.java
