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

/**
 * Outcome of semantic analysis of a graph pattern: either the annotations,
 * or the first error found.
 *
 * <p>There is no partial result; if analysis fails, nothing it computed
 * before the error is available.
 */
public abstract class AnalysisResult {
  private AnalysisResult() {}

  static AnalysisResult success(Annotations annotations) {
    return new Success(annotations);
  }

  static AnalysisResult failure(GqlException e) {
    return new Failure(e);
  }

  /** Returns whether analysis succeeded. */
  public abstract boolean isSuccess();

  /** Returns the annotations; throws {@link IllegalStateException} if
   * analysis failed. */
  public abstract Annotations annotations();

  /** Returns the error; throws {@link IllegalStateException} if analysis
   * succeeded. */
  public abstract GqlException exception();

  /** Returns the annotations, or throws the error. */
  public abstract Annotations orElseThrow();

  /** Successful analysis. */
  private static class Success extends AnalysisResult {
    private final Annotations annotations;

    Success(Annotations annotations) {
      this.annotations = requireNonNull(annotations);
    }

    @Override public String toString() {
      return "success";
    }

    @Override public boolean isSuccess() {
      return true;
    }

    @Override public Annotations annotations() {
      return annotations;
    }

    @Override public GqlException exception() {
      throw new IllegalStateException("analysis succeeded");
    }

    @Override public Annotations orElseThrow() {
      return annotations;
    }
  }

  /** Failed analysis. */
  private static class Failure extends AnalysisResult {
    private final GqlException e;

    Failure(GqlException e) {
      this.e = requireNonNull(e);
    }

    @Override public String toString() {
      return e.describeTo(new StringBuilder("failure: ")).toString();
    }

    @Override public boolean isSuccess() {
      return false;
    }

    @Override public Annotations annotations() {
      throw new IllegalStateException("analysis failed: " + e.getMessage(),
          e);
    }

    @Override public GqlException exception() {
      return e;
    }

    @Override public Annotations orElseThrow() {
      throw e;
    }
  }
}

// End AnalysisResult.java
