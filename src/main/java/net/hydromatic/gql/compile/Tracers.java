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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.Pos;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each declaration,
   * then calls the underlying tracer. */
  public static Tracer withOnDeclare(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDeclare(String name, VariableType type,
          Pos pos) {
        consumer.accept(name);
        super.onDeclare(name, type, pos);
      }
    };
  }

  /** Returns a tracer that performs the given action on each path pattern
   * and its joinable variables, then calls the underlying tracer. */
  public static Tracer withOnPathPattern(Tracer tracer,
      BiConsumer<Ast.PathPattern, Set<String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPathPattern(Ast.PathPattern pathPattern,
          Set<String> joinable) {
        consumer.accept(pathPattern, joinable);
        super.onPathPattern(pathPattern, joinable);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of a
   * successful analysis, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<Annotations> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Ast.GraphPattern graphPattern,
          Annotations annotations) {
        consumer.accept(annotations);
        super.onResult(graphPattern, annotations);
      }
    };
  }

  /** Returns a tracer that performs the given action on an error, then
   * calls the underlying tracer. */
  public static Tracer withOnException(Tracer tracer,
      Consumer<GqlException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(Ast.GraphPattern graphPattern,
          GqlException e) {
        consumer.accept(e);
        super.onException(graphPattern, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onDeclare(String name, VariableType type,
        Pos pos) {
    }

    @Override public void onPathPattern(Ast.PathPattern pathPattern,
        Set<String> joinable) {
    }

    @Override public void onResult(Ast.GraphPattern graphPattern,
        Annotations annotations) {
    }

    @Override public void onException(Ast.GraphPattern graphPattern,
        GqlException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onDeclare(String name, VariableType type,
        Pos pos) {
      tracer.onDeclare(name, type, pos);
    }

    @Override public void onPathPattern(Ast.PathPattern pathPattern,
        Set<String> joinable) {
      tracer.onPathPattern(pathPattern, joinable);
    }

    @Override public void onResult(Ast.GraphPattern graphPattern,
        Annotations annotations) {
      tracer.onResult(graphPattern, annotations);
    }

    @Override public void onException(Ast.GraphPattern graphPattern,
        GqlException e) {
      tracer.onException(graphPattern, e);
    }
  }
}

// End Tracers.java
