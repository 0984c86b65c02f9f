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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.gql.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link Tracers}. */
public class TracersTest {
  final PatternFixture f = new PatternFixture();

  @Test void testTracer() {
    final List<String> declared = new ArrayList<>();
    final List<Set<String>> joinable = new ArrayList<>();
    final List<Annotations> results = new ArrayList<>();
    final List<GqlException> exceptions = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnDeclare(tracer, declared::add);
    tracer = Tracers.withOnPathPattern(tracer, (p, names) -> joinable.add(names));
    tracer = Tracers.withOnResult(tracer, results::add);
    tracer = Tracers.withOnException(tracer, exceptions::add);
    final PatternAnalyzer analyzer =
        new PatternAnalyzer(ImmutableMap.of(), tracer);

    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.optional(f.paren(f.edge("e"),
                f.node("b")))),
            f.path(f.node("a"), f.edge("f"), f.node("c")));
    assertThat(analyzer.analyze(g).isSuccess(), is(true));
    assertThat(declared, contains("a", "e", "b", "a", "f", "c"));
    assertThat(joinable, hasSize(2));
    assertThat(joinable.get(0), contains("a"));
    assertThat(joinable.get(1), contains("a", "f", "c"));
    assertThat(results, hasSize(1));
    assertThat(exceptions, empty());

    final Ast.GraphPattern g2 = f.graph(f.path(f.edge("e")));
    assertThat(analyzer.analyze(g2).isSuccess(), is(false));
    assertThat(results, hasSize(1));
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0).code(),
        is(ErrorCode.PATH_PATTERN_ZERO_NODE_COUNT));
  }

  /** The empty tracer accepts every event. */
  @Test void testEmpty() {
    final Tracer tracer = Tracers.empty();
    final Ast.GraphPattern g = f.graph(f.path(f.node("a")));
    final AnalysisResult result =
        new PatternAnalyzer(ImmutableMap.of(), tracer).analyze(g);
    tracer.onResult(g, result.annotations());
    assertThat(result.annotations().variables(g).keySet(), contains("a"));
  }
}

// End TracersTest.java
