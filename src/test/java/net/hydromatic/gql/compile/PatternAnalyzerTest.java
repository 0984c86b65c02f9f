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

import static net.hydromatic.gql.ast.AstBuilder.ast;
import static net.hydromatic.gql.compile.Matchers.failsWith;
import static net.hydromatic.gql.compile.Matchers.isVariable;
import static net.hydromatic.gql.compile.Matchers.succeeds;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link PatternAnalyzer}. */
public class PatternAnalyzerTest {
  final PatternFixture f = new PatternFixture();

  /** Tests "(a)-[e]->(b)". */
  @Test void testSimplePath() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.edge("e"), f.node("b")));
    final Map<String, Variable> variables = f.variables(g);
    assertThat(variables.keySet(), contains("a", "e", "b"));
    assertThat(variables.get("a"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(variables.get("e"),
        isVariable(VariableType.EDGE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(variables.get("b"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(variables.get("a").isTemp, is(false));
  }

  /** Tests "(a)-[e]->{1,3}(b)"; the edge variable becomes a bounded
   * group. */
  @Test void testBoundedQuantifier() {
    final Ast.PathPattern path =
        f.path(f.node("a"), f.quantified(f.edge("e"), 1, 3), f.node("b"));
    final Ast.GraphPattern g = f.graph(path);
    final Annotations annotations = f.analyze(g).orElseThrow();
    final Map<String, Variable> variables = annotations.variables(g);
    assertThat(variables.get("a"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(variables.get("e"),
        isVariable(VariableType.EDGE, Degree.EFFECTIVELY_BOUNDED_GROUP));
    assertThat(variables.get("b"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(annotations.joinableVariables(path), contains("a", "b"));
  }

  /** Tests "(a) [-[e]->(x)]{1,3} (b)"; every variable inside the quantified
   * group is a bounded group. */
  @Test void testQuantifiedParenthesized() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"),
                f.quantified(f.paren(f.edge("e"), f.node("x")), 1, 3),
                f.node("b")));
    final Map<String, Variable> variables = f.variables(g);
    assertThat(variables.keySet(), contains("a", "e", "x", "b"));
    assertThat(variables.get("e"),
        isVariable(VariableType.EDGE, Degree.EFFECTIVELY_BOUNDED_GROUP));
    assertThat(variables.get("x"),
        isVariable(VariableType.NODE, Degree.EFFECTIVELY_BOUNDED_GROUP));
  }

  /** Tests "(a)-[e]->(b) | (a)-[e2]->(c)". Only "a" is bound by every
   * operand. */
  @Test void testUnion() {
    final Ast.PathPattern path =
        f.path(
            f.union(f.term(f.node("a"), f.edge("e"), f.node("b")),
                f.term(f.node("a"), f.edge("e2"), f.node("c"))));
    final Ast.GraphPattern g = f.graph(path);
    final Annotations annotations = f.analyze(g).orElseThrow();
    final Map<String, Variable> variables = annotations.variables(g);
    assertThat(variables.keySet(), contains("a", "e", "b", "e2", "c"));
    assertThat(variables.get("a"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    for (String name : ImmutableList.of("b", "c")) {
      assertThat(variables.get(name),
          isVariable(VariableType.NODE, Degree.CONDITIONAL_SINGLETON));
    }
    for (String name : ImmutableList.of("e", "e2")) {
      assertThat(variables.get(name),
          isVariable(VariableType.EDGE, Degree.CONDITIONAL_SINGLETON));
    }
    assertThat(annotations.joinableVariables(path), contains("a"));
  }

  /** Tests "(a) [-[e]->(b)]?"; variables inside an optional primary are
   * conditional and are not joinable. */
  @Test void testQuestioned() {
    final Ast.PathPattern path =
        f.path(f.node("a"), f.optional(f.paren(f.edge("e"), f.node("b"))));
    final Ast.GraphPattern g = f.graph(path);
    final Annotations annotations = f.analyze(g).orElseThrow();
    final Map<String, Variable> variables = annotations.variables(g);
    assertThat(variables.get("e"),
        isVariable(VariableType.EDGE, Degree.CONDITIONAL_SINGLETON));
    assertThat(variables.get("b"),
        isVariable(VariableType.NODE, Degree.CONDITIONAL_SINGLETON));
    assertThat(annotations.joinableVariables(path), contains("a"));
  }

  /** Tests that a node variable may be declared in two path patterns, which
   * joins them. */
  @Test void testJoin() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.edge("e"), f.node("b")),
            f.path(f.node("b"), f.edge("f"), f.node("c")));
    final Map<String, Variable> variables = f.variables(g);
    assertThat(variables.keySet(), contains("a", "e", "b", "f", "c"));
    assertThat(variables.get("b"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(variables.get("b").pos.startColumn, is(6));
  }

  @Test void testTemporaryVariable() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.tempNode("t"), f.edge(), f.node("b")));
    final Map<String, Variable> variables = f.variables(g);
    assertThat(variables.keySet(), contains("t", "b"));
    assertThat(variables.get("t").isTemp, is(true));
    assertThat(variables.get("b").isTemp, is(false));
  }

  @Test void testPathAndSubpathVariables() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.pathVar("p"), f.node("a"),
                f.paren(f.subpathVar("q"), Ast.PathMode.WALK,
                    f.expr(f.edge("e"), f.node("b")), null)));
    final Map<String, Variable> variables = f.variables(g);
    assertThat(variables.keySet(), contains("p", "a", "q", "e", "b"));
    assertThat(variables.get("p"),
        isVariable(VariableType.PATH, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(variables.get("q"),
        isVariable(VariableType.SUBPATH, Degree.UNCONDITIONAL_SINGLETON));
  }

  // declaration errors

  @Test void testVariableKindConflict() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.edge("a"), f.node("b")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.VARIABLE_KIND_CONFLICT,
            "edge variable \"a\" was declared before as a node variable"));
  }

  @Test void testDuplicatePathVariable() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.pathVar("p"), f.node("a")),
            f.path(f.pathVar("p"), f.node("b")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.DUPLICATE_PATH_VARIABLE,
            "Path variable \"p\" was declared more than once"));
  }

  @Test void testDuplicateSubpathVariable() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"),
                f.paren(f.subpathVar("q"), Ast.PathMode.WALK,
                    f.expr(f.edge("e"), f.node("b")), null),
                f.edge("f"),
                f.paren(f.subpathVar("q"), Ast.PathMode.WALK,
                    f.expr(f.node("c")), null)));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.DUPLICATE_SUBPATH_VARIABLE,
            "Subpath variable \"q\" was declared more than once"));
  }

  // quantifier errors

  /** Tests "(a) [-[e]->(x) -[f]->{1,2} (y)]{1,3}". */
  @Test void testNestedQuantifier() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"),
                f.quantified(
                    f.paren(f.edge("e"), f.node("x"),
                        f.quantified(f.edge("f"), 1, 2), f.node("y")),
                    1, 3)));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.NESTED_QUANTIFIED_PATH_PRIMARY));
  }

  /** Tests "(a)-[e]->+(b)", which is only valid if something makes the
   * number of matches finite. */
  @Test void testUnboundedQuantifier() {
    assertThat(f.analyze(f.graph(unboundedPath(null))),
        failsWith(ErrorCode.UNBOUNDED_QUANTIFIER_NOT_ALLOWED));

    final PatternFixture f2 = new PatternFixture();
    final Ast.GraphPattern trail =
        f2.graph(
            f2.path(null, f2.mode(Ast.PathMode.TRAIL),
                f2.expr(f2.node("a"), f2.quantified(f2.edge("e"), 1, null),
                    f2.node("b"))));
    assertThat(f2.variables(trail).get("e"),
        isVariable(VariableType.EDGE, Degree.EFFECTIVELY_BOUNDED_GROUP));

    final PatternFixture f3 = new PatternFixture();
    final Ast.GraphPattern differentEdges =
        f3.graph(Ast.MatchMode.DIFFERENT_EDGES, null,
            f3.path(f3.node("a"), f3.quantified(f3.edge("e"), 1, null),
                f3.node("b")));
    assertThat(f3.analyze(differentEdges), succeeds());
  }

  /** Tests that the default match mode can be set using a property. */
  @Test void testMatchModeProperty() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.MATCH_MODE.setLenient(props, "different_edges");
    assertThat(f.analyze(props, f.graph(unboundedPath(null))), succeeds());
  }

  /** Tests "ANY SHORTEST (a)-[e]->+(b)". A selective path pattern allows an
   * unbounded quantifier. */
  @Test void testUnboundedQuantifierInSelective() {
    final Ast.PathPattern path = unboundedPath(f.anyShortest());
    final Ast.GraphPattern g = f.graph(path);
    final Annotations annotations = f.analyze(g).orElseThrow();

    // Inside the path pattern, "e" is an unbounded group; outside it is
    // bounded.
    final Ast.PathFactor quantified = path.expr.terms.get(0).factors.get(1);
    assertThat(annotations.referenceScope(quantified).get("e"),
        isVariable(VariableType.EDGE, Degree.EFFECTIVELY_UNBOUNDED_GROUP));
    assertThat(annotations.variables(g).get("e"),
        isVariable(VariableType.EDGE, Degree.EFFECTIVELY_BOUNDED_GROUP));
  }

  private Ast.PathPattern unboundedPath(
      Ast.@Nullable PathPatternPrefix prefix) {
    final Ast.PathPatternExpression expr =
        f.expr(f.node("a"), f.quantified(f.edge("e"), 1, null), f.node("b"));
    return f.path(null, prefix == null ? ast.defaultPrefix() : prefix, expr);
  }

  /** Tests "(a) (b){1,3}". */
  @Test void testQuantifiedZeroLength() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.quantified(f.node("b"), 1, 3)));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.QUANTIFIED_PRIMARY_ZERO_PATH_LENGTH));
  }

  /** Tests "(a) (b)?". */
  @Test void testQuestionedZeroLength() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.optional(f.node("b"))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.QUESTIONED_PRIMARY_ZERO_PATH_LENGTH));
  }

  /** Tests "(a)-[e]->{3,1}(b)". */
  @Test void testInvalidQuantifierBounds() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"), f.quantified(f.edge("e"), 3, 1),
                f.node("b")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.INVALID_QUANTIFIER_BOUNDS,
            "Quantifier upper bound 1 is less than lower bound 3"));
  }

  // exposure errors

  /** Tests "(a)-[e]->(b), (c) [-[f]->(b)]?". In the second path pattern,
   * "b" is conditional, so it cannot join the first. */
  @Test void testIncompatibleDegreeOfExposure() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.edge("e"), f.node("b")),
            f.path(f.node("c"),
                f.optional(f.paren(f.edge("f"), f.node("b")))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.INCOMPATIBLE_DEGREE_OF_EXPOSURE,
            "Element variable \"b\" was declared before and has incompatible "
                + "degree of exposure"));
  }

  /** Tests "ANY SHORTEST (a)-[e]->(m)-[f]->(b),
   * ANY SHORTEST (c)-[g]->(m)-[h]->(d)". */
  @Test void testStrictInteriorClash() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(null, f.anyShortest(),
                f.expr(f.node("a"), f.edge("e"), f.node("m"), f.edge("f"),
                    f.node("b"))),
            f.path(null, f.anyShortest(),
                f.expr(f.node("c"), f.edge("g"), f.node("m"), f.edge("h"),
                    f.node("d"))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.STRICT_INTERIOR_VARIABLE_CLASH));
  }

  /** Tests that selective path patterns may share boundary variables. */
  @Test void testSelectiveJoinOnBoundary() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(null, f.anyShortest(),
                f.expr(f.node("a"), f.edge("e"), f.node("b"))),
            f.path(null, f.anyShortest(),
                f.expr(f.node("b"), f.edge("f"), f.node("c"))));
    assertThat(f.analyze(g), succeeds());
  }

  // shape errors

  /** Tests "-[e]->". */
  @Test void testPathWithoutNode() {
    final Ast.GraphPattern g = f.graph(f.path(f.edge("e")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.PATH_PATTERN_ZERO_NODE_COUNT));
  }

  /** Tests "(a) [q = -[e]->] (b)". */
  @Test void testSubpathWithoutNode() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"),
                f.paren(f.subpathVar("q"), Ast.PathMode.WALK,
                    f.expr(f.edge("e")), null),
                f.node("b")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.SUBPATH_PATTERN_ZERO_NODE_COUNT));
  }

  /** Tests that a parenthesized expression without a subpath variable may
   * contain no node. */
  @Test void testParenthesizedWithoutNode() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.paren(f.edge("e")), f.node("b")));
    assertThat(f.analyze(g), succeeds());
  }

  /** Tests "(a:Person WHERE a.age = 21)". */
  @Test void testElementPredicate() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a", "Person", f.eq(f.prop("a", "age"), f.lit(21)))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.ELEMENT_PREDICATE_NOT_REWRITTEN));
  }

  // references

  /** Tests "[(a)-[e]->(b) WHERE e.w = 1]{1,3}". A condition inside a
   * quantified group sees singletons. */
  @Test void testReferenceInsideQuantified() {
    final Ast.WhereClause where = f.where(f.eq(f.prop("e", "w"), f.lit(1)));
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("s"),
                f.quantified(
                    f.paren(f.expr(f.node("a"), f.edge("e"), f.node("b")),
                        where), 1, 3)));
    final Annotations annotations = f.analyze(g).orElseThrow();
    final SearchConditionScope condition = annotations.searchCondition(where);
    assertThat(condition.referencedVariables().get("e"),
        isVariable(VariableType.EDGE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(annotations.variables(g).get("e"),
        isVariable(VariableType.EDGE, Degree.EFFECTIVELY_BOUNDED_GROUP));
  }

  /** Tests "(a) [-[e]->(x)]{1,2} [-[f]->(c) WHERE x.y = 1]". */
  @Test void testNonLocalGroupReference() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"),
                f.quantified(f.paren(f.edge("e"), f.node("x")), 1, 2),
                f.paren(f.expr(f.edge("f"), f.node("c")),
                    f.where(f.eq(f.prop("x", "y"), f.lit(1))))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.NON_LOCAL_GROUP_REFERENCE));
  }

  /** Tests "(a) [[-[e]->(x)]{1,2} WHERE x.y = 1]". */
  @Test void testLocalGroupReference() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(f.node("a"),
                f.paren(
                    f.expr(
                        f.quantified(f.paren(f.edge("e"), f.node("x")), 1, 2)),
                    f.where(f.eq(f.prop("x", "y"), f.lit(1))))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.EXPECTED_SINGLETON_REFERENCE));
  }

  /** Tests "(a)-[e]->(b), ANY SHORTEST [(c)-[f]->(d) WHERE a.x = c.x]". */
  @Test void testReferenceFromSelective() {
    final Ast.GraphPattern g =
        f.graph(f.path(f.node("a"), f.edge("e"), f.node("b")),
            f.path(null, f.anyShortest(),
                f.expr(
                    f.paren(f.expr(f.node("c"), f.edge("f"), f.node("d")),
                        f.where(f.eq(f.prop("a", "x"), f.prop("c", "x")))))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.REFERENCE_FROM_SELECTIVE_PATH_PATTERN));
  }

  /** Tests "ANY SHORTEST [(c)-[f]->(d) WHERE c.x = d.x]". */
  @Test void testReferenceWithinSelective() {
    final Ast.WhereClause where =
        f.where(f.eq(f.prop("c", "x"), f.prop("d", "x")));
    final Ast.GraphPattern g =
        f.graph(
            f.path(null, f.anyShortest(),
                f.expr(
                    f.paren(f.expr(f.node("c"), f.edge("f"), f.node("d")),
                        where))));
    final Annotations annotations = f.analyze(g).orElseThrow();
    final SearchConditionScope condition = annotations.searchCondition(where);
    assertThat(condition.restrictedToVariables(),
        containsInAnyOrder("c", "f", "d"));
    assertThat(condition.referencedVariables().keySet(), contains("c", "d"));
  }

  /** Tests "(a) WHERE z.x = 1". */
  @Test void testUnknownVariable() {
    final Ast.GraphPattern g =
        f.graph(null, f.where(f.eq(f.prop("z", "x"), f.lit(1))),
            f.path(f.node("a")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.UNKNOWN_VARIABLE,
            "Reference to unknown variable \"z\""));
  }

  /** Tests "p = (a) WHERE p.x = 1". */
  @Test void testPropertyOfPathVariable() {
    final Ast.GraphPattern g =
        f.graph(null, f.where(f.eq(f.prop("p", "x"), f.lit(1))),
            f.path(f.pathVar("p"), f.node("a")));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.EXPECTED_ELEMENT_REFERENCE,
            "Expected element variable, but \"p\" is a path variable"));
  }

  /** Tests that a path variable may be referenced without a property. */
  @Test void testPathVariableReference() {
    final Ast.WhereClause where = f.where(f.eq(f.id("p"), f.id("p")));
    final Ast.GraphPattern g =
        f.graph(null, where, f.path(f.pathVar("p"), f.node("a")));
    final Annotations annotations = f.analyze(g).orElseThrow();
    assertThat(annotations.searchCondition(where).referencedVariables(),
        aMapWithSize(1));
  }

  /** Tests "(a)-[e]->(b) | [(a)-[f]->(c) WHERE b.x = 1]". Variable "b" is
   * declared only in the other operand. */
  @Test void testReferenceToAdjacentOperand() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(
                f.union(f.term(f.node("a"), f.edge("e"), f.node("b")),
                    f.term(
                        f.paren(f.expr(f.node("a"), f.edge("f"), f.node("c")),
                            f.where(f.eq(f.prop("b", "x"), f.lit(1))))))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.REFERENCE_TO_ADJACENT_UNION_OPERAND));
  }

  /** Tests "(a)-[e]->(b) | (b)-[f]->[(a) WHERE b.x = 1]". Variable "b" is
   * declared in both operands, so the condition may reference it. */
  @Test void testReferenceToSharedOperandVariable() {
    final Ast.WhereClause where = f.where(f.eq(f.prop("b", "x"), f.lit(1)));
    final Ast.GraphPattern g =
        f.graph(
            f.path(
                f.union(f.term(f.node("a"), f.edge("e"), f.node("b")),
                    f.term(f.node("b"), f.edge("f"),
                        f.paren(f.expr(f.node("a")), where)))));
    final Annotations annotations = f.analyze(g).orElseThrow();
    final SearchConditionScope condition = annotations.searchCondition(where);
    assertThat(condition.inaccessibleVariables(), contains("e"));
    assertThat(condition.referencedVariables().get("b"),
        isVariable(VariableType.NODE, Degree.UNCONDITIONAL_SINGLETON));
    assertThat(annotations.variables(g).get("f"),
        isVariable(VariableType.EDGE, Degree.CONDITIONAL_SINGLETON));
  }

  /** Tests a union of three operands where the first and third declare "b"
   * and the second references it. */
  @Test void testReferenceAcrossThreeOperands() {
    final Ast.GraphPattern g =
        f.graph(
            f.path(
                f.union(f.term(f.node("b"), f.edge("e1"), f.node("x")),
                    f.term(f.node("y"), f.edge("e2"),
                        f.paren(f.expr(f.node("z")),
                            f.where(f.eq(f.prop("b", "p"), f.lit(1))))),
                    f.term(f.node("b"), f.edge("e3"), f.node("w")))));
    assertThat(f.analyze(g),
        failsWith(ErrorCode.REFERENCE_TO_ADJACENT_UNION_OPERAND));
  }

  // properties

  @Test void testReferenceCheckDisabled() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.REFERENCE_CHECK_ENABLED.set(props, false);
    final Ast.WhereClause where = f.where(f.eq(f.prop("z", "x"), f.lit(1)));
    final Ast.GraphPattern g = f.graph(null, where, f.path(f.node("a")));
    final AnalysisResult result = f.analyze(props, g);
    assertThat(result, succeeds());
    assertThat(result.annotations().searchCondition(where)
        .referencedVariables(), anEmptyMap());
    assertThat(result.annotations().searchConditions(), hasSize(1));
  }

  /** Tests that declarations must be visited in increasing position, unless
   * the check is disabled. */
  @Test void testDeclarationOrder() {
    final Pos pos1 = new Pos("", 1, 10, 1, 11);
    final Pos pos2 = new Pos("", 1, 5, 1, 6);
    final Ast.PathFactor a =
        ast.pathFactor(
            ast.nodePattern(pos1, ast.filler(ast.elementVariable(pos1, "a"))));
    final Ast.PathFactor e =
        ast.pathFactor(
            ast.edgePattern(pos2, Ast.Direction.POINTING_RIGHT,
                ast.filler(ast.elementVariable(pos2, "e"))));
    final Ast.GraphPattern g = f.graph(f.path(a, e));

    assertThrows(VerifyException.class, () -> f.analyze(g));

    final Map<Prop, Object> props = new HashMap<>();
    Prop.CHECK_DECLARATION_ORDER.set(props, false);
    assertThat(f.analyze(props, g), succeeds());
  }

  @Test void testFailureDescription() {
    final Ast.GraphPattern g = f.graph(f.path(f.edge("e")));
    final AnalysisResult result = f.analyze(g);
    assertThat(result.toString(),
        is("failure: 1.1 Error: [E0109] Path pattern shall have minimum "
            + "node count that is greater than zero"));
    assertThrows(GqlException.class, result::orElseThrow);
  }

  @Test void testSearchConditionsInOrder() {
    final Ast.WhereClause w1 = f.where(f.eq(f.prop("a", "x"), f.lit(1)));
    final Ast.GraphPattern g =
        f.graph(null, f.where(f.eq(f.prop("b", "x"), f.lit(2))),
            f.path(f.paren(f.expr(f.node("a")), w1), f.edge(), f.node("b")));
    final Annotations annotations = f.analyze(g).orElseThrow();
    assertThat(annotations.searchConditions(), hasSize(2));
    assertThat(annotations.searchConditions().get(0).where, is(w1));
    assertThat(annotations.searchCondition(w1).inaccessibleVariables(),
        empty());
  }
}

// End PatternAnalyzerTest.java
