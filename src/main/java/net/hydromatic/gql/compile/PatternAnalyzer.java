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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.Op;

/**
 * Semantic analysis of graph patterns.
 *
 * <p>Walks a graph pattern, driving a {@link GraphPatternContext}, then
 * checks the variable references in its search conditions using
 * {@link ReferenceChecker}.
 */
public class PatternAnalyzer {
  private final Map<Prop, Object> props;
  private final Tracer tracer;

  /** Creates a PatternAnalyzer. */
  public PatternAnalyzer(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a PatternAnalyzer with default properties and no tracing. */
  public static PatternAnalyzer create() {
    return new PatternAnalyzer(ImmutableMap.of(), Tracers.empty());
  }

  /** Analyzes a graph pattern.
   *
   * <p>Returns either the annotations or the first error; never throws
   * {@link GqlException}. */
  public AnalysisResult analyze(Ast.GraphPattern graphPattern) {
    final Annotations annotations;
    try {
      annotations = analyzeOrThrow(graphPattern);
    } catch (GqlException e) {
      tracer.onException(graphPattern, e);
      return AnalysisResult.failure(e);
    }
    tracer.onResult(graphPattern, annotations);
    return AnalysisResult.success(annotations);
  }

  private Annotations analyzeOrThrow(Ast.GraphPattern graphPattern) {
    final Ast.MatchMode matchMode =
        graphPattern.matchMode != null
            ? graphPattern.matchMode
            : Prop.MATCH_MODE.enumValue(props, Ast.MatchMode.class);
    final GraphPatternContext context =
        new GraphPatternContext(matchMode == Ast.MatchMode.DIFFERENT_EDGES,
            props, tracer);
    for (Ast.PathPattern pathPattern : graphPattern.paths) {
      pathPattern(context, pathPattern);
    }
    if (graphPattern.where != null) {
      context.addSearchCondition(graphPattern.where);
    }
    context.finalizeContext();

    if (Prop.REFERENCE_CHECK_ENABLED.booleanValue(props)) {
      for (SearchConditionScope condition : context.searchConditions()) {
        ReferenceChecker.check(context.scopes(), condition);
      }
    }
    return context.annotations(graphPattern);
  }

  private void pathPattern(GraphPatternContext context,
      Ast.PathPattern pathPattern) {
    context.enterPathPattern(pathPattern.prefix.isSelective());
    if (pathPattern.var != null) {
      context.declarePathVariable(pathPattern.var);
    }
    context.enterPathMode(pathPattern.prefix.mode);
    expression(context, pathPattern.expr);
    context.exitPathMode();
    context.exitPathPattern(pathPattern);
  }

  private void expression(GraphPatternContext context,
      Ast.PathPatternExpression expr) {
    context.enterReferenceScope(expr);
    final boolean union = expr.isUnion();
    if (union) {
      context.enterPathPatternUnion();
    }
    for (Ast.PathTerm term : expr.terms) {
      if (union) {
        context.enterPathPatternUnionOperand();
      }
      for (Ast.PathFactor factor : term.factors) {
        factor(context, factor);
      }
      if (union) {
        context.exitPathPatternUnionOperand();
      }
    }
    if (union) {
      context.exitPathPatternUnion();
    }
    context.exitReferenceScope();
  }

  private void factor(GraphPatternContext context, Ast.PathFactor factor) {
    context.enterReferenceScope(factor);
    final Ast.Quantifier quantifier = factor.quantifier;
    if (quantifier != null) {
      if (quantifier.op == Op.QUESTIONED) {
        context.enterQuestionedPathPrimary();
      } else {
        if (quantifier.upper != null && quantifier.upper < quantifier.lower) {
          throw GqlException.of(ErrorCode.INVALID_QUANTIFIER_BOUNDS,
              quantifier, quantifier.upper, quantifier.lower);
        }
        context.enterQuantifiedPathPrimary(factor, quantifier.isBounded());
      }
    }

    primary(context, factor.primary);

    if (quantifier != null) {
      if (quantifier.op == Op.QUESTIONED) {
        context.exitQuestionedPathPrimary(factor);
      } else {
        context.exitQuantifiedPathPrimary(factor, quantifier.isBounded(),
            quantifier.lower);
      }
    }
    context.exitReferenceScope();
  }

  private void primary(GraphPatternContext context,
      Ast.PathPrimary primary) {
    switch (primary.op) {
    case NODE_PATTERN:
      final Ast.NodePattern node = (Ast.NodePattern) primary;
      context.enterNodePattern();
      if (node.filler.var != null) {
        context.declareNodeVariable(node.filler.var);
      }
      checkFiller(node.filler);
      return;

    case EDGE_PATTERN:
      final Ast.EdgePattern edge = (Ast.EdgePattern) primary;
      context.enterEdgePattern();
      if (edge.filler.var != null) {
        context.declareEdgeVariable(edge.filler.var);
      }
      checkFiller(edge.filler);
      return;

    case PARENTHESIZED_PATH_PATTERN_EXPRESSION:
      final Ast.ParenthesizedPathPatternExpression parenthesized =
          (Ast.ParenthesizedPathPatternExpression) primary;
      context.enterParenthesizedPathPatternExpression();
      if (parenthesized.var != null) {
        context.declareSubpathVariable(parenthesized.var);
      }
      context.enterPathMode(parenthesized.mode);
      expression(context, parenthesized.expr);
      if (parenthesized.where != null) {
        context.addSearchCondition(parenthesized.where);
      }
      context.exitPathMode();
      context.exitParenthesizedPathPatternExpression(parenthesized.var != null,
          parenthesized);
      return;

    default:
      throw new AssertionError("unknown path primary " + primary.op);
    }
  }

  /** Checks that an element pattern's inline predicate has been rewritten
   * into a WHERE clause. */
  private static void checkFiller(Ast.ElementPatternFiller filler) {
    if (filler.predicate != null) {
      throw GqlException.of(ErrorCode.ELEMENT_PREDICATE_NOT_REWRITTEN, filler);
    }
  }
}

// End PatternAnalyzer.java
