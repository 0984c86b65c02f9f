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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import net.hydromatic.gql.ast.Ast;
import net.hydromatic.gql.ast.AstNode;
import net.hydromatic.gql.ast.Pos;
import net.hydromatic.gql.util.FrameStack;

/**
 * State of semantic analysis of one graph pattern.
 *
 * <p>A traversal (usually {@link PatternAnalyzer}) walks the graph pattern
 * and calls an {@code enterXxx} method on the way into each construct and the
 * matching {@code exitXxx} method on the way out. Each exit folds what was
 * learned inside the construct into the enclosing construct. When the whole
 * pattern has been walked, the traversal calls {@link #finalizeContext()},
 * after which the results are available.
 *
 * <p>Every method may throw {@link GqlException}. After an exception, the
 * context is abandoned; the traversal must not call any more exit methods.
 *
 * <p>Not thread-safe; a context is used for one graph pattern.
 */
public class GraphPatternContext {
  private final boolean differentEdges;
  private final Tracer tracer;

  private final VariableTable variables;
  private final ScopeTree scopes = new ScopeTree();
  private final FrameStack<ExposureFrame> frames =
      FrameStack.of(new ExposureFrame());
  private final UnionTracker unions = new UnionTracker();
  private final PathShape shape = new PathShape();
  private final BoundaryTracker boundaries = new BoundaryTracker();
  private final SearchConditionRegistry registry =
      new SearchConditionRegistry();
  private final FrameStack<Boolean> restrictive = FrameStack.of(false);
  private final FrameStack<Map<String, Variable>> referenceScopes =
      new FrameStack<>();
  private final Annotations.Builder annotations = new Annotations.Builder();

  private boolean insideQuantified;
  /** Size of the registry when the current selective path pattern was
   * entered. */
  private int selectiveStart;
  private boolean finalized;

  /** Creates a GraphPatternContext.
   *
   * @param differentEdges Whether the graph pattern uses the different-edges
   *                       match mode
   * @param props          Properties
   * @param tracer         Tracer
   */
  public GraphPatternContext(boolean differentEdges, Map<Prop, Object> props,
      Tracer tracer) {
    this.differentEdges = differentEdges;
    this.tracer = requireNonNull(tracer);
    this.variables =
        new VariableTable(Prop.CHECK_DECLARATION_ORDER.booleanValue(props));
    enterVariableScope();
  }

  /** Creates a GraphPatternContext with default properties. */
  public GraphPatternContext(boolean differentEdges) {
    this(differentEdges, ImmutableMap.of(), Tracers.empty());
  }

  // declarations

  public void declarePathVariable(Ast.VarDecl var) {
    declare(var.name, var.pos, VariableType.PATH, false);
  }

  public void declareSubpathVariable(Ast.VarDecl var) {
    declare(var.name, var.pos, VariableType.SUBPATH, false);
  }

  public void declareNodeVariable(Ast.VarDecl var) {
    declare(var.name, var.pos, VariableType.NODE, var.isTemp);
    boundaries.nodeDeclared(var.name, var.isTemp);
  }

  public void declareEdgeVariable(Ast.VarDecl var) {
    declare(var.name, var.pos, VariableType.EDGE, var.isTemp);
  }

  private void declare(String name, Pos pos, VariableType type,
      boolean isTemp) {
    variables.declare(name, type, pos);
    tracer.onDeclare(name, type, pos);
    exposeNew(name, ExposedVariable.declared(type, pos, isTemp));
    unions.declared(name);
  }

  // path patterns

  public void enterPathPattern(boolean selective) {
    boundaries.enterPathPattern(selective);
    frames.push(new ExposureFrame());
    if (selective) {
      enterVariableScope();
      selectiveStart = registry.size();
    }
    shape.enterGroup();
  }

  public void exitPathPattern(Ast.PathPattern node) {
    if (boundaries.isInsideSelective()) {
      // Conditions inside a selective path pattern may only reference
      // variables that the path pattern declares.
      final Set<String> names = frames.top().names();
      exitVariableScope(UnaryOperator.identity());
      registry.restrictSince(selectiveStart, names);

      final ExposureFrame frame = frames.top();
      for (String name : names) {
        final ExposedVariable v = requireNonNull(frame.get(name));
        if (boundaries.isBoundary(name)) {
          verify(v.degree == Degree.UNCONDITIONAL_SINGLETON,
              "boundary variable %s has degree %s", name, v.degree);
        } else {
          frame.put(name, v.asStrictInterior());
        }
      }
    }

    final ExposureFrame frame = frames.pop();
    final ImmutableSet.Builder<String> joinable = ImmutableSet.builder();
    frame.forEach((name, v) -> {
      if (v.degree == Degree.UNCONDITIONAL_SINGLETON) {
        joinable.add(name);
      }
    });
    final Set<String> joinableVariables = joinable.build();
    annotations.joinableVariables(node, joinableVariables);
    tracer.onPathPattern(node, joinableVariables);

    frame.forEach((name, v) ->
        frames.top().expose(name, v.withDegree(v.degree.capped())));

    if (!shape.hasNode()) {
      throw GqlException.of(ErrorCode.PATH_PATTERN_ZERO_NODE_COUNT, node);
    }
    shape.exitPathPattern();
  }

  public void enterParenthesizedPathPatternExpression() {
    enterVariableScope();
    shape.enterGroup();
  }

  public void exitParenthesizedPathPatternExpression(
      boolean hasSubpathVariable, AstNode node) {
    exitVariableScope(Degree::capped);
    if (hasSubpathVariable && !shape.hasNode()) {
      throw GqlException.of(ErrorCode.SUBPATH_PATTERN_ZERO_NODE_COUNT, node);
    }
    shape.exitParenthesized();
  }

  public void enterPathMode(Ast.PathMode mode) {
    restrictive.push(restrictive.top() || mode.isRestrictive());
  }

  public void exitPathMode() {
    restrictive.pop();
  }

  /** Returns whether the current construct is inside a restrictive path
   * mode (TRAIL, SIMPLE or ACYCLIC). */
  public boolean isInsideRestrictiveSearch() {
    return restrictive.top();
  }

  // quantified and questioned primaries

  public void enterQuantifiedPathPrimary(AstNode node, boolean bounded) {
    if (insideQuantified) {
      throw GqlException.of(ErrorCode.NESTED_QUANTIFIED_PATH_PRIMARY, node);
    }
    insideQuantified = true;

    if (!bounded
        && !isInsideRestrictiveSearch()
        && !boundaries.isInsideSelective()
        && !differentEdges) {
      throw GqlException.of(ErrorCode.UNBOUNDED_QUANTIFIER_NOT_ALLOWED, node);
    }

    boundaries.closeLeft();
    shape.enterRepetition();
    frames.push(new ExposureFrame());
  }

  public void exitQuantifiedPathPrimary(AstNode node, boolean bounded,
      int lowerBound) {
    insideQuantified = false;

    final boolean effectivelyBounded = bounded || isInsideRestrictiveSearch();
    final ExposureFrame frame = frames.pop();
    frame.forEach((name, v) ->
        exposeNew(name, v.withDegree(v.degree.quantified(effectivelyBounded))));

    boundaries.resetRight();

    if (shape.minimumLength() == 0) {
      throw GqlException.of(ErrorCode.QUANTIFIED_PRIMARY_ZERO_PATH_LENGTH,
          node);
    }
    shape.exitQuantified(lowerBound);
  }

  public void enterQuestionedPathPrimary() {
    boundaries.closeLeft();
    shape.enterRepetition();
    frames.push(new ExposureFrame());
  }

  public void exitQuestionedPathPrimary(AstNode node) {
    final ExposureFrame frame = frames.pop();
    frame.forEach((name, v) ->
        exposeNew(name, v.withDegree(v.degree.conditional())));

    boundaries.resetRight();

    if (shape.minimumLength() == 0) {
      throw GqlException.of(ErrorCode.QUESTIONED_PRIMARY_ZERO_PATH_LENGTH,
          node);
    }
    shape.exitQuestioned();
  }

  // unions

  public void enterPathPatternUnion() {
    frames.push(new ExposureFrame());
    boundaries.closeLeft();
    shape.enterUnion();
    unions.enterUnion(registry.size());
  }

  public void exitPathPatternUnion() {
    appendExposedVariables(UnaryOperator.identity());
    boundaries.resetRight();
    shape.exitUnion();
    unions.exitUnion(registry);
  }

  public void enterPathPatternUnionOperand() {
    frames.push(new ExposureFrame());
    shape.enterOperand();
    unions.enterOperand();
  }

  public void exitPathPatternUnionOperand() {
    final ExposureFrame operand = frames.pop();
    final ExposureFrame union = frames.top();

    // A variable that an earlier operand exposed but this one does not is
    // no longer certain to be bound.
    for (String name : union.names()) {
      final ExposedVariable v = requireNonNull(union.get(name));
      if (!operand.contains(name)) {
        union.put(name, v.withDegree(v.degree.conditional()));
      }
    }

    final boolean first = unions.isFirstOperand();
    operand.forEach((name, v) -> {
      final ExposedVariable existing = union.get(name);
      if (existing == null) {
        union.put(name, first ? v : v.withDegree(v.degree.conditional()));
      } else {
        union.put(name,
            existing.withDegree(existing.degree.dominant(v.degree)));
      }
    });

    shape.exitOperand();
    unions.exitOperand(registry.size());
  }

  // element patterns

  public void enterNodePattern() {
    shape.node();
  }

  public void enterEdgePattern() {
    boundaries.edge();
    shape.edge();
  }

  // search conditions and reference scopes

  /** Registers a search condition, owned by the current scope. */
  public void addSearchCondition(Ast.WhereClause where) {
    registry.add(where, scopes.current());
  }

  /** Opens a variable reference scope for a path factor or path pattern
   * expression. Node and edge variables exposed while it is the innermost
   * reference scope are recorded in its annotation. */
  public void enterReferenceScope(AstNode node) {
    final Map<String, Variable> map = new LinkedHashMap<>();
    annotations.referenceScope(node, map);
    referenceScopes.push(map);
  }

  public void exitReferenceScope() {
    referenceScopes.pop();
  }

  // lexical scopes

  void enterVariableScope() {
    frames.push(new ExposureFrame());
    scopes.enter();
  }

  private void exitVariableScope(UnaryOperator<Degree> fold) {
    final Map<String, Variable> localVariables = new LinkedHashMap<>();
    frames.top().forEach((name, v) -> localVariables.put(name, v.toVariable()));
    scopes.exit(localVariables);
    appendExposedVariables(fold);
  }

  /** Pops the top frame and exposes its variables in the frame beneath. */
  private void appendExposedVariables(UnaryOperator<Degree> fold) {
    final ExposureFrame frame = frames.pop();
    frame.forEach((name, v) ->
        frames.top().expose(name, v.withDegree(fold.apply(v.degree))));
  }

  /** Exposes a variable that appears for the first time at the current
   * depth, recording node and edge variables in the current reference
   * scope. */
  private void exposeNew(String name, ExposedVariable v) {
    frames.top().expose(name, v);
    if (v.type.isElement()) {
      verify(!referenceScopes.isEmpty(),
          "no variable reference scope for %s", name);
      referenceScopes.top().put(name, v.toVariable());
    }
  }

  // results

  /** Completes analysis. Works out which variables are inaccessible to each
   * search condition, and closes the root scope. */
  public void finalizeContext() {
    checkState(!finalized, "already finalized");
    verify(frames.size() == 2 && scopes.depth() == 1,
        "unbalanced scopes: %s frames, %s open scopes", frames.size(),
        scopes.depth());
    verify(restrictive.size() == 1 && referenceScopes.isEmpty()
            && unions.depth() == 0 && !insideQuantified,
        "unbalanced enter and exit calls");
    verify(shape.lengthDepth() == 1 && shape.nodeDepth() == 1,
        "unbalanced path shape: %s", shape);

    registry.finalizeAll(unions.totals());
    exitVariableScope(UnaryOperator.identity());
    finalized = true;
  }

  /** Returns the variables of the graph pattern, in order of first
   * declaration. */
  public Map<String, Variable> variables() {
    checkState(finalized, "not finalized");
    final ExposureFrame root = frames.get(0);
    final Map<String, Variable> map = new LinkedHashMap<>();
    for (String name : variables.names()) {
      final VariableTable.Declaration declaration =
          requireNonNull(variables.get(name));
      final ExposedVariable v = requireNonNull(root.get(name));
      map.put(name,
          new Variable(declaration.type, declaration.firstPos, v.isTemp,
              v.degree));
    }
    return ImmutableMap.copyOf(map);
  }

  /** Returns the search conditions, in the order they were registered. */
  public List<SearchConditionScope> searchConditions() {
    return registry.asList();
  }

  /** Returns the tree of lexical scopes. */
  public ScopeTree scopes() {
    return scopes;
  }

  /** Returns the annotations for a graph pattern. */
  public Annotations annotations(Ast.GraphPattern graphPattern) {
    return annotations.variables(graphPattern, variables())
        .searchConditions(registry.asList())
        .scopes(scopes)
        .build();
  }
}

// End GraphPatternContext.java
