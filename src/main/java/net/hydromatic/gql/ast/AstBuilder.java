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
package net.hydromatic.gql.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // expressions

  /** Creates an identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a reference to a property, "base.property". */
  public Ast.PropertyRef propertyRef(Pos pos, Ast.Id base, String property) {
    return new Ast.PropertyRef(pos, base, property);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, b);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, long i) {
    return new Ast.Literal(pos, Op.INT_LITERAL, i);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String s) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, s);
  }

  /** Creates a call to an infix operator. */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a comparison "a0 = a1". */
  public Ast.InfixCall equal(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(pos, Op.EQ, a0, a1);
  }

  /** Creates a comparison "a0 <> a1". */
  public Ast.InfixCall notEqual(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(pos, Op.NE, a0, a1);
  }

  /** Creates "a0 AND a1". */
  public Ast.InfixCall and(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(pos, Op.AND, a0, a1);
  }

  /** Creates "a0 OR a1". */
  public Ast.InfixCall or(Pos pos, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(pos, Op.OR, a0, a1);
  }

  /** Creates "NOT a". */
  public Ast.PrefixCall not(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.NOT, a);
  }

  // variable declarations

  public Ast.VarDecl elementVariable(Pos pos, String name) {
    return elementVariable(pos, name, false);
  }

  public Ast.VarDecl elementVariable(Pos pos, String name, boolean isTemp) {
    return new Ast.VarDecl(pos, Op.ELEMENT_VARIABLE, name, isTemp);
  }

  public Ast.VarDecl pathVariable(Pos pos, String name) {
    return new Ast.VarDecl(pos, Op.PATH_VARIABLE, name, false);
  }

  public Ast.VarDecl subpathVariable(Pos pos, String name) {
    return new Ast.VarDecl(pos, Op.SUBPATH_VARIABLE, name, false);
  }

  // patterns

  public Ast.WhereClause where(Pos pos, Ast.Exp condition) {
    return new Ast.WhereClause(pos, condition);
  }

  public Ast.ElementPatternFiller filler(Pos pos, Ast.@Nullable VarDecl var,
      @Nullable String label, Ast.@Nullable Exp predicate) {
    return new Ast.ElementPatternFiller(pos, var, label, predicate);
  }

  /** Creates a filler that declares a variable and nothing else. */
  public Ast.ElementPatternFiller filler(Ast.VarDecl var) {
    return filler(var.pos, var, null, null);
  }

  public Ast.NodePattern nodePattern(Pos pos, Ast.ElementPatternFiller filler) {
    return new Ast.NodePattern(pos, filler);
  }

  public Ast.EdgePattern edgePattern(Pos pos, Ast.Direction direction,
      Ast.ElementPatternFiller filler) {
    return new Ast.EdgePattern(pos, direction, filler);
  }

  public Ast.ParenthesizedPathPatternExpression parenthesized(Pos pos,
      Ast.@Nullable VarDecl var, Ast.PathMode mode,
      Ast.PathPatternExpression expr, Ast.@Nullable WhereClause where) {
    return new Ast.ParenthesizedPathPatternExpression(pos, var, mode, expr,
        where);
  }

  /** Creates a quantifier "{lower,upper}"; if {@code upper} is null, the
   * quantifier is unbounded. */
  public Ast.Quantifier quantifier(Pos pos, int lower,
      @Nullable Integer upper) {
    return new Ast.Quantifier(pos, Op.QUANTIFIER, lower, upper);
  }

  /** Creates the "?" quantifier. */
  public Ast.Quantifier questioned(Pos pos) {
    return new Ast.Quantifier(pos, Op.QUESTIONED, 0, 1);
  }

  public Ast.PathFactor pathFactor(Pos pos, Ast.PathPrimary primary,
      Ast.@Nullable Quantifier quantifier) {
    return new Ast.PathFactor(pos, primary, quantifier);
  }

  /** Creates an unquantified path factor. */
  public Ast.PathFactor pathFactor(Ast.PathPrimary primary) {
    return pathFactor(primary.pos, primary, null);
  }

  public Ast.PathTerm pathTerm(Pos pos, List<Ast.PathFactor> factors) {
    return new Ast.PathTerm(pos, ImmutableList.copyOf(factors));
  }

  /** Creates a path term, deducing its position from its factors. */
  public Ast.PathTerm pathTerm(List<Ast.PathFactor> factors) {
    return pathTerm(Pos.sum(factors), factors);
  }

  public Ast.PathPatternExpression pathPatternExpression(Pos pos,
      List<Ast.PathTerm> terms) {
    return new Ast.PathPatternExpression(pos, ImmutableList.copyOf(terms));
  }

  /** Creates a path pattern expression, deducing its position from its
   * terms. */
  public Ast.PathPatternExpression pathPatternExpression(
      List<Ast.PathTerm> terms) {
    return pathPatternExpression(Pos.sum(terms), terms);
  }

  public Ast.PathPatternPrefix prefix(Pos pos, Ast.PathMode mode,
      Ast.PathSearch search, int count) {
    return new Ast.PathPatternPrefix(pos, mode, search, count);
  }

  /** Creates a prefix with no search, optionally a path mode. */
  public Ast.PathPatternPrefix prefix(Pos pos, Ast.PathMode mode) {
    return prefix(pos, mode, Ast.PathSearch.ALL, 0);
  }

  /** Returns the implicit prefix "ALL WALK" of a path pattern that has
   * none. */
  public Ast.PathPatternPrefix defaultPrefix() {
    return prefix(Pos.ZERO, Ast.PathMode.WALK);
  }

  public Ast.PathPattern pathPattern(Pos pos, Ast.@Nullable VarDecl var,
      Ast.PathPatternPrefix prefix, Ast.PathPatternExpression expr) {
    return new Ast.PathPattern(pos, var, prefix, expr);
  }

  public Ast.GraphPattern graphPattern(Pos pos,
      Ast.@Nullable MatchMode matchMode, List<Ast.PathPattern> paths,
      Ast.@Nullable WhereClause where) {
    return new Ast.GraphPattern(pos, matchMode, ImmutableList.copyOf(paths),
        where);
  }
}

// End AstBuilder.java
