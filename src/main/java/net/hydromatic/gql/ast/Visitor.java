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

/** Visits syntax trees.
 *
 * <p>The default implementation of each method visits the node's children
 * in source order. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.PropertyRef propertyRef) {
    propertyRef.base.accept(this);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  // patterns

  protected void visit(Ast.VarDecl varDecl) {}

  protected void visit(Ast.WhereClause whereClause) {
    whereClause.condition.accept(this);
  }

  protected void visit(Ast.ElementPatternFiller filler) {
    if (filler.var != null) {
      filler.var.accept(this);
    }
    if (filler.predicate != null) {
      filler.predicate.accept(this);
    }
  }

  protected void visit(Ast.NodePattern nodePattern) {
    nodePattern.filler.accept(this);
  }

  protected void visit(Ast.EdgePattern edgePattern) {
    edgePattern.filler.accept(this);
  }

  protected void visit(Ast.ParenthesizedPathPatternExpression parenthesized) {
    if (parenthesized.var != null) {
      parenthesized.var.accept(this);
    }
    parenthesized.expr.accept(this);
    if (parenthesized.where != null) {
      parenthesized.where.accept(this);
    }
  }

  protected void visit(Ast.Quantifier quantifier) {}

  protected void visit(Ast.PathFactor pathFactor) {
    pathFactor.primary.accept(this);
    if (pathFactor.quantifier != null) {
      pathFactor.quantifier.accept(this);
    }
  }

  protected void visit(Ast.PathTerm pathTerm) {
    pathTerm.factors.forEach(this::accept);
  }

  protected void visit(Ast.PathPatternExpression expr) {
    expr.terms.forEach(this::accept);
  }

  protected void visit(Ast.PathPatternPrefix prefix) {}

  protected void visit(Ast.PathPattern pathPattern) {
    if (pathPattern.var != null) {
      pathPattern.var.accept(this);
    }
    pathPattern.prefix.accept(this);
    pathPattern.expr.accept(this);
  }

  protected void visit(Ast.GraphPattern graphPattern) {
    graphPattern.paths.forEach(this::accept);
    if (graphPattern.where != null) {
      graphPattern.where.accept(this);
    }
  }
}

// End Visitor.java
