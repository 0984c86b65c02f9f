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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Match mode of a graph pattern. */
  public enum MatchMode {
    REPEATABLE_ELEMENTS("REPEATABLE ELEMENTS"),
    /** Different-edges matching; unbounded quantifiers are allowed anywhere. */
    DIFFERENT_EDGES("DIFFERENT EDGES");

    public final String sql;

    MatchMode(String sql) {
      this.sql = sql;
    }
  }

  /** Path mode, the restriction on repeated elements within a path. */
  public enum PathMode {
    WALK,
    TRAIL,
    SIMPLE,
    ACYCLIC;

    /** Returns whether this mode restricts the paths that may match; every
     * mode but {@link #WALK} is restrictive. */
    public boolean isRestrictive() {
      return this != WALK;
    }
  }

  /** Path search prefix. */
  public enum PathSearch {
    ALL("ALL"),
    ANY("ANY"),
    ALL_SHORTEST("ALL SHORTEST"),
    ANY_SHORTEST("ANY SHORTEST"),
    COUNTED_SHORTEST_PATH("SHORTEST %d"),
    COUNTED_SHORTEST_GROUP("SHORTEST %d GROUP");

    public final String template;

    PathSearch(String template) {
      this.template = template;
    }

    /** Returns whether this search selects a subset of the matching paths. */
    public boolean isSelective() {
      return this != ALL;
    }

    /** Returns whether this search takes a count, as in "SHORTEST 3". */
    public boolean isCounted() {
      return this == COUNTED_SHORTEST_PATH || this == COUNTED_SHORTEST_GROUP;
    }
  }

  /** Direction of an edge pattern. */
  public enum Direction {
    POINTING_LEFT("<-[", "]-"),
    POINTING_RIGHT("-[", "]->"),
    UNDIRECTED("~[", "]~"),
    ANY_DIRECTION("-[", "]-");

    public final String open;
    public final String close;

    Direction(String open, String close) {
      this.open = open;
      this.close = close;
    }
  }

  /** Base class for an expression in a search condition. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, value) -> args.add(exp));
      return args.build();
    }
  }

  /** Parse tree node of an identifier; in a search condition, a reference to
   * an element, path or subpath variable. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Reference to a property of a variable, for example "a.name". */
  public static class PropertyRef extends Exp {
    public final Id base;
    public final String property;

    PropertyRef(Pos pos, Id base, String property) {
      super(pos, Op.PROPERTY_REF);
      this.base = requireNonNull(base);
      this.property = requireNonNull(property);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(base.name).append(".").id(property);
    }
  }

  /** Parse tree node of a literal (constant). */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.BOOL_LITERAL
          || op == Op.INT_LITERAL
          || op == Op.STRING_LITERAL);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Call to an infix operator. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isComparison() || op == Op.AND || op == Op.OR);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a prefix operator. */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
      checkArgument(op == Op.NOT);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Declaration of an element, path or subpath variable.
   *
   * <p>For example, "a" in "(a)-[e]->(b)" declares a node variable, and "p"
   * in "p = (a)-[e]->(b)" declares a path variable. A temporary variable is
   * one that the parser invented for an anonymous element; it never becomes
   * a boundary variable of a selective path pattern. */
  public static class VarDecl extends AstNode {
    public final String name;
    public final boolean isTemp;

    VarDecl(Pos pos, Op op, String name, boolean isTemp) {
      super(pos, op);
      this.name = requireNonNull(name);
      this.isTemp = isTemp;
      checkArgument(op == Op.ELEMENT_VARIABLE
          || op == Op.PATH_VARIABLE
          || op == Op.SUBPATH_VARIABLE);
      checkArgument(!isTemp || op == Op.ELEMENT_VARIABLE,
          "only element variables may be temporary");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Search condition, "WHERE condition". */
  public static class WhereClause extends AstNode {
    public final Exp condition;

    WhereClause(Pos pos, Exp condition) {
      super(pos, Op.WHERE);
      this.condition = requireNonNull(condition);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("WHERE ").append(condition, 0, 0);
    }
  }

  /** Contents of a node or edge pattern, "var :label WHERE predicate".
   *
   * <p>An inline predicate is expected to have been rewritten into the WHERE
   * clause of an enclosing parenthesized path pattern expression before
   * semantic analysis. */
  public static class ElementPatternFiller extends AstNode {
    public final @Nullable VarDecl var;
    public final @Nullable String label;
    public final @Nullable Exp predicate;

    ElementPatternFiller(Pos pos, @Nullable VarDecl var,
        @Nullable String label, @Nullable Exp predicate) {
      super(pos, Op.ELEMENT_PATTERN_FILLER);
      this.var = var;
      this.label = label;
      this.predicate = predicate;
      checkArgument(var == null || var.op == Op.ELEMENT_VARIABLE);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (var != null) {
        w.append(var, 0, 0);
      }
      if (label != null) {
        w.append(var != null ? " :" : ":").id(label);
      }
      if (predicate != null) {
        w.append(var != null || label != null ? " WHERE " : "WHERE ")
            .append(predicate, 0, 0);
      }
      return w;
    }
  }

  /** Base class for a path primary: a node pattern, an edge pattern or a
   * parenthesized path pattern expression. */
  public abstract static class PathPrimary extends AstNode {
    PathPrimary(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Node pattern, for example "(a:Person)". */
  public static class NodePattern extends PathPrimary {
    public final ElementPatternFiller filler;

    NodePattern(Pos pos, ElementPatternFiller filler) {
      super(pos, Op.NODE_PATTERN);
      this.filler = requireNonNull(filler);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(filler, 0, 0).append(")");
    }
  }

  /** Edge pattern, for example "-[e:Knows]->". */
  public static class EdgePattern extends PathPrimary {
    public final Direction direction;
    public final ElementPatternFiller filler;

    EdgePattern(Pos pos, Direction direction, ElementPatternFiller filler) {
      super(pos, Op.EDGE_PATTERN);
      this.direction = requireNonNull(direction);
      this.filler = requireNonNull(filler);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(direction.open)
          .append(filler, 0, 0)
          .append(direction.close);
    }
  }

  /** Parenthesized path pattern expression, for example
   * "[q = TRAIL (a)-[e]->(b) WHERE a.x = b.x]". */
  public static class ParenthesizedPathPatternExpression extends PathPrimary {
    public final @Nullable VarDecl var;
    public final PathMode mode;
    public final PathPatternExpression expr;
    public final @Nullable WhereClause where;

    ParenthesizedPathPatternExpression(Pos pos, @Nullable VarDecl var,
        PathMode mode, PathPatternExpression expr,
        @Nullable WhereClause where) {
      super(pos, Op.PARENTHESIZED_PATH_PATTERN_EXPRESSION);
      this.var = var;
      this.mode = requireNonNull(mode);
      this.expr = requireNonNull(expr);
      this.where = where;
      checkArgument(var == null || var.op == Op.SUBPATH_VARIABLE);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[");
      if (var != null) {
        w.append(var, 0, 0).append(" = ");
      }
      if (mode != PathMode.WALK) {
        w.append(mode.name()).append(" ");
      }
      w.append(expr, 0, 0);
      if (where != null) {
        w.append(" ").append(where, 0, 0);
      }
      return w.append("]");
    }
  }

  /** Quantifier of a path factor.
   *
   * <p>If {@link #op} is {@link Op#QUESTIONED} this is the "?" of an optional
   * primary. Otherwise it is a general quantifier; {@link #upper} is null if
   * the quantifier is unbounded, as in "{2,}", "*" and "+". */
  public static class Quantifier extends AstNode {
    public final int lower;
    public final @Nullable Integer upper;

    Quantifier(Pos pos, Op op, int lower, @Nullable Integer upper) {
      super(pos, op);
      this.lower = lower;
      this.upper = upper;
      checkArgument(op == Op.QUANTIFIER || op == Op.QUESTIONED);
      checkArgument(lower >= 0, "negative lower bound");
      checkArgument(op == Op.QUANTIFIER
          || lower == 0 && upper != null && upper == 1);
    }

    /** Returns whether the quantifier has an upper bound. */
    public boolean isBounded() {
      return upper != null;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (op == Op.QUESTIONED) {
        return w.append("?");
      }
      if (upper == null) {
        switch (lower) {
        case 0:
          return w.append("*");
        case 1:
          return w.append("+");
        default:
          return w.append("{").append(Integer.toString(lower)).append(",}");
        }
      }
      if (upper == lower) {
        return w.append("{").append(Integer.toString(lower)).append("}");
      }
      return w.append("{")
          .append(Integer.toString(lower))
          .append(",")
          .append(Integer.toString(upper))
          .append("}");
    }
  }

  /** Path factor: a path primary, optionally quantified. */
  public static class PathFactor extends AstNode {
    public final PathPrimary primary;
    public final @Nullable Quantifier quantifier;

    PathFactor(Pos pos, PathPrimary primary, @Nullable Quantifier quantifier) {
      super(pos, Op.PATH_FACTOR);
      this.primary = requireNonNull(primary);
      this.quantifier = quantifier;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(primary, 0, 0);
      if (quantifier != null) {
        w.append(quantifier, 0, 0);
      }
      return w;
    }
  }

  /** Path term: a concatenation of one or more path factors. */
  public static class PathTerm extends AstNode {
    public final List<PathFactor> factors;

    PathTerm(Pos pos, ImmutableList<PathFactor> factors) {
      super(pos, Op.PATH_TERM);
      this.factors = requireNonNull(factors);
      checkArgument(!factors.isEmpty(), "empty path term");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(factors, "");
    }
  }

  /** Path pattern expression: one path term, or a union of several. */
  public static class PathPatternExpression extends AstNode {
    public final List<PathTerm> terms;

    PathPatternExpression(Pos pos, ImmutableList<PathTerm> terms) {
      super(pos, Op.PATH_PATTERN_EXPRESSION);
      this.terms = requireNonNull(terms);
      checkArgument(!terms.isEmpty(), "empty path pattern expression");
    }

    /** Returns whether this expression is a union of two or more terms. */
    public boolean isUnion() {
      return terms.size() > 1;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(terms, op.padded);
    }
  }

  /** Path pattern prefix, for example "ANY SHORTEST TRAIL". */
  public static class PathPatternPrefix extends AstNode {
    public final PathMode mode;
    public final PathSearch search;
    public final int count;

    PathPatternPrefix(Pos pos, PathMode mode, PathSearch search, int count) {
      super(pos, Op.PATH_PATTERN_PREFIX);
      this.mode = requireNonNull(mode);
      this.search = requireNonNull(search);
      this.count = count;
      checkArgument(search.isCounted() ? count > 0 : count == 0,
          "count must be positive for a counted search, and zero otherwise");
    }

    /** Returns whether the path pattern that has this prefix is selective. */
    public boolean isSelective() {
      return search.isSelective();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      final StringBuilder b = new StringBuilder();
      if (search != PathSearch.ALL) {
        b.append(String.format(search.template, count));
      }
      if (mode != PathMode.WALK) {
        b.append(b.length() > 0 ? " " : "").append(mode.name());
      }
      return w.append(b.toString());
    }
  }

  /** Path pattern, "[p =] [prefix] expression". */
  public static class PathPattern extends AstNode {
    public final @Nullable VarDecl var;
    public final PathPatternPrefix prefix;
    public final PathPatternExpression expr;

    PathPattern(Pos pos, @Nullable VarDecl var, PathPatternPrefix prefix,
        PathPatternExpression expr) {
      super(pos, Op.PATH_PATTERN);
      this.var = var;
      this.prefix = requireNonNull(prefix);
      this.expr = requireNonNull(expr);
      checkArgument(var == null || var.op == Op.PATH_VARIABLE);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (var != null) {
        w.append(var, 0, 0).append(" = ");
      }
      if (prefix.search != PathSearch.ALL || prefix.mode != PathMode.WALK) {
        w.append(prefix, 0, 0).append(" ");
      }
      return w.append(expr, 0, 0);
    }
  }

  /** Graph pattern: one or more path patterns, an optional match mode and an
   * optional WHERE clause. The unit of semantic analysis. */
  public static class GraphPattern extends AstNode {
    public final @Nullable MatchMode matchMode;
    public final List<PathPattern> paths;
    public final @Nullable WhereClause where;

    GraphPattern(Pos pos, @Nullable MatchMode matchMode,
        ImmutableList<PathPattern> paths, @Nullable WhereClause where) {
      super(pos, Op.GRAPH_PATTERN);
      this.matchMode = matchMode;
      this.paths = requireNonNull(paths);
      this.where = where;
      checkArgument(!paths.isEmpty(), "graph pattern has no path patterns");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (matchMode != null) {
        w.append(matchMode.sql).append(" ");
      }
      w.appendAll(paths, ", ");
      if (where != null) {
        w.append(" ").append(where, 0, 0);
      }
      return w;
    }
  }
}

// End Ast.java
