// This file is part of ShardTSDB.
// Copyright (C) 2026  The ShardTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.shardtsdb.query.sharding;

import net.shardtsdb.query.ast.AggregateExpr;
import net.shardtsdb.query.ast.BinaryExpr;
import net.shardtsdb.query.ast.Call;
import net.shardtsdb.query.ast.Expr;
import net.shardtsdb.query.ast.ExprVisitor;
import net.shardtsdb.query.ast.MatrixSelector;
import net.shardtsdb.query.ast.NumberLiteral;
import net.shardtsdb.query.ast.ParenExpr;
import net.shardtsdb.query.ast.StringLiteral;
import net.shardtsdb.query.ast.SubqueryExpr;
import net.shardtsdb.query.ast.UnaryExpr;
import net.shardtsdb.query.ast.ValueType;
import net.shardtsdb.query.ast.VectorSelector;

/**
 * Predicates deciding which parts of a query can run on disjoint subsets
 * of series.
 * <p>
 * An expression is per series when every output series is computed from
 * a single input series. Running it once per shard and concatenating the
 * outputs then gives the same result as running it once over everything.
 * Anything unknown is treated as not per series.
 */
public final class Shardability {

  private static final PerSeries PER_SERIES = new PerSeries();
  private static final HasSelector HAS_SELECTOR = new HasSelector();

  private Shardability() { }

  /**
   * @param expr An expression.
   * @return True if the expression is an instant vector that is per series
   * and reads at least one shardable selector.
   */
  public static boolean canConcat(final Expr expr) {
    return expr.type() == ValueType.VECTOR
        && expr.accept(PER_SERIES)
        && expr.accept(HAS_SELECTOR);
  }

  /**
   * @param expr An expression.
   * @return True if the expression reads a selector that is neither
   * embedded nor already bound to a shard.
   */
  public static boolean hasRawSelector(final Expr expr) {
    return expr.accept(HAS_SELECTOR);
  }

  /**
   * @param selector A selector.
   * @return True if the selector can be bound to a shard.
   */
  static boolean isShardableSelector(final VectorSelector selector) {
    return !EmbeddedQueries.isEmbedded(selector)
        && !ShardDescriptor.hasShardMatcher(selector.matchers());
  }

  private static class PerSeries implements ExprVisitor<Boolean> {

    @Override
    public Boolean visitNumber(final NumberLiteral expr) {
      return true;
    }

    @Override
    public Boolean visitString(final StringLiteral expr) {
      return true;
    }

    @Override
    public Boolean visitVectorSelector(final VectorSelector expr) {
      return isShardableSelector(expr);
    }

    @Override
    public Boolean visitMatrixSelector(final MatrixSelector expr) {
      return isShardableSelector(expr.selector());
    }

    @Override
    public Boolean visitSubquery(final SubqueryExpr expr) {
      return false;
    }

    @Override
    public Boolean visitAggregate(final AggregateExpr expr) {
      return false;
    }

    @Override
    public Boolean visitBinary(final BinaryExpr expr) {
      // vector to vector operations join series of different shards
      if (expr.lhs().type() == ValueType.VECTOR
          && expr.rhs().type() == ValueType.VECTOR) {
        return false;
      }
      return expr.lhs().accept(this) && expr.rhs().accept(this);
    }

    @Override
    public Boolean visitCall(final Call expr) {
      if (!expr.function().isPerSeries()) {
        return false;
      }
      for (final Expr arg : expr.args()) {
        if (!arg.accept(this)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public Boolean visitParen(final ParenExpr expr) {
      return expr.expr().accept(this);
    }

    @Override
    public Boolean visitUnary(final UnaryExpr expr) {
      return expr.expr().accept(this);
    }
  }

  private static class HasSelector implements ExprVisitor<Boolean> {

    @Override
    public Boolean visitNumber(final NumberLiteral expr) {
      return false;
    }

    @Override
    public Boolean visitString(final StringLiteral expr) {
      return false;
    }

    @Override
    public Boolean visitVectorSelector(final VectorSelector expr) {
      return isShardableSelector(expr);
    }

    @Override
    public Boolean visitMatrixSelector(final MatrixSelector expr) {
      return isShardableSelector(expr.selector());
    }

    @Override
    public Boolean visitSubquery(final SubqueryExpr expr) {
      return expr.expr().accept(this);
    }

    @Override
    public Boolean visitAggregate(final AggregateExpr expr) {
      return expr.expr().accept(this)
          || (expr.param() != null && expr.param().accept(this));
    }

    @Override
    public Boolean visitBinary(final BinaryExpr expr) {
      return expr.lhs().accept(this) || expr.rhs().accept(this);
    }

    @Override
    public Boolean visitCall(final Call expr) {
      for (final Expr arg : expr.args()) {
        if (arg.accept(this)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Boolean visitParen(final ParenExpr expr) {
      return expr.expr().accept(this);
    }

    @Override
    public Boolean visitUnary(final UnaryExpr expr) {
      return expr.expr().accept(this);
    }
  }
}
