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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.shardtsdb.common.Const;
import net.shardtsdb.query.ast.AggregateExpr;
import net.shardtsdb.query.ast.BinaryExpr;
import net.shardtsdb.query.ast.Call;
import net.shardtsdb.query.ast.Expr;
import net.shardtsdb.query.ast.ExprTransformer;
import net.shardtsdb.query.ast.MatrixSelector;
import net.shardtsdb.query.ast.NumberLiteral;
import net.shardtsdb.query.ast.ParenExpr;
import net.shardtsdb.query.ast.SubqueryExpr;
import net.shardtsdb.query.ast.UnaryExpr;
import net.shardtsdb.query.ast.ValueType;
import net.shardtsdb.query.ast.VectorSelector;
import net.shardtsdb.query.sharding.EmbeddedQueries.EmbeddedQuery;

/**
 * Rewrites a query into an equivalent one whose selectors are embedded
 * sharded sub queries.
 * <p>
 * Shardable aggregations run once per shard and are combined by an outer
 * aggregation:
 * <ul>
 * <li>{@code sum}, {@code min}, {@code max}, {@code group}: the same
 * operator over the partial results.</li>
 * <li>{@code count}: a sum of the partial counts.</li>
 * <li>{@code avg}: the sum of partial sums divided by the sum of partial
 * counts.</li>
 * <li>{@code topk}, {@code bottomk} with a literal parameter: the same
 * operator over the per shard winners.</li>
 * </ul>
 * Other per series instant vector expressions are concatenated across
 * shards. Everything else is descended into. Calls that read a range but
 * cannot be sharded, and {@code absent}, are embedded whole as a single
 * unsharded query.
 * <p>
 * Not thread safe, use one instance per rewrite.
 */
class ShardingMapper extends ExprTransformer {

  /** Aggregations that can be split by shard. */
  static final Set<String> SHARDABLE_AGGREGATIONS = ImmutableSet.of(
      "sum", "min", "max", "count", "group", "avg", "topk", "bottomk");

  /** Aggregations whose partial results must be tagged with the shard. */
  private static final Set<String> TAGGED_AGGREGATIONS = ImmutableSet.of(
      "sum", "min", "max", "count", "group", "avg");

  /** Functions whose output depends on which series are absent. */
  private static final Set<String> EMBED_WHOLE = ImmutableSet.of(
      "absent", "absent_over_time");

  private final int total_shards;
  private final MapperStats stats;

  ShardingMapper(final int total_shards, final MapperStats stats) {
    this.total_shards = total_shards;
    this.stats = stats;
  }

  @Override
  public Expr visitVectorSelector(final VectorSelector expr) {
    if (Shardability.canConcat(expr)) {
      return concat(expr);
    }
    return expr;
  }

  @Override
  public Expr visitMatrixSelector(final MatrixSelector expr) {
    // a range cannot be embedded, the enclosing call decides
    return expr;
  }

  @Override
  public Expr visitSubquery(final SubqueryExpr expr) {
    return expr;
  }

  @Override
  public Expr visitAggregate(final AggregateExpr expr) {
    if (isShardable(expr)) {
      return shardAggregation(expr);
    }
    return super.visitAggregate(expr);
  }

  @Override
  public Expr visitBinary(final BinaryExpr expr) {
    if (Shardability.canConcat(expr)) {
      return concat(expr);
    }
    return super.visitBinary(expr);
  }

  @Override
  public Expr visitCall(final Call expr) {
    if (Shardability.canConcat(expr)) {
      return concat(expr);
    }
    if (expr.type() == ValueType.VECTOR
        && Shardability.hasRawSelector(expr)
        && (EMBED_WHOLE.contains(expr.name()) || readsRange(expr))) {
      return embedUnsharded(expr);
    }
    return super.visitCall(expr);
  }

  @Override
  public Expr visitParen(final ParenExpr expr) {
    if (Shardability.canConcat(expr)) {
      return concat(expr);
    }
    return super.visitParen(expr);
  }

  @Override
  public Expr visitUnary(final UnaryExpr expr) {
    if (Shardability.canConcat(expr)) {
      return concat(expr);
    }
    return super.visitUnary(expr);
  }

  /**
   * @param expr An aggregation.
   * @return True if the aggregation can be computed from per shard
   * partial aggregations.
   */
  static boolean isShardable(final AggregateExpr expr) {
    if (!SHARDABLE_AGGREGATIONS.contains(expr.op())) {
      return false;
    }
    if ((expr.op().equals("topk") || expr.op().equals("bottomk"))
        && !(expr.param() instanceof NumberLiteral)) {
      return false;
    }
    return Shardability.canConcat(expr.expr());
  }

  private Expr shardAggregation(final AggregateExpr expr) {
    final String op = expr.op();
    final boolean tagged = TAGGED_AGGREGATIONS.contains(op);
    final List<String> outer_grouping = outerGrouping(expr, tagged);

    if (op.equals("avg")) {
      final Expr sums = new AggregateExpr("sum", embedSharded(
          new AggregateExpr("sum", expr.expr(), null, expr.grouping(),
              expr.without()), true), null, outer_grouping, expr.without());
      final Expr counts = new AggregateExpr("sum", embedSharded(
          new AggregateExpr("count", expr.expr(), null, expr.grouping(),
              expr.without()), true), null, outer_grouping, expr.without());
      return new ParenExpr(BinaryExpr.of("/", sums, counts));
    }

    final String outer_op = op.equals("count") ? "sum" : op;
    return new AggregateExpr(outer_op, embedSharded(expr, tagged),
        expr.param(), outer_grouping, expr.without());
  }

  private static List<String> outerGrouping(final AggregateExpr expr,
                                            final boolean tagged) {
    if (!expr.without() || !tagged) {
      return expr.grouping();
    }
    final List<String> grouping = Lists.newArrayList(expr.grouping());
    grouping.add(Const.QUERY_SHARD_LABEL);
    return grouping;
  }

  private Expr concat(final Expr expr) {
    return embedSharded(expr, false);
  }

  /**
   * Embeds one copy of the expression per shard.
   */
  private VectorSelector embedSharded(final Expr expr, final boolean tagged) {
    final List<EmbeddedQuery> queries = Lists.newArrayListWithCapacity(
        total_shards);
    for (int i = 0; i < total_shards; i++) {
      final ShardDescriptor shard = new ShardDescriptor(i, total_shards);
      queries.add(new EmbeddedQuery(
          expr.accept(new ShardLabeler(shard)).toString(),
          shard.labelValue()));
    }
    stats.addShardedQueries(total_shards);
    return new EmbeddedQueries(queries, tagged).toSelector();
  }

  private static VectorSelector embedUnsharded(final Expr expr) {
    return new EmbeddedQueries(Collections.singletonList(
        new EmbeddedQuery(expr.toString(), null)), false).toSelector();
  }

  private static boolean readsRange(final Call expr) {
    for (final Expr arg : expr.args()) {
      if (arg.type() == ValueType.MATRIX) {
        return true;
      }
    }
    return false;
  }
}
