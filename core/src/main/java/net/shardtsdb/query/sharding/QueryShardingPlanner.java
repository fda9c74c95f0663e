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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;
import net.shardtsdb.query.ast.Expr;
import net.shardtsdb.query.ql.ExprParser;
import net.shardtsdb.query.ql.QueryParseException;

/**
 * Turns query text into a sharded equivalent. The output is a valid query
 * whose selectors are all embedded queries, so evaluating it against a
 * {@link ShardedQueryable} fans each of them out to the shards.
 * <p>
 * Planning is a pure function of the query and the shard count. Thread
 * safe.
 */
public class QueryShardingPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryShardingPlanner.class);

  private final ExprParser parser;

  public QueryShardingPlanner() {
    this(new ExprParser());
  }

  public QueryShardingPlanner(final ExprParser parser) {
    if (parser == null) {
      throw new IllegalArgumentException("Parser cannot be null.");
    }
    this.parser = parser;
  }

  /**
   * Plans a query.
   * @param query The query text.
   * @param total_shards How many shards to split selectors into, at least 2.
   * @return The plan. When nothing could be sharded the plan carries the
   * original query and zero sharded queries.
   * @throws IllegalArgumentException if the shard count is less than 2.
   * @throws ApiException with {@link ErrorType#BAD_DATA} if the query does
   * not parse.
   * @throws ShardingException if the rewrite failed.
   */
  public ShardingPlan plan(final String query, final int total_shards) {
    if (total_shards < 2) {
      throw new IllegalArgumentException("Total shards must be at least 2, "
          + "got " + total_shards);
    }
    final Expr expr;
    try {
      expr = parser.parse(query);
    } catch (QueryParseException e) {
      throw new ApiException(ErrorType.BAD_DATA, e.getMessage(), e);
    }

    final MapperStats stats = new MapperStats();
    final Expr mapped;
    try {
      mapped = expr.accept(new ShardingMapper(total_shards, stats));
    } catch (ShardingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ShardingException("Failed to shard query: " + query, e);
    }

    if (stats.shardedQueries() == 0 || Shardability.hasRawSelector(mapped)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Nothing to shard in query: " + query);
      }
      return new ShardingPlan(query, new MapperStats());
    }
    final String rewritten = mapped.toString();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sharded query " + query + " into " + rewritten + " with "
          + stats.shardedQueries() + " sharded queries");
    }
    return new ShardingPlan(rewritten, stats);
  }
}
