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

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;
import net.shardtsdb.query.QueryContext;
import net.shardtsdb.query.QueryHandler;
import net.shardtsdb.query.QueryMiddleware;
import net.shardtsdb.query.QueryRequest;
import net.shardtsdb.query.QueryResponse;
import net.shardtsdb.query.engine.EvaluationResult;
import net.shardtsdb.query.engine.QueryEngine;
import net.shardtsdb.query.execution.EngineErrors;
import net.shardtsdb.stats.StatsCollector;
import net.shardtsdb.stats.StatsCollector.Counter;
import net.shardtsdb.stats.StatsCollector.Histogram;
import net.shardtsdb.utils.Config;
import net.shardtsdb.utils.Limits;

/**
 * Middleware splitting range queries by shard.
 * <p>
 * For each request it decides whether sharding applies, rewrites the query
 * with a {@link QueryShardingPlanner} and evaluates the rewritten query
 * with the {@link QueryEngine} over a {@link ShardedQueryable} that sends
 * the embedded queries to the next handler. Requests that cannot or should
 * not be sharded, including those whose rewrite failed, are passed to the
 * next handler untouched.
 * <p>
 * Embedded queries are dispatched on a pool owned by the middleware,
 * release it with {@link #close()}.
 */
public class ShardingMiddleware implements QueryMiddleware, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      ShardingMiddleware.class);

  public static final String REWRITES_ATTEMPTED_METRIC =
      "query_sharding.rewrites_attempted";
  public static final String REWRITES_SUCCEEDED_METRIC =
      "query_sharding.rewrites_succeeded";
  public static final String SHARDED_QUERIES_METRIC =
      "query_sharding.sharded_queries";
  public static final String SHARDED_QUERIES_PER_QUERY_METRIC =
      "query_sharding.sharded_queries_per_query";

  private final Limits limits;
  private final QueryEngine engine;
  private final QueryShardingPlanner planner;
  private final ExecutorService executor;
  private final long timeout_ms;

  private final Counter rewrites_attempted;
  private final Counter rewrites_succeeded;
  private final Counter sharded_queries;
  private final Histogram sharded_queries_per_query;

  /**
   * Ctor with a default planner.
   * @param limits Per tenant limits.
   * @param engine The engine evaluating rewritten queries.
   * @param stats Where to register metrics.
   * @param config The config to read the timeout and pool size from.
   */
  public ShardingMiddleware(final Limits limits,
                            final QueryEngine engine,
                            final StatsCollector stats,
                            final Config config) {
    this(limits, engine, stats, config, new QueryShardingPlanner());
  }

  /**
   * Default ctor.
   * @param limits Per tenant limits.
   * @param engine The engine evaluating rewritten queries.
   * @param stats Where to register metrics.
   * @param config The config to read the timeout and pool size from.
   * @param planner The planner.
   */
  public ShardingMiddleware(final Limits limits,
                            final QueryEngine engine,
                            final StatsCollector stats,
                            final Config config,
                            final QueryShardingPlanner planner) {
    if (limits == null) {
      throw new IllegalArgumentException("Limits cannot be null.");
    }
    if (engine == null) {
      throw new IllegalArgumentException("Engine cannot be null.");
    }
    if (stats == null) {
      throw new IllegalArgumentException("Stats cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (planner == null) {
      throw new IllegalArgumentException("Planner cannot be null.");
    }
    this.limits = limits;
    this.engine = engine;
    this.planner = planner;

    timeout_ms = config.getLong(Config.SHARDING_TIMEOUT_KEY);
    if (timeout_ms <= 0) {
      throw new IllegalArgumentException("The value of "
          + Config.SHARDING_TIMEOUT_KEY + " must be greater than 0.");
    }
    final int threads = config.getInt(Config.SHARDING_FANOUT_THREADS_KEY);
    final ThreadFactory factory = new ThreadFactoryBuilder()
        .setNameFormat("query-sharding-%d")
        .setDaemon(true)
        .build();
    executor = threads > 0 ? Executors.newFixedThreadPool(threads, factory)
        : Executors.newCachedThreadPool(factory);

    rewrites_attempted = stats.counter(REWRITES_ATTEMPTED_METRIC,
        "Total number of queries the middleware attempted to shard.");
    rewrites_succeeded = stats.counter(REWRITES_SUCCEEDED_METRIC,
        "Total number of queries successfully rewritten in a shardable way.");
    sharded_queries = stats.counter(SHARDED_QUERIES_METRIC,
        "Total number of sharded queries.");
    sharded_queries_per_query = stats.histogram(
        SHARDED_QUERIES_PER_QUERY_METRIC,
        "Number of sharded queries a single query has been rewritten to.");
  }

  @Override
  public QueryHandler wrap(final QueryHandler next) {
    if (next == null) {
      throw new IllegalArgumentException("Next handler cannot be null.");
    }
    return new ShardingHandler(next);
  }

  /** Stops the dispatch pool. Queries in flight are left to finish. */
  @Override
  public void close() {
    executor.shutdown();
  }

  /**
   * @param tenants The tenants of a request.
   * @return The smallest positive shard count among the tenants or 0 if
   * none has one.
   */
  int totalShards(final List<String> tenants) {
    int total = 0;
    for (final String tenant : tenants) {
      final int shards = limits.queryShardingTotalShards(tenant);
      if (shards > 0 && (total == 0 || shards < total)) {
        total = shards;
      }
    }
    return total;
  }

  /**
   * The handler returned by {@link #wrap(QueryHandler)}.
   */
  private class ShardingHandler implements QueryHandler {
    private final QueryHandler next;

    ShardingHandler(final QueryHandler next) {
      this.next = next;
    }

    @Override
    public Deferred<QueryResponse> handle(final QueryContext context,
                                          final QueryRequest request) {
      if (context.tenants().isEmpty()) {
        return Deferred.fromResult(QueryResponse.fromError(new ApiException(
            ErrorType.BAD_DATA, "no tenant ID found in the request context")));
      }

      int total_shards = totalShards(context.tenants());
      if (request.options().totalShards() > 0) {
        total_shards = request.options().totalShards();
      }
      if (request.options().shardingDisabled() || total_shards <= 1) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Query sharding is disabled for this query or tenant: "
              + request.query());
        }
        return next.handle(context, request);
      }

      rewrites_attempted.increment();
      final ShardingPlan plan;
      try {
        plan = planner.plan(request.query(), total_shards);
      } catch (RuntimeException e) {
        LOG.warn("Failed to rewrite the query into a shardable query, "
            + "falling back to executing it without sharding: "
            + request.query(), e);
        return next.handle(context, request);
      }
      if (!plan.isSharded()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Query cannot be rewritten into a shardable query: "
              + request.query());
        }
        return next.handle(context, request);
      }

      final int count = plan.stats().shardedQueries();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Query " + request.query() + " has been rewritten into "
            + plan.query() + " with " + count + " sharded queries");
      }
      rewrites_succeeded.increment();
      sharded_queries.add(count);
      sharded_queries_per_query.observe(count);
      context.stats().addShardedQueries(count);

      return executeSharded(context, request.withQuery(plan.query()));
    }

    private Deferred<QueryResponse> executeSharded(
        final QueryContext context,
        final QueryRequest request) {
      final ShardedQueryable queryable = new ShardedQueryable(context,
          request, next, executor, timeout_ms);

      class SuccessCB implements Callback<QueryResponse, EvaluationResult> {
        @Override
        public QueryResponse call(final EvaluationResult result)
            throws Exception {
          if (context.isCancelled()) {
            return QueryResponse.fromError(new ApiException(
                ErrorType.CANCELED, "Query was canceled: "
                    + context.cancelReason()));
          }
          return QueryResponse.newBuilder()
              .setResultType(result.type())
              .setResult(result.streams())
              .addHeaders(queryable.responseHeaders())
              .addWarnings(result.warnings())
              .addWarnings(queryable.warnings())
              .build();
        }
      }

      class ErrorCB implements Callback<QueryResponse, Exception> {
        @Override
        public QueryResponse call(final Exception e) throws Exception {
          final ApiException api = EngineErrors.map(e);
          if (LOG.isDebugEnabled()) {
            LOG.debug("Sharded evaluation of " + request.query()
                + " failed", e);
          }
          return QueryResponse.fromError(api);
        }
      }

      try {
        return engine.execute(context, queryable, request.query(),
            request.start(), request.end(), request.step())
            .addCallbacks(new SuccessCB(), new ErrorCB());
      } catch (RuntimeException e) {
        LOG.warn("Failed to start the sharded evaluation of "
            + request.query(), e);
        return Deferred.fromResult(QueryResponse.fromError(
            EngineErrors.map(e)));
      }
    }
  }
}
