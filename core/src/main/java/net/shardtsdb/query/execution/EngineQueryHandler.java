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
package net.shardtsdb.query.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.QueryCanceledException;
import net.shardtsdb.query.QueryContext;
import net.shardtsdb.query.QueryHandler;
import net.shardtsdb.query.QueryRequest;
import net.shardtsdb.query.QueryResponse;
import net.shardtsdb.query.Queryable;
import net.shardtsdb.query.engine.EvaluationResult;
import net.shardtsdb.query.engine.QueryEngine;

/**
 * Terminal handler evaluating requests with a {@link QueryEngine} against a
 * fixed {@link Queryable}. This is what a shard executor runs for each
 * embedded query it receives.
 */
public class EngineQueryHandler implements QueryHandler {
  private static final Logger LOG = LoggerFactory.getLogger(
      EngineQueryHandler.class);

  private final QueryEngine engine;
  private final Queryable queryable;

  public EngineQueryHandler(final QueryEngine engine,
                            final Queryable queryable) {
    if (engine == null) {
      throw new IllegalArgumentException("Engine cannot be null.");
    }
    if (queryable == null) {
      throw new IllegalArgumentException("Queryable cannot be null.");
    }
    this.engine = engine;
    this.queryable = queryable;
  }

  @Override
  public Deferred<QueryResponse> handle(final QueryContext context,
                                        final QueryRequest request) {
    if (context.isCancelled()) {
      return Deferred.fromResult(QueryResponse.fromError(EngineErrors.map(
          new QueryCanceledException(
              "Query was canceled: " + context.cancelReason()))));
    }

    class SuccessCB implements Callback<QueryResponse, EvaluationResult> {
      @Override
      public QueryResponse call(final EvaluationResult result)
          throws Exception {
        return QueryResponse.newBuilder()
            .setResultType(result.type())
            .setResult(result.streams())
            .addWarnings(result.warnings())
            .build();
      }
    }

    class ErrorCB implements Callback<QueryResponse, Exception> {
      @Override
      public QueryResponse call(final Exception e) throws Exception {
        final ApiException api = EngineErrors.map(e);
        if (LOG.isDebugEnabled()) {
          LOG.debug("Evaluation of " + request.query() + " failed", e);
        }
        return QueryResponse.fromError(api);
      }
    }

    try {
      return engine.execute(context, queryable, request.query(),
          request.start(), request.end(), request.step())
          .addCallbacks(new SuccessCB(), new ErrorCB());
    } catch (RuntimeException e) {
      LOG.warn("Failed to start evaluation of " + request.query(), e);
      return Deferred.fromResult(QueryResponse.fromError(EngineErrors.map(e)));
    }
  }
}
