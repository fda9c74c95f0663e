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
package net.shardtsdb.query.engine;

import com.stumbleupon.async.Deferred;

import net.shardtsdb.query.QueryContext;
import net.shardtsdb.query.Queryable;

/**
 * Evaluates query text against a {@link Queryable}. The engine pulls all
 * series through {@link Queryable#select}, so swapping the queryable is
 * how sharded execution is injected.
 */
public interface QueryEngine {

  /**
   * Evaluates a range query. Failures surface through the deferred and use
   * the canceled, timeout and storage exception types where they apply.
   * @param context The request context.
   * @param queryable The data source.
   * @param query The query text.
   * @param start Start of the range in ms.
   * @param end End of the range in ms, inclusive.
   * @param step Resolution in ms.
   * @return A deferred resolving to the result.
   */
  public Deferred<EvaluationResult> execute(final QueryContext context,
                                            final Queryable queryable,
                                            final String query,
                                            final long start,
                                            final long end,
                                            final long step);
}
