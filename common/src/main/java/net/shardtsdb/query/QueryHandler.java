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
package net.shardtsdb.query;

import com.stumbleupon.async.Deferred;

/**
 * Executes a query request. Used both as the next handler of a
 * middleware and as the executor of sharded sub queries.
 * <p>
 * Failures may be returned either as an errored deferred or as a response
 * with an error status. Implementations must be thread safe.
 */
public interface QueryHandler {

  /**
   * @param context The non-null request context.
   * @param request The non-null request.
   * @return A deferred resolving to the response.
   */
  public Deferred<QueryResponse> handle(final QueryContext context,
                                        final QueryRequest request);
}
