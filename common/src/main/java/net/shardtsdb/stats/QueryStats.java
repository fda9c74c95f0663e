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
package net.shardtsdb.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per request statistics carried along with the query context.
 */
public class QueryStats {
  private final AtomicLong sharded_queries = new AtomicLong();

  /** @param count Sharded queries to add. */
  public void addShardedQueries(final long count) {
    sharded_queries.addAndGet(count);
  }

  /** @return The number of sharded queries executed for the request. */
  public long shardedQueries() {
    return sharded_queries.get();
  }

  @Override
  public String toString() {
    return "shardedQueries=" + sharded_queries.get();
  }
}
