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

/**
 * The output of {@link QueryShardingPlanner#plan(String, int)}.
 */
public final class ShardingPlan {
  private final String query;
  private final MapperStats stats;

  public ShardingPlan(final String query, final MapperStats stats) {
    this.query = query;
    this.stats = stats;
  }

  /** @return The rewritten query text, or the original when nothing was
   * sharded. */
  public String query() {
    return query;
  }

  public MapperStats stats() {
    return stats;
  }

  /** @return True if executing the plan involves sharded sub queries. */
  public boolean isSharded() {
    return stats.shardedQueries() > 0;
  }

  @Override
  public String toString() {
    return "query=" + query + ", " + stats;
  }
}
