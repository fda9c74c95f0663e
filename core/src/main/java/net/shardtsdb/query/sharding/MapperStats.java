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
 * Counters produced by one rewrite.
 */
public class MapperStats {
  private int sharded_queries;

  /** @param count Number of embedded sub queries added. */
  public void addShardedQueries(final int count) {
    sharded_queries += count;
  }

  /** @return How many sub queries the rewrite embedded, 0 if none. */
  public int shardedQueries() {
    return sharded_queries;
  }

  @Override
  public String toString() {
    return "shardedQueries=" + sharded_queries;
  }
}
