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
package net.shardtsdb.utils;

/**
 * {@link Limits} read from a {@link Config}. A tenant specific key of the
 * form {@code shardtsdb.query.sharding.total_shards.<tenant>} overrides the
 * default {@code shardtsdb.query.sharding.total_shards}.
 */
public class ConfigLimits implements Limits {
  private final Config config;

  public ConfigLimits(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
  }

  @Override
  public int queryShardingTotalShards(final String tenant) {
    if (tenant != null) {
      final String key = Config.SHARDING_TENANT_SHARDS_PREFIX + tenant;
      if (config.hasProperty(key)) {
        return config.getInt(key);
      }
    }
    return config.getInt(Config.SHARDING_TOTAL_SHARDS_KEY);
  }
}
