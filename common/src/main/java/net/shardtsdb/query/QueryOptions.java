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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;

/**
 * Per request query options.
 */
@JsonInclude(Include.NON_DEFAULT)
@JsonDeserialize(builder = QueryOptions.Builder.class)
public final class QueryOptions {

  /** Options with every field at its default. */
  public static final QueryOptions DEFAULT = newBuilder().build();

  /** A total shard count overriding the configured one when > 0. */
  private final int total_shards;

  /** Whether sharding is disabled for the request. */
  private final boolean sharding_disabled;

  private QueryOptions(final Builder builder) {
    if (builder.totalShards < 0) {
      throw new IllegalArgumentException("Total shards cannot be negative.");
    }
    total_shards = builder.totalShards;
    sharding_disabled = builder.shardingDisabled;
  }

  @JsonProperty("totalShards")
  public int totalShards() {
    return total_shards;
  }

  @JsonProperty("shardingDisabled")
  public boolean shardingDisabled() {
    return sharding_disabled;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryOptions)) {
      return false;
    }
    final QueryOptions other = (QueryOptions) o;
    return total_shards == other.total_shards
        && sharding_disabled == other.sharding_disabled;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(total_shards, sharding_disabled);
  }

  @Override
  public String toString() {
    return "totalShards=" + total_shards
        + ", shardingDisabled=" + sharding_disabled;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private int totalShards;
    @JsonProperty
    private boolean shardingDisabled;

    public Builder setTotalShards(final int total_shards) {
      totalShards = total_shards;
      return this;
    }

    public Builder setShardingDisabled(final boolean sharding_disabled) {
      shardingDisabled = sharding_disabled;
      return this;
    }

    public QueryOptions build() {
      return new QueryOptions(this);
    }
  }
}
