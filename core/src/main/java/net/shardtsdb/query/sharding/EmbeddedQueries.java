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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import net.shardtsdb.common.Const;
import net.shardtsdb.query.LabelMatcher;
import net.shardtsdb.query.ast.VectorSelector;
import net.shardtsdb.utils.JSON;

/**
 * A list of sub queries embedded in a rewritten query as the selector
 * {@code __embedded_queries__{__queries__="<json>"}}. The sharded queryable
 * runs the sub queries and returns their series as the selector's result.
 * <p>
 * When {@code shard_labels} is set the sub queries return partial
 * aggregates that may share labels across shards, so each result series is
 * tagged with its shard label to keep them apart.
 */
@JsonInclude(Include.NON_DEFAULT)
public final class EmbeddedQueries {
  private final List<EmbeddedQuery> queries;
  private final boolean shard_labels;

  @JsonCreator
  public EmbeddedQueries(
      @JsonProperty("queries") final List<EmbeddedQuery> queries,
      @JsonProperty("shard_labels") final boolean shard_labels) {
    if (queries == null || queries.isEmpty()) {
      throw new IllegalArgumentException("Queries cannot be null or empty.");
    }
    this.queries = ImmutableList.copyOf(queries);
    this.shard_labels = shard_labels;
  }

  @JsonProperty("queries")
  public List<EmbeddedQuery> queries() {
    return queries;
  }

  @JsonProperty("shard_labels")
  public boolean shardLabels() {
    return shard_labels;
  }

  /** @return Deterministic JSON for the queries. */
  public String encode() {
    return JSON.serializeToString(this);
  }

  /** @return The selector carrying these queries. */
  public VectorSelector toSelector() {
    return new VectorSelector(Const.EMBEDDED_QUERIES_METRIC,
        Collections.singletonList(LabelMatcher.equal(
            Const.EMBEDDED_QUERIES_LABEL, encode())), 0);
  }

  /**
   * @param json Encoded queries.
   * @return The decoded queries.
   * @throws IllegalArgumentException if the JSON is invalid.
   */
  public static EmbeddedQueries decode(final String json) {
    return JSON.parseToObject(json, EmbeddedQueries.class);
  }

  /**
   * @param selector A selector.
   * @return True if the selector carries embedded queries.
   */
  public static boolean isEmbedded(final VectorSelector selector) {
    return Const.EMBEDDED_QUERIES_METRIC.equals(selector.name());
  }

  /**
   * Extracts embedded queries from the matchers of a select call.
   * @param matchers The matchers.
   * @return The queries or null if the matchers are not an embedded
   * selector.
   * @throws IllegalArgumentException if the payload cannot be decoded.
   */
  public static EmbeddedQueries fromMatchers(final List<LabelMatcher> matchers) {
    boolean named = false;
    String payload = null;
    for (final LabelMatcher matcher : matchers) {
      if (matcher.type() != LabelMatcher.Type.EQUAL) {
        continue;
      }
      if (matcher.name().equals(Const.METRIC_NAME_LABEL)
          && matcher.value().equals(Const.EMBEDDED_QUERIES_METRIC)) {
        named = true;
      } else if (matcher.name().equals(Const.EMBEDDED_QUERIES_LABEL)) {
        payload = matcher.value();
      }
    }
    if (!named || payload == null) {
      return null;
    }
    return decode(payload);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EmbeddedQueries)) {
      return false;
    }
    final EmbeddedQueries other = (EmbeddedQueries) o;
    return queries.equals(other.queries) && shard_labels == other.shard_labels;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(queries, shard_labels);
  }

  @Override
  public String toString() {
    return encode();
  }

  /** One sub query, optionally bound to a shard. */
  @JsonInclude(Include.NON_NULL)
  public static final class EmbeddedQuery {
    private final String query;
    private final String shard;

    @JsonCreator
    public EmbeddedQuery(@JsonProperty("query") final String query,
                         @JsonProperty("shard") final String shard) {
      if (query == null || query.isEmpty()) {
        throw new IllegalArgumentException("Query cannot be null or empty.");
      }
      this.query = query;
      this.shard = shard;
    }

    @JsonProperty("query")
    public String query() {
      return query;
    }

    /** @return The shard label value or null for unsharded queries. */
    @JsonProperty("shard")
    public String shard() {
      return shard;
    }

    /** @return The shard or null. */
    @JsonIgnore
    public ShardDescriptor descriptor() {
      return shard == null ? null : ShardDescriptor.parse(shard);
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof EmbeddedQuery)) {
        return false;
      }
      final EmbeddedQuery other = (EmbeddedQuery) o;
      return query.equals(other.query) && Objects.equal(shard, other.shard);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(query, shard);
    }
  }
}
