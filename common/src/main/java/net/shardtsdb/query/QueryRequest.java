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
import com.google.common.base.Strings;

/**
 * An immutable range query request. Times are in milliseconds. Instant
 * queries use {@code start == end}.
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = QueryRequest.Builder.class)
public final class QueryRequest {
  private final String query;
  private final long start;
  private final long end;
  private final long step;
  private final QueryOptions options;

  private QueryRequest(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.query)) {
      throw new IllegalArgumentException("Query cannot be null or empty.");
    }
    if (builder.end < builder.start) {
      throw new IllegalArgumentException("End cannot be before start.");
    }
    if (builder.step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero.");
    }
    query = builder.query;
    start = builder.start;
    end = builder.end;
    step = builder.step;
    options = builder.options == null ? QueryOptions.DEFAULT
        : builder.options;
  }

  @JsonProperty("query")
  public String query() {
    return query;
  }

  @JsonProperty("start")
  public long start() {
    return start;
  }

  @JsonProperty("end")
  public long end() {
    return end;
  }

  @JsonProperty("step")
  public long step() {
    return step;
  }

  @JsonProperty("options")
  public QueryOptions options() {
    return options;
  }

  /**
   * @param query The new query text.
   * @return A copy of this request with the query replaced.
   */
  public QueryRequest withQuery(final String query) {
    return toBuilder().setQuery(query).build();
  }

  public Builder toBuilder() {
    return newBuilder()
        .setQuery(query)
        .setStart(start)
        .setEnd(end)
        .setStep(step)
        .setOptions(options);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryRequest)) {
      return false;
    }
    final QueryRequest other = (QueryRequest) o;
    return query.equals(other.query)
        && start == other.start
        && end == other.end
        && step == other.step
        && options.equals(other.options);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(query, start, end, step, options);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("query=")
        .append(query)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", step=")
        .append(step)
        .append(", options=[")
        .append(options)
        .append("]")
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String query;
    @JsonProperty
    private long start;
    @JsonProperty
    private long end;
    @JsonProperty
    private long step;
    @JsonProperty
    private QueryOptions options;

    public Builder setQuery(final String query) {
      this.query = query;
      return this;
    }

    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }

    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }

    public Builder setStep(final long step) {
      this.step = step;
      return this;
    }

    public Builder setOptions(final QueryOptions options) {
      this.options = options;
      return this;
    }

    public QueryRequest build() {
      return new QueryRequest(this);
    }
  }
}
