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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.shardtsdb.data.SampleStream;
import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;

/**
 * The response to a {@link QueryRequest}. Either successful with a typed
 * result or an error with a classification.
 */
@JsonInclude(Include.NON_EMPTY)
public final class QueryResponse {
  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_ERROR = "error";

  private final String status;
  private final ErrorType error_type;
  private final String error;
  private final ResultType result_type;
  private final List<SampleStream> result;
  private final SortedMap<String, SortedSet<String>> headers;
  private final SortedSet<String> warnings;

  private QueryResponse(final Builder builder) {
    if (builder.errorType != null) {
      status = STATUS_ERROR;
    } else {
      if (builder.resultType == null) {
        throw new IllegalArgumentException("Result type cannot be null.");
      }
      status = STATUS_SUCCESS;
    }
    error_type = builder.errorType;
    error = builder.error;
    result_type = builder.resultType;
    result = builder.result == null ? Collections.<SampleStream>emptyList()
        : ImmutableList.copyOf(builder.result);
    final ImmutableSortedMap.Builder<String, SortedSet<String>> hdrs =
        ImmutableSortedMap.naturalOrder();
    for (final Map.Entry<String, Collection<String>> entry
        : builder.headers.entrySet()) {
      hdrs.put(entry.getKey(), ImmutableSortedSet.copyOf(entry.getValue()));
    }
    headers = hdrs.build();
    warnings = ImmutableSortedSet.copyOf(builder.warnings);
  }

  /**
   * @param e A non-null API exception.
   * @return An error response for the exception.
   */
  public static QueryResponse fromError(final ApiException e) {
    return newBuilder()
        .setError(e.type(), e.getMessage())
        .build();
  }

  @JsonProperty("status")
  public String status() {
    return status;
  }

  @JsonIgnore
  public boolean isSuccess() {
    return error_type == null;
  }

  @JsonIgnore
  public ErrorType errorType() {
    return error_type;
  }

  @JsonProperty("errorType")
  public String errorTypeName() {
    return error_type == null ? null : error_type.typeName();
  }

  @JsonProperty("error")
  public String error() {
    return error;
  }

  @JsonProperty("resultType")
  public ResultType resultType() {
    return result_type;
  }

  @JsonProperty("result")
  public List<SampleStream> result() {
    return result;
  }

  /** @return Response headers with their values sorted. */
  @JsonProperty("headers")
  public SortedMap<String, SortedSet<String>> headers() {
    return headers;
  }

  @JsonProperty("warnings")
  public SortedSet<String> warnings() {
    return warnings;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("status=")
        .append(status)
        .append(", errorType=")
        .append(error_type)
        .append(", error=")
        .append(error)
        .append(", resultType=")
        .append(result_type)
        .append(", result=")
        .append(result)
        .append(", headers=")
        .append(headers)
        .append(", warnings=")
        .append(warnings)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private ErrorType errorType;
    private String error;
    private ResultType resultType;
    private List<SampleStream> result;
    private final Map<String, Collection<String>> headers = Maps.newTreeMap();
    private final List<String> warnings = Lists.newArrayList();

    public Builder setError(final ErrorType type, final String error) {
      errorType = type;
      this.error = error;
      return this;
    }

    public Builder setResultType(final ResultType result_type) {
      resultType = result_type;
      return this;
    }

    public Builder setResult(final List<SampleStream> result) {
      this.result = result;
      return this;
    }

    public Builder addHeader(final String name,
                             final Collection<String> values) {
      Collection<String> existing = headers.get(name);
      if (existing == null) {
        existing = Lists.newArrayList();
        headers.put(name, existing);
      }
      existing.addAll(values);
      return this;
    }

    public Builder addHeaders(final Map<String, ? extends Collection<String>> headers) {
      for (final Map.Entry<String, ? extends Collection<String>> entry
          : headers.entrySet()) {
        addHeader(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder addWarnings(final Collection<String> warnings) {
      this.warnings.addAll(warnings);
      return this;
    }

    public QueryResponse build() {
      return new QueryResponse(this);
    }
  }
}
