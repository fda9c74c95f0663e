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
package net.shardtsdb.query.execution;

import com.google.common.base.Strings;

import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;
import net.shardtsdb.exceptions.Exceptions;
import net.shardtsdb.exceptions.QueryCanceledException;
import net.shardtsdb.exceptions.QueryTimeoutException;
import net.shardtsdb.query.ql.QueryParseException;

/**
 * Maps errors raised while evaluating a query to {@link ApiException}s.
 */
public final class EngineErrors {

  private EngineErrors() { }

  /**
   * Classifies an evaluation error. An {@link ApiException} anywhere in the
   * causal chain keeps its type. Otherwise parse errors are bad data,
   * cancellations and timeouts keep their meaning and anything else is
   * internal.
   * @param e A non-null error.
   * @return The API error, the input itself if it already is one.
   */
  public static ApiException map(final Throwable e) {
    if (e == null) {
      throw new IllegalArgumentException("Exception cannot be null.");
    }
    final Throwable t = Exceptions.unwrap(e);
    final ApiException api = Exceptions.find(t, ApiException.class);
    if (api != null) {
      return api;
    }
    final String msg = Strings.isNullOrEmpty(t.getMessage())
        ? t.getClass().getSimpleName() : t.getMessage();
    if (Exceptions.find(t, QueryParseException.class) != null) {
      return new ApiException(ErrorType.BAD_DATA, msg, t);
    }
    if (Exceptions.find(t, QueryCanceledException.class) != null) {
      return new ApiException(ErrorType.CANCELED, msg, t);
    }
    if (Exceptions.find(t, QueryTimeoutException.class) != null) {
      return new ApiException(ErrorType.TIMEOUT, msg, t);
    }
    return new ApiException(ErrorType.INTERNAL, msg, t);
  }
}
