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
package net.shardtsdb.query.ql;

/**
 * Thrown when query text cannot be lexed, parsed or type checked.
 */
public class QueryParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 7467410214905531478L;

  public QueryParseException(final String msg) {
    super(msg);
  }

  public QueryParseException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
