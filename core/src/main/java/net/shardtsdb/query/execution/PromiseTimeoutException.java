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

import net.shardtsdb.exceptions.QueryTimeoutException;

/**
 * Thrown by {@link Promise#join()} when the wait ran out before the promise
 * was marked done.
 */
public class PromiseTimeoutException extends QueryTimeoutException {
  private static final long serialVersionUID = 3462014983015702195L;

  public PromiseTimeoutException(final String msg) {
    super(msg);
  }
}
