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

import java.util.List;

import net.shardtsdb.data.SeriesSet;

/**
 * A source of series the query engine pulls from.
 */
public interface Queryable {

  /**
   * Selects the series matching every matcher. Errors are reported through
   * {@link SeriesSet#error()} rather than thrown.
   * @param hints Time bounds of the selection.
   * @param matchers Label matchers, all of which must match.
   * @return A label ordered series set.
   */
  public SeriesSet select(final SelectHints hints,
                          final List<LabelMatcher> matchers);
}
