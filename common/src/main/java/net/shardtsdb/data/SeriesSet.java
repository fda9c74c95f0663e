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
package net.shardtsdb.data;

import java.util.Collection;

/**
 * A pull based cursor over series ordered by labels.
 */
public interface SeriesSet {

  /**
   * Advances to the next series.
   * @return True if a series is available via {@link #at()}.
   */
  public boolean next();

  /** @return The current series. */
  public Series at();

  /** @return The error that ended the set or null. */
  public Exception error();

  /** @return Non-fatal warnings collected while producing the set. */
  public Collection<String> warnings();
}
