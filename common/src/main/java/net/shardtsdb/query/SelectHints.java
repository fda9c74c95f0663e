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

/**
 * Time bounds of a select call, in milliseconds, inclusive.
 */
public final class SelectHints {
  private final long start;
  private final long end;
  private final long step;

  public SelectHints(final long start, final long end, final long step) {
    this.start = start;
    this.end = end;
    this.step = step;
  }

  public long start() {
    return start;
  }

  public long end() {
    return end;
  }

  public long step() {
    return step;
  }

  @Override
  public String toString() {
    return "start=" + start + ", end=" + end + ", step=" + step;
  }
}
