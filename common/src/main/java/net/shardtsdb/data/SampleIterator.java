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

/**
 * A forward only cursor over the samples of a series or chunk.
 * <p>
 * Before the first successful {@link #next()} or {@link #seek(long)} the
 * accessors are undefined. Once either returns false the cursor is
 * exhausted and must not be advanced again; {@link #error()} then tells an
 * exhausted cursor apart from a failed one.
 */
public interface SampleIterator {

  /**
   * Advances to the next sample.
   * @return True if a sample is available.
   */
  public boolean next();

  /**
   * Advances to the first sample with a timestamp at or after the given
   * time. Never moves backwards: if the current sample already satisfies
   * the target it stays put.
   * @param timestamp The target timestamp in milliseconds.
   * @return True if such a sample is available.
   */
  public boolean seek(final long timestamp);

  /** @return The timestamp of the current sample. */
  public long timestamp();

  /** @return The value of the current sample. */
  public double value();

  /** @return An error that ended the iteration or null if none. */
  public Exception error();
}
