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
 * An encoded, time bounded block of samples of a single series.
 */
public interface Chunk {

  /** @return The first timestamp covered, inclusive. */
  public long minTime();

  /** @return The last timestamp covered, inclusive. */
  public long maxTime();

  /** @return The number of samples encoded in the chunk. */
  public int numSamples();

  /** @return A new decoding cursor over the samples. */
  public SampleIterator iterator();
}
