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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.shardtsdb.data.iterators.SeriesMergeIterator;

/**
 * A series stored as a list of chunks. Each call to {@link #iterator()}
 * starts a fresh merge over the chunks.
 */
public class ChunkSeries implements ChunkedSeries {
  private final Labels labels;
  private final List<Chunk> chunks;

  public ChunkSeries(final Labels labels, final List<Chunk> chunks) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (chunks == null) {
      throw new IllegalArgumentException("Chunks cannot be null.");
    }
    this.labels = labels;
    this.chunks = ImmutableList.copyOf(chunks);
  }

  @Override
  public Labels labels() {
    return labels;
  }

  @Override
  public List<Chunk> chunks() {
    return chunks;
  }

  @Override
  public SeriesMergeIterator iterator() {
    return new SeriesMergeIterator(labels, chunks);
  }

  @Override
  public String toString() {
    return labels + " chunks=" + chunks.size();
  }
}
