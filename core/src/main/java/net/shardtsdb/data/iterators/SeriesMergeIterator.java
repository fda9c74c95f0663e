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
package net.shardtsdb.data.iterators;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ComparisonChain;

import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.Labels;
import net.shardtsdb.data.SampleIterator;

/**
 * Iterates the samples of one series stored in possibly overlapping or
 * duplicated chunks.
 * <p>
 * Chunks are ordered by min time then max time and consumed in that order.
 * Once a timestamp has been yielded any sample at or before it in a later
 * chunk is skipped, so the output is strictly increasing. Chunk cursors
 * are opened on demand and dropped once exhausted; {@link #seek(long)}
 * hops over chunks ending before the target without decoding them.
 * <p>
 * The yielded sequence only depends on the chunks, not on how the caller
 * mixes {@link #next()} and {@link #seek(long)}.
 */
public class SeriesMergeIterator implements SampleIterator {

  /** Orders chunks by min time, then max time. */
  public static final Comparator<Chunk> CHUNK_ORDER = new Comparator<Chunk>() {
    @Override
    public int compare(final Chunk a, final Chunk b) {
      return ComparisonChain.start()
          .compare(a.minTime(), b.minTime())
          .compare(a.maxTime(), b.maxTime())
          .result();
    }
  };

  private final Labels labels;
  private final Chunk[] chunks;

  /** Lazily opened cursors, indexed like {@link #chunks}. */
  private final SampleIterator[] cursors;

  /** Index of the chunk being consumed. */
  private int index;

  private boolean has_last;
  private long last_ts;
  private double last_value;

  /** Whether the last next or seek call landed on a sample. */
  private boolean has_value;

  private boolean exhausted;
  private Exception error;

  /**
   * Default ctor.
   * @param labels The non-null series labels, used in errors.
   * @param chunks The non-null chunks in any order.
   */
  public SeriesMergeIterator(final Labels labels, final List<Chunk> chunks) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (chunks == null) {
      throw new IllegalArgumentException("Chunks cannot be null.");
    }
    this.labels = labels;
    this.chunks = chunks.toArray(new Chunk[chunks.size()]);
    // Arrays.sort on objects is stable.
    Arrays.sort(this.chunks, CHUNK_ORDER);
    cursors = new SampleIterator[this.chunks.length];
    if (this.chunks.length == 0) {
      error = new IllegalStateException("no chunks");
    }
  }

  @Override
  public boolean next() {
    if (error != null || exhausted) {
      has_value = false;
      return false;
    }
    while (index < chunks.length) {
      final SampleIterator cursor = cursor(index);
      while (cursor.next()) {
        final long ts = cursor.timestamp();
        if (!has_last || ts > last_ts) {
          accept(cursor);
          return true;
        }
      }
      if (cursor.error() != null) {
        fail(cursor.error());
        return false;
      }
      release();
    }
    finish();
    return false;
  }

  @Override
  public boolean seek(final long timestamp) {
    if (error != null || exhausted) {
      has_value = false;
      return false;
    }
    if (has_value && last_ts >= timestamp) {
      return true;
    }
    final long target;
    if (has_last) {
      if (last_ts == Long.MAX_VALUE) {
        finish();
        return false;
      }
      target = Math.max(timestamp, last_ts + 1);
    } else {
      target = timestamp;
    }

    while (index < chunks.length) {
      if (cursors[index] == null && chunks[index].maxTime() < target) {
        // never opened and entirely before the target
        index++;
        continue;
      }
      final SampleIterator cursor = cursor(index);
      if (cursor.seek(target)) {
        accept(cursor);
        return true;
      }
      if (cursor.error() != null) {
        fail(cursor.error());
        return false;
      }
      release();
    }
    finish();
    return false;
  }

  @Override
  public long timestamp() {
    return last_ts;
  }

  @Override
  public double value() {
    return last_value;
  }

  @Override
  public Exception error() {
    return error;
  }

  /** @return The series labels. */
  public Labels labels() {
    return labels;
  }

  /** @return How many chunk cursors are currently open. */
  int openCursors() {
    int open = 0;
    for (final SampleIterator cursor : cursors) {
      if (cursor != null) {
        open++;
      }
    }
    return open;
  }

  private SampleIterator cursor(final int idx) {
    if (cursors[idx] == null) {
      cursors[idx] = chunks[idx].iterator();
    }
    return cursors[idx];
  }

  private void release() {
    cursors[index] = null;
    index++;
  }

  private void accept(final SampleIterator cursor) {
    last_ts = cursor.timestamp();
    last_value = cursor.value();
    has_last = true;
    has_value = true;
  }

  private void finish() {
    exhausted = true;
    has_value = false;
  }

  private void fail(final Exception cause) {
    error = new SeriesIterationException(
        "cannot iterate chunk for series: " + labels + ": "
            + cause.getMessage(), cause);
    has_value = false;
    Arrays.fill(cursors, null);
  }

  /** Raised through {@link #error()} when a chunk fails to decode. */
  public static class SeriesIterationException extends Exception {
    private static final long serialVersionUID = 3381262098129935025L;

    SeriesIterationException(final String msg, final Throwable cause) {
      super(msg, cause);
    }
  }
}
