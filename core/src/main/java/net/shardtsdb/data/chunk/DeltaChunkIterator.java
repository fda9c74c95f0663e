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
package net.shardtsdb.data.chunk;

import net.shardtsdb.data.SampleIterator;

/**
 * Lazily decodes a {@link DeltaChunk} payload. A truncated or malformed
 * payload ends the iteration with a {@link ChunkDecodeException}.
 */
public class DeltaChunkIterator implements SampleIterator {
  private final byte[] data;
  private final int total;
  private int offset = 2;
  private int read;
  private boolean done;
  private long timestamp;
  private long bits;
  private ChunkDecodeException error;

  DeltaChunkIterator(final byte[] data) {
    this.data = data;
    if (data.length < 2) {
      total = 0;
      if (data.length > 0) {
        error = new ChunkDecodeException(ChunkDecodeException.EOF);
      }
    } else {
      total = ((data[0] & 0xFF) << 8) | (data[1] & 0xFF);
    }
  }

  @Override
  public boolean next() {
    if (done || error != null || read >= total) {
      done = true;
      return false;
    }
    try {
      if (read == 0) {
        final long zigzag = readVarint();
        timestamp = (zigzag >>> 1) ^ -(zigzag & 1);
        if (offset + 8 > data.length) {
          throw new ChunkDecodeException(ChunkDecodeException.EOF);
        }
        long raw = 0;
        for (int i = 0; i < 8; i++) {
          raw = (raw << 8) | (data[offset++] & 0xFF);
        }
        bits = raw;
      } else {
        final long delta = readVarint();
        if (delta <= 0) {
          throw new ChunkDecodeException("invalid timestamp delta " + delta
              + " at sample " + read);
        }
        timestamp += delta;
        bits ^= readVarint();
      }
    } catch (ChunkDecodeException e) {
      error = e;
      done = true;
      return false;
    }
    read++;
    return true;
  }

  @Override
  public boolean seek(final long target) {
    if (done || error != null) {
      return false;
    }
    if (read > 0 && timestamp >= target) {
      return true;
    }
    while (next()) {
      if (timestamp >= target) {
        return true;
      }
    }
    return false;
  }

  @Override
  public long timestamp() {
    return timestamp;
  }

  @Override
  public double value() {
    return Double.longBitsToDouble(bits);
  }

  @Override
  public Exception error() {
    return error;
  }

  private long readVarint() throws ChunkDecodeException {
    long result = 0;
    for (int shift = 0; shift < 64; shift += 7) {
      if (offset >= data.length) {
        throw new ChunkDecodeException(ChunkDecodeException.EOF);
      }
      final byte b = data[offset++];
      result |= (long) (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new ChunkDecodeException("varint overflows 64 bits");
  }
}
