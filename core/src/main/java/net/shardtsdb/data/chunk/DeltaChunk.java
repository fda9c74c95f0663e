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

import java.util.Arrays;

import net.shardtsdb.data.Chunk;
import net.shardtsdb.data.SampleIterator;

/**
 * An immutable delta encoded chunk.
 * <p>
 * Layout:
 * <ul>
 * <li>2 bytes: the number of samples, unsigned big endian.</li>
 * <li>First sample: the timestamp as a zig-zag varint followed by the
 * 8 raw bytes of the value, big endian.</li>
 * <li>Following samples: the timestamp delta to the previous sample as an
 * unsigned varint, always greater than zero, followed by the XOR of the
 * raw value bits with the previous value's bits as an unsigned varint.</li>
 * </ul>
 * Raw bits are kept so NaN payloads such as staleness markers survive.
 */
public class DeltaChunk implements Chunk {

  /** The most samples a chunk can hold. */
  public static final int MAX_SAMPLES = 0xFFFF;

  private final byte[] data;
  private final long min_time;
  private final long max_time;

  /**
   * Wraps an encoded payload. The payload is not validated, corrupt data
   * surfaces as an iterator error.
   * @param data The non-null payload.
   * @param min_time The first timestamp covered.
   * @param max_time The last timestamp covered.
   */
  public DeltaChunk(final byte[] data, final long min_time, final long max_time) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    if (max_time < min_time) {
      throw new IllegalArgumentException("Max time " + max_time
          + " cannot be less than min time " + min_time);
    }
    this.data = data;
    this.min_time = min_time;
    this.max_time = max_time;
  }

  @Override
  public long minTime() {
    return min_time;
  }

  @Override
  public long maxTime() {
    return max_time;
  }

  @Override
  public int numSamples() {
    if (data.length < 2) {
      return 0;
    }
    return ((data[0] & 0xFF) << 8) | (data[1] & 0xFF);
  }

  @Override
  public SampleIterator iterator() {
    return new DeltaChunkIterator(data);
  }

  /** @return A copy of the encoded payload. */
  public byte[] bytes() {
    return Arrays.copyOf(data, data.length);
  }

  @Override
  public String toString() {
    return "DeltaChunk[minTime=" + min_time + ", maxTime=" + max_time
        + ", samples=" + numSamples() + ", bytes=" + data.length + "]";
  }

  public static Appender newAppender() {
    return new Appender();
  }

  /**
   * Builds chunks one sample at a time. Not thread safe.
   */
  public static class Appender {
    private byte[] buf = new byte[64];
    private int length = 2;
    private int count;
    private long first_ts;
    private long last_ts;
    private long last_bits;

    /**
     * @param timestamp A timestamp greater than the last appended one.
     * @param value The value.
     * @return The appender.
     * @throws IllegalArgumentException if the timestamp is out of order.
     * @throws IllegalStateException if the chunk is full.
     */
    public Appender append(final long timestamp, final double value) {
      if (count >= MAX_SAMPLES) {
        throw new IllegalStateException("Chunk is full with " + count
            + " samples.");
      }
      final long bits = Double.doubleToRawLongBits(value);
      if (count == 0) {
        writeVarint((timestamp << 1) ^ (timestamp >> 63));
        ensure(8);
        for (int shift = 56; shift >= 0; shift -= 8) {
          buf[length++] = (byte) (bits >>> shift);
        }
        first_ts = timestamp;
      } else {
        if (timestamp <= last_ts) {
          throw new IllegalArgumentException("Timestamp " + timestamp
              + " must be greater than the last timestamp " + last_ts);
        }
        writeVarint(timestamp - last_ts);
        writeVarint(bits ^ last_bits);
      }
      last_ts = timestamp;
      last_bits = bits;
      count++;
      return this;
    }

    public int count() {
      return count;
    }

    public boolean isFull() {
      return count >= MAX_SAMPLES;
    }

    /** @return A chunk with the samples appended so far. */
    public DeltaChunk build() {
      final byte[] data = Arrays.copyOf(buf, length);
      data[0] = (byte) (count >>> 8);
      data[1] = (byte) count;
      if (count == 0) {
        return new DeltaChunk(data, 0, 0);
      }
      return new DeltaChunk(data, first_ts, last_ts);
    }

    private void writeVarint(long value) {
      ensure(10);
      while ((value & ~0x7FL) != 0) {
        buf[length++] = (byte) ((value & 0x7F) | 0x80);
        value >>>= 7;
      }
      buf[length++] = (byte) value;
    }

    private void ensure(final int bytes) {
      if (length + bytes > buf.length) {
        buf = Arrays.copyOf(buf, Math.max(buf.length * 2, length + bytes));
      }
    }
  }
}
