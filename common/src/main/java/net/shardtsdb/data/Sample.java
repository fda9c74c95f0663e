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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import net.shardtsdb.common.Const;

/**
 * A single timestamped value. Serializes as a {@code [timestamp, value]}
 * pair.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({ "timestamp", "value" })
public final class Sample {
  private final long timestamp;
  private final double value;

  @JsonCreator
  public Sample(@JsonProperty("timestamp") final long timestamp,
                @JsonProperty("value") final double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  /** @return The timestamp in milliseconds since the epoch. */
  @JsonProperty("timestamp")
  public long timestamp() {
    return timestamp;
  }

  @JsonProperty("value")
  public double value() {
    return value;
  }

  /**
   * @param value A value.
   * @return True if the value carries the staleness marker bits.
   */
  public static boolean isStaleMarker(final double value) {
    return Double.doubleToRawLongBits(value) == Const.STALE_NAN_BITS;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sample)) {
      return false;
    }
    final Sample other = (Sample) o;
    return timestamp == other.timestamp
        && Double.doubleToRawLongBits(value)
            == Double.doubleToRawLongBits(other.value);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(timestamp) * 31
        + Long.hashCode(Double.doubleToRawLongBits(value));
  }

  @Override
  public String toString() {
    return value + " @" + timestamp;
  }
}
