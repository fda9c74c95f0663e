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
package net.shardtsdb.query.sharding;

import java.util.List;

import com.google.common.base.Objects;

import net.shardtsdb.common.Const;
import net.shardtsdb.data.Labels;
import net.shardtsdb.query.LabelMatcher;

/**
 * Identifies one of N disjoint shards of the series space. Rendered as a
 * {@code __query_shard__="<index+1>_of_<total>"} label value with a one
 * based index. A series belongs to the shard whose zero based index equals
 * its label hash modulo the total.
 */
public final class ShardDescriptor {
  private static final String SEPARATOR = "_of_";

  private final int index;
  private final int total;

  /**
   * Default ctor.
   * @param index The zero based shard index.
   * @param total The total number of shards.
   * @throws IllegalArgumentException if the index is out of range.
   */
  public ShardDescriptor(final int index, final int total) {
    if (total < 1) {
      throw new IllegalArgumentException("Total shards must be at least 1.");
    }
    if (index < 0 || index >= total) {
      throw new IllegalArgumentException("Shard index " + index
          + " out of range for " + total + " shards.");
    }
    this.index = index;
    this.total = total;
  }

  /** @return The zero based index. */
  public int index() {
    return index;
  }

  public int total() {
    return total;
  }

  /** @return The label value, e.g. {@code 1_of_16}. */
  public String labelValue() {
    return (index + 1) + SEPARATOR + total;
  }

  /** @return A matcher selecting this shard. */
  public LabelMatcher matcher() {
    return LabelMatcher.equal(Const.QUERY_SHARD_LABEL, labelValue());
  }

  /**
   * @param labels A series' labels.
   * @return True if the series belongs to this shard.
   */
  public boolean owns(final Labels labels) {
    return Long.remainderUnsigned(labels.hash(), total) == index;
  }

  /**
   * @param value A label value such as {@code 3_of_16}.
   * @return The descriptor.
   * @throws IllegalArgumentException if the value is malformed.
   */
  public static ShardDescriptor parse(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Shard value cannot be null.");
    }
    final int sep = value.indexOf(SEPARATOR);
    if (sep <= 0) {
      throw new IllegalArgumentException("Invalid shard value: " + value);
    }
    try {
      final int one_based = Integer.parseInt(value.substring(0, sep));
      final int total = Integer.parseInt(value.substring(
          sep + SEPARATOR.length()));
      return new ShardDescriptor(one_based - 1, total);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid shard value: " + value, e);
    }
  }

  /**
   * @param matchers Matchers of a selector.
   * @return The shard selected by an equality matcher on the shard label
   * or null if there is none.
   * @throws IllegalArgumentException if the shard matcher is malformed.
   */
  public static ShardDescriptor fromMatchers(final List<LabelMatcher> matchers) {
    for (final LabelMatcher matcher : matchers) {
      if (matcher.name().equals(Const.QUERY_SHARD_LABEL)) {
        if (matcher.type() != LabelMatcher.Type.EQUAL) {
          throw new IllegalArgumentException("Shard matcher must be an "
              + "equality matcher: " + matcher);
        }
        return parse(matcher.value());
      }
    }
    return null;
  }

  /**
   * @param matchers Matchers of a selector.
   * @return True if any matcher is on the shard label.
   */
  public static boolean hasShardMatcher(final List<LabelMatcher> matchers) {
    for (final LabelMatcher matcher : matchers) {
      if (matcher.name().equals(Const.QUERY_SHARD_LABEL)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ShardDescriptor)) {
      return false;
    }
    final ShardDescriptor other = (ShardDescriptor) o;
    return index == other.index && total == other.total;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(index, total);
  }

  @Override
  public String toString() {
    return labelValue();
  }
}
