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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.hash.Hasher;

import net.shardtsdb.common.Const;

/**
 * An immutable set of name/value pairs identifying a series, sorted by
 * name. Equality is set equality and the natural order sorts label sets
 * pairwise by name then value, shorter sets first on a common prefix.
 * <p>
 * Empty values are dropped on build as a label with an empty value is
 * the same as a missing label.
 */
public final class Labels implements Comparable<Labels>, Iterable<Labels.Label> {

  /** The empty label set. */
  public static final Labels EMPTY = new Labels(new Label[0]);

  private final Label[] labels;

  /** Cached hash, computed on first use. */
  private volatile long hash;
  private volatile boolean hashed;

  private Labels(final Label[] labels) {
    this.labels = labels;
  }

  /**
   * Builds a label set from alternating names and values.
   * @param name_values An even number of strings.
   * @return The label set.
   * @throws IllegalArgumentException if the count is odd.
   */
  public static Labels of(final String... name_values) {
    if (name_values.length % 2 != 0) {
      throw new IllegalArgumentException("Names and values must be "
          + "provided in pairs.");
    }
    final Builder builder = newBuilder();
    for (int i = 0; i < name_values.length; i += 2) {
      builder.set(name_values[i], name_values[i + 1]);
    }
    return builder.build();
  }

  /**
   * Builds a label set from a map.
   * @param map A non-null map.
   * @return The label set.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Labels fromMap(final Map<String, String> map) {
    final Builder builder = newBuilder();
    for (final Map.Entry<String, String> entry : map.entrySet()) {
      builder.set(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /** @return The number of labels. */
  public int size() {
    return labels.length;
  }

  /** @return Whether or not the set is empty. */
  public boolean isEmpty() {
    return labels.length == 0;
  }

  /**
   * @param name The label name.
   * @return The value or null if the label is not present.
   */
  public String get(final String name) {
    final int idx = indexOf(name);
    return idx < 0 ? null : labels[idx].value;
  }

  /**
   * @param name The label name.
   * @return Whether the label is present.
   */
  public boolean has(final String name) {
    return indexOf(name) >= 0;
  }

  /**
   * @param names Names of labels to remove.
   * @return A label set without the given labels.
   */
  public Labels without(final Collection<String> names) {
    final Builder builder = toBuilder();
    for (final String name : names) {
      builder.remove(name);
    }
    return builder.build();
  }

  /**
   * @param names Names of labels to keep.
   * @return A label set with only the given labels.
   */
  public Labels keep(final Collection<String> names) {
    final Set<String> keep = Sets.newHashSet(names);
    final Builder builder = newBuilder();
    for (final Label label : labels) {
      if (keep.contains(label.name)) {
        builder.set(label.name, label.value);
      }
    }
    return builder.build();
  }

  /** @return The labels as a sorted map. */
  @JsonValue
  public Map<String, String> asMap() {
    final Map<String, String> map = Maps.newLinkedHashMap();
    for (final Label label : labels) {
      map.put(label.name, label.value);
    }
    return Collections.unmodifiableMap(map);
  }

  /**
   * A deterministic 64 bit hash over the sorted pairs. Used for shard
   * ownership so it must not change.
   * @return The hash.
   */
  public long hash() {
    if (!hashed) {
      final Hasher hasher = Const.HASH_FUNCTION.newHasher();
      for (final Label label : labels) {
        hasher.putString(label.name, Const.UTF8_CHARSET);
        hasher.putByte((byte) 0xFF);
        hasher.putString(label.value, Const.UTF8_CHARSET);
        hasher.putByte((byte) 0xFF);
      }
      hash = hasher.hash().asLong();
      hashed = true;
    }
    return hash;
  }

  @Override
  public Iterator<Label> iterator() {
    return Iterators.forArray(labels);
  }

  /** @return A builder initialized with these labels. */
  public Builder toBuilder() {
    final Builder builder = newBuilder();
    for (final Label label : labels) {
      builder.set(label.name, label.value);
    }
    return builder;
  }

  @Override
  public int compareTo(final Labels other) {
    final int common = Math.min(labels.length, other.labels.length);
    for (int i = 0; i < common; i++) {
      final int cmp = ComparisonChain.start()
          .compare(labels[i].name, other.labels[i].name)
          .compare(labels[i].value, other.labels[i].value)
          .result();
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(labels.length, other.labels.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(labels, ((Labels) o).labels);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(labels);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder().append("{");
    for (int i = 0; i < labels.length; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(labels[i].name)
         .append("=\"")
         .append(escape(labels[i].value))
         .append("\"");
    }
    return buf.append("}").toString();
  }

  /**
   * Escapes backslashes, double quotes and newlines.
   * @param value A non-null value.
   * @return The escaped value.
   */
  public static String escape(final String value) {
    final StringBuilder buf = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
      case '\\':
        buf.append("\\\\");
        break;
      case '"':
        buf.append("\\\"");
        break;
      case '\n':
        buf.append("\\n");
        break;
      default:
        buf.append(c);
      }
    }
    return buf.toString();
  }

  private int indexOf(final String name) {
    int lo = 0;
    int hi = labels.length - 1;
    while (lo <= hi) {
      final int mid = (lo + hi) >>> 1;
      final int cmp = labels[mid].name.compareTo(name);
      if (cmp < 0) {
        lo = mid + 1;
      } else if (cmp > 0) {
        hi = mid - 1;
      } else {
        return mid;
      }
    }
    return -1;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A single name/value pair. */
  public static final class Label {
    private final String name;
    private final String value;

    public Label(final String name, final String value) {
      this.name = name;
      this.value = value;
    }

    public String name() {
      return name;
    }

    public String value() {
      return value;
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Label)) {
        return false;
      }
      final Label other = (Label) o;
      return name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(name, value);
    }

    @Override
    public String toString() {
      return name + "=\"" + escape(value) + "\"";
    }
  }

  public static final class Builder {
    private final TreeMap<String, String> map = new TreeMap<String, String>();

    public Builder set(final String name, final String value) {
      if (Strings.isNullOrEmpty(name)) {
        throw new IllegalArgumentException("Label name cannot be null "
            + "or empty.");
      }
      if (Strings.isNullOrEmpty(value)) {
        map.remove(name);
      } else {
        map.put(name, value);
      }
      return this;
    }

    public Builder remove(final String name) {
      map.remove(name);
      return this;
    }

    public Labels build() {
      if (map.isEmpty()) {
        return EMPTY;
      }
      final Label[] labels = new Label[map.size()];
      int i = 0;
      for (final Map.Entry<String, String> entry : map.entrySet()) {
        labels[i++] = new Label(entry.getKey(), entry.getValue());
      }
      return new Labels(labels);
    }
  }
}
