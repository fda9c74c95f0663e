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
package net.shardtsdb.query.ast;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * How series on both sides of a binary operation are matched.
 */
public final class VectorMatching {

  public static enum Cardinality {
    ONE_TO_ONE,
    MANY_TO_ONE,
    ONE_TO_MANY,
    MANY_TO_MANY
  }

  private final Cardinality cardinality;
  private final List<String> labels;
  private final boolean on;
  private final List<String> include;

  /**
   * Default ctor.
   * @param cardinality The cardinality.
   * @param labels Labels of the on or ignoring clause.
   * @param on True for {@code on}, false for {@code ignoring}.
   * @param include Extra labels of a group_left or group_right clause.
   */
  public VectorMatching(final Cardinality cardinality,
                        final List<String> labels,
                        final boolean on,
                        final List<String> include) {
    if (cardinality == null) {
      throw new IllegalArgumentException("Cardinality cannot be null.");
    }
    this.cardinality = cardinality;
    this.labels = labels == null ? Collections.<String>emptyList()
        : ImmutableList.copyOf(labels);
    this.on = on;
    this.include = include == null ? Collections.<String>emptyList()
        : ImmutableList.copyOf(include);
  }

  public Cardinality cardinality() {
    return cardinality;
  }

  public List<String> labels() {
    return labels;
  }

  public boolean on() {
    return on;
  }

  public List<String> include() {
    return include;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VectorMatching)) {
      return false;
    }
    final VectorMatching other = (VectorMatching) o;
    return cardinality == other.cardinality
        && labels.equals(other.labels)
        && on == other.on
        && include.equals(other.include);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(cardinality, labels, on, include);
  }
}
