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

import com.google.common.base.Objects;

/**
 * A selector over a range of time, e.g. {@code foo[5m]}.
 */
public final class MatrixSelector implements Expr {
  private final VectorSelector selector;
  private final long range;

  public MatrixSelector(final VectorSelector selector, final long range) {
    if (selector == null) {
      throw new IllegalArgumentException("Selector cannot be null.");
    }
    if (range <= 0) {
      throw new IllegalArgumentException("Range must be greater than zero.");
    }
    this.selector = selector;
    this.range = range;
  }

  public VectorSelector selector() {
    return selector;
  }

  /** @return The range in ms. */
  public long range() {
    return range;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitMatrixSelector(this);
  }

  @Override
  public ValueType type() {
    return ValueType.MATRIX;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MatrixSelector)) {
      return false;
    }
    final MatrixSelector other = (MatrixSelector) o;
    return selector.equals(other.selector) && range == other.range;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(selector, range);
  }

  @Override
  public String toString() {
    return selector.selectorText() + "[" + Durations.format(range) + "]"
        + VectorSelector.offsetText(selector.offset());
  }
}
