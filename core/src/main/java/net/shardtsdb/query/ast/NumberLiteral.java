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

/**
 * A numeric literal.
 */
public final class NumberLiteral implements Expr {
  private final double value;

  public NumberLiteral(final double value) {
    this.value = value;
  }

  public double value() {
    return value;
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitNumber(this);
  }

  @Override
  public ValueType type() {
    return ValueType.SCALAR;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof NumberLiteral
        && Double.compare(value, ((NumberLiteral) o).value) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString() {
    return format(value);
  }

  /**
   * @param value A value.
   * @return The value as query text, integral values without a fraction.
   */
  public static String format(final double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
