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
 * Evaluates an instant vector expression over a range at a resolution,
 * e.g. {@code rate(foo[1m])[10m:1m]}.
 */
public final class SubqueryExpr implements Expr {
  private final Expr expr;
  private final long range;
  private final long step;
  private final long offset;

  /**
   * Default ctor.
   * @param expr An instant vector expression.
   * @param range The range in ms.
   * @param step The resolution in ms, 0 for the default.
   * @param offset The offset in ms.
   */
  public SubqueryExpr(final Expr expr,
                      final long range,
                      final long step,
                      final long offset) {
    if (expr == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    this.expr = expr;
    this.range = range;
    this.step = step;
    this.offset = offset;
  }

  public Expr expr() {
    return expr;
  }

  public long range() {
    return range;
  }

  public long step() {
    return step;
  }

  public long offset() {
    return offset;
  }

  public SubqueryExpr withOffset(final long offset) {
    return new SubqueryExpr(expr, range, step, offset);
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitSubquery(this);
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
    if (!(o instanceof SubqueryExpr)) {
      return false;
    }
    final SubqueryExpr other = (SubqueryExpr) o;
    return expr.equals(other.expr)
        && range == other.range
        && step == other.step
        && offset == other.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(expr, range, step, offset);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    if (expr instanceof BinaryExpr || expr instanceof UnaryExpr) {
      buf.append("(").append(expr).append(")");
    } else {
      buf.append(expr);
    }
    buf.append("[")
       .append(Durations.format(range))
       .append(":");
    if (step > 0) {
      buf.append(Durations.format(step));
    }
    return buf.append("]")
              .append(VectorSelector.offsetText(offset))
              .toString();
  }
}
