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

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * An aggregation across series, e.g. {@code sum by (dc) (foo)} or
 * {@code topk(5, foo)}.
 */
public final class AggregateExpr implements Expr {
  private final String op;
  private final Expr expr;
  private final Expr param;
  private final List<String> grouping;
  private final boolean without;

  /**
   * Default ctor.
   * @param op The aggregation operator.
   * @param expr The aggregated expression.
   * @param param The parameter of topk, bottomk, quantile and count_values,
   * null for other operators.
   * @param grouping Grouping labels, may be null.
   * @param without Whether the grouping lists labels to drop.
   */
  public AggregateExpr(final String op,
                       final Expr expr,
                       final Expr param,
                       final List<String> grouping,
                       final boolean without) {
    if (op == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    if (expr == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    this.op = op;
    this.expr = expr;
    this.param = param;
    this.grouping = grouping == null ? Collections.<String>emptyList()
        : ImmutableList.copyOf(grouping);
    this.without = without;
  }

  public String op() {
    return op;
  }

  public Expr expr() {
    return expr;
  }

  /** @return The parameter or null. */
  public Expr param() {
    return param;
  }

  public List<String> grouping() {
    return grouping;
  }

  public boolean without() {
    return without;
  }

  /**
   * @return A copy with another expression and the same operator,
   * parameter and grouping.
   */
  public AggregateExpr withExpr(final Expr expr) {
    return new AggregateExpr(op, expr, param, grouping, without);
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitAggregate(this);
  }

  @Override
  public ValueType type() {
    return ValueType.VECTOR;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AggregateExpr)) {
      return false;
    }
    final AggregateExpr other = (AggregateExpr) o;
    return op.equals(other.op)
        && expr.equals(other.expr)
        && Objects.equal(param, other.param)
        && grouping.equals(other.grouping)
        && without == other.without;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(op, expr, param, grouping, without);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(op);
    if (without || !grouping.isEmpty()) {
      buf.append(without ? " without (" : " by (")
         .append(Joiner.on(", ").join(grouping))
         .append(") ");
    }
    buf.append("(");
    if (param != null) {
      buf.append(param).append(", ");
    }
    return buf.append(expr).append(")").toString();
  }
}
