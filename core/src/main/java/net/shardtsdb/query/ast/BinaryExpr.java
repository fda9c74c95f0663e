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

import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;

import net.shardtsdb.query.ast.VectorMatching.Cardinality;

/**
 * A binary operation. Operands that are themselves binary operations are
 * printed in parentheses so the text does not depend on precedence rules.
 */
public final class BinaryExpr implements Expr {
  public static final Set<String> ARITHMETIC = ImmutableSet.of(
      "+", "-", "*", "/", "%", "^");
  public static final Set<String> COMPARISON = ImmutableSet.of(
      "==", "!=", "<", "<=", ">", ">=");
  public static final Set<String> SET = ImmutableSet.of(
      "and", "or", "unless");

  private final String op;
  private final Expr lhs;
  private final Expr rhs;
  private final VectorMatching matching;
  private final boolean return_bool;

  /**
   * Default ctor.
   * @param op The operator.
   * @param lhs The left operand.
   * @param rhs The right operand.
   * @param matching Vector matching, null when not both sides are vectors.
   * @param return_bool Whether a comparison returns 0/1 instead of
   * filtering.
   */
  public BinaryExpr(final String op,
                    final Expr lhs,
                    final Expr rhs,
                    final VectorMatching matching,
                    final boolean return_bool) {
    if (op == null || lhs == null || rhs == null) {
      throw new IllegalArgumentException("Operator and operands cannot "
          + "be null.");
    }
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
    this.matching = matching;
    this.return_bool = return_bool;
  }

  /** @return A one to one binary operation without modifiers. */
  public static BinaryExpr of(final String op, final Expr lhs, final Expr rhs) {
    final VectorMatching matching = lhs.type() == ValueType.VECTOR
        && rhs.type() == ValueType.VECTOR
        ? new VectorMatching(SET.contains(op) ? Cardinality.MANY_TO_MANY
            : Cardinality.ONE_TO_ONE, null, false, null)
        : null;
    return new BinaryExpr(op, lhs, rhs, matching, false);
  }

  public String op() {
    return op;
  }

  public Expr lhs() {
    return lhs;
  }

  public Expr rhs() {
    return rhs;
  }

  /** @return The matching or null. */
  public VectorMatching matching() {
    return matching;
  }

  public boolean returnBool() {
    return return_bool;
  }

  /** @return A copy with new operands. */
  public BinaryExpr withOperands(final Expr lhs, final Expr rhs) {
    return new BinaryExpr(op, lhs, rhs, matching, return_bool);
  }

  @Override
  public <R> R accept(final ExprVisitor<R> visitor) {
    return visitor.visitBinary(this);
  }

  @Override
  public ValueType type() {
    if (lhs.type() == ValueType.SCALAR && rhs.type() == ValueType.SCALAR) {
      return ValueType.SCALAR;
    }
    return ValueType.VECTOR;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BinaryExpr)) {
      return false;
    }
    final BinaryExpr other = (BinaryExpr) o;
    return op.equals(other.op)
        && lhs.equals(other.lhs)
        && rhs.equals(other.rhs)
        && Objects.equal(matching, other.matching)
        && return_bool == other.return_bool;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(op, lhs, rhs, matching, return_bool);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    operand(buf, lhs);
    buf.append(" ").append(op);
    if (return_bool) {
      buf.append(" bool");
    }
    if (matching != null) {
      if (matching.on() || !matching.labels().isEmpty()) {
        buf.append(matching.on() ? " on (" : " ignoring (")
           .append(Joiner.on(", ").join(matching.labels()))
           .append(")");
      }
      if (matching.cardinality() == Cardinality.MANY_TO_ONE
          || matching.cardinality() == Cardinality.ONE_TO_MANY) {
        buf.append(matching.cardinality() == Cardinality.MANY_TO_ONE
            ? " group_left (" : " group_right (")
           .append(Joiner.on(", ").join(matching.include()))
           .append(")");
      }
    }
    buf.append(" ");
    operand(buf, rhs);
    return buf.toString();
  }

  private void operand(final StringBuilder buf, final Expr operand) {
    if (operand instanceof BinaryExpr
        || (op.equals("^") && operand instanceof UnaryExpr)) {
      buf.append("(").append(operand).append(")");
    } else {
      buf.append(operand);
    }
  }
}
