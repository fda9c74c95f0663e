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
 * One method per expression variant so a new variant fails compilation
 * everywhere it is not handled.
 */
public interface ExprVisitor<R> {

  public R visitNumber(final NumberLiteral expr);

  public R visitString(final StringLiteral expr);

  public R visitVectorSelector(final VectorSelector expr);

  public R visitMatrixSelector(final MatrixSelector expr);

  public R visitSubquery(final SubqueryExpr expr);

  public R visitAggregate(final AggregateExpr expr);

  public R visitBinary(final BinaryExpr expr);

  public R visitCall(final Call expr);

  public R visitParen(final ParenExpr expr);

  public R visitUnary(final UnaryExpr expr);
}
