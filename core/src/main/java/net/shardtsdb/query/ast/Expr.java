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
 * A node of a parsed query. Nodes are immutable and their
 * {@link Object#toString()} renders canonical query text with the same
 * meaning. Printing is a fixpoint: parsing the text and printing the
 * result yields the same text.
 */
public interface Expr {

  /**
   * Dispatches to the visitor method for the node's variant.
   * @param visitor A non-null visitor.
   * @return The visitor's result.
   */
  public <R> R accept(final ExprVisitor<R> visitor);

  /** @return The type of value the node evaluates to. */
  public ValueType type();
}
