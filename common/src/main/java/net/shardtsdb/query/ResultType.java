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
package net.shardtsdb.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The shape of an evaluation result.
 */
public enum ResultType {
  MATRIX("matrix"),
  VECTOR("vector"),
  SCALAR("scalar"),
  STRING("string");

  private final String name;

  private ResultType(final String name) {
    this.name = name;
  }

  @JsonValue
  public String typeName() {
    return name;
  }
}
