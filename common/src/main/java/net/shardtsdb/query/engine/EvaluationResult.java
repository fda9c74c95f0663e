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
package net.shardtsdb.query.engine;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.shardtsdb.data.SampleStream;
import net.shardtsdb.query.ResultType;

/**
 * The typed result of evaluating a query.
 */
public final class EvaluationResult {
  private final ResultType type;
  private final List<SampleStream> streams;
  private final List<String> warnings;

  public EvaluationResult(final ResultType type,
                          final List<SampleStream> streams,
                          final List<String> warnings) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    this.type = type;
    this.streams = streams == null ? Collections.<SampleStream>emptyList()
        : ImmutableList.copyOf(streams);
    this.warnings = warnings == null ? Collections.<String>emptyList()
        : ImmutableList.copyOf(warnings);
  }

  public ResultType type() {
    return type;
  }

  public List<SampleStream> streams() {
    return streams;
  }

  public List<String> warnings() {
    return warnings;
  }
}
