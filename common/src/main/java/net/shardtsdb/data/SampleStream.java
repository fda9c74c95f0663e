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
package net.shardtsdb.data;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A labeled list of samples as returned by a query evaluation. Samples
 * are expected in ascending timestamp order.
 */
public final class SampleStream {
  private final Labels labels;
  private final List<Sample> samples;

  @JsonCreator
  public SampleStream(@JsonProperty("metric") final Labels labels,
                      @JsonProperty("values") final List<Sample> samples) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    this.labels = labels;
    this.samples = samples == null ? Collections.<Sample>emptyList()
        : ImmutableList.copyOf(samples);
  }

  @JsonProperty("metric")
  public Labels labels() {
    return labels;
  }

  @JsonProperty("values")
  public List<Sample> samples() {
    return samples;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SampleStream)) {
      return false;
    }
    final SampleStream other = (SampleStream) o;
    return labels.equals(other.labels) && samples.equals(other.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(labels, samples);
  }

  @Override
  public String toString() {
    return labels + " " + samples;
  }
}
