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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.shardtsdb.data.Labels;
import net.shardtsdb.data.Sample;
import net.shardtsdb.data.SampleStream;
import net.shardtsdb.exceptions.ApiException;
import net.shardtsdb.exceptions.ApiException.ErrorType;
import net.shardtsdb.utils.JSON;

public class TestQueryResponse {

  @Test
  public void success() throws Exception {
    QueryResponse response = QueryResponse.newBuilder()
        .setResultType(ResultType.MATRIX)
        .setResult(Lists.newArrayList(new SampleStream(Labels.of("a", "b"),
            Lists.newArrayList(new Sample(1000, 1)))))
        .addHeader("X-Cache", Lists.newArrayList("miss", "hit"))
        .addHeader("X-Cache", Lists.newArrayList("hit"))
        .addHeaders(ImmutableMap.of("X-Shard", Lists.newArrayList("1")))
        .addWarnings(Lists.newArrayList("b", "a", "b"))
        .build();
    assertTrue(response.isSuccess());
    assertEquals(QueryResponse.STATUS_SUCCESS, response.status());
    assertNull(response.errorType());
    assertSame(ResultType.MATRIX, response.resultType());
    assertEquals(1, response.result().size());
    assertEquals(Lists.newArrayList("X-Cache", "X-Shard"),
        Lists.newArrayList(response.headers().keySet()));
    assertEquals(Lists.newArrayList("hit", "miss"),
        Lists.newArrayList(response.headers().get("X-Cache")));
    assertEquals(Lists.newArrayList("a", "b"),
        Lists.newArrayList(response.warnings()));

    String json = JSON.serializeToString(response);
    assertTrue(json.contains("\"status\":\"success\""));
    assertTrue(json.contains("\"resultType\":\"matrix\""));
    assertTrue(json.contains("\"values\":[[1000,1.0]]"));
    assertFalse(json.contains("errorType"));
  }

  @Test
  public void successNeedsResultType() throws Exception {
    try {
      QueryResponse.newBuilder().build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void fromError() throws Exception {
    QueryResponse response = QueryResponse.fromError(
        new ApiException(ErrorType.TIMEOUT, "too slow"));
    assertFalse(response.isSuccess());
    assertEquals(QueryResponse.STATUS_ERROR, response.status());
    assertSame(ErrorType.TIMEOUT, response.errorType());
    assertEquals("timeout", response.errorTypeName());
    assertEquals("too slow", response.error());
    assertTrue(response.result().isEmpty());

    String json = JSON.serializeToString(response);
    assertTrue(json.contains("\"errorType\":\"timeout\""));
    assertTrue(json.contains("\"error\":\"too slow\""));
  }
}
