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
package net.shardtsdb.query.sharding;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.shardtsdb.common.Const;
import net.shardtsdb.query.LabelMatcher;
import net.shardtsdb.query.ast.VectorSelector;
import net.shardtsdb.query.ql.ExprParser;
import net.shardtsdb.query.sharding.EmbeddedQueries.EmbeddedQuery;

public class TestEmbeddedQueries {

  private static EmbeddedQueries twoShards(final boolean shard_labels) {
    return new EmbeddedQueries(Lists.newArrayList(
        new EmbeddedQuery("sum(foo{__query_shard__=\"1_of_2\"})", "1_of_2"),
        new EmbeddedQuery("sum(foo{__query_shard__=\"2_of_2\"})", "2_of_2")),
        shard_labels);
  }

  @Test
  public void encode() throws Exception {
    assertEquals("{\"queries\":[{\"query\":\"rate(foo[1m])\"}]}",
        new EmbeddedQueries(Lists.newArrayList(
            new EmbeddedQuery("rate(foo[1m])", null)), false).encode());
    assertEquals("{\"queries\":[{\"query\":\"foo\",\"shard\":\"1_of_2\"}],"
        + "\"shard_labels\":true}",
        new EmbeddedQueries(Lists.newArrayList(
            new EmbeddedQuery("foo", "1_of_2")), true).encode());
  }

  @Test
  public void decode() throws Exception {
    final EmbeddedQueries queries = twoShards(true);
    final EmbeddedQueries decoded = EmbeddedQueries.decode(queries.encode());
    assertEquals(queries, decoded);
    assertTrue(decoded.shardLabels());
    assertEquals(new ShardDescriptor(1, 2),
        decoded.queries().get(1).descriptor());
    assertNull(EmbeddedQueries.decode("{\"queries\":[{\"query\":\"foo\"}]}")
        .queries().get(0).descriptor());
  }

  @Test
  public void decodeInvalid() throws Exception {
    for (final String bad : new String[] { null, "", "{", "{\"queries\":[]}",
        "[1,2]" }) {
      try {
        EmbeddedQueries.decode(bad);
        fail("Expected IllegalArgumentException for " + bad);
      } catch (IllegalArgumentException e) { }
    }
  }

  @Test
  public void ctor() throws Exception {
    try {
      new EmbeddedQueries(null, false);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new EmbeddedQueries(Collections.<EmbeddedQuery>emptyList(), false);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new EmbeddedQuery("", "1_of_2");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void selectorSurvivesPrintAndParse() throws Exception {
    final EmbeddedQueries queries = twoShards(false);
    final VectorSelector selector = queries.toSelector();
    assertTrue(EmbeddedQueries.isEmbedded(selector));
    assertEquals(Const.EMBEDDED_QUERIES_METRIC, selector.name());

    final VectorSelector parsed = (VectorSelector) new ExprParser()
        .parse(selector.toString());
    assertEquals(selector, parsed);
    assertEquals(queries, EmbeddedQueries.fromMatchers(parsed.allMatchers()));
  }

  @Test
  public void fromMatchers() throws Exception {
    assertNull(EmbeddedQueries.fromMatchers(Lists.newArrayList(
        LabelMatcher.equal(Const.METRIC_NAME_LABEL, "foo"))));
    // payload without the embedded metric name
    assertNull(EmbeddedQueries.fromMatchers(Lists.newArrayList(
        LabelMatcher.equal(Const.EMBEDDED_QUERIES_LABEL,
            twoShards(false).encode()))));
    try {
      EmbeddedQueries.fromMatchers(Lists.newArrayList(
          LabelMatcher.equal(Const.METRIC_NAME_LABEL,
              Const.EMBEDDED_QUERIES_METRIC),
          LabelMatcher.equal(Const.EMBEDDED_QUERIES_LABEL, "not json")));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void isEmbedded() throws Exception {
    assertFalse(EmbeddedQueries.isEmbedded((VectorSelector) new ExprParser()
        .parse("foo")));
  }
}
