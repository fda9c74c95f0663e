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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.shardtsdb.data.Labels;
import net.shardtsdb.query.LabelMatcher.Type;

public class TestLabelMatcher {

  @Test
  public void ctor() throws Exception {
    LabelMatcher matcher = new LabelMatcher(Type.REGEX, "host", "web.*");
    assertSame(Type.REGEX, matcher.type());
    assertEquals("host", matcher.name());
    assertEquals("web.*", matcher.value());

    try {
      new LabelMatcher(null, "host", "web");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelMatcher(Type.EQUAL, "", "web");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelMatcher(Type.EQUAL, "host", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelMatcher(Type.REGEX, "host", "web(");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void equal() throws Exception {
    LabelMatcher matcher = LabelMatcher.equal("dc", "PHX");
    assertTrue(matcher.matches("PHX"));
    assertFalse(matcher.matches("LGA"));
    assertFalse(matcher.matches((String) null));
    assertTrue(matcher.matches(Labels.of("dc", "PHX", "host", "web01")));
    assertFalse(matcher.matches(Labels.of("host", "web01")));

    assertTrue(LabelMatcher.equal("dc", "").matchesEmpty());
    assertTrue(LabelMatcher.equal("dc", "").matches(Labels.of("a", "b")));
  }

  @Test
  public void notEqual() throws Exception {
    LabelMatcher matcher = new LabelMatcher(Type.NOT_EQUAL, "dc", "PHX");
    assertFalse(matcher.matches("PHX"));
    assertTrue(matcher.matches("LGA"));
    assertTrue(matcher.matchesEmpty());
  }

  @Test
  public void regexIsAnchored() throws Exception {
    LabelMatcher matcher = new LabelMatcher(Type.REGEX, "host", "web0[12]");
    assertTrue(matcher.matches("web01"));
    assertTrue(matcher.matches("web02"));
    assertFalse(matcher.matches("web03"));
    assertFalse(matcher.matches("aweb01"));
    assertFalse(matcher.matches("web012"));
    assertFalse(matcher.matchesEmpty());

    matcher = new LabelMatcher(Type.REGEX, "host", "a|b");
    assertTrue(matcher.matches("a"));
    assertFalse(matcher.matches("ab"));

    matcher = new LabelMatcher(Type.REGEX, "msg", ".*");
    assertTrue(matcher.matches("multi\nline"));
    assertTrue(matcher.matchesEmpty());
  }

  @Test
  public void notRegex() throws Exception {
    LabelMatcher matcher = new LabelMatcher(Type.NOT_REGEX, "host", "web.*");
    assertFalse(matcher.matches("web01"));
    assertTrue(matcher.matches("db01"));
    assertTrue(matcher.matchesEmpty());
  }

  @Test
  public void fromOperator() throws Exception {
    assertSame(Type.EQUAL, Type.fromOperator("="));
    assertSame(Type.NOT_EQUAL, Type.fromOperator("!="));
    assertSame(Type.REGEX, Type.fromOperator("=~"));
    assertSame(Type.NOT_REGEX, Type.fromOperator("!~"));
    try {
      Type.fromOperator("==");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void equalsAndToString() throws Exception {
    assertEquals(LabelMatcher.equal("a", "b"), LabelMatcher.equal("a", "b"));
    assertEquals(LabelMatcher.equal("a", "b").hashCode(),
        LabelMatcher.equal("a", "b").hashCode());
    assertNotEquals(LabelMatcher.equal("a", "b"),
        new LabelMatcher(Type.NOT_EQUAL, "a", "b"));
    assertEquals("a=~\"x\\\"y\"",
        new LabelMatcher(Type.REGEX, "a", "x\"y").toString());
  }
}
