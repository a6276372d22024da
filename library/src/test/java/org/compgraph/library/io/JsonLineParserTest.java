/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.compgraph.library.io;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import org.compgraph.api.MalformedInputException;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

public class JsonLineParserTest
{
  private final JsonLineParser parser = new JsonLineParser();

  @Test
  public void testScalarsAndArrays()
  {
    Row row = parser.parse("{\"doc_id\": 7, \"text\": \"hi\", \"score\": 1.5, \"ok\": true, \"none\": null,"
        + " \"start\": [37.5, 55]}");
    Assert.assertEquals(Value.of(7), row.get("doc_id"));
    Assert.assertEquals(Value.of("hi"), row.get("text"));
    Assert.assertEquals(Value.of(1.5), row.get("score"));
    Assert.assertEquals(Value.TRUE, row.get("ok"));
    Assert.assertEquals(Value.NULL, row.get("none"));
    Assert.assertEquals(Value.of(Arrays.asList(Value.of(37.5), Value.of(55))), row.get("start"));
  }

  @Test
  public void testLargeIdentifierStaysIntegral()
  {
    Row row = parser.parse("{\"edge_id\": 8414926848168493057}");
    Assert.assertEquals(8414926848168493057L, row.getLong("edge_id"));
  }

  @Test
  public void testEmptyObject()
  {
    Assert.assertEquals(Row.EMPTY, parser.parse("{}"));
  }

  @Test
  public void testRejectsInvalidJson()
  {
    assertMalformed("{\"text\": ");
  }

  @Test
  public void testRejectsNonObject()
  {
    assertMalformed("[1, 2]");
    assertMalformed("42");
  }

  @Test
  public void testRejectsNestedObject()
  {
    assertMalformed("{\"a\": {\"b\": 1}}");
  }

  @Test
  public void testRejectsHugeInteger()
  {
    assertMalformed("{\"a\": 123456789012345678901234567890}");
  }

  private void assertMalformed(String line)
  {
    try {
      parser.parse(line);
      Assert.fail("expected failure for " + line);
    } catch (MalformedInputException ex) {
      Assert.assertEquals(line, ex.getLine());
    }
  }
}
