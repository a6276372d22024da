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
package org.compgraph.library.operator;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.compgraph.api.MalformedInputException;
import org.compgraph.api.Mapper;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

public class MappersTest
{
  static List<Row> apply(Mapper mapper, Row row)
  {
    return Lists.newArrayList(mapper.map(row));
  }

  @Test
  public void testDummyMapper()
  {
    Row row = Row.of("a", 1, "b", "x");
    Assert.assertEquals(Collections.singletonList(row), apply(new DummyMapper(), row));
  }

  @Test
  public void testFilterPunctuationAndLowerCase()
  {
    Row row = Row.of("doc_id", 1, "text", "Hello, World! (it's me)");
    Row clean = apply(new FilterPunctuation("text"), row).get(0);
    Assert.assertEquals("Hello World its me", clean.getText("text"));
    Assert.assertEquals(1L, clean.getLong("doc_id"));

    Row lower = apply(new LowerCase("text"), clean).get(0);
    Assert.assertEquals("hello world its me", lower.getText("text"));
  }

  @Test
  public void testSplitOnWhitespace()
  {
    List<Row> words = apply(new Split("text"), Row.of("id", 7, "text", "  one two\tthree\n "));
    Assert.assertEquals(Arrays.asList(Row.of("id", 7, "text", "one"), Row.of("id", 7, "text", "two"),
        Row.of("id", 7, "text", "three")), words);
    Assert.assertTrue(apply(new Split("text"), Row.of("text", "   ")).isEmpty());
  }

  @Test
  public void testSplitOnSeparator()
  {
    List<Row> parts = apply(new Split("text", "--"), Row.of("text", "a--b----c"));
    Assert.assertEquals(Arrays.asList(Row.of("text", "a"), Row.of("text", "b"), Row.of("text", ""),
        Row.of("text", "c")), parts);
  }

  @Test
  public void testProduct()
  {
    Row integral = apply(new Product(Arrays.asList("a", "b")), Row.of("a", 3, "b", 4)).get(0);
    Assert.assertEquals(Value.of(12), integral.get("product"));

    Row mixed = apply(new Product(Arrays.asList("a", "b"), "p"), Row.of("a", 3, "b", 0.5)).get(0);
    Assert.assertEquals(Value.of(1.5), mixed.get("p"));
  }

  @Test
  public void testFilterAndProject()
  {
    Mapper positive = new Filter(row -> row.getLong("x") > 0);
    Assert.assertEquals(1, apply(positive, Row.of("x", 1)).size());
    Assert.assertTrue(apply(positive, Row.of("x", -1)).isEmpty());

    Row projected = apply(new Project(ImmutableList.of("x", "z")), Row.of("x", 1, "y", 2, "z", 3)).get(0);
    Assert.assertEquals(Row.of("x", 1, "z", 3), projected);
  }

  @Test
  public void testDivide()
  {
    Row row = apply(new Divide("a", "b", "ratio"), Row.of("a", 3, "b", 4)).get(0);
    Assert.assertEquals(0.75, row.getDouble("ratio"), 0);
  }

  @Test
  public void testIdfAndPmi()
  {
    Row idf = apply(new Idf("doc_count", "num_word_entries", "text", "idf"),
        Row.of("text", "hello", "doc_count", 3, "num_word_entries", 2, "extra", true)).get(0);
    Assert.assertEquals(ImmutableList.of("text", "idf"), ImmutableList.copyOf(idf.getColumns()));
    Assert.assertEquals(Math.log(1.5), idf.getDouble("idf"), 1e-12);

    Row pmi = apply(new Pmi("tf", "tf_total", "pmi"), Row.of("tf", 0.6, "tf_total", 0.375)).get(0);
    Assert.assertEquals(Math.log(1.6), pmi.getDouble("pmi"), 1e-12);
  }

  @Test
  public void testHaversineLength()
  {
    Row row = Row.of("edge_id", 8414926848168493057L,
        "start", Arrays.asList(37.84870228730142, 55.73853974696249),
        "end", Arrays.asList(37.8490418381989, 55.73832445777953));
    Row result = apply(new HaversineLength("start", "end", "length"), row).get(0);
    Assert.assertEquals(0.03201389419178626, result.getDouble("length"), 1e-6);
    Assert.assertEquals(8414926848168493057L, result.getLong("edge_id"));
    Assert.assertEquals(111.19492664455873, HaversineLength.distance(0, 0, 0, 1), 1e-9);
  }

  @Test
  public void testProcessTime()
  {
    ProcessTime mapper = new ProcessTime("enter_time", "leave_time", "time", "weekday", "hour");
    Row friday = apply(mapper, Row.of("enter_time", "20171020T112237.427000",
        "leave_time", "20171020T112238.723000")).get(0);
    Assert.assertEquals("Fri", friday.getText("weekday"));
    Assert.assertEquals(11L, friday.getLong("hour"));
    Assert.assertEquals(1.296, friday.getDouble("time"), 1e-9);

    Row wednesday = apply(mapper, Row.of("enter_time", "20171011T145551.957000",
        "leave_time", "20171011T145553.040000")).get(0);
    Assert.assertEquals("Wed", wednesday.getText("weekday"));
    Assert.assertEquals(14L, wednesday.getLong("hour"));
    Assert.assertEquals(1.083, wednesday.getDouble("time"), 1e-9);

    Row whole = apply(mapper, Row.of("enter_time", "20171011T145551", "leave_time", "20171011T145651")).get(0);
    Assert.assertEquals(60.0, whole.getDouble("time"), 0);
  }

  @Test
  public void testProcessTimeRejectsGarbage()
  {
    ProcessTime mapper = new ProcessTime("enter_time", "leave_time", "time", "weekday", "hour");
    try {
      apply(mapper, Row.of("enter_time", "yesterday", "leave_time", "20171011T145651"));
      Assert.fail("timestamp should not parse");
    } catch (MalformedInputException ex) {
      Assert.assertEquals("yesterday", ex.getLine());
    }
  }

  @Test
  public void testProcessSpeed()
  {
    Row row = apply(new ProcessSpeed("length", "time", "speed"), Row.of("length", 2.5, "time", 1800)).get(0);
    Assert.assertEquals(5.0, row.getDouble("speed"), 1e-12);
  }
}
