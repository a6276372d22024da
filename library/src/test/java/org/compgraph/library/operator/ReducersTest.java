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
import java.util.Iterator;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.compgraph.api.Key;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

public class ReducersTest
{
  private static final List<String> KEYS = Collections.singletonList("k");
  private static final Key KEY = Key.of(Value.of("a"));

  private static List<Row> reduce(Reducer reducer, Row... rows)
  {
    return Lists.newArrayList(reducer.reduce(KEY, KEYS, Arrays.asList(rows).iterator()));
  }

  @Test
  public void testFirstReducer()
  {
    Row first = Row.of("k", "a", "v", 1);
    Assert.assertEquals(Collections.singletonList(first), reduce(new FirstReducer(), first, Row.of("k", "a", "v", 2)));
  }

  @Test
  public void testFirstReducerLeavesRestOfGroup()
  {
    Iterator<Row> group = Arrays.asList(Row.of("k", "a", "v", 1), Row.of("k", "a", "v", 2)).iterator();
    Lists.newArrayList(new FirstReducer().reduce(KEY, KEYS, group));
    Assert.assertTrue(group.hasNext());
  }

  @Test
  public void testCount()
  {
    List<Row> rows = reduce(new Count("count"), Row.of("k", "a", "v", 1), Row.of("k", "a", "v", 2),
        Row.of("k", "a", "v", 3));
    Assert.assertEquals(Collections.singletonList(Row.of("k", "a", "count", 3)), rows);
  }

  @Test
  public void testCountWithoutKeys()
  {
    List<Row> rows = Lists.newArrayList(new Count("n").reduce(Key.EMPTY, Collections.<String>emptyList(),
        Arrays.asList(Row.of("x", 1), Row.of("x", 2)).iterator()));
    Assert.assertEquals(Collections.singletonList(Row.of("n", 2)), rows);
  }

  @Test
  public void testSafeCountRepeatsCountRow()
  {
    List<Row> rows = reduce(new SafeCount("n"), Row.of("k", "a"), Row.of("k", "a"), Row.of("k", "a"));
    Row expected = Row.of("k", "a", "n", 3);
    Assert.assertEquals(Arrays.asList(expected, expected, expected), rows);
  }

  @Test
  public void testSum()
  {
    Assert.assertEquals(Collections.singletonList(Row.of("k", "a", "v", 6)),
        reduce(new Sum("v"), Row.of("k", "a", "v", 1, "w", 0), Row.of("k", "a", "v", 5)));
    Assert.assertEquals(Collections.singletonList(Row.of("k", "a", "v", 1.5)),
        reduce(new Sum("v"), Row.of("k", "a", "v", 1), Row.of("k", "a", "v", 0.5)));
  }

  @Test
  public void testMultipleSum()
  {
    List<Row> rows = reduce(new MultipleSum(ImmutableList.of("time", "length")),
        Row.of("k", "a", "time", 10, "length", 1.5), Row.of("k", "a", "time", 20, "length", 2.0));
    Assert.assertEquals(Collections.singletonList(Row.of("k", "a", "time", 30, "length", 3.5)), rows);
  }

  @Test
  public void testTermFrequency()
  {
    List<Row> rows = reduce(new TermFrequency("text"), Row.of("k", "a", "text", "hello"),
        Row.of("k", "a", "text", "world"), Row.of("k", "a", "text", "hello"), Row.of("k", "a", "text", "hello"));
    Assert.assertEquals(Arrays.asList(Row.of("k", "a", "text", "hello", "tf", 0.75),
        Row.of("k", "a", "text", "world", "tf", 0.25)), rows);
  }

  @Test
  public void testTopNKeepsLargestAndEarliestOnTies()
  {
    List<Row> rows = reduce(new TopN("v", 3), Row.of("k", "a", "v", 1, "id", 0), Row.of("k", "a", "v", 5, "id", 1),
        Row.of("k", "a", "v", 3, "id", 2), Row.of("k", "a", "v", 5, "id", 3), Row.of("k", "a", "v", 3, "id", 4),
        Row.of("k", "a", "v", 2, "id", 5));
    List<Long> ids = Lists.newArrayList();
    for (Row row : rows) {
      ids.add(row.getLong("id"));
    }
    Assert.assertEquals(Arrays.asList(1L, 3L, 2L), ids);
  }

  @Test
  public void testTopNSmallGroup()
  {
    List<Row> rows = reduce(new TopN("v", 10), Row.of("k", "a", "v", 1), Row.of("k", "a", "v", 2));
    Assert.assertEquals(Arrays.asList(Row.of("k", "a", "v", 2), Row.of("k", "a", "v", 1)), rows);
    Assert.assertTrue(reduce(new TopN("v", 0), Row.of("k", "a", "v", 1)).isEmpty());
  }

  @Test
  public void testMean()
  {
    List<Row> rows = reduce(new Mean("speed", "mean"), Row.of("k", "a", "speed", 2), Row.of("k", "a", "speed", 3.0),
        Row.of("k", "a", "speed", 4));
    Assert.assertEquals(Collections.singletonList(Row.of("k", "a", "mean", 3.0)), rows);
  }

  @Test
  public void testSumFolder()
  {
    SumFolder folder = new SumFolder("total");
    Row accumulator = Row.of("total", 0);
    for (int i = 1; i <= 4; i++) {
      accumulator = folder.fold(accumulator, Row.of("total", i, "other", "x"));
    }
    Assert.assertEquals(Row.of("total", 10), accumulator);
  }
}
