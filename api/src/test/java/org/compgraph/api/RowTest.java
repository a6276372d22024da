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
package org.compgraph.api;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class RowTest
{
  @Test
  public void testInsertionOrderAndEquality()
  {
    Row row = Row.of("b", 1, "a", "x");
    Assert.assertEquals(ImmutableList.of("b", "a"), ImmutableList.copyOf(row.getColumns()));
    Assert.assertEquals(Row.of("a", "x", "b", 1), row);
    Assert.assertEquals(Row.of("a", "x", "b", 1).hashCode(), row.hashCode());
    Assert.assertEquals("{b=1, a=\"x\"}", row.toString());
  }

  @Test
  public void testDerivationsReturnNewRows()
  {
    Row row = Row.of("a", 1, "b", 2);
    Assert.assertEquals(Row.of("a", 1, "b", 3), row.with("b", 3));
    Assert.assertEquals(Row.of("a", 1, "b", 2, "c", true), row.with("c", true));
    Assert.assertEquals(Row.of("b", 2), row.without("a"));
    Assert.assertEquals(Row.of("z", 1, "b", 2), row.rename("a", "z"));
    Assert.assertEquals(ImmutableList.of("z", "b"), ImmutableList.copyOf(row.rename("a", "z").getColumns()));
    Assert.assertEquals(Row.of("b", 2), row.project(ImmutableList.of("b")));
    Assert.assertEquals(Row.of("a", 1, "b", 2), row);
  }

  @Test
  public void testMissingColumn()
  {
    Row row = Row.of("a", 1);
    try {
      row.get("b");
      Assert.fail("column b is absent");
    } catch (MissingColumnException ex) {
      Assert.assertEquals("b", ex.getColumn());
    }
    try {
      row.key(ImmutableList.of("a", "b"));
      Assert.fail("column b is absent");
    } catch (MissingColumnException ex) {
      Assert.assertEquals("b", ex.getColumn());
    }
  }

  @Test
  public void testKey()
  {
    Row row = Row.of("a", 1, "b", "x", "c", 2.5);
    Key key = row.key(ImmutableList.of("b", "a"));
    Assert.assertEquals(Key.of(Value.of("x"), Value.of(1)), key);
    Assert.assertEquals(Key.EMPTY, row.key(ImmutableList.<String>of()));
    Assert.assertTrue(Key.of(Value.of("x")).compareTo(key) < 0);
    Assert.assertTrue(key.compareTo(Key.of(Value.of("x"), Value.of(2))) < 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOddArguments()
  {
    Row.of("a", 1, "b");
  }

  @Test
  public void testBuilder()
  {
    Row row = Row.builder().put("a", 1).put("b", (Object)null).put("a", 2).build();
    Assert.assertEquals(ImmutableList.of("a", "b"), ImmutableList.copyOf(row.getColumns()));
    Assert.assertEquals(2, row.getLong("a"));
    Assert.assertTrue(row.get("b").isNull());
    Assert.assertSame(Row.EMPTY, Row.builder().build());
  }
}
