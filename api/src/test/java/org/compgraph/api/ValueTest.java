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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class ValueTest
{
  @Test
  public void testKindOrder()
  {
    List<Value> expected = ImmutableList.of(Value.NULL, Value.FALSE, Value.TRUE, Value.of(-1), Value.of(0.5),
        Value.of(1), Value.of("A"), Value.of("a"), Value.list(), Value.list(Value.of(1)),
        Value.list(Value.of(1), Value.NULL));
    List<Value> shuffled = new ArrayList<>(expected);
    Collections.shuffle(shuffled, new Random(3));
    Collections.sort(shuffled);
    Assert.assertEquals(expected, shuffled);
  }

  @Test
  public void testNumbersCompareAcrossKinds()
  {
    Assert.assertTrue(Value.of(2).compareTo(Value.of(2.5)) < 0);
    Assert.assertTrue(Value.of(3.0).compareTo(Value.of(2)) > 0);
    // 2^53 + 1 has no exact double representation
    long big = (1L << 53) + 1;
    Assert.assertTrue(Value.of(big).compareTo(Value.of((double)(1L << 53))) > 0);
    Assert.assertTrue(Value.of(Long.MAX_VALUE).compareTo(Value.of(Double.POSITIVE_INFINITY)) < 0);
  }

  @Test
  public void testEqualNumbersOfDifferentKinds()
  {
    Value integer = Value.of(2);
    Value floating = Value.of(2.0);
    Assert.assertNotEquals(integer, floating);
    Assert.assertTrue(integer.compareTo(floating) < 0);
    Assert.assertTrue(floating.compareTo(integer) > 0);
  }

  @Test
  public void testSpecialFloats()
  {
    Value nan = Value.of(Double.NaN);
    Assert.assertTrue(nan.compareTo(Value.of(Double.POSITIVE_INFINITY)) > 0);
    Assert.assertTrue(nan.compareTo(Value.of(Long.MAX_VALUE)) > 0);
    Assert.assertEquals(nan, Value.of(Double.NaN));
    Assert.assertTrue(Value.of(-0.0).compareTo(Value.of(0.0)) < 0);
  }

  @Test
  public void testCompareToConsistentWithEquals()
  {
    List<Value> values = Lists.newArrayList(Value.NULL, Value.TRUE, Value.of(1), Value.of(1.0), Value.of("1"),
        Value.list(Value.of(1)), Value.list(Value.of(1.0)), Value.of(-0.0), Value.of(0));
    for (Value a : values) {
      for (Value b : values) {
        Assert.assertEquals(a + " vs " + b, a.equals(b), a.compareTo(b) == 0);
        Assert.assertEquals(Integer.signum(a.compareTo(b)), -Integer.signum(b.compareTo(a)));
      }
    }
  }

  @Test
  public void testFrom()
  {
    Assert.assertEquals(Value.of(7), Value.from(7));
    Assert.assertEquals(Value.of(7), Value.from((short)7));
    Assert.assertEquals(Value.of(1.5), Value.from(1.5f));
    Assert.assertEquals(Value.NULL, Value.from(null));
    Assert.assertEquals(Value.list(Value.of("a"), Value.NULL), Value.from(Lists.newArrayList("a", null)));
    Assert.assertEquals(Value.of("x"), Value.from(Value.of("x")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFromUnsupported()
  {
    Value.from(new Object());
  }

  @Test
  public void testAccessors()
  {
    Assert.assertEquals(3.0, Value.of(3).asDouble(), 0);
    Assert.assertEquals("x", Value.of("x").asText());
    Assert.assertEquals(ImmutableList.of(Value.TRUE), Value.list(Value.TRUE).asList());
    Assert.assertEquals(ImmutableList.of(1L, "a"), Value.list(Value.of(1), Value.of("a")).toJava());
    try {
      Value.of("x").asLong();
      Assert.fail("text is not a number");
    } catch (IllegalStateException ex) {
      // expected
    }
    try {
      Value.of(1.5).asLong();
      Assert.fail("float is not narrowed");
    } catch (IllegalStateException ex) {
      // expected
    }
  }
}
