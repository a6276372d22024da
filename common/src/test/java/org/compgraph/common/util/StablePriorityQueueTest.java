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
package org.compgraph.common.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 */
public class StablePriorityQueueTest
{
  @Test
  public void testOffer()
  {
    StablePriorityQueue<Integer> instance = new StablePriorityQueue<>(1);
    Integer i = 10;
    assertTrue(instance.offer(i));
    Object result = instance.peek();
    assertEquals(i, result);
    assertEquals(1, instance.size());
  }

  @Test
  public void testPollEmpty()
  {
    StablePriorityQueue<Integer> instance = new StablePriorityQueue<>(4);
    assertNull(instance.peek());
    assertNull(instance.poll());
    assertTrue(instance.isEmpty());
  }

  @Test
  public void testEqualElementsLeaveInInsertionOrder()
  {
    StablePriorityQueue<String> instance = new StablePriorityQueue<>(4, Comparator.comparing(String::length));
    for (String s : Lists.newArrayList("ccc", "bb", "a1", "d", "cc", "a2", "a3")) {
      instance.offer(s);
    }
    assertEquals(Lists.newArrayList("d", "bb", "a1", "cc", "a2", "a3", "ccc"), drain(instance));
  }

  @Test
  public void testExplicitRankOverridesInsertionOrder()
  {
    StablePriorityQueue<String> instance = new StablePriorityQueue<>(4, Comparator.comparing(String::length));
    instance.offer("late", 2);
    instance.offer("mid_", 1);
    instance.offer("x", 7);
    instance.offer("firs", 0);
    assertEquals(Lists.newArrayList("x", "firs", "mid_", "late"), drain(instance));
  }

  @Test
  public void testClear()
  {
    StablePriorityQueue<Integer> instance = new StablePriorityQueue<>(2);
    instance.offer(3);
    instance.offer(1);
    instance.clear();
    assertTrue(instance.isEmpty());
    instance.offer(2);
    assertEquals(Integer.valueOf(2), instance.remove());
  }

  private static <E> List<E> drain(StablePriorityQueue<E> queue)
  {
    List<E> result = new ArrayList<>();
    while (!queue.isEmpty()) {
      result.add(queue.poll());
    }
    return result;
  }
}
