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

import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Priority queue which orders equal elements by a rank instead of arbitrarily<p>
 * <br>
 * An element offered without an explicit rank gets the next value of an internal counter, so equal elements
 * leave the queue in insertion order. An explicit rank lets the caller define the order of equal elements
 * independently of insertion order, e.g. the index of the sorted run an element was read from during a k-way
 * merge, where the same run is re-offered many times.<br>
 *
 * @param <E> type of the queued elements
 * @since 1.0.0
 */
public class StablePriorityQueue<E>
{
  private final PriorityQueue<StableWrapper<E>> queue;
  private long counter = 0;

  /**
   * Constructs a queue ordering elements by their natural order.
   *
   * @param initialCapacity The size of the queue to be set up
   */
  public StablePriorityQueue(int initialCapacity)
  {
    queue = new PriorityQueue<>(Math.max(1, initialCapacity), new StableWrapper.NaturalComparator<E>());
  }

  /**
   * @param initialCapacity Size of the queue to be set up
   * @param comparator      {@link java.util.Comparator} object for comparison
   */
  public StablePriorityQueue(int initialCapacity, Comparator<? super E> comparator)
  {
    queue = new PriorityQueue<>(Math.max(1, initialCapacity), new StableWrapper.ProvidedComparator<>(comparator));
  }

  public boolean offer(E e)
  {
    return queue.offer(new StableWrapper<>(e, counter++));
  }

  public boolean offer(E e, long rank)
  {
    return queue.offer(new StableWrapper<>(e, rank));
  }

  public E peek()
  {
    StableWrapper<E> sw = queue.peek();
    if (sw == null) {
      return null;
    }

    return sw.object;
  }

  public E poll()
  {
    StableWrapper<E> sw = queue.poll();
    if (sw == null) {
      return null;
    }

    return sw.object;
  }

  public E remove() throws NoSuchElementException
  {
    return queue.remove().object;
  }

  public int size()
  {
    return queue.size();
  }

  public boolean isEmpty()
  {
    return queue.isEmpty();
  }

  public void clear()
  {
    queue.clear();
    counter = 0;
  }
}
