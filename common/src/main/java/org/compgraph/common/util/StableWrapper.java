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

/**
 * Pairs a queued element with the rank that breaks ties between equal elements<p>
 * <br>
 * {@see StablePriorityQueue}<br>
 * <br>
 *
 * @since 1.0.0
 */
class StableWrapper<E>
{
  public final long rank;
  public final E object;

  public StableWrapper(E o, long rank)
  {
    this.rank = rank;
    this.object = o;
  }

  static class NaturalComparator<E> implements Comparator<StableWrapper<E>>
  {
    @Override
    public int compare(StableWrapper<E> o1, StableWrapper<E> o2)
    {
      @SuppressWarnings({"unchecked", "rawtypes"})
      int ret = ((Comparable)o1.object).compareTo(o2.object);

      if (ret == 0) {
        ret = Long.compare(o1.rank, o2.rank);
      }

      return ret;
    }
  }

  static class ProvidedComparator<E> implements Comparator<StableWrapper<E>>
  {
    public final Comparator<? super E> comparator;

    public ProvidedComparator(Comparator<? super E> comparator)
    {
      this.comparator = comparator;
    }

    @Override
    public int compare(StableWrapper<E> o1, StableWrapper<E> o2)
    {
      int ret = comparator.compare(o1.object, o2.object);

      if (ret == 0) {
        ret = Long.compare(o1.rank, o2.rank);
      }

      return ret;
    }
  }

}
