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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

import com.google.common.base.Preconditions;

import org.compgraph.api.Key;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Emits the {@code n} rows of a group with the largest values in a column, largest first. Among equal values
 * earlier rows win and come first. Holds at most {@code n} rows.
 *
 * @since 1.0.0
 */
public class TopN implements Reducer
{
  private final String column;
  private final int n;

  public TopN(String column, int n)
  {
    Preconditions.checkArgument(n >= 0, "n %s must not be negative", n);
    this.column = column;
    this.n = n;
  }

  @Override
  public Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group)
  {
    // root is the entry to evict first: the smallest value, the latest among equal values
    Comparator<Entry> worstFirst = Comparator.<Entry, Value>comparing(entry -> entry.value)
        .thenComparing(Comparator.<Entry>comparingLong(entry -> entry.sequence).reversed());
    PriorityQueue<Entry> heap = new PriorityQueue<>(Math.max(1, n), worstFirst);
    long sequence = 0;
    while (group.hasNext()) {
      Row row = group.next();
      Entry entry = new Entry(row, sequence++);
      if (heap.size() < n) {
        heap.offer(entry);
      } else if (n > 0 && entry.value.compareTo(heap.peek().value) > 0) {
        heap.poll();
        heap.offer(entry);
      }
    }
    List<Entry> top = new ArrayList<>(heap);
    top.sort(worstFirst.reversed());
    List<Row> rows = new ArrayList<>(top.size());
    for (Entry entry : top) {
      rows.add(entry.row);
    }
    return rows.iterator();
  }

  private class Entry
  {
    final Row row;
    final Value value;
    final long sequence;

    Entry(Row row, long sequence)
    {
      this.row = row;
      this.value = row.get(column);
      this.sequence = sequence;
    }
  }
}
