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
package org.compgraph.engine.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.compgraph.api.Row;
import org.compgraph.common.util.StablePriorityQueue;

/**
 * K-way merge of sorted runs.
 * <p>
 * The queue holds the head row of every run that is not exhausted. Heads comparing equal leave the queue in
 * the order of their runs, which keeps the merge stable when the runs are given in input order.
 *
 * @since 1.0.0
 */
class RunMerger implements SortedRun.Cursor
{
  private final List<SortedRun> runs;
  private final StablePriorityQueue<Head> queue;
  private final List<Head> heads;
  private boolean opened;

  RunMerger(List<SortedRun> runs, final Comparator<Row> comparator)
  {
    this.runs = runs;
    this.heads = new ArrayList<>(runs.size());
    this.queue = new StablePriorityQueue<>(runs.size(), new Comparator<Head>()
    {
      @Override
      public int compare(Head left, Head right)
      {
        return comparator.compare(left.row, right.row);
      }
    });
  }

  private void open()
  {
    opened = true;
    for (int i = 0; i < runs.size(); i++) {
      Head head = new Head(runs.get(i).open(), i);
      heads.add(head);
      if (head.advance()) {
        queue.offer(head, head.rank);
      }
    }
  }

  @Override
  public Row read()
  {
    if (!opened) {
      open();
    }
    Head head = queue.poll();
    if (head == null) {
      return null;
    }
    Row row = head.row;
    if (head.advance()) {
      queue.offer(head, head.rank);
    }
    return row;
  }

  @Override
  public void close()
  {
    queue.clear();
    RuntimeException failure = null;
    for (Head head : heads) {
      try {
        head.close();
      } catch (RuntimeException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    heads.clear();
    if (failure != null) {
      throw failure;
    }
  }

  private static class Head
  {
    final SortedRun.Cursor cursor;
    final int rank;
    Row row;
    boolean closed;

    Head(SortedRun.Cursor cursor, int rank)
    {
      this.cursor = cursor;
      this.rank = rank;
    }

    boolean advance()
    {
      row = cursor.read();
      if (row == null) {
        close();
        return false;
      }
      return true;
    }

    void close()
    {
      if (!closed) {
        closed = true;
        cursor.close();
      }
    }
  }
}
