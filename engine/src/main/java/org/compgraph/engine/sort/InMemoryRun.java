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

import java.util.Iterator;
import java.util.List;

import org.compgraph.api.Row;

/**
 * The last, partially filled chunk of a sort, kept in memory.
 *
 * @since 1.0.0
 */
class InMemoryRun implements SortedRun
{
  private List<Row> rows;

  InMemoryRun(List<Row> rows)
  {
    this.rows = rows;
  }

  @Override
  public long size()
  {
    return rows == null ? 0 : rows.size();
  }

  @Override
  public Cursor open()
  {
    final Iterator<Row> iterator = rows.iterator();
    return new Cursor()
    {
      @Override
      public Row read()
      {
        return iterator.hasNext() ? iterator.next() : null;
      }

      @Override
      public void close()
      {
      }
    };
  }

  @Override
  public void discard()
  {
    rows = null;
  }

  @Override
  public String toString()
  {
    return "InMemoryRun{" + "rows=" + size() + '}';
  }
}
