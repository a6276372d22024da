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

import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.common.util.AbstractRowStream;

/**
 * Stream of the parent's rows in key order. The parent is drained on the first pull.
 *
 * @since 1.0.0
 */
public class SortStream extends AbstractRowStream
{
  private final RowStream parent;
  private final ExternalSorter sorter;
  private ExternalSorter.Sorted sorted;

  public SortStream(RowStream parent, ExternalSorter sorter)
  {
    this.parent = parent;
    this.sorter = sorter;
  }

  @Override
  protected Row computeNext()
  {
    if (sorted == null) {
      sorted = sorter.sort(parent);
    }
    return sorted.read();
  }

  @Override
  protected void release()
  {
    try {
      parent.close();
    } finally {
      if (sorted != null) {
        sorted.close();
      }
    }
  }
}
