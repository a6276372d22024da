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
package org.compgraph.engine.plan;

import java.io.File;
import java.util.List;

import com.google.common.base.Preconditions;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.RowStream;
import org.compgraph.engine.sort.ExternalSorter;
import org.compgraph.engine.sort.SortStream;

/**
 * @since 1.0.0
 */
public class SortNode extends GraphNode
{
  private final List<String> keyColumns;

  public SortNode(int parent, List<String> keyColumns)
  {
    super(parent);
    this.keyColumns = checkKeyColumns(keyColumns);
    Preconditions.checkArgument(!this.keyColumns.isEmpty(), "sort needs at least one key column");
  }

  public List<String> getKeyColumns()
  {
    return keyColumns;
  }

  @Override
  public RowStream open(ExecutionScope scope, int nodeId)
  {
    ExecutionContext context = scope.getContext();
    String spillDirectory = context.getValue(ExecutionContext.SPILL_DIRECTORY);
    File spillParent = new File(spillDirectory == null ? System.getProperty("java.io.tmpdir") : spillDirectory);
    ExternalSorter sorter = new ExternalSorter(keyColumns, context.getValue(ExecutionContext.SORT_CHUNK_SIZE),
        context.getValue(ExecutionContext.SORT_MERGE_FAN_IN), spillParent);
    return new SortStream(scope.open(parent(0)), sorter);
  }

  @Override
  public GraphNode relocate(int offset)
  {
    return new SortNode(parent(0) + offset, keyColumns);
  }

  @Override
  public String describe()
  {
    return "sort" + keyColumns;
  }
}
