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

import java.util.List;

import com.google.common.base.Preconditions;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.Reducer;
import org.compgraph.api.RowStream;
import org.compgraph.engine.group.GroupedInput;
import org.compgraph.engine.group.KeyOrderVerifier;
import org.compgraph.engine.group.ReduceStream;

/**
 * @since 1.0.0
 */
public class ReduceNode extends GraphNode
{
  private final Reducer reducer;
  private final List<String> keyColumns;

  public ReduceNode(int parent, Reducer reducer, List<String> keyColumns)
  {
    super(parent);
    this.reducer = Preconditions.checkNotNull(reducer, "reducer");
    this.keyColumns = checkKeyColumns(keyColumns);
  }

  public List<String> getKeyColumns()
  {
    return keyColumns;
  }

  @Override
  public RowStream open(ExecutionScope scope, int nodeId)
  {
    boolean verify = scope.getContext().getValue(ExecutionContext.VERIFY_SORTED_INPUT);
    RowStream parent = scope.open(parent(0));
    GroupedInput input = new GroupedInput(parent, keyColumns, new KeyOrderVerifier(scope.describe(nodeId), verify));
    return new ReduceStream(parent, input, reducer);
  }

  @Override
  public GraphNode relocate(int offset)
  {
    return new ReduceNode(parent(0) + offset, reducer, keyColumns);
  }

  @Override
  public String describe()
  {
    return "reduce(" + nameOf(reducer) + ")" + keyColumns;
  }
}
