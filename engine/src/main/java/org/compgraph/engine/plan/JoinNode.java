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
import org.compgraph.api.Joiner;
import org.compgraph.api.RowStream;
import org.compgraph.engine.group.GroupedInput;
import org.compgraph.engine.group.KeyOrderVerifier;
import org.compgraph.engine.group.MergeJoinStream;

/**
 * @since 1.0.0
 */
public class JoinNode extends GraphNode
{
  private final Joiner joiner;
  private final List<String> keyColumns;

  public JoinNode(int left, int right, Joiner joiner, List<String> keyColumns)
  {
    super(left, right);
    this.joiner = Preconditions.checkNotNull(joiner, "joiner");
    Preconditions.checkNotNull(joiner.getMode(), "%s has no join mode", joiner);
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
    String name = scope.describe(nodeId);
    RowStream[] parents = openParents(scope, parent(0), parent(1));
    GroupedInput left = new GroupedInput(parents[0], keyColumns, new KeyOrderVerifier(name + " left", verify));
    GroupedInput right = new GroupedInput(parents[1], keyColumns, new KeyOrderVerifier(name + " right", verify));
    return new MergeJoinStream(parents[0], left, parents[1], right, joiner);
  }

  @Override
  public GraphNode relocate(int offset)
  {
    return new JoinNode(parent(0) + offset, parent(1) + offset, joiner, keyColumns);
  }

  @Override
  public String describe()
  {
    return "join(" + nameOf(joiner) + ", " + joiner.getMode() + ")" + keyColumns;
  }
}
