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

import com.google.common.base.Preconditions;

import org.compgraph.api.Mapper;
import org.compgraph.api.RowStream;
import org.compgraph.engine.stream.MapStream;

/**
 * @since 1.0.0
 */
public class MapNode extends GraphNode
{
  private final Mapper mapper;

  public MapNode(int parent, Mapper mapper)
  {
    super(parent);
    this.mapper = Preconditions.checkNotNull(mapper, "mapper");
  }

  @Override
  public RowStream open(ExecutionScope scope, int nodeId)
  {
    return new MapStream(scope.open(parent(0)), mapper);
  }

  @Override
  public GraphNode relocate(int offset)
  {
    return new MapNode(parent(0) + offset, mapper);
  }

  @Override
  public String describe()
  {
    return "map(" + nameOf(mapper) + ")";
  }
}
