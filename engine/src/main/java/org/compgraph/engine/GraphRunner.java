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
package org.compgraph.engine;

import java.util.Iterator;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.api.UnboundSourceException;
import org.compgraph.engine.plan.ExecutionScope;
import org.compgraph.engine.plan.GraphNode;

/**
 * One run of a graph: binds the sources and opens the nodes into a tree of streams.
 *
 * @since 1.0.0
 */
class GraphRunner implements ExecutionScope
{
  private final Graph graph;
  private final ExecutionContext context;
  private final Map<String, Supplier<? extends Iterator<Row>>> bindings;

  GraphRunner(Graph graph, ExecutionContext context, Map<String, ? extends Supplier<? extends Iterator<Row>>> bindings)
  {
    this.graph = graph;
    this.context = Preconditions.checkNotNull(context, "context");
    this.bindings = ImmutableMap.copyOf(Preconditions.checkNotNull(bindings, "bindings"));
  }

  RowStream start()
  {
    for (String name : graph.getSourceNames()) {
      if (!bindings.containsKey(name)) {
        throw new UnboundSourceException(name);
      }
    }
    ExecutionConfiguration.validate(context);
    logger.debug("Running {} with sources {}", graph, bindings.keySet());
    return open(graph.getTerminal());
  }

  @Override
  public ExecutionContext getContext()
  {
    return context;
  }

  @Override
  public RowStream open(int nodeId)
  {
    GraphNode node = graph.getNodes().get(nodeId);
    return node.open(this, nodeId);
  }

  @Override
  public Supplier<? extends Iterator<Row>> getBinding(String sourceName)
  {
    Supplier<? extends Iterator<Row>> binding = bindings.get(sourceName);
    if (binding == null) {
      throw new UnboundSourceException(sourceName);
    }
    return binding;
  }

  @Override
  public String describe(int nodeId)
  {
    return "#" + nodeId + " " + graph.getNodes().get(nodeId).describe();
  }

  private static final Logger logger = LoggerFactory.getLogger(GraphRunner.class);
}
