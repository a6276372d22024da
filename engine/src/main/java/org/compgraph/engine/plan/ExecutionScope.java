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

import java.util.Iterator;
import java.util.function.Supplier;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;

/**
 * State of one run of a graph, handed to the nodes while they are opened.
 *
 * @since 1.0.0
 */
public interface ExecutionScope
{
  ExecutionContext getContext();

  /**
   * Opens the node with the given id and, recursively, its parents.
   *
   * @param nodeId id of the node in the graph
   * @return the output stream of the node
   */
  RowStream open(int nodeId);

  /**
   * @param sourceName name of a source node
   * @return the factory bound to the name
   */
  Supplier<? extends Iterator<Row>> getBinding(String sourceName);

  /**
   * @param nodeId id of the node in the graph
   * @return printable name of the node, used in error messages
   */
  String describe(int nodeId);
}
