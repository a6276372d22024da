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
import com.google.common.collect.ImmutableList;

import org.compgraph.api.RowStream;
import org.compgraph.common.util.RowStreams;

/**
 * A node of a graph: one operator together with the ids of its parent nodes.
 * <p>
 * Nodes are immutable and never reference other nodes directly, so a node can be shared by the node arenas of
 * several graphs. Parent ids are always smaller than the id of the node itself.
 *
 * @since 1.0.0
 */
public abstract class GraphNode
{
  private final ImmutableList<Integer> parents;

  protected GraphNode(Integer... parents)
  {
    this.parents = ImmutableList.copyOf(parents);
  }

  public List<Integer> getParents()
  {
    return parents;
  }

  /**
   * Creates the output stream of the node for one run.
   *
   * @param scope the run
   * @param nodeId id of this node in the graph being run
   * @return the output stream, owning the streams of the parents
   */
  public abstract RowStream open(ExecutionScope scope, int nodeId);

  /**
   * @param offset value added to every parent id
   * @return copy of this node for an arena appended behind {@code offset} other nodes
   */
  public abstract GraphNode relocate(int offset);

  /**
   * @return short description of the operator, e.g. {@code sort[text]}
   */
  public abstract String describe();

  /**
   * @return simple class name of an operator, or the binary name without the package for anonymous classes
   */
  protected static String nameOf(Object operator)
  {
    Class<?> type = operator.getClass();
    String name = type.getSimpleName();
    if (name.isEmpty()) {
      name = type.getName().substring(type.getName().lastIndexOf('.') + 1);
    }
    return name;
  }

  protected int parent(int index)
  {
    return parents.get(index);
  }

  protected static List<String> checkKeyColumns(List<String> keyColumns)
  {
    Preconditions.checkNotNull(keyColumns, "keyColumns");
    for (String column : keyColumns) {
      Preconditions.checkNotNull(column, "null key column in %s", keyColumns);
    }
    ImmutableList<String> copy = ImmutableList.copyOf(keyColumns);
    Preconditions.checkArgument(copy.size() == copy.stream().distinct().count(), "duplicate key column in %s",
        keyColumns);
    return copy;
  }

  /**
   * Opens both parents of a binary node, closing the first when opening the second fails.
   */
  protected static RowStream[] openParents(ExecutionScope scope, int first, int second)
  {
    RowStream left = scope.open(first);
    try {
      return new RowStream[] {left, scope.open(second)};
    } catch (RuntimeException | Error ex) {
      try {
        RowStreams.closeAll(left);
      } catch (RuntimeException suppressed) {
        ex.addSuppressed(suppressed);
      }
      throw ex;
    }
  }

  @Override
  public String toString()
  {
    return describe();
  }
}
