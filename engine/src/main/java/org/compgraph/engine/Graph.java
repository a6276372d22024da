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

import java.io.File;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.Folder;
import org.compgraph.api.Joiner;
import org.compgraph.api.LineParser;
import org.compgraph.api.Mapper;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.engine.plan.FileSourceNode;
import org.compgraph.engine.plan.FoldNode;
import org.compgraph.engine.plan.GraphNode;
import org.compgraph.engine.plan.JoinNode;
import org.compgraph.engine.plan.MapNode;
import org.compgraph.engine.plan.ReduceNode;
import org.compgraph.engine.plan.SortNode;
import org.compgraph.engine.plan.SourceNode;

/**
 * Immutable description of a computation over row streams.
 * <p>
 * A graph is an arena of {@link GraphNode}s addressed by their index, and the index of the terminal node whose
 * output is the output of the graph. Every builder method returns a new graph that appends one node to a copy
 * of the arena; the receiver stays usable. Parents always precede their children in the arena, so a graph
 * cannot contain a cycle.
 * <p>
 * Nothing is read before {@link #run(Map)} is called and its result is pulled. Reduce and join expect inputs
 * already sorted by their key columns; put a {@link #sort(List)} in front of them where needed.
 *
 * <pre>
 * Graph wordCount = Graph.fromIterator("docs")
 *     .map(new Split("text"))
 *     .sort(ImmutableList.of("text"))
 *     .reduce(new Count("count"), ImmutableList.of("text"));
 * </pre>
 *
 * @since 1.0.0
 */
public final class Graph
{
  private final ImmutableList<GraphNode> nodes;
  private final int terminal;

  private Graph(ImmutableList<GraphNode> nodes)
  {
    this.nodes = nodes;
    this.terminal = nodes.size() - 1;
  }

  /**
   * @param name name the rows are bound to at run time
   * @return graph reading the rows of the named source
   */
  public static Graph fromIterator(String name)
  {
    return new Graph(ImmutableList.<GraphNode>of(new SourceNode(name)));
  }

  /**
   * @param path text file, read lazily when the graph runs
   * @param parser turns one line into a row
   * @return graph reading the parsed lines of the file
   */
  public static Graph fromFile(String path, LineParser parser)
  {
    Preconditions.checkNotNull(path, "path");
    return fromFile(new File(path), parser);
  }

  public static Graph fromFile(File file, LineParser parser)
  {
    return new Graph(ImmutableList.<GraphNode>of(new FileSourceNode(file, parser)));
  }

  public Graph map(Mapper mapper)
  {
    return append(new MapNode(terminal, mapper));
  }

  /**
   * Sorts by the key columns, stably, with bounded memory.
   *
   * @param keyColumns columns to sort by, at least one
   * @return the new graph
   */
  public Graph sort(List<String> keyColumns)
  {
    return append(new SortNode(terminal, keyColumns));
  }

  public Graph sort(String... keyColumns)
  {
    return sort(Arrays.asList(keyColumns));
  }

  /**
   * Calls the reducer once per run of rows with equal keys. The input must be sorted by the key columns.
   *
   * @param reducer the reducer
   * @param keyColumns grouping columns, an empty list makes the whole input one group
   * @return the new graph
   */
  public Graph reduce(Reducer reducer, List<String> keyColumns)
  {
    return append(new ReduceNode(terminal, reducer, keyColumns));
  }

  /**
   * Folds all rows into one, starting from the initial row.
   *
   * @param folder the folder
   * @param initial the accumulator before the first row, and the output for an empty input
   * @return the new graph
   */
  public Graph fold(Folder folder, Row initial)
  {
    return append(new FoldNode(terminal, folder, initial));
  }

  /**
   * Merge-joins this graph (left) with another one (right). Both inputs must be sorted by the key columns.
   *
   * @param joiner combines the groups of one key, its mode decides which one sided keys are kept
   * @param other right input
   * @param keyColumns join columns, an empty list joins every row with every row
   * @return the new graph
   */
  public Graph join(Joiner joiner, Graph other, List<String> keyColumns)
  {
    Preconditions.checkNotNull(other, "other");
    int offset = nodes.size();
    ImmutableList.Builder<GraphNode> builder = ImmutableList.builder();
    builder.addAll(nodes);
    for (GraphNode node : other.nodes) {
      builder.add(node.relocate(offset));
    }
    builder.add(new JoinNode(terminal, other.terminal + offset, joiner, keyColumns));
    return new Graph(builder.build());
  }

  /**
   * Runs the graph with the configuration of {@link ExecutionConfiguration#load()}.
   *
   * @see #run(ExecutionContext, Map)
   */
  public RowStream run(Map<String, ? extends Supplier<? extends Iterator<Row>>> bindings)
  {
    return run(ExecutionConfiguration.load(), bindings);
  }

  /**
   * Binds the sources and returns the lazy output of the graph. Every call reads fresh iterators from the
   * factories; the caller should close the stream when it stops reading before the end.
   *
   * @param context configuration of the run
   * @param bindings iterator factory for every source name, extra entries are ignored
   * @return the output rows
   * @throws org.compgraph.api.UnboundSourceException if a source of the graph has no binding
   */
  public RowStream run(ExecutionContext context, Map<String, ? extends Supplier<? extends Iterator<Row>>> bindings)
  {
    return new GraphRunner(this, context, bindings).start();
  }

  public List<GraphNode> getNodes()
  {
    return nodes;
  }

  public int getTerminal()
  {
    return terminal;
  }

  /**
   * @return names of all the sources that have to be bound to run the graph
   */
  public Set<String> getSourceNames()
  {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (GraphNode node : nodes) {
      if (node instanceof SourceNode) {
        names.add(((SourceNode)node).getName());
      }
    }
    return names.build();
  }

  private Graph append(GraphNode node)
  {
    return new Graph(ImmutableList.<GraphNode>builder().addAll(nodes).add(node).build());
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < nodes.size(); i++) {
      GraphNode node = nodes.get(i);
      if (i > 0) {
        sb.append(' ');
      }
      sb.append('#').append(i).append(' ').append(node.describe());
      if (!node.getParents().isEmpty()) {
        sb.append(" <- ");
        for (int p = 0; p < node.getParents().size(); p++) {
          if (p > 0) {
            sb.append(", ");
          }
          sb.append('#').append(node.getParents().get(p));
        }
      }
      if (i < nodes.size() - 1) {
        sb.append(';');
      }
    }
    return sb.toString();
  }
}
