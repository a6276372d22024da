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

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import org.compgraph.api.Row;
import org.compgraph.api.RowStream;

/**
 * Sorts a stream of any length holding at most one chunk of rows in memory.
 * <p>
 * The input is cut into chunks of {@code chunkSize} rows. Every full chunk that is followed by more input is
 * stably sorted and spilled as a run into a private {@link SpillScope}; the last chunk stays in memory. When
 * there are more runs than {@code fanIn}, consecutive groups of runs are merged into larger spilled runs first.
 * The remaining runs are merged lazily while the result is read.
 *
 * @since 1.0.0
 */
public class ExternalSorter
{
  private final RowKeyComparator comparator;
  private final int chunkSize;
  private final int fanIn;
  private final File spillParent;

  public ExternalSorter(List<String> keyColumns, int chunkSize, int fanIn, File spillParent)
  {
    Preconditions.checkArgument(chunkSize >= 1, "chunk size %s must be at least 1", chunkSize);
    Preconditions.checkArgument(fanIn >= 2, "merge fan-in %s must be at least 2", fanIn);
    this.comparator = new RowKeyComparator(keyColumns);
    this.chunkSize = chunkSize;
    this.fanIn = fanIn;
    this.spillParent = Preconditions.checkNotNull(spillParent, "spillParent");
  }

  /**
   * Drains and closes the input.
   *
   * @param input rows to sort
   * @return cursor over the sorted rows, it owns the spill scope of this pass
   */
  public Sorted sort(RowStream input)
  {
    SpillScope scope = new SpillScope(spillParent);
    try {
      List<SortedRun> runs = new ArrayList<>();
      List<Row> chunk = new ArrayList<>(Math.min(chunkSize, 1024));
      long total = 0;
      while (input.hasNext()) {
        if (chunk.size() == chunkSize) {
          runs.add(spill(chunk, scope));
          chunk = new ArrayList<>(Math.min(chunkSize, 1024));
        }
        chunk.add(input.next());
        total++;
      }
      input.close();
      if (!chunk.isEmpty()) {
        chunk.sort(comparator);
        runs.add(new InMemoryRun(chunk));
      }
      logger.debug("Sorting {} rows by {} from {} runs", total, comparator.getKeyColumns(), runs.size());
      runs = cascade(runs, scope);
      return new Sorted(new RunMerger(runs, comparator), scope);
    } catch (RuntimeException | Error ex) {
      try {
        scope.close();
      } catch (RuntimeException suppressed) {
        ex.addSuppressed(suppressed);
      }
      throw ex;
    }
  }

  private SpilledRun spill(List<Row> chunk, SpillScope scope)
  {
    chunk.sort(comparator);
    SpilledRun run = SpilledRun.write(scope, chunk);
    logger.debug("Spilled {} rows to {}", run.size(), run.getFile());
    return run;
  }

  private List<SortedRun> cascade(List<SortedRun> runs, SpillScope scope)
  {
    int pass = 0;
    while (runs.size() > fanIn) {
      pass++;
      List<SortedRun> merged = new ArrayList<>((runs.size() + fanIn - 1) / fanIn);
      for (int from = 0; from < runs.size(); from += fanIn) {
        List<SortedRun> group = runs.subList(from, Math.min(from + fanIn, runs.size()));
        if (group.size() == 1) {
          merged.add(group.get(0));
          continue;
        }
        RunMerger merger = new RunMerger(group, comparator);
        SpilledRun run;
        try {
          run = SpilledRun.write(scope, merger);
        } finally {
          merger.close();
        }
        for (SortedRun source : group) {
          source.discard();
        }
        merged.add(run);
      }
      logger.debug("Merge pass {} reduced {} runs to {}", pass, runs.size(), merged.size());
      runs = merged;
    }
    return runs;
  }

  /**
   * The sorted output of one pass. Closing it releases the spill scope.
   */
  public static class Sorted implements SortedRun.Cursor
  {
    private final RunMerger merger;
    private final SpillScope scope;

    Sorted(RunMerger merger, SpillScope scope)
    {
      this.merger = merger;
      this.scope = scope;
    }

    @Override
    public Row read()
    {
      return merger.read();
    }

    @Override
    public void close()
    {
      try {
        merger.close();
      } finally {
        scope.close();
      }
    }
  }

  private static final Logger logger = LoggerFactory.getLogger(ExternalSorter.class);
}
