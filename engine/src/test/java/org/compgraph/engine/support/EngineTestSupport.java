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
package org.compgraph.engine.support;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.function.Supplier;

import org.junit.rules.TestWatcher;
import org.junit.runner.Description;

import org.apache.commons.io.FileUtils;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;

import org.compgraph.api.Context.ExecutionContext;
import org.compgraph.api.Key;
import org.compgraph.api.Row;
import org.compgraph.api.Value;
import org.compgraph.engine.DefaultExecutionContext;

/**
 * Helpers shared by the engine tests.
 */
public abstract class EngineTestSupport
{
  public static Supplier<Iterator<Row>> rows(final Row... rows)
  {
    return rows(Arrays.asList(rows));
  }

  public static Supplier<Iterator<Row>> rows(final List<Row> rows)
  {
    return new Supplier<Iterator<Row>>()
    {
      @Override
      public Iterator<Row> get()
      {
        return rows.iterator();
      }
    };
  }

  public static Map<String, Supplier<Iterator<Row>>> bind(String name, List<Row> rows)
  {
    return ImmutableMap.of(name, rows(rows));
  }

  public static List<Row> numbered(String column, int... values)
  {
    List<Row> rows = new ArrayList<>();
    for (int value : values) {
      rows.add(Row.of(column, value));
    }
    return rows;
  }

  public static Key key(Object... values)
  {
    Value[] converted = new Value[values.length];
    for (int i = 0; i < values.length; i++) {
      converted[i] = Value.from(values[i]);
    }
    return Key.of(converted);
  }

  /**
   * Shuffled rows {@code {k, seq}} with few distinct keys, so that stability is observable.
   */
  public static List<Row> shuffledWithDuplicates(int count, long seed)
  {
    List<Row> rows = new ArrayList<>(count);
    Random random = new Random(seed);
    for (int i = 0; i < count; i++) {
      rows.add(Row.of("k", random.nextInt(Math.max(1, count / 4)), "seq", i));
    }
    return rows;
  }

  public static DefaultExecutionContext context(File spillDirectory, int chunkSize, int fanIn)
  {
    return new DefaultExecutionContext()
        .with(ExecutionContext.SPILL_DIRECTORY, spillDirectory.getAbsolutePath())
        .with(ExecutionContext.SORT_CHUNK_SIZE, chunkSize)
        .with(ExecutionContext.SORT_MERGE_FAN_IN, fanIn);
  }

  public static List<Row> stableSort(List<Row> rows, final String column)
  {
    List<Row> sorted = new ArrayList<>(rows);
    Collections.sort(sorted, (a, b) -> a.get(column).compareTo(b.get(column)));
    return sorted;
  }

  public static int size(Iterator<Row> iterator)
  {
    return Iterators.size(iterator);
  }

  /**
   * Per test working directory under target, removed when the test finishes.
   */
  public static class TestMeta extends TestWatcher
  {
    private File dir;

    @Override
    protected void starting(Description description)
    {
      dir = new File("target/" + description.getClassName() + "/" + description.getMethodName());
      try {
        FileUtils.deleteDirectory(dir);
        FileUtils.forceMkdir(dir);
      } catch (IOException e) {
        throw new RuntimeException("Fail to create test working directory " + dir.getAbsolutePath(), e);
      }
    }

    @Override
    protected void finished(Description description)
    {
      FileUtils.deleteQuietly(dir);
    }

    public File getDir()
    {
      return dir;
    }

    /**
     * @return the entries left in the working directory
     */
    public String[] list()
    {
      String[] names = dir.list();
      return names == null ? new String[0] : names;
    }
  }

  /**
   * Source counting the rows handed out and failing when it is pulled further than {@code window} rows ahead
   * of the rows the consumer acknowledged.
   */
  public static class BoundedWindowSource implements Iterator<Row>
  {
    private final Iterator<Row> rows;
    private final int window;
    private int produced;
    private int acknowledged;

    public BoundedWindowSource(Iterator<Row> rows, int window)
    {
      this.rows = rows;
      this.window = window;
    }

    public void acknowledge()
    {
      acknowledged++;
    }

    public int getProduced()
    {
      return produced;
    }

    @Override
    public boolean hasNext()
    {
      return rows.hasNext();
    }

    @Override
    public Row next()
    {
      if (!rows.hasNext()) {
        throw new NoSuchElementException();
      }
      if (produced - acknowledged >= window) {
        throw new AssertionError("pulled row " + produced + " with only " + acknowledged + " rows consumed");
      }
      produced++;
      return rows.next();
    }
  }
}
