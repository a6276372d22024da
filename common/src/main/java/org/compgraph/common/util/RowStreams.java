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
package org.compgraph.common.util;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;

import org.compgraph.api.Row;
import org.compgraph.api.RowStream;

/**
 * Static helpers for {@link RowStream}s.
 *
 * @since 1.0.0
 */
public class RowStreams
{
  private RowStreams()
  {
  }

  public static RowStream empty()
  {
    return of(Collections.<Row>emptyIterator());
  }

  /**
   * Adapts an iterator. Closing the stream closes the iterator when it is {@link Closeable}.
   *
   * @param iterator rows
   * @return the stream
   */
  public static RowStream of(final Iterator<Row> iterator)
  {
    Preconditions.checkNotNull(iterator, "iterator");
    if (iterator instanceof RowStream) {
      return (RowStream)iterator;
    }
    return new IteratorRowStream(iterator);
  }

  public static RowStream of(Iterable<Row> rows)
  {
    return of(rows.iterator());
  }

  /**
   * Drains the stream into a list and closes it, also when draining fails.
   *
   * @param stream stream to drain
   * @return all remaining rows in order
   */
  public static List<Row> toList(RowStream stream)
  {
    try {
      List<Row> rows = new ArrayList<>();
      while (stream.hasNext()) {
        rows.add(stream.next());
      }
      return rows;
    } finally {
      stream.close();
    }
  }

  /**
   * Closes all the streams, even when one of them fails; the first failure is rethrown with the later ones
   * attached as suppressed.
   *
   * @param streams streams to close, null entries are skipped
   */
  public static void closeAll(RowStream... streams)
  {
    RuntimeException failure = null;
    for (RowStream stream : streams) {
      if (stream == null) {
        continue;
      }
      try {
        stream.close();
      } catch (RuntimeException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static class IteratorRowStream implements RowStream
  {
    private Iterator<Row> iterator;

    IteratorRowStream(Iterator<Row> iterator)
    {
      this.iterator = iterator;
    }

    @Override
    public boolean hasNext()
    {
      return iterator != null && iterator.hasNext();
    }

    @Override
    public Row next()
    {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return iterator.next();
    }

    @Override
    public void close()
    {
      Iterator<Row> closed = iterator;
      iterator = null;
      if (closed instanceof Closeable) {
        try {
          ((Closeable)closed).close();
        } catch (IOException ex) {
          throw new UncheckedIOException(ex);
        }
      }
    }
  }
}
