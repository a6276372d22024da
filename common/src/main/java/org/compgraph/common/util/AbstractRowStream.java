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

import java.util.NoSuchElementException;

import org.compgraph.api.Row;
import org.compgraph.api.RowStream;

/**
 * Skeleton of a pull based stream in the manner of Guava's {@code AbstractIterator}.
 * <p>
 * Subclasses compute rows one at a time in {@link #computeNext()} and free whatever they hold in
 * {@link #release()}. Release happens exactly once: when {@link #computeNext()} signals the end of the stream,
 * when it throws, or when the consumer closes the stream early. A failure while releasing after a failed
 * computation is attached to the original failure as suppressed.
 *
 * @since 1.0.0
 */
public abstract class AbstractRowStream implements RowStream
{
  private enum State
  {
    READY, NOT_READY, DONE, FAILED
  }

  private State state = State.NOT_READY;
  private Row next;
  private boolean closed;

  /**
   * @return the next row, or null at the end of the stream
   */
  protected abstract Row computeNext();

  /**
   * Frees the resources of this stream, including the upstream streams it owns.
   */
  protected abstract void release();

  @Override
  public final boolean hasNext()
  {
    switch (state) {
      case READY:
        return true;
      case DONE:
        return false;
      case FAILED:
        throw new IllegalStateException("Stream " + this + " failed earlier");
      default:
    }
    if (closed) {
      state = State.DONE;
      return false;
    }

    state = State.FAILED;
    Row row;
    try {
      row = computeNext();
    } catch (RuntimeException | Error ex) {
      closeAfterFailure(ex);
      throw ex;
    }
    if (row == null) {
      state = State.DONE;
      close();
      return false;
    }
    next = row;
    state = State.READY;
    return true;
  }

  @Override
  public final Row next()
  {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    state = State.NOT_READY;
    Row row = next;
    next = null;
    return row;
  }

  @Override
  public final void close()
  {
    if (closed) {
      return;
    }
    closed = true;
    next = null;
    if (state != State.FAILED) {
      state = State.DONE;
    }
    release();
  }

  public final boolean isClosed()
  {
    return closed;
  }

  private void closeAfterFailure(Throwable failure)
  {
    try {
      close();
    } catch (RuntimeException | Error ex) {
      if (ex != failure) {
        failure.addSuppressed(ex);
      }
    }
  }
}
