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
package org.compgraph.engine.group;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.compgraph.api.Key;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;

/**
 * Splits a stream sorted by the key columns into maximal runs of rows with equal keys.
 * <p>
 * At most one row is read ahead: the first row of the next group. The current group can be consumed lazily
 * through {@link #group()}, buffered with {@link #take()}, or skipped; whatever is left of it is skipped when
 * the input advances to the next group.
 *
 * @since 1.0.0
 */
public class GroupedInput
{
  private final RowStream stream;
  private final List<String> keyColumns;
  private final KeyOrderVerifier verifier;
  private Row lookahead;
  private Key key;
  private GroupIterator current;

  public GroupedInput(RowStream stream, List<String> keyColumns, KeyOrderVerifier verifier)
  {
    this.stream = stream;
    this.keyColumns = keyColumns;
    this.verifier = verifier;
  }

  /**
   * Moves to the next group, skipping the unread rest of the current one.
   *
   * @return false when the input is exhausted
   */
  public boolean advance()
  {
    if (current != null) {
      current.skipRemaining();
      current = null;
    }
    if (lookahead == null) {
      if (!stream.hasNext()) {
        key = null;
        return false;
      }
      lookahead = stream.next();
    }
    key = lookahead.key(keyColumns);
    verifier.verify(key);
    logger.trace("Group {} starts with {}", key, lookahead);
    current = new GroupIterator(key, lookahead);
    lookahead = null;
    return true;
  }

  /**
   * @return key of the current group, null before the first and after the last group
   */
  public Key key()
  {
    return key;
  }

  /**
   * @return single pass view over the rows of the current group
   */
  public Iterator<Row> group()
  {
    if (current == null) {
      throw new IllegalStateException("No current group");
    }
    return current;
  }

  /**
   * @return the unread rows of the current group
   */
  public List<Row> take()
  {
    List<Row> rows = new ArrayList<>();
    Iterator<Row> group = group();
    while (group.hasNext()) {
      rows.add(group.next());
    }
    return rows;
  }

  public List<String> getKeyColumns()
  {
    return keyColumns;
  }

  private class GroupIterator implements Iterator<Row>
  {
    private final Key groupKey;
    private Row next;
    private boolean ended;

    GroupIterator(Key groupKey, Row first)
    {
      this.groupKey = groupKey;
      this.next = first;
    }

    @Override
    public boolean hasNext()
    {
      if (next != null) {
        return true;
      }
      if (ended) {
        return false;
      }
      if (!stream.hasNext()) {
        ended = true;
        return false;
      }
      Row row = stream.next();
      if (row.key(keyColumns).compareTo(groupKey) == 0) {
        next = row;
        return true;
      }
      lookahead = row;
      ended = true;
      return false;
    }

    @Override
    public Row next()
    {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Row row = next;
      next = null;
      return row;
    }

    void skipRemaining()
    {
      while (hasNext()) {
        next();
      }
    }
  }

  private static final Logger logger = LoggerFactory.getLogger(GroupedInput.class);
}
