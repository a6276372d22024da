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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import org.compgraph.api.JoinMode;
import org.compgraph.api.Joiner;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.common.util.AbstractRowStream;
import org.compgraph.common.util.RowStreams;

/**
 * Sorted merge of two inputs grouped by the same key columns.
 * <p>
 * For a key present on both sides the joiner receives both groups. For a key present on one side only, the
 * joiner is called with an empty list for the other side when the join mode keeps keys of that side, and the
 * group is skipped without buffering otherwise. Only the two groups of the current key are held in memory.
 *
 * @since 1.0.0
 */
public class MergeJoinStream extends AbstractRowStream
{
  private final RowStream leftStream;
  private final RowStream rightStream;
  private final GroupedInput left;
  private final GroupedInput right;
  private final Joiner joiner;
  private final JoinMode mode;
  private boolean leftHasGroup;
  private boolean rightHasGroup;
  private boolean started;
  private Iterator<Row> output;

  public MergeJoinStream(RowStream leftStream, GroupedInput left, RowStream rightStream, GroupedInput right,
      Joiner joiner)
  {
    this.leftStream = leftStream;
    this.rightStream = rightStream;
    this.left = left;
    this.right = right;
    this.joiner = joiner;
    this.mode = Preconditions.checkNotNull(joiner.getMode(), "%s has no join mode", joiner);
  }

  @Override
  protected Row computeNext()
  {
    if (!started) {
      started = true;
      leftHasGroup = left.advance();
      rightHasGroup = right.advance();
    }
    while (true) {
      if (output != null && output.hasNext()) {
        return Preconditions.checkNotNull(output.next(), "%s produced a null row", joiner);
      }
      output = null;
      if (!leftHasGroup && !rightHasGroup) {
        return null;
      }
      if (!leftHasGroup && !mode.includesRightOnlyKeys() || !rightHasGroup && !mode.includesLeftOnlyKeys()) {
        return null;
      }

      int cmp;
      if (!leftHasGroup) {
        cmp = 1;
      } else if (!rightHasGroup) {
        cmp = -1;
      } else {
        cmp = left.key().compareTo(right.key());
      }

      if (cmp == 0) {
        logger.trace("Joining groups of key {}", left.key());
        output = join(left.take(), right.take());
        leftHasGroup = left.advance();
        rightHasGroup = right.advance();
      } else if (cmp < 0) {
        if (mode.includesLeftOnlyKeys()) {
          output = join(left.take(), Collections.<Row>emptyList());
        }
        leftHasGroup = left.advance();
      } else {
        if (mode.includesRightOnlyKeys()) {
          output = join(Collections.<Row>emptyList(), right.take());
        }
        rightHasGroup = right.advance();
      }
    }
  }

  private Iterator<Row> join(List<Row> leftGroup, List<Row> rightGroup)
  {
    return Preconditions.checkNotNull(joiner.join(left.getKeyColumns(), Collections.unmodifiableList(leftGroup),
        Collections.unmodifiableList(rightGroup)), "%s returned null", joiner);
  }

  @Override
  protected void release()
  {
    output = null;
    RowStreams.closeAll(leftStream, rightStream);
  }

  private static final Logger logger = LoggerFactory.getLogger(MergeJoinStream.class);
}
