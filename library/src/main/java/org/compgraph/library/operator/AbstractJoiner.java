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
package org.compgraph.library.operator;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

import org.compgraph.api.JoinMode;
import org.compgraph.api.Joiner;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Base for the standard joiners.
 * <p>
 * When one group is empty the rows of the other group pass through unchanged. Otherwise every left row is
 * combined with every right row: the columns of the left row come first, then those of the right row. A non-key
 * column present in both rows gets the left suffix on the left value and the right suffix on the right value.
 *
 * @since 1.0.0
 */
public abstract class AbstractJoiner implements Joiner
{
  public static final String DEFAULT_LEFT_SUFFIX = "_1";
  public static final String DEFAULT_RIGHT_SUFFIX = "_2";

  private final JoinMode mode;
  private final String leftSuffix;
  private final String rightSuffix;

  protected AbstractJoiner(JoinMode mode, String leftSuffix, String rightSuffix)
  {
    this.mode = Preconditions.checkNotNull(mode, "mode");
    this.leftSuffix = Preconditions.checkNotNull(leftSuffix, "leftSuffix");
    this.rightSuffix = Preconditions.checkNotNull(rightSuffix, "rightSuffix");
    Preconditions.checkArgument(!leftSuffix.equals(rightSuffix), "Suffixes must differ: %s", leftSuffix);
  }

  @Override
  public JoinMode getMode()
  {
    return mode;
  }

  @Override
  public Iterator<Row> join(final List<String> keyColumns, List<Row> left, final List<Row> right)
  {
    if (left.isEmpty()) {
      return right.iterator();
    }
    if (right.isEmpty()) {
      return left.iterator();
    }
    return Iterators.concat(Iterators.transform(left.iterator(),
        leftRow -> Iterators.transform(right.iterator(), rightRow -> combine(keyColumns, leftRow, rightRow))));
  }

  protected Row combine(List<String> keyColumns, Row left, Row right)
  {
    Row.Builder builder = Row.builder();
    for (Map.Entry<String, Value> column : left.asMap().entrySet()) {
      String name = column.getKey();
      boolean collides = right.contains(name) && !keyColumns.contains(name);
      builder.put(collides ? name + leftSuffix : name, column.getValue());
    }
    for (Map.Entry<String, Value> column : right.asMap().entrySet()) {
      String name = column.getKey();
      boolean collides = left.contains(name) && !keyColumns.contains(name);
      builder.put(collides ? name + rightSuffix : name, column.getValue());
    }
    return builder.build();
  }

  @Override
  public String toString()
  {
    return getClass().getSimpleName() + "{" + leftSuffix + ", " + rightSuffix + "}";
  }
}
