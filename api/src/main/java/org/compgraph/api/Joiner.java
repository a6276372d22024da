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
package org.compgraph.api;

import java.util.Iterator;
import java.util.List;

/**
 * Combines the two groups of rows that share a key during a sorted merge-join.
 * <p>
 * Both groups are buffered for the duration of one key. For a key present on one side only the joiner is
 * invoked with an empty list for the other side, and only if {@link #getMode()} asks for such keys.
 *
 * @since 1.0.0
 */
public interface Joiner
{
  JoinMode getMode();

  /**
   * @param keyColumns the join key column names
   * @param left rows of the left input having the current key
   * @param right rows of the right input having the current key
   * @return rows produced for the key; may be produced lazily
   */
  Iterator<Row> join(List<String> keyColumns, List<Row> left, List<Row> right);

}
