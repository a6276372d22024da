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
 * Grouped aggregation, invoked once per maximal run of consecutive rows sharing a key.
 * <p>
 * The group can be consumed at most once, in order. It is a view over the input stream, so the reducer must
 * not assume it fits in memory unless it chooses to buffer it. Rows the reducer leaves unread are skipped
 * by the engine before the next group starts.
 *
 * @since 1.0.0
 */
public interface Reducer
{
  /**
   * @param key key values shared by every row of the group
   * @param keyColumns the names of the key columns, in key order
   * @param group the rows of the group
   * @return rows produced for the group; may be produced lazily
   */
  Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group);

}
