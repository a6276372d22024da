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

import com.google.common.collect.Iterators;

import org.compgraph.api.Key;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Emits the key columns and the sum of a numeric column for every group.
 * <pre>
 * key [a], column b:  {a=1, b=2, c=4}, {a=1, b=3, c=5}  =&gt;  {a=1, b=5}
 * </pre>
 *
 * @since 1.0.0
 */
public class Sum implements Reducer
{
  private final String column;

  public Sum(String column)
  {
    this.column = column;
  }

  @Override
  public Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group)
  {
    Value sum = Arithmetic.ZERO;
    while (group.hasNext()) {
      sum = Arithmetic.add(sum, group.next().get(column));
    }
    return Iterators.singletonIterator(KeyRows.builder(key, keyColumns).put(column, sum).build());
  }
}
