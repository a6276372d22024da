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

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import org.compgraph.api.Key;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * {@link Sum} over several columns at once.
 *
 * @since 1.0.0
 */
public class MultipleSum implements Reducer
{
  private final List<String> columns;

  public MultipleSum(List<String> columns)
  {
    this.columns = ImmutableList.copyOf(columns);
  }

  @Override
  public Iterator<Row> reduce(Key key, List<String> keyColumns, Iterator<Row> group)
  {
    Value[] sums = new Value[columns.size()];
    Arrays.fill(sums, Arithmetic.ZERO);
    while (group.hasNext()) {
      Row row = group.next();
      for (int i = 0; i < sums.length; i++) {
        sums[i] = Arithmetic.add(sums[i], row.get(columns.get(i)));
      }
    }
    Row.Builder builder = KeyRows.builder(key, keyColumns);
    for (int i = 0; i < sums.length; i++) {
      builder.put(columns.get(i), sums[i]);
    }
    return Iterators.singletonIterator(builder.build());
  }
}
