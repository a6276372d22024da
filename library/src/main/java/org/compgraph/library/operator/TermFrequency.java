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

import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import org.compgraph.api.Key;
import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Relative frequency of every distinct word in a group: the key columns, the word and
 * {@code occurrences / rows in group}. Words are emitted in order of first occurrence.
 *
 * @since 1.0.0
 */
public class TermFrequency implements Reducer
{
  private final String wordsColumn;
  private final String resultColumn;

  public TermFrequency(String wordsColumn)
  {
    this(wordsColumn, "tf");
  }

  public TermFrequency(String wordsColumn, String resultColumn)
  {
    this.wordsColumn = wordsColumn;
    this.resultColumn = resultColumn;
  }

  @Override
  public Iterator<Row> reduce(final Key key, final List<String> keyColumns, Iterator<Row> group)
  {
    Map<Value, int[]> counts = Maps.newLinkedHashMap();
    long total = 0;
    while (group.hasNext()) {
      Value word = group.next().get(wordsColumn);
      int[] count = counts.get(word);
      if (count == null) {
        counts.put(word, new int[] {1});
      } else {
        count[0]++;
      }
      total++;
    }
    final double length = total;
    return Iterators.transform(counts.entrySet().iterator(), entry -> KeyRows.builder(key, keyColumns)
        .put(wordsColumn, entry.getKey())
        .put(resultColumn, entry.getValue()[0] / length)
        .build());
  }
}
