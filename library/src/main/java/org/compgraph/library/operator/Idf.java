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

import com.google.common.collect.Iterators;

import org.compgraph.api.Mapper;
import org.compgraph.api.Row;

/**
 * Inverse document frequency of a word: {@code ln(documents / documents containing the word)}. The output row
 * holds the word and the idf only.
 *
 * @since 1.0.0
 */
public class Idf implements Mapper
{
  private final String docCountColumn;
  private final String wordEntriesColumn;
  private final String textColumn;
  private final String resultColumn;

  public Idf(String docCountColumn, String wordEntriesColumn, String textColumn, String resultColumn)
  {
    this.docCountColumn = docCountColumn;
    this.wordEntriesColumn = wordEntriesColumn;
    this.textColumn = textColumn;
    this.resultColumn = resultColumn;
  }

  @Override
  public Iterator<Row> map(Row row)
  {
    double idf = Math.log(row.getDouble(docCountColumn) / row.getDouble(wordEntriesColumn));
    return Iterators.singletonIterator(Row.of(textColumn, row.get(textColumn), resultColumn, idf));
  }
}
