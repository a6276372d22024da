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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.Iterators;

import org.compgraph.api.Mapper;
import org.compgraph.api.Row;

/**
 * Emits one copy of the row per part of a text column.
 * <p>
 * Without a separator the text is split at runs of whitespace and empty parts are dropped. With a separator
 * every occurrence splits, so adjacent separators produce empty parts.
 *
 * @since 1.0.0
 */
public class Split implements Mapper
{
  private final String column;
  private final String separator;

  public Split(String column)
  {
    this(column, null);
  }

  public Split(String column, String separator)
  {
    this.column = column;
    this.separator = separator;
  }

  @Override
  public Iterator<Row> map(final Row row)
  {
    String text = row.getText(column);
    String[] parts = separator == null ? StringUtils.split(text)
        : StringUtils.splitByWholeSeparatorPreserveAllTokens(text, separator);
    return Iterators.transform(Iterators.forArray(parts), part -> row.with(column, part));
  }
}
