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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import org.compgraph.api.Mapper;
import org.compgraph.api.Row;
import org.compgraph.api.Value;

/**
 * Stores the product of numeric columns in a result column.
 *
 * @since 1.0.0
 */
public class Product implements Mapper
{
  private final List<String> columns;
  private final String resultColumn;

  public Product(List<String> columns)
  {
    this(columns, "product");
  }

  public Product(List<String> columns, String resultColumn)
  {
    this.columns = ImmutableList.copyOf(columns);
    this.resultColumn = resultColumn;
  }

  @Override
  public Iterator<Row> map(Row row)
  {
    Value product = Arithmetic.ONE;
    for (String column : columns) {
      product = Arithmetic.multiply(product, row.get(column));
    }
    return Iterators.singletonIterator(row.with(resultColumn, product));
  }
}
