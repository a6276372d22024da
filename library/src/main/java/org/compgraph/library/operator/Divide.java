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
 * Stores {@code numerator / denominator} as a floating point value.
 *
 * @since 1.0.0
 */
public class Divide implements Mapper
{
  private final String numerator;
  private final String denominator;
  private final String resultColumn;

  public Divide(String numerator, String denominator, String resultColumn)
  {
    this.numerator = numerator;
    this.denominator = denominator;
    this.resultColumn = resultColumn;
  }

  @Override
  public Iterator<Row> map(Row row)
  {
    return Iterators.singletonIterator(row.with(resultColumn, row.getDouble(numerator) / row.getDouble(denominator)));
  }
}
