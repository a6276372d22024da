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

import java.util.Collections;
import java.util.Iterator;
import java.util.function.Predicate;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

import org.compgraph.api.Mapper;
import org.compgraph.api.Row;

/**
 * Keeps the rows satisfying a condition.
 *
 * @since 1.0.0
 */
public class Filter implements Mapper
{
  private final Predicate<Row> condition;

  public Filter(Predicate<Row> condition)
  {
    this.condition = Preconditions.checkNotNull(condition, "condition");
  }

  @Override
  public Iterator<Row> map(Row row)
  {
    return condition.test(row) ? Iterators.singletonIterator(row) : Collections.<Row>emptyIterator();
  }
}
