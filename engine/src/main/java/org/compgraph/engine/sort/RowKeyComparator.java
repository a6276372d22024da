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
package org.compgraph.engine.sort;

import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.compgraph.api.Row;

/**
 * Orders rows by the values of the key columns, compared one column at a time.
 *
 * @since 1.0.0
 */
public class RowKeyComparator implements Comparator<Row>
{
  private final List<String> keyColumns;

  public RowKeyComparator(List<String> keyColumns)
  {
    this.keyColumns = ImmutableList.copyOf(keyColumns);
  }

  @Override
  public int compare(Row left, Row right)
  {
    for (String column : keyColumns) {
      int result = left.get(column).compareTo(right.get(column));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  public List<String> getKeyColumns()
  {
    return keyColumns;
  }
}
