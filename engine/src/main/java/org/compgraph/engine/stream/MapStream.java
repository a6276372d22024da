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
package org.compgraph.engine.stream;

import java.util.Iterator;

import com.google.common.base.Preconditions;

import org.compgraph.api.Mapper;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.common.util.AbstractRowStream;

/**
 * Concatenation of the mapper outputs for every row of the parent, in order.
 *
 * @since 1.0.0
 */
public class MapStream extends AbstractRowStream
{
  private final RowStream parent;
  private final Mapper mapper;
  private Iterator<Row> output;

  public MapStream(RowStream parent, Mapper mapper)
  {
    this.parent = parent;
    this.mapper = mapper;
  }

  @Override
  protected Row computeNext()
  {
    while (output == null || !output.hasNext()) {
      if (!parent.hasNext()) {
        return null;
      }
      Row row = parent.next();
      output = Preconditions.checkNotNull(mapper.map(row), "%s returned null for %s", mapper, row);
    }
    return Preconditions.checkNotNull(output.next(), "%s produced a null row", mapper);
  }

  @Override
  protected void release()
  {
    output = null;
    parent.close();
  }
}
