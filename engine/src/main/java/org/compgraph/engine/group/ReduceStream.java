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
package org.compgraph.engine.group;

import java.util.Iterator;

import com.google.common.base.Preconditions;

import org.compgraph.api.Reducer;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.common.util.AbstractRowStream;

/**
 * Calls the reducer once for every group of the sorted parent and concatenates the outputs.
 *
 * @since 1.0.0
 */
public class ReduceStream extends AbstractRowStream
{
  private final RowStream parent;
  private final GroupedInput input;
  private final Reducer reducer;
  private Iterator<Row> output;

  public ReduceStream(RowStream parent, GroupedInput input, Reducer reducer)
  {
    this.parent = parent;
    this.input = input;
    this.reducer = reducer;
  }

  @Override
  protected Row computeNext()
  {
    while (true) {
      if (output != null && output.hasNext()) {
        return Preconditions.checkNotNull(output.next(), "%s produced a null row", reducer);
      }
      output = null;
      if (!input.advance()) {
        return null;
      }
      output = Preconditions.checkNotNull(reducer.reduce(input.key(), input.getKeyColumns(), input.group()),
          "%s returned null for %s", reducer, input.key());
    }
  }

  @Override
  protected void release()
  {
    output = null;
    parent.close();
  }
}
