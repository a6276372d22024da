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
import java.util.function.Supplier;

import com.google.common.base.Preconditions;

import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.common.util.AbstractRowStream;
import org.compgraph.common.util.RowStreams;

/**
 * Rows of a named source. The bound factory is asked for a fresh iterator on the first pull.
 *
 * @since 1.0.0
 */
public class SourceStream extends AbstractRowStream
{
  private final String name;
  private final Supplier<? extends Iterator<Row>> factory;
  private RowStream rows;

  public SourceStream(String name, Supplier<? extends Iterator<Row>> factory)
  {
    this.name = name;
    this.factory = factory;
  }

  @Override
  protected Row computeNext()
  {
    if (rows == null) {
      Iterator<Row> iterator = factory.get();
      rows = RowStreams.of(Preconditions.checkNotNull(iterator, "factory of source %s returned null", name));
    }
    if (!rows.hasNext()) {
      return null;
    }
    return Preconditions.checkNotNull(rows.next(), "source %s produced a null row", name);
  }

  @Override
  protected void release()
  {
    if (rows != null) {
      rows.close();
    }
  }

  @Override
  public String toString()
  {
    return "SourceStream{" + "name=" + name + '}';
  }
}
