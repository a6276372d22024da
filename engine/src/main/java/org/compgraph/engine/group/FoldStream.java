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

import com.google.common.base.Preconditions;

import org.compgraph.api.Folder;
import org.compgraph.api.Row;
import org.compgraph.api.RowStream;
import org.compgraph.common.util.AbstractRowStream;

/**
 * Threads an accumulator through every row of the parent and emits the final accumulator as the only row.
 *
 * @since 1.0.0
 */
public class FoldStream extends AbstractRowStream
{
  private final RowStream parent;
  private final Folder folder;
  private final Row initial;
  private boolean emitted;

  public FoldStream(RowStream parent, Folder folder, Row initial)
  {
    this.parent = parent;
    this.folder = folder;
    this.initial = initial;
  }

  @Override
  protected Row computeNext()
  {
    if (emitted) {
      return null;
    }
    Row accumulator = initial;
    while (parent.hasNext()) {
      accumulator = Preconditions.checkNotNull(folder.fold(accumulator, parent.next()), "%s returned null", folder);
    }
    emitted = true;
    return accumulator;
  }

  @Override
  protected void release()
  {
    parent.close();
  }
}
