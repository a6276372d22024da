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

import java.io.Closeable;

import org.compgraph.api.Row;

/**
 * A sorted sequence of rows, held in memory or spilled to a file.
 *
 * @since 1.0.0
 */
interface SortedRun
{
  long size();

  Cursor open();

  /**
   * Frees the storage of the run. Open cursors must be closed first.
   */
  void discard();

  interface Cursor extends Closeable
  {
    /**
     * @return the next row of the run or null after the last one
     */
    Row read();

    @Override
    void close();
  }
}
